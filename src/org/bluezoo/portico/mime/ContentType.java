/*
 * ContentType.java
 * Copyright (C) 2025 Chris Burdess
 *
 * This file is part of portico, a request/response layer for Java
 * gateway applications.
 *
 * portico is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * portico is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with portico.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.portico.mime;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A Content-Type value, as sent in the {@code CONTENT_TYPE} gateway
 * variable or in the headers of a multipart body part.
 * @see <a href='https://www.rfc-editor.org/rfc/rfc2045#section-5'>RFC 2045</a>
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ContentType {

	private final String primaryType;
	private final String subType;
	private final Map<String, String> parameterMap;

	/**
	 * Constructor.
	 * @param primaryType the primary component of the media type, e.g.
	 * "text", "multipart" or "application". May not be null
	 * @param subType the subtype of the media type, e.g. "form-data".
	 * May not be null
	 * @param parameters optional list of parameters, in order. May be null
	 * @exception NullPointerException if primaryType or subType are null
	 */
	public ContentType(String primaryType, String subType, List<Parameter> parameters) {
		if (primaryType == null || subType == null) {
			throw new NullPointerException("primaryType and subType must not be null");
		}
		this.primaryType = primaryType;
		this.subType = subType;
		Map<String, String> map = new LinkedHashMap<>();
		if (parameters != null) {
			for (Parameter parameter : parameters) {
				map.putIfAbsent(parameter.getName().toLowerCase(), parameter.getValue());
			}
		}
		this.parameterMap = Collections.unmodifiableMap(map);
	}

	public String getPrimaryType() {
		return primaryType;
	}

	public String getSubType() {
		return subType;
	}

	/**
	 * Returns the lower-cased media type without parameters,
	 * e.g. "multipart/form-data".
	 * @return the media type
	 */
	public String getMimeType() {
		return (primaryType + '/' + subType).toLowerCase();
	}

	/**
	 * Indicates whether this content type has the given primary type.
	 * Comparisons are case insensitive.
	 * @param primaryType the primary media type to test
	 * @return true if this content-type matches, false otherwise
	 */
	public boolean isPrimaryType(String primaryType) {
		return this.primaryType.equalsIgnoreCase(primaryType);
	}

	/**
	 * Indicates whether this content type matches the specified MIME type
	 * string in "type/subtype" format. Comparisons are case insensitive.
	 * @param mimeType the MIME type to test, e.g. "multipart/form-data"
	 * @return true if this content-type matches the given MIME type
	 */
	public boolean isMimeType(String mimeType) {
		return mimeType != null && getMimeType().equalsIgnoreCase(mimeType);
	}

	/**
	 * Returns the value of the specified parameter, if any.
	 * Parameter names are case insensitive; the first occurrence wins.
	 * @param name the name of the parameter
	 * @return the parameter value, or null if there is no such parameter
	 */
	public String getParameter(String name) {
		return parameterMap.get(name.toLowerCase());
	}

	/**
	 * Returns all parameters, keyed by lower-cased name.
	 * @return an unmodifiable ordered map of parameters
	 */
	public Map<String, String> getParameters() {
		return parameterMap;
	}

	/**
	 * Returns the charset named by the charset parameter.
	 * @param defaultCharset the charset to use if the parameter is absent
	 * or names a charset this JVM does not support
	 * @return the charset to decode text with
	 */
	public Charset getCharset(Charset defaultCharset) {
		String name = getParameter("charset");
		if (name == null || name.isEmpty()) {
			return defaultCharset;
		}
		try {
			return Charset.forName(name);
		} catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
			return defaultCharset;
		}
	}

	@Override
	public int hashCode() {
		return getMimeType().hashCode() + parameterMap.hashCode();
	}

	@Override
	public boolean equals(Object other) {
		if (!(other instanceof ContentType)) {
			return false;
		}
		ContentType o = (ContentType) other;
		return getMimeType().equals(o.getMimeType()) && parameterMap.equals(o.parameterMap);
	}

	@Override
	public String toString() {
		StringBuilder buf = new StringBuilder(primaryType);
		buf.append('/');
		buf.append(subType);
		for (Map.Entry<String, String> entry : parameterMap.entrySet()) {
			buf.append("; ");
			buf.append(entry.getKey());
			buf.append('=');
			buf.append(entry.getValue());
		}
		return buf.toString();
	}

}
