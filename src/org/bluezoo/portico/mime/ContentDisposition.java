/*
 * ContentDisposition.java
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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A Content-Disposition value of a multipart body part.
 * For multipart/form-data the disposition type is "form-data" and the
 * interesting parameters are "name" and "filename".
 * @see <a href='https://www.rfc-editor.org/rfc/rfc7578#section-4.2'>RFC 7578</a>
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ContentDisposition {

	private final String dispositionType;
	private final Map<String, String> parameterMap;

	/**
	 * Constructor.
	 * @param dispositionType the disposition type. May not be null
	 * @param parameters optional list of parameters, in order. May be null
	 * @exception NullPointerException if dispositionType is null
	 */
	public ContentDisposition(String dispositionType, List<Parameter> parameters) {
		if (dispositionType == null) {
			throw new NullPointerException("dispositionType must not be null");
		}
		this.dispositionType = dispositionType;
		Map<String, String> map = new LinkedHashMap<>();
		if (parameters != null) {
			for (Parameter parameter : parameters) {
				map.putIfAbsent(parameter.getName().toLowerCase(), parameter.getValue());
			}
		}
		this.parameterMap = Collections.unmodifiableMap(map);
	}

	public String getDispositionType() {
		return dispositionType;
	}

	public boolean isDispositionType(String dispositionType) {
		return this.dispositionType.equalsIgnoreCase(dispositionType);
	}

	/**
	 * Returns the value for the specified parameter name, if any.
	 * Parameter names are case insensitive.
	 * @param name the parameter name
	 * @return the parameter value, or null
	 */
	public String getParameter(String name) {
		return parameterMap.get(name.toLowerCase());
	}

	/**
	 * Indicates whether the parameter is present, even with an empty value.
	 * @param name the parameter name
	 * @return true if present
	 */
	public boolean hasParameter(String name) {
		return parameterMap.containsKey(name.toLowerCase());
	}

	@Override
	public String toString() {
		StringBuilder buf = new StringBuilder(dispositionType);
		for (Map.Entry<String, String> entry : parameterMap.entrySet()) {
			buf.append("; ");
			buf.append(entry.getKey());
			buf.append("=\"");
			buf.append(entry.getValue());
			buf.append('"');
		}
		return buf.toString();
	}

}
