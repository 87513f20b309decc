/*
 * Parameter.java
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

import java.io.ByteArrayOutputStream;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;

/**
 * A parameter in a structured header value such as Content-Type or
 * Content-Disposition. It consists of a name and a fully decoded value.
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Parameter {

	private final String name;
	private final String value;

	/**
	 * Constructor for a new parameter.
	 * @param name the name of the parameter
	 * @param value the parameter value
	 * @exception NullPointerException if name or value are null
	 */
	public Parameter(String name, String value) {
		if (name == null || value == null) {
			throw new NullPointerException("name and value must not be null");
		}
		this.name = name;
		this.value = value;
	}

	/**
	 * Returns the name of this parameter. This should be compared case
	 * insensitively with other parameter names.
	 * @return the parameter name
	 */
	public String getName() {
		return name;
	}

	/**
	 * Returns the fully decoded value of this parameter.
	 * @return the parameter value
	 */
	public String getValue() {
		return value;
	}

	@Override
	public int hashCode() {
		return name.toLowerCase().hashCode() + value.hashCode();
	}

	@Override
	public boolean equals(Object other) {
		if (!(other instanceof Parameter)) {
			return false;
		}
		Parameter o = (Parameter) other;
		return name.equalsIgnoreCase(o.name) && value.equals(o.value);
	}

	@Override
	public String toString() {
		return name + "=" + value;
	}

	/**
	 * Decodes an RFC 2231 extended value of the form
	 * {@code charset'language'percent-encoded}.
	 * Browsers use this for non-ASCII upload filenames
	 * ({@code filename*=UTF-8''na%C3%AFve.txt}).
	 * @param extendedValue the raw extended value
	 * @return the decoded value, or null if it is not a well-formed
	 * extended value
	 * @see <a href='https://datatracker.ietf.org/doc/html/rfc2231'>RFC 2231</a>
	 */
	static String decodeExtendedValue(String extendedValue) {
		int q1 = extendedValue.indexOf('\'');
		if (q1 < 0) {
			return null;
		}
		int q2 = extendedValue.indexOf('\'', q1 + 1);
		if (q2 < 0) {
			return null;
		}
		Charset charset = StandardCharsets.UTF_8;
		String charsetName = extendedValue.substring(0, q1);
		if (!charsetName.isEmpty()) {
			try {
				charset = Charset.forName(charsetName);
			} catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
				return null;
			}
		}
		String encoded = extendedValue.substring(q2 + 1);
		ByteArrayOutputStream sink = new ByteArrayOutputStream(encoded.length());
		for (int i = 0; i < encoded.length(); i++) {
			char c = encoded.charAt(i);
			if (c == '%' && i + 2 < encoded.length()) {
				int hi = Character.digit(encoded.charAt(i + 1), 16);
				int lo = Character.digit(encoded.charAt(i + 2), 16);
				if (hi < 0 || lo < 0) {
					return null;
				}
				sink.write((hi << 4) | lo);
				i += 2;
			} else if (c == '%') {
				return null;
			} else {
				sink.write((byte) c);
			}
		}
		return new String(sink.toByteArray(), charset);
	}

}
