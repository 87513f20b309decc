/*
 * ContentDispositionParser.java
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

/**
 * Parser for Content-Disposition header values.
 * @see <a href='https://www.ietf.org/rfc/rfc2183.txt'>RFC 2183</a>
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ContentDispositionParser {

	private ContentDispositionParser() {
		// Static utility class
	}

	/**
	 * Parses a Content-Disposition header value.
	 * @param value the header value string
	 * @return the parsed ContentDisposition, or null if the value is invalid
	 */
	public static ContentDisposition parse(String value) {
		if (value == null || value.isEmpty()) {
			return null;
		}

		int semicolonIndex = value.indexOf(';');
		String dispositionType = (semicolonIndex < 0 ? value : value.substring(0, semicolonIndex)).trim();
		String paramsPart = semicolonIndex < 0 ? "" : value.substring(semicolonIndex + 1);

		if (!MIMEUtils.isToken(dispositionType)) {
			return null;
		}
		return new ContentDisposition(dispositionType, ContentTypeParser.parseParameterList(paramsPart));
	}

}
