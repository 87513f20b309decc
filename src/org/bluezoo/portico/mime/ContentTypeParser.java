/*
 * ContentTypeParser.java
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

import java.util.ArrayList;
import java.util.List;

/**
 * Parser for Content-Type header values.
 * Parameter parsing is lenient in the way user agents require:
 * unquoted values are taken up to the next semicolon, and RFC 2231
 * extended parameters ({@code name*=charset''value}) are decoded and
 * take precedence over their plain counterparts.
 * @see <a href='https://www.rfc-editor.org/rfc/rfc2045#section-5'>RFC 2045</a>
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ContentTypeParser {

	private ContentTypeParser() {
		// Static utility class
	}

	/**
	 * Parses a Content-Type header value.
	 * @param value the header value string
	 * @return the parsed ContentType, or null if the value is invalid
	 */
	public static ContentType parse(String value) {
		if (value == null || value.isEmpty()) {
			return null;
		}

		int semicolonIndex = value.indexOf(';');
		String typePart = semicolonIndex < 0 ? value : value.substring(0, semicolonIndex);
		String paramsPart = semicolonIndex < 0 ? "" : value.substring(semicolonIndex + 1);

		int slashIndex = typePart.indexOf('/');
		if (slashIndex < 0) {
			return null;
		}
		String primaryType = typePart.substring(0, slashIndex).trim();
		String subType = typePart.substring(slashIndex + 1).trim();
		if (!MIMEUtils.isToken(primaryType) || !MIMEUtils.isToken(subType)) {
			return null;
		}

		return new ContentType(primaryType, subType, parseParameterList(paramsPart));
	}

	/**
	 * Parses a semicolon-separated list of parameters.
	 * Malformed parameters are skipped.
	 * @param paramsPart the text following the first semicolon
	 * @return the parameters in order, extended values first
	 */
	static List<Parameter> parseParameterList(String paramsPart) {
		List<Parameter> plain = new ArrayList<>();
		List<Parameter> extended = new ArrayList<>();
		int pos = 0;
		int len = paramsPart.length();

		while (pos < len) {
			while (pos < len && (paramsPart.charAt(pos) == ';' ||
								  Character.isWhitespace(paramsPart.charAt(pos)))) {
				pos++;
			}
			if (pos >= len) {
				break;
			}

			int equalsIndex = paramsPart.indexOf('=', pos);
			int nextSemi = paramsPart.indexOf(';', pos);
			if (equalsIndex < 0 || (nextSemi >= 0 && nextSemi < equalsIndex)) {
				// Parameter without a value
				pos = (nextSemi < 0) ? len : nextSemi;
				continue;
			}
			String name = paramsPart.substring(pos, equalsIndex).trim();
			pos = equalsIndex + 1;
			while (pos < len && paramsPart.charAt(pos) == ' ') {
				pos++;
			}

			String paramValue;
			if (pos < len && paramsPart.charAt(pos) == '"') {
				pos++;
				StringBuilder sb = new StringBuilder();
				while (pos < len) {
					char c = paramsPart.charAt(pos);
					if (c == '\\' && pos + 1 < len) {
						sb.append(paramsPart.charAt(pos + 1));
						pos += 2;
					} else if (c == '"') {
						pos++;
						break;
					} else {
						sb.append(c);
						pos++;
					}
				}
				paramValue = sb.toString();
				int semi = paramsPart.indexOf(';', pos);
				pos = (semi < 0) ? len : semi;
			} else {
				int semi = paramsPart.indexOf(';', pos);
				if (semi < 0) {
					semi = len;
				}
				paramValue = paramsPart.substring(pos, semi).trim();
				pos = semi;
			}

			if (name.endsWith("*")) {
				String decoded = Parameter.decodeExtendedValue(paramValue);
				if (decoded != null) {
					extended.add(new Parameter(name.substring(0, name.length() - 1), decoded));
				}
			} else if (MIMEUtils.isToken(name)) {
				plain.add(new Parameter(name, paramValue));
			}
		}

		List<Parameter> parameters = new ArrayList<>(extended.size() + plain.size());
		parameters.addAll(extended);
		parameters.addAll(plain);
		return parameters;
	}

}
