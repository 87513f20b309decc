/*
 * HeaderGuard.java
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

package org.bluezoo.portico.http;

import java.nio.charset.StandardCharsets;
import java.text.MessageFormat;
import java.util.ResourceBundle;
import java.util.logging.Logger;

/**
 * Validates and queues outbound response headers.
 * <p>
 * Every header that portico writes goes through {@link #emit}. Names and
 * values are converted to their transport string form and rejected if
 * they contain a carriage return or line feed, which would let an
 * attacker who controls part of a header inject further headers or a
 * body (HTTP response splitting). There is no way to skip this check.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class HeaderGuard {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.portico.http.L10N");
    private static final Logger LOGGER = Logger.getLogger(HeaderGuard.class.getName());

    private HeaderGuard() {
        // Static utility class
    }

    /**
     * Appends a header to the given sequence.
     *
     * @param headers the outbound header sequence
     * @param name the header name
     * @param value the header value
     * @exception InvalidHeaderException if the name or value contains CR or LF
     */
    public static void emit(Headers headers, Object name, Object value) {
        emit(headers, name, value, false);
    }

    /**
     * Appends a header to the given sequence.
     * If {@code unique} is true and a header with the same name
     * (case-insensitively) is already queued, nothing happens.
     *
     * @param headers the outbound header sequence
     * @param name the header name
     * @param value the header value
     * @param unique whether to skip the header if one with this name exists
     * @return true if the header was appended
     * @exception InvalidHeaderException if the name or value contains CR or LF
     */
    public static boolean emit(Headers headers, Object name, Object value, boolean unique) {
        String n = toTransportString(name);
        String v = toTransportString(value);
        if (containsLineBreak(n) || containsLineBreak(v)) {
            String message = MessageFormat.format(L10N.getString("err.invalid_header"), printable(n));
            LOGGER.warning(message);
            throw new InvalidHeaderException(message);
        }
        if (unique && headers.containsName(n)) {
            return false;
        }
        headers.add(new Header(n, v));
        return true;
    }

    /**
     * Converts a header name or value to the string form that is written.
     * Byte arrays are taken to be UTF-8, null becomes the empty string.
     */
    static String toTransportString(Object o) {
        if (o == null) {
            return "";
        }
        if (o instanceof byte[]) {
            return new String((byte[]) o, StandardCharsets.UTF_8);
        }
        return o.toString();
    }

    static boolean containsLineBreak(String s) {
        return s.indexOf('\r') >= 0 || s.indexOf('\n') >= 0;
    }

    private static String printable(String s) {
        return s.replace("\r", "\\r").replace("\n", "\\n");
    }

}
