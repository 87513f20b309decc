/*
 * CookieParser.java
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

package org.bluezoo.portico.cookie;

import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ResourceBundle;
import java.util.TreeSet;

/**
 * Strict parser for the Cookie request header.
 * <p>
 * This follows the traditional cookie grammar: a sequence of
 * {@code name=value} pairs separated by semicolons or whitespace, where
 * a value is either a run of cookie characters or a double-quoted string
 * with backslash and octal escapes. Attribute pairs (names starting with
 * {@code $}, or reserved names such as {@code Path}) are accepted and
 * discarded, since a server has no use for them.
 * <p>
 * Parsing stops quietly at the first position where no pair can be
 * recognised, keeping the pairs read so far. A header that is
 * structurally wrong in a way that makes its pairs meaningless (an
 * attribute before any cookie, a cookie without a value) yields no
 * cookies at all. A cookie name containing characters outside the legal
 * set raises {@link CookieParseException}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
class CookieParser {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.portico.cookie.L10N");

    private static final Collection<String> RESERVED = new TreeSet<>(Arrays.asList(
        "expires", "path", "comment", "domain", "max-age", "secure", "httponly", "version", "samesite"
    ));
    private static final Collection<String> FLAGS = new TreeSet<>(Arrays.asList(
        "secure", "httponly"
    ));

    private static final String NAME_PUNCTUATION = "!#%&'~_`><@,:/$*+-.^|)(?}{";
    private static final String VALUE_PUNCTUATION = NAME_PUNCTUATION + "=[]";
    private static final String LEGAL_PUNCTUATION = "!#$%&'*+-.^_`|~:";

    private final String header;
    private final int len;
    private int pos;

    CookieParser(String header) {
        this.header = header;
        this.len = header.length();
    }

    /**
     * Parses the header.
     * @return the cookie names and (unquoted, still percent-encoded)
     * values, in header order; a later duplicate replaces the value of an
     * earlier one
     * @exception CookieParseException if a cookie name is not legal
     */
    Map<String, String> parse() throws CookieParseException {
        List<String[]> pairs = new ArrayList<>();
        boolean cookieSeen = false;
        while (true) {
            skipWhitespace();
            if (pos >= len) {
                break;
            }
            String name = readName();
            if (name == null) {
                break;
            }
            String value = null;
            int mark = pos;
            skipWhitespace();
            if (pos < len && header.charAt(pos) == '=') {
                pos++;
                skipWhitespace();
                value = readValue();
                if (value == null) {
                    break;
                }
            } else {
                pos = mark;
            }
            if (!readTerminator()) {
                break;
            }

            if (name.charAt(0) == '$') {
                continue;
            }
            String lname = name.toLowerCase();
            if (RESERVED.contains(lname)) {
                if (!cookieSeen) {
                    return Collections.emptyMap();
                }
                if (value == null && !FLAGS.contains(lname)) {
                    return Collections.emptyMap();
                }
            } else if (value != null) {
                pairs.add(new String[] { name, unquote(value) });
                cookieSeen = true;
            } else {
                return Collections.emptyMap();
            }
        }

        Map<String, String> cookies = new LinkedHashMap<>();
        for (String[] pair : pairs) {
            if (!isLegalName(pair[0])) {
                String message = MessageFormat.format(L10N.getString("err.illegal_name"), pair[0]);
                throw new CookieParseException(message);
            }
            cookies.put(pair[0], pair[1]);
        }
        return cookies;
    }

    private void skipWhitespace() {
        while (pos < len && Character.isWhitespace(header.charAt(pos))) {
            pos++;
        }
    }

    private String readName() {
        int start = pos;
        while (pos < len && isNameChar(header.charAt(pos))) {
            pos++;
        }
        return (pos == start) ? null : header.substring(start, pos);
    }

    /**
     * Reads a quoted string (including its quotes) or a possibly empty run
     * of value characters.
     * @return the raw value, or null for an unterminated quoted string
     */
    private String readValue() {
        int start = pos;
        if (pos < len && header.charAt(pos) == '"') {
            pos++;
            while (pos < len) {
                char c = header.charAt(pos);
                if (c == '\\' && pos + 1 < len) {
                    pos += 2;
                } else if (c == '"') {
                    pos++;
                    return header.substring(start, pos);
                } else {
                    pos++;
                }
            }
            return null;
        }
        while (pos < len && isValueChar(header.charAt(pos))) {
            pos++;
        }
        return header.substring(start, pos);
    }

    /**
     * A pair ends with whitespace, a semicolon or the end of the header.
     */
    private boolean readTerminator() {
        int start = pos;
        skipWhitespace();
        if (pos >= len) {
            return true;
        }
        if (header.charAt(pos) == ';') {
            pos++;
            return true;
        }
        return pos > start;
    }

    private static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || NAME_PUNCTUATION.indexOf(c) >= 0;
    }

    private static boolean isValueChar(char c) {
        return Character.isLetterOrDigit(c) || VALUE_PUNCTUATION.indexOf(c) >= 0;
    }

    static boolean isLegalName(String name) {
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            boolean ascii = (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9');
            if (!ascii && LEGAL_PUNCTUATION.indexOf(c) < 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Removes the quotes from a quoted-string value and resolves its
     * escapes: a backslash followed by three octal digits is that
     * character, a backslash followed by anything else is the following
     * character. Unquoted values are returned as they are.
     */
    static String unquote(String value) {
        int vlen = value.length();
        if (vlen < 2 || value.charAt(0) != '"' || value.charAt(vlen - 1) != '"') {
            return value;
        }
        String s = value.substring(1, vlen - 1);
        StringBuilder buf = new StringBuilder(s.length());
        int slen = s.length();
        for (int i = 0; i < slen; i++) {
            char c = s.charAt(i);
            if (c != '\\' || i + 1 >= slen) {
                buf.append(c);
                continue;
            }
            if (isOctalEscape(s, i + 1)) {
                int code = (s.charAt(i + 1) - '0') * 64 + (s.charAt(i + 2) - '0') * 8 + (s.charAt(i + 3) - '0');
                buf.append((char) code);
                i += 3;
            } else {
                buf.append(s.charAt(i + 1));
                i++;
            }
        }
        return buf.toString();
    }

    private static boolean isOctalEscape(String s, int start) {
        if (start + 3 > s.length()) {
            return false;
        }
        char c1 = s.charAt(start);
        char c2 = s.charAt(start + 1);
        char c3 = s.charAt(start + 2);
        return c1 >= '0' && c1 <= '3' && c2 >= '0' && c2 <= '7' && c3 >= '0' && c3 <= '7';
    }

}
