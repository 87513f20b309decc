/*
 * PercentCodec.java
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

package org.bluezoo.portico.util;

import java.io.ByteArrayOutputStream;
import java.nio.charset.Charset;

/**
 * Lenient percent-encoding, as used in cookie values and
 * application/x-www-form-urlencoded data.
 * <p>
 * Unlike {@link java.net.URLDecoder}, decoding never fails: a {@code %}
 * that is not followed by two hex digits is kept as it is, and byte
 * sequences that are not valid in the charset are replaced by U+FFFD.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class PercentCodec {

    private static final char[] HEX_DIGITS = "0123456789ABCDEF".toCharArray();

    private PercentCodec() {
        // Static utility class
    }

    /**
     * Decodes percent escapes in the given text.
     *
     * @param s the encoded text
     * @param charset the charset of the escaped bytes
     * @param plusAsSpace whether '+' denotes a space (form data) or
     * itself (cookies)
     * @return the decoded text
     */
    public static String decode(String s, Charset charset, boolean plusAsSpace) {
        if (s.indexOf('%') < 0 && (!plusAsSpace || s.indexOf('+') < 0)) {
            return s;
        }
        StringBuilder out = new StringBuilder(s.length());
        ByteArrayOutputStream pending = new ByteArrayOutputStream();
        int len = s.length();
        for (int i = 0; i < len; i++) {
            char c = s.charAt(i);
            if (c == '%' && i + 2 < len && isEscape(s, i)) {
                pending.write((hexValue(s.charAt(i + 1)) << 4) | hexValue(s.charAt(i + 2)));
                i += 2;
                continue;
            }
            flush(pending, charset, out);
            if (c == '+' && plusAsSpace) {
                out.append(' ');
            } else {
                out.append(c);
            }
        }
        flush(pending, charset, out);
        return out.toString();
    }

    /**
     * Percent-encodes the given text.
     * Letters, digits, {@code _.-~} and any character in {@code safe} are
     * left alone; everything else is encoded as the escaped bytes of its
     * representation in the charset.
     *
     * @param s the text to encode
     * @param charset the charset to encode characters with
     * @param safe additional characters that are not encoded
     * @return the encoded text
     */
    public static String encode(String s, Charset charset, String safe) {
        StringBuilder out = new StringBuilder(s.length());
        byte[] bytes = s.getBytes(charset);
        for (byte b : bytes) {
            int ub = b & 0xff;
            if (isUnreserved(ub) || (ub < 0x80 && safe.indexOf(ub) >= 0)) {
                out.append((char) ub);
            } else {
                out.append('%');
                out.append(HEX_DIGITS[(ub >> 4) & 0x0f]);
                out.append(HEX_DIGITS[ub & 0x0f]);
            }
        }
        return out.toString();
    }

    private static boolean isEscape(String s, int i) {
        return hexValue(s.charAt(i + 1)) >= 0 && hexValue(s.charAt(i + 2)) >= 0;
    }

    private static int hexValue(char c) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        } else if (c >= 'a' && c <= 'f') {
            return c - 'a' + 10;
        } else if (c >= 'A' && c <= 'F') {
            return c - 'A' + 10;
        }
        return -1;
    }

    private static boolean isUnreserved(int c) {
        return (c >= 'A' && c <= 'Z') ||
               (c >= 'a' && c <= 'z') ||
               (c >= '0' && c <= '9') ||
               c == '_' || c == '.' || c == '-' || c == '~';
    }

    private static void flush(ByteArrayOutputStream pending, Charset charset, StringBuilder out) {
        if (pending.size() > 0) {
            out.append(new String(pending.toByteArray(), charset));
            pending.reset();
        }
    }

}
