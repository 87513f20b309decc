/*
 * URLEncodedParser.java
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

package org.bluezoo.portico.form;

import org.bluezoo.portico.util.PercentCodec;

import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parser for {@code application/x-www-form-urlencoded} text, as found in
 * query strings and form bodies.
 * <p>
 * Pairs are separated by {@code &}. Keys and values are percent-decoded,
 * with {@code +} standing for a space. Blank values are kept, and a pair
 * without {@code =} is a key with a blank value. Empty pairs are skipped.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class URLEncodedParser {

    private URLEncodedParser() {
        // Static utility class
    }

    /**
     * Parses urlencoded text.
     * @param text the text, may be null
     * @param charset the charset of the percent-encoded bytes
     * @return the values for each key, keys in order of first appearance
     */
    public static Map<String, List<String>> parse(String text, Charset charset) {
        Map<String, List<String>> result = new LinkedHashMap<>();
        if (text == null || text.isEmpty()) {
            return result;
        }
        int start = 0;
        int len = text.length();
        while (start <= len) {
            int end = text.indexOf('&', start);
            if (end < 0) {
                end = len;
            }
            if (end > start) {
                String pair = text.substring(start, end);
                int ei = pair.indexOf('=');
                String key = (ei < 0) ? pair : pair.substring(0, ei);
                String value = (ei < 0) ? "" : pair.substring(ei + 1);
                key = PercentCodec.decode(key, charset, true);
                value = PercentCodec.decode(value, charset, true);
                List<String> values = result.get(key);
                if (values == null) {
                    values = new ArrayList<>();
                    result.put(key, values);
                }
                values.add(value);
            }
            start = end + 1;
        }
        return result;
    }

    /**
     * Parses urlencoded text and applies scalar collapse to the values.
     */
    public static Map<String, FieldValue<String>> parseFields(String text, Charset charset) {
        return collapse(parse(text, charset));
    }

    static <T> Map<String, FieldValue<T>> collapse(Map<String, List<T>> map) {
        Map<String, FieldValue<T>> result = new LinkedHashMap<>();
        for (Map.Entry<String, List<T>> entry : map.entrySet()) {
            result.put(entry.getKey(), FieldValue.collapse(entry.getValue()));
        }
        return result;
    }

}
