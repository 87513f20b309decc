/*
 * CookieCodec.java
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

import org.bluezoo.portico.http.HTTPDateFormat;
import org.bluezoo.portico.util.PercentCodec;

import java.nio.charset.StandardCharsets;
import java.text.DateFormat;
import java.text.MessageFormat;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.servlet.http.Cookie;

/**
 * Encodes Set-Cookie header values and decodes Cookie request headers.
 * <p>
 * The two directions are asymmetric: an encoded cookie carries its
 * attributes (expiry, path, domain, flags), while decoding only ever
 * yields names and values, because user agents never send attributes
 * back.
 * <p>
 * Decoding is forgiving. It never throws; a malformed header produces
 * whatever cookies could be recovered from it, possibly none.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class CookieCodec {

    private static final Logger LOGGER = Logger.getLogger(CookieCodec.class.getName());

    /**
     * Offset in seconds substituted for a negative expiry, placing the
     * expiry date decades in the past so the user agent drops the cookie.
     */
    static final long EXPIRE_NOW_OFFSET = -1000000000L;

    private CookieCodec() {
        // Static utility class
    }

    /**
     * Encodes a cookie as a Set-Cookie header value.
     * <p>
     * The value is percent-encoded. {@code expires} may be null or empty
     * (no expires attribute), a {@link Number} of seconds from now (a
     * negative number meaning "expire immediately"), or any other object
     * whose string form is used verbatim. {@code sameSite} is appended only
     * if it is one of Strict, Lax or None (in any case); other values are
     * ignored.
     *
     * @param name the cookie name
     * @param value the cookie value
     * @param expires the expiry, see above
     * @param domain the domain attribute, or null
     * @param secure whether to add the Secure flag
     * @param httpOnly whether to add the HttpOnly flag
     * @param path the path attribute, or null
     * @param sameSite the SameSite attribute, or null
     * @return the header value
     * @exception IllegalArgumentException if the name is not a valid
     * cookie name
     */
    public static String encode(String name, String value, Object expires, String domain,
            boolean secure, boolean httpOnly, String path, String sameSite) {
        Cookie cookie = new Cookie(name, PercentCodec.encode(value == null ? "" : value,
                StandardCharsets.UTF_8, "/"));
        if (domain != null && !domain.isEmpty()) {
            cookie.setDomain(domain);
        }
        if (path != null && !path.isEmpty()) {
            cookie.setPath(path);
        }
        cookie.setSecure(secure);
        cookie.setHttpOnly(httpOnly);

        StringBuilder buf = new StringBuilder();
        buf.append(cookie.getName());
        buf.append('=');
        buf.append(cookie.getValue());
        String expiresValue = formatExpires(expires);
        if (expiresValue != null) {
            buf.append("; expires=");
            buf.append(expiresValue);
        }
        if (cookie.getPath() != null) {
            buf.append("; path=");
            buf.append(cookie.getPath());
        }
        if (cookie.getDomain() != null) {
            buf.append("; domain=");
            buf.append(cookie.getDomain());
        }
        if (cookie.getSecure()) {
            buf.append("; Secure");
        }
        if (cookie.isHttpOnly()) {
            buf.append("; HttpOnly");
        }
        // Not modelled by javax.servlet.http.Cookie
        if (sameSite != null) {
            String ss = sameSite.toLowerCase(Locale.ROOT);
            if ("strict".equals(ss) || "lax".equals(ss) || "none".equals(ss)) {
                buf.append("; SameSite=");
                buf.append(sameSite);
            }
        }
        return buf.toString();
    }

    static String formatExpires(Object expires) {
        if (expires == null) {
            return null;
        }
        if (expires instanceof Number) {
            long seconds = ((Number) expires).longValue();
            if (seconds < 0L) {
                seconds = EXPIRE_NOW_OFFSET;
            }
            DateFormat format = new HTTPDateFormat();
            return format.format(new Date(System.currentTimeMillis() + seconds * 1000L));
        }
        String s = expires.toString();
        return s.isEmpty() ? null : s;
    }

    /**
     * Decodes a Cookie request header into cookie names and values.
     * <p>
     * If the header contains a double quote, it is parsed with the strict
     * cookie grammar, which understands quoted values. Should that fail,
     * each semicolon-separated segment is parsed on its own and the
     * segments that still fail are dropped.
     * <p>
     * Otherwise the header is simply split on semicolons and each segment
     * on its first equals sign; segments without one are dropped.
     * <p>
     * In both cases values are percent-decoded as UTF-8.
     *
     * @param header the Cookie header value, may be null
     * @return an ordered map of cookie names to values, never null
     */
    public static Map<String, String> decode(String header) {
        if (header == null || header.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, String> raw;
        if (header.indexOf('"') >= 0) {
            raw = decodeQuoted(header);
        } else {
            raw = decodeSimple(header);
        }
        Map<String, String> cookies = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : raw.entrySet()) {
            cookies.put(entry.getKey(), PercentCodec.decode(entry.getValue(), StandardCharsets.UTF_8, false));
        }
        return cookies;
    }

    private static Map<String, String> decodeQuoted(String header) {
        try {
            return new CookieParser(header).parse();
        } catch (CookieParseException e) {
            if (LOGGER.isLoggable(Level.FINE)) {
                String message = MessageFormat.format(CookieParser.L10N.getString("log.recovering"), e.getMessage());
                LOGGER.fine(message);
            }
        }
        Map<String, String> cookies = new LinkedHashMap<>();
        for (String segment : header.split(";")) {
            try {
                cookies.putAll(new CookieParser(segment).parse());
            } catch (CookieParseException e) {
                LOGGER.log(Level.FINEST, e.getMessage(), e);
            }
        }
        return cookies;
    }

    private static Map<String, String> decodeSimple(String header) {
        Map<String, String> cookies = new LinkedHashMap<>();
        for (String segment : header.split(";")) {
            int ei = segment.indexOf('=');
            if (ei < 0) {
                continue;
            }
            String name = segment.substring(0, ei).trim();
            String value = segment.substring(ei + 1).trim();
            cookies.put(name, value);
        }
        return cookies;
    }

}
