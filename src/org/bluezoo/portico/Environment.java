/*
 * Environment.java
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

package org.bluezoo.portico;

import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only view of the per-request environment supplied by the gateway:
 * CGI-style protocol metadata plus the request body stream.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Environment {

    public static final String REQUEST_METHOD = "REQUEST_METHOD";
    public static final String CONTENT_TYPE = "CONTENT_TYPE";
    public static final String CONTENT_LENGTH = "CONTENT_LENGTH";
    public static final String HTTP_TRANSFER_ENCODING = "HTTP_TRANSFER_ENCODING";
    public static final String HTTP_COOKIE = "HTTP_COOKIE";
    public static final String QUERY_STRING = "QUERY_STRING";
    public static final String PATH_INFO = "PATH_INFO";
    public static final String SCRIPT_NAME = "SCRIPT_NAME";
    public static final String REAL_SCRIPT_NAME = "REAL_SCRIPT_NAME";
    public static final String HTTP_HOST = "HTTP_HOST";
    public static final String HTTPS = "HTTPS";
    public static final String REMOTE_ADDR = "REMOTE_ADDR";

    /** The request body, an {@link InputStream}. */
    public static final String INPUT = "portico.input";
    /** Where {@link Context#debug} writes, an OutputStream or Writer. */
    public static final String ERRORS = "portico.errors";
    /** The URL scheme, if not implied by {@link #HTTPS}. */
    public static final String URL_SCHEME = "portico.url_scheme";

    private final Map<String, Object> map;

    public Environment(Map<String, ?> map) {
        this.map = Collections.unmodifiableMap(new LinkedHashMap<String, Object>(map));
    }

    public Object get(String key) {
        return map.get(key);
    }

    /**
     * Returns the string value of a variable.
     * @param key the variable name
     * @return the value, or null if not set
     */
    public String getString(String key) {
        Object value = map.get(key);
        return (value == null) ? null : value.toString();
    }

    public String getString(String key, String defaultValue) {
        String value = getString(key);
        return (value == null) ? defaultValue : value;
    }

    public boolean containsKey(String key) {
        return map.containsKey(key);
    }

    /**
     * Returns the request body stream, or null if there is none.
     */
    public InputStream getInputStream() {
        Object value = map.get(INPUT);
        return (value instanceof InputStream) ? (InputStream) value : null;
    }

    public Map<String, Object> asMap() {
        return map;
    }

    @Override
    public String toString() {
        return map.toString();
    }

}
