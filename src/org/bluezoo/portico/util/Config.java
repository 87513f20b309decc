/*
 * Config.java
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

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;

/**
 * Library-wide defaults, taken from system properties.
 * <ul>
 * <li>{@code portico.debug}: whether an unexpected failure while handling
 * a request is reported to the client with its stack trace instead of the
 * plain internal error message (default false)</li>
 * <li>{@code portico.charset}: charset assumed for form data and cookie
 * values that do not declare one (default UTF-8)</li>
 * <li>{@code portico.multipart.location}: directory for upload temporary
 * files (default {@code java.io.tmpdir})</li>
 * <li>{@code portico.multipart.fileSizeThreshold}: bytes of a part kept
 * in memory before it is spooled to disk (default 262144)</li>
 * <li>{@code portico.multipart.maxFileSize}: maximum size of a single part
 * (default -1, unlimited)</li>
 * <li>{@code portico.multipart.maxRequestSize}: maximum size of a
 * multipart body (default -1, unlimited)</li>
 * </ul>
 * Properties are read each time they are asked for.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Config {

    public static final String DEBUG = "portico.debug";
    public static final String CHARSET = "portico.charset";
    public static final String MULTIPART_LOCATION = "portico.multipart.location";
    public static final String MULTIPART_FILE_SIZE_THRESHOLD = "portico.multipart.fileSizeThreshold";
    public static final String MULTIPART_MAX_FILE_SIZE = "portico.multipart.maxFileSize";
    public static final String MULTIPART_MAX_REQUEST_SIZE = "portico.multipart.maxRequestSize";

    private Config() {
        // Static utility class
    }

    public static boolean isDebug() {
        return Boolean.getBoolean(DEBUG);
    }

    /**
     * Returns the default charset. An unknown charset name falls back to
     * UTF-8.
     */
    public static Charset getCharset() {
        String name = System.getProperty(CHARSET);
        if (name == null || name.isEmpty()) {
            return StandardCharsets.UTF_8;
        }
        try {
            return Charset.forName(name);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            return StandardCharsets.UTF_8;
        }
    }

    public static String getMultipartLocation() {
        return System.getProperty(MULTIPART_LOCATION, System.getProperty("java.io.tmpdir"));
    }

    public static long getFileSizeThreshold() {
        return Long.getLong(MULTIPART_FILE_SIZE_THRESHOLD, 262144L).longValue();
    }

    public static long getMaxFileSize() {
        return Long.getLong(MULTIPART_MAX_FILE_SIZE, -1L).longValue();
    }

    public static long getMaxRequestSize() {
        return Long.getLong(MULTIPART_MAX_REQUEST_SIZE, -1L).longValue();
    }

}
