/*
 * StreamUtils.java
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
import java.io.IOException;
import java.io.InputStream;

/**
 * Stream helpers.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class StreamUtils {

    private static final int BUFFER_SIZE = 8192;

    private StreamUtils() {
        // Static utility class
    }

    /**
     * Reads bytes from a stream.
     * @param in the stream, may be null (no bytes)
     * @param length the number of bytes to read, or a negative number to
     * read to the end of the stream
     * @return the bytes read; fewer than {@code length} if the stream
     * ended first
     */
    public static byte[] read(InputStream in, long length) throws IOException {
        if (in == null || length == 0L) {
            return new byte[0];
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buf = new byte[BUFFER_SIZE];
        long remaining = length;
        while (length < 0L || remaining > 0L) {
            int max = (length < 0L) ? buf.length : (int) Math.min(buf.length, remaining);
            int len = in.read(buf, 0, max);
            if (len == -1) {
                break;
            }
            out.write(buf, 0, len);
            remaining -= len;
        }
        return out.toByteArray();
    }

}
