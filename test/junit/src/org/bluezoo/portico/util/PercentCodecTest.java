/*
 * PercentCodecTest.java
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

import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link PercentCodec} and {@link StreamUtils}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class PercentCodecTest {

    @Test
    public void testDecodePlain() {
        assertEquals("abc", PercentCodec.decode("abc", StandardCharsets.UTF_8, true));
    }

    @Test
    public void testDecodeMultibyte() {
        assertEquals("Zé", PercentCodec.decode("Z%C3%A9", StandardCharsets.UTF_8, false));
        assertEquals("Zé", PercentCodec.decode("Z%c3%a9", StandardCharsets.UTF_8, false));
        assertEquals("Zé", PercentCodec.decode("Z%E9", StandardCharsets.ISO_8859_1, false));
    }

    @Test
    public void testDecodePlus() {
        assertEquals("a b", PercentCodec.decode("a+b", StandardCharsets.UTF_8, true));
        assertEquals("Cookie values keep '+'", "a+b", PercentCodec.decode("a+b", StandardCharsets.UTF_8, false));
        assertEquals("a+b", PercentCodec.decode("a%2Bb", StandardCharsets.UTF_8, true));
    }

    @Test
    public void testDecodeInvalidEscapesKept() {
        assertEquals("100%", PercentCodec.decode("100%", StandardCharsets.UTF_8, false));
        assertEquals("%zz", PercentCodec.decode("%zz", StandardCharsets.UTF_8, false));
        assertEquals("%4", PercentCodec.decode("%4", StandardCharsets.UTF_8, false));
    }

    @Test
    public void testEncode() {
        assertEquals("a%20b", PercentCodec.encode("a b", StandardCharsets.UTF_8, ""));
        assertEquals("/path/x", PercentCodec.encode("/path/x", StandardCharsets.UTF_8, "/"));
        assertEquals("%2Fpath", PercentCodec.encode("/path", StandardCharsets.UTF_8, ""));
        assertEquals("Z%C3%A9", PercentCodec.encode("Zé", StandardCharsets.UTF_8, ""));
        assertEquals("a-b_c.d~e", PercentCodec.encode("a-b_c.d~e", StandardCharsets.UTF_8, ""));
    }

    @Test
    public void testReadStream() throws Exception {
        byte[] data = "hello world".getBytes(StandardCharsets.US_ASCII);

        assertEquals("hello", new String(StreamUtils.read(new ByteArrayInputStream(data), 5L),
                StandardCharsets.US_ASCII));
        assertEquals("Negative length reads to end", 11,
                StreamUtils.read(new ByteArrayInputStream(data), -1L).length);
        assertEquals("Short stream returns what it has", 11,
                StreamUtils.read(new ByteArrayInputStream(data), 100L).length);
        assertEquals(0, StreamUtils.read(null, 10L).length);
        assertEquals(0, StreamUtils.read(new ByteArrayInputStream(data), 0L).length);
    }

}
