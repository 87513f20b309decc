/*
 * CookieCodecTest.java
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
import org.junit.Test;

import java.util.Date;
import java.util.Map;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link CookieCodec}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class CookieCodecTest {

    // ===== Decode Tests =====

    @Test
    public void testDecodeEmpty() {
        assertTrue(CookieCodec.decode("").isEmpty());
        assertTrue(CookieCodec.decode(null).isEmpty());
    }

    @Test
    public void testDecodeSimple() {
        Map<String, String> cookies = CookieCodec.decode("a=1");

        assertEquals(1, cookies.size());
        assertEquals("1", cookies.get("a"));
    }

    @Test
    public void testDecodePercentEscapes() {
        assertEquals("1 2", CookieCodec.decode("a=1%202").get("a"));
        assertEquals("ZéZ", CookieCodec.decode("a=Z%C3%A9Z").get("a"));
        assertEquals("Plus is not a space", "1+2", CookieCodec.decode("a=1+2").get("a"));
    }

    @Test
    public void testDecodeSeveral() {
        Map<String, String> cookies = CookieCodec.decode("a=1; b=2; c=3");

        assertEquals(3, cookies.size());
        assertEquals("1", cookies.get("a"));
        assertEquals("2", cookies.get("b"));
        assertEquals("3", cookies.get("c"));
    }

    @Test
    public void testDecodeQuoted() {
        assertEquals("E=mc2", CookieCodec.decode("keebler=\"E=mc2\"").get("keebler"));
    }

    @Test
    public void testDecodeQuotedEscapes() {
        Map<String, String> cookies = CookieCodec.decode("keebler=\"E=mc2; L=\\\"Loves\\\"; fudge=\\012;\"");

        assertEquals("E=mc2; L=\"Loves\"; fudge=\n;", cookies.get("keebler"));
    }

    @Test
    public void testDecodeUnquotedEquals() {
        assertEquals("E=mc2", CookieCodec.decode("keebler=E=mc2").get("keebler"));
    }

    @Test
    public void testDecodeIllegalCharactersInValue() {
        Map<String, String> cookies = CookieCodec.decode("a=1; b=w(%22x%22)|y=z; c=3");

        assertEquals("1", cookies.get("a"));
        assertEquals("w(\"x\")|y=z", cookies.get("b"));
        assertEquals("3", cookies.get("c"));
    }

    @Test
    public void testDecodeWhitespaceTrimmed() {
        Map<String, String> cookies = CookieCodec.decode("  a = 1 ;b=2");

        assertEquals("1", cookies.get("a"));
        assertEquals("2", cookies.get("b"));
    }

    @Test
    public void testDecodeSegmentWithoutEquals() {
        Map<String, String> cookies = CookieCodec.decode("a=1; junk; b=2");

        assertEquals(2, cookies.size());
        assertFalse(cookies.containsKey("junk"));
    }

    @Test
    public void testDecodeMalformedNeverThrows() {
        String[] headers = {
            "\"",
            "a=\"unterminated",
            "=",
            ";;;",
            "a=1; \"b\"=2",
            "na[me]=\"x\"; ok=\"y\"",
            "\u00e9=\"1\"",
        };
        for (String header : headers) {
            assertNotNull(header, CookieCodec.decode(header));
        }
    }

    @Test
    public void testDecodeRecoversGoodSegments() {
        Map<String, String> cookies = CookieCodec.decode("a(b)=\"x\"; ok=\"y\"");

        assertEquals(1, cookies.size());
        assertEquals("y", cookies.get("ok"));
    }

    // ===== Encode Tests =====

    @Test
    public void testEncodeMinimal() {
        assertEquals("a=1", CookieCodec.encode("a", "1", null, null, false, false, null, null));
    }

    @Test
    public void testEncodeValueEscaped() {
        assertEquals("a=x%20y%3B/z", CookieCodec.encode("a", "x y;/z", null, null, false, false, null, null));
    }

    @Test
    public void testEncodeAttributeOrder() {
        String header = CookieCodec.encode("sid", "abc", "Thu, 01 Jan 2099 00:00:00 GMT", "example.com",
                true, true, "/app/", "Lax");

        assertEquals("sid=abc; expires=Thu, 01 Jan 2099 00:00:00 GMT; path=/app/; domain=example.com"
                + "; Secure; HttpOnly; SameSite=Lax", header);
    }

    @Test
    public void testEncodeEmptyExpires() {
        assertEquals("a=1; path=/", CookieCodec.encode("a", "1", "", null, false, false, "/", null));
    }

    @Test
    public void testEncodeExpiresSeconds() throws Exception {
        long before = System.currentTimeMillis();
        String expires = CookieCodec.formatExpires(Integer.valueOf(3600));
        Date date = new HTTPDateFormat().parse(expires);

        assertTrue(expires.endsWith(" GMT"));
        long delta = date.getTime() - before;
        assertTrue("About an hour ahead: " + delta, delta > 3590000L && delta <= 3601000L);
    }

    @Test
    public void testEncodeNegativeExpiresIsPast() throws Exception {
        String expires = CookieCodec.formatExpires(Integer.valueOf(-1));
        Date date = new HTTPDateFormat().parse(expires);

        assertTrue("Expiry decades in the past", date.getTime() < System.currentTimeMillis() - 365L * 24 * 3600 * 1000 * 20);
    }

    @Test
    public void testEncodeSameSite() {
        assertTrue(CookieCodec.encode("a", "1", null, null, false, false, null, "strict").endsWith("; SameSite=strict"));
        assertTrue(CookieCodec.encode("a", "1", null, null, false, false, null, "None").endsWith("; SameSite=None"));
        assertEquals("Unknown SameSite ignored", "a=1",
                CookieCodec.encode("a", "1", null, null, false, false, null, "sometimes"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEncodeIllegalName() {
        CookieCodec.encode("bad name", "1", null, null, false, false, null, null);
    }

}
