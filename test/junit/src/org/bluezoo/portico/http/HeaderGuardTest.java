/*
 * HeaderGuardTest.java
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

import org.junit.Before;
import org.junit.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link HeaderGuard}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class HeaderGuardTest {

    private Headers headers;

    @Before
    public void setUp() {
        headers = new Headers();
    }

    @Test
    public void testEmit() {
        HeaderGuard.emit(headers, "Content-Type", "text/plain");
        HeaderGuard.emit(headers, "X-Count", Integer.valueOf(3));

        assertEquals(2, headers.size());
        assertEquals("Content-Type", headers.get(0).getName());
        assertEquals("text/plain", headers.get(0).getValue());
        assertEquals("3", headers.getValue("x-count"));
    }

    @Test
    public void testEmitBytes() {
        HeaderGuard.emit(headers, "X-Name".getBytes(StandardCharsets.UTF_8), "Zé".getBytes(StandardCharsets.UTF_8));

        assertEquals("Zé", headers.getValue("X-Name"));
    }

    @Test
    public void testDuplicatesAllowed() {
        HeaderGuard.emit(headers, "Set-Cookie", "a=1");
        HeaderGuard.emit(headers, "Set-Cookie", "b=2");

        assertEquals(2, headers.getValues("set-cookie").size());
    }

    @Test
    public void testUnique() {
        assertTrue(HeaderGuard.emit(headers, "Location", "/a", true));
        assertFalse("Second unique header dropped", HeaderGuard.emit(headers, "location", "/b", true));

        assertEquals(1, headers.size());
        assertEquals("/a", headers.getValue("Location"));
    }

    @Test
    public void testLineBreakInValueRejected() {
        String[] values = { "a\r\nSet-Cookie: evil=1", "a\nb", "a\rb" };
        for (String value : values) {
            try {
                HeaderGuard.emit(headers, "X-Test", value);
                fail("Expected InvalidHeaderException for " + value);
            } catch (InvalidHeaderException e) {
                assertNotNull(e.getMessage());
            }
        }
        assertTrue("Nothing was queued", headers.isEmpty());
    }

    @Test
    public void testLineBreakInNameRejected() {
        try {
            HeaderGuard.emit(headers, "X-Test\r\nX-Evil", "1");
            fail("Expected InvalidHeaderException");
        } catch (InvalidHeaderException e) {
            assertFalse("Message does not carry raw line breaks", e.getMessage().contains("\n"));
        }
        assertTrue(headers.isEmpty());
    }

    @Test
    public void testInvalidHeaderIsIllegalArgument() {
        try {
            HeaderGuard.emit(headers, "X-Test", "a\nb", true);
            fail("Expected exception");
        } catch (IllegalArgumentException e) {
            assertTrue(e instanceof InvalidHeaderException);
        }
    }

}
