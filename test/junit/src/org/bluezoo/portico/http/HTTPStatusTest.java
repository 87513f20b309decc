/*
 * HTTPStatusTest.java
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

import org.junit.Test;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link HTTPStatus}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class HTTPStatusTest {

    @Test
    public void testStatusLine() {
        assertEquals("200 OK", HTTPStatus.OK.getStatusLine());
        assertEquals("404 Not Found", HTTPStatus.NOT_FOUND.getStatusLine());
        assertEquals("451 Unavailable For Legal Reasons", HTTPStatus.UNAVAILABLE_FOR_LEGAL_REASONS.toString());
    }

    @Test
    public void testFromCode() {
        assertSame(HTTPStatus.SEE_OTHER, HTTPStatus.fromCode(303));
        assertSame(HTTPStatus.INTERNAL_SERVER_ERROR, HTTPStatus.fromCode(500));
        assertNull(HTTPStatus.fromCode(418));
    }

    @Test
    public void testKinds() {
        for (HTTPStatus status : HTTPStatus.values()) {
            HTTPStatus.Kind expected;
            if (status.code < 300) {
                expected = HTTPStatus.Kind.SUCCESS;
            } else if (status.code < 400) {
                expected = HTTPStatus.Kind.REDIRECT;
            } else {
                expected = HTTPStatus.Kind.ERROR;
            }
            assertEquals(status.name(), expected, status.getKind());
        }
    }

    @Test
    public void testDelegating() {
        for (HTTPStatus status : HTTPStatus.values()) {
            boolean expected = status.code == 404 || status.code == 451 || status.code == 500;
            assertEquals(status.name(), expected, status.isDelegating());
        }
    }

    @Test
    public void testDefaults() {
        assertEquals("not found", HTTPStatus.NOT_FOUND.getDefaultMessage());
        assertEquals("Created", HTTPStatus.CREATED.getDefaultMessage());
        assertEquals("", HTTPStatus.OK.getDefaultMessage());
        assertEquals("text/html", HTTPStatus.FOUND.getContentType());
        assertNull("304 queues no headers", HTTPStatus.NOT_MODIFIED.getContentType());
        assertNull(HTTPStatus.OK.getContentType());
    }

}
