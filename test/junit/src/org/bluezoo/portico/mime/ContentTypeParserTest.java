/*
 * ContentTypeParserTest.java
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

package org.bluezoo.portico.mime;

import org.junit.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link ContentTypeParser} and
 * {@link ContentDispositionParser}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ContentTypeParserTest {

    @Test
    public void testSimple() {
        ContentType ct = ContentTypeParser.parse("text/plain");

        assertNotNull(ct);
        assertEquals("text", ct.getPrimaryType());
        assertEquals("plain", ct.getSubType());
        assertTrue(ct.getParameters().isEmpty());
    }

    @Test
    public void testCaseInsensitiveMatch() {
        ContentType ct = ContentTypeParser.parse("Multipart/Form-Data; Boundary=abc");

        assertTrue(ct.isMimeType("multipart/form-data"));
        assertTrue(ct.isPrimaryType("MULTIPART"));
        assertEquals("Parameter names are case insensitive", "abc", ct.getParameter("boundary"));
    }

    @Test
    public void testQuotedParameter() {
        ContentType ct = ContentTypeParser.parse("multipart/form-data; boundary=\"a b;c\"; charset=utf-8");

        assertEquals("a b;c", ct.getParameter("boundary"));
        assertEquals(StandardCharsets.UTF_8, ct.getCharset(StandardCharsets.ISO_8859_1));
    }

    @Test
    public void testCharsetDefault() {
        assertEquals(StandardCharsets.ISO_8859_1,
                ContentTypeParser.parse("text/plain").getCharset(StandardCharsets.ISO_8859_1));
        assertEquals("Unknown charset falls back", StandardCharsets.UTF_8,
                ContentTypeParser.parse("text/plain; charset=x-no-such").getCharset(StandardCharsets.UTF_8));
    }

    @Test
    public void testInvalid() {
        assertNull(ContentTypeParser.parse(null));
        assertNull(ContentTypeParser.parse(""));
        assertNull(ContentTypeParser.parse("text"));
        assertNull(ContentTypeParser.parse("text/"));
        assertNull(ContentTypeParser.parse("te xt/plain"));
    }

    @Test
    public void testMalformedParameterSkipped() {
        ContentType ct = ContentTypeParser.parse("text/plain; flag; charset=utf-8");

        assertEquals("utf-8", ct.getParameter("charset"));
        assertNull(ct.getParameter("flag"));
    }

    @Test
    public void testContentDisposition() {
        ContentDisposition cd = ContentDispositionParser.parse("form-data; name=\"file\"; filename=\"a b.txt\"");

        assertTrue(cd.isDispositionType("FORM-DATA"));
        assertEquals("file", cd.getParameter("name"));
        assertEquals("a b.txt", cd.getParameter("filename"));
        assertTrue(cd.hasParameter("filename"));
        assertFalse(cd.hasParameter("size"));
    }

    @Test
    public void testExtendedFilename() {
        ContentDisposition cd = ContentDispositionParser.parse(
                "form-data; name=\"f\"; filename=\"plain.txt\"; filename*=UTF-8''Z%C3%A9.txt");

        assertEquals("Extended value preferred", "Zé.txt", cd.getParameter("filename"));
    }

}
