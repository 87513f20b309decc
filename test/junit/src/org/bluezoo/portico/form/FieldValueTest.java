/*
 * FieldValueTest.java
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

import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link FieldValue} and the scalar collapse of
 * url-encoded data.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class FieldValueTest {

    @Test
    public void testSingleValueIsScalar() {
        FieldValue<String> value = FieldValue.collapse(Collections.singletonList("2"));

        assertFalse(value.isSequence());
        assertEquals("2", value.getValue());
        assertEquals("2", value.toObject());
        assertEquals("2", value.getLast());
        assertEquals(Collections.singletonList("2"), value.getValues());
    }

    @Test
    public void testRepeatedValuesAreSequence() {
        FieldValue<String> value = FieldValue.collapse(Arrays.asList("1", "2"));

        assertTrue(value.isSequence());
        assertEquals(Arrays.asList("1", "2"), value.toObject());
        assertEquals("2", value.getLast());
        try {
            value.getValue();
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) {
            // expected
        }
    }

    @Test
    public void testValuesAreImmutable() {
        List<String> source = new ArrayList<>(Arrays.asList("1", "2"));
        FieldValue<String> value = FieldValue.collapse(source);
        source.add("3");

        assertEquals("Copy is independent of its source", 2, value.getValues().size());
        try {
            value.getValues().add("4");
            fail("Expected UnsupportedOperationException");
        } catch (UnsupportedOperationException e) {
            // expected
        }
    }

    @Test
    public void testEquality() {
        assertEquals(FieldValue.of("a"), FieldValue.collapse(Collections.singletonList("a")));
        assertNotEquals(FieldValue.of("a"), FieldValue.collapse(Arrays.asList("a", "a")));
        assertEquals(FieldValue.of("a").hashCode(), FieldValue.collapse(Collections.singletonList("a")).hashCode());
    }

    @Test
    public void testQueryStringCollapse() {
        Map<String, FieldValue<String>> fields = URLEncodedParser.parseFields("x=2&y=1&y=2", StandardCharsets.UTF_8);

        assertEquals(2, fields.size());
        assertEquals(FieldValue.of("2"), fields.get("x"));
        assertEquals(Arrays.asList("1", "2"), fields.get("y").toObject());
    }

    @Test
    public void testEmptyPairsSkipped() {
        Map<String, List<String>> fields = URLEncodedParser.parse("&&a=1&&", StandardCharsets.UTF_8);

        assertEquals(1, fields.size());
        assertEquals(Collections.singletonList("1"), fields.get("a"));
    }

    @Test
    public void testEmptyString() {
        assertTrue(URLEncodedParser.parseFields("", StandardCharsets.UTF_8).isEmpty());
    }

}
