/*
 * FieldValue.java
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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The value submitted under one form field name: either a single value or
 * an ordered sequence of values.
 * <p>
 * A field submitted exactly once is a scalar. A field submitted two or
 * more times (or, for an explicitly constructed value, not at all) is a
 * sequence, in submission order. This holds for urlencoded and multipart
 * fields alike, and for uploaded files.
 *
 * @param <T> the value type, {@link String} for text fields and
 * {@link FileUpload} for files
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class FieldValue<T> {

    private final List<T> values;

    private FieldValue(List<T> values) {
        this.values = values;
    }

    /**
     * Creates a field value from the values submitted for a name.
     * @param values the submitted values, in order
     * @return a scalar if there is exactly one value, a sequence otherwise
     */
    public static <T> FieldValue<T> collapse(List<T> values) {
        return new FieldValue<T>(Collections.unmodifiableList(new ArrayList<T>(values)));
    }

    public static <T> FieldValue<T> of(T value) {
        return new FieldValue<T>(Collections.singletonList(value));
    }

    /**
     * Indicates whether this is a sequence rather than a scalar.
     */
    public boolean isSequence() {
        return values.size() != 1;
    }

    /**
     * Returns the scalar value.
     * @exception IllegalStateException if this is a sequence
     */
    public T getValue() {
        if (values.size() != 1) {
            throw new IllegalStateException("sequence of " + values.size() + " values");
        }
        return values.get(0);
    }

    /**
     * Returns all the values in submission order. A scalar yields a
     * one-element list.
     */
    public List<T> getValues() {
        return values;
    }

    /**
     * Returns the last value submitted, or null if there are none.
     */
    public T getLast() {
        return values.isEmpty() ? null : values.get(values.size() - 1);
    }

    /**
     * Returns the scalar value itself, or the list of values for a
     * sequence.
     */
    public Object toObject() {
        return isSequence() ? values : values.get(0);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public boolean equals(Object other) {
        return (other instanceof FieldValue) && values.equals(((FieldValue<?>) other).values);
    }

    @Override
    public String toString() {
        return isSequence() ? values.toString() : String.valueOf(values.get(0));
    }

}
