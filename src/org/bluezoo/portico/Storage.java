/*
 * Storage.java
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

import org.bluezoo.portico.form.FileUpload;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Validated request values, as returned by {@link Context#input} and
 * {@link Context#cookies}.
 * <p>
 * An ordered map from name to value. Looking up a name that is not
 * present yields null. Values are strings, byte arrays (uploaded file
 * content), {@link FileUpload}s or lists of these, depending on the
 * {@link FieldSpec} used.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class Storage extends LinkedHashMap<String, Object> {

    private static final long serialVersionUID = 1L;

    /**
     * Returns a value as text. Content held as bytes, such as a large text
     * field spooled like an upload, is decoded as UTF-8.
     */
    public String getString(String name) {
        Object value = get(name);
        if (value instanceof byte[]) {
            return new String((byte[]) value, StandardCharsets.UTF_8);
        }
        return (value == null) ? null : value.toString();
    }

    public String getString(String name, String defaultValue) {
        String value = getString(name);
        return (value == null) ? defaultValue : value;
    }

    /**
     * Returns a list value, as collected for names declared with
     * {@link FieldSpec#defaultList}.
     * @exception ClassCastException if the value is not a list
     */
    @SuppressWarnings("unchecked")
    public List<Object> getList(String name) {
        return (List<Object>) get(name);
    }

    /**
     * Returns an uploaded file kept for a name declared with
     * {@link FieldSpec#defaultFile}, or null if the value is not a file.
     */
    public FileUpload getFile(String name) {
        Object value = get(name);
        return (value instanceof FileUpload) ? (FileUpload) value : null;
    }

    /**
     * Returns the content of an uploaded file, or null if the value is not
     * file content.
     */
    public byte[] getBytes(String name) {
        Object value = get(name);
        return (value instanceof byte[]) ? (byte[]) value : null;
    }

}
