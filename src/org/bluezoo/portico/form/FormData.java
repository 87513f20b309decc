/*
 * FormData.java
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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The result of decoding a form body: text fields and uploaded files,
 * each keyed by field name in order of first submission.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class FormData {

    private static final FormData EMPTY = new FormData(
            Collections.<String, FieldValue<String>>emptyMap(),
            Collections.<String, FieldValue<FileUpload>>emptyMap());

    private final Map<String, FieldValue<String>> fields;
    private final Map<String, FieldValue<FileUpload>> files;

    public FormData(Map<String, FieldValue<String>> fields, Map<String, FieldValue<FileUpload>> files) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.files = Collections.unmodifiableMap(new LinkedHashMap<>(files));
    }

    public static FormData empty() {
        return EMPTY;
    }

    public Map<String, FieldValue<String>> getFields() {
        return fields;
    }

    public Map<String, FieldValue<FileUpload>> getFiles() {
        return files;
    }

    public boolean isEmpty() {
        return fields.isEmpty() && files.isEmpty();
    }

    /**
     * Releases every uploaded file.
     */
    public void release() {
        for (FieldValue<FileUpload> value : files.values()) {
            for (FileUpload file : value.getValues()) {
                file.release();
            }
        }
    }

    @Override
    public String toString() {
        return "FormData[fields=" + fields + ", files=" + files.keySet() + "]";
    }

}
