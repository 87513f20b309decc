/*
 * FieldSpec.java
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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Describes the request values an application expects: which names are
 * required, what absent names default to, and how values are presented.
 * <pre>
 * Storage i = ctx.input(FieldSpec.required("title")
 *         .defaultValue("page", "1")
 *         .defaultList("tag")
 *         .defaultFile("attachment"));
 * </pre>
 * <ul>
 * <li>A name given to {@link #defaultList} is always a {@code List}, with
 * every submitted value (uploaded files as their content), and is empty
 * if nothing was submitted.</li>
 * <li>A name given to {@link #defaultFile} keeps its uploaded file as a
 * {@link org.bluezoo.portico.form.FileUpload} and is null if nothing was
 * submitted.</li>
 * <li>Any other name submitted more than once takes its last value;
 * uploaded files are presented as their content, a {@code byte[]}.</li>
 * </ul>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class FieldSpec {

    /**
     * How a default is applied.
     */
    enum Kind {
        VALUE,
        LIST,
        FILE;
    }

    static final class Default {

        final Kind kind;
        final Object value;

        Default(Kind kind, Object value) {
            this.kind = kind;
            this.value = value;
        }
    }

    private final Set<String> required = new LinkedHashSet<>();
    private final Map<String, Default> defaults = new LinkedHashMap<>();
    private String method;
    private Boolean unicode;

    public static FieldSpec create() {
        return new FieldSpec();
    }

    public static FieldSpec required(String... names) {
        return new FieldSpec().require(names);
    }

    public FieldSpec require(String... names) {
        Collections.addAll(required, names);
        return this;
    }

    public FieldSpec defaultValue(String name, Object value) {
        defaults.put(name, new Default(Kind.VALUE, value));
        return this;
    }

    public FieldSpec defaultList(String name) {
        defaults.put(name, new Default(Kind.LIST, null));
        return this;
    }

    public FieldSpec defaultFile(String name) {
        defaults.put(name, new Default(Kind.FILE, null));
        return this;
    }

    /**
     * Selects where {@link Context#input} takes values from: "get" (the
     * query string), "post" (the body; "put" and "patch" are synonyms) or
     * "both", the default, where body values win.
     */
    public FieldSpec method(String method) {
        this.method = method;
        return this;
    }

    /**
     * Sets whether text values are normalized (Unicode NFC). This is on by
     * default for {@link Context#input} and off for {@link Context#cookies}.
     * Normalization can change the submitted characters, so turn it off for
     * values compared exactly, such as passwords.
     */
    public FieldSpec unicode(boolean unicode) {
        this.unicode = Boolean.valueOf(unicode);
        return this;
    }

    Set<String> getRequired() {
        return required;
    }

    Map<String, Default> getDefaults() {
        return defaults;
    }

    Kind getKind(String name) {
        Default d = defaults.get(name);
        return (d == null) ? Kind.VALUE : d.kind;
    }

    String getMethod() {
        return method;
    }

    boolean isUnicode(boolean defaultValue) {
        return (unicode == null) ? defaultValue : unicode.booleanValue();
    }

}
