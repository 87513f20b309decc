/*
 * Headers.java
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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * The ordered outbound header sequence of a response.
 * Insertion order is preserved and is the order in which the gateway
 * writes the headers; lookups by name are case-insensitive.
 * New headers are added through {@link HeaderGuard#emit}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class Headers extends ArrayList<Header> {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an empty headers collection.
     */
    public Headers() {
        super();
    }

    /**
     * Creates a headers collection containing the headers from the specified collection.
     *
     * @param headers the collection of headers to copy
     */
    public Headers(Collection<? extends Header> headers) {
        super(headers);
    }

    /**
     * Returns the value of the first header with the specified name.
     *
     * @param name the header name
     * @return the header value, or null if no header with that name exists
     */
    public String getValue(String name) {
        for (Header header : this) {
            if (name.equalsIgnoreCase(header.getName())) {
                return header.getValue();
            }
        }
        return null;
    }

    /**
     * Returns all values for headers with the specified name, in order.
     *
     * @param name the header name
     * @return a list of header values (may be empty, never null)
     */
    public List<String> getValues(String name) {
        List<String> values = new ArrayList<>();
        for (Header header : this) {
            if (name.equalsIgnoreCase(header.getName())) {
                values.add(header.getValue());
            }
        }
        return values;
    }

    /**
     * Returns true if a header with the specified name exists.
     *
     * @param name the header name
     * @return true if the header exists
     */
    public boolean containsName(String name) {
        for (Header header : this) {
            if (name.equalsIgnoreCase(header.getName())) {
                return true;
            }
        }
        return false;
    }

}
