/*
 * Header.java
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

/**
 * An outbound response header: a name/value pair in transport string form.
 * Instances are only created by {@link HeaderGuard}, so neither part ever
 * contains a CR or LF.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Header {

    private final String name;
    private final String value;

    Header(String name, String value) {
        this.name = name;
        this.value = value;
    }

    public String getName() {
        return name;
    }

    public String getValue() {
        return value;
    }

    @Override
    public int hashCode() {
        return name.toLowerCase().hashCode() * 31 + value.hashCode();
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof Header)) {
            return false;
        }
        Header o = (Header) other;
        return name.equalsIgnoreCase(o.name) && value.equals(o.value);
    }

    @Override
    public String toString() {
        return name + ": " + value;
    }

}
