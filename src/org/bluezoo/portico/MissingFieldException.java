/*
 * MissingFieldException.java
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

/**
 * A required request value was not submitted.
 * {@link Context#input} and {@link Context#cookies} turn this into a
 * 400 Bad Request outcome.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class MissingFieldException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String name;

    public MissingFieldException(String message, String name) {
        super(message);
        this.name = name;
    }

    public String getName() {
        return name;
    }

}
