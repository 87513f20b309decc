/*
 * UnsupportedContentTypeException.java
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

/**
 * The request body has a content type that is neither
 * {@code application/x-www-form-urlencoded} nor
 * {@code multipart/form-data}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class UnsupportedContentTypeException extends DecodeException {

    private static final long serialVersionUID = 1L;

    private final String contentType;

    public UnsupportedContentTypeException(String message, String contentType) {
        super(message);
        this.contentType = contentType;
    }

    /**
     * Returns the offending content type, as sent by the client.
     */
    public String getContentType() {
        return contentType;
    }

}
