/*
 * FileUpload.java
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

import java.io.IOException;
import java.io.InputStream;

/**
 * A file uploaded in a multipart/form-data body.
 * <p>
 * The content is always exposed as raw bytes: no charset is ever applied
 * to it, whatever the part declares.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public interface FileUpload {

    /**
     * Returns the form field name this file was submitted under.
     */
    String getName();

    /**
     * Returns the file name supplied by the client, or null if the part did
     * not carry one. The name is not sanitized in any way.
     */
    String getFilename();

    /**
     * Returns the content type declared for the part, or null.
     */
    String getContentType();

    /**
     * Returns the size of the content in bytes.
     */
    long getSize();

    /**
     * Returns the content.
     * @exception IOException if the content was spooled to disk and could
     * not be read back
     */
    byte[] getValue() throws IOException;

    /**
     * Returns a stream over the content.
     */
    InputStream getInputStream() throws IOException;

    /**
     * Discards the content, deleting any temporary file holding it.
     * Calling this more than once has no further effect.
     */
    void release();

}
