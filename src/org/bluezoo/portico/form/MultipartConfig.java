/*
 * MultipartConfig.java
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

import org.bluezoo.portico.util.Config;

/**
 * Storage limits for multipart/form-data decoding.
 * <p>
 * A new instance takes its values from {@link Config}; fields may then be
 * assigned directly. Sizes are in bytes, and a negative maximum means no
 * limit.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class MultipartConfig {

    /** Directory in which parts over the threshold are stored. */
    public String location;

    /** Number of bytes of a part held in memory before it is spooled. */
    public long fileSizeThreshold;

    /** Maximum size of any one part. */
    public long maxFileSize;

    /** Maximum size of the whole multipart body. */
    public long maxRequestSize;

    public MultipartConfig() {
        location = Config.getMultipartLocation();
        fileSizeThreshold = Config.getFileSizeThreshold();
        maxFileSize = Config.getMaxFileSize();
        maxRequestSize = Config.getMaxRequestSize();
    }

    public MultipartConfig(String location, long fileSizeThreshold, long maxFileSize, long maxRequestSize) {
        this.location = location;
        this.fileSizeThreshold = fileSizeThreshold;
        this.maxFileSize = maxFileSize;
        this.maxRequestSize = maxRequestSize;
    }

}
