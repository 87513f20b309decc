/*
 * HTTPDateFormat.java
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

import java.text.SimpleDateFormat;
import java.util.Locale;
import java.util.TimeZone;

/**
 * The RFC 1123 date format used in HTTP headers such as the cookie
 * {@code expires} attribute, e.g. {@code Fri, 15 Nov 2024 12:30:45 GMT}.
 * Day of month is always two digits.
 * <p>
 * Like any {@link java.text.DateFormat}, instances are not thread safe.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class HTTPDateFormat extends SimpleDateFormat {

    private static final long serialVersionUID = 1L;

    public HTTPDateFormat() {
        super("EEE, dd MMM yyyy HH:mm:ss 'GMT'", Locale.US);
        setTimeZone(TimeZone.getTimeZone("GMT"));
    }

}
