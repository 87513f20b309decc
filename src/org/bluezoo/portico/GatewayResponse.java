/*
 * GatewayResponse.java
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

import org.bluezoo.portico.http.Header;

import java.util.Collections;
import java.util.List;

/**
 * What the gateway writes to the client once a request has been handled:
 * the status line, the headers queued on the context and the body.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class GatewayResponse {

    private final String status;
    private final List<Header> headers;
    private final byte[] body;

    GatewayResponse(String status, List<Header> headers, byte[] body) {
        this.status = status;
        this.headers = Collections.unmodifiableList(headers);
        this.body = body;
    }

    /**
     * Returns the status line, e.g. "200 OK".
     */
    public String getStatus() {
        return status;
    }

    /**
     * Returns the numeric status code.
     */
    public int getStatusCode() {
        int si = status.indexOf(' ');
        return Integer.parseInt((si < 0) ? status : status.substring(0, si));
    }

    public List<Header> getHeaders() {
        return headers;
    }

    public String getHeader(String name) {
        for (Header header : headers) {
            if (name.equalsIgnoreCase(header.getName())) {
                return header.getValue();
            }
        }
        return null;
    }

    public byte[] getBody() {
        return body;
    }

    @Override
    public String toString() {
        return "GatewayResponse[" + status + ", " + headers.size() + " headers, " + body.length + " bytes]";
    }

}
