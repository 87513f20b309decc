/*
 * HTTPOutcome.java
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

import org.bluezoo.portico.http.HTTPStatus;
import org.bluezoo.portico.http.Header;
import org.bluezoo.portico.http.Headers;

import java.util.Collections;
import java.util.List;

/**
 * A complete response decided by application code: status, headers and
 * body. Outcomes are built by {@link HTTPOutcomes} and are immutable.
 * <p>
 * Return an outcome from a {@link Handler}, or throw its
 * {@link #signal()} to end the request from deeper in the call chain.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class HTTPOutcome {

    private final HTTPStatus status;
    private final List<Header> headers;
    private final String body;

    HTTPOutcome(HTTPStatus status, Headers headers, String body) {
        this.status = status;
        this.headers = Collections.unmodifiableList(new Headers(headers));
        this.body = (body == null) ? "" : body;
    }

    public HTTPStatus getStatus() {
        return status;
    }

    public HTTPStatus.Kind getKind() {
        return status.getKind();
    }

    public String getStatusLine() {
        return status.getStatusLine();
    }

    /**
     * Returns the headers this outcome queued on its context, in order.
     */
    public List<Header> getHeaders() {
        return headers;
    }

    /**
     * Returns the first value of the named header, or null.
     */
    public String getHeader(String name) {
        for (Header header : headers) {
            if (name.equalsIgnoreCase(header.getName())) {
                return header.getValue();
            }
        }
        return null;
    }

    /**
     * Returns the resolved redirect target, or null if this is not a
     * redirect (or is 304 Not Modified).
     */
    public String getLocation() {
        return getHeader("Location");
    }

    public String getBody() {
        return body;
    }

    /**
     * Returns a signal carrying this outcome, to be thrown.
     */
    public OutcomeSignal signal() {
        return new OutcomeSignal(this);
    }

    @Override
    public String toString() {
        return getStatusLine();
    }

}
