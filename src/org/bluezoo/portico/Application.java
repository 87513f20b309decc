/*
 * Application.java
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

/**
 * A routing scope in the nested application stack.
 * <p>
 * When a handler signals 404, 451 or 500 without a message of its own,
 * the innermost application on the stack produces the outcome, so that
 * each application can supply its own error pages. The default methods
 * produce the built-in outcomes.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public interface Application {

    default HTTPOutcome notFound(Context ctx) {
        return HTTPOutcomes.error(ctx, HTTPStatus.NOT_FOUND, null);
    }

    default HTTPOutcome unavailableForLegalReasons(Context ctx) {
        return HTTPOutcomes.error(ctx, HTTPStatus.UNAVAILABLE_FOR_LEGAL_REASONS, null);
    }

    default HTTPOutcome internalError(Context ctx) {
        return HTTPOutcomes.error(ctx, HTTPStatus.INTERNAL_SERVER_ERROR, null);
    }

}
