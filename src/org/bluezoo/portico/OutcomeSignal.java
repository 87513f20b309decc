/*
 * OutcomeSignal.java
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
 * Carries an {@link HTTPOutcome} from deep inside application code up to
 * the dispatcher, which writes it to the client.
 * <p>
 * This is not an error: it is how a handler ends a request early, for
 * example with a redirect. It records no stack trace.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class OutcomeSignal extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient HTTPOutcome outcome;

    public OutcomeSignal(HTTPOutcome outcome) {
        super(outcome.getStatusLine(), null, false, false);
        this.outcome = outcome;
    }

    public HTTPOutcome getOutcome() {
        return outcome;
    }

}
