/*
 * RequestScope.java
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

import org.bluezoo.portico.http.Headers;
import org.bluezoo.portico.http.InvalidHeaderException;
import org.bluezoo.portico.util.Config;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.text.MessageFormat;
import java.util.Deque;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a handler for one request, in a fresh {@link Context}.
 * <p>
 * The outcome the handler returns, or signals, becomes the response. Any
 * other failure is logged and answered with 500 Internal Server Error,
 * except an {@link InvalidHeaderException}, which is propagated to the
 * gateway. Whatever happens, the context is released before this returns.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class RequestScope {

    private static final Logger LOGGER = Logger.getLogger(RequestScope.class.getName());

    private RequestScope() {
        // Static utility class
    }

    /**
     * Handles a request.
     * @param env the gateway environment of the request
     * @param applications the nested application stack, innermost last
     * @param handler the application code
     * @return the response to write
     * @exception InvalidHeaderException if the handler tried to queue a
     * header containing CR or LF and did not handle the failure itself
     */
    public static GatewayResponse handle(Environment env, Deque<Application> applications, Handler handler) {
        return handle(new Context(env, applications), handler);
    }

    /**
     * Handles a request in the given context, releasing it afterwards.
     */
    public static GatewayResponse handle(Context ctx, Handler handler) {
        try {
            HTTPOutcome outcome;
            try {
                outcome = handler.handle(ctx);
            } catch (OutcomeSignal signal) {
                outcome = signal.getOutcome();
            } catch (InvalidHeaderException e) {
                throw e;
            } catch (Exception e) {
                String message = MessageFormat.format(Context.L10N.getString("log.internal_error"),
                        ctx.getMethod(), ctx.getFullPath());
                LOGGER.log(Level.SEVERE, message, e);
                outcome = internalError(ctx, e);
            }
            String body = (outcome == null) ? "" : outcome.getBody();
            return new GatewayResponse(ctx.getStatus(), new Headers(ctx.getHeaders()),
                    body.getBytes(StandardCharsets.UTF_8));
        } finally {
            ctx.release();
        }
    }

    private static HTTPOutcome internalError(Context ctx, Exception e) {
        // Discard the partial response
        ctx.getHeaders().clear();
        if (Config.isDebug()) {
            StringWriter trace = new StringWriter();
            e.printStackTrace(new PrintWriter(trace));
            return HTTPOutcomes.internalError(ctx, trace.toString());
        }
        return HTTPOutcomes.internalError(ctx);
    }

}
