/**
 * Request and response handling between a gateway and application code.
 *
 * <p>A gateway supplies each request as an
 * {@link org.bluezoo.portico.Environment}: CGI-style metadata such as
 * {@code REQUEST_METHOD} and {@code QUERY_STRING}, plus the body stream.
 * Application code receives a {@link org.bluezoo.portico.Context} built
 * from it, through which it reads validated form values and cookies and
 * builds the response status and headers.
 *
 * <p>Responses are decided by {@link org.bluezoo.portico.HTTPOutcome}s,
 * built by {@link org.bluezoo.portico.HTTPOutcomes}. A handler returns an
 * outcome, or throws its {@link org.bluezoo.portico.OutcomeSignal} to end
 * the request from further down the call chain.
 * {@link org.bluezoo.portico.RequestScope} turns either into the
 * {@link org.bluezoo.portico.GatewayResponse} the gateway writes.
 *
 * <pre>
 * GatewayResponse response = RequestScope.handle(env, applications, ctx -&gt; {
 *     Storage i = ctx.input("name");
 *     if (i.getString("name").isEmpty()) {
 *         return HTTPOutcomes.seeOther(ctx, "form");
 *     }
 *     ctx.setCookie("name", i.getString("name"));
 *     return HTTPOutcomes.ok(ctx, "Hello " + i.getString("name"));
 * });
 * </pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
package org.bluezoo.portico;
