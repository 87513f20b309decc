/**
 * HTTP response primitives: the statuses an application can signal and
 * the ordered outbound header sequence.
 *
 * <p>All headers are added through
 * {@link org.bluezoo.portico.http.HeaderGuard}, which rejects any name or
 * value containing CR or LF.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
package org.bluezoo.portico.http;
