/**
 * Structured header parsing for request bodies.
 *
 * <p>This package parses the Content-Type values found in the
 * {@code CONTENT_TYPE} gateway variable and the Content-Type and
 * Content-Disposition headers of multipart/form-data body parts.
 *
 * <ul>
 *   <li>{@link org.bluezoo.portico.mime.ContentTypeParser} - media type
 *       and parameters, including the multipart boundary and charset</li>
 *   <li>{@link org.bluezoo.portico.mime.ContentDispositionParser} - part
 *       name and submitted filename</li>
 * </ul>
 *
 * <p>RFC 2231 extended parameters are decoded; RFC 2047 encoded words are
 * not, since user agents do not send them in form-data.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
package org.bluezoo.portico.mime;
