/**
 * Cookie encoding and decoding.
 *
 * <p>{@link org.bluezoo.portico.cookie.CookieCodec} produces Set-Cookie
 * header values, using {@link javax.servlet.http.Cookie} to validate the
 * cookie name and hold its attributes, and parses the Cookie request
 * header leniently: malformed input yields the cookies that could be
 * recovered rather than an error.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
package org.bluezoo.portico.cookie;
