/*
 * HTTPOutcomes.java
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
import org.bluezoo.portico.http.HeaderGuard;
import org.bluezoo.portico.http.Headers;

import java.net.URI;
import java.net.URISyntaxException;
import java.text.MessageFormat;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds {@link HTTPOutcome}s.
 * <p>
 * Building an outcome sets the status line of the context and queues the
 * outcome's headers on it, so the outcome only has to reach the
 * dispatcher for the response to be complete.
 * <p>
 * Success outcomes carry a body and no headers. Redirects carry
 * {@code Content-Type: text/html} and a fully qualified {@code Location}
 * and an empty body; 304 Not Modified carries neither. Errors carry a
 * {@code Content-Type} and the caller's message or the default message of
 * the status.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class HTTPOutcomes {

    private static final Logger LOGGER = Logger.getLogger(HTTPOutcomes.class.getName());

    /**
     * Methods advertised in the Allow header of 405 Method Not Allowed.
     */
    static final List<String> ALLOW_CANDIDATES = Collections.unmodifiableList(Arrays.asList(
        "GET", "HEAD", "POST", "PUT", "DELETE"
    ));

    private HTTPOutcomes() {
        // Static utility class
    }

    // -- 2xx --

    public static HTTPOutcome ok(Context ctx) {
        return success(ctx, HTTPStatus.OK, null);
    }

    public static HTTPOutcome ok(Context ctx, String body) {
        return success(ctx, HTTPStatus.OK, body);
    }

    public static HTTPOutcome created(Context ctx) {
        return success(ctx, HTTPStatus.CREATED, null);
    }

    public static HTTPOutcome created(Context ctx, String body) {
        return success(ctx, HTTPStatus.CREATED, body);
    }

    public static HTTPOutcome accepted(Context ctx) {
        return success(ctx, HTTPStatus.ACCEPTED, null);
    }

    public static HTTPOutcome accepted(Context ctx, String body) {
        return success(ctx, HTTPStatus.ACCEPTED, body);
    }

    public static HTTPOutcome noContent(Context ctx) {
        return success(ctx, HTTPStatus.NO_CONTENT, null);
    }

    public static HTTPOutcome noContent(Context ctx, String body) {
        return success(ctx, HTTPStatus.NO_CONTENT, body);
    }

    /**
     * Builds a success outcome.
     * @param body the body, or null for the default message of the status
     */
    public static HTTPOutcome success(Context ctx, HTTPStatus status, String body) {
        checkKind(status, HTTPStatus.Kind.SUCCESS);
        return build(ctx, status, new Headers(), (body == null) ? status.getDefaultMessage() : body);
    }

    // -- 3xx --

    /**
     * 301 Moved Permanently to a URL relative to the current request path.
     */
    public static HTTPOutcome redirect(Context ctx, String url) {
        return redirect(ctx, HTTPStatus.MOVED_PERMANENTLY, url, false);
    }

    /**
     * 301 Moved Permanently.
     * @param absolute whether a site-relative target is qualified with the
     * site root rather than the application's home
     */
    public static HTTPOutcome redirect(Context ctx, String url, boolean absolute) {
        return redirect(ctx, HTTPStatus.MOVED_PERMANENTLY, url, absolute);
    }

    public static HTTPOutcome found(Context ctx, String url) {
        return redirect(ctx, HTTPStatus.FOUND, url, false);
    }

    public static HTTPOutcome found(Context ctx, String url, boolean absolute) {
        return redirect(ctx, HTTPStatus.FOUND, url, absolute);
    }

    public static HTTPOutcome seeOther(Context ctx, String url) {
        return redirect(ctx, HTTPStatus.SEE_OTHER, url, false);
    }

    public static HTTPOutcome seeOther(Context ctx, String url, boolean absolute) {
        return redirect(ctx, HTTPStatus.SEE_OTHER, url, absolute);
    }

    public static HTTPOutcome tempRedirect(Context ctx, String url) {
        return redirect(ctx, HTTPStatus.TEMPORARY_REDIRECT, url, false);
    }

    public static HTTPOutcome tempRedirect(Context ctx, String url, boolean absolute) {
        return redirect(ctx, HTTPStatus.TEMPORARY_REDIRECT, url, absolute);
    }

    /**
     * 304 Not Modified: no Location, no body.
     */
    public static HTTPOutcome notModified(Context ctx) {
        return build(ctx, HTTPStatus.NOT_MODIFIED, new Headers(), "");
    }

    /**
     * Builds a redirect.
     * <p>
     * The target is resolved against the current request path. If the
     * result is site-relative (starts with "/") it is prefixed with the
     * application's home, or with the site root if {@code absolute}.
     *
     * @param status the redirect status
     * @param url the target
     * @param absolute whether to resolve against the site root
     */
    public static HTTPOutcome redirect(Context ctx, HTTPStatus status, String url, boolean absolute) {
        checkKind(status, HTTPStatus.Kind.REDIRECT);
        if (status == HTTPStatus.NOT_MODIFIED) {
            return notModified(ctx);
        }
        String location = resolve(ctx.getPath(), url);
        if (location.startsWith("/")) {
            location = (absolute ? ctx.getRealHome() : ctx.getHome()) + location;
        }
        Headers headers = new Headers();
        HeaderGuard.emit(headers, "Content-Type", status.getContentType());
        HeaderGuard.emit(headers, "Location", location);
        return build(ctx, status, headers, "");
    }

    /**
     * Resolves a URL reference against a base path, as a browser would.
     */
    static String resolve(String base, String url) {
        if (url == null) {
            url = "";
        }
        if (base == null || base.isEmpty()) {
            base = "/";
        }
        if (url.isEmpty()) {
            return base;
        }
        // java.net.URI follows RFC 2396 here, which drops the last segment
        if (url.charAt(0) == '?') {
            return truncate(base, "?#") + url;
        } else if (url.charAt(0) == '#') {
            return truncate(base, "#") + url;
        }
        try {
            URI resolved = new URI(base).resolve(new URI(url));
            String resolvedPath = resolved.getRawPath();
            if (resolvedPath == null || !resolvedPath.startsWith("/")) {
                return resolved.toString();
            }
            StringBuilder buf = new StringBuilder();
            if (resolved.getScheme() != null) {
                buf.append(resolved.getScheme()).append(':');
            }
            if (resolved.getRawAuthority() != null) {
                buf.append("//").append(resolved.getRawAuthority());
            }
            return buf.append(removeDotSegments(resolvedPath))
                    .append((resolved.getRawQuery() == null) ? "" : "?" + resolved.getRawQuery())
                    .append((resolved.getRawFragment() == null) ? "" : "#" + resolved.getRawFragment())
                    .toString();
        } catch (URISyntaxException | IllegalArgumentException e) {
            // Not a valid URI reference, e.g. unescaped spaces: join literally
            if (LOGGER.isLoggable(Level.FINEST)) {
                LOGGER.log(Level.FINEST, e.getMessage(), e);
            }
            if (url.startsWith("/") || url.indexOf(':') > 0) {
                return url;
            }
            int si = base.lastIndexOf('/');
            return base.substring(0, si + 1) + url;
        }
    }

    /**
     * Removes "." and ".." segments from an absolute path (RFC 3986 section
     * 5.2.4). A ".." at the root is dropped.
     */
    static String removeDotSegments(String path) {
        Deque<String> segments = new ArrayDeque<>();
        String[] parts = path.substring(1).split("/", -1);
        for (int i = 0; i < parts.length; i++) {
            String part = parts[i];
            boolean last = (i == parts.length - 1);
            if (".".equals(part)) {
                if (last) {
                    segments.addLast("");
                }
            } else if ("..".equals(part)) {
                segments.pollLast();
                if (last) {
                    segments.addLast("");
                }
            } else {
                segments.addLast(part);
            }
        }
        return "/" + String.join("/", segments);
    }

    private static String truncate(String s, String delimiters) {
        for (int i = 0; i < s.length(); i++) {
            if (delimiters.indexOf(s.charAt(i)) >= 0) {
                return s.substring(0, i);
            }
        }
        return s;
    }

    // -- 4xx, 5xx --

    public static HTTPOutcome badRequest(Context ctx) {
        return error(ctx, HTTPStatus.BAD_REQUEST, null);
    }

    public static HTTPOutcome badRequest(Context ctx, String message) {
        return error(ctx, HTTPStatus.BAD_REQUEST, message);
    }

    public static HTTPOutcome unauthorized(Context ctx) {
        return error(ctx, HTTPStatus.UNAUTHORIZED, null);
    }

    public static HTTPOutcome unauthorized(Context ctx, String message) {
        return error(ctx, HTTPStatus.UNAUTHORIZED, message);
    }

    public static HTTPOutcome forbidden(Context ctx) {
        return error(ctx, HTTPStatus.FORBIDDEN, null);
    }

    public static HTTPOutcome forbidden(Context ctx, String message) {
        return error(ctx, HTTPStatus.FORBIDDEN, message);
    }

    /**
     * 404 Not Found, produced by the innermost nested application if there
     * is one.
     */
    public static HTTPOutcome notFound(Context ctx) {
        return delegate(ctx, HTTPStatus.NOT_FOUND, null);
    }

    public static HTTPOutcome notFound(Context ctx, String message) {
        return delegate(ctx, HTTPStatus.NOT_FOUND, message);
    }

    /**
     * 405 Method Not Allowed.
     * @param exposed the methods the target handler implements, or null if
     * it is not known; the Allow header lists those among GET, HEAD, POST,
     * PUT and DELETE
     */
    public static HTTPOutcome noMethod(Context ctx, Set<String> exposed) {
        HTTPStatus status = HTTPStatus.METHOD_NOT_ALLOWED;
        List<String> allowed = new ArrayList<>();
        for (String method : ALLOW_CANDIDATES) {
            if (exposed == null || exposed.contains(method)) {
                allowed.add(method);
            }
        }
        Headers headers = new Headers();
        HeaderGuard.emit(headers, "Content-Type", status.getContentType());
        HeaderGuard.emit(headers, "Allow", String.join(", ", allowed));
        return build(ctx, status, headers, status.getDefaultMessage());
    }

    public static HTTPOutcome notAcceptable(Context ctx) {
        return error(ctx, HTTPStatus.NOT_ACCEPTABLE, null);
    }

    public static HTTPOutcome notAcceptable(Context ctx, String message) {
        return error(ctx, HTTPStatus.NOT_ACCEPTABLE, message);
    }

    public static HTTPOutcome conflict(Context ctx) {
        return error(ctx, HTTPStatus.CONFLICT, null);
    }

    public static HTTPOutcome conflict(Context ctx, String message) {
        return error(ctx, HTTPStatus.CONFLICT, message);
    }

    public static HTTPOutcome gone(Context ctx) {
        return error(ctx, HTTPStatus.GONE, null);
    }

    public static HTTPOutcome gone(Context ctx, String message) {
        return error(ctx, HTTPStatus.GONE, message);
    }

    public static HTTPOutcome preconditionFailed(Context ctx) {
        return error(ctx, HTTPStatus.PRECONDITION_FAILED, null);
    }

    public static HTTPOutcome preconditionFailed(Context ctx, String message) {
        return error(ctx, HTTPStatus.PRECONDITION_FAILED, message);
    }

    public static HTTPOutcome unsupportedMediaType(Context ctx) {
        return error(ctx, HTTPStatus.UNSUPPORTED_MEDIA_TYPE, null);
    }

    public static HTTPOutcome unsupportedMediaType(Context ctx, String message) {
        return error(ctx, HTTPStatus.UNSUPPORTED_MEDIA_TYPE, message);
    }

    /**
     * 451 Unavailable For Legal Reasons, produced by the innermost nested
     * application if there is one.
     */
    public static HTTPOutcome unavailableForLegalReasons(Context ctx) {
        return delegate(ctx, HTTPStatus.UNAVAILABLE_FOR_LEGAL_REASONS, null);
    }

    public static HTTPOutcome unavailableForLegalReasons(Context ctx, String message) {
        return delegate(ctx, HTTPStatus.UNAVAILABLE_FOR_LEGAL_REASONS, message);
    }

    /**
     * 500 Internal Server Error, produced by the innermost nested
     * application if there is one.
     */
    public static HTTPOutcome internalError(Context ctx) {
        return delegate(ctx, HTTPStatus.INTERNAL_SERVER_ERROR, null);
    }

    public static HTTPOutcome internalError(Context ctx, String message) {
        return delegate(ctx, HTTPStatus.INTERNAL_SERVER_ERROR, message);
    }

    /**
     * Builds an error outcome without consulting the application stack.
     * This is what {@link Application}'s default methods return.
     * @param message the body, or null (or empty) for the default message
     */
    public static HTTPOutcome error(Context ctx, HTTPStatus status, String message) {
        checkKind(status, HTTPStatus.Kind.ERROR);
        if (status == HTTPStatus.METHOD_NOT_ALLOWED) {
            return noMethod(ctx, null);
        }
        Headers headers = new Headers();
        HeaderGuard.emit(headers, "Content-Type", status.getContentType());
        String body = (message == null || message.isEmpty()) ? status.getDefaultMessage() : message;
        return build(ctx, status, headers, body);
    }

    private static HTTPOutcome delegate(Context ctx, HTTPStatus status, String message) {
        if (message == null || message.isEmpty()) {
            Deque<Application> applications = ctx.getApplications();
            if (status.isDelegating() && !applications.isEmpty()) {
                Application app = applications.peekLast();
                switch (status) {
                    case NOT_FOUND:
                        return app.notFound(ctx);
                    case UNAVAILABLE_FOR_LEGAL_REASONS:
                        return app.unavailableForLegalReasons(ctx);
                    case INTERNAL_SERVER_ERROR:
                        return app.internalError(ctx);
                    default:
                        break;
                }
            }
        }
        return error(ctx, status, message);
    }

    // -- table --

    /**
     * Builds the outcome for a status code.
     * <p>
     * For redirects the message is the target URL. For errors it is the
     * body, null meaning the default message (or, for 404, 451 and 500,
     * the innermost application's outcome). For 405 it is ignored and all
     * candidate methods are allowed.
     *
     * @param code the status code
     * @param message the message or target, may be null
     * @exception IllegalArgumentException if there is no outcome for the code
     */
    public static HTTPOutcome of(Context ctx, int code, String message) {
        HTTPStatus status = HTTPStatus.fromCode(code);
        if (status == null) {
            String text = MessageFormat.format(Context.L10N.getString("err.unknown_status"), code);
            throw new IllegalArgumentException(text);
        }
        switch (status) {
            case OK:
            case CREATED:
            case ACCEPTED:
            case NO_CONTENT:
                return success(ctx, status, message);
            case NOT_MODIFIED:
                return notModified(ctx);
            case MOVED_PERMANENTLY:
            case FOUND:
            case SEE_OTHER:
            case TEMPORARY_REDIRECT:
                return redirect(ctx, status, message, false);
            case METHOD_NOT_ALLOWED:
                return noMethod(ctx, null);
            case NOT_FOUND:
            case UNAVAILABLE_FOR_LEGAL_REASONS:
            case INTERNAL_SERVER_ERROR:
                return delegate(ctx, status, message);
            default:
                return error(ctx, status, message);
        }
    }

    private static void checkKind(HTTPStatus status, HTTPStatus.Kind kind) {
        if (status.getKind() != kind) {
            String text = MessageFormat.format(Context.L10N.getString("err.wrong_kind"), status, kind);
            throw new IllegalArgumentException(text);
        }
    }

    private static HTTPOutcome build(Context ctx, HTTPStatus status, Headers headers, String body) {
        ctx.setStatus(status);
        for (Header header : headers) {
            ctx.header(header.getName(), header.getValue());
        }
        return new HTTPOutcome(status, headers, body);
    }

}
