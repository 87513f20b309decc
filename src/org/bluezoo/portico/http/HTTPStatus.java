/*
 * HTTPStatus.java
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

package org.bluezoo.portico.http;

import java.util.HashMap;
import java.util.Map;

/**
 * Symbolic enumeration of the HTTP statuses an application can signal.
 *
 * <p>Each constant carries everything needed to build its outcome: the
 * reason phrase for the status line, the family it belongs to, the
 * default message body, the default Content-Type and whether, in the
 * absence of an explicit message, the innermost nested application gets
 * to produce the outcome itself.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum HTTPStatus {

    // ─────────────────────────────────────────────────────────────────────────
    // Success (2xx)
    // ─────────────────────────────────────────────────────────────────────────

    /** 200 OK */
    OK(200, "OK", Kind.SUCCESS, "", null),

    /** 201 Created */
    CREATED(201, "Created", Kind.SUCCESS, "Created", null),

    /** 202 Accepted */
    ACCEPTED(202, "Accepted", Kind.SUCCESS, "Accepted", null),

    /** 204 No Content */
    NO_CONTENT(204, "No Content", Kind.SUCCESS, "No Content", null),

    // ─────────────────────────────────────────────────────────────────────────
    // Redirection (3xx)
    // ─────────────────────────────────────────────────────────────────────────

    /** 301 Moved Permanently */
    MOVED_PERMANENTLY(301, "Moved Permanently", Kind.REDIRECT, "", "text/html"),

    /** 302 Found */
    FOUND(302, "Found", Kind.REDIRECT, "", "text/html"),

    /** 303 See Other */
    SEE_OTHER(303, "See Other", Kind.REDIRECT, "", "text/html"),

    /** 304 Not Modified: no Location, no body */
    NOT_MODIFIED(304, "Not Modified", Kind.REDIRECT, "", null),

    /** 307 Temporary Redirect */
    TEMPORARY_REDIRECT(307, "Temporary Redirect", Kind.REDIRECT, "", "text/html"),

    // ─────────────────────────────────────────────────────────────────────────
    // Client Errors (4xx)
    // ─────────────────────────────────────────────────────────────────────────

    /** 400 Bad Request */
    BAD_REQUEST(400, "Bad Request", Kind.ERROR, "bad request", "text/html"),

    /** 401 Unauthorized */
    UNAUTHORIZED(401, "Unauthorized", Kind.ERROR, "unauthorized", "text/html"),

    /** 403 Forbidden */
    FORBIDDEN(403, "Forbidden", Kind.ERROR, "forbidden", "text/html"),

    /** 404 Not Found */
    NOT_FOUND(404, "Not Found", Kind.ERROR, "not found", "text/html; charset=utf-8", true),

    /** 405 Method Not Allowed */
    METHOD_NOT_ALLOWED(405, "Method Not Allowed", Kind.ERROR, "method not allowed", "text/html"),

    /** 406 Not Acceptable */
    NOT_ACCEPTABLE(406, "Not Acceptable", Kind.ERROR, "not acceptable", "text/html"),

    /** 409 Conflict */
    CONFLICT(409, "Conflict", Kind.ERROR, "conflict", "text/html"),

    /** 410 Gone */
    GONE(410, "Gone", Kind.ERROR, "gone", "text/html"),

    /** 412 Precondition Failed */
    PRECONDITION_FAILED(412, "Precondition Failed", Kind.ERROR, "precondition failed", "text/html"),

    /** 415 Unsupported Media Type */
    UNSUPPORTED_MEDIA_TYPE(415, "Unsupported Media Type", Kind.ERROR, "unsupported media type", "text/html"),

    /** 451 Unavailable For Legal Reasons */
    UNAVAILABLE_FOR_LEGAL_REASONS(451, "Unavailable For Legal Reasons", Kind.ERROR,
            "unavailable for legal reasons", "text/html", true),

    // ─────────────────────────────────────────────────────────────────────────
    // Server Errors (5xx)
    // ─────────────────────────────────────────────────────────────────────────

    /** 500 Internal Server Error */
    INTERNAL_SERVER_ERROR(500, "Internal Server Error", Kind.ERROR, "internal server error", "text/html", true);

    /**
     * The family of an outcome.
     */
    public enum Kind {
        /** 2xx: carries only a body */
        SUCCESS,
        /** 3xx: carries a resolved Location (except 304) */
        REDIRECT,
        /** 4xx and 5xx: carries a default or caller-supplied message */
        ERROR;
    }

    private static final Map<Integer, HTTPStatus> BY_CODE = new HashMap<Integer, HTTPStatus>();
    static {
        for (HTTPStatus status : values()) {
            BY_CODE.put(status.code, status);
        }
    }

    /**
     * The numeric HTTP status code.
     */
    public final int code;

    private final String reasonPhrase;
    private final Kind kind;
    private final String defaultMessage;
    private final String contentType;
    private final boolean delegating;

    HTTPStatus(int code, String reasonPhrase, Kind kind, String defaultMessage, String contentType) {
        this(code, reasonPhrase, kind, defaultMessage, contentType, false);
    }

    HTTPStatus(int code, String reasonPhrase, Kind kind, String defaultMessage, String contentType,
            boolean delegating) {
        this.code = code;
        this.reasonPhrase = reasonPhrase;
        this.kind = kind;
        this.defaultMessage = defaultMessage;
        this.contentType = contentType;
        this.delegating = delegating;
    }

    public String getReasonPhrase() {
        return reasonPhrase;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Returns the body used when the caller supplies no message.
     *
     * @return the default message, possibly empty
     */
    public String getDefaultMessage() {
        return defaultMessage;
    }

    /**
     * Returns the Content-Type header value queued with this status.
     *
     * @return the content type, or null if no Content-Type is queued
     */
    public String getContentType() {
        return contentType;
    }

    /**
     * Indicates whether an outcome with this status and no explicit
     * message is produced by the innermost nested application when there
     * is one.
     *
     * @return true for 404, 451 and 500
     */
    public boolean isDelegating() {
        return delegating;
    }

    /**
     * Returns the status line, e.g. "404 Not Found".
     *
     * @return the status line
     */
    public String getStatusLine() {
        return code + " " + reasonPhrase;
    }

    @Override
    public String toString() {
        return getStatusLine();
    }

    /**
     * Returns the HTTPStatus for the given numeric status code.
     *
     * @param statusCode the numeric HTTP status code
     * @return the corresponding HTTPStatus, or null if it is not one portico
     * can signal
     */
    public static HTTPStatus fromCode(int statusCode) {
        return BY_CODE.get(statusCode);
    }

}
