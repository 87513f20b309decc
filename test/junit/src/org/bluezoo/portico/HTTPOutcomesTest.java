/*
 * HTTPOutcomesTest.java
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
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link HTTPOutcomes}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class HTTPOutcomesTest {

    private Deque<Application> applications;
    private Context ctx;

    @Before
    public void setUp() {
        Map<String, Object> env = new LinkedHashMap<>();
        env.put(Environment.REQUEST_METHOD, "GET");
        env.put(Environment.HTTP_HOST, "example.com");
        env.put(Environment.SCRIPT_NAME, "/app");
        env.put(Environment.PATH_INFO, "/x");
        applications = new ArrayDeque<>();
        ctx = new Context(new Environment(env), applications);
    }

    // ===== Success =====

    @Test
    public void testOk() {
        HTTPOutcome outcome = HTTPOutcomes.ok(ctx, "hello");

        assertEquals(HTTPStatus.Kind.SUCCESS, outcome.getKind());
        assertEquals("200 OK", outcome.getStatusLine());
        assertEquals("hello", outcome.getBody());
        assertTrue(outcome.getHeaders().isEmpty());
        assertEquals("200 OK", ctx.getStatus());
    }

    @Test
    public void testSuccessDefaults() {
        assertEquals("Created", HTTPOutcomes.created(ctx).getBody());
        assertEquals("Accepted", HTTPOutcomes.accepted(ctx).getBody());
        assertEquals("No Content", HTTPOutcomes.noContent(ctx).getBody());
        assertEquals("204 No Content", ctx.getStatus());
    }

    // ===== Redirects =====

    @Test
    public void testRedirectRelative() {
        HTTPOutcome outcome = HTTPOutcomes.redirect(ctx, "y");

        assertEquals("301 Moved Permanently", outcome.getStatusLine());
        assertEquals("http://example.com/app/y", outcome.getLocation());
        assertEquals("text/html", outcome.getHeader("Content-Type"));
        assertEquals("", outcome.getBody());
        assertEquals("301 Moved Permanently", ctx.getStatus());
        assertEquals("http://example.com/app/y", ctx.getHeaders().getValue("Location"));
    }

    @Test
    public void testRedirectAbsolute() {
        assertEquals("http://example.com/z", HTTPOutcomes.seeOther(ctx, "/z", true).getLocation());
        assertEquals("http://example.com/app/z", HTTPOutcomes.seeOther(ctx, "/z").getLocation());
    }

    @Test
    public void testRedirectQueryAndFragment() {
        assertEquals("http://example.com/app/x?page=2", HTTPOutcomes.found(ctx, "?page=2").getLocation());
        assertEquals("http://example.com/app/x#top", HTTPOutcomes.found(ctx, "#top").getLocation());
    }

    @Test
    public void testRedirectAboveRoot() {
        assertEquals("http://example.com/app/a", HTTPOutcomes.redirect(ctx, "../../a").getLocation());
    }

    @Test
    public void testRedirectFullUrl() {
        HTTPOutcome outcome = HTTPOutcomes.tempRedirect(ctx, "https://other.example/path");

        assertEquals("307 Temporary Redirect", outcome.getStatusLine());
        assertEquals("https://other.example/path", outcome.getLocation());
    }

    @Test
    public void testResolve() {
        assertEquals("/a/c", HTTPOutcomes.resolve("/a/b", "c"));
        assertEquals("/c", HTTPOutcomes.resolve("/a/b", "../c"));
        assertEquals("/a/b", HTTPOutcomes.resolve("/a/b", ""));
        assertEquals("/a/b?q", HTTPOutcomes.resolve("/a/b?old", "?q"));
        assertEquals("Excess parent segments dropped", "/a", HTTPOutcomes.resolve("/x", "../../a"));
        assertEquals("/c", HTTPOutcomes.resolve("/a/b", "../../../c"));
        assertEquals("/a/", HTTPOutcomes.resolve("/a/b/c", ".."));
        assertEquals("/a/d?q=1", HTTPOutcomes.resolve("/a/b/c", "../d?q=1"));
        assertEquals("http://h/y", HTTPOutcomes.resolve("/a", "http://h/x/../../y"));
        assertEquals("Invalid reference joined literally", "/a/b c", HTTPOutcomes.resolve("/a/b", "b c"));
    }

    @Test
    public void testNotModified() {
        HTTPOutcome outcome = HTTPOutcomes.notModified(ctx);

        assertEquals("304 Not Modified", outcome.getStatusLine());
        assertTrue(outcome.getHeaders().isEmpty());
        assertNull(outcome.getLocation());
        assertTrue(ctx.getHeaders().isEmpty());
    }

    // ===== Errors =====

    @Test
    public void testErrorDefaults() {
        HTTPOutcome outcome = HTTPOutcomes.forbidden(ctx);

        assertEquals("403 Forbidden", outcome.getStatusLine());
        assertEquals("forbidden", outcome.getBody());
        assertEquals("text/html", outcome.getHeader("Content-Type"));
        assertEquals(HTTPStatus.Kind.ERROR, outcome.getKind());
    }

    @Test
    public void testErrorMessage() {
        assertEquals("no such user", HTTPOutcomes.badRequest(ctx, "no such user").getBody());
        assertEquals("Empty message means default", "gone", HTTPOutcomes.gone(ctx, "").getBody());
    }

    @Test
    public void testNotFoundContentType() {
        assertEquals("text/html; charset=utf-8", HTTPOutcomes.notFound(ctx).getHeader("Content-Type"));
    }

    @Test
    public void testNoMethod() {
        HTTPOutcome outcome = HTTPOutcomes.noMethod(ctx, new HashSet<>(Arrays.asList("GET", "POST", "OPTIONS")));

        assertEquals("405 Method Not Allowed", outcome.getStatusLine());
        assertEquals("GET, POST", outcome.getHeader("Allow"));
        assertEquals("method not allowed", outcome.getBody());
        assertEquals("GET, HEAD, POST, PUT, DELETE", HTTPOutcomes.noMethod(ctx, null).getHeader("Allow"));
    }

    @Test
    public void testDelegation() {
        applications.add(new Application() {});
        applications.add(new Application() {
            @Override
            public HTTPOutcome notFound(Context c) {
                return HTTPOutcomes.error(c, HTTPStatus.NOT_FOUND, "custom not found");
            }

            @Override
            public HTTPOutcome internalError(Context c) {
                return HTTPOutcomes.error(c, HTTPStatus.INTERNAL_SERVER_ERROR, "custom failure");
            }
        });

        assertEquals("Innermost application used", "custom not found", HTTPOutcomes.notFound(ctx).getBody());
        assertEquals("custom failure", HTTPOutcomes.internalError(ctx).getBody());
        assertEquals("unavailable for legal reasons", HTTPOutcomes.unavailableForLegalReasons(ctx).getBody());
        assertEquals("Explicit message bypasses delegation", "missing",
                HTTPOutcomes.notFound(ctx, "missing").getBody());
    }

    @Test
    public void testNoDelegationWithoutApplications() {
        assertEquals("not found", HTTPOutcomes.notFound(ctx).getBody());
        assertEquals("internal server error", HTTPOutcomes.internalError(ctx).getBody());
    }

    // ===== Table =====

    @Test
    public void testOf() {
        assertEquals("409 Conflict", HTTPOutcomes.of(ctx, 409, null).getStatusLine());
        assertEquals("teapot", HTTPOutcomes.of(ctx, 412, "teapot").getBody());
        assertEquals("http://example.com/app/done", HTTPOutcomes.of(ctx, 303, "done").getLocation());
        assertEquals("body", HTTPOutcomes.of(ctx, 200, "body").getBody());
        assertEquals("GET, HEAD, POST, PUT, DELETE", HTTPOutcomes.of(ctx, 405, null).getHeader("Allow"));
        assertNull(HTTPOutcomes.of(ctx, 304, null).getLocation());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testOfUnknownCode() {
        HTTPOutcomes.of(ctx, 418, null);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testWrongKind() {
        HTTPOutcomes.success(ctx, HTTPStatus.NOT_FOUND, "x");
    }

    @Test
    public void testSignal() {
        HTTPOutcome outcome = HTTPOutcomes.gone(ctx);
        OutcomeSignal signal = outcome.signal();

        assertSame(outcome, signal.getOutcome());
        assertEquals(0, signal.getStackTrace().length);
    }

}
