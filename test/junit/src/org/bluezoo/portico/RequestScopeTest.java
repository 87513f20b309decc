/*
 * RequestScopeTest.java
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

import org.bluezoo.portico.form.FileUpload;
import org.bluezoo.portico.form.FormDecoder;
import org.bluezoo.portico.form.MultipartConfig;
import org.bluezoo.portico.http.HTTPStatus;
import org.bluezoo.portico.http.InvalidHeaderException;
import org.bluezoo.portico.util.Config;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link RequestScope}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class RequestScopeTest {

    private static final String BOUNDARY = "AaB03x";
    private static final String CRLF = "\r\n";

    private File tempDir;
    private Map<String, Object> env;

    @Before
    public void setUp() throws IOException {
        tempDir = File.createTempFile("scope_test_", "");
        tempDir.delete();
        tempDir.mkdirs();
        env = new LinkedHashMap<>();
        env.put(Environment.REQUEST_METHOD, "GET");
        env.put(Environment.HTTP_HOST, "example.com");
    }

    @After
    public void tearDown() {
        System.clearProperty(Config.DEBUG);
        File[] files = tempDir.listFiles();
        if (files != null) {
            for (File file : files) {
                file.delete();
            }
        }
        tempDir.delete();
    }

    private Context context() {
        FormDecoder decoder = new FormDecoder(new MultipartConfig(tempDir.getAbsolutePath(), 16, -1L, -1L),
                StandardCharsets.UTF_8);
        return new Context(new Environment(env), new ArrayDeque<Application>(), decoder);
    }

    @Test
    public void testReturnedOutcome() {
        GatewayResponse response = RequestScope.handle(context(), new Handler() {
            @Override
            public HTTPOutcome handle(Context ctx) {
                ctx.header("X-Trace", "1");
                return HTTPOutcomes.created(ctx, "made");
            }
        });

        assertEquals("201 Created", response.getStatus());
        assertEquals(201, response.getStatusCode());
        assertEquals("1", response.getHeader("X-Trace"));
        assertArrayEquals("made".getBytes(StandardCharsets.UTF_8), response.getBody());
    }

    @Test
    public void testSignalledOutcome() {
        GatewayResponse response = RequestScope.handle(context(), new Handler() {
            @Override
            public HTTPOutcome handle(Context ctx) {
                throw HTTPOutcomes.seeOther(ctx, "/login").signal();
            }
        });

        assertEquals("303 See Other", response.getStatus());
        assertEquals("http://example.com/login", response.getHeader("Location"));
        assertEquals(0, response.getBody().length);
    }

    @Test
    public void testMissingInputIsBadRequest() {
        GatewayResponse response = RequestScope.handle(context(), new Handler() {
            @Override
            public HTTPOutcome handle(Context ctx) {
                ctx.input("name");
                return HTTPOutcomes.ok(ctx);
            }
        });

        assertEquals(400, response.getStatusCode());
        assertEquals("bad request", new String(response.getBody(), StandardCharsets.UTF_8));
    }

    @Test
    public void testNullOutcome() {
        GatewayResponse response = RequestScope.handle(context(), new Handler() {
            @Override
            public HTTPOutcome handle(Context ctx) {
                return null;
            }
        });

        assertEquals("200 OK", response.getStatus());
        assertEquals(0, response.getBody().length);
    }

    @Test
    public void testFailureIsInternalError() {
        GatewayResponse response = RequestScope.handle(context(), new Handler() {
            @Override
            public HTTPOutcome handle(Context ctx) throws Exception {
                ctx.header("X-Partial", "1");
                throw new IOException("disk on fire");
            }
        });

        assertEquals("500 Internal Server Error", response.getStatus());
        assertNull("Partial headers discarded", response.getHeader("X-Partial"));
        assertEquals("internal server error", new String(response.getBody(), StandardCharsets.UTF_8));
    }

    @Test
    public void testFailureDelegatesToApplication() {
        ArrayDeque<Application> applications = new ArrayDeque<>();
        applications.add(new Application() {
            @Override
            public HTTPOutcome internalError(Context ctx) {
                return HTTPOutcomes.error(ctx, HTTPStatus.INTERNAL_SERVER_ERROR, "oops");
            }
        });
        GatewayResponse response = RequestScope.handle(new Environment(env), applications, new Handler() {
            @Override
            public HTTPOutcome handle(Context ctx) {
                throw new IllegalStateException("bug");
            }
        });

        assertEquals("oops", new String(response.getBody(), StandardCharsets.UTF_8));
    }

    @Test
    public void testDebugFailureShowsTrace() {
        System.setProperty(Config.DEBUG, "true");
        GatewayResponse response = RequestScope.handle(context(), new Handler() {
            @Override
            public HTTPOutcome handle(Context ctx) {
                throw new IllegalStateException("traceable");
            }
        });

        String body = new String(response.getBody(), StandardCharsets.UTF_8);
        assertEquals(500, response.getStatusCode());
        assertTrue(body, body.contains("IllegalStateException: traceable"));
    }

    @Test
    public void testInvalidHeaderPropagates() {
        try {
            RequestScope.handle(context(), new Handler() {
                @Override
                public HTTPOutcome handle(Context ctx) {
                    ctx.header("X-Evil", "a\r\nb");
                    return HTTPOutcomes.ok(ctx);
                }
            });
            fail("Expected InvalidHeaderException");
        } catch (InvalidHeaderException e) {
            assertNotNull(e.getMessage());
        }
    }

    @Test
    public void testUploadsReleasedOnEveryPath() throws Exception {
        final FileUpload[] seen = new FileUpload[1];
        Handler handler = new Handler() {
            @Override
            public HTTPOutcome handle(Context ctx) {
                seen[0] = ctx.input(FieldSpec.create().defaultFile("doc")).getFile("doc");
                assertEquals("Upload spooled to disk", 1, tempDir.list().length);
                throw new IllegalStateException("after upload");
            }
        };
        byte[] body = multipartUpload();
        env.put(Environment.REQUEST_METHOD, "POST");
        env.put(Environment.CONTENT_TYPE, "multipart/form-data; boundary=" + BOUNDARY);
        env.put(Environment.CONTENT_LENGTH, String.valueOf(body.length));
        env.put(Environment.INPUT, new ByteArrayInputStream(body));

        GatewayResponse response = RequestScope.handle(context(), handler);

        assertEquals(500, response.getStatusCode());
        assertNotNull(seen[0]);
        assertEquals("Temporary files removed", 0, tempDir.list().length);
    }

    private static byte[] multipartUpload() {
        char[] content = new char[200];
        Arrays.fill(content, 'z');
        String body = "--" + BOUNDARY + CRLF
            + "Content-Disposition: form-data; name=\"doc\"; filename=\"z.txt\"" + CRLF + CRLF
            + new String(content) + CRLF
            + "--" + BOUNDARY + "--" + CRLF;
        return body.getBytes(StandardCharsets.US_ASCII);
    }

}
