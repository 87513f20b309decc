/*
 * Context.java
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

import org.bluezoo.portico.cookie.CookieCodec;
import org.bluezoo.portico.form.DecodeException;
import org.bluezoo.portico.form.FieldValue;
import org.bluezoo.portico.form.FileUpload;
import org.bluezoo.portico.form.FormData;
import org.bluezoo.portico.form.FormDecoder;
import org.bluezoo.portico.form.URLEncodedParser;
import org.bluezoo.portico.http.HTTPStatus;
import org.bluezoo.portico.http.HeaderGuard;
import org.bluezoo.portico.http.Headers;
import org.bluezoo.portico.http.InvalidHeaderException;
import org.bluezoo.portico.util.StreamUtils;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.text.MessageFormat;
import java.text.Normalizer;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The state of one request: the gateway environment it arrived with and
 * the response being built for it.
 * <p>
 * A context is created for each request and used by one thread only. The
 * request body is read from the environment at most once, the first time
 * it is needed, and every consumer shares the bytes read. Decoded form
 * data and cookies are likewise decoded once and cached.
 * <p>
 * The context must be {@linkplain #release released} when the response is
 * complete, which deletes any temporary files holding uploads.
 * {@link RequestScope} does this on every exit path.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class Context {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.portico.L10N");
    private static final Logger LOGGER = Logger.getLogger(Context.class.getName());

    private static final String BOTH = "both";

    private final Environment env;
    private final Deque<Application> applications;
    private final FormDecoder formDecoder;

    private final String protocol;
    private final String host;
    private final String homeDomain;
    private final String realHome;
    private final String ip;
    private final String method;
    private final String path;
    private final String query;
    private String homePath;
    private String home;

    private String status = HTTPStatus.OK.getStatusLine();
    private final Headers headers = new Headers();

    // Lazily populated, see body(), getFormData() and getCookies()
    private byte[] body;
    private FormData formData;
    private Map<String, String> cookies;

    public Context(Environment env) {
        this(env, new ArrayDeque<Application>(), new FormDecoder());
    }

    public Context(Environment env, Deque<Application> applications) {
        this(env, applications, new FormDecoder());
    }

    /**
     * Constructor.
     * @param env the gateway environment
     * @param applications the nested application stack, innermost last;
     * consulted only to produce default error outcomes
     * @param formDecoder the decoder used for multipart bodies
     */
    public Context(Environment env, Deque<Application> applications, FormDecoder formDecoder) {
        this.env = env;
        this.applications = applications;
        this.formDecoder = formDecoder;

        String scheme = env.getString(Environment.URL_SCHEME);
        String https = env.getString(Environment.HTTPS, "").toLowerCase(Locale.ROOT);
        if ("http".equals(scheme) || "https".equals(scheme)) {
            protocol = scheme;
        } else if ("on".equals(https) || "true".equals(https) || "1".equals(https)) {
            protocol = "https";
        } else {
            protocol = "http";
        }
        host = env.getString(Environment.HTTP_HOST, "[unknown]");
        homeDomain = protocol + "://" + host;
        String scriptName = env.getString(Environment.REAL_SCRIPT_NAME);
        if (scriptName == null) {
            scriptName = env.getString(Environment.SCRIPT_NAME, "");
        }
        setHomePath(scriptName);
        realHome = homeDomain;
        ip = env.getString(Environment.REMOTE_ADDR);
        method = env.getString(Environment.REQUEST_METHOD, "GET");
        path = env.getString(Environment.PATH_INFO, "/");
        String queryString = env.getString(Environment.QUERY_STRING, "");
        query = queryString.isEmpty() ? "" : "?" + queryString;
    }

    public Environment getEnvironment() {
        return env;
    }

    /**
     * Returns the nested application stack, innermost last. The routing
     * layer pushes and pops applications as it descends.
     */
    public Deque<Application> getApplications() {
        return applications;
    }

    // -- Request metadata --

    /**
     * Returns "https" or "http".
     */
    public String getProtocol() {
        return protocol;
    }

    /**
     * Returns the requested host, or "[unknown]" if the client did not
     * send one.
     */
    public String getHost() {
        return host;
    }

    /**
     * Returns the scheme and host, e.g. "https://example.com".
     */
    public String getHomeDomain() {
        return homeDomain;
    }

    /**
     * Returns the path the application is mounted at, e.g. "/app", or an
     * empty string for the site root.
     */
    public String getHomePath() {
        return homePath;
    }

    /**
     * Changes the mount path, when dispatch descends into a sub-application.
     */
    public void setHomePath(String homePath) {
        this.homePath = (homePath == null) ? "" : homePath;
        this.home = homeDomain + this.homePath;
    }

    /**
     * Returns the base URL of the application, e.g.
     * "https://example.com/app".
     */
    public String getHome() {
        return home;
    }

    /**
     * Returns the base URL of the site, e.g. "https://example.com".
     */
    public String getRealHome() {
        return realHome;
    }

    public String getIp() {
        return ip;
    }

    public String getMethod() {
        return method;
    }

    /**
     * Returns the request path relative to the application's mount path.
     */
    public String getPath() {
        return path;
    }

    /**
     * Returns "?" followed by the query string, or an empty string if there
     * is no query.
     */
    public String getQuery() {
        return query;
    }

    public String getFullPath() {
        return path + query;
    }

    // -- Response --

    public String getStatus() {
        return status;
    }

    public void setStatus(HTTPStatus status) {
        this.status = status.getStatusLine();
    }

    /**
     * Sets the status line, e.g. "418 I'm a teapot".
     * @exception InvalidHeaderException if it contains CR or LF
     */
    public void setStatus(String status) {
        if (status.indexOf('\r') >= 0 || status.indexOf('\n') >= 0) {
            String message = MessageFormat.format(L10N.getString("err.invalid_status"),
                    status.replace("\r", "\\r").replace("\n", "\\n"));
            throw new InvalidHeaderException(message);
        }
        this.status = status;
    }

    /**
     * Returns the outbound headers queued so far, in order.
     */
    public Headers getHeaders() {
        return headers;
    }

    /**
     * Queues an outbound header.
     * @exception InvalidHeaderException if the name or value contains CR or LF
     */
    public void header(Object name, Object value) {
        HeaderGuard.emit(headers, name, value, false);
    }

    /**
     * Queues an outbound header, unless {@code unique} is set and a header
     * of that name is already queued.
     * @return true if the header was queued
     * @exception InvalidHeaderException if the name or value contains CR or LF
     */
    public boolean header(Object name, Object value, boolean unique) {
        return HeaderGuard.emit(headers, name, value, unique);
    }

    public void setCookie(String name, String value) {
        setCookie(name, value, "", null, false, false, null, null);
    }

    public void setCookie(String name, String value, Object expires) {
        setCookie(name, value, expires, null, false, false, null, null);
    }

    /**
     * Queues a Set-Cookie header.
     *
     * @param expires seconds from now (negative to expire the cookie
     * immediately), a literal date string, or empty for a session cookie
     * @param domain the domain, or null
     * @param secure whether the cookie is only sent over HTTPS
     * @param httpOnly whether the cookie is hidden from scripts
     * @param path the path, or null for the application's mount path
     * @param sameSite Strict, Lax or None; anything else is ignored
     * @see CookieCodec#encode
     */
    public void setCookie(String name, String value, Object expires, String domain, boolean secure,
            boolean httpOnly, String path, String sameSite) {
        if (path == null || path.isEmpty()) {
            path = homePath + "/";
        }
        String header = CookieCodec.encode(name, value, expires, domain, secure, httpOnly, path, sameSite);
        header("Set-Cookie", header);
    }

    // -- Request body --

    /**
     * Returns the request body.
     * <p>
     * For a chunked request the whole input stream is read; otherwise the
     * number of bytes given by the content length, none if it is missing or
     * invalid. The stream is only ever read once: later calls, and the
     * form decoding methods, return or use the same bytes. Do not modify
     * the returned array.
     *
     * @exception UncheckedIOException if the input stream fails
     */
    public byte[] body() {
        if (body == null) {
            body = readBody(-1L);
        }
        return body;
    }

    /**
     * Reads the request body from the input stream.
     * @param limit the maximum number of bytes to buffer, or negative for
     * no limit
     * @return the body, or null if it is larger than the limit
     */
    private byte[] readBody(long limit) {
        long length;
        if ("chunked".equalsIgnoreCase(env.getString(Environment.HTTP_TRANSFER_ENCODING))) {
            length = -1L;
        } else {
            length = parseContentLength(env.getString(Environment.CONTENT_LENGTH));
        }
        if (limit >= 0L) {
            if (length > limit) {
                return null;
            } else if (length < 0L) {
                // read one byte past the limit to detect an oversized body
                length = limit + 1L;
            }
        }
        InputStream in = env.getInputStream();
        byte[] bytes;
        try {
            bytes = StreamUtils.read(in, length);
        } catch (IOException e) {
            throw new UncheckedIOException(L10N.getString("err.read_body"), e);
        }
        return (limit >= 0L && bytes.length > limit) ? null : bytes;
    }

    /**
     * Synonym for {@link #body()}.
     */
    public byte[] data() {
        return body();
    }

    static long parseContentLength(String value) {
        if (value == null) {
            return 0L;
        }
        try {
            long length = Long.parseLong(value.trim());
            return (length < 0L) ? 0L : length;
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    /**
     * Returns the submitted form values, undecorated.
     * <p>
     * With "get" the values come from the query string. With "post" (or
     * "put" or "patch") they come from the body of a POST, PUT or PATCH
     * request: a multipart body contributes text fields and uploaded files,
     * any other body is read as urlencoded text. With "both" the two are
     * merged, body values replacing query values of the same name.
     * <p>
     * A multipart body that cannot be decoded contributes nothing.
     *
     * @param method "get", "post", "put", "patch" or "both"; null means both
     * @return the values by name
     * @exception IllegalArgumentException if the method is not one of these
     */
    public Map<String, FieldValue<?>> rawFields(String method) {
        String m = (method == null) ? BOTH : method.toLowerCase(Locale.ROOT);
        boolean get = false;
        boolean post = false;
        switch (m) {
            case BOTH:
                get = true;
                post = true;
                break;
            case "get":
                get = true;
                break;
            case "post":
            case "put":
            case "patch":
                post = true;
                break;
            default:
                String message = MessageFormat.format(L10N.getString("err.bad_fields_method"), method);
                throw new IllegalArgumentException(message);
        }
        Map<String, FieldValue<?>> result = new LinkedHashMap<>();
        if (get) {
            String queryString = env.getString(Environment.QUERY_STRING, "");
            result.putAll(URLEncodedParser.parseFields(queryString, StandardCharsets.UTF_8));
        }
        if (post && FormDecoder.isWriteMethod(this.method)) {
            String contentType = env.getString(Environment.CONTENT_TYPE, "");
            if (contentType.toLowerCase(Locale.ROOT).startsWith("multipart/")) {
                FormData data = getFormData();
                result.putAll(data.getFields());
                result.putAll(data.getFiles());
            } else {
                String text = new String(body(), StandardCharsets.UTF_8);
                result.putAll(URLEncodedParser.parseFields(text, StandardCharsets.UTF_8));
            }
        }
        return result;
    }

    /**
     * Returns the decoded multipart body, decoding it on first use.
     * A body that cannot be decoded yields empty form data, also cached.
     * If the body has not been read yet, no more than the configured
     * maximum request size is buffered; a larger body is discarded and
     * {@link #body()} then returns no bytes.
     */
    public FormData getFormData() {
        if (formData == null) {
            if (body == null) {
                long limit = formDecoder.getConfig().maxRequestSize;
                body = readBody(limit);
                if (body == null) {
                    body = new byte[0];
                    LOGGER.warning(MessageFormat.format(L10N.getString("log.body_too_large"), limit));
                    formData = FormData.empty();
                    return formData;
                }
            }
            byte[] bytes = body;
            String contentType = env.getString(Environment.CONTENT_TYPE);
            try {
                formData = formDecoder.decode(method, contentType, bytes.length,
                        new ByteArrayInputStream(bytes), true);
            } catch (DecodeException e) {
                String message = MessageFormat.format(L10N.getString("log.form_decode_failed"), e.getMessage());
                LOGGER.log(Level.WARNING, message, e);
                formData = FormData.empty();
            }
        }
        return formData;
    }

    // -- Validated values --

    /**
     * Returns the submitted form values (from the query string and body),
     * failing with 400 Bad Request unless all the given names are present.
     * @exception OutcomeSignal carrying 400 Bad Request
     */
    public Storage input(String... required) {
        return input(FieldSpec.required(required));
    }

    /**
     * Returns the submitted form values as described by the given {@link FieldSpec}.
     * Text values are normalized unless it says otherwise.
     * @exception OutcomeSignal carrying 400 Bad Request if a required value
     * is missing
     */
    public Storage input(FieldSpec spec) {
        Map<String, FieldValue<?>> raw = rawFields(spec.getMethod());
        try {
            return storify(raw, spec, spec.isUnicode(true));
        } catch (MissingFieldException e) {
            LOGGER.fine(e.getMessage());
            throw HTTPOutcomes.badRequest(this).signal();
        }
    }

    /**
     * Returns the request cookies, failing with 400 Bad Request unless all
     * the given names are present.
     * @exception OutcomeSignal carrying 400 Bad Request
     */
    public Storage cookies(String... required) {
        return cookies(FieldSpec.required(required));
    }

    /**
     * Returns the request cookies as described by the given {@link FieldSpec}.
     * @exception OutcomeSignal carrying 400 Bad Request if a required cookie
     * is missing
     */
    public Storage cookies(FieldSpec spec) {
        Map<String, FieldValue<String>> raw = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : getCookies().entrySet()) {
            raw.put(entry.getKey(), FieldValue.of(entry.getValue()));
        }
        try {
            return storify(raw, spec, spec.isUnicode(false));
        } catch (MissingFieldException e) {
            LOGGER.fine(e.getMessage());
            throw HTTPOutcomes.badRequest(this).signal();
        }
    }

    /**
     * Returns the cookies sent with the request, parsing the Cookie header
     * on first use. A malformed header yields the cookies that could be
     * recovered from it.
     */
    public Map<String, String> getCookies() {
        if (cookies == null) {
            cookies = Collections.unmodifiableMap(CookieCodec.decode(env.getString(Environment.HTTP_COOKIE, "")));
        }
        return cookies;
    }

    static Storage storify(Map<String, ? extends FieldValue<?>> raw, FieldSpec spec, boolean unicode)
            throws MissingFieldException {
        Storage storage = new Storage();
        for (String name : spec.getRequired()) {
            if (!raw.containsKey(name)) {
                String message = MessageFormat.format(L10N.getString("err.missing_field"), name);
                throw new MissingFieldException(message, name);
            }
        }
        List<String> names = new ArrayList<>(spec.getRequired());
        for (String name : raw.keySet()) {
            if (!spec.getRequired().contains(name)) {
                names.add(name);
            }
        }
        for (String name : names) {
            FieldValue<?> fieldValue = raw.get(name);
            FieldSpec.Kind kind = spec.getKind(name);
            Object value;
            if (kind == FieldSpec.Kind.LIST) {
                List<Object> list = new ArrayList<>();
                for (Object o : fieldValue.getValues()) {
                    list.add(present(o, unicode));
                }
                value = list;
            } else if (kind == FieldSpec.Kind.FILE) {
                value = fieldValue.getLast();
            } else {
                value = present(fieldValue.getLast(), unicode);
            }
            storage.put(name, value);
        }
        for (Map.Entry<String, FieldSpec.Default> entry : spec.getDefaults().entrySet()) {
            String name = entry.getKey();
            if (!storage.containsKey(name)) {
                FieldSpec.Default d = entry.getValue();
                storage.put(name, (d.kind == FieldSpec.Kind.LIST) ? new ArrayList<Object>() : d.value);
            }
        }
        return storage;
    }

    /**
     * Uploaded files become their content, text is optionally normalized.
     */
    private static Object present(Object value, boolean unicode) {
        if (value instanceof FileUpload) {
            try {
                return ((FileUpload) value).getValue();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        } else if (unicode && value instanceof String) {
            return Normalizer.normalize((String) value, Normalizer.Form.NFC);
        }
        return value;
    }

    // -- Diagnostics --

    /**
     * Writes each argument on its own line to the gateway's error stream,
     * or to standard error if the environment has none.
     */
    public void debug(Object... args) {
        StringBuilder buf = new StringBuilder();
        String eol = System.getProperty("line.separator");
        for (Object arg : args) {
            if (arg instanceof Object[]) {
                buf.append(Arrays.deepToString((Object[]) arg));
            } else if (arg instanceof byte[]) {
                buf.append(Arrays.toString((byte[]) arg));
            } else {
                buf.append(arg);
            }
            buf.append(eol);
        }
        String text = buf.toString();
        Object errors = env.get(Environment.ERRORS);
        try {
            if (errors instanceof Writer) {
                Writer writer = (Writer) errors;
                writer.write(text);
                writer.flush();
            } else if (errors instanceof OutputStream) {
                OutputStream out = (OutputStream) errors;
                out.write(text.getBytes(StandardCharsets.UTF_8));
                out.flush();
            } else {
                PrintStream err = System.err;
                err.print(text);
                err.flush();
            }
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, L10N.getString("log.debug_failed"), e);
        }
    }

    /**
     * Releases the resources held for this request: uploaded files are
     * deleted. Calling this more than once has no further effect.
     */
    public void release() {
        if (formData != null) {
            formData.release();
        }
    }

    @Override
    public String toString() {
        return "Context[" + method + " " + getFullPath() + " " + status + "]";
    }

}
