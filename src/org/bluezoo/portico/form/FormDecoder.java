/*
 * FormDecoder.java
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

package org.bluezoo.portico.form;

import org.bluezoo.portico.mime.ContentType;
import org.bluezoo.portico.mime.ContentTypeParser;
import org.bluezoo.portico.mime.MIMEUtils;
import org.bluezoo.portico.util.Config;
import org.bluezoo.portico.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ResourceBundle;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decodes form request bodies into text fields and uploaded files.
 * <p>
 * Only bodies of write-style requests (POST, PUT and PATCH) are decoded;
 * for any other method the result is empty. Two content types are
 * understood: {@code application/x-www-form-urlencoded} and
 * {@code multipart/form-data}.
 * <p>
 * In strict mode a body that cannot be decoded raises a
 * {@link DecodeException}, after any uploaded files created for it have
 * been released. Otherwise the failure is logged and an empty result is
 * returned.
 * <p>
 * Multipart parts are files if they carry a filename or were too large
 * to hold in memory. Values submitted more than once under the same name
 * are kept in order; see {@link FieldValue} for how they are presented.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class FormDecoder {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.portico.form.L10N");
    private static final Logger LOGGER = Logger.getLogger(FormDecoder.class.getName());

    private static final Collection<String> WRITE_METHODS = new TreeSet<>(Arrays.asList(
        "POST", "PUT", "PATCH"
    ));

    public static final String URLENCODED = "application/x-www-form-urlencoded";
    public static final String MULTIPART_FORM_DATA = "multipart/form-data";

    private final MultipartConfig config;
    private final Charset defaultCharset;

    /**
     * Creates a decoder using the library defaults.
     */
    public FormDecoder() {
        this(new MultipartConfig(), Config.getCharset());
    }

    /**
     * Creates a decoder.
     * @param config limits and temporary storage for multipart bodies
     * @param defaultCharset the charset used for text that does not
     * declare one
     */
    public FormDecoder(MultipartConfig config, Charset defaultCharset) {
        this.config = config;
        this.defaultCharset = defaultCharset;
    }

    public MultipartConfig getConfig() {
        return config;
    }

    /**
     * Indicates whether request bodies of the given method are decoded.
     */
    public static boolean isWriteMethod(String method) {
        return method != null && WRITE_METHODS.contains(method.toUpperCase(Locale.ROOT));
    }

    /**
     * Decodes a request body.
     *
     * @param method the request method
     * @param contentType the Content-Type of the body
     * @param contentLength the length of the body, or -1 if not known
     * @param body the body
     * @param strict whether failures are thrown rather than producing an
     * empty result
     * @return the decoded fields and files
     * @exception DecodeException if strict and the body cannot be decoded
     */
    public FormData decode(String method, String contentType, long contentLength, InputStream body,
            boolean strict) throws DecodeException {
        if (!isWriteMethod(method)) {
            return FormData.empty();
        }
        try {
            return decodeBody(contentType, contentLength, body);
        } catch (DecodeException e) {
            if (strict) {
                throw e;
            }
            if (LOGGER.isLoggable(Level.FINE)) {
                String message = MessageFormat.format(L10N.getString("log.decode_failed"), e.getMessage());
                LOGGER.log(Level.FINE, message, e);
            }
            return FormData.empty();
        }
    }

    private FormData decodeBody(String contentTypeValue, long contentLength, InputStream body)
            throws DecodeException {
        if (contentTypeValue == null || contentTypeValue.trim().isEmpty()) {
            throw new DecodeException(L10N.getString("err.no_content_type"));
        }
        ContentType contentType = ContentTypeParser.parse(contentTypeValue);
        if (contentType == null) {
            String message = MessageFormat.format(L10N.getString("err.bad_content_type"), contentTypeValue);
            throw new DecodeException(message);
        }
        Charset charset = contentType.getCharset(defaultCharset);
        if (contentType.isMimeType(MULTIPART_FORM_DATA)) {
            String boundary = contentType.getParameter("boundary");
            if (boundary == null || boundary.isEmpty()) {
                String message = MessageFormat.format(L10N.getString("err.no_boundary"), contentTypeValue);
                throw new DecodeException(message);
            }
            if (!MIMEUtils.isValidBoundary(boundary)) {
                String message = MessageFormat.format(L10N.getString("err.bad_boundary"), boundary);
                throw new DecodeException(message);
            }
            if (config.maxRequestSize >= 0L && contentLength > config.maxRequestSize) {
                String message = MessageFormat.format(L10N.getString("err.max_request_size_exceeded"),
                        config.maxRequestSize);
                throw new DecodeException(message);
            }
            MultipartParser parser = new MultipartParser(config, boundary);
            return collect(parser.parse(body), charset);
        } else if (contentType.isMimeType(URLENCODED)) {
            byte[] bytes;
            try {
                bytes = StreamUtils.read(body, contentLength);
            } catch (IOException e) {
                throw new DecodeException(L10N.getString("err.read_failed"), e);
            }
            String text = new String(bytes, charset);
            return new FormData(URLEncodedParser.parseFields(text, charset),
                    new LinkedHashMap<String, FieldValue<FileUpload>>());
        }
        String message = MessageFormat.format(L10N.getString("err.unsupported_content_type"), contentTypeValue);
        throw new UnsupportedContentTypeException(message, contentTypeValue);
    }

    /**
     * Sorts parsed parts into fields and files.
     */
    private FormData collect(List<MimePart> parts, Charset charset) throws DecodeException {
        Map<String, List<String>> fields = new LinkedHashMap<>();
        Map<String, List<FileUpload>> files = new LinkedHashMap<>();
        try {
            for (MimePart part : parts) {
                String name = part.getName();
                if (name == null) {
                    part.release();
                    continue;
                }
                if (part.isFile()) {
                    add(files, name, (FileUpload) part);
                } else {
                    add(fields, name, part.getText(charset));
                    part.release();
                }
            }
        } catch (IOException e) {
            for (MimePart part : parts) {
                part.release();
            }
            throw new DecodeException(L10N.getString("err.part_storage"), e);
        }
        return new FormData(URLEncodedParser.collapse(fields), URLEncodedParser.collapse(files));
    }

    private static <T> void add(Map<String, List<T>> map, String name, T value) {
        List<T> values = map.get(name);
        if (values == null) {
            values = new ArrayList<>();
            map.put(name, values);
        }
        values.add(value);
    }

}
