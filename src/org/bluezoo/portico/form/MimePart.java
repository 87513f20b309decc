/*
 * MimePart.java
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

import org.bluezoo.portico.mime.ContentDisposition;
import org.bluezoo.portico.mime.ContentDispositionParser;
import org.bluezoo.portico.mime.ContentType;
import org.bluezoo.portico.mime.ContentTypeParser;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One body part of a multipart/form-data request.
 * Stores part headers and body content, using memory for small parts and
 * a temporary file for parts exceeding the configured threshold.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
class MimePart implements FileUpload {

	private static final Logger LOGGER = Logger.getLogger(MimePart.class.getName());

	private final MultipartConfig config;
	private final Map<String, List<String>> headers;
	private ContentType contentType;
	private ContentDisposition contentDisposition;

	// Content storage - either bytes (small) or file (large)
	private byte[] bytes;
	private File tempFile;
	private long size;
	private ContentSink sink;

	/**
	 * Creates a new MimePart with the given configuration.
	 * Use {@link #getOutputStream()} to write content.
	 */
	MimePart(MultipartConfig config) {
		this.config = config;
		this.headers = new LinkedHashMap<>();
	}

	/**
	 * Adds a header to this part.
	 */
	void addHeader(String name, String value) {
		String key = name.toLowerCase();
		List<String> values = headers.get(key);
		if (values == null) {
			values = new ArrayList<>();
			headers.put(key, values);
		}
		values.add(value);
	}

	/**
	 * Returns an output stream for writing the part body.
	 * Content will be stored in memory until it exceeds the threshold,
	 * then switched to a temporary file.
	 */
	OutputStream getOutputStream() {
		sink = new ContentSink();
		return sink;
	}

	/**
	 * Called when writing is complete to finalize storage.
	 */
	void finishWriting(byte[] data, File file, long length) {
		this.bytes = data;
		this.tempFile = file;
		this.size = length;
		this.sink = null;
	}

	/**
	 * Indicates whether the content is held in memory rather than in a
	 * temporary file.
	 */
	boolean isInMemory() {
		return tempFile == null;
	}

	/**
	 * A part is presented as a file if the client supplied a non-empty
	 * filename or if it was too large to keep in memory. Browsers send an
	 * empty filename for a file input left blank.
	 */
	boolean isFile() {
		String filename = getFilename();
		return (filename != null && !filename.isEmpty()) || !isInMemory();
	}

	/**
	 * Returns the content decoded as text, using the part's declared
	 * charset or else the given default.
	 */
	String getText(Charset defaultCharset) throws IOException {
		ContentType ct = getContentTypeParsed();
		Charset charset = (ct != null) ? ct.getCharset(defaultCharset) : defaultCharset;
		return new String(getValue(), charset);
	}

	@Override
	public byte[] getValue() throws IOException {
		if (tempFile != null) {
			return Files.readAllBytes(tempFile.toPath());
		}
		return (bytes != null) ? bytes.clone() : new byte[0];
	}

	@Override
	public InputStream getInputStream() throws IOException {
		if (tempFile != null) {
			return Files.newInputStream(tempFile.toPath());
		}
		return new ByteArrayInputStream(bytes != null ? bytes : new byte[0]);
	}

	@Override
	public String getContentType() {
		String value = getHeader("Content-Type");
		if (value == null) {
			return null;
		}
		ContentType ct = getContentTypeParsed();
		return (ct != null) ? ct.toString() : value;
	}

	private ContentType getContentTypeParsed() {
		if (contentType == null) {
			String value = getHeader("Content-Type");
			if (value != null) {
				contentType = ContentTypeParser.parse(value);
			}
		}
		return contentType;
	}

	@Override
	public String getName() {
		ContentDisposition cd = getContentDispositionParsed();
		return (cd != null) ? cd.getParameter("name") : null;
	}

	@Override
	public String getFilename() {
		ContentDisposition cd = getContentDispositionParsed();
		return (cd != null) ? cd.getParameter("filename") : null;
	}

	private ContentDisposition getContentDispositionParsed() {
		if (contentDisposition == null) {
			String value = getHeader("Content-Disposition");
			if (value != null) {
				contentDisposition = ContentDispositionParser.parse(value);
			}
		}
		return contentDisposition;
	}

	@Override
	public long getSize() {
		return size;
	}

	File getTempFile() {
		return tempFile;
	}

	@Override
	public void release() {
		if (sink != null) {
			sink.abandon();
			sink = null;
		}
		if (tempFile != null) {
			try {
				Files.deleteIfExists(tempFile.toPath());
			} catch (IOException e) {
				String message = MessageFormat.format(FormDecoder.L10N.getString("log.release_failed"), tempFile);
				LOGGER.log(Level.WARNING, message, e);
			}
			tempFile = null;
		}
		bytes = null;
	}

	String getHeader(String name) {
		List<String> values = headers.get(name.toLowerCase());
		return (values != null && !values.isEmpty()) ? values.get(0) : null;
	}

	@Override
	public String toString() {
		return "MimePart[name=" + getName() + ", filename=" + getFilename() + ", size=" + size + "]";
	}

	/**
	 * Thrown when a part grows beyond the maximum file size.
	 */
	static class SizeLimitException extends IOException {

		private static final long serialVersionUID = 1L;

		SizeLimitException(String message) {
			super(message);
		}

	}

	/**
	 * Output stream that stores content in memory until threshold,
	 * then switches to a temporary file.
	 */
	private class ContentSink extends OutputStream {

		private ByteArrayOutputStream memoryBuffer;
		private FileOutputStream fileOut;
		private File file;
		private long length;

		ContentSink() {
			this.memoryBuffer = new ByteArrayOutputStream();
		}

		@Override
		public void write(int b) throws IOException {
			length++;
			checkMaxSize();
			checkThreshold();
			if (memoryBuffer != null) {
				memoryBuffer.write(b);
			} else {
				fileOut.write(b);
			}
		}

		@Override
		public void write(byte[] buf, int off, int len) throws IOException {
			length += len;
			checkMaxSize();
			checkThreshold();
			if (memoryBuffer != null) {
				memoryBuffer.write(buf, off, len);
			} else {
				fileOut.write(buf, off, len);
			}
		}

		private void checkThreshold() throws IOException {
			if (memoryBuffer != null && length > config.fileSizeThreshold) {
				switchToFile();
			}
		}

		private void checkMaxSize() throws IOException {
			if (config.maxFileSize >= 0L && length > config.maxFileSize) {
				String message = MessageFormat.format(FormDecoder.L10N.getString("err.max_file_size_exceeded"),
						getName(), config.maxFileSize);
				throw new SizeLimitException(message);
			}
		}

		private void switchToFile() throws IOException {
			File dir = new File(config.location);
			file = File.createTempFile("upload_", ".tmp", dir);
			// Visible to release() from here on, even if the part is never finished
			tempFile = file;
			fileOut = new FileOutputStream(file);
			fileOut.write(memoryBuffer.toByteArray());
			memoryBuffer = null;
			if (LOGGER.isLoggable(Level.FINE)) {
				String message = MessageFormat.format(FormDecoder.L10N.getString("log.spooled"), getName(), file);
				LOGGER.fine(message);
			}
		}

		@Override
		public void flush() throws IOException {
			if (fileOut != null) {
				fileOut.flush();
			}
		}

		@Override
		public void close() throws IOException {
			if (fileOut != null) {
				fileOut.close();
				finishWriting(null, file, length);
			} else {
				finishWriting(memoryBuffer.toByteArray(), null, length);
			}
		}

		/**
		 * Closes the temporary file, if any, without completing the part.
		 */
		void abandon() {
			if (fileOut != null) {
				try {
					fileOut.close();
				} catch (IOException e) {
					LOGGER.log(Level.FINE, e.getMessage(), e);
				}
				fileOut = null;
			}
			memoryBuffer = null;
		}
	}
}
