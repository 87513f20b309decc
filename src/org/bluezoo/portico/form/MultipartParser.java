/*
 * MultipartParser.java
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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Parses multipart/form-data request bodies.
 * Produces a list of {@link MimePart} instances, in body order.
 * <p>
 * The body is processed line by line. A line that starts with
 * {@code --boundary} ends the current part; the line ending that precedes
 * it belongs to the delimiter, not to the part content. Lines longer than
 * any boundary line are passed through in chunks so that large binary
 * parts never need to be held in memory whole.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
class MultipartParser {

	/**
	 * RFC 2046 defines the maximum boundary length of 70 characters, so no
	 * delimiter line (plus transport padding) comes close to this.
	 */
	static final int MAX_CHUNK = 8192;

	private static final int NO_MATCH = 0;
	private static final int DELIMITER = 1;
	private static final int CLOSE_DELIMITER = 2;

	private final MultipartConfig config;
	private final String boundary;

	/**
	 * Creates a parser for the given boundary.
	 * @param config the multipart configuration
	 * @param boundary the multipart boundary from Content-Type header
	 */
	MultipartParser(MultipartConfig config, String boundary) {
		this.config = config;
		this.boundary = boundary;
	}

	/**
	 * Parses the multipart body from the input stream.
	 * If parsing fails, every part created so far is released before the
	 * exception is thrown.
	 * @param in the request body
	 * @return the parsed parts
	 * @throws DecodeException if the body is malformed, exceeds a limit, or
	 * cannot be read or stored
	 */
	List<MimePart> parse(InputStream in) throws DecodeException {
		List<MimePart> parts = new ArrayList<>();
		boolean success = false;
		try {
			parseParts(new ChunkReader(in), parts);
			success = true;
			return parts;
		} catch (MimePart.SizeLimitException e) {
			throw new DecodeException(e.getMessage(), e);
		} catch (IOException e) {
			throw new DecodeException(FormDecoder.L10N.getString("err.read_failed"), e);
		} finally {
			if (!success) {
				for (MimePart part : parts) {
					part.release();
				}
			}
		}
	}

	private void parseParts(ChunkReader reader, List<MimePart> parts) throws IOException, DecodeException {
		// Preamble
		while (true) {
			Chunk chunk = reader.next();
			if (chunk == null) {
				String message = MessageFormat.format(FormDecoder.L10N.getString("err.no_first_boundary"), boundary);
				throw new DecodeException(message);
			}
			int match = matchBoundary(chunk);
			if (match == CLOSE_DELIMITER) {
				return;
			} else if (match == DELIMITER) {
				break;
			}
		}
		while (true) {
			MimePart part = new MimePart(config);
			parts.add(part);
			readHeaders(reader, part);
			if (readBody(reader, part) == CLOSE_DELIMITER) {
				return; // epilogue is ignored
			}
		}
	}

	private void readHeaders(ChunkReader reader, MimePart part) throws IOException, DecodeException {
		String name = null;
		StringBuilder value = null;
		while (true) {
			Chunk chunk = reader.next();
			if (chunk == null || !chunk.endsLine) {
				throw new DecodeException(FormDecoder.L10N.getString("err.incomplete_headers"));
			}
			String line = new String(chunk.data, 0, chunk.data.length - chunk.eolLength(), StandardCharsets.UTF_8);
			if (line.isEmpty()) {
				if (name != null) {
					part.addHeader(name, value.toString());
				}
				return;
			}
			char c = line.charAt(0);
			if ((c == ' ' || c == '\t') && name != null) {
				// folded continuation line
				value.append(' ').append(line.trim());
				continue;
			}
			if (name != null) {
				part.addHeader(name, value.toString());
			}
			int ci = line.indexOf(':');
			if (ci < 1) {
				String message = MessageFormat.format(FormDecoder.L10N.getString("err.bad_part_header"), line);
				throw new DecodeException(message);
			}
			name = line.substring(0, ci).trim();
			value = new StringBuilder(line.substring(ci + 1).trim());
		}
	}

	/**
	 * Copies part content up to the next delimiter.
	 * @return the kind of delimiter that ended the part
	 */
	private int readBody(ChunkReader reader, MimePart part) throws IOException, DecodeException {
		OutputStream out = part.getOutputStream();
		byte[] heldEol = null;
		while (true) {
			Chunk chunk = reader.next();
			if (chunk == null) {
				throw new DecodeException(FormDecoder.L10N.getString("err.no_final_boundary"));
			}
			int match = matchBoundary(chunk);
			if (match != NO_MATCH) {
				out.close();
				return match;
			}
			if (heldEol != null) {
				out.write(heldEol);
			}
			int eol = chunk.eolLength();
			out.write(chunk.data, 0, chunk.data.length - eol);
			heldEol = (eol > 0) ? Arrays.copyOfRange(chunk.data, chunk.data.length - eol, chunk.data.length) : null;
		}
	}

	/**
	 * Matches a line against {@code --boundary} or {@code --boundary--},
	 * optionally followed by linear whitespace and the line ending.
	 */
	int matchBoundary(Chunk chunk) {
		if (!chunk.startsLine) {
			return NO_MATCH;
		}
		byte[] data = chunk.data;
		int end = data.length - chunk.eolLength();
		int pos = 0;
		if (end < 2 || data[0] != '-' || data[1] != '-') {
			return NO_MATCH;
		}
		pos += 2;
		for (int i = 0; i < boundary.length(); i++) {
			if (pos >= end || data[pos] != (byte) boundary.charAt(i)) {
				return NO_MATCH;
			}
			pos++;
		}
		int result = DELIMITER;
		if (pos + 1 < end && data[pos] == '-' && data[pos + 1] == '-') {
			result = CLOSE_DELIMITER;
			pos += 2;
		}
		// transport padding
		while (pos < end) {
			if (data[pos] != ' ' && data[pos] != '\t') {
				return NO_MATCH;
			}
			pos++;
		}
		return result;
	}

	/**
	 * A run of bytes from the body: a whole line including its line ending,
	 * or a piece of an overlong line, or the unterminated last line.
	 */
	static final class Chunk {

		final byte[] data;
		final boolean startsLine;
		final boolean endsLine;

		Chunk(byte[] data, boolean startsLine, boolean endsLine) {
			this.data = data;
			this.startsLine = startsLine;
			this.endsLine = endsLine;
		}

		/**
		 * Number of trailing bytes forming the CRLF or LF line ending.
		 */
		int eolLength() {
			if (!endsLine) {
				return 0;
			}
			int len = data.length;
			return (len > 1 && data[len - 2] == '\r') ? 2 : 1;
		}
	}

	/**
	 * Reads the body in chunks, enforcing the maximum request size.
	 */
	final class ChunkReader {

		private final InputStream in;
		private final byte[] buf = new byte[MAX_CHUNK];
		private int pos;
		private int limit;
		private long total;
		private boolean atLineStart = true;
		private final ByteArrayOutputStream line = new ByteArrayOutputStream();

		ChunkReader(InputStream in) {
			this.in = in;
		}

		private boolean fill() throws IOException {
			int len = in.read(buf, 0, buf.length);
			if (len <= 0) {
				return false;
			}
			total += len;
			if (config.maxRequestSize >= 0L && total > config.maxRequestSize) {
				String message = MessageFormat.format(FormDecoder.L10N.getString("err.max_request_size_exceeded"),
						config.maxRequestSize);
				throw new MimePart.SizeLimitException(message);
			}
			pos = 0;
			limit = len;
			return true;
		}

		/**
		 * Returns the next chunk, or null at end of stream.
		 */
		Chunk next() throws IOException {
			line.reset();
			boolean startsLine = atLineStart;
			int count = 0;
			while (count < MAX_CHUNK) {
				if (pos >= limit && !fill()) {
					break;
				}
				byte b = buf[pos++];
				line.write(b);
				count++;
				if (b == '\n') {
					atLineStart = true;
					return new Chunk(line.toByteArray(), startsLine, true);
				}
			}
			if (count == 0) {
				return null;
			}
			byte[] data = line.toByteArray();
			if (count == MAX_CHUNK && data[count - 1] == '\r') {
				// keep a CR with the LF that may follow it
				pos--;
				data = Arrays.copyOf(data, count - 1);
			}
			atLineStart = false;
			return new Chunk(data, startsLine, false);
		}
	}

}
