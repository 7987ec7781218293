/*
 * Copyright 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.ssewire;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Incrementally reassembles a Server-Sent Event byte stream into {@link ServerSentEvent} instances.
 * <p>
 * Bytes may be fed in chunks of any size - a frame split across many {@link #decode(byte[])} calls, even one byte at a time,
 * decodes exactly as it would have if all of its bytes had arrived at once. Bytes that do not yet form a complete frame
 * (one terminated by a blank line, where {@code \n} and {@code \r\n} line endings may be freely mixed) are retained until more input arrives.
 * <p>
 * Decoding never fails on malformed input: lines that are neither comments nor {@code name: value} fields are skipped,
 * as are unknown field names and non-numeric {@code retry} values. Field names are matched case-insensitively.
 * <p>
 * A frame made up only of comment lines (for example, a {@code ":\n\n"} heartbeat) yields a degenerate event for which
 * {@link ServerSentEvent#isEmpty()} is {@code true}.
 * <p>
 * Instances hold per-stream state and are intended for use by a single thread; use one decoder per stream.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public final class ServerSentEventDecoder {
	@NonNull
	private static final Integer DEFAULT_INITIAL_CAPACITY;

	static {
		DEFAULT_INITIAL_CAPACITY = 1_024;
	}

	@NonNull
	private byte[] buffer;
	// Number of valid bytes in the buffer
	private int length;
	// Start of the first byte not yet resolved into a frame
	private int consumed;
	// Next buffer index to examine as a potential frame boundary end
	private int scanPosition;

	/**
	 * Acquires a new decoder with an empty buffer.
	 *
	 * @return a new decoder
	 */
	@NonNull
	public static ServerSentEventDecoder withDefaults() {
		return new ServerSentEventDecoder();
	}

	private ServerSentEventDecoder() {
		this.buffer = new byte[DEFAULT_INITIAL_CAPACITY];
		this.length = 0;
		this.consumed = 0;
		this.scanPosition = 0;
	}

	/**
	 * Feeds bytes into the decoder.
	 *
	 * @param bytes the bytes to feed
	 * @return the events completed by these bytes, in stream order (possibly empty)
	 */
	@NonNull
	public List<@NonNull ServerSentEvent> decode(@NonNull byte[] bytes) {
		requireNonNull(bytes);
		return decode(bytes, 0, bytes.length);
	}

	/**
	 * Feeds a range of bytes into the decoder.
	 *
	 * @param bytes  the byte array holding the bytes to feed
	 * @param offset index of the first byte to feed
	 * @param length number of bytes to feed
	 * @return the events completed by these bytes, in stream order (possibly empty)
	 */
	@NonNull
	public List<@NonNull ServerSentEvent> decode(@NonNull byte[] bytes,
																							 int offset,
																							 int length) {
		requireNonNull(bytes);

		if (offset < 0 || length < 0 || offset > bytes.length - length)
			throw new IndexOutOfBoundsException(format("Illegal range: offset %d, length %d for array of length %d", offset, length, bytes.length));

		append(bytes, offset, length);

		List<ServerSentEvent> serverSentEvents = new ArrayList<>();

		while (this.scanPosition < this.length) {
			int end = this.scanPosition;
			int frameEnd = -1;

			// A boundary is any line break that ends an empty line (ignoring a trailing \r), so mixed
			// \n and \r\n line endings are handled. Boundaries must lie entirely within the unconsumed region.
			// A \r left at the end of the frame is stripped during parsing.
			if (this.buffer[end] == '\n') {
				if (end - 1 >= this.consumed && this.buffer[end - 1] == '\n')
					frameEnd = end - 1;
				else if (end - 2 >= this.consumed
						&& this.buffer[end - 1] == '\r'
						&& this.buffer[end - 2] == '\n')
					frameEnd = end - 2;
			}

			this.scanPosition = end + 1;

			if (frameEnd >= 0) {
				serverSentEvents.add(parseFrame(this.buffer, this.consumed, frameEnd));
				this.consumed = end + 1;
			}
		}

		compact();

		return serverSentEvents;
	}

	/**
	 * Signals end-of-stream, decoding any buffered bytes as a final frame even though no terminating blank line was seen.
	 * <p>
	 * The residue only produces an event if it contains at least one non-blank line. The decoder is empty afterwards and may be reused.
	 *
	 * @return the final event, if any
	 */
	@NonNull
	public List<@NonNull ServerSentEvent> finish() {
		List<ServerSentEvent> serverSentEvents = new ArrayList<>(1);

		if (containsNonBlankLine(this.buffer, this.consumed, this.length))
			serverSentEvents.add(parseFrame(this.buffer, this.consumed, this.length));

		this.length = 0;
		this.consumed = 0;
		this.scanPosition = 0;

		return serverSentEvents;
	}

	/**
	 * How many fed bytes have not yet been resolved into an event?
	 *
	 * @return the number of pending bytes
	 */
	@NonNull
	public Integer getPendingByteCount() {
		return this.length - this.consumed;
	}

	/**
	 * Are there fed bytes which have not yet been resolved into an event?
	 *
	 * @return {@code true} if bytes are pending
	 */
	@NonNull
	public Boolean hasPendingBytes() {
		return getPendingByteCount() > 0;
	}

	private void append(@NonNull byte[] bytes,
											int offset,
											int length) {
		requireNonNull(bytes);

		if (length == 0)
			return;

		int required = this.length + length;

		if (required > this.buffer.length) {
			int newCapacity = Math.max(required, this.buffer.length * 2);
			this.buffer = Arrays.copyOf(this.buffer, newCapacity);
		}

		System.arraycopy(bytes, offset, this.buffer, this.length, length);
		this.length = required;
	}

	private void compact() {
		if (this.consumed == 0)
			return;

		int remaining = this.length - this.consumed;

		if (remaining > 0)
			System.arraycopy(this.buffer, this.consumed, this.buffer, 0, remaining);

		this.scanPosition -= this.consumed;
		this.length = remaining;
		this.consumed = 0;
	}

	@NonNull
	private Boolean containsNonBlankLine(@NonNull byte[] bytes,
																			 int start,
																			 int end) {
		requireNonNull(bytes);

		for (int i = start; i < end; i++)
			if (bytes[i] != '\n' && bytes[i] != '\r')
				return true;

		return false;
	}

	@NonNull
	private ServerSentEvent parseFrame(@NonNull byte[] bytes,
																		 int start,
																		 int end) {
		requireNonNull(bytes);

		// Frames are only ever sliced at ASCII line breaks, so multibyte UTF-8 sequences are never split here
		String frame = new String(bytes, start, end - start, StandardCharsets.UTF_8);

		String id = null;
		String event = null;
		StringBuilder data = null;
		Duration retry = null;

		int lineStart = 0;
		int frameLength = frame.length();

		while (lineStart <= frameLength) {
			int lineEnd = frame.indexOf('\n', lineStart);

			if (lineEnd == -1)
				lineEnd = frameLength;

			String line = frame.substring(lineStart, lineEnd);
			lineStart = lineEnd + 1;

			if (line.endsWith("\r"))
				line = line.substring(0, line.length() - 1);

			// Blank lines and comments carry no fields
			if (line.isEmpty() || line.charAt(0) == ':')
				continue;

			int colonIndex = line.indexOf(':');

			// Malformed
			if (colonIndex == -1)
				continue;

			String name = Utilities.trimAggressivelyToEmpty(line.substring(0, colonIndex)).toLowerCase(Locale.ROOT);
			String value = line.substring(colonIndex + 1);

			if (name.equals("data")) {
				if (value.startsWith(" "))
					value = value.substring(1);

				if (data == null)
					data = new StringBuilder(value);
				else
					data.append('\n').append(value);
			} else if (name.equals("event")) {
				String trimmedValue = Utilities.trimAggressivelyToNull(value);

				if (trimmedValue != null && trimmedValue.indexOf('\r') == -1)
					event = trimmedValue;
			} else if (name.equals("id")) {
				String trimmedValue = Utilities.trimAggressivelyToNull(value);

				if (trimmedValue != null && trimmedValue.indexOf('\u0000') == -1 && trimmedValue.indexOf('\r') == -1)
					id = trimmedValue;
			} else if (name.equals("retry")) {
				Duration parsedRetry = parseRetry(Utilities.trimAggressivelyToEmpty(value));

				if (parsedRetry != null)
					retry = parsedRetry;
			}

			// Unknown fields are ignored
		}

		return ServerSentEvent.withDefaults()
				.id(id)
				.event(event)
				.data(data == null ? null : data.toString())
				.retry(retry)
				.build();
	}

	@Nullable
	private Duration parseRetry(@NonNull String value) {
		requireNonNull(value);

		// Long.MAX_VALUE has 19 digits
		if (value.isEmpty() || value.length() > 18)
			return null;

		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);

			if (c < '0' || c > '9')
				return null;
		}

		return Duration.ofMillis(Long.parseLong(value));
	}
}
