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
import javax.annotation.concurrent.ThreadSafe;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Objects;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The HTTP status line and headers written once, before any frame, when a connection writer owns the raw response.
 * <p>
 * Most hosting servers send their own response head, in which case no preamble should be configured.
 * When one is needed, {@link #withDefaults()} provides a {@code 200} response whose headers satisfy
 * {@link ServerSentEventValidator#isValidResponse(Map)}:
 * <pre>{@code HTTP/1.1 200 OK
 * Content-Type: text/event-stream; charset=UTF-8
 * Cache-Control: no-cache
 * Connection: keep-alive}</pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class ServerSentEventPreamble {
	@NonNull
	private static final Set<@NonNull String> ILLEGAL_LOWERCASE_HEADER_NAMES;
	@NonNull
	private static final Map<@NonNull Integer, @NonNull String> REASON_PHRASES_BY_STATUS_CODE;

	static {
		// Event streams are unbounded
		ILLEGAL_LOWERCASE_HEADER_NAMES = Set.of("content-length");

		REASON_PHRASES_BY_STATUS_CODE = Map.of(
				200, "OK",
				204, "No Content",
				400, "Bad Request",
				401, "Unauthorized",
				403, "Forbidden",
				404, "Not Found",
				406, "Not Acceptable",
				429, "Too Many Requests",
				500, "Internal Server Error",
				503, "Service Unavailable"
		);
	}

	@NonNull
	private final Integer statusCode;
	@NonNull
	private final Map<@NonNull String, @NonNull Set<@NonNull String>> headers;

	/**
	 * Acquires a builder for a {@code 200} preamble with the standard Server-Sent Event response headers.
	 *
	 * @return the builder
	 */
	@NonNull
	public static Builder withDefaults() {
		return new Builder(200)
				.header("Content-Type", "text/event-stream; charset=UTF-8")
				.header("Cache-Control", "no-cache")
				.header("Connection", "keep-alive");
	}

	/**
	 * Acquires a builder for a preamble with the given status code and no headers.
	 *
	 * @param statusCode the HTTP status code
	 * @return the builder
	 */
	@NonNull
	public static Builder withStatusCode(@NonNull Integer statusCode) {
		requireNonNull(statusCode);
		return new Builder(statusCode);
	}

	protected ServerSentEventPreamble(@NonNull Builder builder) {
		requireNonNull(builder);

		if (builder.statusCode < 100 || builder.statusCode > 599)
			throw new IllegalArgumentException(format("Illegal HTTP status code: %d", builder.statusCode));

		Map<String, Set<String>> headers = new LinkedHashMap<>(builder.headers.size());

		for (Entry<String, Set<String>> entry : builder.headers.entrySet()) {
			String headerName = entry.getKey();

			if (ILLEGAL_LOWERCASE_HEADER_NAMES.contains(headerName.toLowerCase(Locale.ENGLISH)))
				throw new IllegalArgumentException(format("You may not specify the '%s' header for %s instances",
						headerName, ServerSentEventPreamble.class.getSimpleName()));

			for (String value : entry.getValue())
				if (value.indexOf('\r') >= 0 || value.indexOf('\n') >= 0)
					throw new IllegalArgumentException(format("Value for header '%s' must not contain CR or LF characters. You supplied '%s'",
							headerName, Utilities.printableString(value)));

			headers.put(headerName, Collections.unmodifiableSet(new LinkedHashSet<>(entry.getValue())));
		}

		this.statusCode = builder.statusCode;
		this.headers = Collections.unmodifiableMap(headers);
	}

	/**
	 * Renders this preamble as an HTTP/1.1 status line and header block, including the blank line which terminates it.
	 *
	 * @return the ISO-8859-1 encoded response head
	 */
	@NonNull
	public byte[] toBytes() {
		try (ByteArrayOutputStream outputStream = new ByteArrayOutputStream(256);
				 OutputStreamWriter outputStreamWriter = new OutputStreamWriter(outputStream, StandardCharsets.ISO_8859_1);
				 PrintWriter printWriter = new PrintWriter(outputStreamWriter, false)) {
			String reasonPhrase = REASON_PHRASES_BY_STATUS_CODE.get(getStatusCode());

			if (reasonPhrase != null)
				printWriter.printf("HTTP/1.1 %d %s\r\n", getStatusCode(), reasonPhrase);
			else
				printWriter.printf("HTTP/1.1 %d\r\n", getStatusCode());

			for (Entry<String, Set<String>> entry : getHeaders().entrySet())
				for (String value : entry.getValue())
					printWriter.printf("%s: %s\r\n", entry.getKey(), value);

			// Terminate header section
			printWriter.print("\r\n");
			printWriter.flush();

			return outputStream.toByteArray();
		} catch (IOException e) {
			// Not possible for in-memory streams
			throw new UncheckedIOException(e);
		}
	}

	@NonNull
	public Builder copy() {
		Builder builder = new Builder(getStatusCode());

		for (Entry<String, Set<String>> entry : getHeaders().entrySet())
			builder.headers.put(entry.getKey(), new LinkedHashSet<>(entry.getValue()));

		return builder;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{statusCode=%s, headers=%s}", getClass().getSimpleName(), getStatusCode(), getHeaders());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ServerSentEventPreamble serverSentEventPreamble))
			return false;

		return Objects.equals(getStatusCode(), serverSentEventPreamble.getStatusCode())
				&& Objects.equals(getHeaders(), serverSentEventPreamble.getHeaders());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getStatusCode(), getHeaders());
	}

	@NonNull
	public Integer getStatusCode() {
		return this.statusCode;
	}

	@NonNull
	public Map<@NonNull String, @NonNull Set<@NonNull String>> getHeaders() {
		return this.headers;
	}

	/**
	 * Builder used to construct instances of {@link ServerSentEventPreamble}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private Integer statusCode;
		@NonNull
		private final Map<@NonNull String, @NonNull Set<@NonNull String>> headers;

		protected Builder(@NonNull Integer statusCode) {
			requireNonNull(statusCode);
			this.statusCode = statusCode;
			this.headers = new LinkedHashMap<>();
		}

		@NonNull
		public Builder statusCode(@NonNull Integer statusCode) {
			requireNonNull(statusCode);
			this.statusCode = statusCode;
			return this;
		}

		/**
		 * Adds a header value, keeping any values already present for the same name.
		 *
		 * @param name  the header name
		 * @param value the header value
		 * @return this builder
		 */
		@NonNull
		public Builder header(@NonNull String name,
													@NonNull String value) {
			requireNonNull(name);
			requireNonNull(value);

			this.headers.computeIfAbsent(name, ignored -> new LinkedHashSet<>()).add(value);
			return this;
		}

		@NonNull
		public ServerSentEventPreamble build() {
			return new ServerSentEventPreamble(this);
		}
	}
}
