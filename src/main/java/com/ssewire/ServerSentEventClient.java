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
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Opens Server-Sent Event streams over HTTP and feeds them to a {@link ServerSentEventListener}.
 * <p>
 * Requests are sent as {@code GET} with {@code Accept: text/event-stream} and {@code Cache-Control: no-cache}.
 * Responses that don't look like event streams are logged but still read, since intermediaries sometimes rewrite headers;
 * responses with a non-2xx status are not read at all.
 * <p>
 * For example:
 * <pre>{@code  ServerSentEventClient client = ServerSentEventClient.withDefaults()
 *   .readTimeout(Duration.ofSeconds(30))
 *   .build();
 *
 * ServerSentEventStreamResult result = client.connectAndReceive(URI.create("https://example.com/prices"), (event) -> {
 *   System.out.printf("%s: %s\n", event.getEvent(), event.getData());
 *   return true;
 * });}</pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class ServerSentEventClient {
	@NonNull
	private static final Duration DEFAULT_CONNECT_TIMEOUT;
	@NonNull
	private static final Duration DEFAULT_READ_TIMEOUT;
	// The JDK client manages these itself and refuses to send them
	@NonNull
	private static final Set<@NonNull String> RESTRICTED_LOWERCASE_HEADER_NAMES;

	static {
		DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
		DEFAULT_READ_TIMEOUT = Duration.ofSeconds(60);
		RESTRICTED_LOWERCASE_HEADER_NAMES = Set.of("connection", "content-length", "expect", "host", "upgrade");
	}

	@NonNull
	private final Duration connectTimeout;
	@NonNull
	private final Duration readTimeout;
	@NonNull
	private final Map<@NonNull String, @NonNull String> headers;
	@NonNull
	private final LifecycleObserver lifecycleObserver;
	@NonNull
	private final HttpClient httpClient;
	@NonNull
	private final ServerSentEventValidator validator;
	@NonNull
	private final ServerSentEventStreamReader streamReader;

	/**
	 * Acquires a builder for {@link ServerSentEventClient} instances.
	 *
	 * @return the builder
	 */
	@NonNull
	public static Builder withDefaults() {
		return new Builder();
	}

	protected ServerSentEventClient(@NonNull Builder builder) {
		requireNonNull(builder);

		this.connectTimeout = builder.connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : builder.connectTimeout;
		this.readTimeout = builder.readTimeout == null ? DEFAULT_READ_TIMEOUT : builder.readTimeout;
		this.lifecycleObserver = builder.lifecycleObserver == null ? LifecycleObserver.defaultInstance() : builder.lifecycleObserver;

		if (this.connectTimeout.isNegative() || this.connectTimeout.isZero())
			throw new IllegalArgumentException(format("Connect timeout must be positive. You supplied %s", this.connectTimeout));

		if (this.readTimeout.isNegative() || this.readTimeout.isZero())
			throw new IllegalArgumentException(format("Read timeout must be positive. You supplied %s", this.readTimeout));

		Map<String, String> headers = new LinkedHashMap<>(builder.headers);

		for (String headerName : headers.keySet())
			if (RESTRICTED_LOWERCASE_HEADER_NAMES.contains(headerName.toLowerCase(Locale.ROOT)))
				throw new IllegalArgumentException(format("The '%s' header is managed by the HTTP client and may not be specified", headerName));

		this.headers = Collections.unmodifiableMap(headers);
		this.httpClient = HttpClient.newBuilder()
				.connectTimeout(this.connectTimeout)
				.followRedirects(HttpClient.Redirect.NORMAL)
				.build();
		this.validator = ServerSentEventValidator.withLifecycleObserver(this.lifecycleObserver);
		this.streamReader = ServerSentEventStreamReader.withDefaults()
				.lifecycleObserver(this.lifecycleObserver)
				.build();
	}

	/**
	 * Connects to the given URI and reads its event stream until it ends, the listener stops, a read times out, or an error occurs.
	 * <p>
	 * This method blocks the calling thread for the lifetime of the stream.
	 *
	 * @param uri      the event stream URI
	 * @param listener receives each decoded event
	 * @return how the stream ended
	 */
	@NonNull
	public ServerSentEventStreamResult connectAndReceive(@NonNull URI uri,
																											 @NonNull ServerSentEventListener listener) {
		requireNonNull(uri);
		requireNonNull(listener);

		// The request timeout bounds the wait for response headers; body reads are bounded separately by the stream reader
		HttpRequest.Builder requestBuilder = HttpRequest.newBuilder(uri)
				.timeout(getReadTimeout())
				.GET();

		for (Entry<String, Set<String>> entry : ServerSentEventValidator.clientRequestHeaders().entrySet())
			if (!RESTRICTED_LOWERCASE_HEADER_NAMES.contains(entry.getKey().toLowerCase(Locale.ROOT)))
				for (String value : entry.getValue())
					requestBuilder.header(entry.getKey(), value);

		for (Entry<String, String> entry : getHeaders().entrySet())
			requestBuilder.header(entry.getKey(), entry.getValue());

		HttpResponse<InputStream> response;

		try {
			response = getHttpClient().send(requestBuilder.build(), HttpResponse.BodyHandlers.ofInputStream());
		} catch (HttpConnectTimeoutException e) {
			safelyLog(LogEvent.with(LogEventType.SERVER_SENT_EVENT_STREAM_READ_FAILED, format("Timed out connecting to %s", uri))
					.throwable(e)
					.build());

			return new ServerSentEventStreamResult.TimedOut(0L, e);
		} catch (HttpTimeoutException e) {
			safelyLog(LogEvent.with(LogEventType.SERVER_SENT_EVENT_STREAM_READ_FAILED,
							format("No response headers arrived from %s within %s", uri, getReadTimeout()))
					.throwable(e)
					.build());

			return new ServerSentEventStreamResult.TimedOut(0L, e);
		} catch (IOException e) {
			safelyLog(LogEvent.with(LogEventType.SERVER_SENT_EVENT_STREAM_READ_FAILED, format("Unable to connect to %s", uri))
					.throwable(e)
					.build());

			return new ServerSentEventStreamResult.Failed(0L, e);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return new ServerSentEventStreamResult.Failed(0L, e);
		}

		try (ServerSentEventSource source = ServerSentEventSource.forInputStream(response.body())) {
			if (response.statusCode() < 200 || response.statusCode() > 299) {
				IOException exception = new IOException(format("Server-Sent Event request to %s failed with HTTP status %d", uri, response.statusCode()));

				safelyLog(LogEvent.with(LogEventType.SERVER_SENT_EVENT_STREAM_READ_FAILED, exception.getMessage())
						.throwable(exception)
						.build());

				return new ServerSentEventStreamResult.Failed(0L, exception);
			}

			getValidator().checkResponse(toHeaderSets(response.headers().map()));

			return getStreamReader().read(source, getReadTimeout(), listener);
		}
	}

	@NonNull
	public Duration getConnectTimeout() {
		return this.connectTimeout;
	}

	@NonNull
	public Duration getReadTimeout() {
		return this.readTimeout;
	}

	@NonNull
	public Map<@NonNull String, @NonNull String> getHeaders() {
		return this.headers;
	}

	@NonNull
	public LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}

	@NonNull
	private Map<@NonNull String, @NonNull Set<@NonNull String>> toHeaderSets(@NonNull Map<@NonNull String, @NonNull List<@NonNull String>> headers) {
		requireNonNull(headers);

		Map<String, Set<String>> headerSets = new LinkedHashMap<>(headers.size());

		for (Entry<String, List<String>> entry : headers.entrySet())
			headerSets.put(entry.getKey(), new LinkedHashSet<>(entry.getValue()));

		return headerSets;
	}

	private void safelyLog(@NonNull LogEvent logEvent) {
		requireNonNull(logEvent);

		try {
			getLifecycleObserver().didReceiveLogEvent(logEvent);
		} catch (Throwable throwable) {
			// The LifecycleObserver implementation errored out, but we can't let that affect us.
			// Not much else we can do here but dump to stderr
			throwable.printStackTrace(System.err);
		}
	}

	@NonNull
	private HttpClient getHttpClient() {
		return this.httpClient;
	}

	@NonNull
	private ServerSentEventValidator getValidator() {
		return this.validator;
	}

	@NonNull
	private ServerSentEventStreamReader getStreamReader() {
		return this.streamReader;
	}

	/**
	 * Builder used to construct instances of {@link ServerSentEventClient} via {@link ServerSentEventClient#withDefaults()}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@Nullable
		private Duration connectTimeout;
		@Nullable
		private Duration readTimeout;
		@NonNull
		private final Map<@NonNull String, @NonNull String> headers;
		@Nullable
		private LifecycleObserver lifecycleObserver;

		protected Builder() {
			this.headers = new LinkedHashMap<>();
		}

		@NonNull
		public Builder connectTimeout(@Nullable Duration connectTimeout) {
			this.connectTimeout = connectTimeout;
			return this;
		}

		/**
		 * The longest to wait for the response headers, and then for any single read of the response body. Defaults to 60 seconds.
		 *
		 * @param readTimeout the read timeout
		 * @return this builder
		 */
		@NonNull
		public Builder readTimeout(@Nullable Duration readTimeout) {
			this.readTimeout = readTimeout;
			return this;
		}

		/**
		 * Adds a request header, for example {@code Authorization}.
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

			this.headers.put(name, value);
			return this;
		}

		@NonNull
		public Builder lifecycleObserver(@Nullable LifecycleObserver lifecycleObserver) {
			this.lifecycleObserver = lifecycleObserver;
			return this;
		}

		@NonNull
		public ServerSentEventClient build() {
			return new ServerSentEventClient(this);
		}
	}
}
