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

import javax.annotation.concurrent.ThreadSafe;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Advisory checks that classify whether an HTTP exchange looks like a Server-Sent Event stream.
 * <p>
 * The static predicates are pure functions over a method and a header map (header names are matched case-insensitively).
 * Intermediaries sometimes rewrite headers, so a failed check is usually worth logging rather than rejecting outright -
 * instances acquired via {@link #withLifecycleObserver(LifecycleObserver)} do exactly that.
 * <p>
 * For example:
 * <ul>
 *   <li>{@code GET} with {@code Accept: text/event-stream} is a valid request</li>
 *   <li>{@code POST} with {@code Accept: text/event-stream} is not</li>
 *   <li>{@code Content-Type: text/event-stream} with {@code Cache-Control: no-cache, no-store} is a valid response</li>
 * </ul>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class ServerSentEventValidator {
	/**
	 * The Server-Sent Event media type.
	 */
	@NonNull
	public static final String EVENT_STREAM_CONTENT_TYPE = "text/event-stream";

	@NonNull
	private static final Map<@NonNull String, @NonNull Set<@NonNull String>> CLIENT_REQUEST_HEADERS;

	static {
		Map<String, Set<String>> clientRequestHeaders = new LinkedHashMap<>(3);
		clientRequestHeaders.put("Accept", Set.of(EVENT_STREAM_CONTENT_TYPE));
		clientRequestHeaders.put("Cache-Control", Set.of("no-cache"));
		clientRequestHeaders.put("Connection", Set.of("keep-alive"));

		CLIENT_REQUEST_HEADERS = Collections.unmodifiableMap(clientRequestHeaders);
	}

	@NonNull
	private final LifecycleObserver lifecycleObserver;

	/**
	 * Acquires a validator that reports failed checks to the given observer.
	 *
	 * @param lifecycleObserver the observer to receive {@link LogEvent}s for failed checks
	 * @return the validator
	 */
	@NonNull
	public static ServerSentEventValidator withLifecycleObserver(@NonNull LifecycleObserver lifecycleObserver) {
		requireNonNull(lifecycleObserver);
		return new ServerSentEventValidator(lifecycleObserver);
	}

	private ServerSentEventValidator(@NonNull LifecycleObserver lifecycleObserver) {
		requireNonNull(lifecycleObserver);
		this.lifecycleObserver = lifecycleObserver;
	}

	/**
	 * Is this a valid Server-Sent Event request?
	 * <p>
	 * The method must be exactly {@code GET} (case-sensitive) and some {@code Accept} value, split on {@code ,} and with
	 * any media type parameters removed, must be {@code text/event-stream} (case-insensitive).
	 *
	 * @param httpMethod the request method
	 * @param headers    the request headers
	 * @return {@code true} if the request is a valid Server-Sent Event request
	 */
	@NonNull
	public static Boolean isValidRequest(@Nullable String httpMethod,
																			 @Nullable Map<@Nullable String, @Nullable Set<@Nullable String>> headers) {
		if (httpMethod == null || headers == null)
			return false;

		if (!"GET".equals(httpMethod))
			return false;

		for (String acceptHeaderValue : Utilities.headerValues(headers, "Accept")) {
			for (String mediaRange : acceptHeaderValue.split(",")) {
				int parameterIndex = mediaRange.indexOf(';');

				if (parameterIndex >= 0)
					mediaRange = mediaRange.substring(0, parameterIndex);

				if (EVENT_STREAM_CONTENT_TYPE.equalsIgnoreCase(Utilities.trimAggressivelyToEmpty(mediaRange)))
					return true;
			}
		}

		return false;
	}

	/**
	 * Is this a valid Server-Sent Event response?
	 * <p>
	 * Some {@code Content-Type} value must contain {@code text/event-stream} and some {@code Cache-Control} value must contain
	 * {@code no-cache}; both are case-insensitive substring checks, so {@code no-cache, no-store} is acceptable.
	 *
	 * @param headers the response headers
	 * @return {@code true} if the response is a valid Server-Sent Event response
	 */
	@NonNull
	public static Boolean isValidResponse(@Nullable Map<@Nullable String, @Nullable Set<@Nullable String>> headers) {
		if (headers == null)
			return false;

		return anyHeaderValueContains(headers, "Content-Type", EVENT_STREAM_CONTENT_TYPE)
				&& anyHeaderValueContains(headers, "Cache-Control", "no-cache");
	}

	/**
	 * The headers a client should send when opening a Server-Sent Event stream.
	 *
	 * @return an unmodifiable map of client request headers
	 */
	@NonNull
	public static Map<@NonNull String, @NonNull Set<@NonNull String>> clientRequestHeaders() {
		return CLIENT_REQUEST_HEADERS;
	}

	/**
	 * Performs {@link #isValidRequest(String, Map)}, emitting a {@link LogEventType#SERVER_SENT_EVENT_INVALID_REQUEST} log event on failure.
	 *
	 * @param httpMethod the request method
	 * @param headers    the request headers
	 * @return {@code true} if the request is a valid Server-Sent Event request
	 */
	@NonNull
	public Boolean checkRequest(@Nullable String httpMethod,
															@Nullable Map<@Nullable String, @Nullable Set<@Nullable String>> headers) {
		Boolean valid = isValidRequest(httpMethod, headers);

		if (!valid)
			safelyLog(LogEvent.with(LogEventType.SERVER_SENT_EVENT_INVALID_REQUEST,
					format("Request does not look like a Server-Sent Event request (method %s, Accept %s)", httpMethod,
							headers == null ? null : Utilities.headerValues(headers, "Accept"))).build());

		return valid;
	}

	/**
	 * Performs {@link #isValidResponse(Map)}, emitting a {@link LogEventType#SERVER_SENT_EVENT_INVALID_RESPONSE} log event on failure.
	 *
	 * @param headers the response headers
	 * @return {@code true} if the response is a valid Server-Sent Event response
	 */
	@NonNull
	public Boolean checkResponse(@Nullable Map<@Nullable String, @Nullable Set<@Nullable String>> headers) {
		Boolean valid = isValidResponse(headers);

		if (!valid)
			safelyLog(LogEvent.with(LogEventType.SERVER_SENT_EVENT_INVALID_RESPONSE,
					format("Response does not look like a Server-Sent Event response (Content-Type %s, Cache-Control %s)",
							headers == null ? null : Utilities.headerValues(headers, "Content-Type"),
							headers == null ? null : Utilities.headerValues(headers, "Cache-Control"))).build());

		return valid;
	}

	@NonNull
	public LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}

	@NonNull
	private static Boolean anyHeaderValueContains(@NonNull Map<@Nullable String, @Nullable Set<@Nullable String>> headers,
																								@NonNull String headerName,
																								@NonNull String fragment) {
		requireNonNull(headers);
		requireNonNull(headerName);
		requireNonNull(fragment);

		String lowercaseFragment = fragment.toLowerCase(Locale.ROOT);

		for (String headerValue : Utilities.headerValues(headers, headerName))
			if (headerValue.toLowerCase(Locale.ROOT).contains(lowercaseFragment))
				return true;

		return false;
	}

	private void safelyLog(@NonNull LogEvent logEvent) {
		requireNonNull(logEvent);

		try {
			getLifecycleObserver().didReceiveLogEvent(logEvent);
		} catch (Throwable throwable) {
			// The observer itself failed; not much else we can do here but dump to stderr
			throwable.printStackTrace(System.err);
		}
	}
}
