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
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Reads a Server-Sent Event stream to its end, handing each decoded event to a {@link ServerSentEventListener}.
 * <p>
 * Reading continues until one of the following, each reported as a {@link ServerSentEventStreamResult}:
 * <ul>
 *   <li>the source reaches end-of-stream ({@link ServerSentEventStreamResult.Completed}) - any trailing frame without a terminating blank line is still delivered</li>
 *   <li>the listener returns {@code false} ({@link ServerSentEventStreamResult.Stopped})</li>
 *   <li>a single read waits longer than the read timeout ({@link ServerSentEventStreamResult.TimedOut})</li>
 *   <li>the source fails or the listener throws ({@link ServerSentEventStreamResult.Failed})</li>
 * </ul>
 * <p>
 * Degenerate events (such as those produced by heartbeat comments) are not delivered unless
 * {@link Builder#deliverEmptyEvents(Boolean)} is enabled.
 * <p>
 * The reader does not close the source; that's the caller's responsibility.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class ServerSentEventStreamReader {
	@NonNull
	private final Boolean deliverEmptyEvents;
	@NonNull
	private final LifecycleObserver lifecycleObserver;

	/**
	 * Acquires a builder for {@link ServerSentEventStreamReader} instances.
	 *
	 * @return the builder
	 */
	@NonNull
	public static Builder withDefaults() {
		return new Builder();
	}

	protected ServerSentEventStreamReader(@NonNull Builder builder) {
		requireNonNull(builder);

		this.deliverEmptyEvents = builder.deliverEmptyEvents == null ? false : builder.deliverEmptyEvents;
		this.lifecycleObserver = builder.lifecycleObserver == null ? LifecycleObserver.defaultInstance() : builder.lifecycleObserver;
	}

	/**
	 * Reads the source until the stream ends, the listener stops, a read times out, or an error occurs.
	 *
	 * @param source      the stream to read
	 * @param readTimeout the longest to wait for any single read
	 * @param listener    receives each decoded event
	 * @return how the stream ended
	 */
	@NonNull
	public ServerSentEventStreamResult read(@NonNull ServerSentEventSource source,
																					@NonNull Duration readTimeout,
																					@NonNull ServerSentEventListener listener) {
		requireNonNull(source);
		requireNonNull(readTimeout);
		requireNonNull(listener);

		if (readTimeout.isNegative() || readTimeout.isZero())
			throw new IllegalArgumentException(format("Read timeout must be positive. You supplied %s", readTimeout));

		ServerSentEventDecoder decoder = ServerSentEventDecoder.withDefaults();
		ReadProgress readProgress = new ReadProgress();

		while (true) {
			Optional<byte[]> bytes;

			try {
				bytes = source.read(readTimeout);
			} catch (SocketTimeoutException e) {
				safelyLog(LogEvent.with(LogEventType.SERVER_SENT_EVENT_STREAM_READ_FAILED,
								format("No Server-Sent Event bytes arrived within %s", readTimeout))
						.throwable(e)
						.build());

				return new ServerSentEventStreamResult.TimedOut(readProgress.eventCount, e);
			} catch (IOException e) {
				safelyLog(LogEvent.with(LogEventType.SERVER_SENT_EVENT_STREAM_READ_FAILED, "Unable to read Server-Sent Event stream")
						.throwable(e)
						.build());

				return new ServerSentEventStreamResult.Failed(readProgress.eventCount, e);
			}

			// End of stream: flush whatever partial frame remains
			if (bytes.isEmpty()) {
				ServerSentEventStreamResult result = deliver(decoder.finish(), listener, readProgress);
				return result == null ? new ServerSentEventStreamResult.Completed(readProgress.eventCount) : result;
			}

			ServerSentEventStreamResult result = deliver(decoder.decode(bytes.get()), listener, readProgress);

			if (result != null)
				return result;
		}
	}

	@NonNull
	public Boolean getDeliverEmptyEvents() {
		return this.deliverEmptyEvents;
	}

	@NonNull
	public LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}

	// Returns a terminal result if delivery should stop, null to keep reading
	@Nullable
	private ServerSentEventStreamResult deliver(@NonNull List<@NonNull ServerSentEvent> serverSentEvents,
																							@NonNull ServerSentEventListener listener,
																							@NonNull ReadProgress readProgress) {
		requireNonNull(serverSentEvents);
		requireNonNull(listener);
		requireNonNull(readProgress);

		for (ServerSentEvent serverSentEvent : serverSentEvents) {
			if (serverSentEvent.isEmpty() && !getDeliverEmptyEvents())
				continue;

			Boolean keepReading;

			try {
				keepReading = listener.onEvent(serverSentEvent);
			} catch (RuntimeException e) {
				safelyLog(LogEvent.with(LogEventType.SERVER_SENT_EVENT_LISTENER_FAILED,
								format("An exception occurred while invoking %s::onEvent", ServerSentEventListener.class.getSimpleName()))
						.throwable(e)
						.build());

				return new ServerSentEventStreamResult.Failed(readProgress.eventCount, e);
			}

			++readProgress.eventCount;

			if (!Boolean.TRUE.equals(keepReading))
				return new ServerSentEventStreamResult.Stopped(readProgress.eventCount);
		}

		return null;
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

	@NotThreadSafe
	private static final class ReadProgress {
		private long eventCount;
	}

	/**
	 * Builder used to construct instances of {@link ServerSentEventStreamReader} via {@link ServerSentEventStreamReader#withDefaults()}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@Nullable
		private Boolean deliverEmptyEvents;
		@Nullable
		private LifecycleObserver lifecycleObserver;

		protected Builder() {
			// Nothing to do
		}

		/**
		 * Should degenerate events (no id, event, data, or retry) be handed to listeners? Defaults to {@code false}.
		 *
		 * @param deliverEmptyEvents whether to deliver degenerate events
		 * @return this builder
		 */
		@NonNull
		public Builder deliverEmptyEvents(@Nullable Boolean deliverEmptyEvents) {
			this.deliverEmptyEvents = deliverEmptyEvents;
			return this;
		}

		@NonNull
		public Builder lifecycleObserver(@Nullable LifecycleObserver lifecycleObserver) {
			this.lifecycleObserver = lifecycleObserver;
			return this;
		}

		@NonNull
		public ServerSentEventStreamReader build() {
			return new ServerSentEventStreamReader(this);
		}
	}
}
