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

import static java.util.Objects.requireNonNull;

/**
 * How a client-side Server-Sent Event stream ended.
 * <p>
 * Every variant reports how many events were delivered to the listener before the stream ended.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public sealed interface ServerSentEventStreamResult permits ServerSentEventStreamResult.Completed,
		ServerSentEventStreamResult.Stopped, ServerSentEventStreamResult.TimedOut, ServerSentEventStreamResult.Failed {
	/**
	 * How many events were delivered to the listener.
	 *
	 * @return the delivered event count
	 */
	@NonNull
	Long getEventCount();

	/**
	 * The peer ended the stream.
	 *
	 * @param eventCount how many events were delivered
	 */
	record Completed(@NonNull Long eventCount) implements ServerSentEventStreamResult {
		public Completed {
			requireNonNull(eventCount);
		}

		@NonNull
		@Override
		public Long getEventCount() {
			return eventCount();
		}
	}

	/**
	 * The listener asked to stop reading.
	 *
	 * @param eventCount how many events were delivered, including the one whose handling requested the stop
	 */
	record Stopped(@NonNull Long eventCount) implements ServerSentEventStreamResult {
		public Stopped {
			requireNonNull(eventCount);
		}

		@NonNull
		@Override
		public Long getEventCount() {
			return eventCount();
		}
	}

	/**
	 * No bytes arrived within the read timeout.
	 *
	 * @param eventCount how many events were delivered
	 * @param cause      the timeout exception
	 */
	record TimedOut(@NonNull Long eventCount,
									@NonNull Throwable cause) implements ServerSentEventStreamResult {
		public TimedOut {
			requireNonNull(eventCount);
			requireNonNull(cause);
		}

		@NonNull
		@Override
		public Long getEventCount() {
			return eventCount();
		}
	}

	/**
	 * The stream could not be read, the peer rejected the request, or the listener threw.
	 *
	 * @param eventCount how many events were delivered
	 * @param cause      the failure
	 */
	record Failed(@NonNull Long eventCount,
								@NonNull Throwable cause) implements ServerSentEventStreamResult {
		public Failed {
			requireNonNull(eventCount);
			requireNonNull(cause);
		}

		@NonNull
		@Override
		public Long getEventCount() {
			return eventCount();
		}
	}
}
