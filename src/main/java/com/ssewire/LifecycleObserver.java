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

/**
 * Read-only hooks into the lifecycle of Server-Sent Event connections managed by a {@link ServerSentEventRegistry}.
 * <p>
 * All methods are no-ops by default except {@link #didReceiveLogEvent(LogEvent)}, which forwards to SLF4J.
 * <p>
 * Implementations are invoked on whatever thread performed the triggering operation (registration, unicast, broadcast, shutdown),
 * so they must be threadsafe and should return quickly. Exceptions thrown by observer methods are caught and reported
 * via {@link #didReceiveLogEvent(LogEvent)}; they never affect delivery.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface LifecycleObserver {
	/**
	 * Called after a connection has been registered and is eligible to receive events.
	 *
	 * @param serverSentEventConnection the connection that was registered
	 */
	default void didRegisterConnection(@NonNull ServerSentEventConnection serverSentEventConnection) {
		// No-op by default
	}

	/**
	 * Called after a connection has been removed from its registry.
	 *
	 * @param serverSentEventConnection the connection that was unregistered
	 * @param terminationReason         why the connection was unregistered
	 */
	default void didUnregisterConnection(@NonNull ServerSentEventConnection serverSentEventConnection,
																			 ServerSentEventConnection.@NonNull TerminationReason terminationReason) {
		// No-op by default
	}

	/**
	 * Called after an event's frame has been handed to the transport.
	 *
	 * @param connectionId    the connection the event was written to
	 * @param serverSentEvent the event that was written
	 */
	default void didWriteServerSentEvent(@NonNull Long connectionId,
																			 @NonNull ServerSentEvent serverSentEvent) {
		// No-op by default
	}

	/**
	 * Called after an event could not be written, which closes the connection.
	 *
	 * @param connectionId    the connection the event was destined for
	 * @param serverSentEvent the event that was not written
	 * @param throwable       the failure cause, or {@code null} if the transport simply reported failure
	 */
	default void didFailToWriteServerSentEvent(@NonNull Long connectionId,
																						 @NonNull ServerSentEvent serverSentEvent,
																						 @Nullable Throwable throwable) {
		// No-op by default
	}

	/**
	 * Called after a comment's frame has been handed to the transport.
	 *
	 * @param connectionId           the connection the comment was written to
	 * @param serverSentEventComment the comment that was written
	 */
	default void didWriteServerSentEventComment(@NonNull Long connectionId,
																							@NonNull ServerSentEventComment serverSentEventComment) {
		// No-op by default
	}

	/**
	 * Called after a comment could not be written, which closes the connection.
	 *
	 * @param connectionId           the connection the comment was destined for
	 * @param serverSentEventComment the comment that was not written
	 * @param throwable              the failure cause, or {@code null} if the transport simply reported failure
	 */
	default void didFailToWriteServerSentEventComment(@NonNull Long connectionId,
																										@NonNull ServerSentEventComment serverSentEventComment,
																										@Nullable Throwable throwable) {
		// No-op by default
	}

	/**
	 * Called after a broadcast has been attempted against a snapshot of registered connections.
	 *
	 * @param attemptedCount how many connections were in the snapshot
	 * @param deliveredCount how many of them accepted the payload
	 */
	default void didBroadcast(@NonNull Long attemptedCount,
														@NonNull Long deliveredCount) {
		// No-op by default
	}

	/**
	 * Called when SSEWire emits a log event.
	 * <p>
	 * By default, log events are written to SLF4J under the {@code com.ssewire} logger hierarchy.
	 *
	 * @param logEvent the log event
	 */
	default void didReceiveLogEvent(@NonNull LogEvent logEvent) {
		DefaultLifecycleObserver.logToSlf4j(logEvent);
	}

	/**
	 * Acquires a threadsafe {@link LifecycleObserver} instance with sensible defaults.
	 *
	 * @return a {@code LifecycleObserver} with default settings
	 */
	@NonNull
	static LifecycleObserver defaultInstance() {
		return DefaultLifecycleObserver.defaultInstance();
	}
}
