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

import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Tracks every open Server-Sent Event connection and delivers events to one or all of them.
 * <p>
 * Connection identifiers are assigned at registration, starting at {@code 1} and increasing monotonically;
 * {@link #NO_CONNECTION_ID} ({@code 0}) signals that registration did not happen.
 * <p>
 * Delivery is at-most-once. A connection whose write fails is closed and unregistered immediately and is never retried.
 * Broadcasts write to a snapshot of the registered connections taken under a short-held lock, so a slow peer never blocks
 * registration of new peers or delivery to others.
 * <p>
 * For example:
 * <pre>{@code  ServerSentEventRegistry registry = ServerSentEventRegistry.withDefaults();
 *
 * Long connectionId = registry.register(ServerSentEventTransport.forOutputStream(responseOutputStream));
 * registry.sendToClient(connectionId, ServerSentEvent.withEvent("welcome").data("hi").build());
 *
 * Long deliveredCount = registry.broadcast(ServerSentEvent.withData("tick").build());
 *
 * registry.shutdown();}</pre>
 * <p>
 * Implementations must be threadsafe.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface ServerSentEventRegistry extends ServerSentEventBroadcaster {
	/**
	 * The identifier returned when registration is refused.
	 */
	@NonNull
	Long NO_CONNECTION_ID = 0L;

	/**
	 * Registers a transport, sending the configured preamble (if any) before it becomes eligible for delivery.
	 *
	 * @param transport the transport to take ownership of
	 * @return the new connection's identifier, or {@link #NO_CONNECTION_ID} if the transport is {@code null}, the registry
	 * has been shut down, or the preamble could not be sent
	 */
	@NonNull
	Long register(@Nullable ServerSentEventTransport transport);

	/**
	 * Sends an event to a single connection.
	 *
	 * @param connectionId    the target connection
	 * @param serverSentEvent the event to send
	 * @return {@code true} if the connection accepted the event, {@code false} if it is unknown or the write failed
	 */
	@NonNull
	Boolean sendToClient(@NonNull Long connectionId,
											 @NonNull ServerSentEvent serverSentEvent);

	/**
	 * Sends several events to a single connection as one write, so nothing else can be interleaved between them.
	 *
	 * @param connectionId     the target connection
	 * @param serverSentEvents the events to send, in wire order
	 * @return {@code true} if the connection accepted the events, {@code false} if it is unknown or the write failed
	 */
	@NonNull
	Boolean sendEventsToClient(@NonNull Long connectionId,
														 @NonNull List<@NonNull ServerSentEvent> serverSentEvents);

	/**
	 * Sends a comment to a single connection.
	 *
	 * @param connectionId           the target connection
	 * @param serverSentEventComment the comment to send
	 * @return {@code true} if the connection accepted the comment, {@code false} if it is unknown or the write failed
	 */
	@NonNull
	Boolean sendCommentToClient(@NonNull Long connectionId,
															@NonNull ServerSentEventComment serverSentEventComment);

	/**
	 * Sends an event to every registered connection.
	 *
	 * @param serverSentEvent the event to send
	 * @return the number of connections that accepted the event
	 */
	@NonNull
	default Long broadcast(@NonNull ServerSentEvent serverSentEvent) {
		requireNonNull(serverSentEvent);
		return broadcastEvent(serverSentEvent);
	}

	/**
	 * Acquires a unicaster bound to a single connection.
	 *
	 * @param connectionId the target connection
	 * @return a unicaster, or {@link Optional#empty()} if no such connection is registered
	 */
	@NonNull
	Optional<ServerSentEventUnicaster> acquireUnicaster(@NonNull Long connectionId);

	/**
	 * Closes a connection and unregisters it. Closing an unknown or already-closed connection has no effect.
	 *
	 * @param connectionId the connection to close
	 * @return {@code true} if this call unregistered the connection
	 */
	@NonNull
	Boolean close(@NonNull Long connectionId);

	/**
	 * Unregisters and closes every connection. Afterwards, registration returns {@link #NO_CONNECTION_ID} and sends return {@code false}.
	 * <p>
	 * Calling this more than once has no additional effect.
	 */
	void shutdown();

	@NonNull
	Optional<ServerSentEventConnection> getConnection(@NonNull Long connectionId);

	/**
	 * Identifiers of all currently registered connections, in no particular order.
	 *
	 * @return a snapshot of registered connection identifiers
	 */
	@NonNull
	List<@NonNull Long> getConnectionIds();

	@NonNull
	Long getConnectionCount();

	@NonNull
	Boolean isShutdown();

	@NonNull
	@Override
	default Long getClientCount() {
		return getConnectionCount();
	}

	/**
	 * Acquires a registry with the given configuration.
	 *
	 * @param serverSentEventConfig the configuration
	 * @return a new registry
	 */
	@NonNull
	static ServerSentEventRegistry withConfig(@NonNull ServerSentEventConfig serverSentEventConfig) {
		requireNonNull(serverSentEventConfig);
		return new DefaultServerSentEventRegistry(serverSentEventConfig);
	}

	/**
	 * Acquires a registry with default configuration.
	 *
	 * @return a new registry
	 */
	@NonNull
	static ServerSentEventRegistry withDefaults() {
		return withConfig(ServerSentEventConfig.withDefaults().build());
	}
}
