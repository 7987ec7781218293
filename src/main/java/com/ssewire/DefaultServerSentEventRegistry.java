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
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class DefaultServerSentEventRegistry implements ServerSentEventRegistry {
	@NonNull
	private final ServerSentEventConfig serverSentEventConfig;
	// Guarded by lock
	@NonNull
	private final Map<@NonNull Long, @NonNull ServerSentEventConnection> connectionsById;
	@NonNull
	private final AtomicLong connectionIdGenerator;
	@NonNull
	private final ReentrantLock lock;
	// Guarded by lock
	private boolean shutdown;

	DefaultServerSentEventRegistry(@NonNull ServerSentEventConfig serverSentEventConfig) {
		requireNonNull(serverSentEventConfig);

		this.serverSentEventConfig = serverSentEventConfig;
		this.connectionsById = new HashMap<>();
		this.connectionIdGenerator = new AtomicLong(1);
		this.lock = new ReentrantLock();
		this.shutdown = false;
	}

	@NonNull
	@Override
	public Long register(@Nullable ServerSentEventTransport transport) {
		if (transport == null)
			return NO_CONNECTION_ID;

		if (isShutdown()) {
			safelyLog(LogEvent.with(LogEventType.SERVER_SENT_EVENT_REGISTRY_SHUT_DOWN, "Refusing to register transport; registry has been shut down").build());
			return NO_CONNECTION_ID;
		}

		Long connectionId = getConnectionIdGenerator().getAndIncrement();

		ServerSentEventConnectionWriter writer = ServerSentEventConnectionWriter.withTransport(connectionId, transport)
				.encoder(getServerSentEventConfig().getEncoder())
				.preamble(getServerSentEventConfig().getPreamble().orElse(null))
				.lifecycleObserver(getLifecycleObserver())
				.build();

		// Preamble goes out before the connection is visible to broadcasts.
		// On failure the writer has already closed the transport and logged the problem.
		if (!writer.sendPreamble())
			return NO_CONNECTION_ID;

		ServerSentEventConnection connection = new ServerSentEventConnection(connectionId, Instant.now(), writer);
		boolean registered;

		getLock().lock();

		try {
			registered = !this.shutdown;

			if (registered)
				getConnectionsById().put(connectionId, connection);
		} finally {
			getLock().unlock();
		}

		// Shutdown happened while we were sending the preamble
		if (!registered) {
			writer.close();
			safelyLog(LogEvent.with(LogEventType.SERVER_SENT_EVENT_REGISTRY_SHUT_DOWN, "Refusing to register transport; registry has been shut down")
					.connectionId(connectionId)
					.build());
			return NO_CONNECTION_ID;
		}

		try {
			getLifecycleObserver().didRegisterConnection(connection);
		} catch (Throwable t) {
			safelyLog(LogEvent.with(LogEventType.LIFECYCLE_OBSERVER_DID_REGISTER_CONNECTION_FAILED,
							format("An exception occurred while invoking %s::didRegisterConnection", LifecycleObserver.class.getSimpleName()))
					.throwable(t)
					.connectionId(connectionId)
					.build());
		}

		return connectionId;
	}

	@NonNull
	@Override
	public Boolean sendToClient(@NonNull Long connectionId,
															@NonNull ServerSentEvent serverSentEvent) {
		requireNonNull(connectionId);
		requireNonNull(serverSentEvent);

		return unicast(connectionId, writer -> writer.writeEvent(serverSentEvent));
	}

	@NonNull
	@Override
	public Boolean sendEventsToClient(@NonNull Long connectionId,
																		@NonNull List<@NonNull ServerSentEvent> serverSentEvents) {
		requireNonNull(connectionId);
		requireNonNull(serverSentEvents);

		return unicast(connectionId, writer -> writer.writeEvents(serverSentEvents));
	}

	@NonNull
	@Override
	public Boolean sendCommentToClient(@NonNull Long connectionId,
																		 @NonNull ServerSentEventComment serverSentEventComment) {
		requireNonNull(connectionId);
		requireNonNull(serverSentEventComment);

		return unicast(connectionId, writer -> writer.writeComment(serverSentEventComment));
	}

	@NonNull
	@Override
	public Long broadcastEvent(@NonNull ServerSentEvent serverSentEvent) {
		requireNonNull(serverSentEvent);
		return broadcastToAll(writer -> writer.writeEvent(serverSentEvent));
	}

	@NonNull
	@Override
	public Long broadcastComment(@NonNull ServerSentEventComment serverSentEventComment) {
		requireNonNull(serverSentEventComment);
		return broadcastToAll(writer -> writer.writeComment(serverSentEventComment));
	}

	@NonNull
	@Override
	public Optional<ServerSentEventUnicaster> acquireUnicaster(@NonNull Long connectionId) {
		requireNonNull(connectionId);

		if (getConnection(connectionId).isEmpty())
			return Optional.empty();

		return Optional.of(new DefaultServerSentEventUnicaster(connectionId, this));
	}

	@NonNull
	@Override
	public Boolean close(@NonNull Long connectionId) {
		requireNonNull(connectionId);

		ServerSentEventConnection connection;

		getLock().lock();

		try {
			connection = getConnectionsById().remove(connectionId);
		} finally {
			getLock().unlock();
		}

		if (connection == null)
			return false;

		connection.getWriter().close();
		notifyUnregistered(connection, ServerSentEventConnection.TerminationReason.CLOSED);

		return true;
	}

	@Override
	public void shutdown() {
		List<ServerSentEventConnection> connectionsSnapshot;

		getLock().lock();

		try {
			if (this.shutdown)
				return;

			this.shutdown = true;

			connectionsSnapshot = new ArrayList<>(getConnectionsById().values());
			getConnectionsById().clear();
		} finally {
			getLock().unlock();
		}

		// Close outside the lock; one misbehaving transport must not prevent the rest from closing
		for (ServerSentEventConnection connection : connectionsSnapshot) {
			try {
				connection.getWriter().close();
			} catch (Throwable t) {
				safelyLog(LogEvent.with(LogEventType.SERVER_SENT_EVENT_TRANSPORT_CLOSE_FAILED, "Unable to close Server-Sent Event connection during shutdown")
						.throwable(t)
						.connectionId(connection.getId())
						.build());
			}

			notifyUnregistered(connection, ServerSentEventConnection.TerminationReason.REGISTRY_SHUTDOWN);
		}
	}

	@NonNull
	@Override
	public Optional<ServerSentEventConnection> getConnection(@NonNull Long connectionId) {
		requireNonNull(connectionId);

		getLock().lock();

		try {
			return Optional.ofNullable(getConnectionsById().get(connectionId));
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	@Override
	public List<@NonNull Long> getConnectionIds() {
		getLock().lock();

		try {
			return new ArrayList<>(getConnectionsById().keySet());
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	@Override
	public Long getConnectionCount() {
		getLock().lock();

		try {
			return (long) getConnectionsById().size();
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	@Override
	public Boolean isShutdown() {
		getLock().lock();

		try {
			return this.shutdown;
		} finally {
			getLock().unlock();
		}
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{connectionCount=%s, shutdown=%s}", getClass().getSimpleName(), getConnectionCount(), isShutdown());
	}

	@NonNull
	private Boolean unicast(@NonNull Long connectionId,
													@NonNull Function<ServerSentEventConnectionWriter, Boolean> writeFunction) {
		requireNonNull(connectionId);
		requireNonNull(writeFunction);

		ServerSentEventConnection connection = getConnection(connectionId).orElse(null);

		if (connection == null)
			return false;

		// Write outside the registry lock; the writer serializes access to its own transport
		Boolean written = writeFunction.apply(connection.getWriter());

		if (!written)
			unregister(connection, ServerSentEventConnection.TerminationReason.WRITE_FAILED);

		return written;
	}

	@NonNull
	private Long broadcastToAll(@NonNull Function<ServerSentEventConnectionWriter, Boolean> writeFunction) {
		requireNonNull(writeFunction);

		List<ServerSentEventConnection> connectionsSnapshot;

		getLock().lock();

		try {
			connectionsSnapshot = new ArrayList<>(getConnectionsById().values());
		} finally {
			getLock().unlock();
		}

		long deliveredCount = 0;

		for (ServerSentEventConnection connection : connectionsSnapshot) {
			if (writeFunction.apply(connection.getWriter()))
				++deliveredCount;
			else
				unregister(connection, ServerSentEventConnection.TerminationReason.WRITE_FAILED);
		}

		try {
			getLifecycleObserver().didBroadcast((long) connectionsSnapshot.size(), deliveredCount);
		} catch (Throwable t) {
			safelyLog(LogEvent.with(LogEventType.LIFECYCLE_OBSERVER_DID_BROADCAST_FAILED,
							format("An exception occurred while invoking %s::didBroadcast", LifecycleObserver.class.getSimpleName()))
					.throwable(t)
					.build());
		}

		return deliveredCount;
	}

	private void unregister(@NonNull ServerSentEventConnection connection,
													ServerSentEventConnection.@NonNull TerminationReason terminationReason) {
		requireNonNull(connection);
		requireNonNull(terminationReason);

		boolean removed;

		getLock().lock();

		try {
			// Only remove the exact connection we failed to write to
			removed = getConnectionsById().remove(connection.getId(), connection);
		} finally {
			getLock().unlock();
		}

		if (!removed)
			return;

		// Normally a no-op since failed writes close the writer, but keeps the open/registered states consistent
		connection.getWriter().close();
		notifyUnregistered(connection, terminationReason);
	}

	private void notifyUnregistered(@NonNull ServerSentEventConnection connection,
																	ServerSentEventConnection.@NonNull TerminationReason terminationReason) {
		requireNonNull(connection);
		requireNonNull(terminationReason);

		try {
			getLifecycleObserver().didUnregisterConnection(connection, terminationReason);
		} catch (Throwable t) {
			safelyLog(LogEvent.with(LogEventType.LIFECYCLE_OBSERVER_DID_UNREGISTER_CONNECTION_FAILED,
							format("An exception occurred while invoking %s::didUnregisterConnection", LifecycleObserver.class.getSimpleName()))
					.throwable(t)
					.connectionId(connection.getId())
					.build());
		}
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
	private ServerSentEventConfig getServerSentEventConfig() {
		return this.serverSentEventConfig;
	}

	@NonNull
	private LifecycleObserver getLifecycleObserver() {
		return getServerSentEventConfig().getLifecycleObserver();
	}

	@NonNull
	private Map<@NonNull Long, @NonNull ServerSentEventConnection> getConnectionsById() {
		return this.connectionsById;
	}

	@NonNull
	private AtomicLong getConnectionIdGenerator() {
		return this.connectionIdGenerator;
	}

	@NonNull
	private ReentrantLock getLock() {
		return this.lock;
	}

	@ThreadSafe
	private static final class DefaultServerSentEventUnicaster implements ServerSentEventUnicaster {
		@NonNull
		private final Long connectionId;
		@NonNull
		private final ServerSentEventRegistry serverSentEventRegistry;

		private DefaultServerSentEventUnicaster(@NonNull Long connectionId,
																						@NonNull ServerSentEventRegistry serverSentEventRegistry) {
			requireNonNull(connectionId);
			requireNonNull(serverSentEventRegistry);

			this.connectionId = connectionId;
			this.serverSentEventRegistry = serverSentEventRegistry;
		}

		@NonNull
		@Override
		public Boolean unicastEvent(@NonNull ServerSentEvent serverSentEvent) {
			requireNonNull(serverSentEvent);
			return this.serverSentEventRegistry.sendToClient(getConnectionId(), serverSentEvent);
		}

		@NonNull
		@Override
		public Boolean unicastComment(@NonNull ServerSentEventComment serverSentEventComment) {
			requireNonNull(serverSentEventComment);
			return this.serverSentEventRegistry.sendCommentToClient(getConnectionId(), serverSentEventComment);
		}

		@NonNull
		@Override
		public Long getConnectionId() {
			return this.connectionId;
		}

		@Override
		@NonNull
		public String toString() {
			return format("%s{connectionId=%s}", getClass().getSimpleName(), getConnectionId());
		}
	}
}
