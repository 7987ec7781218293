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
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Serializes writes of Server-Sent Event frames to a single {@link ServerSentEventTransport}.
 * <p>
 * A writer starts out open and closes exactly once, never to reopen. It closes when {@link #close()} is called, or when
 * encoding or sending a frame fails; either way the transport is closed too. Writes against a closed writer return
 * {@code false} and have no side effects.
 * <p>
 * All operations may be called from any thread. A per-writer lock guarantees that frames never interleave on the wire
 * and that the open check and the write it guards happen atomically. Because the lock is held for the duration of a
 * transport send, a slow peer only ever blocks callers writing to that same peer.
 * <p>
 * If a {@link ServerSentEventPreamble} is configured, it is sent exactly once, before the first frame.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class ServerSentEventConnectionWriter {
	@NonNull
	private final Long connectionId;
	@NonNull
	private final ServerSentEventTransport transport;
	@NonNull
	private final ServerSentEventEncoder encoder;
	@Nullable
	private final ServerSentEventPreamble preamble;
	@NonNull
	private final LifecycleObserver lifecycleObserver;
	@NonNull
	private final ReentrantLock lock;
	@NonNull
	private final AtomicBoolean open;
	// Guarded by lock
	private boolean preambleSent;

	private record WriteResult(@NonNull Boolean attempted,
														 @NonNull Boolean written,
														 @Nullable Throwable throwable) {
		@NonNull
		static WriteResult notAttempted() {
			return new WriteResult(false, false, null);
		}

		@NonNull
		static WriteResult succeeded() {
			return new WriteResult(true, true, null);
		}

		@NonNull
		static WriteResult failed(@Nullable Throwable throwable) {
			return new WriteResult(true, false, throwable);
		}
	}

	/**
	 * Acquires a builder for a writer that owns the given transport.
	 *
	 * @param connectionId the identifier reported in lifecycle callbacks and log events
	 * @param transport    the transport to write to; it must not be shared with any other writer
	 * @return the builder
	 */
	@NonNull
	public static Builder withTransport(@NonNull Long connectionId,
																			@NonNull ServerSentEventTransport transport) {
		requireNonNull(connectionId);
		requireNonNull(transport);

		return new Builder(connectionId, transport);
	}

	protected ServerSentEventConnectionWriter(@NonNull Builder builder) {
		requireNonNull(builder);

		this.connectionId = builder.connectionId;
		this.transport = builder.transport;
		this.encoder = builder.encoder == null ? ServerSentEventEncoder.defaultInstance() : builder.encoder;
		this.preamble = builder.preamble;
		this.lifecycleObserver = builder.lifecycleObserver == null ? LifecycleObserver.defaultInstance() : builder.lifecycleObserver;
		this.lock = new ReentrantLock();
		this.open = new AtomicBoolean(true);
		this.preambleSent = false;
	}

	/**
	 * Sends the configured preamble, if it has not been sent already.
	 * <p>
	 * Failure to send the preamble closes this writer.
	 *
	 * @return {@code true} if the preamble has been sent or none is configured, {@code false} if this writer is closed
	 */
	@NonNull
	public Boolean sendPreamble() {
		getLock().lock();

		try {
			if (!isOpen())
				return false;

			return sendPreambleUnderLock();
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Encodes and sends a single event.
	 *
	 * @param serverSentEvent the event to send
	 * @return {@code true} if the frame was handed to the transport, {@code false} if this writer is (or has now become) closed
	 */
	@NonNull
	public Boolean writeEvent(@NonNull ServerSentEvent serverSentEvent) {
		requireNonNull(serverSentEvent);

		WriteResult writeResult = write(() -> getEncoder().encodeEvent(serverSentEvent));

		if (writeResult.written()) {
			try {
				getLifecycleObserver().didWriteServerSentEvent(getConnectionId(), serverSentEvent);
			} catch (Throwable t) {
				safelyLog(LogEvent.with(LogEventType.LIFECYCLE_OBSERVER_DID_WRITE_SERVER_SENT_EVENT_FAILED,
								format("An exception occurred while invoking %s::didWriteServerSentEvent", LifecycleObserver.class.getSimpleName()))
						.throwable(t)
						.connectionId(getConnectionId())
						.build());
			}
		} else if (writeResult.attempted()) {
			notifyWriteFailure(serverSentEvent, writeResult.throwable());
		}

		return writeResult.written();
	}

	/**
	 * Encodes several events and sends them to the transport in a single call, so no other frame can land between them.
	 *
	 * @param serverSentEvents the events to send, in wire order
	 * @return {@code true} if the frames were handed to the transport, {@code false} if this writer is (or has now become) closed
	 */
	@NonNull
	public Boolean writeEvents(@NonNull List<@NonNull ServerSentEvent> serverSentEvents) {
		requireNonNull(serverSentEvents);

		if (serverSentEvents.isEmpty())
			return isOpen();

		WriteResult writeResult = write(() -> getEncoder().encodeEvents(serverSentEvents));

		for (ServerSentEvent serverSentEvent : serverSentEvents) {
			if (writeResult.written()) {
				try {
					getLifecycleObserver().didWriteServerSentEvent(getConnectionId(), serverSentEvent);
				} catch (Throwable t) {
					safelyLog(LogEvent.with(LogEventType.LIFECYCLE_OBSERVER_DID_WRITE_SERVER_SENT_EVENT_FAILED,
									format("An exception occurred while invoking %s::didWriteServerSentEvent", LifecycleObserver.class.getSimpleName()))
							.throwable(t)
							.connectionId(getConnectionId())
							.build());
				}
			} else if (writeResult.attempted()) {
				notifyWriteFailure(serverSentEvent, writeResult.throwable());
			}
		}

		return writeResult.written();
	}

	/**
	 * Encodes and sends a comment.
	 *
	 * @param serverSentEventComment the comment to send
	 * @return {@code true} if the frame was handed to the transport, {@code false} if this writer is (or has now become) closed
	 */
	@NonNull
	public Boolean writeComment(@NonNull ServerSentEventComment serverSentEventComment) {
		requireNonNull(serverSentEventComment);

		WriteResult writeResult = write(() -> getEncoder().encodeComment(serverSentEventComment));

		if (writeResult.written()) {
			try {
				getLifecycleObserver().didWriteServerSentEventComment(getConnectionId(), serverSentEventComment);
			} catch (Throwable t) {
				safelyLog(LogEvent.with(LogEventType.LIFECYCLE_OBSERVER_DID_WRITE_SERVER_SENT_EVENT_COMMENT_FAILED,
								format("An exception occurred while invoking %s::didWriteServerSentEventComment", LifecycleObserver.class.getSimpleName()))
						.throwable(t)
						.connectionId(getConnectionId())
						.build());
			}
		} else if (writeResult.attempted()) {
			try {
				getLifecycleObserver().didFailToWriteServerSentEventComment(getConnectionId(), serverSentEventComment, writeResult.throwable());
			} catch (Throwable t) {
				safelyLog(LogEvent.with(LogEventType.LIFECYCLE_OBSERVER_DID_FAIL_TO_WRITE_SERVER_SENT_EVENT_COMMENT_FAILED,
								format("An exception occurred while invoking %s::didFailToWriteServerSentEventComment", LifecycleObserver.class.getSimpleName()))
						.throwable(t)
						.connectionId(getConnectionId())
						.build());
			}
		}

		return writeResult.written();
	}

	/**
	 * Closes this writer and its transport.
	 *
	 * @return {@code true} if this call closed the writer, {@code false} if it was already closed
	 */
	@NonNull
	public Boolean close() {
		getLock().lock();

		try {
			return closeUnderLock();
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	public Boolean isOpen() {
		return this.open.get();
	}

	@NonNull
	public Boolean isPreambleSent() {
		getLock().lock();

		try {
			return this.preambleSent;
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	public Long getConnectionId() {
		return this.connectionId;
	}

	@NonNull
	public Optional<ServerSentEventPreamble> getPreamble() {
		return Optional.ofNullable(this.preamble);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{connectionId=%s, open=%s}", getClass().getSimpleName(), getConnectionId(), isOpen());
	}

	@NonNull
	private WriteResult write(@NonNull Supplier<byte[]> frameSupplier) {
		requireNonNull(frameSupplier);

		getLock().lock();

		try {
			if (!isOpen())
				return WriteResult.notAttempted();

			if (!sendPreambleUnderLock())
				return WriteResult.failed(null);

			byte[] frame;

			try {
				frame = frameSupplier.get();
			} catch (RuntimeException e) {
				safelyLog(LogEvent.with(LogEventType.SERVER_SENT_EVENT_ENCODING_FAILED, "Unable to encode Server-Sent Event frame")
						.throwable(e)
						.connectionId(getConnectionId())
						.build());

				closeUnderLock();
				return WriteResult.failed(e);
			}

			Throwable sendThrowable = null;
			boolean sent;

			try {
				sent = Boolean.TRUE.equals(getTransport().send(frame));
			} catch (RuntimeException e) {
				sent = false;
				sendThrowable = e;
			}

			if (!sent) {
				safelyLog(LogEvent.with(LogEventType.SERVER_SENT_EVENT_TRANSPORT_SEND_FAILED,
								format("Unable to send %d bytes to Server-Sent Event transport, closing connection", frame.length))
						.throwable(sendThrowable)
						.connectionId(getConnectionId())
						.build());

				closeUnderLock();
				return WriteResult.failed(sendThrowable);
			}

			return WriteResult.succeeded();
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	private Boolean sendPreambleUnderLock() {
		if (this.preambleSent || this.preamble == null)
			return true;

		Throwable throwable = null;
		boolean sent;

		try {
			sent = Boolean.TRUE.equals(getTransport().send(this.preamble.toBytes()));
		} catch (RuntimeException e) {
			sent = false;
			throwable = e;
		}

		if (!sent) {
			safelyLog(LogEvent.with(LogEventType.SERVER_SENT_EVENT_PREAMBLE_FAILED, "Unable to send Server-Sent Event preamble, closing connection")
					.throwable(throwable)
					.connectionId(getConnectionId())
					.build());

			closeUnderLock();
			return false;
		}

		this.preambleSent = true;
		return true;
	}

	@NonNull
	private Boolean closeUnderLock() {
		if (!this.open.compareAndSet(true, false))
			return false;

		try {
			getTransport().close();
		} catch (RuntimeException e) {
			safelyLog(LogEvent.with(LogEventType.SERVER_SENT_EVENT_TRANSPORT_CLOSE_FAILED, "Unable to close Server-Sent Event transport")
					.throwable(e)
					.connectionId(getConnectionId())
					.build());
		}

		return true;
	}

	private void notifyWriteFailure(@NonNull ServerSentEvent serverSentEvent,
																	@Nullable Throwable throwable) {
		requireNonNull(serverSentEvent);

		try {
			getLifecycleObserver().didFailToWriteServerSentEvent(getConnectionId(), serverSentEvent, throwable);
		} catch (Throwable t) {
			safelyLog(LogEvent.with(LogEventType.LIFECYCLE_OBSERVER_DID_FAIL_TO_WRITE_SERVER_SENT_EVENT_FAILED,
							format("An exception occurred while invoking %s::didFailToWriteServerSentEvent", LifecycleObserver.class.getSimpleName()))
					.throwable(t)
					.connectionId(getConnectionId())
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
	private ServerSentEventTransport getTransport() {
		return this.transport;
	}

	@NonNull
	private ServerSentEventEncoder getEncoder() {
		return this.encoder;
	}

	@NonNull
	private LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}

	@NonNull
	private ReentrantLock getLock() {
		return this.lock;
	}

	/**
	 * Builder used to construct instances of {@link ServerSentEventConnectionWriter} via {@link ServerSentEventConnectionWriter#withTransport(Long, ServerSentEventTransport)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final Long connectionId;
		@NonNull
		private final ServerSentEventTransport transport;
		@Nullable
		private ServerSentEventEncoder encoder;
		@Nullable
		private ServerSentEventPreamble preamble;
		@Nullable
		private LifecycleObserver lifecycleObserver;

		protected Builder(@NonNull Long connectionId,
											@NonNull ServerSentEventTransport transport) {
			requireNonNull(connectionId);
			requireNonNull(transport);

			this.connectionId = connectionId;
			this.transport = transport;
		}

		@NonNull
		public Builder encoder(@Nullable ServerSentEventEncoder encoder) {
			this.encoder = encoder;
			return this;
		}

		@NonNull
		public Builder preamble(@Nullable ServerSentEventPreamble preamble) {
			this.preamble = preamble;
			return this;
		}

		@NonNull
		public Builder lifecycleObserver(@Nullable LifecycleObserver lifecycleObserver) {
			this.lifecycleObserver = lifecycleObserver;
			return this;
		}

		@NonNull
		public ServerSentEventConnectionWriter build() {
			return new ServerSentEventConnectionWriter(this);
		}
	}
}
