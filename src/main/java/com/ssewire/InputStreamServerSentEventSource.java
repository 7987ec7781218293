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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class InputStreamServerSentEventSource implements ServerSentEventSource {
	@NonNull
	private static final Logger LOGGER;
	@NonNull
	private static final Integer READ_BUFFER_SIZE;
	@NonNull
	private static final Integer QUEUE_CAPACITY;
	@NonNull
	private static final AtomicLong PUMP_THREAD_COUNTER;

	static {
		LOGGER = LoggerFactory.getLogger(InputStreamServerSentEventSource.class);
		READ_BUFFER_SIZE = 8_192;
		QUEUE_CAPACITY = 16;
		PUMP_THREAD_COUNTER = new AtomicLong(0);
	}

	@NonNull
	private final InputStream inputStream;
	@NonNull
	private final BlockingQueue<@NonNull Chunk> chunks;
	@NonNull
	private final AtomicBoolean closed;
	@NonNull
	private final Thread pumpThread;
	// Terminal chunk (end-of-stream or failure), replayed on every later read
	@Nullable
	private volatile Chunk terminalChunk;

	private record Chunk(@Nullable byte[] bytes,
											 @Nullable IOException exception) {}

	InputStreamServerSentEventSource(@NonNull InputStream inputStream) {
		requireNonNull(inputStream);

		this.inputStream = inputStream;
		this.chunks = new ArrayBlockingQueue<>(QUEUE_CAPACITY);
		this.closed = new AtomicBoolean(false);
		this.pumpThread = new Thread(this::pump, format("ssewire-source-pump-%d", PUMP_THREAD_COUNTER.incrementAndGet()));
		this.pumpThread.setDaemon(true);
		this.pumpThread.start();
	}

	@NonNull
	@Override
	public Optional<byte[]> read(@NonNull Duration timeout) throws IOException {
		requireNonNull(timeout);

		Chunk chunk = this.terminalChunk;

		if (chunk == null) {
			try {
				chunk = this.chunks.poll(Math.max(0L, timeout.toNanos()), TimeUnit.NANOSECONDS);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				throw new InterruptedIOException("Interrupted while waiting for stream bytes");
			}

			if (chunk == null)
				throw new SocketTimeoutException(format("No bytes arrived within %s", timeout));

			if (chunk.bytes() == null)
				this.terminalChunk = chunk;
		}

		if (chunk.exception() != null)
			throw new IOException("Unable to read from input stream", chunk.exception());

		return Optional.ofNullable(chunk.bytes());
	}

	@Override
	public void close() {
		if (!this.closed.compareAndSet(false, true))
			return;

		try {
			this.inputStream.close();
		} catch (IOException e) {
			LOGGER.debug("Unable to close input stream", e);
		}

		this.pumpThread.interrupt();
	}

	private void pump() {
		byte[] buffer = new byte[READ_BUFFER_SIZE];

		try {
			while (!this.closed.get()) {
				int bytesRead;

				try {
					bytesRead = this.inputStream.read(buffer);
				} catch (IOException e) {
					// Closing the stream ourselves shows up as a read failure; that's a normal end-of-stream
					this.chunks.put(this.closed.get() ? new Chunk(null, null) : new Chunk(null, e));
					return;
				}

				if (bytesRead == -1) {
					this.chunks.put(new Chunk(null, null));
					return;
				}

				if (bytesRead > 0)
					this.chunks.put(new Chunk(Arrays.copyOf(buffer, bytesRead), null));
			}
		} catch (InterruptedException e) {
			LOGGER.trace("Pump thread interrupted", e);
		}
	}
}
