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

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * The inbound half of a Server-Sent Event stream, for example an HTTP client response body.
 * <p>
 * Sources are read by a single thread.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface ServerSentEventSource extends AutoCloseable {
	/**
	 * Reads the next chunk of bytes, waiting at most {@code timeout} for it to arrive.
	 *
	 * @param timeout how long to wait for bytes
	 * @return the next non-empty chunk, or {@link Optional#empty()} if the stream has ended
	 * @throws java.net.SocketTimeoutException if no bytes arrived within {@code timeout}
	 * @throws IOException                     if the stream failed
	 */
	@NonNull
	Optional<byte[]> read(@NonNull Duration timeout) throws IOException;

	/**
	 * Releases the underlying stream. No-op by default.
	 */
	@Override
	default void close() {
		// No-op by default
	}

	/**
	 * Adapts a blocking {@link InputStream} to a source whose reads honor a timeout.
	 * <p>
	 * A daemon thread pumps the stream into a small bounded queue; {@link #close()} closes the stream and stops the thread.
	 *
	 * @param inputStream the stream to read from
	 * @return a source backed by the stream
	 */
	@NonNull
	static ServerSentEventSource forInputStream(@NonNull InputStream inputStream) {
		requireNonNull(inputStream);
		return new InputStreamServerSentEventSource(inputStream);
	}
}
