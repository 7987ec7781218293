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

import java.io.OutputStream;

import static java.util.Objects.requireNonNull;

/**
 * The outbound half of a long-lived HTTP response, supplied by whatever HTTP server hosts the Server-Sent Event stream.
 * <p>
 * A transport is exclusively owned by a single {@link ServerSentEventConnectionWriter}, which guarantees that
 * {@link #send(byte[])} and {@link #close()} are never invoked concurrently.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface ServerSentEventTransport {
	/**
	 * Writes the given bytes to the peer.
	 * <p>
	 * I/O failures are reported by returning {@code false} rather than by throwing.
	 *
	 * @param bytes the bytes to write
	 * @return {@code true} if all bytes were handed off to the peer, {@code false} otherwise
	 */
	@NonNull
	Boolean send(@NonNull byte[] bytes);

	/**
	 * Terminates the underlying connection. Invoked at most once per writer.
	 */
	void close();

	/**
	 * Adapts an {@link OutputStream}, for example a servlet response body, to a transport.
	 * <p>
	 * Each {@link #send(byte[])} writes and flushes; {@link #close()} closes the stream.
	 *
	 * @param outputStream the stream to write to
	 * @return a transport backed by the stream
	 */
	@NonNull
	static ServerSentEventTransport forOutputStream(@NonNull OutputStream outputStream) {
		requireNonNull(outputStream);
		return new OutputStreamServerSentEventTransport(outputStream);
	}
}
