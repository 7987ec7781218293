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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.NotThreadSafe;
import java.io.IOException;
import java.io.OutputStream;

import static java.util.Objects.requireNonNull;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
final class OutputStreamServerSentEventTransport implements ServerSentEventTransport {
	@NonNull
	private static final Logger LOGGER;

	static {
		LOGGER = LoggerFactory.getLogger(OutputStreamServerSentEventTransport.class);
	}

	@NonNull
	private final OutputStream outputStream;

	OutputStreamServerSentEventTransport(@NonNull OutputStream outputStream) {
		requireNonNull(outputStream);
		this.outputStream = outputStream;
	}

	@NonNull
	@Override
	public Boolean send(@NonNull byte[] bytes) {
		requireNonNull(bytes);

		try {
			getOutputStream().write(bytes);
			getOutputStream().flush();
			return true;
		} catch (IOException e) {
			LOGGER.debug("Unable to write {} bytes to output stream", bytes.length, e);
			return false;
		}
	}

	@Override
	public void close() {
		try {
			getOutputStream().close();
		} catch (IOException e) {
			LOGGER.debug("Unable to close output stream", e);
		}
	}

	@NonNull
	private OutputStream getOutputStream() {
		return this.outputStream;
	}
}
