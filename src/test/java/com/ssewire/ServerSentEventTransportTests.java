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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import javax.annotation.concurrent.ThreadSafe;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class ServerSentEventTransportTests {
	@Test
	public void outputStreamTransport() {
		ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
		ServerSentEventTransport transport = ServerSentEventTransport.forOutputStream(outputStream);

		Assertions.assertTrue(transport.send(TestSupport.utf8("data: x\n\n")));
		Assertions.assertEquals("data: x\n\n", outputStream.toString(StandardCharsets.UTF_8));
	}

	@Test
	public void outputStreamTransportReportsFailure() {
		OutputStream brokenOutputStream = new OutputStream() {
			@Override
			public void write(int b) throws IOException {
				throw new IOException("Broken pipe");
			}

			@Override
			public void close() throws IOException {
				throw new IOException("Already closed");
			}
		};

		ServerSentEventTransport transport = ServerSentEventTransport.forOutputStream(brokenOutputStream);

		Assertions.assertFalse(transport.send(TestSupport.utf8("data: x\n\n")), "I/O failures should be reported, not thrown");
		Assertions.assertDoesNotThrow(transport::close);
	}

	@Test
	@Timeout(value = 10, unit = TimeUnit.SECONDS)
	public void inputStreamSourceReadsToEnd() throws IOException {
		byte[] bytes = TestSupport.utf8("data: one\n\ndata: two\n\n");

		try (ServerSentEventSource source = ServerSentEventSource.forInputStream(new ByteArrayInputStream(bytes))) {
			ByteArrayOutputStream collected = new ByteArrayOutputStream();
			Optional<byte[]> chunk;

			while ((chunk = source.read(Duration.ofSeconds(5))).isPresent())
				collected.write(chunk.get());

			Assertions.assertArrayEquals(bytes, collected.toByteArray());

			// End-of-stream is sticky
			Assertions.assertTrue(source.read(Duration.ofMillis(10)).isEmpty());
		}
	}

	@Test
	@Timeout(value = 10, unit = TimeUnit.SECONDS)
	public void inputStreamSourceTimesOut() throws IOException {
		PipedOutputStream pipedOutputStream = new PipedOutputStream();
		PipedInputStream pipedInputStream = new PipedInputStream(pipedOutputStream);

		try (ServerSentEventSource source = ServerSentEventSource.forInputStream(pipedInputStream)) {
			Assertions.assertThrows(SocketTimeoutException.class, () -> source.read(Duration.ofMillis(100)));

			pipedOutputStream.write(TestSupport.utf8("data: late\n\n"));
			pipedOutputStream.flush();

			Assertions.assertEquals("data: late\n\n", new String(source.read(Duration.ofSeconds(5)).orElseThrow(), StandardCharsets.UTF_8));

			pipedOutputStream.close();

			Assertions.assertTrue(source.read(Duration.ofSeconds(5)).isEmpty());
		}
	}

	@Test
	@Timeout(value = 10, unit = TimeUnit.SECONDS)
	public void inputStreamSourcePropagatesFailures() {
		InputStream failingInputStream = new InputStream() {
			@Override
			public int read() throws IOException {
				throw new IOException("Connection reset");
			}
		};

		try (ServerSentEventSource source = ServerSentEventSource.forInputStream(failingInputStream)) {
			IOException exception = Assertions.assertThrows(IOException.class, () -> source.read(Duration.ofSeconds(5)));
			Assertions.assertFalse(exception instanceof SocketTimeoutException);
			Assertions.assertEquals("Connection reset", exception.getCause().getMessage());
		}
	}

	@Test
	@Timeout(value = 10, unit = TimeUnit.SECONDS)
	public void streamReaderOverInputStream() {
		byte[] bytes = ServerSentEventEncoder.defaultInstance().encodeEvent(ServerSentEvent.withEvent("update").data("multi\nline").build());

		try (ServerSentEventSource source = ServerSentEventSource.forInputStream(new ByteArrayInputStream(bytes))) {
			ServerSentEventStreamResult result = ServerSentEventStreamReader.withDefaults()
					.lifecycleObserver(new TestSupport.RecordingLifecycleObserver())
					.build()
					.read(source, Duration.ofSeconds(5), serverSentEvent -> {
						Assertions.assertEquals("multi\nline", serverSentEvent.getData());
						return true;
					});

			Assertions.assertEquals(new ServerSentEventStreamResult.Completed(1L), result);
		}
	}
}
