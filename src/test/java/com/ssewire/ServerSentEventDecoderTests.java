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

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class ServerSentEventDecoderTests {
	private static final String MIXED_STREAM = ": connected\n\n"
			+ "event: welcome\ndata: hi\n\n"
			+ "id: 7\r\nevent: update\r\ndata: line one\r\ndata: line two\r\nretry: 2500\r\n\r\n"
			+ "data: héllo ✓\n\n"
			+ "data:  leading space kept\nunknown: ignored\ngarbage line\n\n"
			+ "data: tail";

	@Test
	public void basicFrame() {
		List<ServerSentEvent> serverSentEvents = ServerSentEventDecoder.withDefaults().decode(TestSupport.utf8("event: welcome\ndata: hi\n\n"));

		Assertions.assertEquals(1, serverSentEvents.size());
		Assertions.assertEquals("welcome", serverSentEvents.get(0).getEvent());
		Assertions.assertEquals("hi", serverSentEvents.get(0).getData());
		Assertions.assertTrue(serverSentEvents.get(0).hasExplicitEvent());
		Assertions.assertTrue(serverSentEvents.get(0).getId().isEmpty());
	}

	@Test
	public void roundTrip() {
		ServerSentEventEncoder encoder = ServerSentEventEncoder.defaultInstance();

		List<ServerSentEvent> originals = List.of(
				ServerSentEvent.withEvent("update").id("42").data("{\"price\": 12.34}").retry(Duration.ofMillis(1500)).build(),
				ServerSentEvent.withData("a\nb").build(),
				ServerSentEvent.withData(" leading and trailing ").build(),
				ServerSentEvent.withData("héllo ✓").id("ünicode").build());

		for (ServerSentEvent original : originals) {
			List<ServerSentEvent> decoded = ServerSentEventDecoder.withDefaults().decode(encoder.encodeEvent(original));
			Assertions.assertEquals(List.of(original), decoded, "Round-trip failed for " + original);
		}
	}

	@Test
	public void multilineData() {
		byte[] bytes = ServerSentEventEncoder.defaultInstance().encodeEvent(ServerSentEvent.withData("a\nb").build());

		Assertions.assertEquals("data: a\ndata: b\n\n", new String(bytes, StandardCharsets.UTF_8));
		Assertions.assertEquals("a\nb", ServerSentEventDecoder.withDefaults().decode(bytes).get(0).getData());
	}

	@Test
	public void chunkInvariance() {
		byte[] bytes = TestSupport.utf8(MIXED_STREAM);
		List<ServerSentEvent> expected = decodeAll(bytes, bytes.length);

		Assertions.assertEquals(6, expected.size(), "Unexpected number of events for single feed");

		// Every two-way split
		for (int split = 0; split <= bytes.length; split++) {
			ServerSentEventDecoder decoder = ServerSentEventDecoder.withDefaults();
			List<ServerSentEvent> actual = new ArrayList<>();

			actual.addAll(decoder.decode(bytes, 0, split));
			actual.addAll(decoder.decode(bytes, split, bytes.length - split));
			actual.addAll(decoder.finish());

			Assertions.assertEquals(expected, actual, "Mismatch when splitting at byte " + split);
		}

		// Byte-by-byte
		Assertions.assertEquals(expected, decodeAll(bytes, 1));

		// Arbitrary chunk sizes
		Random random = new Random(1234);

		for (int i = 0; i < 50; i++) {
			ServerSentEventDecoder decoder = ServerSentEventDecoder.withDefaults();
			List<ServerSentEvent> actual = new ArrayList<>();
			int offset = 0;

			while (offset < bytes.length) {
				int length = Math.min(bytes.length - offset, 1 + random.nextInt(9));
				actual.addAll(decoder.decode(bytes, offset, length));
				offset += length;
			}

			actual.addAll(decoder.finish());
			Assertions.assertEquals(expected, actual);
		}
	}

	@Test
	public void mixedStreamContents() {
		byte[] bytes = TestSupport.utf8(MIXED_STREAM);
		List<ServerSentEvent> serverSentEvents = decodeAll(bytes, bytes.length);

		Assertions.assertTrue(serverSentEvents.get(0).isEmpty(), "Comment-only frame should decode to a degenerate event");

		Assertions.assertEquals("welcome", serverSentEvents.get(1).getEvent());
		Assertions.assertEquals("hi", serverSentEvents.get(1).getData());

		ServerSentEvent update = serverSentEvents.get(2);
		Assertions.assertEquals("7", update.getId().orElse(null));
		Assertions.assertEquals("update", update.getEvent());
		Assertions.assertEquals("line one\nline two", update.getData());
		Assertions.assertEquals(Duration.ofMillis(2500), update.getRetry().orElse(null));

		Assertions.assertEquals("héllo ✓", serverSentEvents.get(3).getData());

		// Only the first space after the colon is stripped from data values
		Assertions.assertEquals(" leading space kept", serverSentEvents.get(4).getData());
		Assertions.assertEquals(ServerSentEvent.DEFAULT_EVENT, serverSentEvents.get(4).getEvent());

		// Residue without a terminating blank line is decoded at end-of-stream
		Assertions.assertEquals("tail", serverSentEvents.get(5).getData());
	}

	@Test
	public void commentSkipping() {
		ServerSentEventDecoder decoder = ServerSentEventDecoder.withDefaults();
		List<ServerSentEvent> serverSentEvents = decoder.decode(TestSupport.utf8(": ping\n\n"));

		Assertions.assertEquals(1, serverSentEvents.size());
		Assertions.assertTrue(serverSentEvents.get(0).isEmpty(), "Comment should not produce any fields");
		Assertions.assertEquals("", serverSentEvents.get(0).getData());
		Assertions.assertFalse(decoder.hasPendingBytes());

		List<ServerSentEvent> withComment = ServerSentEventDecoder.withDefaults().decode(TestSupport.utf8("data: x\n: note\n\n"));
		Assertions.assertEquals("x", withComment.get(0).getData());
	}

	@Test
	public void fieldNamesAreCaseInsensitiveAndTolerateWhitespace() {
		List<ServerSentEvent> serverSentEvents = ServerSentEventDecoder.withDefaults()
				.decode(TestSupport.utf8("DATA: first\n Event :  update  \nId:  9 \nData:second\n\n"));

		ServerSentEvent serverSentEvent = serverSentEvents.get(0);

		Assertions.assertEquals("first\nsecond", serverSentEvent.getData());
		Assertions.assertEquals("update", serverSentEvent.getEvent());
		Assertions.assertEquals("9", serverSentEvent.getId().orElse(null));
	}

	@Test
	public void invalidRetryIsIgnored() {
		ServerSentEventDecoder decoder = ServerSentEventDecoder.withDefaults();

		Assertions.assertTrue(decoder.decode(TestSupport.utf8("retry: soon\ndata: x\n\n")).get(0).getRetry().isEmpty());
		Assertions.assertTrue(decoder.decode(TestSupport.utf8("retry: -5\ndata: x\n\n")).get(0).getRetry().isEmpty());
		Assertions.assertTrue(decoder.decode(TestSupport.utf8("retry: 99999999999999999999999\ndata: x\n\n")).get(0).getRetry().isEmpty());
		Assertions.assertEquals(Duration.ofMillis(10), decoder.decode(TestSupport.utf8("retry:10\n\n")).get(0).getRetry().orElse(null));
	}

	@Test
	public void malformedLinesAreIgnored() {
		List<ServerSentEvent> serverSentEvents = ServerSentEventDecoder.withDefaults()
				.decode(TestSupport.utf8("this is not a field\ndata: ok\nid: bad\u0000id\n\n"));

		Assertions.assertEquals(1, serverSentEvents.size());
		Assertions.assertEquals("ok", serverSentEvents.get(0).getData());
		Assertions.assertTrue(serverSentEvents.get(0).getId().isEmpty(), "IDs containing NUL should be ignored");
	}

	@Test
	public void incompleteFramesStayPending() {
		ServerSentEventDecoder decoder = ServerSentEventDecoder.withDefaults();

		Assertions.assertTrue(decoder.decode(TestSupport.utf8("data: partial")).isEmpty());
		Assertions.assertEquals(13, decoder.getPendingByteCount());

		Assertions.assertTrue(decoder.decode(TestSupport.utf8("\n")).isEmpty());
		Assertions.assertEquals(14, decoder.getPendingByteCount());

		List<ServerSentEvent> serverSentEvents = decoder.decode(TestSupport.utf8("\ndata: next"));

		Assertions.assertEquals(1, serverSentEvents.size());
		Assertions.assertEquals("partial", serverSentEvents.get(0).getData());
		Assertions.assertEquals(10, decoder.getPendingByteCount());

		List<ServerSentEvent> residue = decoder.finish();

		Assertions.assertEquals("next", residue.get(0).getData());
		Assertions.assertFalse(decoder.hasPendingBytes());
	}

	@Test
	public void mixedLineEndingsSeparateFrames() {
		String stream = "data: a\n\r\ndata: b\n\nevent: c\r\n\ndata: d\r\n\r\n";

		List<ServerSentEvent> serverSentEvents = ServerSentEventDecoder.withDefaults().decode(TestSupport.utf8(stream));

		Assertions.assertEquals(4, serverSentEvents.size());
		Assertions.assertEquals("a", serverSentEvents.get(0).getData());
		Assertions.assertEquals("b", serverSentEvents.get(1).getData());
		Assertions.assertEquals("c", serverSentEvents.get(2).getEvent());
		Assertions.assertEquals("d", serverSentEvents.get(3).getData());

		List<ServerSentEvent> byteAtATime = decodeAll(TestSupport.utf8(stream), 1);

		Assertions.assertEquals(serverSentEvents, byteAtATime);
	}

	@Test
	public void blankResidueProducesNothing() {
		ServerSentEventDecoder decoder = ServerSentEventDecoder.withDefaults();

		decoder.decode(TestSupport.utf8("data: x\n\n\r\n"));

		Assertions.assertTrue(decoder.finish().isEmpty());
		Assertions.assertTrue(ServerSentEventDecoder.withDefaults().finish().isEmpty());
	}

	@Test
	public void largeFramesGrowTheBuffer() {
		String data = "x".repeat(100_000);
		byte[] bytes = ServerSentEventEncoder.defaultInstance().encodeEvent(ServerSentEvent.withData(data).build());

		List<ServerSentEvent> serverSentEvents = decodeAll(bytes, 4_096);

		Assertions.assertEquals(1, serverSentEvents.size());
		Assertions.assertEquals(data, serverSentEvents.get(0).getData());
	}

	@Test
	public void illegalRangeIsRejected() {
		Assertions.assertThrows(IndexOutOfBoundsException.class, () -> ServerSentEventDecoder.withDefaults().decode(new byte[4], 3, 2));
	}

	private List<ServerSentEvent> decodeAll(byte[] bytes, int chunkSize) {
		ServerSentEventDecoder decoder = ServerSentEventDecoder.withDefaults();
		List<ServerSentEvent> serverSentEvents = new ArrayList<>();

		for (int offset = 0; offset < bytes.length; offset += chunkSize)
			serverSentEvents.addAll(decoder.decode(bytes, offset, Math.min(chunkSize, bytes.length - offset)));

		serverSentEvents.addAll(decoder.finish());
		return serverSentEvents;
	}
}
