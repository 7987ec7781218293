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
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class ServerSentEventValidatorTests {
	@Test
	public void validRequests() {
		Assertions.assertTrue(ServerSentEventValidator.isValidRequest("GET", Map.of("Accept", Set.of("text/event-stream"))));
		Assertions.assertTrue(ServerSentEventValidator.isValidRequest("GET", Map.of("Accept", Set.of("text/html, text/event-stream"))));
		Assertions.assertTrue(ServerSentEventValidator.isValidRequest("GET", Map.of("accept", Set.of("TEXT/Event-Stream"))),
				"Header names and media types should be matched case-insensitively");
		Assertions.assertTrue(ServerSentEventValidator.isValidRequest("GET", Map.of("Accept", Set.of("text/event-stream;q=0.9, */*;q=0.1"))));
		Assertions.assertTrue(ServerSentEventValidator.isValidRequest("GET", Map.of("Accept", new LinkedHashSet<>(List.of("text/html", "text/event-stream")))));
	}

	@Test
	public void invalidRequests() {
		Assertions.assertFalse(ServerSentEventValidator.isValidRequest("POST", Map.of("Accept", Set.of("text/event-stream"))));
		Assertions.assertFalse(ServerSentEventValidator.isValidRequest("get", Map.of("Accept", Set.of("text/event-stream"))),
				"Method matching is case-sensitive");
		Assertions.assertFalse(ServerSentEventValidator.isValidRequest("GET", Map.of("Accept", Set.of("text/html"))));
		Assertions.assertFalse(ServerSentEventValidator.isValidRequest("GET", Map.of("Accept", Set.of("text/event-streaming"))));
		Assertions.assertFalse(ServerSentEventValidator.isValidRequest("GET", Map.of()));
		Assertions.assertFalse(ServerSentEventValidator.isValidRequest(null, Map.of("Accept", Set.of("text/event-stream"))));
		Assertions.assertFalse(ServerSentEventValidator.isValidRequest("GET", null));
	}

	@Test
	public void validResponses() {
		Assertions.assertTrue(ServerSentEventValidator.isValidResponse(Map.of(
				"Content-Type", Set.of("text/event-stream"),
				"Cache-Control", Set.of("no-cache"))));
		Assertions.assertTrue(ServerSentEventValidator.isValidResponse(Map.of(
				"content-type", Set.of("Text/Event-Stream; charset=UTF-8"),
				"CACHE-CONTROL", Set.of("no-cache, no-store"))));
		Assertions.assertTrue(ServerSentEventValidator.isValidResponse(ServerSentEventPreamble.withDefaults().build().getHeaders()),
				"Default preamble headers should satisfy the response check");
	}

	@Test
	public void invalidResponses() {
		Assertions.assertFalse(ServerSentEventValidator.isValidResponse(Map.of(
				"Content-Type", Set.of("application/json"),
				"Cache-Control", Set.of("no-cache"))));
		Assertions.assertFalse(ServerSentEventValidator.isValidResponse(Map.of("Content-Type", Set.of("text/event-stream"))));
		Assertions.assertFalse(ServerSentEventValidator.isValidResponse(Map.of("Cache-Control", Set.of("no-cache"))));
		Assertions.assertFalse(ServerSentEventValidator.isValidResponse(null));
	}

	@Test
	public void nullHeaderEntriesAreTolerated() {
		Map<String, Set<String>> headers = new HashMap<>();
		headers.put(null, Set.of("text/event-stream"));
		headers.put("Accept", null);

		Assertions.assertFalse(ServerSentEventValidator.isValidRequest("GET", headers));
	}

	@Test
	public void checksLogFailures() {
		TestSupport.RecordingLifecycleObserver lifecycleObserver = new TestSupport.RecordingLifecycleObserver();
		ServerSentEventValidator validator = ServerSentEventValidator.withLifecycleObserver(lifecycleObserver);

		Assertions.assertTrue(validator.checkRequest("GET", Map.of("Accept", Set.of("text/event-stream"))));
		Assertions.assertTrue(lifecycleObserver.getLogEvents().isEmpty(), "Valid requests should not be logged");

		Assertions.assertFalse(validator.checkRequest("POST", Map.of("Accept", Set.of("text/event-stream"))));
		Assertions.assertTrue(lifecycleObserver.hasLogEventOfType(LogEventType.SERVER_SENT_EVENT_INVALID_REQUEST));

		Assertions.assertFalse(validator.checkResponse(Map.of("Content-Type", Set.of("application/json"))));
		Assertions.assertTrue(lifecycleObserver.hasLogEventOfType(LogEventType.SERVER_SENT_EVENT_INVALID_RESPONSE));
	}

	@Test
	public void clientRequestHeaders() {
		Map<String, Set<String>> headers = ServerSentEventValidator.clientRequestHeaders();

		Assertions.assertTrue(ServerSentEventValidator.isValidRequest("GET", headers), "Canonical client headers should form a valid request");
		Assertions.assertEquals(Set.of("no-cache"), headers.get("Cache-Control"));
		Assertions.assertEquals(Set.of("keep-alive"), headers.get("Connection"));
		Assertions.assertThrows(UnsupportedOperationException.class, () -> headers.put("X-Test", Set.of("x")));
	}
}
