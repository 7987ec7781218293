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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import javax.annotation.concurrent.ThreadSafe;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class ServerSentEventRegistryTests {
	@Test
	public void endToEnd() {
		TestSupport.RecordingTransport transport = new TestSupport.RecordingTransport();
		ServerSentEventRegistry registry = ServerSentEventRegistry.withDefaults();

		Long connectionId = registry.register(transport);

		Assertions.assertEquals(1L, connectionId, "First connection should get identifier 1");
		Assertions.assertTrue(registry.sendToClient(connectionId, ServerSentEvent.withEvent("welcome").data("hi").build()));
		Assertions.assertEquals("event: welcome\ndata: hi\n\n", transport.getSentText());

		registry.shutdown();

		Assertions.assertFalse(registry.sendToClient(connectionId, ServerSentEvent.withEvent("welcome").data("hi").build()));
		Assertions.assertEquals(1, transport.getCloseCount());
		Assertions.assertTrue(registry.isShutdown());
	}

	@Test
	public void identifiersAreMonotonic() {
		ServerSentEventRegistry registry = ServerSentEventRegistry.withDefaults();

		Long first = registry.register(new TestSupport.RecordingTransport());
		Long second = registry.register(new TestSupport.RecordingTransport());

		registry.close(first);

		Long third = registry.register(new TestSupport.RecordingTransport());

		Assertions.assertEquals(List.of(1L, 2L, 3L), List.of(first, second, third), "Identifiers must never be reused");
		Assertions.assertEquals(Set.of(2L, 3L), Set.copyOf(registry.getConnectionIds()));
		Assertions.assertEquals(2L, registry.getConnectionCount());
		Assertions.assertEquals(2L, registry.getClientCount());
	}

	@Test
	public void registrationRefusals() {
		ServerSentEventRegistry registry = ServerSentEventRegistry.withDefaults();

		Assertions.assertEquals(ServerSentEventRegistry.NO_CONNECTION_ID, registry.register(null));

		registry.shutdown();

		TestSupport.RecordingTransport transport = new TestSupport.RecordingTransport();

		Assertions.assertEquals(ServerSentEventRegistry.NO_CONNECTION_ID, registry.register(transport));
		Assertions.assertEquals(0L, registry.getConnectionCount());
	}

	@Test
	public void broadcastPartialFailure() {
		TestSupport.RecordingLifecycleObserver lifecycleObserver = new TestSupport.RecordingLifecycleObserver();
		ServerSentEventRegistry registry = ServerSentEventRegistry.withConfig(ServerSentEventConfig.withDefaults()
				.lifecycleObserver(lifecycleObserver)
				.build());

		TestSupport.RecordingTransport healthy1 = new TestSupport.RecordingTransport();
		TestSupport.RecordingTransport failing = new TestSupport.RecordingTransport();
		TestSupport.RecordingTransport healthy2 = new TestSupport.RecordingTransport();

		Long healthy1Id = registry.register(healthy1);
		Long failingId = registry.register(failing);
		Long healthy2Id = registry.register(healthy2);

		failing.failSends(true);

		Long deliveredCount = registry.broadcast(ServerSentEvent.withData("tick").build());

		Assertions.assertEquals(2L, deliveredCount);
		Assertions.assertTrue(registry.getConnection(failingId).isEmpty(), "Failing connection should have been unregistered");
		Assertions.assertEquals(Set.of(healthy1Id, healthy2Id), Set.copyOf(registry.getConnectionIds()));
		Assertions.assertEquals("data: tick\n\n", healthy1.getSentText());
		Assertions.assertEquals("data: tick\n\n", healthy2.getSentText());
		Assertions.assertEquals(1, failing.getCloseCount());

		Assertions.assertEquals(List.of(failingId + ":WRITE_FAILED"), lifecycleObserver.getUnregistrations());
		Assertions.assertEquals(1, lifecycleObserver.getBroadcasts().size());
		Assertions.assertArrayEquals(new long[]{3L, 2L}, lifecycleObserver.getBroadcasts().get(0));

		// No retry: the failed connection doesn't come back
		failing.failSends(false);
		Assertions.assertEquals(2L, registry.broadcastComment(ServerSentEventComment.withHeartbeat()));
		Assertions.assertTrue(failing.getSends().isEmpty());
	}

	@Test
	public void broadcastWithNoConnections() {
		ServerSentEventRegistry registry = ServerSentEventRegistry.withDefaults();
		Assertions.assertEquals(0L, registry.broadcastEvent(ServerSentEvent.withData("nobody").build()));
	}

	@Test
	public void unicastFailureUnregisters() {
		TestSupport.RecordingTransport transport = new TestSupport.RecordingTransport();
		ServerSentEventRegistry registry = ServerSentEventRegistry.withDefaults();
		Long connectionId = registry.register(transport);

		transport.failSends(true);

		Assertions.assertFalse(registry.sendCommentToClient(connectionId, ServerSentEventComment.withComment("hello")));
		Assertions.assertTrue(registry.getConnection(connectionId).isEmpty());
		Assertions.assertFalse(registry.sendToClient(connectionId, ServerSentEvent.withData("x").build()));
	}

	@Test
	public void unknownConnections() {
		ServerSentEventRegistry registry = ServerSentEventRegistry.withDefaults();

		Assertions.assertFalse(registry.sendToClient(99L, ServerSentEvent.withData("x").build()));
		Assertions.assertFalse(registry.close(99L));
		Assertions.assertTrue(registry.acquireUnicaster(99L).isEmpty());
		Assertions.assertTrue(registry.getConnection(99L).isEmpty());
	}

	@Test
	public void idempotentClose() {
		TestSupport.RecordingTransport transport = new TestSupport.RecordingTransport();
		TestSupport.RecordingLifecycleObserver lifecycleObserver = new TestSupport.RecordingLifecycleObserver();
		ServerSentEventRegistry registry = ServerSentEventRegistry.withConfig(ServerSentEventConfig.withDefaults()
				.lifecycleObserver(lifecycleObserver)
				.build());

		Long connectionId = registry.register(transport);

		Assertions.assertTrue(registry.close(connectionId));
		Assertions.assertFalse(registry.close(connectionId), "Second close should be a no-op");
		Assertions.assertEquals(1, transport.getCloseCount());
		Assertions.assertEquals(List.of(connectionId + ":CLOSED"), lifecycleObserver.getUnregistrations());
	}

	@Test
	public void shutdownToleratesFailingTransports() {
		TestSupport.RecordingLifecycleObserver lifecycleObserver = new TestSupport.RecordingLifecycleObserver();
		ServerSentEventRegistry registry = ServerSentEventRegistry.withConfig(ServerSentEventConfig.withDefaults()
				.lifecycleObserver(lifecycleObserver)
				.build());

		TestSupport.RecordingTransport exploding = new TestSupport.RecordingTransport().throwOnClose(true);
		TestSupport.RecordingTransport healthy = new TestSupport.RecordingTransport();

		registry.register(exploding);
		registry.register(healthy);

		registry.shutdown();
		registry.shutdown();

		Assertions.assertEquals(1, exploding.getCloseCount());
		Assertions.assertEquals(1, healthy.getCloseCount());
		Assertions.assertEquals(0L, registry.getConnectionCount());
		Assertions.assertEquals(2, lifecycleObserver.getUnregistrations().size());
		Assertions.assertTrue(lifecycleObserver.getUnregistrations().stream().allMatch(unregistration -> unregistration.endsWith(":REGISTRY_SHUTDOWN")));
	}

	@Test
	public void unicaster() {
		TestSupport.RecordingTransport transport = new TestSupport.RecordingTransport();
		ServerSentEventRegistry registry = ServerSentEventRegistry.withDefaults();
		Long connectionId = registry.register(transport);

		ServerSentEventUnicaster unicaster = registry.acquireUnicaster(connectionId).orElseThrow();

		Assertions.assertEquals(connectionId, unicaster.getConnectionId());
		Assertions.assertTrue(unicaster.unicastEvent(ServerSentEvent.withData("direct").build()));
		Assertions.assertTrue(unicaster.unicastComment(ServerSentEventComment.withComment("note")));
		Assertions.assertEquals("data: direct\n\n: note\n\n", transport.getSentText());

		registry.close(connectionId);

		Assertions.assertFalse(unicaster.unicastEvent(ServerSentEvent.withData("gone").build()));
	}

	@Test
	public void batchedSend() {
		TestSupport.RecordingTransport transport = new TestSupport.RecordingTransport();
		ServerSentEventRegistry registry = ServerSentEventRegistry.withDefaults();
		Long connectionId = registry.register(transport);

		Assertions.assertTrue(registry.sendEventsToClient(connectionId, List.of(
				ServerSentEvent.withData("1").id("1").build(),
				ServerSentEvent.withData("2").id("2").build())));

		Assertions.assertEquals(1, transport.getSends().size());
		Assertions.assertEquals("id: 1\ndata: 1\n\nid: 2\ndata: 2\n\n", transport.getSentText());
	}

	@Test
	public void preambleOnRegistration() {
		ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
		ServerSentEventRegistry registry = ServerSentEventRegistry.withConfig(ServerSentEventConfig.withDefaults()
				.preamble(ServerSentEventPreamble.withDefaults().build())
				.build());

		Long connectionId = registry.register(ServerSentEventTransport.forOutputStream(outputStream));
		registry.sendToClient(connectionId, ServerSentEvent.withData("first").build());

		String written = outputStream.toString(StandardCharsets.UTF_8);

		Assertions.assertTrue(written.startsWith("HTTP/1.1 200 OK\r\nContent-Type: text/event-stream; charset=UTF-8\r\n"));
		Assertions.assertTrue(written.endsWith("\r\n\r\ndata: first\n\n"));
		Assertions.assertTrue(registry.getConnection(connectionId).orElseThrow().getWriter().isPreambleSent());
	}

	@Test
	public void failedPreambleRefusesRegistration() {
		TestSupport.RecordingTransport transport = new TestSupport.RecordingTransport().failSends(true);
		ServerSentEventRegistry registry = ServerSentEventRegistry.withConfig(ServerSentEventConfig.withDefaults()
				.preamble(ServerSentEventPreamble.withDefaults().build())
				.build());

		Assertions.assertEquals(ServerSentEventRegistry.NO_CONNECTION_ID, registry.register(transport));
		Assertions.assertEquals(0L, registry.getConnectionCount());
		Assertions.assertEquals(1, transport.getCloseCount());
	}

	@Test
	public void throwingObserverDoesNotAffectDelivery() {
		ServerSentEventRegistry registry = ServerSentEventRegistry.withConfig(ServerSentEventConfig.withDefaults()
				.lifecycleObserver(new LifecycleObserver() {
					@Override
					public void didRegisterConnection(@NonNull ServerSentEventConnection serverSentEventConnection) {
						throw new IllegalStateException("Simulated observer failure");
					}

					@Override
					public void didWriteServerSentEvent(@NonNull Long connectionId,
																							@NonNull ServerSentEvent serverSentEvent) {
						throw new IllegalStateException("Simulated observer failure");
					}

					@Override
					public void didReceiveLogEvent(@NonNull LogEvent logEvent) {
						// Quiet
					}
				})
				.build());

		Long connectionId = registry.register(new TestSupport.RecordingTransport());

		Assertions.assertEquals(1L, connectionId);
		Assertions.assertTrue(registry.sendToClient(connectionId, ServerSentEvent.withData("x").build()));
	}

	@Test
	@Timeout(value = 10, unit = TimeUnit.SECONDS)
	public void slowPeerDoesNotBlockRegistration() throws Exception {
		CountDownLatch sendStarted = new CountDownLatch(1);
		CountDownLatch releaseSend = new CountDownLatch(1);

		ServerSentEventTransport slowTransport = new ServerSentEventTransport() {
			@NonNull
			@Override
			public Boolean send(@NonNull byte[] bytes) {
				sendStarted.countDown();

				try {
					releaseSend.await();
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
					return false;
				}

				return true;
			}

			@Override
			public void close() {
				// Nothing to do
			}
		};

		ServerSentEventRegistry registry = ServerSentEventRegistry.withDefaults();
		registry.register(slowTransport);

		Thread broadcastThread = new Thread(() -> registry.broadcast(ServerSentEvent.withData("slow").build()));
		broadcastThread.start();

		Assertions.assertTrue(sendStarted.await(5, TimeUnit.SECONDS));

		// The broadcast is stuck writing to the slow peer; the registry must still accept new peers
		TestSupport.RecordingTransport fastTransport = new TestSupport.RecordingTransport();
		Long fastConnectionId = registry.register(fastTransport);

		Assertions.assertEquals(2L, fastConnectionId);
		Assertions.assertTrue(registry.sendToClient(fastConnectionId, ServerSentEvent.withData("fast").build()));

		releaseSend.countDown();
		broadcastThread.join(5_000);

		Assertions.assertEquals("data: fast\n\n", fastTransport.getSentText());
	}
}
