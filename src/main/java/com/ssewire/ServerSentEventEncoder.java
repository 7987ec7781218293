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

import java.nio.charset.StandardCharsets;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Turns {@link ServerSentEvent} and {@link ServerSentEventComment} instances into their UTF-8 wire representation.
 * <p>
 * An event is written as its field lines, in this order, followed by a blank line:
 * <ul>
 *   <li>{@code id: <id>} if an id is present and non-empty</li>
 *   <li>{@code event: <event>} if an event value was specified and is non-empty</li>
 *   <li>{@code data: <line>} for each line of a non-empty data payload</li>
 *   <li>{@code retry: <milliseconds>} if a retry duration is present</li>
 * </ul>
 * <p>
 * For example, {@code ServerSentEvent.withEvent("welcome").data("hi").build()} encodes to {@code "event: welcome\ndata: hi\n\n"}.
 * <p>
 * An event with none of these fields (see {@link ServerSentEvent#isEmpty()}) is written as the heartbeat comment
 * {@code ":\n\n"} rather than a lone {@code "\n"}. A decoder yields an empty event for either form.
 * <p>
 * Implementations must be threadsafe; a single instance is shared by every connection of a registry.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface ServerSentEventEncoder {
	/**
	 * Formats an event as an SSE frame.
	 *
	 * @param serverSentEvent the event to format
	 * @return the frame, including its terminating blank line
	 */
	@NonNull
	String formatEvent(@NonNull ServerSentEvent serverSentEvent);

	/**
	 * Formats a comment as an SSE frame.
	 *
	 * @param serverSentEventComment the comment to format
	 * @return the frame, including its terminating blank line
	 */
	@NonNull
	String formatComment(@NonNull ServerSentEventComment serverSentEventComment);

	/**
	 * Encodes an event as UTF-8 frame bytes.
	 *
	 * @param serverSentEvent the event to encode
	 * @return the frame bytes
	 */
	@NonNull
	default byte[] encodeEvent(@NonNull ServerSentEvent serverSentEvent) {
		requireNonNull(serverSentEvent);
		return formatEvent(serverSentEvent).getBytes(StandardCharsets.UTF_8);
	}

	/**
	 * Encodes several events back-to-back so they can be handed to a transport in a single send.
	 *
	 * @param serverSentEvents the events to encode, in wire order
	 * @return the concatenated frame bytes
	 */
	@NonNull
	default byte[] encodeEvents(@NonNull List<@NonNull ServerSentEvent> serverSentEvents) {
		requireNonNull(serverSentEvents);

		StringBuilder stringBuilder = new StringBuilder();

		for (ServerSentEvent serverSentEvent : serverSentEvents)
			stringBuilder.append(formatEvent(requireNonNull(serverSentEvent)));

		return stringBuilder.toString().getBytes(StandardCharsets.UTF_8);
	}

	/**
	 * Encodes a comment as UTF-8 frame bytes.
	 *
	 * @param serverSentEventComment the comment to encode
	 * @return the frame bytes
	 */
	@NonNull
	default byte[] encodeComment(@NonNull ServerSentEventComment serverSentEventComment) {
		requireNonNull(serverSentEventComment);
		return formatComment(serverSentEventComment).getBytes(StandardCharsets.UTF_8);
	}

	/**
	 * Acquires a threadsafe {@link ServerSentEventEncoder} instance with sensible defaults.
	 *
	 * @return a {@code ServerSentEventEncoder} with default settings
	 */
	@NonNull
	static ServerSentEventEncoder defaultInstance() {
		return DefaultServerSentEventEncoder.defaultInstance();
	}
}
