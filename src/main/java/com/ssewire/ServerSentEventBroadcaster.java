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

/**
 * Delivers Server-Sent Event payloads to every connected client.
 * <p>
 * Delivery is at-most-once: clients whose write fails are disconnected and never retried. Broadcasts are best-effort,
 * so it is safe to call these methods even when no clients are connected.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface ServerSentEventBroadcaster {
	/**
	 * How many clients are currently connected?
	 *
	 * @return the number of connected clients
	 */
	@NonNull
	Long getClientCount();

	/**
	 * Broadcasts a single Server-Sent Event to all connected clients.
	 *
	 * @param serverSentEvent the event to broadcast
	 * @return the number of clients that accepted the event
	 */
	@NonNull
	Long broadcastEvent(@NonNull ServerSentEvent serverSentEvent);

	/**
	 * Broadcasts a single Server-Sent Event comment to all connected clients.
	 *
	 * @param serverSentEventComment the comment to broadcast
	 * @return the number of clients that accepted the comment
	 */
	@NonNull
	Long broadcastComment(@NonNull ServerSentEventComment serverSentEventComment);
}
