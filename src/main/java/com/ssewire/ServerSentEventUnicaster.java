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
 * Delivers Server-Sent Event payloads to a single connected client.
 * <p>
 * Acquire instances via {@link ServerSentEventRegistry#acquireUnicaster(Long)}. A unicaster outlives the connection it
 * targets; once that connection is gone, every call returns {@code false}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface ServerSentEventUnicaster {
	/**
	 * Sends a Server-Sent Event to the client.
	 *
	 * @param serverSentEvent the event to send
	 * @return {@code true} if the client accepted the event
	 */
	@NonNull
	Boolean unicastEvent(@NonNull ServerSentEvent serverSentEvent);

	/**
	 * Sends a Server-Sent Event comment to the client.
	 *
	 * @param serverSentEventComment the comment to send
	 * @return {@code true} if the client accepted the comment
	 */
	@NonNull
	Boolean unicastComment(@NonNull ServerSentEventComment serverSentEventComment);

	/**
	 * The identifier of the connection this unicaster targets.
	 *
	 * @return the connection identifier
	 */
	@NonNull
	Long getConnectionId();
}
