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

/**
 * Kinds of {@link LogEvent} instances that SSEWire can produce.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum LogEventType {
	/**
	 * Indicates {@link LifecycleObserver#didRegisterConnection(ServerSentEventConnection)} threw an exception.
	 */
	LIFECYCLE_OBSERVER_DID_REGISTER_CONNECTION_FAILED,
	/**
	 * Indicates {@link LifecycleObserver#didUnregisterConnection(ServerSentEventConnection, ServerSentEventConnection.TerminationReason)} threw an exception.
	 */
	LIFECYCLE_OBSERVER_DID_UNREGISTER_CONNECTION_FAILED,
	/**
	 * Indicates {@link LifecycleObserver#didWriteServerSentEvent(Long, ServerSentEvent)} threw an exception.
	 */
	LIFECYCLE_OBSERVER_DID_WRITE_SERVER_SENT_EVENT_FAILED,
	/**
	 * Indicates {@link LifecycleObserver#didFailToWriteServerSentEvent(Long, ServerSentEvent, Throwable)} threw an exception.
	 */
	LIFECYCLE_OBSERVER_DID_FAIL_TO_WRITE_SERVER_SENT_EVENT_FAILED,
	/**
	 * Indicates {@link LifecycleObserver#didWriteServerSentEventComment(Long, ServerSentEventComment)} threw an exception.
	 */
	LIFECYCLE_OBSERVER_DID_WRITE_SERVER_SENT_EVENT_COMMENT_FAILED,
	/**
	 * Indicates {@link LifecycleObserver#didFailToWriteServerSentEventComment(Long, ServerSentEventComment, Throwable)} threw an exception.
	 */
	LIFECYCLE_OBSERVER_DID_FAIL_TO_WRITE_SERVER_SENT_EVENT_COMMENT_FAILED,
	/**
	 * Indicates {@link LifecycleObserver#didBroadcast(Long, Long)} threw an exception.
	 */
	LIFECYCLE_OBSERVER_DID_BROADCAST_FAILED,
	/**
	 * Indicates an event or comment could not be encoded into its wire representation.
	 */
	SERVER_SENT_EVENT_ENCODING_FAILED,
	/**
	 * Indicates the transport refused or failed to send bytes to a connection.
	 */
	SERVER_SENT_EVENT_TRANSPORT_SEND_FAILED,
	/**
	 * Indicates the transport failed while being closed.
	 */
	SERVER_SENT_EVENT_TRANSPORT_CLOSE_FAILED,
	/**
	 * Indicates the initial status line/headers could not be written to a newly-registered connection.
	 */
	SERVER_SENT_EVENT_PREAMBLE_FAILED,
	/**
	 * Indicates a registration was attempted on a registry that has already been shut down.
	 */
	SERVER_SENT_EVENT_REGISTRY_SHUT_DOWN,
	/**
	 * Indicates a request does not look like a Server-Sent Event request (method or {@code Accept} header).
	 */
	SERVER_SENT_EVENT_INVALID_REQUEST,
	/**
	 * Indicates a response does not look like a Server-Sent Event response ({@code Content-Type} or {@code Cache-Control} header).
	 */
	SERVER_SENT_EVENT_INVALID_RESPONSE,
	/**
	 * Indicates a client-side stream ended with a read timeout or an I/O error.
	 */
	SERVER_SENT_EVENT_STREAM_READ_FAILED,
	/**
	 * Indicates a {@link ServerSentEventListener} threw an exception while handling an event.
	 */
	SERVER_SENT_EVENT_LISTENER_FAILED
}
