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
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Instant;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A Server-Sent Event connection tracked by a {@link ServerSentEventRegistry}.
 * <p>
 * The registry exclusively owns its connections: each one wraps a writer whose transport is never shared.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class ServerSentEventConnection {
	@NonNull
	private final Long id;
	@NonNull
	private final Instant establishedAt;
	@NonNull
	private final ServerSentEventConnectionWriter writer;

	/**
	 * Why a connection was removed from its registry.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	public enum TerminationReason {
		/**
		 * Encoding or sending a frame failed.
		 */
		WRITE_FAILED,
		/**
		 * The connection was explicitly closed via {@link ServerSentEventRegistry#close(Long)}.
		 */
		CLOSED,
		/**
		 * The registry was shut down.
		 */
		REGISTRY_SHUTDOWN
	}

	ServerSentEventConnection(@NonNull Long id,
														@NonNull Instant establishedAt,
														@NonNull ServerSentEventConnectionWriter writer) {
		requireNonNull(id);
		requireNonNull(establishedAt);
		requireNonNull(writer);

		this.id = id;
		this.establishedAt = establishedAt;
		this.writer = writer;
	}

	/**
	 * The registry-assigned identifier for this connection, unique and never reused within a registry.
	 *
	 * @return the connection identifier
	 */
	@NonNull
	public Long getId() {
		return this.id;
	}

	/**
	 * The instant at which this connection was registered.
	 *
	 * @return the registration instant
	 */
	@NonNull
	public Instant getEstablishedAt() {
		return this.establishedAt;
	}

	@NonNull
	public ServerSentEventConnectionWriter getWriter() {
		return this.writer;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{id=%s, establishedAt=%s, open=%s}", getClass().getSimpleName(), getId(), getEstablishedAt(), getWriter().isOpen());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ServerSentEventConnection serverSentEventConnection))
			return false;

		return Objects.equals(getId(), serverSentEventConnection.getId())
				&& Objects.equals(getEstablishedAt(), serverSentEventConnection.getEstablishedAt());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getId(), getEstablishedAt());
	}
}
