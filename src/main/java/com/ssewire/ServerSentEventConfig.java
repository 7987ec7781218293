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

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Settings for a {@link ServerSentEventRegistry}.
 * <p>
 * For example:
 * <pre>{@code  ServerSentEventConfig config = ServerSentEventConfig.withDefaults()
 *   .lifecycleObserver(new LifecycleObserver() {
 *     @Override
 *     public void didUnregisterConnection(ServerSentEventConnection connection,
 *                                         ServerSentEventConnection.TerminationReason terminationReason) {
 *       System.out.printf("Connection %d gone: %s\n", connection.getId(), terminationReason);
 *     }
 *   })
 *   .preamble(ServerSentEventPreamble.withDefaults().build())
 *   .build();
 *
 * ServerSentEventRegistry registry = ServerSentEventRegistry.withConfig(config);}</pre>
 * <p>
 * By default no preamble is sent, since the hosting HTTP server normally writes the response head itself.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class ServerSentEventConfig {
	@NonNull
	private final LifecycleObserver lifecycleObserver;
	@NonNull
	private final ServerSentEventEncoder encoder;
	@Nullable
	private final ServerSentEventPreamble preamble;

	/**
	 * Acquires a builder for {@link ServerSentEventConfig} instances, seeded with default values.
	 *
	 * @return the builder
	 */
	@NonNull
	public static Builder withDefaults() {
		return new Builder();
	}

	protected ServerSentEventConfig(@NonNull Builder builder) {
		requireNonNull(builder);

		this.lifecycleObserver = builder.lifecycleObserver == null ? LifecycleObserver.defaultInstance() : builder.lifecycleObserver;
		this.encoder = builder.encoder == null ? ServerSentEventEncoder.defaultInstance() : builder.encoder;
		this.preamble = builder.preamble;
	}

	/**
	 * Vends a mutable copier seeded with this instance's data, suitable for building new instances.
	 *
	 * @return a copier for this instance
	 */
	@NonNull
	public Builder copy() {
		return new Builder()
				.lifecycleObserver(getLifecycleObserver())
				.encoder(getEncoder())
				.preamble(getPreamble().orElse(null));
	}

	@NonNull
	public LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}

	@NonNull
	public ServerSentEventEncoder getEncoder() {
		return this.encoder;
	}

	@NonNull
	public Optional<ServerSentEventPreamble> getPreamble() {
		return Optional.ofNullable(this.preamble);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{lifecycleObserver=%s, encoder=%s, preamble=%s}", getClass().getSimpleName(),
				getLifecycleObserver(), getEncoder(), getPreamble().orElse(null));
	}

	/**
	 * Builder used to construct instances of {@link ServerSentEventConfig} via {@link ServerSentEventConfig#withDefaults()}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@Nullable
		private LifecycleObserver lifecycleObserver;
		@Nullable
		private ServerSentEventEncoder encoder;
		@Nullable
		private ServerSentEventPreamble preamble;

		protected Builder() {
			// Nothing to do
		}

		@NonNull
		public Builder lifecycleObserver(@Nullable LifecycleObserver lifecycleObserver) {
			this.lifecycleObserver = lifecycleObserver;
			return this;
		}

		@NonNull
		public Builder encoder(@Nullable ServerSentEventEncoder encoder) {
			this.encoder = encoder;
			return this;
		}

		@NonNull
		public Builder preamble(@Nullable ServerSentEventPreamble preamble) {
			this.preamble = preamble;
			return this;
		}

		@NonNull
		public ServerSentEventConfig build() {
			return new ServerSentEventConfig(this);
		}
	}
}
