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
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Encapsulates a <a href="https://developer.mozilla.org/en-US/docs/Web/API/Server-sent_events/Using_server-sent_events">Server-Sent Event</a> payload that can be sent across the wire to a client.
 * <p>
 * For example:
 * <pre>{@code  ServerSentEvent event = ServerSentEvent.withEvent("stock_update")
 *   .data("""
 *     {
 *       "symbol": "ABC",
 *       "price": 12.34
 *     }
 *     """)
 *   .id("42")
 *   .retry(Duration.ofSeconds(5))
 *   .build();}</pre>
 * <p>
 * Threadsafe instances can be acquired via these builder factory methods:
 * <ul>
 *   <li>{@link #withEvent(String)} (builder primed with an event value)</li>
 *   <li>{@link #withData(String)} (builder primed with a data value)</li>
 *   <li>{@link #withDefaults()} ("empty" builder suitable for constructing special cases like {@code retry}-only or {@code id}-only events.)</li>
 * </ul>
 * <p>
 * If no {@code event} value is specified, {@link #getEvent()} reports {@value #DEFAULT_EVENT}, which is what browsers assume for frames without an {@code event:} line.
 * An empty {@code event} or {@code id} is treated as if it had not been specified at all, so such an event is equal to
 * whatever it decodes back to.
 * <p>
 * Formal specification is available at <a href="https://html.spec.whatwg.org/multipage/server-sent-events.html#server-sent-events">https://html.spec.whatwg.org/multipage/server-sent-events.html#server-sent-events</a>.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class ServerSentEvent {
	/**
	 * The {@code event} value reported for events that do not specify one.
	 */
	@NonNull
	public static final String DEFAULT_EVENT = "message";

	@Nullable
	private final String id;
	@Nullable
	private final String event;
	@NonNull
	private final String data;
	@Nullable
	private final Duration retry;

	/**
	 * Acquires a builder for {@link ServerSentEvent} instances, seeded with an {@code event} value.
	 *
	 * @param event the {@code event} value for the instance
	 * @return the builder
	 */
	@NonNull
	public static Builder withEvent(@Nullable String event) {
		return new Builder().event(event);
	}

	/**
	 * Acquires a builder for {@link ServerSentEvent} instances, seeded with a {@code data} value.
	 *
	 * @param data the {@code data} value for the instance
	 * @return the builder
	 */
	@NonNull
	public static Builder withData(@Nullable String data) {
		return new Builder().data(data);
	}

	/**
	 * Acquires an "empty" builder for {@link ServerSentEvent} instances, useful for creating special cases like {@code retry}-only or {@code id}-only events.
	 *
	 * @return the builder
	 */
	@NonNull
	public static Builder withDefaults() {
		return new Builder();
	}

	protected ServerSentEvent(@NonNull Builder builder) {
		requireNonNull(builder);

		// Empty id and event values are treated as unspecified
		this.id = builder.id == null || builder.id.isEmpty() ? null : builder.id;
		this.event = builder.event == null || builder.event.isEmpty() ? null : builder.event;
		this.data = builder.data == null ? "" : builder.data;
		this.retry = builder.retry;

		// Ensure legal construction

		if (this.retry != null && this.retry.isNegative())
			throw new IllegalArgumentException(format("%s 'retry' values must be non-negative. You supplied '%s'",
					ServerSentEvent.class.getSimpleName(), this.retry));

		if (this.event != null && containsLineBreaks(this.event))
			throw new IllegalArgumentException(format("%s 'event' values must not contain CR or LF characters. You supplied '%s'",
					ServerSentEvent.class.getSimpleName(), Utilities.printableString(this.event)));

		if (this.id != null && (containsLineBreaks(this.id) || this.id.contains("\u0000")))
			throw new IllegalArgumentException(format("%s 'id' values must not contain NUL (\\u0000), CR, or LF characters. You supplied '%s'",
					ServerSentEvent.class.getSimpleName(), Utilities.printableString(this.id)));
	}

	@NonNull
	private Boolean containsLineBreaks(@NonNull String string) {
		requireNonNull(string);
		return string.indexOf('\n') >= 0 || string.indexOf('\r') >= 0;
	}

	/**
	 * Vends a mutable copier seeded with this instance's data, suitable for building new instances.
	 *
	 * @return a copier for this instance
	 */
	@NonNull
	public Builder copy() {
		return new Builder()
				.id(this.id)
				.event(this.event)
				.data(this.data)
				.retry(this.retry);
	}

	/**
	 * Builder used to construct instances of {@link ServerSentEvent} via {@link ServerSentEvent#withEvent(String)}, {@link ServerSentEvent#withData(String)}, or {@link ServerSentEvent#withDefaults()}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@Nullable
		private String id;
		@Nullable
		private String event;
		@Nullable
		private String data;
		@Nullable
		private Duration retry;

		protected Builder() {
			// Nothing to do
		}

		@NonNull
		public Builder id(@Nullable String id) {
			this.id = id;
			return this;
		}

		@NonNull
		public Builder event(@Nullable String event) {
			this.event = event;
			return this;
		}

		@NonNull
		public Builder data(@Nullable String data) {
			this.data = data;
			return this;
		}

		@NonNull
		public Builder retry(@Nullable Duration retry) {
			this.retry = retry;
			return this;
		}

		@NonNull
		public ServerSentEvent build() {
			return new ServerSentEvent(this);
		}
	}

	/**
	 * Is this a degenerate event, i.e. one that carries no fields at all?
	 * <p>
	 * Decoding a frame made only of comment or blank lines produces such an event. Consumers are free to ignore it.
	 *
	 * @return {@code true} if no {@code id}, explicit {@code event}, {@code data}, or {@code retry} value is present
	 */
	@NonNull
	public Boolean isEmpty() {
		return this.id == null && this.event == null && this.data.isEmpty() && this.retry == null;
	}

	@Override
	@NonNull
	public String toString() {
		List<String> components = new ArrayList<>(4);

		components.add(format("event=%s", getEvent()));

		if (this.id != null)
			components.add(format("id=%s", this.id));
		if (this.retry != null)
			components.add(format("retry=%s", this.retry));
		if (!this.data.isEmpty())
			components.add(format("data=%s", this.data.trim()));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(Collectors.joining(", ")));
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ServerSentEvent serverSentEvent))
			return false;

		return Objects.equals(getId(), serverSentEvent.getId())
				&& Objects.equals(getEvent(), serverSentEvent.getEvent())
				&& Objects.equals(getData(), serverSentEvent.getData())
				&& Objects.equals(getRetry(), serverSentEvent.getRetry());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getId(), getEvent(), getData(), getRetry());
	}

	/**
	 * The {@code id} for this Server-Sent Event.
	 *
	 * @return the optional {@code id} for this Server-Sent Event
	 */
	@NonNull
	public Optional<String> getId() {
		return Optional.ofNullable(this.id);
	}

	/**
	 * The {@code event} value for this Server-Sent Event, or {@value #DEFAULT_EVENT} if none was specified.
	 *
	 * @return the {@code event} value for this Server-Sent Event
	 */
	@NonNull
	public String getEvent() {
		return this.event == null ? DEFAULT_EVENT : this.event;
	}

	/**
	 * Was an {@code event} value explicitly specified for this Server-Sent Event?
	 * <p>
	 * Encoders only emit an {@code event:} line for explicitly-specified, non-empty values.
	 *
	 * @return {@code true} if an {@code event} value was specified
	 */
	@NonNull
	public Boolean hasExplicitEvent() {
		return this.event != null;
	}

	/**
	 * The {@code data} payload for this Server-Sent Event.
	 * <p>
	 * Multiline payloads are joined with {@code \n}. This is the empty string if no data was specified.
	 *
	 * @return the {@code data} payload for this Server-Sent Event
	 */
	@NonNull
	public String getData() {
		return this.data;
	}

	/**
	 * The {@code retry} duration for this Server-Sent Event.
	 *
	 * @return the optional {@code retry} duration for this Server-Sent Event
	 */
	@NonNull
	public Optional<Duration> getRetry() {
		return Optional.ofNullable(this.retry);
	}
}
