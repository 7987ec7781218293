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
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Encapsulates a Server-Sent Event comment, which is written to the wire as one or more lines prefixed with {@code :}.
 * <p>
 * Clients never surface comments as events; they are useful for keeping idle connections alive through proxies
 * and for detecting dead peers (a failed comment write closes the connection just like a failed event write).
 * <p>
 * Use {@link #withComment(String)} for an application-provided comment or {@link #withHeartbeat()} for a bare {@code ":"} keep-alive.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class ServerSentEventComment {
	@NonNull
	private static final ServerSentEventComment HEARTBEAT;

	static {
		HEARTBEAT = new ServerSentEventComment(null, CommentType.HEARTBEAT);
	}

	@Nullable
	private final String comment;
	@NonNull
	private final CommentType commentType;

	/**
	 * Types of Server-Sent Event comments.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	public enum CommentType {
		/**
		 * Application-provided comment.
		 */
		COMMENT,
		/**
		 * Keep-alive/heartbeat comment.
		 */
		HEARTBEAT
	}

	/**
	 * Acquires a comment with the given payload.
	 * <p>
	 * Payloads containing line breaks are written as multiple comment lines. An empty payload is written as a bare {@code ":"} line.
	 *
	 * @param comment the comment payload
	 * @return the comment
	 */
	@NonNull
	public static ServerSentEventComment withComment(@NonNull String comment) {
		requireNonNull(comment);
		return new ServerSentEventComment(comment, CommentType.COMMENT);
	}

	/**
	 * Acquires the heartbeat comment.
	 * <p>
	 * Heartbeat comments do not carry a payload; {@link #getComment()} will be empty.
	 *
	 * @return the heartbeat comment
	 */
	@NonNull
	public static ServerSentEventComment withHeartbeat() {
		return HEARTBEAT;
	}

	private ServerSentEventComment(@Nullable String comment,
																 @NonNull CommentType commentType) {
		requireNonNull(commentType);

		this.comment = comment;
		this.commentType = commentType;
	}

	/**
	 * The comment payload.
	 * <p>
	 * Heartbeat comments return {@link Optional#empty()}.
	 *
	 * @return the comment payload
	 */
	@NonNull
	public Optional<String> getComment() {
		return Optional.ofNullable(this.comment);
	}

	/**
	 * The comment type.
	 *
	 * @return the comment type
	 */
	@NonNull
	public CommentType getCommentType() {
		return this.commentType;
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ServerSentEventComment serverSentEventComment))
			return false;

		return Objects.equals(getComment(), serverSentEventComment.getComment())
				&& Objects.equals(getCommentType(), serverSentEventComment.getCommentType());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getComment(), getCommentType());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{commentType=%s, comment=%s}", getClass().getSimpleName(), this.commentType, this.comment);
	}
}
