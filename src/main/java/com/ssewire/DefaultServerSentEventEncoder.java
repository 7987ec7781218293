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

import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;

import static java.util.Objects.requireNonNull;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class DefaultServerSentEventEncoder implements ServerSentEventEncoder {
	@NonNull
	private static final DefaultServerSentEventEncoder DEFAULT_INSTANCE;
	@NonNull
	static final String HEARTBEAT_COMMENT_PAYLOAD;
	@NonNull
	private static final Integer DEFAULT_SSE_BUILDER_CAPACITY;

	static {
		DEFAULT_INSTANCE = new DefaultServerSentEventEncoder();
		HEARTBEAT_COMMENT_PAYLOAD = ":\n\n";
		DEFAULT_SSE_BUILDER_CAPACITY = 256;
	}

	@NonNull
	public static DefaultServerSentEventEncoder defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	private DefaultServerSentEventEncoder() {
		// Nothing to do
	}

	@NonNull
	@Override
	public String formatEvent(@NonNull ServerSentEvent serverSentEvent) {
		requireNonNull(serverSentEvent);

		StringBuilder sb = new StringBuilder(DEFAULT_SSE_BUILDER_CAPACITY);
		boolean hasField = false;

		// 1. ID
		String id = serverSentEvent.getId().orElse(null);

		if (id != null) {
			sb.append("id: ").append(id).append('\n');
			hasField = true;
		}

		// 2. Event name (only if explicitly specified - "message" is implied otherwise)
		if (serverSentEvent.hasExplicitEvent()) {
			sb.append("event: ").append(serverSentEvent.getEvent()).append('\n');
			hasField = true;
		}

		// 3. Data, one line per segment.
		// We perform a manual scan to avoid Regex compilation and array allocation.
		String data = serverSentEvent.getData();
		int len = data.length();

		if (len > 0) {
			hasField = true;
			int start = 0;

			for (int i = 0; i < len; i++) {
				char c = data.charAt(i);

				if (c == '\n' || c == '\r') {
					sb.append("data: ").append(data, start, i).append('\n');

					// Treat CRLF as a single break
					if (c == '\r' && (i + 1) < len && data.charAt(i + 1) == '\n')
						i++;

					start = i + 1;
				}
			}

			// A trailing line break yields a final empty "data: " line so the break survives decoding
			sb.append("data: ").append(data, start, len).append('\n');
		}

		// 4. Retry
		Duration retry = serverSentEvent.getRetry().orElse(null);

		if (retry != null) {
			sb.append("retry: ").append(retry.toMillis()).append('\n');
			hasField = true;
		}

		// An event with no fields is written as a heartbeat comment, not a bare blank line
		if (!hasField)
			return HEARTBEAT_COMMENT_PAYLOAD;

		// Terminate the frame
		sb.append('\n');

		return sb.toString();
	}

	@NonNull
	@Override
	public String formatComment(@NonNull ServerSentEventComment serverSentEventComment) {
		requireNonNull(serverSentEventComment);

		String comment = serverSentEventComment.getComment().orElse(null);

		if (comment == null || comment.isEmpty())
			return HEARTBEAT_COMMENT_PAYLOAD;

		StringBuilder stringBuilder = new StringBuilder(DEFAULT_SSE_BUILDER_CAPACITY);
		int len = comment.length();
		int start = 0;

		for (int i = 0; i < len; i++) {
			char c = comment.charAt(i);

			if (c == '\n' || c == '\r') {
				appendCommentLine(stringBuilder, comment, start, i);

				if (c == '\r' && (i + 1) < len && comment.charAt(i + 1) == '\n')
					i++;

				start = i + 1;
			}
		}

		appendCommentLine(stringBuilder, comment, start, len);
		stringBuilder.append('\n');

		return stringBuilder.toString();
	}

	private void appendCommentLine(@NonNull StringBuilder stringBuilder,
																 @NonNull String comment,
																 int start,
																 int end) {
		stringBuilder.append(':');

		if (end > start)
			stringBuilder.append(' ').append(comment, start, end);

		stringBuilder.append('\n');
	}
}
