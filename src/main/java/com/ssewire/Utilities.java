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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;
import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * A non-instantiable collection of utility methods.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Utilities {
	@NonNull
	private static final Pattern HEAD_WHITESPACE_PATTERN;
	@NonNull
	private static final Pattern TAIL_WHITESPACE_PATTERN;

	static {
		// See https://www.regular-expressions.info/unicode.html
		// \p{Z} or \p{Separator}: any kind of whitespace or invisible separator.
		// \s covers ASCII whitespace like tabs, which \p{Z} does not.
		HEAD_WHITESPACE_PATTERN = Pattern.compile("^(\\p{Z}|\\s)+");
		TAIL_WHITESPACE_PATTERN = Pattern.compile("(\\p{Z}|\\s)+$");
	}

	private Utilities() {
		// Non-instantiable
	}

	/**
	 * Returns all values for the given header name, matching the name case-insensitively as required by RFC 9110.
	 * <p>
	 * Values are returned in iteration order of the supplied map, with {@code null} entries skipped.
	 *
	 * @param headers    the headers to search; may be {@code null}
	 * @param headerName the header name to look for
	 * @return the header values, or an empty list if none are present
	 */
	@NonNull
	public static List<@NonNull String> headerValues(@Nullable Map<@Nullable String, @Nullable Set<@Nullable String>> headers,
																									 @NonNull String headerName) {
		requireNonNull(headerName);

		if (headers == null || headers.isEmpty())
			return Collections.emptyList();

		List<String> values = new ArrayList<>();

		for (Entry<String, Set<String>> entry : headers.entrySet()) {
			String name = entry.getKey();

			if (name == null || !name.trim().equalsIgnoreCase(headerName) || entry.getValue() == null)
				continue;

			for (String value : entry.getValue())
				if (value != null)
					values.add(value);
		}

		return values;
	}

	/**
	 * Aggressively trims Unicode whitespace from the given string.
	 * <p>
	 * Header values copy-pasted by humans or mangled by intermediaries often carry non-ASCII separators like
	 * {@code U+202F "Narrow No-Break Space (NNBSP)"} which {@link String#trim()} would leave in place.
	 *
	 * @param string the string to trim
	 * @return the trimmed string, or {@code null} if the input string is {@code null}
	 */
	@Nullable
	public static String trimAggressively(@Nullable String string) {
		if (string == null)
			return null;

		string = HEAD_WHITESPACE_PATTERN.matcher(string).replaceAll("");

		if (string.length() == 0)
			return string;

		return TAIL_WHITESPACE_PATTERN.matcher(string).replaceAll("");
	}

	/**
	 * Aggressively trims Unicode whitespace from the given string and returns {@code null} if the result is empty.
	 *
	 * @param string the input string; may be {@code null}
	 * @return a trimmed, non-empty string; or {@code null} if input was {@code null} or trimmed to empty
	 */
	@Nullable
	public static String trimAggressivelyToNull(@Nullable String string) {
		if (string == null)
			return null;

		string = trimAggressively(string);
		return string.length() == 0 ? null : string;
	}

	/**
	 * Aggressively trims Unicode whitespace from the given string and returns {@code ""} if the input is {@code null}.
	 *
	 * @param string the input string; may be {@code null}
	 * @return a trimmed string (never {@code null}); {@code ""} if input was {@code null}
	 */
	@NonNull
	public static String trimAggressivelyToEmpty(@Nullable String string) {
		if (string == null)
			return "";

		return trimAggressively(string);
	}

	@NonNull
	static String printableString(@NonNull String input) {
		requireNonNull(input);

		StringBuilder out = new StringBuilder(input.length() + 16);

		for (int i = 0; i < input.length(); i++)
			out.append(printableChar(input.charAt(i)));

		return out.toString();
	}

	@NonNull
	static String printableChar(char c) {
		if (c == '\r') return "\\r";
		if (c == '\n') return "\\n";
		if (c == '\t') return "\\t";
		if (c == '\\') return "\\\\";
		if (c == 0) return "\\0";

		if (c < 0x20 || c == 0x7F || Character.isISOControl(c) || Character.getType(c) == Character.FORMAT)
			return String.format("\\u%04X", (int) c);

		return String.valueOf(c);
	}
}
