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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;

import static java.util.Objects.requireNonNull;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class DefaultLifecycleObserver implements LifecycleObserver {
	@NonNull
	private static final DefaultLifecycleObserver DEFAULT_INSTANCE;
	@NonNull
	private static final Logger LOGGER;

	static {
		DEFAULT_INSTANCE = new DefaultLifecycleObserver();
		LOGGER = LoggerFactory.getLogger("com.ssewire.LifecycleObserver");
	}

	@NonNull
	public static DefaultLifecycleObserver defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	static void logToSlf4j(@NonNull LogEvent logEvent) {
		requireNonNull(logEvent);

		String connectionDescription = logEvent.getConnectionId()
				.map(connectionId -> " (connection " + connectionId + ")")
				.orElse("");

		Throwable throwable = logEvent.getThrowable().orElse(null);

		if (throwable == null)
			LOGGER.warn("[{}] {}{}", logEvent.getLogEventType().name(), logEvent.getMessage(), connectionDescription);
		else
			LOGGER.error("[{}] {}{}", logEvent.getLogEventType().name(), logEvent.getMessage(), connectionDescription, throwable);
	}

	// No method overrides
}
