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

package com.ssewire.util;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import ch.qos.logback.core.util.StatusPrinter;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;
import org.slf4j.bridge.SLF4JBridgeHandler;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.LogManager;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Bootstraps Logback for applications that host SSEWire.
 * <p>
 * SSEWire itself only depends on the SLF4J API; this is a convenience for applications that want Logback as their
 * backend and want {@code java.util.logging} output (for example, from the JDK's HTTP client) routed through it too.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class LoggingUtils {
	@NonNull
	private static final Object LOCK;

	static {
		LOCK = new Object();
	}

	/**
	 * Options for {@link #initializeLogback(Path, LogbackOption...)}.
	 */
	public enum LogbackOption {
		/**
		 * Print Logback's internal status if configuration produced errors or warnings.
		 */
		DEBUGGING_ENABLED
	}

	private LoggingUtils() {
		// Non-instantiable
	}

	/**
	 * Resets Logback, configures it from the given file, and bridges {@code java.util.logging} to SLF4J.
	 *
	 * @param logbackConfigurationFile the Logback XML configuration file
	 * @param logbackOptions           optional initialization behaviors
	 * @throws IllegalArgumentException if the file does not exist or is not a regular file
	 * @throws IllegalStateException    if SLF4J is not bound to Logback or the configuration is invalid
	 */
	public static void initializeLogback(@NonNull Path logbackConfigurationFile,
																			 @Nullable LogbackOption... logbackOptions) {
		requireNonNull(logbackConfigurationFile);

		List<LogbackOption> logbackOptionsAsList = logbackOptions == null ? Collections.emptyList() : Arrays.asList(logbackOptions);

		synchronized (LOCK) {
			if (!Files.exists(logbackConfigurationFile))
				throw new IllegalArgumentException(format("Unable to initialize Logback logging. Could not find a configuration file at %s",
						logbackConfigurationFile.toAbsolutePath()));

			if (!Files.isRegularFile(logbackConfigurationFile))
				throw new IllegalArgumentException(format("Unable to initialize Logback logging. The configuration path %s does not appear to be a regular file",
						logbackConfigurationFile.toAbsolutePath()));

			ILoggerFactory loggerFactory = LoggerFactory.getILoggerFactory();

			if (!(loggerFactory instanceof LoggerContext loggerContext))
				throw new IllegalStateException(format("Unable to initialize Logback logging. SLF4J is bound to %s instead of Logback",
						loggerFactory.getClass().getName()));

			uninstallJulBridge();

			try {
				JoranConfigurator configurator = new JoranConfigurator();
				configurator.setContext(loggerContext);
				loggerContext.reset();
				configurator.doConfigure(logbackConfigurationFile.toFile().getAbsolutePath());
			} catch (JoranException e) {
				throw new IllegalStateException(format("Unable to configure Logback logging from %s", logbackConfigurationFile.toAbsolutePath()), e);
			}

			if (logbackOptionsAsList.contains(LogbackOption.DEBUGGING_ENABLED))
				StatusPrinter.printInCaseOfErrorsOrWarnings(loggerContext);

			// Bridge all java.util.logging to SLF4J
			java.util.logging.Logger rootLogger = LogManager.getLogManager().getLogger("");

			for (Handler handler : rootLogger.getHandlers())
				rootLogger.removeHandler(handler);

			SLF4JBridgeHandler.install();
		}
	}

	/**
	 * Stops routing {@code java.util.logging} through SLF4J. Safe to call even if the bridge was never installed.
	 */
	public static void uninstallJulBridge() {
		synchronized (LOCK) {
			if (SLF4JBridgeHandler.isInstalled())
				SLF4JBridgeHandler.uninstall();
		}
	}

	/**
	 * Is {@code java.util.logging} currently routed through SLF4J?
	 *
	 * @return {@code true} if the bridge is installed
	 */
	public static boolean isJulBridgeInstalled() {
		synchronized (LOCK) {
			return SLF4JBridgeHandler.isInstalled();
		}
	}
}
