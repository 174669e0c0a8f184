/*
 * RuntimeOptions.java
 *
 * This source file is part of the vpnclient-async open source project
 *
 * Copyright 2020-2026 the vpnclient-async project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package net.vpnclient;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Settings for an {@link AsyncRuntime}. Build with {@link #builder()} or read from
 *  {@link Properties} with {@link #fromProperties(Properties)}; the recognized keys are
 *  the {@code KEY_} constants of this class. Unset keys take their defaults.
 */
public final class RuntimeOptions {
	public static final String PREFIX = "vpnclient.async.";
	public static final String KEY_WORKER_THREADS = PREFIX + "workerThreads";
	public static final String KEY_TIMER_THREADS = PREFIX + "timerThreads";
	public static final String KEY_THREAD_NAME_PREFIX = PREFIX + "threadNamePrefix";
	public static final String KEY_WALL_CLOCK_CHECK_MILLIS = PREFIX + "wallClockCheckMillis";
	public static final String KEY_SHUTDOWN_TIMEOUT_MILLIS = PREFIX + "shutdownTimeoutMillis";

	public static final int DEFAULT_TIMER_THREADS = 1;
	public static final String DEFAULT_THREAD_NAME_PREFIX = "vpnclient-async";
	public static final long DEFAULT_WALL_CLOCK_CHECK_MILLIS = 1000L;
	public static final long DEFAULT_SHUTDOWN_TIMEOUT_MILLIS = 5000L;

	private final int workerThreads;
	private final int timerThreads;
	private final String threadNamePrefix;
	private final Duration wallClockCheckInterval;
	private final Duration shutdownTimeout;

	private RuntimeOptions(Builder builder) {
		this.workerThreads = builder.workerThreads;
		this.timerThreads = builder.timerThreads;
		this.threadNamePrefix = builder.threadNamePrefix;
		this.wallClockCheckInterval = builder.wallClockCheckInterval;
		this.shutdownTimeout = builder.shutdownTimeout;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * @return options with every setting at its default
	 */
	public static RuntimeOptions defaults() {
		return builder().build();
	}

	/**
	 * Reads options from {@code properties}.
	 *
	 * @param properties the source of settings
	 *
	 * @return the parsed options
	 *
	 * @throws IllegalArgumentException if a recognized key holds an invalid value
	 */
	public static RuntimeOptions fromProperties(Properties properties) {
		Objects.requireNonNull(properties, "properties must not be null");
		Builder builder = builder();
		String value = trimmed(properties, KEY_WORKER_THREADS);
		if(value != null)
			builder.workerThreads(parseInt(KEY_WORKER_THREADS, value));
		value = trimmed(properties, KEY_TIMER_THREADS);
		if(value != null)
			builder.timerThreads(parseInt(KEY_TIMER_THREADS, value));
		value = trimmed(properties, KEY_THREAD_NAME_PREFIX);
		if(value != null)
			builder.threadNamePrefix(value);
		value = trimmed(properties, KEY_WALL_CLOCK_CHECK_MILLIS);
		if(value != null)
			builder.wallClockCheckInterval(Duration.ofMillis(parseLong(KEY_WALL_CLOCK_CHECK_MILLIS, value)));
		value = trimmed(properties, KEY_SHUTDOWN_TIMEOUT_MILLIS);
		if(value != null)
			builder.shutdownTimeout(Duration.ofMillis(parseLong(KEY_SHUTDOWN_TIMEOUT_MILLIS, value)));
		return builder.build();
	}

	public static RuntimeOptions fromSystemProperties() {
		return fromProperties(System.getProperties());
	}

	private static String trimmed(Properties properties, String key) {
		String value = properties.getProperty(key);
		return value == null ? null : value.trim();
	}

	private static int parseInt(String key, String value) {
		try {
			return Integer.parseInt(value);
		} catch(NumberFormatException e) {
			throw new IllegalArgumentException(key + " must be an integer, got \"" + value + "\"", e);
		}
	}

	private static long parseLong(String key, String value) {
		try {
			return Long.parseLong(value);
		} catch(NumberFormatException e) {
			throw new IllegalArgumentException(key + " must be an integer, got \"" + value + "\"", e);
		}
	}

	public int getWorkerThreads() {
		return workerThreads;
	}

	public int getTimerThreads() {
		return timerThreads;
	}

	public String getThreadNamePrefix() {
		return threadNamePrefix;
	}

	public Duration getWallClockCheckInterval() {
		return wallClockCheckInterval;
	}

	public Duration getShutdownTimeout() {
		return shutdownTimeout;
	}

	@Override
	public String toString() {
		return "RuntimeOptions(workerThreads=" + workerThreads + ", timerThreads=" + timerThreads
		       + ", threadNamePrefix=" + threadNamePrefix + ", wallClockCheckInterval=" + wallClockCheckInterval
		       + ", shutdownTimeout=" + shutdownTimeout + ")";
	}

	/**
	 * Collects settings for a {@link RuntimeOptions}.
	 */
	public static final class Builder {
		private int workerThreads = Runtime.getRuntime().availableProcessors();
		private int timerThreads = DEFAULT_TIMER_THREADS;
		private String threadNamePrefix = DEFAULT_THREAD_NAME_PREFIX;
		private Duration wallClockCheckInterval = Duration.ofMillis(DEFAULT_WALL_CLOCK_CHECK_MILLIS);
		private Duration shutdownTimeout = Duration.ofMillis(DEFAULT_SHUTDOWN_TIMEOUT_MILLIS);

		private Builder() {}

		public Builder workerThreads(int workerThreads) {
			if(workerThreads < 1)
				throw new IllegalArgumentException(KEY_WORKER_THREADS + " must be at least 1, got " + workerThreads);
			this.workerThreads = workerThreads;
			return this;
		}

		public Builder timerThreads(int timerThreads) {
			if(timerThreads < 1)
				throw new IllegalArgumentException(KEY_TIMER_THREADS + " must be at least 1, got " + timerThreads);
			this.timerThreads = timerThreads;
			return this;
		}

		public Builder threadNamePrefix(String threadNamePrefix) {
			if(threadNamePrefix == null || threadNamePrefix.isEmpty())
				throw new IllegalArgumentException(KEY_THREAD_NAME_PREFIX + " must not be empty");
			this.threadNamePrefix = threadNamePrefix;
			return this;
		}

		public Builder wallClockCheckInterval(Duration interval) {
			Objects.requireNonNull(interval, "interval must not be null");
			if(interval.isZero() || interval.isNegative())
				throw new IllegalArgumentException(KEY_WALL_CLOCK_CHECK_MILLIS + " must be positive, got " + interval.toMillis());
			this.wallClockCheckInterval = interval;
			return this;
		}

		public Builder shutdownTimeout(Duration timeout) {
			Objects.requireNonNull(timeout, "timeout must not be null");
			if(timeout.isNegative())
				throw new IllegalArgumentException(KEY_SHUTDOWN_TIMEOUT_MILLIS + " must not be negative, got " + timeout.toMillis());
			this.shutdownTimeout = timeout;
			return this;
		}

		public RuntimeOptions build() {
			return new RuntimeOptions(this);
		}
	}
}
