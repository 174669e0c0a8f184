/*
 * RetryStrategy.java
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
package net.vpnclient.async;

import java.util.Objects;

/**
 * How often a computation is attempted and how long to pause between attempts.
 *
 * @see Futures#retry
 */
public final class RetryStrategy {
	private final int maxAttempts;
	private final WaitPolicy waitPolicy;
	private final TimerKind timerKind;

	/**
	 * @param maxAttempts the total number of attempts, including the first
	 * @param waitPolicy the pauses between attempts
	 * @param timerKind the clock the pauses are measured against
	 */
	public RetryStrategy(int maxAttempts, WaitPolicy waitPolicy, TimerKind timerKind) {
		if(maxAttempts < 1)
			throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
		this.maxAttempts = maxAttempts;
		this.waitPolicy = Objects.requireNonNull(waitPolicy, "waitPolicy must not be null");
		this.timerKind = Objects.requireNonNull(timerKind, "timerKind must not be null");
	}

	public RetryStrategy(int maxAttempts, WaitPolicy waitPolicy) {
		this(maxAttempts, waitPolicy, TimerKind.DEADLINE);
	}

	/**
	 * Tries {@code maxAttempts} times in a row without pausing.
	 *
	 * @param maxAttempts the total number of attempts
	 *
	 * @return a strategy that retries immediately
	 */
	public static RetryStrategy immediate(int maxAttempts) {
		return new RetryStrategy(maxAttempts, WaitPolicy.immediate());
	}

	public int getMaxAttempts() {
		return maxAttempts;
	}

	public WaitPolicy getWaitPolicy() {
		return waitPolicy;
	}

	public TimerKind getTimerKind() {
		return timerKind;
	}

	@Override
	public String toString() {
		return "RetryStrategy(maxAttempts=" + maxAttempts + ", wait=" + waitPolicy + ", timer=" + timerKind + ")";
	}
}
