/*
 * Scheduler.java
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

import java.time.Duration;

/**
 * Runs tasks after a delay. Every timer-based combinator takes its {@code Scheduler}
 *  as an argument; there is no process-wide default.
 *
 * @see ScheduledTimer
 */
public interface Scheduler {
	/**
	 * Schedules {@code task} to run once after {@code delay} has elapsed on the clock
	 *  selected by {@code kind}. The task runs at most once and never after the returned
	 *  handle has been cancelled.
	 *
	 * @param delay how long to wait, must not be negative
	 * @param kind the clock against which {@code delay} is measured
	 * @param task the routine to run
	 *
	 * @return a handle that abandons the timer if it has not fired yet
	 *
	 * @throws IllegalArgumentException if {@code delay} is negative
	 */
	Cancellable schedule(Duration delay, TimerKind kind, Runnable task);
}
