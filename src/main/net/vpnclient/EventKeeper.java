/*
 * EventKeeper.java
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

import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Receives counts and timings from the scheduling machinery so that an embedding
 *  application can watch how much work is retried, delayed, queued and cancelled.<br>
 * <br>
 * Implementations must be thread-safe. Timers fire on the timer pool, operations
 *  start on the worker pool, and retries are counted on whichever thread delivered the
 *  failed attempt.
 */
public interface EventKeeper {

	/**
	 * Adds {@code amt} occurrences of {@code event}.
	 *
	 * @param event the event that occurred
	 * @param amt how many times it occurred
	 */
	void count(Event event, long amt);

	default void increment(Event event) {
		count(event, 1L);
	}

	/**
	 * Records one occurrence of a timed event that took {@code nanos}. The event should
	 *  report {@code true} from {@link Event#isTimeEvent()}.
	 *
	 * @param event the timed event
	 * @param nanos the elapsed time in nanoseconds
	 */
	void timeNanos(Event event, long nanos);

	default void time(Event event, long duration, TimeUnit unit) {
		timeNanos(event, unit.toNanos(duration));
	}

	/**
	 * @param event the event to look up
	 * @return how often {@code event} was recorded, or 0 if never
	 */
	long getCount(Event event);

	/**
	 * @param event the timed event to look up
	 * @return the accumulated nanoseconds for {@code event}, or 0 if never recorded
	 */
	long getTimeNanos(Event event);

	/**
	 * Returns the accumulated time for {@code event} converted to {@code unit}. The
	 *  conversion truncates.
	 *
	 * @param event the timed event to look up
	 * @param unit the unit to report in
	 * @return the accumulated time
	 */
	default long getTime(Event event, TimeUnit unit) {
		return unit.convert(getTimeNanos(event), TimeUnit.NANOSECONDS);
	}

	/**
	 * Returns an immutable copy of every count recorded so far, keyed by event.
	 *
	 * @return the recorded counts
	 */
	Map<Event, Long> snapshot();

	/**
	 * Identifies a kind of event. Implementations need stable {@code equals} and
	 *  {@code hashCode} since keepers use events as map keys.
	 */
	interface Event {
		String name();

		default boolean isTimeEvent() {
			return false;
		}
	}

	/**
	 * The events recorded by this library.
	 */
	enum Events implements Event {
		/**
		 * A retry loop started another attempt after a failure.
		 */
		RETRY_ATTEMPTS,
		/**
		 * A retry loop gave up and resolved with its last failure.
		 */
		RETRIES_EXHAUSTED,
		TIMERS_FIRED,
		OPERATIONS_STARTED,
		/**
		 * An operation was cancelled before its body ran.
		 */
		OPERATIONS_CANCELLED,
		OPERATIONS_FINISHED,
		/**
		 * Time between an operation becoming ready and a worker starting it.
		 */
		OPERATION_QUEUE_WAIT_NANOS {
			@Override
			public boolean isTimeEvent() {
				return true;
			}
		};
	}
}
