/*
 * WaitPolicy.java
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
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * The sequence of pauses a retry loop takes between attempts. A policy is immutable;
 *  each retry loop draws from its own {@link #iterator()}, so a single policy can be
 *  shared between loops. When the sequence runs out the loop stops retrying, exactly as
 *  if its attempt budget had been spent.
 */
public final class WaitPolicy {
	private static final WaitPolicy IMMEDIATE = constant(Duration.ZERO);

	private final Supplier<Iterator<Duration>> waits;
	private final String description;

	private WaitPolicy(Supplier<Iterator<Duration>> waits, String description) {
		this.waits = waits;
		this.description = description;
	}

	/**
	 * Retries without pausing.
	 *
	 * @return a policy that always waits zero
	 */
	public static WaitPolicy immediate() {
		return IMMEDIATE;
	}

	public static WaitPolicy constant(Duration wait) {
		checkWait(wait, "wait");
		return new WaitPolicy(() -> new Iterator<Duration>() {
			@Override
			public boolean hasNext() {
				return true;
			}

			@Override
			public Duration next() {
				return wait;
			}
		}, "constant(" + wait + ")");
	}

	/**
	 * Doubles the wait after every retry, starting at {@code initial} and never
	 *  exceeding {@code max}.
	 *
	 * @param initial the first wait
	 * @param max the upper bound for every wait
	 *
	 * @return an unbounded exponential backoff policy
	 */
	public static WaitPolicy exponential(Duration initial, Duration max) {
		checkWait(initial, "initial");
		checkWait(max, "max");
		if(max.compareTo(initial) < 0)
			throw new IllegalArgumentException("max " + max + " is shorter than initial " + initial);
		return new WaitPolicy(() -> new Iterator<Duration>() {
			private Duration next = initial;

			@Override
			public boolean hasNext() {
				return true;
			}

			@Override
			public Duration next() {
				Duration current = next;
				Duration doubled = current.multipliedBy(2);
				next = doubled.compareTo(max) > 0 || doubled.compareTo(current) < 0 ? max : doubled;
				return current;
			}
		}, "exponential(" + initial + ", " + max + ")");
	}

	/**
	 * Returns a policy that yields at most {@code count} waits of this one.
	 *
	 * @param count how many waits to allow, zero disabling retries altogether
	 *
	 * @return the capped policy
	 */
	public WaitPolicy limit(int count) {
		if(count < 0)
			throw new IllegalArgumentException("count must not be negative: " + count);
		Supplier<Iterator<Duration>> source = waits;
		return new WaitPolicy(() -> new Iterator<Duration>() {
			private final Iterator<Duration> delegate = source.get();
			private int remaining = count;

			@Override
			public boolean hasNext() {
				return remaining > 0 && delegate.hasNext();
			}

			@Override
			public Duration next() {
				if(!hasNext())
					throw new NoSuchElementException();
				remaining--;
				return delegate.next();
			}
		}, description + ".limit(" + count + ")");
	}

	/**
	 * Starts a fresh sequence of waits.
	 *
	 * @return an iterator over the waits of one retry loop
	 */
	public Iterator<Duration> iterator() {
		return waits.get();
	}

	@Override
	public String toString() {
		return description;
	}

	private static void checkWait(Duration wait, String name) {
		Objects.requireNonNull(wait, name + " must not be null");
		if(wait.isNegative())
			throw new IllegalArgumentException(name + " must not be negative: " + wait);
	}
}
