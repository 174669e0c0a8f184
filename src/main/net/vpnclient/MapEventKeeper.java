/*
 * MapEventKeeper.java
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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * An in-memory {@link EventKeeper}. Besides counts and total time, timed events keep the
 *  longest single timing recorded.
 */
public class MapEventKeeper implements EventKeeper {
	private final ConcurrentMap<Event, Tally> tallies = new ConcurrentHashMap<>();

	/**
	 * {@inheritDoc}
	 *
	 * @throws IllegalArgumentException if {@code amt} is negative
	 */
	@Override
	public void count(Event event, long amt) {
		if(amt < 0)
			throw new IllegalArgumentException("Cannot count " + event.name() + " a negative number of times: " + amt);
		tallyOf(event).occurrences.add(amt);
	}

	/**
	 * {@inheritDoc}
	 *
	 * @throws IllegalArgumentException if {@code event} is not a time event or {@code nanos} is negative
	 */
	@Override
	public void timeNanos(Event event, long nanos) {
		if(!event.isTimeEvent())
			throw new IllegalArgumentException(event.name() + " is not a time event");
		if(nanos < 0)
			throw new IllegalArgumentException("Negative timing for " + event.name() + ": " + nanos);
		Tally tally = tallyOf(event);
		tally.occurrences.increment();
		tally.totalNanos.add(nanos);
		tally.longestNanos.accumulateAndGet(nanos, Math::max);
	}

	@Override
	public long getCount(Event event) {
		Tally tally = tallies.get(event);
		return tally == null ? 0L : tally.occurrences.sum();
	}

	@Override
	public long getTimeNanos(Event event) {
		Tally tally = tallies.get(event);
		return tally == null ? 0L : tally.totalNanos.sum();
	}

	/**
	 * @param event the timed event to look up
	 * @return the longest single timing recorded for {@code event}, or 0 if never recorded
	 */
	public long getLongestTimeNanos(Event event) {
		Tally tally = tallies.get(event);
		return tally == null ? 0L : tally.longestNanos.get();
	}

	/**
	 * {@inheritDoc}
	 *  Events are ordered by name so that logged snapshots line up between runs.
	 */
	@Override
	public Map<Event, Long> snapshot() {
		List<Event> events = new ArrayList<>(tallies.keySet());
		events.sort(Comparator.comparing(Event::name));
		Map<Event, Long> copy = new LinkedHashMap<>();
		for(Event event : events) {
			copy.put(event, getCount(event));
		}
		return Collections.unmodifiableMap(copy);
	}

	/**
	 * Forgets every recorded event.
	 */
	public void reset() {
		tallies.clear();
	}

	private Tally tallyOf(Event event) {
		return tallies.computeIfAbsent(event, ignore -> new Tally());
	}

	private static final class Tally {
		private final LongAdder occurrences = new LongAdder();
		private final LongAdder totalNanos = new LongAdder();
		private final AtomicLong longestNanos = new AtomicLong();
	}
}
