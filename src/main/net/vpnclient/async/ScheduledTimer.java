/*
 * ScheduledTimer.java
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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import net.vpnclient.EventKeeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link Scheduler} backed by a {@link ScheduledExecutorService}.<br>
 * <br>
 * {@link TimerKind#DEADLINE} timers are handed to the executor as a single delay.
 *  {@link TimerKind#WALL_CLOCK} timers compute a target instant from the supplied
 *  {@link Clock} and are re-armed in slices no longer than the wall clock check interval,
 *  firing once the clock has reached the target. A wall clock timer therefore fires late
 *  by at most one check interval if the clock is set forward, and does not fire early if
 *  the clock is set back.
 */
public class ScheduledTimer implements Scheduler, AutoCloseable {
	private static final Logger LOGGER = LoggerFactory.getLogger(ScheduledTimer.class);

	private final ScheduledExecutorService executor;
	private final boolean ownsExecutor;
	private final Clock clock;
	private final Duration wallClockCheckInterval;
	private final EventKeeper eventKeeper;

	/**
	 * Creates a timer running on a pool of {@code threads} threads from {@code threadFactory}.
	 *
	 * @param threads number of timer threads
	 * @param threadFactory creates the timer threads
	 * @param clock the clock wall clock timers are measured against
	 * @param wallClockCheckInterval how often a wall clock timer re-reads {@code clock}
	 * @param eventKeeper where to count fired timers, may be {@code null}
	 */
	public ScheduledTimer(int threads, ThreadFactory threadFactory, Clock clock, Duration wallClockCheckInterval,
	                      EventKeeper eventKeeper) {
		this(newExecutor(threads, threadFactory), true, clock, wallClockCheckInterval, eventKeeper);
	}

	/**
	 * Creates a timer on an executor owned by the caller; {@link #close()} leaves it running.
	 *
	 * @param executor runs the timers
	 * @param clock the clock wall clock timers are measured against
	 * @param wallClockCheckInterval how often a wall clock timer re-reads {@code clock}
	 */
	public ScheduledTimer(ScheduledExecutorService executor, Clock clock, Duration wallClockCheckInterval) {
		this(executor, false, clock, wallClockCheckInterval, null);
	}

	private ScheduledTimer(ScheduledExecutorService executor, boolean ownsExecutor, Clock clock,
	                       Duration wallClockCheckInterval, EventKeeper eventKeeper) {
		this.executor = Objects.requireNonNull(executor, "executor must not be null");
		this.ownsExecutor = ownsExecutor;
		this.clock = Objects.requireNonNull(clock, "clock must not be null");
		Objects.requireNonNull(wallClockCheckInterval, "wallClockCheckInterval must not be null");
		if(wallClockCheckInterval.isZero() || wallClockCheckInterval.isNegative())
			throw new IllegalArgumentException("wallClockCheckInterval must be positive: " + wallClockCheckInterval);
		this.wallClockCheckInterval = wallClockCheckInterval;
		this.eventKeeper = eventKeeper;
	}

	private static ScheduledExecutorService newExecutor(int threads, ThreadFactory threadFactory) {
		if(threads < 1)
			throw new IllegalArgumentException("threads must be at least 1, was " + threads);
		ScheduledThreadPoolExecutor pool = new ScheduledThreadPoolExecutor(threads, threadFactory);
		pool.setRemoveOnCancelPolicy(true);
		return pool;
	}

	@Override
	public Cancellable schedule(Duration delay, TimerKind kind, Runnable task) {
		Objects.requireNonNull(delay, "delay must not be null");
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(task, "task must not be null");
		if(delay.isNegative())
			throw new IllegalArgumentException("delay must not be negative: " + delay);
		Timer timer = new Timer(task);
		if(kind == TimerKind.WALL_CLOCK) {
			timer.armWallClock(clock.instant().plus(delay));
		} else {
			timer.arm(delay.toNanos(), timer::fire);
		}
		return timer;
	}

	public Clock getClock() {
		return clock;
	}

	/**
	 * Stops the timer threads if this timer created them. Timers still pending never fire.
	 */
	@Override
	public void close() {
		if(ownsExecutor) {
			LOGGER.debug("Shutting down timer pool");
			executor.shutdownNow();
		}
	}

	private final class Timer implements Cancellable {
		private final Runnable task;
		private final AtomicBoolean done = new AtomicBoolean(false);
		private ScheduledFuture<?> pending;

		Timer(Runnable task) {
			this.task = task;
		}

		void arm(long nanos, Runnable action) {
			ScheduledFuture<?> next = executor.schedule(action, nanos, TimeUnit.NANOSECONDS);
			boolean cancelNow;
			synchronized(this) {
				pending = next;
				cancelNow = done.get();
			}
			if(cancelNow)
				next.cancel(false);
		}

		void armWallClock(Instant target) {
			if(done.get())
				return;
			Duration remaining = Duration.between(clock.instant(), target);
			if(remaining.isZero() || remaining.isNegative()) {
				fire();
				return;
			}
			Duration slice = remaining.compareTo(wallClockCheckInterval) < 0 ? remaining : wallClockCheckInterval;
			arm(slice.toNanos(), () -> armWallClock(target));
		}

		void fire() {
			if(!done.compareAndSet(false, true))
				return;
			if(eventKeeper != null)
				eventKeeper.increment(EventKeeper.Events.TIMERS_FIRED);
			try {
				task.run();
			} catch(RuntimeException e) {
				LOGGER.error("Timer task threw", e);
				throw e;
			}
		}

		@Override
		public void cancel() {
			if(!done.compareAndSet(false, true))
				return;
			ScheduledFuture<?> toCancel;
			synchronized(this) {
				toCancel = pending;
				pending = null;
			}
			if(toCancel != null)
				toCancel.cancel(false);
		}
	}
}
