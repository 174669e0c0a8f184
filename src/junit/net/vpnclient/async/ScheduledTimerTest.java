/*
 * ScheduledTimerTest.java
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
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import net.vpnclient.DaemonThreadFactory;
import net.vpnclient.EventKeeper.Events;
import net.vpnclient.MapEventKeeper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Timer tests use real threads with delays scaled down to milliseconds.
 */
class ScheduledTimerTest {
	private MutableClock clock;
	private MapEventKeeper events;
	private ScheduledTimer timer;

	@BeforeEach
	void setUp() {
		clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
		events = new MapEventKeeper();
		timer = new ScheduledTimer(1, new DaemonThreadFactory("timer-test"), clock, Duration.ofMillis(10), events);
	}

	@AfterEach
	void tearDown() {
		timer.close();
	}

	@Test
	void testDeadlineTimerFiresAfterDelay() throws InterruptedException {
		CountDownLatch fired = new CountDownLatch(1);
		long start = System.nanoTime();

		timer.schedule(Duration.ofMillis(50), TimerKind.DEADLINE, fired::countDown);

		Assertions.assertTrue(fired.await(5, TimeUnit.SECONDS));
		Assertions.assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(50), "Timer fired early");
		Assertions.assertEquals(1L, events.getCount(Events.TIMERS_FIRED));
	}

	@Test
	void testCancelledTimerNeverFires() throws InterruptedException {
		AtomicInteger fired = new AtomicInteger();
		Cancellable pending = timer.schedule(Duration.ofMillis(50), TimerKind.DEADLINE, fired::incrementAndGet);

		pending.cancel();
		Thread.sleep(200);

		Assertions.assertEquals(0, fired.get());
		Assertions.assertEquals(0L, events.getCount(Events.TIMERS_FIRED));
	}

	@Test
	void testWallClockTimerFollowsClockJumps() throws InterruptedException {
		CountDownLatch fired = new CountDownLatch(1);
		timer.schedule(Duration.ofHours(1), TimerKind.WALL_CLOCK, fired::countDown);

		Assertions.assertFalse(fired.await(100, TimeUnit.MILLISECONDS), "Wall clock timer fired before the clock moved");

		clock.advance(Duration.ofHours(2));
		Assertions.assertTrue(fired.await(5, TimeUnit.SECONDS), "Wall clock timer missed the clock jump");
	}

	@Test
	void testDelayedFutureWaitsForTheFullDelay() throws InterruptedException {
		CountDownLatch done = new CountDownLatch(1);
		AtomicReference<Completion<String, String>> received = new AtomicReference<>();
		long start = System.nanoTime();

		Future.<String, String>resolved("later").delay(Duration.ofMillis(100), TimerKind.DEADLINE, timer).observe(c -> {
			received.set(c);
			done.countDown();
		});

		Assertions.assertTrue(done.await(5, TimeUnit.SECONDS));
		Assertions.assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(100), "Continuation ran early");
		Assertions.assertEquals(Completion.success("later"), received.get());
	}

	@Test
	void testDelayedFutureCancelledPartWayNeverContinues() throws InterruptedException {
		AtomicInteger continuations = new AtomicInteger();
		AtomicReference<Completion<Integer, String>> received = new AtomicReference<>();
		CancellationToken token = Future.<Integer, String>resolved(1)
				.delay(Duration.ofMillis(250), TimerKind.DEADLINE, timer)
				.map(v -> continuations.incrementAndGet())
				.observe(received::set);

		Thread.sleep(50);
		token.cancel();
		Thread.sleep(400);

		Assertions.assertEquals(0, continuations.get());
		Assertions.assertEquals(Completion.<Integer, String>cancelled(), received.get());
	}

	@Test
	void testRejectsNegativeDelay() {
		Assertions.assertThrows(IllegalArgumentException.class,
		                        () -> timer.schedule(Duration.ofMillis(-5), TimerKind.DEADLINE, () -> {}));
	}

	private static final class MutableClock extends Clock {
		private final AtomicReference<Instant> now;

		MutableClock(Instant start) {
			this.now = new AtomicReference<>(start);
		}

		void advance(Duration amount) {
			now.updateAndGet(instant -> instant.plus(amount));
		}

		@Override
		public ZoneId getZone() {
			return ZoneOffset.UTC;
		}

		@Override
		public Clock withZone(ZoneId zone) {
			return this;
		}

		@Override
		public Instant instant() {
			return now.get();
		}
	}
}
