/*
 * RetryTest.java
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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import net.vpnclient.DaemonThreadFactory;
import net.vpnclient.EventKeeper.Events;
import net.vpnclient.MapEventKeeper;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class RetryTest {

	private static <S, F> List<Completion<S, F>> collect(Future<S, F> future) {
		List<Completion<S, F>> completions = Collections.synchronizedList(new ArrayList<>());
		future.observe(completions::add);
		return completions;
	}

	@Test
	void testImmediateRetrySucceedsOnThirdAttempt() {
		AtomicInteger attempts = new AtomicInteger();
		MapEventKeeper events = new MapEventKeeper();
		Future<String, String> retried = Futures.retry(RetryStrategy.immediate(3), new ManualScheduler(), () -> {
			int attempt = attempts.incrementAndGet();
			return attempt < 3 ? Future.<String, String>failed("failure " + attempt) : Future.<String, String>resolved("ok");
		}, events);

		Assertions.assertEquals(Arrays.asList(Completion.success("ok")), collect(retried));
		Assertions.assertEquals(3, attempts.get(), "Unexpected number of attempts");
		Assertions.assertEquals(2L, events.getCount(Events.RETRY_ATTEMPTS));
		Assertions.assertEquals(0L, events.getCount(Events.RETRIES_EXHAUSTED));
	}

	@Test
	void testExhaustedRetryReturnsLastFailureUnchanged() {
		AtomicInteger attempts = new AtomicInteger();
		MapEventKeeper events = new MapEventKeeper();
		Future<String, String> retried = Futures.retry(RetryStrategy.immediate(2), new ManualScheduler(),
		                                               () -> Future.failed("failure " + attempts.incrementAndGet()), events);

		Assertions.assertEquals(Arrays.asList(Completion.failure("failure 2")), collect(retried));
		Assertions.assertEquals(2, attempts.get());
		Assertions.assertEquals(1L, events.getCount(Events.RETRY_ATTEMPTS));
		Assertions.assertEquals(1L, events.getCount(Events.RETRIES_EXHAUSTED));
	}

	@Test
	void testSingleAttemptNeverRetries() {
		AtomicInteger attempts = new AtomicInteger();
		ManualScheduler scheduler = new ManualScheduler();
		Future<String, String> retried = Futures.retry(new RetryStrategy(1, WaitPolicy.constant(Duration.ofSeconds(1))), scheduler,
		                                               () -> Future.failed("failure " + attempts.incrementAndGet()));

		Assertions.assertEquals(Arrays.asList(Completion.failure("failure 1")), collect(retried));
		Assertions.assertEquals(0, scheduler.pendingCount());
	}

	@Test
	void testConstantWaitRunsBetweenAttempts() {
		AtomicInteger attempts = new AtomicInteger();
		ManualScheduler scheduler = new ManualScheduler();
		Future<String, String> retried = Futures.retry(new RetryStrategy(3, WaitPolicy.constant(Duration.ofSeconds(1))), scheduler,
		                                               () -> Future.failed("failure " + attempts.incrementAndGet()));

		List<Completion<String, String>> completions = collect(retried);
		Assertions.assertEquals(1, attempts.get());
		Assertions.assertEquals(Duration.ofSeconds(1), scheduler.lastDelay());
		Assertions.assertEquals(TimerKind.DEADLINE, scheduler.lastKind());

		scheduler.fireAll();
		Assertions.assertEquals(2, attempts.get());
		Assertions.assertTrue(completions.isEmpty());

		scheduler.fireAll();
		Assertions.assertEquals(3, attempts.get());
		Assertions.assertEquals(Arrays.asList(Completion.failure("failure 3")), completions);
		Assertions.assertEquals(0, scheduler.pendingCount());
	}

	@Test
	void testCancelDuringWaitStopsRetrying() {
		AtomicInteger attempts = new AtomicInteger();
		ManualScheduler scheduler = new ManualScheduler();
		Future<String, String> retried = Futures.retry(new RetryStrategy(5, WaitPolicy.constant(Duration.ofSeconds(1))), scheduler,
		                                               () -> Future.failed("failure " + attempts.incrementAndGet()));
		List<Completion<String, String>> completions = Collections.synchronizedList(new ArrayList<>());

		CancellationToken token = retried.observe(completions::add);
		Assertions.assertEquals(1, scheduler.pendingCount());
		token.cancel();

		Assertions.assertEquals(0, scheduler.fireAll());
		Assertions.assertEquals(1, attempts.get());
		Assertions.assertEquals(Arrays.asList(Completion.<String, String>cancelled()), completions);
	}

	@Test
	void testCancelDuringAttemptCancelsIt() {
		AtomicInteger attemptCancels = new AtomicInteger();
		Future<String, String> retried = Futures.retry(RetryStrategy.immediate(3), new ManualScheduler(),
		                                               () -> new Future<String, String>(r -> r.setCancelHandler(attemptCancels::incrementAndGet)));
		List<Completion<String, String>> completions = Collections.synchronizedList(new ArrayList<>());

		retried.observe(completions::add).cancel();

		Assertions.assertEquals(1, attemptCancels.get());
		Assertions.assertEquals(Arrays.asList(Completion.<String, String>cancelled()), completions);
	}

	@Test
	void testLimitedWaitPolicyEndsRetriesEarly() {
		AtomicInteger attempts = new AtomicInteger();
		Future<String, String> retried = Futures.retry(new RetryStrategy(10, WaitPolicy.immediate().limit(2)), new ManualScheduler(),
		                                               () -> Future.failed("failure " + attempts.incrementAndGet()));

		Assertions.assertEquals(Arrays.asList(Completion.failure("failure 3")), collect(retried));
		Assertions.assertEquals(3, attempts.get());
	}

	@Test
	void testThrowingProducerCancelsRetry() {
		Future<String, String> retried = Futures.retry(RetryStrategy.immediate(3), new ManualScheduler(), () -> {
			throw new IllegalStateException("producer broke");
		});
		List<Completion<String, String>> completions = Collections.synchronizedList(new ArrayList<>());

		Assertions.assertThrows(IllegalStateException.class, () -> retried.observe(completions::add));
		Assertions.assertEquals(Arrays.asList(Completion.<String, String>cancelled()), completions);
	}

	@Test
	void testThenRetryUsesUpstreamValue() {
		AtomicInteger attempts = new AtomicInteger();
		Future<Integer, String> retried = Future.<Integer, String>resolved(4)
				.thenRetry(RetryStrategy.immediate(2), new ManualScheduler(), v -> attempts.incrementAndGet() == 1
				                                                                 ? Future.failed("first")
				                                                                 : Future.resolved(v * 10));

		Assertions.assertEquals(Arrays.asList(Completion.success(40)), collect(retried));
		Assertions.assertEquals(2, attempts.get());
	}

	@Test
	void testManySynchronousFailuresDoNotGrowTheStack() {
		int maxAttempts = 20_000;
		AtomicInteger attempts = new AtomicInteger();
		Future<String, String> retried = Futures.retry(RetryStrategy.immediate(maxAttempts), new ManualScheduler(),
		                                               () -> Future.failed("failure " + attempts.incrementAndGet()));

		Assertions.assertEquals(Arrays.asList(Completion.failure("failure " + maxAttempts)), collect(retried));
		Assertions.assertEquals(maxAttempts, attempts.get());
	}

	@Test
	void testRejectedWaitResolvesWithLastFailure() {
		AtomicReference<Resolver<String, String>> attempt = new AtomicReference<>();
		Scheduler closed = (delay, kind, task) -> {
			throw new RejectedExecutionException("closed");
		};
		Future<String, String> retried = Futures.retry(new RetryStrategy(3, WaitPolicy.constant(Duration.ofSeconds(1))), closed,
		                                               () -> new Future<String, String>(attempt::set));
		List<Completion<String, String>> completions = collect(retried);
		Assertions.assertTrue(completions.isEmpty());

		attempt.get().fail("offline");

		Assertions.assertEquals(Arrays.asList(Completion.<String, String>failure("offline")), completions);
	}

	@Test
	void testCancelRacingAsynchronousRetriesStopsAttempts() throws InterruptedException {
		ExecutorService pool = Executors.newFixedThreadPool(4, new DaemonThreadFactory("retry-race"));
		try {
			for(int round = 0; round < 20; round++) {
				AtomicInteger attempts = new AtomicInteger();
				CountDownLatch running = new CountDownLatch(1 + round % 5);
				Future<String, String> retried = Futures.retry(RetryStrategy.immediate(Integer.MAX_VALUE), new ManualScheduler(), () -> {
					attempts.incrementAndGet();
					running.countDown();
					return new Future<String, String>(r -> pool.execute(() -> r.fail("busy")));
				});
				List<Completion<String, String>> completions = Collections.synchronizedList(new ArrayList<>());
				CancellationToken token = retried.observe(completions::add);

				Assertions.assertTrue(running.await(5, TimeUnit.SECONDS), "Retries did not start");
				token.cancel();
				int atCancel = attempts.get();
				Thread.sleep(20);

				Assertions.assertEquals(Arrays.asList(Completion.<String, String>cancelled()), completions);
				Assertions.assertTrue(attempts.get() <= atCancel + 1,
				                      "Attempts kept starting after cancel: " + atCancel + " then " + attempts.get());
			}
		} finally {
			pool.shutdownNow();
		}
	}

	@Test
	void testStrategyRejectsZeroAttempts() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> RetryStrategy.immediate(0));
		Assertions.assertThrows(NullPointerException.class, () -> new RetryStrategy(1, null));
	}
}
