/*
 * AsyncRuntimeTest.java
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
import java.util.Collections;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import net.vpnclient.EventKeeper.Events;
import net.vpnclient.async.Completion;
import net.vpnclient.async.Future;
import net.vpnclient.async.TimerKind;
import net.vpnclient.operations.Operations;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class AsyncRuntimeTest {

	private static RuntimeOptions testOptions() {
		return RuntimeOptions.builder()
				.workerThreads(2)
				.threadNamePrefix("runtime-test")
				.wallClockCheckInterval(Duration.ofMillis(20))
				.shutdownTimeout(Duration.ofSeconds(2))
				.build();
	}

	@Test
	void testRunsFuturesOnWorkerThreads() throws InterruptedException {
		try(AsyncRuntime runtime = AsyncRuntime.start(testOptions())) {
			AtomicReference<String> threadName = new AtomicReference<>();
			AtomicReference<Completion<String, String>> received = new AtomicReference<>();
			CountDownLatch done = new CountDownLatch(1);
			Future<String, String> work = new Future<>(r -> {
				threadName.set(Thread.currentThread().getName());
				r.succeed("ran");
			});

			Operations.run(work, runtime.getOperationQueue(), runtime.getExclusivityController(), Collections.singleton("account"))
					.observe(c -> {
						received.set(c);
						done.countDown();
					});

			Assertions.assertTrue(done.await(5, TimeUnit.SECONDS));
			Assertions.assertEquals(Completion.success("ran"), received.get());
			Assertions.assertTrue(threadName.get().startsWith("runtime-test-worker-"), threadName.get());
			Assertions.assertEquals(1L, runtime.getEventKeeper().getCount(Events.OPERATIONS_STARTED));
		}
	}

	@Test
	void testTimerAndSerialExecutorCooperate() throws InterruptedException {
		try(AsyncRuntime runtime = AsyncRuntime.start(testOptions(), new MapEventKeeper())) {
			SerialExecutor serial = runtime.newSerialExecutor("tracker");
			AtomicReference<Boolean> onSerial = new AtomicReference<>();
			CountDownLatch done = new CountDownLatch(1);

			Future.<Integer, String>resolved(1)
					.delay(Duration.ofMillis(20), TimerKind.DEADLINE, runtime.getTimer())
					.receive(serial)
					.observe(c -> {
						onSerial.set(serial.isCurrentContext());
						done.countDown();
					});

			Assertions.assertTrue(done.await(5, TimeUnit.SECONDS));
			Assertions.assertTrue(onSerial.get());
			Assertions.assertEquals(1L, runtime.getEventKeeper().getCount(Events.TIMERS_FIRED));
		}
	}

	@Test
	void testClosedRuntimeRejectsUse() {
		AsyncRuntime runtime = AsyncRuntime.start(testOptions());
		runtime.close();
		runtime.close();

		Assertions.assertTrue(runtime.isClosed());
		Assertions.assertThrows(IllegalStateException.class, runtime::getOperationQueue);
		Assertions.assertThrows(IllegalStateException.class, runtime::getTimer);
		Assertions.assertThrows(IllegalStateException.class, () -> runtime.newSerialExecutor("late"));
	}
}
