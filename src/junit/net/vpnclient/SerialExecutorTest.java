/*
 * SerialExecutorTest.java
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
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SerialExecutorTest {
	private ExecutorService pool;

	@BeforeEach
	void setUp() {
		pool = Executors.newFixedThreadPool(4, new DaemonThreadFactory("serial-test"));
	}

	@AfterEach
	void tearDown() {
		pool.shutdownNow();
	}

	@Test
	void testRunsTasksInOrderOneAtATime() throws InterruptedException {
		SerialExecutor serial = new SerialExecutor("ordered", pool);
		List<Integer> order = Collections.synchronizedList(new ArrayList<>());
		AtomicInteger running = new AtomicInteger();
		AtomicBoolean overlapped = new AtomicBoolean(false);
		CountDownLatch done = new CountDownLatch(200);

		for(int i = 0; i < 200; i++) {
			final int task = i;
			serial.execute(() -> {
				if(running.incrementAndGet() != 1)
					overlapped.set(true);
				order.add(task);
				running.decrementAndGet();
				done.countDown();
			});
		}

		Assertions.assertTrue(done.await(10, TimeUnit.SECONDS));
		Assertions.assertFalse(overlapped.get(), "Two tasks ran at the same time");
		for(int i = 0; i < 200; i++)
			Assertions.assertEquals(i, order.get(i).intValue());
	}

	@Test
	void testCurrentContext() throws InterruptedException {
		SerialExecutor serial = new SerialExecutor("context", pool);
		SerialExecutor other = new SerialExecutor("other", pool);
		AtomicBoolean insideSerial = new AtomicBoolean(false);
		AtomicBoolean insideOther = new AtomicBoolean(true);
		CountDownLatch done = new CountDownLatch(1);

		serial.execute(() -> {
			insideSerial.set(serial.isCurrentContext());
			insideOther.set(other.isCurrentContext());
			done.countDown();
		});

		Assertions.assertTrue(done.await(5, TimeUnit.SECONDS));
		Assertions.assertTrue(insideSerial.get());
		Assertions.assertFalse(insideOther.get());
		Assertions.assertFalse(serial.isCurrentContext());
	}

	@Test
	void testThrowingTaskDoesNotStopTheQueue() throws InterruptedException {
		SerialExecutor serial = new SerialExecutor("failing", pool);
		CountDownLatch done = new CountDownLatch(1);

		serial.execute(() -> {
			throw new IllegalStateException("task failed");
		});
		serial.execute(done::countDown);

		Assertions.assertTrue(done.await(5, TimeUnit.SECONDS));
	}
}
