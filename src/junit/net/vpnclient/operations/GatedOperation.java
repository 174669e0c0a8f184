/*
 * GatedOperation.java
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
package net.vpnclient.operations;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * An operation that records when it starts and stays executing until the test releases it.
 */
class GatedOperation extends Operation {
	private final List<String> log;
	private final AtomicInteger concurrent;
	private final AtomicInteger maxConcurrent;
	private final CountDownLatch started = new CountDownLatch(1);

	GatedOperation(String name, List<String> log, AtomicInteger concurrent, AtomicInteger maxConcurrent) {
		super(name);
		this.log = log;
		this.concurrent = concurrent;
		this.maxConcurrent = maxConcurrent;
	}

	@Override
	protected void main() {
		int now = concurrent.incrementAndGet();
		maxConcurrent.accumulateAndGet(now, Math::max);
		log.add("start " + getName());
		started.countDown();
	}

	boolean awaitStart(long millis) throws InterruptedException {
		return started.await(millis, TimeUnit.MILLISECONDS);
	}

	boolean hasStarted() {
		return started.getCount() == 0;
	}

	void release() {
		log.add("finish " + getName());
		concurrent.decrementAndGet();
		finish();
	}
}
