/*
 * DaemonThreadFactory.java
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

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates daemon threads named {@code <prefix>-<n>}, so that pools owned by an
 *  {@link AsyncRuntime} never keep the JVM alive on their own.
 */
public class DaemonThreadFactory implements ThreadFactory {
	private final ThreadFactory factory;
	private final String prefix;
	private final AtomicInteger threadCount = new AtomicInteger();

	public DaemonThreadFactory(String prefix) {
		this(prefix, Executors.defaultThreadFactory());
	}

	public DaemonThreadFactory(String prefix, ThreadFactory factory) {
		this.prefix = Objects.requireNonNull(prefix, "prefix must not be null");
		this.factory = Objects.requireNonNull(factory, "factory must not be null");
	}

	@Override
	public Thread newThread(Runnable r) {
		Thread t = factory.newThread(r);
		t.setName(prefix + "-" + threadCount.incrementAndGet());
		t.setDaemon(true);
		return t;
	}
}
