/*
 * SerialExecutor.java
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

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs submitted tasks one at a time, in submission order, on a backing executor. Tasks
 *  may run on different threads of the backing executor, but never concurrently, and
 *  each task sees the effects of the ones before it.<br>
 * <br>
 * This is the usual target for {@link net.vpnclient.async.Future#schedule} and
 *  {@link net.vpnclient.async.Future#receive} when a component keeps its state confined
 *  to one logical thread.
 */
public class SerialExecutor implements Executor {
	private static final Logger LOGGER = LoggerFactory.getLogger(SerialExecutor.class);
	private static final ThreadLocal<SerialExecutor> CURRENT = new ThreadLocal<>();

	private final String name;
	private final Executor backing;
	private final Queue<Runnable> tasks = new ArrayDeque<>();
	private boolean active = false;

	public SerialExecutor(String name, Executor backing) {
		this.name = Objects.requireNonNull(name, "name must not be null");
		this.backing = Objects.requireNonNull(backing, "backing must not be null");
	}

	@Override
	public void execute(Runnable task) {
		Objects.requireNonNull(task, "task must not be null");
		boolean startDrain;
		synchronized(this) {
			tasks.add(task);
			startDrain = !active;
			active = true;
		}
		if(startDrain) {
			try {
				backing.execute(this::drain);
			} catch(RuntimeException e) {
				synchronized(this) {
					tasks.remove(task);
					active = !tasks.isEmpty();
				}
				throw e;
			}
		}
	}

	/**
	 * Returns {@code true} if the calling thread is currently running a task of this executor.
	 *
	 * @return whether the caller is on this executor
	 */
	public boolean isCurrentContext() {
		return CURRENT.get() == this;
	}

	public String getName() {
		return name;
	}

	private void drain() {
		SerialExecutor previous = CURRENT.get();
		CURRENT.set(this);
		try {
			while(true) {
				Runnable next;
				synchronized(this) {
					next = tasks.poll();
					if(next == null) {
						active = false;
						return;
					}
				}
				try {
					next.run();
				} catch(RuntimeException e) {
					LOGGER.error("Task on serial executor {} threw", name, e);
				}
			}
		} finally {
			if(previous == null)
				CURRENT.remove();
			else
				CURRENT.set(previous);
		}
	}

	@Override
	public String toString() {
		return "SerialExecutor(" + name + ")";
	}
}
