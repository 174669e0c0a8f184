/*
 * AsyncRuntime.java
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

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import net.vpnclient.async.ScheduledTimer;
import net.vpnclient.operations.ExclusivityController;
import net.vpnclient.operations.OperationQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the threads and shared schedulers of the library: a worker pool, a timer, an
 *  operation queue running on the worker pool, and the exclusivity controller that orders
 *  work on that queue. Components receive these objects from the runtime explicitly.<br>
 * <br>
 * A runtime is started once with {@link #start(RuntimeOptions)} and stopped once with
 *  {@link #close()}; it cannot be restarted. After {@code close()} every accessor throws
 *  {@link IllegalStateException}.
 */
public class AsyncRuntime implements AutoCloseable {
	private static final Logger LOGGER = LoggerFactory.getLogger(AsyncRuntime.class);

	private final RuntimeOptions options;
	private final EventKeeper eventKeeper;
	private final ExecutorService workers;
	private final ScheduledTimer timer;
	private final OperationQueue operationQueue;
	private final ExclusivityController exclusivityController;
	private volatile boolean closed = false;

	private AsyncRuntime(RuntimeOptions options, EventKeeper eventKeeper, Clock clock) {
		this.options = options;
		this.eventKeeper = eventKeeper;
		String prefix = options.getThreadNamePrefix();
		this.workers = Executors.newFixedThreadPool(options.getWorkerThreads(), new DaemonThreadFactory(prefix + "-worker"));
		this.timer = new ScheduledTimer(options.getTimerThreads(), new DaemonThreadFactory(prefix + "-timer"), clock,
		                                options.getWallClockCheckInterval(), eventKeeper);
		this.operationQueue = new OperationQueue(prefix, workers, eventKeeper);
		this.exclusivityController = new ExclusivityController();
	}

	/**
	 * Starts a runtime configured from the system properties.
	 *
	 * @return a running runtime
	 *
	 * @see RuntimeOptions#fromSystemProperties()
	 */
	public static AsyncRuntime start() {
		return start(RuntimeOptions.fromSystemProperties());
	}

	public static AsyncRuntime start(RuntimeOptions options) {
		return start(options, new MapEventKeeper());
	}

	/**
	 * Starts a runtime that records its events in {@code eventKeeper}.
	 *
	 * @param options thread counts, names and timeouts
	 * @param eventKeeper where to record scheduling events
	 *
	 * @return a running runtime
	 */
	public static AsyncRuntime start(RuntimeOptions options, EventKeeper eventKeeper) {
		return start(options, eventKeeper, Clock.systemUTC());
	}

	/**
	 * Starts a runtime whose wall clock timers read {@code clock}.
	 *
	 * @param options thread counts, names and timeouts
	 * @param eventKeeper where to record scheduling events
	 * @param clock the clock for wall clock timers
	 *
	 * @return a running runtime
	 */
	public static AsyncRuntime start(RuntimeOptions options, EventKeeper eventKeeper, Clock clock) {
		Objects.requireNonNull(options, "options must not be null");
		Objects.requireNonNull(eventKeeper, "eventKeeper must not be null");
		Objects.requireNonNull(clock, "clock must not be null");
		AsyncRuntime runtime = new AsyncRuntime(options, eventKeeper, clock);
		LOGGER.info("Started async runtime with {}", options);
		return runtime;
	}

	public ExecutorService getWorkers() {
		checkOpen();
		return workers;
	}

	public ScheduledTimer getTimer() {
		checkOpen();
		return timer;
	}

	public OperationQueue getOperationQueue() {
		checkOpen();
		return operationQueue;
	}

	public ExclusivityController getExclusivityController() {
		checkOpen();
		return exclusivityController;
	}

	public EventKeeper getEventKeeper() {
		checkOpen();
		return eventKeeper;
	}

	public RuntimeOptions getOptions() {
		return options;
	}

	/**
	 * Creates an executor that runs tasks one at a time on the worker pool.
	 *
	 * @param name the executor name used in logs
	 *
	 * @return a new serial executor
	 */
	public SerialExecutor newSerialExecutor(String name) {
		checkOpen();
		return new SerialExecutor(name, workers);
	}

	public boolean isClosed() {
		return closed;
	}

	/**
	 * Cancels queued operations, stops the timer and shuts down the worker pool, waiting up
	 *  to the configured shutdown timeout for running tasks. Calling this more than once has
	 *  no further effect.
	 */
	@Override
	public void close() {
		synchronized(this) {
			if(closed)
				return;
			closed = true;
		}
		operationQueue.cancelAllOperations();
		timer.close();
		workers.shutdown();
		long timeoutMillis = options.getShutdownTimeout().toMillis();
		try {
			if(!workers.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
				LOGGER.warn("Worker pool did not terminate within {} ms, interrupting remaining tasks", timeoutMillis);
				workers.shutdownNow();
			}
		} catch(InterruptedException e) {
			workers.shutdownNow();
			Thread.currentThread().interrupt();
		}
		LOGGER.info("Stopped async runtime");
	}

	private void checkOpen() {
		if(closed)
			throw new IllegalStateException("Async runtime has been closed");
	}
}
