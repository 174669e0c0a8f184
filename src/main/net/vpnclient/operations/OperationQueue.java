/*
 * OperationQueue.java
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

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import net.vpnclient.EventKeeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs {@link Operation}s on an {@link Executor} as soon as their dependencies have
 *  finished. Operations with no ordering between them may run concurrently, up to the
 *  parallelism of the executor.
 */
public class OperationQueue {
	private static final Logger LOGGER = LoggerFactory.getLogger(OperationQueue.class);

	private final String name;
	private final Executor executor;
	private final EventKeeper eventKeeper;
	private final Set<Operation> operations = new LinkedHashSet<>();

	public OperationQueue(String name, Executor executor) {
		this(name, executor, null);
	}

	/**
	 * @param name the queue name used in logs
	 * @param executor the executor operations are started on
	 * @param eventKeeper where to record started, cancelled and finished operations and
	 *  queue wait times, may be {@code null}
	 */
	public OperationQueue(String name, Executor executor, EventKeeper eventKeeper) {
		this.name = Objects.requireNonNull(name, "name must not be null");
		this.executor = Objects.requireNonNull(executor, "executor must not be null");
		this.eventKeeper = eventKeeper;
	}

	/**
	 * Adds {@code operation} to this queue. It is started once all of its dependencies
	 *  have finished. An operation that is already in a queue, or has already run, is
	 *  ignored with a warning.
	 *
	 * @param operation the operation to run
	 */
	public void addOperation(Operation operation) {
		Objects.requireNonNull(operation, "operation must not be null");
		boolean added;
		synchronized(this) {
			added = operations.add(operation);
		}
		Operation.Enqueued result = operation.enqueue(this);
		switch(result) {
			case REJECTED:
				if(added) {
					synchronized(this) {
						operations.remove(operation);
					}
				}
				LOGGER.warn("Ignoring {} on queue {}: it was already enqueued or has run", operation, name);
				break;
			case WAITING:
				LOGGER.debug("{} waits for {} on queue {}", operation.getName(), operation.getDependencies(), name);
				break;
			default:
				dispatch(operation);
		}
	}

	public void addOperations(List<? extends Operation> toAdd) {
		for(Operation operation : toAdd)
			addOperation(operation);
	}

	void dispatch(Operation operation) {
		try {
			executor.execute(() -> run(operation));
		} catch(RejectedExecutionException e) {
			LOGGER.warn("Queue {} could not start {}, cancelling it", name, operation, e);
			operation.cancel();
			operation.finish();
		}
	}

	private void run(Operation operation) {
		if(eventKeeper != null) {
			eventKeeper.timeNanos(EventKeeper.Events.OPERATION_QUEUE_WAIT_NANOS, System.nanoTime() - operation.getReadyNanos());
			eventKeeper.increment(operation.isCancelled() ? EventKeeper.Events.OPERATIONS_CANCELLED : EventKeeper.Events.OPERATIONS_STARTED);
		}
		operation.start();
	}

	void operationFinished(Operation operation) {
		synchronized(this) {
			operations.remove(operation);
		}
		if(eventKeeper != null)
			eventKeeper.increment(EventKeeper.Events.OPERATIONS_FINISHED);
	}

	/**
	 * Cancels every operation currently in this queue.
	 */
	public void cancelAllOperations() {
		List<Operation> snapshot;
		synchronized(this) {
			snapshot = new ArrayList<>(operations);
		}
		for(Operation operation : snapshot)
			operation.cancel();
	}

	/**
	 * @return the number of operations added and not yet finished
	 */
	public synchronized int getOperationCount() {
		return operations.size();
	}

	public String getName() {
		return name;
	}
}
