/*
 * Operation.java
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
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import net.vpnclient.async.Cancellable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A unit of work run by an {@link OperationQueue}. An operation moves through
 *  {@link State#CREATED}, {@link State#READY}, {@link State#EXECUTING} and
 *  {@link State#FINISHED}; it becomes ready once every operation it depends on has
 *  finished.<br>
 * <br>
 * Subclasses implement {@link #main()}. An operation is not finished when {@code main()}
 *  returns: the subclass calls {@link #finish()} when its work is done, which may be much
 *  later and on another thread. {@code finish()} is idempotent.<br>
 * <br>
 * Cancelling marks the operation; if it has not started yet it finishes without running
 *  {@code main()} once its dependencies have finished, and if it is executing
 *  {@link #onCancel()} is invoked so the subclass can abandon its work. A cancelled
 *  operation still waits for its dependencies, so cancellation never lets an operation
 *  overtake the ones it was ordered after.
 */
public abstract class Operation implements Cancellable {
	private static final Logger LOGGER = LoggerFactory.getLogger(Operation.class);

	/**
	 * The lifecycle of an {@link Operation}.
	 */
	public enum State {
		CREATED,
		READY,
		EXECUTING,
		FINISHED
	}

	/**
	 * The outcome of handing an operation to a queue.
	 */
	enum Enqueued {
		REJECTED,
		WAITING,
		READY
	}

	private final String name;

	private State state = State.CREATED;
	private boolean cancelled = false;
	private int unfinishedDependencies = 0;
	private final Set<Operation> dependencies = new LinkedHashSet<>();
	private final List<Operation> dependents = new ArrayList<>();
	private List<Runnable> completionListeners = new ArrayList<>();
	private OperationQueue queue = null;
	private long readyNanos = 0L;

	protected Operation(String name) {
		this.name = Objects.requireNonNull(name, "name must not be null");
	}

	protected Operation() {
		String simpleName = getClass().getSimpleName();
		this.name = simpleName.isEmpty() ? "operation" : simpleName;
	}

	/**
	 * The body of this operation, called on a worker thread. Implementations must
	 *  eventually call {@link #finish()}. If {@code main()} throws, the exception is logged
	 *  and the operation is finished.
	 */
	protected abstract void main();

	/**
	 * Invoked once, on the cancelling thread, when an executing operation is cancelled.
	 */
	protected void onCancel() {
	}

	/**
	 * Makes this operation wait until {@code dependency} has finished. Dependencies may
	 *  only be added before the operation is handed to a queue.
	 *
	 * @param dependency the operation to wait for
	 *
	 * @throws IllegalArgumentException if {@code dependency} is this operation
	 * @throws IllegalStateException if this operation has already been enqueued
	 */
	public void addDependency(Operation dependency) {
		Objects.requireNonNull(dependency, "dependency must not be null");
		if(dependency == this)
			throw new IllegalArgumentException("Operation " + name + " cannot depend on itself");
		synchronized(this) {
			if(state != State.CREATED || queue != null)
				throw new IllegalStateException("Cannot add a dependency to " + name + " once it has been enqueued");
			if(!dependencies.add(dependency))
				return;
			unfinishedDependencies++;
		}
		if(!dependency.addDependent(this))
			dependencyFinished();
	}

	private boolean addDependent(Operation dependent) {
		synchronized(this) {
			if(state == State.FINISHED)
				return false;
			dependents.add(dependent);
			return true;
		}
	}

	private void dependencyFinished() {
		OperationQueue dispatchTo = null;
		synchronized(this) {
			unfinishedDependencies--;
			if(unfinishedDependencies == 0 && state == State.CREATED && queue != null) {
				state = State.READY;
				readyNanos = System.nanoTime();
				dispatchTo = queue;
			}
		}
		if(dispatchTo != null)
			dispatchTo.dispatch(this);
	}

	/**
	 * Attaches this operation to {@code target}. Called by the queue.
	 */
	Enqueued enqueue(OperationQueue target) {
		synchronized(this) {
			if(queue != null || state != State.CREATED)
				return Enqueued.REJECTED;
			queue = target;
			if(unfinishedDependencies > 0)
				return Enqueued.WAITING;
			state = State.READY;
			readyNanos = System.nanoTime();
			return Enqueued.READY;
		}
	}

	/**
	 * Runs this operation on the calling thread. A cancelled operation finishes straight
	 *  away without calling {@link #main()}.
	 *
	 * @throws IllegalStateException if a dependency has not finished or the operation has
	 *  already been started
	 */
	public void start() {
		boolean skip;
		synchronized(this) {
			if(unfinishedDependencies > 0)
				throw new IllegalStateException("Operation " + name + " started with unfinished dependencies");
			if(state == State.EXECUTING || state == State.FINISHED)
				throw new IllegalStateException("Operation " + name + " has already been started");
			state = State.EXECUTING;
			skip = cancelled;
		}
		if(skip) {
			finish();
			return;
		}
		try {
			main();
		} catch(RuntimeException e) {
			LOGGER.error("Operation {} threw from its body", name, e);
			finish();
		}
	}

	/**
	 * Marks this operation finished, releasing the operations that depend on it and
	 *  running its completion listeners. Calls after the first have no effect.
	 */
	public void finish() {
		List<Operation> toRelease;
		List<Runnable> listeners;
		OperationQueue owner;
		synchronized(this) {
			if(state == State.FINISHED)
				return;
			state = State.FINISHED;
			toRelease = new ArrayList<>(dependents);
			dependents.clear();
			listeners = completionListeners;
			completionListeners = null;
			owner = queue;
		}
		LOGGER.debug("Operation {} finished", name);
		for(Operation dependent : toRelease)
			dependent.dependencyFinished();
		for(Runnable listener : listeners) {
			try {
				listener.run();
			} catch(RuntimeException e) {
				LOGGER.error("Completion listener of operation {} threw", name, e);
			}
		}
		if(owner != null)
			owner.operationFinished(this);
	}

	/**
	 * Requests cancellation. Has no effect on a finished operation.
	 */
	@Override
	public void cancel() {
		boolean executing;
		synchronized(this) {
			if(cancelled || state == State.FINISHED)
				return;
			cancelled = true;
			executing = state == State.EXECUTING;
		}
		if(executing)
			onCancel();
	}

	/**
	 * Adds {@code listener} to run once this operation finishes, on the finishing thread.
	 *  If it has already finished, the listener runs immediately.
	 *
	 * @param listener the routine to run
	 */
	public void addCompletionListener(Runnable listener) {
		Objects.requireNonNull(listener, "listener must not be null");
		boolean runNow;
		synchronized(this) {
			runNow = state == State.FINISHED;
			if(!runNow)
				completionListeners.add(listener);
		}
		if(runNow)
			listener.run();
	}

	public synchronized State getState() {
		return state;
	}

	public synchronized boolean isCancelled() {
		return cancelled;
	}

	public synchronized boolean isFinished() {
		return state == State.FINISHED;
	}

	public synchronized boolean isExecuting() {
		return state == State.EXECUTING;
	}

	public synchronized Set<Operation> getDependencies() {
		return Collections.unmodifiableSet(new LinkedHashSet<>(dependencies));
	}

	synchronized boolean acceptsDependencies() {
		return state == State.CREATED && queue == null;
	}

	synchronized long getReadyNanos() {
		return readyNanos;
	}

	public String getName() {
		return name;
	}

	@Override
	public String toString() {
		return "Operation(" + name + ", " + getState() + (isCancelled() ? ", cancelled" : "") + ")";
	}
}
