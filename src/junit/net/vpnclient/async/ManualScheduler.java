/*
 * ManualScheduler.java
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
import java.util.List;

/**
 * A {@link Scheduler} whose timers only fire when a test calls {@link #fireAll()}.
 */
class ManualScheduler implements Scheduler {
	private final List<Pending> pending = new ArrayList<>();

	@Override
	public synchronized Cancellable schedule(Duration delay, TimerKind kind, Runnable task) {
		Pending timer = new Pending(delay, kind, task);
		pending.add(timer);
		return timer;
	}

	/**
	 * Fires every timer that is pending and not cancelled. Timers scheduled while firing
	 *  wait for the next call.
	 *
	 * @return how many timers fired
	 */
	int fireAll() {
		List<Pending> due;
		synchronized(this) {
			due = new ArrayList<>(pending);
			pending.clear();
		}
		int fired = 0;
		for(Pending timer : due) {
			if(timer.claim()) {
				timer.task.run();
				fired++;
			}
		}
		return fired;
	}

	synchronized int pendingCount() {
		int count = 0;
		for(Pending timer : pending) {
			if(!timer.isCancelled())
				count++;
		}
		return count;
	}

	synchronized Duration lastDelay() {
		return pending.isEmpty() ? null : pending.get(pending.size() - 1).delay;
	}

	synchronized TimerKind lastKind() {
		return pending.isEmpty() ? null : pending.get(pending.size() - 1).kind;
	}

	private static final class Pending implements Cancellable {
		private final Duration delay;
		private final TimerKind kind;
		private final Runnable task;
		private boolean done = false;

		Pending(Duration delay, TimerKind kind, Runnable task) {
			this.delay = delay;
			this.kind = kind;
			this.task = task;
		}

		synchronized boolean claim() {
			if(done)
				return false;
			done = true;
			return true;
		}

		synchronized boolean isCancelled() {
			return done;
		}

		@Override
		public synchronized void cancel() {
			done = true;
		}
	}
}
