/*
 * RetryLoop.java
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
import java.util.Iterator;
import java.util.function.Supplier;

import net.vpnclient.EventKeeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives the attempts of one {@link Futures#retry} call. Each attempt, and each pause
 *  between attempts, is a "step"; only the token of the current step is held so that a
 *  cancel request reaches whatever is outstanding at that moment.
 */
final class RetryLoop<S, F> implements Cancellable {
	private static final Logger LOGGER = LoggerFactory.getLogger(RetryLoop.class);

	private final RetryStrategy strategy;
	private final Scheduler scheduler;
	private final Supplier<Future<S, F>> producer;
	private final Resolver<S, F> resolver;
	private final EventKeeper eventKeeper;
	private final Iterator<Duration> waits;

	private int attempts = 0;
	private long step = 0;
	private Cancellable outstanding = null;
	private boolean cancelled = false;
	private boolean looping = false;
	private boolean rerun = false;

	RetryLoop(RetryStrategy strategy, Scheduler scheduler, Supplier<Future<S, F>> producer,
	          Resolver<S, F> resolver, EventKeeper eventKeeper) {
		this.strategy = strategy;
		this.scheduler = scheduler;
		this.producer = producer;
		this.resolver = resolver;
		this.eventKeeper = eventKeeper;
		this.waits = strategy.getWaitPolicy().iterator();
	}

	void run() {
		attempt();
	}

	/**
	 * Runs the next attempt. If an attempt is already being started further up the stack
	 *  (an immediate retry of an attempt that failed synchronously), the request is handed
	 *  to that frame instead, so the stack stays flat however many attempts fail in a row.
	 */
	private void attempt() {
		synchronized(this) {
			if(looping) {
				rerun = true;
				return;
			}
			looping = true;
		}
		boolean again = true;
		try {
			while(again) {
				startAttempt();
				synchronized(this) {
					again = rerun;
					rerun = false;
					if(!again)
						looping = false;
				}
			}
		} finally {
			if(again) {
				synchronized(this) {
					looping = false;
					rerun = false;
				}
			}
		}
	}

	private void startAttempt() {
		long current;
		int attempt;
		synchronized(this) {
			if(cancelled)
				return;
			attempt = ++attempts;
			current = ++step;
		}
		Future<S, F> future;
		try {
			future = producer.get();
		} catch(RuntimeException e) {
			resolver.cancel();
			throw e;
		}
		if(future == null) {
			resolver.cancel();
			throw new NullPointerException("retry producer returned null on attempt " + attempt);
		}
		track(current, future.observe(this::attemptFinished));
	}

	private void attemptFinished(Completion<S, F> done) {
		if(!done.isFailure()) {
			resolver.resolve(done);
			return;
		}
		Duration wait;
		int attempt;
		long current;
		synchronized(this) {
			if(cancelled)
				return;
			attempt = attempts;
			if(attempts >= strategy.getMaxAttempts() || !waits.hasNext()) {
				wait = null;
				current = step;
			} else {
				wait = waits.next();
				current = ++step;
			}
		}
		if(wait == null) {
			LOGGER.debug("Giving up after {} attempt(s) with {}", attempt, done.getResult().getError());
			if(eventKeeper != null)
				eventKeeper.increment(EventKeeper.Events.RETRIES_EXHAUSTED);
			resolver.resolve(done);
			return;
		}
		if(eventKeeper != null)
			eventKeeper.increment(EventKeeper.Events.RETRY_ATTEMPTS);
		if(wait.isZero()) {
			LOGGER.debug("Attempt {} failed, retrying immediately", attempt);
			attempt();
			return;
		}
		LOGGER.debug("Attempt {} failed, retrying in {}", attempt, wait);
		Cancellable pause;
		try {
			pause = Future.<F>timer(wait, strategy.getTimerKind(), scheduler).observe(fired -> {
				if(fired.isSuccess())
					attempt();
			});
		} catch(RuntimeException e) {
			LOGGER.warn("Could not schedule attempt {} after {}, giving up with {}", attempt + 1, wait,
			            done.getResult().getError(), e);
			resolver.resolve(done);
			return;
		}
		track(current, pause);
	}

	private void track(long stepOfToken, Cancellable token) {
		boolean cancelNow;
		synchronized(this) {
			cancelNow = cancelled;
			if(!cancelNow && step == stepOfToken)
				outstanding = token;
		}
		if(cancelNow)
			token.cancel();
	}

	@Override
	public void cancel() {
		Cancellable toCancel;
		synchronized(this) {
			if(cancelled)
				return;
			cancelled = true;
			toCancel = outstanding;
			outstanding = null;
		}
		if(toCancel != null)
			toCancel.cancel();
		resolver.cancel();
	}
}
