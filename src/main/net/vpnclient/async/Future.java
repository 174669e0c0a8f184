/*
 * Future.java
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
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The typed result of an asynchronous process. A {@code Future} resolves exactly once,
 *  either to a finished {@link Result} or to the cancelled state, and the resulting
 *  {@link Completion} is pushed to every observer. There is no blocking or polling read;
 *  all waiting is expressed as "has not resolved yet" and observed through
 *  {@link #observe(Consumer)}.<br>
 * <br>
 * <h2>Starting</h2>
 *  A {@code Future} is constructed with a setup function that receives a {@link Resolver}.
 *  The setup function is run exactly once, on the thread that first observes the
 *  {@code Future} (or calls {@link #start()}). Until then no work is done, which is what
 *  allows {@link #schedule(Executor)} and the operation queue to decide where and when a
 *  computation begins.<br>
 * <br>
 * <h2>Observers</h2>
 *  Observers registered before resolution are invoked once, in registration order, on the
 *  thread that resolves the {@code Future}. Observers registered afterwards are invoked
 *  immediately on the registering thread with the stored completion. No lock is held while
 *  an observer runs, so observers are free to start new work.<br>
 * <br>
 * <h2>Cancellation</h2>
 *  Cancelling the {@link CancellationToken} returned by {@code observe} runs the producer's
 *  cancel handler once and resolves the {@code Future} as cancelled. Cancellation and
 *  resolution race; whichever reaches the state first wins and the other is ignored.
 *  Every combinator forwards cancellation to the stage it is waiting on.<br>
 * <br>
 * <h2>Errors thrown by callbacks</h2>
 *  Failures are values of type {@code F}. If a function passed to a combinator throws an
 *  unchecked exception instead, the derived {@code Future} resolves as cancelled, so its
 *  chain still terminates, and the exception is rethrown to the thread that delivered the
 *  upstream completion.
 *
 * @param <S> the type of a successful value
 * @param <F> the type of a failure
 */
public class Future<S, F> {
	private static final Logger LOGGER = LoggerFactory.getLogger(Future.class);

	private Consumer<? super Resolver<S, F>> setup;
	private Completion<S, F> completion = null;
	private List<Consumer<? super Completion<S, F>>> observers = new ArrayList<>();
	private Runnable cancelHandler = null;
	private boolean cancelRequested = false;
	private boolean resolvesOwnCancellation = false;

	/**
	 * Creates a {@code Future} that runs {@code setup} when it is first observed.
	 *  {@code setup} is responsible for eventually resolving the {@link Resolver} it is
	 *  given, and may register a cancel handler on it.
	 *
	 * @param setup the routine that starts the computation
	 */
	public Future(Consumer<? super Resolver<S, F>> setup) {
		this.setup = Objects.requireNonNull(setup, "setup must not be null");
	}

	private Future(Completion<S, F> completion) {
		this.setup = null;
		this.completion = completion;
		this.observers = null;
	}

	/**
	 * Creates a {@code Future} that is already resolved.
	 *
	 * @param completion the completion every observer will receive
	 * @param <S> the type of a successful value
	 * @param <F> the type of a failure
	 *
	 * @return a resolved {@code Future}
	 */
	public static <S, F> Future<S, F> of(Completion<S, F> completion) {
		return new Future<>(Objects.requireNonNull(completion, "completion must not be null"));
	}

	public static <S, F> Future<S, F> resolved(S value) {
		return of(Completion.success(value));
	}

	public static <S, F> Future<S, F> failed(F error) {
		return of(Completion.failure(error));
	}

	public static <S, F> Future<S, F> cancelled() {
		return of(Completion.cancelled());
	}

	/**
	 * Creates a {@code Future} whose result is computed by {@code body} when the
	 *  {@code Future} is started. Combine with {@link #schedule(Executor)} to choose the
	 *  thread the computation runs on.
	 *
	 * @param body the synchronous computation
	 * @param <S> the type of a successful value
	 * @param <F> the type of a failure
	 *
	 * @return a {@code Future} that will resolve with the outcome of {@code body}
	 */
	public static <S, F> Future<S, F> deferred(Supplier<Result<S, F>> body) {
		Objects.requireNonNull(body, "body must not be null");
		return new Future<>(resolver -> resolver.resolve(body.get()));
	}

	/**
	 * Creates a {@code Future} that succeeds after {@code delay} has elapsed.
	 *
	 * @param delay how long to wait
	 * @param kind the clock against which {@code delay} is measured
	 * @param scheduler the scheduler that owns the timer
	 * @param <F> the failure type of the chain this timer is used in
	 *
	 * @return a cancellable timer {@code Future}
	 */
	public static <F> Future<Void, F> timer(Duration delay, TimerKind kind, Scheduler scheduler) {
		checkDelay(delay);
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(scheduler, "scheduler must not be null");
		return new Future<>(resolver -> {
			Cancellable timer = scheduler.schedule(delay, kind, () -> resolver.succeed(null));
			resolver.setCancelHandler(timer::cancel);
		});
	}

	/**
	 * Registers {@code observer} to receive the completion of this {@code Future} and
	 *  starts the computation if it has not been started yet.
	 *
	 * @param observer the callback to invoke once with the completion
	 *
	 * @return a token with which the consumer can request cancellation
	 */
	public CancellationToken observe(Consumer<? super Completion<S, F>> observer) {
		Objects.requireNonNull(observer, "observer must not be null");
		Completion<S, F> done;
		synchronized(this) {
			done = completion;
			if(done == null)
				observers.add(observer);
		}
		if(done != null) {
			observer.accept(done);
		} else {
			start();
		}
		return new CancellationToken(this);
	}

	/**
	 * Starts the computation without observing it. Has no effect if it is already
	 *  started, resolved or cancelled.
	 *
	 * @return this {@code Future}
	 */
	public Future<S, F> start() {
		Consumer<? super Resolver<S, F>> body;
		synchronized(this) {
			body = setup;
			setup = null;
		}
		if(body != null) {
			try {
				body.accept(new Resolver<>(this));
			} catch(RuntimeException e) {
				resolve(Completion.cancelled());
				throw e;
			}
		}
		return this;
	}

	/**
	 * Transforms a successful value. Failures and cancellation pass through unchanged
	 *  and {@code m} is not invoked for them.
	 *
	 * @param m the conversion to run on a successful value
	 * @param <T> the new success type
	 *
	 * @return a new {@code Future} that converts the output of this one
	 */
	public <T> Future<T, F> map(Function<? super S, ? extends T> m) {
		Objects.requireNonNull(m, "m must not be null");
		return derive((done, resolver) -> {
			if(done.isSuccess())
				resolver.succeed(m.apply(done.getResult().getValue()));
			else
				resolver.resolve(done.<T>withoutValue());
		});
	}

	/**
	 * Transforms a failure. Successful values and cancellation pass through unchanged.
	 *
	 * @param m the conversion to run on a failure
	 * @param <G> the new failure type
	 *
	 * @return a new {@code Future} that converts the failures of this one
	 */
	public <G> Future<S, G> mapError(Function<? super F, ? extends G> m) {
		Objects.requireNonNull(m, "m must not be null");
		return derive((done, resolver) -> {
			if(done.isCancelled())
				resolver.cancel();
			else
				resolver.resolve(done.getResult().mapError(m));
		});
	}

	/**
	 * Transforms the completion of this {@code Future}, whatever its state.
	 *
	 * @param m the conversion to run on the completion
	 * @param <T> the new success type
	 * @param <G> the new failure type
	 *
	 * @return a new {@code Future} resolved with the output of {@code m}
	 */
	public <T, G> Future<T, G> mapCompletion(Function<? super Completion<S, F>, Completion<T, G>> m) {
		Objects.requireNonNull(m, "m must not be null");
		return derive((done, resolver) -> resolver.resolve(m.apply(done)));
	}

	/**
	 * Applies the successful result of this {@code Future} as the input of another
	 *  asynchronous computation and returns a handle to that computation's result.
	 *  Failures and cancellation short-circuit without invoking {@code m}.<br>
	 * <br>
	 * Cancelling the returned {@code Future} cancels this one while it is outstanding,
	 *  and the {@code Future} produced by {@code m} once that has started.
	 *
	 * @param m the routine that starts the next computation
	 * @param <T> the success type of the next computation
	 *
	 * @return a new {@code Future} for the result of the chained computation
	 */
	public <T> Future<T, F> then(Function<? super S, Future<T, F>> m) {
		Objects.requireNonNull(m, "m must not be null");
		return new Future<>(resolver -> {
			SerialCancellable stage = new SerialCancellable();
			resolver.setCancelHandler(stage::cancel);
			stage.setFirst(observe(done -> {
				if(!done.isSuccess()) {
					resolver.resolve(done.<T>withoutValue());
					return;
				}
				if(resolver.isCancelled())
					return;
				Future<T, F> next;
				try {
					next = m.apply(done.getResult().getValue());
				} catch(RuntimeException e) {
					resolver.cancel();
					throw e;
				}
				if(next == null) {
					resolver.cancel();
					throw new NullPointerException("then continuation returned null");
				}
				stage.set(next.observe(resolver::resolve));
			}));
		});
	}

	/**
	 * Alias of {@link #then(Function)}.
	 *
	 * @param m the routine that starts the next computation
	 * @param <T> the success type of the next computation
	 *
	 * @return a new {@code Future} for the result of the chained computation
	 */
	public <T> Future<T, F> flatMap(Function<? super S, Future<T, F>> m) {
		return then(m);
	}

	/**
	 * Recovers from a failure by starting another asynchronous computation. Successful
	 *  values pass through and cancellation is kept; {@code m} is invoked only for a
	 *  failure.
	 *
	 * @param m the routine mapping a failure into a replacement computation
	 * @param <G> the failure type of the replacement computation
	 *
	 * @return a new {@code Future} with modified failure behavior
	 */
	public <G> Future<S, G> rescue(Function<? super F, Future<S, G>> m) {
		Objects.requireNonNull(m, "m must not be null");
		return new Future<>(resolver -> {
			SerialCancellable stage = new SerialCancellable();
			resolver.setCancelHandler(stage::cancel);
			stage.setFirst(observe(done -> {
				if(done.isCancelled()) {
					resolver.cancel();
					return;
				}
				if(done.isSuccess()) {
					resolver.succeed(done.getResult().getValue());
					return;
				}
				if(resolver.isCancelled())
					return;
				Future<S, G> replacement;
				try {
					replacement = m.apply(done.getResult().getError());
				} catch(RuntimeException e) {
					resolver.cancel();
					throw e;
				}
				if(replacement == null) {
					resolver.cancel();
					throw new NullPointerException("rescue continuation returned null");
				}
				stage.set(replacement.observe(resolver::resolve));
			}));
		});
	}

	/**
	 * Runs {@code action} with a successful value, then passes the completion on unchanged.
	 *
	 * @param action the side effect
	 *
	 * @return a new {@code Future} with the same completion as this one
	 */
	public Future<S, F> onSuccess(Consumer<? super S> action) {
		Objects.requireNonNull(action, "action must not be null");
		return derive((done, resolver) -> {
			if(done.isSuccess())
				action.accept(done.getResult().getValue());
			resolver.resolve(done);
		});
	}

	public Future<S, F> onFailure(Consumer<? super F> action) {
		Objects.requireNonNull(action, "action must not be null");
		return derive((done, resolver) -> {
			if(done.isFailure())
				action.accept(done.getResult().getError());
			resolver.resolve(done);
		});
	}

	public Future<S, F> onCancel(Runnable action) {
		Objects.requireNonNull(action, "action must not be null");
		return derive((done, resolver) -> {
			if(done.isCancelled())
				action.run();
			resolver.resolve(done);
		});
	}

	/**
	 * Defers starting this {@code Future} until {@code executor} runs it. The setup
	 *  function of this {@code Future} therefore runs on {@code executor}. Cancelling before
	 *  the executor gets to it means this {@code Future} is never started.
	 *
	 * @param executor the context on which to start the computation
	 *
	 * @return a new {@code Future} with the same completion as this one
	 */
	public Future<S, F> schedule(Executor executor) {
		Objects.requireNonNull(executor, "executor must not be null");
		return new Future<>(resolver -> {
			SerialCancellable stage = new SerialCancellable();
			resolver.setCancelHandler(stage::cancel);
			executor.execute(() -> {
				if(resolver.isCancelled())
					return;
				stage.setFirst(observe(resolver::resolve));
			});
		});
	}

	/**
	 * Delivers the completion of this {@code Future} on {@code executor}. Observers of the
	 *  returned {@code Future} are invoked on {@code executor}, including when it resolves
	 *  because of cancellation.
	 *
	 * @param executor the context on which to deliver the completion
	 *
	 * @return a new {@code Future} with the same completion as this one
	 */
	public Future<S, F> receive(Executor executor) {
		Objects.requireNonNull(executor, "executor must not be null");
		return new Future<>(resolver -> {
			resolver.resolvesOwnCancellation();
			SerialCancellable stage = new SerialCancellable();
			resolver.setCancelHandler(() -> {
				stage.cancel();
				dispatch(executor, resolver::cancel, resolver);
			});
			stage.setFirst(observe(done -> dispatch(executor, () -> resolver.resolve(done), resolver)));
		});
	}

	/**
	 * Delivers the completion of this {@code Future} on {@code executor} once
	 *  {@code delay} has elapsed after it resolved. Unlike {@link #delay} this also
	 *  holds back failures.
	 *
	 * @param executor the context on which to deliver the completion
	 * @param delay how long to hold the completion back
	 * @param kind the clock against which {@code delay} is measured
	 * @param scheduler the scheduler that owns the timer
	 *
	 * @return a new {@code Future} with the same completion as this one
	 */
	public Future<S, F> receive(Executor executor, Duration delay, TimerKind kind, Scheduler scheduler) {
		checkDelay(delay);
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(scheduler, "scheduler must not be null");
		Future<S, F> held = new Future<>(resolver -> {
			SerialCancellable stage = new SerialCancellable();
			resolver.setCancelHandler(stage::cancel);
			stage.setFirst(observe(done -> {
				if(done.isCancelled())
					resolver.cancel();
				else
					stage.set(scheduler.schedule(delay, kind, () -> resolver.resolve(done)));
			}));
		});
		return held.receive(executor);
	}

	/**
	 * Inserts a pause between a successful value of this {@code Future} and the downstream
	 *  continuation. Failures and cancellation are passed on without waiting. The timer can
	 *  be cancelled until the moment it fires.
	 *
	 * @param delay how long to wait after success
	 * @param kind the clock against which {@code delay} is measured
	 * @param scheduler the scheduler that owns the timer
	 *
	 * @return a new {@code Future} resolving with the same value, later
	 */
	public Future<S, F> delay(Duration delay, TimerKind kind, Scheduler scheduler) {
		checkDelay(delay);
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(scheduler, "scheduler must not be null");
		return then(value -> Future.<F>timer(delay, kind, scheduler).map(ignore -> value));
	}

	/**
	 * Chains a computation that is retried according to {@code strategy} onto a successful
	 *  value of this {@code Future}.
	 *
	 * @param strategy the attempt budget and spacing
	 * @param scheduler the scheduler used for waits between attempts
	 * @param producer starts one attempt with the value of this {@code Future}
	 * @param <T> the success type of the retried computation
	 *
	 * @return a new {@code Future} for the outcome of the last attempt
	 *
	 * @see Futures#retry(RetryStrategy, Scheduler, Supplier)
	 */
	public <T> Future<T, F> thenRetry(RetryStrategy strategy, Scheduler scheduler, Function<? super S, Future<T, F>> producer) {
		Objects.requireNonNull(producer, "producer must not be null");
		return then(value -> Futures.retry(strategy, scheduler, () -> producer.apply(value)));
	}

	private <T, G> Future<T, G> derive(BiConsumer<? super Completion<S, F>, Resolver<T, G>> handler) {
		return new Future<>(resolver -> {
			CancellationToken upstream = observe(done -> {
				try {
					handler.accept(done, resolver);
				} catch(RuntimeException e) {
					resolver.cancel();
					throw e;
				}
			});
			resolver.setCancelHandler(upstream::cancel);
		});
	}

	private static void dispatch(Executor executor, Runnable delivery, Resolver<?, ?> resolver) {
		try {
			executor.execute(delivery);
		} catch(RejectedExecutionException e) {
			LOGGER.warn("Executor rejected a completion, resolving as cancelled on the calling thread", e);
			resolver.cancel();
		}
	}

	private static void checkDelay(Duration delay) {
		Objects.requireNonNull(delay, "delay must not be null");
		if(delay.isNegative())
			throw new IllegalArgumentException("delay must not be negative: " + delay);
	}

	boolean resolve(Completion<S, F> result) {
		List<Consumer<? super Completion<S, F>>> toNotify;
		synchronized(this) {
			if(completion != null)
				return false;
			completion = result;
			toNotify = observers;
			observers = null;
			cancelHandler = null;
			setup = null;
		}
		notifyObservers(toNotify, result);
		return true;
	}

	private void notifyObservers(List<Consumer<? super Completion<S, F>>> toNotify, Completion<S, F> result) {
		RuntimeException first = null;
		for(Consumer<? super Completion<S, F>> observer : toNotify) {
			try {
				observer.accept(result);
			} catch(RuntimeException e) {
				LOGGER.error("Observer threw while handling completion {}", result, e);
				if(first == null)
					first = e;
				else
					first.addSuppressed(e);
			}
		}
		if(first != null)
			throw first;
	}

	void requestCancel() {
		Runnable handler;
		boolean resolveHere;
		synchronized(this) {
			if(completion != null || cancelRequested)
				return;
			cancelRequested = true;
			handler = cancelHandler;
			cancelHandler = null;
			setup = null;
			resolveHere = !resolvesOwnCancellation || handler == null;
		}
		try {
			if(handler != null)
				handler.run();
		} finally {
			if(resolveHere)
				resolve(Completion.cancelled());
		}
	}

	void setCancelHandler(Runnable handler) {
		boolean runNow;
		synchronized(this) {
			runNow = cancelRequested || (completion != null && completion.isCancelled());
			if(!runNow && completion == null)
				cancelHandler = handler;
		}
		if(runNow)
			handler.run();
	}

	synchronized boolean isCancellationRequested() {
		return cancelRequested || (completion != null && completion.isCancelled());
	}

	synchronized void resolvesOwnCancellation() {
		resolvesOwnCancellation = true;
	}
}
