/*
 * Futures.java
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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.Supplier;

import net.vpnclient.EventKeeper;

/**
 * Provided utilities for composing {@link Future}s.
 */
public class Futures {
	private Futures() {}

	/**
	 * Runs the computation started by {@code producer}, starting it again after each
	 *  failure as {@code strategy} allows.<br>
	 * <br>
	 * The first attempt starts as soon as the returned {@code Future} is started. After a
	 *  failed attempt the loop pauses for the next wait of the strategy's
	 *  {@link WaitPolicy} and then calls {@code producer} again. The returned
	 *  {@code Future} resolves with the first success, or with the completion of the last
	 *  failed attempt once the attempt budget or the wait sequence runs out. Cancelling it
	 *  cancels whichever attempt or pause is outstanding and stops the loop.
	 *
	 * @param strategy the attempt budget and spacing
	 * @param scheduler the scheduler used for pauses between attempts
	 * @param producer starts one attempt each time it is called
	 * @param <S> the type of a successful value
	 * @param <F> the type of a failure
	 *
	 * @return a {@code Future} for the outcome of the last attempt
	 */
	public static <S, F> Future<S, F> retry(RetryStrategy strategy, Scheduler scheduler, Supplier<Future<S, F>> producer) {
		return retry(strategy, scheduler, producer, null);
	}

	/**
	 * Same as {@link #retry(RetryStrategy, Scheduler, Supplier)}, additionally recording
	 *  retries and exhaustion in {@code eventKeeper}.
	 *
	 * @param strategy the attempt budget and spacing
	 * @param scheduler the scheduler used for pauses between attempts
	 * @param producer starts one attempt each time it is called
	 * @param eventKeeper where to record retries, may be {@code null}
	 * @param <S> the type of a successful value
	 * @param <F> the type of a failure
	 *
	 * @return a {@code Future} for the outcome of the last attempt
	 */
	public static <S, F> Future<S, F> retry(RetryStrategy strategy, Scheduler scheduler, Supplier<Future<S, F>> producer,
	                                        EventKeeper eventKeeper) {
		Objects.requireNonNull(strategy, "strategy must not be null");
		Objects.requireNonNull(scheduler, "scheduler must not be null");
		Objects.requireNonNull(producer, "producer must not be null");
		return new Future<>(resolver -> {
			RetryLoop<S, F> loop = new RetryLoop<>(strategy, scheduler, producer, resolver, eventKeeper);
			resolver.setCancelHandler(loop::cancel);
			loop.run();
		});
	}

	/**
	 * Combines the values of several {@code Future}s. The result succeeds with the values
	 *  in input order once all inputs succeed. The first input to fail or be cancelled
	 *  decides the result, and the inputs still outstanding are cancelled.
	 *
	 * @param inputs the futures to wait for
	 * @param <S> the type of a successful value
	 * @param <F> the type of a failure
	 *
	 * @return a {@code Future} for the list of values
	 */
	public static <S, F> Future<List<S>, F> all(Collection<? extends Future<S, F>> inputs) {
		List<Future<S, F>> copy = new ArrayList<>(inputs);
		return new Future<>(resolver -> {
			if(copy.isEmpty()) {
				resolver.succeed(new ArrayList<>());
				return;
			}
			AtomicReferenceArray<S> values = new AtomicReferenceArray<>(copy.size());
			AtomicInteger remaining = new AtomicInteger(copy.size());
			TokenSet tokens = new TokenSet();
			resolver.setCancelHandler(tokens::cancel);
			for(int i = 0; i < copy.size(); i++) {
				final int index = i;
				tokens.add(copy.get(i).observe(done -> {
					if(done.isSuccess()) {
						values.set(index, done.getResult().getValue());
						if(remaining.decrementAndGet() == 0) {
							List<S> list = new ArrayList<>(values.length());
							for(int j = 0; j < values.length(); j++)
								list.add(values.get(j));
							resolver.succeed(list);
						}
					} else if(resolver.resolve(done.<List<S>>withoutValue())) {
						tokens.cancel();
					}
				}));
			}
		});
	}

	@SafeVarargs
	public static <S, F> Future<List<S>, F> all(Future<S, F>... inputs) {
		return all(Arrays.asList(inputs));
	}

	/**
	 * Replaces the successful value of {@code future} with {@code value}.
	 *
	 * @param future the future to wait for
	 * @param value the value to resolve with on success
	 * @param <T> the type of the replacement value
	 * @param <S> the discarded type
	 * @param <F> the type of a failure
	 *
	 * @return a {@code Future} that succeeds with {@code value}
	 */
	public static <T, S, F> Future<T, F> tag(Future<S, F> future, T value) {
		return future.map(ignore -> value);
	}

	public static <S, F> Future<Void, F> ignoreValue(Future<S, F> future) {
		return tag(future, null);
	}

	private static final class TokenSet implements Cancellable {
		private final List<Cancellable> tokens = new ArrayList<>();
		private boolean cancelled = false;

		void add(Cancellable token) {
			boolean cancelNow;
			synchronized(this) {
				cancelNow = cancelled;
				if(!cancelNow)
					tokens.add(token);
			}
			if(cancelNow)
				token.cancel();
		}

		@Override
		public void cancel() {
			List<Cancellable> toCancel;
			synchronized(this) {
				if(cancelled)
					return;
				cancelled = true;
				toCancel = new ArrayList<>(tokens);
				tokens.clear();
			}
			for(Cancellable token : toCancel)
				token.cancel();
		}
	}
}
