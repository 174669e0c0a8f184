/*
 * Resolver.java
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

import java.util.Objects;

/**
 * The producer-side capability to resolve a {@link Future}. A {@code Resolver} is handed
 *  to the setup function of a {@code Future} and is the only way to give that
 *  {@code Future} its {@link Completion}.<br>
 * <br>
 * Resolution is single-assignment: the first call to any of the {@code resolve}
 *  family wins and every later call is ignored. This includes the case where a
 *  cancellation request has already resolved the {@code Future} as cancelled, so
 *  producers do not need to check for cancellation before reporting their outcome.
 *
 * @param <S> the type of a successful value
 * @param <F> the type of a failure
 */
public final class Resolver<S, F> {
	private final Future<S, F> future;

	Resolver(Future<S, F> future) {
		this.future = future;
	}

	/**
	 * Resolves the associated {@code Future}.
	 *
	 * @param completion the terminal state of the computation
	 *
	 * @return {@code true} if this call resolved the {@code Future}, {@code false} if it
	 *  had already been resolved
	 */
	public boolean resolve(Completion<S, F> completion) {
		Objects.requireNonNull(completion, "completion must not be null");
		return future.resolve(completion);
	}

	public boolean resolve(Result<S, F> result) {
		return resolve(Completion.finished(result));
	}

	public boolean succeed(S value) {
		return resolve(Completion.success(value));
	}

	public boolean fail(F error) {
		return resolve(Completion.failure(error));
	}

	/**
	 * Resolves the associated {@code Future} as cancelled without running the cancel
	 *  handler.
	 *
	 * @return {@code true} if this call resolved the {@code Future}
	 */
	public boolean cancel() {
		return future.resolve(Completion.cancelled());
	}

	/**
	 * Sets the routine run when cancellation of the associated {@code Future} is
	 *  requested before it resolves, replacing any routine set earlier. If cancellation
	 *  has already been requested the routine is run immediately on the calling thread;
	 *  if the {@code Future} has already finished normally the routine is dropped.
	 *
	 * @param handler the routine that abandons the producer's outstanding work
	 */
	public void setCancelHandler(Runnable handler) {
		Objects.requireNonNull(handler, "handler must not be null");
		future.setCancelHandler(handler);
	}

	/**
	 * Returns {@code true} once cancellation of the associated {@code Future} has been
	 *  requested, or it has resolved as cancelled.
	 *
	 * @return whether the consumer has given up on this computation
	 */
	public boolean isCancelled() {
		return future.isCancellationRequested();
	}

	/**
	 * Leaves resolution on cancellation to the cancel handler. Used by combinators that
	 *  must deliver the cancelled state on a particular executor.
	 */
	void resolvesOwnCancellation() {
		future.resolvesOwnCancellation();
	}
}
