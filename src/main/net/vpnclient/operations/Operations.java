/*
 * Operations.java
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

import java.util.Collection;
import java.util.Objects;

import net.vpnclient.async.Future;

/**
 * Lifts {@link Future}s into {@link Operation}s so they can be ordered on an
 *  {@link OperationQueue}.
 */
public class Operations {
	private Operations() {}

	/**
	 * Runs {@code future} as an operation on {@code queue}. The returned {@code Future}
	 *  resolves with the completion of {@code future} once the operation finishes; it
	 *  resolves cancelled if the operation is cancelled before it starts. Cancelling the
	 *  returned {@code Future} cancels the operation.<br>
	 * <br>
	 * Nothing is enqueued until the returned {@code Future} is observed or started.
	 *
	 * @param future the computation to run
	 * @param queue the queue to run it on
	 * @param <S> the type of a successful value
	 * @param <F> the type of a failure
	 *
	 * @return a {@code Future} for the outcome of {@code future}
	 */
	public static <S, F> Future<S, F> run(Future<S, F> future, OperationQueue queue) {
		Objects.requireNonNull(future, "future must not be null");
		Objects.requireNonNull(queue, "queue must not be null");
		return new Future<>(resolver -> {
			FutureOperation<S, F> operation = new FutureOperation<>("future", future, resolver::resolve);
			resolver.setCancelHandler(operation::cancel);
			queue.addOperation(operation);
		});
	}

	/**
	 * Runs {@code future} as an operation on {@code queue} that is exclusive in
	 *  {@code categories}: it starts only after every operation previously added to
	 *  {@code controller} under any of those categories has finished.
	 *
	 * @param future the computation to run
	 * @param queue the queue to run it on
	 * @param controller the controller tracking the categories
	 * @param categories the categories the computation is exclusive in
	 * @param <S> the type of a successful value
	 * @param <F> the type of a failure
	 *
	 * @return a {@code Future} for the outcome of {@code future}
	 */
	public static <S, F> Future<S, F> run(Future<S, F> future, OperationQueue queue, ExclusivityController controller,
	                                      Collection<String> categories) {
		Objects.requireNonNull(future, "future must not be null");
		Objects.requireNonNull(queue, "queue must not be null");
		Objects.requireNonNull(controller, "controller must not be null");
		Objects.requireNonNull(categories, "categories must not be null");
		return new Future<>(resolver -> {
			FutureOperation<S, F> operation = new FutureOperation<>(String.join("+", categories), future, resolver::resolve);
			resolver.setCancelHandler(operation::cancel);
			controller.addOperation(operation, categories);
			queue.addOperation(operation);
		});
	}
}
