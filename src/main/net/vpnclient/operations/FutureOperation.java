/*
 * FutureOperation.java
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

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import net.vpnclient.async.CancellationToken;
import net.vpnclient.async.Completion;
import net.vpnclient.async.Future;

/**
 * An operation that starts a {@link Future} and stays executing until that future
 *  resolves. The completion is handed to a consumer exactly once; if the operation
 *  finishes without the future having resolved (because it was cancelled before it
 *  started) the consumer receives a cancelled completion.
 *
 * @param <S> the type of a successful value
 * @param <F> the type of a failure
 */
public class FutureOperation<S, F> extends Operation {
	private final Future<S, F> future;
	private final Consumer<? super Completion<S, F>> onCompletion;
	private final AtomicBoolean delivered = new AtomicBoolean(false);
	private CancellationToken subscription;

	public FutureOperation(String name, Future<S, F> future, Consumer<? super Completion<S, F>> onCompletion) {
		super(name);
		this.future = Objects.requireNonNull(future, "future must not be null");
		this.onCompletion = Objects.requireNonNull(onCompletion, "onCompletion must not be null");
		addCompletionListener(() -> deliver(Completion.cancelled()));
	}

	@Override
	protected void main() {
		CancellationToken token = future.observe(done -> {
			deliver(done);
			finish();
		});
		boolean cancelNow;
		synchronized(this) {
			subscription = token;
			cancelNow = isCancelled();
		}
		if(cancelNow)
			token.cancel();
	}

	@Override
	protected void onCancel() {
		CancellationToken token;
		synchronized(this) {
			token = subscription;
		}
		if(token != null)
			token.cancel();
	}

	private void deliver(Completion<S, F> completion) {
		if(delivered.compareAndSet(false, true))
			onCompletion.accept(completion);
	}
}
