/*
 * CancellationToken.java
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

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The consumer-side handle returned by {@link Future#observe}. Cancelling a token is a
 *  best-effort request: if the {@code Future} has already resolved nothing happens,
 *  otherwise the producer's cancel handler runs once and the {@code Future} resolves as
 *  cancelled, unless the producer's own resolution wins the race.<br>
 * <br>
 * Cancellation chains to the observed {@code Future} itself, so every other observer
 *  of it sees the cancelled completion too.
 */
public final class CancellationToken implements Cancellable {
	private final Future<?, ?> future;
	private final AtomicBoolean cancelled = new AtomicBoolean(false);

	CancellationToken(Future<?, ?> future) {
		this.future = future;
	}

	@Override
	public void cancel() {
		if(cancelled.compareAndSet(false, true)) {
			future.requestCancel();
		}
	}

	/**
	 * Returns {@code true} if {@link #cancel()} has been called on this token.
	 *
	 * @return whether this token has been used
	 */
	public boolean isCancelled() {
		return cancelled.get();
	}
}
