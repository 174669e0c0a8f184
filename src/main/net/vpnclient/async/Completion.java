/*
 * Completion.java
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
 * The terminal state of a {@link Future}: either {@code finished} with a {@link Result}
 *  or {@code cancelled}. Cancellation is not an error; callers that need to tell the two
 *  apart check {@link #isCancelled()} before looking at the result.
 *
 * @param <S> the type of a successful value
 * @param <F> the type of a failure
 */
public final class Completion<S, F> {
	private static final Completion<?, ?> CANCELLED = new Completion<>(null);

	private final Result<S, F> result;

	private Completion(Result<S, F> result) {
		this.result = result;
	}

	public static <S, F> Completion<S, F> finished(Result<S, F> result) {
		Objects.requireNonNull(result, "result must not be null");
		return new Completion<>(result);
	}

	public static <S, F> Completion<S, F> success(S value) {
		return new Completion<>(Result.success(value));
	}

	public static <S, F> Completion<S, F> failure(F error) {
		return new Completion<>(Result.failure(error));
	}

	@SuppressWarnings("unchecked")
	public static <S, F> Completion<S, F> cancelled() {
		return (Completion<S, F>)CANCELLED;
	}

	public boolean isCancelled() {
		return result == null;
	}

	public boolean isFinished() {
		return result != null;
	}

	public boolean isSuccess() {
		return result != null && result.isSuccess();
	}

	public boolean isFailure() {
		return result != null && result.isFailure();
	}

	/**
	 * Gets the {@link Result} of a finished computation.
	 *
	 * @return the result carried by this {@code Completion}
	 *
	 * @throws IllegalStateException if this {@code Completion} is cancelled
	 */
	public Result<S, F> getResult() {
		if(result == null)
			throw new IllegalStateException("Completion is cancelled");
		return result;
	}

	/**
	 * Re-types a cancelled or failed completion for use in a chain with a different
	 *  success type. Only valid for completions that carry no success value.
	 */
	@SuppressWarnings("unchecked")
	<T> Completion<T, F> withoutValue() {
		if(isSuccess())
			throw new IllegalStateException("Completion carries a value");
		return (Completion<T, F>)this;
	}

	@Override
	public boolean equals(Object o) {
		if(this == o)
			return true;
		if(!(o instanceof Completion))
			return false;
		return Objects.equals(result, ((Completion<?, ?>)o).result);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(result);
	}

	@Override
	public String toString() {
		return result == null ? "cancelled" : "finished(" + result + ")";
	}
}
