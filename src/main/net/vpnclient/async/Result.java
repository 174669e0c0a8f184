/*
 * Result.java
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
import java.util.function.Function;

/**
 * The outcome of a computation that ran to completion: either a success value of type
 *  {@code S} or a failure of the caller-defined type {@code F}. A {@code Result} is
 *  immutable.<br>
 * <br>
 * The failure type is not restricted to {@link Throwable}. Callers typically use an
 *  enumeration or a small error class describing their own failure domain.
 *
 * @param <S> the type of a successful value
 * @param <F> the type of a failure
 */
public final class Result<S, F> {
	private final boolean success;
	private final S value;
	private final F error;

	private Result(boolean success, S value, F error) {
		this.success = success;
		this.value = value;
		this.error = error;
	}

	/**
	 * Creates a successful {@code Result}. A {@code null} value is allowed and is
	 *  the usual way of signalling completion of a {@code Void} computation.
	 *
	 * @param value the successful value
	 * @param <S> the type of a successful value
	 * @param <F> the type of a failure
	 *
	 * @return a new successful {@code Result}
	 */
	public static <S, F> Result<S, F> success(S value) {
		return new Result<>(true, value, null);
	}

	/**
	 * Creates a failed {@code Result}.
	 *
	 * @param error the failure, must not be {@code null}
	 * @param <S> the type of a successful value
	 * @param <F> the type of a failure
	 *
	 * @return a new failed {@code Result}
	 */
	public static <S, F> Result<S, F> failure(F error) {
		Objects.requireNonNull(error, "failure must not be null");
		return new Result<>(false, null, error);
	}

	public boolean isSuccess() {
		return success;
	}

	public boolean isFailure() {
		return !success;
	}

	/**
	 * Gets the successful value.
	 *
	 * @return the value of this {@code Result}
	 *
	 * @throws IllegalStateException if this {@code Result} is a failure
	 */
	public S getValue() {
		if(!success)
			throw new IllegalStateException("Result is a failure: " + error);
		return value;
	}

	/**
	 * Gets the failure.
	 *
	 * @return the failure of this {@code Result}
	 *
	 * @throws IllegalStateException if this {@code Result} is a success
	 */
	public F getError() {
		if(success)
			throw new IllegalStateException("Result is not a failure");
		return error;
	}

	/**
	 * Transforms the successful value, passing a failure through unchanged.
	 *
	 * @param m the transformation to apply to a successful value
	 * @param <T> the new success type
	 *
	 * @return a new {@code Result}
	 */
	public <T> Result<T, F> map(Function<? super S, ? extends T> m) {
		if(success)
			return Result.success(m.apply(value));
		return Result.failure(error);
	}

	/**
	 * Transforms the failure, passing a successful value through unchanged.
	 *
	 * @param m the transformation to apply to a failure
	 * @param <G> the new failure type
	 *
	 * @return a new {@code Result}
	 */
	public <G> Result<S, G> mapError(Function<? super F, ? extends G> m) {
		if(success)
			return Result.success(value);
		return Result.failure(m.apply(error));
	}

	/**
	 * Chains a computation that may itself fail onto a successful value.
	 *
	 * @param m the computation to run with a successful value
	 * @param <T> the new success type
	 *
	 * @return the {@code Result} of {@code m}, or this failure
	 */
	public <T> Result<T, F> flatMap(Function<? super S, Result<T, F>> m) {
		if(success)
			return m.apply(value);
		return Result.failure(error);
	}

	@Override
	public boolean equals(Object o) {
		if(this == o)
			return true;
		if(!(o instanceof Result))
			return false;
		Result<?, ?> other = (Result<?, ?>)o;
		return success == other.success && Objects.equals(value, other.value) && Objects.equals(error, other.error);
	}

	@Override
	public int hashCode() {
		return Objects.hash(success, value, error);
	}

	@Override
	public String toString() {
		return success ? "success(" + value + ")" : "failure(" + error + ")";
	}
}
