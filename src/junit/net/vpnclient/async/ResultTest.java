/*
 * ResultTest.java
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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ResultTest {

	@Test
	void testSuccessAndFailureAccessors() {
		Result<Integer, String> success = Result.success(4);
		Result<Integer, String> failure = Result.failure("boom");

		Assertions.assertTrue(success.isSuccess());
		Assertions.assertEquals(4, success.getValue());
		Assertions.assertThrows(IllegalStateException.class, success::getError);

		Assertions.assertTrue(failure.isFailure());
		Assertions.assertEquals("boom", failure.getError());
		Assertions.assertThrows(IllegalStateException.class, failure::getValue);
	}

	@Test
	void testMapOnlyTouchesMatchingSide() {
		Result<Integer, String> success = Result.success(4);
		Result<Integer, String> failure = Result.failure("boom");

		Assertions.assertEquals(Result.success(8), success.map(v -> v * 2));
		Assertions.assertEquals(Result.failure("boom"), failure.map(v -> v * 2));
		Assertions.assertEquals(Result.success(4), success.mapError(String::length));
		Assertions.assertEquals(Result.failure(4), failure.mapError(String::length));
		Assertions.assertEquals(Result.failure("odd"), Result.<Integer, String>success(3)
				.flatMap(v -> v % 2 == 0 ? Result.success(v) : Result.failure("odd")));
	}

	@Test
	void testFailureRequiresError() {
		Assertions.assertThrows(NullPointerException.class, () -> Result.failure(null));
	}

	@Test
	void testCompletionStates() {
		Completion<Integer, String> cancelled = Completion.cancelled();
		Assertions.assertTrue(cancelled.isCancelled());
		Assertions.assertFalse(cancelled.isFinished());
		Assertions.assertFalse(cancelled.isSuccess());
		Assertions.assertFalse(cancelled.isFailure());
		Assertions.assertThrows(IllegalStateException.class, cancelled::getResult);

		Completion<Integer, String> failure = Completion.failure("boom");
		Assertions.assertTrue(failure.isFinished());
		Assertions.assertTrue(failure.isFailure());
		Assertions.assertEquals(Completion.finished(Result.failure("boom")), failure);
		Assertions.assertNotEquals(cancelled, failure);
	}
}
