/*
 * ObserverListTest.java
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
package net.vpnclient;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ObserverListTest {

	@Test
	void testNotifiesInRegistrationOrder() {
		ObserverList<Consumer<String>> observers = new ObserverList<>();
		List<String> received = new ArrayList<>();
		observers.add(s -> received.add("first " + s));
		observers.add(s -> received.add("second " + s));

		observers.forEach(o -> o.accept("connected"));

		Assertions.assertEquals(Arrays.asList("first connected", "second connected"), received);
	}

	@Test
	void testRegistrationsAreRemovedIndividually() {
		ObserverList<Consumer<String>> observers = new ObserverList<>();
		List<String> received = new ArrayList<>();
		Consumer<String> observer = received::add;
		ObserverList<Consumer<String>>.Registration first = observers.add(observer);
		ObserverList<Consumer<String>>.Registration second = observers.add(observer);
		Assertions.assertNotEquals(first.getId(), second.getId());

		first.cancel();
		Assertions.assertFalse(observers.remove(first), "Registration removed twice");
		observers.forEach(o -> o.accept("x"));

		Assertions.assertEquals(Arrays.asList("x"), received);
		Assertions.assertEquals(1, observers.size());
	}

	@Test
	void testThrowingObserverDoesNotStopDelivery() {
		ObserverList<Consumer<String>> observers = new ObserverList<>();
		List<String> received = new ArrayList<>();
		observers.add(s -> {
			throw new IllegalStateException("broken observer");
		});
		observers.add(received::add);

		observers.forEach(o -> o.accept("event"));

		Assertions.assertEquals(Arrays.asList("event"), received);
	}

	@Test
	void testObserverMayRemoveItselfDuringNotification() {
		ObserverList<Runnable> observers = new ObserverList<>();
		List<ObserverList<Runnable>.Registration> handles = new ArrayList<>();
		List<String> calls = new ArrayList<>();
		handles.add(observers.add(() -> {
			calls.add("once");
			handles.get(0).cancel();
		}));

		observers.forEach(Runnable::run);
		observers.forEach(Runnable::run);

		Assertions.assertEquals(Arrays.asList("once"), calls);
		Assertions.assertEquals(0, observers.size());
	}
}
