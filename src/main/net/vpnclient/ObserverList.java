/*
 * ObserverList.java
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

import net.vpnclient.async.Cancellable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A thread-safe list of observers for components that broadcast state changes, such as
 *  a tunnel manager telling interested parties about new tunnel status. Each registration
 *  is identified by a handle rather than by the observer object, so the same observer may
 *  be registered twice and removed one registration at a time.
 *
 * @param <T> the observer type
 */
public class ObserverList<T> {
	private static final Logger LOGGER = LoggerFactory.getLogger(ObserverList.class);

	private final Map<Long, T> observers = new LinkedHashMap<>();
	private long nextId = 0;

	/**
	 * Registers {@code observer}. Cancelling the returned handle removes the registration.
	 *
	 * @param observer the observer to add
	 *
	 * @return the handle for this registration
	 */
	public synchronized Registration add(T observer) {
		Objects.requireNonNull(observer, "observer must not be null");
		long id = nextId++;
		observers.put(id, observer);
		return new Registration(id);
	}

	/**
	 * @param registration the handle returned by {@link #add}
	 * @return {@code true} if the registration was still present
	 */
	public synchronized boolean remove(Registration registration) {
		return registration.owner() == this && observers.remove(registration.id) != null;
	}

	/**
	 * Calls {@code action} with every observer registered at the time of the call, in
	 *  registration order. An exception thrown for one observer is logged and delivery
	 *  continues with the next.
	 *
	 * @param action the notification to deliver
	 */
	public void forEach(Consumer<? super T> action) {
		List<T> snapshot;
		synchronized(this) {
			snapshot = new ArrayList<>(observers.values());
		}
		for(T observer : snapshot) {
			try {
				action.accept(observer);
			} catch(RuntimeException e) {
				LOGGER.error("Observer {} threw during notification", observer, e);
			}
		}
	}

	public synchronized int size() {
		return observers.size();
	}

	/**
	 * The handle of one registration.
	 */
	public final class Registration implements Cancellable {
		private final long id;

		private Registration(long id) {
			this.id = id;
		}

		public long getId() {
			return id;
		}

		private ObserverList<T> owner() {
			return ObserverList.this;
		}

		@Override
		public void cancel() {
			remove(this);
		}
	}
}
