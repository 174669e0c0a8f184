/*
 * ExclusivityController.java
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
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serializes operations that share an exclusivity category while letting operations in
 *  unrelated categories run side by side.<br>
 * <br>
 * For every category the controller remembers the most recently added operation, its
 *  "tail". Adding an operation makes it depend on the current tail of each of its
 *  categories and then makes it the new tail, so operations of one category run one at a
 *  time in the order they were added. A category is forgotten once its tail finishes.<br>
 * <br>
 * Operations must be added here before they are handed to an {@link OperationQueue},
 *  since dependencies cannot be added to an enqueued operation.
 */
public class ExclusivityController {
	private static final Logger LOGGER = LoggerFactory.getLogger(ExclusivityController.class);

	private final Map<String, Operation> tails = new HashMap<>();

	/**
	 * Orders {@code operation} after the operations already registered under any of
	 *  {@code categories}. The registration is removed automatically when the operation
	 *  finishes.
	 *
	 * @param operation the operation to order
	 * @param categories the categories the operation is exclusive in
	 *
	 * @throws IllegalArgumentException if a category is empty
	 * @throws IllegalStateException if the operation has already been enqueued or started
	 */
	public void addOperation(Operation operation, Collection<String> categories) {
		Objects.requireNonNull(operation, "operation must not be null");
		Set<String> keys = checkCategories(categories);
		if(!operation.acceptsDependencies())
			throw new IllegalStateException("Cannot order " + operation + " once it has been enqueued");
		Set<Operation> predecessors = new LinkedHashSet<>();
		synchronized(this) {
			for(String key : keys) {
				Operation tail = tails.put(key, operation);
				if(tail != null && tail != operation)
					predecessors.add(tail);
			}
		}
		for(Operation predecessor : predecessors) {
			LOGGER.debug("{} waits for {} in {}", operation.getName(), predecessor.getName(), keys);
			operation.addDependency(predecessor);
		}
		operation.addCompletionListener(() -> removeOperation(operation, keys));
	}

	/**
	 * Orders a batch of operations: each operation is ordered after the previous one of the
	 *  batch as well as after the current tails of {@code categories}.
	 *
	 * @param batch the operations in the order they must run
	 * @param categories the categories every operation of the batch is exclusive in
	 */
	public void addOperations(List<? extends Operation> batch, Collection<String> categories) {
		Set<String> keys = checkCategories(categories);
		for(Operation operation : batch)
			addOperation(operation, keys);
	}

	/**
	 * Forgets {@code operation} as the tail of each of {@code categories} where it still
	 *  is the tail.
	 *
	 * @param operation the operation to remove
	 * @param categories the categories it was added with
	 */
	public void removeOperation(Operation operation, Collection<String> categories) {
		synchronized(this) {
			for(String key : categories)
				tails.remove(key, operation);
		}
	}

	/**
	 * @return the categories that currently have an unfinished tail operation
	 */
	public synchronized Set<String> activeCategories() {
		return new LinkedHashSet<>(tails.keySet());
	}

	private static Set<String> checkCategories(Collection<String> categories) {
		Objects.requireNonNull(categories, "categories must not be null");
		Set<String> keys = new LinkedHashSet<>();
		for(String key : categories) {
			if(key == null || key.isEmpty())
				throw new IllegalArgumentException("Exclusivity category must be a non-empty string, got " + categories);
			keys.add(key);
		}
		return keys;
	}
}
