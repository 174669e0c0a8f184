/*
 * AsyncOperation.java
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
import java.util.function.Consumer;

/**
 * An operation whose body is a block that receives a "finish" handle. The block may
 *  start asynchronous work and call the handle from any thread once that work is done.
 */
public class AsyncOperation extends Operation {
	private final Consumer<Runnable> block;

	public AsyncOperation(String name, Consumer<Runnable> block) {
		super(name);
		this.block = Objects.requireNonNull(block, "block must not be null");
	}

	/**
	 * Wraps a synchronous task; the operation finishes when {@code task} returns.
	 *
	 * @param name the operation name used in logs
	 * @param task the work to run
	 *
	 * @return a new operation
	 */
	public static AsyncOperation of(String name, Runnable task) {
		Objects.requireNonNull(task, "task must not be null");
		return new AsyncOperation(name, finish -> {
			try {
				task.run();
			} finally {
				finish.run();
			}
		});
	}

	@Override
	protected void main() {
		block.accept(this::finish);
	}
}
