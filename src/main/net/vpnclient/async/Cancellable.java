/*
 * Cancellable.java
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

/**
 * Something whose pending work can be abandoned: a subscription to a {@link Future},
 *  a scheduled timer, or a queued operation. Cancellation reaches the underlying work
 *  itself, so it is abandoned even if other consumers of it have not cancelled.
 */
public interface Cancellable {
	/**
	 * Requests cancellation. Calling this on work that has already completed, or that
	 *  was already cancelled, has no effect. Implementations do not block.
	 */
	void cancel();
}
