/*
 * TimerKind.java
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
 * The clock a timer is measured against.
 */
public enum TimerKind {
	/**
	 * Measured on the monotonic process clock ({@link System#nanoTime()}). The timer is
	 *  unaffected by changes to the wall clock, but time during which the host was
	 *  suspended may not count towards it.
	 */
	DEADLINE,

	/**
	 * Measured on the wall clock. The timer fires once wall time passes its deadline,
	 *  including when that happens because the host slept through the interval.
	 */
	WALL_CLOCK
}
