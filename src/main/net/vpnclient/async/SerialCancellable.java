/*
 * SerialCancellable.java
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
 * Holds whichever stage of a multi-stage computation is currently outstanding, so that a
 *  single cancel request reaches it. Once cancelled, any stage handed over later is
 *  cancelled on arrival.
 */
final class SerialCancellable implements Cancellable {
	private Cancellable current;
	private boolean advanced = false;
	private boolean cancelled = false;

	/**
	 * Makes {@code next} the outstanding stage.
	 */
	void set(Cancellable next) {
		boolean cancelNow;
		synchronized(this) {
			cancelNow = cancelled;
			if(!cancelNow) {
				current = next;
				advanced = true;
			}
		}
		if(cancelNow)
			next.cancel();
	}

	/**
	 * Makes {@code first} the outstanding stage unless a later stage has already been set.
	 */
	void setFirst(Cancellable first) {
		boolean cancelNow;
		synchronized(this) {
			cancelNow = cancelled;
			if(!cancelNow && !advanced)
				current = first;
		}
		if(cancelNow)
			first.cancel();
	}

	@Override
	public void cancel() {
		Cancellable toCancel;
		synchronized(this) {
			if(cancelled)
				return;
			cancelled = true;
			toCancel = current;
			current = null;
		}
		if(toCancel != null)
			toCancel.cancel();
	}
}
