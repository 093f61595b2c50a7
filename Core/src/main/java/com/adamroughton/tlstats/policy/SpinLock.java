/*
 * Copyright 2013 Adam Roughton
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
package com.adamroughton.tlstats.policy;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A non-reentrant test-and-test-and-set lock for critical sections
 * of a handful of instructions.
 */
public final class SpinLock {

	private final AtomicBoolean _isHeld = new AtomicBoolean(false);
	
	public void lock() {
		while (!_isHeld.compareAndSet(false, true)) {
			while (_isHeld.get());
		}
	}
	
	public boolean tryLock() {
		return _isHeld.compareAndSet(false, true);
	}
	
	public void unlock() {
		_isHeld.set(false);
	}
	
	public boolean isLocked() {
		return _isHeld.get();
	}
	
}
