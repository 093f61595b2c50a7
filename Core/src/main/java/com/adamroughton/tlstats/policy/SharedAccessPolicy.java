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

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Policy for stats that may be updated and aggregated from different threads.
 * The main lock is a real mutex that only guards registration; each stat gets
 * its own {@link SpinLock}, so updates to different stats never contend and
 * aggregation of a stat serialises only with updates to that same stat.
 * 
 * @author Adam Roughton
 *
 */
public final class SharedAccessPolicy implements ConcurrencyPolicy {

	@Override
	public MainLock newMainLock() {
		return new ReentrantMainLock();
	}

	@Override
	public <TContainer> ContainerAndLock<TContainer> newContainerAndLock() {
		return new SpinLockedContainerRef<>();
	}

	@Override
	public CounterCell newCounterCell() {
		return new AtomicCounterCell();
	}
	
	@Override
	public String toString() {
		return "SharedAccessPolicy";
	}
	
	private static final class ReentrantMainLock implements MainLock {

		private final Lock _lock = new ReentrantLock();
		
		@Override
		public void lock() {
			_lock.lock();
		}

		@Override
		public void unlock() {
			_lock.unlock();
		}

		@Override
		public void swapThreads() {
		}
		
	}
	
	private static final class SpinLockedContainerRef<TContainer> implements ContainerAndLock<TContainer> {

		private final SpinLock _lock = new SpinLock();
		
		// written under both locks, read without any
		private volatile TContainer _container = null;
		
		@Override
		public TContainer get() {
			return _container;
		}

		@Override
		public void set(TContainer container) {
			_container = container;
		}

		@Override
		public void lock() {
			_lock.lock();
		}

		@Override
		public void unlock() {
			_lock.unlock();
		}
		
	}
	
	private static final class AtomicCounterCell implements CounterCell {

		private final AtomicLong _value = new AtomicLong(0);
		
		@Override
		public void increment(long amount) {
			_value.addAndGet(amount);
		}

		@Override
		public long get() {
			return _value.get();
		}

		@Override
		public long reset() {
			return _value.getAndSet(0);
		}
		
	}
	
}
