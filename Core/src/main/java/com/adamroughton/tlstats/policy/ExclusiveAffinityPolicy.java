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

/**
 * Policy for stats that are only ever touched by one logical thread, including
 * the calls to aggregate them. No locking is performed at all.
 * <p>
 * When thread affinity checking is enabled, the main lock remembers the first
 * thread to acquire it and fails with an {@link IllegalStateException} if any
 * other thread acquires it afterwards, until {@link MainLock#swapThreads()} 
 * is called. Checking is intended for development: it is enabled by default 
 * only when assertions are enabled for this package.
 * 
 * @author Adam Roughton
 *
 */
public final class ExclusiveAffinityPolicy implements ConcurrencyPolicy {

	private final boolean _checkThreadAffinity;
	
	public ExclusiveAffinityPolicy() {
		this(ExclusiveAffinityPolicy.class.desiredAssertionStatus());
	}
	
	public ExclusiveAffinityPolicy(boolean checkThreadAffinity) {
		_checkThreadAffinity = checkThreadAffinity;
	}
	
	public boolean isCheckingThreadAffinity() {
		return _checkThreadAffinity;
	}
	
	@Override
	public MainLock newMainLock() {
		return new AffinityMainLock(_checkThreadAffinity);
	}

	@Override
	public <TContainer> ContainerAndLock<TContainer> newContainerAndLock() {
		return new UnguardedContainerRef<>();
	}

	@Override
	public CounterCell newCounterCell() {
		return new PlainCounterCell();
	}
	
	@Override
	public String toString() {
		return String.format("ExclusiveAffinityPolicy [checkThreadAffinity=%b]", _checkThreadAffinity);
	}
	
	private static final class AffinityMainLock implements MainLock {

		private final boolean _checkThreadAffinity;
		
		// volatile only so that misuse is reported reliably
		private volatile Thread _owner = null;
		
		public AffinityMainLock(boolean checkThreadAffinity) {
			_checkThreadAffinity = checkThreadAffinity;
		}
		
		@Override
		public void lock() {
			if (!_checkThreadAffinity) return;
			Thread current = Thread.currentThread();
			Thread owner = _owner;
			if (owner == null) {
				_owner = current;
			} else if (owner != current) {
				throw new IllegalStateException(String.format("Stats owned by thread '%s' were accessed from thread '%s'. " +
						"Call swapThreads() before handing the stats to another thread.", 
						owner.getName(), current.getName()));
			}
		}

		@Override
		public void unlock() {
		}

		@Override
		public void swapThreads() {
			_owner = null;
		}
		
	}
	
	private static final class UnguardedContainerRef<TContainer> implements ContainerAndLock<TContainer> {

		private TContainer _container = null;
		
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
		}

		@Override
		public void unlock() {
		}
		
	}
	
	private static final class PlainCounterCell implements CounterCell {

		private long _value = 0;
		
		@Override
		public void increment(long amount) {
			_value += amount;
		}

		@Override
		public long get() {
			return _value;
		}

		@Override
		public long reset() {
			long value = _value;
			_value = 0;
			return value;
		}
		
	}
	
}
