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
package com.adamroughton.tlstats;

import com.adamroughton.tlstats.policy.CounterCell;

/**
 * A local counter that aggregates into a global counter of the same name.
 * <p>
 * Only increments are supported: each aggregation adds the net increment since
 * the previous aggregation to the global counter. Setting the counter to a value
 * is deliberately not supported, as the order in which such updates from 
 * different threads reach the global counter is undefined.
 * 
 * @author Adam Roughton
 *
 */
public final class LocalCounter extends Stat {

	private final CounterCell _value;
	
	LocalCounter(StatContainer container, String name) {
		super(container, name);
		_value = getPolicy().newCounterCell();
	}
	
	private LocalCounter(LocalCounter other) {
		super(other);
		_value = getPolicy().newCounterCell();
		_value.increment(other._value.reset());
	}
	
	/**
	 * Moves this counter into a new instance that takes over its name, pending
	 * increment and registration. This counter is left unregistered.
	 * @return the new counter
	 */
	public LocalCounter move() {
		LocalCounter moved = new LocalCounter(this);
		moved.finishMove(this);
		return moved;
	}
	
	/**
	 * Aggregates both counters, then moves {@code other} into this counter.
	 * See {@link Stat#moveAssignment(Stat, MoveContents)}.
	 */
	public void moveFrom(final LocalCounter other) {
		moveAssignment(other, new MoveContents() {
			
			@Override
			public void moveContents() {
				_value.reset();
				_value.increment(other._value.reset());
			}
		});
	}
	
	public void incrementValue() {
		incrementValue(1);
	}
	
	/**
	 * Increments the counter; the amount may be negative.
	 */
	public void incrementValue(long amount) {
		_value.increment(amount);
	}
	
	/**
	 * @return the increment accumulated since the last aggregation
	 */
	public long getValue() {
		return _value.get();
	}

	@Override
	public void aggregate(long nowSeconds) {
		StatContainer container;
		long delta;
		lockStat();
		try {
			container = getContainer();
			if (container == null) return;
			delta = _value.reset();
		} finally {
			unlockStat();
		}
		if (delta != 0) {
			container.getSink().incrementCounter(getName(), delta);
		}
	}
	
}
