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

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import com.esotericsoftware.minlog.Log;

/**
 * Periodically aggregates a set of stat containers until halted. The containers
 * are aggregated once more when the timer is halted so that no pending data is
 * left behind.
 * <p>
 * The timer runs on whichever thread executes {@link #run()}, so the containers
 * must either use a policy that permits aggregation from other threads, or have 
 * been handed over with {@link StatContainer#swapThreads()}.
 * 
 * @author Adam Roughton
 *
 */
public final class AggregationTimer implements Runnable {

	private final AtomicBoolean _haltSignal = new AtomicBoolean(false);
	private final AtomicBoolean _isRunning = new AtomicBoolean(false);
	private final AtomicLong _aggregationCount = new AtomicLong(0);
	
	private final List<StatContainer> _containers = new CopyOnWriteArrayList<>();
	private final Clock _clock;
	private final long _intervalMillis;
	
	public AggregationTimer(Clock clock, long intervalMillis, StatContainer... containers) {
		_clock = Objects.requireNonNull(clock);
		if (intervalMillis <= 0)
			throw new IllegalArgumentException(String.format("The aggregation interval must be greater than 0 (was %d)", intervalMillis));
		_intervalMillis = intervalMillis;
		_containers.addAll(Arrays.asList(containers));
	}
	
	public void add(StatContainer container) {
		_containers.add(Objects.requireNonNull(container));
	}
	
	public boolean remove(StatContainer container) {
		return _containers.remove(container);
	}
	
	@Override
	public void run() {
		if (!_isRunning.compareAndSet(false, true))
			throw new IllegalStateException("The aggregation timer can only be started once.");
		Log.info(String.format("Aggregating %d stats containers every %d ms", _containers.size(), _intervalMillis));
		try {
			long nextAggregationTime = _clock.currentMillis() + _intervalMillis;
			while (!_haltSignal.get()) {
				long timeRemaining;
				while ((timeRemaining = nextAggregationTime - _clock.currentMillis()) > 0 && !_haltSignal.get()) {
					Thread.sleep(Math.min(timeRemaining, _intervalMillis));
				}
				if (_haltSignal.get()) break;
				aggregateAll();
				long now = _clock.currentMillis();
				nextAggregationTime += _intervalMillis;
				if (nextAggregationTime <= now) {
					// fallen behind: skip the missed ticks
					nextAggregationTime = now + _intervalMillis;
				}
			}
		} catch (InterruptedException e) {
			Log.warn("The aggregation timer was interrupted");
			Thread.currentThread().interrupt();
		} finally {
			// final pass so that nothing recorded before the halt is left behind
			aggregateAll();
			_haltSignal.set(false);
			_isRunning.set(false);
			Log.info("Aggregation timer halted");
		}
	}
	
	public void halt() {
		_haltSignal.set(true);
	}
	
	public boolean isRunning() {
		return _isRunning.get();
	}
	
	/**
	 * @return the number of completed passes over the containers
	 */
	public long getAggregationCount() {
		return _aggregationCount.get();
	}
	
	private void aggregateAll() {
		for (StatContainer container : _containers) {
			try {
				container.aggregate();
			} catch (RuntimeException e) {
				Log.error(String.format("Failed to aggregate the stats container %s", container), e);
			}
		}
		_aggregationCount.incrementAndGet();
	}
	
}
