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

import java.io.Closeable;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

import it.unimi.dsi.fastutil.objects.ReferenceOpenHashSet;
import it.unimi.dsi.fastutil.objects.ReferenceSet;

import com.adamroughton.tlstats.policy.ConcurrencyPolicy;
import com.adamroughton.tlstats.policy.MainLock;
import com.adamroughton.tlstats.sink.ExportType;
import com.adamroughton.tlstats.sink.HistogramHandle;
import com.adamroughton.tlstats.sink.StatsSink;
import com.esotericsoftware.minlog.Log;

/**
 * Holds a group of local stats and aggregates them into a {@link StatsSink}.
 * <p>
 * Updating a local stat never touches the sink: the changes are accumulated in
 * the stat and only published when {@link #aggregate()} is called. Callers are
 * expected to call {@link #aggregate()} periodically (ideally once a second),
 * either directly or through an {@link AggregationTimer}.
 * <p>
 * The container tracks its stats by identity only; it does not own them. If the
 * container is closed before its stats, the stats become orphaned: they still
 * accept updates, but can no longer be aggregated.
 * <p>
 * Whether the container and its stats may be used from several threads is decided
 * by the {@link ConcurrencyPolicy} supplied at construction.
 * 
 * @author Adam Roughton
 *
 */
public class StatContainer implements Closeable {

	private final ConcurrencyPolicy _policy;
	private final StatsSink _sink;
	private final Clock _clock;
	
	private final MainLock _mainLock;
	
	// guarded by _mainLock
	private final ReferenceSet<Stat> _stats = new ReferenceOpenHashSet<>();
	private boolean _isClosed = false;
	
	public StatContainer(ConcurrencyPolicy policy, StatsSink sink) {
		this(policy, sink, new DefaultClock());
	}
	
	public StatContainer(ConcurrencyPolicy policy, StatsSink sink, Clock clock) {
		_policy = Objects.requireNonNull(policy);
		_sink = Objects.requireNonNull(sink);
		_clock = Objects.requireNonNull(clock);
		_mainLock = _policy.newMainLock();
	}
	
	public final LocalCounter newCounter(String name) {
		LocalCounter counter = new LocalCounter(this, name);
		counter.postInit(this);
		return counter;
	}
	
	public final LocalTimeseries newTimeseries(String name, ExportType... exportTypes) {
		LocalTimeseries timeseries = new LocalTimeseries(this, name, exportTypes);
		timeseries.postInit(this);
		return timeseries;
	}
	
	public final LocalHistogram newHistogram(String name, long bucketWidth, long min, long max, ExportType... exportTypes) {
		LocalHistogram histogram = new LocalHistogram(this, name, bucketWidth, min, max, exportTypes);
		histogram.postInit(this);
		return histogram;
	}
	
	/**
	 * Creates a local histogram that aggregates into an existing global histogram.
	 * The caller is responsible for the handle being registered under the given name.
	 */
	public final LocalHistogram newHistogram(String name, HistogramHandle globalHistogram) {
		LocalHistogram histogram = new LocalHistogram(this, name, globalHistogram);
		histogram.postInit(this);
		return histogram;
	}
	
	/**
	 * Aggregates every registered stat into the sink.
	 * <p>
	 * The container lock is only held while taking a snapshot of the registered 
	 * stats; each stat is then drained under its own guard. Every stat registered
	 * when the call starts is aggregated exactly once, unless it is unregistered
	 * concurrently, in which case it may be skipped.
	 */
	public void aggregate() {
		long nowSeconds = currentTimeSeconds();
		Stat[] stats;
		_mainLock.lock();
		try {
			stats = _stats.toArray(new Stat[_stats.size()]);
		} finally {
			_mainLock.unlock();
		}
		for (Stat stat : stats) {
			stat.aggregate(nowSeconds);
		}
	}
	
	/**
	 * Call before handing this container (and its stats) over to another thread.
	 * This only matters for policies that check thread affinity, and performs no
	 * synchronisation: the caller must still publish the container safely.
	 */
	public void swapThreads() {
		_mainLock.swapThreads();
	}
	
	public boolean isRegistered(Stat stat) {
		_mainLock.lock();
		try {
			return _stats.contains(stat);
		} finally {
			_mainLock.unlock();
		}
	}
	
	public int getRegisteredCount() {
		_mainLock.lock();
		try {
			return _stats.size();
		} finally {
			_mainLock.unlock();
		}
	}
	
	public boolean isClosed() {
		_mainLock.lock();
		try {
			return _isClosed;
		} finally {
			_mainLock.unlock();
		}
	}
	
	/**
	 * Closes the container, orphaning every stat still registered with it. Pending
	 * data held by those stats is not aggregated. Subsequent attempts to register
	 * stats fail with an {@link IllegalStateException}.
	 */
	@Override
	public void close() {
		int orphanedCount;
		_mainLock.lock();
		try {
			if (_isClosed) return;
			_isClosed = true;
			for (Stat stat : _stats) {
				stat.setContainer(null);
			}
			orphanedCount = _stats.size();
			_stats.clear();
		} finally {
			_mainLock.unlock();
		}
		if (orphanedCount > 0 && Log.DEBUG) {
			Log.debug(String.format("Closed stats container with %d registered stats; the stats are now orphaned", orphanedCount));
		}
	}
	
	public final StatsSink getSink() {
		return _sink;
	}
	
	public final ConcurrencyPolicy getPolicy() {
		return _policy;
	}
	
	public final Clock getClock() {
		return _clock;
	}
	
	public long currentTimeSeconds() {
		return TimeUnit.MILLISECONDS.toSeconds(_clock.currentMillis());
	}
	
	/*
	 * Registration hooks, only called from the Stat lifecycle methods.
	 */
	
	void register(Stat stat) {
		_mainLock.lock();
		try {
			if (_isClosed)
				throw new IllegalStateException(String.format("Cannot register the stat '%s': the stats container has been closed.", stat.getName()));
			if (!_stats.add(stat))
				throw new IllegalStateException(String.format("The stat '%s' is already registered.", stat.getName()));
			stat.setContainer(this);
		} finally {
			_mainLock.unlock();
		}
	}
	
	boolean unregister(Stat stat) {
		_mainLock.lock();
		try {
			if (!_stats.remove(stat)) {
				return false;
			}
			stat.setContainer(null);
			return true;
		} finally {
			_mainLock.unlock();
		}
	}
	
	/**
	 * Moves the registration of {@code current} to {@code replacement} in one step.
	 * @return {@code false} if {@code current} was no longer registered
	 */
	boolean replace(Stat current, Stat replacement) {
		_mainLock.lock();
		try {
			if (!_stats.remove(current)) {
				return false;
			}
			current.setContainer(null);
			_stats.add(replacement);
			replacement.setContainer(this);
			return true;
		} finally {
			_mainLock.unlock();
		}
	}
	
}
