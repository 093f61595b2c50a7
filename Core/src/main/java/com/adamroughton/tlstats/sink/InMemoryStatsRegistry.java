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
package com.adamroughton.tlstats.sink;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

import com.adamroughton.tlstats.util.BucketedHistogram;

/**
 * A thread safe, in process {@link StatsSink}. Counters are summed, timeseries 
 * keep their all time sum and count, and histograms keep the merge of every 
 * sample aggregated into them.
 * <p>
 * {@link #getCounters()} renders the current state as a flat map. Plain counters
 * appear under their own name; timeseries and histograms appear once per exported
 * type as {@code name.sum}, {@code name.count}, {@code name.avg}, {@code name.rate}
 * and {@code name.pct}, and histogram percentiles as {@code name.pNN}. The rate is
 * the sum divided by the number of seconds between the first and last aggregation
 * (at least one second).
 * 
 * @author Adam Roughton
 *
 */
public class InMemoryStatsRegistry implements StatsSink {

	private final ConcurrentMap<String, AtomicLong> _counters = new ConcurrentHashMap<>();
	private final ConcurrentMap<String, TimeseriesEntry> _timeseries = new ConcurrentHashMap<>();
	private final ConcurrentMap<String, HistogramEntry> _histograms = new ConcurrentHashMap<>();
	private final ConcurrentMap<String, Set<ExportType>> _exportTypes = new ConcurrentHashMap<>();
	private final ConcurrentMap<String, Set<Integer>> _percentiles = new ConcurrentHashMap<>();
	
	@Override
	public void incrementCounter(String name, long amount) {
		Objects.requireNonNull(name);
		AtomicLong counter = _counters.get(name);
		if (counter == null) {
			AtomicLong newCounter = new AtomicLong(0);
			counter = _counters.putIfAbsent(name, newCounter);
			if (counter == null) {
				counter = newCounter;
			}
		}
		counter.addAndGet(amount);
	}

	@Override
	public TimeseriesHandle getTimeseries(String name) {
		Objects.requireNonNull(name);
		TimeseriesEntry timeseries = _timeseries.get(name);
		if (timeseries == null) {
			TimeseriesEntry newTimeseries = new TimeseriesEntry(name);
			timeseries = _timeseries.putIfAbsent(name, newTimeseries);
			if (timeseries == null) {
				timeseries = newTimeseries;
			}
		}
		return timeseries;
	}

	@Override
	public HistogramHandle getHistogram(String name, long bucketWidth, long min, long max) {
		Objects.requireNonNull(name);
		HistogramEntry histogram = _histograms.get(name);
		if (histogram == null) {
			HistogramEntry newHistogram = new HistogramEntry(name, bucketWidth, min, max);
			histogram = _histograms.putIfAbsent(name, newHistogram);
			if (histogram == null) {
				histogram = newHistogram;
			}
		}
		if (!histogram.hasBuckets(bucketWidth, min, max)) {
			throw new IllegalArgumentException(String.format("The histogram '%s' already exists with bucket width %d over [%d, %d), " +
					"requested width %d over [%d, %d)", 
					name, histogram.getBucketWidth(), histogram.getMin(), histogram.getMax(), bucketWidth, min, max));
		}
		return histogram;
	}

	@Override
	public void exportStat(String name, ExportType exportType) {
		Objects.requireNonNull(exportType);
		getOrCreateSet(_exportTypes, name).add(exportType);
	}

	@Override
	public void unexportStat(String name, ExportType exportType) {
		Set<ExportType> exportTypes = _exportTypes.get(name);
		if (exportTypes != null) {
			exportTypes.remove(exportType);
		}
	}

	@Override
	public void exportPercentile(String name, int percentile) {
		if (percentile < 0 || percentile > 100)
			throw new IllegalArgumentException(String.format("The percentile must be within [0, 100] (was %d)", percentile));
		getOrCreateSet(_percentiles, name).add(percentile);
	}

	@Override
	public void unexportPercentile(String name, int percentile) {
		Set<Integer> percentiles = _percentiles.get(name);
		if (percentiles != null) {
			percentiles.remove(percentile);
		}
	}
	
	public Set<ExportType> getExportTypes(String name) {
		Set<ExportType> exportTypes = _exportTypes.get(name);
		if (exportTypes == null) {
			return Collections.emptySet();
		} 
		return Collections.unmodifiableSet(exportTypes);
	}
	
	public Set<Integer> getExportedPercentiles(String name) {
		Set<Integer> percentiles = _percentiles.get(name);
		if (percentiles == null) {
			return Collections.emptySet();
		} 
		return Collections.unmodifiableSet(percentiles);
	}
	
	/**
	 * Renders every counter and every exported timeseries and histogram value.
	 * @return a sorted snapshot, keyed by counter name
	 */
	public Map<String, Long> getCounters() {
		Map<String, Long> counters = new TreeMap<>();
		for (Map.Entry<String, AtomicLong> counter : _counters.entrySet()) {
			counters.put(counter.getKey(), counter.getValue().get());
		}
		for (TimeseriesEntry timeseries : _timeseries.values()) {
			for (ExportType exportType : getExportTypes(timeseries.getName())) {
				counters.put(exportType.keyFor(timeseries.getName()), timeseries.getValue(exportType));
			}
		}
		for (HistogramEntry histogram : _histograms.values()) {
			String name = histogram.getName();
			for (ExportType exportType : getExportTypes(name)) {
				counters.put(exportType.keyFor(name), histogram.getValue(exportType));
			}
			for (int percentile : getExportedPercentiles(name)) {
				counters.put(String.format("%s.p%d", name, percentile), histogram.getPercentileEstimate(percentile));
			}
		}
		return counters;
	}
	
	/**
	 * Gets a single rendered value; see {@link #getCounters()} for the key format.
	 * @throws IllegalArgumentException if there is no such counter
	 */
	public long getCounter(String key) {
		Long value = getCounters().get(key);
		if (value == null)
			throw new IllegalArgumentException(String.format("No counter named '%s'", key));
		return value;
	}
	
	public boolean hasCounter(String key) {
		return getCounters().containsKey(key);
	}
	
	/**
	 * Gets a copy of the merged samples of the named histogram.
	 * @throws IllegalArgumentException if there is no such histogram
	 */
	public BucketedHistogram getHistogramSnapshot(String name) {
		HistogramEntry histogram = _histograms.get(name);
		if (histogram == null)
			throw new IllegalArgumentException(String.format("No histogram named '%s'", name));
		return histogram.snapshot();
	}
	
	private static <T> Set<T> getOrCreateSet(ConcurrentMap<String, Set<T>> map, String name) {
		Objects.requireNonNull(name);
		Set<T> set = map.get(name);
		if (set == null) {
			Set<T> newSet = ConcurrentHashMap.newKeySet();
			set = map.putIfAbsent(name, newSet);
			if (set == null) {
				set = newSet;
			}
		}
		return set;
	}
	
	private static long exportValue(ExportType exportType, long sum, long count, long firstUpdate, long lastUpdate) {
		switch (exportType) {
			case SUM:
				return sum;
			case COUNT:
				return count;
			case AVG:
				return count == 0? 0 : sum / count;
			case RATE:
				long elapsed = Math.max(1, lastUpdate - firstUpdate);
				return firstUpdate < 0? 0 : sum / elapsed;
			case PERCENT:
				return count == 0? 0 : Math.round((sum * 100.0) / count);
			default:
				throw new IllegalArgumentException(String.format("Unknown export type %s", exportType));
		}
	}
	
	private static final class TimeseriesEntry implements TimeseriesHandle {

		private final String _name;
		private long _sum = 0;
		private long _count = 0;
		private long _firstUpdate = -1;
		private long _lastUpdate = -1;
		
		public TimeseriesEntry(String name) {
			_name = name;
		}
		
		@Override
		public String getName() {
			return _name;
		}

		@Override
		public synchronized void addValueAggregated(long nowSeconds, long sum, long count) {
			_sum += sum;
			_count += count;
			if (_firstUpdate < 0) {
				_firstUpdate = nowSeconds;
			}
			_lastUpdate = Math.max(_lastUpdate, nowSeconds);
		}
		
		public synchronized long getValue(ExportType exportType) {
			return exportValue(exportType, _sum, _count, _firstUpdate, _lastUpdate);
		}
		
	}
	
	private static final class HistogramEntry implements HistogramHandle {

		private final String _name;
		private final BucketedHistogram _histogram;
		private long _firstUpdate = -1;
		private long _lastUpdate = -1;
		
		public HistogramEntry(String name, long bucketWidth, long min, long max) {
			_name = name;
			_histogram = new BucketedHistogram(bucketWidth, min, max);
		}
		
		@Override
		public String getName() {
			return _name;
		}

		@Override
		public long getBucketWidth() {
			return _histogram.getBucketWidth();
		}

		@Override
		public long getMin() {
			return _histogram.getMin();
		}

		@Override
		public long getMax() {
			return _histogram.getMax();
		}
		
		public boolean hasBuckets(long bucketWidth, long min, long max) {
			return _histogram.hasBuckets(bucketWidth, min, max);
		}

		@Override
		public synchronized void merge(long nowSeconds, BucketedHistogram samples) {
			_histogram.merge(samples);
			if (_firstUpdate < 0) {
				_firstUpdate = nowSeconds;
			}
			_lastUpdate = Math.max(_lastUpdate, nowSeconds);
		}
		
		public synchronized long getValue(ExportType exportType) {
			return exportValue(exportType, _histogram.getTotalSum(), _histogram.getTotalCount(), _firstUpdate, _lastUpdate);
		}
		
		public synchronized long getPercentileEstimate(int percentile) {
			return _histogram.getPercentileEstimate(percentile);
		}
		
		public synchronized BucketedHistogram snapshot() {
			return new BucketedHistogram(_histogram);
		}
		
	}
	
}
