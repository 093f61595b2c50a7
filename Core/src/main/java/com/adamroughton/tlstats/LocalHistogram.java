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

import java.util.Objects;

import com.adamroughton.tlstats.sink.ExportType;
import com.adamroughton.tlstats.sink.HistogramHandle;
import com.adamroughton.tlstats.sink.StatsSink;
import com.adamroughton.tlstats.util.BucketedHistogram;

/**
 * A local bucketed histogram that is merged into a global histogram on aggregation.
 * Aggregation only merges when samples were added since the last aggregation.
 * 
 * @author Adam Roughton
 *
 */
public final class LocalHistogram extends Stat {

	// guarded by the stat lock
	private HistogramHandle _globalStat;
	private BucketedHistogram _samples;
	private boolean _isDirty = false;
	
	LocalHistogram(StatContainer container, String name, long bucketWidth, long min, long max, ExportType... exportTypes) {
		super(container, name);
		_samples = new BucketedHistogram(bucketWidth, min, max);
		StatsSink sink = container.getSink();
		_globalStat = Objects.requireNonNull(sink.getHistogram(name, bucketWidth, min, max));
		for (ExportType exportType : exportTypes) {
			sink.exportStat(name, exportType);
		}
	}
	
	LocalHistogram(StatContainer container, String name, HistogramHandle globalStat) {
		super(container, name);
		_globalStat = Objects.requireNonNull(globalStat);
		_samples = new BucketedHistogram(globalStat.getBucketWidth(), globalStat.getMin(), globalStat.getMax());
	}
	
	private LocalHistogram(LocalHistogram other) {
		super(other);
		other.lockStat();
		try {
			_globalStat = other._globalStat;
			_samples = other._samples;
			_isDirty = other._isDirty;
			other._samples = emptyCopyOf(_samples);
			other._isDirty = false;
		} finally {
			other.unlockStat();
		}
	}
	
	/**
	 * Moves this histogram into a new instance that takes over its name, pending
	 * samples and registration. This histogram is left unregistered.
	 * @return the new histogram
	 */
	public LocalHistogram move() {
		LocalHistogram moved = new LocalHistogram(this);
		moved.finishMove(this);
		return moved;
	}
	
	/**
	 * Aggregates both histograms, then moves {@code other} into this one, including
	 * its bucket parameters. See {@link Stat#moveAssignment(Stat, MoveContents)}.
	 */
	public void moveFrom(final LocalHistogram other) {
		moveAssignment(other, new MoveContents() {
			
			@Override
			public void moveContents() {
				_globalStat = other._globalStat;
				_samples = other._samples;
				_isDirty = other._isDirty;
				other._samples = emptyCopyOf(_samples);
				other._isDirty = false;
			}
		});
	}
	
	public void addValue(long value) {
		lockStat();
		try {
			_samples.addValue(value);
			_isDirty = true;
		} finally {
			unlockStat();
		}
	}
	
	public void addRepeatedValue(long value, long sampleCount) {
		lockStat();
		try {
			_samples.addRepeatedValue(value, sampleCount);
			_isDirty = true;
		} finally {
			unlockStat();
		}
	}
	
	public long getBucketSize() {
		lockStat();
		try {
			return _samples.getBucketWidth();
		} finally {
			unlockStat();
		}
	}
	
	public long getMin() {
		lockStat();
		try {
			return _samples.getMin();
		} finally {
			unlockStat();
		}
	}
	
	public long getMax() {
		lockStat();
		try {
			return _samples.getMax();
		} finally {
			unlockStat();
		}
	}
	
	// the sink synchronises export changes itself, so the stat lock is not needed
	
	public void exportStat(ExportType... exportTypes) {
		StatsSink sink = checkContainer("exporting a stat").getSink();
		for (ExportType exportType : exportTypes) {
			sink.exportStat(getName(), exportType);
		}
	}
	
	public void unexportStat(ExportType... exportTypes) {
		StatsSink sink = checkContainer("unexporting a stat").getSink();
		for (ExportType exportType : exportTypes) {
			sink.unexportStat(getName(), exportType);
		}
	}
	
	public void exportPercentile(int... percentiles) {
		StatsSink sink = checkContainer("exporting a percentile").getSink();
		for (int percentile : percentiles) {
			sink.exportPercentile(getName(), percentile);
		}
	}
	
	public void unexportPercentile(int... percentiles) {
		StatsSink sink = checkContainer("unexporting a percentile").getSink();
		for (int percentile : percentiles) {
			sink.unexportPercentile(getName(), percentile);
		}
	}

	@Override
	public void aggregate(long nowSeconds) {
		lockStat();
		try {
			if (!_isDirty || getContainer() == null) return;
			_globalStat.merge(nowSeconds, _samples);
			_samples.clear();
			_isDirty = false;
		} finally {
			unlockStat();
		}
	}
	
	private static BucketedHistogram emptyCopyOf(BucketedHistogram histogram) {
		return new BucketedHistogram(histogram.getBucketWidth(), histogram.getMin(), histogram.getMax());
	}
	
}
