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
import com.adamroughton.tlstats.sink.StatsSink;
import com.adamroughton.tlstats.sink.TimeseriesHandle;

/**
 * A local sum and count of samples that aggregates into a global timeseries.
 * 
 * @author Adam Roughton
 *
 */
public final class LocalTimeseries extends Stat {

	// guarded by the stat lock
	private TimeseriesHandle _globalStat;
	private long _sum = 0;
	private long _count = 0;
	
	LocalTimeseries(StatContainer container, String name, ExportType... exportTypes) {
		super(container, name);
		StatsSink sink = container.getSink();
		_globalStat = Objects.requireNonNull(sink.getTimeseries(name));
		for (ExportType exportType : exportTypes) {
			sink.exportStat(name, exportType);
		}
	}
	
	private LocalTimeseries(LocalTimeseries other) {
		super(other);
		other.lockStat();
		try {
			_globalStat = other._globalStat;
			_sum = other._sum;
			_count = other._count;
			other._sum = 0;
			other._count = 0;
		} finally {
			other.unlockStat();
		}
	}
	
	/**
	 * Moves this timeseries into a new instance that takes over its name, pending
	 * samples and registration. This timeseries is left unregistered.
	 * @return the new timeseries
	 */
	public LocalTimeseries move() {
		LocalTimeseries moved = new LocalTimeseries(this);
		moved.finishMove(this);
		return moved;
	}
	
	/**
	 * Aggregates both timeseries, then moves {@code other} into this one.
	 * See {@link Stat#moveAssignment(Stat, MoveContents)}.
	 */
	public void moveFrom(final LocalTimeseries other) {
		moveAssignment(other, new MoveContents() {
			
			@Override
			public void moveContents() {
				_globalStat = other._globalStat;
				_sum = other._sum;
				_count = other._count;
				other._sum = 0;
				other._count = 0;
			}
		});
	}
	
	public void addValue(long value) {
		lockStat();
		try {
			_sum += value;
			_count += 1;
		} finally {
			unlockStat();
		}
	}
	
	/**
	 * Adds a batch of samples that has already been summed.
	 * @param value the sum of the samples
	 * @param sampleCount the number of samples
	 */
	public void addValueAggregated(long value, long sampleCount) {
		lockStat();
		try {
			_sum += value;
			_count += sampleCount;
		} finally {
			unlockStat();
		}
	}
	
	public void exportStat(ExportType... exportTypes) {
		StatsSink sink = checkContainer("exporting a stat").getSink();
		for (ExportType exportType : exportTypes) {
			sink.exportStat(getName(), exportType);
		}
	}
	
	public long getSum() {
		lockStat();
		try {
			return _sum;
		} finally {
			unlockStat();
		}
	}
	
	public long getCount() {
		lockStat();
		try {
			return _count;
		} finally {
			unlockStat();
		}
	}

	@Override
	public void aggregate(long nowSeconds) {
		TimeseriesHandle globalStat;
		long sum;
		long count;
		lockStat();
		try {
			if (getContainer() == null) return;
			globalStat = _globalStat;
			sum = _sum;
			count = _count;
			_sum = 0;
			_count = 0;
		} finally {
			unlockStat();
		}
		if (sum != 0 || count != 0) {
			globalStat.addValueAggregated(nowSeconds, sum, count);
		}
	}
	
}
