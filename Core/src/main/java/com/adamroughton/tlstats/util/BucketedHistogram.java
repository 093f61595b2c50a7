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
package com.adamroughton.tlstats.util;

import java.util.Arrays;

/**
 * A histogram with fixed width buckets covering {@code [min, max)}, plus
 * one bucket for values below {@code min} and one for values at or above
 * {@code max}. Each bucket tracks the number of samples and their sum.
 * <p>
 * Instances are not thread safe.
 * 
 * @author Adam Roughton
 *
 */
public final class BucketedHistogram {

	private final long _bucketWidth;
	private final long _min;
	private final long _max;
	private final long[] _counts;
	private final long[] _sums;
	
	public BucketedHistogram(long bucketWidth, long min, long max) {
		if (bucketWidth <= 0)
			throw new IllegalArgumentException(String.format("The bucket width must be greater than 0 (was %d)", bucketWidth));
		if (max <= min)
			throw new IllegalArgumentException(String.format("The max must be greater than the min (min = %d, max = %d)", min, max));
		long range;
		try {
			range = Math.subtractExact(max, min);
		} catch (ArithmeticException eOverflow) {
			throw new IllegalArgumentException(String.format("The range [%d, %d) is too wide", min, max), eOverflow);
		}
		long bucketCount = range / bucketWidth + (range % bucketWidth != 0? 1 : 0) + 2;
		if (bucketCount > Integer.MAX_VALUE)
			throw new IllegalArgumentException(String.format("Too many buckets (%d) for width %d over [%d, %d)", 
					bucketCount, bucketWidth, min, max));
		_bucketWidth = bucketWidth;
		_min = min;
		_max = max;
		_counts = new long[(int) bucketCount];
		_sums = new long[(int) bucketCount];
	}
	
	public BucketedHistogram(BucketedHistogram other) {
		_bucketWidth = other._bucketWidth;
		_min = other._min;
		_max = other._max;
		_counts = Arrays.copyOf(other._counts, other._counts.length);
		_sums = Arrays.copyOf(other._sums, other._sums.length);
	}
	
	public void addValue(long value) {
		addRepeatedValue(value, 1);
	}
	
	/**
	 * @throws ArithmeticException if {@code value * sampleCount} overflows
	 */
	public void addRepeatedValue(long value, long sampleCount) {
		if (sampleCount < 0)
			throw new IllegalArgumentException(String.format("The sample count cannot be negative (was %d)", sampleCount));
		long sum = Math.multiplyExact(value, sampleCount);
		int index = getBucketIndex(value);
		_counts[index] += sampleCount;
		_sums[index] += sum;
	}
	
	/**
	 * Adds all samples of the given histogram to this one.
	 * @param other a histogram with identical bucket parameters
	 */
	public void merge(BucketedHistogram other) {
		if (!hasSameBuckets(other))
			throw new IllegalArgumentException(String.format("Cannot merge histogram %s into %s", other, this));
		for (int i = 0; i < _counts.length; i++) {
			_counts[i] += other._counts[i];
			_sums[i] += other._sums[i];
		}
	}
	
	public void clear() {
		Arrays.fill(_counts, 0);
		Arrays.fill(_sums, 0);
	}
	
	public boolean hasSameBuckets(BucketedHistogram other) {
		return hasBuckets(other._bucketWidth, other._min, other._max);
	}
	
	public boolean hasBuckets(long bucketWidth, long min, long max) {
		return _bucketWidth == bucketWidth && _min == min && _max == max;
	}
	
	public int getBucketIndex(long value) {
		if (value < _min) {
			return 0;
		} else if (value >= _max) {
			return _counts.length - 1;
		} else {
			return (int) ((value - _min) / _bucketWidth) + 1;
		}
	}
	
	/**
	 * Gets the inclusive lower bound of the bucket. The underflow bucket 
	 * reports {@link Long#MIN_VALUE}.
	 */
	public long getBucketMin(int index) {
		if (index == 0) {
			return Long.MIN_VALUE;
		} else {
			return _min + (index - 1) * _bucketWidth;
		}
	}
	
	public int getNumBuckets() {
		return _counts.length;
	}
	
	public long getBucketCount(int index) {
		return _counts[index];
	}
	
	public long getBucketSum(int index) {
		return _sums[index];
	}
	
	public long getTotalCount() {
		long total = 0;
		for (long count : _counts) {
			total += count;
		}
		return total;
	}
	
	public long getTotalSum() {
		long total = 0;
		for (long sum : _sums) {
			total += sum;
		}
		return total;
	}
	
	public boolean isEmpty() {
		return getTotalCount() == 0;
	}
	
	/**
	 * Estimates the value at the given percentile by interpolating linearly
	 * within the bucket that contains it. For the underflow and overflow
	 * buckets the bucket average is returned instead.
	 * 
	 * @param percentile the percentile in the range [0, 100]
	 * @return the estimate, or 0 if the histogram is empty
	 */
	public long getPercentileEstimate(double percentile) {
		if (percentile < 0 || percentile > 100)
			throw new IllegalArgumentException(String.format("The percentile must be within [0, 100] (was %f)", percentile));
		long totalCount = getTotalCount();
		if (totalCount == 0) return 0;
		
		double targetCount = (percentile / 100) * totalCount;
		long cumulativeCount = 0;
		int index = 0;
		for (; index < _counts.length - 1; index++) {
			if (_counts[index] > 0 && cumulativeCount + _counts[index] >= targetCount) break;
			cumulativeCount += _counts[index];
		}
		long bucketCount = _counts[index];
		if (index == 0 || index == _counts.length - 1) {
			return bucketCount == 0? 0 : _sums[index] / bucketCount;
		}
		long low = getBucketMin(index);
		long high = Math.min(low + _bucketWidth, _max);
		double fraction = (targetCount - cumulativeCount) / bucketCount;
		return Math.round(low + (high - low) * fraction);
	}
	
	public long getBucketWidth() {
		return _bucketWidth;
	}
	
	public long getMin() {
		return _min;
	}
	
	public long getMax() {
		return _max;
	}

	@Override
	public String toString() {
		return String.format("BucketedHistogram [bucketWidth=%d, min=%d, max=%d]", _bucketWidth, _min, _max);
	}
	
}
