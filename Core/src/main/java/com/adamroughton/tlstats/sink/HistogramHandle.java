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

import com.adamroughton.tlstats.util.BucketedHistogram;

public interface HistogramHandle {

	String getName();
	
	long getBucketWidth();
	
	long getMin();
	
	long getMax();
	
	/**
	 * Merges the samples of the given histogram into the global histogram. The
	 * samples are copied: the caller may clear the histogram once this returns.
	 * @param nowSeconds the aggregation time in seconds
	 * @param samples a histogram with the same bucket parameters as this handle
	 */
	void merge(long nowSeconds, BucketedHistogram samples);
	
}
