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

/**
 * The shared, name keyed registry of global statistics that local stats
 * are aggregated into. Implementations must be safe for use from any thread.
 * 
 * @author Adam Roughton
 *
 */
public interface StatsSink {

	void incrementCounter(String name, long amount);
	
	/**
	 * Gets the global timeseries with the given name, creating it if required.
	 */
	TimeseriesHandle getTimeseries(String name);
	
	/**
	 * Gets the global histogram with the given name, creating it with the given
	 * bucket parameters if required.
	 * @throws IllegalArgumentException if a histogram with the name already exists
	 * with different bucket parameters
	 */
	HistogramHandle getHistogram(String name, long bucketWidth, long min, long max);
	
	void exportStat(String name, ExportType exportType);
	
	void unexportStat(String name, ExportType exportType);
	
	void exportPercentile(String name, int percentile);
	
	void unexportPercentile(String name, int percentile);
	
}
