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

public interface TimeseriesHandle {

	String getName();
	
	/**
	 * Applies a batch of samples, collected since the last call, at the given time.
	 * @param nowSeconds the aggregation time in seconds
	 * @param sum the sum of the samples
	 * @param count the number of samples
	 */
	void addValueAggregated(long nowSeconds, long sum, long count);
	
}
