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
 * The derived values a timeseries or histogram publishes.
 */
public enum ExportType {
	SUM("sum"),
	COUNT("count"),
	AVG("avg"),
	RATE("rate"),
	PERCENT("pct");
	
	private final String _suffix;
	
	private ExportType(String suffix) {
		_suffix = suffix;
	}
	
	public String getSuffix() {
		return _suffix;
	}
	
	public String keyFor(String statName) {
		return statName + "." + _suffix;
	}
}
