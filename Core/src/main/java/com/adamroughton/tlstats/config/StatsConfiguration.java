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
package com.adamroughton.tlstats.config;

public class StatsConfiguration {

	private String _concurrencyPolicy;
	private Boolean _checkThreadAffinity;
	private Long _aggregationIntervalMillis;
	
	public String getConcurrencyPolicy() {
		return _concurrencyPolicy;
	}
	
	public void setConcurrencyPolicy(String concurrencyPolicy) {
		_concurrencyPolicy = concurrencyPolicy;
	}
	
	public Boolean getCheckThreadAffinity() {
		return _checkThreadAffinity;
	}
	
	public void setCheckThreadAffinity(Boolean checkThreadAffinity) {
		_checkThreadAffinity = checkThreadAffinity;
	}
	
	public Long getAggregationIntervalMillis() {
		return _aggregationIntervalMillis;
	}
	
	public void setAggregationIntervalMillis(Long aggregationIntervalMillis) {
		_aggregationIntervalMillis = aggregationIntervalMillis;
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result
				+ ((_aggregationIntervalMillis == null) ? 0 : _aggregationIntervalMillis.hashCode());
		result = prime * result
				+ ((_checkThreadAffinity == null) ? 0 : _checkThreadAffinity.hashCode());
		result = prime * result
				+ ((_concurrencyPolicy == null) ? 0 : _concurrencyPolicy.hashCode());
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		StatsConfiguration other = (StatsConfiguration) obj;
		if (_aggregationIntervalMillis == null) {
			if (other._aggregationIntervalMillis != null)
				return false;
		} else if (!_aggregationIntervalMillis.equals(other._aggregationIntervalMillis))
			return false;
		if (_checkThreadAffinity == null) {
			if (other._checkThreadAffinity != null)
				return false;
		} else if (!_checkThreadAffinity.equals(other._checkThreadAffinity))
			return false;
		if (_concurrencyPolicy == null) {
			if (other._concurrencyPolicy != null)
				return false;
		} else if (!_concurrencyPolicy.equals(other._concurrencyPolicy))
			return false;
		return true;
	}

	@Override
	public String toString() {
		return String.format("StatsConfiguration [concurrencyPolicy=%s, checkThreadAffinity=%s, aggregationIntervalMillis=%s]", 
				_concurrencyPolicy, _checkThreadAffinity, _aggregationIntervalMillis);
	}
	
}
