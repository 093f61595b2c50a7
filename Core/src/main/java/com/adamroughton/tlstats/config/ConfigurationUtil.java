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

import com.adamroughton.tlstats.AggregationTimer;
import com.adamroughton.tlstats.Clock;
import com.adamroughton.tlstats.Constants;
import com.adamroughton.tlstats.StatContainer;
import com.adamroughton.tlstats.policy.ConcurrencyPolicy;
import com.adamroughton.tlstats.policy.ExclusiveAffinityPolicy;
import com.adamroughton.tlstats.policy.SharedAccessPolicy;
import com.adamroughton.tlstats.sink.StatsSink;
import com.adamroughton.tlstats.util.Util;
import com.esotericsoftware.minlog.Log;

public class ConfigurationUtil {

	public static StatsConfiguration loadDefaultConfiguration() {
		return Util.readYamlResource(StatsConfiguration.class, Constants.DEFAULT_CONFIG_RESOURCE);
	}
	
	public static ConcurrencyPolicy newConcurrencyPolicy(StatsConfiguration config) {
		String policyName = config.getConcurrencyPolicy();
		if (policyName == null) {
			Log.info(String.format("No concurrency policy configured, using '%s'", Constants.POLICY_SHARED_ACCESS));
			policyName = Constants.POLICY_SHARED_ACCESS;
		}
		if (Constants.POLICY_SHARED_ACCESS.equalsIgnoreCase(policyName)) {
			return new SharedAccessPolicy();
		} else if (Constants.POLICY_EXCLUSIVE_AFFINITY.equalsIgnoreCase(policyName)) {
			Boolean checkThreadAffinity = config.getCheckThreadAffinity();
			if (checkThreadAffinity == null) {
				return new ExclusiveAffinityPolicy();
			} else {
				return new ExclusiveAffinityPolicy(checkThreadAffinity);
			}
		} else {
			throw new IllegalArgumentException(String.format("Unknown concurrency policy '%s' (expected '%s' or '%s')", 
					policyName, Constants.POLICY_EXCLUSIVE_AFFINITY, Constants.POLICY_SHARED_ACCESS));
		}
	}
	
	public static long getAggregationIntervalMillis(StatsConfiguration config) {
		Long interval = config.getAggregationIntervalMillis();
		if (interval == null) {
			return Constants.DEFAULT_AGGREGATION_INTERVAL_MILLIS;
		}
		if (interval <= 0)
			throw new IllegalArgumentException(String.format("The aggregation interval must be greater than 0 (was %d)", interval));
		return interval;
	}
	
	public static StatContainer newStatContainer(StatsConfiguration config, StatsSink sink, Clock clock) {
		return new StatContainer(newConcurrencyPolicy(config), sink, clock);
	}
	
	public static AggregationTimer newAggregationTimer(StatsConfiguration config, Clock clock, StatContainer... containers) {
		return new AggregationTimer(clock, getAggregationIntervalMillis(config), containers);
	}
	
}
