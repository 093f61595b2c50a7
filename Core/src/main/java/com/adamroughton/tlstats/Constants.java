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

public final class Constants {

	/**
	 * The default time between aggregations of the local stats
	 * into the global registry.
	 */
	public static final long DEFAULT_AGGREGATION_INTERVAL_MILLIS = 1000L;
	
	public static final String POLICY_EXCLUSIVE_AFFINITY = "exclusiveAffinity";
	
	public static final String POLICY_SHARED_ACCESS = "sharedAccess";
	
	public static final String DEFAULT_CONFIG_RESOURCE = "tlstats-default.yaml";
	
}
