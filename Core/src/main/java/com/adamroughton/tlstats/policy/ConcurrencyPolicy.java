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
package com.adamroughton.tlstats.policy;

/**
 * Fixes the way a stat container and its stats synchronise with each other.
 * The registration and aggregation logic is written once against this interface,
 * and runs unchanged whether the stats are confined to a single thread
 * ({@link ExclusiveAffinityPolicy}) or shared between threads 
 * ({@link SharedAccessPolicy}).
 * 
 * @author Adam Roughton
 *
 */
public interface ConcurrencyPolicy {

	/**
	 * Creates the lock guarding the set of stats registered with a container.
	 * @return a new main lock
	 */
	MainLock newMainLock();
	
	/**
	 * Creates the per-stat guard paired with the stat's reference back to 
	 * its container.
	 * @return a new, empty (unregistered) container reference
	 */
	<TContainer> ContainerAndLock<TContainer> newContainerAndLock();
	
	/**
	 * Creates a numeric cell that can be updated without holding the 
	 * per-stat guard.
	 * @return a new cell holding zero
	 */
	CounterCell newCounterCell();
	
}
