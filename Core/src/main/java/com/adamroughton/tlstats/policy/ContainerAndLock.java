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
 * Pairs a stat's (nullable) reference to its owning container with the 
 * guard protecting the stat's local state.
 *
 * @param <TContainer> the container type
 */
public interface ContainerAndLock<TContainer> {

	/**
	 * @return the container, or {@code null} if the stat is not registered
	 */
	TContainer get();
	
	/**
	 * Changes the container reference. Callers must hold both this guard
	 * and the main lock of the container being attached or detached.
	 * @param container the new container, or {@code null} to detach
	 */
	void set(TContainer container);
	
	void lock();
	
	void unlock();
	
}
