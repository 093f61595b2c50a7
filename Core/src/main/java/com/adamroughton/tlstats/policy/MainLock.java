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

public interface MainLock {

	void lock();
	
	void unlock();
	
	/**
	 * Records that the next caller may legitimately be a different thread.
	 * No synchronisation is performed: the caller is responsible for the
	 * happens-before edge between the old and the new owner.
	 */
	void swapThreads();
	
}
