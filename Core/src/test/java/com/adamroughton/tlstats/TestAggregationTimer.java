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

import static org.junit.Assert.*;
import static org.mockito.Mockito.*;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

import com.adamroughton.tlstats.policy.SharedAccessPolicy;
import com.adamroughton.tlstats.sink.InMemoryStatsRegistry;
import com.adamroughton.tlstats.sink.StatsSink;

@RunWith(MockitoJUnitRunner.class)
public class TestAggregationTimer {

	@Mock private StatsSink _failingSink;
	
	private InMemoryStatsRegistry _registry;
	private StatContainer _container;
	private ExecutorService _executor;
	
	@Before
	public void setUp() {
		_registry = new InMemoryStatsRegistry();
		_container = new StatContainer(new SharedAccessPolicy(), _registry);
		_executor = Executors.newSingleThreadExecutor();
	}
	
	@After
	public void tearDown() {
		_executor.shutdownNow();
	}
	
	@Test(timeout=10000)
	public void aggregatesPeriodically() throws Exception {
		LocalCounter counter = _container.newCounter("c");
		counter.incrementValue(5);
		
		AggregationTimer timer = new AggregationTimer(new DefaultClock(), 10, _container);
		Future<?> task = _executor.submit(timer);
		
		while (!_registry.hasCounter("c")) {
			Thread.sleep(5);
		}
		assertEquals(5, _registry.getCounter("c"));
		assertTrue(timer.getAggregationCount() > 0);
		
		counter.incrementValue(2);
		long countBefore = timer.getAggregationCount();
		while (timer.getAggregationCount() < countBefore + 2) {
			Thread.sleep(5);
		}
		assertEquals(7, _registry.getCounter("c"));
		
		timer.halt();
		task.get(5, TimeUnit.SECONDS);
		assertFalse(timer.isRunning());
	}
	
	@Test(timeout=10000)
	public void haltFlushesPendingData() throws Exception {
		// the clock never advances, so only the final pass on halt aggregates
		DrivableClock clock = new DrivableClock();
		clock.setTime(100, TimeUnit.SECONDS);
		LocalCounter counter = _container.newCounter("c");
		counter.incrementValue(3);
		
		AggregationTimer timer = new AggregationTimer(clock, 1000, _container);
		Future<?> task = _executor.submit(timer);
		
		Thread.sleep(50);
		assertFalse(_registry.hasCounter("c"));
		
		timer.halt();
		task.get(5, TimeUnit.SECONDS);
		
		assertEquals(3, _registry.getCounter("c"));
		assertEquals(1, timer.getAggregationCount());
	}
	
	@Test(timeout=10000)
	public void failingContainerDoesNotStopTimer() throws Exception {
		doThrow(new RuntimeException("sink unavailable")).when(_failingSink).incrementCounter(anyString(), anyLong());
		StatContainer failingContainer = new StatContainer(new SharedAccessPolicy(), _failingSink);
		failingContainer.newCounter("bad").incrementValue(1);
		
		AggregationTimer timer = new AggregationTimer(new DefaultClock(), 5, failingContainer, _container);
		LocalCounter counter = _container.newCounter("good");
		counter.incrementValue(4);
		Future<?> task = _executor.submit(timer);
		
		while (timer.getAggregationCount() < 3) {
			Thread.sleep(5);
		}
		timer.halt();
		task.get(5, TimeUnit.SECONDS);
		
		assertEquals(4, _registry.getCounter("good"));
		verify(_failingSink, atLeastOnce()).incrementCounter("bad", 1);
	}
	
	@Test(timeout=10000)
	public void containerAddedWhileRunning() throws Exception {
		AggregationTimer timer = new AggregationTimer(new DefaultClock(), 5);
		Future<?> task = _executor.submit(timer);
		
		_container.newCounter("late").incrementValue(8);
		timer.add(_container);
		
		while (!_registry.hasCounter("late")) {
			Thread.sleep(5);
		}
		assertTrue(timer.remove(_container));
		timer.halt();
		task.get(5, TimeUnit.SECONDS);
		assertEquals(8, _registry.getCounter("late"));
	}
	
	@Test(expected=IllegalArgumentException.class)
	public void zeroIntervalRejected() {
		new AggregationTimer(new DefaultClock(), 0, _container);
	}
	
	@Test(expected=IllegalArgumentException.class)
	public void negativeIntervalRejected() {
		new AggregationTimer(new DefaultClock(), -10);
	}
	
}
