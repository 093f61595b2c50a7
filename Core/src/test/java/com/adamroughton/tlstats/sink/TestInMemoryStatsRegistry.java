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

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;

import com.adamroughton.tlstats.util.BucketedHistogram;

public class TestInMemoryStatsRegistry {

	private InMemoryStatsRegistry _registry;
	
	@Before
	public void setUp() {
		_registry = new InMemoryStatsRegistry();
	}
	
	@Test
	public void counterIncrements() {
		_registry.incrementCounter("c", 5);
		_registry.incrementCounter("c", -2);
		assertEquals(3, _registry.getCounter("c"));
		assertTrue(_registry.hasCounter("c"));
	}
	
	@Test
	public void timeseriesExportValues() {
		TimeseriesHandle timeseries = _registry.getTimeseries("t");
		for (ExportType exportType : ExportType.values()) {
			_registry.exportStat("t", exportType);
		}
		timeseries.addValueAggregated(100, 10, 1);
		timeseries.addValueAggregated(104, 30, 3);
		
		assertEquals(40, _registry.getCounter("t.sum"));
		assertEquals(4, _registry.getCounter("t.count"));
		assertEquals(10, _registry.getCounter("t.avg"));
		assertEquals(10, _registry.getCounter("t.rate"));
		assertEquals(1000, _registry.getCounter("t.pct"));
	}
	
	@Test
	public void rateWithSingleUpdateUsesOneSecond() {
		TimeseriesHandle timeseries = _registry.getTimeseries("t");
		_registry.exportStat("t", ExportType.RATE);
		timeseries.addValueAggregated(100, 25, 5);
		assertEquals(25, _registry.getCounter("t.rate"));
	}
	
	@Test
	public void unexportedTypesNotRendered() {
		TimeseriesHandle timeseries = _registry.getTimeseries("t");
		_registry.exportStat("t", ExportType.SUM);
		_registry.exportStat("t", ExportType.COUNT);
		timeseries.addValueAggregated(100, 10, 1);
		_registry.unexportStat("t", ExportType.COUNT);
		
		Map<String, Long> counters = _registry.getCounters();
		assertEquals(Long.valueOf(10), counters.get("t.sum"));
		assertFalse(counters.containsKey("t.count"));
		assertEquals(new HashSet<>(Arrays.asList(ExportType.SUM)), _registry.getExportTypes("t"));
	}
	
	@Test
	public void sameTimeseriesHandleReturned() {
		assertSame(_registry.getTimeseries("t"), _registry.getTimeseries("t"));
	}
	
	@Test
	public void histogramPercentiles() {
		HistogramHandle histogram = _registry.getHistogram("h", 10, 0, 100);
		assertSame(histogram, _registry.getHistogram("h", 10, 0, 100));
		_registry.exportPercentile("h", 50);
		_registry.exportPercentile("h", 90);
		_registry.exportStat("h", ExportType.COUNT);
		
		BucketedHistogram samples = new BucketedHistogram(10, 0, 100);
		for (int i = 0; i < 100; i++) {
			samples.addValue(i);
		}
		histogram.merge(10, samples);
		
		assertEquals(50, _registry.getCounter("h.p50"));
		assertEquals(90, _registry.getCounter("h.p90"));
		assertEquals(100, _registry.getCounter("h.count"));
		assertEquals(100, _registry.getHistogramSnapshot("h").getTotalCount());
		
		_registry.unexportPercentile("h", 90);
		assertFalse(_registry.hasCounter("h.p90"));
		assertEquals(new HashSet<>(Arrays.asList(50)), _registry.getExportedPercentiles("h"));
	}
	
	@Test(expected=IllegalArgumentException.class)
	public void conflictingHistogramBucketsRejected() {
		_registry.getHistogram("h", 10, 0, 100);
		_registry.getHistogram("h", 5, 0, 100);
	}
	
	@Test(expected=IllegalArgumentException.class)
	public void percentileOutOfRangeRejected() {
		_registry.exportPercentile("h", 101);
	}
	
	@Test(expected=IllegalArgumentException.class)
	public void unknownCounter() {
		_registry.getCounter("missing");
	}
	
	@Test(expected=IllegalArgumentException.class)
	public void unknownHistogramSnapshot() {
		_registry.getHistogramSnapshot("missing");
	}
	
	@Test
	public void noExportsForUnknownStat() {
		assertTrue(_registry.getExportTypes("missing").isEmpty());
		assertTrue(_registry.getExportedPercentiles("missing").isEmpty());
		assertTrue(_registry.getCounters().isEmpty());
	}
	
	@Test
	public void exportKeys() {
		assertEquals("latency.avg", ExportType.AVG.keyFor("latency"));
		assertEquals("pct", ExportType.PERCENT.getSuffix());
	}
	
}
