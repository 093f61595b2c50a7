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

import static org.junit.Assert.*;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.TimeUnit;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.adamroughton.tlstats.AggregationTimer;
import com.adamroughton.tlstats.Constants;
import com.adamroughton.tlstats.DrivableClock;
import com.adamroughton.tlstats.StatContainer;
import com.adamroughton.tlstats.policy.ConcurrencyPolicy;
import com.adamroughton.tlstats.policy.ExclusiveAffinityPolicy;
import com.adamroughton.tlstats.policy.SharedAccessPolicy;
import com.adamroughton.tlstats.sink.InMemoryStatsRegistry;
import com.adamroughton.tlstats.util.Util;

public class TestConfigurationUtil {

	@Rule
	public TemporaryFolder _tmpFolder = new TemporaryFolder();
	
	@Test
	public void defaultConfiguration() {
		StatsConfiguration config = ConfigurationUtil.loadDefaultConfiguration();
		assertEquals(Constants.POLICY_SHARED_ACCESS, config.getConcurrencyPolicy());
		assertEquals(Long.valueOf(1000), config.getAggregationIntervalMillis());
		assertTrue(ConfigurationUtil.newConcurrencyPolicy(config) instanceof SharedAccessPolicy);
	}
	
	@Test
	public void exclusiveAffinityFromResource() {
		StatsConfiguration config = Util.readYamlResource(StatsConfiguration.class, "exclusive-stats.yaml");
		ConcurrencyPolicy policy = ConfigurationUtil.newConcurrencyPolicy(config);
		assertTrue(policy instanceof ExclusiveAffinityPolicy);
		assertFalse(((ExclusiveAffinityPolicy) policy).isCheckingThreadAffinity());
		assertEquals(250, ConfigurationUtil.getAggregationIntervalMillis(config));
	}
	
	@Test
	public void policyNameIgnoresCase() {
		StatsConfiguration config = new StatsConfiguration();
		config.setConcurrencyPolicy("EXCLUSIVEAFFINITY");
		config.setCheckThreadAffinity(true);
		ConcurrencyPolicy policy = ConfigurationUtil.newConcurrencyPolicy(config);
		assertTrue(((ExclusiveAffinityPolicy) policy).isCheckingThreadAffinity());
	}
	
	@Test
	public void emptyConfigurationUsesDefaults() {
		StatsConfiguration config = new StatsConfiguration();
		assertTrue(ConfigurationUtil.newConcurrencyPolicy(config) instanceof SharedAccessPolicy);
		assertEquals(Constants.DEFAULT_AGGREGATION_INTERVAL_MILLIS, ConfigurationUtil.getAggregationIntervalMillis(config));
	}
	
	@Test(expected=IllegalArgumentException.class)
	public void unknownPolicyRejected() {
		StatsConfiguration config = Util.readYamlResource(StatsConfiguration.class, "unknown-policy-stats.yaml");
		ConfigurationUtil.newConcurrencyPolicy(config);
	}
	
	@Test(expected=IllegalArgumentException.class)
	public void nonPositiveIntervalRejected() {
		StatsConfiguration config = new StatsConfiguration();
		config.setAggregationIntervalMillis(0L);
		ConfigurationUtil.getAggregationIntervalMillis(config);
	}
	
	@Test(expected=IllegalArgumentException.class)
	public void missingResource() {
		Util.readYamlResource(StatsConfiguration.class, "no-such-stats.yaml");
	}
	
	@Test(expected=RuntimeException.class)
	public void missingFile() throws Exception {
		File missing = new File(_tmpFolder.getRoot(), "missing.yaml");
		Util.readYamlFile(StatsConfiguration.class, missing.getAbsolutePath());
	}
	
	@Test
	public void readFromFile() throws Exception {
		File configFile = _tmpFolder.newFile("stats.yaml");
		Files.write(configFile.toPath(), 
				"concurrencyPolicy: sharedAccess\naggregationIntervalMillis: 40\nunusedSetting: 3\n".getBytes(StandardCharsets.UTF_8));
		StatsConfiguration config = Util.readYamlFile(StatsConfiguration.class, configFile.toPath());
		
		StatsConfiguration expected = new StatsConfiguration();
		expected.setConcurrencyPolicy("sharedAccess");
		expected.setAggregationIntervalMillis(40L);
		assertEquals(expected, config);
	}
	
	@Test
	public void buildsContainerAndTimer() {
		StatsConfiguration config = Util.readYamlResource(StatsConfiguration.class, "exclusive-stats.yaml");
		DrivableClock clock = new DrivableClock();
		clock.setTime(10, TimeUnit.SECONDS);
		InMemoryStatsRegistry registry = new InMemoryStatsRegistry();
		
		StatContainer container = ConfigurationUtil.newStatContainer(config, registry, clock);
		assertTrue(container.getPolicy() instanceof ExclusiveAffinityPolicy);
		assertSame(registry, container.getSink());
		assertSame(clock, container.getClock());
		
		AggregationTimer timer = ConfigurationUtil.newAggregationTimer(config, clock, container);
		assertFalse(timer.isRunning());
		assertEquals(0, timer.getAggregationCount());
	}
	
}
