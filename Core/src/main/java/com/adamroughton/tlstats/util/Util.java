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
package com.adamroughton.tlstats.util;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

public class Util {
	
	public static <T> T readYamlFile(Class<T> type, String path) {
		return readYamlFile(type, Paths.get(path));
	}
	
	public static <T> T readYamlFile(Class<T> type, Path path) {
		try (InputStream yamlStream = Files.newInputStream(path, StandardOpenOption.READ)) {
			return readYaml(type, yamlStream);
		} catch (Exception e) {
			throw new RuntimeException(String.format("Error reading yaml file '%s'", path), e);
		}
	}
	
	/**
	 * Reads a yaml document from the class path.
	 * @param resourceName the resource name, relative to the class path root
	 */
	public static <T> T readYamlResource(Class<T> type, String resourceName) {
		ClassLoader classLoader = Util.class.getClassLoader();
		try (InputStream yamlStream = classLoader.getResourceAsStream(resourceName)) {
			if (yamlStream == null)
				throw new IllegalArgumentException(String.format("No such resource '%s'", resourceName));
			return readYaml(type, yamlStream);
		} catch (IllegalArgumentException e) {
			throw e;
		} catch (Exception e) {
			throw new RuntimeException(String.format("Error reading yaml resource '%s'", resourceName), e);
		}
	}
	
	private static <T> T readYaml(Class<T> type, InputStream yamlStream) {
		Constructor constructor = new Constructor(new LoaderOptions());
		constructor.getPropertyUtils().setSkipMissingProperties(true);
		Yaml yaml = new Yaml(constructor);
		return yaml.loadAs(yamlStream, type);
	}
	
}
