/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.sqlbridge.common.config;

import java.util.Properties;

import org.sqlbridge.common.exceptions.BridgeRuntimeException;

import com.google.common.base.Stopwatch;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigRenderOptions;

/**
 * Process wide configuration, fixed at start up.
 *
 * <p>Sources, highest precedence first: {@value ConfigConstants#CONFIG_OVERRIDE_RESOURCE_PATHNAME},
 * programmatic overrides, Java system properties, every
 * {@value ConfigConstants#MODULE_CONFIG_RESOURCE_PATHNAME} found on the classpath and finally
 * {@value ConfigConstants#CONFIG_DEFAULT_RESOURCE_PATHNAME}.</p>
 */
public final class BridgeConfig {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(BridgeConfig.class);

  private final Config config;

  private BridgeConfig(Config config) {
    this.config = config;
  }

  /**
   * Creates a configuration using the default sources only.
   */
  public static BridgeConfig create() {
    return create(new Properties());
  }

  /**
   * Creates a configuration where the given properties override the classpath sources.
   *
   * @param overrides properties that take precedence over everything but the override resource
   */
  public static BridgeConfig create(Properties overrides) {
    final Stopwatch watch = Stopwatch.createStarted();
    final ClassLoader classLoader = BridgeConfig.class.getClassLoader();

    final Config defaults = ConfigFactory.parseResources(classLoader,
        ConfigConstants.CONFIG_DEFAULT_RESOURCE_PATHNAME);
    final Config modules = ConfigFactory.parseResources(classLoader,
        ConfigConstants.MODULE_CONFIG_RESOURCE_PATHNAME);
    final Config override = ConfigFactory.parseResources(classLoader,
        ConfigConstants.CONFIG_OVERRIDE_RESOURCE_PATHNAME);

    final Config effective;
    try {
      effective = override
          .withFallback(ConfigFactory.parseProperties(overrides))
          .withFallback(ConfigFactory.systemProperties())
          .withFallback(modules)
          .withFallback(defaults)
          .resolve();
    } catch (ConfigException e) {
      throw new BridgeRuntimeException("Failure while loading configuration: " + e.getMessage(), e);
    }

    logger.debug("Configuration loaded in {} ms.", watch.elapsed().toMillis());
    return new BridgeConfig(effective);
  }

  public boolean hasPath(String path) {
    return config.hasPath(path);
  }

  public String getString(String path) {
    return config.getString(path);
  }

  public boolean getBoolean(String path) {
    return config.getBoolean(path);
  }

  public long getLong(String path) {
    return config.getLong(path);
  }

  public int getInt(String path) {
    return config.getInt(path);
  }

  /**
   * @return the raw value at the given path rendered as a string, without quotes
   */
  public String getValueAsString(String path) {
    return String.valueOf(config.getValue(path).unwrapped());
  }

  public Config getConfig() {
    return config;
  }

  @Override
  public String toString() {
    return config.root().render(ConfigRenderOptions.concise());
  }
}
