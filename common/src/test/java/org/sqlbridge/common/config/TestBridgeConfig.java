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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Properties;

import org.junit.Test;

import com.typesafe.config.ConfigFactory;

public class TestBridgeConfig {

  @Test
  public void defaultsAreLoaded() {
    final BridgeConfig config = BridgeConfig.create();
    assertEquals("SQL Bridge", config.getString("sqlbridge.server.name"));
    assertTrue(config.getString("sqlbridge.tmp.dir").endsWith("sqlbridge"));
  }

  @Test
  public void overridesTakePrecedence() {
    final Properties overrides = new Properties();
    overrides.setProperty("sqlbridge.server.name", "Test Server");
    overrides.setProperty("sqlbridge.test.flag", "false");
    overrides.setProperty("sqlbridge.test.count", "42");

    final BridgeConfig config = BridgeConfig.create(overrides);
    assertEquals("Test Server", config.getString("sqlbridge.server.name"));
    assertFalse(config.getBoolean("sqlbridge.test.flag"));
    assertEquals(42L, config.getLong("sqlbridge.test.count"));
    assertEquals(42, config.getInt("sqlbridge.test.count"));
    assertEquals("42", config.getValueAsString("sqlbridge.test.count"));
  }

  @Test
  public void systemPropertiesOverrideDefaults() {
    System.setProperty("sqlbridge.server.version", "9.9.9");
    ConfigFactory.invalidateCaches();
    try {
      assertEquals("9.9.9", BridgeConfig.create().getString("sqlbridge.server.version"));
    } finally {
      System.clearProperty("sqlbridge.server.version");
      ConfigFactory.invalidateCaches();
    }
  }

  @Test
  public void missingPath() {
    final BridgeConfig config = BridgeConfig.create();
    assertFalse(config.hasPath("sqlbridge.no.such.key"));
    assertTrue(config.hasPath("sqlbridge.server.name"));
  }
}
