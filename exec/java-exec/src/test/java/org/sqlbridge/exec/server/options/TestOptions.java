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
package org.sqlbridge.exec.server.options;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import org.junit.Before;
import org.junit.Test;
import org.junit.experimental.categories.Category;
import org.sqlbridge.categories.OptionsTest;
import org.sqlbridge.common.config.BridgeConfig;
import org.sqlbridge.common.exceptions.ErrorType;
import org.sqlbridge.common.exceptions.UserException;
import org.sqlbridge.exec.ExecConstants;
import org.sqlbridge.exec.server.options.OptionValue.Kind;
import org.sqlbridge.exec.server.options.OptionValue.OptionType;

import com.google.common.collect.ImmutableMap;

@Category(OptionsTest.class)
public class TestOptions {

  private SystemOptionManager systemOptions;

  @Before
  public void setup() {
    final Properties overrides = new Properties();
    overrides.setProperty(ExecConstants.SESSION_IDLE_TIMEOUT_KEY, "1234");
    systemOptions = new SystemOptionManager(BridgeConfig.create(overrides));
  }

  @Test
  public void systemDefaultsComeFromConfig() {
    assertFalse(systemOptions.getOption(ExecConstants.SINGLE_SESSION));
    assertTrue(systemOptions.getOption(ExecConstants.ASYNC_EXECUTION));
    assertEquals(1234L, systemOptions.getOption(ExecConstants.SESSION_IDLE_TIMEOUT));
    assertEquals("default", systemOptions.getOption(ExecConstants.DEFAULT_DATABASE));
    assertEquals(OptionType.SYSTEM, systemOptions.getOption(ExecConstants.ASYNC_EXECUTION_KEY).type);
  }

  @Test
  public void sessionOverridesSystem() {
    final SessionOptionManager session = new SessionOptionManager(systemOptions);
    session.setOption(ExecConstants.ASYNC_EXECUTION_KEY, "false");

    assertFalse(session.getOption(ExecConstants.ASYNC_EXECUTION));
    assertTrue(systemOptions.getOption(ExecConstants.ASYNC_EXECUTION));
    assertEquals(OptionType.SESSION, session.getOption(ExecConstants.ASYNC_EXECUTION_KEY).type);

    session.deleteOption(ExecConstants.ASYNC_EXECUTION_KEY);
    assertTrue(session.getOption(ExecConstants.ASYNC_EXECUTION));
  }

  @Test
  public void sessionsAreIsolated() {
    final SessionOptionManager first = new SessionOptionManager(systemOptions);
    final SessionOptionManager second = new SessionOptionManager(systemOptions);
    first.setOption("my.key", "one");

    assertEquals("one", first.getOption("my.key").string_val);
    assertNull(second.getOption("my.key"));
  }

  @Test
  public void staticKeyIsRejected() {
    final SessionOptionManager session = new SessionOptionManager(systemOptions);
    try {
      session.setOption(ExecConstants.SINGLE_SESSION_KEY, "true");
      fail();
    } catch (UserException e) {
      assertEquals(ErrorType.IMMUTABLE_CONFIG, e.getErrorType());
      assertEquals("Cannot modify the value of a static config: " + ExecConstants.SINGLE_SESSION_KEY,
          e.getOriginalMessage());
    }
    assertFalse(session.getOption(ExecConstants.SINGLE_SESSION));
    assertTrue(session.getOverrides().isEmpty());
  }

  @Test
  public void illTypedValueIsRejected() {
    final SessionOptionManager session = new SessionOptionManager(systemOptions);
    try {
      session.setOption(ExecConstants.ASYNC_EXECUTION_KEY, "maybe");
      fail();
    } catch (UserException e) {
      assertEquals(ErrorType.VALIDATION, e.getErrorType());
    }
    assertTrue(session.getOption(ExecConstants.ASYNC_EXECUTION));
  }

  @Test
  public void userKeysAreStrings() {
    final SessionOptionManager session = new SessionOptionManager(systemOptions);
    session.setOption(" foo ", "bar");
    final OptionValue value = session.getOption("foo");
    assertEquals(Kind.STRING, value.kind);
    assertEquals("bar", value.getValue());
  }

  @Test
  public void listOptionsIsOrdered() {
    final SessionOptionManager session = new SessionOptionManager(systemOptions);
    session.setOption("zeta", "1");
    session.setOption("alpha", "2");
    session.setOption(ExecConstants.INCREMENTAL_COLLECT_KEY, "false");

    final List<String> explicit = names(session.listOptions(false));
    assertEquals(3, explicit.size());
    assertEquals("alpha", explicit.get(0));
    assertEquals(ExecConstants.INCREMENTAL_COLLECT_KEY, explicit.get(1));
    assertEquals("zeta", explicit.get(2));

    final List<OptionValue> all = session.listOptions(true);
    assertEquals(ExecConstants.VALIDATORS.size() + 2, all.size());
    for (int i = 1; i < all.size(); i++) {
      assertTrue(all.get(i - 1).name.compareTo(all.get(i).name) < 0);
    }
    assertEquals(names(all), names(session.listOptions(true)));
  }

  @Test
  public void resetAll() {
    final SessionOptionManager session = new SessionOptionManager(systemOptions);
    session.setOption("a", "1");
    session.setOption("b", "2");
    session.deleteAllOptions();
    assertTrue(session.listOptions(false).isEmpty());
  }

  @Test
  public void queryOptionsSnapshotSession() {
    final SessionOptionManager session = new SessionOptionManager(systemOptions);
    session.setOption("k", "session");

    final QueryOptionManager query = new QueryOptionManager(session,
        ImmutableMap.of(ExecConstants.INCREMENTAL_COLLECT_KEY, "false"));
    session.setOption("k", "changed later");

    assertEquals("session", query.getOption("k").string_val);
    assertFalse(query.getOption(ExecConstants.INCREMENTAL_COLLECT));
    assertEquals(OptionType.QUERY, query.getOption(ExecConstants.INCREMENTAL_COLLECT_KEY).type);
    // the patch does not leak into the session
    assertTrue(session.getOption(ExecConstants.INCREMENTAL_COLLECT));
  }

  @Test
  public void queryPatchWithStaticKeyIsRejected() {
    final SessionOptionManager session = new SessionOptionManager(systemOptions);
    try {
      new QueryOptionManager(session, ImmutableMap.of(ExecConstants.OPERATION_LOG_DIR_KEY, "/tmp"));
      fail();
    } catch (UserException e) {
      assertEquals(ErrorType.IMMUTABLE_CONFIG, e.getErrorType());
    }
  }

  private static List<String> names(List<OptionValue> values) {
    final List<String> names = new ArrayList<>();
    for (OptionValue value : values) {
      names.add(value.name);
    }
    return names;
  }
}
