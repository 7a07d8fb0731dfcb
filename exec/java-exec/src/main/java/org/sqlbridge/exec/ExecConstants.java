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
package org.sqlbridge.exec;

import java.util.List;

import org.sqlbridge.exec.server.options.OptionValidator;
import org.sqlbridge.exec.server.options.TypeValidators.BooleanValidator;
import org.sqlbridge.exec.server.options.TypeValidators.LongValidator;
import org.sqlbridge.exec.server.options.TypeValidators.StringValidator;

import com.google.common.collect.ImmutableList;

public final class ExecConstants {

  private ExecConstants() {
    // Don't allow instantiation
  }

  public static final String SERVER_NAME_KEY = "sqlbridge.server.name";
  public static final StringValidator SERVER_NAME = new StringValidator(SERVER_NAME_KEY,
      "Name reported to clients as server and DBMS name.", true);

  public static final String SERVER_VERSION_KEY = "sqlbridge.server.version";
  public static final StringValidator SERVER_VERSION = new StringValidator(SERVER_VERSION_KEY,
      "Version reported to clients.", true);

  /**
   * When enabled every connection shares one session: options, temporary views, temporary
   * functions and the current database.
   */
  public static final String SINGLE_SESSION_KEY = "sqlbridge.exec.session.single";
  public static final BooleanValidator SINGLE_SESSION = new BooleanValidator(SINGLE_SESSION_KEY,
      "Whether all connections share a single session.", true);

  public static final String SESSION_CLOSE_TIMEOUT_KEY = "sqlbridge.exec.session.close_timeout_ms";
  public static final LongValidator SESSION_CLOSE_TIMEOUT = new LongValidator(SESSION_CLOSE_TIMEOUT_KEY,
      "Time a closing session waits for its running operations to stop, in milliseconds.", true);

  public static final String SESSION_IDLE_TIMEOUT_KEY = "sqlbridge.exec.session.idle_timeout_ms";
  public static final LongValidator SESSION_IDLE_TIMEOUT = new LongValidator(SESSION_IDLE_TIMEOUT_KEY,
      "Idle sessions are closed after this many milliseconds. 0 disables expiry.", true);

  public static final String SESSION_IDLE_CHECK_INTERVAL_KEY = "sqlbridge.exec.session.idle_check_interval_ms";
  public static final LongValidator SESSION_IDLE_CHECK_INTERVAL = new LongValidator(SESSION_IDLE_CHECK_INTERVAL_KEY,
      "Interval between two idle session checks, in milliseconds.", true);

  public static final String DEFAULT_DATABASE_KEY = "sqlbridge.exec.default_database";
  public static final StringValidator DEFAULT_DATABASE = new StringValidator(DEFAULT_DATABASE_KEY,
      "Current database of a new session.", true);

  public static final String OPERATION_LOG_DIR_KEY = "sqlbridge.exec.operation_log.dir";
  public static final StringValidator OPERATION_LOG_DIR = new StringValidator(OPERATION_LOG_DIR_KEY,
      "Root directory of the per session operation logs.", true);

  public static final String SCRATCH_DIR_KEY = "sqlbridge.exec.scratch.dir";
  public static final StringValidator SCRATCH_DIR = new StringValidator(SCRATCH_DIR_KEY,
      "Directory of the per session pipe files.", true);

  public static final String ASYNC_EXECUTION_KEY = "sqlbridge.exec.async";
  public static final BooleanValidator ASYNC_EXECUTION = new BooleanValidator(ASYNC_EXECUTION_KEY,
      "Whether statements may run in the background. When disabled every statement runs synchronously"
      + " and cancellation has no effect.", false);

  public static final String INCREMENTAL_COLLECT_KEY = "sqlbridge.exec.incremental_collect";
  public static final BooleanValidator INCREMENTAL_COLLECT = new BooleanValidator(INCREMENTAL_COLLECT_KEY,
      "Whether result rows are pulled from the engine as they are fetched rather than collected up front.",
      false);

  public static final String VARIABLE_SUBSTITUTE_KEY = "sqlbridge.exec.variable_substitute";
  public static final BooleanValidator VARIABLE_SUBSTITUTE = new BooleanValidator(VARIABLE_SUBSTITUTE_KEY,
      "Whether ${var} references in statements are replaced by session values.", false);

  /**
   * Every declared option, in the order they are listed by {@code SET -v}.
   */
  public static final List<OptionValidator> VALIDATORS = ImmutableList.<OptionValidator>of(
      SERVER_NAME,
      SERVER_VERSION,
      SINGLE_SESSION,
      SESSION_CLOSE_TIMEOUT,
      SESSION_IDLE_TIMEOUT,
      SESSION_IDLE_CHECK_INTERVAL,
      DEFAULT_DATABASE,
      OPERATION_LOG_DIR,
      SCRATCH_DIR,
      ASYNC_EXECUTION,
      INCREMENTAL_COLLECT,
      VARIABLE_SUBSTITUTE);
}
