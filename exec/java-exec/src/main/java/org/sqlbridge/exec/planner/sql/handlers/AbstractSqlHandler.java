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
package org.sqlbridge.exec.planner.sql.handlers;

import java.util.Locale;

import org.apache.commons.lang3.StringUtils;
import org.sqlbridge.exec.engine.QueryResult;
import org.sqlbridge.exec.ops.QueryContext;

/**
 * Handles statements that act on session state and never reach the engine.
 */
public abstract class AbstractSqlHandler {

  /**
   * @param statement statement text, trimmed and without trailing semicolon
   * @param context context of the operation
   * @return the result, or null if this handler does not recognise the statement
   */
  public abstract QueryResult handle(String statement, QueryContext context) throws Exception;

  /**
   * Identifiers are case insensitive and may be quoted with backticks.
   */
  protected static String normalizeName(String name) {
    return StringUtils.strip(name.trim(), "`").toLowerCase(Locale.ROOT);
  }
}
