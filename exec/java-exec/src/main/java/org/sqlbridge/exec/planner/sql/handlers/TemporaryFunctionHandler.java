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

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.sqlbridge.common.exceptions.UserException;
import org.sqlbridge.exec.engine.QueryResult;
import org.sqlbridge.exec.ops.QueryContext;
import org.sqlbridge.exec.record.ResultSchema;
import org.sqlbridge.exec.record.Row;
import org.sqlbridge.exec.rpc.user.TemporaryFunction;

import com.google.common.collect.ImmutableList;

/**
 * Registers, drops and describes temporary functions of a session. Only the registration is kept
 * here, loading the implementing class is up to the engine.
 */
public class TemporaryFunctionHandler extends AbstractSqlHandler {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(TemporaryFunctionHandler.class);

  static final ResultSchema DESCRIBE_SCHEMA = ResultSchema.ofStrings("function_desc");

  private static final Pattern CREATE = Pattern.compile(
      "CREATE\\s+(OR\\s+REPLACE\\s+)?TEMPORARY\\s+FUNCTION\\s+(\\S+)\\s+AS\\s+'([^']+)'.*",
      Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
  private static final Pattern DROP = Pattern.compile(
      "DROP\\s+TEMPORARY\\s+FUNCTION\\s+(IF\\s+EXISTS\\s+)?(\\S+)", Pattern.CASE_INSENSITIVE);
  private static final Pattern DESCRIBE = Pattern.compile(
      "DESC(?:RIBE)?\\s+FUNCTION\\s+(?:EXTENDED\\s+)?(\\S+)", Pattern.CASE_INSENSITIVE);

  @Override
  public QueryResult handle(String statement, QueryContext context) {
    final Map<String, TemporaryFunction> functions = context.getTemporaryFunctions();

    final Matcher create = CREATE.matcher(statement);
    if (create.matches()) {
      final String name = normalizeName(create.group(2));
      final TemporaryFunction function = new TemporaryFunction(name, create.group(3));
      if (create.group(1) != null) {
        functions.put(name, function);
      } else if (functions.putIfAbsent(name, function) != null) {
        throw UserException.validationError()
            .message("Function %s already exists", name)
            .build(logger);
      }
      return QueryResult.empty();
    }

    final Matcher drop = DROP.matcher(statement);
    if (drop.matches()) {
      final String name = normalizeName(drop.group(2));
      if (functions.remove(name) == null && drop.group(1) == null) {
        throw UserException.validationError()
            .message("Temporary function '%s' not found", name)
            .build(logger);
      }
      return QueryResult.empty();
    }

    final Matcher describe = DESCRIBE.matcher(statement);
    if (describe.matches()) {
      final TemporaryFunction function = functions.get(normalizeName(describe.group(1)));
      if (function == null) {
        return null;
      }
      return QueryResult.of(DESCRIBE_SCHEMA, ImmutableList.of(
          Row.of("Function: " + function.getName()),
          Row.of("Class: " + function.getClassName()),
          Row.of("Usage: N/A.")));
    }
    return null;
  }
}
