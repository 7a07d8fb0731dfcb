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
package org.sqlbridge.exec.planner.sql;

import java.util.List;
import java.util.regex.Pattern;

import org.sqlbridge.exec.ExecConstants;
import org.sqlbridge.exec.engine.QueryEngine;
import org.sqlbridge.exec.engine.QueryResult;
import org.sqlbridge.exec.ops.QueryContext;
import org.sqlbridge.exec.planner.sql.handlers.AbstractSqlHandler;
import org.sqlbridge.exec.planner.sql.handlers.ResetOptionHandler;
import org.sqlbridge.exec.planner.sql.handlers.SetOptionHandler;
import org.sqlbridge.exec.planner.sql.handlers.TemporaryFunctionHandler;
import org.sqlbridge.exec.planner.sql.handlers.TemporaryViewHandler;
import org.sqlbridge.exec.planner.sql.handlers.UseDatabaseHandler;
import org.sqlbridge.exec.server.options.OptionManager;

import com.google.common.collect.ImmutableList;

/**
 * Entry point of statement execution: session commands are handled here, everything else goes to
 * the {@link QueryEngine}.
 */
public class SessionSqlWorker {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(SessionSqlWorker.class);

  private static final Pattern TRAILING_SEMICOLONS = Pattern.compile("[;\\s]+$");

  private final QueryEngine engine;
  private final List<AbstractSqlHandler> handlers = ImmutableList.of(
      new SetOptionHandler(),
      new ResetOptionHandler(),
      new UseDatabaseHandler(),
      new TemporaryViewHandler(),
      new TemporaryFunctionHandler());

  public SessionSqlWorker(QueryEngine engine) {
    this.engine = engine;
  }

  /**
   * @return the statement with variables substituted, or unchanged if substitution is disabled
   */
  public String substitute(String statement, OptionManager options) {
    if (!options.getOption(ExecConstants.VARIABLE_SUBSTITUTE)) {
      return statement;
    }
    return VariableSubstitution.substitute(statement, options);
  }

  public QueryResult execute(QueryContext context) throws Exception {
    final String statement = TRAILING_SEMICOLONS.matcher(context.getStatement().trim()).replaceFirst("");
    for (AbstractSqlHandler handler : handlers) {
      final QueryResult result = handler.handle(statement, context);
      if (result != null) {
        logger.debug("Statement handled by {}: {}", handler.getClass().getSimpleName(), statement);
        return result;
      }
    }
    return engine.execute(context);
  }
}
