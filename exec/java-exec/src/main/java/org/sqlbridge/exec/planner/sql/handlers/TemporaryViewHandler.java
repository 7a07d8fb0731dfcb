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
import org.sqlbridge.exec.rpc.user.TemporaryView;

/**
 * Creates and drops temporary views. Temporary views live in the session and are resolved by the
 * engine through {@link QueryContext#getTemporaryViews()}. {@code DROP VIEW} of a name that is not
 * a temporary view is left to the engine.
 */
public class TemporaryViewHandler extends AbstractSqlHandler {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(TemporaryViewHandler.class);

  private static final Pattern CREATE = Pattern.compile(
      "CREATE\\s+(OR\\s+REPLACE\\s+)?TEMP(?:ORARY)?\\s+VIEW\\s+(IF\\s+NOT\\s+EXISTS\\s+)?(\\S+)\\s+AS\\s+(.+)",
      Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
  private static final Pattern DROP = Pattern.compile(
      "DROP\\s+VIEW\\s+(IF\\s+EXISTS\\s+)?(\\S+)", Pattern.CASE_INSENSITIVE);

  @Override
  public QueryResult handle(String statement, QueryContext context) {
    final Map<String, TemporaryView> views = context.getTemporaryViews();

    final Matcher create = CREATE.matcher(statement);
    if (create.matches()) {
      final boolean replace = create.group(1) != null;
      final boolean ifNotExists = create.group(2) != null;
      final String name = normalizeName(create.group(3));
      final TemporaryView view = new TemporaryView(name, create.group(4).trim());
      if (replace) {
        views.put(name, view);
      } else if (views.putIfAbsent(name, view) != null && !ifNotExists) {
        throw UserException.validationError()
            .message("Temporary view '%s' already exists", name)
            .build(logger);
      }
      return QueryResult.empty();
    }

    final Matcher drop = DROP.matcher(statement);
    if (drop.matches()) {
      final String name = normalizeName(drop.group(2));
      if (views.remove(name) != null) {
        return QueryResult.empty();
      }
    }
    return null;
  }
}
