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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.sqlbridge.exec.engine.QueryResult;
import org.sqlbridge.exec.ops.QueryContext;

public class UseDatabaseHandler extends AbstractSqlHandler {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(UseDatabaseHandler.class);

  private static final Pattern USE = Pattern.compile("USE\\s+(\\S+)", Pattern.CASE_INSENSITIVE);

  @Override
  public QueryResult handle(String statement, QueryContext context) {
    final Matcher matcher = USE.matcher(statement);
    if (!matcher.matches()) {
      return null;
    }
    final String database = normalizeName(matcher.group(1));
    context.getSession().setCurrentDatabase(database);
    logger.debug("Session {}: current database is now {}", context.getSession().getSessionId(), database);
    return QueryResult.empty();
  }
}
