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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.sqlbridge.exec.engine.QueryResult;
import org.sqlbridge.exec.ops.QueryContext;
import org.sqlbridge.exec.record.ResultSchema;
import org.sqlbridge.exec.record.Row;
import org.sqlbridge.exec.server.options.OptionValidator;
import org.sqlbridge.exec.server.options.OptionValue;
import org.sqlbridge.exec.server.options.SessionOptionManager;

import com.google.common.collect.ImmutableList;

/**
 * Converts a {@code SET} statement into session option changes or listings.
 * <ul>
 *   <li>{@code SET}: options set in the session;</li>
 *   <li>{@code SET -v}: every declared option plus the ones set in the session, with meaning;</li>
 *   <li>{@code SET key}: effective value of one option;</li>
 *   <li>{@code SET key=value}: sets an option for the session.</li>
 * </ul>
 */
public class SetOptionHandler extends AbstractSqlHandler {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(SetOptionHandler.class);

  public static final String UNDEFINED = "<undefined>";

  static final ResultSchema SCHEMA = ResultSchema.ofStrings("key", "value");
  static final ResultSchema VERBOSE_SCHEMA = ResultSchema.ofStrings("key", "value", "meaning");

  private static final Pattern SET = Pattern.compile("SET(?:\\s+(.*))?", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
  private static final Pattern PREFIX = Pattern.compile("^(?:hiveconf|hivevar):", Pattern.CASE_INSENSITIVE);

  @Override
  public QueryResult handle(String statement, QueryContext context) {
    final Matcher matcher = SET.matcher(statement);
    if (!matcher.matches()) {
      return null;
    }
    final SessionOptionManager sessionOptions = context.getSessionOptions();
    final String argument = matcher.group(1) == null ? "" : matcher.group(1).trim();

    if (argument.isEmpty()) {
      final List<Row> rows = new ArrayList<>();
      for (OptionValue value : sessionOptions.listOptions(false)) {
        rows.add(Row.of(value.name, value.getValueAsString()));
      }
      return QueryResult.of(SCHEMA, rows);
    }

    if ("-v".equals(argument)) {
      final List<Row> rows = new ArrayList<>();
      for (OptionValue value : sessionOptions.listOptions(true)) {
        final OptionValidator validator = sessionOptions.getSystemOptions().getValidator(value.name);
        rows.add(Row.of(value.name, value.getValueAsString(),
            validator == null ? UNDEFINED : validator.getDescription()));
      }
      return QueryResult.of(VERBOSE_SCHEMA, rows);
    }

    final int eq = argument.indexOf('=');
    if (eq < 0) {
      final String key = stripPrefix(argument);
      final OptionValue value = context.getOptions().getOption(key);
      return QueryResult.of(SCHEMA, ImmutableList.of(
          Row.of(key, value == null ? UNDEFINED : value.getValueAsString())));
    }

    final String key = stripPrefix(argument.substring(0, eq).trim());
    final String value = argument.substring(eq + 1).trim();
    sessionOptions.setOption(key, value);
    logger.debug("Session {}: set {}={}", context.getSession().getSessionId(), key, value);
    return QueryResult.of(SCHEMA, ImmutableList.of(Row.of(key, value)));
  }

  private static String stripPrefix(String key) {
    return PREFIX.matcher(key).replaceFirst("");
  }
}
