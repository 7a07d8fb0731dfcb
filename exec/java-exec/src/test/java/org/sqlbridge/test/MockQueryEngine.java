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
package org.sqlbridge.test;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.sqlbridge.exec.engine.QueryEngine;
import org.sqlbridge.exec.engine.QueryResult;
import org.sqlbridge.exec.engine.RowSource;
import org.sqlbridge.exec.ops.QueryContext;
import org.sqlbridge.exec.record.Column;
import org.sqlbridge.exec.record.ResultSchema;
import org.sqlbridge.exec.record.Row;
import org.sqlbridge.exec.rpc.user.TemporaryView;
import org.sqlbridge.exec.server.options.OptionValue;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

/**
 * Scripted engine for tests. Understands:
 * <ul>
 *   <li>{@code select <number>} and {@code select '<text>'};</li>
 *   <li>{@code select current_database()} and {@code select conf('<key>')};</li>
 *   <li>{@code select * from range(n)}: n rows produced lazily;</li>
 *   <li>{@code select * from failing_range(n, k)}: like range but pulling row k fails;</li>
 *   <li>{@code select sleep(ms)}: waits until cancelled or the time is up, then one row;</li>
 *   <li>{@code select raise_error('<message>')}: fails while executing;</li>
 *   <li>{@code select * from <name>}: a temporary view of the session, or a registered table;</li>
 *   <li>statements registered with {@link #register}.</li>
 * </ul>
 */
public class MockQueryEngine implements QueryEngine {

  public static final ResultSchema RANGE_SCHEMA = ResultSchema.of(Column.of("id", "bigint"));

  private static final Pattern RANGE = Pattern.compile("select \\* from range\\((\\d+)\\)");
  private static final Pattern FAILING_RANGE = Pattern.compile("select \\* from failing_range\\((\\d+),\\s*(\\d+)\\)");
  private static final Pattern SLEEP = Pattern.compile("select sleep\\((\\d+)\\)");
  private static final Pattern RAISE = Pattern.compile("select raise_error\\('(.*)'\\)");
  private static final Pattern CONF = Pattern.compile("select conf\\('(.*)'\\)");
  private static final Pattern NUMBER = Pattern.compile("select (-?\\d+)");
  private static final Pattern TEXT = Pattern.compile("select '(.*)'");
  private static final Pattern FROM = Pattern.compile("select \\* from (\\S+)");

  private final ConcurrentMap<String, QueryResultFactory> tables = Maps.newConcurrentMap();
  private final ConcurrentMap<String, QueryResultFactory> statements = Maps.newConcurrentMap();
  private final AtomicInteger executions = new AtomicInteger();
  private final AtomicInteger rowsPulled = new AtomicInteger();

  private interface QueryResultFactory {
    QueryResult create();
  }

  /**
   * Registers the result of one statement, matched case insensitively.
   */
  public void register(String statement, final ResultSchema schema, final List<Row> rows) {
    statements.put(normalize(statement), new QueryResultFactory() {
      @Override
      public QueryResult create() {
        return QueryResult.of(schema, rows);
      }
    });
  }

  /**
   * Registers a permanent table, readable with {@code select * from <name>}.
   */
  public void registerTable(String name, final ResultSchema schema, final List<Row> rows) {
    tables.put(name.toLowerCase(Locale.ROOT), new QueryResultFactory() {
      @Override
      public QueryResult create() {
        return QueryResult.of(schema, rows);
      }
    });
  }

  /**
   * @return number of statements that reached the engine
   */
  public int getExecutionCount() {
    return executions.get();
  }

  /**
   * @return number of rows pulled from lazily produced results
   */
  public int getRowsPulled() {
    return rowsPulled.get();
  }

  @Override
  public QueryResult execute(QueryContext context) throws Exception {
    executions.incrementAndGet();
    return execute(normalize(context.getStatement()), context);
  }

  private QueryResult execute(String statement, QueryContext context) throws Exception {
    final QueryResultFactory registered = statements.get(statement);
    if (registered != null) {
      return registered.create();
    }

    Matcher m = RANGE.matcher(statement);
    if (m.matches()) {
      return new QueryResult(RANGE_SCHEMA, new RangeSource(Long.parseLong(m.group(1)), -1));
    }
    m = FAILING_RANGE.matcher(statement);
    if (m.matches()) {
      return new QueryResult(RANGE_SCHEMA, new RangeSource(Long.parseLong(m.group(1)), Long.parseLong(m.group(2))));
    }
    m = SLEEP.matcher(statement);
    if (m.matches()) {
      final long millis = Long.parseLong(m.group(1));
      final Stopwatch watch = Stopwatch.createStarted();
      while (watch.elapsed(TimeUnit.MILLISECONDS) < millis) {
        context.getCancellationSignal().checkCancelled();
        Thread.sleep(5);
      }
      return single("slept", "bigint", millis);
    }
    m = RAISE.matcher(statement);
    if (m.matches()) {
      throw new IllegalStateException(m.group(1));
    }
    if ("select current_database()".equals(statement)) {
      return single("current_database()", "string", context.getCurrentDatabase());
    }
    m = CONF.matcher(statement);
    if (m.matches()) {
      final OptionValue value = context.getOptions().getOption(m.group(1));
      return single("value", "string", value == null ? null : value.getValueAsString());
    }
    m = NUMBER.matcher(statement);
    if (m.matches()) {
      return single("_c0", "int", Integer.parseInt(m.group(1)));
    }
    m = TEXT.matcher(statement);
    if (m.matches()) {
      return single("_c0", "string", m.group(1));
    }
    m = FROM.matcher(statement);
    if (m.matches()) {
      final String name = m.group(1);
      final Map<String, TemporaryView> views = context.getTemporaryViews();
      final TemporaryView view = views.get(name);
      if (view != null) {
        return execute(normalize(view.getQuery()), context);
      }
      final QueryResultFactory table = tables.get(name);
      if (table != null) {
        return table.create();
      }
      throw new IllegalArgumentException("Table or view not found: " + name);
    }
    throw new IllegalArgumentException("Unsupported statement: " + statement);
  }

  private static QueryResult single(String column, String type, Object value) {
    return QueryResult.of(ResultSchema.of(Column.of(column, type)), ImmutableList.of(Row.of(value)));
  }

  private static String normalize(String statement) {
    return statement.trim().replaceAll(";+$", "").trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
  }

  private class RangeSource implements RowSource {
    private final long count;
    private final long failAt;
    private long next;

    RangeSource(long count, long failAt) {
      this.count = count;
      this.failAt = failAt;
    }

    @Override
    public Row next() throws Exception {
      if (next == failAt) {
        throw new IllegalStateException("Failure while producing row " + next);
      }
      if (next >= count) {
        return null;
      }
      rowsPulled.incrementAndGet();
      return Row.of(next++);
    }

    @Override
    public void close() {
    }
  }
}
