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
package org.sqlbridge.exec.engine;

import java.util.Iterator;
import java.util.List;

import org.sqlbridge.exec.record.ResultSchema;
import org.sqlbridge.exec.record.Row;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Schema plus row producer returned by {@link QueryEngine#execute}.
 */
public class QueryResult {

  private final ResultSchema schema;
  private final RowSource rows;

  public QueryResult(ResultSchema schema, RowSource rows) {
    this.schema = Preconditions.checkNotNull(schema);
    this.rows = Preconditions.checkNotNull(rows);
  }

  /**
   * Result over rows that are already in memory.
   */
  public static QueryResult of(ResultSchema schema, List<Row> rows) {
    return new QueryResult(schema, new ListRowSource(rows));
  }

  /**
   * Result of a statement that produces no rows.
   */
  public static QueryResult empty() {
    return of(ResultSchema.EMPTY, ImmutableList.<Row>of());
  }

  public ResultSchema getSchema() {
    return schema;
  }

  public RowSource getRows() {
    return rows;
  }

  private static class ListRowSource implements RowSource {
    private final Iterator<Row> iterator;

    ListRowSource(List<Row> rows) {
      this.iterator = ImmutableList.copyOf(rows).iterator();
    }

    @Override
    public Row next() {
      return iterator.hasNext() ? iterator.next() : null;
    }

    @Override
    public void close() {
    }
  }
}
