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
package org.sqlbridge.exec.record;

import java.util.Iterator;
import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * Fixed, ordered list of columns shared by every row of a result.
 */
public class ResultSchema implements Iterable<Column> {

  public static final ResultSchema EMPTY = new ResultSchema(ImmutableList.<Column>of());

  private final List<Column> columns;

  public ResultSchema(List<Column> columns) {
    this.columns = ImmutableList.copyOf(columns);
  }

  public static ResultSchema of(Column... columns) {
    return new ResultSchema(ImmutableList.copyOf(columns));
  }

  /**
   * Shorthand for schemas made of string columns, as returned by session commands.
   */
  public static ResultSchema ofStrings(String... names) {
    final ImmutableList.Builder<Column> builder = ImmutableList.builder();
    for (String name : names) {
      builder.add(Column.of(name, "string"));
    }
    return new ResultSchema(builder.build());
  }

  public int getColumnCount() {
    return columns.size();
  }

  public Column getColumn(int index) {
    return columns.get(index);
  }

  public List<Column> getColumns() {
    return columns;
  }

  @Override
  public Iterator<Column> iterator() {
    return columns.iterator();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ResultSchema && columns.equals(((ResultSchema) o).columns);
  }

  @Override
  public int hashCode() {
    return columns.hashCode();
  }

  @Override
  public String toString() {
    return "[" + Joiner.on(", ").join(columns) + "]";
  }
}
