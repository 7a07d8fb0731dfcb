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
package org.sqlbridge.exec.cursor;

import java.util.List;

import org.sqlbridge.exec.record.ResultSchema;
import org.sqlbridge.exec.record.Row;

import com.google.common.collect.ImmutableList;

/**
 * Rows {@code [startOffset, startOffset + rowCount)} of a result, as returned by one fetch.
 */
public class RowWindow {

  private final long startOffset;
  private final List<Row> rows;
  private final ResultSchema schema;

  public RowWindow(long startOffset, List<Row> rows, ResultSchema schema) {
    this.startOffset = startOffset;
    this.rows = ImmutableList.copyOf(rows);
    this.schema = schema;
  }

  public long getStartOffset() {
    return startOffset;
  }

  public int getRowCount() {
    return rows.size();
  }

  public long getEndOffset() {
    return startOffset + rows.size();
  }

  public List<Row> getRows() {
    return rows;
  }

  public ResultSchema getSchema() {
    return schema;
  }

  @Override
  public String toString() {
    return "RowWindow [" + startOffset + ", " + getEndOffset() + ")";
  }
}
