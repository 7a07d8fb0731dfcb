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
package org.sqlbridge.exec.work.operation;

import java.util.ArrayList;
import java.util.List;

import org.sqlbridge.common.exceptions.UserException;
import org.sqlbridge.exec.cursor.FetchOrientation;
import org.sqlbridge.exec.cursor.RowWindow;
import org.sqlbridge.exec.record.ResultSchema;
import org.sqlbridge.exec.record.Row;

import com.google.common.math.LongMath;

/**
 * Log lines of one operation, readable by clients through a fetch of type LOG. Lines are also
 * forwarded to the session log file.
 *
 * <p>Recording a line and writing it to the file are separate steps. Callers write after releasing
 * their own lock. Lines are dropped once the operation is closed.</p>
 */
public class OperationLog {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(OperationLog.class);

  public static final ResultSchema SCHEMA = ResultSchema.ofStrings("operation_log");

  private final OperationHandle handle;
  private final OperationLogWriter writer;
  private final ArrayList<String> lines = new ArrayList<>();
  private int readPosition;
  private boolean released;

  public OperationLog(OperationHandle handle, OperationLogWriter writer) {
    this.handle = handle;
    this.writer = writer;
  }

  /**
   * Adds a line readable by LOG fetches.
   *
   * @return the event to pass to {@link #publish} once the caller holds no lock
   */
  public synchronized OperationEvent record(OperationState state, String message) {
    if (!released) {
      lines.add(message);
    }
    return new OperationEvent(System.currentTimeMillis(), handle.toString(), state, message);
  }

  /**
   * Appends a recorded event to the session log file.
   */
  public void publish(OperationEvent event) {
    writer.write(event);
  }

  /**
   * Drops the lines kept in memory. Later lines only go to the session log file.
   */
  public synchronized void release() {
    released = true;
    lines.clear();
    lines.trimToSize();
    readPosition = 0;
  }

  /**
   * Reads log lines. FIRST restarts at the first line, NEXT continues after the last line read.
   *
   * @throws UserException validation error for a missing orientation or PRIOR, the log only
   *     scrolls forward
   */
  public synchronized RowWindow read(FetchOrientation orientation, long maxRows) {
    if (orientation == null || orientation == FetchOrientation.PRIOR) {
      throw UserException.validationError()
          .message("Fetch orientation %s is not supported for operation logs.", orientation)
          .build(logger);
    }
    if (maxRows <= 0) {
      throw UserException.validationError()
          .message("The number of rows to fetch must be positive, got %d.", maxRows)
          .build(logger);
    }
    if (orientation == FetchOrientation.FIRST) {
      readPosition = 0;
    }
    final int start = readPosition;
    final int end = (int) Math.min(lines.size(), LongMath.saturatedAdd(start, maxRows));
    final List<Row> rows = new ArrayList<>(end - start);
    for (String line : lines.subList(start, end)) {
      rows.add(Row.of(line));
    }
    readPosition = end;
    return new RowWindow(start, rows, SCHEMA);
  }

  public synchronized List<String> getLines() {
    return new ArrayList<>(lines);
  }
}
