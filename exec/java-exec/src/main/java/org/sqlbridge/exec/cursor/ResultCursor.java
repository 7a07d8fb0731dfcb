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

import java.util.ArrayList;
import java.util.List;

import org.sqlbridge.common.exceptions.UserException;
import org.sqlbridge.exec.engine.CancellationSignal;
import org.sqlbridge.exec.engine.QueryResult;
import org.sqlbridge.exec.engine.RowSource;
import org.sqlbridge.exec.record.ResultSchema;
import org.sqlbridge.exec.record.Row;

import com.google.common.math.LongMath;

/**
 * Scrollable view over the rows of one result.
 *
 * <p>Rows are pulled from the engine only when a fetch needs them and are kept for the lifetime of
 * the cursor, so scrolling back never re-executes the statement. The cursor remembers the bounds
 * {@code [lastFetchStart, lastFetchEnd)} of the previous fetch:</p>
 * <ul>
 *   <li>FIRST(n) returns {@code [0, n)};</li>
 *   <li>NEXT(n) returns {@code [lastFetchEnd, lastFetchEnd + n)};</li>
 *   <li>PRIOR(n) returns {@code [max(0, lastFetchStart - n), that + n)}.</li>
 * </ul>
 * <p>Every window is clamped to the number of rows the result holds. Once the result is exhausted
 * NEXT keeps returning the empty window at its end.</p>
 */
public class ResultCursor implements AutoCloseable {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ResultCursor.class);

  private final ResultSchema schema;
  private final RowSource source;
  private final CancellationSignal cancellationSignal;
  private final List<Row> buffer = new ArrayList<>();

  private boolean totalKnown;
  private int lastFetchStart;
  private int lastFetchEnd;
  private UserException failure;
  private boolean closed;

  public ResultCursor(QueryResult result, CancellationSignal cancellationSignal) {
    this.schema = result.getSchema();
    this.source = result.getRows();
    this.cancellationSignal = cancellationSignal;
  }

  public ResultSchema getSchema() {
    return schema;
  }

  /**
   * Returns the next window of rows.
   *
   * @param orientation anchor of the window
   * @param maxRows maximum number of rows, must be positive
   * @throws UserException validation error for a missing orientation or a non positive row count, state conflict once the
   *     cursor is closed, engine error if pulling rows failed during this or an earlier fetch
   */
  public synchronized RowWindow fetch(FetchOrientation orientation, long maxRows) {
    if (orientation == null) {
      throw UserException.validationError()
          .message("A fetch orientation is required.")
          .build(logger);
    }
    if (maxRows <= 0) {
      throw UserException.validationError()
          .message("The number of rows to fetch must be positive, got %d.", maxRows)
          .build(logger);
    }
    checkOpen();
    final long n = maxRows;

    final int newStart;
    final int newEnd;
    switch (orientation) {
    case FIRST:
      newStart = 0;
      newEnd = materializeUpTo(n);
      break;
    case NEXT:
      newStart = lastFetchEnd;
      newEnd = materializeUpTo(LongMath.saturatedAdd(newStart, n));
      break;
    case PRIOR:
      newStart = (int) Math.max(0L, lastFetchStart - n);
      newEnd = materializeUpTo(LongMath.saturatedAdd(newStart, n));
      break;
    default:
      throw UserException.validationError()
          .message("Unsupported fetch orientation %s.", orientation)
          .build(logger);
    }

    lastFetchStart = newStart;
    lastFetchEnd = newEnd;
    return new RowWindow(newStart, buffer.subList(newStart, newEnd), schema);
  }

  /**
   * Pulls the whole result into the buffer, checking for cancellation between rows.
   *
   * @throws UserException cancellation error if the operation was cancelled meanwhile, engine
   *     error if a row could not be produced
   */
  public synchronized void materializeAll() {
    checkOpen();
    while (!totalKnown) {
      cancellationSignal.checkCancelled();
      pull();
    }
  }

  /**
   * @return number of rows pulled from the engine so far
   */
  public synchronized int getMaterializedRowCount() {
    return buffer.size();
  }

  public synchronized boolean isTotalKnown() {
    return totalKnown;
  }

  /**
   * @return the total number of rows, or -1 while the engine may still produce more
   */
  public synchronized long getTotalRows() {
    return totalKnown ? buffer.size() : -1;
  }

  @Override
  public synchronized void close() throws Exception {
    if (closed) {
      return;
    }
    closed = true;
    buffer.clear();
    source.close();
  }

  private void checkOpen() {
    if (closed) {
      throw UserException.stateConflictError()
          .message("The result cursor is closed.")
          .build(logger);
    }
    if (failure != null) {
      throw failure;
    }
  }

  /**
   * Makes sure the buffer holds {@code k} rows or the whole result, whichever is smaller.
   *
   * @return the number of buffered rows available below {@code k}
   */
  private int materializeUpTo(long k) {
    while (buffer.size() < k && !totalKnown) {
      pull();
    }
    return (int) Math.min(k, buffer.size());
  }

  private void pull() {
    final Row row;
    try {
      row = source.next();
    } catch (Exception e) {
      failure = UserException.engineError(e)
          .addContext("Rows fetched before the failure:", buffer.size())
          .build(logger);
      throw failure;
    }
    if (row == null) {
      totalKnown = true;
      logger.debug("Result exhausted after {} rows.", buffer.size());
    } else {
      buffer.add(row);
    }
  }
}
