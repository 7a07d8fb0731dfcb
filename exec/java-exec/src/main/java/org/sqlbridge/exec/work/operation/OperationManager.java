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

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import org.sqlbridge.common.AutoCloseables;
import org.sqlbridge.common.exceptions.UserException;
import org.sqlbridge.exec.ExecConstants;
import org.sqlbridge.exec.cursor.FetchOrientation;
import org.sqlbridge.exec.cursor.FetchType;
import org.sqlbridge.exec.cursor.ResultCursor;
import org.sqlbridge.exec.cursor.RowWindow;
import org.sqlbridge.exec.engine.QueryResult;
import org.sqlbridge.exec.ops.QueryContext;
import org.sqlbridge.exec.planner.sql.SessionSqlWorker;
import org.sqlbridge.exec.record.ResultSchema;
import org.sqlbridge.exec.rpc.user.SessionHandle;
import org.sqlbridge.exec.rpc.user.UserSession;
import org.sqlbridge.exec.server.BridgeServerContext;
import org.sqlbridge.exec.server.options.QueryOptionManager;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Runs statements and tracks every operation of the server until its session closes.
 *
 * <p>Asynchronous statements get a thread of their own from an unbounded pool, synchronous ones
 * run in the calling thread. No lock is held while the engine executes.</p>
 */
public class OperationManager implements AutoCloseable {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(OperationManager.class);

  private final BridgeServerContext context;
  private final SessionSqlWorker sqlWorker;
  private final ConcurrentMap<OperationHandle, Operation> operations = Maps.newConcurrentMap();
  private final ExecutorService executor;

  public OperationManager(BridgeServerContext context) {
    this.context = context;
    this.sqlWorker = new SessionSqlWorker(context.getEngine());
    this.executor = new ThreadPoolExecutor(0, Integer.MAX_VALUE, 60L, TimeUnit.SECONDS,
        new SynchronousQueue<Runnable>(),
        new ThreadFactoryBuilder().setNameFormat("sqlbridge-operation-%d").setDaemon(true).build()) {
      @Override
      protected void afterExecute(final Runnable r, final Throwable t) {
        if (t != null) {
          logger.error(String.format("%s.run() leaked an exception.", r.getClass().getName()), t);
        }
        super.afterExecute(r, t);
      }
    };
  }

  /**
   * Submits a statement.
   *
   * @param session session the statement runs in
   * @param sessionHandle handle the statement was submitted through
   * @param statement statement text
   * @param patch options for this statement only
   * @param runAsync whether the client asked for background execution; honoured only if the
   *     session allows asynchronous execution
   * @return handle of the new operation, RUNNING if asynchronous, terminal otherwise
   * @throws UserException immutable config error if the patch sets a static key, engine error if a
   *     synchronous statement failed
   */
  public OperationHandle submit(UserSession session, SessionHandle sessionHandle, String statement,
                                Map<String, String> patch, boolean runAsync) {
    final QueryOptionManager options = new QueryOptionManager(session.getOptions(), patch);
    final boolean async = runAsync && options.getOption(ExecConstants.ASYNC_EXECUTION);
    final String text = sqlWorker.substitute(statement, options);

    final OperationHandle handle = OperationHandle.newHandle();
    final Operation operation = new Operation(handle, session, sessionHandle, text, async,
        new OperationLog(handle, session.getResources().getOperationLogWriter()));
    operations.put(handle, operation);
    session.getOperations().put(handle, sessionHandle);
    if (session.isClosed()) {
      // lost a race with closeSession
      operation.skipRun();
      closeOperations(Collections.singleton(handle), 0);
      throw UserException.invalidHandleError()
          .message("Invalid SessionHandle: %s", sessionHandle)
          .build(logger);
    }

    final QueryContext queryContext = new QueryContext(handle, session, options, text,
        operation.getCancellationSignal(), context);
    operation.start();
    final OperationRunner runner = new OperationRunner(operation, queryContext);
    if (async) {
      try {
        executor.execute(runner);
      } catch (RejectedExecutionException e) {
        operation.fail(UserException.resourceError(e)
            .message("The server is shutting down, statement not executed.")
            .build(logger));
        operation.skipRun();
      }
      return handle;
    }

    runner.run();
    if (operation.getState() == OperationState.ERROR) {
      final UserException failure = operation.getFailure();
      closeOperations(Collections.singleton(handle), 0);
      throw failure;
    }
    return handle;
  }

  /**
   * Cancels a running asynchronous operation. Does nothing in every other case.
   *
   * @throws UserException invalid handle error if the operation is unknown
   */
  public void cancel(OperationHandle handle) {
    if (getOperation(handle).cancel()) {
      logger.debug("Operation {} cancelled.", handle);
    }
  }

  /**
   * @throws UserException invalid handle error if the operation is unknown
   */
  public OperationStatus getStatus(OperationHandle handle) {
    return getOperation(handle).getStatus();
  }

  /**
   * Closes an operation. Closing it again is a no-op until its session closes.
   *
   * @throws UserException invalid handle error if the operation is unknown
   */
  public void close(OperationHandle handle) {
    getOperation(handle).close();
  }

  /**
   * Fetches a window of rows. Blocks while the operation is running.
   *
   * @throws UserException invalid handle error if the operation is unknown, state conflict if it is
   *     closed, cancellation error if it was cancelled, engine error if it failed
   */
  public RowWindow fetch(OperationHandle handle, FetchOrientation orientation, long maxRows, FetchType fetchType) {
    final Operation operation = getOperation(handle);
    if (fetchType == FetchType.LOG) {
      if (operation.getState() == OperationState.CLOSED) {
        throw closedError(operation);
      }
      return operation.getOperationLog().read(orientation, maxRows);
    }
    return getCursor(operation).fetch(orientation, maxRows);
  }

  /**
   * @return the result schema of a finished operation, waiting for it if needed
   */
  public ResultSchema getResultSchema(OperationHandle handle) {
    return getCursor(getOperation(handle)).getSchema();
  }

  /**
   * @return the session handle the operation was submitted through
   * @throws UserException invalid handle error if the operation is unknown
   */
  public SessionHandle getSessionHandle(OperationHandle handle) {
    return getOperation(handle).getSessionHandle();
  }

  /**
   * @return true if one of the given operations is still RUNNING
   */
  public boolean isAnyRunning(Collection<OperationHandle> handles) {
    for (OperationHandle handle : handles) {
      final Operation operation = operations.get(handle);
      if (operation != null && operation.getState() == OperationState.RUNNING) {
        return true;
      }
    }
    return false;
  }

  /**
   * Closes the given operations, waits up to {@code timeoutMillis} for their statements to stop and
   * forgets them. Their handles are invalid afterwards.
   */
  public void closeOperations(Collection<OperationHandle> toClose, long timeoutMillis) {
    final List<OperationHandle> handles = ImmutableList.copyOf(toClose);
    for (OperationHandle handle : handles) {
      final Operation operation = operations.get(handle);
      if (operation != null) {
        operation.close();
      }
    }
    final Stopwatch watch = Stopwatch.createStarted();
    for (OperationHandle handle : handles) {
      final Operation operation = operations.remove(handle);
      if (operation == null) {
        continue;
      }
      operation.getSession().getOperations().remove(handle);
      final long remaining = Math.max(0, timeoutMillis - watch.elapsed(TimeUnit.MILLISECONDS));
      try {
        if (!operation.awaitTaskExit(remaining, TimeUnit.MILLISECONDS)) {
          logger.warn("Operation {} did not stop within {} ms after being closed.", handle, timeoutMillis);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        logger.warn("Interrupted while waiting for operation {} to stop.", handle);
        return;
      }
    }
  }

  public int getOperationCount() {
    return operations.size();
  }

  @Override
  public void close() {
    if (!operations.isEmpty()) {
      logger.info("Closing {} remaining operations.", operations.size());
      closeOperations(operations.keySet(), context.getConfig().getLong(ExecConstants.SESSION_CLOSE_TIMEOUT_KEY));
    }
    if (!MoreExecutors.shutdownAndAwaitTermination(executor, 10, TimeUnit.SECONDS)) {
      logger.error("Executor could not terminate.");
    }
  }

  private Operation getOperation(OperationHandle handle) {
    final Operation operation = handle == null ? null : operations.get(handle);
    if (operation == null) {
      throw UserException.invalidHandleError()
          .message("Invalid OperationHandle: %s", handle)
          .build(logger);
    }
    return operation;
  }

  private ResultCursor getCursor(Operation operation) {
    operation.awaitCompletion();
    final OperationStatus status = operation.getStatus();
    switch (status.getState()) {
    case FINISHED:
      final ResultCursor cursor = operation.getCursor();
      if (cursor != null) {
        return cursor;
      }
      // closed meanwhile
      throw closedError(operation);
    case ERROR:
    case CANCELED:
      throw status.getErrorDetail();
    case CLOSED:
      throw closedError(operation);
    default:
      throw UserException.systemError(null)
          .message("Operation %s is %s after completion.", operation.getHandle(), status.getState())
          .build(logger);
    }
  }

  private UserException closedError(Operation operation) {
    return UserException.stateConflictError()
        .message("Operation %s is closed.", operation.getHandle())
        .build(logger);
  }

  /**
   * Executes one statement and applies the outcome to its operation.
   */
  private class OperationRunner implements Runnable {
    private final Operation operation;
    private final QueryContext queryContext;

    OperationRunner(Operation operation, QueryContext queryContext) {
      this.operation = operation;
      this.queryContext = queryContext;
    }

    @Override
    public void run() {
      if (!operation.attachRunner(Thread.currentThread())) {
        operation.skipRun();
        return;
      }
      ResultCursor cursor = null;
      try {
        final QueryResult result = sqlWorker.execute(queryContext);
        cursor = new ResultCursor(result, queryContext.getCancellationSignal());
        if (!queryContext.getOptions().getOption(ExecConstants.INCREMENTAL_COLLECT)) {
          cursor.materializeAll();
        }
        if (operation.finish(cursor)) {
          cursor = null;
        }
      } catch (Exception e) {
        operation.fail(e);
      } catch (Error e) {
        operation.fail(e);
        throw e;
      } finally {
        AutoCloseables.closeSilently(cursor);
        operation.detachRunner();
      }
    }

    @Override
    public String toString() {
      return "OperationRunner [" + operation.getHandle() + "]";
    }
  }
}
