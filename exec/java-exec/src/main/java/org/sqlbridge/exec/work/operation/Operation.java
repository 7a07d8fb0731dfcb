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

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.sqlbridge.common.AutoCloseables;
import org.sqlbridge.common.exceptions.UserException;
import org.sqlbridge.exec.cursor.ResultCursor;
import org.sqlbridge.exec.engine.CancellationSignal;
import org.sqlbridge.exec.rpc.user.SessionHandle;
import org.sqlbridge.exec.rpc.user.UserSession;

/**
 * One statement execution and its state machine. All transitions happen under the operation lock;
 * the state and the status can be read without it. Log lines of a transition are written to the
 * session log file after the lock is released.
 *
 * <p>The outcome of the engine is applied only while the operation is still RUNNING, so a cancel
 * or close that got there first always wins.</p>
 */
public class Operation {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(Operation.class);

  private final OperationHandle handle;
  private final UserSession session;
  private final SessionHandle sessionHandle;
  private final String statement;
  private final boolean runAsync;
  private final OperationLog operationLog;
  private final CancellationSignal cancellationSignal = new CancellationSignal();

  // counted down when the operation leaves RUNNING (or INITIALIZED)
  private final CountDownLatch done = new CountDownLatch(1);
  // counted down when no thread executes the statement anymore
  private final CountDownLatch taskExited = new CountDownLatch(1);

  private volatile OperationState state = OperationState.INITIALIZED;
  private ResultCursor cursor;
  // written before the state it belongs to
  private volatile UserException failure;
  private Thread runner;

  public Operation(OperationHandle handle, UserSession session, SessionHandle sessionHandle, String statement,
                   boolean runAsync, OperationLog operationLog) {
    this.handle = handle;
    this.session = session;
    this.sessionHandle = sessionHandle;
    this.statement = statement;
    this.runAsync = runAsync;
    this.operationLog = operationLog;
  }

  public OperationHandle getHandle() {
    return handle;
  }

  public UserSession getSession() {
    return session;
  }

  /**
   * @return the handle the operation was submitted through
   */
  public SessionHandle getSessionHandle() {
    return sessionHandle;
  }

  public String getStatement() {
    return statement;
  }

  public boolean isRunAsync() {
    return runAsync;
  }

  public OperationState getState() {
    return state;
  }

  public OperationLog getOperationLog() {
    return operationLog;
  }

  public CancellationSignal getCancellationSignal() {
    return cancellationSignal;
  }

  public OperationStatus getStatus() {
    final OperationState current = state;
    final boolean running = current == OperationState.INITIALIZED || current == OperationState.RUNNING;
    return new OperationStatus(current, running ? null : failure);
  }

  public synchronized ResultCursor getCursor() {
    return cursor;
  }

  public UserException getFailure() {
    return failure;
  }

  /**
   * Moves the operation from INITIALIZED to RUNNING.
   *
   * @return false if the operation was closed before it could start
   */
  boolean start() {
    final OperationEvent event;
    synchronized (this) {
      if (state != OperationState.INITIALIZED) {
        return false;
      }
      event = transition(OperationState.RUNNING, "Statement started: " + statement);
    }
    operationLog.publish(event);
    return true;
  }

  /**
   * Registers the thread executing the statement so that it can be interrupted on cancel.
   *
   * @return false if the operation is no longer running, the caller must not execute it then
   */
  synchronized boolean attachRunner(Thread thread) {
    if (state != OperationState.RUNNING) {
      return false;
    }
    runner = thread;
    return true;
  }

  /**
   * Unregisters the executing thread. Must be called by that thread, whatever the outcome.
   */
  void detachRunner() {
    synchronized (this) {
      runner = null;
    }
    // drop an interrupt aimed at the statement, the thread goes back to its pool or caller
    Thread.interrupted();
    taskExited.countDown();
  }

  /**
   * Marks that the statement will never be executed, after {@link #attachRunner} refused.
   */
  void skipRun() {
    taskExited.countDown();
  }

  /**
   * Records success.
   *
   * @return false if the operation had already left RUNNING, the caller keeps ownership of the
   *     cursor then
   */
  boolean finish(ResultCursor resultCursor) {
    final OperationEvent event;
    synchronized (this) {
      if (state != OperationState.RUNNING) {
        return false;
      }
      cursor = resultCursor;
      event = transition(OperationState.FINISHED, "Statement finished.");
    }
    operationLog.publish(event);
    return true;
  }

  /**
   * Records an engine failure, unless the operation was cancelled or closed meanwhile.
   */
  boolean fail(Throwable cause) {
    final OperationEvent event;
    synchronized (this) {
      if (state != OperationState.RUNNING) {
        logger.debug("Ignoring failure of operation {} in state {}.", handle, state, cause);
        return false;
      }
      failure = UserException.engineError(cause)
          .addContext("Operation:", handle)
          .build(logger);
      event = transition(OperationState.ERROR, "Statement failed: " + failure.getOriginalMessage());
    }
    operationLog.publish(event);
    return true;
  }

  /**
   * Cancels a running asynchronous operation: the state becomes CANCELED, the engine is signalled
   * and the executing thread is interrupted. Does nothing in any other case.
   *
   * @return true if the operation was cancelled by this call
   */
  public boolean cancel() {
    final OperationEvent event;
    synchronized (this) {
      if (state != OperationState.RUNNING) {
        return false;
      }
      if (!runAsync) {
        logger.debug("Ignoring cancel of synchronous operation {}.", handle);
        return false;
      }
      failure = UserException.cancelledError()
          .message("Operation %s was cancelled.", handle)
          .build(logger);
      event = transition(OperationState.CANCELED, "Statement cancelled.");
      stopRunner();
    }
    operationLog.publish(event);
    return true;
  }

  /**
   * Closes the operation from any state and releases its result and its log lines. Idempotent.
   */
  public void close() {
    final ResultCursor toClose;
    final OperationEvent event;
    synchronized (this) {
      if (state == OperationState.CLOSED) {
        return;
      }
      event = transition(OperationState.CLOSED, "Operation closed.");
      stopRunner();
      toClose = cursor;
      cursor = null;
    }
    operationLog.publish(event);
    operationLog.release();
    AutoCloseables.closeSilently(toClose);
  }

  /**
   * Blocks until the operation is no longer running.
   */
  public void awaitCompletion() {
    try {
      done.await();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw UserException.systemError(e)
          .message("Interrupted while waiting for operation %s.", handle)
          .build(logger);
    }
  }

  /**
   * Waits for the executing thread, if any, to stop.
   *
   * @return false if it did not stop in time
   */
  boolean awaitTaskExit(long timeout, TimeUnit unit) throws InterruptedException {
    return taskExited.await(timeout, unit);
  }

  private void stopRunner() {
    cancellationSignal.cancel();
    if (runner != null) {
      runner.interrupt();
    }
  }

  private OperationEvent transition(OperationState newState, String message) {
    final OperationState previous = state;
    final OperationEvent event = operationLog.record(newState, message);
    state = newState;
    if (newState.isTerminal()) {
      done.countDown();
    }
    logger.debug("Operation {}: {} -> {}", handle, previous, newState);
    return event;
  }

  @Override
  public String toString() {
    return "Operation [" + handle + ", " + state + "]";
  }
}
