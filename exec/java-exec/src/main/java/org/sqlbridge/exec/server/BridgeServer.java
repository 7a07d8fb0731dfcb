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
package org.sqlbridge.exec.server;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.sqlbridge.common.AutoCloseables;
import org.sqlbridge.common.config.BridgeConfig;
import org.sqlbridge.exec.ExecConstants;
import org.sqlbridge.exec.engine.QueryEngine;
import org.sqlbridge.exec.rpc.user.SessionFactory;
import org.sqlbridge.exec.rpc.user.SessionRegistry;
import org.sqlbridge.exec.rpc.user.UserRequestHandler;
import org.sqlbridge.exec.rpc.user.UserService;
import org.sqlbridge.exec.rpc.user.UserSession;
import org.sqlbridge.exec.server.options.SystemOptionManager;
import org.sqlbridge.exec.work.operation.OperationManager;
import org.sqlbridge.exec.work.user.UserWorker;

import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Wires the query service together and owns its lifecycle. The transport talks to
 * {@link #getRequestHandler()}; embedded users and tests can call {@link #getUserService()}.
 */
public class BridgeServer implements AutoCloseable {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(BridgeServer.class);

  private final BridgeServerContext context;
  private final OperationManager operationManager;
  private final SessionRegistry sessionRegistry;
  private final UserWorker userWorker;
  private final UserRequestHandler requestHandler;
  private final ScheduledExecutorService idleChecker;
  private volatile boolean closed;

  public BridgeServer(BridgeConfig config, QueryEngine engine) {
    this.context = new BridgeServerContext(config, engine);
    final SystemOptionManager options = context.getOptionManager();

    this.operationManager = new OperationManager(context);
    final SessionFactory sessionFactory = new SessionFactory(context);
    final UserSession sharedSession = options.getOption(ExecConstants.SINGLE_SESSION)
        ? sessionFactory.newSession(null, ImmutableMap.<String, String>of())
        : null;
    this.sessionRegistry = new SessionRegistry(sessionFactory, operationManager, sharedSession,
        options.getOption(ExecConstants.SESSION_CLOSE_TIMEOUT));
    this.userWorker = new UserWorker(sessionRegistry, operationManager, options);
    this.requestHandler = new UserRequestHandler(userWorker);

    final long idleTimeout = options.getOption(ExecConstants.SESSION_IDLE_TIMEOUT);
    if (idleTimeout > 0) {
      final long interval = options.getOption(ExecConstants.SESSION_IDLE_CHECK_INTERVAL);
      this.idleChecker = Executors.newSingleThreadScheduledExecutor(
          new ThreadFactoryBuilder().setNameFormat("sqlbridge-session-idle-checker").setDaemon(true).build());
      idleChecker.scheduleWithFixedDelay(new Runnable() {
        @Override
        public void run() {
          try {
            sessionRegistry.closeIdleSessions(idleTimeout);
          } catch (RuntimeException e) {
            logger.error("Failure while closing idle sessions.", e);
          }
        }
      }, interval, interval, TimeUnit.MILLISECONDS);
    } else {
      this.idleChecker = null;
    }

    logger.info("{} {} started in {} session mode.", options.getOption(ExecConstants.SERVER_NAME),
        options.getOption(ExecConstants.SERVER_VERSION), sharedSession != null ? "single" : "multi");
  }

  public BridgeServerContext getContext() {
    return context;
  }

  public UserService getUserService() {
    return userWorker;
  }

  public UserRequestHandler getRequestHandler() {
    return requestHandler;
  }

  public SessionRegistry getSessionRegistry() {
    return sessionRegistry;
  }

  public OperationManager getOperationManager() {
    return operationManager;
  }

  /**
   * Closes every session, then stops the worker threads.
   */
  @Override
  public synchronized void close() throws Exception {
    if (closed) {
      return;
    }
    closed = true;
    if (idleChecker != null && !MoreExecutors.shutdownAndAwaitTermination(idleChecker, 1, TimeUnit.SECONDS)) {
      logger.error("Idle session checker could not terminate.");
    }
    AutoCloseables.close(sessionRegistry, operationManager);
    logger.info("Server closed.");
  }
}
