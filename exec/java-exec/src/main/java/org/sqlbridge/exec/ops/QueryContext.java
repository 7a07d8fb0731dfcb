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
package org.sqlbridge.exec.ops;

import java.util.Map;

import org.sqlbridge.common.config.BridgeConfig;
import org.sqlbridge.exec.engine.CancellationSignal;
import org.sqlbridge.exec.rpc.user.TemporaryFunction;
import org.sqlbridge.exec.rpc.user.TemporaryView;
import org.sqlbridge.exec.rpc.user.UserSession;
import org.sqlbridge.exec.server.BridgeServerContext;
import org.sqlbridge.exec.server.options.OptionManager;
import org.sqlbridge.exec.server.options.QueryOptionManager;
import org.sqlbridge.exec.server.options.SessionOptionManager;
import org.sqlbridge.exec.work.operation.OperationHandle;

/**
 * Everything one statement execution may look at: the statement, the options snapshot taken at
 * submission, the session it runs in and its cancellation signal.
 */
public class QueryContext {

  private final OperationHandle operationHandle;
  private final UserSession session;
  private final QueryOptionManager queryOptions;
  private final String statement;
  private final CancellationSignal cancellationSignal;
  private final BridgeServerContext serverContext;

  public QueryContext(OperationHandle operationHandle, UserSession session, QueryOptionManager queryOptions,
                      String statement, CancellationSignal cancellationSignal, BridgeServerContext serverContext) {
    this.operationHandle = operationHandle;
    this.session = session;
    this.queryOptions = queryOptions;
    this.statement = statement;
    this.cancellationSignal = cancellationSignal;
    this.serverContext = serverContext;
  }

  public OperationHandle getOperationHandle() {
    return operationHandle;
  }

  public UserSession getSession() {
    return session;
  }

  /**
   * @return the statement text, variables already substituted
   */
  public String getStatement() {
    return statement;
  }

  public OptionManager getOptions() {
    return queryOptions;
  }

  public SessionOptionManager getSessionOptions() {
    return session.getOptions();
  }

  public CancellationSignal getCancellationSignal() {
    return cancellationSignal;
  }

  public String getCurrentDatabase() {
    return session.getCurrentDatabase();
  }

  public Map<String, TemporaryView> getTemporaryViews() {
    return session.getTemporaryViews();
  }

  public Map<String, TemporaryFunction> getTemporaryFunctions() {
    return session.getTemporaryFunctions();
  }

  public BridgeConfig getConfig() {
    return serverContext.getConfig();
  }

  public BridgeServerContext getServerContext() {
    return serverContext;
  }
}
