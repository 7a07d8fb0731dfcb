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
package org.sqlbridge.exec.work.user;

import java.util.Map;

import org.sqlbridge.common.exceptions.UserException;
import org.sqlbridge.exec.ExecConstants;
import org.sqlbridge.exec.cursor.FetchOrientation;
import org.sqlbridge.exec.cursor.FetchType;
import org.sqlbridge.exec.cursor.RowWindow;
import org.sqlbridge.exec.record.ResultSchema;
import org.sqlbridge.exec.rpc.user.GetInfoType;
import org.sqlbridge.exec.rpc.user.SessionHandle;
import org.sqlbridge.exec.rpc.user.SessionRegistry;
import org.sqlbridge.exec.rpc.user.UserService;
import org.sqlbridge.exec.rpc.user.UserSession;
import org.sqlbridge.exec.server.options.SystemOptionManager;
import org.sqlbridge.exec.work.operation.OperationHandle;
import org.sqlbridge.exec.work.operation.OperationManager;
import org.sqlbridge.exec.work.operation.OperationStatus;

import com.google.common.collect.ImmutableMap;

/**
 * Implements the client calls on top of the session registry and the operation manager.
 */
public class UserWorker implements UserService {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(UserWorker.class);

  private final SessionRegistry sessionRegistry;
  private final OperationManager operationManager;
  private final SystemOptionManager systemOptions;

  public UserWorker(SessionRegistry sessionRegistry, OperationManager operationManager,
                    SystemOptionManager systemOptions) {
    this.sessionRegistry = sessionRegistry;
    this.operationManager = operationManager;
    this.systemOptions = systemOptions;
  }

  @Override
  public SessionHandle openSession(String userName, Map<String, String> properties) {
    return sessionRegistry.openSession(userName, properties == null ? ImmutableMap.<String, String>of() : properties);
  }

  @Override
  public void closeSession(SessionHandle sessionHandle) {
    sessionRegistry.closeSession(sessionHandle);
  }

  @Override
  public OperationHandle executeStatement(SessionHandle sessionHandle, String statement,
                                          Map<String, String> confOverlay, boolean runAsync) {
    final UserSession session = sessionRegistry.getSession(sessionHandle);
    sessionRegistry.touch(sessionHandle);
    if (statement == null) {
      throw UserException.validationError()
          .message("Statement can not be null.")
          .build(logger);
    }
    final OperationHandle handle = operationManager.submit(session, sessionHandle, statement,
        confOverlay == null ? ImmutableMap.<String, String>of() : confOverlay, runAsync);
    logger.debug("Session {}: submitted operation {}", sessionHandle, handle);
    return handle;
  }

  @Override
  public OperationStatus getOperationStatus(OperationHandle operationHandle) {
    touch(operationHandle);
    return operationManager.getStatus(operationHandle);
  }

  @Override
  public void cancelOperation(OperationHandle operationHandle) {
    touch(operationHandle);
    operationManager.cancel(operationHandle);
  }

  @Override
  public void closeOperation(OperationHandle operationHandle) {
    touch(operationHandle);
    operationManager.close(operationHandle);
  }

  @Override
  public RowWindow fetchResults(OperationHandle operationHandle, FetchOrientation orientation, long maxRows,
                                FetchType fetchType) {
    touch(operationHandle);
    return operationManager.fetch(operationHandle, orientation, maxRows,
        fetchType == null ? FetchType.QUERY_OUTPUT : fetchType);
  }

  @Override
  public ResultSchema getResultSetMetadata(OperationHandle operationHandle) {
    touch(operationHandle);
    return operationManager.getResultSchema(operationHandle);
  }

  @Override
  public String getInfo(SessionHandle sessionHandle, GetInfoType infoType) {
    sessionRegistry.getSession(sessionHandle);
    sessionRegistry.touch(sessionHandle);
    if (infoType == null) {
      throw UserException.validationError()
          .message("An info type is required.")
          .build(logger);
    }
    switch (infoType) {
    case SERVER_NAME:
    case DBMS_NAME:
      return systemOptions.getOption(ExecConstants.SERVER_NAME);
    case DBMS_VERSION:
      return systemOptions.getOption(ExecConstants.SERVER_VERSION);
    default:
      throw UserException.validationError()
          .message("Unsupported info type %s.", infoType)
          .build(logger);
    }
  }

  private void touch(OperationHandle operationHandle) {
    sessionRegistry.touch(operationManager.getSessionHandle(operationHandle));
  }
}
