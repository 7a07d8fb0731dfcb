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
package org.sqlbridge.exec.rpc.user;

import java.util.Map;

import org.sqlbridge.exec.cursor.FetchOrientation;
import org.sqlbridge.exec.cursor.FetchType;
import org.sqlbridge.exec.cursor.RowWindow;
import org.sqlbridge.exec.record.ResultSchema;
import org.sqlbridge.exec.work.operation.OperationHandle;
import org.sqlbridge.exec.work.operation.OperationStatus;

/**
 * Calls a client can make. Every failure is reported as a
 * {@link org.sqlbridge.common.exceptions.UserException}.
 */
public interface UserService {

  SessionHandle openSession(String userName, Map<String, String> properties);

  void closeSession(SessionHandle sessionHandle);

  /**
   * @param confOverlay options for this statement only
   * @param runAsync whether to return as soon as the statement started
   */
  OperationHandle executeStatement(SessionHandle sessionHandle, String statement,
                                   Map<String, String> confOverlay, boolean runAsync);

  OperationStatus getOperationStatus(OperationHandle operationHandle);

  void cancelOperation(OperationHandle operationHandle);

  void closeOperation(OperationHandle operationHandle);

  RowWindow fetchResults(OperationHandle operationHandle, FetchOrientation orientation, long maxRows,
                         FetchType fetchType);

  ResultSchema getResultSetMetadata(OperationHandle operationHandle);

  String getInfo(SessionHandle sessionHandle, GetInfoType infoType);
}
