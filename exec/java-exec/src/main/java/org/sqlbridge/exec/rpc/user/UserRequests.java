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
import org.sqlbridge.exec.work.operation.OperationHandle;

import com.google.common.collect.ImmutableMap;

/**
 * Request bodies of the calls that take more than a handle.
 */
public final class UserRequests {

  private UserRequests() {
  }

  public static class OpenSessionRequest {
    private final String userName;
    private final Map<String, String> properties;

    public OpenSessionRequest(String userName, Map<String, String> properties) {
      this.userName = userName;
      this.properties = properties == null ? ImmutableMap.<String, String>of() : ImmutableMap.copyOf(properties);
    }

    public String getUserName() {
      return userName;
    }

    public Map<String, String> getProperties() {
      return properties;
    }
  }

  public static class ExecuteStatementRequest {
    private final SessionHandle sessionHandle;
    private final String statement;
    private final Map<String, String> confOverlay;
    private final boolean runAsync;

    public ExecuteStatementRequest(SessionHandle sessionHandle, String statement,
                                   Map<String, String> confOverlay, boolean runAsync) {
      this.sessionHandle = sessionHandle;
      this.statement = statement;
      this.confOverlay = confOverlay == null ? ImmutableMap.<String, String>of() : ImmutableMap.copyOf(confOverlay);
      this.runAsync = runAsync;
    }

    public SessionHandle getSessionHandle() {
      return sessionHandle;
    }

    public String getStatement() {
      return statement;
    }

    public Map<String, String> getConfOverlay() {
      return confOverlay;
    }

    public boolean isRunAsync() {
      return runAsync;
    }
  }

  public static class FetchResultsRequest {
    private final OperationHandle operationHandle;
    private final FetchOrientation orientation;
    private final long maxRows;
    private final FetchType fetchType;

    public FetchResultsRequest(OperationHandle operationHandle, FetchOrientation orientation, long maxRows,
                               FetchType fetchType) {
      this.operationHandle = operationHandle;
      this.orientation = orientation;
      this.maxRows = maxRows;
      this.fetchType = fetchType;
    }

    public OperationHandle getOperationHandle() {
      return operationHandle;
    }

    public FetchOrientation getOrientation() {
      return orientation;
    }

    public long getMaxRows() {
      return maxRows;
    }

    public FetchType getFetchType() {
      return fetchType;
    }
  }

  public static class GetInfoRequest {
    private final SessionHandle sessionHandle;
    private final GetInfoType infoType;

    public GetInfoRequest(SessionHandle sessionHandle, GetInfoType infoType) {
      this.sessionHandle = sessionHandle;
      this.infoType = infoType;
    }

    public SessionHandle getSessionHandle() {
      return sessionHandle;
    }

    public GetInfoType getInfoType() {
      return infoType;
    }
  }
}
