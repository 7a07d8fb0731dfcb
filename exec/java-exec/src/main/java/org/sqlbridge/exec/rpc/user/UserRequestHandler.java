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

import org.sqlbridge.common.exceptions.UserException;
import org.sqlbridge.exec.rpc.user.UserRequests.ExecuteStatementRequest;
import org.sqlbridge.exec.rpc.user.UserRequests.FetchResultsRequest;
import org.sqlbridge.exec.rpc.user.UserRequests.GetInfoRequest;
import org.sqlbridge.exec.rpc.user.UserRequests.OpenSessionRequest;
import org.sqlbridge.exec.work.operation.OperationHandle;

/**
 * Dispatches decoded requests to the {@link UserService}. The transport decodes the body according
 * to the rpc type and encodes the returned {@link Response}.
 */
public class UserRequestHandler {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(UserRequestHandler.class);

  private final UserService service;

  public UserRequestHandler(UserService service) {
    this.service = service;
  }

  public Response handle(RpcType rpcType, Object body) {
    switch (rpcType) {

    case OPEN_SESSION: {
      final OpenSessionRequest request = decode(body, OpenSessionRequest.class);
      final SessionHandle handle = service.openSession(request.getUserName(), request.getProperties());
      logger.debug("New session created: {}", handle);
      return new Response(RpcType.SESSION_HANDLE, handle);
    }

    case CLOSE_SESSION:
      service.closeSession(decode(body, SessionHandle.class));
      return new Response(RpcType.ACK, Response.OK);

    case EXECUTE_STATEMENT: {
      final ExecuteStatementRequest request = decode(body, ExecuteStatementRequest.class);
      logger.debug("Received statement on session: {}", request.getSessionHandle());
      final OperationHandle handle = service.executeStatement(request.getSessionHandle(), request.getStatement(),
          request.getConfOverlay(), request.isRunAsync());
      return new Response(RpcType.OPERATION_HANDLE, handle);
    }

    case GET_OPERATION_STATUS:
      return new Response(RpcType.OPERATION_STATUS,
          service.getOperationStatus(decode(body, OperationHandle.class)));

    case CANCEL_OPERATION:
      service.cancelOperation(decode(body, OperationHandle.class));
      return new Response(RpcType.ACK, Response.OK);

    case CLOSE_OPERATION:
      service.closeOperation(decode(body, OperationHandle.class));
      return new Response(RpcType.ACK, Response.OK);

    case FETCH_RESULTS: {
      final FetchResultsRequest request = decode(body, FetchResultsRequest.class);
      return new Response(RpcType.ROW_WINDOW, service.fetchResults(request.getOperationHandle(),
          request.getOrientation(), request.getMaxRows(), request.getFetchType()));
    }

    case GET_RESULT_SET_METADATA:
      return new Response(RpcType.RESULT_SET_METADATA,
          service.getResultSetMetadata(decode(body, OperationHandle.class)));

    case GET_INFO: {
      final GetInfoRequest request = decode(body, GetInfoRequest.class);
      return new Response(RpcType.INFO_VALUE, service.getInfo(request.getSessionHandle(), request.getInfoType()));
    }

    default:
      throw new UnsupportedOperationException(
          String.format("UserRequestHandler received rpc of unknown type. Type was %s.", rpcType));
    }
  }

  private static <T> T decode(Object body, Class<T> clazz) {
    if (!clazz.isInstance(body)) {
      throw UserException.validationError()
          .message("Failure while decoding %s body.", clazz.getSimpleName())
          .addContext("Received:", body == null ? "null" : body.getClass().getName())
          .build(logger);
    }
    return clazz.cast(body);
  }
}
