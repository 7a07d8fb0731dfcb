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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Before;
import org.junit.Test;
import org.sqlbridge.common.exceptions.ErrorType;
import org.sqlbridge.common.exceptions.UserException;
import org.sqlbridge.exec.cursor.FetchOrientation;
import org.sqlbridge.exec.cursor.FetchType;
import org.sqlbridge.exec.cursor.RowWindow;
import org.sqlbridge.exec.record.ResultSchema;
import org.sqlbridge.exec.record.Row;
import org.sqlbridge.exec.rpc.user.UserRequests.ExecuteStatementRequest;
import org.sqlbridge.exec.rpc.user.UserRequests.FetchResultsRequest;
import org.sqlbridge.exec.rpc.user.UserRequests.GetInfoRequest;
import org.sqlbridge.exec.rpc.user.UserRequests.OpenSessionRequest;
import org.sqlbridge.exec.work.operation.OperationHandle;
import org.sqlbridge.exec.work.operation.OperationState;
import org.sqlbridge.exec.work.operation.OperationStatus;
import org.sqlbridge.test.BaseTestQuery;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

public class TestUserRequestHandler extends BaseTestQuery {

  private UserRequestHandler handler;

  @Before
  public void setUpHandler() {
    handler = server.getRequestHandler();
  }

  @Test
  public void fullConversation() {
    Response response = handler.handle(RpcType.OPEN_SESSION,
        new OpenSessionRequest("testUser", ImmutableMap.<String, String>of()));
    assertEquals(RpcType.SESSION_HANDLE, response.getRpcType());
    final SessionHandle session = (SessionHandle) response.getBody();

    response = handler.handle(RpcType.GET_INFO, new GetInfoRequest(session, GetInfoType.DBMS_NAME));
    assertEquals(RpcType.INFO_VALUE, response.getRpcType());
    assertEquals("SQL Bridge", response.getBody());

    response = handler.handle(RpcType.EXECUTE_STATEMENT, new ExecuteStatementRequest(session,
        "select * from range(10)", ImmutableMap.<String, String>of(), false));
    assertEquals(RpcType.OPERATION_HANDLE, response.getRpcType());
    final OperationHandle operation = (OperationHandle) response.getBody();

    response = handler.handle(RpcType.GET_OPERATION_STATUS, operation);
    assertEquals(RpcType.OPERATION_STATUS, response.getRpcType());
    assertEquals(OperationState.FINISHED, ((OperationStatus) response.getBody()).getState());

    response = handler.handle(RpcType.GET_RESULT_SET_METADATA, operation);
    assertEquals(RpcType.RESULT_SET_METADATA, response.getRpcType());
    assertEquals(1, ((ResultSchema) response.getBody()).getColumnCount());

    response = handler.handle(RpcType.FETCH_RESULTS,
        new FetchResultsRequest(operation, FetchOrientation.NEXT, 3, FetchType.QUERY_OUTPUT));
    assertEquals(RpcType.ROW_WINDOW, response.getRpcType());
    final RowWindow window = (RowWindow) response.getBody();
    assertEquals(0, window.getStartOffset());
    assertEquals(ImmutableList.of(Row.of(0L), Row.of(1L), Row.of(2L)), window.getRows());

    response = handler.handle(RpcType.CANCEL_OPERATION, operation);
    assertEquals(RpcType.ACK, response.getRpcType());
    response = handler.handle(RpcType.CLOSE_OPERATION, operation);
    assertEquals(RpcType.ACK, response.getRpcType());
    assertSame(Response.OK, response.getBody());

    response = handler.handle(RpcType.CLOSE_SESSION, session);
    assertEquals(RpcType.ACK, response.getRpcType());
  }

  @Test
  public void wrongBodyIsRejected() {
    final UserException e = expectError(ErrorType.VALIDATION, new Runnable() {
      @Override
      public void run() {
        handler.handle(RpcType.CLOSE_SESSION, "not a handle");
      }
    });
    assertTrue(e.getMessage().contains("Failure while decoding SessionHandle body."));
    expectError(ErrorType.VALIDATION, new Runnable() {
      @Override
      public void run() {
        handler.handle(RpcType.GET_OPERATION_STATUS, null);
      }
    });
  }

  @Test
  public void serviceErrorsPropagate() {
    expectError(ErrorType.INVALID_HANDLE, new Runnable() {
      @Override
      public void run() {
        handler.handle(RpcType.CLOSE_SESSION, SessionHandle.newHandle());
      }
    });
  }

  @Test
  public void responseTypesAreNotRequests() {
    try {
      handler.handle(RpcType.ROW_WINDOW, null);
      fail();
    } catch (UnsupportedOperationException e) {
      assertTrue(e.getMessage().contains("ROW_WINDOW"));
    }
  }
}
