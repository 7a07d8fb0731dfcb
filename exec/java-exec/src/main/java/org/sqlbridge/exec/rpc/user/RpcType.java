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

public enum RpcType {
  ACK,

  // client to server
  OPEN_SESSION,
  CLOSE_SESSION,
  EXECUTE_STATEMENT,
  GET_OPERATION_STATUS,
  CANCEL_OPERATION,
  CLOSE_OPERATION,
  FETCH_RESULTS,
  GET_RESULT_SET_METADATA,
  GET_INFO,

  // server to client
  SESSION_HANDLE,
  OPERATION_HANDLE,
  OPERATION_STATUS,
  ROW_WINDOW,
  RESULT_SET_METADATA,
  INFO_VALUE
}
