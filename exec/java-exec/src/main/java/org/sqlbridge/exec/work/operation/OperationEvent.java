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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One line of a session operation log file.
 */
@JsonInclude(Include.NON_NULL)
public class OperationEvent {

  private final long timestamp;
  private final String operationId;
  private final OperationState state;
  private final String message;

  @JsonCreator
  public OperationEvent(@JsonProperty("timestamp") long timestamp,
                        @JsonProperty("operationId") String operationId,
                        @JsonProperty("state") OperationState state,
                        @JsonProperty("message") String message) {
    this.timestamp = timestamp;
    this.operationId = operationId;
    this.state = state;
    this.message = message;
  }

  @JsonProperty("timestamp")
  public long getTimestamp() {
    return timestamp;
  }

  @JsonProperty("operationId")
  public String getOperationId() {
    return operationId;
  }

  @JsonProperty("state")
  public OperationState getState() {
    return state;
  }

  @JsonProperty("message")
  public String getMessage() {
    return message;
  }
}
