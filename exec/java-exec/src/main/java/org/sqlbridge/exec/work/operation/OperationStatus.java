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

import org.sqlbridge.common.exceptions.UserException;

/**
 * State of an operation at the time it was polled, with the failure of an ERROR or CANCELED
 * operation.
 */
public class OperationStatus {

  private final OperationState state;
  private final UserException errorDetail;

  public OperationStatus(OperationState state, UserException errorDetail) {
    this.state = state;
    this.errorDetail = errorDetail;
  }

  public OperationState getState() {
    return state;
  }

  /**
   * @return the failure, null unless the operation failed or was cancelled
   */
  public UserException getErrorDetail() {
    return errorDetail;
  }

  @Override
  public String toString() {
    return errorDetail == null ? state.name() : state + ": " + errorDetail.getOriginalMessage();
  }
}
