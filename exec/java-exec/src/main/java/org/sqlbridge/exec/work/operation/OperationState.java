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

/**
 * Lifecycle of an operation. {@code INITIALIZED -> RUNNING -> FINISHED | ERROR | CANCELED}, and
 * {@code CLOSED} from any state. Nothing leaves {@code CLOSED}.
 */
public enum OperationState {
  INITIALIZED,
  RUNNING,
  FINISHED,
  ERROR,
  CANCELED,
  CLOSED;

  /**
   * @return true once the engine has nothing left to do for the operation
   */
  public boolean isTerminal() {
    return this != INITIALIZED && this != RUNNING;
  }
}
