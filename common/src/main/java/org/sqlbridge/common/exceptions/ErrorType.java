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
package org.sqlbridge.common.exceptions;

/**
 * Categories of errors reported back to clients through {@link UserException}.
 */
public enum ErrorType {

  /**
   * Unknown or already closed session or operation handle.
   */
  INVALID_HANDLE,

  /**
   * Attempt to change a configuration key that is fixed at process start.
   */
  IMMUTABLE_CONFIG,

  /**
   * Failure surfaced by the query engine while planning or producing rows.
   */
  ENGINE,

  /**
   * The operation was cancelled before it could complete.
   */
  CANCELLED,

  /**
   * The requested transition conflicts with the current operation state.
   */
  STATE_CONFLICT,

  /**
   * Malformed request: bad arguments, ill-typed option values, unknown objects.
   */
  VALIDATION,

  /**
   * Session scoped resources (files, directories) could not be allocated.
   */
  RESOURCE,

  /**
   * Unexpected internal failure.
   */
  SYSTEM;

  public String getDisplayName() {
    return name().replace('_', ' ');
  }
}
