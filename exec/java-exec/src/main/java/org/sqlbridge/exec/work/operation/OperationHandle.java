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

import java.util.UUID;

import com.google.common.base.Preconditions;

/**
 * Opaque, server wide unique identifier of an operation. Never reused.
 */
public final class OperationHandle {

  private final UUID id;

  public OperationHandle(UUID id) {
    this.id = Preconditions.checkNotNull(id);
  }

  public static OperationHandle newHandle() {
    return new OperationHandle(UUID.randomUUID());
  }

  public UUID getId() {
    return id;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof OperationHandle && id.equals(((OperationHandle) o).id);
  }

  @Override
  public int hashCode() {
    return id.hashCode();
  }

  @Override
  public String toString() {
    return id.toString();
  }
}
