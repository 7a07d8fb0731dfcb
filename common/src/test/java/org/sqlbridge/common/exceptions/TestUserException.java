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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.io.IOException;

import org.junit.Test;

/**
 * Test various use cases around creating user exceptions.
 */
public class TestUserException {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(TestUserException.class);

  @Test
  public void messageIsFormatted() {
    final UserException uex = UserException.invalidHandleError()
        .message("Invalid SessionHandle: %s", "abc")
        .build(logger);

    assertEquals(ErrorType.INVALID_HANDLE, uex.getErrorType());
    assertEquals("Invalid SessionHandle: abc", uex.getOriginalMessage());
    assertTrue(uex.getMessage().startsWith("INVALID HANDLE ERROR: Invalid SessionHandle: abc"));
    assertTrue(uex.getMessage().endsWith("[Error Id: " + uex.getErrorId() + "]"));
  }

  @Test
  public void causeMessageIsUsedByDefault() {
    final IOException cause = new IOException("disk full");
    final UserException uex = UserException.resourceError(cause).build(logger);

    assertEquals("disk full", uex.getOriginalMessage());
    assertSame(cause, uex.getCause());
  }

  @Test
  public void causeWithoutMessage() {
    final UserException uex = UserException.engineError(new IllegalStateException()).build(logger);
    assertEquals("IllegalStateException", uex.getOriginalMessage());
  }

  @Test
  public void userExceptionIsNotWrapped() {
    final UserException original = UserException.cancelledError()
        .message("cancelled")
        .build(logger);
    final UserException wrapped = UserException.engineError(original)
        .message("ignored")
        .build(logger);

    assertSame(original, wrapped);
    assertEquals(ErrorType.CANCELLED, wrapped.getErrorType());
  }

  @Test
  public void contextIsAppended() {
    final UserException uex = UserException.validationError()
        .message("bad value")
        .addContext("Option:", "a.b")
        .addContext("plain line")
        .build(logger);

    assertEquals(2, uex.getContext().size());
    assertTrue(uex.getMessage().contains("\nOption: a.b\nplain line\n"));
  }

  @Test
  public void errorIdsAreUnique() {
    final UserException first = UserException.stateConflictError().message("x").build(logger);
    final UserException second = UserException.stateConflictError().message("x").build(logger);
    assertNotEquals(first.getErrorId(), second.getErrorId());
  }

  @Test
  public void displayName() {
    assertEquals("IMMUTABLE CONFIG", ErrorType.IMMUTABLE_CONFIG.getDisplayName());
  }
}
