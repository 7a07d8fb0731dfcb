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

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import org.slf4j.Logger;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Base class for all errors reported back to a client. Instances are created through one of the
 * static builder factories, one per {@link ErrorType}, e.g.:
 *
 * <pre>
 * throw UserException.invalidHandleError()
 *     .message("Invalid SessionHandle: %s", handle)
 *     .build(logger);
 * </pre>
 *
 * <p>{@link Builder#build(Logger)} logs the error together with its id, so the id seen by the
 * client can be matched with the server log.</p>
 */
public class UserException extends BridgeRuntimeException {
  private static final long serialVersionUID = -6720929331624621840L;

  private final ErrorType errorType;
  private final String errorId;
  private final List<String> context;

  public static Builder invalidHandleError() {
    return new Builder(ErrorType.INVALID_HANDLE, null);
  }

  public static Builder immutableConfigError() {
    return new Builder(ErrorType.IMMUTABLE_CONFIG, null);
  }

  /**
   * Wraps a failure surfaced by the query engine. If the cause already is a {@link UserException}
   * the builder returns it unchanged and ignores any message or context added to it.
   *
   * @param cause engine failure, its message is used when no message is set
   */
  public static Builder engineError(Throwable cause) {
    return new Builder(ErrorType.ENGINE, cause);
  }

  public static Builder cancelledError() {
    return new Builder(ErrorType.CANCELLED, null);
  }

  public static Builder stateConflictError() {
    return new Builder(ErrorType.STATE_CONFLICT, null);
  }

  public static Builder validationError() {
    return new Builder(ErrorType.VALIDATION, null);
  }

  public static Builder validationError(Throwable cause) {
    return new Builder(ErrorType.VALIDATION, cause);
  }

  public static Builder resourceError(Throwable cause) {
    return new Builder(ErrorType.RESOURCE, cause);
  }

  public static Builder systemError(Throwable cause) {
    return new Builder(ErrorType.SYSTEM, cause);
  }

  private UserException(Builder builder) {
    super(builder.message, builder.cause);
    this.errorType = builder.errorType;
    this.errorId = UUID.randomUUID().toString();
    this.context = ImmutableList.copyOf(builder.context);
  }

  public ErrorType getErrorType() {
    return errorType;
  }

  public String getErrorId() {
    return errorId;
  }

  public List<String> getContext() {
    return context;
  }

  /**
   * @return the message as it was passed to the builder, without error type, context or id
   */
  public String getOriginalMessage() {
    return super.getMessage();
  }

  @Override
  public String getMessage() {
    final StringBuilder sb = new StringBuilder();
    sb.append(errorType.getDisplayName()).append(" ERROR: ").append(getOriginalMessage());
    for (String line : context) {
      sb.append("\n").append(line);
    }
    sb.append("\n\n[Error Id: ").append(errorId).append("]");
    return sb.toString();
  }

  public static class Builder {
    private final ErrorType errorType;
    private final Throwable cause;
    private final UserException uex;
    private final List<String> context = new ArrayList<>();
    private String message;

    private Builder(ErrorType errorType, Throwable cause) {
      this.errorType = errorType;
      this.cause = cause;
      this.uex = cause instanceof UserException ? (UserException) cause : null;
      if (cause != null && uex == null) {
        this.message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
      }
    }

    public Builder message(String format, Object... args) {
      Preconditions.checkNotNull(format);
      this.message = args.length == 0 ? format : String.format(format, args);
      return this;
    }

    public Builder addContext(String value) {
      context.add(value);
      return this;
    }

    public Builder addContext(String name, Object value) {
      context.add(name + " " + value);
      return this;
    }

    /**
     * Builds the exception and logs it. User caused errors are logged at info level, system errors
     * at error level.
     */
    public UserException build(Logger logger) {
      if (uex != null) {
        return uex;
      }
      final UserException ex = new UserException(this);
      if (errorType == ErrorType.SYSTEM) {
        logger.error("{} ERROR: {} [Error Id: {}]", errorType.getDisplayName(), message, ex.getErrorId(), cause);
      } else {
        logger.info("User Error Occurred: {} ({}) [Error Id: {}]", message, errorType.getDisplayName(),
            ex.getErrorId());
      }
      return ex;
    }
  }
}
