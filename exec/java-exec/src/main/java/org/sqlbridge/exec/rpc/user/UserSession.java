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

import java.nio.file.Path;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.sqlbridge.exec.server.options.SessionOptionManager;
import org.sqlbridge.exec.server.options.SystemOptionManager;
import org.sqlbridge.exec.work.operation.OperationHandle;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

/**
 * State of one session: options, current database, temporary views and functions, open
 * operations and on-disk resources.
 */
public class UserSession implements AutoCloseable {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(UserSession.class);

  private final String sessionId;
  private String userName;
  private final long creationTime = System.currentTimeMillis();
  private SessionOptionManager sessionOptions;
  private SessionResources resources;
  private final AtomicReference<String> currentDatabase = new AtomicReference<>();
  private final ConcurrentMap<String, TemporaryView> temporaryViews = Maps.newConcurrentMap();
  private final ConcurrentMap<String, TemporaryFunction> temporaryFunctions = Maps.newConcurrentMap();
  // open operations, mapped to the handle they were submitted through
  private final ConcurrentMap<OperationHandle, SessionHandle> operations = Maps.newConcurrentMap();
  private final AtomicBoolean closed = new AtomicBoolean();

  public static class Builder {
    private final UserSession userSession;
    private SystemOptionManager systemOptions;
    private Path operationLogDir;
    private Path scratchDir;
    private Map<String, String> properties = ImmutableMap.of();

    public static Builder newBuilder() {
      return new Builder();
    }

    public Builder withUserName(String userName) {
      userSession.userName = userName;
      return this;
    }

    public Builder withOptionManager(SystemOptionManager systemOptions) {
      this.systemOptions = systemOptions;
      return this;
    }

    public Builder withDefaultDatabase(String database) {
      userSession.currentDatabase.set(database);
      return this;
    }

    public Builder withResourceDirectories(Path operationLogDir, Path scratchDir) {
      this.operationLogDir = operationLogDir;
      this.scratchDir = scratchDir;
      return this;
    }

    public Builder withUserProperties(Map<String, String> properties) {
      this.properties = properties == null ? ImmutableMap.<String, String>of() : properties;
      return this;
    }

    /**
     * Creates the session, allocates its resources and applies the user properties. Nothing is
     * left behind if any of these steps fails.
     */
    public UserSession build() {
      Preconditions.checkState(systemOptions != null, "system options are required");
      Preconditions.checkState(operationLogDir != null && scratchDir != null, "resource directories are required");
      userSession.sessionOptions = new SessionOptionManager(systemOptions);
      userSession.resources = SessionResources.create(userSession.sessionId, operationLogDir, scratchDir);
      try {
        SessionProperties.apply(userSession, properties);
      } catch (RuntimeException e) {
        userSession.close();
        throw e;
      }
      return userSession;
    }

    Builder() {
      userSession = new UserSession();
    }
  }

  private UserSession() {
    this.sessionId = UUID.randomUUID().toString();
  }

  public String getSessionId() {
    return sessionId;
  }

  public String getUserName() {
    return userName;
  }

  public long getCreationTime() {
    return creationTime;
  }

  public SessionOptionManager getOptions() {
    return sessionOptions;
  }

  public String getCurrentDatabase() {
    return currentDatabase.get();
  }

  public void setCurrentDatabase(String database) {
    currentDatabase.set(Preconditions.checkNotNull(database));
  }

  public ConcurrentMap<String, TemporaryView> getTemporaryViews() {
    return temporaryViews;
  }

  public ConcurrentMap<String, TemporaryFunction> getTemporaryFunctions() {
    return temporaryFunctions;
  }

  /**
   * @return open operations of this session, mapped to the handle each was submitted through
   */
  public ConcurrentMap<OperationHandle, SessionHandle> getOperations() {
    return operations;
  }

  public SessionResources getResources() {
    return resources;
  }

  public boolean isClosed() {
    return closed.get();
  }

  /**
   * Drops temporary objects and releases the session resources. Operations must have been closed
   * before. Idempotent.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    temporaryViews.clear();
    temporaryFunctions.clear();
    if (resources != null) {
      resources.close();
    }
    logger.debug("Session {} closed.", sessionId);
  }

  @Override
  public String toString() {
    return "UserSession [" + sessionId + ", user=" + userName + "]";
  }
}
