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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentMap;

import org.sqlbridge.common.exceptions.UserException;
import org.sqlbridge.exec.work.operation.OperationHandle;
import org.sqlbridge.exec.work.operation.OperationManager;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

/**
 * Maps session handles to sessions.
 *
 * <p>In multi session mode every open call creates a session of its own. In single session mode
 * every handle aliases the shared session given at construction, which lives until the registry
 * closes; closing a handle then only closes the operations submitted through it.</p>
 *
 * <p>Lookups are lock free. Opening and closing handles is serialized.</p>
 */
public class SessionRegistry implements AutoCloseable {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(SessionRegistry.class);

  private final SessionFactory sessionFactory;
  private final OperationManager operationManager;
  private final UserSession sharedSession;
  private final long closeTimeoutMillis;
  private final ConcurrentMap<SessionHandle, UserSession> sessions = Maps.newConcurrentMap();
  private final ConcurrentMap<SessionHandle, Long> lastAccessTimes = Maps.newConcurrentMap();

  /**
   * @param sharedSession the session every handle aliases, null for multi session mode
   * @param closeTimeoutMillis how long closing a session waits for its running statements
   */
  public SessionRegistry(SessionFactory sessionFactory, OperationManager operationManager,
                         UserSession sharedSession, long closeTimeoutMillis) {
    this.sessionFactory = sessionFactory;
    this.operationManager = operationManager;
    this.sharedSession = sharedSession;
    this.closeTimeoutMillis = closeTimeoutMillis;
  }

  public boolean isSingleSession() {
    return sharedSession != null;
  }

  /**
   * @throws UserException resource error if the session files can not be created, immutable
   *     config error if a property targets a static option
   */
  public synchronized SessionHandle openSession(String userName, Map<String, String> properties) {
    final SessionHandle handle;
    final UserSession session;
    if (sharedSession == null) {
      session = sessionFactory.newSession(userName, properties);
      handle = new SessionHandle(UUID.fromString(session.getSessionId()));
    } else {
      SessionProperties.apply(sharedSession, properties);
      session = sharedSession;
      handle = SessionHandle.newHandle();
    }
    sessions.put(handle, session);
    touch(handle);
    logger.debug("New session handle {} for user {} on session {}.", handle, userName, session.getSessionId());
    return handle;
  }

  /**
   * Closes a handle. In multi session mode its operations are closed and the session is released,
   * in single session mode only the operations submitted through the handle are closed.
   *
   * @throws UserException invalid handle error if the handle is unknown or already closed
   */
  public void closeSession(SessionHandle handle) {
    final UserSession session;
    synchronized (this) {
      session = sessions.remove(handle);
      lastAccessTimes.remove(handle);
    }
    if (session == null) {
      throw invalidHandle(handle);
    }
    if (session == sharedSession) {
      operationManager.closeOperations(getOperations(session, handle), closeTimeoutMillis);
      logger.debug("Session handle {} detached from shared session.", handle);
    } else {
      operationManager.closeOperations(session.getOperations().keySet(), closeTimeoutMillis);
      session.close();
      // statements submitted while the session was closing
      operationManager.closeOperations(session.getOperations().keySet(), 0);
      logger.debug("Session {} closed.", handle);
    }
  }

  /**
   * @throws UserException invalid handle error if the handle is unknown or closed
   */
  public UserSession getSession(SessionHandle handle) {
    final UserSession session = handle == null ? null : sessions.get(handle);
    if (session == null) {
      throw invalidHandle(handle);
    }
    return session;
  }

  /**
   * Records activity on a handle, idle expiry starts over.
   */
  public void touch(SessionHandle handle) {
    if (handle != null && sessions.containsKey(handle)) {
      lastAccessTimes.put(handle, System.currentTimeMillis());
    }
  }

  /**
   * Closes handles without activity for longer than {@code idleTimeoutMillis} and no running
   * operation.
   *
   * @return the number of handles closed
   */
  public int closeIdleSessions(long idleTimeoutMillis) {
    final long threshold = System.currentTimeMillis() - idleTimeoutMillis;
    int closed = 0;
    for (Map.Entry<SessionHandle, Long> entry : ImmutableList.copyOf(lastAccessTimes.entrySet())) {
      final SessionHandle handle = entry.getKey();
      if (entry.getValue() > threshold) {
        continue;
      }
      final UserSession session = sessions.get(handle);
      if (session == null || operationManager.isAnyRunning(getOperations(session, handle))) {
        continue;
      }
      logger.info("Closing session {} after being idle for more than {} ms.", handle, idleTimeoutMillis);
      try {
        closeSession(handle);
        closed++;
      } catch (UserException e) {
        logger.debug("Session {} was closed concurrently.", handle);
      }
    }
    return closed;
  }

  public int getSessionCount() {
    return sessions.size();
  }

  /**
   * Closes every handle, then the shared session if any.
   */
  @Override
  public void close() {
    for (SessionHandle handle : ImmutableList.copyOf(sessions.keySet())) {
      try {
        closeSession(handle);
      } catch (UserException e) {
        logger.debug("Session {} was closed concurrently.", handle);
      }
    }
    if (sharedSession != null) {
      operationManager.closeOperations(sharedSession.getOperations().keySet(), closeTimeoutMillis);
      sharedSession.close();
    }
  }

  private static List<OperationHandle> getOperations(UserSession session, SessionHandle handle) {
    final List<OperationHandle> handles = new ArrayList<>();
    for (Map.Entry<OperationHandle, SessionHandle> entry : session.getOperations().entrySet()) {
      if (entry.getValue().equals(handle)) {
        handles.add(entry.getKey());
      }
    }
    return handles;
  }

  private static UserException invalidHandle(SessionHandle handle) {
    return UserException.invalidHandleError()
        .message("Invalid SessionHandle: %s", handle)
        .build(logger);
  }
}
