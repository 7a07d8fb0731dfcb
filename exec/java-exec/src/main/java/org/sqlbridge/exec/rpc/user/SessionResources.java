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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

import org.sqlbridge.common.AutoCloseables;
import org.sqlbridge.common.exceptions.UserException;
import org.sqlbridge.exec.work.operation.OperationLogWriter;

/**
 * Class holding the on-disk resources of one session: its operation log file and its pipe file,
 * both named after the session id. This class is responsible for the proper cleanup of those
 * resources, exactly once.
 */
public class SessionResources implements AutoCloseable {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(SessionResources.class);

  private final OperationLogWriter operationLogWriter;
  private final Path pipeFile;
  private final AtomicBoolean closed = new AtomicBoolean();

  private SessionResources(OperationLogWriter operationLogWriter, Path pipeFile) {
    this.operationLogWriter = operationLogWriter;
    this.pipeFile = pipeFile;
  }

  /**
   * Allocates the resources of a new session.
   *
   * @throws UserException resource error if a file can not be created
   */
  public static SessionResources create(String sessionId, Path operationLogDir, Path scratchDir) {
    final Path logFile = operationLogDir.resolve(sessionId + ".log");
    final Path pipeFile = scratchDir.resolve(sessionId + ".pipeout");
    OperationLogWriter writer = null;
    try {
      writer = new OperationLogWriter(logFile);
      Files.createFile(pipeFile);
    } catch (IOException e) {
      AutoCloseables.closeSilently(writer);
      deleteQuietly(logFile);
      throw UserException.resourceError(e)
          .message("Failure while creating the resources of session %s.", sessionId)
          .addContext("Operation log:", logFile)
          .addContext("Pipe file:", pipeFile)
          .build(logger);
    }
    return new SessionResources(writer, pipeFile);
  }

  public OperationLogWriter getOperationLogWriter() {
    return operationLogWriter;
  }

  public Path getOperationLogFile() {
    return operationLogWriter.getFile();
  }

  public Path getPipeFile() {
    return pipeFile;
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    try {
      AutoCloseables.close(operationLogWriter);
    } catch (Exception ex) {
      logger.error("Failure while closing the session resources", ex);
    }
    deleteQuietly(operationLogWriter.getFile());
    deleteQuietly(pipeFile);
  }

  private static void deleteQuietly(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      logger.warn("Failure while deleting {}", file, e);
    }
  }
}
