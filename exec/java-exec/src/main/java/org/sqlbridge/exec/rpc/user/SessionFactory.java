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
import java.nio.file.Paths;
import java.util.Map;

import org.sqlbridge.common.exceptions.BridgeRuntimeException;
import org.sqlbridge.exec.ExecConstants;
import org.sqlbridge.exec.server.BridgeServerContext;
import org.sqlbridge.exec.server.options.SystemOptionManager;

/**
 * Creates sessions. Prepares the directories holding session files when constructed.
 */
public class SessionFactory {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(SessionFactory.class);

  private final SystemOptionManager systemOptions;
  private final Path operationLogDir;
  private final Path scratchDir;

  public SessionFactory(BridgeServerContext context) {
    this.systemOptions = context.getOptionManager();
    this.operationLogDir = createDirectory(systemOptions.getOption(ExecConstants.OPERATION_LOG_DIR));
    logger.info("Operation log root directory is created: {}", operationLogDir);
    this.scratchDir = createDirectory(systemOptions.getOption(ExecConstants.SCRATCH_DIR));
  }

  public UserSession newSession(String userName, Map<String, String> properties) {
    return UserSession.Builder.newBuilder()
        .withUserName(userName)
        .withOptionManager(systemOptions)
        .withDefaultDatabase(systemOptions.getOption(ExecConstants.DEFAULT_DATABASE))
        .withResourceDirectories(operationLogDir, scratchDir)
        .withUserProperties(properties)
        .build();
  }

  public Path getOperationLogDir() {
    return operationLogDir;
  }

  public Path getScratchDir() {
    return scratchDir;
  }

  private static Path createDirectory(String location) {
    final Path dir = Paths.get(location).toAbsolutePath();
    try {
      return Files.createDirectories(dir);
    } catch (IOException e) {
      throw new BridgeRuntimeException("Failure while creating directory " + dir, e);
    }
  }
}
