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

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Appends the operation events of one session to its log file, one JSON document per line.
 */
public class OperationLogWriter implements AutoCloseable {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(OperationLogWriter.class);

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final Path file;
  private BufferedWriter writer;

  /**
   * Opens the file for appending, creating it if needed.
   */
  public OperationLogWriter(Path file) throws IOException {
    this.file = file;
    this.writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
  }

  public Path getFile() {
    return file;
  }

  /**
   * Writes one event. A write failure is logged and does not affect the operation.
   */
  public synchronized void write(OperationEvent event) {
    if (writer == null) {
      return;
    }
    try {
      writer.write(MAPPER.writeValueAsString(event));
      writer.newLine();
      writer.flush();
    } catch (IOException e) {
      logger.warn("Failure while writing operation log {}.", file, e);
    }
  }

  @Override
  public synchronized void close() throws IOException {
    if (writer != null) {
      writer.close();
      writer = null;
    }
  }
}
