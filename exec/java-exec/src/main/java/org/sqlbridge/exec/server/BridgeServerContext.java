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
package org.sqlbridge.exec.server;

import org.sqlbridge.common.config.BridgeConfig;
import org.sqlbridge.exec.engine.QueryEngine;
import org.sqlbridge.exec.server.options.SystemOptionManager;

import com.google.common.base.Preconditions;

/**
 * Process wide collaborators shared by every session and operation.
 */
public class BridgeServerContext {

  private final BridgeConfig config;
  private final SystemOptionManager systemOptions;
  private final QueryEngine engine;

  public BridgeServerContext(BridgeConfig config, QueryEngine engine) {
    this.config = Preconditions.checkNotNull(config);
    this.engine = Preconditions.checkNotNull(engine);
    this.systemOptions = new SystemOptionManager(config);
  }

  public BridgeConfig getConfig() {
    return config;
  }

  public SystemOptionManager getOptionManager() {
    return systemOptions;
  }

  public QueryEngine getEngine() {
    return engine;
  }
}
