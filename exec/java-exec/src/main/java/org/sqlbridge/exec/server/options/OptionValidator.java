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
package org.sqlbridge.exec.server.options;

import org.sqlbridge.common.config.BridgeConfig;
import org.sqlbridge.exec.server.options.OptionValue.Kind;
import org.sqlbridge.exec.server.options.OptionValue.OptionType;

/**
 * Validates and describes one declared option. The default value is read from the process
 * configuration under the option name.
 */
public abstract class OptionValidator {

  private final String optionName;
  private final String description;
  private final boolean isStatic;

  protected OptionValidator(String optionName, String description, boolean isStatic) {
    this.optionName = optionName;
    this.description = description;
    this.isStatic = isStatic;
  }

  public String getOptionName() {
    return optionName;
  }

  public String getDescription() {
    return description;
  }

  /**
   * Static options are fixed at process start; every attempt to change them at run time fails.
   */
  public boolean isStatic() {
    return isStatic;
  }

  public abstract Kind getKind();

  /**
   * Parses a textual value, typically coming from a {@code SET} statement or a session property.
   *
   * @throws org.sqlbridge.common.exceptions.UserException validation error if the value does not
   *     fit this option
   */
  public abstract OptionValue parse(OptionType type, String value);

  /**
   * @return the value configured for this option at process start
   */
  public OptionValue loadDefault(BridgeConfig config) {
    return parse(OptionType.SYSTEM, config.getValueAsString(optionName));
  }
}
