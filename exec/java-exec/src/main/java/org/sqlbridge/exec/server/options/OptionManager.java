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

import org.sqlbridge.exec.server.options.TypeValidators.BooleanValidator;
import org.sqlbridge.exec.server.options.TypeValidators.LongValidator;
import org.sqlbridge.exec.server.options.TypeValidators.StringValidator;

/**
 * Manager for option values. Implementations are layered: a query manager falls back to its
 * session manager's snapshot, which falls back to the system manager.
 */
public interface OptionManager {

  /**
   * Gets the option value for the given option name.
   *
   * @param name option name
   * @return the option value, null if the option is neither declared nor set
   */
  OptionValue getOption(String name);

  /**
   * Gets the boolean value (from the option value) for the given boolean validator.
   *
   * @param validator the boolean validator
   * @return the boolean value
   */
  boolean getOption(BooleanValidator validator);

  /**
   * Gets the long value (from the option value) for the given long validator.
   *
   * @param validator the long validator
   * @return the long value
   */
  long getOption(LongValidator validator);

  /**
   * Gets the string value (from the option value) for the given string validator.
   *
   * @param validator the string validator
   * @return the string value
   */
  String getOption(StringValidator validator);
}
