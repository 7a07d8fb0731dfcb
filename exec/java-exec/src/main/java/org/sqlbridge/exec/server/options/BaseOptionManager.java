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

import org.sqlbridge.common.exceptions.UserException;
import org.sqlbridge.exec.server.options.TypeValidators.BooleanValidator;
import org.sqlbridge.exec.server.options.TypeValidators.LongValidator;
import org.sqlbridge.exec.server.options.TypeValidators.StringValidator;

public abstract class BaseOptionManager implements OptionManager {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(BaseOptionManager.class);

  /**
   * Gets the current option value given a validator.
   *
   * @param validator the validator
   * @return option value
   * @throws UserException system error if the option has no value of the expected kind
   */
  private OptionValue getOptionSafe(OptionValidator validator) {
    final String optionName = validator.getOptionName();
    final OptionValue value = getOption(optionName);
    if (value == null || value.kind != validator.getKind()) {
      throw UserException.systemError(null)
          .message("Option %s is missing or does not hold a %s value.", optionName, validator.getKind())
          .build(logger);
    }
    return value;
  }

  @Override
  public boolean getOption(BooleanValidator validator) {
    return getOptionSafe(validator).bool_val;
  }

  @Override
  public long getOption(LongValidator validator) {
    return getOptionSafe(validator).num_val;
  }

  @Override
  public String getOption(StringValidator validator) {
    return getOptionSafe(validator).string_val;
  }
}
