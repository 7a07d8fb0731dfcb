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

import java.util.Collection;
import java.util.Map;

import org.sqlbridge.common.config.BridgeConfig;
import org.sqlbridge.common.exceptions.UserException;
import org.sqlbridge.exec.ExecConstants;
import org.sqlbridge.exec.server.options.OptionValue.OptionType;

import com.google.common.collect.ImmutableMap;

/**
 * Process wide option values, read once from {@link BridgeConfig} at start up and never changed
 * afterwards. Session managers layer their overrides on top of this one.
 */
public class SystemOptionManager extends BaseOptionManager {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(SystemOptionManager.class);

  private final Map<String, OptionValidator> validators;
  private final Map<String, OptionValue> defaults;

  public SystemOptionManager(BridgeConfig config) {
    final ImmutableMap.Builder<String, OptionValidator> validatorBuilder = ImmutableMap.builder();
    final ImmutableMap.Builder<String, OptionValue> defaultBuilder = ImmutableMap.builder();
    for (OptionValidator validator : ExecConstants.VALIDATORS) {
      validatorBuilder.put(validator.getOptionName(), validator);
      defaultBuilder.put(validator.getOptionName(), validator.loadDefault(config));
    }
    this.validators = validatorBuilder.build();
    this.defaults = defaultBuilder.build();
    logger.debug("Loaded {} system options.", defaults.size());
  }

  @Override
  public OptionValue getOption(String name) {
    return defaults.get(name);
  }

  /**
   * @return the validator of a declared option, null for user defined keys
   */
  public OptionValidator getValidator(String name) {
    return validators.get(name);
  }

  public Collection<OptionValidator> getValidators() {
    return validators.values();
  }

  public boolean isStatic(String name) {
    final OptionValidator validator = validators.get(name);
    return validator != null && validator.isStatic();
  }

  /**
   * Turns a user supplied key and value into an option value of the given scope. Declared options
   * are parsed by their validator, any other key is kept as a string.
   *
   * @throws UserException immutable config error for static keys, validation error for values of
   *     the wrong type
   */
  public OptionValue parseUserValue(String name, String value, OptionType type) {
    final OptionValidator validator = validators.get(name);
    if (validator == null) {
      return OptionValue.createString(type, name, value);
    }
    if (validator.isStatic()) {
      throw UserException.immutableConfigError()
          .message("Cannot modify the value of a static config: %s", name)
          .build(logger);
    }
    return validator.parse(type, value);
  }
}
