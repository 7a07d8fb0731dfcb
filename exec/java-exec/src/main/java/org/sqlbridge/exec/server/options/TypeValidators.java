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

import org.apache.commons.lang3.StringUtils;
import org.sqlbridge.common.exceptions.UserException;
import org.sqlbridge.exec.server.options.OptionValue.Kind;
import org.sqlbridge.exec.server.options.OptionValue.OptionType;

public class TypeValidators {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(TypeValidators.class);

  public static class BooleanValidator extends OptionValidator {

    public BooleanValidator(String name, String description, boolean isStatic) {
      super(name, description, isStatic);
    }

    @Override
    public Kind getKind() {
      return Kind.BOOLEAN;
    }

    @Override
    public OptionValue parse(OptionType type, String value) {
      final String trimmed = StringUtils.trimToEmpty(value);
      if ("true".equalsIgnoreCase(trimmed)) {
        return OptionValue.createBoolean(type, getOptionName(), true);
      }
      if ("false".equalsIgnoreCase(trimmed)) {
        return OptionValue.createBoolean(type, getOptionName(), false);
      }
      throw UserException.validationError()
          .message("Option %s must be set to true or false, got '%s'.", getOptionName(), value)
          .build(logger);
    }
  }

  public static class LongValidator extends OptionValidator {

    public LongValidator(String name, String description, boolean isStatic) {
      super(name, description, isStatic);
    }

    @Override
    public Kind getKind() {
      return Kind.LONG;
    }

    @Override
    public OptionValue parse(OptionType type, String value) {
      try {
        return OptionValue.createLong(type, getOptionName(), Long.parseLong(StringUtils.trimToEmpty(value)));
      } catch (NumberFormatException e) {
        throw UserException.validationError(e)
            .message("Option %s must be a number, got '%s'.", getOptionName(), value)
            .build(logger);
      }
    }
  }

  public static class StringValidator extends OptionValidator {

    public StringValidator(String name, String description, boolean isStatic) {
      super(name, description, isStatic);
    }

    @Override
    public Kind getKind() {
      return Kind.STRING;
    }

    @Override
    public OptionValue parse(OptionType type, String value) {
      if (value == null) {
        throw UserException.validationError()
            .message("Option %s can not be null.", getOptionName())
            .build(logger);
      }
      return OptionValue.createString(type, getOptionName(), value);
    }
  }
}
