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

import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentSkipListMap;

import org.apache.commons.lang3.StringUtils;
import org.sqlbridge.common.exceptions.UserException;
import org.sqlbridge.exec.server.options.OptionValue.OptionType;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * {@link OptionManager} that holds the options of one session. Values set here are visible to
 * every operation of the session submitted afterwards and to nobody else.
 */
public class SessionOptionManager extends BaseOptionManager {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(SessionOptionManager.class);

  private final SystemOptionManager systemOptions;
  private final ConcurrentSkipListMap<String, OptionValue> options = new ConcurrentSkipListMap<>();

  public SessionOptionManager(SystemOptionManager systemOptions) {
    this.systemOptions = systemOptions;
  }

  public SystemOptionManager getSystemOptions() {
    return systemOptions;
  }

  @Override
  public OptionValue getOption(String name) {
    final OptionValue value = options.get(name);
    return value != null ? value : systemOptions.getOption(name);
  }

  /**
   * Sets an option for this session. The stored value is unchanged if the call fails.
   *
   * @throws UserException immutable config error if the key is static
   */
  public void setOption(String name, String value) {
    final String key = checkName(name);
    final OptionValue parsed = systemOptions.parseUserValue(key, value, OptionType.SESSION);
    options.put(key, parsed);
    logger.debug("Session option set: {}", parsed);
  }

  public void deleteOption(String name) {
    options.remove(checkName(name));
  }

  public void deleteAllOptions() {
    options.clear();
  }

  /**
   * @return the values set in this session, ordered by name
   */
  public Map<String, OptionValue> getOverrides() {
    return ImmutableMap.copyOf(options);
  }

  /**
   * Lists option values ordered by name. The order only depends on the options set, so the same
   * session state always yields the same list.
   *
   * @param includeDefaults false for the values set in this session only, true to add every
   *     declared option with its effective value
   */
  public List<OptionValue> listOptions(boolean includeDefaults) {
    if (!includeDefaults) {
      return ImmutableList.copyOf(options.values());
    }
    final SortedMap<String, OptionValue> all = new TreeMap<>();
    for (OptionValidator validator : systemOptions.getValidators()) {
      all.put(validator.getOptionName(), systemOptions.getOption(validator.getOptionName()));
    }
    all.putAll(options);
    return ImmutableList.copyOf(all.values());
  }

  private String checkName(String name) {
    if (StringUtils.isBlank(name)) {
      throw UserException.validationError()
          .message("Option name can not be empty.")
          .build(logger);
    }
    return name.trim();
  }
}
