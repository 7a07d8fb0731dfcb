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

import java.util.HashMap;
import java.util.Map;

import org.sqlbridge.exec.server.options.OptionValue.OptionType;

import com.google.common.collect.ImmutableMap;

/**
 * {@link OptionManager} holding the options of one operation: a snapshot of the session values
 * taken at submission plus the options passed along with the statement. Later changes to the
 * session do not reach a running operation.
 */
public class QueryOptionManager extends BaseOptionManager {

  private final SystemOptionManager systemOptions;
  private final Map<String, OptionValue> options;

  /**
   * @param sessionOptions session to snapshot
   * @param patch per statement values, applied on top of the snapshot
   * @throws org.sqlbridge.common.exceptions.UserException immutable config error if the patch holds
   *     a static key
   */
  public QueryOptionManager(SessionOptionManager sessionOptions, Map<String, String> patch) {
    this.systemOptions = sessionOptions.getSystemOptions();
    final Map<String, OptionValue> merged = new HashMap<>(sessionOptions.getOverrides());
    for (Map.Entry<String, String> entry : patch.entrySet()) {
      final String key = entry.getKey().trim();
      merged.put(key, systemOptions.parseUserValue(key, entry.getValue(), OptionType.QUERY));
    }
    this.options = ImmutableMap.copyOf(merged);
  }

  @Override
  public OptionValue getOption(String name) {
    final OptionValue value = options.get(name);
    return value != null ? value : systemOptions.getOption(name);
  }
}
