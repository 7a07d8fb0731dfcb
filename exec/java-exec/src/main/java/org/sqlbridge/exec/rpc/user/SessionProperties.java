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

import java.util.Locale;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

/**
 * Properties a client passes when opening a session.
 * <ul>
 *   <li>{@code use:database} selects the initial current database;</li>
 *   <li>{@code set:hiveconf:<key>} and {@code set:hivevar:<key>} set a session option;</li>
 *   <li>{@code user} and {@code password} are connection attributes and ignored here;</li>
 *   <li>any other key sets the session option of the same name.</li>
 * </ul>
 */
public final class SessionProperties {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(SessionProperties.class);

  public static final String USE_DATABASE = "use:database";
  public static final String SET_HIVECONF_PREFIX = "set:hiveconf:";
  public static final String SET_HIVEVAR_PREFIX = "set:hivevar:";
  public static final String USER = "user";
  public static final String PASSWORD = "password";

  private SessionProperties() {
  }

  /**
   * @throws org.sqlbridge.common.exceptions.UserException immutable config error if a property
   *     targets a static option
   */
  public static void apply(UserSession session, Map<String, String> properties) {
    for (Map.Entry<String, String> entry : properties.entrySet()) {
      final String key = entry.getKey();
      final String value = entry.getValue();
      if (USER.equals(key) || PASSWORD.equals(key)) {
        continue;
      }
      if (USE_DATABASE.equals(key)) {
        session.setCurrentDatabase(StringUtils.strip(value.trim(), "`").toLowerCase(Locale.ROOT));
      } else if (key.startsWith(SET_HIVECONF_PREFIX)) {
        session.getOptions().setOption(key.substring(SET_HIVECONF_PREFIX.length()), value);
      } else if (key.startsWith(SET_HIVEVAR_PREFIX)) {
        session.getOptions().setOption(key.substring(SET_HIVEVAR_PREFIX.length()), value);
      } else {
        session.getOptions().setOption(key, value);
      }
    }
    logger.debug("Applied {} properties to session {}.", properties.size(), session.getSessionId());
  }
}
