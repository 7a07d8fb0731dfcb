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
package org.sqlbridge.exec.planner.sql;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.sqlbridge.exec.server.options.OptionManager;
import org.sqlbridge.exec.server.options.OptionValue;

/**
 * Replaces {@code ${key}}, {@code ${hiveconf:key}} and {@code ${hivevar:key}} with option values.
 * References to options that have no value are kept as they are.
 */
public final class VariableSubstitution {

  private static final Pattern VARIABLE = Pattern.compile("\\$\\{(?:(?:hiveconf|hivevar):)?([^}\\s]+)\\}");

  private VariableSubstitution() {
  }

  public static String substitute(String text, OptionManager options) {
    final Matcher matcher = VARIABLE.matcher(text);
    final StringBuffer sb = new StringBuffer();
    while (matcher.find()) {
      final OptionValue value = options.getOption(matcher.group(1));
      final String replacement = value == null ? matcher.group() : value.getValueAsString();
      matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
    }
    matcher.appendTail(sb);
    return sb.toString();
  }
}
