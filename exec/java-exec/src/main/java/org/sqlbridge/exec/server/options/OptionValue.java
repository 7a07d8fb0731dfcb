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

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

/**
 * An {@link OptionValue option value} is used by an {@link OptionManager} to store a run-time
 * setting. Exactly one of the typed fields is set, according to {@link #kind}.
 */
@JsonInclude(Include.NON_NULL)
public class OptionValue implements Comparable<OptionValue> {

  public enum OptionType {
    SYSTEM, SESSION, QUERY
  }

  public enum Kind {
    BOOLEAN, LONG, STRING
  }

  public final String name;
  public final Kind kind;
  public final OptionType type;
  public final Long num_val;
  public final String string_val;
  public final Boolean bool_val;

  public static OptionValue createLong(OptionType type, String name, long val) {
    return new OptionValue(Kind.LONG, type, name, val, null, null);
  }

  public static OptionValue createBoolean(OptionType type, String name, boolean bool) {
    return new OptionValue(Kind.BOOLEAN, type, name, null, null, bool);
  }

  public static OptionValue createString(OptionType type, String name, String val) {
    return new OptionValue(Kind.STRING, type, name, null, val, null);
  }

  @JsonCreator
  private OptionValue(@JsonProperty("kind") Kind kind,
                      @JsonProperty("type") OptionType type,
                      @JsonProperty("name") String name,
                      @JsonProperty("num_val") Long num_val,
                      @JsonProperty("string_val") String string_val,
                      @JsonProperty("bool_val") Boolean bool_val) {
    Preconditions.checkArgument(name != null, "option name can not be null");
    this.kind = kind;
    this.type = type;
    this.name = name;
    this.num_val = num_val;
    this.string_val = string_val;
    this.bool_val = bool_val;
  }

  /**
   * @return a copy of this value attributed to another scope
   */
  public OptionValue withType(OptionType newType) {
    return new OptionValue(kind, newType, name, num_val, string_val, bool_val);
  }

  @JsonIgnore
  public Object getValue() {
    switch (kind) {
    case BOOLEAN:
      return bool_val;
    case LONG:
      return num_val;
    case STRING:
      return string_val;
    default:
      throw new IllegalStateException("Unknown option kind " + kind);
    }
  }

  @JsonIgnore
  public String getValueAsString() {
    return String.valueOf(getValue());
  }

  @Override
  public int compareTo(OptionValue o) {
    return name.compareTo(o.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, kind, type, num_val, string_val, bool_val);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof OptionValue)) {
      return false;
    }
    final OptionValue other = (OptionValue) obj;
    return name.equals(other.name)
        && kind == other.kind
        && type == other.type
        && Objects.equals(num_val, other.num_val)
        && Objects.equals(string_val, other.string_val)
        && Objects.equals(bool_val, other.bool_val);
  }

  @Override
  public String toString() {
    return "OptionValue [type=" + type + ", name=" + name + ", value=" + getValue() + "]";
  }
}
