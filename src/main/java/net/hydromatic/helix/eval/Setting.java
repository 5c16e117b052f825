/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.helix.eval;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Setting that controls type checking and evaluation.
 *
 * @see Session#map
 */
public enum Setting {
  /**
   * Integer setting "stepBudget" is the maximum number of reduction steps the
   * evaluator may take to evaluate one statement.
   *
   * <p>The default is 1,000,000. A negative value means unbounded.
   */
  STEP_BUDGET("stepBudget", Integer.class, 1_000_000),

  /**
   * Boolean setting "verifySteps" controls whether the evaluator re-derives
   * the type of each intermediate term, and fails if a reduction step has
   * changed it. Default false.
   */
  VERIFY_STEPS("verifySteps", Boolean.class, false),

  /**
   * Boolean setting "echo" controls whether the batch interpreter and the
   * shell print each statement before its result. Default false.
   */
  ECHO("echo", Boolean.class, false);

  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;

  /**
   * Map of all settings, keyed by both {@link #name()} and
   * {@link #camelName}.
   */
  public static final ImmutableMap<String, Setting> BY_NAME;

  /** List of all settings sorted by {@link #camelName}. */
  public static final List<Setting> BY_CAMEL_NAME;

  static {
    final List<Setting> list = Arrays.asList(values());
    final Ordering<Setting> ordering =
        Ordering.from(Comparator.comparing((Setting o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Setting> map = new LinkedHashMap<>();
    for (Setting value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Setting(String camelName, Class<?> type, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /** Looks up a setting by name. Throws if not found; never returns null. */
  public static Setting lookup(String settingName) {
    final Setting setting = BY_NAME.get(settingName);
    if (setting == null) {
      throw new IllegalArgumentException(
          "setting " + settingName + " not found");
    }
    return setting;
  }

  /** Returns the value of a setting. */
  public Object get(Map<Setting, Object> map) {
    final Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this setting's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(type == requestedType,
        "invalid type %s for setting %s", type, camelName);
  }

  /** Returns the value of a boolean setting. */
  public boolean booleanValue(Map<Setting, Object> map) {
    checkType(Boolean.class);
    return (Boolean) get(map);
  }

  /** Returns the value of an integer setting. */
  public int intValue(Map<Setting, Object> map) {
    checkType(Integer.class);
    return (Integer) get(map);
  }

  /**
   * Sets the value of a setting, converting from a string if the setting is
   * not a string; for example, "--stepBudget=100" on the command line.
   */
  public void setLenient(Map<Setting, Object> map, @Nullable Object value) {
    if (value instanceof String) {
      final String s = (String) value;
      if (type == Integer.class) {
        try {
          set(map, Integer.valueOf(s));
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException(
              "value for setting " + camelName + " must be an integer: " + s,
              e);
        }
        return;
      }
      if (type == Boolean.class) {
        if (!s.equals("true") && !s.equals("false")) {
          throw new IllegalArgumentException(
              "value for setting " + camelName
                  + " must be 'true' or 'false': " + s);
        }
        set(map, Boolean.valueOf(s));
        return;
      }
    }
    set(map, value);
  }

  /** Sets the value of a setting. Checks that its type is valid. A null
   * value reverts the setting to its default. */
  public void set(Map<Setting, Object> map, @Nullable Object value) {
    if (value == null) {
      // Reverts to the default value.
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new IllegalArgumentException(
            "value for setting " + camelName + " must have type "
                + type.getSimpleName());
      }
      map.put(this, value);
    }
  }
}

// End Setting.java
