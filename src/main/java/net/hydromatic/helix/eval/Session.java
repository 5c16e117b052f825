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

import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.helix.util.HelixException;

/** Session environment.
 *
 * <p>Holds the settings of one caller (the batch interpreter, a shell, or a
 * test). A session is mutable, and is not shared between threads. */
public class Session {
  /** Setting values. */
  public final Map<Setting, Object> map;

  /** Creates a Session.
   *
   * <p>The {@code map} parameter, that becomes the setting map, is used as is,
   * not copied. It should probably be a {@link LinkedHashMap} to provide
   * deterministic iteration order.
   *
   * @param map Map that contains setting values */
  public Session(Map<Setting, Object> map) {
    this.map = map;
  }

  /** Creates a Session with default settings. */
  public Session() {
    this(new LinkedHashMap<>());
  }

  /** Returns the step budget; negative means unbounded. */
  public int stepBudget() {
    return Setting.STEP_BUDGET.intValue(map);
  }

  /** Returns whether each reduction step is re-checked. */
  public boolean verifySteps() {
    return Setting.VERIFY_STEPS.booleanValue(map);
  }

  /** Formats an error, as the shell and batch interpreter print it. */
  public void handle(HelixException e, StringBuilder buf) {
    e.describeTo(buf);
  }
}

// End Session.java
