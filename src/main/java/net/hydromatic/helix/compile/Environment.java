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
package net.hydromatic.helix.compile;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import net.hydromatic.helix.type.Binding;
import net.hydromatic.helix.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Environment for type checking and evaluation.
 *
 * <p>Every environment is immutable; when you call {@link #bind}, a new
 * environment is created that inherits from the previous environment. The new
 * environment may obscure bindings in the old environment, but neither the new
 * nor the old will ever change.
 *
 * <p>To create an empty environment, call {@link Environments#empty()}; to
 * create an environment containing the built-in types and functions, call
 * {@link Environments#base()}.
 */
public abstract class Environment {
  /**
   * Visits every binding in this environment.
   *
   * <p>Bindings that are obscured by more recent bindings of the same name are
   * visited, but after the more obscuring bindings.
   */
  abstract void visit(Consumer<Binding> consumer);

  /**
   * Converts this environment to a string.
   *
   * <p>This method does not override the {@link #toString()} method; if we did,
   * debuggers would invoke it automatically, burning lots of CPU and memory.
   */
  public String asString() {
    final StringBuilder b = new StringBuilder();
    getValueMap().forEach((k, v) -> b.append(v).append("\n"));
    return b.toString();
  }

  /** Returns the binding of {@code name} if bound, null if not. */
  public abstract @Nullable Binding getOpt(String name);

  /**
   * Creates an environment that is the same as a given environment, plus one
   * more value.
   */
  public Environment bind(String name, Type type) {
    return bind(Binding.of(name, type));
  }

  /** Creates an environment that is this environment plus a binding. */
  public Environment bind(Binding binding) {
    return new Environments.SubEnvironment(this, binding);
  }

  /**
   * Returns a map of the bindings, most recent first. Does not include
   * obscured bindings.
   */
  public final Map<String, Binding> getValueMap() {
    final Map<String, Binding> valueMap = new LinkedHashMap<>();
    visit(binding -> valueMap.putIfAbsent(binding.name, binding));
    return valueMap;
  }

  /**
   * Creates an environment that is the same as this, plus the given bindings.
   */
  public final Environment bindAll(Iterable<Binding> bindings) {
    return Environments.bind(this, bindings);
  }

  /**
   * If this environment only defines bindings in the given set, returns its
   * parent. Never returns null. The empty environment returns itself.
   */
  abstract Environment nearestAncestorNotObscuredBy(Set<String> names);
}

// End Environment.java
