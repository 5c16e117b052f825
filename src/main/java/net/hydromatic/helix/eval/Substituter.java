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

import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.Map;
import net.hydromatic.helix.ast.Core;
import net.hydromatic.helix.ast.Shuttle;

/** Replaces free variables in a term with values.
 *
 * <p>The values are closed terms, so substitution cannot capture a
 * variable, and no renaming is necessary. A binder that rebinds a name stops
 * substitution of that name in its scope. */
public class Substituter extends Shuttle {
  private final Map<String, Core.Exp> map;

  private Substituter(Map<String, Core.Exp> map) {
    this.map = ImmutableMap.copyOf(map);
  }

  /** Replaces the free occurrences of {@code name} in {@code exp} with
   * {@code value}. */
  public static Core.Exp substitute(String name, Core.Exp value,
      Core.Exp exp) {
    return substitute(ImmutableMap.of(name, value), exp);
  }

  /** Replaces free variables in {@code exp} according to a map. */
  public static Core.Exp substitute(Map<String, ? extends Core.Exp> map,
      Core.Exp exp) {
    if (map.isEmpty()) {
      return exp;
    }
    return exp.accept(new Substituter(ImmutableMap.copyOf(map)));
  }

  /** Returns a substituter that does not replace {@code name}. */
  private Substituter minus(String name) {
    if (!map.containsKey(name)) {
      return this;
    }
    final Map<String, Core.Exp> map2 = new HashMap<>(map);
    map2.remove(name);
    return new Substituter(map2);
  }

  @Override protected Core.Exp visit(Core.Id id) {
    final Core.Exp value = map.get(id.name);
    return value != null ? value : id;
  }

  @Override protected Core.Exp visit(Core.Fn fn) {
    final Substituter substituter = minus(fn.name);
    if (substituter.map.isEmpty()) {
      return fn;
    }
    return fn.copy(fn.body.accept(substituter));
  }

  @Override protected Core.Exp visit(Core.Let let) {
    return let.copy(let.exp.accept(this), let.body.accept(minus(let.name)));
  }

  @Override protected Core.Exp visit(Core.FuzzyLet fuzzyLet) {
    return fuzzyLet.copy(fuzzyLet.exp.accept(this),
        fuzzyLet.body.accept(minus(fuzzyLet.name)));
  }
}

// End Substituter.java
