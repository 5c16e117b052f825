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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.helix.ast.CoreBuilder.core;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import net.hydromatic.helix.ast.Pos;
import net.hydromatic.helix.type.Binding;
import net.hydromatic.helix.type.PrimitiveType;
import net.hydromatic.helix.type.TypeSystem;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Helpers for {@link Environment}. */
public abstract class Environments {
  /** The base environment. Built once, shared by all threads. */
  private static final Environment BASE_ENVIRONMENT =
      base(EmptyEnvironment.INSTANCE, new TypeSystem());

  private Environments() {}

  /** Creates an empty environment. */
  public static Environment empty() {
    return EmptyEnvironment.INSTANCE;
  }

  /**
   * Returns the base environment, containing the primitive types and the
   * built-in functions.
   */
  public static Environment base() {
    return BASE_ENVIRONMENT;
  }

  private static Environment base(Environment environment,
      TypeSystem typeSystem) {
    final List<Binding> bindings = new ArrayList<>();
    for (PrimitiveType primitiveType : PrimitiveType.values()) {
      bindings.add(
          Binding.of(primitiveType.moniker, primitiveType,
              Binding.Kind.TYPE));
    }
    BuiltIn.forEach(typeSystem, (builtIn, type) ->
        bindings.add(
            Binding.of(builtIn.mlName,
                core.functionLiteral(Pos.ZERO, builtIn, type))));
    return bind(environment, bindings);
  }

  /** Creates an environment that is a given environment plus bindings. */
  static Environment bind(Environment env, Iterable<Binding> bindings) {
    if (Iterables.size(bindings) < 5) {
      for (Binding binding : bindings) {
        env = env.bind(binding);
      }
      return env;
    } else {
      // Later bindings obscure earlier bindings of the same name.
      final Map<String, Binding> map = new LinkedHashMap<>();
      bindings.forEach(binding -> {
        map.remove(binding.name);
        map.put(binding.name, binding);
      });
      final ImmutableMap<String, Binding> map2 = ImmutableMap.copyOf(map);
      env = env.nearestAncestorNotObscuredBy(map2.keySet());
      return new MapEnvironment(env, map2);
    }
  }

  /**
   * Environment that inherits from a parent environment and adds one binding.
   */
  static class SubEnvironment extends Environment {
    private final Environment parent;
    private final Binding binding;

    SubEnvironment(Environment parent, Binding binding) {
      this.parent = requireNonNull(parent);
      this.binding = requireNonNull(binding);
    }

    @Override
    public String toString() {
      return binding.name + ", ...";
    }

    @Override
    public @Nullable Binding getOpt(String name) {
      if (name.equals(binding.name)) {
        return binding;
      }
      return parent.getOpt(name);
    }

    @Override
    public Environment bind(Binding binding) {
      Environment env;
      if (this.binding.name.equals(binding.name)) {
        // The new binding obscures this environment's binding. Bind the parent
        // environment instead, so that chains stay short and obscured values
        // can be garbage-collected.
        env = parent;
        while (env instanceof SubEnvironment
            && ((SubEnvironment) env).binding.name.equals(binding.name)) {
          env = ((SubEnvironment) env).parent;
        }
      } else {
        env = this;
      }
      return new SubEnvironment(env, binding);
    }

    @Override
    void visit(Consumer<Binding> consumer) {
      consumer.accept(binding);
      parent.visit(consumer);
    }

    @Override
    Environment nearestAncestorNotObscuredBy(Set<String> names) {
      return names.contains(binding.name)
          ? parent.nearestAncestorNotObscuredBy(names)
          : this;
    }
  }

  /** Empty environment. */
  private static class EmptyEnvironment extends Environment {
    static final EmptyEnvironment INSTANCE = new EmptyEnvironment();

    @Override
    void visit(Consumer<Binding> consumer) {}

    @Override
    public @Nullable Binding getOpt(String name) {
      return null;
    }

    @Override
    Environment nearestAncestorNotObscuredBy(Set<String> names) {
      return this;
    }
  }

  /** Environment that keeps bindings in a map. */
  static class MapEnvironment extends Environment {
    private final Environment parent;
    private final ImmutableMap<String, Binding> map;

    MapEnvironment(Environment parent, ImmutableMap<String, Binding> map) {
      this.parent = requireNonNull(parent);
      this.map = requireNonNull(map);
    }

    @Override
    public String toString() {
      return map.keySet() + ", ...";
    }

    @Override
    void visit(Consumer<Binding> consumer) {
      map.values().asList().reverse().forEach(consumer);
      parent.visit(consumer);
    }

    @Override
    public @Nullable Binding getOpt(String name) {
      final Binding binding = map.get(name);
      return binding != null ? binding : parent.getOpt(name);
    }

    @Override
    Environment nearestAncestorNotObscuredBy(Set<String> names) {
      return names.containsAll(map.keySet())
          ? parent.nearestAncestorNotObscuredBy(names)
          : this;
    }
  }
}

// End Environments.java
