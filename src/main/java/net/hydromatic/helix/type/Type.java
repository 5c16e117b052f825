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
package net.hydromatic.helix.type;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;
import net.hydromatic.helix.ast.Op;

/** Type.
 *
 * <p>Types are structural: two types are equal if and only if their
 * monikers are equal. */
public interface Type {
  /**
   * Description of the type, e.g. "{@code Prob}", "{@code Int -> Int}",
   * "{@code Fuzzy<{a: Int}>}".
   *
   * <p>The moniker is valid type syntax, and parses back to this type.
   */
  String moniker();

  /** Type operator. */
  Op op();

  /**
   * Copies this type, applying a given transform to component types, and
   * returning the original type if the component types are unchanged.
   */
  Type copy(TypeSystem typeSystem, UnaryOperator<Type> transform);

  <R> R accept(TypeVisitor<R> typeVisitor);

  /**
   * Returns a copy of this type, specialized by substituting type variables.
   * Type variable {@code 'a} is replaced by {@code types[0]}, and so forth.
   */
  default Type substitute(TypeSystem typeSystem, List<? extends Type> types) {
    if (types.isEmpty()) {
      return this;
    }
    return accept(
        new TypeShuttle(typeSystem) {
          @Override
          public Type visit(TypeVar typeVar) {
            return typeVar.ordinal < types.size()
                ? types.get(typeVar.ordinal)
                : typeVar;
          }
        });
  }

  /** Returns whether this type contains a type variable. */
  default boolean isPolymorphic() {
    final AtomicInteger c = new AtomicInteger();
    accept(
        new TypeVisitor<Void>() {
          @Override
          public Void visit(TypeVar typeVar) {
            c.incrementAndGet();
            return null;
          }
        });
    return c.get() > 0;
  }
}

// End Type.java
