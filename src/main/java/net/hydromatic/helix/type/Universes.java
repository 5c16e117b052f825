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

import org.checkerframework.checker.nullness.qual.Nullable;

/** Implementations of {@link Universe}. */
public enum Universes implements Universe {
  /**
   * A single predicative universe {@code Type}, with {@code Prop} as a
   * separate top sort.
   *
   * <p>Primitive, function, record and fuzzy types built from
   * {@code Type}-sorted components have sort {@code Type}; proposition
   * constants have sort {@code Prop}; {@code Type} and {@code Prop} themselves
   * have no sort, so there is no {@code Type : Type}.
   */
  STANDARD {
    @Override
    public @Nullable Sort sortOf(Type type) {
      return type.accept(SORT_VISITOR);
    }
  };

  private static final TypeVisitor<Sort> SORT_VISITOR =
      new TypeVisitor<Sort>() {
        @Override
        public Sort visit(TypeVar typeVar) {
          return Sort.TYPE;
        }

        @Override
        public @Nullable Sort visit(FnType fnType) {
          return fnType.paramType.accept(this) == Sort.TYPE
              && fnType.resultType.accept(this) == Sort.TYPE
              ? Sort.TYPE
              : null;
        }

        @Override
        public @Nullable Sort visit(RecordType recordType) {
          for (Type type : recordType.argNameTypes.values()) {
            if (type.accept(this) != Sort.TYPE) {
              return null;
            }
          }
          return Sort.TYPE;
        }

        @Override
        public @Nullable Sort visit(FuzzyType fuzzyType) {
          return fuzzyType.argType.accept(this) == Sort.TYPE
              ? Sort.TYPE
              : null;
        }

        @Override
        public Sort visit(PrimitiveType primitiveType) {
          return Sort.TYPE;
        }

        @Override
        public Sort visit(PropType propType) {
          return Sort.PROP;
        }

        @Override
        public @Nullable Sort visit(Sort sort) {
          return null;
        }
      };
}

// End Universes.java
