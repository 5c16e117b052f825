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

/**
 * Visitor over {@link Type} objects.
 *
 * @param <R> return type from {@code visit} methods
 * @see Type#accept(TypeVisitor)
 */
public class TypeVisitor<R> {
  /** Visits a {@link TypeVar}. */
  public R visit(TypeVar typeVar) {
    return null;
  }

  /** Visits a {@link FnType}. */
  public R visit(FnType fnType) {
    fnType.paramType.accept(this);
    return fnType.resultType.accept(this);
  }

  /** Visits a {@link RecordType}. */
  public R visit(RecordType recordType) {
    R r = null;
    for (Type type : recordType.argNameTypes.values()) {
      r = type.accept(this);
    }
    return r;
  }

  /** Visits a {@link FuzzyType}. */
  public R visit(FuzzyType fuzzyType) {
    return fuzzyType.argType.accept(this);
  }

  /** Visits a {@link PrimitiveType}. */
  public R visit(PrimitiveType primitiveType) {
    return null;
  }

  /** Visits a {@link PropType}. */
  public R visit(PropType propType) {
    return null;
  }

  /** Visits a {@link Sort}. */
  public R visit(Sort sort) {
    return null;
  }
}

// End TypeVisitor.java
