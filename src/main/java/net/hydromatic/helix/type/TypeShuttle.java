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

import static java.util.Objects.requireNonNull;

/** Visitor over types that returns a type, possibly a modified copy. */
public class TypeShuttle extends TypeVisitor<Type> {
  protected final TypeSystem typeSystem;

  /** Creates a TypeShuttle. */
  protected TypeShuttle(TypeSystem typeSystem) {
    this.typeSystem = requireNonNull(typeSystem);
  }

  @Override
  public Type visit(TypeVar typeVar) {
    return typeVar;
  }

  @Override
  public Type visit(FnType fnType) {
    return fnType.copy(typeSystem, t -> t.accept(this));
  }

  @Override
  public Type visit(RecordType recordType) {
    return recordType.copy(typeSystem, t -> t.accept(this));
  }

  @Override
  public Type visit(FuzzyType fuzzyType) {
    return fuzzyType.copy(typeSystem, t -> t.accept(this));
  }

  @Override
  public Type visit(PrimitiveType primitiveType) {
    return primitiveType;
  }

  @Override
  public Type visit(PropType propType) {
    return propType;
  }

  @Override
  public Type visit(Sort sort) {
    return sort;
  }
}

// End TypeShuttle.java
