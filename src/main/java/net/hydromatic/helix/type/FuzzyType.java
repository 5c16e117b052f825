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

import java.util.function.UnaryOperator;
import net.hydromatic.helix.ast.Op;

/** The type of a fuzzy value, {@code Fuzzy<T>}: a value of type {@code T}
 * paired with a confidence of type {@code Prob}. */
public class FuzzyType extends BaseType {
  /** Name of the type constructor. */
  public static final String NAME = "Fuzzy";

  public final Type argType;
  private final String moniker;

  FuzzyType(Type argType) {
    super(Op.FUZZY_TYPE);
    this.argType = requireNonNull(argType);
    this.moniker = NAME + "<" + argType + ">";
  }

  @Override
  public String moniker() {
    return moniker;
  }

  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public FuzzyType copy(TypeSystem typeSystem, UnaryOperator<Type> transform) {
    final Type argType2 = argType.copy(typeSystem, transform);
    return argType2 == argType ? this : typeSystem.fuzzyType(argType2);
  }
}

// End FuzzyType.java
