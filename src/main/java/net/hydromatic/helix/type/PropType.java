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

/** A proposition constant, declared by "{@code prop P}".
 *
 * <p>Its sort is {@link Sort#PROP}. Its only inhabitants are axioms; they are
 * checked but never evaluated. */
public class PropType extends BaseType {
  public final String name;

  PropType(String name) {
    super(Op.PROP_TYPE);
    this.name = requireNonNull(name);
  }

  @Override
  public String moniker() {
    return name;
  }

  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public PropType copy(TypeSystem typeSystem, UnaryOperator<Type> transform) {
    return this;
  }
}

// End PropType.java
