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
package net.hydromatic.helix.ast;

import com.google.common.collect.ImmutableSortedMap;
import java.math.BigDecimal;
import java.util.Map;
import net.hydromatic.helix.compile.BuiltIn;
import net.hydromatic.helix.eval.Prob;
import net.hydromatic.helix.eval.Unit;
import net.hydromatic.helix.type.FnType;
import net.hydromatic.helix.type.FuzzyType;
import net.hydromatic.helix.type.PrimitiveType;
import net.hydromatic.helix.type.RecordType;
import net.hydromatic.helix.type.Type;

/** Builds parse tree nodes. */
public enum CoreBuilder {
  /** The singleton instance of the CORE builder.
   * The short name is convenient for use via 'import static',
   * but checkstyle does not approve. */
  // CHECKSTYLE: IGNORE 1
  core;

  /** Creates a literal. */
  public Core.Literal literal(Pos pos, PrimitiveType type, Comparable value) {
    switch (type) {
    case BOOL:
      return new Core.Literal(pos, Op.BOOL_LITERAL, type, (Boolean) value);
    case INT:
      return new Core.Literal(pos, Op.INT_LITERAL, type, (Integer) value);
    case REAL:
      return new Core.Literal(pos, Op.REAL_LITERAL, type, (BigDecimal) value);
    case PROB:
      return new Core.Literal(pos, Op.PROB_LITERAL, type, (Prob) value);
    case STRING:
      return new Core.Literal(pos, Op.STRING_LITERAL, type, (String) value);
    case UNIT:
      return new Core.Literal(pos, Op.UNIT_LITERAL, type, Unit.INSTANCE);
    default:
      throw new AssertionError("unexpected " + type);
    }
  }

  /** Creates a {@code Bool} literal. */
  public Core.Literal boolLiteral(Pos pos, boolean b) {
    return literal(pos, PrimitiveType.BOOL, b);
  }

  /** Creates an {@code Int} literal. */
  public Core.Literal intLiteral(Pos pos, int i) {
    return literal(pos, PrimitiveType.INT, i);
  }

  /** Creates a {@code Real} literal. */
  public Core.Literal realLiteral(Pos pos, BigDecimal value) {
    return literal(pos, PrimitiveType.REAL, value);
  }

  /** Creates a {@code Prob} literal. */
  public Core.Literal probLiteral(Pos pos, Prob value) {
    return literal(pos, PrimitiveType.PROB, value);
  }

  /** Creates a {@code String} literal. */
  public Core.Literal stringLiteral(Pos pos, String value) {
    return literal(pos, PrimitiveType.STRING, value);
  }

  /** Creates a {@code Unit} literal. */
  public Core.Literal unitLiteral(Pos pos) {
    return literal(pos, PrimitiveType.UNIT, Unit.INSTANCE);
  }

  /** Creates a reference to a built-in function, at a given instance of its
   * type. */
  public Core.Literal functionLiteral(Pos pos, BuiltIn builtIn, Type type) {
    return new Core.Literal(pos, Op.FN_LITERAL, type, builtIn);
  }

  public Core.Id id(Pos pos, String name, Type type) {
    return new Core.Id(pos, name, type);
  }

  public Core.Fn fn(Pos pos, FnType type, String name, Core.Exp body) {
    return new Core.Fn(pos, type, name, body);
  }

  public Core.Apply apply(Pos pos, Type type, Core.Exp fn, Core.Exp arg) {
    return new Core.Apply(pos, type, fn, arg);
  }

  /** Creates an application of a function whose type is known to be a
   * function type; the result type is derived from it. */
  public Core.Apply apply(Pos pos, Core.Exp fn, Core.Exp arg) {
    return apply(pos, ((FnType) fn.type).resultType, fn, arg);
  }

  public Core.Let let(Pos pos, String name, Core.Exp exp, Core.Exp body) {
    return new Core.Let(pos, name, exp, body);
  }

  public Core.FuzzyLet fuzzyLet(Pos pos, String name, Core.Exp exp,
      Core.Exp body) {
    return new Core.FuzzyLet(pos, name, exp, body);
  }

  public Core.If ifThenElse(Pos pos, Core.Exp condition, Core.Exp ifTrue,
      Core.Exp ifFalse) {
    return new Core.If(pos, condition, ifTrue, ifFalse);
  }

  public Core.Record record(Pos pos, RecordType type,
      Map<String, ? extends Core.Exp> args) {
    return new Core.Record(pos, type,
        ImmutableSortedMap.copyOf(args, RecordType.ORDERING));
  }

  public Core.Select select(Pos pos, Type type, Core.Exp exp, String name) {
    return new Core.Select(pos, type, exp, name);
  }

  public Core.Wrap wrap(Pos pos, FuzzyType type, Core.Exp value,
      Core.Exp confidence) {
    return new Core.Wrap(pos, type, value, confidence);
  }
}

// End CoreBuilder.java
