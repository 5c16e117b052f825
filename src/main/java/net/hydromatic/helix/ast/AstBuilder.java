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

import static net.hydromatic.helix.type.RecordType.ORDERING;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import net.hydromatic.helix.eval.Unit;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /** The singleton instance of the AST builder.
   * The short name is convenient for use via 'import static',
   * but checkstyle does not approve. */
  // CHECKSTYLE: IGNORE 1
  ast;

  /** Creates a reference to a value. */
  public Ast.Id id(Pos pos, String name) {
    return new Ast.Id(pos, name);
  }

  /** Creates a {@code boolean} literal. */
  public Ast.Literal boolLiteral(Pos p, boolean b) {
    return new Ast.Literal(p, Op.BOOL_LITERAL, b);
  }

  /** Creates an {@code Int} literal. */
  public Ast.Literal intLiteral(Pos pos, int value) {
    return new Ast.Literal(pos, Op.INT_LITERAL, value);
  }

  /** Creates a {@code Real} literal. */
  public Ast.Literal realLiteral(Pos pos, BigDecimal value) {
    return new Ast.Literal(pos, Op.REAL_LITERAL, value);
  }

  /** Creates a probability literal. The value is not range-checked. */
  public Ast.Literal probLiteral(Pos pos, BigDecimal value) {
    return new Ast.Literal(pos, Op.PROB_LITERAL, value);
  }

  /** Creates a string literal. */
  public Ast.Literal stringLiteral(Pos pos, String value) {
    return new Ast.Literal(pos, Op.STRING_LITERAL, value);
  }

  /** Creates a unit literal, "()". */
  public Ast.Literal unitLiteral(Pos p) {
    return new Ast.Literal(p, Op.UNIT_LITERAL, Unit.INSTANCE);
  }

  public Ast.SortExp sortExp(Pos pos, String name) {
    return new Ast.SortExp(pos, name);
  }

  public Ast.Fn fn(Pos pos, String name, Ast.Type paramType, Ast.Exp body) {
    return new Ast.Fn(pos, name, paramType, body);
  }

  /** Creates a curried lambda with one or more parameters,
   * "fn (x: A, y: B) => e". */
  public Ast.Exp fn(Pos pos, List<Map.Entry<String, Ast.Type>> params,
      Ast.Exp body) {
    Ast.Exp e = body;
    for (int i = params.size() - 1; i >= 0; i--) {
      final Map.Entry<String, Ast.Type> param = params.get(i);
      e = fn(pos, param.getKey(), param.getValue(), e);
    }
    return e;
  }

  public Ast.Apply apply(Ast.Exp fn, Ast.Exp arg) {
    return new Ast.Apply(fn.pos.plus(arg.pos), fn, arg);
  }

  /** Creates a curried application, "f(a, b)". */
  public Ast.Exp apply(Pos pos, Ast.Exp fn, List<Ast.Exp> args) {
    Ast.Exp e = fn;
    for (Ast.Exp arg : args) {
      e = new Ast.Apply(pos, e, arg);
    }
    return e;
  }

  public Ast.Select select(Pos pos, Ast.Exp exp, String name) {
    return new Ast.Select(pos, exp, name);
  }

  public Ast.Let let(Pos pos, String name, Ast.@Nullable Type type,
      Ast.Exp exp, Ast.Exp body) {
    return new Ast.Let(pos, name, type, exp, body);
  }

  public Ast.FuzzyLet fuzzyLet(Pos pos, String name, Ast.Exp exp,
      Ast.Exp body) {
    return new Ast.FuzzyLet(pos, name, exp, body);
  }

  public Ast.If ifThenElse(Pos pos, Ast.Exp condition, Ast.Exp ifTrue,
      Ast.Exp ifFalse) {
    return new Ast.If(pos, condition, ifTrue, ifFalse);
  }

  public Ast.AnnotatedExp annotatedExp(Pos pos, Ast.Exp exp, Ast.Type type) {
    return new Ast.AnnotatedExp(pos, exp, type);
  }

  public Ast.Record record(Pos pos, Map<String, Ast.Exp> args) {
    return new Ast.Record(pos, ImmutableSortedMap.copyOf(args, ORDERING));
  }

  public Ast.FuzzyExp fuzzy(Pos pos, Ast.Exp value, Ast.Exp confidence) {
    return new Ast.FuzzyExp(pos, value, confidence);
  }

  public Ast.ValDecl valDecl(Pos pos, String name, Ast.@Nullable Type type,
      Ast.Exp exp) {
    return new Ast.ValDecl(pos, name, type, exp);
  }

  public Ast.TypeDecl typeDecl(Pos pos, String name,
      Ast.@Nullable Type sort, Ast.Type type) {
    return new Ast.TypeDecl(pos, name, sort, type);
  }

  public Ast.PropDecl propDecl(Pos pos, String name,
      Ast.@Nullable Type sort) {
    return new Ast.PropDecl(pos, name, sort);
  }

  public Ast.AxiomDecl axiomDecl(Pos pos, String name, Ast.Type type) {
    return new Ast.AxiomDecl(pos, name, type);
  }

  public Ast.NamedType namedType(Pos pos, String name,
      Iterable<? extends Ast.Type> types) {
    return new Ast.NamedType(pos, name, ImmutableList.copyOf(types));
  }

  public Ast.TyVar tyVar(Pos pos, String name) {
    return new Ast.TyVar(pos, name);
  }

  public Ast.RecordType recordType(Pos pos, Map<String, Ast.Type> fieldTypes) {
    return new Ast.RecordType(pos,
        ImmutableSortedMap.copyOf(fieldTypes, ORDERING));
  }

  public Ast.FunctionType functionType(Pos pos, Ast.Type paramType,
      Ast.Type resultType) {
    return new Ast.FunctionType(pos, paramType, resultType);
  }
}

// End AstBuilder.java
