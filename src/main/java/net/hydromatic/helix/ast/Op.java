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

/** Sub-types of {@link AstNode}, of {@link Core.Exp} and of
 * {@link net.hydromatic.helix.type.Type}. */
public enum Op {
  // identifiers
  ID(true),

  // literals
  BOOL_LITERAL(true),
  INT_LITERAL(true),
  REAL_LITERAL(true),
  /** Probability literal, such as {@code 0.7}: one digit, a point, and one
   * or more digits. */
  PROB_LITERAL(true),
  STRING_LITERAL(true),
  UNIT_LITERAL(true),
  /** Literal whose value is a {@link net.hydromatic.helix.compile.BuiltIn}. */
  FN_LITERAL(true), // occurs in Core, not in Ast

  // value constructors
  RECORD(true),
  FUZZY(true),
  FN,

  // postfix
  APPLY(true),
  SELECT(true),

  // annotated expression "e : t"
  ANNOTATED_EXP(" : ", 0),

  // control
  LET,
  FUZZY_LET,
  IF,

  /** Sort or type keyword ({@code Type}, {@code Prop}, {@code Prob},
   * {@code Fuzzy}) in expression position. */
  SORT(true),

  // declarations
  VAL_DECL,
  TYPE_DECL,
  PROP_DECL,
  AXIOM_DECL,

  // types
  NAMED_TYPE(true),
  TY_VAR(true),
  RECORD_TYPE(true),
  FUZZY_TYPE(true),
  PROP_TYPE(true),
  FUNCTION_TYPE(" -> ", 0);

  /** Padded name, e.g. " : ". */
  public final String padded;
  /** Precedence of the node as seen from its left. */
  public final int left;
  /** Precedence of the node as seen from its right. A node is enclosed in
   * parentheses if its context requires a higher precedence. */
  public final int right;

  Op() {
    this("", 0);
  }

  Op(boolean atom) {
    this("", 99);
    assert atom;
  }

  Op(String padded, int precedence) {
    this.padded = padded;
    this.left = precedence;
    this.right = precedence;
  }
}

// End Op.java
