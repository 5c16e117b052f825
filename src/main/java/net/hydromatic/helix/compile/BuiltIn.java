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

import static net.hydromatic.helix.type.PrimitiveType.BOOL;
import static net.hydromatic.helix.type.PrimitiveType.INT;
import static net.hydromatic.helix.type.PrimitiveType.PROB;
import static net.hydromatic.helix.type.PrimitiveType.REAL;
import static net.hydromatic.helix.type.PrimitiveType.STRING;

import com.google.common.collect.ImmutableMap;
import java.util.function.BiConsumer;
import java.util.function.Function;
import net.hydromatic.helix.type.FnType;
import net.hydromatic.helix.type.Type;
import net.hydromatic.helix.type.TypeSystem;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Built-in functions.
 *
 * <p>Each built-in is bound, under its {@link #mlName}, in the base
 * environment (see {@link Environments#base()}), unless it is internal. Its
 * reduction rule is in {@link net.hydromatic.helix.eval.Evaluator}.
 */
public enum BuiltIn {
  /** Function "prob_add", of type "Prob -&gt; Prob -&gt; Prob".
   *
   * <p>Saturates at 1. */
  PROB_ADD("prob_add", ts -> ts.fnType(PROB, PROB, PROB)),

  /** Function "prob_mul", of type "Prob -&gt; Prob -&gt; Prob". */
  PROB_MUL("prob_mul", ts -> ts.fnType(PROB, PROB, PROB)),

  /** Function "confidence_combine", of type "Prob -&gt; Prob -&gt; Prob".
   *
   * <p>Combines the confidences of two independent fuzzy values by
   * multiplication. */
  CONFIDENCE_COMBINE("confidence_combine", ts -> ts.fnType(PROB, PROB, PROB)),

  /** Function "prob_complement", of type "Prob -&gt; Prob". */
  PROB_COMPLEMENT("prob_complement", ts -> ts.fnType(PROB, PROB)),

  PROB_MAX("prob_max", ts -> ts.fnType(PROB, PROB, PROB)),

  PROB_MIN("prob_min", ts -> ts.fnType(PROB, PROB, PROB)),

  PROB_LT("prob_lt", ts -> ts.fnType(PROB, PROB, BOOL)),

  PROB_TO_REAL("prob_to_real", ts -> ts.fnType(PROB, REAL)),

  INT_ADD("int_add", ts -> ts.fnType(INT, INT, INT)),

  INT_SUB("int_sub", ts -> ts.fnType(INT, INT, INT)),

  INT_MUL("int_mul", ts -> ts.fnType(INT, INT, INT)),

  INT_LT("int_lt", ts -> ts.fnType(INT, INT, BOOL)),

  INT_EQ("int_eq", ts -> ts.fnType(INT, INT, BOOL)),

  REAL_ADD("real_add", ts -> ts.fnType(REAL, REAL, REAL)),

  REAL_MUL("real_mul", ts -> ts.fnType(REAL, REAL, REAL)),

  /** Function "not", of type "Bool -&gt; Bool". */
  NOT("not", ts -> ts.fnType(BOOL, BOOL)),

  STRING_CONCAT("string_concat", ts -> ts.fnType(STRING, STRING, STRING)),

  /** Function "value", of type "Fuzzy&lt;'a&gt; -&gt; 'a". */
  VALUE("value", ts -> ts.fnType(ts.fuzzyType(ts.typeVar(0)), ts.typeVar(0))),

  /** Function "confidence", of type "Fuzzy&lt;'a&gt; -&gt; Prob". */
  CONFIDENCE("confidence", ts -> ts.fnType(ts.fuzzyType(ts.typeVar(0)), PROB)),

  /** Function "fuzzy_map", of type
   * "('a -&gt; 'b) -&gt; Fuzzy&lt;'a&gt; -&gt; Fuzzy&lt;'b&gt;".
   *
   * <p>Lifts a pure function; the confidence is unchanged. */
  FUZZY_MAP("fuzzy_map", ts ->
      ts.fnType(ts.fnType(ts.typeVar(0), ts.typeVar(1)),
          ts.fuzzyType(ts.typeVar(0)),
          ts.fuzzyType(ts.typeVar(1)))),

  /** Function "fuzzy_combine", of type
   * "('a -&gt; 'b -&gt; 'c) -&gt; Fuzzy&lt;'a&gt; -&gt; Fuzzy&lt;'b&gt;
   * -&gt; Fuzzy&lt;'c&gt;".
   *
   * <p>The result's confidence is the product of the arguments'
   * confidences. */
  FUZZY_COMBINE("fuzzy_combine", ts ->
      ts.fnType(ts.fnType(ts.typeVar(0), ts.typeVar(1), ts.typeVar(2)),
          ts.fuzzyType(ts.typeVar(0)),
          ts.fuzzyType(ts.typeVar(1)),
          ts.fuzzyType(ts.typeVar(2)))),

  /** Function "fuzzy_bind", of type
   * "Fuzzy&lt;'a&gt; -&gt; ('a -&gt; Fuzzy&lt;'b&gt;) -&gt; Fuzzy&lt;'b&gt;".
   *
   * <p>The same as "let fuzzy". */
  FUZZY_BIND("fuzzy_bind", ts ->
      ts.fnType(ts.fuzzyType(ts.typeVar(0)),
          ts.fnType(ts.typeVar(0), ts.fuzzyType(ts.typeVar(1))),
          ts.fuzzyType(ts.typeVar(1)))),

  /** Internal function "fuzzy_discount", of type
   * "Prob -&gt; Fuzzy&lt;'a&gt; -&gt; Fuzzy&lt;'a&gt;".
   *
   * <p>Multiplies the confidence of a fuzzy value by a probability. It is
   * produced by the reduction of "let fuzzy", and cannot be referenced by
   * name. */
  FUZZY_DISCOUNT("fuzzy_discount", true, ts ->
      ts.fnType(PROB, ts.fuzzyType(ts.typeVar(0)),
          ts.fuzzyType(ts.typeVar(0))));

  /** Name of the function in the language, e.g. "prob_add". */
  public final String mlName;

  /** Whether the function is internal (not bound in any environment). */
  public final boolean internal;

  /** Number of arguments the function takes before it reduces. */
  public final int arity;

  private final Function<TypeSystem, Type> typeFunction;

  /** Map of non-internal built-ins, keyed by name. */
  public static final ImmutableMap<String, BuiltIn> BY_ML_NAME;

  static {
    final ImmutableMap.Builder<String, BuiltIn> b = ImmutableMap.builder();
    for (BuiltIn builtIn : values()) {
      if (!builtIn.internal) {
        b.put(builtIn.mlName, builtIn);
      }
    }
    BY_ML_NAME = b.build();
  }

  BuiltIn(String mlName, Function<TypeSystem, Type> typeFunction) {
    this(mlName, false, typeFunction);
  }

  BuiltIn(String mlName, boolean internal,
      Function<TypeSystem, Type> typeFunction) {
    this.mlName = mlName;
    this.internal = internal;
    this.typeFunction = typeFunction;
    this.arity = ((FnType) typeFunction.apply(new TypeSystem())).arity();
  }

  /** Returns the type of this function, which may contain type
   * variables. */
  public Type type(TypeSystem typeSystem) {
    return typeFunction.apply(typeSystem);
  }

  /** Looks up a built-in by name; returns null for internal functions and
   * unknown names. */
  public static @Nullable BuiltIn lookup(String mlName) {
    return BY_ML_NAME.get(mlName);
  }

  /** Calls a consumer for each built-in that is not internal. */
  public static void forEach(
      TypeSystem typeSystem, BiConsumer<BuiltIn, Type> consumer) {
    BY_ML_NAME.values().forEach(b -> consumer.accept(b, b.type(typeSystem)));
  }

  @Override
  public String toString() {
    return mlName;
  }
}

// End BuiltIn.java
