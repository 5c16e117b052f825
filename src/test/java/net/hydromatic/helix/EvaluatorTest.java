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
package net.hydromatic.helix;

import static net.hydromatic.helix.Matchers.isFuzzy;
import static net.hydromatic.helix.Matchers.isProb;
import static net.hydromatic.helix.Matchers.isRuntimeError;
import static net.hydromatic.helix.Matchers.list;
import static net.hydromatic.helix.Matchers.throwsA;
import static net.hydromatic.helix.Ml.assertError;
import static net.hydromatic.helix.Ml.ml;
import static net.hydromatic.helix.ast.CoreBuilder.core;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.helix.ast.Core;
import net.hydromatic.helix.ast.Pos;
import net.hydromatic.helix.eval.Evaluator;
import net.hydromatic.helix.eval.HelixRuntimeException;
import net.hydromatic.helix.eval.HelixRuntimeException.Kind;
import net.hydromatic.helix.eval.Prob;
import net.hydromatic.helix.eval.Session;
import net.hydromatic.helix.eval.Setting;
import net.hydromatic.helix.util.Outcome;
import org.junit.jupiter.api.Test;

/** Tests the evaluator. */
public class EvaluatorTest {
  @Test
  void testProbArithmetic() {
    ml("let p: Prob = 0.7 in let q: Prob = 0.5 in prob_mul(p, q)")
        .assertEval(isProb("0.35"))
        .assertEvalRendered("0.35");
    // addition saturates at 1
    ml("prob_add(0.6, 0.7)")
        .assertEval(isProb("1.0"))
        .assertEvalRendered("1.0");
    ml("prob_add(0.25, 0.5)").assertEvalRendered("0.75");
    ml("prob_complement(0.7)").assertEvalRendered("0.3");
    ml("prob_complement(0.0)").assertEvalRendered("1.0");
    ml("prob_max(0.2, 0.9)").assertEvalRendered("0.9");
    ml("prob_min(0.2, 0.9)").assertEvalRendered("0.2");
    ml("prob_lt(0.2, 0.9)").assertEval(is(true));
    ml("confidence_combine(0.8, 0.5)").assertEvalRendered("0.4");
    ml("prob_to_real(0.5)").assertEvalRendered("0.5e0");
  }

  @Test
  void testPrimitives() {
    ml("int_add(1, 2)").assertEval(is(3));
    ml("int_sub(1, 4)").assertEval(is(-3)).assertEvalRendered("~3");
    ml("int_mul(6, 7)").assertEval(is(42));
    ml("int_lt(1, 2)").assertEval(is(true));
    ml("int_eq(1, 2)").assertEval(is(false));
    ml("not(int_eq(1, 1))").assertEval(is(false));
    ml("real_add(1.5, 2.25)")
        .assertEval(is(new BigDecimal("3.75")))
        .assertEvalRendered("3.75e0");
    ml("real_add(~2.0, ~0.5)").assertEvalRendered("~2.5");
    ml("real_add(10.5, 2.0)").assertEvalRendered("12.5");
    ml("string_concat(\"BRCA\", \"1\")")
        .assertEval(is("BRCA1"))
        .assertEvalRendered("\"BRCA1\"");
    ml("()").assertEvalRendered("()");
  }

  @Test
  void testIntOverflow() {
    ml("int_add(2147483647, 1)")
        .assertEvalThrows(Kind.OVERFLOW, "integer overflow in int_add");
    ml("int_mul(65536, 65536)")
        .assertEvalThrows(Kind.OVERFLOW, "integer overflow in int_mul");
  }

  /** Real arithmetic rounds to 16 significant digits, and fails with
   * OVERFLOW if the exponent is too large to represent. */
  @Test
  void testRealPrecision() {
    ml("real_mul(1234567890.123456789, 1.0)")
        .assertEvalRendered("1234567890.123457");
    ml("real_add(1e1000000, 1e~1000000)")
        .assertEvalRendered("1.0e1000000");
    ml("real_mul(0.5e~7, 0.5)").assertEvalRendered("2.5e~8");
    ml("real_mul(1e2000000000, 1e2000000000)")
        .assertEvalThrows(Kind.OVERFLOW, "real overflow in real_mul");
    ml("real_mul(1e~2000000000, 1e~2000000000)")
        .assertEvalThrows(Kind.OVERFLOW, "real overflow in real_mul");
  }

  /** Reals are rendered without trailing zeros. */
  @Test
  void testRealRendering() {
    ml("real_add(1.25, 1.25)").assertEvalRendered("2.5e0");
    ml("real_mul(1.5, 2.0)").assertEvalRendered("3.0e0");
    ml("real_mul(10.0, 10.0)").assertEvalRendered("100.0");
    ml("real_add(~1.5, 1.5)").assertEvalRendered("0.0e0");
    ml("real_mul(~1.0e~10, 1.0)").assertEvalRendered("~1.0e~10");
  }

  @Test
  void testFn() {
    ml("(fn (x: Int) => int_add(x, 1))(41)").assertEval(is(42));
    ml("(fn (x: Int, y: Int) => int_sub(x, y))(10, 3)").assertEval(is(7));
    ml("fn (x: Int) => x").assertEvalRendered("fn");
    // a partial application of a built-in is a value
    ml("prob_mul(0.5)").assertEvalRendered("fn");
    ml("let f = prob_mul(0.5) in f(0.5)").assertEvalRendered("0.25");
    ml("let twice = fn (f: Int -> Int, x: Int) => f(f(x)) in\n"
        + "twice(int_add(3), 1)")
        .assertEval(is(7));
  }

  /** Substitution does not capture, and an inner binding shadows an outer
   * one. */
  @Test
  void testScope() {
    ml("let x = 1 in let f = fn (y: Int) => int_add(x, y) in\n"
        + "let x = 100 in f(2)")
        .assertEval(is(3));
    ml("let x = 1 in (fn (x: Int) => x)(2)").assertEval(is(2));
    ml("let x = 1 in let x = int_add(x, 1) in x").assertEval(is(2));
  }

  @Test
  void testIf() {
    ml("if int_lt(1, 2) then \"yes\" else \"no\"").assertEval(is("yes"));
    ml("if prob_lt(0.9, 0.2) then 1 else 2").assertEval(is(2));
  }

  @Test
  void testRecord() {
    ml("{name = \"BRCA1\", expression = 0.8}")
        .assertEval(is(list(Prob.of("0.8"), "BRCA1")))
        .assertEvalRendered("{expression = 0.8, name = \"BRCA1\"}");
    ml("{a = int_add(1, 2), b = {c = true}}.b.c").assertEval(is(true));
    ml("{a = int_add(1, 2), b = 0.5}").assertEvalRendered("{a = 3, b = 0.5}");
  }

  @Test
  void testFuzzy() {
    ml("fuzzy(42, 0.9)")
        .assertEval(isFuzzy(42, "0.9"))
        .assertEvalRendered("fuzzy(42, 0.9)");
    ml("fuzzy_map(fn (x: Int) => int_add(x, 1), fuzzy(41, 0.9))")
        .assertEval(isFuzzy(42, "0.9"));
    ml("fuzzy_combine(int_add, fuzzy(1, 0.8), fuzzy(2, 0.5))")
        .assertEval(isFuzzy(3, "0.4"))
        .assertEvalRendered("fuzzy(3, 0.4)");
    ml("fuzzy_bind(fuzzy(3, 0.8), fn (x: Int) => fuzzy(int_add(x, 1), 0.5))")
        .assertEval(isFuzzy(4, "0.4"));
    ml("let fuzzy x = fuzzy(2, 0.9) in fuzzy(int_mul(x, x), 0.5)")
        .assertEval(isFuzzy(4, "0.45"));
    ml("value(fuzzy(\"x\", 0.9))").assertEval(is("x"));
    ml("confidence(fuzzy(\"x\", 0.9))").assertEval(isProb("0.9"));
    ml("fuzzy(fuzzy(1, 0.5), 0.5)")
        .assertEvalRendered("fuzzy(fuzzy(1, 0.5), 0.5)");
    // the confidence of a fuzzy value is evaluated
    ml("fuzzy(1, prob_mul(0.5, 0.5))").assertEvalRendered("fuzzy(1, 0.25)");
  }

  @Test
  void testLines() {
    ml("val p = 0.7; val q = prob_complement(p); q")
        .assertLines("val p = 0.7 : Prob",
            "val q = 0.3 : Prob",
            "val it = 0.3 : Prob");
    ml("type Gene = {name: String, expression: Prob};\n"
        + "val g : Gene = {name = \"BRCA1\", expression = 0.8};\n"
        + "g.expression")
        .assertLines("type Gene = {expression: Prob, name: String}",
            "val g = {expression = 0.8, name = \"BRCA1\"} "
                + ": {expression: Prob, name: String}",
            "val it = 0.8 : Prob");
    ml("prop P; axiom h : P; val h2 : P = h")
        .assertLines("prop P : Prop", "axiom h : P", "axiom h2 : P");
    ml("val f = fn (x: Fuzzy<Int>) => confidence(x)")
        .assertLines("val f = fn : Fuzzy<Int> -> Prob");
    ml("val x = fuzzy(1, 0.9)")
        .assertLines("val x = fuzzy(1, 0.9) : Fuzzy<Int>");
    ml("val r : Real = 0.5").assertLines("val r = 0.5e0 : Real");
  }

  @Test
  void testStepBudget() {
    ml("int_add(int_add(1, 2), int_add(3, 4))").assertSteps(is(3));
    ml("prob_mul(0.5, 0.7)").assertSteps(is(1));
    ml("let x = 1 in int_add(x, x)").assertSteps(is(2));
    ml("int_add(int_add(1, 2), int_add(3, 4))")
        .with(Setting.STEP_BUDGET, 3)
        .assertEval(is(10));
    ml("int_add(int_add(1, 2), int_add(3, 4))")
        .with(Setting.STEP_BUDGET, 2)
        .assertEvalThrows(Kind.STEP_BUDGET_EXCEEDED,
            "evaluation exceeded the step budget of 2 steps");
    ml("int_add(int_add(1, 2), int_add(3, 4))")
        .with(Setting.STEP_BUDGET, -1)
        .assertSteps(greaterThan(0));
  }

  /** A runtime error stops evaluation, and the lines of the statements that
   * completed are kept. */
  @Test
  void testErrorStopsProgram() {
    final Helix.Checked checked =
        Helix.typecheck("val a = 1;\nval b = int_add(2147483647, a);\n"
            + "val c = 3", "stdIn");
    final Helix.Result result = Helix.run(checked.program());
    assertThat(result.lines, is(List.of("val a = 1 : Int")));
    assertThat(result.outcome(), is(Outcome.RUNTIME_FAILURE));
    assertThat(result.error != null, is(true));
    final StringBuilder buf = new StringBuilder();
    new Session().handle(result.error, buf);
    assertThat(buf.toString(),
        is("stdIn:2.9-2.31 Error: integer overflow in int_add"));
    assertThat(result.env.getOpt("a") != null, is(true));
    assertThat(result.env.getOpt("b") == null, is(true));
  }

  /** A term that is not a value, but to which no rule applies, is stuck.
   * The type checker never produces one. */
  @Test
  void testStuck() {
    final Pos pos = Pos.ZERO;
    final Core.Exp exp =
        core.ifThenElse(pos, core.intLiteral(pos, 1),
            core.intLiteral(pos, 2), core.intLiteral(pos, 3));
    final Evaluator evaluator = new Evaluator(new Session());
    assertError(() -> evaluator.step(exp), isRuntimeError(Kind.STUCK));
    assertError(() -> evaluator.evaluate(exp),
        throwsA(HelixRuntimeException.class,
            "no reduction rule applies to 1", null));
    assertThat(evaluator.step(core.intLiteral(pos, 1)) == null, is(true));
  }

  /** With {@link Setting#VERIFY_STEPS}, a step that changes the type of the
   * term is an error. */
  @Test
  void testPreservationViolated() {
    final Pos pos = Pos.ZERO;
    final Core.Exp exp =
        core.ifThenElse(pos, core.boolLiteral(pos, false),
            core.intLiteral(pos, 2), core.stringLiteral(pos, "three"));
    final Map<Setting, Object> map = new LinkedHashMap<>();
    Setting.VERIFY_STEPS.set(map, true);
    final Evaluator evaluator = new Evaluator(new Session(map));
    assertError(() -> evaluator.evaluate(exp),
        throwsA(HelixRuntimeException.class,
            "reduction changed type from Int to String", null));

    // Without verification, the bad step goes unnoticed.
    final Core.Exp value = new Evaluator(new Session()).evaluate(exp);
    assertThat(value.toString(), is("\"three\""));
  }
}

// End EvaluatorTest.java
