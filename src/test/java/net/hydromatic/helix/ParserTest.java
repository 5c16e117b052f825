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

import static net.hydromatic.helix.Matchers.throwsA;
import static net.hydromatic.helix.Ml.ml;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.base.Strings;
import java.util.List;
import net.hydromatic.helix.ast.Ast;
import net.hydromatic.helix.ast.AstNode;
import net.hydromatic.helix.ast.Op;
import net.hydromatic.helix.ast.Pos;
import net.hydromatic.helix.parse.HelixParseException;
import net.hydromatic.helix.parse.HelixParser;
import org.junit.jupiter.api.Test;

/** Tests the parser. */
public class ParserTest {
  @Test
  void testLiterals() {
    ml("0.7").assertParseSame();
    ml("1.0").assertParseSame();
    ml("0.35").assertParseSame();
    ml("42").assertParseSame();
    ml("~3").assertParseSame();
    ml("12.5").assertParseSame();
    ml("2.5e0").assertParseSame();
    ml("~2.5").assertParseSame();
    ml("true").assertParseSame();
    ml("false").assertParseSame();
    ml("()").assertParseSame();
    ml("\"a\\nb\"").assertParseSame();
    ml("\"say \\\"hi\\\"\"").assertParseSame();
  }

  /** A probability literal is one digit, a point and some digits; it is not
   * range-checked by the parser. */
  @Test
  void testProbLiteral() {
    ml("1.2").withParser(parser -> {
      final AstNode node = parser.program().get(0);
      assertThat(node.op, is(Op.PROB_LITERAL));
    });
    ml("12.5").withParser(parser -> {
      final AstNode node = parser.program().get(0);
      assertThat(node.op, is(Op.REAL_LITERAL));
    });
    ml("~0.5").withParser(parser -> {
      final AstNode node = parser.program().get(0);
      assertThat(node.op, is(Op.REAL_LITERAL));
    });
  }

  @Test
  void testRecord() {
    ml("{a = 1, b = 0.5}").assertParseSame();
    ml("{}").assertParseSame();
    // fields are sorted by name
    ml("{b = 1, a = 2}").assertParse("{a = 2, b = 1}");
    ml("{a = 1}.a").assertParseSame();
    ml("r.a.b").assertParseSame();
    ml("{a = 1, $a$ = 2}")
        .assertParseThrowsParseException("duplicate field 'a'");
  }

  @Test
  void testFn() {
    ml("fn (x: Prob) => prob_complement(x)").assertParseSame();
    ml("fn (x: Prob, y: Prob) => prob_mul(x, y)")
        .assertParse("fn (x: Prob) => fn (y: Prob) => prob_mul(x, y)");
    ml("(fn (x: Int) => x)(1)").assertParseSame();
    ml("fn (f: Int -> Int) => f(1)").assertParseSame();
    ml("fn (x: Int) $1$")
        .assertParseThrowsParseException("expected '=>', found '1'");
  }

  @Test
  void testApply() {
    ml("prob_mul(0.5, 0.7)").assertParseSame();
    ml("f(1)(2)").assertParse("f(1, 2)");
    ml("f(g(1), {a = 2}.a)").assertParseSame();
    ml("f($)$").assertParseThrowsParseException(
        "expected expression, found ')'");
  }

  @Test
  void testLet() {
    ml("let p: Prob = 0.7 in let q: Prob = 0.5 in prob_mul(p, q)")
        .assertParse("let p : Prob = 0.7 in let q : Prob = 0.5 in "
            + "prob_mul(p, q)");
    ml("let x = 1 in x").assertParseSame();
    ml("let fuzzy x = fuzzy(1, 0.9) in fuzzy(x, 0.5)").assertParseSame();
    ml("(let x = 1 in f)(2)").assertParseSame();
    ml("let x = 1 $;$")
        .assertParseThrowsParseException("expected 'in', found ';'");
  }

  @Test
  void testIf() {
    ml("if true then 1 else 2").assertParseSame();
    ml("if int_lt(1, 2) then \"yes\" else \"no\"").assertParseSame();
  }

  @Test
  void testAnnotation() {
    ml("0.5 : Prob").assertParseSame();
    ml("f(0.5 : Prob)").assertParseSame();
    ml("fuzzy(1, 0.9) : Fuzzy<Int>").assertParseSame();
  }

  @Test
  void testDeclarations() {
    ml("val x : Prob = 0.5").assertParseSame();
    ml("val x = 0.5").assertParseSame();
    ml("val f : Prob -> Prob -> Prob = prob_mul").assertParseSame();
    ml("val f : (Prob -> Prob) -> Prob = g").assertParseSame();
    ml("type Gene = {name: String, expression: Prob}")
        .assertParse("type Gene = {expression: Prob, name: String}");
    ml("type T : Type = Int").assertParseSame();
    ml("prop Expressed").assertParseSame();
    ml("prop Expressed : Prop").assertParseSame();
    ml("axiom h : Expressed").assertParseSame();
    ml("val $=$ 1")
        .assertParseThrowsParseException("expected identifier, found '='");
    ml("axiom h $=$ P")
        .assertParseThrowsParseException("expected ':', found '='");
  }

  @Test
  void testSortInExpression() {
    ml("Type").withParser(parser ->
        assertThat(parser.program().get(0), instanceOf(Ast.SortExp.class)));
    ml("Prob").assertParseSame();
  }

  @Test
  void testComments() {
    ml("(* comment *) 1").assertParse("1");
    ml("(* nested (* comment *) *) 1 (*) to end of line").assertParse("1");
    ml("1 (* unterminated").assertParseThrows(
        throwsA(HelixParseException.class, "unterminated comment", null));
  }

  @Test
  void testLexErrors() {
    ml("$#$").assertParseThrowsParseException("unexpected character '#'");
    ml("\"abc").assertParseThrows(
        throwsA(HelixParseException.class, "unterminated string", null));
    ml("99999999999").assertParseThrows(
        throwsA(HelixParseException.class,
            "integer literal 99999999999 is out of range", null));
  }

  @Test
  void testProgram() {
    final List<AstNode> statements =
        new HelixParser("val x = 1; x;\nx", "stdIn").program();
    assertThat(statements.size(), is(3));
    assertThat(statements.get(0), instanceOf(Ast.ValDecl.class));
    assertThat(statements.get(1), instanceOf(Ast.Id.class));
    assertThat(new HelixParser("", "stdIn").program().isEmpty(), is(true));
    ml("1 $2$").assertParseThrowsParseException(
        "expected ';' or end of input, found '2'");
  }

  /** Nesting deeper than {@link HelixParser#MAX_DEPTH} is a parse error,
   * not a stack overflow. */
  @Test
  void testNestingLimit() {
    final int n = HelixParser.MAX_DEPTH;
    final String ok = Strings.repeat("(", n - 1) + "1"
        + Strings.repeat(")", n - 1);
    assertThat(new HelixParser(ok, "stdIn").program().size(), is(1));

    final String parens = Strings.repeat("(", 20_000) + "1"
        + Strings.repeat(")", 20_000);
    final String message = "too deeply nested; the limit is " + n;
    ml(parens).assertParseThrows(
        throwsA(HelixParseException.class, message,
            new Pos("stdIn", 1, n + 1, 1, n + 2)));
    final String fns =
        Strings.repeat("fn (x: Int) => ", 20_000) + "x";
    ml(fns).assertParseThrowsParseException(message);
    final String types =
        "val f : " + Strings.repeat("Int -> ", 20_000) + "Int = 1";
    ml(types).assertParseThrowsParseException(message);
  }

  @Test
  void testRoundTrip() {
    ml("let p: Prob = 0.7 in let q: Prob = 0.5 in prob_mul(p, q)")
        .assertParseRoundTrip();
    ml("fn (x: Int, y: {a: Int}) => if int_lt(x, y.a) then x else y.a")
        .assertParseRoundTrip();
    ml("fuzzy_combine(int_add, fuzzy(1, 0.8), fuzzy(2, 0.5))")
        .assertParseRoundTrip();
    ml("val f : Fuzzy<Int> -> Prob = confidence").assertParseRoundTrip();
    ml("(fn (x: Int) => fn (y: Int) => x)(1)").assertParseRoundTrip();
  }
}

// End ParserTest.java
