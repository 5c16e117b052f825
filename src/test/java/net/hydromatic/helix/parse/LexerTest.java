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
package net.hydromatic.helix.parse;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;
import net.hydromatic.helix.ast.Pos;
import org.junit.jupiter.api.Test;

/** Tests {@link Lexer}. */
public class LexerTest {
  private static List<Token> tokens(String s) {
    return new Lexer(s, "stdIn").tokenize();
  }

  private static String kinds(String s) {
    return tokens(s).stream()
        .map(t -> t.kind.name())
        .collect(Collectors.joining(" "));
  }

  private static HelixParseException error(String s) {
    return assertThrows(HelixParseException.class, () -> tokens(s));
  }

  @Test
  void testKinds() {
    assertThat(kinds("val x = 0.5;"),
        is("VAL ID EQ PROB_LITERAL SEMICOLON EOF"));
    assertThat(kinds("fn (x: Prob) => x"),
        is("FN LPAREN ID COLON PROB RPAREN DARROW ID EOF"));
    assertThat(kinds("Fuzzy<Int> -> Type"),
        is("FUZZY_TYPE LT ID GT ARROW TYPE_SORT EOF"));
    assertThat(kinds("let fuzzy x = y in z"),
        is("LET FUZZY ID EQ ID IN ID EOF"));
    assertThat(kinds("'a x' x_1"), is("TY_VAR ID ID EOF"));
    assertThat(kinds(""), is("EOF"));
  }

  @Test
  void testNumbers() {
    final List<Token> tokens = tokens("0.35 12.5 ~0.5 2.5e0 1.0e~1 42 ~3");
    assertThat(tokens.get(0).kind, is(Token.Kind.PROB_LITERAL));
    assertThat(tokens.get(0).value, is(new BigDecimal("0.35")));
    assertThat(tokens.get(1).kind, is(Token.Kind.REAL_LITERAL));
    assertThat(tokens.get(2).kind, is(Token.Kind.REAL_LITERAL));
    assertThat(tokens.get(2).value, is(new BigDecimal("-0.5")));
    assertThat(tokens.get(3).kind, is(Token.Kind.REAL_LITERAL));
    assertThat(tokens.get(4).kind, is(Token.Kind.REAL_LITERAL));
    assertThat(tokens.get(4).value, is(new BigDecimal("1.0e-1")));
    assertThat(tokens.get(5).value, is(42));
    assertThat(tokens.get(6).value, is(-3));
    // "1." is an integer followed by a dot
    assertThat(kinds("r.1"), is("ID DOT INT_LITERAL EOF"));
    assertThat(kinds("1.a"), is("INT_LITERAL DOT ID EOF"));
  }

  @Test
  void testIntRange() {
    assertThat(tokens("2147483647").get(0).value, is(Integer.MAX_VALUE));
    assertThat(tokens("~2147483648").get(0).value, is(Integer.MIN_VALUE));
    assertThat(error("2147483648").getMessage(),
        is("integer literal 2147483648 is out of range"));
  }

  @Test
  void testStrings() {
    final Token token = tokens("\"a\\\"b\\n\\\\\"").get(0);
    assertThat(token.kind, is(Token.Kind.STRING_LITERAL));
    assertThat(token.value, is("a\"b\n\\"));
    assertThat(error("\"a\\qb\"").getMessage(),
        is("invalid escape sequence"));
    assertThat(error("\"abc").getMessage(), is("unterminated string"));
  }

  @Test
  void testComments() {
    assertThat(kinds("(* a (* b *) c *) x"), is("ID EOF"));
    assertThat(kinds("x (*) rest of line\ny"), is("ID ID EOF"));
    assertThat(kinds("f ()"), is("ID LPAREN RPAREN EOF"));
    assertThat(error("x (* a").getMessage(), is("unterminated comment"));
  }

  @Test
  void testPositions() {
    final List<Token> tokens = tokens("val x =\n  0.5");
    assertThat(tokens.get(1).pos, is(new Pos("stdIn", 1, 5, 1, 6)));
    assertThat(tokens.get(3).pos, is(new Pos("stdIn", 2, 3, 2, 6)));
    assertThat(tokens.get(3).pos.toString(), is("stdIn:2.3-2.6"));
    assertThat(tokens.get(1).pos.toString(), is("stdIn:1.5"));
  }

  @Test
  void testErrors() {
    final HelixParseException e = error("x # y");
    assertThat(e.getMessage(), is("unexpected character '#'"));
    assertThat(e.kind, is(HelixParseException.Kind.LEX));
    assertThat(e.pos(), is(new Pos("stdIn", 1, 3, 1, 4)));
    assertThat(error("x - y").getMessage(), is("unexpected character '-'"));
    assertThat(error("12abc").getMessage(), is("invalid numeric literal"));
    // exponent too large for BigDecimal
    final HelixParseException e2 = error("val r = 1e99999999999");
    assertThat(e2.getMessage(), is("invalid numeric literal"));
    assertThat(e2.pos(), is(new Pos("stdIn", 1, 9, 1, 22)));
    assertThat(tokens("1e999999999").get(0).kind,
        is(Token.Kind.REAL_LITERAL));
    assertThat(error("'1").getMessage(), is("invalid type variable"));
  }
}

// End LexerTest.java
