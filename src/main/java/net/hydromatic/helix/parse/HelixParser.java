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

import static net.hydromatic.helix.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.helix.ast.Ast;
import net.hydromatic.helix.ast.AstNode;
import net.hydromatic.helix.ast.Pos;
import net.hydromatic.helix.util.Pair;

/** Recursive-descent parser.
 *
 * <p>Grammar:
 *
 * <pre>
 * program   := [statement (';' statement)*] [';'] EOF
 * statement := 'val' ID [':' type] '=' exp
 *            | 'type' ID [':' type] '=' type
 *            | 'prop' ID [':' type]
 *            | 'axiom' ID ':' type
 *            | exp
 * exp       := 'fn' '(' ID ':' type (',' ID ':' type)* ')' '=&gt;' exp
 *            | 'let' ID [':' type] '=' exp 'in' exp
 *            | 'let' 'fuzzy' ID '=' exp 'in' exp
 *            | 'if' exp 'then' exp 'else' exp
 *            | postfix [':' type]
 * postfix   := atom ( '(' exp (',' exp)* ')' | '.' ID )*
 * atom      := literal | ID | '(' ')' | '(' exp ')'
 *            | '{' [ID '=' exp (',' ID '=' exp)*] '}'
 *            | 'fuzzy' '(' exp ',' exp ')'
 *            | 'Type' | 'Prop' | 'Prob' | 'Fuzzy'
 * type      := btype ['-&gt;' type]
 * btype     := (ID | 'Prob' | 'Type' | 'Prop' | 'Fuzzy')
 *                  ['&lt;' type (',' type)* '&gt;']
 *            | TY_VAR
 *            | '{' [ID ':' type (',' ID ':' type)*] '}'
 *            | '(' type ')'
 * </pre>
 *
 * <p>The parser has no side effects, and knows nothing about types. */
public class HelixParser {
  /** Maximum nesting of expressions and types. */
  public static final int MAX_DEPTH = 1_000;

  private final ImmutableList<Token> tokens;
  private int i;
  private int depth;

  /** Creates a parser. Throws if the source is not lexically valid. */
  public HelixParser(String source, String file) {
    this.tokens = new Lexer(source, file).tokenize();
  }

  /** Creates a parser for a source string that has no file name. */
  public HelixParser(String source) {
    this(source, "");
  }

  /** Parses a program, returning a list of statements. Each statement is an
   * {@link Ast.Decl} or an {@link Ast.Exp}. */
  public List<AstNode> program() {
    final List<AstNode> statements = new ArrayList<>();
    while (!at(Token.Kind.EOF)) {
      statements.add(statement());
      if (!accept(Token.Kind.SEMICOLON)) {
        break;
      }
    }
    expect(Token.Kind.EOF, "';' or end of input");
    return statements;
  }

  /** Parses a single expression, followed by end of input. */
  public Ast.Exp expressionEof() {
    final Ast.Exp exp = exp();
    expect(Token.Kind.EOF, "end of input");
    return exp;
  }

  /** Parses a single type, followed by end of input. */
  public Ast.Type typeEof() {
    final Ast.Type type = type();
    expect(Token.Kind.EOF, "end of input");
    return type;
  }

  private Token peek() {
    return tokens.get(i);
  }

  private boolean at(Token.Kind kind) {
    return peek().kind == kind;
  }

  private boolean accept(Token.Kind kind) {
    if (at(kind)) {
      ++i;
      return true;
    }
    return false;
  }

  private Token expect(Token.Kind kind, String description) {
    if (!at(kind)) {
      throw unexpected(description);
    }
    return tokens.get(i++);
  }

  private Token expect(Token.Kind kind) {
    return expect(kind, kind.describe());
  }

  private HelixParseException unexpected(String expected) {
    final Token token = peek();
    return new HelixParseException(HelixParseException.Kind.PARSE,
        "expected " + expected + ", found " + token, token.pos);
  }

  /** Returns the position from the start of a token to the end of the most
   * recently consumed token. */
  private Pos posFrom(Token start) {
    return start.pos.plus(tokens.get(i - 1).pos);
  }

  private String id() {
    return expect(Token.Kind.ID).image;
  }

  AstNode statement() {
    final Token start = peek();
    switch (start.kind) {
    case VAL: {
      ++i;
      final String name = id();
      final Ast.Type type = accept(Token.Kind.COLON) ? type() : null;
      expect(Token.Kind.EQ);
      final Ast.Exp exp = exp();
      return ast.valDecl(posFrom(start), name, type, exp);
    }
    case TYPE: {
      ++i;
      final String name = id();
      final Ast.Type sort = accept(Token.Kind.COLON) ? type() : null;
      expect(Token.Kind.EQ);
      final Ast.Type type = type();
      return ast.typeDecl(posFrom(start), name, sort, type);
    }
    case PROP: {
      ++i;
      final String name = id();
      final Ast.Type sort = accept(Token.Kind.COLON) ? type() : null;
      return ast.propDecl(posFrom(start), name, sort);
    }
    case AXIOM: {
      ++i;
      final String name = id();
      expect(Token.Kind.COLON);
      final Ast.Type type = type();
      return ast.axiomDecl(posFrom(start), name, type);
    }
    default:
      return exp();
    }
  }

  Ast.Exp exp() {
    enter();
    try {
      return unlimitedExp();
    } finally {
      --depth;
    }
  }

  private Ast.Exp unlimitedExp() {
    final Token start = peek();
    switch (start.kind) {
    case FN: {
      ++i;
      expect(Token.Kind.LPAREN);
      final List<Map.Entry<String, Ast.Type>> params = new ArrayList<>();
      do {
        final String name = id();
        expect(Token.Kind.COLON);
        params.add(Pair.of(name, type()));
      } while (accept(Token.Kind.COMMA));
      expect(Token.Kind.RPAREN, "',' or ')'");
      expect(Token.Kind.DARROW);
      final Ast.Exp body = exp();
      return ast.fn(posFrom(start), params, body);
    }
    case LET: {
      ++i;
      if (accept(Token.Kind.FUZZY)) {
        final String name = id();
        expect(Token.Kind.EQ);
        final Ast.Exp exp = exp();
        expect(Token.Kind.IN);
        final Ast.Exp body = exp();
        return ast.fuzzyLet(posFrom(start), name, exp, body);
      }
      final String name = id();
      final Ast.Type type = accept(Token.Kind.COLON) ? type() : null;
      expect(Token.Kind.EQ);
      final Ast.Exp exp = exp();
      expect(Token.Kind.IN);
      final Ast.Exp body = exp();
      return ast.let(posFrom(start), name, type, exp, body);
    }
    case IF: {
      ++i;
      final Ast.Exp condition = exp();
      expect(Token.Kind.THEN);
      final Ast.Exp ifTrue = exp();
      expect(Token.Kind.ELSE);
      final Ast.Exp ifFalse = exp();
      return ast.ifThenElse(posFrom(start), condition, ifTrue, ifFalse);
    }
    default:
      final Ast.Exp e = postfix();
      if (accept(Token.Kind.COLON)) {
        final Ast.Type type = type();
        return ast.annotatedExp(posFrom(start), e, type);
      }
      return e;
    }
  }

  private Ast.Exp postfix() {
    final Token start = peek();
    Ast.Exp e = atom();
    for (;;) {
      if (accept(Token.Kind.LPAREN)) {
        final List<Ast.Exp> args = new ArrayList<>();
        do {
          args.add(exp());
        } while (accept(Token.Kind.COMMA));
        expect(Token.Kind.RPAREN, "',' or ')'");
        e = ast.apply(posFrom(start), e, args);
      } else if (accept(Token.Kind.DOT)) {
        final String name = id();
        e = ast.select(posFrom(start), e, name);
      } else {
        return e;
      }
    }
  }

  private Ast.Exp atom() {
    final Token start = peek();
    switch (start.kind) {
    case INT_LITERAL:
      ++i;
      return ast.intLiteral(start.pos, (Integer) start.value);
    case REAL_LITERAL:
      ++i;
      return ast.realLiteral(start.pos, (BigDecimal) start.value);
    case PROB_LITERAL:
      ++i;
      return ast.probLiteral(start.pos, (BigDecimal) start.value);
    case STRING_LITERAL:
      ++i;
      return ast.stringLiteral(start.pos, (String) start.value);
    case TRUE:
    case FALSE:
      ++i;
      return ast.boolLiteral(start.pos, start.kind == Token.Kind.TRUE);
    case ID:
      ++i;
      return ast.id(start.pos, start.image);
    case TYPE_SORT:
    case PROP_SORT:
    case PROB:
    case FUZZY_TYPE:
      ++i;
      return ast.sortExp(start.pos, start.image);
    case LPAREN:
      ++i;
      if (accept(Token.Kind.RPAREN)) {
        return ast.unitLiteral(posFrom(start));
      }
      final Ast.Exp e = exp();
      expect(Token.Kind.RPAREN);
      return e;
    case LBRACE: {
      ++i;
      final Map<String, Ast.Exp> args = new LinkedHashMap<>();
      if (!at(Token.Kind.RBRACE)) {
        do {
          final Token label = expect(Token.Kind.ID);
          expect(Token.Kind.EQ);
          if (args.put(label.image, exp()) != null) {
            throw duplicateField(label);
          }
        } while (accept(Token.Kind.COMMA));
      }
      expect(Token.Kind.RBRACE, "',' or '}'");
      return ast.record(posFrom(start), args);
    }
    case FUZZY: {
      ++i;
      expect(Token.Kind.LPAREN);
      final Ast.Exp value = exp();
      expect(Token.Kind.COMMA);
      final Ast.Exp confidence = exp();
      expect(Token.Kind.RPAREN);
      return ast.fuzzy(posFrom(start), value, confidence);
    }
    default:
      throw unexpected("expression");
    }
  }

  /** Starts parsing a nested expression or type; the caller must decrement
   * {@link #depth} when done. */
  private void enter() {
    if (++depth > MAX_DEPTH) {
      --depth;
      throw new HelixParseException(HelixParseException.Kind.PARSE,
          "too deeply nested; the limit is " + MAX_DEPTH, peek().pos);
    }
  }

  private static HelixParseException duplicateField(Token label) {
    return new HelixParseException(HelixParseException.Kind.PARSE,
        "duplicate field '" + label.image + "'", label.pos);
  }

  Ast.Type type() {
    enter();
    try {
      final Token start = peek();
      final Ast.Type type = btype();
      if (accept(Token.Kind.ARROW)) {
        final Ast.Type resultType = type();
        return ast.functionType(posFrom(start), type, resultType);
      }
      return type;
    } finally {
      --depth;
    }
  }

  private Ast.Type btype() {
    final Token start = peek();
    switch (start.kind) {
    case ID:
    case PROB:
    case TYPE_SORT:
    case PROP_SORT:
    case FUZZY_TYPE:
      ++i;
      final List<Ast.Type> args = new ArrayList<>();
      if (accept(Token.Kind.LT)) {
        do {
          args.add(type());
        } while (accept(Token.Kind.COMMA));
        expect(Token.Kind.GT, "',' or '>'");
      }
      return ast.namedType(posFrom(start), start.image, args);
    case TY_VAR:
      ++i;
      return ast.tyVar(start.pos, start.image);
    case LBRACE: {
      ++i;
      final Map<String, Ast.Type> fieldTypes = new LinkedHashMap<>();
      if (!at(Token.Kind.RBRACE)) {
        do {
          final Token label = expect(Token.Kind.ID);
          expect(Token.Kind.COLON);
          if (fieldTypes.put(label.image, type()) != null) {
            throw duplicateField(label);
          }
        } while (accept(Token.Kind.COMMA));
      }
      expect(Token.Kind.RBRACE, "',' or '}'");
      return ast.recordType(posFrom(start), fieldTypes);
    }
    case LPAREN:
      ++i;
      final Ast.Type type = type();
      expect(Token.Kind.RPAREN);
      return type;
    default:
      throw unexpected("type");
    }
  }
}

// End HelixParser.java
