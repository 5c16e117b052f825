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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.Map;
import net.hydromatic.helix.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Token produced by the {@link Lexer}. */
public class Token {
  public final Kind kind;
  /** Source text of the token. */
  public final String image;
  /** Value of a literal token: an {@link Integer}, a
   * {@link java.math.BigDecimal} or a {@link String}; otherwise null. */
  public final @Nullable Object value;
  public final Pos pos;

  Token(Kind kind, String image, @Nullable Object value, Pos pos) {
    this.kind = requireNonNull(kind);
    this.image = requireNonNull(image);
    this.value = value;
    this.pos = requireNonNull(pos);
  }

  @Override public String toString() {
    return kind == Kind.EOF ? "end of input" : "'" + image + "'";
  }

  /** Kinds of token. */
  public enum Kind {
    ID,
    TY_VAR,
    INT_LITERAL,
    REAL_LITERAL,
    PROB_LITERAL,
    STRING_LITERAL,

    // keywords
    TYPE_SORT("Type"),
    PROP_SORT("Prop"),
    PROB("Prob"),
    FUZZY_TYPE("Fuzzy"),
    VAL("val"),
    TYPE("type"),
    PROP("prop"),
    AXIOM("axiom"),
    FN("fn"),
    LET("let"),
    IN("in"),
    IF("if"),
    THEN("then"),
    ELSE("else"),
    FUZZY("fuzzy"),
    TRUE("true"),
    FALSE("false"),

    // punctuation
    LPAREN("("),
    RPAREN(")"),
    LBRACE("{"),
    RBRACE("}"),
    LT("<"),
    GT(">"),
    COMMA(","),
    DOT("."),
    COLON(":"),
    SEMICOLON(";"),
    EQ("="),
    DARROW("=>"),
    ARROW("->"),

    EOF;

    /** Fixed text of a keyword or punctuation token, or null. */
    public final @Nullable String text;

    private static final ImmutableMap<String, Kind> KEYWORDS;

    static {
      final Map<String, Kind> map = new HashMap<>();
      for (Kind kind : values()) {
        if (kind.text != null
            && Character.isLetter(kind.text.charAt(0))) {
          map.put(kind.text, kind);
        }
      }
      KEYWORDS = ImmutableMap.copyOf(map);
    }

    Kind() {
      this(null);
    }

    Kind(@Nullable String text) {
      this.text = text;
    }

    /** Returns the keyword with the given text, or null if the text is an
     * ordinary identifier. */
    static @Nullable Kind keyword(String name) {
      return KEYWORDS.get(name);
    }

    /** Description for error messages, e.g. "'=>'" or "identifier". */
    public String describe() {
      if (text != null) {
        return "'" + text + "'";
      }
      switch (this) {
      case ID:
        return "identifier";
      case TY_VAR:
        return "type variable";
      case EOF:
        return "end of input";
      default:
        return "literal";
      }
    }
  }
}

// End Token.java
