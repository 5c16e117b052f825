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

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import net.hydromatic.helix.ast.Pos;

/** Converts source text into a list of {@link Token}s.
 *
 * <p>Whitespace and comments are skipped. A comment is either
 * "{@code (* ... *)}", which may nest, or "{@code (*)}", which extends to the
 * end of the line.
 *
 * <p>A number with exactly one digit before the point, one or more digits
 * after it, and no exponent or sign, such as {@code 0.7} or {@code 1.2}, is a
 * probability literal; whether it is in range is decided by the type
 * checker. Other numbers with a point or exponent are real literals. A
 * leading '~' makes a number negative. */
public class Lexer {
  private final String source;
  private final String file;
  /** Offset of the start of each line. */
  private final int[] lineStarts;
  private int offset;

  /** Creates a Lexer. */
  public Lexer(String source, String file) {
    this.source = requireNonNull(source);
    this.file = requireNonNull(file);
    final List<Integer> starts = new ArrayList<>();
    starts.add(0);
    for (int i = 0; i < source.length(); i++) {
      if (source.charAt(i) == '\n') {
        starts.add(i + 1);
      }
    }
    this.lineStarts = starts.stream().mapToInt(i -> i).toArray();
  }

  /** Converts the whole source into tokens. The last token is
   * {@link Token.Kind#EOF}. */
  public ImmutableList<Token> tokenize() {
    final ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    for (;;) {
      final Token token = next();
      tokens.add(token);
      if (token.kind == Token.Kind.EOF) {
        return tokens.build();
      }
    }
  }

  /** Returns the position of a range of offsets. */
  Pos pos(int start, int end) {
    return new Pos(file, line(start) + 1, column(start),
        line(end) + 1, column(end));
  }

  private int line(int offset) {
    final int i = Arrays.binarySearch(lineStarts, offset);
    return i >= 0 ? i : -i - 2;
  }

  private int column(int offset) {
    return offset - lineStarts[line(offset)] + 1;
  }

  private char peek(int ahead) {
    final int i = offset + ahead;
    return i < source.length() ? source.charAt(i) : 0;
  }

  private HelixParseException error(String message, int start, int end) {
    return new HelixParseException(HelixParseException.Kind.LEX, message,
        pos(start, end));
  }

  /** Reads the next token. */
  public Token next() {
    skipWhitespaceAndComments();
    final int start = offset;
    if (offset >= source.length()) {
      return new Token(Token.Kind.EOF, "", null, pos(start, start + 1));
    }
    final char c = source.charAt(offset);
    if (isDigit(c) || c == '~' && isDigit(peek(1))) {
      return number();
    }
    if (isLetterOrDigit(c)) {
      ++offset;
      while (isIdentifierPart(peek(0))) {
        ++offset;
      }
      final String image = source.substring(start, offset);
      final Token.Kind keyword = Token.Kind.keyword(image);
      return new Token(keyword != null ? keyword : Token.Kind.ID, image, null,
          pos(start, offset));
    }
    if (c == '\'') {
      ++offset;
      if (peek(0) < 'a' || peek(0) > 'z') {
        throw error("invalid type variable", start, offset);
      }
      while (isLetterOrDigit(peek(0))) {
        ++offset;
      }
      return new Token(Token.Kind.TY_VAR, source.substring(start, offset),
          null, pos(start, offset));
    }
    if (c == '"') {
      return string();
    }
    final Token.Kind kind;
    switch (c) {
    case '(':
      kind = Token.Kind.LPAREN;
      break;
    case ')':
      kind = Token.Kind.RPAREN;
      break;
    case '{':
      kind = Token.Kind.LBRACE;
      break;
    case '}':
      kind = Token.Kind.RBRACE;
      break;
    case '<':
      kind = Token.Kind.LT;
      break;
    case '>':
      kind = Token.Kind.GT;
      break;
    case ',':
      kind = Token.Kind.COMMA;
      break;
    case '.':
      kind = Token.Kind.DOT;
      break;
    case ':':
      kind = Token.Kind.COLON;
      break;
    case ';':
      kind = Token.Kind.SEMICOLON;
      break;
    case '=':
      kind = peek(1) == '>' ? Token.Kind.DARROW : Token.Kind.EQ;
      break;
    case '-':
      if (peek(1) == '>') {
        kind = Token.Kind.ARROW;
        break;
      }
      // fall through
    default:
      throw error("unexpected character '" + c + "'", start, start + 1);
    }
    offset += requireNonNull(kind.text).length();
    return new Token(kind, kind.text, null, pos(start, offset));
  }

  private void skipWhitespaceAndComments() {
    for (;;) {
      if (offset >= source.length()) {
        return;
      }
      final char c = source.charAt(offset);
      if (Character.isWhitespace(c)) {
        ++offset;
      } else if (c == '(' && peek(1) == '*' && peek(2) == ')') {
        // "(*)" comments out the rest of the line
        while (offset < source.length() && source.charAt(offset) != '\n') {
          ++offset;
        }
      } else if (c == '(' && peek(1) == '*') {
        skipBlockComment();
      } else {
        return;
      }
    }
  }

  private void skipBlockComment() {
    final int start = offset;
    int depth = 0;
    while (offset < source.length()) {
      if (peek(0) == '(' && peek(1) == '*') {
        ++depth;
        offset += 2;
      } else if (peek(0) == '*' && peek(1) == ')') {
        offset += 2;
        if (--depth == 0) {
          return;
        }
      } else {
        ++offset;
      }
    }
    throw error("unterminated comment", start, start + 2);
  }

  private Token number() {
    final int start = offset;
    final boolean negative = peek(0) == '~';
    if (negative) {
      ++offset;
    }
    final int intStart = offset;
    while (isDigit(peek(0))) {
      ++offset;
    }
    final int intDigits = offset - intStart;
    boolean fraction = false;
    boolean exponent = false;
    if (peek(0) == '.' && isDigit(peek(1))) {
      fraction = true;
      ++offset;
      while (isDigit(peek(0))) {
        ++offset;
      }
    }
    if ((peek(0) == 'e' || peek(0) == 'E')
        && (isDigit(peek(1)) || peek(1) == '~' && isDigit(peek(2)))) {
      exponent = true;
      offset += 2;
      while (isDigit(peek(0))) {
        ++offset;
      }
    }
    if (isIdentifierPart(peek(0))) {
      throw error("invalid numeric literal", start, offset + 1);
    }
    final String image = source.substring(start, offset);
    final Pos pos = pos(start, offset);
    if (!fraction && !exponent) {
      final long value = intDigits > 10
          ? Long.MAX_VALUE
          : Long.parseLong(image.replace('~', '-'));
      if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
        throw error("integer literal " + image + " is out of range",
            start, offset);
      }
      return new Token(Token.Kind.INT_LITERAL, image, (int) value, pos);
    }
    final BigDecimal value;
    try {
      value = new BigDecimal(image.replace('~', '-'));
    } catch (NumberFormatException e) {
      // exponent does not fit in an int
      throw error("invalid numeric literal", start, offset);
    }
    if (!negative && intDigits == 1 && fraction && !exponent) {
      return new Token(Token.Kind.PROB_LITERAL, image, value, pos);
    }
    return new Token(Token.Kind.REAL_LITERAL, image, value, pos);
  }

  private Token string() {
    final int start = offset;
    final StringBuilder b = new StringBuilder();
    ++offset;
    for (;;) {
      if (offset >= source.length()) {
        throw error("unterminated string", start, start + 1);
      }
      final char c = source.charAt(offset++);
      if (c == '"') {
        return new Token(Token.Kind.STRING_LITERAL,
            source.substring(start, offset), b.toString(),
            pos(start, offset));
      }
      if (c == '\\') {
        final char c2 = peek(0);
        switch (c2) {
        case '"':
        case '\\':
          b.append(c2);
          break;
        case 'n':
          b.append('\n');
          break;
        case 't':
          b.append('\t');
          break;
        default:
          throw error("invalid escape sequence", offset - 1, offset + 1);
        }
        ++offset;
      } else {
        b.append(c);
      }
    }
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isLetterOrDigit(char c) {
    return c >= 'a' && c <= 'z'
        || c >= 'A' && c <= 'Z'
        || isDigit(c)
        || c == '_';
  }

  private static boolean isIdentifierPart(char c) {
    return isLetterOrDigit(c) || c == '\'';
  }
}

// End Lexer.java
