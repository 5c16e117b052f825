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

import java.math.BigDecimal;

/** Context for writing an AST out as a string. */
public class AstWriter {
  /** Range of decimal exponents for which {@link #realToString} writes a
   * plain number. */
  private static final int MIN_PLAIN_EXPONENT = -7;
  private static final int MAX_PLAIN_EXPONENT = 20;

  private final StringBuilder b = new StringBuilder();

  /** Appends a string to the output. */
  public AstWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends a node, in a context of given precedence. */
  public AstWriter append(AstNode node, int left, int right) {
    return node.unparse(this, left, right);
  }

  /** Appends an identifier. */
  public AstWriter id(String name) {
    return append(name);
  }

  /** Appends a node enclosed in parentheses. */
  public AstWriter parens(AstNode node) {
    return append("(").append(node, 0, 0).append(")");
  }

  /** Appends a literal. */
  public AstWriter appendLiteral(Op op, Object value) {
    switch (op) {
    case BOOL_LITERAL:
      return append((Boolean) value ? "true" : "false");
    case INT_LITERAL:
      return append(intToString((Integer) value));
    case REAL_LITERAL:
      return append(realToString((BigDecimal) value));
    case PROB_LITERAL:
      return append(value instanceof BigDecimal
          ? ((BigDecimal) value).toPlainString()
          : value.toString());
    case STRING_LITERAL:
      return append(stringToString((String) value));
    case UNIT_LITERAL:
      return append("()");
    case FN_LITERAL:
      return id(value.toString());
    default:
      throw new AssertionError("unknown literal " + op);
    }
  }

  /** Converts an integer to source form, e.g. "42", "~3". */
  public static String intToString(int i) {
    return i < 0
        ? "~" + Long.toString(-(long) i)
        : Integer.toString(i);
  }

  /** Converts a real number to source form.
   *
   * <p>Always has a fractional digit, and no trailing zeros. A non-negative
   * value less than 10 gets an exponent, so that it is not read back as a
   * probability literal; e.g. "2.5e0", "12.5", "~2.5". A very large or very
   * small value is written in scientific notation, e.g. "1.0e400",
   * "~1.5e~8". */
  public static String realToString(BigDecimal value) {
    final BigDecimal abs = value.abs().stripTrailingZeros();
    final int exponent = abs.precision() - abs.scale() - 1;
    String s;
    if (abs.signum() != 0
        && (exponent < MIN_PLAIN_EXPONENT || exponent > MAX_PLAIN_EXPONENT)) {
      final String digits = abs.unscaledValue().toString();
      s = digits.charAt(0) + "."
          + (digits.length() > 1 ? digits.substring(1) : "0")
          + "e" + intToString(exponent);
    } else {
      s = abs.toPlainString();
      if (s.indexOf('.') < 0) {
        s += ".0";
      }
      if (value.signum() >= 0 && abs.compareTo(BigDecimal.TEN) < 0) {
        s += "e0";
      }
    }
    return value.signum() < 0 ? "~" + s : s;
  }

  /** Converts a string to a quoted literal, escaping special characters. */
  public static String stringToString(String s) {
    final StringBuilder buf = new StringBuilder("\"");
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      switch (c) {
      case '"':
        buf.append("\\\"");
        break;
      case '\\':
        buf.append("\\\\");
        break;
      case '\n':
        buf.append("\\n");
        break;
      case '\t':
        buf.append("\\t");
        break;
      default:
        buf.append(c);
      }
    }
    return buf.append('"').toString();
  }

  @Override public String toString() {
    return b.toString();
  }
}

// End AstWriter.java
