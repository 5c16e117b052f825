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

import net.hydromatic.helix.ast.Pos;
import net.hydromatic.helix.util.HelixException;
import net.hydromatic.helix.util.Outcome;

/** Exception caused by a lexical or syntax error. */
public class HelixParseException extends RuntimeException
    implements HelixException {
  public final Kind kind;
  private final Pos pos;

  HelixParseException(Kind kind, String message, Pos pos) {
    super(message);
    this.kind = requireNonNull(kind);
    this.pos = requireNonNull(pos);
  }

  @Override public String toString() {
    return super.toString() + " at " + pos;
  }

  @Override public Pos pos() {
    return pos;
  }

  @Override public Outcome outcome() {
    return Outcome.PARSE_FAILURE;
  }

  @Override public StringBuilder describeTo(StringBuilder buf) {
    return pos.describeTo(buf)
        .append(" Error: ")
        .append(getMessage());
  }

  /** Kind of parse error. */
  public enum Kind {
    /** Invalid character sequence, such as an unterminated string. */
    LEX,
    /** Tokens that do not match the grammar. */
    PARSE
  }
}

// End HelixParseException.java
