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
package net.hydromatic.helix.eval;

import static java.util.Objects.requireNonNull;

import net.hydromatic.helix.ast.Pos;
import net.hydromatic.helix.util.HelixException;
import net.hydromatic.helix.util.Outcome;

/** Error that occurs while evaluating a well-typed program.
 *
 * <p>Apart from {@link Kind#STEP_BUDGET_EXCEEDED} and
 * {@link Kind#OVERFLOW}, these errors indicate a defect in the type checker
 * or the evaluator, not in the user's program. */
public class HelixRuntimeException extends RuntimeException
    implements HelixException {
  public final Kind kind;
  private final Pos pos;

  /** Creates a HelixRuntimeException. */
  public HelixRuntimeException(Kind kind, String message, Pos pos) {
    super(message);
    this.kind = requireNonNull(kind);
    this.pos = requireNonNull(pos);
  }

  /** Creates a HelixRuntimeException with no position. */
  public HelixRuntimeException(Kind kind, String message) {
    this(kind, message, Pos.ZERO);
  }

  /** Returns a copy of this exception with a position, if it has none. */
  public HelixRuntimeException withPos(Pos pos) {
    if (!this.pos.equals(Pos.ZERO)) {
      return this;
    }
    final HelixRuntimeException e =
        new HelixRuntimeException(kind, getMessage(), pos);
    e.setStackTrace(getStackTrace());
    return e;
  }

  @Override public String toString() {
    return super.toString() + " at " + pos;
  }

  @Override public Pos pos() {
    return pos;
  }

  @Override public Outcome outcome() {
    return Outcome.RUNTIME_FAILURE;
  }

  @Override public StringBuilder describeTo(StringBuilder buf) {
    if (!pos.equals(Pos.ZERO)) {
      pos.describeTo(buf).append(" ");
    }
    return buf.append("Error: ").append(getMessage());
  }

  /** Kinds of runtime error. */
  public enum Kind {
    /** Evaluation took more steps than allowed by
     * {@link Setting#STEP_BUDGET}. */
    STEP_BUDGET_EXCEEDED,
    /** Integer arithmetic overflowed. */
    OVERFLOW,
    /** A probability outside [0, 1] was given to, or would have been
     * produced by, the probability arithmetic. */
    PROB_INVARIANT,
    /** A term is not a value, but no reduction rule applies. */
    STUCK,
    /** A reduction step changed the type of the term. */
    PRESERVATION_VIOLATED
  }
}

// End HelixRuntimeException.java
