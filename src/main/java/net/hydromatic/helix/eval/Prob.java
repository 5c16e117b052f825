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

import java.math.BigDecimal;

/** A probability, a real number in the closed interval [0, 1].
 *
 * <p>Instances are immutable. It is not possible to create an instance
 * outside the interval: {@link #of(BigDecimal)} throws a
 * {@link HelixRuntimeException} of kind
 * {@link HelixRuntimeException.Kind#PROB_INVARIANT}.
 *
 * <p>Equality is numeric: {@code 0.40} equals {@code 0.4}. */
public final class Prob implements Comparable<Prob> {
  public static final Prob ZERO = new Prob(BigDecimal.ZERO);
  public static final Prob ONE = new Prob(BigDecimal.ONE);

  private final BigDecimal value;

  private Prob(BigDecimal value) {
    this.value = requireNonNull(value);
  }

  /** Returns whether a number is a valid probability. */
  public static boolean isValid(BigDecimal value) {
    return value.signum() >= 0 && value.compareTo(BigDecimal.ONE) <= 0;
  }

  /** Creates a Prob, throwing if the value is out of range. */
  public static Prob of(BigDecimal value) {
    if (!isValid(value)) {
      throw new HelixRuntimeException(
          HelixRuntimeException.Kind.PROB_INVARIANT,
          "probability " + value.toPlainString()
              + " is out of range [0, 1]");
    }
    return new Prob(value);
  }

  /** Creates a Prob from a string such as "0.35". */
  public static Prob of(String s) {
    return of(new BigDecimal(s));
  }

  /** Returns the value as a {@link BigDecimal}. */
  public BigDecimal bigDecimalValue() {
    return value;
  }

  public double doubleValue() {
    return value.doubleValue();
  }

  @Override public int compareTo(Prob o) {
    return value.compareTo(o.value);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Prob
        && value.compareTo(((Prob) o).value) == 0;
  }

  @Override public int hashCode() {
    return value.signum() == 0 ? 0 : value.stripTrailingZeros().hashCode();
  }

  /** Returns the value with at least one fractional digit and no trailing
   * zeros beyond it, e.g. "0.35", "1.0", "0.0". */
  @Override public String toString() {
    final String s = value.stripTrailingZeros().toPlainString();
    return s.indexOf('.') < 0 ? s + ".0" : s;
  }
}

// End Prob.java
