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

import java.math.BigDecimal;

/** Checked arithmetic on probabilities.
 *
 * <p>Every operation is closed over [0, 1]. Inputs are checked, and so are
 * results; a value out of range indicates an internal error and raises
 * {@link HelixRuntimeException.Kind#PROB_INVARIANT}, never an out-of-range
 * result. */
public abstract class Probs {
  private Probs() {}

  /** Returns {@code p * q}. */
  public static Prob mul(Prob p, Prob q) {
    return result(check(p).multiply(check(q)));
  }

  /** Returns {@code min(p + q, 1)}. Saturates; never fails on valid
   * inputs. */
  public static Prob add(Prob p, Prob q) {
    return result(check(p).add(check(q)).min(BigDecimal.ONE));
  }

  /** Returns {@code 1 - p}. */
  public static Prob complement(Prob p) {
    return result(BigDecimal.ONE.subtract(check(p)));
  }

  /** Combines the confidences of two independent fuzzy values. The same as
   * {@link #mul}. */
  public static Prob combine(Prob c1, Prob c2) {
    return mul(c1, c2);
  }

  /** Returns whether {@code p < q}. */
  public static boolean lt(Prob p, Prob q) {
    return check(p).compareTo(check(q)) < 0;
  }

  /** Returns the greater of two probabilities. */
  public static Prob max(Prob p, Prob q) {
    return lt(p, q) ? q : p;
  }

  /** Returns the lesser of two probabilities. */
  public static Prob min(Prob p, Prob q) {
    return lt(q, p) ? q : p;
  }

  /** Converts a probability to a real number. */
  public static BigDecimal toReal(Prob p) {
    return check(p);
  }

  private static BigDecimal check(Prob p) {
    if (p == null) {
      throw new HelixRuntimeException(
          HelixRuntimeException.Kind.PROB_INVARIANT, "missing probability");
    }
    final BigDecimal v = p.bigDecimalValue();
    if (!Prob.isValid(v)) {
      throw new HelixRuntimeException(
          HelixRuntimeException.Kind.PROB_INVARIANT,
          "probability " + v.toPlainString() + " is out of range [0, 1]");
    }
    return v;
  }

  private static Prob result(BigDecimal v) {
    return Prob.of(v);
  }
}

// End Probs.java
