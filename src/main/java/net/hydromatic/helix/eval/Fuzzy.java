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

import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;

/** A value paired with a confidence; the Java form of a value of type
 * {@code Fuzzy<T>}.
 *
 * @param <T> Value type */
public final class Fuzzy<T> {
  public final T value;
  public final Prob confidence;

  private Fuzzy(T value, Prob confidence) {
    this.value = requireNonNull(value);
    this.confidence = requireNonNull(confidence);
  }

  /** Creates a Fuzzy. */
  public static <T> Fuzzy<T> of(T value, Prob confidence) {
    return new Fuzzy<>(value, confidence);
  }

  /** Applies a pure function to the value. The confidence is unchanged. */
  public <U> Fuzzy<U> map(Function<? super T, ? extends U> f) {
    return of(f.apply(value), confidence);
  }

  /** Combines two fuzzy values under a binary operator. Confidences are
   * assumed independent, so they multiply. */
  public <U, R> Fuzzy<R> combine(Fuzzy<U> other,
      BiFunction<? super T, ? super U, ? extends R> op) {
    return of(op.apply(value, other.value),
        Probs.combine(confidence, other.confidence));
  }

  /** Applies a function that returns a fuzzy value, and discounts its
   * confidence by this value's confidence. */
  public <U> Fuzzy<U> bind(Function<? super T, Fuzzy<U>> f) {
    final Fuzzy<U> u = f.apply(value);
    return of(u.value, Probs.mul(confidence, u.confidence));
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Fuzzy
        && value.equals(((Fuzzy) o).value)
        && confidence.equals(((Fuzzy) o).confidence);
  }

  @Override public int hashCode() {
    return Objects.hash(value, confidence);
  }

  @Override public String toString() {
    return "fuzzy(" + value + ", " + confidence + ")";
  }
}

// End Fuzzy.java
