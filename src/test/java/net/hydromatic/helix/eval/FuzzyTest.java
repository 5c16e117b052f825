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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.util.function.Function;
import org.junit.jupiter.api.Test;

/** Tests {@link Fuzzy}. */
public class FuzzyTest {
  private static final Prob P09 = Prob.of("0.9");
  private static final Prob P08 = Prob.of("0.8");
  private static final Prob P05 = Prob.of("0.5");

  @Test
  void testMap() {
    final Fuzzy<Integer> x = Fuzzy.of(41, P09);
    assertThat(x.map(i -> i + 1), is(Fuzzy.of(42, P09)));
    // identity
    assertThat(x.map(i -> i), is(x));
    // composition
    final Function<Integer, Integer> f = i -> i * 2;
    final Function<Integer, String> g = i -> "#" + i;
    assertThat(x.map(f).map(g), is(x.map(f.andThen(g))));
  }

  /** A pure function lifted over a fuzzy value leaves its confidence
   * unchanged, at every confidence. */
  @Test
  void testMapKeepsConfidence() {
    final Function<Integer, String> f = i -> "#" + i;
    for (Prob c : ProbsTest.grid()) {
      final Fuzzy<Integer> x = Fuzzy.of(7, c);
      assertThat(x.map(f).confidence, is(c));
      assertThat(x.map(f).value, is("#7"));
      assertThat(x.map(i -> i), is(x));
    }
  }

  /** The confidence of a combination is the product of the confidences,
   * and never exceeds either of them. */
  @Test
  void testCombineGrid() {
    for (Prob c1 : ProbsTest.grid()) {
      for (Prob c2 : ProbsTest.grid()) {
        final Fuzzy<Integer> z =
            Fuzzy.of(1, c1).combine(Fuzzy.of(2, c2), Integer::sum);
        assertThat(z.value, is(3));
        assertThat(z.confidence, is(Probs.mul(c1, c2)));
        assertThat(z.confidence.compareTo(c1) <= 0, is(true));
        assertThat(z.confidence.compareTo(c2) <= 0, is(true));
      }
    }
  }

  @Test
  void testCombine() {
    final Fuzzy<Integer> x = Fuzzy.of(1, P08);
    final Fuzzy<Integer> y = Fuzzy.of(2, P05);
    assertThat(x.combine(y, Integer::sum), is(Fuzzy.of(3, Prob.of("0.4"))));
    // confidence is symmetric
    assertThat(y.combine(x, Integer::sum).confidence,
        is(x.combine(y, Integer::sum).confidence));
  }

  @Test
  void testBind() {
    final Fuzzy<Integer> x = Fuzzy.of(3, P08);
    final Function<Integer, Fuzzy<Integer>> f = i -> Fuzzy.of(i + 1, P05);
    assertThat(x.bind(f), is(Fuzzy.of(4, Prob.of("0.4"))));
    // left identity: a certain value bound to f is f applied to the value
    assertThat(Fuzzy.of(3, Prob.ONE).bind(f), is(f.apply(3)));
    // right identity
    assertThat(x.bind(i -> Fuzzy.of(i, Prob.ONE)), is(x));
    // associativity
    final Function<Integer, Fuzzy<Integer>> g = i -> Fuzzy.of(i * 10, P09);
    assertThat(x.bind(f).bind(g), is(x.bind(i -> f.apply(i).bind(g))));
  }

  @Test
  void testToString() {
    assertThat(Fuzzy.of(42, P09).toString(), is("fuzzy(42, 0.9)"));
    assertThat(Fuzzy.of("a", Prob.ONE).toString(), is("fuzzy(a, 1.0)"));
  }
}

// End FuzzyTest.java
