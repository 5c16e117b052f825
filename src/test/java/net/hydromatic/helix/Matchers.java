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
package net.hydromatic.helix;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.util.Arrays;
import java.util.List;
import net.hydromatic.helix.ast.AstNode;
import net.hydromatic.helix.ast.Pos;
import net.hydromatic.helix.eval.Fuzzy;
import net.hydromatic.helix.eval.HelixRuntimeException;
import net.hydromatic.helix.eval.Prob;
import net.hydromatic.helix.type.Type;
import net.hydromatic.helix.util.HelixException;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Description;
import org.hamcrest.Matcher;
import org.hamcrest.TypeSafeMatcher;

/** Matchers for use in Helix tests. */
public abstract class Matchers {
  private Matchers() {}

  /** Matches an AST node by its string representation. */
  static <T extends AstNode> Matcher<T> isAst(
      Class<? extends T> clazz, String expected) {
    return new CustomTypeSafeMatcher<T>("ast with value " + expected) {
      @Override
      protected boolean matchesSafely(T t) {
        assertThat(clazz.isInstance(t), is(true));
        final String s = t.toString();
        return s.equals(expected) && s.equals(t.toString());
      }
    };
  }

  /** Matches a type by its moniker. */
  static Matcher<Type> hasMoniker(String expected) {
    return new CustomTypeSafeMatcher<Type>("type with moniker " + expected) {
      @Override
      protected boolean matchesSafely(Type type) {
        return type.moniker().equals(expected);
      }
    };
  }

  /** Matches a {@link Prob} numerically. */
  static Matcher<Object> isProb(String expected) {
    final Prob prob = Prob.of(expected);
    return new CustomTypeSafeMatcher<Object>("probability " + expected) {
      @Override
      protected boolean matchesSafely(Object o) {
        return prob.equals(o);
      }
    };
  }

  /** Matches a {@link Fuzzy} with a given value and confidence. */
  static Matcher<Object> isFuzzy(Object value, String confidence) {
    final Fuzzy<Object> fuzzy = Fuzzy.of(value, Prob.of(confidence));
    return new CustomTypeSafeMatcher<Object>(fuzzy.toString()) {
      @Override
      protected boolean matchesSafely(Object o) {
        return fuzzy.equals(o);
      }
    };
  }

  static List<Object> list(Object... values) {
    return Arrays.asList(values);
  }

  static Matcher<Throwable> throwsA(String message) {
    return new CustomTypeSafeMatcher<Throwable>("throwable: " + message) {
      @Override
      protected boolean matchesSafely(Throwable item) {
        return item.toString().contains(message);
      }
    };
  }

  static <T extends Throwable> Matcher<Throwable> throwsA(
      Class<T> clazz, Matcher<?> messageMatcher) {
    return new CustomTypeSafeMatcher<Throwable>(
        clazz + " with message " + messageMatcher) {
      @Override
      protected boolean matchesSafely(Throwable item) {
        return clazz.isInstance(item)
            && messageMatcher.matches(item.getMessage());
      }
    };
  }

  /**
   * Matches an exception of a given class and message that implements
   * {@link HelixException}, and, if {@code pos} is not null, occurs at a
   * given position.
   */
  static <T extends Throwable> Matcher<Throwable> throwsA(
      Class<T> clazz, String message, @Nullable Pos pos) {
    return new TypeSafeMatcher<Throwable>() {
      @Override
      public void describeTo(Description description) {
        description
            .appendText(clazz.getSimpleName() + " with message ")
            .appendValue(message);
        if (pos != null) {
          description.appendText(" at ").appendValue(pos);
        }
      }

      @Override
      protected boolean matchesSafely(Throwable item) {
        return clazz.isInstance(item)
            && message.equals(item.getMessage())
            && (pos == null
                || item instanceof HelixException
                    && pos.equals(((HelixException) item).pos()));
      }
    };
  }

  /** Matches a runtime error of a given kind. */
  static Matcher<Throwable> isRuntimeError(HelixRuntimeException.Kind kind) {
    return new CustomTypeSafeMatcher<Throwable>("runtime error " + kind) {
      @Override
      protected boolean matchesSafely(Throwable item) {
        return item instanceof HelixRuntimeException
            && ((HelixRuntimeException) item).kind == kind;
      }
    };
  }
}

// End Matchers.java
