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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.helix.Matchers.hasMoniker;
import static net.hydromatic.helix.Matchers.isAst;
import static net.hydromatic.helix.Matchers.isRuntimeError;
import static net.hydromatic.helix.Matchers.throwsA;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.fail;

import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import net.hydromatic.helix.ast.AstNode;
import net.hydromatic.helix.ast.Core;
import net.hydromatic.helix.ast.Pos;
import net.hydromatic.helix.compile.Environments;
import net.hydromatic.helix.compile.Program;
import net.hydromatic.helix.compile.Tracer;
import net.hydromatic.helix.compile.Tracers;
import net.hydromatic.helix.compile.TypeChecker;
import net.hydromatic.helix.eval.HelixRuntimeException;
import net.hydromatic.helix.eval.Session;
import net.hydromatic.helix.eval.Setting;
import net.hydromatic.helix.eval.Values;
import net.hydromatic.helix.parse.HelixParseException;
import net.hydromatic.helix.parse.HelixParser;
import net.hydromatic.helix.type.FnType;
import net.hydromatic.helix.type.Type;
import net.hydromatic.helix.util.HelixException;
import net.hydromatic.helix.util.Outcome;
import net.hydromatic.helix.util.Pair;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.hamcrest.Matcher;

/** Fluent test helper. */
class Ml {
  private final String ml;
  private final @Nullable Pos pos;
  private final Map<Setting, Object> settingMap;
  private final Tracer tracer;

  Ml(
      String ml,
      @Nullable Pos pos,
      Map<Setting, Object> settingMap,
      Tracer tracer) {
    this.ml = ml;
    this.pos = pos;
    this.settingMap = ImmutableMap.copyOf(settingMap);
    this.tracer = tracer;
  }

  /** Creates an {@code Ml}. */
  static Ml ml(String ml) {
    return new Ml(ml, null, ImmutableMap.of(), Tracers.empty());
  }

  /** Creates an {@code Ml} with an error position delimited by a given
   * character. */
  static Ml ml(String ml, char delimiter) {
    Pair<String, Pos> pair = Pos.split(ml, delimiter, "stdIn");
    return new Ml(pair.left, pair.right, ImmutableMap.of(), Tracers.empty());
  }

  /**
   * Runs a task and checks that it throws an exception.
   *
   * @param runnable Task to run
   * @param matcher Checks whether exception is as expected
   */
  static void assertError(Runnable runnable, Matcher<Throwable> matcher) {
    try {
      runnable.run();
      fail("expected error");
    } catch (Throwable e) {
      assertThat(e, matcher);
    }
  }

  @CanIgnoreReturnValue
  Ml withParser(Consumer<HelixParser> action) {
    final HelixParser parser = new HelixParser(ml, "stdIn");
    action.accept(parser);
    return this;
  }

  /** Parses the program, which must have exactly one statement. */
  private static AstNode statement(HelixParser parser) {
    final List<AstNode> statements = parser.program();
    assertThat(statements.size(), is(1));
    return statements.get(0);
  }

  /**
   * Checks that a statement can be parsed and returns the given string when
   * unparsed.
   */
  @CanIgnoreReturnValue
  Ml assertParse(String expected) {
    return withParser(
        parser -> assertThat(statement(parser),
            isAst(AstNode.class, expected)));
  }

  /**
   * Checks that a statement can be parsed and returns the identical
   * statement when unparsed.
   */
  @CanIgnoreReturnValue
  Ml assertParseSame() {
    return assertParse(ml.replaceAll("[\n ]+", " "));
  }

  /** Checks that unparsing a statement and parsing the result gives an equal
   * tree. */
  @CanIgnoreReturnValue
  Ml assertParseRoundTrip() {
    return withParser(
        parser -> {
          final AstNode node = statement(parser);
          final AstNode node2 =
              statement(new HelixParser(node.toString(), "stdIn"));
          assertThat(node2, is(node));
          assertThat(node2.toString(), is(node.toString()));
        });
  }

  @CanIgnoreReturnValue
  Ml assertParseThrowsParseException(String message) {
    return assertParseThrows(
        throwsA(HelixParseException.class, message, pos));
  }

  @CanIgnoreReturnValue
  Ml assertParseThrows(Matcher<Throwable> matcher) {
    assertError(() -> new HelixParser(ml, "stdIn").program(), matcher);
    return this;
  }

  /** Parses and type-checks the program. */
  private Helix.Checked typecheck() {
    return Helix.typecheck(ml, "stdIn", Environments.base(), tracer);
  }

  /** Type-checks the program, which must be valid, and returns it. */
  private Program program() {
    final Helix.Checked checked = typecheck();
    if (!checked.isValid()) {
      fail("expected valid program, got " + checked.errorLines());
    }
    return checked.program();
  }

  /** Checks the type of the last statement. */
  @CanIgnoreReturnValue
  Ml assertType(Matcher<Type> matcher) {
    final Program program = program();
    final Program.Statement last =
        program.statements.get(program.statements.size() - 1);
    assertThat(last.binding.type, matcher);
    return this;
  }

  @CanIgnoreReturnValue
  Ml assertType(String expected) {
    return assertType(hasMoniker(expected));
  }

  /**
   * Checks that the program has exactly one type error, of a given kind and
   * message, and at the delimited position if there is one.
   */
  @CanIgnoreReturnValue
  Ml assertTypeThrows(TypeChecker.TypeException.Kind kind, String message) {
    final Helix.Checked checked = typecheck();
    assertThat(checked.errors.size(), is(1));
    final HelixException e = checked.errors.get(0);
    assertThat((Throwable) e,
        throwsA(TypeChecker.TypeException.class, message, pos));
    assertThat(((TypeChecker.TypeException) e).kind, is(kind));
    assertThat(checked.outcome(), is(Outcome.TYPE_FAILURE));
    return this;
  }

  /** Checks the lines of error output of a program that does not
   * type-check. */
  @CanIgnoreReturnValue
  Ml assertErrorLines(String... expected) {
    final Helix.Checked checked = typecheck();
    assertThat(checked.isValid(), is(false));
    assertThat(checked.errorLines(), is(List.of(expected)));
    return this;
  }

  /** Checks the Core form of the last expression statement. */
  @CanIgnoreReturnValue
  Ml assertCore(String expected) {
    final List<Core.Exp> list = new ArrayList<>();
    withTracer(Tracers.withOnCore(tracer, list::add)).program();
    assertThat(list.isEmpty(), is(false));
    assertThat(list.get(list.size() - 1).toString(), is(expected));
    return this;
  }

  /** Returns the Core form of the last statement, which must be an
   * expression. */
  private static Core.Exp lastExp(Program program) {
    final Program.Statement last =
        program.statements.get(program.statements.size() - 1);
    assertThat(last.exp, notNullValue());
    return requireNonNull(last.exp);
  }

  /**
   * Checks that the Core form of the last expression, converted to a string
   * and type-checked again, has the same string and type.
   */
  @CanIgnoreReturnValue
  Ml assertCoreRoundTrip() {
    final Core.Exp exp = lastExp(program());
    final String s = exp.toString();
    final Core.Exp exp2 = lastExp(ml(s).program());
    assertThat(exp2.toString(), is(s));
    assertThat(exp2.type, is(exp.type));
    return this;
  }

  /**
   * Checks that the rendered value of the last expression, parsed and
   * evaluated again, gives the same rendering and type.
   *
   * <p>Function values render as "fn" and are not re-parsed.
   */
  @CanIgnoreReturnValue
  Ml assertValueRoundTrip() {
    final Helix.Result result = run();
    if (result.error != null) {
      fail("evaluation failed", result.error);
    }
    final Core.Exp value = requireNonNull(result.value);
    if (value.type instanceof FnType) {
      assertThat(result.rendered(), is("fn"));
      return this;
    }
    final String rendered = requireNonNull(result.rendered());
    final Helix.Result result2 = ml(rendered).run();
    if (result2.error != null) {
      fail("evaluation failed", result2.error);
    }
    assertThat(result2.rendered(), is(rendered));
    assertThat(requireNonNull(result2.value).type, is(value.type));
    return this;
  }

  /** Type-checks and runs the program. */
  private Helix.Result run() {
    final Session session = new Session(new LinkedHashMap<>(settingMap));
    return Helix.run(program(), session, tracer);
  }

  /** Checks the value of the last expression statement, converted to Java
   * by {@link Values#toJava}. */
  @CanIgnoreReturnValue
  Ml assertEval(Matcher<Object> matcher) {
    final Helix.Result result = run();
    if (result.error != null) {
      fail("evaluation failed", result.error);
    }
    assertThat(result.value, notNullValue());
    assertThat(Values.toJava(result.value), matcher);
    return this;
  }

  /** Checks the rendered value of the last expression statement. */
  @CanIgnoreReturnValue
  Ml assertEvalRendered(String expected) {
    final Helix.Result result = run();
    if (result.error != null) {
      fail("evaluation failed", result.error);
    }
    assertThat(result.rendered(), is(expected));
    return this;
  }

  /** Checks the output lines of the program, one per statement. */
  @CanIgnoreReturnValue
  Ml assertLines(String... expected) {
    final Helix.Result result = run();
    if (result.error != null) {
      fail("evaluation failed", result.error);
    }
    assertThat(result.lines, is(List.of(expected)));
    return this;
  }

  /** Checks that evaluation fails with a runtime error of a given kind and
   * message. */
  @CanIgnoreReturnValue
  Ml assertEvalThrows(HelixRuntimeException.Kind kind, String message) {
    final Helix.Result result = run();
    assertThat(result.error, notNullValue());
    assertThat(result.error, isRuntimeError(kind));
    assertThat(result.error.getMessage(), is(message));
    return this;
  }

  /** Checks the number of reduction steps taken by the whole program. */
  @CanIgnoreReturnValue
  Ml assertSteps(Matcher<Integer> matcher) {
    final AtomicInteger count = new AtomicInteger();
    withTracer(Tracers.withOnStep(tracer, (i, e) -> count.incrementAndGet()))
        .assertEval(notNullValue());
    assertThat(count.get(), matcher);
    return this;
  }

  Ml with(Setting setting, Object value) {
    final Map<Setting, Object> map = new LinkedHashMap<>(settingMap);
    map.put(setting, value);
    return new Ml(ml, pos, map, tracer);
  }

  Ml withTracer(Tracer tracer) {
    return new Ml(ml, pos, settingMap, tracer);
  }
}

// End Ml.java
