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
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import net.hydromatic.helix.util.Outcome;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests the batch interpreter, {@link Main}. */
public class MainTest {
  /** Runs a program and checks its outcome and output lines. */
  private static void assertMain(List<String> args, String ml,
      Outcome expectedOutcome, String... expectedLines) {
    final StringWriter sw = new StringWriter();
    final Main main =
        new Main(args, new StringReader(ml), sw, new LinkedHashMap<>());
    final Outcome outcome = main.run();
    assertThat(lines(sw), is(Arrays.asList(expectedLines)));
    assertThat(outcome, is(expectedOutcome));
  }

  private static void assertMain(String ml, Outcome expectedOutcome,
      String... expectedLines) {
    assertMain(ImmutableList.of(), ml, expectedOutcome, expectedLines);
  }

  private static List<String> lines(StringWriter sw) {
    final String s = sw.toString();
    return s.isEmpty()
        ? ImmutableList.of()
        : Arrays.asList(s.split("\\R"));
  }

  @Test
  void testSuccess() {
    assertMain("val p = prob_mul(0.7, 0.5);\np", Outcome.SUCCESS,
        "val p = 0.35 : Prob",
        "val it = 0.35 : Prob");
    assertMain("", Outcome.SUCCESS);
    assertMain("fuzzy_combine(int_add, fuzzy(1, 0.8), fuzzy(2, 0.5));",
        Outcome.SUCCESS,
        "val it = fuzzy(3, 0.4) : Fuzzy<Int>");
  }

  @Test
  void testParseFailure() {
    assertMain("val = 1", Outcome.PARSE_FAILURE,
        "stdIn:1.5 Error: expected identifier, found '='");
    assertMain("val r = 1e99999999999", Outcome.PARSE_FAILURE,
        "stdIn:1.9-1.22 Error: invalid numeric literal");
    assertThat(Outcome.PARSE_FAILURE.exitCode, is(1));
  }

  /** Every statement that fails to type-check is reported, and nothing is
   * evaluated. */
  @Test
  void testTypeFailure() {
    assertMain("val p : Prob = 1.2;\nval q = prob_mul(0.5, 0.5);\nz",
        Outcome.TYPE_FAILURE,
        "stdIn:1.16-1.19 Error: "
            + "probability literal 1.2 is out of range [0, 1]",
        "stdIn:3.1 Error: unbound variable: z");
    assertThat(Outcome.TYPE_FAILURE.exitCode, is(2));
  }

  @Test
  void testRuntimeFailure() {
    assertMain("val a = 1;\nint_add(2147483647, 1);\nval b = 2",
        Outcome.RUNTIME_FAILURE,
        "val a = 1 : Int",
        "stdIn:2.1-2.23 Error: integer overflow in int_add");
    assertMain("real_mul(1e2000000000, 1e2000000000)",
        Outcome.RUNTIME_FAILURE,
        "stdIn:1.1-1.37 Error: real overflow in real_mul");
    assertThat(Outcome.RUNTIME_FAILURE.exitCode, is(3));
  }

  @Test
  void testEcho() {
    assertMain(ImmutableList.of("--echo"), "val p = 0.7; prob_complement(p)",
        Outcome.SUCCESS,
        "> val p = 0.7;",
        "val p = 0.7 : Prob",
        "> prob_complement(p);",
        "val it = 0.3 : Prob");
  }

  @Test
  void testStepBudget() {
    final String ml = "int_add(int_add(1, 2), int_add(3, 4))";
    assertMain(ImmutableList.of("--stepBudget=3"), ml, Outcome.SUCCESS,
        "val it = 10 : Int");
    assertMain(ImmutableList.of("--stepBudget=2"), ml,
        Outcome.RUNTIME_FAILURE,
        "stdIn:1.1-1.38 Error: "
            + "evaluation exceeded the step budget of 2 steps");
    assertMain(ImmutableList.of("--verify", "--STEP_BUDGET=-1"), ml,
        Outcome.SUCCESS,
        "val it = 10 : Int");
  }

  @Test
  void testHelp() {
    final StringWriter sw = new StringWriter();
    final Main main = new Main(ImmutableList.of("--help"),
        new StringReader("not read"), sw, new LinkedHashMap<>());
    assertThat(main.run(), is(Outcome.SUCCESS));
    assertThat(lines(sw).get(0),
        is("Usage: java net.hydromatic.helix.Main [options] [file]"));
  }

  @Test
  void testBadArguments() {
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> new Main(ImmutableList.of("--foo"), new StringReader(""),
                new StringWriter(), new LinkedHashMap<>()));
    assertThat(e.getMessage(), is("unknown option: --foo"));
    final IllegalArgumentException e2 =
        assertThrows(IllegalArgumentException.class,
            () -> new Main(ImmutableList.of("--foo=1"), new StringReader(""),
                new StringWriter(), new LinkedHashMap<>()));
    assertThat(e2.getMessage(), is("setting foo not found"));
    final IllegalArgumentException e3 =
        assertThrows(IllegalArgumentException.class,
            () -> new Main(ImmutableList.of("--stepBudget=x"),
                new StringReader(""), new StringWriter(),
                new LinkedHashMap<>()));
    assertThat(e3.getMessage(), startsWith("value for setting stepBudget"));
  }

  /** Reads the program from a file; positions use the file name. */
  @Test
  void testFile(@TempDir Path dir) throws IOException {
    final Path file = dir.resolve("genes.hx");
    Files.write(file,
        ("type Gene = {name: String, expression: Prob};\n"
            + "val g : Gene = {name = \"BRCA1\", expression = 0.8};\n"
            + "prob_complement(g.expression);\n"
            + "g.score")
            .getBytes(StandardCharsets.UTF_8));
    final StringWriter sw = new StringWriter();
    final Main main = new Main(ImmutableList.of(file.toString()),
        new StringReader(""), sw, new LinkedHashMap<>());
    assertThat(main.run(), is(Outcome.TYPE_FAILURE));
    assertThat(lines(sw),
        is(List.of(file + ":4.1-4.8 Error: "
            + "no field 'score' in type {expression: Prob, name: String}")));
  }
}

// End MainTest.java
