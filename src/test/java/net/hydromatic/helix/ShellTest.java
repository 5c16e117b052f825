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

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import net.hydromatic.helix.compile.Environment;
import net.hydromatic.helix.compile.Environments;
import net.hydromatic.helix.eval.Session;
import net.hydromatic.helix.eval.Setting;
import net.hydromatic.helix.type.PrimitiveType;
import org.hamcrest.Matcher;
import org.junit.jupiter.api.Test;

/** Tests the interactive shell, {@link Shell}. */
public class ShellTest {
  private static final List<String> DUMB =
      ImmutableList.of("--system=false", "--terminal=dumb");

  /** Runs a shell over some input, and checks its output. */
  private static void assertShell(List<String> args, String in,
      Matcher<String> matcher) {
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    try {
      final Shell shell =
          Shell.create(args,
              new ByteArrayInputStream(in.getBytes(StandardCharsets.UTF_8)),
              out);
      shell.run();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    assertThat(out.toString(StandardCharsets.UTF_8), matcher);
  }

  private static List<String> plus(List<String> list, String... more) {
    return ImmutableList.<String>builder().addAll(list).add(more).build();
  }

  @Test
  void testBanner() {
    assertShell(DUMB, "", containsString("helix (java version"));
    assertShell(plus(DUMB, "--banner=false"), "",
        not(containsString("helix (java version")));
  }

  @Test
  void testOneLine() {
    assertShell(plus(DUMB, "--banner=false"),
        "prob_mul(0.7, 0.5);\n",
        containsString("val it = 0.35 : Prob"));
  }

  /** A statement may span several lines; it ends at a line that ends with
   * ';'. Bindings persist from one statement to the next. */
  @Test
  void testContinuation() {
    assertShell(plus(DUMB, "--banner=false"),
        "val p =\n"
            + "  0.7;\n"
            + "(* a comment *)\n"
            + "\n"
            + "prob_complement(p);\n",
        containsString("val it = 0.3 : Prob"));
  }

  @Test
  void testErrors() {
    assertShell(plus(DUMB, "--banner=false"),
        "val x = y;\nint_add(2147483647, 1);\n",
        containsString("stdIn:1.9 Error: unbound variable: y"));
    assertShell(plus(DUMB, "--banner=false"),
        "int_add(2147483647, 1);\n",
        containsString("Error: integer overflow in int_add"));
  }

  @Test
  void testHelp() {
    assertShell(plus(DUMB, "--help"), "",
        containsString("Usage: java net.hydromatic.helix.Shell"));
    assertShell(plus(DUMB, "--banner=false"), "help\nquit\n1;\n",
        containsString("List of available commands:"));
    assertShell(plus(DUMB, "--banner=false"), "quit\nprob_mul(0.7, 0.5);\n",
        not(containsString("val it")));
  }

  /** Tests {@link Shell#command}, which checks and runs one buffer of
   * input. */
  @Test
  void testCommand() {
    final Session session = new Session(new LinkedHashMap<>());
    final List<String> lines = new ArrayList<>();
    Environment env = Environments.base();
    env = Shell.command(session, env, "val p = 0.7;", lines::add);
    assertThat(env.getOpt("p").type, is(PrimitiveType.PROB));
    env = Shell.command(session, env, "prob_complement(p);", lines::add);
    final Environment env2 = env;
    env = Shell.command(session, env, "val q = z;", lines::add);
    assertThat(env, is(env2));
    env = Shell.command(session, env, "val r = prob_mul(p, it);", lines::add);
    assertThat(lines,
        is(List.of("val p = 0.7 : Prob",
            "val it = 0.3 : Prob",
            "stdIn:1.9 Error: unbound variable: z",
            "val r = 0.21 : Prob")));

    lines.clear();
    Setting.STEP_BUDGET.set(session.map, 0);
    env = Shell.command(session, env, "int_add(1, 2);", lines::add);
    assertThat(lines,
        is(List.of("stdIn:1.1-1.14 Error: "
            + "evaluation exceeded the step budget of 0 steps")));
    assertThat(env.getOpt("r") != null, is(true));
  }
}

// End ShellTest.java
