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

import com.google.common.collect.ImmutableList;
import com.google.common.io.CharStreams;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import net.hydromatic.helix.compile.Environments;
import net.hydromatic.helix.compile.Program;
import net.hydromatic.helix.compile.Tracers;
import net.hydromatic.helix.eval.Session;
import net.hydromatic.helix.eval.Setting;
import net.hydromatic.helix.util.Outcome;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Batch interpreter.
 *
 * <p>Reads a program from a file, or from standard input if no file is
 * given; prints one line per statement; prints errors as
 * "{@code <pos> Error: <message>}"; and exits with the code of the
 * {@link Outcome}.
 */
public class Main {
  private final Reader in;
  private final PrintWriter out;
  private final @Nullable String file;
  private final boolean help;
  final Session session;

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    final Main main;
    try {
      main = new Main(ImmutableList.copyOf(args), System.in, System.out,
          new LinkedHashMap<>());
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      usage(System.err::println);
      System.exit(64);
      return;
    }
    System.exit(main.run().exitCode);
  }

  /** Creates a Main. */
  public Main(List<String> args, InputStream in, PrintStream out,
      Map<Setting, Object> settingMap) {
    this(args, new InputStreamReader(in, StandardCharsets.UTF_8),
        new OutputStreamWriter(out, StandardCharsets.UTF_8), settingMap);
  }

  /** Creates a Main. */
  public Main(List<String> argList, Reader in, Writer out,
      Map<Setting, Object> settingMap) {
    this.in = in;
    this.out = buffer(out);
    this.session = new Session(settingMap);
    String file = null;
    boolean help = false;
    for (String arg : argList) {
      if (arg.equals("--help")) {
        help = true;
      } else if (arg.equals("--echo")) {
        Setting.ECHO.set(session.map, true);
      } else if (arg.equals("--verify")) {
        Setting.VERIFY_STEPS.set(session.map, true);
      } else if (arg.startsWith("--") && arg.contains("=")) {
        final int i = arg.indexOf('=');
        Setting.lookup(arg.substring(2, i))
            .setLenient(session.map, arg.substring(i + 1));
      } else if (arg.startsWith("--")) {
        throw new IllegalArgumentException("unknown option: " + arg);
      } else {
        file = arg;
      }
    }
    this.file = file;
    this.help = help;
  }

  private static PrintWriter buffer(Writer out) {
    if (out instanceof PrintWriter) {
      return (PrintWriter) out;
    } else {
      if (!(out instanceof BufferedWriter)) {
        out = new BufferedWriter(out);
      }
      return new PrintWriter(out);
    }
  }

  static void usage(Consumer<String> outLines) {
    final String[] usageLines = {
        "Usage: java " + Main.class.getName() + " [options] [file]",
        "Options:",
        "    --stepBudget=N  Maximum reduction steps per statement"
            + " (negative means unbounded)",
        "    --verify        Re-check the type of the term after each step",
        "    --echo          Print each statement before its result",
        "    --help          Print this help",
    };
    for (String line : usageLines) {
      outLines.accept(line);
    }
  }

  /** Reads the program, checks and runs it, and returns the outcome. */
  public Outcome run() {
    try {
      if (help) {
        usage(out::println);
        return Outcome.SUCCESS;
      }
      final String source = read();
      final Helix.Checked checked =
          Helix.typecheck(source, file == null ? "stdIn" : file,
              Environments.base(), Tracers.empty());
      if (!checked.isValid()) {
        checked.errorLines().forEach(out::println);
        return checked.outcome();
      }
      final Program program = checked.program();
      final Helix.Result result =
          Helix.run(program, session, Tracers.empty());
      final boolean echo = Setting.ECHO.booleanValue(session.map);
      for (int i = 0; i < result.lines.size(); i++) {
        if (echo) {
          out.println("> " + program.statements.get(i).node + ";");
        }
        out.println(result.lines.get(i));
      }
      if (result.error != null) {
        final StringBuilder buf = new StringBuilder();
        session.handle(result.error, buf);
        out.println(buf);
      }
      return result.outcome();
    } finally {
      out.flush();
    }
  }

  private String read() {
    try {
      if (file != null) {
        return new String(Files.readAllBytes(Paths.get(file)),
            StandardCharsets.UTF_8);
      }
      return CharStreams.toString(in);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}

// End Main.java
