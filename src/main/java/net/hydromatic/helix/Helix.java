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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.helix.ast.Ast;
import net.hydromatic.helix.ast.AstNode;
import net.hydromatic.helix.ast.Core;
import net.hydromatic.helix.compile.Compiles;
import net.hydromatic.helix.compile.Environment;
import net.hydromatic.helix.compile.Environments;
import net.hydromatic.helix.compile.Program;
import net.hydromatic.helix.compile.Tracer;
import net.hydromatic.helix.compile.Tracers;
import net.hydromatic.helix.eval.Evaluator;
import net.hydromatic.helix.eval.HelixRuntimeException;
import net.hydromatic.helix.eval.Session;
import net.hydromatic.helix.eval.Substituter;
import net.hydromatic.helix.eval.Values;
import net.hydromatic.helix.parse.HelixParseException;
import net.hydromatic.helix.parse.HelixParser;
import net.hydromatic.helix.type.Binding;
import net.hydromatic.helix.type.TypeSystem;
import net.hydromatic.helix.type.Universes;
import net.hydromatic.helix.util.HelixException;
import net.hydromatic.helix.util.Outcome;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Entry points for checking and running Helix programs.
 *
 * <p>{@link #typecheck} parses and type-checks source text; {@link #run}
 * evaluates a program that type-checked. For example,
 *
 * <blockquote><pre>
 * Helix.Checked checked = Helix.typecheck("val p = prob_mul(0.5, 0.7)");
 * Helix.Result result = Helix.run(checked.program());
 * result.lines; // ["val p = 0.35 : Prob"]
 * </pre></blockquote>
 */
public class Helix {
  private Helix() {}

  /** Parses and type-checks a program in the base environment. */
  public static Checked typecheck(String source) {
    return typecheck(source, "", Environments.base(), Tracers.empty());
  }

  /** Parses and type-checks a program from a given file in the base
   * environment. */
  public static Checked typecheck(String source, String file) {
    return typecheck(source, file, Environments.base(), Tracers.empty());
  }

  /**
   * Parses and type-checks a program.
   *
   * <p>If the program does not parse, the result contains the single parse
   * error. Otherwise it contains the program, and one error for each
   * statement that failed to type-check.
   */
  public static Checked typecheck(String source, String file,
      Environment env, Tracer tracer) {
    final List<AstNode> statements;
    try {
      statements = new HelixParser(source, file).program();
    } catch (HelixParseException e) {
      return new Checked(null, ImmutableList.of(e));
    }
    final Program program = Compiles.typecheck(new TypeSystem(),
        Universes.STANDARD, env, statements, tracer);
    return new Checked(program, program.errors);
  }

  /** Runs a program with default settings. */
  public static Result run(Program program) {
    return run(program, new Session(), Tracers.empty());
  }

  /**
   * Runs a program that type-checked.
   *
   * <p>Evaluates each statement in order. A runtime error stops evaluation;
   * the result contains the lines of the statements that completed.
   */
  public static Result run(Program program, Session session, Tracer tracer) {
    checkArgument(program.isValid(), "program has type errors");
    final Evaluator evaluator =
        new Evaluator(new TypeSystem(), session, tracer);
    final Map<String, Core.Exp> values = new LinkedHashMap<>();
    program.initialEnv.getValueMap().forEach((name, binding) -> {
      if (binding.kind == Binding.Kind.VALUE && binding.value != null) {
        values.put(name, binding.value);
      }
    });
    final List<String> lines = new ArrayList<>();
    Environment env = program.initialEnv;
    Core.@Nullable Exp last = null;
    for (Program.Statement statement : program.statements) {
      Binding binding = statement.binding;
      values.remove(binding.name);
      if (statement.exp != null) {
        final Core.Exp value;
        try {
          value = evaluator.evaluate(
              Substituter.substitute(values, statement.exp));
        } catch (HelixRuntimeException e) {
          return new Result(lines, last, env, e);
        }
        binding = binding.withValue(value);
        values.put(binding.name, value);
        if (statement.node instanceof Ast.Exp) {
          last = value;
        }
      }
      lines.add(Values.line(binding));
      env = env.bind(binding);
    }
    return new Result(lines, last, env, null);
  }

  /** Result of type-checking a program. */
  public static class Checked {
    private final @Nullable Program program;
    public final ImmutableList<HelixException> errors;

    Checked(@Nullable Program program,
        List<? extends HelixException> errors) {
      this.program = program;
      this.errors = ImmutableList.copyOf(errors);
    }

    /** Returns whether the program parsed and type-checked. */
    public boolean isValid() {
      return program != null && errors.isEmpty();
    }

    /** Returns the program. Throws if the program did not parse. */
    public Program program() {
      return requireNonNull(program, "program did not parse");
    }

    /** Returns the outcome: success, or the most severe error. */
    public Outcome outcome() {
      Outcome outcome = Outcome.SUCCESS;
      for (HelixException error : errors) {
        outcome = outcome.max(error.outcome());
      }
      return outcome;
    }

    /** Returns the errors, one per line, in the form
     * "{@code <pos> Error: <message>}". */
    public List<String> errorLines() {
      final ImmutableList.Builder<String> lines = ImmutableList.builder();
      for (HelixException error : errors) {
        lines.add(error.describeTo(new StringBuilder()).toString());
      }
      return lines.build();
    }
  }

  /** Result of running a program. */
  public static class Result {
    /** One line per statement that completed, e.g.
     * "val x = 0.35 : Prob". */
    public final ImmutableList<String> lines;
    /** Value of the last expression statement, or null. */
    public final Core.@Nullable Exp value;
    /** Environment containing the bindings, with values, of the statements
     * that completed. */
    public final Environment env;
    /** The runtime error that stopped evaluation, or null. */
    public final @Nullable HelixRuntimeException error;

    Result(List<String> lines, Core.@Nullable Exp value, Environment env,
        @Nullable HelixRuntimeException error) {
      this.lines = ImmutableList.copyOf(lines);
      this.value = value;
      this.env = requireNonNull(env);
      this.error = error;
    }

    /** Returns the outcome. */
    public Outcome outcome() {
      return error == null ? Outcome.SUCCESS : error.outcome();
    }

    /** Returns the rendered value of the last expression statement, or
     * null. */
    public @Nullable String rendered() {
      return value == null ? null : Values.render(value);
    }
  }
}

// End Helix.java
