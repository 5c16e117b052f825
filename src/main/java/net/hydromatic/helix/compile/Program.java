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
package net.hydromatic.helix.compile;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.helix.ast.AstNode;
import net.hydromatic.helix.ast.Core;
import net.hydromatic.helix.type.Binding;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A type-checked program.
 *
 * <p>Holds one {@link Statement} per statement of the source, the
 * environment the program was checked in, and the environment its
 * declarations produce. A program whose {@link #errors} list is not empty
 * must not be evaluated.
 */
public class Program {
  public final Environment initialEnv;
  public final Environment env;
  public final ImmutableList<Statement> statements;
  public final ImmutableList<TypeChecker.TypeException> errors;

  Program(Environment initialEnv, Environment env,
      List<Statement> statements,
      List<TypeChecker.TypeException> errors) {
    this.initialEnv = requireNonNull(initialEnv);
    this.env = requireNonNull(env);
    this.statements = ImmutableList.copyOf(statements);
    this.errors = ImmutableList.copyOf(errors);
  }

  /** Returns whether every statement type-checked. */
  public boolean isValid() {
    return errors.isEmpty();
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder();
    for (Statement statement : statements) {
      b.append(statement).append('\n');
    }
    return b.toString();
  }

  /** A type-checked statement. */
  public static class Statement {
    /** The statement as parsed. */
    public final AstNode node;
    /** What the statement binds. An expression statement binds "it". */
    public final Binding binding;
    /** The term to evaluate, or null if the statement has no runtime
     * content (a type, proposition, axiom or proof declaration). */
    public final Core.@Nullable Exp exp;

    Statement(AstNode node, Binding binding, Core.@Nullable Exp exp) {
      this.node = requireNonNull(node);
      this.binding = requireNonNull(binding);
      this.exp = exp;
    }

    @Override
    public String toString() {
      return binding.toString();
    }
  }
}

// End Program.java
