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

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.helix.ast.AstNode;
import net.hydromatic.helix.type.Binding;
import net.hydromatic.helix.type.TypeSystem;
import net.hydromatic.helix.type.Universe;
import net.hydromatic.helix.type.Universes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Helpers for {@link TypeChecker} and {@link Program}. */
public abstract class Compiles {
  private static final Logger LOGGER = LoggerFactory.getLogger(Compiles.class);

  private Compiles() {}

  /**
   * Type-checks a list of statements in the standard universe.
   *
   * @see #typecheck(TypeSystem, Universe, Environment, List, Tracer)
   */
  public static Program typecheck(Environment env, List<AstNode> statements,
      Tracer tracer) {
    return typecheck(new TypeSystem(), Universes.STANDARD, env, statements,
        tracer);
  }

  /**
   * Type-checks a list of statements.
   *
   * <p>Each statement is checked in the environment produced by the previous
   * statements. If a statement fails, its error is recorded and checking
   * continues with the next statement; errors that are consequences of an
   * earlier failure are not recorded.
   */
  public static Program typecheck(TypeSystem typeSystem, Universe universe,
      Environment env, List<AstNode> statements, Tracer tracer) {
    final TypeChecker typeChecker = new TypeChecker(typeSystem, universe);
    final List<Program.Statement> statementList = new ArrayList<>();
    final List<TypeChecker.TypeException> errors = new ArrayList<>();
    Environment env2 = env;
    for (AstNode node : statements) {
      Binding binding;
      try {
        final Program.Statement statement =
            typeChecker.checkStatement(env2, node);
        if (statement.exp != null) {
          tracer.onCore(statement.exp);
        }
        statementList.add(statement);
        binding = statement.binding;
      } catch (TypeChecker.TypeException e) {
        if (e.followOn) {
          LOGGER.debug("suppressed follow-on error: {}", e.getMessage());
        } else {
          tracer.onTypeException(e);
          errors.add(e);
        }
        binding = typeChecker.failedBinding(env2, node);
      }
      env2 = env2.bind(binding);
    }
    LOGGER.debug("checked {} statements, {} errors", statements.size(),
        errors.size());
    return new Program(env, env2, statementList, errors);
  }
}

// End Compiles.java
