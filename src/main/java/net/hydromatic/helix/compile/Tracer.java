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

import net.hydromatic.helix.ast.Core;
import net.hydromatic.helix.eval.HelixRuntimeException;

/** Called on various events during type checking and evaluation. */
public interface Tracer {
  /** Called when a statement has been converted to a typed term. */
  void onCore(Core.Exp e);

  /** Called after each reduction step, with the number of steps taken so
   * far and the new term. */
  void onStep(int step, Core.Exp e);

  /** Called on the result of an evaluation. */
  void onResult(Core.Exp value);

  /**
   * Called with the exception thrown during type checking. Returns whether a
   * handler was found.
   */
  boolean onTypeException(TypeChecker.TypeException e);

  /**
   * Called with the exception thrown during evaluation. Returns whether a
   * handler was found.
   */
  boolean onException(HelixRuntimeException e);
}

// End Tracer.java
