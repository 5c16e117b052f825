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
package net.hydromatic.helix.util;

/** Result of processing a program, as seen by a host such as
 * {@link net.hydromatic.helix.Main}. */
public enum Outcome {
  SUCCESS(0),
  PARSE_FAILURE(1),
  TYPE_FAILURE(2),
  RUNTIME_FAILURE(3);

  /** Process exit code. */
  public final int exitCode;

  Outcome(int exitCode) {
    this.exitCode = exitCode;
  }

  /** Returns the more severe of this outcome and another. */
  public Outcome max(Outcome other) {
    return other.exitCode > exitCode ? other : this;
  }
}

// End Outcome.java
