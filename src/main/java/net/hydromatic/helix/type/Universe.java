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
package net.hydromatic.helix.type;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Rules that classify types by sort.
 *
 * <p>The type checker consults the universe whenever it needs to know whether
 * a type may classify runtime values, or may be declared under a given sort.
 * A different hierarchy of universes can be introduced by implementing this
 * interface; the evaluator does not depend on it.
 *
 * @see Universes
 */
public interface Universe {
  /**
   * Returns the sort that classifies a type, or null if the type is not
   * classified by any sort.
   *
   * <p>For example, {@code Prob -> Prob} has sort {@link Sort#TYPE}; a
   * proposition constant has sort {@link Sort#PROP}; {@code Type} has no
   * sort.
   */
  @Nullable Sort sortOf(Type type);

  /** Returns whether values of a type may exist at runtime. */
  default boolean isValueType(Type type) {
    return sortOf(type) == Sort.TYPE;
  }
}

// End Universe.java
