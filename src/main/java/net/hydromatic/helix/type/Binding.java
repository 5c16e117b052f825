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

import static java.util.Objects.requireNonNull;

import java.util.Objects;
import net.hydromatic.helix.ast.Core;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Binding of a name to a type and, for values that have been evaluated, a
 * value.
 *
 * <p>Used in {@link net.hydromatic.helix.compile.Environment}.
 */
public class Binding {
  public final String name;
  /** The type of a value, the definition of a type name, or the proposition
   * that an axiom proves. */
  public final Type type;
  public final Kind kind;
  public final Core.@Nullable Exp value;

  private Binding(String name, Type type, Kind kind,
      Core.@Nullable Exp value) {
    this.name = requireNonNull(name);
    this.type = requireNonNull(type);
    this.kind = requireNonNull(kind);
    this.value = value;
  }

  /** Creates a binding of a value that has not been evaluated. */
  public static Binding of(String name, Type type) {
    return new Binding(name, type, Kind.VALUE, null);
  }

  /** Creates a binding of a given kind. */
  public static Binding of(String name, Type type, Kind kind) {
    return new Binding(name, type, kind, null);
  }

  /** Creates a binding of a value. */
  public static Binding of(String name, Core.Exp value) {
    return new Binding(name, value.type, Kind.VALUE, value);
  }

  /** Returns a copy of this binding with a value. */
  public Binding withValue(Core.Exp value) {
    return new Binding(name, type, kind, value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type, kind, value);
  }

  @Override
  public boolean equals(Object o) {
    return this == o
        || o instanceof Binding
            && name.equals(((Binding) o).name)
            && type.equals(((Binding) o).type)
            && kind == ((Binding) o).kind
            && Objects.equals(value, ((Binding) o).value);
  }

  @Override
  public String toString() {
    switch (kind) {
    case TYPE:
      return "type " + name + " = " + type.moniker();
    case PROP:
      return "prop " + name + " : " + Sort.PROP;
    case PROOF:
      return "axiom " + name + " : " + type.moniker();
    default:
      return "val " + name
          + (value == null ? "" : " = " + value)
          + " : " + type.moniker();
    }
  }

  /** What a name denotes. */
  public enum Kind {
    /** A runtime value. */
    VALUE,
    /** A type name, for example "Prob" or a declared record type. */
    TYPE,
    /** A proposition constant. */
    PROP,
    /** A proof of a proposition; an axiom, or a value declared to be one. */
    PROOF,
    /** A value whose declaration failed to type-check. References to it are
     * errors, but they are not reported, because the declaration's error
     * already was. */
    FAILED
  }
}

// End Binding.java
