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

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Interner;
import com.google.common.collect.Interners;
import java.util.Map;

/**
 * Factory for types.
 *
 * <p>Types are interned, so that a structurally equal type is usually the same
 * object; but code must not rely on this, and must compare types using
 * {@link Object#equals}. A TypeSystem is thread-safe.
 */
public class TypeSystem {
  private final Interner<Type> interner = Interners.newWeakInterner();

  @SuppressWarnings("unchecked")
  private <T extends Type> T intern(T type) {
    return (T) interner.intern(type);
  }

  /** Creates a function type. */
  public FnType fnType(Type paramType, Type resultType) {
    return intern(new FnType(paramType, resultType));
  }

  /** Creates a curried function type, e.g.
   * {@code fnType(PROB, PROB, BOOL)} is {@code Prob -> Prob -> Bool}. */
  public FnType fnType(Type paramType, Type type1, Type... moreTypes) {
    Type t;
    if (moreTypes.length == 0) {
      t = type1;
    } else {
      t = moreTypes[moreTypes.length - 1];
      for (int i = moreTypes.length - 2; i >= 0; i--) {
        t = fnType(moreTypes[i], t);
      }
      t = fnType(type1, t);
    }
    return fnType(paramType, t);
  }

  /** Creates a record type. */
  public RecordType recordType(Map<String, ? extends Type> argNameTypes) {
    return intern(
        new RecordType(
            ImmutableSortedMap.copyOf(argNameTypes, RecordType.ORDERING)));
  }

  /** Creates a fuzzy type, {@code Fuzzy<T>}. */
  public FuzzyType fuzzyType(Type argType) {
    return intern(new FuzzyType(argType));
  }

  /** Creates the type of a proposition constant. */
  public PropType propType(String name) {
    return intern(new PropType(name));
  }

  /** Creates a type variable. */
  public TypeVar typeVar(int ordinal) {
    return new TypeVar(ordinal);
  }
}

// End TypeSystem.java
