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

import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Matches a type that may contain type variables against a type that does
 * not.
 *
 * <p>This is first-order matching, not full unification: variables occur
 * only on the left.
 */
public class TypeUnifier {
  private final Map<Integer, Type> variables;

  private TypeUnifier(Map<Integer, Type> variables) {
    this.variables = new HashMap<>(variables);
  }

  /**
   * Matches {@code pattern} against {@code type}. Returns the bindings of
   * type variables (extending {@code variables}), or null if there is no
   * match.
   */
  public static @Nullable Map<Integer, Type> match(Type pattern, Type type,
      Map<Integer, Type> variables) {
    final TypeUnifier unifier = new TypeUnifier(variables);
    if (unifier.tryMatch(pattern, type)) {
      return ImmutableMap.copyOf(unifier.variables);
    } else {
      return null;
    }
  }

  boolean tryMatch(Type type1, Type type2) {
    switch (type1.op()) {
    case TY_VAR:
      final TypeVar var1 = (TypeVar) type1;
      final @Nullable Type type1b = variables.get(var1.ordinal);
      if (type1b == null) {
        variables.put(var1.ordinal, type2);
        return true;
      } else {
        return type1b.equals(type2);
      }

    case FUNCTION_TYPE:
      if (!(type2 instanceof FnType)) {
        return false;
      }
      final FnType fn1 = (FnType) type1;
      final FnType fn2 = (FnType) type2;
      return tryMatch(fn1.paramType, fn2.paramType)
          && tryMatch(fn1.resultType, fn2.resultType);

    case FUZZY_TYPE:
      return type2 instanceof FuzzyType
          && tryMatch(((FuzzyType) type1).argType, ((FuzzyType) type2).argType);

    case RECORD_TYPE:
      if (!(type2 instanceof RecordType)) {
        return false;
      }
      final RecordType record1 = (RecordType) type1;
      final RecordType record2 = (RecordType) type2;
      if (!record1.argNameTypes.keySet()
          .equals(record2.argNameTypes.keySet())) {
        return false;
      }
      final Iterator<Type> iterator = record2.argNameTypes.values().iterator();
      for (Type t : record1.argNameTypes.values()) {
        if (!tryMatch(t, iterator.next())) {
          return false;
        }
      }
      return true;

    default:
      return type1.equals(type2);
    }
  }
}

// End TypeUnifier.java
