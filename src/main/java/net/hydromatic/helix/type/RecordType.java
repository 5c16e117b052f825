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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Ordering;
import java.util.Map;
import java.util.function.UnaryOperator;
import net.hydromatic.helix.ast.Op;

/** The type of a record value, e.g. {@code {name: String, p: Prob}}. */
public class RecordType extends BaseType {
  public final ImmutableSortedMap<String, Type> argNameTypes;
  private final String moniker;

  RecordType(ImmutableSortedMap<String, Type> argNameTypes) {
    super(Op.RECORD_TYPE);
    this.argNameTypes = requireNonNull(argNameTypes);
    checkArgument(argNameTypes.comparator() == ORDERING);
    final StringBuilder b = new StringBuilder("{");
    argNameTypes.forEach((name, type) ->
        b.append(b.length() > 1 ? ", " : "")
            .append(name)
            .append(": ")
            .append(type));
    this.moniker = b.append("}").toString();
  }

  @Override
  public String moniker() {
    return moniker;
  }

  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public RecordType copy(TypeSystem typeSystem, UnaryOperator<Type> transform) {
    int differenceCount = 0;
    final ImmutableSortedMap.Builder<String, Type> argNameTypes2 =
        ImmutableSortedMap.orderedBy(ORDERING);
    for (Map.Entry<String, Type> entry : argNameTypes.entrySet()) {
      final Type type = entry.getValue();
      final Type type2 = type.copy(typeSystem, transform);
      if (type != type2) {
        ++differenceCount;
      }
      argNameTypes2.put(entry.getKey(), type2);
    }
    return differenceCount == 0
        ? this
        : typeSystem.recordType(argNameTypes2.build());
  }

  /**
   * Ordering that compares integer values numerically, string values
   * lexicographically, and integer values before string values.
   *
   * <p>Thus: 2, 22, 202, a, a2, a202, a22.
   */
  public static final Ordering<String> ORDERING =
      Ordering.from(RecordType::compareNames);

  /** Helper for {@link #ORDERING}. */
  public static int compareNames(String o1, String o2) {
    int i1 = parseInt(o1);
    int i2 = parseInt(o2);
    int c = Integer.compare(i1, i2);
    if (c != 0) {
      return c;
    }
    return o1.compareTo(o2);
  }

  /**
   * Parses a string that contains a non-negative integer value of at most 9
   * digits; returns {@link Integer#MAX_VALUE} otherwise.
   */
  private static int parseInt(String s) {
    final int length = s.length();
    if (length == 0 || length > 9) {
      return Integer.MAX_VALUE;
    }
    int n = 0;
    for (int i = 0; i < length; i++) {
      final char c = s.charAt(i);
      if (c < '0' || c > '9') {
        return Integer.MAX_VALUE;
      }
      n = n * 10 + (c - '0');
    }
    return n;
  }
}

// End RecordType.java
