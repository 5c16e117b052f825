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
package net.hydromatic.helix.eval;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import net.hydromatic.helix.ast.Core;
import net.hydromatic.helix.ast.Op;
import net.hydromatic.helix.compile.BuiltIn;
import net.hydromatic.helix.type.Binding;

/** Utilities for values.
 *
 * <p>A value is a closed {@link Core.Exp} in normal form: a literal, a
 * closure ({@link Core.Fn}), a built-in function applied to fewer arguments
 * than its arity, or a record or fuzzy pair whose components are values. */
public abstract class Values {
  private Values() {}

  /** Returns whether a term is a value. */
  public static boolean isValue(Core.Exp exp) {
    switch (exp.op) {
    case BOOL_LITERAL:
    case INT_LITERAL:
    case REAL_LITERAL:
    case PROB_LITERAL:
    case STRING_LITERAL:
    case UNIT_LITERAL:
    case FN_LITERAL:
    case FN:
      return true;

    case RECORD:
      return ((Core.Record) exp).args.values().stream()
          .allMatch(Values::isValue);

    case FUZZY:
      final Core.Wrap wrap = (Core.Wrap) exp;
      return isValue(wrap.value) && isValue(wrap.confidence);

    case APPLY:
      return isPartialApplication((Core.Apply) exp);

    default:
      return false;
    }
  }

  /** Returns whether an application is a built-in function applied to values
   * but fewer of them than its arity. */
  static boolean isPartialApplication(Core.Apply apply) {
    final Core.Exp head = apply.head();
    if (head.op != Op.FN_LITERAL) {
      return false;
    }
    final List<Core.Exp> args = apply.args();
    return args.size() < ((Core.Literal) head).unwrap(BuiltIn.class).arity
        && args.stream().allMatch(Values::isValue);
  }

  /** Converts a value to a Java object.
   *
   * <p>{@code Int} becomes {@link Integer}, {@code Real} becomes
   * {@link java.math.BigDecimal}, {@code Prob} becomes {@link Prob},
   * a fuzzy value becomes {@link Fuzzy}, a record becomes a list of its
   * field values in field-name order, and a function remains a
   * {@link Core.Exp}. */
  public static Object toJava(Core.Exp value) {
    switch (value.op) {
    case BOOL_LITERAL:
    case INT_LITERAL:
    case REAL_LITERAL:
    case PROB_LITERAL:
    case STRING_LITERAL:
    case UNIT_LITERAL:
      return ((Core.Literal) value).value;

    case RECORD:
      final ImmutableList.Builder<Object> list = ImmutableList.builder();
      ((Core.Record) value).args.values()
          .forEach(arg -> list.add(toJava(arg)));
      return list.build();

    case FUZZY:
      final Core.Wrap wrap = (Core.Wrap) value;
      return Fuzzy.of(toJava(wrap.value),
          (Prob) toJava(wrap.confidence));

    default:
      if (!isValue(value)) {
        throw new IllegalArgumentException("not a value: " + value);
      }
      return value;
    }
  }

  /** Renders a value for output, e.g. "0.35", "{a = 1, b = 0.5}",
   * "fuzzy(1, 0.9)", "fn". */
  public static String render(Core.Exp value) {
    return render(new StringBuilder(), value).toString();
  }

  private static StringBuilder render(StringBuilder buf, Core.Exp value) {
    switch (value.op) {
    case FN:
    case FN_LITERAL:
    case APPLY:
      return buf.append("fn");

    case RECORD:
      buf.append("{");
      int i = 0;
      for (Map.Entry<String, Core.Exp> e
          : ((Core.Record) value).args.entrySet()) {
        if (i++ > 0) {
          buf.append(", ");
        }
        render(buf.append(e.getKey()).append(" = "), e.getValue());
      }
      return buf.append("}");

    case FUZZY:
      final Core.Wrap wrap = (Core.Wrap) value;
      render(buf.append("fuzzy("), wrap.value).append(", ");
      return render(buf, wrap.confidence).append(")");

    default:
      // Literals unparse to source form.
      return buf.append(value);
    }
  }

  /** Renders a binding as a line of output, e.g.
   * "val x = 0.35 : Prob", "type T = {a: Int}", "prop P : Prop". */
  public static String line(Binding binding) {
    if (binding.kind == Binding.Kind.VALUE && binding.value != null) {
      return "val " + binding.name + " = " + render(binding.value)
          + " : " + binding.type.moniker();
    }
    return binding.toString();
  }
}

// End Values.java
