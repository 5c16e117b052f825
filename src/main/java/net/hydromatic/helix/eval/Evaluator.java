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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.helix.ast.CoreBuilder.core;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.helix.ast.Core;
import net.hydromatic.helix.ast.Pos;
import net.hydromatic.helix.compile.BuiltIn;
import net.hydromatic.helix.compile.Tracer;
import net.hydromatic.helix.compile.Tracers;
import net.hydromatic.helix.compile.TypeChecker;
import net.hydromatic.helix.type.FnType;
import net.hydromatic.helix.type.FuzzyType;
import net.hydromatic.helix.type.PrimitiveType;
import net.hydromatic.helix.type.RecordType;
import net.hydromatic.helix.type.Type;
import net.hydromatic.helix.type.TypeSystem;
import net.hydromatic.helix.type.Universes;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Call-by-value, small-step evaluator.
 *
 * <p>{@link #step} performs one reduction, choosing the leftmost reducible
 * subterm; {@link #evaluate} steps until the term is a value (see
 * {@link Values#isValue}). Variables are replaced by substitution, so every
 * term being evaluated is closed.
 *
 * <p>Reduction rules:
 *
 * <ul>
 * <li>beta: {@code (fn (x: T) => e) v} &rarr; {@code e[x := v]};
 * <li>{@code let x = v in e} &rarr; {@code e[x := v]};
 * <li>{@code if true then a else b} &rarr; {@code a}, and similarly for
 *   {@code false};
 * <li>{@code {a = v, ...}.a} &rarr; {@code v};
 * <li>a built-in applied to as many values as its arity reduces by its
 *   delta rule;
 * <li>{@code let fuzzy x = fuzzy(v, c) in e} &rarr;
 *   {@code fuzzy_discount(c, e[x := v])}.
 * </ul>
 */
public class Evaluator {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(Evaluator.class);

  /** Precision of {@code real_add} and {@code real_mul}. */
  private static final MathContext REAL_CONTEXT = MathContext.DECIMAL64;

  private final TypeSystem typeSystem;
  /** Re-derives types after each step; null if steps are not verified. */
  private final @Nullable TypeChecker verifier;
  private final int stepBudget;
  private final Tracer tracer;

  /** Creates an Evaluator. */
  public Evaluator(TypeSystem typeSystem, Session session, Tracer tracer) {
    this.typeSystem = requireNonNull(typeSystem);
    this.verifier = session.verifySteps()
        ? new TypeChecker(typeSystem, Universes.STANDARD)
        : null;
    this.stepBudget = session.stepBudget();
    this.tracer = requireNonNull(tracer);
  }

  /** Creates an Evaluator with a given session and no tracing. */
  public Evaluator(Session session) {
    this(new TypeSystem(), session, Tracers.empty());
  }

  /** Evaluates a closed, well-typed term to a value. */
  public Core.Exp evaluate(Core.Exp exp) {
    try {
      Core.Exp e = exp;
      for (int steps = 0;;) {
        final Core.Exp next = step(e);
        if (next == null) {
          LOGGER.debug("evaluated in {} steps: {}", steps, e);
          tracer.onResult(e);
          return e;
        }
        ++steps;
        if (stepBudget >= 0 && steps > stepBudget) {
          throw new HelixRuntimeException(
              HelixRuntimeException.Kind.STEP_BUDGET_EXCEEDED,
              "evaluation exceeded the step budget of " + stepBudget
                  + " steps",
              exp.pos);
        }
        if (verifier != null) {
          verify(verifier, next, exp.type);
        }
        tracer.onStep(steps, next);
        e = next;
      }
    } catch (HelixRuntimeException e) {
      tracer.onException(e);
      throw e;
    }
  }

  /** Checks that a term still has its original type. */
  private static void verify(TypeChecker verifier, Core.Exp exp, Type type) {
    final Type type2;
    try {
      type2 = verifier.verify(exp);
    } catch (TypeChecker.TypeException e) {
      throw new HelixRuntimeException(
          HelixRuntimeException.Kind.PRESERVATION_VIOLATED,
          "ill-typed term after reduction: " + e.getMessage(), exp.pos);
    }
    if (!type2.equals(type)) {
      throw new HelixRuntimeException(
          HelixRuntimeException.Kind.PRESERVATION_VIOLATED,
          "reduction changed type from " + type.moniker() + " to "
              + type2.moniker(),
          exp.pos);
    }
  }

  /** Performs one reduction step. Returns the reduced term, or null if the
   * term is a value. Throws {@link HelixRuntimeException.Kind#STUCK} if the
   * term is not a value but cannot be reduced. */
  public Core.@Nullable Exp step(Core.Exp exp) {
    if (Values.isValue(exp)) {
      return null;
    }
    switch (exp.op) {
    case APPLY:
      return stepApply((Core.Apply) exp);

    case LET:
      final Core.Let let = (Core.Let) exp;
      if (!Values.isValue(let.exp)) {
        return let.copy(stepSub(let.exp), let.body);
      }
      return Substituter.substitute(let.name, let.exp, let.body);

    case FUZZY_LET:
      final Core.FuzzyLet fuzzyLet = (Core.FuzzyLet) exp;
      if (!Values.isValue(fuzzyLet.exp)) {
        return fuzzyLet.copy(stepSub(fuzzyLet.exp), fuzzyLet.body);
      }
      final Core.Wrap wrap = wrap(fuzzyLet.exp);
      return discount(fuzzyLet.pos, wrap.confidence,
          Substituter.substitute(fuzzyLet.name, wrap.value, fuzzyLet.body));

    case IF:
      final Core.If anIf = (Core.If) exp;
      if (!Values.isValue(anIf.condition)) {
        return anIf.copy(stepSub(anIf.condition), anIf.ifTrue, anIf.ifFalse);
      }
      return literal(anIf.condition, Boolean.class)
          ? anIf.ifTrue
          : anIf.ifFalse;

    case SELECT:
      final Core.Select select = (Core.Select) exp;
      if (!Values.isValue(select.exp)) {
        return select.copy(stepSub(select.exp));
      }
      if (!(select.exp instanceof Core.Record)) {
        throw stuck(exp);
      }
      final Core.Exp field = ((Core.Record) select.exp).args.get(select.name);
      if (field == null) {
        throw stuck(exp);
      }
      return field;

    case RECORD:
      final Core.Record record = (Core.Record) exp;
      for (Map.Entry<String, Core.Exp> e : record.args.entrySet()) {
        if (!Values.isValue(e.getValue())) {
          return core.record(record.pos, (RecordType) record.type,
              replace(record.args, e.getKey(), stepSub(e.getValue())));
        }
      }
      throw stuck(exp);

    case FUZZY:
      final Core.Wrap wrap2 = (Core.Wrap) exp;
      if (!Values.isValue(wrap2.value)) {
        return wrap2.copy(stepSub(wrap2.value), wrap2.confidence);
      }
      return wrap2.copy(wrap2.value, stepSub(wrap2.confidence));

    default:
      throw stuck(exp);
    }
  }

  /** Steps a subterm that is known not to be a value. */
  private Core.Exp stepSub(Core.Exp exp) {
    return requireNonNull(step(exp));
  }

  private static Map<String, Core.Exp> replace(Map<String, Core.Exp> map,
      String key, Core.Exp value) {
    final Map<String, Core.Exp> map2 = new LinkedHashMap<>(map);
    map2.put(key, value);
    return map2;
  }

  private Core.Exp stepApply(Core.Apply apply) {
    if (!Values.isValue(apply.fn)) {
      return apply.copy(stepSub(apply.fn), apply.arg);
    }
    if (!Values.isValue(apply.arg)) {
      return apply.copy(apply.fn, stepSub(apply.arg));
    }
    if (apply.fn instanceof Core.Fn) {
      final Core.Fn fn = (Core.Fn) apply.fn;
      return Substituter.substitute(fn.name, apply.arg, fn.body);
    }
    final Core.Exp head = apply.head();
    if (!(head instanceof Core.Literal)) {
      throw stuck(apply);
    }
    final BuiltIn builtIn = literal(head, BuiltIn.class);
    final List<Core.Exp> args = apply.args();
    if (args.size() != builtIn.arity) {
      throw stuck(apply);
    }
    try {
      return delta(apply, builtIn, args);
    } catch (HelixRuntimeException e) {
      throw e.withPos(apply.pos);
    }
  }

  /** Applies the rule for a built-in function whose arguments are all
   * values. */
  private Core.Exp delta(Core.Apply apply, BuiltIn builtIn,
      List<Core.Exp> args) {
    final Pos pos = apply.pos;
    switch (builtIn) {
    case PROB_ADD:
      return core.probLiteral(pos, Probs.add(prob(args, 0), prob(args, 1)));
    case PROB_MUL:
      return core.probLiteral(pos, Probs.mul(prob(args, 0), prob(args, 1)));
    case CONFIDENCE_COMBINE:
      return core.probLiteral(pos,
          Probs.combine(prob(args, 0), prob(args, 1)));
    case PROB_COMPLEMENT:
      return core.probLiteral(pos, Probs.complement(prob(args, 0)));
    case PROB_MAX:
      return core.probLiteral(pos, Probs.max(prob(args, 0), prob(args, 1)));
    case PROB_MIN:
      return core.probLiteral(pos, Probs.min(prob(args, 0), prob(args, 1)));
    case PROB_LT:
      return core.boolLiteral(pos, Probs.lt(prob(args, 0), prob(args, 1)));
    case PROB_TO_REAL:
      return core.realLiteral(pos, Probs.toReal(prob(args, 0)));

    case INT_ADD:
      try {
        return core.intLiteral(pos,
            Math.addExact(integer(args, 0), integer(args, 1)));
      } catch (ArithmeticException e) {
        throw overflow(builtIn, pos);
      }
    case INT_SUB:
      try {
        return core.intLiteral(pos,
            Math.subtractExact(integer(args, 0), integer(args, 1)));
      } catch (ArithmeticException e) {
        throw overflow(builtIn, pos);
      }
    case INT_MUL:
      try {
        return core.intLiteral(pos,
            Math.multiplyExact(integer(args, 0), integer(args, 1)));
      } catch (ArithmeticException e) {
        throw overflow(builtIn, pos);
      }
    case INT_LT:
      return core.boolLiteral(pos, integer(args, 0) < integer(args, 1));
    case INT_EQ:
      return core.boolLiteral(pos, integer(args, 0) == integer(args, 1));

    case REAL_ADD:
      try {
        return core.realLiteral(pos,
            real(args, 0).add(real(args, 1), REAL_CONTEXT));
      } catch (ArithmeticException e) {
        throw overflow(builtIn, pos);
      }
    case REAL_MUL:
      try {
        return core.realLiteral(pos,
            real(args, 0).multiply(real(args, 1), REAL_CONTEXT));
      } catch (ArithmeticException e) {
        throw overflow(builtIn, pos);
      }

    case NOT:
      return core.boolLiteral(pos, !literal(args.get(0), Boolean.class));
    case STRING_CONCAT:
      return core.stringLiteral(pos,
          literal(args.get(0), String.class)
              + literal(args.get(1), String.class));

    case VALUE:
      return wrap(args.get(0)).value;
    case CONFIDENCE:
      return wrap(args.get(0)).confidence;

    case FUZZY_MAP:
      // fuzzy_map(f, fuzzy(v, c)) -> fuzzy(f(v), c)
      final Core.Wrap w = wrap(args.get(1));
      return core.wrap(pos, (FuzzyType) apply.type,
          core.apply(pos, args.get(0), w.value), w.confidence);

    case FUZZY_COMBINE:
      // fuzzy_combine(op, fuzzy(v1, c1), fuzzy(v2, c2))
      //   -> fuzzy(op(v1, v2), c1 * c2)
      final Core.Wrap w1 = wrap(args.get(1));
      final Core.Wrap w2 = wrap(args.get(2));
      return core.wrap(pos, (FuzzyType) apply.type,
          core.apply(pos, core.apply(pos, args.get(0), w1.value), w2.value),
          core.probLiteral(pos,
              Probs.combine(literal(w1.confidence, Prob.class),
                  literal(w2.confidence, Prob.class))));

    case FUZZY_BIND:
      // fuzzy_bind(fuzzy(v, c), f) -> fuzzy_discount(c, f(v))
      final Core.Wrap w3 = wrap(args.get(0));
      return discount(pos, w3.confidence,
          core.apply(pos, args.get(1), w3.value));

    case FUZZY_DISCOUNT:
      // fuzzy_discount(c, fuzzy(w, d)) -> fuzzy(w, c * d)
      final Core.Wrap w4 = wrap(args.get(1));
      return core.wrap(pos, (FuzzyType) w4.type, w4.value,
          core.probLiteral(pos,
              Probs.mul(prob(args, 0), literal(w4.confidence, Prob.class))));

    default:
      throw new AssertionError("unknown built-in " + builtIn);
    }
  }

  /** Creates {@code fuzzy_discount(c, e)}. */
  private Core.Exp discount(Pos pos, Core.Exp confidence, Core.Exp exp) {
    final FnType fnType =
        typeSystem.fnType(PrimitiveType.PROB, exp.type, exp.type);
    final Core.Exp fn =
        core.functionLiteral(pos, BuiltIn.FUZZY_DISCOUNT, fnType);
    return core.apply(pos, core.apply(pos, fn, confidence), exp);
  }

  private static HelixRuntimeException overflow(BuiltIn builtIn, Pos pos) {
    return new HelixRuntimeException(HelixRuntimeException.Kind.OVERFLOW,
        (builtIn == BuiltIn.REAL_ADD || builtIn == BuiltIn.REAL_MUL
            ? "real overflow in "
            : "integer overflow in ") + builtIn.mlName, pos);
  }

  private static HelixRuntimeException stuck(Core.Exp exp) {
    return new HelixRuntimeException(HelixRuntimeException.Kind.STUCK,
        "no reduction rule applies to " + exp, exp.pos);
  }

  private static Core.Wrap wrap(Core.Exp exp) {
    if (!(exp instanceof Core.Wrap)) {
      throw stuck(exp);
    }
    return (Core.Wrap) exp;
  }

  private static <C> C literal(Core.Exp exp, Class<C> clazz) {
    if (!(exp instanceof Core.Literal)
        || !clazz.isInstance(((Core.Literal) exp).value)) {
      throw stuck(exp);
    }
    return ((Core.Literal) exp).unwrap(clazz);
  }

  private static Prob prob(List<Core.Exp> args, int i) {
    return literal(args.get(i), Prob.class);
  }

  private static int integer(List<Core.Exp> args, int i) {
    return literal(args.get(i), Integer.class);
  }

  private static BigDecimal real(List<Core.Exp> args, int i) {
    return literal(args.get(i), BigDecimal.class);
  }
}

// End Evaluator.java
