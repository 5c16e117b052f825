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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.helix.ast.CoreBuilder.core;

import com.google.common.collect.ImmutableMap;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.helix.ast.Ast;
import net.hydromatic.helix.ast.AstNode;
import net.hydromatic.helix.ast.Core;
import net.hydromatic.helix.ast.Op;
import net.hydromatic.helix.ast.Pos;
import net.hydromatic.helix.eval.Prob;
import net.hydromatic.helix.type.Binding;
import net.hydromatic.helix.type.FnType;
import net.hydromatic.helix.type.FuzzyType;
import net.hydromatic.helix.type.PrimitiveType;
import net.hydromatic.helix.type.RecordType;
import net.hydromatic.helix.type.Sort;
import net.hydromatic.helix.type.Type;
import net.hydromatic.helix.type.TypeShuttle;
import net.hydromatic.helix.type.TypeSystem;
import net.hydromatic.helix.type.TypeUnifier;
import net.hydromatic.helix.type.TypeVar;
import net.hydromatic.helix.type.Universe;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bidirectional type checker.
 *
 * <p>{@link #infer} synthesizes the type of an expression; {@link #check}
 * checks an expression against an expected type. Both convert the
 * expression to a {@link Core.Exp} that carries its type.
 *
 * <p>The checker never coerces: a value of type {@code Prob} is not a
 * {@code Real}. The one exception is a probability literal checked against
 * {@code Real}, which is read as a real literal.
 *
 * <p>Every failure throws a {@link TypeException}.
 */
public class TypeChecker {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(TypeChecker.class);

  /** Name bound by an expression statement. */
  public static final String IT = "it";

  final TypeSystem typeSystem;
  final Universe universe;

  public TypeChecker(TypeSystem typeSystem, Universe universe) {
    this.typeSystem = requireNonNull(typeSystem);
    this.universe = requireNonNull(universe);
  }

  /** Checks a statement (declaration or expression). */
  public Program.Statement checkStatement(Environment env, AstNode node) {
    final Program.Statement statement;
    switch (node.op) {
    case VAL_DECL:
      statement = checkValDecl(env, (Ast.ValDecl) node);
      break;
    case TYPE_DECL:
      statement = checkTypeDecl(env, (Ast.TypeDecl) node);
      break;
    case PROP_DECL:
      statement = checkPropDecl(env, (Ast.PropDecl) node);
      break;
    case AXIOM_DECL:
      statement = checkAxiomDecl(env, (Ast.AxiomDecl) node);
      break;
    default:
      final Core.Exp e = infer(env, (Ast.Exp) node);
      statement = new Program.Statement(node, Binding.of(IT, e.type), e);
    }
    LOGGER.debug("checked {}", statement);
    return statement;
  }

  /**
   * Returns what a statement binds after it has failed to type-check.
   *
   * <p>A {@code val} with a valid annotation is bound at its declared type,
   * so that later statements can be checked; other declarations are bound as
   * {@link Binding.Kind#FAILED}.
   */
  public Binding failedBinding(Environment env, AstNode node) {
    final String name = node instanceof Ast.Decl
        ? ((Ast.Decl) node).name
        : IT;
    if (node instanceof Ast.ValDecl && ((Ast.ValDecl) node).type != null) {
      try {
        final Type type =
            resolveValueType(env, requireNonNull(((Ast.ValDecl) node).type));
        return Binding.of(name, type);
      } catch (TypeException e) {
        LOGGER.debug("annotation of failed declaration is invalid", e);
      }
    }
    return Binding.of(name, PrimitiveType.UNIT, Binding.Kind.FAILED);
  }

  private Program.Statement checkValDecl(Environment env,
      Ast.ValDecl valDecl) {
    if (valDecl.type != null) {
      final Type type = resolveType(env, valDecl.type);
      final @Nullable Sort sort = universe.sortOf(type);
      if (sort == Sort.PROP) {
        checkProof(env, valDecl.exp, type);
        return new Program.Statement(valDecl,
            Binding.of(valDecl.name, type, Binding.Kind.PROOF), null);
      }
      if (sort != Sort.TYPE) {
        throw notValueType(type, valDecl.type.pos);
      }
      final Core.Exp e = check(env, valDecl.exp, type);
      return new Program.Statement(valDecl, Binding.of(valDecl.name, type), e);
    }
    final @Nullable Binding proof = proofBinding(env, valDecl.exp);
    if (proof != null) {
      return new Program.Statement(valDecl,
          Binding.of(valDecl.name, proof.type, Binding.Kind.PROOF), null);
    }
    final Core.Exp e = infer(env, valDecl.exp);
    return new Program.Statement(valDecl, Binding.of(valDecl.name, e.type), e);
  }

  /** If an expression is a reference to a proof, returns its binding. */
  private static @Nullable Binding proofBinding(Environment env,
      Ast.Exp exp) {
    if (exp.op == Op.ID) {
      final Binding binding = env.getOpt(((Ast.Id) exp).name);
      if (binding != null && binding.kind == Binding.Kind.PROOF) {
        return binding;
      }
    }
    return null;
  }

  private void checkProof(Environment env, Ast.Exp exp, Type prop) {
    final Binding proof = proofBinding(env, exp);
    if (proof == null) {
      throw new TypeException(TypeException.Kind.TYPE_MISMATCH,
          "expected a proof of " + prop.moniker(), exp.pos);
    }
    if (!proof.type.equals(prop)) {
      throw mismatch(prop, proof.type, exp.pos);
    }
  }

  private Program.Statement checkTypeDecl(Environment env,
      Ast.TypeDecl typeDecl) {
    final Sort sort = typeDecl.sort == null
        ? Sort.TYPE
        : resolveSort(env, typeDecl.sort);
    final Type type = resolveType(env, typeDecl.type);
    final @Nullable Sort actualSort = universe.sortOf(type);
    if (actualSort != sort) {
      throw new TypeException(TypeException.Kind.UNIVERSE_MISMATCH,
          "type " + type.moniker() + " does not have sort " + sort,
          typeDecl.type.pos);
    }
    return new Program.Statement(typeDecl,
        Binding.of(typeDecl.name, type, Binding.Kind.TYPE), null);
  }

  private Program.Statement checkPropDecl(Environment env,
      Ast.PropDecl propDecl) {
    if (propDecl.sort != null) {
      final Sort sort = resolveSort(env, propDecl.sort);
      if (sort != Sort.PROP) {
        throw new TypeException(TypeException.Kind.UNIVERSE_MISMATCH,
            "proposition " + propDecl.name + " must have sort " + Sort.PROP
                + ", not " + sort,
            propDecl.sort.pos);
      }
    }
    return new Program.Statement(propDecl,
        Binding.of(propDecl.name, typeSystem.propType(propDecl.name),
            Binding.Kind.PROP),
        null);
  }

  private Program.Statement checkAxiomDecl(Environment env,
      Ast.AxiomDecl axiomDecl) {
    final Type type = resolveType(env, axiomDecl.type);
    if (universe.sortOf(type) != Sort.PROP) {
      throw new TypeException(TypeException.Kind.UNIVERSE_MISMATCH,
          "axiom " + axiomDecl.name + " must prove a proposition, but "
              + type.moniker() + " is not a proposition",
          axiomDecl.type.pos);
    }
    return new Program.Statement(axiomDecl,
        Binding.of(axiomDecl.name, type, Binding.Kind.PROOF), null);
  }

  /** Infers the type of an expression. */
  public Core.Exp infer(Environment env, Ast.Exp exp) {
    switch (exp.op) {
    case ID:
      return inferId(env, (Ast.Id) exp, null);

    case BOOL_LITERAL:
    case INT_LITERAL:
    case REAL_LITERAL:
    case STRING_LITERAL:
    case UNIT_LITERAL:
    case PROB_LITERAL:
      return literal((Ast.Literal) exp);

    case SORT:
      final Ast.SortExp sortExp = (Ast.SortExp) exp;
      throw new TypeException(TypeException.Kind.SORT_IN_VALUE_POSITION,
          sortExp.name + " is not a value", exp.pos);

    case FN:
      final Ast.Fn fn = (Ast.Fn) exp;
      final Type paramType = resolveValueType(env, fn.paramType);
      final Core.Exp body = infer(env.bind(fn.name, paramType), fn.body);
      return core.fn(fn.pos, typeSystem.fnType(paramType, body.type), fn.name,
          body);

    case APPLY:
      return inferApply(env, (Ast.Apply) exp, null);

    case SELECT:
      final Ast.Select select = (Ast.Select) exp;
      final Core.Exp record = infer(env, select.exp);
      if (!(record.type instanceof RecordType)) {
        throw new TypeException(TypeException.Kind.TYPE_MISMATCH,
            "expected a record type, but got " + record.type.moniker(),
            select.exp.pos);
      }
      final @Nullable Type fieldType =
          ((RecordType) record.type).argNameTypes.get(select.name);
      if (fieldType == null) {
        throw new TypeException(TypeException.Kind.NO_SUCH_FIELD,
            "no field '" + select.name + "' in type "
                + record.type.moniker(),
            select.pos);
      }
      return core.select(select.pos, fieldType, record, select.name);

    case ANNOTATED_EXP:
      final Ast.AnnotatedExp annotatedExp = (Ast.AnnotatedExp) exp;
      return check(env, annotatedExp.exp,
          resolveValueType(env, annotatedExp.type));

    case LET:
      final Ast.Let let = (Ast.Let) exp;
      final Core.Exp e = let.type == null
          ? infer(env, let.exp)
          : check(env, let.exp, resolveValueType(env, let.type));
      return core.let(let.pos, let.name, e,
          infer(env.bind(let.name, e.type), let.body));

    case FUZZY_LET:
      final Ast.FuzzyLet fuzzyLet = (Ast.FuzzyLet) exp;
      final Core.Exp e2 = infer(env, fuzzyLet.exp);
      final FuzzyType fuzzyType = requireFuzzy(e2, fuzzyLet.exp.pos);
      final Core.Exp body2 =
          infer(env.bind(fuzzyLet.name, fuzzyType.argType), fuzzyLet.body);
      requireFuzzy(body2, fuzzyLet.body.pos);
      return core.fuzzyLet(fuzzyLet.pos, fuzzyLet.name, e2, body2);

    case IF:
      final Ast.If anIf = (Ast.If) exp;
      final Core.Exp condition =
          check(env, anIf.condition, PrimitiveType.BOOL);
      final Core.Exp ifTrue = infer(env, anIf.ifTrue);
      final Core.Exp ifFalse = check(env, anIf.ifFalse, ifTrue.type);
      return core.ifThenElse(anIf.pos, condition, ifTrue, ifFalse);

    case RECORD:
      final Ast.Record astRecord = (Ast.Record) exp;
      final Map<String, Core.Exp> args = new LinkedHashMap<>();
      final Map<String, Type> argTypes = new LinkedHashMap<>();
      astRecord.args.forEach((name, arg) -> {
        final Core.Exp e3 = infer(env, arg);
        args.put(name, e3);
        argTypes.put(name, e3.type);
      });
      return core.record(astRecord.pos, typeSystem.recordType(argTypes), args);

    case FUZZY:
      final Ast.FuzzyExp fuzzyExp = (Ast.FuzzyExp) exp;
      final Core.Exp value = infer(env, fuzzyExp.value);
      final Core.Exp confidence =
          check(env, fuzzyExp.confidence, PrimitiveType.PROB);
      return core.wrap(fuzzyExp.pos, typeSystem.fuzzyType(value.type), value,
          confidence);

    default:
      throw new AssertionError("unknown expression " + exp.op);
    }
  }

  /** Checks an expression against an expected type. */
  public Core.Exp check(Environment env, Ast.Exp exp, Type expected) {
    switch (exp.op) {
    case ID:
      final Core.Exp id = inferId(env, (Ast.Id) exp, expected);
      return expect(id, expected, exp.pos);

    case PROB_LITERAL:
      if (expected == PrimitiveType.REAL) {
        // A probability literal is also a real literal.
        return core.realLiteral(exp.pos,
            (BigDecimal) ((Ast.Literal) exp).value);
      }
      break;

    case FN:
      if (expected instanceof FnType) {
        final Ast.Fn fn = (Ast.Fn) exp;
        final FnType fnType = (FnType) expected;
        final Type paramType = resolveValueType(env, fn.paramType);
        if (!paramType.equals(fnType.paramType)) {
          throw mismatch(fnType.paramType, paramType, fn.paramType.pos);
        }
        final Core.Exp body =
            check(env.bind(fn.name, paramType), fn.body, fnType.resultType);
        return core.fn(fn.pos, fnType, fn.name, body);
      }
      break;

    case APPLY:
      return expect(inferApply(env, (Ast.Apply) exp, expected), expected,
          exp.pos);

    case LET:
      final Ast.Let let = (Ast.Let) exp;
      final Core.Exp e = let.type == null
          ? infer(env, let.exp)
          : check(env, let.exp, resolveValueType(env, let.type));
      return core.let(let.pos, let.name, e,
          check(env.bind(let.name, e.type), let.body, expected));

    case FUZZY_LET:
      if (expected instanceof FuzzyType) {
        final Ast.FuzzyLet fuzzyLet = (Ast.FuzzyLet) exp;
        final Core.Exp e2 = infer(env, fuzzyLet.exp);
        final FuzzyType fuzzyType = requireFuzzy(e2, fuzzyLet.exp.pos);
        final Core.Exp body = check(env.bind(fuzzyLet.name, fuzzyType.argType),
            fuzzyLet.body, expected);
        return core.fuzzyLet(fuzzyLet.pos, fuzzyLet.name, e2, body);
      }
      break;

    case IF:
      final Ast.If anIf = (Ast.If) exp;
      return core.ifThenElse(anIf.pos,
          check(env, anIf.condition, PrimitiveType.BOOL),
          check(env, anIf.ifTrue, expected),
          check(env, anIf.ifFalse, expected));

    case RECORD:
      final Ast.Record record = (Ast.Record) exp;
      if (expected instanceof RecordType
          && ((RecordType) expected).argNameTypes.keySet()
              .equals(record.args.keySet())) {
        final RecordType recordType = (RecordType) expected;
        final Map<String, Core.Exp> args = new LinkedHashMap<>();
        record.args.forEach((name, arg) ->
            args.put(name,
                check(env, arg, recordType.argNameTypes.get(name))));
        return core.record(record.pos, recordType, args);
      }
      break;

    case FUZZY:
      if (expected instanceof FuzzyType) {
        final Ast.FuzzyExp fuzzyExp = (Ast.FuzzyExp) exp;
        return core.wrap(fuzzyExp.pos, (FuzzyType) expected,
            check(env, fuzzyExp.value, ((FuzzyType) expected).argType),
            check(env, fuzzyExp.confidence, PrimitiveType.PROB));
      }
      break;

    default:
      break;
    }
    return expect(infer(env, exp), expected, exp.pos);
  }

  /** Throws if an expression does not have the expected type. */
  private static Core.Exp expect(Core.Exp e, Type expected, Pos pos) {
    if (!e.type.equals(expected)) {
      throw mismatch(expected, e.type, pos);
    }
    return e;
  }

  private static FuzzyType requireFuzzy(Core.Exp e, Pos pos) {
    if (!(e.type instanceof FuzzyType)) {
      throw new TypeException(TypeException.Kind.TYPE_MISMATCH,
          "expected " + FuzzyType.NAME + "<T>, but got " + e.type.moniker(),
          pos);
    }
    return (FuzzyType) e.type;
  }

  private Core.Exp literal(Ast.Literal literal) {
    switch (literal.op) {
    case BOOL_LITERAL:
      return core.boolLiteral(literal.pos, (Boolean) literal.value);
    case INT_LITERAL:
      return core.intLiteral(literal.pos, (Integer) literal.value);
    case REAL_LITERAL:
      return core.realLiteral(literal.pos, (BigDecimal) literal.value);
    case STRING_LITERAL:
      return core.stringLiteral(literal.pos, (String) literal.value);
    case UNIT_LITERAL:
      return core.unitLiteral(literal.pos);
    case PROB_LITERAL:
      final BigDecimal value = (BigDecimal) literal.value;
      if (!Prob.isValid(value)) {
        throw new TypeException(TypeException.Kind.PROB_OUT_OF_RANGE,
            "probability literal " + value.toPlainString()
                + " is out of range [0, 1]",
            literal.pos);
      }
      return core.probLiteral(literal.pos, Prob.of(value));
    default:
      throw new AssertionError("unknown literal " + literal.op);
    }
  }

  /**
   * Converts a reference to a variable. If the variable is a polymorphic
   * built-in, its type is instantiated by matching against {@code expected};
   * if there is no expected type, throws {@code CANNOT_INFER}.
   */
  private Core.Exp inferId(Environment env, Ast.Id id,
      @Nullable Type expected) {
    final Binding binding = lookup(env, id);
    if (binding.value != null && binding.value.op == Op.FN_LITERAL) {
      final BuiltIn builtIn =
          ((Core.Literal) binding.value).unwrap(BuiltIn.class);
      Type type = binding.type;
      if (type.isPolymorphic()) {
        final @Nullable Map<Integer, Type> map = expected == null
            ? null
            : TypeUnifier.match(type, expected, ImmutableMap.of());
        if (map == null) {
          if (expected != null) {
            throw mismatch(expected, type, id.pos);
          }
          throw cannotInfer(builtIn, id.pos);
        }
        type = substitute(type, map);
      }
      return core.functionLiteral(id.pos, builtIn, type);
    }
    return core.id(id.pos, id.name, binding.type);
  }

  /** Looks up a variable, which must be bound to a value. */
  private static Binding lookup(Environment env, Ast.Id id) {
    final @Nullable Binding binding = env.getOpt(id.name);
    if (binding == null) {
      throw new TypeException(TypeException.Kind.UNBOUND_VARIABLE,
          "unbound variable: " + id.name, id.pos);
    }
    switch (binding.kind) {
    case VALUE:
      return binding;
    case TYPE:
      throw new TypeException(TypeException.Kind.SORT_IN_VALUE_POSITION,
          id.name + " is a type, not a value", id.pos);
    case PROP:
      throw new TypeException(TypeException.Kind.SORT_IN_VALUE_POSITION,
          id.name + " is a proposition, not a value", id.pos);
    case PROOF:
      throw new TypeException(TypeException.Kind.SORT_IN_VALUE_POSITION,
          id.name + " is a proof, not a value", id.pos);
    default:
      throw TypeException.followOn(id.name, id.pos);
    }
  }

  /**
   * Converts an application.
   *
   * <p>Flattens the spine {@code f(a)(b)} into a head and arguments. If the
   * head is a polymorphic built-in, its type variables are instantiated by
   * matching the parameter types against the inferred types of the
   * arguments, and finally the result type against {@code expected}.
   */
  private Core.Exp inferApply(Environment env, Ast.Apply apply,
      @Nullable Type expected) {
    final List<Ast.Apply> applies = new ArrayList<>();
    Ast.Exp head = apply;
    while (head instanceof Ast.Apply) {
      applies.add(0, (Ast.Apply) head);
      head = ((Ast.Apply) head).fn;
    }

    final @Nullable Binding builtInBinding = builtInBinding(env, head);
    if (builtInBinding != null && builtInBinding.type.isPolymorphic()) {
      return instantiate(env, builtInBinding, head, applies, expected);
    }

    Core.Exp fn = infer(env, head);
    for (Ast.Apply a : applies) {
      if (!(fn.type instanceof FnType)) {
        throw notAFunction(fn.type, head.pos);
      }
      final FnType fnType = (FnType) fn.type;
      final Core.Exp arg = check(env, a.arg, fnType.paramType);
      fn = core.apply(a.pos, fnType.resultType, fn, arg);
    }
    return fn;
  }

  /** If an expression is a reference to a built-in function, returns its
   * binding. */
  private static @Nullable Binding builtInBinding(Environment env,
      Ast.Exp exp) {
    if (exp.op == Op.ID) {
      final Binding binding = env.getOpt(((Ast.Id) exp).name);
      if (binding != null
          && binding.kind == Binding.Kind.VALUE
          && binding.value != null
          && binding.value.op == Op.FN_LITERAL) {
        return binding;
      }
    }
    return null;
  }

  private Core.Exp instantiate(Environment env, Binding binding,
      Ast.Exp head, List<Ast.Apply> applies, @Nullable Type expected) {
    final BuiltIn builtIn =
        ((Core.Literal) requireNonNull(binding.value)).unwrap(BuiltIn.class);
    Map<Integer, Type> map = ImmutableMap.of();
    Type type = binding.type;
    final List<Core.Exp> args = new ArrayList<>();
    for (Ast.Apply a : applies) {
      if (!(type instanceof FnType)) {
        throw notAFunction(substitute(type, map), head.pos);
      }
      final FnType fnType = (FnType) type;
      final Type paramType = substitute(fnType.paramType, map);
      if (paramType.isPolymorphic()) {
        final Core.Exp arg = infer(env, a.arg);
        final @Nullable Map<Integer, Type> map2 =
            TypeUnifier.match(paramType, arg.type, map);
        if (map2 == null) {
          throw mismatch(paramType, arg.type, a.arg.pos);
        }
        map = map2;
        args.add(arg);
      } else {
        args.add(check(env, a.arg, paramType));
      }
      type = fnType.resultType;
    }
    if (expected != null) {
      final @Nullable Map<Integer, Type> map2 =
          TypeUnifier.match(substitute(type, map), expected, map);
      if (map2 != null) {
        map = map2;
      }
    }
    final Type fnType = substitute(binding.type, map);
    if (fnType.isPolymorphic()) {
      throw cannotInfer(builtIn, head.pos);
    }
    Core.Exp fn = core.functionLiteral(head.pos, builtIn, fnType);
    for (int i = 0; i < args.size(); i++) {
      fn = core.apply(applies.get(i).pos, fn, args.get(i));
    }
    return fn;
  }

  /** Replaces type variables according to a map. */
  private Type substitute(Type type, Map<Integer, Type> map) {
    if (map.isEmpty()) {
      return type;
    }
    return type.accept(
        new TypeShuttle(typeSystem) {
          @Override
          public Type visit(TypeVar typeVar) {
            return map.getOrDefault(typeVar.ordinal, typeVar);
          }
        });
  }

  /** Converts a type expression to a type of any sort. */
  public Type resolveType(Environment env, Ast.Type type) {
    switch (type.op) {
    case NAMED_TYPE:
      final Ast.NamedType namedType = (Ast.NamedType) type;
      if (namedType.name.equals(FuzzyType.NAME)) {
        if (namedType.types.size() != 1) {
          throw new TypeException(TypeException.Kind.TYPE_MISMATCH,
              FuzzyType.NAME + " takes exactly one type argument, but got "
                  + namedType.types.size(),
              type.pos);
        }
        return typeSystem.fuzzyType(
            resolveValueType(env, namedType.types.get(0)));
      }
      if (!namedType.types.isEmpty()) {
        throw new TypeException(TypeException.Kind.TYPE_MISMATCH,
            "type " + namedType.name + " takes no type arguments",
            type.pos);
      }
      for (Sort sort : Sort.values()) {
        if (sort.moniker.equals(namedType.name)) {
          return sort;
        }
      }
      final @Nullable Binding binding = env.getOpt(namedType.name);
      if (binding != null) {
        switch (binding.kind) {
        case TYPE:
        case PROP:
          return binding.type;
        case FAILED:
          throw TypeException.followOn(namedType.name, type.pos);
        default:
          break;
        }
      }
      if (namedType.name.equals(PrimitiveType.PROB.moniker)) {
        return PrimitiveType.PROB;
      }
      throw new TypeException(TypeException.Kind.UNKNOWN_TYPE,
          "unknown type: " + namedType.name, type.pos);

    case TY_VAR:
      throw new TypeException(TypeException.Kind.UNKNOWN_TYPE,
          "type variables are not allowed in declarations: "
              + ((Ast.TyVar) type).name,
          type.pos);

    case RECORD_TYPE:
      final Ast.RecordType recordType = (Ast.RecordType) type;
      final Map<String, Type> fieldTypes = new LinkedHashMap<>();
      recordType.fieldTypes.forEach((name, fieldType) ->
          fieldTypes.put(name, resolveValueType(env, fieldType)));
      return typeSystem.recordType(fieldTypes);

    case FUNCTION_TYPE:
      final Ast.FunctionType functionType = (Ast.FunctionType) type;
      return typeSystem.fnType(resolveType(env, functionType.paramType),
          resolveType(env, functionType.resultType));

    default:
      throw new AssertionError("unknown type " + type.op);
    }
  }

  /** Converts a type expression to a type that classifies runtime values. */
  public Type resolveValueType(Environment env, Ast.Type type) {
    final Type t = resolveType(env, type);
    if (!universe.isValueType(t)) {
      throw notValueType(t, type.pos);
    }
    return t;
  }

  /** Converts a type expression that must denote a sort. */
  public Sort resolveSort(Environment env, Ast.Type type) {
    final Type t = resolveType(env, type);
    if (!(t instanceof Sort)) {
      throw new TypeException(TypeException.Kind.UNIVERSE_MISMATCH,
          t.moniker() + " is not a sort", type.pos);
    }
    return (Sort) t;
  }

  /**
   * Re-derives the type of a closed typed term, and checks that every node's
   * type is consistent with its children.
   *
   * <p>Used to check that reduction preserves types.
   */
  public Type verify(Core.Exp exp) {
    return verify(ImmutableMap.of(), exp);
  }

  private Type verify(Map<String, Type> vars, Core.Exp exp) {
    final Type type;
    switch (exp.op) {
    case ID:
      final Core.Id id = (Core.Id) exp;
      final @Nullable Type varType = vars.get(id.name);
      if (varType == null) {
        throw new TypeException(TypeException.Kind.UNBOUND_VARIABLE,
            "unbound variable: " + id.name, id.pos);
      }
      type = varType;
      break;

    case FN_LITERAL:
      final BuiltIn builtIn = ((Core.Literal) exp).unwrap(BuiltIn.class);
      if (TypeUnifier.match(builtIn.type(typeSystem), exp.type,
          ImmutableMap.of()) == null) {
        throw mismatch(builtIn.type(typeSystem), exp.type, exp.pos);
      }
      type = exp.type;
      break;

    case BOOL_LITERAL:
    case INT_LITERAL:
    case REAL_LITERAL:
    case PROB_LITERAL:
    case STRING_LITERAL:
    case UNIT_LITERAL:
      type = exp.type;
      break;

    case FN:
      final Core.Fn fn = (Core.Fn) exp;
      final Type bodyType =
          verify(plus(vars, fn.name, fn.paramType()), fn.body);
      type = typeSystem.fnType(fn.paramType(), bodyType);
      break;

    case APPLY:
      final Core.Apply apply = (Core.Apply) exp;
      final Type fnType = verify(vars, apply.fn);
      if (!(fnType instanceof FnType)) {
        throw notAFunction(fnType, apply.fn.pos);
      }
      expectType(verify(vars, apply.arg), ((FnType) fnType).paramType,
          apply.arg.pos);
      type = ((FnType) fnType).resultType;
      break;

    case LET:
      final Core.Let let = (Core.Let) exp;
      type = verify(plus(vars, let.name, verify(vars, let.exp)), let.body);
      break;

    case FUZZY_LET:
      final Core.FuzzyLet fuzzyLet = (Core.FuzzyLet) exp;
      final Type expType = verify(vars, fuzzyLet.exp);
      if (!(expType instanceof FuzzyType)) {
        throw mismatch(typeSystem.fuzzyType(typeSystem.typeVar(0)), expType,
            fuzzyLet.exp.pos);
      }
      type = verify(plus(vars, fuzzyLet.name, ((FuzzyType) expType).argType),
          fuzzyLet.body);
      if (!(type instanceof FuzzyType)) {
        throw mismatch(typeSystem.fuzzyType(typeSystem.typeVar(0)), type,
            fuzzyLet.body.pos);
      }
      break;

    case IF:
      final Core.If anIf = (Core.If) exp;
      expectType(verify(vars, anIf.condition), PrimitiveType.BOOL,
          anIf.condition.pos);
      type = verify(vars, anIf.ifTrue);
      expectType(verify(vars, anIf.ifFalse), type, anIf.ifFalse.pos);
      break;

    case RECORD:
      final Core.Record record = (Core.Record) exp;
      final Map<String, Type> argTypes = new LinkedHashMap<>();
      record.args.forEach((name, arg) -> argTypes.put(name, verify(vars, arg)));
      type = typeSystem.recordType(argTypes);
      break;

    case SELECT:
      final Core.Select select = (Core.Select) exp;
      final Type recordType = verify(vars, select.exp);
      final @Nullable Type fieldType = recordType instanceof RecordType
          ? ((RecordType) recordType).argNameTypes.get(select.name)
          : null;
      if (fieldType == null) {
        throw new TypeException(TypeException.Kind.NO_SUCH_FIELD,
            "no field '" + select.name + "' in type " + recordType.moniker(),
            select.pos);
      }
      type = fieldType;
      break;

    case FUZZY:
      final Core.Wrap wrap = (Core.Wrap) exp;
      expectType(verify(vars, wrap.confidence), PrimitiveType.PROB,
          wrap.confidence.pos);
      type = typeSystem.fuzzyType(verify(vars, wrap.value));
      break;

    default:
      throw new AssertionError("unknown term " + exp.op);
    }
    expectType(type, exp.type, exp.pos);
    return type;
  }

  private static Map<String, Type> plus(Map<String, Type> vars, String name,
      Type type) {
    final Map<String, Type> map = new HashMap<>(vars);
    map.put(name, type);
    return map;
  }

  private static void expectType(Type actual, Type expected, Pos pos) {
    if (!actual.equals(expected)) {
      throw mismatch(expected, actual, pos);
    }
  }

  private static TypeException mismatch(Type expected, Type actual, Pos pos) {
    return new TypeException(TypeException.Kind.TYPE_MISMATCH,
        "expected " + expected.moniker() + ", but got " + actual.moniker(),
        pos);
  }

  private static TypeException notAFunction(Type type, Pos pos) {
    return new TypeException(TypeException.Kind.NOT_A_FUNCTION,
        "expression of type " + type.moniker() + " is not a function", pos);
  }

  private static TypeException cannotInfer(BuiltIn builtIn, Pos pos) {
    return new TypeException(TypeException.Kind.CANNOT_INFER,
        "cannot infer the type of polymorphic function '" + builtIn.mlName
            + "'; apply it to arguments or annotate it",
        pos);
  }

  private TypeException notValueType(Type type, Pos pos) {
    final String reason;
    if (type instanceof Sort) {
      reason = " is a sort";
    } else if (universe.sortOf(type) == Sort.PROP) {
      reason = " is a proposition";
    } else {
      reason = " is not a type of values";
    }
    return new TypeException(TypeException.Kind.SORT_IN_VALUE_POSITION,
        type.moniker() + reason + ", and cannot be the type of a value", pos);
  }

  /** Error while deducing types. */
  public static class TypeException extends CompileException {
    public final Kind kind;
    /** Whether this error is a consequence of an earlier error, and
     * therefore should not be reported. */
    public final boolean followOn;

    public TypeException(Kind kind, String message, Pos pos) {
      this(kind, message, pos, false);
    }

    private TypeException(Kind kind, String message, Pos pos,
        boolean followOn) {
      super(message, pos);
      this.kind = requireNonNull(kind);
      this.followOn = followOn;
    }

    /** Creates an exception for a reference to a name whose declaration
     * failed. */
    static TypeException followOn(String name, Pos pos) {
      return new TypeException(Kind.UNBOUND_VARIABLE,
          "declaration of " + name + " failed", pos, true);
    }

    /** Kind of type error. */
    public enum Kind {
      UNBOUND_VARIABLE,
      TYPE_MISMATCH,
      PROB_OUT_OF_RANGE,
      NOT_A_FUNCTION,
      NO_SUCH_FIELD,
      SORT_IN_VALUE_POSITION,
      UNIVERSE_MISMATCH,
      UNKNOWN_TYPE,
      CANNOT_INFER
    }
  }
}

// End TypeChecker.java
