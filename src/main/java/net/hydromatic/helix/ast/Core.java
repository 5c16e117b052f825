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
package net.hydromatic.helix.ast;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.helix.ast.CoreBuilder.core;

import com.google.common.collect.ImmutableSortedMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import net.hydromatic.helix.compile.BuiltIn;
import net.hydromatic.helix.type.FnType;
import net.hydromatic.helix.type.FuzzyType;
import net.hydromatic.helix.type.RecordType;
import net.hydromatic.helix.type.Type;

/** Core expressions.
 *
 * <p>A core expression is the result of type-checking an {@link Ast.Exp};
 * every node carries its type. Values are core expressions in normal form
 * (see {@link net.hydromatic.helix.eval.Values}).
 *
 * <p>Equality is structural and ignores positions. {@link #toString()}
 * generates source text that parses and type-checks to an equal
 * expression. */
public class Core {
  private Core() {}

  /** Abstract base class of Core expressions. */
  public abstract static class Exp extends AstNode {
    public final Type type;

    Exp(Pos pos, Op op, Type type) {
      super(pos, op);
      this.type = requireNonNull(type);
    }

    /** Returns the type. */
    public Type type() {
      return type;
    }

    public abstract Exp accept(Shuttle shuttle);

    /** Returns whether this expression is a call to the given built-in,
     * with any number of arguments. */
    public boolean isCallTo(BuiltIn builtIn) {
      return false;
    }
  }

  /** Reference to a variable. */
  public static class Id extends Exp {
    public final String name;

    Id(Pos pos, String name, Type type) {
      super(pos, Op.ID, type);
      this.name = requireNonNull(name);
    }

    @Override public int hashCode() {
      return name.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Id
          && name.equals(((Id) o).name)
          && type.equals(((Id) o).type);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name);
    }
  }

  /** Code of a literal (constant).
   *
   * <p>The value is a {@link Boolean}, {@link Integer},
   * {@link java.math.BigDecimal} (for {@code Real}), {@link String},
   * {@link net.hydromatic.helix.eval.Prob},
   * {@link net.hydromatic.helix.eval.Unit}, or, if the op is
   * {@link Op#FN_LITERAL}, a {@link BuiltIn}. */
  public static class Literal extends Exp {
    public final Comparable value;

    Literal(Pos pos, Op op, Type type, Comparable value) {
      super(pos, op, type);
      this.value = requireNonNull(value);
    }

    /** Returns the value of this literal as a given class,
     * throwing if it is not of that class. */
    public <C> C unwrap(Class<C> clazz) {
      return clazz.cast(value);
    }

    @Override public int hashCode() {
      return Ast.literalHashCode(value);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
          && op == ((Literal) o).op
          && Ast.literalEquals(value, ((Literal) o).value)
          && (op != Op.FN_LITERAL || type.equals(((Literal) o).type));
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public boolean isCallTo(BuiltIn builtIn) {
      return op == Op.FN_LITERAL && value == builtIn;
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendLiteral(op, value);
    }
  }

  /** Lambda expression, "fn (x: T) => e". */
  public static class Fn extends Exp {
    public final String name;
    public final Exp body;

    Fn(Pos pos, FnType type, String name, Exp body) {
      super(pos, Op.FN, type);
      this.name = requireNonNull(name);
      this.body = requireNonNull(body);
    }

    /** Returns the type of the parameter. */
    public Type paramType() {
      return ((FnType) type).paramType;
    }

    @Override public int hashCode() {
      return Objects.hash(name, body);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Fn
          && name.equals(((Fn) o).name)
          && type.equals(((Fn) o).type)
          && body.equals(((Fn) o).body);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (right > op.right) {
        return w.parens(this);
      }
      return w.append("fn (").id(name).append(": ")
          .append(paramType().moniker()).append(") => ")
          .append(body, 0, right);
    }

    public Fn copy(Exp body) {
      return body == this.body ? this
          : core.fn(pos, (FnType) type, name, body);
    }
  }

  /** Application of a function to an argument. */
  public static class Apply extends Exp {
    public final Exp fn;
    public final Exp arg;

    Apply(Pos pos, Type type, Exp fn, Exp arg) {
      super(pos, Op.APPLY, type);
      this.fn = requireNonNull(fn);
      this.arg = requireNonNull(arg);
    }

    /** Returns the head of the application spine; for "f(a, b)",
     * returns "f". */
    public Exp head() {
      Exp e = fn;
      while (e instanceof Apply) {
        e = ((Apply) e).fn;
      }
      return e;
    }

    /** Returns the arguments of the application spine; for "f(a, b)",
     * returns [a, b]. */
    public List<Exp> args() {
      final List<Exp> args = new ArrayList<>();
      Exp e = this;
      while (e instanceof Apply) {
        args.add(0, ((Apply) e).arg);
        e = ((Apply) e).fn;
      }
      return args;
    }

    @Override public int hashCode() {
      return Objects.hash(fn, arg);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Apply
          && fn.equals(((Apply) o).fn)
          && arg.equals(((Apply) o).arg);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public boolean isCallTo(BuiltIn builtIn) {
      return head().isCallTo(builtIn);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      final List<Exp> args = args();
      w.append(head(), left, op.right).append("(");
      for (int i = 0; i < args.size(); i++) {
        w.append(i == 0 ? "" : ", ").append(args.get(i), 0, 0);
      }
      return w.append(")");
    }

    public Apply copy(Exp fn, Exp arg) {
      return fn == this.fn && arg == this.arg ? this
          : core.apply(pos, type, fn, arg);
    }
  }

  /** "let x = e in body". */
  public static class Let extends Exp {
    public final String name;
    public final Exp exp;
    public final Exp body;

    Let(Pos pos, String name, Exp exp, Exp body) {
      super(pos, Op.LET, body.type);
      this.name = requireNonNull(name);
      this.exp = requireNonNull(exp);
      this.body = requireNonNull(body);
    }

    @Override public int hashCode() {
      return Objects.hash(name, exp, body);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Let
          && name.equals(((Let) o).name)
          && exp.equals(((Let) o).exp)
          && body.equals(((Let) o).body);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (right > op.right) {
        return w.parens(this);
      }
      return w.append("let ").id(name)
          .append(" = ").append(exp, 0, 0)
          .append(" in ").append(body, 0, right);
    }

    public Let copy(Exp exp, Exp body) {
      return exp == this.exp && body == this.body ? this
          : core.let(pos, name, exp, body);
    }
  }

  /** "let fuzzy x = e in body"; {@code e} and {@code body} are fuzzy. */
  public static class FuzzyLet extends Exp {
    public final String name;
    public final Exp exp;
    public final Exp body;

    FuzzyLet(Pos pos, String name, Exp exp, Exp body) {
      super(pos, Op.FUZZY_LET, body.type);
      this.name = requireNonNull(name);
      this.exp = requireNonNull(exp);
      this.body = requireNonNull(body);
    }

    /** Returns the type of the bound variable. */
    public Type varType() {
      return ((FuzzyType) exp.type).argType;
    }

    @Override public int hashCode() {
      return Objects.hash(name, exp, body, op);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof FuzzyLet
          && name.equals(((FuzzyLet) o).name)
          && exp.equals(((FuzzyLet) o).exp)
          && body.equals(((FuzzyLet) o).body);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (right > op.right) {
        return w.parens(this);
      }
      return w.append("let fuzzy ").id(name)
          .append(" = ").append(exp, 0, 0)
          .append(" in ").append(body, 0, right);
    }

    public FuzzyLet copy(Exp exp, Exp body) {
      return exp == this.exp && body == this.body ? this
          : core.fuzzyLet(pos, name, exp, body);
    }
  }

  /** "if condition then ifTrue else ifFalse". */
  public static class If extends Exp {
    public final Exp condition;
    public final Exp ifTrue;
    public final Exp ifFalse;

    If(Pos pos, Exp condition, Exp ifTrue, Exp ifFalse) {
      super(pos, Op.IF, ifTrue.type);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
    }

    @Override public int hashCode() {
      return Objects.hash(condition, ifTrue, ifFalse);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof If
          && condition.equals(((If) o).condition)
          && ifTrue.equals(((If) o).ifTrue)
          && ifFalse.equals(((If) o).ifFalse);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (right > op.right) {
        return w.parens(this);
      }
      return w.append("if ").append(condition, 0, 0)
          .append(" then ").append(ifTrue, 0, 0)
          .append(" else ").append(ifFalse, 0, right);
    }

    public If copy(Exp condition, Exp ifTrue, Exp ifFalse) {
      return condition == this.condition
          && ifTrue == this.ifTrue
          && ifFalse == this.ifFalse
          ? this
          : core.ifThenElse(pos, condition, ifTrue, ifFalse);
    }
  }

  /** Record construction. Fields are sorted by name. */
  public static class Record extends Exp {
    public final ImmutableSortedMap<String, Exp> args;

    Record(Pos pos, RecordType type, ImmutableSortedMap<String, Exp> args) {
      super(pos, Op.RECORD, type);
      this.args = requireNonNull(args);
    }

    @Override public int hashCode() {
      return args.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Record
          && args.equals(((Record) o).args);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return Ast.appendFields(w, args, " = ");
    }

    public Record copy(ImmutableSortedMap<String, Exp> args) {
      return args.equals(this.args) ? this
          : core.record(pos, (RecordType) type, args);
    }
  }

  /** Projection of a field from a record, "e.name". */
  public static class Select extends Exp {
    public final Exp exp;
    public final String name;

    Select(Pos pos, Type type, Exp exp, String name) {
      super(pos, Op.SELECT, type);
      this.exp = requireNonNull(exp);
      this.name = requireNonNull(name);
    }

    @Override public int hashCode() {
      return Objects.hash(exp, name);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Select
          && exp.equals(((Select) o).exp)
          && name.equals(((Select) o).name);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(exp, left, op.right).append(".").id(name);
    }

    public Select copy(Exp exp) {
      return exp == this.exp ? this : core.select(pos, type, exp, name);
    }
  }

  /** Fuzzy value, "fuzzy(value, confidence)". */
  public static class Wrap extends Exp {
    public final Exp value;
    public final Exp confidence;

    Wrap(Pos pos, FuzzyType type, Exp value, Exp confidence) {
      super(pos, Op.FUZZY, type);
      this.value = requireNonNull(value);
      this.confidence = requireNonNull(confidence);
    }

    @Override public int hashCode() {
      return Objects.hash(value, confidence);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Wrap
          && value.equals(((Wrap) o).value)
          && confidence.equals(((Wrap) o).confidence);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("fuzzy(").append(value, 0, 0)
          .append(", ").append(confidence, 0, 0).append(")");
    }

    public Wrap copy(Exp value, Exp confidence) {
      return value == this.value && confidence == this.confidence ? this
          : core.wrap(pos, (FuzzyType) type, value, confidence);
    }
  }
}

// End Core.java
