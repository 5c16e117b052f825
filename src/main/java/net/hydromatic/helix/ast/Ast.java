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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Various sub-classes of AST nodes. */
public class Ast {
  private Ast() {}

  /** Writes a comma-separated list of "name sep value" entries. */
  static AstWriter appendFields(AstWriter w,
      Map<String, ? extends AstNode> map, String sep) {
    w.append("{");
    int i = 0;
    for (Map.Entry<String, ? extends AstNode> e : map.entrySet()) {
      w.append(i++ > 0 ? ", " : "")
          .id(e.getKey()).append(sep).append(e.getValue(), 0, 0);
    }
    return w.append("}");
  }

  /** Compares literal values; numbers compare by value, ignoring scale. */
  static boolean literalEquals(Object v0, Object v1) {
    if (v0 instanceof BigDecimal && v1 instanceof BigDecimal) {
      return ((BigDecimal) v0).compareTo((BigDecimal) v1) == 0;
    }
    return v0.equals(v1);
  }

  static int literalHashCode(Object v) {
    return v instanceof BigDecimal
        ? ((BigDecimal) v).stripTrailingZeros().hashCode()
        : v.hashCode();
  }

  /** Base class for parse tree nodes that represent types. */
  public abstract static class Type extends AstNode {
    /** Creates a type node. */
    Type(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Parse tree for a named type, e.g. "Int", "Gene" or "Fuzzy&lt;Prob&gt;".
   *
   * <p>The sort keywords {@code Type} and {@code Prop} are named types in
   * the parse tree; the type checker decides where they are allowed. */
  public static class NamedType extends Type {
    public final String name;
    public final List<Type> types;

    NamedType(Pos pos, String name, ImmutableList<Type> types) {
      super(pos, Op.NAMED_TYPE);
      this.name = requireNonNull(name);
      this.types = requireNonNull(types);
    }

    @Override public int hashCode() {
      return Objects.hash(name, types);
    }

    @Override public boolean equals(Object obj) {
      return obj == this
          || obj instanceof NamedType
          && name.equals(((NamedType) obj).name)
          && types.equals(((NamedType) obj).types);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.id(name);
      if (!types.isEmpty()) {
        w.append("<");
        for (int i = 0; i < types.size(); i++) {
          w.append(i == 0 ? "" : ", ").append(types.get(i), 0, 0);
        }
        w.append(">");
      }
      return w;
    }
  }

  /** Parse tree node of a type variable, e.g. "'a". */
  public static class TyVar extends Type {
    public final String name;

    TyVar(Pos pos, String name) {
      super(pos, Op.TY_VAR);
      this.name = requireNonNull(name);
    }

    @Override public int hashCode() {
      return name.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof TyVar
          && this.name.equals(((TyVar) o).name);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name);
    }
  }

  /** Parse tree node of a record type. */
  public static class RecordType extends Type {
    public final ImmutableSortedMap<String, Type> fieldTypes;

    RecordType(Pos pos, ImmutableSortedMap<String, Type> fieldTypes) {
      super(pos, Op.RECORD_TYPE);
      this.fieldTypes = requireNonNull(fieldTypes);
    }

    @Override public int hashCode() {
      return fieldTypes.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof RecordType
          && this.fieldTypes.equals(((RecordType) o).fieldTypes);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return appendFields(w, fieldTypes, ": ");
    }
  }

  /** Function type, "A -> B". Right-associative. */
  public static class FunctionType extends Type {
    public final Type paramType;
    public final Type resultType;

    FunctionType(Pos pos, Type paramType, Type resultType) {
      super(pos, Op.FUNCTION_TYPE);
      this.paramType = requireNonNull(paramType);
      this.resultType = requireNonNull(resultType);
    }

    @Override public int hashCode() {
      return Objects.hash(paramType, resultType);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof FunctionType
          && paramType.equals(((FunctionType) o).paramType)
          && resultType.equals(((FunctionType) o).resultType);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (right > op.right) {
        return w.parens(this);
      }
      return w.append(paramType, left, op.right + 1)
          .append(op.padded)
          .append(resultType, op.right, right);
    }
  }

  /** Base class of expression ASTs. */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Parse tree node of an identifier. */
  public static class Id extends Exp {
    public final String name;

    Id(Pos pos, String name) {
      super(pos, Op.ID);
      this.name = requireNonNull(name);
    }

    @Override public int hashCode() {
      return name.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Id
          && this.name.equals(((Id) o).name);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name);
    }
  }

  /** Parse tree node of a literal (constant).
   *
   * <p>The value of a probability literal is the {@link BigDecimal} as
   * written; it may be out of range, which the type checker reports. */
  public static class Literal extends Exp {
    public final Comparable value;

    Literal(Pos pos, Op op, Comparable value) {
      super(pos, op);
      this.value = requireNonNull(value);
    }

    @Override public int hashCode() {
      return Objects.hash(op, literalHashCode(value));
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
          && this.op == ((Literal) o).op
          && literalEquals(this.value, ((Literal) o).value);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendLiteral(op, value);
    }
  }

  /** Sort or type keyword used as an expression, e.g. "Prob". */
  public static class SortExp extends Exp {
    public final String name;

    SortExp(Pos pos, String name) {
      super(pos, Op.SORT);
      this.name = requireNonNull(name);
    }

    @Override public int hashCode() {
      return name.hashCode() + 1;
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof SortExp
          && this.name.equals(((SortExp) o).name);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name);
    }
  }

  /** Lambda, "fn (x: T) => e". */
  public static class Fn extends Exp {
    public final String name;
    public final Type paramType;
    public final Exp body;

    Fn(Pos pos, String name, Type paramType, Exp body) {
      super(pos, Op.FN);
      this.name = requireNonNull(name);
      this.paramType = requireNonNull(paramType);
      this.body = requireNonNull(body);
    }

    @Override public int hashCode() {
      return Objects.hash(name, paramType, body);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Fn
          && name.equals(((Fn) o).name)
          && paramType.equals(((Fn) o).paramType)
          && body.equals(((Fn) o).body);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (right > op.right) {
        return w.parens(this);
      }
      return w.append("fn (").id(name).append(": ")
          .append(paramType, 0, 0).append(") => ")
          .append(body, 0, right);
    }
  }

  /** Application of a function to one argument. "f(a, b)" is parsed as
   * two nested applications. */
  public static class Apply extends Exp {
    public final Exp fn;
    public final Exp arg;

    Apply(Pos pos, Exp fn, Exp arg) {
      super(pos, Op.APPLY);
      this.fn = requireNonNull(fn);
      this.arg = requireNonNull(arg);
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

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      final List<Exp> args = new ArrayList<>();
      Exp e = this;
      while (e instanceof Apply) {
        args.add(0, ((Apply) e).arg);
        e = ((Apply) e).fn;
      }
      w.append(e, left, op.right).append("(");
      for (int i = 0; i < args.size(); i++) {
        w.append(i == 0 ? "" : ", ").append(args.get(i), 0, 0);
      }
      return w.append(")");
    }
  }

  /** Field projection, "e.name". */
  public static class Select extends Exp {
    public final Exp exp;
    public final String name;

    Select(Pos pos, Exp exp, String name) {
      super(pos, Op.SELECT);
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

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(exp, left, op.right).append(".").id(name);
    }
  }

  /** Let expression, "let x [: T] = e in body". */
  public static class Let extends Exp {
    public final String name;
    public final @Nullable Type type;
    public final Exp exp;
    public final Exp body;

    Let(Pos pos, String name, @Nullable Type type, Exp exp, Exp body) {
      super(pos, Op.LET);
      this.name = requireNonNull(name);
      this.type = type;
      this.exp = requireNonNull(exp);
      this.body = requireNonNull(body);
    }

    @Override public int hashCode() {
      return Objects.hash(name, type, exp, body);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Let
          && name.equals(((Let) o).name)
          && Objects.equals(type, ((Let) o).type)
          && exp.equals(((Let) o).exp)
          && body.equals(((Let) o).body);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (right > op.right) {
        return w.parens(this);
      }
      w.append("let ").id(name);
      if (type != null) {
        w.append(" : ").append(type, 0, 0);
      }
      return w.append(" = ").append(exp, 0, 0)
          .append(" in ").append(body, 0, right);
    }
  }

  /** Fuzzy bind, "let fuzzy x = e in body". */
  public static class FuzzyLet extends Exp {
    public final String name;
    public final Exp exp;
    public final Exp body;

    FuzzyLet(Pos pos, String name, Exp exp, Exp body) {
      super(pos, Op.FUZZY_LET);
      this.name = requireNonNull(name);
      this.exp = requireNonNull(exp);
      this.body = requireNonNull(body);
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

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (right > op.right) {
        return w.parens(this);
      }
      return w.append("let fuzzy ").id(name)
          .append(" = ").append(exp, 0, 0)
          .append(" in ").append(body, 0, right);
    }
  }

  /** Parse tree node of an "if ... then ... else" expression. */
  public static class If extends Exp {
    public final Exp condition;
    public final Exp ifTrue;
    public final Exp ifFalse;

    If(Pos pos, Exp condition, Exp ifTrue, Exp ifFalse) {
      super(pos, Op.IF);
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

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (right > op.right) {
        return w.parens(this);
      }
      return w.append("if ").append(condition, 0, 0)
          .append(" then ").append(ifTrue, 0, 0)
          .append(" else ").append(ifFalse, 0, right);
    }
  }

  /** Parse tree node of an expression annotated with a type, "e : T". */
  public static class AnnotatedExp extends Exp {
    public final Exp exp;
    public final Type type;

    AnnotatedExp(Pos pos, Exp exp, Type type) {
      super(pos, Op.ANNOTATED_EXP);
      this.exp = requireNonNull(exp);
      this.type = requireNonNull(type);
    }

    @Override public int hashCode() {
      return Objects.hash(type, exp);
    }

    @Override public boolean equals(Object obj) {
      return this == obj
          || obj instanceof AnnotatedExp
          && type.equals(((AnnotatedExp) obj).type)
          && exp.equals(((AnnotatedExp) obj).exp);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (right > op.right) {
        return w.parens(this);
      }
      return w.append(exp, left, op.right + 1)
          .append(op.padded)
          .append(type, 0, 0);
    }
  }

  /** Record construction, "{a = e1, b = e2}". */
  public static class Record extends Exp {
    public final ImmutableSortedMap<String, Exp> args;

    Record(Pos pos, ImmutableSortedMap<String, Exp> args) {
      super(pos, Op.RECORD);
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

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return appendFields(w, args, " = ");
    }
  }

  /** Fuzzy wrap, "fuzzy(v, c)". */
  public static class FuzzyExp extends Exp {
    public final Exp value;
    public final Exp confidence;

    FuzzyExp(Pos pos, Exp value, Exp confidence) {
      super(pos, Op.FUZZY);
      this.value = requireNonNull(value);
      this.confidence = requireNonNull(confidence);
    }

    @Override public int hashCode() {
      return Objects.hash(value, confidence);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof FuzzyExp
          && value.equals(((FuzzyExp) o).value)
          && confidence.equals(((FuzzyExp) o).confidence);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("fuzzy(").append(value, 0, 0)
          .append(", ").append(confidence, 0, 0).append(")");
    }
  }

  /** Base class for declarations. */
  public abstract static class Decl extends AstNode {
    public final String name;

    Decl(Pos pos, Op op, String name) {
      super(pos, op);
      this.name = requireNonNull(name);
    }
  }

  /** Value declaration, "val x [: T] = e". */
  public static class ValDecl extends Decl {
    public final @Nullable Type type;
    public final Exp exp;

    ValDecl(Pos pos, String name, @Nullable Type type, Exp exp) {
      super(pos, Op.VAL_DECL, name);
      this.type = type;
      this.exp = requireNonNull(exp);
    }

    @Override public int hashCode() {
      return Objects.hash(name, type, exp);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof ValDecl
          && name.equals(((ValDecl) o).name)
          && Objects.equals(type, ((ValDecl) o).type)
          && exp.equals(((ValDecl) o).exp);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("val ").id(name);
      if (type != null) {
        w.append(" : ").append(type, 0, 0);
      }
      return w.append(" = ").append(exp, 0, right);
    }
  }

  /** Type declaration, "type N [: S] = T". */
  public static class TypeDecl extends Decl {
    public final @Nullable Type sort;
    public final Type type;

    TypeDecl(Pos pos, String name, @Nullable Type sort, Type type) {
      super(pos, Op.TYPE_DECL, name);
      this.sort = sort;
      this.type = requireNonNull(type);
    }

    @Override public int hashCode() {
      return Objects.hash(name, sort, type);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof TypeDecl
          && name.equals(((TypeDecl) o).name)
          && Objects.equals(sort, ((TypeDecl) o).sort)
          && type.equals(((TypeDecl) o).type);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("type ").id(name);
      if (sort != null) {
        w.append(" : ").append(sort, 0, 0);
      }
      return w.append(" = ").append(type, 0, 0);
    }
  }

  /** Declaration of an opaque proposition constant, "prop N [: S]". */
  public static class PropDecl extends Decl {
    public final @Nullable Type sort;

    PropDecl(Pos pos, String name, @Nullable Type sort) {
      super(pos, Op.PROP_DECL, name);
      this.sort = sort;
    }

    @Override public int hashCode() {
      return Objects.hash(name, sort, op);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof PropDecl
          && name.equals(((PropDecl) o).name)
          && Objects.equals(sort, ((PropDecl) o).sort);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("prop ").id(name);
      if (sort != null) {
        w.append(" : ").append(sort, 0, 0);
      }
      return w;
    }
  }

  /** Declaration of an opaque proof of a proposition, "axiom h : P". */
  public static class AxiomDecl extends Decl {
    public final Type type;

    AxiomDecl(Pos pos, String name, Type type) {
      super(pos, Op.AXIOM_DECL, name);
      this.type = requireNonNull(type);
    }

    @Override public int hashCode() {
      return Objects.hash(name, type, op);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof AxiomDecl
          && name.equals(((AxiomDecl) o).name)
          && type.equals(((AxiomDecl) o).type);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("axiom ").id(name).append(" : ").append(type, 0, 0);
    }
  }
}

// End Ast.java
