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
package net.hydromatic.boxer.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.boxer.ast.DrtBuilder.drt;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/** Various sub-classes of DRT nodes. */
public class Drt {
  private Drt() {}

  /** Variable; a discourse referent, an argument of an atom, or the name of
   * a predicate.
   *
   * <p>Two variables are equal if their names are equal. */
  public static class Variable extends DrtNode
      implements Comparable<Variable> {
    public final String name;

    Variable(String name) {
      super(Op.VARIABLE);
      this.name = requireNonNull(name);
      checkArgument(!name.isEmpty(), "empty variable name");
    }

    @Override public int hashCode() {
      return name.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Variable
          && name.equals(((Variable) o).name);
    }

    @Override public int compareTo(Variable o) {
      return name.compareTo(o.name);
    }

    @Override DrtWriter unparse(DrtWriter w) {
      return w.append(name);
    }

    @Override public Variable accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Base class of DRT expressions. */
  public abstract static class Exp extends DrtNode {
    Exp(Op op) {
      super(op);
    }

    @Override public abstract Exp accept(Shuttle shuttle);
  }

  /** Discourse Representation Structure, or "box": a list of referents and
   * a list of conditions that hold over them.
   *
   * <p>For example, "a dog barks" might be
   * {@code ([x0,e1],[n_dog_1(x0), v_bark_1(e1), r_agent_2(e1,x0)])}. */
  public static class Drs extends Exp {
    public final List<Variable> refs;
    public final List<Exp> conds;

    Drs(ImmutableList<Variable> refs, ImmutableList<Exp> conds) {
      super(Op.DRS);
      this.refs = requireNonNull(refs);
      this.conds = requireNonNull(conds);
    }

    @Override public int hashCode() {
      return Objects.hash(refs, conds);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Drs
          && refs.equals(((Drs) o).refs)
          && conds.equals(((Drs) o).conds);
    }

    @Override DrtWriter unparse(DrtWriter w) {
      return w.append("([")
          .appendAll(refs, ",")
          .append("],[")
          .appendAll(conds, ", ")
          .append("])");
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /** Creates a copy of this box with given referents and conditions,
     * or returns this box if they are the same. */
    public Drs copy(List<Variable> refs, List<Exp> conds) {
      return refs.equals(this.refs) && conds.equals(this.conds)
          ? this
          : drt.drs(refs, conds);
    }
  }

  /** Negation of an expression, {@code -e}. */
  public static class Negation extends Exp {
    public final Exp exp;

    Negation(Exp exp) {
      super(Op.NEGATION);
      this.exp = requireNonNull(exp);
    }

    @Override public int hashCode() {
      return Objects.hash(op, exp);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Negation
          && exp.equals(((Negation) o).exp);
    }

    @Override DrtWriter unparse(DrtWriter w) {
      return w.append(op.padded).append(exp);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public Negation copy(Exp exp) {
      return exp == this.exp ? this : drt.not(exp);
    }
  }

  /** Binary connective between two expressions: disjunction, implication
   * or concatenation (merge). */
  public static class Connective extends Exp {
    public final Exp left;
    public final Exp right;

    Connective(Op op, Exp left, Exp right) {
      super(op);
      checkArgument(op.isConnective(), "not a connective: %s", op);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
    }

    @Override public int hashCode() {
      return Objects.hash(op, left, right);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Connective
          && op == ((Connective) o).op
          && left.equals(((Connective) o).left)
          && right.equals(((Connective) o).right);
    }

    @Override DrtWriter unparse(DrtWriter w) {
      return w.infix(left, op, right);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public Connective copy(Exp left, Exp right) {
      return left == this.left && right == this.right
          ? this
          : drt.connective(op, left, right);
    }
  }

  /** Equality between two variables, {@code x = y}. */
  public static class Equality extends Exp {
    public final Variable left;
    public final Variable right;

    Equality(Variable left, Variable right) {
      super(Op.EQUALITY);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
    }

    @Override public int hashCode() {
      return Objects.hash(op, left, right);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Equality
          && left.equals(((Equality) o).left)
          && right.equals(((Equality) o).right);
    }

    @Override DrtWriter unparse(DrtWriter w) {
      return w.infix(left, op, right);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public Equality copy(Variable left, Variable right) {
      return left == this.left && right == this.right
          ? this
          : drt.eq(left, right);
    }
  }

  /** Predicate applied to one or more variables, for example
   * {@code r_agent_2(e1,x0)}.
   *
   * <p>An atom is the result of applying the predicate to its arguments one
   * at a time; see {@link #apply(Variable)}. */
  public static class Atom extends Exp {
    public final Variable predicate;
    public final List<Variable> args;

    Atom(Variable predicate, ImmutableList<Variable> args) {
      super(Op.ATOM);
      this.predicate = requireNonNull(predicate);
      this.args = requireNonNull(args);
      checkArgument(!args.isEmpty(), "atom %s has no arguments", predicate);
    }

    @Override public int hashCode() {
      return Objects.hash(predicate, args);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Atom
          && predicate.equals(((Atom) o).predicate)
          && args.equals(((Atom) o).args);
    }

    /** Returns the number of arguments. */
    public int arity() {
      return args.size();
    }

    /** Returns an atom with one more argument. */
    public Atom apply(Variable arg) {
      return new Atom(predicate,
          ImmutableList.<Variable>builder().addAll(args).add(arg).build());
    }

    @Override DrtWriter unparse(DrtWriter w) {
      return w.append(predicate)
          .append("(")
          .appendAll(args, ",")
          .append(")");
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public Atom copy(Variable predicate, List<Variable> args) {
      return predicate == this.predicate && args.equals(this.args)
          ? this
          : drt.atom(predicate, args);
    }
  }
}

// End Drt.java
