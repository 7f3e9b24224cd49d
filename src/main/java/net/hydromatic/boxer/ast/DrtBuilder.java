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

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Builds DRT expressions. */
public enum DrtBuilder {
  /**
   * The singleton instance of the DRT builder. The short name is convenient
   * for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  drt;

  /** Creates a variable. */
  public Drt.Variable variable(String name) {
    return new Drt.Variable(name);
  }

  /** Creates a box. */
  public Drt.Drs drs(List<Drt.Variable> refs, List<? extends Drt.Exp> conds) {
    return new Drt.Drs(ImmutableList.copyOf(refs), ImmutableList.copyOf(conds));
  }

  /** Creates a box with no referents and no conditions. */
  public Drt.Drs emptyDrs() {
    return drs(ImmutableList.of(), ImmutableList.of());
  }

  public Drt.Negation not(Drt.Exp exp) {
    return new Drt.Negation(exp);
  }

  public Drt.Connective or(Drt.Exp left, Drt.Exp right) {
    return connective(Op.OR, left, right);
  }

  public Drt.Connective imp(Drt.Exp left, Drt.Exp right) {
    return connective(Op.IMPLIES, left, right);
  }

  /** Creates a merge of two boxes. */
  public Drt.Connective concat(Drt.Exp left, Drt.Exp right) {
    return connective(Op.CONCATENATION, left, right);
  }

  public Drt.Connective connective(Op op, Drt.Exp left, Drt.Exp right) {
    return new Drt.Connective(op, left, right);
  }

  public Drt.Equality eq(Drt.Variable left, Drt.Variable right) {
    return new Drt.Equality(left, right);
  }

  /** Creates an atom by applying a predicate to each argument in turn. */
  public Drt.Atom atom(Drt.Variable predicate, List<Drt.Variable> args) {
    checkArgument(!args.isEmpty(), "atom %s has no arguments", predicate);
    Drt.Atom atom =
        new Drt.Atom(predicate, ImmutableList.of(args.get(0)));
    for (Drt.Variable arg : args.subList(1, args.size())) {
      atom = atom.apply(arg);
    }
    return atom;
  }

  /** Creates an atom from a predicate name and argument names. */
  public Drt.Atom atom(String predicate, String... args) {
    final ImmutableList.Builder<Drt.Variable> list = ImmutableList.builder();
    for (String arg : args) {
      list.add(variable(arg));
    }
    return atom(variable(predicate), list.build());
  }
}

// End DrtBuilder.java
