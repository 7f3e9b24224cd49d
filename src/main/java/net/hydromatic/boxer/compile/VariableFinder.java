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
package net.hydromatic.boxer.compile;

import com.google.common.collect.ImmutableSet;
import java.util.Set;
import java.util.function.Consumer;
import net.hydromatic.boxer.ast.Drt;
import net.hydromatic.boxer.ast.Visitor;

/** Finds the variables in an expression. */
class VariableFinder extends Visitor {
  private final boolean referentsOnly;
  private final Consumer<Drt.Variable> consumer;

  private VariableFinder(boolean referentsOnly,
      Consumer<Drt.Variable> consumer) {
    this.referentsOnly = referentsOnly;
    this.consumer = consumer;
  }

  /** Returns the referents declared by every box in an expression,
   * including nested boxes. */
  static Set<Drt.Variable> referents(Drt.Exp exp) {
    final ImmutableSet.Builder<Drt.Variable> set = ImmutableSet.builder();
    exp.accept(new VariableFinder(true, set::add));
    return set.build();
  }

  /** Returns the names of all variables in an expression, including
   * predicates. */
  static Set<String> names(Drt.Exp exp) {
    final ImmutableSet.Builder<String> set = ImmutableSet.builder();
    exp.accept(new VariableFinder(false, v -> set.add(v.name)));
    return set.build();
  }

  @Override protected void visit(Drt.Drs drs) {
    if (referentsOnly) {
      drs.refs.forEach(consumer);
      drs.conds.forEach(this::accept);
    } else {
      super.visit(drs);
    }
  }

  @Override protected void visit(Drt.Variable variable) {
    if (!referentsOnly) {
      consumer.accept(variable);
    }
  }
}

// End VariableFinder.java
