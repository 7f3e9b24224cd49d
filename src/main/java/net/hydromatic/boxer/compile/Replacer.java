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

import static java.util.Objects.requireNonNull;

import java.util.Map;
import net.hydromatic.boxer.ast.Drt;
import net.hydromatic.boxer.ast.Shuttle;

/** Replaces variables with other variables, wherever they occur as a
 * referent or an argument. Predicates are not replaced. */
class Replacer extends Shuttle {
  private final Map<Drt.Variable, Drt.Variable> substitution;

  private Replacer(Map<Drt.Variable, Drt.Variable> substitution) {
    this.substitution = requireNonNull(substitution);
  }

  static Drt.Exp substitute(Map<Drt.Variable, Drt.Variable> substitution,
      Drt.Exp exp) {
    if (substitution.isEmpty()) {
      return exp;
    }
    return exp.accept(new Replacer(substitution));
  }

  @Override protected Drt.Variable visit(Drt.Variable variable) {
    return substitution.getOrDefault(variable, variable);
  }

  @Override protected Drt.Exp visit(Drt.Atom atom) {
    return atom.copy(atom.predicate, visitList(atom.args));
  }
}

// End Replacer.java
