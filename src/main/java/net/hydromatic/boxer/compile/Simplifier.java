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

import static net.hydromatic.boxer.ast.DrtBuilder.drt;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import net.hydromatic.boxer.ast.Drt;
import net.hydromatic.boxer.ast.Op;
import net.hydromatic.boxer.ast.Shuttle;
import net.hydromatic.boxer.parse.PredicateNames;

/** Simplifier of DRT expressions. */
public class Simplifier {
  private Simplifier() {}

  /**
   * Simplifies an expression.
   *
   * <ul>
   *   <li>{@code (([x],[A]) + ([y],[B]))} &rarr; {@code ([x,y],[A, B])}
   *   <li>{@code r_nn_2(x,y)} &rarr; {@code (x = y)}
   * </ul>
   */
  public static Drt.Exp simplify(Drt.Exp exp) {
    return foldCompoundNouns(flattenMerges(exp));
  }

  /**
   * Merges each concatenation of two boxes into one box.
   *
   * <p>Referents of the right box that are also declared in the left box
   * are renamed first, so that the boxes keep their distinct entities.
   */
  public static Drt.Exp flattenMerges(Drt.Exp exp) {
    return exp.accept(new MergeShuttle());
  }

  /** Converts each compound-noun relation {@code r_nn_2(x,y)} into the
   * equality {@code (x = y)}. */
  public static Drt.Exp foldCompoundNouns(Drt.Exp exp) {
    return exp.accept(new CompoundNounShuttle());
  }

  /**
   * Merges two boxes.
   *
   * <p>Fresh names for clashing referents avoid only the names that occur
   * in the two boxes. A fresh name may equal a name declared in an
   * enclosing box; the merged box then shadows it, as any nested box may,
   * and no free variable of either operand is captured.
   */
  static Drt.Drs merge(Drt.Drs left, Drt.Drs right) {
    final Set<Drt.Variable> clashes =
        Sets.intersection(VariableFinder.referents(left),
            VariableFinder.referents(right));
    if (!clashes.isEmpty()) {
      final NameGenerator nameGenerator =
          new NameGenerator(
              Sets.union(VariableFinder.names(left),
                  VariableFinder.names(right)));
      final Map<Drt.Variable, Drt.Variable> substitution =
          new LinkedHashMap<>();
      for (Drt.Variable clash : clashes) {
        substitution.put(clash,
            drt.variable(nameGenerator.fresh(clash.name)));
      }
      right = (Drt.Drs) Replacer.substitute(substitution, right);
    }
    return drt.drs(
        ImmutableList.<Drt.Variable>builder()
            .addAll(left.refs).addAll(right.refs).build(),
        ImmutableList.<Drt.Exp>builder()
            .addAll(left.conds).addAll(right.conds).build());
  }

  /** Shuttle that merges concatenated boxes, bottom-up. */
  private static class MergeShuttle extends Shuttle {
    @Override protected Drt.Exp visit(Drt.Connective connective) {
      final Drt.Exp exp = super.visit(connective);
      if (exp.op == Op.CONCATENATION) {
        final Drt.Connective concat = (Drt.Connective) exp;
        if (concat.left.op == Op.DRS && concat.right.op == Op.DRS) {
          return merge((Drt.Drs) concat.left, (Drt.Drs) concat.right);
        }
      }
      return exp;
    }
  }

  /** Shuttle that replaces compound-noun relations with equalities. */
  private static class CompoundNounShuttle extends Shuttle {
    @Override protected Drt.Exp visit(Drt.Atom atom) {
      if (atom.predicate.name.equals(PredicateNames.COMPOUND_NOUN)
          && atom.arity() == 2) {
        return drt.eq(atom.args.get(0), atom.args.get(1));
      }
      return super.visit(atom);
    }
  }
}

// End Simplifier.java
