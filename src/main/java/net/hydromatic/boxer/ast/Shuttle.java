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

import java.util.ArrayList;
import java.util.List;

/**
 * Visits and transforms DRT expressions.
 *
 * <p>Each {@code visit} method rebuilds its node bottom-up from the
 * transformed children, and returns the original node if no child changed.
 */
public class Shuttle {
  /** Creates a Shuttle. */
  public Shuttle() {}

  protected <E extends DrtNode> List<E> visitList(List<E> nodes) {
    final List<E> list = new ArrayList<>();
    for (E node : nodes) {
      //noinspection unchecked
      list.add((E) node.accept(this));
    }
    return list;
  }

  protected Drt.Variable visit(Drt.Variable variable) {
    return variable; // leaf
  }

  protected Drt.Exp visit(Drt.Drs drs) {
    return drs.copy(visitList(drs.refs), visitList(drs.conds));
  }

  protected Drt.Exp visit(Drt.Negation negation) {
    return negation.copy(negation.exp.accept(this));
  }

  protected Drt.Exp visit(Drt.Connective connective) {
    return connective.copy(connective.left.accept(this),
        connective.right.accept(this));
  }

  protected Drt.Exp visit(Drt.Equality equality) {
    return equality.copy(equality.left.accept(this),
        equality.right.accept(this));
  }

  protected Drt.Exp visit(Drt.Atom atom) {
    return atom.copy(atom.predicate.accept(this), visitList(atom.args));
  }
}

// End Shuttle.java
