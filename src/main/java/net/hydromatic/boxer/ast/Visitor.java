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

/** Visits DRT expressions. */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends DrtNode> void accept(E e) {
    e.accept(this);
  }

  protected void visit(Drt.Variable variable) {}

  protected void visit(Drt.Drs drs) {
    drs.refs.forEach(this::accept);
    drs.conds.forEach(this::accept);
  }

  protected void visit(Drt.Negation negation) {
    negation.exp.accept(this);
  }

  protected void visit(Drt.Connective connective) {
    connective.left.accept(this);
    connective.right.accept(this);
  }

  protected void visit(Drt.Equality equality) {
    equality.left.accept(this);
    equality.right.accept(this);
  }

  protected void visit(Drt.Atom atom) {
    atom.predicate.accept(this);
    atom.args.forEach(this::accept);
  }
}

// End Visitor.java
