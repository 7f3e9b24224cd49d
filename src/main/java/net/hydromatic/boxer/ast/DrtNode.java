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

import static java.util.Objects.requireNonNull;

/** Node in a Discourse Representation Theory (DRT) expression tree. */
public abstract class DrtNode {
  public final Op op;

  DrtNode(Op op) {
    this.op = requireNonNull(op);
  }

  /**
   * Converts this node into a string in linear DRT notation.
   *
   * <p>The purpose of this string is debugging and testing. For example,
   * a box with referent {@code x0} and one condition is written
   * {@code ([x0],[n_dog_1(x0)])}.
   */
  @Override
  public final String toString() {
    // Marked final because you should override unparse, not toString
    return unparse(new DrtWriter()).toString();
  }

  abstract DrtWriter unparse(DrtWriter w);

  /**
   * Accepts a shuttle, calling the {@link Shuttle#visit} method appropriate
   * to the type of this node, and returning the result.
   */
  public abstract DrtNode accept(Shuttle shuttle);

  /**
   * Accepts a visitor, calling the {@link Visitor#visit} method appropriate
   * to the type of this node.
   */
  public abstract void accept(Visitor visitor);
}

// End DrtNode.java
