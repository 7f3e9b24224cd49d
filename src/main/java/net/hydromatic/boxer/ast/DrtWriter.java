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

import java.util.List;

/** Prints DRT expressions in linear notation. */
class DrtWriter {
  private final StringBuilder b = new StringBuilder();

  @Override public String toString() {
    return b.toString();
  }

  /** Appends a string. */
  DrtWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends a node. */
  DrtWriter append(DrtNode node) {
    return node.unparse(this);
  }

  /** Appends a list of nodes, separated by a given string. */
  DrtWriter appendAll(List<? extends DrtNode> nodes, String sep) {
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) {
        b.append(sep);
      }
      nodes.get(i).unparse(this);
    }
    return this;
  }

  /** Appends a binary expression, in parentheses. */
  DrtWriter infix(DrtNode left, Op op, DrtNode right) {
    b.append('(');
    left.unparse(this);
    b.append(op.padded);
    right.unparse(this);
    b.append(')');
    return this;
  }
}

// End DrtWriter.java
