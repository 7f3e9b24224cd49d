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
package net.hydromatic.boxer.batch;

import static java.util.Objects.requireNonNull;

import net.hydromatic.boxer.ast.Pos;
import net.hydromatic.boxer.util.BoxerException;

/** Thrown when the output of Boxer does not have the line layout that a
 * {@link TermLocator} expects. */
public class MalformedBatchLayoutException extends RuntimeException
    implements BoxerException {
  /** 1-based line of the output where the problem was found. */
  public final int line;
  public final String expected;
  public final String actual;

  MalformedBatchLayoutException(int line, String expected, String actual) {
    super("line " + line + ": expected " + expected + " but found '"
        + actual + "'");
    this.line = line;
    this.expected = requireNonNull(expected);
    this.actual = requireNonNull(actual);
  }

  @Override
  public Pos pos() {
    return Pos.ofLine(line, actual);
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return pos().describeTo(buf).append(": ").append(getMessage());
  }
}

// End MalformedBatchLayoutException.java
