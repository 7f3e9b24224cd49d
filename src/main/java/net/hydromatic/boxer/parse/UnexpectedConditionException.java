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
package net.hydromatic.boxer.parse;

import static java.util.Objects.requireNonNull;

import net.hydromatic.boxer.ast.Pos;

/** Thrown when a term or condition starts with a keyword that the parser
 * does not know, such as {@code foo(x0)}. */
public class UnexpectedConditionException extends BoxerParseException {
  public final String token;

  UnexpectedConditionException(String token, Pos pos) {
    super("unexpected condition '" + token + "'", pos);
    this.token = requireNonNull(token);
  }
}

// End UnexpectedConditionException.java
