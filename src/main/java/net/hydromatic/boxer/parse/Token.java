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

/** Lexical token of a Boxer term. */
public class Token {
  public final Kind kind;
  /** Text of the token. For a quoted atom, the text between the quotes,
   * with escape characters removed. */
  public final String text;
  public final Pos pos;

  Token(Kind kind, String text, Pos pos) {
    this.kind = requireNonNull(kind);
    this.text = requireNonNull(text);
    this.pos = requireNonNull(pos);
  }

  /** Returns whether this token is the given punctuation character. */
  public boolean is(char punctuation) {
    return kind == Kind.PUNCTUATION && text.charAt(0) == punctuation;
  }

  @Override public String toString() {
    return kind == Kind.END ? "<EOF>" : text;
  }

  /** Kind of token. */
  public enum Kind {
    /** One of {@code ( ) [ ] , :}. */
    PUNCTUATION,
    /** Unquoted word, such as {@code drs}, {@code x0} or {@code 1001}. */
    WORD,
    /** Atom in single quotes, such as {@code 'XXXX'}. */
    QUOTED,
    /** End of input. */
    END
  }
}

// End Token.java
