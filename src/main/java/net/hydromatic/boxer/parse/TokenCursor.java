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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.List;

/**
 * Cursor over a list of tokens, with one token of lookahead.
 *
 * <p>Each parse has its own cursor, so parsers hold no state between
 * calls.
 */
public class TokenCursor {
  private final List<Token> tokens;
  private int i = 0;

  TokenCursor(List<Token> tokens) {
    checkArgument(!tokens.isEmpty()
            && tokens.get(tokens.size() - 1).kind == Token.Kind.END,
        "token list must end with END");
    this.tokens = tokens;
  }

  /** Creates a cursor over the tokens of a piece of text. */
  public static TokenCursor of(String text) {
    return new TokenCursor(BoxerTokenizer.tokenize(text));
  }

  /** Returns the next token without consuming it. */
  public Token peek() {
    return tokens.get(i);
  }

  /** Returns whether the next token is a given punctuation character. */
  public boolean peekIs(char punctuation) {
    return peek().is(punctuation);
  }

  /** Consumes and returns the next token. Never moves past the end token. */
  public Token next() {
    final Token token = tokens.get(i);
    if (token.kind != Token.Kind.END) {
      ++i;
    }
    return token;
  }

  /** Consumes the next token, which must be a given punctuation character. */
  public Token expect(char punctuation) {
    final Token token = next();
    if (!token.is(punctuation)) {
      throw new UnexpectedTokenException(String.valueOf(punctuation),
          token.toString(), token.pos);
    }
    return token;
  }

  /** Consumes the next token, which must be a word or quoted atom, and
   * returns its text. */
  public String atom() {
    final Token token = next();
    if (token.kind != Token.Kind.WORD && token.kind != Token.Kind.QUOTED) {
      throw new UnexpectedTokenException("<atom>", token.toString(),
          token.pos);
    }
    return token.text;
  }

  /** Consumes the next token if it is a comma. */
  public boolean skipComma() {
    if (peekIs(',')) {
      next();
      return true;
    }
    return false;
  }

  /** Throws unless all tokens have been consumed. */
  public void expectEnd() {
    final Token token = peek();
    if (token.kind != Token.Kind.END) {
      throw new UnexpectedTokenException("<EOF>", token.toString(),
          token.pos);
    }
  }
}

// End TokenCursor.java
