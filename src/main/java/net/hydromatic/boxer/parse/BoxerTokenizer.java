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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.boxer.ast.Pos;

/**
 * Splits the text of a Boxer term into tokens.
 *
 * <p>Tokens are punctuation ({@code ( ) [ ] , :}), words, and atoms in
 * single quotes. Inside quotes, a backslash makes the next character
 * literal; the backslash itself is dropped. Whitespace separates tokens.
 *
 * <p>A quote that follows word characters without intervening whitespace
 * continues the same token, so {@code ab'c d'} is the single token
 * {@code abc d}. The empty atom {@code ''} is a token with empty text.
 *
 * <p>Positions are computed as the text is scanned, in a single pass.
 */
public class BoxerTokenizer {
  static final String PUNCTUATION = "()[],:";
  private static final char QUOTE = '\'';
  private static final char ESCAPE = '\\';

  private final String text;
  private int i = 0;
  /** 1-based line of offset {@link #i}. */
  private int line = 1;
  /** Offset of the first character of {@link #line}. */
  private int lineStart = 0;

  private BoxerTokenizer(String text) {
    this.text = text;
  }

  /** Splits text into tokens. The last token is always of kind
   * {@link Token.Kind#END}. */
  public static List<Token> tokenize(String text) {
    return new BoxerTokenizer(text).tokenize();
  }

  private List<Token> tokenize() {
    final ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    for (;;) {
      skipWhitespace();
      if (i >= text.length()) {
        tokens.add(new Token(Token.Kind.END, "", pos(line, i)));
        return tokens.build();
      }
      final int startLine = line;
      final int start = i;
      final char c = text.charAt(i);
      if (PUNCTUATION.indexOf(c) >= 0) {
        advance();
        tokens.add(
            new Token(Token.Kind.PUNCTUATION, String.valueOf(c),
                pos(startLine, start)));
      } else {
        tokens.add(word(startLine, start));
      }
    }
  }

  /** Moves past the current character, keeping track of lines. */
  private void advance() {
    if (text.charAt(i++) == '\n') {
      ++line;
      lineStart = i;
    }
  }

  /** Returns the position from a start offset to the current offset. */
  private Pos pos(int startLine, int start) {
    final int startColumn = startLine == line
        ? start - lineStart + 1
        : start - text.lastIndexOf('\n', start - 1);
    return new Pos(startLine, startColumn, line, i - lineStart + 1);
  }

  private void skipWhitespace() {
    while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
      advance();
    }
  }

  /** Reads a word or a quoted atom, starting at the current position. */
  private Token word(int startLine, int start) {
    final StringBuilder b = new StringBuilder();
    boolean quoted = false;
    while (i < text.length()) {
      final char c = text.charAt(i);
      if (Character.isWhitespace(c) || PUNCTUATION.indexOf(c) >= 0) {
        break;
      }
      if (c == QUOTE) {
        quoted(b);
        quoted = true;
        continue;
      }
      checkLegal(c);
      b.append(c);
      advance();
    }
    return new Token(quoted ? Token.Kind.QUOTED : Token.Kind.WORD,
        b.toString(), pos(startLine, start));
  }

  /** Reads a quoted section, appending its content (without quotes) to a
   * builder. On entry, the current character is the opening quote. The
   * section may be empty, as in {@code ''}. */
  private void quoted(StringBuilder b) {
    final int startLine = line;
    final int start = i;
    advance(); // skip opening quote
    for (;;) {
      if (i >= text.length()) {
        throw new TokenizationException(
            "end of input reached; expected closing quote",
            pos(startLine, start));
      }
      final char c = text.charAt(i);
      if (c == QUOTE) {
        advance();
        return;
      }
      if (c == ESCAPE) {
        advance();
        if (i >= text.length()) {
          throw new TokenizationException(
              "end of input reached after escape character",
              pos(startLine, start));
        }
      }
      final char c2 = text.charAt(i);
      checkLegal(c2);
      b.append(c2);
      advance();
    }
  }

  private void checkLegal(char c) {
    if (Character.isISOControl(c) && !Character.isWhitespace(c)) {
      final int column = i - lineStart + 1;
      throw new TokenizationException(
          String.format("illegal character U+%04X", (int) c),
          new Pos(line, column, line, column + 1));
    }
  }
}

// End BoxerTokenizer.java
