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

import com.google.common.base.CharMatcher;

/** Utilities for parsing. */
public final class Parsers {
  private Parsers() {}

  /** Prefix that Boxer gives to the variables it generates. */
  static final String INTERNAL_VARIABLE_PREFIX = "_G";

  /** Prefix that replaces {@link #INTERNAL_VARIABLE_PREFIX}. */
  static final String VARIABLE_PREFIX = "z";

  private static final CharMatcher NAME_CHARS =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'))
          .or(CharMatcher.is('_'))
          .precomputed();

  /**
   * Removes every character that is not an ASCII letter, digit or
   * underscore; {@code "ice-cream"} becomes {@code "icecream"}.
   */
  public static String sanitize(String name) {
    return NAME_CHARS.retainFrom(name);
  }

  /** Renames a variable generated by Boxer; {@code "_G123"} becomes
   * {@code "z123"}. Other names are returned unchanged. */
  public static String variableName(String name) {
    if (name.startsWith(INTERNAL_VARIABLE_PREFIX)) {
      return VARIABLE_PREFIX
          + name.substring(INTERNAL_VARIABLE_PREFIX.length());
    }
    return name;
  }

  /**
   * Given an identifier that may be in single quotes, such as
   * {@code 'd1'}, returns the identifier without quotes.
   */
  public static String unquoteIdentifier(String s) {
    checkArgument(!s.isEmpty(), "empty identifier");
    if (s.length() >= 2
        && s.charAt(0) == '\''
        && s.charAt(s.length() - 1) == '\'') {
      return s.substring(1, s.length() - 1);
    }
    return s;
  }
}

// End Parsers.java
