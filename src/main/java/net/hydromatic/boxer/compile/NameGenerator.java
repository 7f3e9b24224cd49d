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
package net.hydromatic.boxer.compile;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CharMatcher;
import java.util.HashSet;
import java.util.Set;

/**
 * Generates unique variable names.
 *
 * <p>A fresh name keeps the alphabetic prefix of the name it replaces, so
 * the replacement for {@code x1} is {@code x2} or another unused "x" name.
 */
class NameGenerator {
  private static final CharMatcher DIGIT = CharMatcher.inRange('0', '9');

  private final Set<String> used;

  /** Creates a NameGenerator that avoids a given set of names. */
  NameGenerator(Set<String> used) {
    this.used = new HashSet<>(used);
  }

  /** Generates a name that is unique in this program, and marks it used. */
  String fresh(String name) {
    checkArgument(!name.isEmpty());
    String prefix = DIGIT.trimTrailingFrom(name);
    if (prefix.isEmpty()) {
      prefix = "z";
    }
    for (int i = 0;; i++) {
      final String candidate = prefix + i;
      if (used.add(candidate)) {
        return candidate;
      }
    }
  }
}

// End NameGenerator.java
