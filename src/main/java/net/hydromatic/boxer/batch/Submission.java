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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CharMatcher;
import java.util.List;

/**
 * Formats discourses as input for the C&amp;C parser that precedes Boxer.
 *
 * <p>Each discourse starts with a line {@code <META>'id'}, followed by one
 * line per sentence. Boxer echoes the identifier in the {@code id} line of
 * its output, where {@link FixedOffsetTermLocator} finds it.
 */
public final class Submission {
  private Submission() {}

  static final String META = "<META>";

  /** Characters that may not occur in a discourse id. The id must survive
   * quoting and the {@code id(<discourse>,<drs>).} line of the output. */
  static final CharMatcher ILLEGAL_ID_CHARS = CharMatcher.anyOf("',()\r\n");

  /**
   * Formats discourses.
   *
   * @param discourses List of discourses, each a list of sentences
   * @param discourseIds Identifier of each discourse
   * @return Input text
   */
  public static String format(List<? extends List<String>> discourses,
      List<String> discourseIds) {
    checkArgument(discourses.size() == discourseIds.size(),
        "%s discourses but %s ids", discourses.size(), discourseIds.size());
    final StringBuilder b = new StringBuilder();
    for (int i = 0; i < discourses.size(); i++) {
      final String discourseId = discourseIds.get(i);
      checkArgument(discourseId != null, "null id for discourse %s", i);
      checkArgument(ILLEGAL_ID_CHARS.matchesNoneOf(discourseId),
          "invalid discourse id %s", discourseId);
      if (b.length() > 0) {
        b.append('\n');
      }
      b.append(META).append('\'').append(discourseId).append('\'');
      for (String sentence : discourses.get(i)) {
        checkArgument(sentence.indexOf('\n') < 0,
            "sentence contains a line break: %s", sentence);
        b.append('\n').append(sentence);
      }
    }
    return b.toString();
  }
}

// End Submission.java
