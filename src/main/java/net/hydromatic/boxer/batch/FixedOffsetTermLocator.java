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
import static net.hydromatic.boxer.parse.Parsers.unquoteIdentifier;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import net.hydromatic.boxer.config.Prop;

/**
 * Locates terms by their distance from the {@code id} line of each
 * discourse.
 *
 * <p>Boxer writes each discourse as a block of lines like this:
 *
 * <pre>
 * id('d1',1).
 * ...
 * ...
 * ...
 * sem(1,[...],
 * ...
 * ...
 * ...
 * drs([[1001]:x0],[[1002]:pred(x0,dog,n,0)])).
 * </pre>
 *
 * <p>By default the {@code sem} header is 4 lines after the {@code id}
 * line, and the term is 8 lines after. Both lines are checked, so that a
 * change in layout causes an error rather than a wrong result.
 */
public class FixedOffsetTermLocator implements TermLocator {
  private static final String ID_PREFIX = "id(";
  private static final String TERM_SUFFIX = ").";
  private static final Splitter LINE_SPLITTER = Splitter.onPattern("\r?\n");

  private final int semLineOffset;
  private final int termLineOffset;

  public FixedOffsetTermLocator(int semLineOffset, int termLineOffset) {
    checkArgument(semLineOffset > 0, "semLineOffset must be positive");
    checkArgument(termLineOffset > semLineOffset,
        "termLineOffset must be greater than semLineOffset");
    this.semLineOffset = semLineOffset;
    this.termLineOffset = termLineOffset;
  }

  /** Creates a locator with the offsets in a map of properties. */
  public static FixedOffsetTermLocator of(Map<Prop, Object> map) {
    return new FixedOffsetTermLocator(Prop.SEM_LINE_OFFSET.intValue(map),
        Prop.TERM_LINE_OFFSET.intValue(map));
  }

  @Override public List<TermBlock> locate(String output) {
    final List<String> lines = LINE_SPLITTER.splitToList(output);
    final ImmutableList.Builder<TermBlock> blocks = ImmutableList.builder();
    for (int i = 0; i < lines.size(); i++) {
      final String line = lines.get(i);
      if (!line.startsWith(ID_PREFIX)) {
        continue;
      }
      final int comma = line.indexOf(',');
      final int close = line.indexOf(')', comma + 1);
      if (comma < 0
          || close < 0
          || line.substring(ID_PREFIX.length(), comma).trim().isEmpty()) {
        throw new MalformedBatchLayoutException(i + 1,
            "'id(<discourse>,<drs>)'", line);
      }
      final String discourseId =
          unquoteIdentifier(line.substring(ID_PREFIX.length(), comma).trim());
      final String drsId = line.substring(comma + 1, close).trim();

      final String semPrefix = "sem(" + drsId + ",";
      final String semLine = line(lines, i + semLineOffset, semPrefix);
      if (!semLine.startsWith(semPrefix)) {
        throw new MalformedBatchLayoutException(i + semLineOffset + 1,
            "line starting '" + semPrefix + "'", semLine);
      }

      final String termLine = CharMatcher.whitespace()
          .trimTrailingFrom(line(lines, i + termLineOffset, TERM_SUFFIX));
      if (!termLine.endsWith(TERM_SUFFIX)) {
        throw new MalformedBatchLayoutException(i + termLineOffset + 1,
            "line ending '" + TERM_SUFFIX + "'", termLine);
      }
      final String term =
          termLine.substring(0, termLine.length() - TERM_SUFFIX.length())
              .trim();
      blocks.add(
          new TermBlock(discourseId, drsId, term, i + termLineOffset + 1));
      i += termLineOffset;
    }
    return blocks.build();
  }

  /** Returns a line, or throws if the output ends before it. */
  private static String line(List<String> lines, int i, String expected) {
    if (i >= lines.size()) {
      throw new MalformedBatchLayoutException(i + 1,
          "'" + expected + "'", "<end of output>");
    }
    return lines.get(i);
  }
}

// End FixedOffsetTermLocator.java
