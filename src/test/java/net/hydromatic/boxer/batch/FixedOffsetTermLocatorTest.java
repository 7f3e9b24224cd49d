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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.boxer.config.Prop;
import org.junit.jupiter.api.Test;

/** Tests for {@link FixedOffsetTermLocator}. */
class FixedOffsetTermLocatorTest {
  private static final String DOG =
      "drs([[1001]:x0],[[1002]:pred(x0,dog,n,0)])";

  private static final TermLocator LOCATOR =
      FixedOffsetTermLocator.of(ImmutableMap.of());

  @Test void testLocate() {
    final String output = new BoxerOutput()
        .line(":- multifile sem/3, id/2.")
        .discourse("d1", 1, DOG)
        .discourse("d2", 2, "drs([],[])")
        .toString();
    final List<TermBlock> blocks = LOCATOR.locate(output);
    assertThat(blocks, hasSize(2));
    assertThat(blocks.get(0).discourseId, is("d1"));
    assertThat(blocks.get(0).drsId, is("1"));
    assertThat(blocks.get(0).term, is(DOG));
    assertThat(blocks.get(0).line, is(10));
    assertThat(blocks.get(1),
        hasToString("TermBlock{discourseId=d2, drsId=2, line=19}"));
    assertThat(blocks.get(1).term, is("drs([],[])"));
  }

  @Test void testEmpty() {
    assertThat(LOCATOR.locate(""), hasSize(0));
    assertThat(LOCATOR.locate(":- multifile sem/3.\n"), hasSize(0));
  }

  @Test void testWindowsLineEndings() {
    final String output =
        new BoxerOutput().discourse("d1", 1, DOG).toString()
            .replace("\n", "\r\n");
    final List<TermBlock> blocks = LOCATOR.locate(output);
    assertThat(blocks, hasSize(1));
    assertThat(blocks.get(0).term, is(DOG));
  }

  @Test void testTrailingWhitespace() {
    final List<String> lines =
        new ArrayList<>(new BoxerOutput().discourse("d1", 1, DOG).lines());
    lines.set(8, lines.get(8) + "  \t");
    final List<TermBlock> blocks = LOCATOR.locate(String.join("\n", lines));
    assertThat(blocks.get(0).term, is(DOG));
  }

  @Test void testUnquotedId() {
    final List<String> lines =
        new ArrayList<>(new BoxerOutput().discourse("d1", 1, DOG).lines());
    lines.set(0, "id(7, 1).");
    final List<TermBlock> blocks = LOCATOR.locate(String.join("\n", lines));
    assertThat(blocks.get(0).discourseId, is("7"));
    assertThat(blocks.get(0).drsId, is("1"));
  }

  @Test void testBadIdLine() {
    final List<String> lines =
        new ArrayList<>(new BoxerOutput().discourse("d1", 1, DOG).lines());
    lines.set(0, "id(,1).");
    final MalformedBatchLayoutException e =
        assertThrows(MalformedBatchLayoutException.class,
            () -> LOCATOR.locate(String.join("\n", lines)));
    assertThat(e.line, is(1));
    assertThat(e.actual, is("id(,1)."));
  }

  @Test void testBadSemLine() {
    final List<String> lines =
        new ArrayList<>(new BoxerOutput().discourse("d1", 1, DOG).lines());
    lines.set(4, "sem(2,[],");
    final MalformedBatchLayoutException e =
        assertThrows(MalformedBatchLayoutException.class,
            () -> LOCATOR.locate(String.join("\n", lines)));
    assertThat(e.line, is(5));
    assertThat(e.getMessage(),
        is("line 5: expected line starting 'sem(1,' but found 'sem(2,[],'"));
    assertThat(e.pos(), hasToString("5.1-5.10"));
  }

  @Test void testBadTermLine() {
    final List<String> lines =
        new ArrayList<>(new BoxerOutput().discourse("d1", 1, DOG).lines());
    lines.set(8, "    " + DOG);
    final MalformedBatchLayoutException e =
        assertThrows(MalformedBatchLayoutException.class,
            () -> LOCATOR.locate(String.join("\n", lines)));
    assertThat(e.line, is(9));
    assertThat(e.expected, is("line ending ').'"));
  }

  @Test void testTruncated() {
    final List<String> lines =
        new BoxerOutput().discourse("d1", 1, DOG).lines().subList(0, 6);
    final MalformedBatchLayoutException e =
        assertThrows(MalformedBatchLayoutException.class,
            () -> LOCATOR.locate(String.join("\n", lines)));
    assertThat(e.line, is(9));
    assertThat(e.actual, is("<end of output>"));
  }

  @Test void testOffsets() {
    final Map<Prop, Object> map =
        ImmutableMap.of(Prop.SEM_LINE_OFFSET, 1, Prop.TERM_LINE_OFFSET, 2);
    final String output = "id(a,3).\nsem(3,[],\n  drs([],[])).\n"
        + "id(b,4).\nsem(4,[],\n  " + DOG + ").\n";
    final List<TermBlock> blocks =
        FixedOffsetTermLocator.of(map).locate(output);
    assertThat(blocks, hasSize(2));
    assertThat(blocks.get(0).term, is("drs([],[])"));
    assertThat(blocks.get(1).discourseId, is("b"));
    assertThat(blocks.get(1).line, is(6));

    assertThrows(IllegalArgumentException.class,
        () -> new FixedOffsetTermLocator(4, 4));
  }
}

// End FixedOffsetTermLocatorTest.java
