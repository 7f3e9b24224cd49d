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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link PredicateNames}, {@link Parsers} and
 * {@link Occurrence}. */
class PredicateNamesTest {
  private static List<Occurrence> at(int... indexes) {
    final ImmutableList.Builder<Occurrence> list = ImmutableList.builder();
    for (int index : indexes) {
      list.add(Occurrence.decode(index));
    }
    return list.build();
  }

  @Test void testBuild() {
    assertThat(PredicateNames.build("n", "dog", at(1002), 1, null, false),
        is("n_dog_1"));
    assertThat(PredicateNames.build("n", "dog", at(1002), 1, null, true),
        is("n_dog_s0_w1_1"));
    assertThat(PredicateNames.build("v", "see", at(3004), 2, "t", true),
        is("v_see_t_s2_w3_2"));
    assertThat(PredicateNames.build("v", "see", at(3004), 2, "t", false),
        is("v_see_t_2"));

    // only the first index counts
    assertThat(
        PredicateNames.build("n", "ice cream", at(1005, 1006), 1, "", true),
        is("n_icecream_s0_w4_1"));
  }

  /** Without a position, a word becomes a relation, and has neither
   * discourse nor position in its name. */
  @Test void testBuildWithoutIndex() {
    assertThat(PredicateNames.build("n", "thing", at(), 1, "d1", true),
        is("r_thing_1"));
  }

  @Test void testFixed() {
    assertThat(PredicateNames.fixed(PredicateNames.RELATION, "agent", 2),
        is("r_agent_2"));
    assertThat(PredicateNames.fixed(PredicateNames.NAME, "New-York", 1),
        is("n_NewYork_1"));
  }

  @Test void testRelation() {
    assertThat(PredicateNames.relation("agent", 2), is("r_agent_2"));
    assertThat(PredicateNames.relation("nn", 2), is("r_nn_2"));
    assertThat(PredicateNames.relation("r_nn_2", 2), is("r_nn_2"));
    assertThat(PredicateNames.relation("r-nn_2", 2), is("r_rnn_2_2"));
    assertThat(PredicateNames.relation("r_nn_2", 1), is("r_r_nn_2_1"));
    assertThat(PredicateNames.relation("r__2", 2), is("r_r__2_2"));
    assertThrows(InvalidArityException.class,
        () -> PredicateNames.relation("r_nn_0", 0));
  }

  @Test void testInvalidArity() {
    final InvalidArityException e =
        assertThrows(InvalidArityException.class,
            () -> PredicateNames.build("n", "dog", at(1001), 0, null, false));
    assertThat(e.arity, is(0));
    assertThrows(InvalidArityException.class,
        () -> PredicateNames.fixed("r", "of", -1));
  }

  @Test void testSanitize() {
    assertThat(Parsers.sanitize("ice-cream"), is("icecream"));
    assertThat(Parsers.sanitize("of."), is("of"));
    assertThat(Parsers.sanitize("café_au_lait"), is("caf_au_lait"));
    assertThat(Parsers.sanitize("--"), is(""));
    for (String s
        : new String[] {"ice-cream", "a b\tc", "x_1", "été"}) {
      final String once = Parsers.sanitize(s);
      assertThat(Parsers.sanitize(once), is(once));
    }
  }

  @Test void testVariableName() {
    assertThat(Parsers.variableName("_G123"), is("z123"));
    assertThat(Parsers.variableName("x0"), is("x0"));
    assertThat(Parsers.variableName("G1"), is("G1"));
  }

  @Test void testUnquoteIdentifier() {
    assertThat(Parsers.unquoteIdentifier("'d1'"), is("d1"));
    assertThat(Parsers.unquoteIdentifier("d1"), is("d1"));
    assertThat(Parsers.unquoteIdentifier("'"), is("'"));
  }

  @Test void testOccurrence() {
    assertThat(Occurrence.decode(1004), is(new Occurrence(0, 3)));
    assertThat(Occurrence.decode(2001).toString(), is("(1, 0)"));
    for (int i = 1001; i <= 9999; i++) {
      if (i % 1000 == 0) {
        continue;
      }
      assertThat(Occurrence.decode(i).encode(), is(i));
    }
  }
}

// End PredicateNamesTest.java
