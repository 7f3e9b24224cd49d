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
package net.hydromatic.boxer.config;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.io.StringReader;
import java.util.EnumMap;
import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.Test;

/** Tests for {@link Prop}. */
class PropTest {
  @Test void testDefaults() {
    final Map<Prop, Object> map = new EnumMap<>(Prop.class);
    assertThat(Prop.OCCURRENCE_INDEX.booleanValue(map), is(false));
    assertThat(Prop.SEM_LINE_OFFSET.intValue(map), is(4));
    assertThat(Prop.TERM_LINE_OFFSET.intValue(map), is(8));
    assertThat(Prop.PARALLEL.booleanValue(map), is(false));
  }

  @Test void testLookup() {
    assertThat(Prop.lookup("termLineOffset"), is(Prop.TERM_LINE_OFFSET));
    assertThat(Prop.lookup("TERM_LINE_OFFSET"), is(Prop.TERM_LINE_OFFSET));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.lookup("lineOffset"));
    assertThat(Prop.BY_CAMEL_NAME,
        hasToString("[OCCURRENCE_INDEX, PARALLEL, SEM_LINE_OFFSET, "
            + "TERM_LINE_OFFSET]"));
  }

  @Test void testSet() {
    final Map<Prop, Object> map = new EnumMap<>(Prop.class);
    Prop.PARALLEL.set(map, true);
    assertThat(Prop.PARALLEL.booleanValue(map), is(true));
    Prop.SEM_LINE_OFFSET.setLenient(map, " 3 ");
    assertThat(Prop.SEM_LINE_OFFSET.intValue(map), is(3));
    Prop.OCCURRENCE_INDEX.setLenient(map, "TRUE");
    assertThat(Prop.OCCURRENCE_INDEX.booleanValue(map), is(true));

    assertThrows(IllegalArgumentException.class,
        () -> Prop.SEM_LINE_OFFSET.set(map, "3"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.SEM_LINE_OFFSET.setLenient(map, "three"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.PARALLEL.setLenient(map, "yes"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.PARALLEL.set(map, null));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.PARALLEL.intValue(map));

    assertThat(Prop.PARALLEL.booleanValue(map), is(true));
  }

  @Test void testLoad() throws IOException {
    final Properties properties = new Properties();
    properties.load(
        new StringReader("occurrenceIndex=true\nTERM_LINE_OFFSET=9\n"));
    final Map<Prop, Object> map = Prop.load(properties);
    assertThat(map.size(), is(2));
    assertThat(Prop.OCCURRENCE_INDEX.booleanValue(map), is(true));
    assertThat(Prop.TERM_LINE_OFFSET.intValue(map), is(9));
    assertThat(Prop.SEM_LINE_OFFSET.intValue(map), is(4));

    final Properties bad = new Properties();
    bad.setProperty("verbose", "true");
    assertThrows(IllegalArgumentException.class, () -> Prop.load(bad));
  }
}

// End PropTest.java
