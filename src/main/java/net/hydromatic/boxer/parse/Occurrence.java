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

import java.util.Objects;

/**
 * Position of a word in the input: a 0-based sentence number and a 0-based
 * word number within that sentence.
 *
 * <p>Boxer encodes an occurrence as the integer
 * {@code 1000 * (sentence + 1) + (word + 1)}; for example, 1004 is the
 * fourth word of the first sentence, {@code (0, 3)}.
 */
public class Occurrence {
  public final int sentence;
  public final int word;

  public Occurrence(int sentence, int word) {
    this.sentence = sentence;
    this.word = word;
  }

  /** Decodes an index such as 1004. */
  public static Occurrence decode(int index) {
    return new Occurrence(Math.floorDiv(index, 1000) - 1,
        Math.floorMod(index, 1000) - 1);
  }

  /** Returns the integer that Boxer uses for this occurrence. */
  public int encode() {
    return 1000 * (sentence + 1) + (word + 1);
  }

  @Override public int hashCode() {
    return Objects.hash(sentence, word);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Occurrence
        && sentence == ((Occurrence) o).sentence
        && word == ((Occurrence) o).word;
  }

  @Override public String toString() {
    return "(" + sentence + ", " + word + ")";
  }
}

// End Occurrence.java
