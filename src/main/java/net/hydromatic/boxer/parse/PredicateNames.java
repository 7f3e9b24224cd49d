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

import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Builds the names of predicates.
 *
 * <p>A name has the form
 *
 * <blockquote>{@code <pos>_<lemma>_[<discourse>_][s<sentence>_w<word>_]<arity>}
 * </blockquote>
 *
 * <p>For example, the verb "see" occurring as word 3 of sentence 2 of
 * discourse "t", with occurrence indexing enabled, is {@code v_see_t_s2_w3_2}.
 * Without occurrence indexing it is {@code v_see_t_2}.
 *
 * <p>A word with no position in the text is not lexical, and its part of
 * speech becomes {@code r} (relation). Its name has neither discourse nor
 * position, so the same relation has the same name in every discourse.
 */
public final class PredicateNames {
  private PredicateNames() {}

  /** Part of speech of relations and of predicates with no position. */
  public static final String RELATION = "r";

  /** Part of speech of named entities. */
  public static final String NAME = "n";

  /** Predicate of the compound-noun relation. */
  public static final String COMPOUND_NOUN = "r_nn_2";

  /** Predicate of cardinality conditions. */
  public static final String CARDINALITY = "r_card_3";

  /**
   * Builds a predicate name.
   *
   * @param pos Part of speech, e.g. "n" or "v"
   * @param lemma Lemma; characters other than letters, digits and
   *     underscore are removed
   * @param indices Positions of the word; only the first is used
   * @param arity Number of arguments; must be positive
   * @param discourseId Discourse identifier, or null
   * @param occurrenceIndex Whether to include the word's position
   * @return Predicate name
   * @throws InvalidArityException if arity is not positive
   */
  public static String build(String pos, String lemma,
      List<Occurrence> indices, int arity, @Nullable String discourseId,
      boolean occurrenceIndex) {
    if (arity <= 0) {
      throw new InvalidArityException(arity);
    }
    final StringBuilder b = new StringBuilder();
    b.append(indices.isEmpty() ? RELATION : pos)
        .append('_')
        .append(Parsers.sanitize(lemma))
        .append('_');
    if (discourseId != null
        && !discourseId.isEmpty()
        && !indices.isEmpty()) {
      b.append(discourseId).append('_');
    }
    if (occurrenceIndex && !indices.isEmpty()) {
      final Occurrence occurrence = indices.get(0);
      b.append('s').append(occurrence.sentence)
          .append("_w").append(occurrence.word)
          .append('_');
    }
    return b.append(arity).toString();
  }

  /**
   * Builds the name of a relation, such as {@code r_agent_2} from
   * {@code agent}.
   *
   * <p>A name that is already a relation name of the same arity, such as
   * {@code r_nn_2}, is returned unchanged (after sanitizing), so the
   * relations {@code nn} and {@code r_nn_2} have the same name.
   */
  public static String relation(String name, int arity) {
    final String sanitized = Parsers.sanitize(name);
    final String prefix = RELATION + '_';
    final String suffix = "_" + arity;
    if (arity > 0
        && sanitized.length() > prefix.length() + suffix.length()
        && sanitized.startsWith(prefix)
        && sanitized.endsWith(suffix)) {
      return sanitized;
    }
    return fixed(RELATION, sanitized, arity);
  }

  /** Builds the name of a relation with a fixed part of speech, such as
   * {@code r_agent_2} or {@code n_john_1}. */
  public static String fixed(String pos, String name, int arity) {
    if (arity <= 0) {
      throw new InvalidArityException(arity);
    }
    return pos + '_' + Parsers.sanitize(name) + '_' + arity;
  }
}

// End PredicateNames.java
