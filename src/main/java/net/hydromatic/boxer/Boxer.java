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
package net.hydromatic.boxer;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.boxer.ast.Drt;
import net.hydromatic.boxer.batch.DiscourseDemultiplexer;
import net.hydromatic.boxer.batch.Submission;
import net.hydromatic.boxer.batch.Tracer;
import net.hydromatic.boxer.batch.Tracers;
import net.hydromatic.boxer.config.Prop;
import org.apache.log4j.Logger;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Interprets English text as DRT expressions, using Boxer.
 *
 * <p>For example,
 *
 * <pre>{@code
 * Boxer boxer = new Boxer(client, ImmutableMap.of());
 * Drt.Exp e = boxer.interpret("A dog barks.");
 * }</pre>
 *
 * <p>Each method returns null for a discourse that Boxer could not
 * interpret.
 */
public class Boxer {
  private static final Logger LOGGER = Logger.getLogger(Boxer.class);

  private final BoxerClient client;
  private final DiscourseDemultiplexer demultiplexer;

  /** Creates a Boxer. */
  public Boxer(BoxerClient client, Map<Prop, Object> map, Tracer tracer) {
    this.client = requireNonNull(client);
    this.demultiplexer = DiscourseDemultiplexer.create(map, tracer);
  }

  /** Creates a Boxer that does not trace. */
  public Boxer(BoxerClient client, Map<Prop, Object> map) {
    this(client, map, Tracers.empty());
  }

  /** Creates a Boxer with default properties. */
  public Boxer(BoxerClient client) {
    this(client, ImmutableMap.of());
  }

  /** Interprets a sentence. */
  public Drt.@Nullable Exp interpret(String sentence) {
    return interpretMultiSentence(ImmutableList.of(sentence));
  }

  /** Interprets a sentence as a discourse with the given identifier. */
  public Drt.@Nullable Exp interpret(String sentence, String discourseId) {
    return interpretMultiSentence(ImmutableList.of(sentence), discourseId);
  }

  /** Interprets a list of sentences as one discourse. */
  public Drt.@Nullable Exp interpretMultiSentence(List<String> sentences) {
    return batchInterpretMultiSentence(ImmutableList.of(sentences), null)
        .get(0);
  }

  /** Interprets a list of sentences as one discourse with the given
   * identifier. */
  public Drt.@Nullable Exp interpretMultiSentence(List<String> sentences,
      String discourseId) {
    return batchInterpretMultiSentence(ImmutableList.of(sentences),
        ImmutableList.of(discourseId)).get(0);
  }

  /** Interprets each sentence as a separate discourse. */
  public List<Drt.@Nullable Exp> batchInterpret(List<String> sentences,
      @Nullable List<String> discourseIds) {
    final List<List<String>> discourses = new ArrayList<>();
    for (String sentence : sentences) {
      discourses.add(ImmutableList.of(sentence));
    }
    return batchInterpretMultiSentence(discourses, discourseIds);
  }

  /**
   * Interprets a batch of discourses in one call to Boxer.
   *
   * @param discourses List of discourses, each a list of sentences
   * @param discourseIds Identifier of each discourse, to be inserted into
   *     the names of its occurrence predicates; or null, in which case
   *     discourses are known by their position and names have no identifier
   * @return Expression for each discourse, in the same order, null if the
   *     discourse could not be interpreted
   */
  public List<Drt.@Nullable Exp> batchInterpretMultiSentence(
      List<? extends List<String>> discourses,
      @Nullable List<String> discourseIds) {
    if (discourseIds != null) {
      checkArgument(discourseIds.size() == discourses.size(),
          "%s discourses but %s ids", discourses.size(), discourseIds.size());
    }
    final List<String> ids = discourseIds != null
        ? discourseIds
        : DiscourseDemultiplexer.defaultIds(discourses.size());
    final String input = Submission.format(discourses, ids);
    final String output;
    try {
      output = client.call(input);
    } catch (IOException e) {
      throw new UncheckedIOException("error calling Boxer", e);
    }
    LOGGER.debug("Boxer returned " + output.length() + " characters");
    final Map<String, Drt.@Nullable Exp> results = discourseIds != null
        ? demultiplexer.demultiplex(output, discourseIds)
        : demultiplexer.demultiplex(output, discourses.size());
    final List<Drt.@Nullable Exp> list = new ArrayList<>();
    for (String id : ids) {
      list.add(results.get(id));
    }
    return list;
  }
}

// End Boxer.java
