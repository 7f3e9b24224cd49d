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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import net.hydromatic.boxer.ast.Drt;
import net.hydromatic.boxer.compile.Simplifier;
import net.hydromatic.boxer.config.Prop;
import net.hydromatic.boxer.parse.BoxerParseException;
import net.hydromatic.boxer.parse.BoxerParser;
import org.apache.log4j.Logger;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Splits the output of one Boxer run into its discourses, and parses and
 * simplifies the term of each.
 *
 * <p>The result has one entry for each requested discourse, in the order
 * requested. A discourse whose term is missing from the output, or cannot
 * be parsed, has a null value. A term that cannot be parsed does not
 * prevent the other discourses from being parsed; a problem with the layout
 * of the output does, and throws {@link MalformedBatchLayoutException}.
 */
public class DiscourseDemultiplexer {
  private static final Logger LOGGER =
      Logger.getLogger(DiscourseDemultiplexer.class);

  private final TermLocator locator;
  private final boolean occurrenceIndex;
  private final boolean parallel;
  private final Tracer tracer;

  /** Creates a DiscourseDemultiplexer. */
  public DiscourseDemultiplexer(TermLocator locator, boolean occurrenceIndex,
      boolean parallel, Tracer tracer) {
    this.locator = requireNonNull(locator);
    this.occurrenceIndex = occurrenceIndex;
    this.parallel = parallel;
    this.tracer = requireNonNull(tracer);
  }

  /** Creates a DiscourseDemultiplexer whose settings come from a map of
   * properties. */
  public static DiscourseDemultiplexer create(Map<Prop, Object> map,
      Tracer tracer) {
    return new DiscourseDemultiplexer(FixedOffsetTermLocator.of(map),
        Prop.OCCURRENCE_INDEX.booleanValue(map),
        Prop.PARALLEL.booleanValue(map), tracer);
  }

  /**
   * Parses the discourses with the given identifiers. Each identifier is
   * inserted into the names of its discourse's occurrence predicates.
   *
   * @param output Output of Boxer
   * @param discourseIds Identifiers of the discourses, as submitted
   * @return Map from each identifier to its expression, or null
   */
  public Map<String, Drt.@Nullable Exp> demultiplex(String output,
      List<String> discourseIds) {
    return demultiplex(output, discourseIds, true);
  }

  /**
   * Parses discourses that were submitted without identifiers. Boxer knows
   * them by their position, "0", "1", and so forth; predicate names do not
   * contain a discourse identifier.
   *
   * @param output Output of Boxer
   * @param discourseCount Number of discourses submitted
   * @return Map from each position to its expression, or null
   */
  public Map<String, Drt.@Nullable Exp> demultiplex(String output,
      int discourseCount) {
    return demultiplex(output, defaultIds(discourseCount), false);
  }

  /** Returns the identifiers of discourses that were submitted without
   * identifiers: "0", "1", and so forth. */
  public static List<String> defaultIds(int discourseCount) {
    checkArgument(discourseCount >= 0, "negative count");
    return IntStream.range(0, discourseCount)
        .mapToObj(Integer::toString)
        .collect(ImmutableList.toImmutableList());
  }

  private Map<String, Drt.@Nullable Exp> demultiplex(String output,
      List<String> discourseIds, boolean insertDiscourseId) {
    checkArgument(ImmutableSet.copyOf(discourseIds).size()
        == discourseIds.size(), "duplicate discourse id in %s", discourseIds);

    final Map<String, TermBlock> blocks = new LinkedHashMap<>();
    for (TermBlock block : locator.locate(output)) {
      if (blocks.put(block.discourseId, block) != null) {
        LOGGER.warn("discourse " + block.discourseId
            + " occurs more than once; using the term at line "
            + block.line);
      }
    }
    LOGGER.info("located " + blocks.size() + " terms for "
        + discourseIds.size() + " discourses");

    final Map<String, Drt.Exp> parsed = new ConcurrentHashMap<>();
    final Stream<TermBlock> stream = discourseIds.stream()
        .map(blocks::get)
        .filter(block -> block != null);
    (parallel ? stream.parallel() : stream).forEach(block -> {
      final Drt.@Nullable Exp exp = parse(block, insertDiscourseId);
      if (exp != null) {
        parsed.put(block.discourseId, exp);
      }
    });

    final Map<String, Drt.@Nullable Exp> results = new LinkedHashMap<>();
    for (String discourseId : discourseIds) {
      if (!blocks.containsKey(discourseId)) {
        LOGGER.warn("no term for discourse " + discourseId);
      }
      results.put(discourseId, parsed.get(discourseId));
    }
    return Collections.unmodifiableMap(results);
  }

  /** Parses and simplifies the term of one discourse. Returns null if the
   * term is not valid. */
  private Drt.@Nullable Exp parse(TermBlock block,
      boolean insertDiscourseId) {
    tracer.onBlock(block);
    final BoxerParser parser =
        new BoxerParser(occurrenceIndex,
            insertDiscourseId ? block.discourseId : null);
    try {
      final Drt.Exp exp = Simplifier.simplify(parser.parse(block.term));
      if (LOGGER.isDebugEnabled()) {
        LOGGER.debug("discourse " + block.discourseId + ": " + exp);
      }
      tracer.onResult(block.discourseId, exp);
      return exp;
    } catch (BoxerParseException e) {
      LOGGER.warn("cannot parse term of discourse " + block.discourseId
          + " at line " + block.line + ": "
          + e.describeTo(new StringBuilder()), e);
      tracer.onException(block.discourseId, e);
      return null;
    }
  }
}

// End DiscourseDemultiplexer.java
