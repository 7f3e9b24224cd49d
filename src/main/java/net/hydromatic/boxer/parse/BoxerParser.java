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

import static net.hydromatic.boxer.ast.DrtBuilder.drt;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.boxer.ast.Drt;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Parses the Prolog DRS terms that Boxer writes into DRT expressions.
 *
 * <p>For example,
 *
 * <pre>{@code drs([[1001]:x0],[[1002]:pred(x0,dog,n,0)])}</pre>
 *
 * <p>becomes the box {@code ([x0],[n_dog_1(x0)])}. Predicate names are built
 * by {@link PredicateNames}.
 *
 * <p>The parser holds only its settings; the state of a parse lives in a
 * {@link TokenCursor}. So one parser may be used by several threads.
 */
public class BoxerParser {
  private final boolean occurrenceIndex;
  private final @Nullable String discourseId;

  /**
   * Creates a BoxerParser.
   *
   * @param occurrenceIndex Whether predicate names contain the position of
   *     their word
   * @param discourseId Identifier of the discourse, to be inserted into the
   *     names of predicates that have a position; or null
   */
  public BoxerParser(boolean occurrenceIndex, @Nullable String discourseId) {
    this.occurrenceIndex = occurrenceIndex;
    this.discourseId = discourseId;
  }

  /** Parses the text of a term. The text must contain exactly one term. */
  public Drt.Exp parse(String text) {
    final TokenCursor cursor = TokenCursor.of(text);
    final Drt.Exp exp = parseTerm(cursor);
    cursor.expectEnd();
    return exp;
  }

  /** Parses one term, leaving any following tokens unconsumed. */
  public Drt.Exp parseTerm(TokenCursor c) {
    final List<Occurrence> indices = optionalIndexList(c);
    final Token token = head(c);
    switch (token.text) {
    case "drs":
      return parseDrs(c);
    case "merge":
    case "smerge":
      return binary(c, drt::concat);
    default:
      // A condition where a box was expected. Several conditions, which
      // only "timex" produces, become a box.
      final List<Drt.Exp> conds = condition(token, indices, c);
      return conds.size() == 1
          ? conds.get(0)
          : drt.drs(ImmutableList.of(), conds);
    }
  }

  /** Parses a condition, such as {@code pred(x0,dog,n,0)}. Returns a list
   * because some conditions (such as {@code timex}) expand into several. */
  List<Drt.Exp> parseCondition(TokenCursor c, List<Occurrence> indices) {
    return condition(head(c), indices, c);
  }

  /** Consumes the keyword at the start of a term or condition. */
  private static Token head(TokenCursor c) {
    final Token token = c.next();
    if (token.kind == Token.Kind.PUNCTUATION
        || token.kind == Token.Kind.END) {
      throw new UnexpectedTokenException("<term>", token.toString(),
          token.pos);
    }
    return token;
  }

  private List<Drt.Exp> condition(Token token, List<Occurrence> indices,
      TokenCursor c) {
    switch (token.text) {
    case "not":
      c.expect('(');
      final Drt.Exp e = parseTerm(c);
      c.expect(')');
      return ImmutableList.of(drt.not(e));
    case "or":
      return ImmutableList.of(binary(c, drt::or));
    case "imp":
      return ImmutableList.of(binary(c, drt::imp));
    case "eq":
      return ImmutableList.of(parseEq(c));
    case "prop":
      return ImmutableList.of(parseProp(c));
    case "pred":
      return ImmutableList.of(parsePred(c, indices));
    case "named":
      return ImmutableList.of(parseNamed(c));
    case "rel":
      return ImmutableList.of(parseRel(c));
    case "card":
      return ImmutableList.of(parseCard(c));
    case "timex":
      return parseTimex(c);
    case "whq":
      return ImmutableList.of(parseWhq(c));
    default:
      throw new UnexpectedConditionException(token.toString(), token.pos);
    }
  }

  /** Parses the body of a box,
   * {@code ([[1001]:x0],[[1002]:pred(x0,dog,n,0)])}. */
  private Drt.Drs parseDrs(TokenCursor c) {
    c.expect('(');
    c.expect('[');
    final List<Drt.Variable> refs = new ArrayList<>();
    while (!c.peekIs(']')) {
      optionalIndexList(c);
      refs.add(variable(c));
      c.skipComma();
    }
    c.expect(']');
    c.expect(',');
    c.expect('[');
    final List<Drt.Exp> conds = new ArrayList<>();
    while (!c.peekIs(']')) {
      final List<Occurrence> indices = optionalIndexList(c);
      conds.addAll(parseCondition(c, indices));
      c.skipComma();
    }
    c.expect(']');
    c.expect(')');
    return drt.drs(refs, conds);
  }

  /** Parses {@code (term, term)}. */
  private Drt.Exp binary(TokenCursor c, BinaryFactory factory) {
    c.expect('(');
    final Drt.Exp left = parseTerm(c);
    c.expect(',');
    final Drt.Exp right = parseTerm(c);
    c.expect(')');
    return factory.create(left, right);
  }

  /** Parses {@code (x0, x1)}. */
  private Drt.Exp parseEq(TokenCursor c) {
    c.expect('(');
    final Drt.Variable left = variable(c);
    c.expect(',');
    final Drt.Variable right = variable(c);
    c.expect(')');
    return drt.eq(left, right);
  }

  /** Parses {@code (x0, drs(...))}. The variable is discarded. */
  private Drt.Exp parseProp(TokenCursor c) {
    c.expect('(');
    variable(c);
    c.expect(',');
    final Drt.Exp exp = parseTerm(c);
    c.expect(')');
    return exp;
  }

  /** Parses {@code (x0, dog, n, 0)}. */
  private Drt.Exp parsePred(TokenCursor c, List<Occurrence> indices) {
    c.expect('(');
    final Drt.Variable arg = variable(c);
    c.expect(',');
    final String name = c.atom();
    c.expect(',');
    final String pos = c.atom();
    c.expect(',');
    c.atom(); // sense
    c.expect(')');
    final String predicate =
        PredicateNames.build(pos, name, indices, 1, discourseId,
            occurrenceIndex);
    return drt.atom(drt.variable(predicate), ImmutableList.of(arg));
  }

  /** Parses {@code (x0, john, per, 0)}. */
  private Drt.Exp parseNamed(TokenCursor c) {
    c.expect('(');
    final Drt.Variable arg = variable(c);
    c.expect(',');
    final String name = c.atom();
    c.expect(',');
    c.atom(); // category, such as "per" or "loc"
    c.expect(',');
    c.atom(); // sense
    c.expect(')');
    final String predicate =
        PredicateNames.fixed(PredicateNames.NAME, name, 1);
    return drt.atom(drt.variable(predicate), ImmutableList.of(arg));
  }

  /** Parses {@code (e1, x0, agent, 0)}. */
  private Drt.Exp parseRel(TokenCursor c) {
    c.expect('(');
    final Drt.Variable arg1 = variable(c);
    c.expect(',');
    final Drt.Variable arg2 = variable(c);
    c.expect(',');
    final String name = c.atom();
    c.expect(',');
    c.atom(); // sense
    c.expect(')');
    final String predicate = PredicateNames.relation(name, 2);
    return drt.atom(drt.variable(predicate), ImmutableList.of(arg1, arg2));
  }

  /** Parses {@code (x0, 28, ge)}. */
  private Drt.Exp parseCard(TokenCursor c) {
    c.expect('(');
    final Drt.Variable arg = variable(c);
    c.expect(',');
    final Drt.Variable value = variable(c);
    c.expect(',');
    final Drt.Variable comparator = variable(c);
    c.expect(')');
    return drt.atom(drt.variable(PredicateNames.CARDINALITY),
        ImmutableList.of(arg, value, comparator));
  }

  /** Parses {@code (x0, date([]:+, []:'XXXX', [1004]:'04', []:'XX'))} or
   * {@code (x0, time([1018]:'18', []:'XX', []:'XX'))}. */
  private List<Drt.Exp> parseTimex(TokenCursor c) {
    c.expect('(');
    final Drt.Variable arg = variable(c);
    c.expect(',');
    final Token functor = head(c);
    final ImmutableList.Builder<Drt.Exp> conds = ImmutableList.builder();
    switch (functor.text) {
    case "date":
    case "time":
      conds.add(atom("r_" + functor.text + "_1", arg));
      break;
    default:
      throw new UnexpectedConditionException(functor.toString(),
          functor.pos);
    }
    c.expect('(');
    if (functor.text.equals("date")) {
      parseDate(c, arg, conds);
    } else {
      parseTime(c, arg, conds);
    }
    c.expect(')');
    c.expect(')');
    return conds.build();
  }

  private void parseDate(TokenCursor c, Drt.Variable arg,
      ImmutableList.Builder<Drt.Exp> conds) {
    final String polarity = timeSlot(c);
    if (polarity.equals("+")) {
      conds.add(atom("r_pol_2", arg, "pos"));
    } else if (polarity.equals("-")) {
      conds.add(atom("r_pol_2", arg, "neg"));
    }
    c.expect(',');
    final String year = timeSlot(c);
    if (!year.equals("XXXX")) {
      conds.add(atom("r_year_2", arg, year.replace(':', '_')));
    }
    c.expect(',');
    addUnlessUnknown(conds, "r_month_2", arg, timeSlot(c));
    c.expect(',');
    addUnlessUnknown(conds, "r_day_2", arg, timeSlot(c));
  }

  private void parseTime(TokenCursor c, Drt.Variable arg,
      ImmutableList.Builder<Drt.Exp> conds) {
    addUnlessUnknown(conds, "r_hour_2", arg, timeSlot(c));
    c.expect(',');
    addUnlessUnknown(conds, "r_min_2", arg, timeSlot(c));
    c.expect(',');
    addUnlessUnknown(conds, "r_sec_2", arg, timeSlot(c));
  }

  /** Parses a slot of a date or time, {@code [1004]:'04'}, and returns its
   * value. The index list is discarded. */
  private static String timeSlot(TokenCursor c) {
    optionalIndexList(c);
    return nonEmptyAtom(c, "<value>");
  }

  private void addUnlessUnknown(ImmutableList.Builder<Drt.Exp> conds,
      String predicate, Drt.Variable arg, String value) {
    if (!value.equals("XX")) {
      conds.add(atom(predicate, arg, value));
    }
  }

  /** Parses {@code ([num:cou], drs(...), x0, drs(...))}. */
  private Drt.Exp parseWhq(TokenCursor c) {
    c.expect('(');
    c.expect('[');
    final List<String> answerTypes = new ArrayList<>();
    while (!c.peekIs(']')) {
      final String category = c.atom();
      c.expect(':');
      final String answer = c.atom();
      switch (category) {
      case "num":
        answerTypes.add("number");
        answerTypes.add(answer.equals("cou") ? "count" : answer);
        break;
      default:
        // "des" (description), and any other category
        answerTypes.add(answer);
      }
      c.skipComma();
    }
    c.expect(']');
    c.expect(',');
    final Drt.Exp restriction = parseTerm(c);
    c.expect(',');
    final Drt.Variable ref = variable(c);
    c.expect(',');
    final Drt.Exp body = parseTerm(c);
    c.expect(')');
    final List<Drt.Exp> typeConds = new ArrayList<>();
    for (String answerType : answerTypes) {
      final String predicate =
          PredicateNames.fixed(PredicateNames.NAME, answerType, 1);
      typeConds.add(drt.atom(drt.variable(predicate), ImmutableList.of(ref)));
    }
    return drt.concat(drt.drs(ImmutableList.of(), typeConds),
        drt.concat(restriction, body));
  }

  /** Parses an index list, {@code [1001,1002]:}, if present. */
  static List<Occurrence> optionalIndexList(TokenCursor c) {
    if (!c.peekIs('[')) {
      return ImmutableList.of();
    }
    c.expect('[');
    final ImmutableList.Builder<Occurrence> indices = ImmutableList.builder();
    while (!c.peekIs(']')) {
      final Token token = c.next();
      indices.add(Occurrence.decode(integer(token)));
      c.skipComma();
    }
    c.expect(']');
    c.expect(':');
    return indices.build();
  }

  private static int integer(Token token) {
    final @Nullable Integer i =
        token.kind == Token.Kind.WORD ? Ints.tryParse(token.text) : null;
    if (i != null) {
      return i;
    }
    throw new UnexpectedTokenException("<integer>", token.toString(),
        token.pos);
  }

  /** Consumes a variable, renaming it if Boxer generated it. */
  private static Drt.Variable variable(TokenCursor c) {
    return drt.variable(Parsers.variableName(nonEmptyAtom(c, "<variable>")));
  }

  /** Consumes an atom that must not be the empty atom {@code ''}. */
  private static String nonEmptyAtom(TokenCursor c, String expected) {
    final Token token = c.peek();
    final String atom = c.atom();
    if (atom.isEmpty()) {
      throw new UnexpectedTokenException(expected, "''", token.pos);
    }
    return atom;
  }

  private static Drt.Atom atom(String predicate, Drt.Variable arg,
      String... values) {
    final ImmutableList.Builder<Drt.Variable> args = ImmutableList.builder();
    args.add(arg);
    for (String value : values) {
      args.add(drt.variable(Parsers.variableName(value)));
    }
    return drt.atom(drt.variable(predicate), args.build());
  }

  /** Creates a binary expression. */
  @FunctionalInterface
  private interface BinaryFactory {
    Drt.Exp create(Drt.Exp left, Drt.Exp right);
  }
}

// End BoxerParser.java
