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

import static net.hydromatic.boxer.Matchers.hasConsistentArity;
import static net.hydromatic.boxer.Matchers.isDrt;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import net.hydromatic.boxer.ast.Drt;
import net.hydromatic.boxer.ast.Op;
import org.junit.jupiter.api.Test;

/** Tests for {@link BoxerParser}. */
class BoxerParserTest {
  private static final String DOG =
      "drs([[1001]:x0],[[1002]:pred(x0,dog,n,0)])";

  private static Drt.Exp parse(String s) {
    return new BoxerParser(false, null).parse(s);
  }

  @Test void testPred() {
    final Drt.Exp e = parse(DOG);
    assertThat(e, instanceOf(Drt.Drs.class));
    final Drt.Drs drs = (Drt.Drs) e;
    assertThat(drs.refs, hasSize(1));
    assertThat(drs.refs.get(0).name, is("x0"));
    assertThat(drs.conds, hasSize(1));
    final Drt.Atom atom = (Drt.Atom) drs.conds.get(0);
    assertThat(atom.predicate.name, is("n_dog_1"));
    assertThat(atom.args, hasSize(1));
    assertThat(atom.args.get(0).name, is("x0"));
    assertThat(e, isDrt("([x0],[n_dog_1(x0)])"));
  }

  @Test void testOccurrenceIndex() {
    assertThat(new BoxerParser(true, null).parse(DOG),
        isDrt("([x0],[n_dog_s0_w1_1(x0)])"));
    assertThat(new BoxerParser(false, "d1").parse(DOG),
        isDrt("([x0],[n_dog_d1_1(x0)])"));
    assertThat(new BoxerParser(true, "d1").parse(DOG),
        isDrt("([x0],[n_dog_d1_s0_w1_1(x0)])"));
  }

  /** A predicate with no position is a relation, and is the same in every
   * discourse. */
  @Test void testPredWithoutIndex() {
    final String s = "drs([],[[]:pred(x0,event,n,0)])";
    assertThat(new BoxerParser(true, "d1").parse(s),
        isDrt("([],[r_event_1(x0)])"));
  }

  @Test void testNamedRelCard() {
    final String s = "drs([[1001]:x0,[1003]:x1,[]:e2],"
        + "[[1001]:named(x0,'John',per,0),"
        + "[1002]:rel(e2,x0,agent,0),"
        + "[1003]:card(x1,28,ge),"
        + "[]:eq(x0,x1)])";
    assertThat(new BoxerParser(true, "d1").parse(s),
        isDrt("([x0,x1,e2],[n_John_1(x0), r_agent_2(e2,x0), "
            + "r_card_3(x1,28,ge), (x0 = x1)])"));
  }

  @Test void testSanitizedNames() {
    final String s = "drs([],[[1001]:pred(x0,'ice-cream',n,0),"
        + "[1002]:rel(x0,x1,'of.',0)])";
    assertThat(parse(s), isDrt("([],[n_icecream_1(x0), r_of_2(x0,x1)])"));
  }

  @Test void testInternalVariables() {
    final String s = "drs([[1001]:_G123],[[1001]:pred(_G123,cat,n,0),"
        + "[]:eq(_G123,_G7)])";
    assertThat(parse(s),
        isDrt("([z123],[n_cat_1(z123), (z123 = z7)])"));
  }

  @Test void testCompoundNounRelation() {
    assertThat(parse("drs([],[[0]:rel(x0,x1,nn,0)])"),
        isDrt("([],[r_nn_2(x0,x1)])"));
  }

  /** A relation whose name is already the name of a binary relation keeps
   * that name. */
  @Test void testRelationAlreadyNamed() {
    assertThat(parse("drs([],[[0]:rel(x0,x1,r_nn_2,0)])"),
        isDrt("([],[r_nn_2(x0,x1)])"));
    assertThat(parse("drs([],[[]:rel(x0,x1,'r_of_2',0),"
            + "[]:rel(x0,x1,r_of_3,0),[]:rel(x0,x1,r,0)])"),
        isDrt("([],[r_of_2(x0,x1), r_r_of_3_2(x0,x1), r_r_2(x0,x1)])"));
  }

  /** The empty atom {@code ''} is a valid name, but not a valid variable. */
  @Test void testEmptyAtom() {
    assertThat(parse("drs([[1001]:x0],[[1001]:named(x0,'',per,0),"
            + "[1002]:pred(x0,'',n,0)])"),
        isDrt("([x0],[n__1(x0), n__1(x0)])"));

    final UnexpectedTokenException e =
        assertThrows(UnexpectedTokenException.class,
            () -> parse("drs([],[[]:eq(x0,'')])"));
    assertThat(e.expected, is("<variable>"));
    assertThat(e.actual, is("''"));
    assertThat(e.pos(), hasToString("1.18-1.20"));

    final UnexpectedTokenException e2 =
        assertThrows(UnexpectedTokenException.class,
            () -> parse("timex(x0,time([]:'',[]:'XX',[]:'XX'))"));
    assertThat(e2.expected, is("<value>"));
  }

  @Test void testConnectives() {
    final String s = "drs([],[[]:not(drs([],[[1002]:pred(x0,dog,n,0)])),"
        + "[]:or(drs([],[]),drs([[1004]:x1],[])),"
        + "[]:imp(drs([[1001]:x0],[]),drs([],[[1003]:pred(x0,bark,v,0)]))])";
    assertThat(parse(s),
        isDrt("([],[-([],[n_dog_1(x0)]), (([],[]) | ([x1],[])), "
            + "(([x0],[]) -> ([],[v_bark_1(x0)]))])"));
  }

  @Test void testMerge() {
    final Drt.Exp e =
        parse("merge(drs([[1001]:x0],[]),smerge(drs([],[]),drs([],[])))");
    assertThat(e.op, is(Op.CONCATENATION));
    assertThat(((Drt.Connective) e).right.op, is(Op.CONCATENATION));
    assertThat(e, isDrt("(([x0],[]) + (([],[]) + ([],[])))"));
  }

  @Test void testProp() {
    final String s = "drs([[1001]:x0],[[]:prop(x1,"
        + "drs([],[[1003]:pred(x0,sleep,v,0)]))])";
    assertThat(parse(s), isDrt("([x0],[([],[v_sleep_1(x0)])])"));
  }

  @Test void testDate() {
    final Drt.Drs drs = (Drt.Drs)
        parse("drs([[1001]:x0],[[1004]:timex(x0,"
            + "date([]: +, []:'XXXX', [1004]:'04', []:'XX'))])");
    assertThat(drs.conds, hasSize(3));
    assertThat(drs,
        isDrt("([x0],[r_date_1(x0), r_pol_2(x0,pos), r_month_2(x0,04)])"));

    assertThat(
        parse("drs([],[[]:timex(x0,date([]:-,[1003]:'2010',[]:'XX',"
            + "[1005]:'31'))])"),
        isDrt("([],[r_date_1(x0), r_pol_2(x0,neg), r_year_2(x0,2010), "
            + "r_day_2(x0,31)])"));

    // Polarity other than '+' or '-' is unknown.
    assertThat(
        parse("drs([],[[]:timex(x0,date([]:'XX',[]:'XXXX',[]:'XX',"
            + "[]:'XX'))])"),
        isDrt("([],[r_date_1(x0)])"));
  }

  @Test void testTime() {
    assertThat(
        parse("drs([],[[]:timex(x0,time([1018]:'18', []:'XX', []:'30'))])"),
        isDrt("([],[r_time_1(x0), r_hour_2(x0,18), r_sec_2(x0,30)])"));
  }

  @Test void testTimexAsTerm() {
    assertThat(parse("timex(x0,time([]:'XX',[]:'15',[]:'XX'))"),
        isDrt("([],[r_time_1(x0), r_min_2(x0,15)])"));
    assertThat(parse("pred(x0,dog,n,0)"), isDrt("r_dog_1(x0)"));
  }

  @Test void testWhq() {
    final String s = "whq([num:cou],drs([[1001]:x0],[[1002]:pred(x0,dog,n,0)]),"
        + "x0,drs([],[[1003]:pred(x0,bark,v,0)]))";
    assertThat(parse(s),
        isDrt("(([],[n_number_1(x0), n_count_1(x0)]) + "
            + "(([x0],[n_dog_1(x0)]) + ([],[v_bark_1(x0)])))"));

    final String s2 = "whq([des:person, loc:city, num:kg],drs([],[]),"
        + "_G1,drs([],[]))";
    assertThat(parse(s2),
        isDrt("(([],[n_person_1(z1), n_city_1(z1), n_number_1(z1), "
            + "n_kg_1(z1)]) + (([],[]) + ([],[])))"));
  }

  @Test void testOrderPreserved() {
    final String s = "drs([[1003]:x2,[1001]:x0,[1002]:x1],"
        + "[[1003]:pred(x2,c,n,0),[1001]:pred(x0,a,n,0),"
        + "[1002]:rel(x1,x0,b,0)])";
    final Drt.Drs drs = (Drt.Drs) parse(s);
    assertThat(drs.refs, hasToString("[x2, x0, x1]"));
    assertThat(drs.conds,
        hasToString("[n_c_1(x2), n_a_1(x0), r_b_2(x1,x0)]"));
  }

  @Test void testArityMatchesName() {
    final String s = "drs([[1001]:x0,[]:e1],[[1001]:named(x0,john,per,0),"
        + "[1002]:pred(e1,walk,v,0),[]:rel(e1,x0,agent,0),"
        + "[]:card(x0,1,eq),"
        + "[]:timex(e1,date([]:+,[]:'2001',[]:'02',[]:'03')),"
        + "[]:not(drs([],[[]:whq([des:thing],drs([],[]),x0,drs([],[])))]))])";
    assertThat(new BoxerParser(true, "7").parse(s), hasConsistentArity());
  }

  @Test void testParseTermLeavesRemainder() {
    final TokenCursor c = TokenCursor.of(DOG + ", rest");
    final Drt.Exp e = new BoxerParser(false, null).parseTerm(c);
    assertThat(e, isDrt("([x0],[n_dog_1(x0)])"));
    assertThat(c.peek().text, is(","));
  }

  @Test void testUnknownCondition() {
    final UnexpectedConditionException e =
        assertThrows(UnexpectedConditionException.class,
            () -> parse("drs([],[[1001]:foo(x0)])"));
    assertThat(e.token, is("foo"));
    assertThat(e.getMessage(), is("unexpected condition 'foo'"));
    assertThat(e.pos(), hasToString("1.16-1.19"));
  }

  @Test void testUnknownTimeFunctor() {
    final UnexpectedConditionException e =
        assertThrows(UnexpectedConditionException.class,
            () -> parse("drs([],[[]:timex(x0,week([]:'12'))])"));
    assertThat(e.token, is("week"));
  }

  @Test void testUnexpectedToken() {
    final UnexpectedTokenException e =
        assertThrows(UnexpectedTokenException.class,
            () -> parse("drs([] [])"));
    assertThat(e.expected, is(","));
    assertThat(e.actual, is("["));
    assertThat(e.pos(), hasToString("1.8"));
    assertThat(e.describeTo(new StringBuilder()),
        hasToString("1.8: expected ',' but found '['"));
  }

  @Test void testTrailingTokens() {
    final UnexpectedTokenException e =
        assertThrows(UnexpectedTokenException.class,
            () -> parse("drs([],[]))"));
    assertThat(e.expected, is("<EOF>"));
    assertThat(e.actual, is(")"));
  }

  @Test void testTruncated() {
    final UnexpectedTokenException e =
        assertThrows(UnexpectedTokenException.class,
            () -> parse("drs([],[[1002]:pred(x0,dog"));
    assertThat(e.expected, is(","));
    assertThat(e.actual, is("<EOF>"));
  }

  @Test void testBadIndex() {
    final UnexpectedTokenException e =
        assertThrows(UnexpectedTokenException.class,
            () -> parse("drs([],[[abc]:pred(x0,dog,n,0)])"));
    assertThat(e.expected, is("<integer>"));
    assertThat(e.actual, is("abc"));
  }

  @Test void testMissingTerm() {
    final UnexpectedTokenException e =
        assertThrows(UnexpectedTokenException.class,
            () -> parse("not((drs([],[])))"));
    assertThat(e.expected, is("<term>"));
    assertThat(e.actual, is("("));
  }
}

// End BoxerParserTest.java
