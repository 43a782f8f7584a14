/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.termwalk.util.automaton;

import java.util.Arrays;

import org.termwalk.util.BytesRef;
import org.termwalk.util.IntsRef;
import org.termwalk.util.TermwalkTestCase;

public class TestOperations extends TermwalkTestCase {

  private static Automaton minimalDfa(Automaton a) {
    return Operations.removeDeadStates(Operations.determinize(a, Integer.MAX_VALUE));
  }

  private static void assertSameLanguageBruteForce(Automaton expected, Automaton actual) {
    for (int i = 0; i < 30; i++) {
      String s = AutomatonTestUtil.randomString(random(), 6);
      assertEquals(s, AutomatonTestUtil.accepts(expected, s), AutomatonTestUtil.accepts(actual, s));
    }
    for (int i = 0; i < 10; i++) {
      int[] accepted = AutomatonTestUtil.randomAcceptedString(random(), expected);
      if (accepted == null) {
        break;
      }
      assertTrue(AutomatonTestUtil.accepts(actual, accepted));
    }
  }

  public void testRemoveDeadStates() {
    Automaton a = new Automaton();
    int s0 = a.createState();
    int s1 = a.createState();
    int s2 = a.createState();
    int unreachable = a.createState();
    a.setAccept(s1, true);
    a.setAccept(unreachable, true);
    a.addTransition(s0, s1, 'a');
    a.addTransition(s0, s2, 'b');
    a.addTransition(s2, s2, 'c');
    a.finishState();

    assertTrue(Operations.hasDeadStates(a));
    assertTrue(Operations.hasDeadStatesFromInitial(a));
    assertTrue(Operations.hasDeadStatesToAccept(a));

    Automaton b = Operations.removeDeadStates(a);
    assertEquals(2, b.getNumStates());
    assertFalse(Operations.hasDeadStates(b));
    assertTrue(Operations.run(b, "a"));
    assertFalse(Operations.run(b, "bc"));
  }

  public void testRemoveDeadStatesEmptyLanguage() {
    Automaton a = Operations.removeDeadStates(Automata.makeEmpty());
    assertEquals(0, a.getNumStates());
    assertTrue(Operations.isEmpty(a));
  }

  public void testRemoveDeadStatesRandom() {
    int iters = atLeast(50);
    for (int iter = 0; iter < iters; iter++) {
      Automaton a = AutomatonTestUtil.randomAutomaton(random());
      Automaton b = Operations.removeDeadStates(a);
      assertFalse(Operations.hasDeadStates(b));
      assertSameLanguageBruteForce(a, b);
    }
  }

  public void testSameLanguageAndSubsetOfSelf() {
    int iters = atLeast(50);
    for (int iter = 0; iter < iters; iter++) {
      Automaton a = minimalDfa(AutomatonTestUtil.randomAutomaton(random()));
      assertTrue(Operations.sameLanguage(a, a));
      assertTrue(Operations.subsetOf(a, a));
      Automaton copy = new Automaton();
      copy.copy(a);
      copy.finishState();
      assertTrue(Operations.sameLanguage(a, copy));
    }
  }

  public void testSubsetOf() {
    Automaton a = Automata.makeChar('a');
    Automaton abc = Automata.makeCharRange('a', 'c');
    assertTrue(Operations.subsetOf(a, abc));
    assertFalse(Operations.subsetOf(abc, a));
    assertFalse(Operations.sameLanguage(a, abc));
  }

  public void testSubsetOfRequiresDeterministic() {
    Automaton nfa = Operations.union(Automata.makeString("ab"), Automata.makeString("ac"));
    assertFalse(nfa.isDeterministic());
    expectThrows(IllegalArgumentException.class, () -> Operations.subsetOf(nfa, Automata.makeAnyString()));
    expectThrows(IllegalArgumentException.class, () -> Operations.subsetOf(Automata.makeAnyString(), nfa));
  }

  public void testUnionCommutative() {
    int iters = atLeast(30);
    for (int iter = 0; iter < iters; iter++) {
      Automaton a1 = AutomatonTestUtil.randomAutomaton(random());
      Automaton a2 = AutomatonTestUtil.randomAutomaton(random());
      Automaton u12 = Operations.union(a1, a2);
      Automaton u21 = Operations.union(a2, a1);
      assertTrue(Operations.sameLanguage(minimalDfa(u12), minimalDfa(u21)));
      for (int i = 0; i < 30; i++) {
        String s = AutomatonTestUtil.randomString(random(), 6);
        boolean expected = AutomatonTestUtil.accepts(a1, s) || AutomatonTestUtil.accepts(a2, s);
        assertEquals(s, expected, AutomatonTestUtil.accepts(u12, s));
      }
      int[] accepted = AutomatonTestUtil.randomAcceptedString(random(), a1);
      if (accepted != null) {
        assertTrue(AutomatonTestUtil.accepts(u12, accepted));
      }
    }
  }

  public void testUnionOfMany() {
    Automaton a = Operations.union(Arrays.asList(
        Automata.makeString("foo"), Automata.makeEmpty(), Automata.makeString("bar"), Automata.makeEmptyString()));
    assertTrue(AutomatonTestUtil.accepts(a, "foo"));
    assertTrue(AutomatonTestUtil.accepts(a, "bar"));
    assertTrue(AutomatonTestUtil.accepts(a, ""));
    assertFalse(AutomatonTestUtil.accepts(a, "fo"));
  }

  public void testIntersection() {
    Automaton a = Operations.intersection(Automata.makeCharRange('a', 'm'), Automata.makeCharRange('k', 'z'));
    assertTrue(Operations.run(a, "k"));
    assertTrue(Operations.run(a, "m"));
    assertFalse(Operations.run(a, "j"));
    assertFalse(Operations.run(a, "n"));
  }

  public void testIntersectionRandom() {
    int iters = atLeast(30);
    for (int iter = 0; iter < iters; iter++) {
      Automaton a1 = AutomatonTestUtil.randomAutomaton(random());
      Automaton a2 = AutomatonTestUtil.randomAutomaton(random());
      Automaton both = Operations.intersection(a1, a2);
      assertFalse(Operations.hasDeadStates(both));
      for (int i = 0; i < 30; i++) {
        String s = AutomatonTestUtil.randomString(random(), 6);
        boolean expected = AutomatonTestUtil.accepts(a1, s) && AutomatonTestUtil.accepts(a2, s);
        assertEquals(s, expected, AutomatonTestUtil.accepts(both, s));
      }
      int[] accepted = AutomatonTestUtil.randomAcceptedString(random(), both);
      if (accepted != null) {
        assertTrue(AutomatonTestUtil.accepts(a1, accepted));
        assertTrue(AutomatonTestUtil.accepts(a2, accepted));
      }
    }
  }

  public void testConcatenate() {
    Automaton a = Operations.concatenate(Arrays.asList(
        Automata.makeString("a"), Operations.optional(Automata.makeString("b")), Automata.makeString("c")));
    assertTrue(AutomatonTestUtil.accepts(a, "ac"));
    assertTrue(AutomatonTestUtil.accepts(a, "abc"));
    assertFalse(AutomatonTestUtil.accepts(a, "ab"));
    assertFalse(AutomatonTestUtil.accepts(a, "abbc"));
  }

  public void testConcatenateThroughSeveralEmptyMatches() {
    Automaton a = Operations.concatenate(Arrays.asList(
        Automata.makeString("a"),
        Operations.optional(Automata.makeString("b")),
        Operations.optional(Automata.makeString("c")),
        Automata.makeString("d")));
    for (String s : new String[] {"ad", "abd", "acd", "abcd"}) {
      assertTrue(s, AutomatonTestUtil.accepts(a, s));
    }
    assertFalse(AutomatonTestUtil.accepts(a, "acbd"));
    assertFalse(AutomatonTestUtil.accepts(a, "a"));
  }

  public void testConcatenateWithEmptyLanguage() {
    Automaton a = Operations.concatenate(Automata.makeString("a"), Operations.removeDeadStates(Automata.makeEmpty()));
    assertTrue(Operations.isEmpty(a));
  }

  public void testConcatenateRandom() {
    int iters = atLeast(30);
    for (int iter = 0; iter < iters; iter++) {
      Automaton a1 = AutomatonTestUtil.randomAutomaton(random());
      Automaton a2 = AutomatonTestUtil.randomAutomaton(random());
      Automaton c = Operations.concatenate(a1, a2);
      int[] s1 = AutomatonTestUtil.randomAcceptedString(random(), a1);
      int[] s2 = AutomatonTestUtil.randomAcceptedString(random(), a2);
      if (s1 != null && s2 != null) {
        int[] both = Arrays.copyOf(s1, s1.length + s2.length);
        System.arraycopy(s2, 0, both, s1.length, s2.length);
        assertTrue(AutomatonTestUtil.accepts(c, both));
      }
      int[] s = AutomatonTestUtil.randomAcceptedString(random(), c);
      if (s != null) {
        // some split point must work
        boolean found = false;
        for (int split = 0; split <= s.length && found == false; split++) {
          found = AutomatonTestUtil.accepts(a1, Arrays.copyOfRange(s, 0, split))
              && AutomatonTestUtil.accepts(a2, Arrays.copyOfRange(s, split, s.length));
        }
        assertTrue(found);
      }
    }
  }

  public void testRepeatRange() {
    Automaton a = Operations.repeat(Automata.makeChar('x'), 2, 3);
    assertTrue(AutomatonTestUtil.accepts(a, "xx"));
    assertTrue(AutomatonTestUtil.accepts(a, "xxx"));
    assertFalse(AutomatonTestUtil.accepts(a, "x"));
    assertFalse(AutomatonTestUtil.accepts(a, "xxxx"));
    assertFalse(AutomatonTestUtil.accepts(a, ""));
  }

  public void testRepeatRangeFromZero() {
    Automaton a = Operations.repeat(Automata.makeString("ab"), 0, 2);
    assertTrue(AutomatonTestUtil.accepts(a, ""));
    assertTrue(AutomatonTestUtil.accepts(a, "ab"));
    assertTrue(AutomatonTestUtil.accepts(a, "abab"));
    assertFalse(AutomatonTestUtil.accepts(a, "ababab"));
    assertTrue(Operations.isEmpty(Operations.repeat(Automata.makeChar('x'), 3, 2)));
  }

  public void testRepeatStar() {
    Automaton a = Operations.repeat(Automata.makeString("ab"));
    assertTrue(AutomatonTestUtil.accepts(a, ""));
    assertTrue(AutomatonTestUtil.accepts(a, "ab"));
    assertTrue(AutomatonTestUtil.accepts(a, "ababab"));
    assertFalse(AutomatonTestUtil.accepts(a, "aba"));
    assertFalse(Operations.isFinite(a));
  }

  public void testRepeatMin() {
    Automaton a = Operations.repeat(Automata.makeChar('x'), 2);
    assertFalse(AutomatonTestUtil.accepts(a, "x"));
    assertTrue(AutomatonTestUtil.accepts(a, "xx"));
    assertTrue(AutomatonTestUtil.accepts(a, "xxxxxxx"));
  }

  public void testRepeatEmptyLanguage() {
    Automaton empty = Operations.removeDeadStates(Automata.makeEmpty());
    assertTrue(AutomatonTestUtil.accepts(Operations.repeat(empty), ""));
    assertTrue(AutomatonTestUtil.accepts(Operations.repeat(empty, 0, 3), ""));
    assertTrue(Operations.isEmpty(Operations.repeat(empty, 1, 3)));
  }

  public void testOptional() {
    Automaton a = Operations.optional(Automata.makeString("ab"));
    assertTrue(AutomatonTestUtil.accepts(a, ""));
    assertTrue(AutomatonTestUtil.accepts(a, "ab"));
    assertFalse(AutomatonTestUtil.accepts(a, "a"));
  }

  public void testComplement() {
    Automaton a = Operations.complement(Automata.makeString("foo"), Operations.DEFAULT_DETERMINIZE_WORK_LIMIT);
    assertTrue(a.isDeterministic());
    assertFalse(Operations.run(a, "foo"));
    assertTrue(Operations.run(a, ""));
    assertTrue(Operations.run(a, "fo"));
    assertTrue(Operations.run(a, "fooo"));
    assertTrue(Operations.run(a, new String(Character.toChars(Character.MAX_CODE_POINT))));
  }

  public void testComplementComplement() {
    int iters = atLeast(30);
    for (int iter = 0; iter < iters; iter++) {
      Automaton a = AutomatonTestUtil.randomAutomaton(random());
      Automaton twice;
      try {
        twice = Operations.complement(Operations.complement(a, 100000), 100000);
      } catch (TooComplexToDeterminizeException tctde) {
        continue;
      }
      assertTrue(Operations.sameLanguage(minimalDfa(a), twice));
    }
  }

  public void testComplementOfEverythingIsEmpty() {
    Automaton a = Operations.complement(Automata.makeAnyString(), Operations.DEFAULT_DETERMINIZE_WORK_LIMIT);
    assertTrue(Operations.isEmpty(a));
    Automaton b = Operations.complement(a, Operations.DEFAULT_DETERMINIZE_WORK_LIMIT);
    assertTrue(Operations.run(b, "anything"));
  }

  public void testMinus() {
    Automaton a = Operations.minus(Automata.makeCharRange('a', 'e'), Automata.makeChar('c'),
        Operations.DEFAULT_DETERMINIZE_WORK_LIMIT);
    assertTrue(AutomatonTestUtil.accepts(a, "a"));
    assertTrue(AutomatonTestUtil.accepts(a, "e"));
    assertFalse(AutomatonTestUtil.accepts(a, "c"));

    Automaton same = Automata.makeString("x");
    assertTrue(Operations.isEmpty(Operations.minus(same, same, Operations.DEFAULT_DETERMINIZE_WORK_LIMIT)));
    assertSame(same, Operations.minus(same, Automata.makeEmpty(), Operations.DEFAULT_DETERMINIZE_WORK_LIMIT));
  }

  public void testIsEmpty() {
    assertTrue(Operations.isEmpty(new Automaton()));
    assertTrue(Operations.isEmpty(Automata.makeEmpty()));
    assertFalse(Operations.isEmpty(Automata.makeEmptyString()));
    Automaton a = new Automaton();
    int s0 = a.createState();
    int s1 = a.createState();
    a.addTransition(s0, s1, 'a');
    a.finishState();
    assertTrue(Operations.isEmpty(a));
  }

  public void testIsTotal() {
    assertTrue(Operations.isTotal(Automata.makeAnyString()));
    assertFalse(Operations.isTotal(Automata.makeAnyChar()));
    assertFalse(Operations.isTotal(new Automaton()));
    assertTrue(Operations.isTotal(Automata.makeAnyBinary(), 0, 255));
  }

  public void testGetSingleton() {
    String s = randomUnicodeString(random(), 10);
    IntsRef singleton = Operations.getSingleton(Automata.makeString(s));
    assertNotNull(singleton);
    assertArrayEquals(s.codePoints().toArray(), Arrays.copyOfRange(singleton.ints, singleton.offset, singleton.offset + singleton.length));

    assertNull(Operations.getSingleton(Automata.makeAnyString()));
    assertNull(Operations.getSingleton(Automata.makeEmpty()));
    // empty languages built by the algebra have no states at all
    assertNull(Operations.getSingleton(new Automaton()));
    assertNull(Operations.getSingleton(Operations.complement(Automata.makeAnyString(), Operations.DEFAULT_DETERMINIZE_WORK_LIMIT)));
    assertNull(Operations.getSingleton(Operations.union(Automata.makeEmpty(), Automata.makeEmpty())));
    assertNull(Operations.getSingleton(Automata.makeCharRange('a', 'b')));
    assertNull(Operations.getSingleton(Operations.optional(Automata.makeString("ab"))));

    IntsRef empty = Operations.getSingleton(Automata.makeEmptyString());
    assertNotNull(empty);
    assertEquals(0, empty.length);
  }

  public void testIsFinite() {
    assertTrue(Operations.isFinite(Automata.makeString("foo")));
    assertTrue(Operations.isFinite(Automata.makeEmpty()));
    assertTrue(Operations.isFinite(Operations.repeat(Automata.makeChar('a'), 1, 10)));
    assertFalse(Operations.isFinite(Automata.makeAnyString()));
    assertFalse(Operations.isFinite(Operations.concatenate(Automata.makeString("ab"), Operations.repeat(Automata.makeChar('c')))));
  }

  public void testIsFiniteDeepAutomaton() {
    // a long chain must not overflow the stack
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < 50000; i++) {
      sb.append('a');
    }
    assertTrue(Operations.isFinite(Automata.makeString(sb.toString())));
  }

  public void testGetCommonPrefix() {
    Automaton a = Operations.concatenate(Automata.makeString("foo"),
        Operations.union(Automata.makeString("bar"), Automata.makeString("baz")));
    assertEquals("fooba", Operations.getCommonPrefix(a));
    assertEquals("", Operations.getCommonPrefix(Automata.makeAnyString()));
    assertEquals("", Operations.getCommonPrefix(Operations.removeDeadStates(Automata.makeEmpty())));
    assertEquals("abc", Operations.getCommonPrefix(Automata.makeString("abc")));
  }

  public void testGetCommonPrefixDeadStates() {
    Automaton a = new Automaton();
    int s0 = a.createState();
    int s1 = a.createState();
    int s2 = a.createState();
    a.setAccept(s1, true);
    a.addTransition(s0, s1, 'a');
    a.addTransition(s0, s2, 'b');
    a.finishState();
    expectThrows(IllegalArgumentException.class, () -> Operations.getCommonPrefix(a));
  }

  public void testGetCommonPrefixBytesRef() {
    Automaton a = Operations.concatenate(Automata.makeBinary(new BytesRef(new byte[] {(byte) 0xf0, 1})),
        Automata.makeAnyBinary());
    assertEquals(new BytesRef(new byte[] {(byte) 0xf0, 1}), Operations.getCommonPrefixBytesRef(a));
  }

  public void testGetCommonSuffixBytesRef() {
    Automaton a = Operations.concatenate(Automata.makeAnyString(), Automata.makeString("ing"));
    assertEquals(new BytesRef("ing"), Operations.getCommonSuffixBytesRef(a));

    Automaton b = Operations.union(Automata.makeString("walking"), Automata.makeString("talking"));
    assertEquals(new BytesRef("alking"), Operations.getCommonSuffixBytesRef(b));

    assertEquals(0, Operations.getCommonSuffixBytesRef(Automata.makeAnyBinary()).length);
  }

  public void testReverse() {
    Automaton a = Operations.reverse(Automata.makeString("abc"));
    assertTrue(AutomatonTestUtil.accepts(a, "cba"));
    assertFalse(AutomatonTestUtil.accepts(a, "abc"));
    assertTrue(Operations.isEmpty(Operations.reverse(Automata.makeEmpty())));
  }

  public void testReverseRandom() {
    int iters = atLeast(30);
    for (int iter = 0; iter < iters; iter++) {
      Automaton a = AutomatonTestUtil.randomAutomaton(random());
      Automaton r = Operations.reverse(a);
      for (int i = 0; i < 10; i++) {
        int[] s = AutomatonTestUtil.randomAcceptedString(random(), a);
        if (s == null) {
          break;
        }
        int[] reversed = new int[s.length];
        for (int j = 0; j < s.length; j++) {
          reversed[j] = s[s.length - 1 - j];
        }
        assertTrue(AutomatonTestUtil.accepts(r, reversed));
      }
    }
  }

  public void testTotalize() {
    Automaton a = Operations.totalize(Automata.makeString("ab"), 0, 255);
    assertEquals(4, a.getNumStates());
    assertTrue(a.isDeterministic());
    Transition t = new Transition();
    for (int s = 0; s < a.getNumStates(); s++) {
      int next = 0;
      int count = a.initTransition(s, t);
      for (int i = 0; i < count; i++) {
        a.getNextTransition(t);
        assertEquals(next, t.min);
        next = t.max + 1;
      }
      assertEquals("state " + s + " must cover every byte", 256, next);
    }
    assertTrue(Operations.run(a, "ab"));
    assertFalse(Operations.run(a, "a"));
    assertFalse(Operations.run(a, "abc"));
  }

  public void testFindIndex() {
    int[] points = new int[] {0, 3, 7};
    assertEquals(0, Operations.findIndex(0, points));
    assertEquals(0, Operations.findIndex(2, points));
    assertEquals(1, Operations.findIndex(3, points));
    assertEquals(1, Operations.findIndex(6, points));
    assertEquals(2, Operations.findIndex(7, points));
    assertEquals(2, Operations.findIndex(Character.MAX_CODE_POINT, points));
  }
}
