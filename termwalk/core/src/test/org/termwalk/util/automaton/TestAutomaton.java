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

import org.termwalk.util.TermwalkTestCase;

public class TestAutomaton extends TermwalkTestCase {

  public void testBasic() {
    Automaton a = new Automaton();
    int start = a.createState();
    int x = a.createState();
    int y = a.createState();
    int end = a.createState();
    a.setAccept(end, true);

    a.addTransition(start, x, 'a', 'a');
    a.addTransition(start, end, 'd', 'd');
    a.addTransition(x, y, 'b', 'b');
    a.addTransition(y, end, 'c', 'c');
    a.finishState();

    assertEquals(4, a.getNumStates());
    assertEquals(4, a.getNumTransitions());
    assertTrue(a.isDeterministic());
    assertTrue(Operations.run(a, "abc"));
    assertTrue(Operations.run(a, "d"));
    assertFalse(Operations.run(a, "ab"));
    assertFalse(Operations.run(a, ""));
  }

  public void testTransitionsFromOneStateMustBeContiguous() {
    Automaton a = new Automaton();
    int s0 = a.createState();
    int s1 = a.createState();
    a.addTransition(s0, s1, 'a');
    a.addTransition(s1, s0, 'b');
    IllegalStateException expected = expectThrows(IllegalStateException.class, () -> {
      a.addTransition(s0, s1, 'c');
    });
    assertTrue(expected.getMessage().contains("from state (0) already had transitions added"));
  }

  public void testBadStateIds() {
    Automaton a = new Automaton();
    int s0 = a.createState();
    expectThrows(IndexOutOfBoundsException.class, () -> {
      a.addTransition(s0, 3, 'a');
    });
    expectThrows(IndexOutOfBoundsException.class, () -> {
      a.setAccept(7, true);
    });
    expectThrows(IndexOutOfBoundsException.class, () -> {
      a.getNumTransitions(2);
    });
  }

  public void testFinishStateSortsAndMerges() {
    Automaton a = new Automaton();
    int s0 = a.createState();
    int s1 = a.createState();
    int s2 = a.createState();
    a.setAccept(s1, true);
    a.setAccept(s2, true);
    a.addTransition(s0, s2, 'x', 'z');
    a.addTransition(s0, s1, 'd', 'f');
    a.addTransition(s0, s1, 'a', 'c');
    a.addTransition(s0, s1, 'b', 'e');
    a.finishState();

    // a-c, b-e and d-f all lead to s1 and collapse into a single transition
    assertEquals(2, a.getNumTransitions(s0));
    Transition t = new Transition();
    a.initTransition(s0, t);
    a.getNextTransition(t);
    assertEquals(s1, t.dest);
    assertEquals('a', t.min);
    assertEquals('f', t.max);
    a.getNextTransition(t);
    assertEquals(s2, t.dest);
    assertEquals('x', t.min);
    assertEquals('z', t.max);
    assertTrue(a.isDeterministic());
  }

  public void testOverlappingTransitionsAreNonDeterministic() {
    Automaton a = new Automaton();
    int s0 = a.createState();
    int s1 = a.createState();
    int s2 = a.createState();
    a.setAccept(s2, true);
    a.addTransition(s0, s1, 'a', 'm');
    a.addTransition(s0, s2, 'k', 'z');
    a.finishState();
    assertFalse(a.isDeterministic());
    assertFalse(AutomatonTestUtil.isDeterministicSlow(a));
  }

  public void testBuilderAcceptsAnyOrder() {
    Automaton.Builder b = new Automaton.Builder();
    int s0 = b.createState();
    int s1 = b.createState();
    int s2 = b.createState();
    b.setAccept(s2, true);
    b.addTransition(s1, s2, 'b');
    b.addTransition(s0, s1, 'a');
    b.addTransition(s2, s2, 'c');
    b.addTransition(s0, s2, 'x');
    Automaton a = b.finish();

    assertEquals(3, a.getNumStates());
    assertEquals(4, a.getNumTransitions());
    assertTrue(a.isDeterministic());
    assertTrue(Operations.run(a, "ab"));
    assertTrue(Operations.run(a, "abccc"));
    assertTrue(Operations.run(a, "xc"));
    assertFalse(Operations.run(a, "a"));
  }

  public void testBuilderEpsilon() {
    Automaton.Builder b = new Automaton.Builder();
    int s0 = b.createState();
    int s1 = b.createState();
    int s2 = b.createState();
    b.setAccept(s2, true);
    b.addTransition(s1, s2, 'b');
    b.addEpsilon(s0, s1);
    b.addEpsilon(s0, s2);
    Automaton a = b.finish();
    assertTrue(a.isAccept(s0));
    assertTrue(Operations.run(a, ""));
    assertTrue(Operations.run(a, "b"));
    assertFalse(Operations.run(a, "bb"));
  }

  public void testEpsilonCopiesTransitionsAndAccept() {
    Automaton a = new Automaton();
    int s0 = a.createState();
    int s1 = a.createState();
    int s2 = a.createState();
    a.setAccept(s1, true);
    a.addTransition(s1, s2, 'z');
    a.addTransition(s2, s2, 'y');
    a.addEpsilon(s0, s1);
    a.finishState();
    assertTrue(a.isAccept(s0));
    assertEquals(1, a.getNumTransitions(s0));
    assertEquals(s2, a.step(s0, 'z'));
  }

  public void testCopy() {
    Automaton a = Automata.makeString("foo");
    Automaton b = new Automaton();
    b.createState();
    b.copy(a);
    b.finishState();
    assertEquals(1 + a.getNumStates(), b.getNumStates());
    assertEquals(a.getNumTransitions(), b.getNumTransitions());
    assertEquals(2, b.step(1, 'f'));
    assertTrue(b.isAccept(4));
    assertFalse(b.isAccept(0));
  }

  public void testStepAndNext() {
    Automaton a = new Automaton();
    int s0 = a.createState();
    int s1 = a.createState();
    int s2 = a.createState();
    int s3 = a.createState();
    a.addTransition(s0, s1, 'a', 'c');
    a.addTransition(s0, s2, 'f', 'h');
    a.addTransition(s0, s3, 'x');
    a.finishState();

    assertEquals(s1, a.step(s0, 'b'));
    assertEquals(-1, a.step(s0, 'd'));
    assertEquals(s3, a.step(s0, 'x'));
    assertEquals(-1, a.step(s1, 'a'));

    Transition t = new Transition();
    t.source = s0;
    t.transitionUpto = -1;
    assertEquals(s1, a.next(t, 'a'));
    assertEquals('a', t.min);
    assertEquals('c', t.max);
    assertEquals(-1, a.next(t, 'e'));
    assertEquals(s2, a.next(t, 'g'));
    assertEquals('f', t.min);
    assertEquals(s3, a.next(t, 'x'));
    assertEquals(-1, a.next(t, 'y'));
  }

  public void testGetStartPoints() {
    Automaton a = new Automaton();
    int s0 = a.createState();
    int s1 = a.createState();
    a.addTransition(s0, s1, 'b', 'd');
    a.addTransition(s1, s1, 'c', Character.MAX_CODE_POINT);
    a.finishState();
    assertArrayEquals(new int[] {0, 'b', 'c', 'e'}, a.getStartPoints());
  }

  public void testRandomStepMatchesBruteForce() {
    int iters = atLeast(50);
    for (int iter = 0; iter < iters; iter++) {
      Automaton a = Operations.determinize(AutomatonTestUtil.randomAutomaton(random()), Integer.MAX_VALUE);
      for (int i = 0; i < 20; i++) {
        String s = AutomatonTestUtil.randomString(random(), 6);
        assertEquals(s, AutomatonTestUtil.accepts(a, s), Operations.run(a, s));
      }
    }
  }

  public void testGetSortedTransitions() {
    Automaton a = Automata.makeCharRange('a', 'c');
    Transition[][] sorted = a.getSortedTransitions();
    assertEquals(2, sorted.length);
    assertEquals(1, sorted[0].length);
    assertEquals(0, sorted[1].length);
    assertEquals(1, sorted[0][0].dest);
    assertEquals('a', sorted[0][0].min);
    assertEquals('c', sorted[0][0].max);
  }

  public void testToDot() {
    String dot = Automata.makeString("ab").toDot();
    assertTrue(dot, dot.startsWith("digraph Automaton {"));
    assertTrue(dot, dot.contains("doublecircle"));
    assertTrue(dot, dot.contains("label=\"a\""));
  }

  public void testRamBytesUsed() {
    Automaton small = Automata.makeString("a");
    Automaton large = Automata.makeString("abcdefghijklmnopqrstuvwxyz");
    assertTrue(small.ramBytesUsed() > 0);
    assertTrue(large.ramBytesUsed() > small.ramBytesUsed());
  }

  public void testBuilderCopyStates() {
    Automaton.Builder builder = new Automaton.Builder();
    builder.createState();
    builder.copyStates(Automata.makeString("ab"));
    assertEquals(4, builder.getNumStates());
    assertTrue(builder.isAccept(3));
    assertFalse(builder.isAccept(1));
    Automaton a = builder.finish();
    assertEquals(0, a.getNumTransitions());
  }
}
