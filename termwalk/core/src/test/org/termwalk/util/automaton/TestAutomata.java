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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

import org.termwalk.util.BytesRef;
import org.termwalk.util.TermwalkTestCase;

public class TestAutomata extends TermwalkTestCase {

  public void testMakeEmpty() {
    Automaton a = Automata.makeEmpty();
    assertEquals(1, a.getNumStates());
    assertFalse(a.isAccept(0));
    assertTrue(Operations.isEmpty(a));
    assertFalse(Operations.run(a, ""));
    assertFalse(Operations.run(a, "a"));
  }

  public void testMakeEmptyString() {
    Automaton a = Automata.makeEmptyString();
    assertTrue(Operations.run(a, ""));
    assertFalse(Operations.run(a, "a"));
    assertFalse(Operations.isEmpty(a));
  }

  public void testMakeAnyString() {
    Automaton a = Automata.makeAnyString();
    assertTrue(Operations.isTotal(a));
    assertTrue(Operations.run(a, ""));
    assertTrue(Operations.run(a, randomUnicodeString(random(), 20)));
  }

  public void testMakeAnyBinary() {
    Automaton a = Automata.makeAnyBinary();
    assertTrue(Operations.isTotal(a, 0, 255));
    assertFalse(Operations.isTotal(a));
    Automaton nonEmpty = Automata.makeNonEmptyBinary();
    assertFalse(nonEmpty.isAccept(0));
    assertEquals(1, nonEmpty.step(0, 0xff));
    assertTrue(nonEmpty.isAccept(1));
  }

  public void testMakeCharRange() {
    Automaton a = Automata.makeCharRange('a', 'c');
    assertTrue(Operations.run(a, "a"));
    assertTrue(Operations.run(a, "b"));
    assertTrue(Operations.run(a, "c"));
    assertFalse(Operations.run(a, "d"));
    assertFalse(Operations.run(a, ""));
    assertFalse(Operations.run(a, "ab"));
  }

  public void testMakeCharRangeEmpty() {
    assertTrue(Operations.isEmpty(Automata.makeCharRange('z', 'a')));
  }

  public void testMakeChar() {
    Automaton a = Automata.makeChar(0x1f600);
    assertTrue(Operations.run(a, new String(Character.toChars(0x1f600))));
    assertFalse(Operations.run(a, "a"));
    Automaton any = Automata.makeAnyChar();
    assertTrue(Operations.run(any, "\u0000"));
    assertTrue(Operations.run(any, new String(Character.toChars(Character.MAX_CODE_POINT))));
    assertFalse(Operations.run(any, "ab"));
  }

  public void testAppendCharAndAnyChar() {
    Automaton a = new Automaton();
    int s = a.createState();
    s = Automata.appendChar(a, s, 'f');
    s = Automata.appendAnyChar(a, s);
    a.setAccept(s, true);
    a.finishState();
    assertTrue(Operations.run(a, "fx"));
    assertTrue(Operations.run(a, "f\u20ac"));
    assertFalse(Operations.run(a, "f"));
    assertFalse(Operations.run(a, "xf"));
  }

  public void testMakeString() {
    String s = randomUnicodeString(random(), 10);
    Automaton a = Automata.makeString(s);
    assertTrue(a.isDeterministic());
    assertTrue(Operations.run(a, s));
    assertFalse(Operations.run(a, s + "x"));
    int[] codePoints = s.codePoints().toArray();
    Automaton b = Automata.makeString(codePoints, 0, codePoints.length);
    assertTrue(Operations.sameLanguage(a, b));
  }

  public void testMakeBinary() {
    BytesRef term = new BytesRef(new byte[] {(byte) 0xff, 0, 'a'});
    Automaton a = Automata.makeBinary(term);
    assertTrue(AutomatonTestUtil.acceptsBytes(a, term));
    assertFalse(AutomatonTestUtil.acceptsBytes(a, new BytesRef(new byte[] {(byte) 0xff, 0})));
  }

  public void testDecimalInterval() {
    CharacterRunAutomaton a = new CharacterRunAutomaton(Automata.makeDecimalInterval(5, 25, 0));
    assertTrue(a.run("5"));
    assertTrue(a.run("12"));
    assertTrue(a.run("25"));
    assertFalse(a.run("4"));
    assertFalse(a.run("26"));
    assertFalse(a.run("005"));
    assertFalse(a.run(""));
  }

  public void testDecimalIntervalFixedDigits() {
    CharacterRunAutomaton a = new CharacterRunAutomaton(Automata.makeDecimalInterval(5, 25, 3));
    assertTrue(a.run("005"));
    assertTrue(a.run("012"));
    assertTrue(a.run("025"));
    assertFalse(a.run("5"));
    assertFalse(a.run("026"));
    assertFalse(a.run("0005"));
  }

  public void testDecimalIntervalRandom() {
    int iters = atLeast(20);
    for (int iter = 0; iter < iters; iter++) {
      int min = random().nextInt(2000);
      int max = min + random().nextInt(2000);
      CharacterRunAutomaton a = new CharacterRunAutomaton(Automata.makeDecimalInterval(min, max, 0));
      for (int i = 0; i < 50; i++) {
        int value = random().nextInt(5000);
        assertEquals(min + ".." + max + " " + value, value >= min && value <= max, a.run(Integer.toString(value)));
      }
      assertTrue(a.run(Integer.toString(min)));
      assertTrue(a.run(Integer.toString(max)));
      if (min > 0) {
        assertFalse(a.run("0" + min));
      }
    }
  }

  public void testDecimalIntervalZero() {
    CharacterRunAutomaton a = new CharacterRunAutomaton(Automata.makeDecimalInterval(0, 3, 0));
    assertTrue(a.run("0"));
    assertTrue(a.run("3"));
    assertFalse(a.run("00"));
    assertFalse(a.run("03"));
    assertFalse(a.run("4"));
  }

  public void testDecimalIntervalIllegal() {
    expectThrows(IllegalArgumentException.class, () -> Automata.makeDecimalInterval(10, 5, 0));
    expectThrows(IllegalArgumentException.class, () -> Automata.makeDecimalInterval(-1, 5, 0));
    expectThrows(IllegalArgumentException.class, () -> Automata.makeDecimalInterval(1, 1000, 2));
  }

  public void testBinaryIntervalIllegal() {
    expectThrows(IllegalArgumentException.class, () -> Automata.makeBinaryInterval(null, false, new BytesRef("b"), true));
    expectThrows(IllegalArgumentException.class, () -> Automata.makeBinaryInterval(new BytesRef("b"), true, null, false));
  }

  public void testBinaryIntervalBasic() {
    Automaton a = Automata.makeBinaryInterval(new BytesRef("bar"), true, new BytesRef("foo"), false);
    assertTrue(a.isDeterministic());
    assertTrue(AutomatonTestUtil.acceptsBytes(a, new BytesRef("bar")));
    assertTrue(AutomatonTestUtil.acceptsBytes(a, new BytesRef("bara")));
    assertTrue(AutomatonTestUtil.acceptsBytes(a, new BytesRef("fo")));
    assertTrue(AutomatonTestUtil.acceptsBytes(a, new BytesRef("fonzzz")));
    assertFalse(AutomatonTestUtil.acceptsBytes(a, new BytesRef("foo")));
    assertFalse(AutomatonTestUtil.acceptsBytes(a, new BytesRef("ba")));
    assertFalse(AutomatonTestUtil.acceptsBytes(a, new BytesRef("")));
  }

  public void testBinaryIntervalOpenEnded() {
    Automaton all = Automata.makeBinaryInterval(null, true, null, true);
    assertTrue(AutomatonTestUtil.acceptsBytes(all, new BytesRef("")));
    assertTrue(AutomatonTestUtil.acceptsBytes(all, new BytesRef(new byte[] {(byte) 0xff, (byte) 0xff})));

    Automaton below = Automata.makeBinaryInterval(null, true, new BytesRef("m"), false);
    assertTrue(AutomatonTestUtil.acceptsBytes(below, new BytesRef("")));
    assertTrue(AutomatonTestUtil.acceptsBytes(below, new BytesRef("lzzz")));
    assertFalse(AutomatonTestUtil.acceptsBytes(below, new BytesRef("m")));

    Automaton above = Automata.makeBinaryInterval(new BytesRef("m"), false, null, true);
    assertFalse(AutomatonTestUtil.acceptsBytes(above, new BytesRef("m")));
    assertTrue(AutomatonTestUtil.acceptsBytes(above, new BytesRef("m\u0000")));
    assertTrue(AutomatonTestUtil.acceptsBytes(above, new BytesRef("n")));
  }

  public void testBinaryIntervalOpenEndedAfterMaxByte() {
    Automaton a = Automata.makeBinaryInterval(new BytesRef(new byte[] {(byte) 0xff}), true, null, true);
    assertTrue(a.isDeterministic());
    assertTrue(AutomatonTestUtil.acceptsBytes(a, new BytesRef(new byte[] {(byte) 0xff})));
    assertTrue(AutomatonTestUtil.acceptsBytes(a, new BytesRef(new byte[] {(byte) 0xff, 0})));
    assertFalse(AutomatonTestUtil.acceptsBytes(a, new BytesRef(new byte[] {(byte) 0xfe, (byte) 0xff})));
    assertFalse(AutomatonTestUtil.acceptsBytes(a, new BytesRef("")));

    Automaton exclusive = Automata.makeBinaryInterval(new BytesRef(new byte[] {(byte) 0xff, (byte) 0xff}), false, null, true);
    assertFalse(AutomatonTestUtil.acceptsBytes(exclusive, new BytesRef(new byte[] {(byte) 0xff, (byte) 0xff})));
    assertTrue(AutomatonTestUtil.acceptsBytes(exclusive, new BytesRef(new byte[] {(byte) 0xff, (byte) 0xff, 0})));
    assertFalse(AutomatonTestUtil.acceptsBytes(exclusive, new BytesRef(new byte[] {(byte) 0xff})));
  }

  public void testBinaryIntervalEmpty() {
    BytesRef x = new BytesRef("x");
    assertTrue(Operations.isEmpty(Automata.makeBinaryInterval(x, true, x, false)));
    assertTrue(Operations.isEmpty(Automata.makeBinaryInterval(new BytesRef("y"), true, x, true)));
    Automaton single = Automata.makeBinaryInterval(x, true, x, true);
    assertTrue(AutomatonTestUtil.acceptsBytes(single, x));
    assertFalse(AutomatonTestUtil.acceptsBytes(single, new BytesRef("x\u0000")));
  }

  private static BytesRef randomBinaryTerm() {
    byte[] bytes = new byte[random().nextInt(4)];
    for (int i = 0; i < bytes.length; i++) {
      // few distinct values so that terms share prefixes
      bytes[i] = (byte) (random().nextBoolean() ? random().nextInt(3) : 253 + random().nextInt(3));
    }
    return new BytesRef(bytes);
  }

  public void testBinaryIntervalRandom() {
    int iters = atLeast(100);
    for (int iter = 0; iter < iters; iter++) {
      BytesRef min = random().nextInt(5) == 0 ? null : randomBinaryTerm();
      BytesRef max = random().nextInt(5) == 0 ? null : randomBinaryTerm();
      boolean minInclusive = min == null || random().nextBoolean();
      boolean maxInclusive = max == null || random().nextBoolean();
      Automaton a = Automata.makeBinaryInterval(min, minInclusive, max, maxInclusive);
      assertTrue(a.isDeterministic());
      for (int i = 0; i < 50; i++) {
        BytesRef term = randomBinaryTerm();
        boolean expected = true;
        if (min != null) {
          int cmp = term.compareTo(min);
          expected = minInclusive ? cmp >= 0 : cmp > 0;
        }
        if (max != null) {
          int cmp = term.compareTo(max);
          expected &= maxInclusive ? cmp <= 0 : cmp < 0;
        }
        assertEquals("min=" + min + " (" + minInclusive + ") max=" + max + " (" + maxInclusive + ") term=" + term,
            expected, AutomatonTestUtil.acceptsBytes(a, term));
      }
    }
  }

  public void testStringUnion() {
    List<BytesRef> terms = new ArrayList<>(new TreeSet<>(Arrays.asList(
        new BytesRef("bar"), new BytesRef("barn"), new BytesRef("foo"), new BytesRef("food"), new BytesRef("\u20acuro"))));
    Automaton a = Automata.makeStringUnion(terms);
    assertTrue(a.isDeterministic());
    assertFalse(Operations.hasDeadStates(a));
    for (BytesRef term : terms) {
      assertTrue(term.utf8ToString(), Operations.run(a, term.utf8ToString()));
    }
    assertFalse(Operations.run(a, "ba"));
    assertFalse(Operations.run(a, "barns"));
    assertFalse(Operations.run(a, "fooo"));
    assertFalse(Operations.run(a, ""));
    // code point labels, not bytes
    assertNotEquals(-1, a.step(0, 0x20ac));
  }

  public void testStringUnionEmpty() {
    assertTrue(Operations.isEmpty(Automata.makeStringUnion(Collections.<BytesRef>emptyList())));
    assertTrue(Operations.isEmpty(Automata.makeBinaryStringUnion(Collections.<BytesRef>emptyList())));
  }

  public void testStringUnionUnsorted() {
    List<BytesRef> terms = Arrays.asList(new BytesRef("foo"), new BytesRef("bar"));
    IllegalArgumentException expected = expectThrows(IllegalArgumentException.class, () -> Automata.makeStringUnion(terms));
    assertTrue(expected.getMessage().contains("sorted"));
  }

  public void testBinaryStringUnion() {
    List<BytesRef> terms = Arrays.asList(
        new BytesRef(new byte[] {0}), new BytesRef(new byte[] {0, (byte) 0x80}), new BytesRef(new byte[] {(byte) 0xc3}));
    Automaton a = Automata.makeBinaryStringUnion(terms);
    for (BytesRef term : terms) {
      assertTrue(AutomatonTestUtil.acceptsBytes(a, term));
    }
    assertFalse(AutomatonTestUtil.acceptsBytes(a, new BytesRef(new byte[] {0, 0})));
    // byte labels: 0xc3 is not decoded as the lead byte of a code point
    assertNotEquals(-1, a.step(0, 0xc3));
  }

  public void testMakeStringFromCodePoints() {
    int[] codePoints = new int[] {'x', 'a', 0x1f600, 'b', 'y'};
    Automaton a = Automata.makeString(codePoints, 1, 3);
    assertTrue(AutomatonTestUtil.accepts(a, new int[] {'a', 0x1f600, 'b'}));
    assertFalse(AutomatonTestUtil.accepts(a, new int[] {'x', 'a', 0x1f600, 'b'}));
    assertEquals("a\ud83d\ude00b", Operations.getCommonPrefix(a));
  }
}
