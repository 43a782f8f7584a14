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
import java.util.HashMap;
import java.util.Map;

import org.termwalk.util.Accountable;
import org.termwalk.util.ArrayUtil;
import org.termwalk.util.RamUsageEstimator;

/**
 * A RunAutomaton that does not require DFA. It will lazily determinize on-demand, memorizing the
 * generated DFA states that has been explored.  Each DFA state is the set of NFA states reachable
 * on the same input.
 *
 * <p>The lazily built tables are guarded by this instance's monitor, so one instance can be
 * stepped by several threads at once.
 *
 * @termwalk.experimental
 */
public class NFARunAutomaton implements ByteRunnable, TransitionAccessor, Accountable {

  /** state ordinal of "no such state" */
  public static final int MISSING = -1;

  private static final int NOT_COMPUTED = -2;

  private static final long BASE_RAM_BYTES = RamUsageEstimator.shallowSizeOfInstance(NFARunAutomaton.class);
  private static final long DSTATE_RAM_BYTES = RamUsageEstimator.shallowSizeOfInstance(DState.class);

  private final Automaton automaton;
  private final int[] points;
  private final int alphabetSize;
  final int[] classmap; // map from char number to class

  private final Map<IntSet, Integer> setToOrd = new HashMap<>();
  private DState[] dStates;

  // scratch, only touched under the monitor
  private final StateSet statesSet = new StateSet(5);
  private final Transition stepTransition = new Transition();

  /**
   * Constructor, assuming alphabet size is the whole Unicode code point space
   *
   * @param automaton incoming automaton, should be NFA, for DFA please use {@link RunAutomaton} for
   *     better efficiency
   */
  public NFARunAutomaton(Automaton automaton) {
    this(automaton, Character.MAX_CODE_POINT + 1);
  }

  /**
   * Constructor
   *
   * @param automaton incoming automaton, should be NFA, for DFA please use {@link RunAutomaton} *
   *     for better efficiency
   * @param alphabetSize alphabet size, 256 for byte automata
   */
  public NFARunAutomaton(Automaton automaton, int alphabetSize) {
    this.automaton = automaton;
    this.alphabetSize = alphabetSize;
    points = automaton.getStartPoints();
    dStates = new DState[10];
    statesSet.reset();
    if (automaton.getNumStates() > 0) {
      statesSet.incr(0);
    }
    // the initial state always gets ordinal 0, even when it has no NFA members
    findDState();

    /*
     * Set alphabet table for optimal run performance.
     */
    classmap = new int[Math.min(256, alphabetSize)];
    int i = 0;
    for (int j = 0; j < classmap.length; j++) {
      if (i + 1 < points.length && j == points[i + 1]) {
        i++;
      }
      classmap[j] = i;
    }
  }

  private int getCharClass(int c) {
    assert c < alphabetSize;
    if (c < classmap.length) {
      return classmap[c];
    }
    return Operations.findIndex(c, points);
  }

  @Override
  public synchronized int step(int state, int c) {
    assert dStates[state] != null;
    return dStates[state].nextState(getCharClass(c));
  }

  @Override
  public synchronized boolean isAccept(int state) {
    assert dStates[state] != null;
    return dStates[state].isAccept;
  }

  /** Number of DFA states minted so far; grows as more of the automaton is explored. */
  @Override
  public synchronized int getSize() {
    return setToOrd.size();
  }

  /** Returns the ordinal of the DFA state named by the current {@link #statesSet}, minting it when unseen. */
  private int findDState() {
    Integer ord = setToOrd.get(statesSet);
    if (ord != null) {
      return ord;
    }
    int newOrd = setToOrd.size();
    FrozenIntSet frozen = statesSet.freeze(newOrd);
    setToOrd.put(frozen, newOrd);
    dStates = ArrayUtil.grow(dStates, newOrd + 1);
    dStates[newOrd] = new DState(frozen);
    return newOrd;
  }

  @Override
  public synchronized int initTransition(int state, Transition t) {
    t.source = state;
    t.transitionUpto = -1;
    return getNumTransitions(state);
  }

  @Override
  public synchronized void getNextTransition(Transition t) {
    DState dState = dStates[t.source];
    assert dState.sortedTransitions != null : "initTransition was not called";
    t.transitionUpto++;
    assert t.transitionUpto < dState.numSortedTransitions();
    dState.fill(t.transitionUpto, t);
  }

  @Override
  public synchronized int getNumTransitions(int state) {
    DState dState = dStates[state];
    dState.determinizeFully();
    return dState.numSortedTransitions();
  }

  @Override
  public synchronized void getTransition(int state, int index, Transition t) {
    DState dState = dStates[state];
    dState.determinizeFully();
    t.source = state;
    t.transitionUpto = index;
    dState.fill(index, t);
  }

  @Override
  public synchronized long ramBytesUsed() {
    long size = BASE_RAM_BYTES
        + automaton.ramBytesUsed()
        + RamUsageEstimator.sizeOf(points)
        + RamUsageEstimator.sizeOf(classmap)
        + RamUsageEstimator.shallowSizeOfArray(dStates.length)
        + setToOrd.size() * RamUsageEstimator.HASHTABLE_RAM_BYTES_PER_ENTRY;
    for (int i = 0; i < setToOrd.size(); i++) {
      size += dStates[i].ramBytesUsed();
    }
    return size;
  }

  @Override
  public String toString() {
    return "NFARunAutomaton(numNFAStates=" + automaton.getNumStates() + ", numCharClasses=" + points.length
        + ", numDStates=" + getSize() + ")";
  }

  private final class DState {
    private final FrozenIntSet nfaStates;
    private final boolean isAccept;
    // per char class successor, allocated on the first step out of this state
    private int[] transitions;
    private int computedTransitions;
    // dest, min, max triples with adjacent classes merged; built by determinizeFully
    private int[] sortedTransitions;

    private DState(FrozenIntSet nfaStates) {
      this.nfaStates = nfaStates;
      boolean accept = false;
      for (int s : nfaStates.values) {
        if (automaton.isAccept(s)) {
          accept = true;
          break;
        }
      }
      this.isAccept = accept;
    }

    private int nextState(int charClass) {
      if (transitions == null) {
        transitions = new int[points.length];
        Arrays.fill(transitions, NOT_COMPUTED);
      }
      if (transitions[charClass] == NOT_COMPUTED) {
        // every label of a char class leads to the same NFA states, so its start point stands in for all
        transitions[charClass] = successor(points[charClass]);
        computedTransitions++;
      }
      return transitions[charClass];
    }

    private int successor(int label) {
      statesSet.reset();
      for (int nfaState : nfaStates.values) {
        int count = automaton.initTransition(nfaState, stepTransition);
        for (int i = 0; i < count; i++) {
          automaton.getNextTransition(stepTransition);
          if (stepTransition.min > label) {
            // sorted by min
            break;
          }
          if (stepTransition.max >= label) {
            statesSet.incr(stepTransition.dest);
          }
        }
      }
      if (statesSet.size() == 0) {
        return MISSING;
      }
      return findDState();
    }

    private void determinizeFully() {
      if (sortedTransitions != null) {
        return;
      }
      int[] buffer = new int[3 * points.length];
      int upto = 0;
      for (int charClass = 0; charClass < points.length; charClass++) {
        int dest = nextState(charClass);
        if (dest == MISSING) {
          continue;
        }
        int min = points[charClass];
        int max = charClass + 1 < points.length ? points[charClass + 1] - 1 : alphabetSize - 1;
        if (upto > 0 && buffer[upto - 3] == dest && buffer[upto - 1] == min - 1) {
          buffer[upto - 1] = max;
        } else {
          buffer[upto++] = dest;
          buffer[upto++] = min;
          buffer[upto++] = max;
        }
      }
      assert computedTransitions == points.length;
      sortedTransitions = ArrayUtil.copyOfSubArray(buffer, 0, upto);
    }

    private int numSortedTransitions() {
      return sortedTransitions.length / 3;
    }

    private void fill(int index, Transition t) {
      int i = 3 * index;
      t.dest = sortedTransitions[i];
      t.min = sortedTransitions[i + 1];
      t.max = sortedTransitions[i + 2];
    }

    private long ramBytesUsed() {
      long size = DSTATE_RAM_BYTES + RamUsageEstimator.sizeOf(nfaStates.values);
      if (transitions != null) {
        size += RamUsageEstimator.sizeOf(transitions);
      }
      if (sortedTransitions != null) {
        size += RamUsageEstimator.sizeOf(sortedTransitions);
      }
      return size;
    }

    @Override
    public String toString() {
      return "DState(" + nfaStates + ", accept=" + isAccept + ")";
    }
  }
}
