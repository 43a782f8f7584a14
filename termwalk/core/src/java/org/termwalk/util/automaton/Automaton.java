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
import java.util.BitSet;
import java.util.Objects;

import org.termwalk.util.Accountable;
import org.termwalk.util.ArrayUtil;
import org.termwalk.util.InPlaceMergeSorter;
import org.termwalk.util.RamUsageEstimator;
import org.termwalk.util.Sorter;

/** A finite automaton over int labels (Unicode code points, or bytes once
 *  converted).  States are ints handed out by {@link #createState}, and state 0
 *  is always the initial state.  Accept states are flagged with {@link
 *  #setAccept}.
 *
 *  <p>Transitions are appended with {@link #addTransition} and must be added
 *  one source state at a time: starting on a new source, or calling {@link
 *  #finishState}, freezes the previous source.  Freezing sorts that state's
 *  transitions by min, max then dest, and merges ranges that touch or overlap
 *  when they lead to the same dest.  Callers that discover transitions in
 *  arbitrary order should use {@link Automaton.Builder}.
 *
 *  <p>Storage is two flat arrays: {@code states} holds (offset, count) per
 *  state into {@code transitions}, which holds (dest, min, max) per
 *  transition.
 *
 * @termwalk.experimental */
public class Automaton implements Accountable, TransitionAccessor {

  private static final long BASE_RAM_BYTES = RamUsageEstimator.shallowSizeOfInstance(Automaton.class);

  /** Next write position in {@link #states}; advances by 2 per state. */
  private int nextState;

  /** Next write position in {@link #transitions}; advances by 3 per transition. */
  private int nextTransition;

  /** Source state currently receiving transitions, or -1. */
  private int curState = -1;

  /** For each state: offset of its first transition in {@link #transitions}
   *  (-1 until one is added), then its transition count. */
  private int[] states;

  private final BitSet isAccept;

  /** dest, min, max for each transition. */
  private int[] transitions;

  /** False once any state has two transitions with overlapping labels. */
  private boolean deterministic = true;

  /** Creates an automaton with no states. */
  public Automaton() {
    this(2, 2);
  }

  /**
   * Creates an automaton with room for the given number of states and
   * transitions before any array needs to grow.
   */
  public Automaton(int numStates, int numTransitions) {
    states = new int[numStates * 2];
    isAccept = new BitSet(numStates);
    transitions = new int[numTransitions * 3];
  }

  /** Allocates a new non-accepting state without transitions and returns its id. */
  public int createState() {
    if (nextState + 2 > states.length) {
      states = ArrayUtil.grow(states, nextState + 2);
    }
    int state = nextState / 2;
    states[nextState] = -1;
    states[nextState + 1] = 0;
    nextState += 2;
    return state;
  }

  /** Set or clear this state as an accept state. */
  public void setAccept(int state, boolean accept) {
    Objects.checkIndex(state, getNumStates());
    isAccept.set(state, accept);
  }

  /** Returns true if this state is an accept state. */
  public boolean isAccept(int state) {
    return isAccept.get(state);
  }

  /** Returns the accept bits; bit {@code s} is set when state {@code s} accepts. */
  BitSet getAcceptStates() {
    return isAccept;
  }

  /** Materializes every transition as a {@link Transition} object, indexed by
   *  source state.  Allocation heavy; prefer {@link #initTransition}. */
  public Transition[][] getSortedTransitions() {
    int numStates = getNumStates();
    Transition[][] result = new Transition[numStates][];
    for (int s = 0; s < numStates; s++) {
      int count = getNumTransitions(s);
      result[s] = new Transition[count];
      for (int i = 0; i < count; i++) {
        Transition t = new Transition();
        getTransition(s, i, t);
        result[s][i] = t;
      }
    }
    return result;
  }

  /** Adds a transition on the single label {@code label}. */
  public void addTransition(int source, int dest, int label) {
    addTransition(source, dest, label, label);
  }

  /** Adds a transition from {@code source} to {@code dest} on labels min..max (inclusive). */
  public void addTransition(int source, int dest, int min, int max) {
    assert nextTransition % 3 == 0;
    assert min <= max: "min=" + min + " max=" + max;

    int numStates = getNumStates();
    Objects.checkIndex(source, numStates);
    Objects.checkIndex(dest, numStates);

    if (curState != source) {
      if (curState != -1) {
        finishCurrentState();
      }
      if (states[2 * source] != -1) {
        throw new IllegalStateException("from state (" + source + ") already had transitions added");
      }
      assert states[2 * source + 1] == 0;
      curState = source;
      states[2 * source] = nextTransition;
    }

    if (nextTransition + 3 > transitions.length) {
      transitions = ArrayUtil.grow(transitions, nextTransition + 3);
    }
    transitions[nextTransition++] = dest;
    transitions[nextTransition++] = min;
    transitions[nextTransition++] = max;
    states[2 * curState + 1]++;
  }

  /** Simulates an epsilon transition from {@code source} to {@code dest} by
   *  copying dest's transitions and accept bit onto source.  The transitions
   *  of {@code dest} must already be complete. */
  public void addEpsilon(int source, int dest) {
    Transition t = new Transition();
    int count = initTransition(dest, t);
    for (int i = 0; i < count; i++) {
      getNextTransition(t);
      addTransition(source, t.dest, t.min, t.max);
    }
    if (isAccept(dest)) {
      setAccept(source, true);
    }
  }

  /** Appends all states and transitions of {@code other}; its state {@code s}
   *  becomes {@code getNumStates() + s} here. */
  public void copy(Automaton other) {
    int stateOffset = getNumStates();

    states = ArrayUtil.grow(states, nextState + other.nextState);
    System.arraycopy(other.states, 0, states, nextState, other.nextState);
    for (int i = 0; i < other.nextState; i += 2) {
      if (states[nextState + i] != -1) {
        states[nextState + i] += nextTransition;
      }
    }
    nextState += other.nextState;

    BitSet otherAccept = other.getAcceptStates();
    for (int s = otherAccept.nextSetBit(0); s != -1 && s < other.getNumStates(); s = otherAccept.nextSetBit(s + 1)) {
      setAccept(stateOffset + s, true);
    }

    transitions = ArrayUtil.grow(transitions, nextTransition + other.nextTransition);
    System.arraycopy(other.transitions, 0, transitions, nextTransition, other.nextTransition);
    for (int i = 0; i < other.nextTransition; i += 3) {
      transitions[nextTransition + i] += stateOffset;
    }
    nextTransition += other.nextTransition;

    if (other.deterministic == false) {
      deterministic = false;
    }
  }

  /** Sorts, merges and re-checks the transitions of {@link #curState}. */
  private void finishCurrentState() {
    int count = states[2 * curState + 1];
    assert count > 0;

    int offset = states[2 * curState];
    int first = offset / 3;
    destMinMaxSorter.sort(first, first + count);

    // Merge runs to the same dest whose ranges touch or overlap
    int upto = 0;
    int dest = -1;
    int min = -1;
    int max = -1;
    for (int i = 0; i < count; i++) {
      int tDest = transitions[offset + 3 * i];
      int tMin = transitions[offset + 3 * i + 1];
      int tMax = transitions[offset + 3 * i + 2];
      if (dest == tDest && tMin <= max + 1) {
        max = Math.max(max, tMax);
        continue;
      }
      if (dest != -1) {
        writeTransition(offset, upto++, dest, min, max);
      }
      dest = tDest;
      min = tMin;
      max = tMax;
    }
    if (dest != -1) {
      writeTransition(offset, upto++, dest, min, max);
    }

    nextTransition -= (count - upto) * 3;
    states[2 * curState + 1] = upto;

    minMaxDestSorter.sort(first, first + upto);

    if (deterministic) {
      int lastMax = transitions[offset + 2];
      for (int i = 1; i < upto; i++) {
        if (transitions[offset + 3 * i + 1] <= lastMax) {
          deterministic = false;
          break;
        }
        lastMax = transitions[offset + 3 * i + 2];
      }
    }
  }

  private void writeTransition(int offset, int index, int dest, int min, int max) {
    int i = offset + 3 * index;
    transitions[i] = dest;
    transitions[i + 1] = min;
    transitions[i + 2] = max;
  }

  /** Returns true if no state has two transitions sharing a label. */
  public boolean isDeterministic() {
    return deterministic;
  }

  /** Freezes the state currently receiving transitions.  Starting a new
   *  source state does this implicitly; call it after the last one. */
  public void finishState() {
    if (curState != -1) {
      finishCurrentState();
      curState = -1;
    }
  }

  /** Number of states. */
  public int getNumStates() {
    return nextState / 2;
  }

  /** Total number of transitions across all states. */
  public int getNumTransitions() {
    return nextTransition / 3;
  }

  @Override
  public int getNumTransitions(int state) {
    Objects.checkIndex(state, getNumStates());
    return states[2 * state + 1];
  }

  /** Orders packed (dest, min, max) triples; subclasses pick the key order. */
  private abstract class TripleSorter extends InPlaceMergeSorter {
    @Override
    protected void swap(int i, int j) {
      int a = 3 * i;
      int b = 3 * j;
      for (int k = 0; k < 3; k++) {
        int x = transitions[a + k];
        transitions[a + k] = transitions[b + k];
        transitions[b + k] = x;
      }
    }

    /** Compares field {@code field} (0=dest, 1=min, 2=max) of triples i and j. */
    int compareField(int i, int j, int field) {
      return Integer.compare(transitions[3 * i + field], transitions[3 * j + field]);
    }
  }

  /** dest, then min, then max */
  private final Sorter destMinMaxSorter = new TripleSorter() {
    @Override
    protected int compare(int i, int j) {
      int cmp = compareField(i, j, 0);
      if (cmp == 0) {
        cmp = compareField(i, j, 1);
        if (cmp == 0) {
          cmp = compareField(i, j, 2);
        }
      }
      return cmp;
    }
  };

  /** min, then max, then dest */
  private final Sorter minMaxDestSorter = new TripleSorter() {
    @Override
    protected int compare(int i, int j) {
      int cmp = compareField(i, j, 1);
      if (cmp == 0) {
        cmp = compareField(i, j, 2);
        if (cmp == 0) {
          cmp = compareField(i, j, 0);
        }
      }
      return cmp;
    }
  };

  @Override
  public int initTransition(int state, Transition t) {
    Objects.checkIndex(state, getNumStates());
    t.source = state;
    t.transitionUpto = states[2 * state];
    return getNumTransitions(state);
  }

  @Override
  public void getNextTransition(Transition t) {
    assert (t.transitionUpto + 3 - states[2 * t.source]) <= 3 * states[2 * t.source + 1];
    assert transitionSorted(t);
    t.dest = transitions[t.transitionUpto++];
    t.min = transitions[t.transitionUpto++];
    t.max = transitions[t.transitionUpto++];
  }

  /** True if the transition at {@code t.transitionUpto} sorts strictly after {@code t}. */
  private boolean transitionSorted(Transition t) {
    int upto = t.transitionUpto;
    if (upto == states[2 * t.source]) {
      // first transition, nothing to compare with
      return true;
    }
    int nextMin = transitions[upto + 1];
    if (nextMin != t.min) {
      return nextMin > t.min;
    }
    int nextMax = transitions[upto + 2];
    if (nextMax != t.max) {
      return nextMax > t.max;
    }
    return transitions[upto] > t.dest;
  }

  @Override
  public void getTransition(int state, int index, Transition t) {
    assert index >= 0 && index < getNumTransitions(state): "index=" + index + " state=" + state;
    int i = states[2 * state] + 3 * index;
    t.source = state;
    t.dest = transitions[i++];
    t.min = transitions[i++];
    t.max = transitions[i];
  }

  /** Appends a printable form of label {@code c}: printable ASCII as is,
   *  anything else as an escaped 8 digit hex code. */
  static void appendCharString(int c, StringBuilder b) {
    if (c >= 0x21 && c <= 0x7e && c != '\\' && c != '"') {
      b.appendCodePoint(c);
    } else {
      String hex = Integer.toHexString(c);
      b.append("\\\\U");
      for (int pad = hex.length(); pad < 8; pad++) {
        b.append('0');
      }
      b.append(hex);
    }
  }

  /** Renders this automaton in graphviz dot syntax. */
  public String toDot() {
    StringBuilder b = new StringBuilder();
    b.append("digraph Automaton {\n");
    b.append("  rankdir = LR\n");
    b.append("  node [width=0.2, height=0.2, fontsize=8]\n");
    final int numStates = getNumStates();
    if (numStates > 0) {
      b.append("  initial [shape=plaintext,label=\"\"]\n");
      b.append("  initial -> 0\n");
    }

    Transition t = new Transition();
    for (int state = 0; state < numStates; state++) {
      String shape = isAccept(state) ? "doublecircle" : "circle";
      b.append("  ").append(state).append(" [shape=").append(shape).append(",label=\"").append(state).append("\"]\n");
      int count = initTransition(state, t);
      for (int i = 0; i < count; i++) {
        getNextTransition(t);
        b.append("  ").append(state).append(" -> ").append(t.dest).append(" [label=\"");
        appendCharString(t.min, b);
        if (t.max != t.min) {
          b.append('-');
          appendCharString(t.max, b);
        }
        b.append("\"]\n");
      }
    }
    b.append('}');
    return b.toString();
  }

  /**
   * Returns the sorted start points of the label intervals on which every
   * state behaves uniformly: each transition contributes its min and max+1.
   * Always contains 0.
   */
  int[] getStartPoints() {
    int[] points = new int[2 * getNumTransitions() + 1];
    int count = 0;
    points[count++] = Character.MIN_CODE_POINT;
    for (int s = 0; s < nextState; s += 2) {
      int trans = states[s];
      int limit = trans + 3 * states[s + 1];
      for (; trans < limit; trans += 3) {
        points[count++] = transitions[trans + 1];
        int max = transitions[trans + 2];
        if (max < Character.MAX_CODE_POINT) {
          points[count++] = max + 1;
        }
      }
    }
    Arrays.sort(points, 0, count);
    int unique = 0;
    for (int i = 0; i < count; i++) {
      if (unique == 0 || points[i] != points[unique - 1]) {
        points[unique++] = points[i];
      }
    }
    return ArrayUtil.copyOfSubArray(points, 0, unique);
  }

  /**
   * Returns the destination reached from {@code state} on {@code label}, or -1.
   * Assumes this automaton is deterministic.
   */
  public int step(int state, int label) {
    return next(state, 0, label, null);
  }

  /**
   * Like {@link #step(int, int)}, but resumes the search at {@code
   * transition.transitionUpto} and leaves there the index of the match (or
   * the insertion point when nothing matches).  Useful for ascending labels
   * from one source.  {@code transition} receives the matching dest, min and
   * max; dest is -1 when nothing matches.
   */
  public int next(Transition transition, int label) {
    return next(transition.source, transition.transitionUpto, label, transition);
  }

  private int next(int state, int fromIndex, int label, Transition transition) {
    assert state >= 0;
    assert label >= 0;
    int offset = states[2 * state];
    int low = Math.max(fromIndex, 0);
    int high = states[2 * state + 1] - 1;
    while (low <= high) {
      int mid = (low + high) >>> 1;
      int i = offset + 3 * mid;
      if (transitions[i + 1] > label) {
        high = mid - 1;
      } else if (transitions[i + 2] < label) {
        low = mid + 1;
      } else {
        int dest = transitions[i];
        if (transition != null) {
          transition.dest = dest;
          transition.min = transitions[i + 1];
          transition.max = transitions[i + 2];
          transition.transitionUpto = mid;
        }
        return dest;
      }
    }
    if (transition != null) {
      transition.dest = -1;
      transition.transitionUpto = low;
    }
    return -1;
  }

  @Override
  public String toString() {
    return "Automaton(numStates=" + getNumStates() + ", numTransitions=" + getNumTransitions()
        + ", deterministic=" + deterministic + ")";
  }

  /** Collects states, accept bits and transitions in any order, then
   *  {@link #finish} produces the {@link Automaton}.  Transitions are
   *  buffered as (source, dest, min, max) and replayed sorted by source. */
  public static class Builder {
    private int nextState = 0;
    private final BitSet isAccept;
    private int[] transitions;
    private int nextTransition = 0;

    /** Pre-allocates for 16 states and transitions. */
    public Builder() {
      this(16, 16);
    }

    /** Pre-allocates for the given number of states and transitions. */
    public Builder(int numStates, int numTransitions) {
      isAccept = new BitSet(numStates);
      transitions = new int[numTransitions * 4];
    }

    /** Adds a transition on the single label {@code label}. */
    public void addTransition(int source, int dest, int label) {
      addTransition(source, dest, label, label);
    }

    /** Buffers a transition; states may be visited in any order. */
    public void addTransition(int source, int dest, int min, int max) {
      assert min <= max: "min=" + min + " max=" + max;
      if (transitions.length < nextTransition + 4) {
        transitions = ArrayUtil.grow(transitions, nextTransition + 4);
      }
      transitions[nextTransition++] = source;
      transitions[nextTransition++] = dest;
      transitions[nextTransition++] = min;
      transitions[nextTransition++] = max;
    }

    /** Copies the transitions buffered so far for {@code dest}, and its accept
     *  bit, onto {@code source}. */
    public void addEpsilon(int source, int dest) {
      int limit = nextTransition;
      for (int upto = 0; upto < limit; upto += 4) {
        if (transitions[upto] == dest) {
          addTransition(source, transitions[upto + 1], transitions[upto + 2], transitions[upto + 3]);
        }
      }
      if (isAccept(dest)) {
        setAccept(source, true);
      }
    }

    /** source, then min, then max, then dest */
    private final Sorter sorter = new InPlaceMergeSorter() {
      @Override
      protected void swap(int i, int j) {
        int a = 4 * i;
        int b = 4 * j;
        for (int k = 0; k < 4; k++) {
          int x = transitions[a + k];
          transitions[a + k] = transitions[b + k];
          transitions[b + k] = x;
        }
      }

      @Override
      protected int compare(int i, int j) {
        int a = 4 * i;
        int b = 4 * j;
        int cmp = Integer.compare(transitions[a], transitions[b]);
        if (cmp == 0) {
          cmp = Integer.compare(transitions[a + 2], transitions[b + 2]);
          if (cmp == 0) {
            cmp = Integer.compare(transitions[a + 3], transitions[b + 3]);
            if (cmp == 0) {
              cmp = Integer.compare(transitions[a + 1], transitions[b + 1]);
            }
          }
        }
        return cmp;
      }
    };

    /** Creates every state, sorts the buffered transitions and replays them
     *  into a new {@link Automaton}. */
    public Automaton finish() {
      int numStates = nextState;
      int numTransitions = nextTransition / 4;
      Automaton a = new Automaton(numStates, numTransitions);
      for (int state = 0; state < numStates; state++) {
        a.createState();
        a.setAccept(state, isAccept(state));
      }

      sorter.sort(0, numTransitions);
      for (int upto = 0; upto < nextTransition; upto += 4) {
        a.addTransition(transitions[upto], transitions[upto + 1], transitions[upto + 2], transitions[upto + 3]);
      }
      a.finishState();
      return a;
    }

    /** Allocates a new state id. */
    public int createState() {
      return nextState++;
    }

    /** Set or clear this state as an accept state. */
    public void setAccept(int state, boolean accept) {
      Objects.checkIndex(state, getNumStates());
      isAccept.set(state, accept);
    }

    /** Returns true if this state is an accept state. */
    public boolean isAccept(int state) {
      return isAccept.get(state);
    }

    /** Number of states created so far. */
    public int getNumStates() {
      return nextState;
    }

    /** Appends all states and transitions of {@code other}, shifted past the
     *  states created so far. */
    public void copy(Automaton other) {
      int offset = getNumStates();
      int otherNumStates = other.getNumStates();
      copyStates(other);
      Transition t = new Transition();
      for (int s = 0; s < otherNumStates; s++) {
        int count = other.initTransition(s, t);
        for (int i = 0; i < count; i++) {
          other.getNextTransition(t);
          addTransition(offset + s, offset + t.dest, t.min, t.max);
        }
      }
    }

    /** Appends the states (accept bits only) of {@code other}. */
    public void copyStates(Automaton other) {
      int otherNumStates = other.getNumStates();
      for (int s = 0; s < otherNumStates; s++) {
        int newState = createState();
        setAccept(newState, other.isAccept(s));
      }
    }
  }

  @Override
  public long ramBytesUsed() {
    // BitSet words are not exposed; size() is its capacity in bits
    return BASE_RAM_BYTES
        + RamUsageEstimator.sizeOf(states)
        + RamUsageEstimator.sizeOf(transitions)
        + RamUsageEstimator.NUM_BYTES_OBJECT_HEADER + RamUsageEstimator.alignObjectSize(isAccept.size() / 8);
  }
}
