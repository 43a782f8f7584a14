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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

import com.carrotsearch.hppc.BitMixer;
import org.termwalk.util.ArrayUtil;
import org.termwalk.util.BytesRef;
import org.termwalk.util.BytesRefBuilder;
import org.termwalk.util.IntsRef;
import org.termwalk.util.IntsRefBuilder;

/**
 * Automata operations: the algebra over {@link Automaton}s, determinization,
 * dead state analysis and language queries.
 *
 * <p>Unless stated otherwise the inputs are not modified and may be returned
 * as is when the result would be identical.
 *
 * @termwalk.experimental
 */
public final class Operations {
  /**
   * Default maximum effort that {@link #determinize} may spend before giving up
   * with {@link TooComplexToDeterminizeException}.
   */
  public static final int DEFAULT_DETERMINIZE_WORK_LIMIT = 10000;

  private Operations() {}

  /**
   * Returns an automaton that accepts the concatenation of the languages of the
   * given automata.
   *
   * <p>Complexity: linear in total number of states.
   */
  public static Automaton concatenate(Automaton a1, Automaton a2) {
    return concatenate(Arrays.asList(a1, a2));
  }

  /**
   * Returns an automaton that accepts the concatenation of the languages of the
   * given automata, in order.
   *
   * <p>Complexity: linear in total number of states.
   */
  public static Automaton concatenate(List<Automaton> l) {
    Automaton result = new Automaton();

    // First pass: create all states; any empty operand empties the result
    for (Automaton a : l) {
      if (a.getNumStates() == 0) {
        result.finishState();
        return result;
      }
      int numStates = a.getNumStates();
      for (int s = 0; s < numStates; s++) {
        result.createState();
      }
    }

    // Second pass: copy transitions, and link each accept state to the
    // initial state of the following operands
    int stateOffset = 0;
    Transition t = new Transition();
    for (int i = 0; i < l.size(); i++) {
      Automaton a = l.get(i);
      int numStates = a.getNumStates();
      Automaton nextA = (i == l.size() - 1) ? null : l.get(i + 1);

      for (int s = 0; s < numStates; s++) {
        int count = a.initTransition(s, t);
        for (int j = 0; j < count; j++) {
          a.getNextTransition(t);
          result.addTransition(stateOffset + s, stateOffset + t.dest, t.min, t.max);
        }

        if (a.isAccept(s)) {
          Automaton followA = nextA;
          int followOffset = stateOffset;
          int upto = i + 1;
          while (true) {
            if (followA == null) {
              // accepting all the way to the end
              result.setAccept(stateOffset + s, true);
              break;
            }
            count = followA.initTransition(0, t);
            for (int j = 0; j < count; j++) {
              followA.getNextTransition(t);
              result.addTransition(stateOffset + s, followOffset + numStates + t.dest, t.min, t.max);
            }
            if (followA.isAccept(0) == false) {
              break;
            }
            // followA matches the empty string: keep threading into the next operand
            followOffset += followA.getNumStates();
            followA = (upto == l.size() - 1) ? null : l.get(upto + 1);
            upto++;
          }
        }
      }

      stateOffset += numStates;
    }

    if (result.getNumStates() == 0) {
      result.createState();
    }

    result.finishState();
    return result;
  }

  /**
   * Returns an automaton that accepts the union of the empty string and the
   * language of the given automaton.  This may create a dead state.
   *
   * <p>Complexity: linear in number of states.
   */
  public static Automaton optional(Automaton a) {
    Automaton result = new Automaton();
    result.createState();
    result.setAccept(0, true);
    if (a.getNumStates() > 0) {
      result.copy(a);
      result.addEpsilon(0, 1);
    }
    result.finishState();
    return result;
  }

  /**
   * Returns an automaton that accepts the Kleene star (zero or more
   * concatenated repetitions) of the language of the given automaton.
   *
   * <p>Complexity: linear in number of states.
   */
  public static Automaton repeat(Automaton a) {
    if (a.getNumStates() == 0) {
      // zero repetitions of the empty language
      return Automata.makeEmptyString();
    }
    Automaton.Builder builder = new Automaton.Builder();
    builder.createState();
    builder.setAccept(0, true);
    builder.copy(a);

    // new initial state behaves like the old one, and accepts
    Transition t = new Transition();
    int count = a.initTransition(0, t);
    for (int i = 0; i < count; i++) {
      a.getNextTransition(t);
      builder.addTransition(0, t.dest + 1, t.min, t.max);
    }

    // every accept state may start over
    int numStates = a.getNumStates();
    for (int s = 0; s < numStates; s++) {
      if (a.isAccept(s)) {
        count = a.initTransition(0, t);
        for (int i = 0; i < count; i++) {
          a.getNextTransition(t);
          builder.addTransition(s + 1, t.dest + 1, t.min, t.max);
        }
      }
    }

    return builder.finish();
  }

  /**
   * Returns an automaton that accepts <code>min</code> or more concatenated
   * repetitions of the language of the given automaton.
   *
   * <p>Complexity: linear in number of states and in <code>min</code>.
   */
  public static Automaton repeat(Automaton a, int count) {
    if (count == 0) {
      return repeat(a);
    }
    List<Automaton> as = new ArrayList<>();
    while (count-- > 0) {
      as.add(a);
    }
    as.add(repeat(a));
    return concatenate(as);
  }

  /**
   * Returns an automaton that accepts between <code>min</code> and
   * <code>max</code> (including both) concatenated repetitions of the language
   * of the given automaton.  An empty automaton is returned when {@code min > max}.
   *
   * <p>Complexity: linear in number of states and in <code>min</code> and
   * <code>max</code>.
   */
  public static Automaton repeat(Automaton a, int min, int max) {
    if (min > max) {
      return Automata.makeEmpty();
    }
    if (a.getNumStates() == 0) {
      return min == 0 ? Automata.makeEmptyString() : Automata.makeEmpty();
    }

    Automaton b;
    if (min == 0) {
      b = Automata.makeEmptyString();
    } else if (min == 1) {
      b = new Automaton();
      b.copy(a);
    } else {
      List<Automaton> as = new ArrayList<>();
      for (int i = 0; i < min; i++) {
        as.add(a);
      }
      b = concatenate(as);
    }

    // each optional repetition hangs off the accept states of the previous one
    List<Integer> prevAcceptStates = acceptStates(b, 0);
    Automaton.Builder builder = new Automaton.Builder();
    builder.copy(b);
    for (int i = min; i < max; i++) {
      int numStates = builder.getNumStates();
      builder.copy(a);
      for (int s : prevAcceptStates) {
        builder.addEpsilon(s, numStates);
      }
      prevAcceptStates = acceptStates(a, numStates);
    }

    return builder.finish();
  }

  private static List<Integer> acceptStates(Automaton a, int offset) {
    int numStates = a.getNumStates();
    BitSet isAccept = a.getAcceptStates();
    List<Integer> result = new ArrayList<>();
    for (int s = isAccept.nextSetBit(0); s != -1 && s < numStates; s = isAccept.nextSetBit(s + 1)) {
      result.add(offset + s);
    }
    return result;
  }

  /**
   * Returns a (deterministic) automaton that accepts the complement of the
   * language of the given automaton over the full code point alphabet.
   *
   * <p>Complexity: linear in number of states if already deterministic and
   * exponential otherwise.
   *
   * @param determinizeWorkLimit maximum effort to spend determinizing
   * @throws TooComplexToDeterminizeException if determinizing needs more effort
   */
  public static Automaton complement(Automaton a, int determinizeWorkLimit) {
    a = totalize(determinize(a, determinizeWorkLimit), Character.MIN_CODE_POINT, Character.MAX_CODE_POINT);
    int numStates = a.getNumStates();
    for (int p = 0; p < numStates; p++) {
      a.setAccept(p, !a.isAccept(p));
    }
    return removeDeadStates(a);
  }

  /**
   * Returns a (deterministic) automaton that accepts the intersection of the
   * language of <code>a1</code> and the complement of the language of
   * <code>a2</code>.
   *
   * <p>Complexity: quadratic in number of states if a2 already deterministic
   * and exponential in number of a2's states otherwise.
   *
   * @throws TooComplexToDeterminizeException if determinizing a2 needs more effort
   */
  public static Automaton minus(Automaton a1, Automaton a2, int determinizeWorkLimit) {
    if (Operations.isEmpty(a1) || a1 == a2) {
      return Automata.makeEmpty();
    }
    if (Operations.isEmpty(a2)) {
      return a1;
    }
    return intersection(a1, complement(a2, determinizeWorkLimit));
  }

  /**
   * Returns an automaton that accepts the intersection of the languages of the
   * given automata.  Never modifies the input automata languages.
   *
   * <p>Complexity: quadratic in number of states.
   */
  public static Automaton intersection(Automaton a1, Automaton a2) {
    if (a1 == a2) {
      return a1;
    }
    if (a1.getNumStates() == 0) {
      return a1;
    }
    if (a2.getNumStates() == 0) {
      return a2;
    }
    Transition[][] transitions1 = a1.getSortedTransitions();
    Transition[][] transitions2 = a2.getSortedTransitions();
    Automaton c = new Automaton();
    c.createState();
    ArrayDeque<StatePair> worklist = new ArrayDeque<>();
    HashMap<StatePair, StatePair> newstates = new HashMap<>();
    StatePair p = new StatePair(0, 0, 0);
    worklist.add(p);
    newstates.put(p, p);
    while (worklist.size() > 0) {
      p = worklist.removeFirst();
      c.setAccept(p.s, a1.isAccept(p.s1) && a2.isAccept(p.s2));
      Transition[] t1 = transitions1[p.s1];
      Transition[] t2 = transitions2[p.s2];
      for (int n1 = 0, b2 = 0; n1 < t1.length; n1++) {
        while (b2 < t2.length && t2[b2].max < t1[n1].min) {
          b2++;
        }
        for (int n2 = b2; n2 < t2.length && t1[n1].max >= t2[n2].min; n2++) {
          if (t2[n2].max >= t1[n1].min) {
            StatePair q = new StatePair(t1[n1].dest, t2[n2].dest);
            StatePair r = newstates.get(q);
            if (r == null) {
              q.s = c.createState();
              worklist.add(q);
              newstates.put(q, q);
              r = q;
            }
            int min = Math.max(t1[n1].min, t2[n2].min);
            int max = Math.min(t1[n1].max, t2[n2].max);
            c.addTransition(p.s, r.s, min, max);
          }
        }
      }
    }
    c.finishState();

    return removeDeadStates(c);
  }

  /**
   * Returns true if these two automata accept exactly the same language.  This
   * is a costly computation!  Both automata must be determinized and have no
   * dead states!
   */
  public static boolean sameLanguage(Automaton a1, Automaton a2) {
    if (a1 == a2) {
      return true;
    }
    return subsetOf(a2, a1) && subsetOf(a1, a2);
  }

  /** Returns true if the automaton has any states that cannot be reached
   *  from the initial state or cannot reach an accept state. */
  public static boolean hasDeadStates(Automaton a) {
    BitSet liveStates = getLiveStates(a);
    int numLive = liveStates.cardinality();
    int numStates = a.getNumStates();
    assert numLive <= numStates: "numLive=" + numLive + " numStates=" + numStates + " " + liveStates;
    return numLive < numStates;
  }

  /** Returns true if there are dead states reachable from an initial state. */
  public static boolean hasDeadStatesFromInitial(Automaton a) {
    BitSet reachableFromInitial = getLiveStatesFromInitial(a);
    BitSet reachableFromAccept = getLiveStatesToAccept(a);
    reachableFromInitial.andNot(reachableFromAccept);
    return reachableFromInitial.isEmpty() == false;
  }

  /** Returns true if there are dead states that reach an accept state. */
  public static boolean hasDeadStatesToAccept(Automaton a) {
    BitSet reachableFromInitial = getLiveStatesFromInitial(a);
    BitSet reachableFromAccept = getLiveStatesToAccept(a);
    reachableFromAccept.andNot(reachableFromInitial);
    return reachableFromAccept.isEmpty() == false;
  }

  /**
   * Returns true if the language of <code>a1</code> is a subset of the language
   * of <code>a2</code>.  Both automata must be determinized and must have no
   * dead states.
   *
   * <p>Complexity: quadratic in number of states.
   *
   * @throws IllegalArgumentException if either automaton is not deterministic
   */
  public static boolean subsetOf(Automaton a1, Automaton a2) {
    if (a1.isDeterministic() == false) {
      throw new IllegalArgumentException("a1 must be deterministic");
    }
    if (a2.isDeterministic() == false) {
      throw new IllegalArgumentException("a2 must be deterministic");
    }
    assert hasDeadStatesFromInitial(a1) == false;
    assert hasDeadStatesFromInitial(a2) == false;
    if (a1.getNumStates() == 0) {
      // the empty language is a subset of every language
      return true;
    } else if (a2.getNumStates() == 0) {
      return isEmpty(a1);
    }

    Transition[][] transitions1 = a1.getSortedTransitions();
    Transition[][] transitions2 = a2.getSortedTransitions();
    ArrayDeque<StatePair> worklist = new ArrayDeque<>();
    HashSet<StatePair> visited = new HashSet<>();
    StatePair p = new StatePair(0, 0);
    worklist.add(p);
    visited.add(p);
    while (worklist.size() > 0) {
      p = worklist.removeFirst();
      if (a1.isAccept(p.s1) && a2.isAccept(p.s2) == false) {
        return false;
      }
      Transition[] t1 = transitions1[p.s1];
      Transition[] t2 = transitions2[p.s2];
      for (int n1 = 0, b2 = 0; n1 < t1.length; n1++) {
        while (b2 < t2.length && t2[b2].max < t1[n1].min) {
          b2++;
        }
        // labels of t1[n1] not yet covered by a2 are [min1, max1]
        int min1 = t1[n1].min, max1 = t1[n1].max;

        for (int n2 = b2; n2 < t2.length && t1[n1].max >= t2[n2].min; n2++) {
          if (t2[n2].min > min1) {
            return false;
          }
          if (t2[n2].max < Character.MAX_CODE_POINT) {
            min1 = t2[n2].max + 1;
          } else {
            min1 = Character.MAX_CODE_POINT;
            max1 = Character.MIN_CODE_POINT;
          }
          StatePair q = new StatePair(t1[n1].dest, t2[n2].dest);
          if (visited.add(q)) {
            worklist.add(q);
          }
        }
        if (min1 <= max1) {
          return false;
        }
      }
    }
    return true;
  }

  /**
   * Returns an automaton that accepts the union of the languages of the given
   * automata.
   *
   * <p>Complexity: linear in number of states.
   */
  public static Automaton union(Automaton a1, Automaton a2) {
    return union(Arrays.asList(a1, a2));
  }

  /**
   * Returns an automaton that accepts the union of the languages of the given
   * automata.
   *
   * <p>Complexity: linear in number of states.
   */
  public static Automaton union(Collection<Automaton> l) {
    Automaton result = new Automaton();

    // new initial state, followed by every operand
    result.createState();
    for (Automaton a : l) {
      result.copy(a);
    }

    int stateOffset = 1;
    for (Automaton a : l) {
      if (a.getNumStates() == 0) {
        continue;
      }
      result.addEpsilon(0, stateOffset);
      stateOffset += a.getNumStates();
    }

    result.finishState();

    return removeDeadStates(result);
  }

  /** Growable list of packed (dest, min, max) triples. */
  private static final class TransitionList {
    int[] transitions = new int[3];
    int next;

    void add(Transition t) {
      if (transitions.length < next + 3) {
        transitions = ArrayUtil.grow(transitions, next + 3);
      }
      transitions[next] = t.dest;
      transitions[next + 1] = t.min;
      transitions[next + 2] = t.max;
      next += 3;
    }
  }

  /** Transitions that start at {@link #point}, or end at point-1. */
  private static final class PointTransitions implements Comparable<PointTransitions> {
    int point;
    final TransitionList ends = new TransitionList();
    final TransitionList starts = new TransitionList();

    @Override
    public int compareTo(PointTransitions other) {
      return Integer.compare(point, other.point);
    }

    void reset(int point) {
      this.point = point;
      ends.next = 0;
      starts.next = 0;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof PointTransitions && ((PointTransitions) other).point == point;
    }

    @Override
    public int hashCode() {
      return point;
    }
  }

  /**
   * The interval boundaries of one subset's outgoing transitions.  Points are
   * registered on demand by {@link #add}, so every transition's min and max+1
   * is always present before the sweep.  Linear scan while small, then a hash
   * map.  Instances are reused across subsets through {@link #reset}.
   */
  private static final class PointTransitionSet {
    private static final int HASHMAP_CUTOVER = 30;

    int count;
    PointTransitions[] points = new PointTransitions[5];
    private final HashMap<Integer, PointTransitions> map = new HashMap<>();
    private boolean useHash = false;

    private PointTransitions next(int point) {
      if (count == points.length) {
        points = ArrayUtil.grow(points, 1 + count);
      }
      PointTransitions p = points[count];
      if (p == null) {
        p = points[count] = new PointTransitions();
      }
      p.reset(point);
      count++;
      return p;
    }

    private PointTransitions find(int point) {
      if (useHash) {
        return map.computeIfAbsent(point, this::next);
      }
      for (int i = 0; i < count; i++) {
        if (points[i].point == point) {
          return points[i];
        }
      }
      PointTransitions p = next(point);
      if (count == HASHMAP_CUTOVER) {
        assert map.isEmpty();
        for (int i = 0; i < count; i++) {
          map.put(points[i].point, points[i]);
        }
        useHash = true;
      }
      return p;
    }

    void reset() {
      if (useHash) {
        map.clear();
        useHash = false;
      }
      count = 0;
    }

    void sort() {
      // points are usually already (nearly) sorted
      if (count > 1) {
        ArrayUtil.timSort(points, 0, count);
      }
    }

    void add(Transition t) {
      find(t.min).starts.add(t);
      find(1 + t.max).ends.add(t);
    }

    @Override
    public String toString() {
      StringBuilder s = new StringBuilder();
      for (int i = 0; i < count; i++) {
        if (i > 0) {
          s.append(' ');
        }
        s.append(points[i].point).append(':').append(points[i].starts.next / 3).append(',').append(points[i].ends.next / 3);
      }
      return s.toString();
    }
  }

  /**
   * Determinizes the given automaton by subset construction.
   *
   * <p>Worst case complexity: exponential in number of states.  Each subset
   * taken off the worklist costs its size; once the accumulated cost reaches
   * {@code workLimit * 10} this gives up.
   *
   * @param workLimit maximum amount of "work" that the powerset construction
   *     will spend before throwing {@link TooComplexToDeterminizeException}.
   *     Higher numbers allow this operation to consume more computation but
   *     allow more complex automatons.  Use {@link
   *     #DEFAULT_DETERMINIZE_WORK_LIMIT} as a decent default if you don't
   *     otherwise know what to specify.
   * @throws TooComplexToDeterminizeException if determinizing requires more
   *     than {@code workLimit} "effort"
   */
  public static Automaton determinize(Automaton a, int workLimit) {
    if (a.isDeterministic()) {
      return a;
    }
    if (a.getNumStates() <= 1) {
      return a;
    }

    Automaton.Builder b = new Automaton.Builder();

    // hashes the same way a StateSet holding only state 0 does
    FrozenIntSet initialset = new FrozenIntSet(new int[] {0}, 1L + BitMixer.mix(0), 0);

    b.createState();

    ArrayDeque<FrozenIntSet> worklist = new ArrayDeque<>();
    Map<IntSet, Integer> newstate = new HashMap<>();

    worklist.add(initialset);

    b.setAccept(0, a.isAccept(0));
    newstate.put(initialset, 0);

    final PointTransitionSet points = new PointTransitionSet();

    // NFA state -> number of open intervals leading to it
    final StateSet statesSet = new StateSet(5);

    Transition t = new Transition();

    long effortSpent = 0;
    final long effortLimit = workLimit * 10L;

    while (worklist.size() > 0) {
      FrozenIntSet s = worklist.removeFirst();

      effortSpent += s.values.length;
      if (effortSpent >= effortLimit) {
        throw new TooComplexToDeterminizeException(a, workLimit);
      }

      // Collate all outgoing transitions by min/1+max:
      for (int i = 0; i < s.values.length; i++) {
        final int s0 = s.values[i];
        int numTransitions = a.initTransition(s0, t);
        for (int j = 0; j < numTransitions; j++) {
          a.getNextTransition(t);
          points.add(t);
        }
      }

      if (points.count == 0) {
        // no outgoing transitions
        continue;
      }

      points.sort();

      int lastPoint = -1;
      int accCount = 0;

      final int r = s.state;

      for (int i = 0; i < points.count; i++) {

        final int point = points.points[i].point;

        if (statesSet.size() > 0) {
          assert lastPoint != -1;

          Integer q = newstate.get(statesSet);
          if (q == null) {
            q = b.createState();
            final FrozenIntSet p = statesSet.freeze(q);
            worklist.add(p);
            b.setAccept(q, accCount > 0);
            newstate.put(p, q);
          } else {
            assert (accCount > 0) == b.isAccept(q): "accCount=" + accCount + " vs existing accept=" +
              b.isAccept(q) + " states=" + Arrays.toString(statesSet.getArray());
          }

          b.addTransition(r, q, lastPoint, point - 1);
        }

        // close the intervals that end just before this point
        int[] transitions = points.points[i].ends.transitions;
        int limit = points.points[i].ends.next;
        for (int j = 0; j < limit; j += 3) {
          int dest = transitions[j];
          statesSet.decr(dest);
          accCount -= a.isAccept(dest) ? 1 : 0;
        }
        points.points[i].ends.next = 0;

        // open the intervals starting at this point
        transitions = points.points[i].starts.transitions;
        limit = points.points[i].starts.next;
        for (int j = 0; j < limit; j += 3) {
          int dest = transitions[j];
          statesSet.incr(dest);
          accCount += a.isAccept(dest) ? 1 : 0;
        }
        lastPoint = point;
        points.points[i].starts.next = 0;
      }
      points.reset();
      assert statesSet.size() == 0: "size=" + statesSet.size();
    }

    Automaton result = b.finish();
    assert result.isDeterministic();
    return result;
  }

  /**
   * Returns true if the given automaton accepts no strings.
   */
  public static boolean isEmpty(Automaton a) {
    if (a.getNumStates() == 0) {
      return true;
    }
    if (a.isAccept(0) == false && a.getNumTransitions(0) == 0) {
      return true;
    }
    if (a.isAccept(0)) {
      // accepts the empty string
      return false;
    }

    ArrayDeque<Integer> workList = new ArrayDeque<>();
    BitSet seen = new BitSet(a.getNumStates());
    workList.add(0);
    seen.set(0);

    Transition t = new Transition();
    while (workList.isEmpty() == false) {
      int state = workList.removeFirst();
      if (a.isAccept(state)) {
        return false;
      }
      int count = a.initTransition(state, t);
      for (int i = 0; i < count; i++) {
        a.getNextTransition(t);
        if (seen.get(t.dest) == false) {
          workList.add(t.dest);
          seen.set(t.dest);
        }
      }
    }

    return true;
  }

  /**
   * Returns true if the given automaton accepts all strings over the code point
   * alphabet.  Only recognizes the canonical form: an accepting initial state
   * with a single self loop over the whole alphabet.
   */
  public static boolean isTotal(Automaton a) {
    return isTotal(a, Character.MIN_CODE_POINT, Character.MAX_CODE_POINT);
  }

  /**
   * Returns true if the given automaton accepts all strings for the specified
   * min/max range of the alphabet.  Only recognizes the canonical form: an
   * accepting initial state with a single self loop over the range.
   */
  public static boolean isTotal(Automaton a, int minAlphabet, int maxAlphabet) {
    if (a.getNumStates() > 0 && a.isAccept(0) && a.getNumTransitions(0) == 1) {
      Transition t = new Transition();
      a.getTransition(0, 0, t);
      return t.dest == 0
        && t.min == minAlphabet
        && t.max == maxAlphabet;
    }
    return false;
  }

  /**
   * Returns true if the given string is accepted by the automaton.  The input
   * must be deterministic.
   *
   * <p>Complexity: linear in the length of the string.
   */
  public static boolean run(Automaton a, String s) {
    assert a.isDeterministic();
    if (a.getNumStates() == 0) {
      return false;
    }
    int state = 0;
    for (int i = 0, cp = 0; i < s.length(); i += Character.charCount(cp)) {
      int nextState = a.step(state, cp = s.codePointAt(i));
      if (nextState == -1) {
        return false;
      }
      state = nextState;
    }
    return a.isAccept(state);
  }

  /**
   * Returns true if the given label sequence is accepted by the automaton.  The
   * input must be deterministic.
   *
   * <p>Complexity: linear in the length of the string.
   */
  public static boolean run(Automaton a, IntsRef s) {
    assert a.isDeterministic();
    if (a.getNumStates() == 0) {
      return false;
    }
    int state = 0;
    for (int i = 0; i < s.length; i++) {
      int nextState = a.step(state, s.ints[s.offset + i]);
      if (nextState == -1) {
        return false;
      }
      state = nextState;
    }
    return a.isAccept(state);
  }

  /**
   * Returns the set of live states.  A state is "live" if an accept state is
   * reachable from it and if it is reachable from the initial state.
   */
  private static BitSet getLiveStates(Automaton a) {
    BitSet live = getLiveStatesFromInitial(a);
    live.and(getLiveStatesToAccept(a));
    return live;
  }

  /** Returns bitset marking states reachable from the initial state. */
  private static BitSet getLiveStatesFromInitial(Automaton a) {
    int numStates = a.getNumStates();
    BitSet live = new BitSet(numStates);
    if (numStates == 0) {
      return live;
    }
    ArrayDeque<Integer> workList = new ArrayDeque<>();
    live.set(0);
    workList.add(0);

    Transition t = new Transition();
    while (workList.isEmpty() == false) {
      int s = workList.removeFirst();
      int count = a.initTransition(s, t);
      for (int i = 0; i < count; i++) {
        a.getNextTransition(t);
        if (live.get(t.dest) == false) {
          live.set(t.dest);
          workList.add(t.dest);
        }
      }
    }

    return live;
  }

  /** Returns bitset marking states that can reach an accept state. */
  private static BitSet getLiveStatesToAccept(Automaton a) {
    // walk the reversed graph backwards from every accept state
    Automaton.Builder builder = new Automaton.Builder();
    Transition t = new Transition();
    int numStates = a.getNumStates();
    for (int s = 0; s < numStates; s++) {
      builder.createState();
    }
    for (int s = 0; s < numStates; s++) {
      int count = a.initTransition(s, t);
      for (int i = 0; i < count; i++) {
        a.getNextTransition(t);
        builder.addTransition(t.dest, s, t.min, t.max);
      }
    }
    Automaton reversed = builder.finish();

    ArrayDeque<Integer> workList = new ArrayDeque<>();
    BitSet live = new BitSet(numStates);
    BitSet acceptBits = a.getAcceptStates();
    for (int s = acceptBits.nextSetBit(0); s != -1 && s < numStates; s = acceptBits.nextSetBit(s + 1)) {
      live.set(s);
      workList.add(s);
    }

    while (workList.isEmpty() == false) {
      int s = workList.removeFirst();
      int count = reversed.initTransition(s, t);
      for (int i = 0; i < count; i++) {
        reversed.getNextTransition(t);
        if (live.get(t.dest) == false) {
          live.set(t.dest);
          workList.add(t.dest);
        }
      }
    }

    return live;
  }

  /**
   * Removes transitions to dead states (a state is "dead" if it is not
   * reachable from the initial state or no accept state is reachable from it.)
   * The empty language comes back with no states at all.
   */
  public static Automaton removeDeadStates(Automaton a) {
    int numStates = a.getNumStates();
    BitSet liveSet = getLiveStates(a);

    int[] map = new int[numStates];

    Automaton result = new Automaton();
    for (int i = liveSet.nextSetBit(0); i != -1 && i < numStates; i = liveSet.nextSetBit(i + 1)) {
      map[i] = result.createState();
      result.setAccept(map[i], a.isAccept(i));
    }

    Transition t = new Transition();
    for (int i = liveSet.nextSetBit(0); i != -1 && i < numStates; i = liveSet.nextSetBit(i + 1)) {
      int count = a.initTransition(i, t);
      for (int j = 0; j < count; j++) {
        a.getNextTransition(t);
        if (liveSet.get(t.dest)) {
          result.addTransition(map[i], map[t.dest], t.min, t.max);
        }
      }
    }

    result.finishState();
    assert hasDeadStates(result) == false;
    return result;
  }

  /**
   * Returns true if the language of this automaton is finite.  The automaton
   * must not have any dead states.
   */
  public static boolean isFinite(Automaton a) {
    int numStates = a.getNumStates();
    if (numStates == 0) {
      return true;
    }
    // iterative DFS: a back edge onto the current path is a cycle
    BitSet path = new BitSet(numStates);
    BitSet visited = new BitSet(numStates);
    int[] stack = new int[8];
    int[] nextIndex = new int[8];
    int depth = 0;
    stack[depth] = 0;
    nextIndex[depth] = 0;
    depth++;
    path.set(0);

    Transition t = new Transition();
    while (depth > 0) {
      int state = stack[depth - 1];
      int index = nextIndex[depth - 1];
      if (index < a.getNumTransitions(state)) {
        nextIndex[depth - 1]++;
        a.getTransition(state, index, t);
        if (path.get(t.dest)) {
          return false;
        }
        if (visited.get(t.dest) == false) {
          if (depth == stack.length) {
            stack = ArrayUtil.grow(stack, depth + 1);
            nextIndex = ArrayUtil.grow(nextIndex, depth + 1);
          }
          stack[depth] = t.dest;
          nextIndex[depth] = 0;
          depth++;
          path.set(t.dest);
        }
      } else {
        path.clear(state);
        visited.set(state);
        depth--;
      }
    }
    return true;
  }

  /**
   * Returns the longest string that is a prefix of all accepted strings and
   * visits each state at most once.  The automaton must not have dead states.
   * If this automaton has already been converted to UTF-8 (e.g. using {@link
   * UTF32ToUTF8}) then you should use {@link #getCommonPrefixBytesRef} instead.
   *
   * @throws IllegalArgumentException if the automaton has dead states reachable
   *     from the initial state.
   * @return common prefix, which can be an empty (length 0) String (never null)
   */
  public static String getCommonPrefix(Automaton a) {
    if (hasDeadStatesFromInitial(a)) {
      throw new IllegalArgumentException("input automaton has dead states");
    }
    if (isEmpty(a)) {
      return "";
    }
    StringBuilder builder = new StringBuilder();
    Transition scratch = new Transition();
    BitSet current = new BitSet(a.getNumStates());
    BitSet next = new BitSet(a.getNumStates());
    current.set(0);

    // step every path forward together while they all read the same label
    while (true) {
      int label = -1;
      for (int state = current.nextSetBit(0); state != -1; state = current.nextSetBit(state + 1)) {
        if (a.isAccept(state)) {
          return builder.toString();
        }
        int count = a.getNumTransitions(state);
        for (int i = 0; i < count; i++) {
          a.getTransition(state, i, scratch);
          if (label == -1) {
            label = scratch.min;
          }
          if (scratch.min != scratch.max || scratch.min != label) {
            return builder.toString();
          }
          next.set(scratch.dest);
        }
      }
      assert label != -1: "no transition found; dead states were checked up front";
      builder.appendCodePoint(label);

      BitSet tmp = current;
      current = next;
      next = tmp;
      next.clear();
    }
  }

  /**
   * Returns the longest BytesRef that is a prefix of all accepted strings and
   * visits each state at most once.
   *
   * @return common prefix, which can be an empty (length 0) BytesRef (never null)
   * @throws IllegalStateException if a label of the prefix does not fit a byte
   */
  public static BytesRef getCommonPrefixBytesRef(Automaton a) {
    String prefix = getCommonPrefix(a);
    BytesRefBuilder builder = new BytesRefBuilder();
    for (int i = 0; i < prefix.length(); i++) {
      char ch = prefix.charAt(i);
      if (ch > 255) {
        throw new IllegalStateException("automaton is not binary");
      }
      builder.append((byte) (ch & 0xff));
    }
    return builder.get();
  }

  /**
   * If this automaton accepts a single input, return it.  Else, return null.
   * The automaton must be deterministic.
   *
   * @throws IllegalArgumentException if the automaton is not deterministic
   */
  public static IntsRef getSingleton(Automaton a) {
    if (a.isDeterministic() == false) {
      throw new IllegalArgumentException("input automaton must be deterministic");
    }
    if (a.getNumStates() == 0) {
      return null;
    }
    IntsRefBuilder builder = new IntsRefBuilder();
    BitSet visited = new BitSet(a.getNumStates());
    int s = 0;
    Transition t = new Transition();
    while (true) {
      visited.set(s);
      if (a.isAccept(s) == false) {
        if (a.getNumTransitions(s) == 1) {
          a.getTransition(s, 0, t);
          if (t.min == t.max && visited.get(t.dest) == false) {
            builder.append(t.min);
            s = t.dest;
            continue;
          }
        }
      } else if (a.getNumTransitions(s) == 0) {
        return builder.get();
      }

      // more than one accepted string, or none
      return null;
    }
  }

  /**
   * Returns the longest BytesRef that is a suffix of all accepted strings.
   * Worst case complexity: exponential in number of states (this calls
   * reverse and common prefix on an NFA).
   *
   * @return common suffix, which can be an empty (length 0) BytesRef (never null)
   */
  public static BytesRef getCommonSuffixBytesRef(Automaton a) {
    // the common prefix of the reversed language, reversed
    Automaton r = removeDeadStates(reverse(a));
    BytesRef ref = getCommonPrefixBytesRef(r);
    reverseBytes(ref);
    return ref;
  }

  private static void reverseBytes(BytesRef ref) {
    for (int i = ref.offset, j = ref.offset + ref.length - 1; i < j; i++, j--) {
      byte b = ref.bytes[i];
      ref.bytes[i] = ref.bytes[j];
      ref.bytes[j] = b;
    }
  }

  /** Returns an automaton accepting the reverse language. */
  public static Automaton reverse(Automaton a) {
    if (Operations.isEmpty(a)) {
      return new Automaton();
    }

    int numStates = a.getNumStates();

    // every edge flipped; states shift by one to make room for a new initial state
    Automaton.Builder builder = new Automaton.Builder();
    builder.createState();
    for (int s = 0; s < numStates; s++) {
      builder.createState();
    }

    // old initial state accepts
    builder.setAccept(1, true);

    Transition t = new Transition();
    for (int s = 0; s < numStates; s++) {
      int count = a.initTransition(s, t);
      for (int i = 0; i < count; i++) {
        a.getNextTransition(t);
        builder.addTransition(t.dest + 1, s + 1, t.min, t.max);
      }
    }

    Automaton result = builder.finish();

    // new initial state leads wherever the old accept states did
    BitSet acceptStates = a.getAcceptStates();
    for (int s = acceptStates.nextSetBit(0); s != -1 && s < numStates; s = acceptStates.nextSetBit(s + 1)) {
      result.addEpsilon(0, s + 1);
    }

    result.finishState();

    return result;
  }

  /**
   * Returns a copy of the automaton with an extra, non-accepting sink state so
   * that every state has a transition for every label in [min, max].
   */
  static Automaton totalize(Automaton a, int minAlphabet, int maxAlphabet) {
    Automaton result = new Automaton();
    int numStates = a.getNumStates();
    for (int i = 0; i < numStates; i++) {
      result.createState();
      result.setAccept(i, a.isAccept(i));
    }

    int deadState = result.createState();
    result.addTransition(deadState, deadState, minAlphabet, maxAlphabet);

    Transition t = new Transition();
    for (int i = 0; i < numStates; i++) {
      int maxi = minAlphabet;
      int count = a.initTransition(i, t);
      for (int j = 0; j < count; j++) {
        a.getNextTransition(t);
        result.addTransition(i, t.dest, t.min, t.max);
        if (t.min > maxi) {
          result.addTransition(i, deadState, maxi, t.min - 1);
        }
        if (t.max + 1 > maxi) {
          maxi = t.max + 1;
        }
      }

      if (maxi <= maxAlphabet) {
        result.addTransition(i, deadState, maxi, maxAlphabet);
      }
    }

    result.finishState();
    return result;
  }

  /**
   * Returns the index of the interval in {@code points} (sorted interval start
   * points) that contains {@code c}.
   */
  static int findIndex(int c, int[] points) {
    int a = 0;
    int b = points.length;
    while (b - a > 1) {
      int d = (a + b) >>> 1;
      if (points[d] > c) {
        b = d;
      } else if (points[d] < c) {
        a = d;
      } else {
        return d;
      }
    }
    return a;
  }
}
