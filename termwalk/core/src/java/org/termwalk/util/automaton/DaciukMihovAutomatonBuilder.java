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
import java.util.Collection;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import org.termwalk.util.BytesRef;
import org.termwalk.util.IntsRefBuilder;

/**
 * Builds the minimal deterministic automaton accepting a sorted set of
 * strings, adding them one at a time.  Implements the incremental algorithm of
 * Jan Daciuk, Stoyan Mihov, Bruce W. Watson and Richard E. Watson, "Incremental
 * Construction of Minimal Acyclic Finite-State Automata" (2000): after each
 * addition, the part of the previous word that can no longer change is merged
 * into a registry of equivalent states.
 *
 * <p>Labels are code points, or raw bytes in binary mode.
 *
 * @see #build(Collection, boolean)
 * @see Automata#makeStringUnion(Collection)
 * @see Automata#makeBinaryStringUnion(Collection)
 */
final class DaciukMihovAutomatonBuilder {

  /** Longest accepted term, in labels. */
  static final int MAX_TERM_LENGTH = 1_000;

  /** A state of the acyclic intermediate automaton. */
  private static final class State {

    private static final int[] NO_LABELS = new int[0];

    private static final State[] NO_STATES = new State[0];

    /** Sorted outgoing labels. */
    int[] labels = NO_LABELS;

    /** Target of each label, aligned with {@link #labels}. */
    State[] states = NO_STATES;

    boolean isFinal;

    /** Returns the target for {@code label}, or null. */
    State getState(int label) {
      int low = 0;
      int high = labels.length - 1;
      while (low <= high) {
        int mid = (low + high) >>> 1;
        if (labels[mid] < label) {
          low = mid + 1;
        } else if (labels[mid] > label) {
          high = mid - 1;
        } else {
          return states[mid];
        }
      }
      return null;
    }

    /**
     * Two states are equivalent when they agree on finality, labels and
     * targets.  Targets compare by identity: they are already registered, so
     * equal right languages share one instance.
     */
    @Override
    public boolean equals(Object obj) {
      final State other = (State) obj;
      if (isFinal != other.isFinal || labels.length != other.labels.length) {
        return false;
      }
      for (int i = 0; i < labels.length; i++) {
        if (labels[i] != other.labels[i] || states[i] != other.states[i]) {
          return false;
        }
      }
      return true;
    }

    @Override
    public int hashCode() {
      int hash = isFinal ? 1 : 0;
      hash ^= hash * 31 + labels.length;
      for (int c : labels) {
        hash ^= hash * 31 + c;
      }
      for (State s : states) {
        hash ^= System.identityHashCode(s);
      }
      return hash;
    }

    boolean hasChildren() {
      return labels.length > 0;
    }

    /** Appends a new target for {@code label}, which sorts after every existing label. */
    State newState(int label) {
      assert labels.length == 0 || labels[labels.length - 1] < label: "labels out of order: " + label;
      labels = Arrays.copyOf(labels, labels.length + 1);
      states = Arrays.copyOf(states, states.length + 1);

      labels[labels.length - 1] = label;
      return states[states.length - 1] = new State();
    }

    State lastChild() {
      assert hasChildren(): "No outgoing transitions.";
      return states[states.length - 1];
    }

    /** Returns the last child if it is reached on {@code label}, else null. */
    State lastChild(int label) {
      final int index = labels.length - 1;
      State s = null;
      if (index >= 0 && labels[index] == label) {
        s = states[index];
      }
      assert s == getState(label);
      return s;
    }

    void replaceLastChild(State state) {
      assert hasChildren(): "No outgoing transitions.";
      states[states.length - 1] = state;
    }
  }

  /** Registry of minimal states, null once {@link #complete} ran. */
  private HashMap<State, State> stateRegistry = new HashMap<>();

  private final State root = new State();

  /** Previously added term, to check the sort order. */
  private BytesRef previous;

  private final IntsRefBuilder labels = new IntsRefBuilder();

  private DaciukMihovAutomatonBuilder() {}

  /**
   * Adds a term; terms must arrive in unsigned byte order, which for UTF-8 is
   * code point order.
   *
   * @throws IllegalArgumentException if the term sorts before the previous one
   *     or has more than {@link #MAX_TERM_LENGTH} labels
   */
  private void add(BytesRef current, boolean asBinary) {
    if (stateRegistry == null) {
      throw new IllegalStateException("Automaton already built.");
    }
    if (previous != null && previous.compareTo(current) > 0) {
      throw new IllegalArgumentException("Input must be in sorted UTF-8 order: " + previous + " >= " + current);
    }
    previous = BytesRef.deepCopyOf(current);

    if (asBinary) {
      labels.clear();
      for (int i = 0; i < current.length; i++) {
        labels.append(current.bytes[current.offset + i] & 0xff);
      }
    } else {
      labels.copyUTF8Bytes(current);
    }
    if (labels.length() > MAX_TERM_LENGTH) {
      throw new IllegalArgumentException("This builder doesn't allow terms that are larger than "
          + MAX_TERM_LENGTH + " labels, got " + labels.length() + " for " + current);
    }

    // follow the longest prefix already in the automaton
    int[] ints = labels.ints();
    int len = labels.length();
    int pos = 0;
    State next, state = root;
    while (pos < len && (next = state.lastChild(ints[pos])) != null) {
      state = next;
      pos++;
    }

    if (state.hasChildren()) {
      replaceOrRegister(state);
    }

    // append the remaining suffix as a fresh chain
    while (pos < len) {
      state = state.newState(ints[pos++]);
    }
    state.isFinal = true;
  }

  /** Registers the remaining path of the last word and returns the root. */
  private State complete() {
    if (stateRegistry == null) {
      throw new IllegalStateException();
    }
    if (root.hasChildren()) {
      replaceOrRegister(root);
    }
    stateRegistry = null;
    return root;
  }

  /** Replaces the last child of {@code state} with an equivalent registered state, registering it if new. */
  private void replaceOrRegister(State state) {
    final State child = state.lastChild();

    if (child.hasChildren()) {
      replaceOrRegister(child);
    }

    final State registered = stateRegistry.get(child);
    if (registered != null) {
      state.replaceLastChild(registered);
    } else {
      stateRegistry.put(child, child);
    }
  }

  /** Copies the graph below {@code root} into {@code a}, numbering states in depth-first order. */
  private static void convert(Automaton.Builder a, State root) {
    Map<State, Integer> visited = new IdentityHashMap<>();
    List<State> pending = new ArrayList<>();
    visited.put(root, a.createState());
    a.setAccept(0, root.isFinal);
    pending.add(root);
    while (pending.isEmpty() == false) {
      State s = pending.remove(pending.size() - 1);
      int source = visited.get(s);
      for (int i = 0; i < s.labels.length; i++) {
        State target = s.states[i];
        Integer dest = visited.get(target);
        if (dest == null) {
          dest = a.createState();
          a.setAccept(dest, target.isFinal);
          visited.put(target, dest);
          pending.add(target);
        }
        a.addTransition(source, dest, s.labels[i]);
      }
    }
  }

  /**
   * Builds a minimal, deterministic automaton accepting exactly the given
   * terms.
   *
   * @param input terms in unsigned byte order
   * @param asBinary label transitions with bytes instead of code points
   */
  static Automaton build(Collection<BytesRef> input, boolean asBinary) {
    final DaciukMihovAutomatonBuilder builder = new DaciukMihovAutomatonBuilder();
    for (BytesRef b : input) {
      builder.add(b, asBinary);
    }

    Automaton.Builder a = new Automaton.Builder();
    convert(a, builder.complete());
    return a.finish();
  }
}
