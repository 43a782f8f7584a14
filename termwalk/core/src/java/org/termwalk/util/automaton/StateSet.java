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

import com.carrotsearch.hppc.BitMixer;
import com.carrotsearch.hppc.IntIntHashMap;
import com.carrotsearch.hppc.cursors.IntCursor;

/**
 * The NFA states reached so far while building one DFA state. Each NFA state
 * is counted once per transition that reaches it; it leaves the set when its
 * count drops back to zero.
 * <p>
 * The hash is kept current on every membership change. The sorted member
 * array is only rebuilt when {@link #getArray()} is called after a change.
 */
final class StateSet extends IntSet {

  private static final int[] EMPTY = new int[0];

  // state -> number of times it was added
  private final IntIntHashMap counts;
  // sum of BitMixer.mix over the members
  private long mixSum;
  private int[] sorted = EMPTY;
  private boolean sortedStale;

  StateSet(int capacity) {
    counts = new IntIntHashMap(capacity);
  }

  void incr(int state) {
    if (counts.addTo(state, 1) == 1) {
      mixSum += BitMixer.mix(state);
      sortedStale = true;
    }
  }

  void decr(int state) {
    int index = counts.indexOf(state);
    assert counts.indexExists(index) : "state=" + state + " is not a member";
    int count = counts.indexGet(index);
    if (count > 1) {
      counts.indexReplace(index, count - 1);
    } else {
      counts.remove(state);
      mixSum -= BitMixer.mix(state);
      sortedStale = true;
    }
  }

  void reset() {
    counts.clear();
    mixSum = 0;
    sorted = EMPTY;
    sortedStale = false;
  }

  /** Snapshots the members (not their counts) as the DFA state {@code state}. */
  FrozenIntSet freeze(int state) {
    return new FrozenIntSet(getArray(), longHashCode(), state);
  }

  @Override
  int[] getArray() {
    if (sortedStale) {
      int[] members = new int[counts.size()];
      int upto = 0;
      for (IntCursor cursor : counts.keys()) {
        members[upto++] = cursor.value;
      }
      Arrays.sort(members);
      sorted = members;
      sortedStale = false;
    }
    return sorted;
  }

  @Override
  int size() {
    return counts.size();
  }

  @Override
  long longHashCode() {
    return counts.size() + mixSum;
  }
}
