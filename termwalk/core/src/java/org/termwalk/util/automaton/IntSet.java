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

/** A set of NFA state ids that names a DFA state during determinization.
 *  Equality compares the sorted members; the hash is precomputed by
 *  subclasses so that mutable and frozen sets hash identically. */
abstract class IntSet {
  /**
   * Return an array representation of this int set's values. Values are valid for indices [0,
   * {@link #size()}). The array must be sorted, and may be larger than {@link #size()}.
   */
  abstract int[] getArray();

  /** Number of members. */
  abstract int size();

  /** Order independent hash of the members. */
  abstract long longHashCode();

  @Override
  public int hashCode() {
    return Long.hashCode(longHashCode());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof IntSet)) return false;
    IntSet that = (IntSet) o;
    return longHashCode() == that.longHashCode()
        && Arrays.equals(getArray(), 0, size(), that.getArray(), 0, that.size());
  }
}
