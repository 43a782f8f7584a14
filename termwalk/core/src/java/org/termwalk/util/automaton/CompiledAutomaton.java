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

import java.util.BitSet;
import java.util.Objects;

import org.termwalk.util.Accountable;
import org.termwalk.util.BytesRef;
import org.termwalk.util.BytesRefBuilder;
import org.termwalk.util.InfoStream;
import org.termwalk.util.IntsRef;
import org.termwalk.util.RamUsageEstimator;

/**
 * Immutable class holding compiled details for a given
 * Automaton.  The Automaton could either be deterministic
 * or non-deterministic.  For deterministic automata, it
 * must not have dead states but is not necessarily minimal.
 *
 * <p>Instances are safe to share between threads that walk a term dictionary.
 *
 * @termwalk.experimental
 */
public class CompiledAutomaton implements Accountable {
  private static final long BASE_RAM_BYTES = RamUsageEstimator.shallowSizeOfInstance(CompiledAutomaton.class);
  private static final long BYTES_REF_RAM_BYTES = RamUsageEstimator.shallowSizeOfInstance(BytesRef.class);

  /** Component name used for {@link InfoStream} messages. */
  public static final String INFO_STREAM_COMPONENT = "CA";

  /** Above this many states plus transitions the common suffix is not computed. */
  static final int MAX_SIZE_FOR_COMMON_SUFFIX = 1000;

  /**
   * Automata are compiled into different internal forms for the
   * most efficient execution depending upon the language they accept.
   */
  public enum AUTOMATON_TYPE {
    /** Automaton that accepts no strings. */
    NONE,
    /** Automaton that accepts all possible strings. */
    ALL,
    /** Automaton that accepts only a single fixed string. */
    SINGLE,
    /** Catch-all for any other automata. */
    NORMAL
  }

  /** If simplify is true this will be the "simplified" type; else, this is NORMAL */
  public final AUTOMATON_TYPE type;

  /**
   * For {@link AUTOMATON_TYPE#SINGLE} this is the singleton term.
   */
  public final BytesRef term;

  /**
   * Matcher for quickly determining if a byte[] is accepted.
   * only valid for {@link AUTOMATON_TYPE#NORMAL} and deterministic input.
   */
  public final ByteRunAutomaton runAutomaton;

  /**
   * Two dimensional array of transitions, indexed by state
   * number for traversal. The state numbering is consistent with
   * {@link #runAutomaton}.
   * Only valid for {@link AUTOMATON_TYPE#NORMAL} and deterministic input.
   */
  public final Automaton automaton;

  /**
   * Matcher directly run on a NFA, it will determinize the state on need and caches it.
   * Only valid for {@link AUTOMATON_TYPE#NORMAL} and non-deterministic input.
   */
  public final NFARunAutomaton nfaRunAutomaton;

  /**
   * Shared common suffix accepted by the automaton. Only valid
   * for {@link AUTOMATON_TYPE#NORMAL}, and only when the
   * automaton accepts an infinite language.  This will be null
   * if the common suffix is empty.
   */
  public final BytesRef commonSuffixRef;

  /**
   * Indicates if the automaton accepts a finite set of strings.
   * Null if this was not computed.
   * Only valid for {@link AUTOMATON_TYPE#NORMAL}.
   */
  public final Boolean finite;

  /** Which state, if any, accepts all suffixes, else -1. */
  public final int sinkState;

  /** Create this, passing simplify=true, so that we try
   *  to simplify the automaton. */
  public CompiledAutomaton(Automaton automaton) {
    this(automaton, null, true);
  }

  /** Create this.  If finite is null, we use {@link Operations#isFinite}
   *  to determine whether it is finite.  If simplify is true, we run
   *  possibly expensive operations to determine if the automaton is one
   *  the cases in {@link CompiledAutomaton.AUTOMATON_TYPE}. */
  public CompiledAutomaton(Automaton automaton, Boolean finite, boolean simplify) {
    this(automaton, finite, simplify, false);
  }

  /** Create this.  If finite is null, we use {@link Operations#isFinite}
   *  to determine whether it is finite.  If simplify is true, we run
   *  possibly expensive operations to determine if the automaton is one
   *  the cases in {@link CompiledAutomaton.AUTOMATON_TYPE}. Set isBinary
   *  to true if the automaton already matches bytes rather than code points. */
  public CompiledAutomaton(Automaton automaton, Boolean finite, boolean simplify, boolean isBinary) {
    this(automaton, finite, simplify, Operations.DEFAULT_DETERMINIZE_WORK_LIMIT, isBinary);
  }

  /** Create this.  If finite is null, we use {@link Operations#isFinite}
   *  to determine whether it is finite.  If simplify is true, we run
   *  possibly expensive operations to determine if the automaton is one
   *  the cases in {@link CompiledAutomaton.AUTOMATON_TYPE}. If simplify
   *  requires determinizing the automaton then at most determinizeWorkLimit
   *  effort will be spent.  Any more than that will cause a
   *  TooComplexToDeterminizeException.
   */
  public CompiledAutomaton(Automaton automaton, Boolean finite, boolean simplify,
                           int determinizeWorkLimit, boolean isBinary) {
    final InfoStream infoStream = InfoStream.getDefault();

    if (automaton.getNumStates() == 0) {
      automaton = new Automaton();
      automaton.createState();
    }

    if (simplify && automaton.isDeterministic()) {

      // Test whether the automaton is a "simple" form and
      // if so, don't create a runAutomaton.  Note that on a
      // large automaton these tests could be costly:

      if (Operations.isEmpty(automaton)) {
        // matches nothing
        type = AUTOMATON_TYPE.NONE;
        term = null;
        commonSuffixRef = null;
        runAutomaton = null;
        this.automaton = null;
        this.finite = true;
        sinkState = -1;
        nfaRunAutomaton = null;
        log(infoStream, "type=NONE");
        return;
      }

      boolean isTotal;

      // NOTE: only approximate, because automaton may not be minimal:
      if (isBinary) {
        isTotal = Operations.isTotal(automaton, 0, 0xff);
      } else {
        isTotal = Operations.isTotal(automaton);
      }

      if (isTotal) {
        // matches all possible strings
        type = AUTOMATON_TYPE.ALL;
        term = null;
        commonSuffixRef = null;
        runAutomaton = null;
        this.automaton = null;
        this.finite = false;
        sinkState = -1;
        nfaRunAutomaton = null;
        log(infoStream, "type=ALL");
        return;
      }

      IntsRef singleton = Operations.getSingleton(automaton);

      if (singleton != null) {
        // matches a fixed string
        type = AUTOMATON_TYPE.SINGLE;
        commonSuffixRef = null;
        runAutomaton = null;
        this.automaton = null;
        this.finite = true;

        if (isBinary) {
          term = intsRefToBytesRef(singleton);
        } else {
          term = new BytesRef(new String(singleton.ints, singleton.offset, singleton.length));
        }
        sinkState = -1;
        nfaRunAutomaton = null;
        log(infoStream, "type=SINGLE term=" + term);
        return;
      }
    }

    type = AUTOMATON_TYPE.NORMAL;
    term = null;

    if (finite == null) {
      this.finite = Operations.isFinite(automaton);
    } else {
      this.finite = finite;
    }

    Automaton binary;
    if (isBinary) {
      // Caller already built binary automaton themselves, e.g. PrefixQuery
      // does this since it can be provided with a binary (not necessarily
      // UTF8!) term:
      binary = automaton;
    } else {
      // Incoming automaton is unicode, and we must convert to UTF8 to match what's in the index:
      binary = new UTF32ToUTF8().convert(automaton);
    }

    // compute a common suffix for infinite DFAs, this is an optimization for "leading wildcard"
    // so don't burn cycles on it if the DFA is finite, or largeish
    if (this.finite || automaton.getNumStates() + automaton.getNumTransitions() > MAX_SIZE_FOR_COMMON_SUFFIX) {
      commonSuffixRef = null;
    } else {
      BytesRef suffix = Operations.getCommonSuffixBytesRef(binary);
      if (suffix.length == 0) {
        commonSuffixRef = null;
      } else {
        commonSuffixRef = suffix;
      }
    }

    if (automaton.isDeterministic() == false && binary.isDeterministic() == false) {
      this.automaton = null;
      this.runAutomaton = null;
      this.sinkState = -1;
      this.nfaRunAutomaton = new NFARunAutomaton(binary, 256);
      log(infoStream, "type=NORMAL nfa states=" + binary.getNumStates() + " finite=" + this.finite
          + " commonSuffix=" + commonSuffixRef);
    } else {
      // A DFA's UTF-8 form may be an NFA again, but determinizing it stays cheap
      binary = Operations.determinize(binary, determinizeWorkLimit);
      binary = Operations.removeDeadStates(binary);
      if (binary.getNumStates() == 0) {
        binary = Automata.makeEmpty();
      }
      this.automaton = binary;
      // only the first sink state is reported; a non-minimal automaton may have more
      sinkState = findSinkState(this.automaton);
      runAutomaton = new ByteRunAutomaton(binary, true, determinizeWorkLimit);
      this.nfaRunAutomaton = null;
      log(infoStream, "type=NORMAL dfa states=" + binary.getNumStates() + " finite=" + this.finite
          + " commonSuffix=" + commonSuffixRef + " sinkState=" + sinkState);
    }
  }

  private static void log(InfoStream infoStream, String message) {
    if (infoStream.isEnabled(INFO_STREAM_COMPONENT)) {
      infoStream.message(INFO_STREAM_COMPONENT, message);
    }
  }

  private static BytesRef intsRefToBytesRef(IntsRef ints) {
    byte[] bytes = new byte[ints.length];
    for (int i = 0; i < ints.length; i++) {
      int x = ints.ints[ints.offset + i];
      assert x >= 0 && x <= 255;
      bytes[i] = (byte) x;
    }
    return new BytesRef(bytes);
  }

  private static int findSinkState(Automaton automaton) {
    int numStates = automaton.getNumStates();
    Transition t = new Transition();
    int foundState = -1;
    for (int s = 0; s < numStates; s++) {
      if (automaton.isAccept(s)) {
        int count = automaton.initTransition(s, t);
        boolean isSinkState = false;
        for (int i = 0; i < count; i++) {
          automaton.getNextTransition(t);
          if (t.dest == s && t.min == 0 && t.max == 0xff) {
            isSinkState = true;
            break;
          }
        }
        if (isSinkState) {
          foundState = s;
          break;
        }
      }
    }

    return foundState;
  }

  /**
   * Get a {@link ByteRunnable} instance, it will be different depending on whether a NFA or DFA is
   * passed in, and does not guarantee returning non-null object
   */
  public ByteRunnable getByteRunnable() {
    // they can be both null but not both non-null
    assert nfaRunAutomaton == null || runAutomaton == null;
    if (nfaRunAutomaton == null) {
      return runAutomaton;
    }
    return nfaRunAutomaton;
  }

  /**
   * Get a {@link TransitionAccessor} instance, it will be different depending on whether a NFA or
   * DFA is passed in, and does not guarantee returning non-null object
   */
  public TransitionAccessor getTransitionAccessor() {
    // they can be both null but not both non-null
    assert nfaRunAutomaton == null || automaton == null;
    if (nfaRunAutomaton == null) {
      return automaton;
    }
    return nfaRunAutomaton;
  }

  // Appends floorLabel's tail: the greatest label below leadLabel out of state, then the greatest path to an accept
  private BytesRef addTail(int state, BytesRefBuilder term, int idx, int leadLabel) {
    Transition transition = new Transition();

    // Find biggest transition that's < label
    // TODO: use binary search here
    int maxIndex = -1;
    int numTransitions = automaton.initTransition(state, transition);
    for (int i = 0; i < numTransitions; i++) {
      automaton.getNextTransition(transition);
      if (transition.min < leadLabel) {
        maxIndex = i;
      } else {
        // Transitions are always sorted
        break;
      }
    }

    assert maxIndex != -1;
    automaton.getTransition(state, maxIndex, transition);

    // Append floorLabel
    final int floorLabel;
    if (transition.max > leadLabel - 1) {
      floorLabel = leadLabel - 1;
    } else {
      floorLabel = transition.max;
    }
    term.setLength(idx);
    term.append((byte) floorLabel);

    state = transition.dest;
    BitSet onPath = new BitSet(automaton.getNumStates());

    // Push down to last accept state
    while (true) {
      numTransitions = automaton.getNumTransitions(state);
      if (numTransitions == 0) {
        assert runAutomaton.isAccept(state);
        return term.get();
      } else {
        if (onPath.get(state)) {
          throw new IllegalStateException("no largest accepted term below the input: state " + state
              + " starts an infinite suffix");
        }
        onPath.set(state);
        // We are pushing "top" -- so get last label of
        // last transition:
        automaton.getTransition(state, numTransitions - 1, transition);
        term.append((byte) transition.max);
        state = transition.dest;
      }
    }
  }

  /**
   * Finds largest term accepted by this Automaton, that's &lt;= the provided input term. The result
   * is placed in output; it's fine for output and input to point to the same bytes. The returned
   * result is either the provided output, or null if there is no floor term (ie, the provided
   * input term is before the first term accepted by this Automaton).
   *
   * <p>Only defined for {@link AUTOMATON_TYPE#NORMAL} with deterministic input.
   *
   * @throws IllegalStateException if the automaton is not a deterministic {@link
   *     AUTOMATON_TYPE#NORMAL} one, or if the floor term would have to be infinitely long
   */
  public BytesRef floor(BytesRef input, BytesRefBuilder output) {
    if (runAutomaton == null) {
      throw new IllegalStateException("floor requires a deterministic NORMAL automaton, got type=" + type);
    }

    // states[i] is the state after reading the first i bytes
    final int[] states = new int[input.length + 1];
    int state = 0;
    int walked = 0;
    while (walked < input.length) {
      int next = runAutomaton.step(state, input.bytes[input.offset + walked] & 0xff);
      if (next == -1) {
        break;
      }
      states[walked] = state;
      state = next;
      walked++;
    }
    states[walked] = state;

    // fill in the prefix up front; input and output may share bytes
    output.clear();
    output.append(input.bytes, input.offset, walked);

    if (walked == input.length && runAutomaton.isAccept(state)) {
      // Input string is accepted
      return output.get();
    }

    // Pop back to a prefix that has a lower label
    for (int idx = Math.min(walked, input.length - 1); idx >= 0; idx--) {
      state = states[idx];
      int label = input.bytes[input.offset + idx] & 0xff;
      if (automaton.getNumTransitions(state) > 0) {
        Transition transition = new Transition();
        automaton.getTransition(state, 0, transition);
        if (transition.min < label) {
          return addTail(state, output, idx, label);
        }
      }
      if (runAutomaton.isAccept(state)) {
        output.setLength(idx);
        return output.get();
      }
    }
    return null;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + ((runAutomaton == null) ? 0 : runAutomaton.hashCode());
    result = prime * result + ((term == null) ? 0 : term.hashCode());
    result = prime * result + ((type == null) ? 0 : type.hashCode());
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) return true;
    if (obj == null) return false;
    if (getClass() != obj.getClass()) return false;
    CompiledAutomaton other = (CompiledAutomaton) obj;
    if (type != other.type) return false;
    if (type == AUTOMATON_TYPE.SINGLE) {
      if (!term.equals(other.term)) return false;
    } else if (type == AUTOMATON_TYPE.NORMAL) {
      if (!Objects.equals(runAutomaton, other.runAutomaton)) return false;
      // lazily built, so only the same instance is known to be equal
      if (nfaRunAutomaton != other.nfaRunAutomaton) return false;
    }

    return true;
  }

  private static long sizeOf(BytesRef ref) {
    return ref == null ? 0 : BYTES_REF_RAM_BYTES + RamUsageEstimator.sizeOf(ref.bytes);
  }

  @Override
  public long ramBytesUsed() {
    return BASE_RAM_BYTES +
        (automaton == null ? 0 : automaton.ramBytesUsed()) +
        (runAutomaton == null ? 0 : runAutomaton.ramBytesUsed()) +
        (nfaRunAutomaton == null ? 0 : nfaRunAutomaton.ramBytesUsed()) +
        sizeOf(commonSuffixRef) +
        sizeOf(term);
  }

  @Override
  public String toString() {
    return "CompiledAutomaton(type=" + type + (term == null ? "" : ", term=" + term) + ")";
  }
}
