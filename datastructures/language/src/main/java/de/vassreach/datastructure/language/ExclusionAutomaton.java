/* Copyright (C) 2021 – University of Mons, University Antwerpen
 * This file is part of VASSReach.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package de.vassreach.datastructure.language;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Deque;

import net.automatalib.automata.fsa.DFA;
import net.automatalib.words.Alphabet;

/**
 * A deterministic automaton over transition indices recognizing paths that are
 * known to be spurious.
 * 
 * The automaton is compiled from an AutomataLib {@link DFA} into successor
 * tables. States from which no excluded word can be reached any more are
 * collapsed into {@link #RELEASED}: a path in that state can never be excluded
 * by this automaton and does not need to track it.
 * 
 * A <i>trap</i> state is an accepting state that cannot be left: every
 * extension of a path reaching it is excluded too.
 * 
 * @author Gaëtan Staquet
 */
public final class ExclusionAutomaton {

    /**
     * The kind of spurious structure an automaton excludes.
     */
    public enum Kind {
        /**
         * A path prefix that blocks with exact counters. The automaton is
         * prefix-closed: every extension is excluded.
         */
        NEGATIVE_PREFIX,
        /**
         * A family {@code prefix . loop^k . suffix} whose members never balance.
         * Only complete paths are excluded.
         */
        WRAP_LOOP
    }

    /**
     * State value of a path that can no longer be excluded.
     */
    public static final int RELEASED = -1;

    private final Kind kind;
    private final String description;
    private final int initialState;
    private final int[][] successors;
    private final boolean[] excluding;
    private final boolean[] trap;

    <S> ExclusionAutomaton(Kind kind, String description, DFA<S, Integer> dfa, Alphabet<Integer> transitions) {
        this.kind = kind;
        this.description = description;

        // number the DFA states and collect the raw transition table
        final int size = dfa.size();
        final int symbols = transitions.size();
        final int[][] raw = new int[size][symbols];
        final boolean[] accepting = new boolean[size];
        for (S state : dfa) {
            int id = dfa.stateIDs().getStateId(state);
            accepting[id] = dfa.isAccepting(state);
            for (int symbol = 0; symbol < symbols; symbol++) {
                S successor = dfa.getSuccessor(state, transitions.getSymbol(symbol));
                raw[id][symbol] = successor == null ? RELEASED : dfa.stateIDs().getStateId(successor);
            }
        }

        // states that can still reach an accepting state
        BitSet live = new BitSet(size);
        Deque<Integer> queue = new ArrayDeque<>();
        for (int id = 0; id < size; id++) {
            if (accepting[id]) {
                live.set(id);
                queue.add(id);
            }
        }
        while (!queue.isEmpty()) {
            int target = queue.poll();
            for (int id = 0; id < size; id++) {
                if (!live.get(id)) {
                    for (int symbol = 0; symbol < symbols; symbol++) {
                        if (raw[id][symbol] == target) {
                            live.set(id);
                            queue.add(id);
                            break;
                        }
                    }
                }
            }
        }

        this.successors = new int[size][symbols];
        this.excluding = accepting;
        this.trap = new boolean[size];
        for (int id = 0; id < size; id++) {
            boolean closed = accepting[id];
            for (int symbol = 0; symbol < symbols; symbol++) {
                int successor = raw[id][symbol];
                successors[id][symbol] = successor != RELEASED && live.get(successor) ? successor : RELEASED;
                closed &= successors[id][symbol] == id;
            }
            trap[id] = closed;
        }

        S init = dfa.getInitialState();
        if (init == null || !live.get(dfa.stateIDs().getStateId(init))) {
            this.initialState = RELEASED;
        } else {
            this.initialState = dfa.stateIDs().getStateId(init);
        }
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return A human readable description of the excluded structure
     */
    public String getDescription() {
        return description;
    }

    public int getInitialState() {
        return initialState;
    }

    /**
     * @param state           A state, possibly {@link #RELEASED}
     * @param transitionIndex The index of the transition that is taken
     * @return The successor, possibly {@link #RELEASED}
     */
    public int getSuccessor(int state, int transitionIndex) {
        if (state == RELEASED) {
            return RELEASED;
        }
        return successors[state][transitionIndex];
    }

    /**
     * @param state A state, possibly {@link #RELEASED}
     * @return True iff a complete path ending in this state is excluded
     */
    public boolean isExcluding(int state) {
        return state != RELEASED && excluding[state];
    }

    /**
     * @param state A state, possibly {@link #RELEASED}
     * @return True iff every extension of a path reaching this state is excluded
     */
    public boolean isTrap(int state) {
        return state != RELEASED && trap[state];
    }

    /**
     * @param transitionIndices A sequence of transition indices
     * @return True iff the sequence, seen as a complete path, is excluded
     */
    public boolean excludes(int... transitionIndices) {
        int state = initialState;
        for (int index : transitionIndices) {
            if (isTrap(state)) {
                return true;
            }
            state = getSuccessor(state, index);
        }
        return isExcluding(state);
    }

    @Override
    public String toString() {
        return kind + "(" + description + ")" + (initialState == RELEASED ? " released" : "");
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj == null || obj.getClass() != getClass()) {
            return false;
        }
        ExclusionAutomaton o = (ExclusionAutomaton) obj;
        return o.kind == kind && o.initialState == initialState && Arrays.deepEquals(o.successors, successors)
                && Arrays.equals(o.excluding, excluding);
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + Arrays.deepHashCode(successors);
    }
}
