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
package de.vassreach.api.vass;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import net.automatalib.words.Alphabet;
import net.automatalib.words.Word;

/**
 * An initialized vector addition system with states.
 * 
 * States are the integers {@code 0, ..., size() - 1}. Every transition carries
 * a label, an integer effect vector of length {@link #getDimension()} and a
 * {@link Guard}. A run starts in the initial state with every counter equal to
 * zero; the reachability question asks whether the final state can be reached
 * with every counter equal to zero again, without any counter ever dropping
 * below zero and with every guard satisfied.
 * 
 * Instances are immutable and are created by a {@link VASSBuilder}.
 * 
 * @param <I> Label type
 * @author Gaëtan Staquet
 */
public final class VASS<I> {
    private final int size;
    private final int dimension;
    private final int initialState;
    private final int finalState;
    private final List<VASSTransition<I>> transitions;
    private final List<List<VASSTransition<I>>> outgoing;
    private final List<List<VASSTransition<I>>> incoming;
    private final Alphabet<I> alphabet;

    VASS(int size, int dimension, int initialState, int finalState, List<VASSTransition<I>> transitions,
            Alphabet<I> alphabet) {
        this.size = size;
        this.dimension = dimension;
        this.initialState = initialState;
        this.finalState = finalState;
        this.transitions = Collections.unmodifiableList(new ArrayList<>(transitions));
        this.alphabet = alphabet;

        List<List<VASSTransition<I>>> out = new ArrayList<>(size);
        List<List<VASSTransition<I>>> in = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            out.add(new ArrayList<>());
            in.add(new ArrayList<>());
        }
        for (VASSTransition<I> transition : transitions) {
            out.get(transition.getSource()).add(transition);
            in.get(transition.getTarget()).add(transition);
        }
        for (int i = 0; i < size; i++) {
            out.set(i, Collections.unmodifiableList(out.get(i)));
            in.set(i, Collections.unmodifiableList(in.get(i)));
        }
        this.outgoing = Collections.unmodifiableList(out);
        this.incoming = Collections.unmodifiableList(in);
    }

    /**
     * @return The number of states
     */
    public int size() {
        return size;
    }

    /**
     * @return The number of counters
     */
    public int getDimension() {
        return dimension;
    }

    public int getInitialState() {
        return initialState;
    }

    public int getFinalState() {
        return finalState;
    }

    /**
     * @return The transitions, ordered by index
     */
    public List<VASSTransition<I>> getTransitions() {
        return transitions;
    }

    public VASSTransition<I> getTransition(int index) {
        return transitions.get(index);
    }

    public int getTransitionCount() {
        return transitions.size();
    }

    /**
     * @param state The state
     * @return The transitions leaving the state, ordered by index
     */
    public List<VASSTransition<I>> getOutgoingTransitions(int state) {
        return outgoing.get(state);
    }

    /**
     * @param state The state
     * @return The transitions entering the state, ordered by index
     */
    public List<VASSTransition<I>> getIncomingTransitions(int state) {
        return incoming.get(state);
    }

    /**
     * @return The labels used by the transitions
     */
    public Alphabet<I> getAlphabet() {
        return alphabet;
    }

    /**
     * Evaluates the guard of a transition.
     * 
     * @param transition The index of the transition
     * @param counters   The counter valuation before the transition is fired
     * @return True iff the guard holds
     */
    public boolean guardHolds(int transition, long[] counters) {
        return transitions.get(transition).getGuard().holds(counters);
    }

    /**
     * Decides whether some run reads the given label word from the zero
     * configuration in the initial state to the zero configuration in the final
     * state.
     * 
     * Since several transitions can share a label, every matching transition is
     * followed.
     * 
     * @param word The label word
     * @return True iff the word labels a zero-to-zero run
     */
    public boolean accepts(Word<I> word) {
        Set<Configuration> current = new HashSet<>();
        current.add(new Configuration(initialState, new long[dimension]));

        for (I symbol : word) {
            Set<Configuration> next = new HashSet<>();
            for (Configuration configuration : current) {
                for (VASSTransition<I> transition : outgoing.get(configuration.state)) {
                    if (!Objects.equals(transition.getLabel(), symbol)
                            || !transition.getGuard().holds(configuration.counters)) {
                        continue;
                    }
                    long[] counters = configuration.counters.clone();
                    transition.applyTo(counters);
                    if (isNonNegative(counters)) {
                        next.add(new Configuration(transition.getTarget(), counters));
                    }
                }
            }
            if (next.isEmpty()) {
                return false;
            }
            current = next;
        }

        return current.contains(new Configuration(finalState, new long[dimension]));
    }

    private static boolean isNonNegative(long[] counters) {
        for (long value : counters) {
            if (value < 0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "VASS[states=" + size + ", dimension=" + dimension + ", transitions=" + transitions.size()
                + ", initial=q" + initialState + ", final=q" + finalState + "]";
    }

    private static final class Configuration {
        private final int state;
        private final long[] counters;

        Configuration(int state, long[] counters) {
            this.state = state;
            this.counters = counters;
        }

        @Override
        public boolean equals(Object obj) {
            if (obj == this) {
                return true;
            }
            if (obj == null || obj.getClass() != this.getClass()) {
                return false;
            }
            Configuration o = (Configuration) obj;
            return o.state == state && Arrays.equals(o.counters, counters);
        }

        @Override
        public int hashCode() {
            return 31 * state + Arrays.hashCode(counters);
        }
    }
}
