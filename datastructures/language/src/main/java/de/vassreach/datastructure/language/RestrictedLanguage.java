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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import de.vassreach.api.language.LanguageStep;
import de.vassreach.api.language.ReachabilityLanguage;
import de.vassreach.api.vass.VASS;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The product of a reachability language with a list of exclusion automata.
 * 
 * A derivation is cut as soon as one automaton reaches a trap state. A
 * derivation state is accepting iff it is accepting in the underlying language
 * and no automaton is in an excluding state.
 * 
 * @param <S> Derivation state type of the underlying language
 * @param <I> Label type
 * @author Gaëtan Staquet
 */
public final class RestrictedLanguage<S, I> implements ReachabilityLanguage<RestrictedLanguage.State<S>, I> {

    /**
     * A state of the underlying language together with the states of the
     * exclusion automata.
     * 
     * @param <S> Derivation state type of the underlying language
     */
    public static final class State<S> {
        private final S base;
        private final int[] exclusionStates;
        private final int hash;

        State(S base, int[] exclusionStates) {
            this.base = base;
            this.exclusionStates = exclusionStates;
            this.hash = 31 * base.hashCode() + Arrays.hashCode(exclusionStates);
        }

        public S getBase() {
            return base;
        }

        public int getExclusionState(int automaton) {
            return exclusionStates[automaton];
        }

        @Override
        public boolean equals(@Nullable Object obj) {
            if (obj == this) {
                return true;
            }
            if (obj == null || obj.getClass() != getClass()) {
                return false;
            }
            State<?> o = (State<?>) obj;
            return o.hash == hash && Objects.equals(o.base, base) && Arrays.equals(o.exclusionStates, exclusionStates);
        }

        @Override
        public int hashCode() {
            return hash;
        }

        @Override
        public String toString() {
            return base + Arrays.toString(exclusionStates);
        }
    }

    private final ReachabilityLanguage<S, I> language;
    private final List<ExclusionAutomaton> exclusions;
    private final State<S> initialState;

    public RestrictedLanguage(ReachabilityLanguage<S, I> language, List<ExclusionAutomaton> exclusions) {
        this.language = language;
        this.exclusions = Collections.unmodifiableList(new ArrayList<>(exclusions));
        int[] initial = new int[this.exclusions.size()];
        for (int i = 0; i < initial.length; i++) {
            initial[i] = this.exclusions.get(i).getInitialState();
        }
        this.initialState = new State<>(language.getInitialState(), initial);
    }

    public ReachabilityLanguage<S, I> getUnderlyingLanguage() {
        return language;
    }

    public List<ExclusionAutomaton> getExclusions() {
        return exclusions;
    }

    @Override
    public VASS<I> getVASS() {
        return language.getVASS();
    }

    @Override
    public State<S> getInitialState() {
        return initialState;
    }

    /**
     * @param state A derivation state
     * @return True iff every extension of the derivation is excluded
     */
    public boolean isTrapped(State<S> state) {
        for (int i = 0; i < exclusions.size(); i++) {
            if (exclusions.get(i).isTrap(state.exclusionStates[i])) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean isAccepting(State<S> state) {
        if (!language.isAccepting(state.base)) {
            return false;
        }
        for (int i = 0; i < exclusions.size(); i++) {
            if (exclusions.get(i).isExcluding(state.exclusionStates[i])) {
                return false;
            }
        }
        return true;
    }

    @Override
    public List<LanguageStep<State<S>, I>> expand(State<S> state) {
        if (isTrapped(state)) {
            return Collections.emptyList();
        }
        final List<LanguageStep<S, I>> baseSteps = language.expand(state.base);
        final List<LanguageStep<State<S>, I>> steps = new ArrayList<>(baseSteps.size());
        for (LanguageStep<S, I> step : baseSteps) {
            final int index = step.getTransition().getIndex();
            final int[] next = new int[exclusions.size()];
            boolean trapped = false;
            for (int i = 0; i < next.length && !trapped; i++) {
                next[i] = exclusions.get(i).getSuccessor(state.exclusionStates[i], index);
                trapped = exclusions.get(i).isTrap(next[i]);
            }
            if (!trapped) {
                steps.add(new LanguageStep<>(step.getTransition(), new State<>(step.getTarget(), next)));
            }
        }
        return steps;
    }

    @Override
    public String toString() {
        return "RestrictedLanguage[" + language + ", " + exclusions.size() + " exclusions]";
    }
}
