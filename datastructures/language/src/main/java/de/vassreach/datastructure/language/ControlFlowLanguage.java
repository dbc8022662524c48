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
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

import de.learnlib.api.logging.LearnLogger;
import de.vassreach.api.language.LanguageStep;
import de.vassreach.api.language.ReachabilityLanguage;
import de.vassreach.api.vass.VASS;
import de.vassreach.api.vass.VASSTransition;

/**
 * The language of the control graph of a {@link VASS}: every walk from the
 * initial state to the final state, counters ignored.
 * 
 * Derivation states are the control states. The graph is trimmed once, at
 * construction: only states that are reachable from the initial state and
 * co-reachable to the final state are kept. As a consequence, every derivation
 * of this language can be completed into an accepted word.
 * 
 * @param <I> Label type
 * @author Gaëtan Staquet
 */
public final class ControlFlowLanguage<I> implements ReachabilityLanguage<Integer, I> {

    private static final LearnLogger LOGGER = LearnLogger.getLogger(ControlFlowLanguage.class);

    private final VASS<I> vass;
    private final BitSet useful;
    private final List<List<LanguageStep<Integer, I>>> steps;

    public ControlFlowLanguage(VASS<I> vass) {
        this.vass = vass;
        BitSet reachable = reachableStates(vass);
        BitSet coReachable = coReachableStates(vass);
        this.useful = (BitSet) reachable.clone();
        this.useful.and(coReachable);

        this.steps = new ArrayList<>(vass.size());
        for (int state = 0; state < vass.size(); state++) {
            if (!useful.get(state)) {
                steps.add(Collections.emptyList());
                continue;
            }
            List<LanguageStep<Integer, I>> outgoing = new ArrayList<>();
            // getOutgoingTransitions is sorted by index
            for (VASSTransition<I> transition : vass.getOutgoingTransitions(state)) {
                if (useful.get(transition.getTarget())) {
                    outgoing.add(new LanguageStep<>(transition, transition.getTarget()));
                }
            }
            steps.add(Collections.unmodifiableList(outgoing));
        }

        if (useful.cardinality() < vass.size()) {
            LOGGER.debug("Trimmed the control graph from {} to {} states", vass.size(), useful.cardinality());
        }
    }

    private static <I> BitSet reachableStates(VASS<I> vass) {
        BitSet seen = new BitSet(vass.size());
        Deque<Integer> queue = new ArrayDeque<>();
        seen.set(vass.getInitialState());
        queue.add(vass.getInitialState());
        while (!queue.isEmpty()) {
            int state = queue.poll();
            for (VASSTransition<I> transition : vass.getOutgoingTransitions(state)) {
                if (!seen.get(transition.getTarget())) {
                    seen.set(transition.getTarget());
                    queue.add(transition.getTarget());
                }
            }
        }
        return seen;
    }

    private static <I> BitSet coReachableStates(VASS<I> vass) {
        BitSet seen = new BitSet(vass.size());
        Deque<Integer> queue = new ArrayDeque<>();
        seen.set(vass.getFinalState());
        queue.add(vass.getFinalState());
        while (!queue.isEmpty()) {
            int state = queue.poll();
            for (VASSTransition<I> transition : vass.getIncomingTransitions(state)) {
                if (!seen.get(transition.getSource())) {
                    seen.set(transition.getSource());
                    queue.add(transition.getSource());
                }
            }
        }
        return seen;
    }

    /**
     * @return True iff the language does not contain any word
     */
    public boolean isEmpty() {
        return !useful.get(vass.getInitialState());
    }

    /**
     * @param state A control state
     * @return True iff the state lies on a walk from the initial state to the
     *         final state
     */
    public boolean isUseful(int state) {
        return useful.get(state);
    }

    /**
     * @return The number of useful control states
     */
    public int getUsefulStateCount() {
        return useful.cardinality();
    }

    @Override
    public VASS<I> getVASS() {
        return vass;
    }

    @Override
    public Integer getInitialState() {
        return vass.getInitialState();
    }

    @Override
    public boolean isAccepting(Integer state) {
        return state == vass.getFinalState() && useful.get(state);
    }

    @Override
    public List<LanguageStep<Integer, I>> expand(Integer state) {
        return steps.get(state);
    }

    @Override
    public String toString() {
        return "ControlFlowLanguage[" + useful.cardinality() + "/" + vass.size() + " states]";
    }
}
