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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import net.automatalib.words.Alphabet;
import net.automatalib.words.impl.Alphabets;

/**
 * Collects states and transitions and creates an immutable {@link VASS}.
 * 
 * Structural checks are delayed until {@link #create(int, int)} so that a
 * loader can describe the instance in any order. Transitions whose guard can
 * never be satisfied are dropped at that point; the remaining transitions keep
 * their relative order and are re-indexed from zero.
 * 
 * <pre>
 * VASSBuilder&lt;Character&gt; builder = new VASSBuilder&lt;&gt;(1);
 * int q0 = builder.addState();
 * int q1 = builder.addState();
 * builder.addTransition(q0, q1, 'a', +1);
 * VASS&lt;Character&gt; vass = builder.create(q0, q1);
 * </pre>
 * 
 * @param <I> Label type
 * @author Gaëtan Staquet
 */
public class VASSBuilder<I> {

    private final int dimension;
    private int size;
    private final List<PendingTransition<I>> pending = new ArrayList<>();

    /**
     * @param dimension The number of counters
     * @throws MalformedInstanceException If the dimension is negative
     */
    public VASSBuilder(int dimension) {
        if (dimension < 0) {
            throw new MalformedInstanceException("The dimension must be non-negative, got " + dimension);
        }
        this.dimension = dimension;
    }

    public int getDimension() {
        return dimension;
    }

    /**
     * Adds a new state.
     * 
     * @return The identifier of the state
     */
    public int addState() {
        return size++;
    }

    /**
     * Adds an unguarded transition.
     * 
     * @param source The source state
     * @param target The target state
     * @param label  The label
     * @param effect The effect on the counters
     * @return This builder
     */
    public VASSBuilder<I> addTransition(int source, int target, I label, int... effect) {
        return addGuardedTransition(source, target, label, Guard.alwaysTrue(), effect);
    }

    /**
     * Adds a guarded transition.
     * 
     * @param source The source state
     * @param target The target state
     * @param label  The label
     * @param guard  The guard, evaluated before the effect is applied
     * @param effect The effect on the counters
     * @return This builder
     */
    public VASSBuilder<I> addGuardedTransition(int source, int target, I label, Guard guard, int... effect) {
        pending.add(new PendingTransition<>(source, target, label, guard, effect.clone()));
        return this;
    }

    /**
     * Validates the description and creates the VASS.
     * 
     * @param initialState The initial state
     * @param finalState   The final state
     * @return The VASS
     * @throws MalformedInstanceException If the description is inconsistent
     */
    public VASS<I> create(int initialState, int finalState) {
        checkState(initialState, "initial state");
        checkState(finalState, "final state");

        List<VASSTransition<I>> transitions = new ArrayList<>(pending.size());
        Set<I> labels = new LinkedHashSet<>();

        for (int i = 0; i < pending.size(); i++) {
            PendingTransition<I> p = pending.get(i);
            checkState(p.source, "source of transition " + i);
            checkState(p.target, "target of transition " + i);
            if (p.label == null) {
                throw new MalformedInstanceException("Transition " + i + " has no label");
            }
            if (p.guard == null) {
                throw new MalformedInstanceException("Transition " + i + " has no guard");
            }
            if (p.effect.length != dimension) {
                throw new MalformedInstanceException("Transition " + i + " has an effect of dimension "
                        + p.effect.length + " but the VASS has dimension " + dimension + ": "
                        + Arrays.toString(p.effect));
            }
            if (p.guard instanceof Guards.LowerBoundGuard
                    && ((Guards.LowerBoundGuard) p.guard).dimension() != dimension) {
                throw new MalformedInstanceException("Transition " + i + " has a guard of dimension "
                        + ((Guards.LowerBoundGuard) p.guard).dimension() + " but the VASS has dimension "
                        + dimension);
            }

            VASSTransition<I> transition = new VASSTransition<>(transitions.size(), p.source, p.target, p.label,
                    p.effect, p.guard);
            if (!p.guard.isSatisfiableFrom(transition.getMinimalEnablingValuation())) {
                // structurally dead, the transition can never be fired
                continue;
            }
            transitions.add(transition);
            labels.add(p.label);
        }

        Alphabet<I> alphabet = Alphabets.fromList(new ArrayList<>(labels));
        return new VASS<>(size, dimension, initialState, finalState, transitions, alphabet);
    }

    private void checkState(int state, String role) {
        if (state < 0 || state >= size) {
            throw new MalformedInstanceException(
                    "The " + role + " (" + state + ") is not a declared state; the VASS has " + size + " states");
        }
    }

    private static final class PendingTransition<I> {
        private final int source;
        private final int target;
        private final I label;
        private final Guard guard;
        private final int[] effect;

        PendingTransition(int source, int target, I label, Guard guard, int[] effect) {
            this.source = source;
            this.target = target;
            this.label = label;
            this.guard = guard;
            this.effect = effect;
        }
    }
}
