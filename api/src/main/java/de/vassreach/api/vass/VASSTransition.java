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

import java.util.Arrays;

/**
 * A guarded, labeled transition of a {@link VASS}.
 * 
 * Transitions are immutable. The index is the position of the transition in
 * {@link VASS#getTransitions()} and is used as the tie-break order of every
 * search.
 * 
 * @param <I> Label type
 * @author Gaëtan Staquet
 */
public final class VASSTransition<I> {
    private final int index;
    private final int source;
    private final int target;
    private final I label;
    private final int[] effect;
    private final Guard guard;

    VASSTransition(int index, int source, int target, I label, int[] effect, Guard guard) {
        this.index = index;
        this.source = source;
        this.target = target;
        this.label = label;
        this.effect = effect.clone();
        this.guard = guard;
    }

    public int getIndex() {
        return index;
    }

    public int getSource() {
        return source;
    }

    public int getTarget() {
        return target;
    }

    public I getLabel() {
        return label;
    }

    public Guard getGuard() {
        return guard;
    }

    public int getDimension() {
        return effect.length;
    }

    /**
     * @return A copy of the effect vector
     */
    public int[] getEffect() {
        return effect.clone();
    }

    public int getEffect(int counter) {
        return effect[counter];
    }

    /**
     * Adds the effect to the given valuation, in place.
     * 
     * Valuations are kept in {@code long}: a path of at most
     * {@code Integer.MAX_VALUE} transitions with {@code int} effects cannot leave
     * the range, so an overflow is a fault.
     * 
     * @param counters The valuation to update
     * @throws ArithmeticException If a counter overflows
     */
    public void applyTo(long[] counters) {
        for (int i = 0; i < effect.length; i++) {
            counters[i] = Math.addExact(counters[i], effect[i]);
        }
    }

    /**
     * Adds the effect to the given residues, in place, modulo {@code modulus}.
     * 
     * @param residues The residues, each in {@code [0, modulus)}
     * @param modulus  The modulus
     */
    public void applyModulo(int[] residues, int modulus) {
        for (int i = 0; i < effect.length; i++) {
            residues[i] = (int) Math.floorMod((long) residues[i] + effect[i], (long) modulus);
        }
    }

    /**
     * The smallest valuation from which the effect can be applied without a
     * counter dropping below zero.
     * 
     * @return The negated negative part of the effect
     */
    public long[] getMinimalEnablingValuation() {
        long[] minimum = new long[effect.length];
        for (int i = 0; i < effect.length; i++) {
            minimum[i] = Math.max(0L, -(long) effect[i]);
        }
        return minimum;
    }

    @Override
    public String toString() {
        return "q" + source + " --(" + label + ", " + Arrays.toString(effect) + ")-> q" + target;
    }
}
