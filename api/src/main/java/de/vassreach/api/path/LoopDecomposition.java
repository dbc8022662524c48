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
package de.vassreach.api.path;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import de.vassreach.api.vass.VASSTransition;

/**
 * Splits a path into {@code prefix . loop . suffix} where {@code loop} is a
 * non-empty cycle of the control graph.
 * 
 * The decomposition describes the family of paths
 * {@code prefix . loop^k . suffix}, for every {@code k >= 0}. The net effect of
 * the member with {@code k} repetitions is {@code base + k * loopEffect} where
 * {@code base} is the net effect of {@code prefix . suffix}.
 * 
 * @param <I> Label type
 * @author Gaëtan Staquet
 */
public final class LoopDecomposition<I> {
    /**
     * Special value indicating that no repetition count balances the family.
     */
    public static final long NO_REPETITION = -1;

    private final Path<I> path;
    private final int loopStart;
    private final int loopEnd;

    /**
     * @param path      The path
     * @param loopStart The position of the first transition of the loop
     * @param loopEnd   The position after the last transition of the loop
     * @throws IllegalArgumentException If the positions do not delimit a
     *                                  non-empty cycle
     */
    public LoopDecomposition(Path<I> path, int loopStart, int loopEnd) {
        if (loopStart < 0 || loopEnd > path.length() || loopStart >= loopEnd) {
            throw new IllegalArgumentException("Invalid loop [" + loopStart + ", " + loopEnd + ")");
        }
        int[] states = path.getStates();
        if (states[loopStart] != states[loopEnd]) {
            throw new IllegalArgumentException("Transitions [" + loopStart + ", " + loopEnd + ") do not form a cycle");
        }
        this.path = path;
        this.loopStart = loopStart;
        this.loopEnd = loopEnd;
    }

    public Path<I> getPath() {
        return path;
    }

    public int getLoopStart() {
        return loopStart;
    }

    public int getLoopEnd() {
        return loopEnd;
    }

    /**
     * @return The state in which the loop starts and ends
     */
    public int getLoopState() {
        return path.getStates()[loopStart];
    }

    public List<VASSTransition<I>> getPrefix() {
        return Collections.unmodifiableList(path.getTransitions().subList(0, loopStart));
    }

    public List<VASSTransition<I>> getLoop() {
        return Collections.unmodifiableList(path.getTransitions().subList(loopStart, loopEnd));
    }

    public List<VASSTransition<I>> getSuffix() {
        return Collections.unmodifiableList(path.getTransitions().subList(loopEnd, path.length()));
    }

    public long[] getLoopEffect() {
        return sum(getLoop(), path.getVASS().getDimension());
    }

    /**
     * @return The net effect of {@code prefix . suffix}
     */
    public long[] getBaseEffect() {
        long[] base = path.getNetEffect();
        long[] loop = getLoopEffect();
        for (int i = 0; i < base.length; i++) {
            base[i] -= loop[i];
        }
        return base;
    }

    /**
     * Finds the smallest {@code k >= 0} such that {@code base + k * loopEffect} is
     * the zero vector.
     * 
     * @return The repetition count, or {@link #NO_REPETITION}
     */
    public long findZeroRepetition() {
        long[] base = getBaseEffect();
        long[] loop = getLoopEffect();
        long repetition = NO_REPETITION;
        for (int i = 0; i < base.length; i++) {
            if (loop[i] == 0) {
                if (base[i] != 0) {
                    return NO_REPETITION;
                }
                continue;
            }
            long value = -base[i];
            if (value % loop[i] != 0) {
                return NO_REPETITION;
            }
            long k = value / loop[i];
            if (k < 0 || (repetition != NO_REPETITION && repetition != k)) {
                return NO_REPETITION;
            }
            repetition = k;
        }
        // every counter ignores the loop: the family is balanced iff the base is
        return repetition == NO_REPETITION ? 0 : repetition;
    }

    /**
     * @return True iff no member of the family has a zero net effect
     */
    public boolean isNeverBalanced() {
        return findZeroRepetition() == NO_REPETITION;
    }

    private static <I> long[] sum(List<VASSTransition<I>> transitions, int dimension) {
        long[] effect = new long[dimension];
        for (VASSTransition<I> transition : transitions) {
            transition.applyTo(effect);
        }
        return effect;
    }

    @Override
    public String toString() {
        return "LoopDecomposition[loop=[" + loopStart + ", " + loopEnd + "), loopEffect="
                + Arrays.toString(getLoopEffect()) + ", baseEffect=" + Arrays.toString(getBaseEffect()) + "]";
    }
}
