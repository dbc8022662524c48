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
package de.vassreach.oracle.path;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import de.vassreach.api.path.LoopDecomposition;
import de.vassreach.api.path.Path;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Finds cycles in paths.
 * 
 * @author Gaëtan Staquet
 */
public final class Loops {

    private Loops() {
    }

    /**
     * Lists the innermost cycles of a path. For every position {@code j} whose
     * state already appeared before, the cycle starts at the last earlier
     * position {@code i} with the same state and covers the transitions
     * {@code [i, j)}.
     * 
     * @param <I>  Label type
     * @param path The path
     * @return The decompositions, sorted by the end of the cycle
     */
    public static <I> List<LoopDecomposition<I>> innermostLoops(Path<I> path) {
        final int[] states = path.getStates();
        final int[] lastSeen = new int[path.getVASS().size()];
        Arrays.fill(lastSeen, -1);

        final List<LoopDecomposition<I>> loops = new ArrayList<>();
        for (int j = 0; j < states.length; j++) {
            final int i = lastSeen[states[j]];
            if (i != -1) {
                loops.add(new LoopDecomposition<>(path, i, j));
            }
            lastSeen[states[j]] = j;
        }
        return Collections.unmodifiableList(loops);
    }

    /**
     * @param <I>  Label type
     * @param path The path
     * @return The first innermost cycle such that no repetition count balances
     *         the path, or {@code null}
     */
    public static <I> @Nullable LoopDecomposition<I> findNeverBalancedLoop(Path<I> path) {
        for (LoopDecomposition<I> loop : innermostLoops(path)) {
            if (loop.isNeverBalanced()) {
                return loop;
            }
        }
        return null;
    }
}
