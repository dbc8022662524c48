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
import java.util.List;

import de.vassreach.api.path.Path;
import de.vassreach.api.path.Trace;
import de.vassreach.api.vass.VASSTransition;

/**
 * Replays paths with exact counter values.
 * 
 * @author Gaëtan Staquet
 */
public final class CounterSimulator {

    private CounterSimulator() {
    }

    /**
     * Replays a path from the zero valuation.
     * 
     * Counters are replayed in {@code long}, so values beyond the {@code int}
     * range are reached exactly.
     * 
     * A transition blocks if its guard does not hold on the current valuation or
     * if a counter would drop below zero. The replay stops right after the first
     * blocking transition.
     * 
     * @param <I>  Label type
     * @param path The path
     * @return The trace
     */
    public static <I> Trace replay(Path<I> path) {
        final List<long[]> valuations = new ArrayList<>(path.length() + 1);
        long[] current = new long[path.getVASS().getDimension()];
        valuations.add(current);
        int blockedAt = Trace.NOT_BLOCKED;

        for (int i = 0; i < path.length(); i++) {
            final VASSTransition<I> transition = path.getTransition(i);
            final boolean guardHolds = transition.getGuard().holds(current);
            final long[] next = current.clone();
            transition.applyTo(next);
            valuations.add(next);
            if (!guardHolds || !isNonNegative(next)) {
                blockedAt = i;
                break;
            }
            current = next;
        }

        return new Trace(valuations.toArray(new long[0][]), blockedAt);
    }

    private static boolean isNonNegative(long[] valuation) {
        for (long value : valuation) {
            if (value < 0) {
                return false;
            }
        }
        return true;
    }
}
