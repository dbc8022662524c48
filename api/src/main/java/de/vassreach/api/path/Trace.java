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

/**
 * The exact counter valuations along a {@link Path}.
 * 
 * The valuation at position {@code i} is the valuation after the first
 * {@code i} transitions; position zero is the all-zero valuation. A replay
 * stops at the first transition that cannot be fired legally, either because
 * its guard does not hold or because a counter drops below zero. The last
 * valuation of a blocked trace is the one this transition would produce.
 * 
 * @author Gaëtan Staquet
 */
public final class Trace {
    /**
     * Special value indicating that every transition could be fired.
     */
    public static final int NOT_BLOCKED = -1;

    private final long[][] valuations;
    private final int blockedAt;
    private final long maximalMagnitude;

    public Trace(long[][] valuations, int blockedAt) {
        if (valuations.length == 0) {
            throw new IllegalArgumentException("A trace contains at least the initial valuation");
        }
        if (blockedAt != NOT_BLOCKED && blockedAt != valuations.length - 2) {
            throw new IllegalArgumentException("A blocked trace ends right after the blocking transition");
        }
        this.valuations = new long[valuations.length][];
        for (int i = 0; i < valuations.length; i++) {
            this.valuations[i] = valuations[i].clone();
        }
        // only legally reached valuations count
        final int legal = blockedAt == NOT_BLOCKED ? valuations.length : blockedAt + 1;
        long magnitude = 0;
        for (int i = 0; i < legal; i++) {
            for (long value : valuations[i]) {
                magnitude = Math.max(magnitude, Math.abs(value));
            }
        }
        this.blockedAt = blockedAt;
        this.maximalMagnitude = magnitude;
    }

    /**
     * @return The number of replayed transitions, the blocking one included
     */
    public int length() {
        return valuations.length - 1;
    }

    /**
     * @param position A position in {@code [0, length()]}
     * @return A copy of the valuation after {@code position} transitions
     */
    public long[] getValuation(int position) {
        return valuations[position].clone();
    }

    public long[] getFinalValuation() {
        return getValuation(valuations.length - 1);
    }

    /**
     * @return The index of the first transition that could not be fired, or
     *         {@link #NOT_BLOCKED}
     */
    public int getBlockedAt() {
        return blockedAt;
    }

    public boolean isBlocked() {
        return blockedAt != NOT_BLOCKED;
    }

    /**
     * @return The largest absolute counter value among the legally reached
     *         valuations, that is, every valuation before the blocking
     *         transition
     */
    public long getMaximalMagnitude() {
        return maximalMagnitude;
    }

    /**
     * @return True iff no counter is negative at any position
     */
    public boolean isNonNegative() {
        for (long[] valuation : valuations) {
            for (long value : valuation) {
                if (value < 0) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * @return True iff every counter is zero at the end of the trace
     */
    public boolean endsInZero() {
        for (long value : valuations[valuations.length - 1]) {
            if (value != 0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < valuations.length; i++) {
            if (i > 0) {
                builder.append(" -> ");
            }
            builder.append(Arrays.toString(valuations[i]));
        }
        if (isBlocked()) {
            builder.append(" (blocked at ").append(blockedAt).append(')');
        }
        return builder.toString();
    }
}
