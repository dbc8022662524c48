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
package de.vassreach.api.solver;

import java.time.Duration;
import java.util.Objects;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Limits imposed on one reachability query. Exceeding any of them yields an
 * unknown verdict.
 * 
 * Budgets are immutable; the {@code with} methods return modified copies.
 * 
 * @author Gaëtan Staquet
 */
public final class SearchBudget {

    /**
     * The limit that was exceeded.
     */
    public enum Limit {
        ITERATIONS, MODULUS, PATH_LENGTH, TIME
    }

    public static final int UNBOUNDED = Integer.MAX_VALUE;

    private static final int DEFAULT_MAX_MODULUS = 100;

    private final int maxIterations;
    private final int maxModulus;
    private final int maxPathLength;
    private final @Nullable Duration timeout;

    private SearchBudget(int maxIterations, int maxModulus, int maxPathLength, @Nullable Duration timeout) {
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("The number of iterations must be positive, got " + maxIterations);
        }
        if (maxModulus < 2) {
            throw new IllegalArgumentException("The maximal modulus must be at least 2, got " + maxModulus);
        }
        if (maxPathLength < 0) {
            throw new IllegalArgumentException("The maximal path length must be non-negative, got " + maxPathLength);
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("The timeout must be positive, got " + timeout);
        }
        this.maxIterations = maxIterations;
        this.maxModulus = maxModulus;
        this.maxPathLength = maxPathLength;
        this.timeout = timeout;
    }

    /**
     * @return A budget without any limit
     */
    public static SearchBudget unbounded() {
        return new SearchBudget(UNBOUNDED, UNBOUNDED, UNBOUNDED, null);
    }

    /**
     * @return A budget bounding the modulus by 100 and nothing else
     */
    public static SearchBudget defaults() {
        return new SearchBudget(UNBOUNDED, DEFAULT_MAX_MODULUS, UNBOUNDED, null);
    }

    public SearchBudget withMaxIterations(int maxIterations) {
        return new SearchBudget(maxIterations, maxModulus, maxPathLength, timeout);
    }

    public SearchBudget withMaxModulus(int maxModulus) {
        return new SearchBudget(maxIterations, maxModulus, maxPathLength, timeout);
    }

    public SearchBudget withMaxPathLength(int maxPathLength) {
        return new SearchBudget(maxIterations, maxModulus, maxPathLength, timeout);
    }

    public SearchBudget withTimeout(@Nullable Duration timeout) {
        return new SearchBudget(maxIterations, maxModulus, maxPathLength, timeout);
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public int getMaxModulus() {
        return maxModulus;
    }

    public int getMaxPathLength() {
        return maxPathLength;
    }

    public @Nullable Duration getTimeout() {
        return timeout;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj == null || obj.getClass() != getClass()) {
            return false;
        }
        SearchBudget o = (SearchBudget) obj;
        return o.maxIterations == maxIterations && o.maxModulus == maxModulus && o.maxPathLength == maxPathLength
                && Objects.equals(o.timeout, timeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxIterations, maxModulus, maxPathLength, timeout);
    }

    @Override
    public String toString() {
        return "SearchBudget[maxIterations=" + bound(maxIterations) + ", maxModulus=" + bound(maxModulus)
                + ", maxPathLength=" + bound(maxPathLength) + ", timeout=" + (timeout == null ? "none" : timeout)
                + "]";
    }

    private static String bound(int value) {
        return value == UNBOUNDED ? "none" : String.valueOf(value);
    }
}
