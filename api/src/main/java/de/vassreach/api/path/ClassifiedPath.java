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

import java.util.Objects;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A candidate path together with its exact trace and its classification.
 * 
 * A negative excursion carries the position of the blocking transition. A
 * wrap-only loop carries the loop decomposition that proves the family never
 * balances.
 * 
 * @param <I> Label type
 * @author Gaëtan Staquet
 */
public final class ClassifiedPath<I> {
    private final Path<I> path;
    private final Trace trace;
    private final Classification classification;
    private final @Nullable LoopDecomposition<I> loop;

    private ClassifiedPath(Path<I> path, Trace trace, Classification classification,
            @Nullable LoopDecomposition<I> loop) {
        this.path = path;
        this.trace = trace;
        this.classification = classification;
        this.loop = loop;
    }

    public static <I> ClassifiedPath<I> genuine(Path<I> path, Trace trace) {
        return new ClassifiedPath<>(path, trace, Classification.GENUINE_WITNESS, null);
    }

    public static <I> ClassifiedPath<I> negativeExcursion(Path<I> path, Trace trace) {
        if (!trace.isBlocked()) {
            throw new IllegalArgumentException("A negative excursion must be blocked");
        }
        return new ClassifiedPath<>(path, trace, Classification.NEGATIVE_EXCURSION, null);
    }

    public static <I> ClassifiedPath<I> wrapOnlyLoop(Path<I> path, Trace trace, LoopDecomposition<I> loop) {
        return new ClassifiedPath<>(path, trace, Classification.WRAP_ONLY_LOOP, loop);
    }

    public static <I> ClassifiedPath<I> inconclusive(Path<I> path, Trace trace) {
        return new ClassifiedPath<>(path, trace, Classification.INCONCLUSIVE, null);
    }

    public Path<I> getPath() {
        return path;
    }

    public Trace getTrace() {
        return trace;
    }

    public Classification getClassification() {
        return classification;
    }

    /**
     * @return The length of the prefix that must be excluded, that is, the
     *         blocking transition included
     * @throws IllegalStateException If the path is not a negative excursion
     */
    public int getExcludedPrefixLength() {
        if (classification != Classification.NEGATIVE_EXCURSION) {
            throw new IllegalStateException("Only negative excursions have an excluded prefix");
        }
        return trace.getBlockedAt() + 1;
    }

    /**
     * @return The loop decomposition
     * @throws IllegalStateException If the path is not a wrap-only loop
     */
    public LoopDecomposition<I> getLoop() {
        if (loop == null) {
            throw new IllegalStateException("Only wrap-only loops have a loop decomposition");
        }
        return loop;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj == null || obj.getClass() != getClass()) {
            return false;
        }
        ClassifiedPath<?> o = (ClassifiedPath<?>) obj;
        return o.classification == classification && Objects.equals(o.path, path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, classification);
    }

    @Override
    public String toString() {
        return classification + ": " + path;
    }
}
