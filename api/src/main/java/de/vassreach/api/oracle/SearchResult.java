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
package de.vassreach.api.oracle;

import de.vassreach.api.path.Path;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The answer of a {@link CandidateOracle}.
 * 
 * @param <I> Label type
 * @author Gaëtan Staquet
 */
public final class SearchResult<I> {

    public enum Status {
        /**
         * A candidate was found.
         */
        FOUND,
        /**
         * The language was fully explored without finding a candidate.
         */
        EXHAUSTED,
        /**
         * The exploration was cut by the path length bound.
         */
        TRUNCATED,
        /**
         * The exploring thread was interrupted.
         */
        INTERRUPTED
    }

    private final Status status;
    private final @Nullable Path<I> candidate;
    private final long exploredStates;

    private SearchResult(Status status, @Nullable Path<I> candidate, long exploredStates) {
        this.status = status;
        this.candidate = candidate;
        this.exploredStates = exploredStates;
    }

    public static <I> SearchResult<I> found(Path<I> candidate, long exploredStates) {
        return new SearchResult<>(Status.FOUND, candidate, exploredStates);
    }

    public static <I> SearchResult<I> exhausted(long exploredStates) {
        return new SearchResult<>(Status.EXHAUSTED, null, exploredStates);
    }

    public static <I> SearchResult<I> truncated(long exploredStates) {
        return new SearchResult<>(Status.TRUNCATED, null, exploredStates);
    }

    public static <I> SearchResult<I> interrupted(long exploredStates) {
        return new SearchResult<>(Status.INTERRUPTED, null, exploredStates);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }

    /**
     * @return The candidate
     * @throws IllegalStateException If no candidate was found
     */
    public Path<I> getCandidate() {
        if (candidate == null) {
            throw new IllegalStateException("The search ended with status " + status);
        }
        return candidate;
    }

    /**
     * @return The number of product states that were discovered during the search
     */
    public long getExploredStates() {
        return exploredStates;
    }

    @Override
    public String toString() {
        return status + (candidate == null ? "" : " " + candidate) + " (" + exploredStates + " states)";
    }
}
