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
package de.vassreach.api.statistic;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import de.vassreach.api.oracle.SearchResult;
import de.vassreach.api.path.Classification;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Diagnostics of one refinement iteration.
 * 
 * @author Gaëtan Staquet
 */
public final class IterationRecord {
    /**
     * Value of the candidate length when the iteration did not produce a
     * candidate.
     */
    public static final int NO_CANDIDATE = -1;

    private final int iteration;
    private final int modulus;
    private final int candidateWordLength;
    private final SearchResult.Status searchStatus;
    private final @Nullable Classification classification;
    private final long exploredStates;
    private final Duration elapsed;

    public IterationRecord(int iteration, int modulus, int candidateWordLength, SearchResult.Status searchStatus,
            @Nullable Classification classification, long exploredStates, Duration elapsed) {
        this.iteration = iteration;
        this.modulus = modulus;
        this.candidateWordLength = candidateWordLength;
        this.searchStatus = searchStatus;
        this.classification = classification;
        this.exploredStates = exploredStates;
        this.elapsed = elapsed;
    }

    public int getIteration() {
        return iteration;
    }

    public int getModulus() {
        return modulus;
    }

    public int getCandidateWordLength() {
        return candidateWordLength;
    }

    public SearchResult.Status getSearchStatus() {
        return searchStatus;
    }

    public @Nullable Classification getClassification() {
        return classification;
    }

    public long getExploredStates() {
        return exploredStates;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    /**
     * @return The name of the classification, or the search status when no
     *         candidate was found
     */
    public String getOutcome() {
        return classification == null ? searchStatus.name() : classification.name();
    }

    /**
     * @return The record as ordered key/value pairs
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("iteration", iteration);
        map.put("modulus", modulus);
        map.put("candidate_word_length", candidateWordLength);
        map.put("classification", getOutcome());
        map.put("explored_states", exploredStates);
        map.put("elapsed_time_ms", elapsed.toMillis());
        return Collections.unmodifiableMap(map);
    }

    @Override
    public String toString() {
        return toMap().toString();
    }
}
