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

import de.vassreach.api.solver.Verdict;

/**
 * Diagnostics of a finished reachability query.
 * 
 * @author Gaëtan Staquet
 */
public final class SolverSummary {
    private final Verdict<?> verdict;
    private final int totalIterations;
    private final Duration wallTime;
    private final int peakModulus;

    public SolverSummary(Verdict<?> verdict, int totalIterations, Duration wallTime, int peakModulus) {
        this.verdict = verdict;
        this.totalIterations = totalIterations;
        this.wallTime = wallTime;
        this.peakModulus = peakModulus;
    }

    public Verdict<?> getVerdict() {
        return verdict;
    }

    public int getTotalIterations() {
        return totalIterations;
    }

    public Duration getWallTime() {
        return wallTime;
    }

    public int getPeakModulus() {
        return peakModulus;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("verdict", verdict.getStatus().name());
        map.put("total_iterations", totalIterations);
        map.put("wall_time_ms", wallTime.toMillis());
        map.put("peak_modulus", peakModulus);
        return Collections.unmodifiableMap(map);
    }

    @Override
    public String toString() {
        return toMap().toString();
    }
}
