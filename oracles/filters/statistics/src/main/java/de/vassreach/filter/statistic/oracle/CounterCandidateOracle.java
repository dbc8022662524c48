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
package de.vassreach.filter.statistic.oracle;

import de.learnlib.api.statistic.StatisticCollector;
import de.learnlib.filter.statistic.Counter;
import de.vassreach.api.language.ReachabilityLanguage;
import de.vassreach.api.oracle.CandidateOracle;
import de.vassreach.api.oracle.SearchResult;

/**
 * Counts the number of candidate searches and the number of product states they
 * explored.
 * 
 * @param <I> Label type
 * @author Gaëtan Staquet
 */
public class CounterCandidateOracle<I> implements CandidateOracle<I>, StatisticCollector {

    private final Counter counter;
    private final Counter exploredStates;
    private CandidateOracle<I> candidateOracle;

    public CounterCandidateOracle(CandidateOracle<I> candidateOracle, String name) {
        this.candidateOracle = candidateOracle;
        this.counter = new Counter(name, "searches");
        this.exploredStates = new Counter(name, "explored states");
    }

    @Override
    public Counter getStatisticalData() {
        return counter;
    }

    @Override
    public <S> SearchResult<I> findCandidate(ReachabilityLanguage<S, I> language, int modulus, int maxPathLength) {
        counter.increment();
        SearchResult<I> result = getNextOracle().findCandidate(language, modulus, maxPathLength);
        exploredStates.increment(result.getExploredStates());
        return result;
    }

    public Counter getCounter() {
        return this.counter;
    }

    public long getCount() {
        return counter.getCount();
    }

    public Counter getExploredStatesCounter() {
        return exploredStates;
    }

    public long getExploredStates() {
        return exploredStates.getCount();
    }

    public void setNext(CandidateOracle<I> next) {
        this.candidateOracle = next;
    }

    protected CandidateOracle<I> getNextOracle() {
        return candidateOracle;
    }
}
