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

import java.util.EnumMap;
import java.util.Map;

import de.learnlib.api.statistic.StatisticCollector;
import de.learnlib.filter.statistic.Counter;
import de.vassreach.api.oracle.PathOracle;
import de.vassreach.api.path.Classification;
import de.vassreach.api.path.ClassifiedPath;
import de.vassreach.api.path.Path;

/**
 * Counts the number of validated candidates, in total and per classification.
 * 
 * @param <I> Label type
 * @author Gaëtan Staquet
 */
public class CounterPathOracle<I> implements PathOracle<I>, StatisticCollector {

    private final Counter counter;
    private final Map<Classification, Counter> perClassification = new EnumMap<>(Classification.class);
    private PathOracle<I> pathOracle;

    public CounterPathOracle(PathOracle<I> pathOracle, String name) {
        this.pathOracle = pathOracle;
        this.counter = new Counter(name, "validations");
        for (Classification classification : Classification.values()) {
            perClassification.put(classification, new Counter(name + " (" + classification + ")", "validations"));
        }
    }

    @Override
    public Counter getStatisticalData() {
        return counter;
    }

    @Override
    public ClassifiedPath<I> classify(Path<I> candidate, int modulus) {
        counter.increment();
        ClassifiedPath<I> classified = getNextOracle().classify(candidate, modulus);
        perClassification.get(classified.getClassification()).increment();
        return classified;
    }

    public Counter getCounter() {
        return this.counter;
    }

    public long getCount() {
        return counter.getCount();
    }

    public long getCount(Classification classification) {
        return perClassification.get(classification).getCount();
    }

    public void setNext(PathOracle<I> next) {
        this.pathOracle = next;
    }

    protected PathOracle<I> getNextOracle() {
        return pathOracle;
    }
}
