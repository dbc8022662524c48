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

import de.learnlib.api.logging.LearnLogger;
import de.vassreach.api.oracle.PathOracle;
import de.vassreach.api.path.ClassifiedPath;
import de.vassreach.api.path.LoopDecomposition;
import de.vassreach.api.path.Path;
import de.vassreach.api.path.Trace;

/**
 * Classifies candidates by replaying them with exact counter values.
 * 
 * The cases are tried in this order:
 * <ol>
 * <li>the replay is never blocked and ends in the zero valuation: genuine
 * witness;</li>
 * <li>the replay is blocked and every legally reached counter value is smaller
 * than the modulus in magnitude: negative excursion;</li>
 * <li>the path has an innermost cycle that no number of repetitions can
 * balance: wrap-only loop;</li>
 * <li>otherwise, inconclusive.</li>
 * </ol>
 * 
 * @param <I> Label type
 * @author Gaëtan Staquet
 */
public class CounterSimulatorOracle<I> implements PathOracle<I> {

    private static final LearnLogger LOGGER = LearnLogger.getLogger(CounterSimulatorOracle.class);

    @Override
    public ClassifiedPath<I> classify(Path<I> candidate, int modulus) {
        final Trace trace = CounterSimulator.replay(candidate);
        LOGGER.debug("Trace of {}: {}", candidate, trace);

        if (!trace.isBlocked() && trace.endsInZero()) {
            return ClassifiedPath.genuine(candidate, trace);
        }

        if (trace.isBlocked() && trace.getMaximalMagnitude() < modulus) {
            return ClassifiedPath.negativeExcursion(candidate, trace);
        }

        final LoopDecomposition<I> loop = Loops.findNeverBalancedLoop(candidate);
        if (loop != null) {
            return ClassifiedPath.wrapOnlyLoop(candidate, trace, loop);
        }

        return ClassifiedPath.inconclusive(candidate, trace);
    }
}
