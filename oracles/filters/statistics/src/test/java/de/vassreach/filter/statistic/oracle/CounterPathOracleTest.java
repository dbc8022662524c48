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

import de.vassreach.api.path.Classification;
import de.vassreach.api.path.Path;
import de.vassreach.api.vass.VASS;
import de.vassreach.examples.ExampleTwoCounters;
import de.vassreach.examples.ExampleWrapLoop;
import de.vassreach.oracle.path.CounterSimulatorOracle;
import org.testng.Assert;
import org.testng.annotations.Test;

public class CounterPathOracleTest {

    @Test
    public void testCountsPerClassification() {
        CounterPathOracle<Character> oracle = new CounterPathOracle<>(new CounterSimulatorOracle<>(),
                "validations");
        VASS<Character> pump = ExampleTwoCounters.createPumpAndDrain().getVASS();
        VASS<Character> wrap = ExampleWrapLoop.constructMachine(2);

        oracle.classify(Path.ofIndices(pump, 0, 0, 1), 2);
        oracle.classify(Path.ofIndices(pump, 1), 2);
        oracle.classify(Path.ofIndices(pump, 1, 2), 2);
        oracle.classify(Path.ofIndices(wrap, 0, 1, 1), 3);

        Assert.assertEquals(oracle.getCount(), 4);
        Assert.assertEquals(oracle.getCount(Classification.GENUINE_WITNESS), 1);
        Assert.assertEquals(oracle.getCount(Classification.NEGATIVE_EXCURSION), 2);
        Assert.assertEquals(oracle.getCount(Classification.WRAP_ONLY_LOOP), 1);
        Assert.assertEquals(oracle.getCount(Classification.INCONCLUSIVE), 0);
    }
}
