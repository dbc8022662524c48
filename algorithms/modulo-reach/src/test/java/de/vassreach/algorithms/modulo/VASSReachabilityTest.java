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
package de.vassreach.algorithms.modulo;

import java.util.Random;

import de.vassreach.api.solver.SearchBudget;
import de.vassreach.api.solver.Verdict;
import de.vassreach.api.vass.VASS;
import de.vassreach.examples.ExampleDisconnected;
import de.vassreach.examples.ExampleMutex;
import de.vassreach.examples.ExampleNegativeStep;
import de.vassreach.examples.ExampleRandomVASS;
import de.vassreach.examples.ExampleTinyReach;
import de.vassreach.examples.ExampleTwoCounters;
import de.vassreach.examples.ExampleWrapLoop;
import de.vassreach.examples.VASSExample;
import de.vassreach.oracle.path.CounterSimulator;
import net.automatalib.words.impl.Alphabets;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class VASSReachabilityTest {

    @DataProvider(name = "examples")
    public static Object[][] examples() {
        return new Object[][] { { ExampleTinyReach.createExample() }, { ExampleNegativeStep.createExample() },
                { ExampleDisconnected.createExample() }, { ExampleWrapLoop.createExample() },
                { new ExampleWrapLoop(3) }, { ExampleMutex.createExample() },
                { ExampleTwoCounters.createPumpAndDrain() }, { ExampleTwoCounters.createUnbalancedSecondCounter() },
                { ExampleTwoCounters.createNegativeEntry() } };
    }

    @Test(dataProvider = "examples")
    public void testExpectedVerdict(VASSExample<Character> example) {
        Verdict<Character> verdict = VASSReachability.decideReachability(example.getVASS(), SearchBudget.defaults());
        Assert.assertEquals(verdict.getStatus(), example.getExpectedStatus());
        if (verdict.isTrue()) {
            Assert.assertTrue(example.getVASS().accepts(verdict.getWitness().getLabelWord()));
        }
    }

    @Test(dataProvider = "examples")
    public void testParallelVerdict(VASSExample<Character> example) {
        Verdict<Character> sequential = VASSReachability.decideReachability(example.getVASS(),
                SearchBudget.defaults());
        Verdict<Character> parallel = VASSReachability.decideReachability(example.getVASS(), SearchBudget.defaults(),
                ModuloReachOptions.defaults().withParallelism(3));
        Assert.assertEquals(parallel, sequential);
    }

    @Test(timeOut = 60000)
    public void testRandomVerdictsAreSound() {
        Random random = new Random(7);
        SearchBudget budget = SearchBudget.defaults().withMaxModulus(12).withMaxIterations(50)
                .withMaxPathLength(40);
        for (int i = 0; i < 30; i++) {
            VASS<Character> vass = ExampleRandomVASS.constructMachine(random, Alphabets.characters('a', 'c'), 4, 2,
                    8, 2);
            Verdict<Character> verdict = VASSReachability.decideReachability(vass, budget);
            if (verdict.isTrue()) {
                Assert.assertTrue(CounterSimulator.replay(verdict.getWitness()).endsInZero());
                Assert.assertTrue(vass.accepts(verdict.getWitness().getLabelWord()));
            }
            if (verdict.isUnknown()) {
                Assert.assertEquals(verdict.getReason(), Verdict.UnknownReason.BUDGET_EXHAUSTED);
            }
        }
    }
}
