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

import java.time.Duration;
import java.util.List;

import de.vassreach.api.path.Classification;
import de.vassreach.api.path.Path;
import de.vassreach.api.solver.SearchBudget;
import de.vassreach.api.solver.Verdict;
import de.vassreach.api.statistic.IterationRecord;
import de.vassreach.api.vass.VASS;
import de.vassreach.api.vass.VASSBuilder;
import de.vassreach.examples.ExampleDisconnected;
import de.vassreach.examples.ExampleMutex;
import de.vassreach.examples.ExampleNegativeStep;
import de.vassreach.examples.ExampleTinyReach;
import de.vassreach.examples.ExampleTwoCounters;
import de.vassreach.examples.ExampleWrapLoop;
import de.vassreach.filter.statistic.oracle.CounterCandidateOracle;
import de.vassreach.filter.statistic.oracle.CounterPathOracle;
import de.vassreach.oracle.candidate.BreadthFirstCandidateOracle;
import de.vassreach.oracle.path.CounterSimulator;
import de.vassreach.oracle.path.CounterSimulatorOracle;
import net.automatalib.words.Word;
import org.testng.Assert;
import org.testng.annotations.Test;

public class ModuloReachSolverTest {

    private static <I> ModuloReachSolver<I> solve(VASS<I> vass, SearchBudget budget, ModuloReachOptions options) {
        ModuloReachSolver<I> solver = new ModuloReachSolver<>(vass, budget, options);
        solver.run();
        return solver;
    }

    private static <I> ModuloReachSolver<I> solve(VASS<I> vass) {
        return solve(vass, SearchBudget.defaults(), ModuloReachOptions.defaults());
    }

    private static void checkModulusHistory(List<IterationRecord> records) {
        for (int i = 1; i < records.size(); i++) {
            IterationRecord previous = records.get(i - 1);
            IterationRecord current = records.get(i);
            Assert.assertEquals(current.getIteration(), previous.getIteration() + 1);
            if (previous.getClassification() == Classification.INCONCLUSIVE) {
                Assert.assertTrue(current.getModulus() > previous.getModulus());
            } else {
                Assert.assertEquals(current.getModulus(), previous.getModulus());
            }
        }
    }

    @Test
    public void testTinyReach() {
        VASS<Character> vass = ExampleTinyReach.constructMachine();
        ModuloReachSolver<Character> solver = solve(vass);
        Verdict<Character> verdict = solver.getResult();

        Assert.assertTrue(verdict.isTrue());
        Assert.assertEquals(verdict.getWitness().getLabelWord(), Word.fromCharSequence("ab"));
        Assert.assertTrue(vass.accepts(verdict.getWitness().getLabelWord()));
        Assert.assertEquals(solver.getIterationRecords().size(), 1);
        Assert.assertEquals(solver.getPhase(), RefinementPhase.DONE);
        Assert.assertEquals(solver.getSummary().getTotalIterations(), 1);
        Assert.assertEquals(solver.getSummary().getPeakModulus(), 2);
    }

    @Test
    public void testWitnessAfterNegativeExcursion() {
        VASS<Character> vass = ExampleTwoCounters.createPumpAndDrain().getVASS();
        ModuloReachSolver<Character> solver = solve(vass);
        Verdict<Character> verdict = solver.getResult();

        Assert.assertTrue(verdict.isTrue());
        Assert.assertEquals(verdict.getWitness(), Path.ofIndices(vass, 0, 0, 1));
        Assert.assertTrue(CounterSimulator.replay(verdict.getWitness()).endsInZero());
        Assert.assertEquals(solver.getExclusionCount(), 1);

        List<IterationRecord> records = solver.getIterationRecords();
        Assert.assertEquals(records.size(), 2);
        Assert.assertEquals(records.get(0).getClassification(), Classification.NEGATIVE_EXCURSION);
        Assert.assertEquals(records.get(0).getCandidateWordLength(), 1);
        Assert.assertEquals(records.get(1).getClassification(), Classification.GENUINE_WITNESS);
        Assert.assertEquals(records.get(1).getModulus(), 2);
    }

    // No path through the negative step has a zero residue, so the abstract
    // language is exhausted before any excursion is classified (DESIGN.md, decision 3).
    @Test
    public void testNoCandidateModuloTwo() {
        ModuloReachSolver<Character> solver = solve(ExampleNegativeStep.constructMachine());

        Assert.assertTrue(solver.getResult().isFalse());
        Assert.assertEquals(solver.getIterationRecords().size(), 1);
        Assert.assertEquals(solver.getIterationRecords().get(0).getCandidateWordLength(),
                IterationRecord.NO_CANDIDATE);
        Assert.assertNull(solver.getIterationRecords().get(0).getClassification());
    }

    @Test
    public void testNegativeEntry() {
        ModuloReachSolver<Character> solver = solve(ExampleTwoCounters.createNegativeEntry().getVASS());

        Assert.assertTrue(solver.getResult().isFalse());
        Assert.assertEquals(solver.getExclusionCount(), 1);
        Assert.assertEquals(solver.getIterationRecords().size(), 2);
    }

    @Test
    public void testUnbalancedSecondCounter() {
        ModuloReachSolver<Character> solver = solve(ExampleTwoCounters.createUnbalancedSecondCounter().getVASS());

        Assert.assertTrue(solver.getResult().isFalse());
        Assert.assertEquals(solver.getIterationRecords().size(), 1);
    }

    @Test
    public void testDisconnected() {
        ModuloReachSolver<Character> solver = solve(ExampleDisconnected.constructMachine());

        Assert.assertTrue(solver.getResult().isFalse());
        Assert.assertEquals(solver.getIterationRecords().get(0).getExploredStates(), 1);
    }

    @Test
    public void testWrapLoop() {
        ModuloReachSolver<Character> solver = solve(ExampleWrapLoop.constructMachine(2));

        Assert.assertTrue(solver.getResult().isFalse());
        Assert.assertEquals(solver.getModulus(), 3);
        Assert.assertEquals(solver.getSummary().getPeakModulus(), 3);

        List<IterationRecord> records = solver.getIterationRecords();
        Assert.assertEquals(records.size(), 3);
        Assert.assertEquals(records.get(0).getClassification(), Classification.INCONCLUSIVE);
        Assert.assertEquals(records.get(0).getModulus(), 2);
        Assert.assertEquals(records.get(1).getClassification(), Classification.WRAP_ONLY_LOOP);
        Assert.assertEquals(records.get(1).getCandidateWordLength(), 3);
        Assert.assertEquals(records.get(2).getOutcome(), "EXHAUSTED");
        checkModulusHistory(records);
    }

    @Test(timeOut = 60000)
    public void testMutex() {
        ModuloReachSolver<Character> solver = solve(ExampleMutex.constructMachine());

        Assert.assertTrue(solver.getResult().isFalse());
        Assert.assertEquals(solver.getExclusionCount(), 4);
        Assert.assertEquals(solver.getModulus(), 2);

        List<IterationRecord> records = solver.getIterationRecords();
        Assert.assertEquals(records.size(), 5);
        for (int i = 0; i < 4; i++) {
            Assert.assertEquals(records.get(i).getClassification(), Classification.NEGATIVE_EXCURSION);
        }
        checkModulusHistory(records);
    }

    @Test
    public void testInitialStateIsFinal() {
        VASSBuilder<Character> builder = new VASSBuilder<>(1);
        int q0 = builder.addState();
        builder.addTransition(q0, q0, 'a', -1);
        VASS<Character> vass = builder.create(q0, q0);

        Verdict<Character> verdict = solve(vass).getResult();
        Assert.assertTrue(verdict.isTrue());
        Assert.assertTrue(verdict.getWitness().isEmpty());
    }

    @Test
    public void testCounterBeyondIntRange() {
        VASSBuilder<Character> builder = new VASSBuilder<>(1);
        int q0 = builder.addState();
        int q1 = builder.addState();
        int q2 = builder.addState();
        int q3 = builder.addState();
        int q4 = builder.addState();
        builder.addTransition(q0, q1, 'a', 1);
        builder.addTransition(q1, q2, 'b', Integer.MAX_VALUE);
        builder.addTransition(q2, q3, 'c', -Integer.MAX_VALUE);
        builder.addTransition(q3, q4, 'd', -1);
        VASS<Character> vass = builder.create(q0, q4);

        ModuloReachSolver<Character> solver = solve(vass);
        Verdict<Character> verdict = solver.getResult();

        // the run passes through 2^31 before draining back to zero
        Assert.assertTrue(verdict.isTrue());
        Assert.assertEquals(verdict.getWitness(), Path.ofIndices(vass, 0, 1, 2, 3));
        Assert.assertEquals(solver.getIterationRecords().size(), 1);
        Assert.assertEquals(solver.getIterationRecords().get(0).getClassification(), Classification.GENUINE_WITNESS);
        Assert.assertTrue(vass.accepts(Word.fromCharSequence("abcd")));
    }

    @Test
    public void testModulusPolicies() {
        VASS<Character> vass = ExampleWrapLoop.constructMachine(2);

        ModuloReachSolver<Character> doubling = solve(vass, SearchBudget.defaults(),
                ModuloReachOptions.defaults().withModulusPolicy(ModulusPolicy.DOUBLE));
        Assert.assertTrue(doubling.getResult().isFalse());
        Assert.assertEquals(doubling.getModulus(), 4);
        Assert.assertEquals(doubling.getIterationRecords().get(1).getCandidateWordLength(), 2);

        ModuloReachSolver<Character> lcm = solve(vass, SearchBudget.defaults(),
                ModuloReachOptions.defaults().withModulusPolicy(ModulusPolicy.LEAST_COMMON_MULTIPLE));
        Assert.assertTrue(lcm.getResult().isFalse());
        Assert.assertEquals(lcm.getModulus(), 6);
        checkModulusHistory(lcm.getIterationRecords());
    }

    @Test
    public void testInitialModulus() {
        ModuloReachSolver<Character> solver = solve(ExampleWrapLoop.constructMachine(2), SearchBudget.defaults(),
                ModuloReachOptions.defaults().withInitialModulus(3));

        Assert.assertTrue(solver.getResult().isFalse());
        Assert.assertEquals(solver.getIterationRecords().size(), 2);
    }

    @Test
    public void testIterationLimit() {
        ModuloReachSolver<Character> solver = solve(ExampleWrapLoop.constructMachine(2),
                SearchBudget.defaults().withMaxIterations(1), ModuloReachOptions.defaults());
        Verdict<Character> verdict = solver.getResult();

        Assert.assertTrue(verdict.isUnknown());
        Assert.assertEquals(verdict.getReason(), Verdict.UnknownReason.BUDGET_EXHAUSTED);
        Assert.assertEquals(verdict.getLimit(), SearchBudget.Limit.ITERATIONS);
        Assert.assertEquals(solver.getIterationRecords().size(), 1);
    }

    @Test
    public void testModulusLimit() {
        Verdict<Character> verdict = solve(ExampleWrapLoop.constructMachine(2),
                SearchBudget.defaults().withMaxModulus(2), ModuloReachOptions.defaults()).getResult();
        Assert.assertEquals(verdict.getLimit(), SearchBudget.Limit.MODULUS);

        ModuloReachSolver<Character> solver = solve(ExampleTinyReach.constructMachine(),
                SearchBudget.defaults().withMaxModulus(3), ModuloReachOptions.defaults().withInitialModulus(5));
        Assert.assertEquals(solver.getResult().getLimit(), SearchBudget.Limit.MODULUS);
        Assert.assertTrue(solver.getIterationRecords().isEmpty());
    }

    @Test
    public void testPathLengthLimit() {
        ModuloReachSolver<Character> solver = solve(ExampleWrapLoop.constructMachine(2),
                SearchBudget.defaults().withMaxPathLength(2), ModuloReachOptions.defaults());

        Assert.assertEquals(solver.getResult().getLimit(), SearchBudget.Limit.PATH_LENGTH);
        Assert.assertEquals(solver.getIterationRecords().size(), 2);
        Assert.assertEquals(solver.getIterationRecords().get(1).getOutcome(), "TRUNCATED");
    }

    @Test
    public void testTimeout() {
        Verdict<Character> verdict = solve(ExampleMutex.constructMachine(),
                SearchBudget.defaults().withTimeout(Duration.ofNanos(1)), ModuloReachOptions.defaults())
                .getResult();
        Assert.assertEquals(verdict.getLimit(), SearchBudget.Limit.TIME);
    }

    @Test
    public void testInterrupted() {
        ModuloReachSolver<Character> solver = new ModuloReachSolver<>(ExampleMutex.constructMachine(),
                SearchBudget.defaults());
        Thread.currentThread().interrupt();
        try {
            Verdict<Character> verdict = solver.run();
            Assert.assertTrue(verdict.isUnknown());
            Assert.assertEquals(verdict.getReason(), Verdict.UnknownReason.INTERRUPTED);
            Assert.assertNull(verdict.getLimit());
            Assert.assertTrue(solver.getIterationRecords().isEmpty());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    public void testDeterminism() {
        VASS<Character> vass = ExampleTwoCounters.createPumpAndDrain().getVASS();
        Verdict<Character> first = solve(vass).getResult();
        Verdict<Character> second = solve(vass).getResult();
        Verdict<Character> parallel = solve(vass, SearchBudget.defaults(),
                ModuloReachOptions.defaults().withParallelism(4)).getResult();

        Assert.assertEquals(second, first);
        Assert.assertEquals(parallel, first);
        Assert.assertEquals(parallel.getWitness(), first.getWitness());
    }

    @Test
    public void testDecoratedOracles() {
        CounterCandidateOracle<Character> candidates = new CounterCandidateOracle<>(
                new BreadthFirstCandidateOracle<>(), "candidate searches");
        CounterPathOracle<Character> validations = new CounterPathOracle<>(new CounterSimulatorOracle<>(),
                "validations");
        ModuloReachSolver<Character> solver = new ModuloReachSolver<>(ExampleMutex.constructMachine(),
                SearchBudget.defaults(), ModuloReachOptions.defaults().withProfile(true), candidates, validations);

        Assert.assertTrue(solver.run().isFalse());
        Assert.assertEquals(candidates.getCount(), 5);
        Assert.assertEquals(validations.getCount(), 4);
        Assert.assertEquals(validations.getCount(Classification.NEGATIVE_EXCURSION), 4);
        Assert.assertEquals(solver.getRounds().getCount(), 5);

        long explored = 0;
        for (IterationRecord record : solver.getIterationRecords()) {
            explored += record.getExploredStates();
        }
        Assert.assertEquals(candidates.getExploredStates(), explored);
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testRunTwice() {
        ModuloReachSolver<Character> solver = new ModuloReachSolver<>(ExampleTinyReach.constructMachine(),
                SearchBudget.defaults());
        solver.run();
        solver.run();
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testSummaryBeforeRun() {
        ModuloReachSolver<Character> solver = new ModuloReachSolver<>(ExampleTinyReach.constructMachine(),
                SearchBudget.defaults());
        Assert.assertEquals(solver.getPhase(), RefinementPhase.INIT);
        Assert.assertFalse(solver.hasRun());
        solver.getSummary();
    }
}
