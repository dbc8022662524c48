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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.checkerframework.checker.nullness.qual.Nullable;

import de.learnlib.api.logging.LearnLogger;
import de.vassreach.api.oracle.CandidateOracle;
import de.vassreach.api.oracle.PathOracle;
import de.vassreach.api.oracle.SearchResult;
import de.vassreach.api.path.ClassifiedPath;
import de.vassreach.api.path.Path;
import de.vassreach.api.path.Trace;
import de.vassreach.api.solver.SearchBudget;
import de.vassreach.api.solver.Verdict;
import de.vassreach.api.statistic.IterationRecord;
import de.vassreach.api.statistic.SolverSummary;
import de.vassreach.api.vass.VASS;
import de.vassreach.datastructure.language.ControlFlowLanguage;
import de.vassreach.datastructure.language.ExclusionSet;
import de.vassreach.datastructure.language.ReachabilityLanguages;
import de.vassreach.datastructure.language.RestrictedLanguage;
import de.vassreach.oracle.candidate.BreadthFirstCandidateOracle;
import de.vassreach.oracle.path.CounterSimulatorOracle;
import de.vassreach.util.AbstractRefinementExperiment;
import de.vassreach.util.Arithmetic;

/**
 * Decides zero reachability by refining modulo abstractions.
 * 
 * Each iteration searches the control-flow language of the VASS, minus the
 * recorded exclusions, for a shortest path whose net effect is zero modulo the
 * current modulus. The path is then replayed with exact counters:
 * <ul>
 * <li>a genuine witness ends the query with a true verdict;</li>
 * <li>a negative excursion excludes the blocking prefix;</li>
 * <li>a wrap-only loop excludes the family of paths pumping the loop;</li>
 * <li>an inconclusive path increases the modulus.</li>
 * </ul>
 * If no candidate is left, the answer is false: no path of the language has a
 * zero effect modulo the modulus, so no path has a zero effect.
 * 
 * The modulus and the exclusions are owned by the solver and only change
 * between two searches. A solver answers a single query and can only be run
 * once.
 * 
 * @param <I> Label type
 * @author Gaëtan Staquet
 */
public final class ModuloReachSolver<I> extends AbstractRefinementExperiment<Verdict<I>> {

    public static final String SEARCH_PROFILE_KEY = "Searching for candidate";
    public static final String VALIDATION_PROFILE_KEY = "Validating candidate";

    private static final LearnLogger LOGGER = LearnLogger.getLogger(ModuloReachSolver.class);

    private final VASS<I> vass;
    private final SearchBudget budget;
    private final ModuloReachOptions options;
    private final CandidateOracle<I> candidateOracle;
    private final PathOracle<I> pathOracle;

    private final ExclusionSet exclusions = new ExclusionSet();
    private final List<IterationRecord> records = new ArrayList<>();
    private RefinementPhase phase = RefinementPhase.INIT;
    private int modulus;
    private @Nullable SolverSummary summary;

    public ModuloReachSolver(VASS<I> vass, SearchBudget budget) {
        this(vass, budget, ModuloReachOptions.defaults());
    }

    public ModuloReachSolver(VASS<I> vass, SearchBudget budget, ModuloReachOptions options) {
        this(vass, budget, options, new BreadthFirstCandidateOracle<>(options.getParallelism()),
                new CounterSimulatorOracle<>());
    }

    /**
     * @param vass            The VASS
     * @param budget          The limits of the query
     * @param options         The tuning options
     * @param candidateOracle The oracle searching for candidates
     * @param pathOracle      The oracle classifying candidates
     */
    public ModuloReachSolver(VASS<I> vass, SearchBudget budget, ModuloReachOptions options,
            CandidateOracle<I> candidateOracle, PathOracle<I> pathOracle) {
        this.vass = vass;
        this.budget = budget;
        this.options = options;
        this.candidateOracle = candidateOracle;
        this.pathOracle = pathOracle;
        this.modulus = options.getInitialModulus();
        setProfile(options.isProfile());
    }

    @Override
    protected Verdict<I> runInternal() {
        final long start = System.nanoTime();
        final ControlFlowLanguage<I> language = ReachabilityLanguages.controlFlow(vass);
        LOGGER.logPhase("Deciding zero reachability of " + vass);

        if (modulus > budget.getMaxModulus()) {
            return finish(Verdict.budgetExhausted(SearchBudget.Limit.MODULUS), start);
        }

        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                return finish(Verdict.interrupted(), start);
            }
            if (records.size() >= budget.getMaxIterations()) {
                return finish(Verdict.budgetExhausted(SearchBudget.Limit.ITERATIONS), start);
            }
            if (isTimeExceeded(start)) {
                return finish(Verdict.budgetExhausted(SearchBudget.Limit.TIME), start);
            }

            rounds.increment();
            final long iterationStart = System.nanoTime();
            LOGGER.logPhase("Starting iteration " + rounds.getCount() + " with modulus " + modulus);

            phase = RefinementPhase.SEARCHING;
            LOGGER.logPhase("Searching for candidate");
            final RestrictedLanguage<Integer, I> restricted = exclusions.restrict(language);
            profileStart(SEARCH_PROFILE_KEY);
            final SearchResult<I> result = candidateOracle.findCandidate(restricted, modulus,
                    budget.getMaxPathLength());
            profileStop(SEARCH_PROFILE_KEY);

            switch (result.getStatus()) {
            case EXHAUSTED:
                record(result, null, iterationStart);
                return finish(Verdict.unreachable(), start);
            case TRUNCATED:
                record(result, null, iterationStart);
                return finish(Verdict.budgetExhausted(SearchBudget.Limit.PATH_LENGTH), start);
            case INTERRUPTED:
                record(result, null, iterationStart);
                return finish(Verdict.interrupted(), start);
            case FOUND:
                break;
            default:
                throw new IllegalStateException("Unknown search status " + result.getStatus());
            }

            final Path<I> candidate = result.getCandidate();
            LOGGER.logCounterexample(candidate.toString());

            phase = RefinementPhase.VALIDATING;
            LOGGER.logPhase("Validating candidate");
            profileStart(VALIDATION_PROFILE_KEY);
            final ClassifiedPath<I> classified = pathOracle.classify(candidate, modulus);
            profileStop(VALIDATION_PROFILE_KEY);
            record(result, classified, iterationStart);
            LOGGER.info("Candidate classified as {}", classified.getClassification());

            switch (classified.getClassification()) {
            case GENUINE_WITNESS:
                checkWitness(classified);
                return finish(Verdict.reachable(candidate), start);
            case NEGATIVE_EXCURSION:
                exclusions.excludePrefix(candidate, classified.getExcludedPrefixLength());
                break;
            case WRAP_ONLY_LOOP:
                exclusions.excludeLoopFamily(classified.getLoop());
                break;
            case INCONCLUSIVE:
                final long next = options.getModulusPolicy().next(modulus,
                        classified.getTrace().getMaximalMagnitude());
                assert next > modulus;
                if (next > budget.getMaxModulus()) {
                    return finish(Verdict.budgetExhausted(SearchBudget.Limit.MODULUS), start);
                }
                LOGGER.info("Increasing the modulus from {} to {}", modulus, next);
                modulus = Arithmetic.clampToInt(next);
                break;
            default:
                throw new IllegalStateException("Unknown classification " + classified.getClassification());
            }
        }
    }

    private boolean isTimeExceeded(long start) {
        final Duration timeout = budget.getTimeout();
        return timeout != null && System.nanoTime() - start >= timeout.toNanos();
    }

    private void record(SearchResult<I> result, @Nullable ClassifiedPath<I> classified, long iterationStart) {
        final int length = result.isFound() ? result.getCandidate().length() : IterationRecord.NO_CANDIDATE;
        final IterationRecord record = new IterationRecord(records.size() + 1, modulus, length, result.getStatus(),
                classified == null ? null : classified.getClassification(), result.getExploredStates(),
                Duration.ofNanos(System.nanoTime() - iterationStart));
        records.add(record);
        LOGGER.debug("Iteration record: {}", record);
    }

    /**
     * A true verdict is only given for a non-negative trace that ends in zero.
     */
    private void checkWitness(ClassifiedPath<I> classified) {
        final Trace trace = classified.getTrace();
        if (trace.isBlocked() || !trace.isNonNegative() || !trace.endsInZero()
                || trace.length() != classified.getPath().length()) {
            throw new IllegalStateException("Invalid witness " + classified.getPath() + ": " + trace);
        }
        assert vass.accepts(classified.getPath().getLabelWord());
    }

    private Verdict<I> finish(Verdict<I> verdict, long start) {
        phase = RefinementPhase.DONE;
        summary = new SolverSummary(verdict, records.size(), Duration.ofNanos(System.nanoTime() - start), modulus);
        LOGGER.logPhase("Done: " + verdict);
        LOGGER.logStatistic(rounds);
        LOGGER.info("Summary: {}", summary.toMap());
        return verdict;
    }

    public VASS<I> getVASS() {
        return vass;
    }

    public SearchBudget getBudget() {
        return budget;
    }

    public ModuloReachOptions getOptions() {
        return options;
    }

    public RefinementPhase getPhase() {
        return phase;
    }

    /**
     * @return The current modulus, or the last one used once the solver is done
     */
    public int getModulus() {
        return modulus;
    }

    /**
     * @return The number of recorded exclusions
     */
    public int getExclusionCount() {
        return exclusions.size();
    }

    /**
     * @return The diagnostics of the iterations run so far, in order
     */
    public List<IterationRecord> getIterationRecords() {
        return Collections.unmodifiableList(new ArrayList<>(records));
    }

    /**
     * @return The summary of the query
     * @throws IllegalStateException If the solver has not been run
     */
    public SolverSummary getSummary() {
        if (summary == null) {
            throw new IllegalStateException("Experiment has not yet been run");
        }
        return summary;
    }
}
