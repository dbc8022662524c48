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
package de.vassreach.oracle.candidate;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import de.learnlib.api.logging.LearnLogger;
import de.vassreach.api.language.LanguageStep;
import de.vassreach.api.language.ReachabilityLanguage;
import de.vassreach.api.oracle.CandidateOracle;
import de.vassreach.api.oracle.SearchResult;
import de.vassreach.api.path.Path;
import de.vassreach.api.vass.VASSTransition;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Breadth-first search over the product of a reachability language and the
 * modulo automaton.
 * 
 * The search proceeds layer by layer. Successors are generated in frontier
 * order and, for each frontier node, in increasing transition index order. A
 * product state is only kept the first time it is seen. Hence, the first
 * candidate that is discovered is a shortest one and, among the shortest
 * candidates, the smallest when comparing transition indices from left to
 * right.
 * 
 * With a parallelism greater than one, the successors of a layer are computed
 * by a pool of workers, each handling a contiguous slice of the frontier. The
 * slices are merged in frontier order by the calling thread, so the result does
 * not depend on the scheduling. The pool only lives for one call.
 * 
 * The interrupt flag of the calling thread is checked between two layers.
 * 
 * @param <I> Label type
 * @author Gaëtan Staquet
 */
public class BreadthFirstCandidateOracle<I> implements CandidateOracle<I> {

    private static final LearnLogger LOGGER = LearnLogger.getLogger(BreadthFirstCandidateOracle.class);

    /**
     * Frontiers smaller than this are expanded by the calling thread.
     */
    private static final int PARALLEL_THRESHOLD = 64;

    private final int parallelism;

    public BreadthFirstCandidateOracle() {
        this(1);
    }

    /**
     * @param parallelism The number of threads used to expand a layer
     */
    public BreadthFirstCandidateOracle(int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("The parallelism must be at least 1, got " + parallelism);
        }
        this.parallelism = parallelism;
    }

    public int getParallelism() {
        return parallelism;
    }

    @Override
    public <S> SearchResult<I> findCandidate(ReachabilityLanguage<S, I> language, int modulus, int maxPathLength) {
        final ModuloAbstraction abstraction = new ModuloAbstraction(modulus, language.getVASS().getDimension());
        final ExecutorService executor = parallelism > 1 ? Executors.newFixedThreadPool(parallelism) : null;
        try {
            return new Search<>(language, abstraction, maxPathLength, executor, parallelism).run();
        } finally {
            if (executor != null) {
                executor.shutdownNow();
            }
        }
    }

    private static final class ProductState<S> {
        private final S state;
        private final ResidueVector residues;
        private final int hash;

        ProductState(S state, ResidueVector residues) {
            this.state = state;
            this.residues = residues;
            this.hash = 31 * state.hashCode() + residues.hashCode();
        }

        @Override
        public boolean equals(@Nullable Object obj) {
            if (obj == this) {
                return true;
            }
            if (obj == null || obj.getClass() != getClass()) {
                return false;
            }
            ProductState<?> o = (ProductState<?>) obj;
            return o.hash == hash && Objects.equals(o.state, state) && o.residues.equals(residues);
        }

        @Override
        public int hashCode() {
            return hash;
        }
    }

    private static final class SearchNode<S, I> {
        private final ProductState<S> product;
        private final @Nullable SearchNode<S, I> parent;
        private final @Nullable VASSTransition<I> transition;

        SearchNode(ProductState<S> product, @Nullable SearchNode<S, I> parent,
                @Nullable VASSTransition<I> transition) {
            this.product = product;
            this.parent = parent;
            this.transition = transition;
        }
    }

    private static final class Search<S, I> {
        private final ReachabilityLanguage<S, I> language;
        private final ModuloAbstraction abstraction;
        private final int maxPathLength;
        private final @Nullable ExecutorService executor;
        private final int workers;
        private final Set<ProductState<S>> visited = new HashSet<>();

        Search(ReachabilityLanguage<S, I> language, ModuloAbstraction abstraction, int maxPathLength,
                @Nullable ExecutorService executor, int workers) {
            this.language = language;
            this.abstraction = abstraction;
            this.maxPathLength = maxPathLength;
            this.executor = executor;
            this.workers = workers;
        }

        SearchResult<I> run() {
            final SearchNode<S, I> root = new SearchNode<>(
                    new ProductState<>(language.getInitialState(), abstraction.getStartState()), null, null);
            visited.add(root.product);
            if (isCandidate(root.product)) {
                return SearchResult.found(toPath(root), visited.size());
            }

            List<SearchNode<S, I>> frontier = Collections.singletonList(root);
            int depth = 0;
            while (!frontier.isEmpty()) {
                if (Thread.currentThread().isInterrupted()) {
                    LOGGER.info("Search interrupted at depth {}", depth);
                    return SearchResult.interrupted(visited.size());
                }

                final List<List<SearchNode<S, I>>> successors;
                try {
                    successors = expandLayer(frontier);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return SearchResult.interrupted(visited.size());
                }

                final List<SearchNode<S, I>> next = new ArrayList<>();
                for (List<SearchNode<S, I>> slice : successors) {
                    for (SearchNode<S, I> node : slice) {
                        if (!visited.add(node.product)) {
                            continue;
                        }
                        if (depth == maxPathLength) {
                            // a new product state lies beyond the bound
                            LOGGER.debug("Search truncated at length {}", maxPathLength);
                            return SearchResult.truncated(visited.size());
                        }
                        if (isCandidate(node.product)) {
                            return SearchResult.found(toPath(node), visited.size());
                        }
                        next.add(node);
                    }
                }

                frontier = next;
                depth++;
            }

            LOGGER.debug("Search exhausted after {} product states", visited.size());
            return SearchResult.exhausted(visited.size());
        }

        private boolean isCandidate(ProductState<S> product) {
            return language.isAccepting(product.state) && !abstraction.isAccepting(product.residues);
        }

        private List<List<SearchNode<S, I>>> expandLayer(List<SearchNode<S, I>> frontier)
                throws InterruptedException {
            if (executor == null || frontier.size() < PARALLEL_THRESHOLD) {
                return Collections.singletonList(expandSlice(frontier));
            }

            final int slices = Math.min(frontier.size(), workers);
            final int sliceSize = (frontier.size() + slices - 1) / slices;
            final List<Future<List<SearchNode<S, I>>>> futures = new ArrayList<>(slices);
            for (int start = 0; start < frontier.size(); start += sliceSize) {
                final List<SearchNode<S, I>> slice = frontier.subList(start, Math.min(frontier.size(), start + sliceSize));
                final Callable<List<SearchNode<S, I>>> task = () -> expandSlice(slice);
                futures.add(executor.submit(task));
            }

            final List<List<SearchNode<S, I>>> result = new ArrayList<>(futures.size());
            for (Future<List<SearchNode<S, I>>> future : futures) {
                try {
                    result.add(future.get());
                } catch (ExecutionException e) {
                    throw new IllegalStateException("Expanding a layer failed", e.getCause());
                }
            }
            return result;
        }

        /**
         * Only reads {@link #visited}: the set is not modified while workers run.
         */
        private List<SearchNode<S, I>> expandSlice(List<SearchNode<S, I>> slice) {
            final List<SearchNode<S, I>> successors = new ArrayList<>();
            for (SearchNode<S, I> node : slice) {
                for (LanguageStep<S, I> step : language.expand(node.product.state)) {
                    final ProductState<S> product = new ProductState<>(step.getTarget(),
                            abstraction.step(node.product.residues, step.getTransition()));
                    if (!visited.contains(product)) {
                        successors.add(new SearchNode<>(product, node, step.getTransition()));
                    }
                }
            }
            return successors;
        }

        private Path<I> toPath(SearchNode<S, I> node) {
            final Deque<VASSTransition<I>> transitions = new ArrayDeque<>();
            SearchNode<S, I> current = node;
            while (current.transition != null) {
                transitions.addFirst(current.transition);
                current = current.parent;
            }
            return Path.of(language.getVASS(), new ArrayList<>(transitions));
        }
    }

    @Override
    public String toString() {
        return "BreadthFirstCandidateOracle[parallelism=" + parallelism + "]";
    }
}
