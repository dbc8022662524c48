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
package de.vassreach.datastructure.language;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import de.learnlib.api.logging.LearnLogger;
import de.vassreach.api.language.ReachabilityLanguage;
import de.vassreach.api.path.LoopDecomposition;
import de.vassreach.api.path.Path;

/**
 * The spurious structures recorded during one reachability query.
 * 
 * The set only grows. It is not thread-safe: it is meant to be owned by a
 * single refinement loop and modified between two searches. Searches see an
 * immutable snapshot through {@link #restrict(ReachabilityLanguage)}.
 * 
 * @author Gaëtan Staquet
 */
public final class ExclusionSet {

    private static final LearnLogger LOGGER = LearnLogger.getLogger(ExclusionSet.class);

    private final List<ExclusionAutomaton> automata = new ArrayList<>();

    /**
     * Records that every path starting with the given prefix is spurious.
     * 
     * @param <I>    Label type
     * @param path   The path
     * @param length The length of the prefix to exclude
     * @return The recorded automaton
     */
    public <I> ExclusionAutomaton excludePrefix(Path<I> path, int length) {
        return add(ExclusionAutomata.negativePrefix(path, length));
    }

    /**
     * Records that every complete path pumping the loop of the decomposition is
     * spurious.
     * 
     * @param <I>           Label type
     * @param decomposition The loop decomposition
     * @return The recorded automaton
     */
    public <I> ExclusionAutomaton excludeLoopFamily(LoopDecomposition<I> decomposition) {
        return add(ExclusionAutomata.wrapLoop(decomposition));
    }

    private ExclusionAutomaton add(ExclusionAutomaton automaton) {
        automata.add(automaton);
        LOGGER.info("Recorded exclusion #{}: {}", automata.size(), automaton);
        return automaton;
    }

    public int size() {
        return automata.size();
    }

    public boolean isEmpty() {
        return automata.isEmpty();
    }

    /**
     * @return An immutable copy of the recorded automata, in recording order
     */
    public List<ExclusionAutomaton> snapshot() {
        return Collections.unmodifiableList(new ArrayList<>(automata));
    }

    /**
     * @param transitionIndices A sequence of transition indices
     * @return True iff a recorded automaton excludes the sequence as a complete
     *         path
     */
    public boolean excludes(int... transitionIndices) {
        for (ExclusionAutomaton automaton : automata) {
            if (automaton.excludes(transitionIndices)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Restricts a language to the paths that are not excluded by the current
     * content of the set. Later additions do not affect the returned language.
     * 
     * @param <S>      Derivation state type of the language
     * @param <I>      Label type
     * @param language The language
     * @return The restricted language
     */
    public <S, I> RestrictedLanguage<S, I> restrict(ReachabilityLanguage<S, I> language) {
        return new RestrictedLanguage<>(language, snapshot());
    }

    @Override
    public String toString() {
        return automata.toString();
    }
}
