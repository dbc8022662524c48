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
package de.vassreach.api.oracle;

import de.vassreach.api.language.ReachabilityLanguage;

/**
 * Searches a reachability language for a candidate path at a given modulus.
 * 
 * A candidate is a path whose word is in the language and whose net effect is
 * zero modulo the modulus. The oracle must return the shortest candidate and,
 * among the shortest ones, the one that is smallest when comparing transition
 * indices from left to right.
 * 
 * @param <I> Label type
 * @author Gaëtan Staquet
 */
public interface CandidateOracle<I> {

    /**
     * Special value for the path length bound meaning that paths are not bounded.
     */
    int UNBOUNDED = Integer.MAX_VALUE;

    /**
     * @param <S>           Derivation state type
     * @param language      The language to explore
     * @param modulus       The modulus, at least 2
     * @param maxPathLength The length of the longest path that may be returned,
     *                      or {@link #UNBOUNDED}
     * @return The search result
     */
    <S> SearchResult<I> findCandidate(ReachabilityLanguage<S, I> language, int modulus, int maxPathLength);
}
