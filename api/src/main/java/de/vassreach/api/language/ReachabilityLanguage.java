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
package de.vassreach.api.language;

import java.util.List;

import de.vassreach.api.vass.VASS;

/**
 * The control-flow language of a {@link VASS}, presented as a derivation-step
 * capability.
 * 
 * A derivation state is an opaque value; states are compared with
 * {@link Object#equals(Object)} and must be hashable. A word of transitions is
 * in the language iff there is a sequence of steps from the initial state
 * producing it and ending in an accepting state.
 * 
 * @param <S> Derivation state type
 * @param <I> Label type
 * @author Gaëtan Staquet
 */
public interface ReachabilityLanguage<S, I> {

    VASS<I> getVASS();

    S getInitialState();

    boolean isAccepting(S state);

    /**
     * Gives the possible steps from a derivation state.
     * 
     * The steps must be sorted by increasing transition index. Searches rely on
     * this order to break ties.
     * 
     * @param state The derivation state
     * @return The steps, sorted by transition index
     */
    List<LanguageStep<S, I>> expand(S state);
}
