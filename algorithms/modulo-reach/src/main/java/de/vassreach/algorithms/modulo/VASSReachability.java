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

import de.vassreach.api.solver.SearchBudget;
import de.vassreach.api.solver.Verdict;
import de.vassreach.api.vass.VASS;

/**
 * Entry point to decide zero reachability.
 * 
 * @author Gaëtan Staquet
 */
public final class VASSReachability {

    private VASSReachability() {
    }

    /**
     * Decides whether the zero valuation in the final state can be reached from
     * the zero valuation in the initial state.
     * 
     * @param <I>    Label type
     * @param vass   The VASS
     * @param budget The limits of the query
     * @return The verdict
     */
    public static <I> Verdict<I> decideReachability(VASS<I> vass, SearchBudget budget) {
        return decideReachability(vass, budget, ModuloReachOptions.defaults());
    }

    public static <I> Verdict<I> decideReachability(VASS<I> vass, SearchBudget budget, ModuloReachOptions options) {
        return new ModuloReachSolver<>(vass, budget, options).run();
    }
}
