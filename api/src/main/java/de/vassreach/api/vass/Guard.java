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
package de.vassreach.api.vass;

/**
 * A predicate over the counter valuation that must hold before a transition is
 * fired.
 * 
 * The guard is evaluated on the valuation reached <em>before</em> the
 * transition's effect is applied. Non-negativity of the counters after the
 * effect is always required and does not need to be encoded in the guard.
 * 
 * @author Gaëtan Staquet
 */
@FunctionalInterface
public interface Guard {

    /**
     * Decides whether the guard holds for the given counter valuation.
     * 
     * @param counters The current counter valuation. Must not be modified
     * @return True iff the transition may be fired from this valuation
     */
    boolean holds(long[] counters);

    /**
     * Decides whether the guard can be satisfied by some non-negative valuation
     * that is at least as large as the given minimum (component-wise).
     * 
     * The default implementation answers true. Returning false drops the
     * transition when the VASS is created, so a guard must only do it when it is
     * certain.
     * 
     * @param minimum The smallest valuation allowing the effect to be applied
     * @return False if the transition can never be fired
     */
    default boolean isSatisfiableFrom(long[] minimum) {
        return true;
    }

    /**
     * @return A guard accepting every valuation
     */
    static Guard alwaysTrue() {
        return Guards.TRUE;
    }

    /**
     * @return A guard rejecting every valuation
     */
    static Guard never() {
        return Guards.FALSE;
    }

    /**
     * @param lowerBounds The lower bound for each counter
     * @return A guard accepting valuations that are component-wise at least as
     *         large as the bounds
     */
    static Guard atLeast(int... lowerBounds) {
        return new Guards.LowerBoundGuard(lowerBounds);
    }
}
