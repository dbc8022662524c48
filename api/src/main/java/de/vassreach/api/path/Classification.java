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
package de.vassreach.api.path;

/**
 * The outcome of replaying a candidate path with exact counter values.
 * 
 * @author Gaëtan Staquet
 */
public enum Classification {
    /**
     * Every prefix is non-negative, every guard holds and the net effect is zero.
     */
    GENUINE_WITNESS,
    /**
     * The path is blocked before its end while every counter value stayed below
     * the modulus in magnitude. The exact prefix up to the blocking transition can
     * be excluded for good.
     */
    NEGATIVE_EXCURSION,
    /**
     * The path contains a cycle such that no number of repetitions of the cycle
     * brings the net effect to zero. The whole family of paths pumping that cycle
     * can be excluded for good.
     */
    WRAP_ONLY_LOOP,
    /**
     * None of the other cases applies. The modulus must be increased.
     */
    INCONCLUSIVE;

    /**
     * @return True iff the classification records an exclusion without changing
     *         the modulus
     */
    public boolean isCertifiedSpurious() {
        return this == NEGATIVE_EXCURSION || this == WRAP_ONLY_LOOP;
    }
}
