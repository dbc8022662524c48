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

import de.vassreach.util.Arithmetic;

/**
 * How the modulus grows after an inconclusive candidate. Every policy is
 * strictly increasing.
 * 
 * @author Gaëtan Staquet
 */
public enum ModulusPolicy {
    /**
     * {@code mu + 1}.
     */
    INCREMENT {
        @Override
        public long next(int modulus, long largestMagnitude) {
            return modulus + 1L;
        }
    },
    /**
     * {@code 2 * mu}.
     */
    DOUBLE {
        @Override
        public long next(int modulus, long largestMagnitude) {
            return 2L * modulus;
        }
    },
    /**
     * The least common multiple of {@code mu} and one more than the largest
     * counter value of the inconclusive candidate, or {@code mu + 1} if that is
     * not larger than {@code mu}. The new modulus is a multiple of the old one, so
     * residues that were distinguished stay distinguished.
     */
    LEAST_COMMON_MULTIPLE {
        @Override
        public long next(int modulus, long largestMagnitude) {
            final long candidate;
            try {
                candidate = Arithmetic.lcm(modulus, largestMagnitude + 1);
            } catch (ArithmeticException e) {
                return Long.MAX_VALUE;
            }
            return candidate > modulus ? candidate : modulus + 1L;
        }
    };

    /**
     * @param modulus          The current modulus
     * @param largestMagnitude The largest absolute counter value of the
     *                         inconclusive candidate
     * @return The next modulus, strictly larger than {@code modulus}
     */
    public abstract long next(int modulus, long largestMagnitude);
}
