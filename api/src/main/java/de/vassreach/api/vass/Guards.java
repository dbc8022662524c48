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

import java.util.Arrays;

/**
 * The guards shipped with the API.
 * 
 * @author Gaëtan Staquet
 */
final class Guards {

    static final Guard TRUE = new Guard() {
        @Override
        public boolean holds(long[] counters) {
            return true;
        }

        @Override
        public String toString() {
            return "true";
        }
    };

    static final Guard FALSE = new Guard() {
        @Override
        public boolean holds(long[] counters) {
            return false;
        }

        @Override
        public boolean isSatisfiableFrom(long[] minimum) {
            return false;
        }

        @Override
        public String toString() {
            return "false";
        }
    };

    private Guards() {
    }

    /**
     * Upward-closed guard {@code x >= b}, component-wise.
     */
    static final class LowerBoundGuard implements Guard {
        private final int[] lowerBounds;

        LowerBoundGuard(int[] lowerBounds) {
            this.lowerBounds = lowerBounds.clone();
        }

        int dimension() {
            return lowerBounds.length;
        }

        @Override
        public boolean holds(long[] counters) {
            for (int i = 0; i < lowerBounds.length; i++) {
                if (counters[i] < lowerBounds[i]) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public boolean equals(Object obj) {
            if (obj == this) {
                return true;
            }
            if (obj == null || obj.getClass() != this.getClass()) {
                return false;
            }
            return Arrays.equals(lowerBounds, ((LowerBoundGuard) obj).lowerBounds);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(lowerBounds);
        }

        @Override
        public String toString() {
            return ">= " + Arrays.toString(lowerBounds);
        }
    }
}
