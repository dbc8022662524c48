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
package de.vassreach.util;

/**
 * Small integer helpers used when choosing moduli.
 * 
 * @author Gaëtan Staquet
 */
public final class Arithmetic {

    private Arithmetic() {
    }

    /**
     * @return The greatest common divisor of the absolute values, zero iff both
     *         are zero
     */
    public static long gcd(long a, long b) {
        long x = Math.abs(a);
        long y = Math.abs(b);
        while (y != 0) {
            long t = x % y;
            x = y;
            y = t;
        }
        return x;
    }

    /**
     * @return The least common multiple of two positive values
     * @throws ArithmeticException If the result overflows
     */
    public static long lcm(long a, long b) {
        if (a <= 0 || b <= 0) {
            throw new IllegalArgumentException("lcm is only defined for positive values, got " + a + " and " + b);
        }
        return Math.multiplyExact(a / gcd(a, b), b);
    }

    /**
     * Saturating conversion.
     * 
     * @return The value, or {@link Integer#MAX_VALUE} if it does not fit
     */
    public static int clampToInt(long value) {
        if (value > Integer.MAX_VALUE) {
            return Integer.MAX_VALUE;
        }
        if (value < Integer.MIN_VALUE) {
            return Integer.MIN_VALUE;
        }
        return (int) value;
    }
}
