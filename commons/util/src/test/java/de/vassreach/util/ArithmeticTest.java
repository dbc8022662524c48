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

import org.testng.Assert;
import org.testng.annotations.Test;

public class ArithmeticTest {

    @Test
    public void testGcd() {
        Assert.assertEquals(Arithmetic.gcd(12, 18), 6);
        Assert.assertEquals(Arithmetic.gcd(-4, 6), 2);
        Assert.assertEquals(Arithmetic.gcd(7, 0), 7);
        Assert.assertEquals(Arithmetic.gcd(0, 0), 0);
    }

    @Test
    public void testLcm() {
        Assert.assertEquals(Arithmetic.lcm(4, 6), 12);
        Assert.assertEquals(Arithmetic.lcm(2, 3), 6);
        Assert.assertEquals(Arithmetic.lcm(5, 5), 5);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testLcmOfZero() {
        Arithmetic.lcm(0, 3);
    }

    @Test(expectedExceptions = ArithmeticException.class)
    public void testLcmOverflow() {
        Arithmetic.lcm(Long.MAX_VALUE, Long.MAX_VALUE - 1);
    }

    @Test
    public void testClamp() {
        Assert.assertEquals(Arithmetic.clampToInt(5L), 5);
        Assert.assertEquals(Arithmetic.clampToInt(1L + Integer.MAX_VALUE), Integer.MAX_VALUE);
        Assert.assertEquals(Arithmetic.clampToInt(Integer.MIN_VALUE - 1L), Integer.MIN_VALUE);
    }
}
