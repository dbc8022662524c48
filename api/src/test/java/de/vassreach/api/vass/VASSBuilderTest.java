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

import org.testng.Assert;
import org.testng.annotations.Test;

public class VASSBuilderTest {

    @Test
    public void testCreate() {
        VASSBuilder<Character> builder = new VASSBuilder<>(2);
        int q0 = builder.addState();
        int q1 = builder.addState();
        builder.addTransition(q0, q0, 'a', 1, 0);
        builder.addTransition(q0, q1, 'b', -2, 0);
        builder.addTransition(q1, q1, 'b', -1, 0);

        VASS<Character> vass = builder.create(q0, q1);

        Assert.assertEquals(vass.size(), 2);
        Assert.assertEquals(vass.getDimension(), 2);
        Assert.assertEquals(vass.getInitialState(), q0);
        Assert.assertEquals(vass.getFinalState(), q1);
        Assert.assertEquals(vass.getTransitionCount(), 3);
        Assert.assertEquals(vass.getAlphabet().size(), 2);
        Assert.assertEquals((char) vass.getAlphabet().getSymbol(0), 'a');
        Assert.assertEquals(vass.getOutgoingTransitions(q0).size(), 2);
        Assert.assertEquals(vass.getIncomingTransitions(q1).size(), 2);

        for (int i = 0; i < vass.getTransitionCount(); i++) {
            Assert.assertEquals(vass.getTransition(i).getIndex(), i);
        }
        Assert.assertEquals(vass.getTransition(1).getEffect(), new int[] { -2, 0 });
        Assert.assertEquals(vass.getTransition(1).getMinimalEnablingValuation(), new long[] { 2, 0 });
    }

    @Test(expectedExceptions = MalformedInstanceException.class)
    public void testNegativeDimension() {
        new VASSBuilder<Character>(-1);
    }

    @Test(expectedExceptions = MalformedInstanceException.class)
    public void testUnknownInitialState() {
        VASSBuilder<Character> builder = new VASSBuilder<>(1);
        int q0 = builder.addState();
        builder.create(q0 + 1, q0);
    }

    @Test(expectedExceptions = MalformedInstanceException.class)
    public void testUnknownFinalState() {
        VASSBuilder<Character> builder = new VASSBuilder<>(1);
        int q0 = builder.addState();
        builder.create(q0, -1);
    }

    @Test(expectedExceptions = MalformedInstanceException.class)
    public void testDanglingTarget() {
        VASSBuilder<Character> builder = new VASSBuilder<>(1);
        int q0 = builder.addState();
        builder.addTransition(q0, 7, 'a', 1);
        builder.create(q0, q0);
    }

    @Test(expectedExceptions = MalformedInstanceException.class)
    public void testInconsistentDimension() {
        VASSBuilder<Character> builder = new VASSBuilder<>(2);
        int q0 = builder.addState();
        builder.addTransition(q0, q0, 'a', 1, 0);
        builder.addTransition(q0, q0, 'b', 1);
        builder.create(q0, q0);
    }

    @Test(expectedExceptions = MalformedInstanceException.class)
    public void testInconsistentGuardDimension() {
        VASSBuilder<Character> builder = new VASSBuilder<>(2);
        int q0 = builder.addState();
        builder.addGuardedTransition(q0, q0, 'a', Guard.atLeast(1), 1, 0);
        builder.create(q0, q0);
    }

    @Test
    public void testMalformedInstanceIsIllegalArgument() {
        try {
            new VASSBuilder<Character>(1).create(0, 0);
            Assert.fail("A VASS without states must be rejected");
        } catch (IllegalArgumentException e) {
            Assert.assertTrue(e instanceof MalformedInstanceException);
        }
    }

    @Test
    public void testDeadTransitionsAreDropped() {
        VASSBuilder<Character> builder = new VASSBuilder<>(1);
        int q0 = builder.addState();
        int q1 = builder.addState();
        builder.addGuardedTransition(q0, q1, 'x', Guard.never(), 0);
        builder.addTransition(q0, q1, 'a', 1);
        builder.addGuardedTransition(q1, q1, 'b', Guard.atLeast(2), -1);

        VASS<Character> vass = builder.create(q0, q1);

        Assert.assertEquals(vass.getTransitionCount(), 2);
        Assert.assertEquals((char) vass.getTransition(0).getLabel(), 'a');
        Assert.assertEquals(vass.getTransition(0).getIndex(), 0);
        Assert.assertEquals((char) vass.getTransition(1).getLabel(), 'b');
        Assert.assertEquals(vass.getTransition(1).getIndex(), 1);
        Assert.assertFalse(vass.getAlphabet().containsSymbol('x'));
    }

    @Test
    public void testGuardHolds() {
        VASSBuilder<Character> builder = new VASSBuilder<>(2);
        int q0 = builder.addState();
        builder.addGuardedTransition(q0, q0, 'a', Guard.atLeast(1, 2), 0, 0);
        builder.addTransition(q0, q0, 'b', 0, 0);
        VASS<Character> vass = builder.create(q0, q0);

        Assert.assertTrue(vass.guardHolds(0, new long[] { 1, 2 }));
        Assert.assertFalse(vass.guardHolds(0, new long[] { 1, 1 }));
        Assert.assertTrue(vass.guardHolds(1, new long[] { 0, 0 }));
    }

    @Test
    public void testBuilderCopiesEffects() {
        VASSBuilder<Character> builder = new VASSBuilder<>(1);
        int q0 = builder.addState();
        int[] effect = { 3 };
        builder.addTransition(q0, q0, 'a', effect);
        effect[0] = 5;
        VASS<Character> vass = builder.create(q0, q0);
        Assert.assertEquals(vass.getTransition(0).getEffect(0), 3);

        vass.getTransition(0).getEffect()[0] = 7;
        Assert.assertEquals(vass.getTransition(0).getEffect(0), 3);
    }
}
