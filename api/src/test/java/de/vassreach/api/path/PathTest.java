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

import de.vassreach.api.vass.VASS;
import de.vassreach.api.vass.VASSBuilder;
import net.automatalib.words.Word;
import org.testng.Assert;
import org.testng.annotations.Test;

public class PathTest {

    private static VASS<Character> loopVASS() {
        VASSBuilder<Character> builder = new VASSBuilder<>(1);
        int q0 = builder.addState();
        int q1 = builder.addState();
        builder.addTransition(q0, q1, 'a', 2);
        builder.addTransition(q1, q1, 'b', -1);
        builder.addTransition(q1, q0, 'c', 0);
        return builder.create(q0, q1);
    }

    @Test
    public void testAccessors() {
        VASS<Character> vass = loopVASS();
        Path<Character> path = Path.ofIndices(vass, 0, 1, 1);

        Assert.assertEquals(path.length(), 3);
        Assert.assertEquals(path.getStates(), new int[] { 0, 1, 1, 1 });
        Assert.assertEquals(path.getEndState(), 1);
        Assert.assertEquals(path.getLabelWord(), Word.fromCharSequence("abb"));
        Assert.assertEquals(path.getNetEffect(), new long[] { 0 });
        Assert.assertEquals(path.getTransitionIndices(), new int[] { 0, 1, 1 });
        Assert.assertEquals(path.prefix(1), Path.ofIndices(vass, 0));
    }

    @Test
    public void testToString() {
        VASS<Character> vass = loopVASS();
        Assert.assertEquals(Path.ofIndices(vass, 0, 2).toString(), "q0 --(a)-> q1 --(c)-> q0");
        Assert.assertEquals(Path.empty(vass).toString(), "q0");
    }

    @Test
    public void testAppend() {
        VASS<Character> vass = loopVASS();
        Path<Character> path = Path.empty(vass).append(vass.getTransition(0)).append(vass.getTransition(1));
        Assert.assertEquals(path, Path.ofIndices(vass, 0, 1));
        Assert.assertEquals(path.hashCode(), Path.ofIndices(vass, 0, 1).hashCode());
        Assert.assertTrue(Path.empty(vass).isEmpty());
        Assert.assertEquals(Path.empty(vass).getEndState(), vass.getInitialState());
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testAppendDisconnected() {
        VASS<Character> vass = loopVASS();
        Path.empty(vass).append(vass.getTransition(1));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNotAWalk() {
        Path.ofIndices(loopVASS(), 0, 0);
    }
}
