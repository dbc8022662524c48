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
package de.vassreach.oracle.path;

import java.util.List;

import de.vassreach.api.path.LoopDecomposition;
import de.vassreach.api.path.Path;
import de.vassreach.api.vass.VASS;
import de.vassreach.api.vass.VASSBuilder;
import de.vassreach.examples.ExampleTinyReach;
import de.vassreach.examples.ExampleWrapLoop;
import org.testng.Assert;
import org.testng.annotations.Test;

public class LoopsTest {

    @Test
    public void testNoLoop() {
        VASS<Character> vass = ExampleTinyReach.constructMachine();
        Path<Character> path = Path.ofIndices(vass, 0, 1);

        Assert.assertTrue(Loops.innermostLoops(path).isEmpty());
        Assert.assertNull(Loops.findNeverBalancedLoop(path));
    }

    @Test
    public void testInnermostLoops() {
        // q0 -a-> q1 -b-> q0 -c-> q0 -a-> q1
        VASSBuilder<Character> builder = new VASSBuilder<>(1);
        int q0 = builder.addState();
        int q1 = builder.addState();
        builder.addTransition(q0, q1, 'a', 1);
        builder.addTransition(q1, q0, 'b', -1);
        builder.addTransition(q0, q0, 'c', 0);
        VASS<Character> vass = builder.create(q0, q1);
        Path<Character> path = Path.ofIndices(vass, 0, 1, 2, 0);

        List<LoopDecomposition<Character>> loops = Loops.innermostLoops(path);
        Assert.assertEquals(loops.size(), 3);
        Assert.assertEquals(loops.get(0).getLoopStart(), 0);
        Assert.assertEquals(loops.get(0).getLoopEnd(), 2);
        Assert.assertEquals(loops.get(1).getLoopStart(), 2);
        Assert.assertEquals(loops.get(1).getLoopEnd(), 3);
        Assert.assertEquals(loops.get(2).getLoopStart(), 1);
        Assert.assertEquals(loops.get(2).getLoopEnd(), 4);

        // the path ends in 1 and the first loop does not change it
        LoopDecomposition<Character> unbalanced = Loops.findNeverBalancedLoop(path);
        Assert.assertNotNull(unbalanced);
        Assert.assertEquals(unbalanced.getLoopEnd(), 2);

        Assert.assertNull(Loops.findNeverBalancedLoop(Path.ofIndices(vass, 0, 1, 2)));
    }

    @Test
    public void testNeverBalancedLoop() {
        VASS<Character> vass = ExampleWrapLoop.constructMachine(2);
        LoopDecomposition<Character> loop = Loops.findNeverBalancedLoop(Path.ofIndices(vass, 0, 1, 1));

        Assert.assertNotNull(loop);
        Assert.assertEquals(loop.getLoopStart(), 1);
        Assert.assertEquals(loop.getLoopEnd(), 2);
        Assert.assertEquals(loop.getLoopState(), 1);
    }
}
