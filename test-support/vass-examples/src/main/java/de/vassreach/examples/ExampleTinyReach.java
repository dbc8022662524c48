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
package de.vassreach.examples;

import de.vassreach.api.solver.Verdict;
import de.vassreach.api.vass.VASS;
import de.vassreach.api.vass.VASSBuilder;

/**
 * The smallest VASS with a non-trivial witness: one increment followed by one
 * decrement.
 * 
 * @author Gaëtan Staquet
 */
public class ExampleTinyReach extends DefaultVASSExample<Character> {

    public ExampleTinyReach() {
        super(constructMachine(), Verdict.Status.TRUE);
    }

    /**
     * @return A one-counter VASS {@code q0 --(a, +1)-> q1 --(b, -1)-> q2}
     */
    public static VASS<Character> constructMachine() {
        VASSBuilder<Character> builder = new VASSBuilder<>(1);
        int q0 = builder.addState();
        int q1 = builder.addState();
        int q2 = builder.addState();

        builder.addTransition(q0, q1, 'a', +1);
        builder.addTransition(q1, q2, 'b', -1);

        return builder.create(q0, q2);
    }

    public static ExampleTinyReach createExample() {
        return new ExampleTinyReach();
    }
}
