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
 * A VASS whose final state cannot be reached in the control graph.
 * 
 * @author Gaëtan Staquet
 */
public class ExampleDisconnected extends DefaultVASSExample<Character> {

    public ExampleDisconnected() {
        super(constructMachine(), Verdict.Status.FALSE);
    }

    public static VASS<Character> constructMachine() {
        VASSBuilder<Character> builder = new VASSBuilder<>(1);
        int q0 = builder.addState();
        int q1 = builder.addState();
        int q2 = builder.addState();

        builder.addTransition(q0, q0, 'a', +1);
        builder.addTransition(q0, q1, 'b', 0);
        builder.addTransition(q1, q0, 'c', -1);
        builder.addTransition(q2, q2, 'd', -1);

        return builder.create(q0, q2);
    }

    public static ExampleDisconnected createExample() {
        return new ExampleDisconnected();
    }
}
