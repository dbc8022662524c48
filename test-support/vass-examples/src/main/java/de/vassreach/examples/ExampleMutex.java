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
 * A model of two processes competing for a shared resource.
 * 
 * Counters 0 and 1 are the idle and critical places of the first process,
 * counters 2 and 3 those of the second process, and counter 4 is the resource.
 * The final state can only be entered when both processes are in their critical
 * section, which the resource forbids. The resource is never released in the
 * initial marking, so no process can even enter.
 * 
 * @author Gaëtan Staquet
 */
public class ExampleMutex extends DefaultVASSExample<Character> {

    public ExampleMutex() {
        super(constructMachine(), Verdict.Status.FALSE);
    }

    public static VASS<Character> constructMachine() {
        VASSBuilder<Character> builder = new VASSBuilder<>(5);
        int q0 = builder.addState();
        int q1 = builder.addState();
        int q2 = builder.addState();

        // initial marking
        builder.addTransition(q0, q1, 'e', 1, 0, 1, 0, 0);

        builder.addTransition(q1, q1, 'a', -1, 1, 0, 0, -1);
        builder.addTransition(q1, q1, 'b', 0, 0, -1, 1, -1);
        builder.addTransition(q1, q1, 'c', 1, -1, 0, 0, 1);
        builder.addTransition(q1, q1, 'd', 0, 0, 1, -1, 1);

        // both critical sections
        builder.addTransition(q1, q2, 'e', 0, -1, 0, -1, 0);

        return builder.create(q0, q2);
    }

    public static ExampleMutex createExample() {
        return new ExampleMutex();
    }
}
