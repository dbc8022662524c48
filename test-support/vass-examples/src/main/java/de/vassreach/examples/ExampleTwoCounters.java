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
 * Small two-counter instances with one self-loop on each of the two states.
 * 
 * @author Gaëtan Staquet
 */
public class ExampleTwoCounters extends DefaultVASSExample<Character> {

    public ExampleTwoCounters(VASS<Character> vass, Verdict.Status expectedStatus) {
        super(vass, expectedStatus);
    }

    /**
     * Pump the first counter with {@code a}, then spend two with {@code b} and one
     * more per extra {@code b}. The shortest witness is {@code a a b}.
     * 
     * @return The example
     */
    public static ExampleTwoCounters createPumpAndDrain() {
        VASSBuilder<Character> builder = new VASSBuilder<>(2);
        int q0 = builder.addState();
        int q1 = builder.addState();

        builder.addTransition(q0, q0, 'a', 1, 0);
        builder.addTransition(q0, q1, 'b', -2, 0);
        builder.addTransition(q1, q1, 'b', -1, 0);

        return new ExampleTwoCounters(builder.create(q0, q1), Verdict.Status.TRUE);
    }

    /**
     * The second counter is incremented exactly once and never decremented.
     * 
     * @return The example
     */
    public static ExampleTwoCounters createUnbalancedSecondCounter() {
        VASSBuilder<Character> builder = new VASSBuilder<>(2);
        int q0 = builder.addState();
        int q1 = builder.addState();

        builder.addTransition(q0, q0, 'a', 1, 0);
        builder.addTransition(q0, q1, 'b', 0, 1);
        builder.addTransition(q1, q1, 'b', -1, 0);

        return new ExampleTwoCounters(builder.create(q0, q1), Verdict.Status.FALSE);
    }

    /**
     * Every path starts by decrementing the first counter.
     * 
     * @return The example
     */
    public static ExampleTwoCounters createNegativeEntry() {
        VASSBuilder<Character> builder = new VASSBuilder<>(2);
        int q0 = builder.addState();
        int q1 = builder.addState();

        builder.addTransition(q0, q1, 'a', -1, 0);
        builder.addTransition(q1, q1, 'b', 1, 0);

        return new ExampleTwoCounters(builder.create(q0, q1), Verdict.Status.FALSE);
    }
}
