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
 * A cycle that only ever increments its counter by a fixed step. The counter
 * comes back to zero modulo every divisor of a multiple of the step, but never
 * for real.
 * 
 * @author Gaëtan Staquet
 */
public class ExampleWrapLoop extends DefaultVASSExample<Character> {

    public static final int DEFAULT_STEP = 2;

    public ExampleWrapLoop() {
        this(DEFAULT_STEP);
    }

    public ExampleWrapLoop(int step) {
        super(constructMachine(step), Verdict.Status.FALSE);
    }

    /**
     * @param step The positive increment of both transitions
     * @return The VASS {@code q0 --(a, +step)-> q1} with the loop
     *         {@code q1 --(b, +step)-> q1}, where {@code q1} is final
     */
    public static VASS<Character> constructMachine(int step) {
        if (step <= 0) {
            throw new IllegalArgumentException("The step must be positive");
        }
        VASSBuilder<Character> builder = new VASSBuilder<>(1);
        int q0 = builder.addState();
        int q1 = builder.addState();

        builder.addTransition(q0, q1, 'a', step);
        builder.addTransition(q1, q1, 'b', step);

        return builder.create(q0, q1);
    }

    public static ExampleWrapLoop createExample() {
        return new ExampleWrapLoop();
    }
}
