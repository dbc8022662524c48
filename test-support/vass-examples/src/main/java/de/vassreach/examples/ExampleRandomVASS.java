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

import java.util.Random;

import de.vassreach.api.solver.Verdict;
import de.vassreach.api.vass.VASS;
import de.vassreach.api.vass.VASSBuilder;
import net.automatalib.words.Alphabet;

/**
 * A randomly generated VASS. The answer is not known in advance.
 * 
 * @param <I> Label type
 * @author Gaëtan Staquet
 */
public class ExampleRandomVASS<I> extends DefaultVASSExample<I> {

    public ExampleRandomVASS(Alphabet<I> alphabet, int size, int dimension, int transitions, int maxEffect) {
        this(new Random(), alphabet, size, dimension, transitions, maxEffect);
    }

    public ExampleRandomVASS(Random rand, Alphabet<I> alphabet, int size, int dimension, int transitions,
            int maxEffect) {
        super(constructMachine(rand, alphabet, size, dimension, transitions, maxEffect), Verdict.Status.UNKNOWN);
    }

    /**
     * Draws a VASS with {@code size} states and {@code transitions} transitions.
     * Sources, targets, labels and effects are uniform; each effect component is
     * in {@code [-maxEffect, maxEffect]}. The initial state is {@code 0} and the
     * final state is {@code size - 1}.
     * 
     * @param <I>         Label type
     * @param rand        The random source
     * @param alphabet    The labels
     * @param size        The number of states, at least 1
     * @param dimension   The number of counters
     * @param transitions The number of transitions
     * @param maxEffect   The largest absolute effect of a transition on a counter
     * @return The VASS
     */
    public static <I> VASS<I> constructMachine(Random rand, Alphabet<I> alphabet, int size, int dimension,
            int transitions, int maxEffect) {
        if (size <= 0 || alphabet.size() == 0) {
            throw new IllegalArgumentException("A random VASS needs at least one state and one label");
        }
        VASSBuilder<I> builder = new VASSBuilder<>(dimension);
        for (int i = 0; i < size; i++) {
            builder.addState();
        }
        for (int i = 0; i < transitions; i++) {
            int source = rand.nextInt(size);
            int target = rand.nextInt(size);
            I label = alphabet.getSymbol(rand.nextInt(alphabet.size()));
            int[] effect = new int[dimension];
            for (int c = 0; c < dimension; c++) {
                effect[c] = rand.nextInt(2 * maxEffect + 1) - maxEffect;
            }
            builder.addTransition(source, target, label, effect);
        }
        return builder.create(0, size - 1);
    }
}
