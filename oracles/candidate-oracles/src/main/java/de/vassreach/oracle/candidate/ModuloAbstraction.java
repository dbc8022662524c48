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
package de.vassreach.oracle.candidate;

import de.vassreach.api.vass.VASSTransition;

/**
 * The modulo automaton of a VASS for a fixed modulus.
 * 
 * States are the vectors of residues of the counters. The start state is the
 * zero vector and every other state is accepting: the automaton accepts exactly
 * the paths whose net effect is not zero modulo the modulus. A path it rejects
 * may balance the counters and is a candidate.
 * 
 * The automaton is never tabulated. Memoization of visited residue vectors is
 * left to the search, which must drop it when the modulus changes.
 * 
 * @author Gaëtan Staquet
 */
public final class ModuloAbstraction {

    private final int modulus;
    private final ResidueVector startState;

    /**
     * @param modulus   The modulus, at least 2
     * @param dimension The number of counters
     */
    public ModuloAbstraction(int modulus, int dimension) {
        if (modulus < 2) {
            throw new IllegalArgumentException("The modulus must be at least 2, got " + modulus);
        }
        this.modulus = modulus;
        this.startState = new ResidueVector(new int[dimension]);
    }

    public int getModulus() {
        return modulus;
    }

    public ResidueVector getStartState() {
        return startState;
    }

    /**
     * @param state  A residue vector
     * @param effect An effect vector, of any sign
     * @return The residue vector of {@code state + effect}
     */
    public ResidueVector step(ResidueVector state, int[] effect) {
        int[] residues = state.toArray();
        for (int i = 0; i < residues.length; i++) {
            residues[i] = (int) Math.floorMod((long) residues[i] + effect[i], (long) modulus);
        }
        return new ResidueVector(residues);
    }

    /**
     * @param state      A residue vector
     * @param transition A transition
     * @return The residue vector after taking the transition
     */
    public <I> ResidueVector step(ResidueVector state, VASSTransition<I> transition) {
        int[] residues = state.toArray();
        transition.applyModulo(residues, modulus);
        return new ResidueVector(residues);
    }

    /**
     * @param state A residue vector
     * @return True iff the state is not the start state
     */
    public boolean isAccepting(ResidueVector state) {
        return !state.equals(startState);
    }

    @Override
    public String toString() {
        return "MDFA(" + modulus + ")";
    }
}
