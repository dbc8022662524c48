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

import java.util.Arrays;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An immutable vector of counter values modulo some modulus.
 * 
 * @author Gaëtan Staquet
 */
public final class ResidueVector {
    private final int[] residues;
    private final int hash;

    ResidueVector(int[] residues) {
        this.residues = residues;
        this.hash = Arrays.hashCode(residues);
    }

    public int getDimension() {
        return residues.length;
    }

    public int get(int counter) {
        return residues[counter];
    }

    /**
     * @return A copy of the residues
     */
    public int[] toArray() {
        return residues.clone();
    }

    public boolean isZero() {
        for (int residue : residues) {
            if (residue != 0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj == null || obj.getClass() != getClass()) {
            return false;
        }
        ResidueVector o = (ResidueVector) obj;
        return o.hash == hash && Arrays.equals(o.residues, residues);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return Arrays.toString(residues);
    }
}
