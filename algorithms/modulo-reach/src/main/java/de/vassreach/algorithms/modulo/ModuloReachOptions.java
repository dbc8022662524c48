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
package de.vassreach.algorithms.modulo;

import java.util.Objects;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Tuning options of {@link ModuloReachSolver}. Options are immutable; the
 * {@code with} methods return modified copies.
 * 
 * @author Gaëtan Staquet
 */
public final class ModuloReachOptions {

    public static final int DEFAULT_INITIAL_MODULUS = 2;

    private final int initialModulus;
    private final ModulusPolicy modulusPolicy;
    private final int parallelism;
    private final boolean profile;

    private ModuloReachOptions(int initialModulus, ModulusPolicy modulusPolicy, int parallelism, boolean profile) {
        if (initialModulus < 2) {
            throw new IllegalArgumentException("The initial modulus must be at least 2, got " + initialModulus);
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("The parallelism must be at least 1, got " + parallelism);
        }
        this.initialModulus = initialModulus;
        this.modulusPolicy = Objects.requireNonNull(modulusPolicy);
        this.parallelism = parallelism;
        this.profile = profile;
    }

    /**
     * @return Initial modulus 2, incrementing policy, sequential search, no
     *         profiling
     */
    public static ModuloReachOptions defaults() {
        return new ModuloReachOptions(DEFAULT_INITIAL_MODULUS, ModulusPolicy.INCREMENT, 1, false);
    }

    public ModuloReachOptions withInitialModulus(int initialModulus) {
        return new ModuloReachOptions(initialModulus, modulusPolicy, parallelism, profile);
    }

    public ModuloReachOptions withModulusPolicy(ModulusPolicy modulusPolicy) {
        return new ModuloReachOptions(initialModulus, modulusPolicy, parallelism, profile);
    }

    public ModuloReachOptions withParallelism(int parallelism) {
        return new ModuloReachOptions(initialModulus, modulusPolicy, parallelism, profile);
    }

    public ModuloReachOptions withProfile(boolean profile) {
        return new ModuloReachOptions(initialModulus, modulusPolicy, parallelism, profile);
    }

    public int getInitialModulus() {
        return initialModulus;
    }

    public ModulusPolicy getModulusPolicy() {
        return modulusPolicy;
    }

    public int getParallelism() {
        return parallelism;
    }

    public boolean isProfile() {
        return profile;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj == null || obj.getClass() != getClass()) {
            return false;
        }
        ModuloReachOptions o = (ModuloReachOptions) obj;
        return o.initialModulus == initialModulus && o.modulusPolicy == modulusPolicy
                && o.parallelism == parallelism && o.profile == profile;
    }

    @Override
    public int hashCode() {
        return Objects.hash(initialModulus, modulusPolicy, parallelism, profile);
    }

    @Override
    public String toString() {
        return "ModuloReachOptions[initialModulus=" + initialModulus + ", modulusPolicy=" + modulusPolicy
                + ", parallelism=" + parallelism + ", profile=" + profile + "]";
    }
}
