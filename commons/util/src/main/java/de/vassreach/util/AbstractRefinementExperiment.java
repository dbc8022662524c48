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
package de.vassreach.util;

import org.checkerframework.checker.nullness.qual.Nullable;

import de.learnlib.filter.statistic.Counter;
import de.learnlib.util.statistics.SimpleProfiler;

/**
 * Abstract base class for refinement experiments.
 * 
 * A refinement experiment repeatedly searches an abstraction for a candidate,
 * checks the candidate, and refines the abstraction until it can conclude. An
 * experiment can only be run once.
 * 
 * @param <R> The type of the result
 * @author Gaëtan Staquet
 */
public abstract class AbstractRefinementExperiment<R extends Object> {
    protected final Counter rounds = new Counter("refinement rounds", "#");
    protected boolean profile;

    private @Nullable R result;

    public R getResult() {
        if (result == null) {
            throw new IllegalStateException("Experiment has not yet been run");
        }

        return result;
    }

    public boolean hasRun() {
        return result != null;
    }

    public R run() {
        if (this.result != null) {
            throw new IllegalStateException("Experiment has already been run");
        }

        result = runInternal();
        return result;
    }

    /**
     * Actually run the refinement loop. It is guaranteed that the experiment has
     * not yet been ran.
     * 
     * @return The result
     */
    protected abstract R runInternal();

    protected void profileStart(String taskname) {
        if (profile) {
            SimpleProfiler.start(taskname);
        }
    }

    protected void profileStop(String taskname) {
        if (profile) {
            SimpleProfiler.stop(taskname);
        }
    }

    /**
     * @param profile flag whether the refinement process should be profiled
     */
    public void setProfile(boolean profile) {
        this.profile = profile;
    }

    /**
     * @return the rounds
     */
    public Counter getRounds() {
        return rounds;
    }
}
