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

import org.testng.Assert;
import org.testng.annotations.Test;

public class AbstractRefinementExperimentTest {

    private static final class CountingExperiment extends AbstractRefinementExperiment<String> {
        @Override
        protected String runInternal() {
            for (int i = 0; i < 3; i++) {
                rounds.increment();
                profileStart("round");
                profileStop("round");
            }
            return "done";
        }
    }

    @Test
    public void testRunOnce() {
        CountingExperiment experiment = new CountingExperiment();
        experiment.setProfile(true);
        Assert.assertFalse(experiment.hasRun());
        Assert.assertEquals(experiment.run(), "done");
        Assert.assertTrue(experiment.hasRun());
        Assert.assertEquals(experiment.getResult(), "done");
        Assert.assertEquals(experiment.getRounds().getCount(), 3L);
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testRunTwice() {
        CountingExperiment experiment = new CountingExperiment();
        experiment.run();
        experiment.run();
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testResultBeforeRun() {
        new CountingExperiment().getResult();
    }
}
