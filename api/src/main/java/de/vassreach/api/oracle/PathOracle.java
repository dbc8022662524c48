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
package de.vassreach.api.oracle;

import de.vassreach.api.path.ClassifiedPath;
import de.vassreach.api.path.Path;

/**
 * Replays a candidate path with exact counter values and classifies it.
 * 
 * @param <I> Label type
 * @author Gaëtan Staquet
 */
public interface PathOracle<I> {

    /**
     * @param candidate The path to replay
     * @param modulus   The modulus at which the candidate was found
     * @return The classified path
     */
    ClassifiedPath<I> classify(Path<I> candidate, int modulus);
}
