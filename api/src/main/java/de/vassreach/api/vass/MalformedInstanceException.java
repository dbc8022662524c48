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
package de.vassreach.api.vass;

/**
 * Thrown when a {@link VASS} cannot be constructed because its description is
 * structurally inconsistent (dangling state references, an unknown initial or
 * final state, effects or guards of the wrong dimension).
 * 
 * The exception is raised before any search begins and is never retried.
 * 
 * @author Gaëtan Staquet
 */
public class MalformedInstanceException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public MalformedInstanceException(String message) {
        super(message);
    }
}
