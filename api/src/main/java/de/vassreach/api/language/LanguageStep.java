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
package de.vassreach.api.language;

import java.util.Objects;

import de.vassreach.api.vass.VASSTransition;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * One derivation step: the transition that is taken and the derivation state it
 * leads to.
 * 
 * @param <S> Derivation state type
 * @param <I> Label type
 * @author Gaëtan Staquet
 */
public final class LanguageStep<S, I> {
    private final VASSTransition<I> transition;
    private final S target;

    public LanguageStep(VASSTransition<I> transition, S target) {
        this.transition = transition;
        this.target = target;
    }

    public VASSTransition<I> getTransition() {
        return transition;
    }

    public I getLabel() {
        return transition.getLabel();
    }

    public S getTarget() {
        return target;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj == null || obj.getClass() != getClass()) {
            return false;
        }
        LanguageStep<?, ?> o = (LanguageStep<?, ?>) obj;
        return o.transition == transition && Objects.equals(o.target, target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(transition.getIndex(), target);
    }

    @Override
    public String toString() {
        return "(" + transition.getLabel() + ", " + target + ")";
    }
}
