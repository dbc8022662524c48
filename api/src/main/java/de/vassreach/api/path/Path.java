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
package de.vassreach.api.path;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import de.vassreach.api.vass.VASS;
import de.vassreach.api.vass.VASSTransition;
import net.automatalib.words.Word;
import net.automatalib.words.WordBuilder;

/**
 * A walk through the control graph of a {@link VASS}, starting in the initial
 * state.
 * 
 * The label word of a path is the sequence of its transitions' labels; its net
 * effect is the sum of their effects. Paths are immutable.
 * 
 * @param <I> Label type
 * @author Gaëtan Staquet
 */
public final class Path<I> implements Iterable<VASSTransition<I>> {
    private final VASS<I> vass;
    private final List<VASSTransition<I>> transitions;

    private Path(VASS<I> vass, List<VASSTransition<I>> transitions) {
        this.vass = vass;
        this.transitions = transitions;
    }

    /**
     * @param <I>  Label type
     * @param vass The VASS
     * @return The path without any transition
     */
    public static <I> Path<I> empty(VASS<I> vass) {
        return new Path<>(vass, Collections.emptyList());
    }

    /**
     * Creates a path from a sequence of transitions.
     * 
     * @param <I>         Label type
     * @param vass        The VASS
     * @param transitions The transitions
     * @return The path
     * @throws IllegalArgumentException If the transitions do not form a walk from
     *                                  the initial state
     */
    public static <I> Path<I> of(VASS<I> vass, List<VASSTransition<I>> transitions) {
        int state = vass.getInitialState();
        for (VASSTransition<I> transition : transitions) {
            if (transition.getSource() != state) {
                throw new IllegalArgumentException("Transition " + transition.getIndex() + " does not leave q" + state);
            }
            state = transition.getTarget();
        }
        return new Path<>(vass, Collections.unmodifiableList(new ArrayList<>(transitions)));
    }

    /**
     * Creates a path from transition indices.
     * 
     * @param <I>     Label type
     * @param vass    The VASS
     * @param indices The indices of the transitions
     * @return The path
     */
    public static <I> Path<I> ofIndices(VASS<I> vass, int... indices) {
        List<VASSTransition<I>> transitions = new ArrayList<>(indices.length);
        for (int index : indices) {
            transitions.add(vass.getTransition(index));
        }
        return of(vass, transitions);
    }

    public VASS<I> getVASS() {
        return vass;
    }

    public int length() {
        return transitions.size();
    }

    public boolean isEmpty() {
        return transitions.isEmpty();
    }

    public VASSTransition<I> getTransition(int position) {
        return transitions.get(position);
    }

    public List<VASSTransition<I>> getTransitions() {
        return transitions;
    }

    /**
     * @return The indices of the transitions, in order
     */
    public int[] getTransitionIndices() {
        int[] indices = new int[transitions.size()];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = transitions.get(i).getIndex();
        }
        return indices;
    }

    /**
     * The visited states. The state at position {@code i} is the state reached
     * after the first {@code i} transitions.
     * 
     * @return An array of length {@code length() + 1}
     */
    public int[] getStates() {
        int[] states = new int[transitions.size() + 1];
        states[0] = vass.getInitialState();
        for (int i = 0; i < transitions.size(); i++) {
            states[i + 1] = transitions.get(i).getTarget();
        }
        return states;
    }

    public int getEndState() {
        return transitions.isEmpty() ? vass.getInitialState() : transitions.get(transitions.size() - 1).getTarget();
    }

    public Word<I> getLabelWord() {
        WordBuilder<I> builder = new WordBuilder<>(transitions.size());
        for (VASSTransition<I> transition : transitions) {
            builder.append(transition.getLabel());
        }
        return builder.toWord();
    }

    public long[] getNetEffect() {
        long[] effect = new long[vass.getDimension()];
        for (VASSTransition<I> transition : transitions) {
            transition.applyTo(effect);
        }
        return effect;
    }

    /**
     * @param newLength The number of transitions to keep
     * @return The path made of the first {@code newLength} transitions
     */
    public Path<I> prefix(int newLength) {
        return new Path<>(vass, transitions.subList(0, newLength));
    }

    /**
     * @param transition A transition leaving {@link #getEndState()}
     * @return A new path, extended by the transition
     */
    public Path<I> append(VASSTransition<I> transition) {
        if (transition.getSource() != getEndState()) {
            throw new IllegalArgumentException("Transition " + transition.getIndex() + " does not leave q" + getEndState());
        }
        List<VASSTransition<I>> extended = new ArrayList<>(transitions.size() + 1);
        extended.addAll(transitions);
        extended.add(transition);
        return new Path<>(vass, Collections.unmodifiableList(extended));
    }

    @Override
    public Iterator<VASSTransition<I>> iterator() {
        return transitions.iterator();
    }

    @Override
    public int hashCode() {
        int hash = 17;
        for (VASSTransition<I> transition : transitions) {
            hash = 31 * hash + transition.getIndex();
        }
        return hash;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj == null || obj.getClass() != this.getClass()) {
            return false;
        }
        Path<?> o = (Path<?>) obj;
        if (o.vass != vass || o.transitions.size() != transitions.size()) {
            return false;
        }
        for (int i = 0; i < transitions.size(); i++) {
            if (o.transitions.get(i).getIndex() != transitions.get(i).getIndex()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Renders the path as {@code q0 --(a)-> q1 --(b)-> q2}.
     */
    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append('q').append(vass.getInitialState());
        for (VASSTransition<I> transition : transitions) {
            builder.append(" --(").append(transition.getLabel()).append(")-> q").append(transition.getTarget());
        }
        return builder.toString();
    }
}
