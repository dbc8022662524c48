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
package de.vassreach.datastructure.language;

import java.util.List;

import de.vassreach.api.path.LoopDecomposition;
import de.vassreach.api.path.Path;
import de.vassreach.api.vass.VASS;
import de.vassreach.api.vass.VASSTransition;
import net.automatalib.automata.fsa.impl.compact.CompactDFA;
import net.automatalib.automata.fsa.impl.compact.CompactNFA;
import net.automatalib.util.automata.fsa.NFAs;
import net.automatalib.words.Alphabet;
import net.automatalib.words.impl.Alphabets;

/**
 * Factory methods for {@link ExclusionAutomaton}s.
 * 
 * The automata read transition indices: the alphabet of a VASS with {@code m}
 * transitions is {@code 0, ..., m-1}.
 * 
 * @author Gaëtan Staquet
 */
public final class ExclusionAutomata {

    private ExclusionAutomata() {
    }

    /**
     * @param vass The VASS
     * @return The alphabet of transition indices of the VASS
     */
    public static Alphabet<Integer> transitionAlphabet(VASS<?> vass) {
        if (vass.getTransitionCount() == 0) {
            throw new IllegalArgumentException("A VASS without transitions has nothing to exclude");
        }
        return Alphabets.integers(0, vass.getTransitionCount() - 1);
    }

    /**
     * Creates an automaton excluding every path that starts with the first
     * {@code length} transitions of the given path.
     * 
     * @param <I>    Label type
     * @param path   The path
     * @param length The length of the excluded prefix, at least 1
     * @return The automaton
     */
    public static <I> ExclusionAutomaton negativePrefix(Path<I> path, int length) {
        if (length <= 0 || length > path.length()) {
            throw new IllegalArgumentException("Invalid prefix length " + length + " for a path of length " + path.length());
        }
        final Alphabet<Integer> alphabet = transitionAlphabet(path.getVASS());
        final CompactDFA<Integer> dfa = new CompactDFA<>(alphabet);

        Integer state = dfa.addInitialState(false);
        for (int i = 0; i < length; i++) {
            Integer next = dfa.addState(i == length - 1);
            dfa.setTransition(state, alphabet.getSymbol(path.getTransition(i).getIndex()), next);
            state = next;
        }
        for (Integer symbol : alphabet) {
            dfa.setTransition(state, symbol, state);
        }

        return new ExclusionAutomaton(ExclusionAutomaton.Kind.NEGATIVE_PREFIX, path.prefix(length).toString(), dfa,
                alphabet);
    }

    /**
     * Creates an automaton excluding every complete path of the form
     * {@code prefix . loop^k . suffix}, for {@code k >= 0}.
     * 
     * @param <I>           Label type
     * @param decomposition The loop decomposition
     * @return The automaton
     */
    public static <I> ExclusionAutomaton wrapLoop(LoopDecomposition<I> decomposition) {
        final Alphabet<Integer> alphabet = transitionAlphabet(decomposition.getPath().getVASS());
        final CompactNFA<Integer> nfa = new CompactNFA<>(alphabet);

        final List<VASSTransition<I>> prefix = decomposition.getPrefix();
        final List<VASSTransition<I>> loop = decomposition.getLoop();
        final List<VASSTransition<I>> suffix = decomposition.getSuffix();

        Integer loopState = chain(nfa, nfa.addInitialState(false), prefix, alphabet);

        // the loop closes on its own first state
        Integer state = loopState;
        for (int i = 0; i < loop.size(); i++) {
            Integer next = i == loop.size() - 1 ? loopState : nfa.addState(false);
            nfa.addTransition(state, alphabet.getSymbol(loop.get(i).getIndex()), next);
            state = next;
        }

        Integer last = chain(nfa, loopState, suffix, alphabet);
        nfa.setAccepting(last, true);

        final CompactDFA<Integer> dfa = NFAs.determinize(nfa, alphabet);
        return new ExclusionAutomaton(ExclusionAutomaton.Kind.WRAP_LOOP, describe(decomposition), dfa, alphabet);
    }

    private static <I> Integer chain(CompactNFA<Integer> nfa, Integer start, List<VASSTransition<I>> transitions,
            Alphabet<Integer> alphabet) {
        Integer state = start;
        for (VASSTransition<I> transition : transitions) {
            Integer next = nfa.addState(false);
            nfa.addTransition(state, alphabet.getSymbol(transition.getIndex()), next);
            state = next;
        }
        return state;
    }

    private static <I> String describe(LoopDecomposition<I> decomposition) {
        StringBuilder builder = new StringBuilder();
        appendLabels(builder, decomposition.getPrefix());
        builder.append(" (");
        appendLabels(builder, decomposition.getLoop());
        builder.append(")* ");
        appendLabels(builder, decomposition.getSuffix());
        return builder.toString().trim();
    }

    private static <I> void appendLabels(StringBuilder builder, List<VASSTransition<I>> transitions) {
        for (int i = 0; i < transitions.size(); i++) {
            if (i > 0) {
                builder.append(' ');
            }
            builder.append('t').append(transitions.get(i).getIndex());
        }
    }
}
