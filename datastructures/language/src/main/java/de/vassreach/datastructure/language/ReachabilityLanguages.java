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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.TreeMap;

import de.vassreach.api.language.LanguageStep;
import de.vassreach.api.language.ReachabilityLanguage;
import de.vassreach.api.vass.VASS;
import net.automatalib.words.Alphabet;
import net.automatalib.words.Word;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Utility methods for {@link ReachabilityLanguage}s.
 * 
 * @author Gaëtan Staquet
 */
public final class ReachabilityLanguages {

    /**
     * Special value meaning that the words are not bounded.
     */
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    private ReachabilityLanguages() {
    }

    /**
     * @param <I>  Label type
     * @param vass The VASS
     * @return The trimmed control-flow language of the VASS
     */
    public static <I> ControlFlowLanguage<I> controlFlow(VASS<I> vass) {
        return new ControlFlowLanguage<>(vass);
    }

    /**
     * Enumerates the label words of a language.
     * 
     * See {@link #derive(ReachabilityLanguage, int, int)}. The enumeration ends
     * only when the budget is reached or when the language is finite. On a trimmed
     * language (such as {@link ControlFlowLanguage}) every call to
     * {@link Iterator#hasNext()} terminates.
     * 
     * @param <S>        Derivation state type
     * @param <I>        Label type
     * @param language   The language
     * @param wordBudget The maximal number of words to produce
     * @return A restartable, lazy enumeration of the words
     */
    public static <S, I> Iterable<Word<I>> derive(ReachabilityLanguage<S, I> language, int wordBudget) {
        return derive(language, wordBudget, UNBOUNDED);
    }

    /**
     * Enumerates the distinct label words of a language, by increasing length.
     * 
     * Words of the same length are sorted by the alphabet order of their labels,
     * from left to right. Every word of length {@code n} is produced before any
     * word of length {@code n+1}, and no word is skipped. Each call to
     * {@link Iterable#iterator()} restarts the derivation from scratch.
     * 
     * @param <S>           Derivation state type
     * @param <I>           Label type
     * @param language      The language
     * @param wordBudget    The maximal number of words to produce
     * @param maxWordLength The length of the longest word to produce, or
     *                      {@link #UNBOUNDED}
     * @return A restartable, lazy enumeration of the words
     */
    public static <S, I> Iterable<Word<I>> derive(ReachabilityLanguage<S, I> language, int wordBudget,
            int maxWordLength) {
        if (wordBudget < 0 || maxWordLength < 0) {
            throw new IllegalArgumentException("Budgets must be non-negative");
        }
        return () -> new WordIterator<>(language, wordBudget, maxWordLength);
    }

    /**
     * Breadth-first subset construction over the labels: a layer maps every
     * word of the current length to the derivation states reading it.
     */
    private static final class WordIterator<S, I> implements Iterator<Word<I>> {
        private final ReachabilityLanguage<S, I> language;
        private final Alphabet<I> alphabet;
        private final int maxWordLength;
        private int remaining;

        private Map<Word<I>, Set<S>> layer;
        private Iterator<Map.Entry<Word<I>, Set<S>>> layerIterator;
        private int length;
        private @Nullable Word<I> next;

        WordIterator(ReachabilityLanguage<S, I> language, int wordBudget, int maxWordLength) {
            this.language = language;
            this.alphabet = language.getVASS().getAlphabet();
            this.maxWordLength = maxWordLength;
            this.remaining = wordBudget;
            this.layer = new LinkedHashMap<>();
            this.layer.put(Word.epsilon(), Collections.singleton(language.getInitialState()));
            this.layerIterator = layer.entrySet().iterator();
            this.length = 0;
        }

        @Override
        public boolean hasNext() {
            if (next != null) {
                return true;
            }
            if (remaining <= 0) {
                return false;
            }
            while (true) {
                while (layerIterator.hasNext()) {
                    Map.Entry<Word<I>, Set<S>> entry = layerIterator.next();
                    for (S state : entry.getValue()) {
                        if (language.isAccepting(state)) {
                            next = entry.getKey();
                            return true;
                        }
                    }
                }
                if (length >= maxWordLength || !advance()) {
                    return false;
                }
            }
        }

        private boolean advance() {
            Map<Word<I>, Set<S>> nextLayer = new LinkedHashMap<>();
            for (Map.Entry<Word<I>, Set<S>> entry : layer.entrySet()) {
                // group the successors by label index to get a deterministic order
                TreeMap<Integer, Set<S>> byLabel = new TreeMap<>();
                for (S state : entry.getValue()) {
                    for (LanguageStep<S, I> step : language.expand(state)) {
                        byLabel.computeIfAbsent(alphabet.getSymbolIndex(step.getLabel()), k -> new LinkedHashSet<>())
                                .add(step.getTarget());
                    }
                }
                for (Map.Entry<Integer, Set<S>> successor : byLabel.entrySet()) {
                    nextLayer.put(entry.getKey().append(alphabet.getSymbol(successor.getKey())), successor.getValue());
                }
            }
            length++;
            layer = nextLayer;
            layerIterator = layer.entrySet().iterator();
            return !layer.isEmpty();
        }

        @Override
        public Word<I> next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Word<I> word = next;
            next = null;
            remaining--;
            return word;
        }
    }

    /**
     * Collects the words of {@link #derive(ReachabilityLanguage, int, int)} in a
     * list.
     * 
     * @param <S>           Derivation state type
     * @param <I>           Label type
     * @param language      The language
     * @param wordBudget    The maximal number of words
     * @param maxWordLength The maximal length of a word
     * @return The words, by increasing length
     */
    public static <S, I> List<Word<I>> collectWords(ReachabilityLanguage<S, I> language, int wordBudget,
            int maxWordLength) {
        List<Word<I>> words = new ArrayList<>();
        for (Word<I> word : derive(language, wordBudget, maxWordLength)) {
            words.add(word);
        }
        return words;
    }
}
