/*
 * Copyright 2026 The LabelMaker Project
 *
 * The LabelMaker Project licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */
package io.labelmaker.labeler;

import io.netty.buffer.ByteBuf;
import io.netty.util.internal.StringUtil;

/**
 * Labels text with an explicit build lifecycle: insert the patterns, call {@link #finalizeLinks()} once,
 * then categorize any number of texts.
 * <pre>
 *      LabelMaker labeler = new LabelMaker();
 *      labeler.insert("triceratop", "Single");
 *      labeler.insert("triceratops", "Many");
 *      labeler.finalizeLinks();
 *
 *      labeler.categorize("triceratops are a group of herbivorous ceratopsid dinosaurs"); // "Many"
 * </pre>
 * Inserting after {@link #finalizeLinks()} raises {@link AlreadyFinalizedException}. Categorizing before it
 * raises {@link NotFinalizedException}; both are recoverable.
 * <p>
 * Insertion and finalization must happen on one thread. Once finalized, {@link #categorize(byte[])} may
 * be called from any thread.
 *
 * @see LabelAutomaton
 */
public final class LabelMaker {

    private final LabelTrie trie;
    private volatile LabelAutomaton automaton;

    public LabelMaker() {
        this(TrieLayout.defaultLayout());
    }

    public LabelMaker(TrieLayout layout) {
        trie = new LabelTrie(layout);
    }

    /**
     * @see LabelTrie#insert(CharSequence, String)
     */
    public void insert(CharSequence pattern, String label) {
        trie.insert(pattern, label);
    }

    /**
     * @see LabelTrie#insert(byte[], String)
     */
    public void insert(byte[] pattern, String label) {
        trie.insert(pattern, label);
    }

    /**
     * Builds the failure links. Must be called exactly once, after the last insertion.
     *
     * @throws AlreadyFinalizedException if called a second time; the automaton is left untouched
     */
    public void finalizeLinks() {
        automaton = trie.toAutomaton();
    }

    public boolean isFinalized() {
        return automaton != null;
    }

    public String categorize(byte[] text) {
        return automaton().categorize(text);
    }

    public String categorize(byte[] text, int offset, int length) {
        return automaton().categorize(text, offset, length);
    }

    public String categorize(CharSequence text) {
        return automaton().categorize(text);
    }

    public String categorize(ByteBuf text) {
        return automaton().categorize(text);
    }

    /**
     * Returns the finalized automaton.
     *
     * @throws NotFinalizedException if {@link #finalizeLinks()} has not been called yet
     */
    public LabelAutomaton automaton() {
        LabelAutomaton automaton = this.automaton;
        if (automaton == null) {
            throw new NotFinalizedException("Failure links not built yet, call finalizeLinks() first");
        }
        return automaton;
    }

    @Override
    public String toString() {
        LabelAutomaton automaton = this.automaton;
        return StringUtil.simpleClassName(this) + '(' + (automaton != null ? automaton : trie) + ')';
    }
}
