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
import io.netty.util.CharsetUtil;
import io.netty.util.internal.MathUtil;
import io.netty.util.internal.StringUtil;

import java.util.Map;

import static io.labelmaker.labeler.NodeArena.NO_CHILD;
import static io.labelmaker.labeler.NodeArena.ROOT;
import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * Finalized <a href="https://en.wikipedia.org/wiki/Aho%E2%80%93Corasick_algorithm">Aho–Corasick</a>
 * automaton that maps text to the label of a dictionary pattern it contains.
 * <p>
 * Instances are obtained from {@link LabelTrie#toAutomaton()}, from {@link LabelMaker#finalizeLinks()},
 * or in one step from {@link #newAutomaton(Map)}. They are immutable and may be shared by any number of
 * threads.
 * <p>
 * Building is linear in the total length of the patterns. Categorizing is linear in the length of
 * the text: every byte is processed once, sequentially, regardless of the number of patterns.
 * <br>
 * <b>Note:</b> the reported label is the one of the <em>last</em> labeled node entered while scanning
 * from left to right, i.e. of the match that ends rightmost. It is not necessarily the longest or the
 * first match. With the patterns {@code {"triceratop": "Single", "triceratops": "Many"}} the text
 * {@code "triceratops are..."} is labeled {@code "Many"}, and with {@code {"ab": "X", "c": "Y"}} the
 * text {@code "abc"} is labeled {@code "Y"}.
 * <br>
 * Usage example:
 * <pre>
 *      Map&lt;String, String&gt; dictionary = new HashMap&lt;String, String&gt;();
 *      dictionary.put("Tyrannosaurus rex", "Therapod");
 *      dictionary.put("Brachiosaurus", "Saurapod");
 *      LabelAutomaton automaton = LabelAutomaton.newAutomaton(dictionary);
 *
 *      automaton.categorize("a Tyrannosaurus rex skull"); // "Therapod"
 *      automaton.categorize("a stegosaurus");             // null
 * </pre>
 */
public final class LabelAutomaton {

    private final ChildTable children;
    private final int[] fail;
    private final String[] labels;
    private final int patternCount;
    private final TrieLayout layout;

    LabelAutomaton(ChildTable children, int[] fail, String[] labels, int patternCount, TrieLayout layout) {
        this.children = children;
        this.fail = fail;
        this.labels = labels;
        this.patternCount = patternCount;
        this.layout = layout;
    }

    /**
     * Builds an automaton from a mapping of patterns to labels, in the {@linkplain TrieLayout#defaultLayout()
     * default layout}. Patterns are encoded as UTF-8.
     *
     * @param dictionary the patterns and their labels
     * @return a new finalized {@link LabelAutomaton}
     * @throws LabelConflictException if two keys encode to the same bytes but carry different labels
     */
    public static LabelAutomaton newAutomaton(Map<? extends CharSequence, String> dictionary) {
        return newAutomaton(dictionary, TrieLayout.defaultLayout());
    }

    /**
     * Builds an automaton from a mapping of patterns to labels, in the given layout.
     * Patterns are encoded as UTF-8.
     *
     * @param dictionary the patterns and their labels
     * @param layout how the child edges are stored
     * @return a new finalized {@link LabelAutomaton}
     * @throws LabelConflictException if two keys encode to the same bytes but carry different labels
     */
    public static LabelAutomaton newAutomaton(Map<? extends CharSequence, String> dictionary, TrieLayout layout) {
        checkNotNull(dictionary, "dictionary");
        LabelTrie trie = new LabelTrie(layout);
        for (Map.Entry<? extends CharSequence, String> entry : dictionary.entrySet()) {
            trie.insert(entry.getKey(), entry.getValue());
        }
        return trie.toAutomaton();
    }

    /**
     * Returns the label of the rightmost-ending pattern found in {@code text}, or {@code null}
     * if none is found.
     */
    public String categorize(byte[] text) {
        checkNotNull(text, "text");
        return categorize(text, 0, text.length);
    }

    /**
     * Returns the label of the rightmost-ending pattern found in {@code length} bytes of {@code text}
     * starting at {@code offset}, or {@code null} if none is found.
     */
    public String categorize(byte[] text, int offset, int length) {
        checkNotNull(text, "text");
        if (MathUtil.isOutOfBounds(offset, length, text.length)) {
            throw new IndexOutOfBoundsException(
                    "offset: " + offset + ", length: " + length + " (expected: range(0, " + text.length + "))");
        }

        int state = ROOT;
        String result = labels[ROOT];
        for (int i = offset, end = offset + length; i < end; i++) {
            state = next(state, text[i] & 0xff);
            String label = labels[state];
            if (label != null) {
                result = label;
            }
        }
        return result;
    }

    /**
     * Returns the label of the rightmost-ending pattern found in the UTF-8 encoding of {@code text},
     * or {@code null} if none is found. Unpaired surrogates in {@code text} are encoded as {@code '?'},
     * as {@link String#getBytes(java.nio.charset.Charset)} does.
     */
    public String categorize(CharSequence text) {
        checkNotNull(text, "text");
        return categorize(text.toString().getBytes(CharsetUtil.UTF_8));
    }

    /**
     * Returns the label of the rightmost-ending pattern found in the readable bytes of {@code text},
     * or {@code null} if none is found. The reader index of {@code text} is not modified.
     */
    public String categorize(ByteBuf text) {
        checkNotNull(text, "text");
        LabelScanner scanner = newScanner();
        text.forEachByte(text.readerIndex(), text.readableBytes(), scanner);
        return scanner.label();
    }

    /**
     * Returns a new {@link LabelScanner} positioned at the root, for text that arrives in chunks.
     */
    public LabelScanner newScanner() {
        return new LabelScanner(this);
    }

    /**
     * Returns the number of trie nodes, the root included.
     */
    public int nodeCount() {
        return labels.length;
    }

    /**
     * Returns the number of distinct labeled patterns.
     */
    public int patternCount() {
        return patternCount;
    }

    public TrieLayout layout() {
        return layout;
    }

    /**
     * Returns the approximate number of bytes retained by the transition structures.
     */
    public long retainedBytes() {
        return children.retainedBytes() + (long) fail.length * 4;
    }

    /**
     * Advances from {@code state} over the unsigned byte {@code value}, following failure links
     * until a node with a matching child or the root is reached.
     */
    int next(int state, int value) {
        int child;
        while ((child = children.child(state, value)) == NO_CHILD && state != ROOT) {
            state = fail[state];
        }
        return child == NO_CHILD ? ROOT : child;
    }

    String label(int state) {
        return labels[state];
    }

    int fail(int state) {
        return fail[state];
    }

    @Override
    public String toString() {
        return StringUtil.simpleClassName(this) +
                "(nodes: " + nodeCount() + ", patterns: " + patternCount + ", layout: " + layout + ')';
    }
}
