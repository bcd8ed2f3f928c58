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

import io.netty.util.CharsetUtil;
import io.netty.util.internal.StringUtil;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;

import static io.labelmaker.labeler.NodeArena.ROOT;
import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * Mutable trie of labeled patterns, the construction stage of a {@link LabelAutomaton}.
 * <p>
 * Patterns are inserted one at a time with {@link #insert(byte[], String)}. {@link #toAutomaton()}
 * then builds the failure links once and hands out the immutable automaton; the trie rejects any
 * further insertion from that point on.
 * <p>
 * This class is not thread-safe.
 */
public final class LabelTrie {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(LabelTrie.class);

    private final NodeArena arena = new NodeArena();
    private final TrieLayout layout;
    private int patternCount;
    private boolean finalized;

    /**
     * Creates an empty trie whose automaton uses the {@linkplain TrieLayout#defaultLayout() default layout}.
     */
    public LabelTrie() {
        this(TrieLayout.defaultLayout());
    }

    /**
     * Creates an empty trie whose automaton uses the given layout.
     */
    public LabelTrie(TrieLayout layout) {
        this.layout = checkNotNull(layout, "layout");
    }

    /**
     * Returns the UTF-8 encoding of {@code pattern}.
     *
     * @throws IllegalArgumentException if {@code pattern} contains an unpaired surrogate
     */
    public static byte[] encodePattern(CharSequence pattern) {
        checkNotNull(pattern, "pattern");
        ByteBuffer encoded;
        try {
            // CharsetUtil.encoder(Charset) is cached and replaces malformed input.
            encoded = CharsetUtil.encoder(CharsetUtil.UTF_8, CodingErrorAction.REPORT)
                    .encode(CharBuffer.wrap(pattern));
        } catch (CharacterCodingException e) {
            throw new IllegalArgumentException("Pattern is not well-formed UTF-16: " + e.getMessage(), e);
        }
        byte[] bytes = new byte[encoded.remaining()];
        encoded.get(bytes);
        return bytes;
    }

    /**
     * Inserts the UTF-8 encoding of {@code pattern} with the given label.
     *
     * @throws IllegalArgumentException if {@code pattern} contains an unpaired surrogate. Nothing is
     *         inserted in that case.
     * @see #insert(byte[], String)
     */
    public LabelTrie insert(CharSequence pattern, String label) {
        return insert(encodePattern(pattern), label);
    }

    /**
     * Inserts {@code pattern} with the given label. The empty pattern labels the root, which makes
     * its label the result of any scan that finds nothing else.
     * <p>
     * Inserting a pattern again with the same label has no effect.
     *
     * @throws LabelConflictException if {@code pattern} already carries a different label. The nodes
     *         created along the way are kept and the existing label is left unchanged.
     * @throws AlreadyFinalizedException if {@link #toAutomaton()} was already called
     */
    public LabelTrie insert(byte[] pattern, String label) {
        checkNotNull(pattern, "pattern");
        checkNotNull(label, "label");
        if (finalized) {
            throw new AlreadyFinalizedException("Cannot insert after the failure links have been built");
        }

        int node = ROOT;
        for (byte value : pattern) {
            node = arena.childOrCreate(node, value & 0xff);
        }

        String existingLabel = arena.label(node);
        if (existingLabel == null) {
            arena.label(node, label);
            patternCount++;
            if (logger.isDebugEnabled()) {
                logger.debug("Inserted pattern '{}' with label '{}'", new String(pattern, CharsetUtil.UTF_8), label);
            }
        } else if (!existingLabel.equals(label)) {
            throw new LabelConflictException(pattern, label, existingLabel);
        } else if (logger.isDebugEnabled()) {
            logger.debug("Ignored duplicate pattern '{}' with label '{}'", new String(pattern, CharsetUtil.UTF_8),
                    label);
        }
        return this;
    }

    /**
     * Builds the failure links and returns the finalized automaton. Can be called only once.
     *
     * @throws AlreadyFinalizedException if the failure links were already built
     */
    public LabelAutomaton toAutomaton() {
        if (finalized) {
            throw new AlreadyFinalizedException("Failure links have already been built");
        }
        int[] fail = FailureLinks.build(arena);
        LabelAutomaton automaton =
                new LabelAutomaton(layout.newChildTable(arena), fail, arena.labels(), patternCount, layout);
        finalized = true;
        if (logger.isDebugEnabled()) {
            logger.debug("Built failure links: {} nodes, {} patterns, layout: {}, {} bytes retained",
                    automaton.nodeCount(), patternCount, layout, automaton.retainedBytes());
        }
        return automaton;
    }

    public boolean isFinalized() {
        return finalized;
    }

    /**
     * Returns the number of trie nodes, the root included.
     */
    public int nodeCount() {
        return arena.size();
    }

    /**
     * Returns the number of distinct labeled patterns inserted so far.
     */
    public int patternCount() {
        return patternCount;
    }

    public TrieLayout layout() {
        return layout;
    }

    @Override
    public String toString() {
        return StringUtil.simpleClassName(this) +
                "(nodes: " + nodeCount() + ", patterns: " + patternCount + ", finalized: " + finalized + ')';
    }
}
