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

import io.netty.util.ByteProcessor;
import io.netty.util.internal.MathUtil;

import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * Incremental scan over a {@link LabelAutomaton} as a {@link ByteProcessor}.
 * <p>
 * Feeding the bytes of several chunks in order, for example with
 * {@link io.netty.buffer.ByteBuf#forEachByte(ByteProcessor)}, yields the same {@link #label()} as
 * {@link LabelAutomaton#categorize(byte[])} on their concatenation. {@link #process(byte)} always
 * returns {@code true}, so every byte is consumed.
 * <p>
 * A scanner is stateful and must not be shared between threads. Use {@link #reset()} to scan a new text.
 */
public final class LabelScanner implements ByteProcessor {

    private final LabelAutomaton automaton;
    private int state;
    private String label;

    LabelScanner(LabelAutomaton automaton) {
        this.automaton = automaton;
        reset();
    }

    @Override
    public boolean process(byte value) {
        state = automaton.next(state, value & 0xff);
        String current = automaton.label(state);
        if (current != null) {
            label = current;
        }
        return true;
    }

    /**
     * Feeds {@code length} bytes of {@code bytes} starting at {@code offset}.
     */
    public LabelScanner process(byte[] bytes, int offset, int length) {
        checkNotNull(bytes, "bytes");
        if (MathUtil.isOutOfBounds(offset, length, bytes.length)) {
            throw new IndexOutOfBoundsException(
                    "offset: " + offset + ", length: " + length + " (expected: range(0, " + bytes.length + "))");
        }
        for (int i = offset, end = offset + length; i < end; i++) {
            process(bytes[i]);
        }
        return this;
    }

    /**
     * Returns the label of the last labeled node entered so far, or {@code null}.
     */
    public String label() {
        return label;
    }

    /**
     * Returns {@code true} if the scan is currently at a node that carries a label.
     */
    public boolean isMatching() {
        return automaton.label(state) != null;
    }

    public void reset() {
        state = NodeArena.ROOT;
        label = automaton.label(NodeArena.ROOT);
    }
}
