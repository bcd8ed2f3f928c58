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

import java.util.Arrays;

/**
 * {@link ChildTable} with one slot per node and byte value, laid out as
 * {@code table[node << BITS_PER_SYMBOL | value]}.
 */
final class DenseChildTable extends ChildTable {

    static final int BITS_PER_SYMBOL = 8;
    static final int ALPHABET_SIZE = 1 << BITS_PER_SYMBOL;
    static final int MAX_NODES = Integer.MAX_VALUE >> BITS_PER_SYMBOL;

    private final int[] table;

    DenseChildTable(NodeArena arena) {
        int nodes = arena.size();
        if (nodes > MAX_NODES) {
            throw new IllegalStateException(
                    "Too many trie nodes for the dense layout: " + nodes + " (expected: <= " + MAX_NODES +
                    "), use " + TrieLayout.SPARSE);
        }
        table = new int[nodes << BITS_PER_SYMBOL];
        Arrays.fill(table, NodeArena.NO_CHILD);
        for (int node = 0; node < nodes; node++) {
            int base = node << BITS_PER_SYMBOL;
            for (int i = 0, degree = arena.degree(node); i < degree; i++) {
                table[base | arena.edgeValue(node, i)] = arena.edgeTarget(node, i);
            }
        }
    }

    @Override
    int child(int node, int value) {
        return table[node << BITS_PER_SYMBOL | value];
    }

    @Override
    long retainedBytes() {
        return (long) table.length * 4;
    }
}
