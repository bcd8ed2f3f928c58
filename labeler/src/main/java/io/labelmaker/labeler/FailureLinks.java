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

import static io.labelmaker.labeler.NodeArena.NO_CHILD;
import static io.labelmaker.labeler.NodeArena.ROOT;

/**
 * Computes the failure link of every node of a populated trie.
 * <p>
 * The failure link of the node spelling {@code P} is the node spelling the longest proper suffix
 * of {@code P} that is also a prefix of some pattern. Nodes are visited breadth-first, so the links
 * of all shallower nodes are final by the time a node's children are resolved.
 */
final class FailureLinks {

    private FailureLinks() {
    }

    /**
     * Returns the failure links indexed by node. The root links to itself.
     */
    static int[] build(NodeArena arena) {
        final int nodes = arena.size();
        final int[] fail = new int[nodes];

        // Each node is enqueued exactly once, so a flat array is a large enough queue.
        final int[] queue = new int[nodes];
        int head = 0;
        int tail = 0;

        fail[ROOT] = ROOT;
        for (int i = 0, degree = arena.degree(ROOT); i < degree; i++) {
            int child = arena.edgeTarget(ROOT, i);
            fail[child] = ROOT;
            queue[tail++] = child;
        }

        while (head < tail) {
            final int current = queue[head++];
            for (int i = 0, degree = arena.degree(current); i < degree; i++) {
                final int value = arena.edgeValue(current, i);
                final int child = arena.edgeTarget(current, i);

                int cursor = fail[current];
                while (cursor != ROOT && arena.child(cursor, value) == NO_CHILD) {
                    cursor = fail[cursor];
                }

                int next = arena.child(cursor, value);
                fail[child] = next == NO_CHILD ? ROOT : next;
                queue[tail++] = child;
            }
        }
        assert tail == nodes - 1 : "visited " + tail + " of " + (nodes - 1) + " non-root nodes";
        return fail;
    }
}
