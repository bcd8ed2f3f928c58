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

/**
 * {@link ChildTable} that stores only the existing edges. The edges of node {@code n} occupy
 * {@code [offsets[n], offsets[n + 1])} of {@code values} and {@code targets}, sorted by value.
 */
final class SparseChildTable extends ChildTable {

    private final int[] offsets;
    private final byte[] values;
    private final int[] targets;

    SparseChildTable(NodeArena arena) {
        int nodes = arena.size();
        offsets = new int[nodes + 1];
        values = new byte[arena.edgeCount()];
        targets = new int[arena.edgeCount()];

        int edge = 0;
        for (int node = 0; node < nodes; node++) {
            offsets[node] = edge;
            for (int i = 0, degree = arena.degree(node); i < degree; i++) {
                values[edge] = (byte) arena.edgeValue(node, i);
                targets[edge] = arena.edgeTarget(node, i);
                edge++;
            }
        }
        offsets[nodes] = edge;
    }

    @Override
    int child(int node, int value) {
        int low = offsets[node];
        int high = offsets[node + 1] - 1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            int midValue = values[mid] & 0xff;
            if (midValue < value) {
                low = mid + 1;
            } else if (midValue > value) {
                high = mid - 1;
            } else {
                return targets[mid];
            }
        }
        return NodeArena.NO_CHILD;
    }

    @Override
    long retainedBytes() {
        return (long) offsets.length * 4 + values.length + (long) targets.length * 4;
    }
}
