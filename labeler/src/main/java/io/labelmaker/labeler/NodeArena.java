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

import io.netty.util.internal.EmptyArrays;

import java.util.Arrays;

/**
 * Growable store of trie nodes addressed by index. Node {@code 0} is the root.
 * <p>
 * Every node keeps its outgoing edges sorted by unsigned byte value, so edges can be
 * enumerated in ascending order and looked up with a binary search.
 */
final class NodeArena {

    static final int ROOT = 0;
    static final int NO_CHILD = -1;

    private static final int INITIAL_NODES = 16;
    private static final int INITIAL_EDGES = 2;

    private byte[][] edgeValues;
    private int[][] edgeTargets;
    private int[] degrees;
    private String[] labels;
    private int size;
    private int edgeCount;

    NodeArena() {
        edgeValues = new byte[INITIAL_NODES][];
        edgeTargets = new int[INITIAL_NODES][];
        degrees = new int[INITIAL_NODES];
        labels = new String[INITIAL_NODES];
        newNode();
    }

    /**
     * Returns the number of nodes, the root included.
     */
    int size() {
        return size;
    }

    /**
     * Returns the total number of parent to child edges.
     */
    int edgeCount() {
        return edgeCount;
    }

    int degree(int node) {
        return degrees[node];
    }

    /**
     * Returns the unsigned byte value of the {@code i}-th edge of {@code node}, in ascending order.
     */
    int edgeValue(int node, int i) {
        return edgeValues[node][i] & 0xff;
    }

    int edgeTarget(int node, int i) {
        return edgeTargets[node][i];
    }

    /**
     * Returns the child of {@code node} reached by {@code value}, or {@link #NO_CHILD}.
     */
    int child(int node, int value) {
        int i = search(node, value);
        return i >= 0 ? edgeTargets[node][i] : NO_CHILD;
    }

    /**
     * Returns the child of {@code node} reached by {@code value}, allocating an empty one if missing.
     */
    int childOrCreate(int node, int value) {
        int i = search(node, value);
        if (i >= 0) {
            return edgeTargets[node][i];
        }
        int child = newNode();
        addEdge(node, -(i + 1), value, child);
        return child;
    }

    String label(int node) {
        return labels[node];
    }

    void label(int node, String label) {
        labels[node] = label;
    }

    /**
     * Returns a copy of the labels of all nodes, indexed by node.
     */
    String[] labels() {
        return Arrays.copyOf(labels, size);
    }

    private int search(int node, int value) {
        byte[] values = edgeValues[node];
        int low = 0;
        int high = degrees[node] - 1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            int midValue = values[mid] & 0xff;
            if (midValue < value) {
                low = mid + 1;
            } else if (midValue > value) {
                high = mid - 1;
            } else {
                return mid;
            }
        }
        return -(low + 1);
    }

    private void addEdge(int node, int position, int value, int child) {
        int degree = degrees[node];
        byte[] values = edgeValues[node];
        int[] targets = edgeTargets[node];
        if (degree == values.length) {
            int newLength = degree == 0 ? INITIAL_EDGES : Math.min(degree << 1, 256);
            values = Arrays.copyOf(values, newLength);
            targets = Arrays.copyOf(targets, newLength);
            edgeValues[node] = values;
            edgeTargets[node] = targets;
        }
        System.arraycopy(values, position, values, position + 1, degree - position);
        System.arraycopy(targets, position, targets, position + 1, degree - position);
        values[position] = (byte) value;
        targets[position] = child;
        degrees[node] = degree + 1;
        edgeCount++;
    }

    private int newNode() {
        if (size == degrees.length) {
            int newCapacity = size << 1;
            if (newCapacity < 0) {
                throw new IllegalStateException("Too many trie nodes: " + size);
            }
            edgeValues = Arrays.copyOf(edgeValues, newCapacity);
            edgeTargets = Arrays.copyOf(edgeTargets, newCapacity);
            degrees = Arrays.copyOf(degrees, newCapacity);
            labels = Arrays.copyOf(labels, newCapacity);
        }
        int node = size++;
        edgeValues[node] = EmptyArrays.EMPTY_BYTES;
        edgeTargets[node] = EmptyArrays.EMPTY_INTS;
        return node;
    }
}
