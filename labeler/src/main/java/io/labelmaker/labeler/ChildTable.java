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
 * Read-only child lookup of a finalized automaton. Built once from a {@link NodeArena} by a
 * {@link TrieLayout} and never written afterwards.
 */
abstract class ChildTable {

    /**
     * Returns the child of {@code node} reached by the unsigned byte {@code value},
     * or {@link NodeArena#NO_CHILD}.
     */
    abstract int child(int node, int value);

    /**
     * Returns the approximate number of bytes retained by this table.
     */
    abstract long retainedBytes();
}
