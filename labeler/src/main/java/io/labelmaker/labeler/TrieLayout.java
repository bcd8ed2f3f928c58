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

import io.netty.util.internal.SystemPropertyUtil;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

import java.util.Locale;

/**
 * How a finalized {@link LabelAutomaton} stores the child edges of its nodes.
 * The layout never changes which label is found, only the speed and footprint of the lookup.
 * <p>
 * The default layout is read from the {@code io.labelmaker.labeler.layout} system property
 * ({@code dense} or {@code sparse}) and is {@link #DENSE} when the property is absent.
 */
public enum TrieLayout {

    /**
     * 256 slots per node. Every transition is a single array read, at the cost of
     * {@code 1 KiB} per node.
     */
    DENSE {
        @Override
        ChildTable newChildTable(NodeArena arena) {
            return new DenseChildTable(arena);
        }
    },

    /**
     * Only the existing edges are stored, sorted per node and looked up with a binary search.
     * Preferable for large dictionaries of many short, unrelated patterns.
     */
    SPARSE {
        @Override
        ChildTable newChildTable(NodeArena arena) {
            return new SparseChildTable(arena);
        }
    };

    static final String LAYOUT_PROPERTY = "io.labelmaker.labeler.layout";

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(TrieLayout.class);

    private static final TrieLayout DEFAULT_LAYOUT;

    static {
        DEFAULT_LAYOUT = parse(SystemPropertyUtil.get(LAYOUT_PROPERTY), DENSE);
        logger.debug("-D{}: {}", LAYOUT_PROPERTY, DEFAULT_LAYOUT);
    }

    /**
     * Returns the layout selected by the {@code io.labelmaker.labeler.layout} system property.
     */
    public static TrieLayout defaultLayout() {
        return DEFAULT_LAYOUT;
    }

    static TrieLayout parse(String value, TrieLayout def) {
        if (value == null) {
            return def;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return def;
        }
        try {
            return valueOf(trimmed.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            logger.warn("Unknown trie layout '{}' - using the default layout: {}", value, def);
            return def;
        }
    }

    abstract ChildTable newChildTable(NodeArena arena);
}
