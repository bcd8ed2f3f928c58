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

import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * Raised when a pattern that already carries a label is inserted again with a different label.
 * <p>
 * The trie edges created while walking the pattern stay in place, and the stored label is kept.
 */
public class LabelConflictException extends IllegalArgumentException {

    private static final long serialVersionUID = 2815260471192738340L;

    private final byte[] pattern;
    private final String label;
    private final String existingLabel;

    public LabelConflictException(byte[] pattern, String label, String existingLabel) {
        super("Pattern '" + new String(checkNotNull(pattern, "pattern"), CharsetUtil.UTF_8) +
                "' is already labeled as '" + existingLabel + "', conflicts with new label '" + label + '\'');
        this.pattern = pattern.clone();
        this.label = label;
        this.existingLabel = existingLabel;
    }

    /**
     * Returns a copy of the offending pattern.
     */
    public byte[] pattern() {
        return pattern.clone();
    }

    /**
     * Returns the rejected label.
     */
    public String label() {
        return label;
    }

    /**
     * Returns the label the pattern already carried.
     */
    public String existingLabel() {
        return existingLabel;
    }
}
