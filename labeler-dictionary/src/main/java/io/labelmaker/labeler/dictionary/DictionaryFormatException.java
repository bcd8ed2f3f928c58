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
package io.labelmaker.labeler.dictionary;

import java.io.IOException;

/**
 * Raised when a dictionary source contains a malformed line, or a line that gives an already defined
 * pattern a different label.
 */
public class DictionaryFormatException extends IOException {

    private static final long serialVersionUID = -3309275418561037724L;

    private final int lineNumber;

    public DictionaryFormatException(String message, int lineNumber) {
        super(message + " (line " + lineNumber + ')');
        this.lineNumber = lineNumber;
    }

    public DictionaryFormatException(String message, int lineNumber, Throwable cause) {
        super(message + " (line " + lineNumber + ')', cause);
        this.lineNumber = lineNumber;
    }

    /**
     * Returns the 1-based number of the offending line.
     */
    public int lineNumber() {
        return lineNumber;
    }
}
