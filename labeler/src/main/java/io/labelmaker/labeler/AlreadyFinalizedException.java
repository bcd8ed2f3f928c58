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
 * Raised when a pattern or a finalization is requested after the failure links of an automaton
 * have already been built.
 */
public class AlreadyFinalizedException extends IllegalStateException {

    private static final long serialVersionUID = 6372651947300185291L;

    public AlreadyFinalizedException() { }

    public AlreadyFinalizedException(String s) {
        super(s);
    }
}
