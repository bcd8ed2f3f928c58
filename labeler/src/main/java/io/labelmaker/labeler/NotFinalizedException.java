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
 * Raised by {@link LabelMaker} when text is categorized before {@link LabelMaker#finalizeLinks()}.
 */
public class NotFinalizedException extends IllegalStateException {

    private static final long serialVersionUID = -8093317214451846617L;

    public NotFinalizedException() { }

    public NotFinalizedException(String s) {
        super(s);
    }
}
