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

import io.labelmaker.labeler.LabelAutomaton;
import io.labelmaker.labeler.LabelConflictException;
import io.labelmaker.labeler.LabelMaker;
import io.labelmaker.labeler.LabelTrie;
import io.labelmaker.labeler.TrieLayout;
import io.netty.util.CharsetUtil;
import io.netty.util.internal.StringUtil;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * An ordered set of pattern to label entries read from a text source.
 * <p>
 * Each line holds one entry: the pattern, a tab, and the label. The line is split at its <em>last</em>
 * tab, so patterns may contain tabs themselves, and an empty pattern (a line starting with the tab)
 * defines the label of texts that match nothing else. Lines that are empty or blank, and lines that
 * start with {@code #}, are ignored.
 * <pre>
 * # dinosaurs
 * Tyrannosaurus rex	Therapod
 * Velociraptor	Therapod
 * Brachiosaurus	Saurapod
 * </pre>
 * Repeating an entry is allowed. Giving a pattern a second, different label is not.
 */
public final class LabelDictionary {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(LabelDictionary.class);

    private static final char COMMENT_CHAR = '#';
    private static final char SEPARATOR = '\t';

    private final Map<String, String> entries;

    private LabelDictionary(Map<String, String> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    /**
     * Reads a UTF-8 encoded dictionary file.
     */
    public static LabelDictionary load(Path path) throws IOException {
        checkNotNull(path, "path");
        try (InputStream in = Files.newInputStream(path)) {
            LabelDictionary dictionary = load(in);
            logger.debug("Loaded {} dictionary entries from {}", dictionary.size(), path);
            return dictionary;
        }
    }

    /**
     * Reads a UTF-8 encoded dictionary. The stream is not closed.
     */
    public static LabelDictionary load(InputStream in) throws IOException {
        checkNotNull(in, "in");
        return load(new InputStreamReader(in, CharsetUtil.UTF_8));
    }

    /**
     * Reads a dictionary. The reader is not closed.
     *
     * @throws DictionaryFormatException if a line is malformed, has a pattern with an unpaired surrogate,
     *         or conflicts with an earlier line
     */
    public static LabelDictionary load(Reader reader) throws IOException {
        checkNotNull(reader, "reader");
        BufferedReader buff = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        Map<String, String> entries = new LinkedHashMap<String, String>();
        Map<String, Integer> definedAt = new HashMap<String, Integer>();

        String line;
        int lineNumber = 0;
        while ((line = buff.readLine()) != null) {
            lineNumber++;
            if (line.trim().isEmpty() || line.charAt(0) == COMMENT_CHAR) {
                continue;
            }

            int separator = line.lastIndexOf(SEPARATOR);
            if (separator < 0) {
                throw new DictionaryFormatException("Missing tab between pattern and label", lineNumber);
            }
            String pattern = line.substring(0, separator);
            String label = line.substring(separator + 1);
            if (label.trim().isEmpty()) {
                throw new DictionaryFormatException("Empty label for pattern '" + pattern + '\'', lineNumber);
            }

            byte[] encoded;
            try {
                encoded = LabelTrie.encodePattern(pattern);
            } catch (IllegalArgumentException e) {
                throw new DictionaryFormatException("Pattern is not well-formed UTF-16", lineNumber, e);
            }

            String existing = entries.get(pattern);
            if (existing == null) {
                entries.put(pattern, label);
                definedAt.put(pattern, lineNumber);
            } else if (!existing.equals(label)) {
                throw new DictionaryFormatException("Conflicts with the entry at line " + definedAt.get(pattern),
                        lineNumber, new LabelConflictException(encoded, label, existing));
            } else if (logger.isDebugEnabled()) {
                logger.debug("Ignored duplicate entry '{}' at line {}, first defined at line {}",
                        pattern, lineNumber, definedAt.get(pattern));
            }
        }
        return new LabelDictionary(entries);
    }

    /**
     * Returns the entries in source order.
     */
    public Map<String, String> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    /**
     * Builds a finalized automaton of all entries in the {@linkplain TrieLayout#defaultLayout() default layout}.
     */
    public LabelAutomaton toAutomaton() {
        return LabelAutomaton.newAutomaton(entries);
    }

    public LabelAutomaton toAutomaton(TrieLayout layout) {
        return LabelAutomaton.newAutomaton(entries, layout);
    }

    /**
     * Inserts all entries into {@code labeler}, which must not be finalized yet. Finalizing is left to the caller,
     * so several dictionaries can be combined.
     *
     * @throws LabelConflictException if an entry conflicts with a pattern already in
     *         {@code labeler}
     */
    public void loadInto(LabelMaker labeler) {
        checkNotNull(labeler, "labeler");
        for (Map.Entry<String, String> entry : entries.entrySet()) {
            labeler.insert(entry.getKey(), entry.getValue());
        }
    }

    @Override
    public String toString() {
        return StringUtil.simpleClassName(this) + "(entries: " + entries.size() + ')';
    }
}
