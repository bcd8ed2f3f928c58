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

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.util.CharsetUtil;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class LabelAutomatonTest {

    @ParameterizedTest
    @EnumSource(TrieLayout.class)
    public void testDinosaurs(TrieLayout layout) {
        LabelAutomaton automaton = LabelAutomaton.newAutomaton(dinosaurs(), layout);

        assertEquals("Therapod", automaton.categorize("Tyrannosaurus rex"));
        assertEquals("Therapod", automaton.categorize("Velociraptor"));
        assertEquals("Saurapod", automaton.categorize("Brachiosaurus"));
        assertEquals("Saurapod", automaton.categorize("Patagotitan"));
        assertEquals("Saurapod", automaton.categorize("the Patagotitan was found in Argentina"));
        assertNull(automaton.categorize("Stegosaurus"));
        assertEquals(4, automaton.patternCount());
        assertEquals(layout, automaton.layout());
    }

    @ParameterizedTest
    @EnumSource(TrieLayout.class)
    public void testRightmostMatchWins(TrieLayout layout) {
        Map<String, String> dictionary = new HashMap<String, String>();
        dictionary.put("triceratop", "Single");
        dictionary.put("triceratops", "Many");
        LabelAutomaton automaton = LabelAutomaton.newAutomaton(dictionary, layout);

        assertEquals("Many", automaton.categorize("triceratops are a group of herbivorous ceratopsid dinosaurs"));
        assertEquals("Single", automaton.categorize("one triceratop"));
    }

    @ParameterizedTest
    @EnumSource(TrieLayout.class)
    public void testLaterMatchOverwritesEarlierUnrelatedMatch(TrieLayout layout) {
        Map<String, String> dictionary = new HashMap<String, String>();
        dictionary.put("ab", "X");
        dictionary.put("c", "Y");
        LabelAutomaton automaton = LabelAutomaton.newAutomaton(dictionary, layout);

        assertEquals("Y", automaton.categorize("abc"));
        assertEquals("X", automaton.categorize("cab"));
        assertEquals("X", automaton.categorize("cabd"));
    }

    @ParameterizedTest
    @EnumSource(TrieLayout.class)
    public void testSuffixMatchFoundThroughFailureLink(TrieLayout layout) {
        Map<String, String> dictionary = new HashMap<String, String>();
        dictionary.put("he", "pronoun");
        dictionary.put("she", "pronoun");
        dictionary.put("his", "possessive");
        dictionary.put("hers", "possessive");
        LabelAutomaton automaton = LabelAutomaton.newAutomaton(dictionary, layout);

        assertEquals("possessive", automaton.categorize("ushers"));
        assertEquals("pronoun", automaton.categorize("usher"));
        assertEquals("possessive", automaton.categorize("this"));
        assertNull(automaton.categorize("hhhh"));
    }

    @ParameterizedTest
    @EnumSource(TrieLayout.class)
    public void testOnlyDeepestStateIsReported(TrieLayout layout) {
        Map<String, String> dictionary = new HashMap<String, String>();
        dictionary.put("abcd", "long");
        dictionary.put("bc", "short");
        LabelAutomaton automaton = LabelAutomaton.newAutomaton(dictionary, layout);

        // After "abc" the automaton sits on the unlabeled prefix "abc", not on "bc".
        assertNull(automaton.categorize("abc"));
        assertEquals("long", automaton.categorize("abcd"));
        assertEquals("short", automaton.categorize("xbc"));
    }

    @ParameterizedTest
    @EnumSource(TrieLayout.class)
    public void testEmptyText(TrieLayout layout) {
        LabelAutomaton automaton = LabelAutomaton.newAutomaton(dinosaurs(), layout);

        assertNull(automaton.categorize(""));
        assertNull(automaton.categorize(new byte[0]));
        assertNull(automaton.categorize(Unpooled.EMPTY_BUFFER));
    }

    @ParameterizedTest
    @EnumSource(TrieLayout.class)
    public void testEmptyPatternLabelsRoot(TrieLayout layout) {
        Map<String, String> dictionary = new LinkedHashMap<String, String>();
        dictionary.put("", "Unknown");
        dictionary.put("rex", "Therapod");
        LabelAutomaton automaton = LabelAutomaton.newAutomaton(dictionary, layout);

        assertEquals("Unknown", automaton.categorize(""));
        assertEquals("Unknown", automaton.categorize("zzz"));
        assertEquals("Therapod", automaton.categorize("rex"));
        // Falling back to the root after the match reports the root label again.
        assertEquals("Unknown", automaton.categorize("rex!"));
        assertEquals(2, automaton.patternCount());
    }

    @ParameterizedTest
    @EnumSource(TrieLayout.class)
    public void testRawBytes(TrieLayout layout) {
        LabelTrie trie = new LabelTrie(layout);
        trie.insert(new byte[] { 0, (byte) 0xff, 0 }, "binary");
        trie.insert(new byte[] { (byte) 0x80 }, "high");
        LabelAutomaton automaton = trie.toAutomaton();

        assertEquals("binary", automaton.categorize(new byte[] { 1, 0, (byte) 0xff, 0 }));
        assertEquals("high", automaton.categorize(new byte[] { 0, (byte) 0xff, (byte) 0x80 }));
        assertNull(automaton.categorize(new byte[] { 0, (byte) 0xfe, 0 }));
    }

    @ParameterizedTest
    @EnumSource(TrieLayout.class)
    public void testUtf8Patterns(TrieLayout layout) {
        Map<String, String> dictionary = new HashMap<String, String>();
        dictionary.put("☺", "smile");
        dictionary.put("é", "accent");
        LabelAutomaton automaton = LabelAutomaton.newAutomaton(dictionary, layout);

        assertEquals("smile", automaton.categorize("abc☺"));
        assertEquals("accent", automaton.categorize("caf" + "é"));
        assertEquals("accent", automaton.categorize("é".getBytes(CharsetUtil.UTF_8)));
        assertNull(automaton.categorize("e"));
    }

    @ParameterizedTest
    @EnumSource(TrieLayout.class)
    public void testOffsetAndLength(TrieLayout layout) {
        LabelAutomaton automaton = LabelAutomaton.newAutomaton(dinosaurs(), layout);
        byte[] text = "xxVelociraptorxx".getBytes(CharsetUtil.US_ASCII);

        assertEquals("Therapod", automaton.categorize(text, 2, 12));
        assertNull(automaton.categorize(text, 3, 11));
        assertNull(automaton.categorize(text, 2, 11));
        assertNull(automaton.categorize(text, 5, 0));
    }

    @Test
    public void testOutOfBounds() {
        final LabelAutomaton automaton = LabelAutomaton.newAutomaton(dinosaurs());
        final byte[] text = new byte[4];

        assertThrows(IndexOutOfBoundsException.class, () -> automaton.categorize(text, 2, 3));
        assertThrows(IndexOutOfBoundsException.class, () -> automaton.categorize(text, -1, 1));
        assertThrows(NullPointerException.class, () -> automaton.categorize((byte[]) null));
        assertThrows(NullPointerException.class, () -> automaton.categorize((CharSequence) null));
    }

    @ParameterizedTest
    @EnumSource(TrieLayout.class)
    public void testByteBufReaderIndexUntouched(TrieLayout layout) {
        LabelAutomaton automaton = LabelAutomaton.newAutomaton(dinosaurs(), layout);
        ByteBuf text = Unpooled.copiedBuffer("a Brachiosaurus skeleton", CharsetUtil.UTF_8);
        try {
            assertEquals("Saurapod", automaton.categorize(text));
            assertEquals(0, text.readerIndex());

            text.skipBytes(3);
            assertNull(automaton.categorize(text));
            assertEquals(3, text.readerIndex());
        } finally {
            text.release();
        }
    }

    @ParameterizedTest
    @EnumSource(TrieLayout.class)
    public void testEveryPatternFindsItsOwnLabel(TrieLayout layout) {
        Map<String, String> dictionary = new LinkedHashMap<String, String>();
        String[] words = { "a", "ab", "abc", "b", "bca", "cab", "aab", "abab", "c" };
        for (int i = 0; i < words.length; i++) {
            dictionary.put(words[i], "L" + i);
        }
        LabelAutomaton automaton = LabelAutomaton.newAutomaton(dictionary, layout);

        for (Map.Entry<String, String> entry : dictionary.entrySet()) {
            assertEquals(entry.getValue(), automaton.categorize(entry.getKey()), entry.getKey());
        }
    }

    @ParameterizedTest
    @EnumSource(TrieLayout.class)
    @Timeout(30)
    public void testConcurrentCategorize(TrieLayout layout) throws Exception {
        Map<String, String> dictionary = new LinkedHashMap<String, String>();
        String[] words = { "a", "ab", "abc", "b", "bca", "cab", "aab", "abab", "cc" };
        for (int i = 0; i < words.length; i++) {
            dictionary.put(words[i], "L" + i);
        }
        final LabelAutomaton automaton = LabelAutomaton.newAutomaton(dictionary, layout);

        Random random = new Random(42);
        final byte[][] texts = new byte[500][];
        final String[] expected = new String[texts.length];
        for (int i = 0; i < texts.length; i++) {
            byte[] text = new byte[random.nextInt(64)];
            for (int j = 0; j < text.length; j++) {
                text[j] = (byte) ('a' + random.nextInt(4));
            }
            texts[i] = text;
            expected[i] = automaton.categorize(text);
        }

        int threads = 8;
        final CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<Integer>> futures = new ArrayList<Future<Integer>>();
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(new Callable<Integer>() {
                    @Override
                    public Integer call() throws Exception {
                        start.await();
                        int mismatches = 0;
                        for (int round = 0; round < 20; round++) {
                            for (int i = 0; i < texts.length; i++) {
                                String label = round % 2 == 0 ? automaton.categorize(texts[i])
                                        : automaton.newScanner().process(texts[i], 0, texts[i].length).label();
                                if (label == null ? expected[i] != null : !label.equals(expected[i])) {
                                    mismatches++;
                                }
                            }
                        }
                        return mismatches;
                    }
                }));
            }
            start.countDown();
            for (Future<Integer> future : futures) {
                assertEquals(0, future.get().intValue());
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void testLayoutsAgree() {
        LabelAutomaton dense = LabelAutomaton.newAutomaton(dinosaurs(), TrieLayout.DENSE);
        LabelAutomaton sparse = LabelAutomaton.newAutomaton(dinosaurs(), TrieLayout.SPARSE);

        assertEquals(dense.nodeCount(), sparse.nodeCount());
        String[] texts = { "", "Tyrannosaurus", "Tyrannosaurus rex", "Brachiosaurus rex", "PatagotitanVelociraptor" };
        for (String text : texts) {
            assertEquals(dense.categorize(text), sparse.categorize(text), text);
        }
    }

    @Test
    public void testDeterministicBuild() {
        LabelAutomaton first = LabelAutomaton.newAutomaton(dinosaurs());
        LabelAutomaton second = LabelAutomaton.newAutomaton(dinosaurs());

        assertEquals(first.nodeCount(), second.nodeCount());
        for (int state = 0; state < first.nodeCount(); state++) {
            assertEquals(first.fail(state), second.fail(state));
            assertEquals(first.label(state), second.label(state));
        }
    }

    @Test
    public void testToString() {
        LabelAutomaton automaton = LabelAutomaton.newAutomaton(dinosaurs(), TrieLayout.SPARSE);
        assertEquals("LabelAutomaton(nodes: " + automaton.nodeCount() + ", patterns: 4, layout: SPARSE)",
                automaton.toString());
    }

    static Map<String, String> dinosaurs() {
        Map<String, String> dictionary = new LinkedHashMap<String, String>();
        dictionary.put("Tyrannosaurus rex", "Therapod");
        dictionary.put("Velociraptor", "Therapod");
        dictionary.put("Brachiosaurus", "Saurapod");
        dictionary.put("Patagotitan", "Saurapod");
        return dictionary;
    }
}
