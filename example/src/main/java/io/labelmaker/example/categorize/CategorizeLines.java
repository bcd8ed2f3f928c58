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
package io.labelmaker.example.categorize;

import io.labelmaker.labeler.LabelAutomaton;
import io.labelmaker.labeler.dictionary.LabelDictionary;
import io.netty.util.CharsetUtil;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.file.Paths;

/**
 * Labels every line read from the standard input with the dictionary given by {@code -Ddictionary=<file>}
 * and prints {@code <label>\t<line>}, or {@code -\t<line>} when nothing matched.
 * <pre>
 * $ java -Ddictionary=dinosaurs.tsv io.labelmaker.example.categorize.CategorizeLines &lt; notes.txt
 * </pre>
 */
public final class CategorizeLines {

    static final String DICTIONARY = System.getProperty("dictionary");
    static final String NO_LABEL = System.getProperty("noLabel", "-");

    public static void main(String[] args) throws Exception {
        PrintStream out = new PrintStream(System.out, false, CharsetUtil.UTF_8.name());
        int status = run(DICTIONARY, NO_LABEL, new InputStreamReader(System.in, CharsetUtil.UTF_8), out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Loads {@code dictionary} and labels every line of {@code in}. Returns the exit status.
     */
    static int run(String dictionary, String noLabel, Reader in, PrintStream out, PrintStream err)
            throws IOException {
        if (dictionary == null) {
            err.println("Usage: java -Ddictionary=<file> " + CategorizeLines.class.getName() + " < input");
            return 1;
        }

        LabelAutomaton automaton = LabelDictionary.load(Paths.get(dictionary)).toAutomaton();
        err.println("Loaded " + automaton);
        categorizeLines(automaton, noLabel, in, out);
        return 0;
    }

    static void categorizeLines(LabelAutomaton automaton, String noLabel, Reader in, PrintStream out)
            throws IOException {
        BufferedReader reader = in instanceof BufferedReader ? (BufferedReader) in : new BufferedReader(in);
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                String label = automaton.categorize(line);
                out.print(label != null ? label : noLabel);
                out.print('\t');
                out.println(line);
            }
        } finally {
            out.flush();
        }
    }

    private CategorizeLines() {
    }
}
