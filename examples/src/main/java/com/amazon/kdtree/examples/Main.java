/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.kdtree.examples;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.amazon.kdtree.examples.input.PointParser;
import com.amazon.kdtree.examples.playback.PlaybackExample;
import com.amazon.kdtree.examples.serialization.JsonExample;
import com.amazon.kdtree.testutils.ExamplePointSets;
import com.amazon.kdtree.tree.Point;

public class Main {

    public static final String ARCHIVE_NAME = "kdtree-trace-examples-1.0.jar";

    public static final String STDIN = "-";

    public static void main(String[] args) throws Exception {
        new Main().run(args);
    }

    private final Map<String, Example> examples;
    private final PointParser parser;
    private int maxCommandLength;

    public Main() {
        examples = new TreeMap<>();
        parser = new PointParser();
        maxCommandLength = 0;
        add(new PlaybackExample());
        add(new JsonExample());
    }

    private void add(Example example) {
        examples.put(example.command(), example);
        if (maxCommandLength < example.command().length()) {
            maxCommandLength = example.command().length();
        }
    }

    public void run(String[] args) throws Exception {
        run(args, System.out);
    }

    public void run(String[] args, PrintStream out) throws Exception {
        if (args == null || args.length < 1 || args[0].equals("-h") || args[0].equals("--help")) {
            printUsage(out);
            return;
        }

        String command = args[0];
        if (!examples.containsKey(command)) {
            throw new IllegalArgumentException("No such example: " + command);
        }

        List<Point> points = (args.length > 1) ? readPoints(args[1]) : Point.listOf(ExamplePointSets.textbook());
        if (points.isEmpty()) {
            throw new IllegalArgumentException("No valid points found. Please check your input.");
        }
        examples.get(command).run(points, out);
    }

    List<Point> readPoints(String source) throws IOException {
        if (STDIN.equals(source)) {
            return parser.parse(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        }
        try (Reader reader = Files.newBufferedReader(Paths.get(source), StandardCharsets.UTF_8)) {
            return parser.parse(reader);
        }
    }

    public void printUsage(PrintStream out) {
        out.printf("Usage: java -cp %s %s [example] [file | %s]%n", ARCHIVE_NAME, Main.class.getName(), STDIN);
        out.println("Points are read one 'x y' pair per line; without a file the built-in example is used.");
        out.println("Examples:");
        String formatString = String.format("\t %%%ds - %%s%%n", maxCommandLength);
        for (Example example : examples.values()) {
            out.printf(formatString, example.command(), example.description());
        }
    }

}
