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

package com.amazon.kdtree.testutils;

import java.util.Random;

/**
 * Point sets used by tests, examples and benchmarks. Every set is returned as
 * rows of {@code (x, y)} pairs; generated sets are reproducible for a given
 * seed.
 */
public class ExamplePointSets {

    private ExamplePointSets() {
    }

    /**
     * The eight point example used throughout the documentation. Sorted by x it
     * reads (1,1), (2,2), (3,2), (4,4), (5,8), (6,1), (8,7), (9,0), and the root
     * of its tree is (4,4).
     */
    public static double[][] textbook() {
        return new double[][] { { 3, 2 }, { 5, 8 }, { 6, 1 }, { 4, 4 }, { 9, 0 }, { 1, 1 }, { 2, 2 }, { 8, 7 } };
    }

    /**
     * @return the same text as {@link #textbook()}, one point per line
     */
    public static String textbookAsText() {
        StringBuilder builder = new StringBuilder();
        for (double[] row : textbook()) {
            builder.append((long) row[0]).append(' ').append((long) row[1]).append('\n');
        }
        return builder.toString();
    }

    /**
     * Points drawn uniformly from {@code [0, scale) x [0, scale)}.
     */
    public static double[][] uniform(int size, double scale, long seed) {
        Random prg = new Random(seed);
        double[][] data = new double[size][2];
        for (int i = 0; i < size; i++) {
            data[i][0] = scale * prg.nextDouble();
            data[i][1] = scale * prg.nextDouble();
        }
        return data;
    }

    /**
     * Points on a small integer grid, so that most coordinates and many points
     * repeat.
     */
    public static double[][] withDuplicates(int size, int gridSize, long seed) {
        Random prg = new Random(seed);
        double[][] data = new double[size][2];
        for (int i = 0; i < size; i++) {
            data[i][0] = prg.nextInt(gridSize);
            data[i][1] = prg.nextInt(gridSize);
        }
        return data;
    }

    /**
     * Points on the diagonal, {@code (i, i)} for i in {@code [1, size]}.
     */
    public static double[][] diagonal(int size) {
        double[][] data = new double[size][2];
        for (int i = 0; i < size; i++) {
            data[i][0] = i + 1;
            data[i][1] = i + 1;
        }
        return data;
    }

    /**
     * Points sharing the x coordinate, {@code (x, i)} for i in {@code [0, size)}.
     */
    public static double[][] vertical(int size, double x) {
        double[][] data = new double[size][2];
        for (int i = 0; i < size; i++) {
            data[i][0] = x;
            data[i][1] = i;
        }
        return data;
    }
}
