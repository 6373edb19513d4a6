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

package com.amazon.kdtree;

import java.util.List;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

import com.amazon.kdtree.testutils.ExamplePointSets;
import com.amazon.kdtree.trace.Trace;
import com.amazon.kdtree.trace.TraceLinearizer;
import com.amazon.kdtree.tree.BoundingBox;
import com.amazon.kdtree.tree.KdTree;
import com.amazon.kdtree.tree.Point;
import com.amazon.kdtree.tree.TreeBuilder;

@Warmup(iterations = 5)
@Measurement(iterations = 10)
@Fork(value = 1)
@State(Scope.Benchmark)
public class KdTreeBenchmark {

    @State(Scope.Thread)
    public static class BenchmarkState {
        @Param({ "1000", "100000" })
        int size;

        @Param({ "false", "true" })
        boolean duplicates;

        List<Point> points;
        BoundingBox bounds;
        KdTree tree;

        @Setup(Level.Trial)
        public void setUpData() {
            double[][] data = duplicates ? ExamplePointSets.withDuplicates(size, 32, 17)
                    : ExamplePointSets.uniform(size, 100.0, 17);
            points = Point.listOf(data);
            bounds = BoundingBox.padded(points, PartitionSession.DEFAULT_PADDING_FRACTION);
        }

        @Setup(Level.Invocation)
        public void setUpTree() {
            // step indexes are write-once, so every invocation needs a fresh tree
            tree = new TreeBuilder().build(points);
        }
    }

    @Benchmark
    public KdTree build(BenchmarkState state) {
        return new TreeBuilder().build(state.points);
    }

    @Benchmark
    public Trace linearize(BenchmarkState state) {
        return new TraceLinearizer().linearize(state.tree, state.bounds);
    }

    @Benchmark
    public PartitionSession.Snapshot submit(BenchmarkState state) {
        return PartitionSession.builder().build().submit(state.points);
    }
}
