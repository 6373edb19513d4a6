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

import static com.amazon.kdtree.CommonUtils.checkArgument;
import static com.amazon.kdtree.CommonUtils.checkNotNull;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import lombok.Getter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.kdtree.trace.Trace;
import com.amazon.kdtree.trace.TraceLinearizer;
import com.amazon.kdtree.trace.TracePlayer;
import com.amazon.kdtree.tree.BoundingBox;
import com.amazon.kdtree.tree.KdTree;
import com.amazon.kdtree.tree.Point;
import com.amazon.kdtree.tree.TreeBuilder;

/**
 * Runs the build of a tree and its trace for every submitted point set, and
 * publishes the result as one {@link Snapshot}. A new submission replaces the
 * previous snapshot wholesale; readers holding the previous snapshot keep a
 * complete, unchanging tree and trace.
 */
public class PartitionSession {

    private static final Logger logger = LoggerFactory.getLogger(PartitionSession.class);

    /**
     * Default fraction of the extent of the points added on each side of the root
     * rectangle.
     */
    public static final double DEFAULT_PADDING_FRACTION = 0.1;

    private final double paddingFraction;
    private final TreeBuilder treeBuilder;
    private final TraceLinearizer traceLinearizer;
    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>();

    protected PartitionSession(Builder<?> builder) {
        checkArgument(builder.paddingFraction >= 0 && Double.isFinite(builder.paddingFraction),
                "paddingFraction must be a non-negative number");
        this.paddingFraction = builder.paddingFraction;
        this.treeBuilder = checkNotNull(builder.treeBuilder, "treeBuilder must not be null");
        this.traceLinearizer = checkNotNull(builder.traceLinearizer, "traceLinearizer must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    public double getPaddingFraction() {
        return paddingFraction;
    }

    /**
     * Builds the tree and trace for the points, using their padded bounding box as
     * the root rectangle.
     *
     * @param points a non-empty list of points
     * @return the published snapshot
     */
    public Snapshot submit(List<Point> points) {
        checkNotNull(points, "points must not be null");
        checkArgument(!points.isEmpty(), "No valid points found");
        return submit(points, BoundingBox.padded(points, paddingFraction));
    }

    /**
     * Builds the tree and trace for the points with the given root rectangle.
     *
     * @param points a list of points
     * @param bounds the root rectangle
     * @return the published snapshot
     */
    public Snapshot submit(List<Point> points, BoundingBox bounds) {
        checkNotNull(points, "points must not be null");
        checkNotNull(bounds, "bounds must not be null");
        KdTree tree = treeBuilder.build(points);
        Trace trace = traceLinearizer.linearize(tree, bounds);
        Snapshot result = new Snapshot(tree, bounds, trace);
        Snapshot previous = snapshot.getAndSet(result);
        if (logger.isDebugEnabled()) {
            logger.debug("published snapshot with {} points and {} steps, replaced={}", tree.size(), trace.size(),
                    previous != null);
        }
        return result;
    }

    /**
     * @return the latest published snapshot, or null before the first submission
     */
    public Snapshot getSnapshot() {
        return snapshot.get();
    }

    /**
     * A tree, its root rectangle and its trace, published together.
     */
    @Getter
    public static class Snapshot {
        private final KdTree tree;
        private final BoundingBox bounds;
        private final Trace trace;

        Snapshot(KdTree tree, BoundingBox bounds, Trace trace) {
            this.tree = tree;
            this.bounds = bounds;
            this.trace = trace;
        }

        public TracePlayer newPlayer() {
            return new TracePlayer(trace);
        }
    }

    public static class Builder<T extends Builder<T>> {
        protected double paddingFraction = DEFAULT_PADDING_FRACTION;
        protected TreeBuilder treeBuilder = new TreeBuilder();
        protected TraceLinearizer traceLinearizer = new TraceLinearizer();

        public T paddingFraction(double paddingFraction) {
            this.paddingFraction = paddingFraction;
            return (T) this;
        }

        public T treeBuilder(TreeBuilder treeBuilder) {
            this.treeBuilder = treeBuilder;
            return (T) this;
        }

        public T traceLinearizer(TraceLinearizer traceLinearizer) {
            this.traceLinearizer = traceLinearizer;
            return (T) this;
        }

        public PartitionSession build() {
            return new PartitionSession(this);
        }
    }
}
