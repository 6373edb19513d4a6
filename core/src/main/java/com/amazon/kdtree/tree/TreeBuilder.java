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

package com.amazon.kdtree.tree;

import static com.amazon.kdtree.CommonUtils.checkArgument;
import static com.amazon.kdtree.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.kdtree.Visitor;

/**
 * Builds a balanced {@link KdTree} by recursive median splits. At depth d the
 * remaining points are sorted along axis {@code d % 2} and the lower median,
 * the element at index {@code (n - 1) / 2}, becomes the node; the points before
 * and after it form the left and right subtrees.
 * <p>
 * The build is a pure function of the input sequence. Points that are equal in
 * both coordinates keep their relative input order, so two builds of the same
 * sequence always produce the same tree.
 */
public class TreeBuilder {

    private static final Logger logger = LoggerFactory.getLogger(TreeBuilder.class);

    public static final String LABEL_PREFIX = "P";

    /**
     * Builds and labels a tree for the given points. The list is not modified.
     *
     * @param points the points, possibly empty and possibly with duplicates
     * @return a labeled tree with one node per point
     */
    public KdTree build(List<Point> points) {
        checkNotNull(points, "points must not be null");
        for (Point point : points) {
            checkNotNull(point, "points must not contain null");
            checkArgument(point.isFinite(), "point coordinates must be finite");
        }
        if (points.isEmpty()) {
            logger.debug("empty point set, returning the empty tree");
            return KdTree.empty();
        }

        List<Integer> positions = new ArrayList<>(points.size());
        for (int i = 0; i < points.size(); i++) {
            positions.add(i);
        }
        KdNode root = buildSubtree(points, positions, 0);
        KdTree tree = new KdTree(root, points.size());
        labelNodes(tree);
        if (logger.isDebugEnabled()) {
            logger.debug("built tree; size={}, depth={}, root={}", tree.size(), tree.getDepth(), root.getPoint());
        }
        return tree;
    }

    /**
     * @param points    all input points
     * @param positions input positions of the points covered by this subtree
     * @param depth     depth of the subtree root
     * @return the subtree root, or null if there are no points
     */
    KdNode buildSubtree(List<Point> points, List<Integer> positions, int depth) {
        if (positions.isEmpty()) {
            return null;
        }

        int axis = depth % Point.DIMENSIONS;
        PointComparator comparator = new PointComparator(axis);
        List<Integer> sorted = new ArrayList<>(positions);
        sorted.sort((a, b) -> {
            int result = comparator.compare(points.get(a), points.get(b));
            return (result != 0) ? result : Integer.compare(a, b);
        });

        int medianIndex = lowerMedianIndex(sorted.size());
        KdNode left = buildSubtree(points, sorted.subList(0, medianIndex), depth + 1);
        KdNode right = buildSubtree(points, sorted.subList(medianIndex + 1, sorted.size()), depth + 1);
        return new KdNode(points.get(sorted.get(medianIndex)), axis, left, right);
    }

    /**
     * @param size length of a sorted sequence, at least 1
     * @return the index of the lower median
     */
    static int lowerMedianIndex(int size) {
        return (size - 1) / 2;
    }

    /**
     * Assigns the labels P1, P2, ... in pre-order.
     *
     * @param tree a tree that has not been labeled
     * @return the number of labeled nodes
     */
    int labelNodes(KdTree tree) {
        return tree.traverse(new LabelingVisitor());
    }

    private static class LabelingVisitor implements Visitor<Integer> {

        private int counter = 0;

        @Override
        public void accept(INodeView node, int depthOfNode) {
            ++counter;
            ((KdNode) node).setLabel(LABEL_PREFIX + counter);
        }

        @Override
        public Integer getResult() {
            return counter;
        }
    }
}
