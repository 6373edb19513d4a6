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

package com.amazon.kdtree.trace;

import static com.amazon.kdtree.CommonUtils.checkNotNull;
import static com.amazon.kdtree.CommonUtils.checkState;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.kdtree.tree.BoundingBox;
import com.amazon.kdtree.tree.InvalidRangeException;
import com.amazon.kdtree.tree.KdNode;
import com.amazon.kdtree.tree.KdTree;
import com.amazon.kdtree.tree.Range;

/**
 * Walks a built {@link KdTree} in construction order and produces its
 * {@link Trace}. Every node contributes a {@link StepKind#POINT_ADDED} step
 * followed by a {@link StepKind#SPLIT_DRAWN} step, then its left subtree, then
 * its right subtree. Children are walked with the rectangle of the parent cut
 * at the parent's split value.
 */
public class TraceLinearizer {

    private static final Logger logger = LoggerFactory.getLogger(TraceLinearizer.class);

    public Trace linearize(KdTree tree, Range xRange, Range yRange) {
        checkNotNull(xRange, "xRange must not be null");
        checkNotNull(yRange, "yRange must not be null");
        return linearize(tree, new BoundingBox(xRange, yRange));
    }

    /**
     * Produces the trace of the tree and records the step indexes on its nodes.
     * A tree can be linearized once.
     *
     * @param tree   a built tree
     * @param bounds the rectangle of the root, with positive width on both axes
     * @return the trace, containing two steps per node
     * @throws InvalidRangeException if the rectangle has zero width on an axis
     * @throws IllegalStateException if the tree was already linearized
     */
    public Trace linearize(KdTree tree, BoundingBox bounds) {
        checkNotNull(tree, "tree must not be null");
        checkNotNull(bounds, "bounds must not be null");
        if (!bounds.isWellFormed()) {
            throw new InvalidRangeException("root rectangle must have positive width and height: " + bounds);
        }
        if (tree.isEmpty()) {
            return Trace.empty();
        }
        checkState(!tree.getRoot().isLinearized(), "tree is already linearized");

        List<Step> steps = new ArrayList<>(2 * tree.size());
        collectSteps(tree.getRoot(), bounds, new StepCounter(), steps);
        logger.debug("linearized tree of size {} into {} steps", tree.size(), steps.size());
        return new Trace(steps);
    }

    private void collectSteps(KdNode node, BoundingBox bounds, StepCounter counter, List<Step> steps) {
        if (node == null) {
            return;
        }
        int addStepIndex = counter.next();
        steps.add(new Step(StepKind.POINT_ADDED, node, bounds, addStepIndex));
        int splitStepIndex = counter.next();
        steps.add(new Step(StepKind.SPLIT_DRAWN, node, bounds, splitStepIndex));
        node.setStepIndexes(addStepIndex, splitStepIndex);

        double splitValue = node.getSplitValue();
        collectSteps(node.getLeftChild(), bounds.splitLeft(node.getAxis(), splitValue), counter, steps);
        collectSteps(node.getRightChild(), bounds.splitRight(node.getAxis(), splitValue), counter, steps);
    }

    private static class StepCounter {
        private int value = 0;

        int next() {
            return value++;
        }
    }
}
