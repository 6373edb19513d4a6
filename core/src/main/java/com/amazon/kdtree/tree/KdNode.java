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
import static com.amazon.kdtree.CommonUtils.checkState;

/**
 * A node of a {@link KdTree}. The point, the axis and the children are fixed at
 * construction; a node exclusively owns its children. The label and the two
 * step indices are write-once annotations added after the build.
 */
public class KdNode implements INodeView {

    public static final int UNSET = -1;

    private final Point point;
    private final int axis;
    private final KdNode left;
    private final KdNode right;

    private String label = "";
    private int addStepIndex = UNSET;
    private int splitStepIndex = UNSET;

    public KdNode(Point point, int axis, KdNode left, KdNode right) {
        checkNotNull(point, "point must not be null");
        Point.checkAxis(axis);
        this.point = point;
        this.axis = axis;
        this.left = left;
        this.right = right;
    }

    @Override
    public Point getPoint() {
        return point;
    }

    @Override
    public int getAxis() {
        return axis;
    }

    @Override
    public KdNode getLeftChild() {
        return left;
    }

    @Override
    public KdNode getRightChild() {
        return right;
    }

    @Override
    public String getLabel() {
        return label;
    }

    @Override
    public int getAddStepIndex() {
        return addStepIndex;
    }

    @Override
    public int getSplitStepIndex() {
        return splitStepIndex;
    }

    public boolean isLabeled() {
        return !label.isEmpty();
    }

    public boolean isLinearized() {
        return addStepIndex != UNSET;
    }

    /**
     * Assigns the display label of this node.
     *
     * @param label a non-empty label
     * @throws IllegalStateException if the node already has a label
     */
    public void setLabel(String label) {
        checkArgument(label != null && !label.isEmpty(), "label must be non-empty");
        checkState(!isLabeled(), "node " + this.label + " is already labeled");
        this.label = label;
    }

    /**
     * Records the positions of this node's two construction steps in a trace.
     *
     * @param addStepIndex   index of the step that adds the point
     * @param splitStepIndex index of the step that draws the split
     * @throws IllegalStateException if the indices were already recorded
     */
    public void setStepIndexes(int addStepIndex, int splitStepIndex) {
        checkArgument(addStepIndex >= 0 && addStepIndex < splitStepIndex, "incorrect step indexes");
        checkState(!isLinearized(), "node " + label + " is already linearized");
        this.addStepIndex = addStepIndex;
        this.splitStepIndex = splitStepIndex;
    }

    @Override
    public String toString() {
        return String.format("KdNode(%s %s, axis=%d)", label, point, axis);
    }
}
