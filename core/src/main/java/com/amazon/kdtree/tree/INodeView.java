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

/**
 * A read-only view of a node of a {@link KdTree}. This is what renderers and
 * visitors see; the structure of a built tree never changes.
 */
public interface INodeView {

    /**
     * @return the median point stored at this node
     */
    Point getPoint();

    /**
     * @return {@link Point#X_AXIS} if this node splits space along x, otherwise
     *         {@link Point#Y_AXIS}
     */
    int getAxis();

    /**
     * @return the coordinate of the splitting line of this node
     */
    default double getSplitValue() {
        return getPoint().getCoordinate(getAxis());
    }

    INodeView getLeftChild();

    INodeView getRightChild();

    default boolean isLeaf() {
        return getLeftChild() == null && getRightChild() == null;
    }

    /**
     * @return the display label assigned in pre-order, or an empty string if the
     *         tree has not been labeled
     */
    String getLabel();

    /**
     * @return the index of the step that adds this node's point, or
     *         {@link KdNode#UNSET} before linearization
     */
    int getAddStepIndex();

    /**
     * @return the index of the step that draws this node's splitting line, or
     *         {@link KdNode#UNSET} before linearization
     */
    int getSplitStepIndex();
}
