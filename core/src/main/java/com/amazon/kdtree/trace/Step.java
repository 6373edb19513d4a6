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

import lombok.Getter;

import com.amazon.kdtree.tree.BoundingBox;
import com.amazon.kdtree.tree.INodeView;
import com.amazon.kdtree.tree.Range;

/**
 * One entry of a {@link Trace}. The node is a reference into the tree the trace
 * was produced from; the tree has to be retained for as long as the trace is in
 * use. The ranges are the rectangle the node's subtree is responsible for.
 */
@Getter
public class Step {

    private final StepKind kind;
    private final INodeView node;
    private final Range xRange;
    private final Range yRange;
    private final int index;

    public Step(StepKind kind, INodeView node, BoundingBox bounds, int index) {
        this.kind = kind;
        this.node = node;
        this.xRange = bounds.getXRange();
        this.yRange = bounds.getYRange();
        this.index = index;
    }

    public BoundingBox getBounds() {
        return new BoundingBox(xRange, yRange);
    }

    @Override
    public String toString() {
        return String.format("Step(%d, %s, %s %s, %s x %s)", index, kind, node.getLabel(), node.getPoint(), xRange,
                yRange);
    }
}
