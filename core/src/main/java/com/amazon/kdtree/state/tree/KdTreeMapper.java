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

package com.amazon.kdtree.state.tree;

import static com.amazon.kdtree.CommonUtils.checkNotNull;

import com.amazon.kdtree.state.IStateMapper;
import com.amazon.kdtree.state.Version;
import com.amazon.kdtree.tree.INodeView;
import com.amazon.kdtree.tree.KdTree;

/**
 * Maps a {@link KdTree} to nested node states, as needed to draw the
 * hierarchical diagram of the tree.
 */
public class KdTreeMapper implements IStateMapper<KdTree, KdTreeState> {

    @Override
    public KdTreeState toState(KdTree model) {
        checkNotNull(model, "tree must not be null");
        KdTreeState state = new KdTreeState();
        state.setVersion(Version.LATEST);
        state.setSize(model.size());
        state.setDepth(model.getDepth());
        state.setRoot(toNodeState(model.getRoot()));
        return state;
    }

    KdNodeState toNodeState(INodeView node) {
        if (node == null) {
            return null;
        }
        KdNodeState state = new KdNodeState();
        state.setLabel(node.getLabel());
        state.setX(node.getPoint().getX());
        state.setY(node.getPoint().getY());
        state.setAxis(node.getAxis());
        state.setAddStepIndex(node.getAddStepIndex());
        state.setSplitStepIndex(node.getSplitStepIndex());
        state.setLeft(toNodeState(node.getLeftChild()));
        state.setRight(toNodeState(node.getRightChild()));
        return state;
    }
}
