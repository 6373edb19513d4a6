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

import com.amazon.kdtree.Visitor;

/**
 * A balanced two-dimensional KD-tree produced by {@link TreeBuilder}. The tree
 * is empty when it was built from an empty point set.
 */
public class KdTree {

    private static final KdTree EMPTY = new KdTree(null, 0);

    private final KdNode root;
    private final int size;

    KdTree(KdNode root, int size) {
        checkArgument((root == null) == (size == 0), "incorrect size");
        this.root = root;
        this.size = size;
    }

    public static KdTree empty() {
        return EMPTY;
    }

    /**
     * @return the root node, or null for an empty tree
     */
    public KdNode getRoot() {
        return root;
    }

    public boolean isEmpty() {
        return root == null;
    }

    /**
     * @return the number of nodes, which equals the number of points the tree was
     *         built from
     */
    public int size() {
        return size;
    }

    /**
     * @return the number of levels of the tree; 0 for an empty tree
     */
    public int getDepth() {
        return depth(root);
    }

    private static int depth(KdNode node) {
        if (node == null) {
            return 0;
        }
        return 1 + Math.max(depth(node.getLeftChild()), depth(node.getRightChild()));
    }

    /**
     * Visits every node in pre-order: a node, then its left subtree, then its
     * right subtree. Nodes without children are passed to
     * {@link Visitor#acceptLeaf}.
     *
     * @param visitor the visitor
     * @param <R>     the result type of the visitor
     * @return the result of the visitor after the traversal
     */
    public <R> R traverse(Visitor<R> visitor) {
        checkNotNull(visitor, "visitor must not be null");
        traversePreOrder(root, visitor, 0);
        return visitor.getResult();
    }

    private <R> void traversePreOrder(KdNode node, Visitor<R> visitor, int depthOfNode) {
        if (node == null) {
            return;
        }
        if (node.isLeaf()) {
            visitor.acceptLeaf(node, depthOfNode);
        } else {
            visitor.accept(node, depthOfNode);
        }
        traversePreOrder(node.getLeftChild(), visitor, depthOfNode + 1);
        traversePreOrder(node.getRightChild(), visitor, depthOfNode + 1);
    }

    @Override
    public String toString() {
        return String.format("KdTree(size=%d, depth=%d)", size, getDepth());
    }
}
