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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class KdNodeTest {

    private KdNode leaf;
    private KdNode parent;

    @BeforeEach
    public void setUp() {
        leaf = new KdNode(new Point(1, 1), Point.Y_AXIS, null, null);
        parent = new KdNode(new Point(4, 4), Point.X_AXIS, leaf, null);
    }

    @Test
    public void testStructure() {
        assertTrue(leaf.isLeaf());
        assertFalse(parent.isLeaf());
        assertEquals(leaf, parent.getLeftChild());
        assertNull(parent.getRightChild());
        assertEquals(4.0, parent.getSplitValue());
        assertEquals(1.0, leaf.getSplitValue());
    }

    @Test
    public void testInitialAnnotations() {
        assertEquals("", parent.getLabel());
        assertFalse(parent.isLabeled());
        assertEquals(KdNode.UNSET, parent.getAddStepIndex());
        assertEquals(KdNode.UNSET, parent.getSplitStepIndex());
        assertFalse(parent.isLinearized());
    }

    @Test
    public void testLabelIsWriteOnce() {
        parent.setLabel("P1");
        assertEquals("P1", parent.getLabel());
        assertThrows(IllegalStateException.class, () -> parent.setLabel("P2"));
        assertThrows(IllegalArgumentException.class, () -> leaf.setLabel(""));
        assertThrows(IllegalArgumentException.class, () -> leaf.setLabel(null));
    }

    @Test
    public void testStepIndexesAreWriteOnce() {
        parent.setStepIndexes(0, 1);
        assertEquals(0, parent.getAddStepIndex());
        assertEquals(1, parent.getSplitStepIndex());
        assertTrue(parent.isLinearized());
        assertThrows(IllegalStateException.class, () -> parent.setStepIndexes(2, 3));
    }

    @Test
    public void testIncorrectStepIndexes() {
        assertThrows(IllegalArgumentException.class, () -> leaf.setStepIndexes(3, 2));
        assertThrows(IllegalArgumentException.class, () -> leaf.setStepIndexes(1, 1));
        assertThrows(IllegalArgumentException.class, () -> leaf.setStepIndexes(-1, 0));
    }

    @Test
    public void testIncorrectConstruction() {
        assertThrows(NullPointerException.class, () -> new KdNode(null, 0, null, null));
        assertThrows(IllegalArgumentException.class, () -> new KdNode(new Point(0, 0), 2, null, null));
    }
}
