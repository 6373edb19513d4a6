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

import static com.amazon.kdtree.TestUtils.nodesOf;
import static com.amazon.kdtree.TestUtils.pointsBelow;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.amazon.kdtree.Visitor;
import com.amazon.kdtree.state.tree.KdTreeMapper;
import com.amazon.kdtree.testutils.ExamplePointSets;

public class TreeBuilderTest {

    private TreeBuilder builder;

    @BeforeEach
    public void setUp() {
        builder = new TreeBuilder();
    }

    @Test
    public void testTextbookExample() {
        KdTree tree = builder.build(Point.listOf(ExamplePointSets.textbook()));

        assertEquals(8, tree.size());
        assertEquals(4, tree.getDepth());

        KdNode root = tree.getRoot();
        assertEquals(new Point(4, 4), root.getPoint());
        assertEquals(Point.X_AXIS, root.getAxis());

        KdNode left = root.getLeftChild();
        assertEquals(new Point(2, 2), left.getPoint());
        assertEquals(Point.Y_AXIS, left.getAxis());
        assertEquals(new Point(1, 1), left.getLeftChild().getPoint());
        assertEquals(new Point(3, 2), left.getRightChild().getPoint());
        assertTrue(left.getLeftChild().isLeaf());
        assertTrue(left.getRightChild().isLeaf());

        KdNode right = root.getRightChild();
        assertEquals(new Point(6, 1), right.getPoint());
        assertEquals(Point.Y_AXIS, right.getAxis());
        assertEquals(new Point(9, 0), right.getLeftChild().getPoint());
        KdNode rightRight = right.getRightChild();
        assertEquals(new Point(5, 8), rightRight.getPoint());
        assertEquals(Point.X_AXIS, rightRight.getAxis());
        assertNull(rightRight.getLeftChild());
        assertEquals(new Point(8, 7), rightRight.getRightChild().getPoint());
        assertEquals(Point.Y_AXIS, rightRight.getRightChild().getAxis());
    }

    @Test
    public void testLabelsInPreOrder() {
        KdTree tree = builder.build(Point.listOf(ExamplePointSets.textbook()));

        List<String> labels = nodesOf(tree).stream().map(INodeView::getLabel).collect(Collectors.toList());
        List<Point> points = nodesOf(tree).stream().map(INodeView::getPoint).collect(Collectors.toList());

        assertThat(labels, contains("P1", "P2", "P3", "P4", "P5", "P6", "P7", "P8"));
        assertEquals(Point.listOf(new double[][] { { 4, 4 }, { 2, 2 }, { 1, 1 }, { 3, 2 }, { 6, 1 }, { 9, 0 },
                { 5, 8 }, { 8, 7 } }), points);
    }

    @Test
    public void testLabelingTwiceFails() {
        KdTree tree = builder.build(Point.listOf(ExamplePointSets.textbook()));
        assertThrows(IllegalStateException.class, () -> builder.labelNodes(tree));
    }

    @Test
    public void testMedianOfThree() {
        KdTree tree = builder.build(Point.listOf(new double[][] { { 3, 3 }, { 1, 1 }, { 2, 2 } }));
        assertEquals(new Point(2, 2), tree.getRoot().getPoint());
        assertEquals(new Point(1, 1), tree.getRoot().getLeftChild().getPoint());
        assertEquals(new Point(3, 3), tree.getRoot().getRightChild().getPoint());
    }

    @Test
    public void testLowerMedianIndex() {
        assertEquals(0, TreeBuilder.lowerMedianIndex(1));
        assertEquals(0, TreeBuilder.lowerMedianIndex(2));
        assertEquals(1, TreeBuilder.lowerMedianIndex(3));
        assertEquals(1, TreeBuilder.lowerMedianIndex(4));
        assertEquals(3, TreeBuilder.lowerMedianIndex(8));
    }

    @Test
    public void testEvenSizeFavorsLeft() {
        KdTree tree = builder.build(Point.listOf(new double[][] { { 2, 0 }, { 1, 0 } }));
        assertEquals(new Point(1, 0), tree.getRoot().getPoint());
        assertNull(tree.getRoot().getLeftChild());
        assertEquals(new Point(2, 0), tree.getRoot().getRightChild().getPoint());
    }

    @Test
    public void testEmptyInput() {
        KdTree tree = builder.build(Collections.emptyList());
        assertTrue(tree.isEmpty());
        assertEquals(0, tree.size());
    }

    @Test
    public void testSinglePoint() {
        KdTree tree = builder.build(Collections.singletonList(new Point(7, -2)));
        assertEquals(1, tree.size());
        assertTrue(tree.getRoot().isLeaf());
        assertEquals("P1", tree.getRoot().getLabel());
        assertEquals(Point.X_AXIS, tree.getRoot().getAxis());
    }

    @Test
    public void testNullInput() {
        assertThrows(NullPointerException.class, () -> builder.build(null));
        assertThrows(NullPointerException.class, () -> builder.build(Arrays.asList(new Point(0, 0), null)));
    }

    @Test
    public void testNonFiniteCoordinatesAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> builder.build(Arrays.asList(new Point(0, 0), new Point(Double.NaN, 1))));
        assertThrows(IllegalArgumentException.class,
                () -> builder.build(Arrays.asList(new Point(1, Double.POSITIVE_INFINITY), new Point(0, 0))));
        assertThrows(IllegalArgumentException.class,
                () -> builder.build(Collections.singletonList(new Point(Double.NEGATIVE_INFINITY, 0))));
    }

    @Test
    public void testInputIsNotModified() {
        List<Point> points = Point.listOf(ExamplePointSets.textbook());
        List<Point> copy = new ArrayList<>(points);
        builder.build(points);
        assertEquals(copy, points);
    }

    @ParameterizedTest
    @ValueSource(ints = { 1, 2, 3, 7, 8, 100, 257 })
    public void testSizeAndAxisCycling(int size) {
        KdTree tree = builder.build(Point.listOf(ExamplePointSets.uniform(size, 10.0, size)));
        assertEquals(size, tree.size());

        int visited = tree.traverse(new Visitor<Integer>() {
            private int count = 0;

            @Override
            public void accept(INodeView node, int depthOfNode) {
                ++count;
                assertEquals(depthOfNode % 2, node.getAxis());
                if (node.getLeftChild() != null) {
                    assertEquals(1 - node.getAxis(), node.getLeftChild().getAxis());
                }
                if (node.getRightChild() != null) {
                    assertEquals(1 - node.getAxis(), node.getRightChild().getAxis());
                }
            }

            @Override
            public Integer getResult() {
                return count;
            }
        });
        assertEquals(size, visited);
    }

    @ParameterizedTest
    @ValueSource(ints = { 2, 5, 64, 301 })
    public void testMedianRule(int size) {
        KdTree tree = builder.build(Point.listOf(ExamplePointSets.uniform(size, 100.0, 42 + size)));

        for (INodeView node : nodesOf(tree)) {
            PointComparator comparator = new PointComparator(node.getAxis());
            List<Point> subtree = pointsBelow(node);
            long smaller = subtree.stream().filter(p -> comparator.compare(p, node.getPoint()) < 0).count();
            assertEquals((subtree.size() - 1) / 2, smaller);

            for (Point point : pointsBelow(node.getLeftChild())) {
                assertTrue(comparator.compare(point, node.getPoint()) < 0);
            }
            for (Point point : pointsBelow(node.getRightChild())) {
                assertTrue(comparator.compare(point, node.getPoint()) > 0);
            }
        }
    }

    @Test
    public void testDeterminism() {
        List<Point> points = Point.listOf(ExamplePointSets.uniform(500, 1.0, 7));
        KdTreeMapper mapper = new KdTreeMapper();

        assertEquals(mapper.toState(builder.build(points)), mapper.toState(builder.build(points)));
        assertEquals(mapper.toState(builder.build(points)), mapper.toState(new TreeBuilder().build(points)));
    }

    @Test
    public void testDeterminismWithDuplicatesAndPermutedInput() {
        List<Point> points = Point.listOf(ExamplePointSets.withDuplicates(400, 5, 3));
        List<Point> shuffled = new ArrayList<>(points);
        Collections.shuffle(shuffled, new Random(11));
        KdTreeMapper mapper = new KdTreeMapper();

        KdTree tree = builder.build(points);
        assertEquals(400, tree.size());
        assertEquals(mapper.toState(tree), mapper.toState(builder.build(shuffled)));
    }

    @Test
    public void testIdenticalPointsKeepInputOrder() {
        Point first = new Point(1, 1);
        Point second = new Point(1, 1);
        Point third = new Point(1, 1);

        KdTree tree = builder.build(Arrays.asList(first, second, third));

        // all three are equal, so the sorted order is the input order and the median is
        // the second one
        assertSame(second, tree.getRoot().getPoint());
        assertSame(first, tree.getRoot().getLeftChild().getPoint());
        assertSame(third, tree.getRoot().getRightChild().getPoint());
    }

    @Test
    public void testCollinearPoints() {
        KdTree tree = builder.build(Point.listOf(ExamplePointSets.vertical(7, 2.0)));
        // on the x axis every point ties, so the y coordinate decides
        assertThat(tree.getRoot().getPoint(), is(new Point(2, 3)));
        assertEquals(3, tree.getDepth());
    }
}
