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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

public class PointComparatorTest {

    @Test
    public void testPrimaryAxis() {
        PointComparator byX = new PointComparator(Point.X_AXIS);
        PointComparator byY = new PointComparator(Point.Y_AXIS);
        Point a = new Point(1, 5);
        Point b = new Point(2, 3);

        assertThat(byX.compare(a, b), lessThan(0));
        assertThat(byX.compare(b, a), greaterThan(0));
        assertThat(byY.compare(a, b), greaterThan(0));
        assertThat(byY.compare(b, a), lessThan(0));
    }

    @Test
    public void testTieBreakOnOtherAxis() {
        PointComparator byX = new PointComparator(Point.X_AXIS);
        PointComparator byY = new PointComparator(Point.Y_AXIS);

        assertThat(byX.compare(new Point(2, 1), new Point(2, 7)), lessThan(0));
        assertThat(byY.compare(new Point(9, 2), new Point(3, 2)), greaterThan(0));
        assertThat(byX.compare(new Point(2, 2), new Point(2, 2)), is(0));
    }

    @Test
    public void testSortOrder() {
        List<Point> points = new ArrayList<>(Point.listOf(new double[][] { { 3, 2 }, { 2, 2 }, { 1, 1 } }));
        points.sort(new PointComparator(Point.Y_AXIS));
        assertEquals(Point.listOf(new double[][] { { 1, 1 }, { 2, 2 }, { 3, 2 } }), points);
    }

    @Test
    public void testIncorrectAxis() {
        assertThrows(IllegalArgumentException.class, () -> new PointComparator(2));
        assertThrows(IllegalArgumentException.class, () -> new PointComparator(-1));
    }
}
