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

import java.util.Comparator;

/**
 * Orders points along a splitting axis. Points with the same coordinate on the
 * splitting axis are ordered by the other coordinate, so that the order is
 * total for all points which differ in at least one coordinate.
 */
public class PointComparator implements Comparator<Point> {

    private final int axis;

    public PointComparator(int axis) {
        Point.checkAxis(axis);
        this.axis = axis;
    }

    public int getAxis() {
        return axis;
    }

    @Override
    public int compare(Point first, Point second) {
        int result = Double.compare(first.getCoordinate(axis), second.getCoordinate(axis));
        if (result != 0) {
            return result;
        }
        int otherAxis = (axis + 1) % Point.DIMENSIONS;
        return Double.compare(first.getCoordinate(otherAxis), second.getCoordinate(otherAxis));
    }
}
