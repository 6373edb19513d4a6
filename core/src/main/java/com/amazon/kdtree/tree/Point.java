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
import static com.amazon.kdtree.CommonUtils.formatCoordinate;

import java.util.ArrayList;
import java.util.List;

/**
 * An immutable point in the plane. Points are opaque payloads for the tree; two
 * points with the same coordinates are equal but may both be stored in a tree.
 */
public class Point {

    /**
     * The index of the x coordinate, and the axis of a vertical split.
     */
    public static final int X_AXIS = 0;

    /**
     * The index of the y coordinate, and the axis of a horizontal split.
     */
    public static final int Y_AXIS = 1;

    public static final int DIMENSIONS = 2;

    private final double x;
    private final double y;

    public Point(double x, double y) {
        this.x = x;
        this.y = y;
    }

    /**
     * Converts rows of {@code (x, y)} pairs into points.
     *
     * @param coordinates an array of two-element arrays
     * @return the points, in the order of the rows
     */
    public static List<Point> listOf(double[][] coordinates) {
        checkNotNull(coordinates, "coordinates must not be null");
        List<Point> points = new ArrayList<>(coordinates.length);
        for (double[] row : coordinates) {
            checkArgument(row != null && row.length == DIMENSIONS, "each row must contain exactly two coordinates");
            points.add(new Point(row[0], row[1]));
        }
        return points;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    /**
     * @return true if neither coordinate is NaN or infinite
     */
    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y);
    }

    /**
     * @param axis {@link #X_AXIS} or {@link #Y_AXIS}
     * @return the coordinate of this point along the given axis
     */
    public double getCoordinate(int axis) {
        checkAxis(axis);
        return (axis == X_AXIS) ? x : y;
    }

    public double[] toArray() {
        return new double[] { x, y };
    }

    static void checkAxis(int axis) {
        checkArgument(axis == X_AXIS || axis == Y_AXIS, "axis must be 0 or 1");
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof Point)) {
            return false;
        }
        Point otherPoint = (Point) other;
        return Double.compare(x, otherPoint.x) == 0 && Double.compare(y, otherPoint.y) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(x) + Double.hashCode(y);
    }

    @Override
    public String toString() {
        return "(" + formatCoordinate(x) + ", " + formatCoordinate(y) + ")";
    }
}
