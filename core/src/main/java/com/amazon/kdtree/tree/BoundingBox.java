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

import java.util.List;

/**
 * An immutable axis-aligned rectangle {@code [xmin, xmax] x [ymin, ymax]}. Each
 * node of a linearized tree is responsible for the rectangle obtained by
 * narrowing the root rectangle with the splits of its ancestors.
 */
public class BoundingBox {

    /**
     * Padding used when all points share a coordinate and the fraction is zero.
     */
    static final double DEGENERATE_PADDING = 0.5;

    private final Range xRange;
    private final Range yRange;

    public BoundingBox(Range xRange, Range yRange) {
        this.xRange = checkNotNull(xRange, "xRange must not be null");
        this.yRange = checkNotNull(yRange, "yRange must not be null");
    }

    public BoundingBox(double minX, double maxX, double minY, double maxY) {
        this(new Range(minX, maxX), new Range(minY, maxY));
    }

    /**
     * Computes the bounding box of the points and widens every side by
     * {@code fraction} times the extent along that axis. An axis with zero extent
     * is widened by {@code fraction} absolute units instead, or by
     * {@link #DEGENERATE_PADDING} when the fraction is zero, so that the result is
     * always well formed. A degenerate axis is widened by at least one ulp on
     * each side, even when the absolute padding is lost to rounding.
     *
     * @param points   a non-empty collection of points
     * @param fraction the padding fraction, at least 0
     * @return a well formed rectangle containing every point
     */
    public static BoundingBox padded(List<Point> points, double fraction) {
        checkNotNull(points, "points must not be null");
        checkArgument(!points.isEmpty(), "cannot compute the bounds of an empty point set");
        checkArgument(fraction >= 0 && Double.isFinite(fraction), "padding fraction must be a non-negative number");

        double minX = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        for (Point point : points) {
            checkArgument(point.isFinite(), "point coordinates must be finite");
            minX = Math.min(minX, point.getX());
            maxX = Math.max(maxX, point.getX());
            minY = Math.min(minY, point.getY());
            maxY = Math.max(maxY, point.getY());
        }
        return new BoundingBox(pad(minX, maxX, fraction), pad(minY, maxY, fraction));
    }

    private static Range pad(double min, double max, double fraction) {
        double extent = max - min;
        double padding;
        if (extent > 0) {
            padding = fraction * extent;
        } else {
            padding = (fraction > 0) ? fraction : DEGENERATE_PADDING;
        }
        if (extent > 0) {
            return new Range(min - padding, max + padding);
        }
        // padding below half an ulp of the coordinate rounds away
        return new Range(Math.min(min - padding, Math.nextDown(min)), Math.max(max + padding, Math.nextUp(max)));
    }

    public Range getXRange() {
        return xRange;
    }

    public Range getYRange() {
        return yRange;
    }

    public Range getRange(int axis) {
        Point.checkAxis(axis);
        return (axis == Point.X_AXIS) ? xRange : yRange;
    }

    /**
     * @return true if both ranges have positive width
     */
    public boolean isWellFormed() {
        return xRange.isProper() && yRange.isProper();
    }

    public boolean contains(Point point) {
        return xRange.contains(point.getX()) && yRange.contains(point.getY());
    }

    /**
     * @param axis  the axis of the split
     * @param value the split value
     * @return the part of this rectangle at or below the value on the axis
     */
    public BoundingBox splitLeft(int axis, double value) {
        Point.checkAxis(axis);
        if (axis == Point.X_AXIS) {
            return new BoundingBox(xRange.lowerPart(value), yRange);
        }
        return new BoundingBox(xRange, yRange.lowerPart(value));
    }

    /**
     * @param axis  the axis of the split
     * @param value the split value
     * @return the part of this rectangle at or above the value on the axis
     */
    public BoundingBox splitRight(int axis, double value) {
        Point.checkAxis(axis);
        if (axis == Point.X_AXIS) {
            return new BoundingBox(xRange.upperPart(value), yRange);
        }
        return new BoundingBox(xRange, yRange.upperPart(value));
    }

    @Override
    public String toString() {
        return String.format("BoundingBox(%s, %s)", xRange, yRange);
    }

    /**
     * Two bounding boxes are equal if both of their ranges are equal. Bounds are
     * compared exactly.
     *
     * @param other An object to test for equality
     * @return true if other is a bounding box with the same ranges
     */
    @Override
    public boolean equals(Object other) {
        if (!(other instanceof BoundingBox)) {
            return false;
        }
        BoundingBox otherBox = (BoundingBox) other;
        return xRange.equals(otherBox.xRange) && yRange.equals(otherBox.yRange);
    }

    @Override
    public int hashCode() {
        return 31 * xRange.hashCode() + yRange.hashCode();
    }
}
