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

import static com.amazon.kdtree.CommonUtils.formatCoordinate;

/**
 * An immutable closed interval {@code [min, max]} of one axis. A range may have
 * zero width, which happens below splits on duplicate coordinates.
 */
public class Range {

    private final double min;
    private final double max;

    /**
     * @param min the lower bound
     * @param max the upper bound
     * @throws InvalidRangeException if min is greater than max, or either bound is
     *                               NaN
     */
    public Range(double min, double max) {
        if (!(min <= max)) {
            throw new InvalidRangeException(String.format("incorrect range [%s, %s]", min, max));
        }
        this.min = min;
        this.max = max;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public double getWidth() {
        return max - min;
    }

    /**
     * @return true if the range has a positive width
     */
    public boolean isProper() {
        return min < max;
    }

    public boolean contains(double value) {
        return min <= value && value <= max;
    }

    /**
     * @param value a value
     * @return the closest value inside this range
     */
    public double clamp(double value) {
        return Math.min(Math.max(value, min), max);
    }

    /**
     * @param value split value
     * @return {@code [min, value]}, with the value clamped into this range
     */
    public Range lowerPart(double value) {
        return new Range(min, clamp(value));
    }

    /**
     * @param value split value
     * @return {@code [value, max]}, with the value clamped into this range
     */
    public Range upperPart(double value) {
        return new Range(clamp(value), max);
    }

    public double[] toArray() {
        return new double[] { min, max };
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof Range)) {
            return false;
        }
        Range otherRange = (Range) other;
        return Double.compare(min, otherRange.min) == 0 && Double.compare(max, otherRange.max) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(min) + Double.hashCode(max);
    }

    @Override
    public String toString() {
        return "[" + formatCoordinate(min) + ", " + formatCoordinate(max) + "]";
    }
}
