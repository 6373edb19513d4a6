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

package com.amazon.kdtree;

import static com.amazon.kdtree.CommonUtils.checkArgument;
import static com.amazon.kdtree.CommonUtils.checkNotNull;
import static com.amazon.kdtree.CommonUtils.checkState;
import static com.amazon.kdtree.CommonUtils.formatCoordinate;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class CommonUtilsTest {

    @Test
    public void testChecks() {
        assertDoesNotThrow(() -> checkArgument(true, "unused"));
        assertThrows(IllegalArgumentException.class, () -> checkArgument(false, "bad argument"));
        assertDoesNotThrow(() -> checkState(true, "unused"));
        assertThrows(IllegalStateException.class, () -> checkState(false, "bad state"));
        assertEquals("value", checkNotNull("value", "unused"));
        assertThrows(NullPointerException.class, () -> checkNotNull(null, "missing"));
    }

    @Test
    public void testFormatCoordinate() {
        assertEquals("3", formatCoordinate(3.0));
        assertEquals("-4", formatCoordinate(-4.0));
        assertEquals("0", formatCoordinate(0.0));
        assertEquals("2.5", formatCoordinate(2.5));
        assertEquals("Infinity", formatCoordinate(Double.POSITIVE_INFINITY));
        assertEquals("NaN", formatCoordinate(Double.NaN));
        assertEquals("1.0E20", formatCoordinate(1e20));
    }
}
