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

package com.amazon.kdtree.trace;

import static com.amazon.kdtree.CommonUtils.checkArgument;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

/**
 * An immutable, randomly indexable sequence of construction steps. The step at
 * position i has index i.
 */
public class Trace {

    private static final Trace EMPTY = new Trace(Collections.emptyList());

    private final List<Step> steps;

    Trace(List<Step> steps) {
        for (int i = 0; i < steps.size(); i++) {
            checkArgument(steps.get(i).getIndex() == i, "step indexes must be consecutive from 0");
        }
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
    }

    public static Trace empty() {
        return EMPTY;
    }

    public Step get(int index) {
        checkArgument(index >= 0 && index < steps.size(), "step index out of bounds");
        return steps.get(index);
    }

    public int size() {
        return steps.size();
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    /**
     * @return an unmodifiable view of all steps
     */
    public List<Step> getSteps() {
        return steps;
    }

    public Stream<Step> stream() {
        return steps.stream();
    }

    @Override
    public String toString() {
        return String.format("Trace(size=%d)", steps.size());
    }
}
