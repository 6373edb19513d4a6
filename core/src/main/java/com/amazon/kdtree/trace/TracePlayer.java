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
import static com.amazon.kdtree.CommonUtils.checkNotNull;

import java.util.List;
import java.util.Optional;

import com.amazon.kdtree.tree.INodeView;

/**
 * A playback cursor over a {@link Trace}. The cursor ranges over
 * {@code [0, trace.size()]}; steps before the cursor are revealed and the step
 * at the cursor, if any, is the highlighted one. A player is not thread-safe;
 * every reader of a trace uses its own.
 */
public class TracePlayer {

    private final Trace trace;
    private int cursor;

    public TracePlayer(Trace trace) {
        this.trace = checkNotNull(trace, "trace must not be null");
        this.cursor = 0;
    }

    public Trace getTrace() {
        return trace;
    }

    public int getCursor() {
        return cursor;
    }

    public boolean hasNext() {
        return cursor < trace.size();
    }

    public boolean hasPrevious() {
        return cursor > 0;
    }

    /**
     * Reveals the highlighted step.
     *
     * @return true if the cursor moved
     */
    public boolean next() {
        if (!hasNext()) {
            return false;
        }
        ++cursor;
        return true;
    }

    /**
     * Hides the last revealed step.
     *
     * @return true if the cursor moved
     */
    public boolean previous() {
        if (!hasPrevious()) {
            return false;
        }
        --cursor;
        return true;
    }

    public void seek(int position) {
        checkArgument(position >= 0 && position <= trace.size(), "cursor must be in [0, " + trace.size() + "]");
        cursor = position;
    }

    public void reset() {
        cursor = 0;
    }

    public List<Step> getRevealedSteps() {
        return trace.getSteps().subList(0, cursor);
    }

    public Optional<Step> getCurrentStep() {
        return hasNext() ? Optional.of(trace.get(cursor)) : Optional.empty();
    }

    /**
     * @param node a node of the tree the trace was produced from
     * @return true if the point of the node has been revealed
     */
    public boolean isRevealed(INodeView node) {
        checkNotNull(node, "node must not be null");
        int addStepIndex = node.getAddStepIndex();
        return addStepIndex >= 0 && addStepIndex < cursor;
    }
}
