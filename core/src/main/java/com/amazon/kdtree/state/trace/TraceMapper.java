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

package com.amazon.kdtree.state.trace;

import static com.amazon.kdtree.CommonUtils.checkNotNull;

import java.util.stream.Collectors;

import com.amazon.kdtree.state.IStateMapper;
import com.amazon.kdtree.state.Version;
import com.amazon.kdtree.trace.Step;
import com.amazon.kdtree.trace.Trace;

/**
 * Maps a {@link Trace} to a flat list of step states. Each step state carries
 * the label and point of its node so that a renderer does not need the tree to
 * replay the trace.
 */
public class TraceMapper implements IStateMapper<Trace, TraceState> {

    @Override
    public TraceState toState(Trace model) {
        checkNotNull(model, "trace must not be null");
        TraceState state = new TraceState();
        state.setVersion(Version.LATEST);
        state.setSize(model.size());
        state.setSteps(model.stream().map(this::toStepState).collect(Collectors.toList()));
        return state;
    }

    StepState toStepState(Step step) {
        StepState state = new StepState();
        state.setIndex(step.getIndex());
        state.setKind(step.getKind().name());
        state.setLabel(step.getNode().getLabel());
        state.setX(step.getNode().getPoint().getX());
        state.setY(step.getNode().getPoint().getY());
        state.setAxis(step.getNode().getAxis());
        state.setMinX(step.getXRange().getMin());
        state.setMaxX(step.getXRange().getMax());
        state.setMinY(step.getYRange().getMin());
        state.setMaxY(step.getYRange().getMax());
        return state;
    }
}
