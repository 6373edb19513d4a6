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

package com.amazon.kdtree.examples.serialization;

import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.amazon.kdtree.PartitionSession;
import com.amazon.kdtree.examples.Example;
import com.amazon.kdtree.state.trace.TraceMapper;
import com.amazon.kdtree.state.tree.KdTreeMapper;
import com.amazon.kdtree.tree.Point;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Writes a KD-tree and its construction trace as JSON using
 * <a href="https://github.com/FasterXML/jackson">Jackson</a>, for renderers
 * running outside the JVM.
 */
public class JsonExample implements Example {

    @Override
    public String command() {
        return "json";
    }

    @Override
    public String description() {
        return "print a KD-tree and its construction trace as a JSON document";
    }

    @Override
    public void run(List<Point> points, PrintStream out) throws Exception {
        PartitionSession.Snapshot snapshot = PartitionSession.builder().build().submit(points);

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("bounds", new double[][] { snapshot.getBounds().getXRange().toArray(),
                snapshot.getBounds().getYRange().toArray() });
        document.put("tree", new KdTreeMapper().toState(snapshot.getTree()));
        document.put("trace", new TraceMapper().toState(snapshot.getTrace()));

        ObjectMapper jsonMapper = new ObjectMapper();
        out.println(jsonMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document));
    }
}
