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

package com.amazon.kdtree.examples.playback;

import static com.amazon.kdtree.CommonUtils.formatCoordinate;

import java.io.PrintStream;
import java.util.List;

import com.amazon.kdtree.PartitionSession;
import com.amazon.kdtree.Visitor;
import com.amazon.kdtree.examples.Example;
import com.amazon.kdtree.trace.Step;
import com.amazon.kdtree.trace.StepKind;
import com.amazon.kdtree.trace.TracePlayer;
import com.amazon.kdtree.tree.INodeView;
import com.amazon.kdtree.tree.Point;

/**
 * Replays the construction of a KD-tree one step at a time, printing the
 * highlighted step and, half way through, the tree with the nodes revealed so
 * far.
 */
public class PlaybackExample implements Example {

    public static void main(String[] args) throws Exception {
        new PlaybackExample().run(Point.listOf(new double[][] { { 3, 2 }, { 5, 8 }, { 6, 1 }, { 4, 4 } }),
                System.out);
    }

    @Override
    public String command() {
        return "playback";
    }

    @Override
    public String description() {
        return "replay the construction steps of a KD-tree";
    }

    @Override
    public void run(List<Point> points, PrintStream out) throws Exception {
        PartitionSession session = PartitionSession.builder().build();
        PartitionSession.Snapshot snapshot = session.submit(points);
        TracePlayer player = snapshot.newPlayer();

        out.printf("points = %d, depth = %d, steps = %d, bounds = %s%n", snapshot.getTree().size(),
                snapshot.getTree().getDepth(), snapshot.getTrace().size(), snapshot.getBounds());

        int halfWay = snapshot.getTrace().size() / 2;
        while (player.getCurrentStep().isPresent()) {
            out.println(describe(player.getCurrentStep().get()));
            player.next();
            if (player.getCursor() == halfWay) {
                out.printf("after %d steps:%n", halfWay);
                snapshot.getTree().traverse(new RevealedTreePrinter(player, out));
            }
        }

        // step back over the last node to show that playback is reversible
        player.previous();
        player.previous();
        out.printf("stepped back to %d, highlighted: %s%n", player.getCursor(),
                player.getCurrentStep().map(PlaybackExample::describe).orElse("none"));
        player.seek(snapshot.getTrace().size());
        out.println("final tree:");
        snapshot.getTree().traverse(new RevealedTreePrinter(player, out));
    }

    static String describe(Step step) {
        INodeView node = step.getNode();
        if (step.getKind() == StepKind.POINT_ADDED) {
            return String.format("%3d  add    %s %s in %s x %s", step.getIndex(), node.getLabel(), node.getPoint(),
                    step.getXRange(), step.getYRange());
        }
        String axisName = (node.getAxis() == Point.X_AXIS) ? "x" : "y";
        return String.format("%3d  split  %s at %s = %s across %s x %s", step.getIndex(), node.getLabel(), axisName,
                formatCoordinate(node.getSplitValue()), step.getXRange(), step.getYRange());
    }

    /**
     * Prints the tree in pre-order, one node per line, indented by depth.
     * Unrevealed nodes are shown as a placeholder.
     */
    static class RevealedTreePrinter implements Visitor<Integer> {

        private final TracePlayer player;
        private final PrintStream out;
        private int revealed = 0;

        RevealedTreePrinter(TracePlayer player, PrintStream out) {
            this.player = player;
            this.out = out;
        }

        @Override
        public void accept(INodeView node, int depthOfNode) {
            StringBuilder line = new StringBuilder();
            for (int i = 0; i < depthOfNode; i++) {
                line.append("    ");
            }
            if (player.isRevealed(node)) {
                ++revealed;
                line.append(node.getLabel()).append(' ').append(node.getPoint());
            } else {
                line.append("?");
            }
            out.println(line);
        }

        @Override
        public Integer getResult() {
            return revealed;
        }
    }
}
