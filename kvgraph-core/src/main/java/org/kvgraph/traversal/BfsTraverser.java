/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.kvgraph.traversal;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Queue;
import java.util.Set;

import org.kvgraph.GraphStore;
import org.kvgraph.adjacency.Directions;
import org.kvgraph.structure.Edge;
import org.kvgraph.util.E;

/**
 * Breadth-first traversal over the adjacency index. Adjacency entries
 * whose edge is gone, and edges whose other end is missing, are skipped.
 */
public class BfsTraverser {

    private final GraphStore graph;

    public BfsTraverser(GraphStore graph) {
        E.checkNotNull(graph, "graph");
        this.graph = graph;
    }

    /**
     * Visit every node reachable from {@code start} in the given direction.
     * @return node ids in first discovery order, starting with
     *         {@code start} even if no such node is stored
     */
    public List<String> bfs(String start, Directions direction) {
        E.checkArgument(start != null && !start.isEmpty(),
                        "The start node id can't be null or empty");
        E.checkNotNull(direction, "direction");

        List<String> visitOrder = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Queue<String> queue = new ArrayDeque<>();
        queue.add(start);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!visited.add(current)) {
                continue;
            }
            visitOrder.add(current);

            for (String edgeId : this.graph.adjacentEdges(current, direction)) {
                Edge edge = this.graph.getEdge(edgeId);
                if (edge == null) {
                    continue;
                }
                String neighbor = edge.otherEnd(current);
                if (neighbor != null && !visited.contains(neighbor)) {
                    queue.add(neighbor);
                }
            }
        }
        return visitOrder;
    }
}
