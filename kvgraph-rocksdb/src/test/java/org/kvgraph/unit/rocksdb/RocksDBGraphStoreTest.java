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

package org.kvgraph.unit.rocksdb;

import java.util.List;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.kvgraph.GraphStore;
import org.kvgraph.GraphStoreFactory;
import org.kvgraph.adjacency.Directions;
import org.kvgraph.backend.store.rocksdb.RocksDBBackendStore;
import org.kvgraph.structure.Edge;
import org.kvgraph.structure.MergeStrategy;
import org.kvgraph.structure.Node;
import org.kvgraph.structure.PropertyValue;
import org.kvgraph.testutil.Assert;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

public class RocksDBGraphStoreTest extends BaseRocksDBUnitTest {

    private GraphStore graph;

    @Before
    public void setup() {
        this.graph = this.openGraph(false);
    }

    @After
    public void teardown() {
        this.graph.close();
    }

    @Test
    public void testOpenRocksDBBackend() {
        Assert.assertInstanceOf(RocksDBBackendStore.class,
                                this.graph.backendStore());
        Assert.assertEquals("graph", this.graph.backendStore().name());
    }

    @Test
    public void testNodeAndEdgeRoundTrip() {
        Node node = new Node("marko");
        node.property("name", "marko");
        node.property("age", 29L);
        node.property("score", 0.5D);
        this.graph.putNode(node);

        Edge edge = new Edge("knows", "marko", "vadas");
        edge.property("weight", 1.5D);
        this.graph.putEdge(edge);

        Assert.assertEquals(node, this.graph.getNode("marko"));
        Assert.assertEquals(edge, this.graph.getEdge("knows"));
        Assert.assertNull(this.graph.getNode("vadas"));
        Assert.assertEquals(ImmutableSet.of("knows"),
                            this.graph.adjacentEdges("marko",
                                                     Directions.FORWARD));
        Assert.assertEquals(ImmutableSet.of("knows"),
                            this.graph.adjacentEdges("vadas",
                                                     Directions.BACKWARD));

        this.graph.deleteEdge("knows");
        Assert.assertNull(this.graph.getEdge("knows"));
        Assert.assertEquals(ImmutableSet.of(),
                            this.graph.adjacentEdges("marko",
                                                     Directions.ANY));
        Assert.assertNull(this.graph.adjacencyIndex().adjacency("vadas"));
    }

    @Test
    public void testUpdateCreatesMissing() {
        Node node = this.graph.updateNode("n1", ImmutableMap.of("a", 1L),
                                          MergeStrategy.OVERWRITE);
        Assert.assertEquals(PropertyValue.of(1L), node.property("a"));

        node = this.graph.updateNode("n1", ImmutableMap.of("a", 2L,
                                                           "b", "x"),
                                     MergeStrategy.KEEP_EXISTING);
        Assert.assertEquals(PropertyValue.of(1L), node.property("a"));
        Assert.assertEquals(PropertyValue.of("x"), node.property("b"));
        Assert.assertEquals(node, this.graph.getNode("n1"));
    }

    @Test
    public void testBulkAndBfs() {
        this.graph.putNodes(ImmutableList.of(new Node("A"), new Node("B"),
                                             new Node("C")));
        this.graph.putEdgesBulk(ImmutableList.of(new Edge("ab", "A", "B"),
                                                 new Edge("bc", "B", "C"),
                                                 new Edge("ac", "A", "C")));

        List<Node> nodes = this.graph.getNodes(ImmutableList.of("C", "X",
                                                                "A"));
        Assert.assertEquals(3, nodes.size());
        Assert.assertEquals("C", nodes.get(0).id());
        Assert.assertNull(nodes.get(1));
        Assert.assertEquals("A", nodes.get(2).id());

        Assert.assertEquals(ImmutableSet.of("ab", "bc"),
                            this.graph.adjacentEdges("B", Directions.ANY));
        Assert.assertEquals(ImmutableList.of("A", "B", "C"),
                            this.graph.bfs("A"));
        Assert.assertEquals(3, this.graph.scanEdges().size());
    }

    @Test
    public void testReopenWithInternedIds() {
        this.graph.close();
        this.graph = this.openGraph(true);

        this.graph.putNode(new Node("a").property("k", "v"));
        this.graph.putEdge(new Edge("ab", "a", "b"));
        this.graph.close();

        this.graph = this.openGraph(true);
        Assert.assertEquals(PropertyValue.of("v"),
                            this.graph.getNode("a").property("k"));
        Assert.assertEquals(ImmutableList.of("a", "b"), this.graph.bfs("a"));

        // New ids keep getting fresh keys after reopening
        this.graph.putNode(new Node("c"));
        Assert.assertEquals(ImmutableSet.of("a", "c"),
                            ImmutableSet.copyOf(this.nodeIds()));
    }

    private List<String> nodeIds() {
        ImmutableList.Builder<String> ids = ImmutableList.builder();
        for (Node node : this.graph.scanNodes()) {
            ids.add(node.id());
        }
        return ids.build();
    }

    private GraphStore openGraph(boolean internIds) {
        return GraphStoreFactory.open(this.config("backend.intern_ids",
                                                  internIds));
    }
}
