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

package org.kvgraph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

import org.kvgraph.adjacency.AdjacencyIndex;
import org.kvgraph.adjacency.Directions;
import org.kvgraph.backend.store.BackendColumn;
import org.kvgraph.backend.store.BackendColumnIterator;
import org.kvgraph.backend.store.BackendStore;
import org.kvgraph.backend.store.KeyMapper;
import org.kvgraph.backend.store.Partition;
import org.kvgraph.backend.store.RawKeyMapper;
import org.kvgraph.codec.Codec;
import org.kvgraph.codec.EntityCodec;
import org.kvgraph.id.IdGenerator;
import org.kvgraph.id.UuidIdGenerator;
import org.kvgraph.structure.Edge;
import org.kvgraph.structure.GraphElement;
import org.kvgraph.structure.MergeStrategy;
import org.kvgraph.structure.Node;
import org.kvgraph.structure.PropertyValue;
import org.kvgraph.traversal.BfsTraverser;
import org.kvgraph.util.E;
import org.kvgraph.util.Log;
import org.slf4j.Logger;

/**
 * Graph of nodes and edges stored in a {@link BackendStore}. Nodes and
 * edges are encoded by an {@link EntityCodec} and stored under their ids,
 * each edge write also updates the {@link AdjacencyIndex} of its
 * endpoints.
 *
 * Deleting a node doesn't delete its edges, they are left dangling and
 * are skipped by traversals. Operations aren't synchronized and none of
 * the read-modify-write ones is atomic, see {@link #updateNode} and
 * {@link #deleteEdge}.
 *
 * The backend store is owned by the graph store: it's opened before
 * construction and released by {@link #close()}, which callers must
 * invoke on every exit path.
 */
public class GraphStore implements AutoCloseable {

    private static final Logger LOG = Log.logger(GraphStore.class);

    private final BackendStore store;
    private final EntityCodec codec;
    private final KeyMapper keyMapper;
    private final IdGenerator idGenerator;
    private final AdjacencyIndex adjacency;
    private final AtomicBoolean closed;

    public GraphStore(BackendStore store, Codec codec) {
        this(store, new EntityCodec(codec), RawKeyMapper.INSTANCE,
             UuidIdGenerator.INSTANCE);
    }

    public GraphStore(BackendStore store, EntityCodec codec,
                      KeyMapper keyMapper, IdGenerator idGenerator) {
        E.checkNotNull(store, "store");
        E.checkNotNull(codec, "codec");
        E.checkNotNull(keyMapper, "keyMapper");
        E.checkNotNull(idGenerator, "idGenerator");
        this.store = store;
        this.codec = codec;
        this.keyMapper = keyMapper;
        this.idGenerator = idGenerator;
        this.adjacency = new AdjacencyIndex(store, codec, keyMapper);
        this.closed = new AtomicBoolean(false);
    }

    public BackendStore backendStore() {
        return this.store;
    }

    public AdjacencyIndex adjacencyIndex() {
        return this.adjacency;
    }

    public Node newNode() {
        return new Node(this.idGenerator.generate());
    }

    public Edge newEdge(String source, String target) {
        E.checkNotNull(source, "source");
        E.checkNotNull(target, "target");
        return new Edge(this.idGenerator.generate(), source, target);
    }

    public void putNode(Node node) {
        this.checkOpened();
        E.checkNotNull(node, "node");
        this.store.put(Partition.NODES, this.keyMapper.encodeKey(node.id()),
                       this.codec.encodeNode(node));
    }

    /**
     * Get a node by id, null if absent.
     */
    public Node getNode(String id) {
        this.checkOpened();
        byte[] value = this.get(Partition.NODES, id);
        return value == null ? null : this.codec.decodeNode(value);
    }

    /**
     * Delete a node, its edges and their adjacency are kept.
     */
    public void deleteNode(String id) {
        this.checkOpened();
        this.delete(Partition.NODES, id);
    }

    public void putEdge(Edge edge) {
        this.putEdge(edge, true);
    }

    /**
     * Store an edge, and record it in the adjacency of its endpoints when
     * {@code updateAdjacency} is true.
     */
    public void putEdge(Edge edge, boolean updateAdjacency) {
        this.checkOpened();
        E.checkNotNull(edge, "edge");
        this.store.put(Partition.EDGES, this.keyMapper.encodeKey(edge.id()),
                       this.codec.encodeEdge(edge));
        if (updateAdjacency) {
            this.adjacency.recordEdge(edge);
        }
    }

    /**
     * Get an edge by id, null if absent.
     */
    public Edge getEdge(String id) {
        this.checkOpened();
        byte[] value = this.get(Partition.EDGES, id);
        return value == null ? null : this.codec.decodeEdge(value);
    }

    /**
     * Delete an edge and remove it from the adjacency of its endpoints,
     * deleting an absent edge is a no-op. The adjacency is updated before
     * the edge record is deleted, in separate backend calls: a failure in
     * between leaves the edge stored but unreachable from its endpoints.
     */
    public void deleteEdge(String id) {
        this.checkOpened();
        Edge edge = this.getEdge(id);
        if (edge == null) {
            return;
        }
        this.adjacency.removeEdge(edge);
        this.delete(Partition.EDGES, id);
    }

    /**
     * Merge new data into the properties of a node and store it. A missing
     * node is created with the given id and {@code merge({}, newData)} as
     * properties.
     *
     * The read and the write are separate backend calls, two concurrent
     * updates of the same node may lose one of them.
     */
    public Node updateNode(String id, Map<String, ?> newData,
                           MergeStrategy merge) {
        this.checkOpened();
        Node node = this.getNode(id);
        if (node == null) {
            node = new Node(id);
        }
        this.merge(node, newData, merge);
        this.putNode(node);
        return node;
    }

    /**
     * Like {@link #updateNode}, a missing edge is created without source
     * and target. The merged edge is stored through {@link #putEdge(Edge)}.
     */
    public Edge updateEdge(String id, Map<String, ?> newData,
                           MergeStrategy merge) {
        this.checkOpened();
        Edge edge = this.getEdge(id);
        if (edge == null) {
            edge = new Edge(id, null, null);
        }
        this.merge(edge, newData, merge);
        this.putEdge(edge);
        return edge;
    }

    /**
     * Store nodes in one batch.
     */
    public void putNodes(Collection<Node> nodes) {
        this.checkOpened();
        E.checkNotNull(nodes, "nodes");
        this.multiPut(Partition.NODES, nodes, this.codec::encodeNode);
    }

    /**
     * Get nodes in one batch.
     * @return nodes aligned with {@code ids}, null for absent ones
     */
    public List<Node> getNodes(List<String> ids) {
        this.checkOpened();
        return this.multiGet(Partition.NODES, ids, this.codec::decodeNode);
    }

    /**
     * Get edges in one batch.
     * @return edges aligned with {@code ids}, null for absent ones
     */
    public List<Edge> getEdges(List<String> ids) {
        this.checkOpened();
        return this.multiGet(Partition.EDGES, ids, this.codec::decodeEdge);
    }

    /**
     * Store edges in one batch, then record all of them in the adjacency
     * with a single bulk update.
     */
    public void putEdgesBulk(Collection<Edge> edges) {
        this.checkOpened();
        E.checkNotNull(edges, "edges");
        if (edges.isEmpty()) {
            return;
        }
        this.multiPut(Partition.EDGES, edges, this.codec::encodeEdge);
        this.adjacency.bulkRecordEdges(edges);
        LOG.debug("Put {} edges in bulk", edges.size());
    }

    public Set<String> adjacentEdges(String nodeId, Directions direction) {
        this.checkOpened();
        return this.adjacency.query(nodeId, direction);
    }

    public List<String> bfs(String start) {
        return this.bfs(start, Directions.ANY);
    }

    /**
     * Visit the nodes reachable from {@code start} breadth first.
     * @return node ids in first discovery order
     */
    public List<String> bfs(String start, Directions direction) {
        this.checkOpened();
        return new BfsTraverser(this).bfs(start, direction);
    }

    /**
     * Read all nodes, in backend key order.
     */
    public List<Node> scanNodes() {
        this.checkOpened();
        return this.scan(Partition.NODES, this.codec::decodeNode);
    }

    /**
     * Read all edges, in backend key order.
     */
    public List<Edge> scanEdges() {
        this.checkOpened();
        return this.scan(Partition.EDGES, this.codec::decodeEdge);
    }

    public boolean closed() {
        return this.closed.get();
    }

    /**
     * Close the backend store, only the first call has effect.
     */
    @Override
    public void close() {
        if (!this.closed.compareAndSet(false, true)) {
            return;
        }
        this.store.close();
        LOG.info("Closed graph store on backend '{}'", this.store.name());
    }

    private void merge(GraphElement element, Map<String, ?> newData,
                       MergeStrategy merge) {
        E.checkNotNull(newData, "new data");
        E.checkNotNull(merge, "merge strategy");
        Map<String, PropertyValue> data = new LinkedHashMap<>();
        for (Map.Entry<String, ?> e : newData.entrySet()) {
            E.checkNotNull(e.getKey(), "property key");
            data.put(e.getKey(), PropertyValue.of(e.getValue()));
        }
        Map<String, PropertyValue> merged = merge.merge(element.properties(),
                                                        data);
        E.checkState(merged != null, "The merge strategy returned null for " +
                     "'%s'", element.id());
        element.properties(merged);
    }

    private byte[] get(Partition partition, String id) {
        E.checkNotNull(id, "id");
        byte[] key = this.keyMapper.lookupKey(id);
        return key == null ? null : this.store.get(partition, key);
    }

    private void delete(Partition partition, String id) {
        E.checkNotNull(id, "id");
        byte[] key = this.keyMapper.lookupKey(id);
        if (key != null) {
            this.store.delete(partition, key);
        }
    }

    private <T extends GraphElement> void multiPut(Partition partition,
                                                   Collection<T> elements,
                                                   Function<T, byte[]> encoder) {
        if (elements.isEmpty()) {
            return;
        }
        List<String> ids = new ArrayList<>(elements.size());
        for (T element : elements) {
            E.checkNotNull(element, "element");
            ids.add(element.id());
        }
        List<byte[]> keys = this.keyMapper.encodeKeys(ids);
        List<BackendColumn> columns = new ArrayList<>(elements.size());
        int i = 0;
        for (T element : elements) {
            columns.add(BackendColumn.of(keys.get(i++),
                                         encoder.apply(element)));
        }
        this.store.multiPut(partition, columns);
    }

    private <T> List<T> multiGet(Partition partition, List<String> ids,
                                 Function<byte[], T> decoder) {
        E.checkNotNull(ids, "ids");
        List<T> results = new ArrayList<>(ids.size());
        if (ids.isEmpty()) {
            return results;
        }
        List<byte[]> keys = this.keyMapper.lookupKeys(ids);

        // Ids never assigned a key are absent, don't ask the backend
        List<byte[]> existingKeys = new ArrayList<>(keys.size());
        for (byte[] key : keys) {
            if (key != null) {
                existingKeys.add(key);
            }
        }
        List<byte[]> values = existingKeys.isEmpty() ? existingKeys :
                              this.store.multiGet(partition, existingKeys);

        int i = 0;
        for (byte[] key : keys) {
            byte[] value = key == null ? null : values.get(i++);
            results.add(value == null ? null : decoder.apply(value));
        }
        return results;
    }

    private <T> List<T> scan(Partition partition,
                             Function<byte[], T> decoder) {
        List<T> results = new ArrayList<>();
        try (BackendColumnIterator iter = this.store.scan(partition,
                                                          null, null)) {
            while (iter.hasNext()) {
                results.add(decoder.apply(iter.next().value));
            }
        }
        return results;
    }

    private void checkOpened() {
        E.checkState(!this.closed.get(), "Graph store has been closed");
    }
}
