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

package org.kvgraph.adjacency;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.kvgraph.backend.store.BackendColumn;
import org.kvgraph.backend.store.BackendStore;
import org.kvgraph.backend.store.KeyMapper;
import org.kvgraph.backend.store.Partition;
import org.kvgraph.codec.EntityCodec;
import org.kvgraph.structure.Edge;
import org.kvgraph.util.E;
import org.kvgraph.util.Log;
import org.slf4j.Logger;

/**
 * Per node sets of outgoing and incoming edge ids, stored in the
 * {@link Partition#ADJACENCY} partition. For every recorded edge the id is
 * in the outgoing set of its source and in the incoming set of its target,
 * a self-loop is in both sets of its single node. A node without edges has
 * no record at all.
 *
 * No method is atomic as a whole: each one reads records and writes them
 * back in separate backend calls, so concurrent writers of the same node
 * can lose each other's updates.
 */
public class AdjacencyIndex {

    private static final Logger LOG = Log.logger(AdjacencyIndex.class);

    private final BackendStore store;
    private final EntityCodec codec;
    private final KeyMapper keyMapper;

    public AdjacencyIndex(BackendStore store, EntityCodec codec,
                          KeyMapper keyMapper) {
        E.checkNotNull(store, "store");
        E.checkNotNull(codec, "codec");
        E.checkNotNull(keyMapper, "keyMapper");
        this.store = store;
        this.codec = codec;
        this.keyMapper = keyMapper;
    }

    /**
     * Add an edge to the records of its endpoints, one read and one write
     * per endpoint. A missing endpoint is skipped.
     */
    public void recordEdge(Edge edge) {
        E.checkNotNull(edge, "edge");
        String edgeId = edge.id();
        if (edge.selfLoop()) {
            byte[] key = this.keyMapper.encodeKey(edge.source());
            AdjacencyRecord record = this.readOrCreate(key);
            record.addOutgoing(edgeId);
            record.addIncoming(edgeId);
            this.write(key, record);
            return;
        }

        if (edge.source() != null) {
            byte[] key = this.keyMapper.encodeKey(edge.source());
            AdjacencyRecord record = this.readOrCreate(key);
            record.addOutgoing(edgeId);
            this.write(key, record);
        }
        if (edge.target() != null) {
            byte[] key = this.keyMapper.encodeKey(edge.target());
            AdjacencyRecord record = this.readOrCreate(key);
            record.addIncoming(edgeId);
            this.write(key, record);
        }
    }

    /**
     * Remove an edge from the records of its endpoints. An endpoint whose
     * record is absent or doesn't hold the edge is skipped, a record left
     * empty is deleted.
     */
    public void removeEdge(Edge edge) {
        E.checkNotNull(edge, "edge");
        String edgeId = edge.id();
        if (edge.selfLoop()) {
            byte[] key = this.keyMapper.lookupKey(edge.source());
            AdjacencyRecord record = this.read(key);
            if (record != null) {
                boolean changed = record.removeOutgoing(edgeId);
                changed |= record.removeIncoming(edgeId);
                if (changed) {
                    this.writeOrDelete(key, record);
                }
            }
            return;
        }

        if (edge.source() != null) {
            byte[] key = this.keyMapper.lookupKey(edge.source());
            AdjacencyRecord record = this.read(key);
            if (record != null && record.removeOutgoing(edgeId)) {
                this.writeOrDelete(key, record);
            }
        }
        if (edge.target() != null) {
            byte[] key = this.keyMapper.lookupKey(edge.target());
            AdjacencyRecord record = this.read(key);
            if (record != null && record.removeIncoming(edgeId)) {
                this.writeOrDelete(key, record);
            }
        }
    }

    /**
     * Get the edge ids of a node in the given direction, ANY gives the
     * union of both sides without duplicates. A node without record has
     * no edges.
     */
    public Set<String> query(String nodeId, Directions direction) {
        E.checkNotNull(nodeId, "node id");
        E.checkNotNull(direction, "direction");
        AdjacencyRecord record = this.adjacency(nodeId);
        if (record == null) {
            return new LinkedHashSet<>();
        }
        return record.edges(direction);
    }

    /**
     * Get the stored record of a node, null if the node has no edges.
     */
    public AdjacencyRecord adjacency(String nodeId) {
        E.checkNotNull(nodeId, "node id");
        return this.read(this.keyMapper.lookupKey(nodeId));
    }

    /**
     * Record a batch of edges. The new ids are first grouped per node, then
     * the records of all affected nodes are read with one multiGet and
     * written back with one multiPut. The final write is atomic, the read
     * before it is not isolated from other writers.
     */
    public void bulkRecordEdges(Collection<Edge> edges) {
        E.checkNotNull(edges, "edges");
        Map<String, AdjacencyRecord> added = new LinkedHashMap<>();
        for (Edge edge : edges) {
            if (edge.source() != null) {
                added.computeIfAbsent(edge.source(),
                                      k -> new AdjacencyRecord())
                     .addOutgoing(edge.id());
            }
            if (edge.target() != null) {
                added.computeIfAbsent(edge.target(),
                                      k -> new AdjacencyRecord())
                     .addIncoming(edge.id());
            }
        }
        if (added.isEmpty()) {
            return;
        }

        List<String> nodeIds = new ArrayList<>(added.keySet());
        List<byte[]> keys = this.keyMapper.encodeKeys(nodeIds);
        List<byte[]> values = this.store.multiGet(Partition.ADJACENCY, keys);
        assert values.size() == keys.size();

        List<BackendColumn> columns = new ArrayList<>(keys.size());
        for (int i = 0; i < keys.size(); i++) {
            byte[] value = values.get(i);
            AdjacencyRecord record = value == null ? new AdjacencyRecord() :
                                     this.codec.decodeAdjacency(value);
            record.merge(added.get(nodeIds.get(i)));
            columns.add(BackendColumn.of(keys.get(i),
                                         this.codec.encodeAdjacency(record)));
        }
        this.store.multiPut(Partition.ADJACENCY, columns);
        LOG.debug("Recorded {} edges into adjacency of {} nodes",
                  edges.size(), columns.size());
    }

    private AdjacencyRecord read(byte[] key) {
        if (key == null) {
            return null;
        }
        byte[] value = this.store.get(Partition.ADJACENCY, key);
        if (value == null) {
            return null;
        }
        return this.codec.decodeAdjacency(value);
    }

    private AdjacencyRecord readOrCreate(byte[] key) {
        AdjacencyRecord record = this.read(key);
        return record == null ? new AdjacencyRecord() : record;
    }

    private void write(byte[] key, AdjacencyRecord record) {
        this.store.put(Partition.ADJACENCY, key,
                       this.codec.encodeAdjacency(record));
    }

    private void writeOrDelete(byte[] key, AdjacencyRecord record) {
        if (record.empty()) {
            this.store.delete(Partition.ADJACENCY, key);
        } else {
            this.write(key, record);
        }
    }
}
