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

package org.kvgraph.codec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.kvgraph.adjacency.AdjacencyRecord;
import org.kvgraph.structure.Edge;
import org.kvgraph.structure.Node;
import org.kvgraph.structure.PropertyValue;
import org.kvgraph.util.E;

/**
 * Encodes entities by kind on top of a {@link Codec}. Each kind has its own
 * record shape, the codec only decides the bytes:
 * <pre>
 *   node:      {id, properties}
 *   edge:      {id, source, target, properties}
 *   adjacency: {outgoing, incoming}
 * </pre>
 * An adjacency record carries no id, it is keyed by its node.
 */
public class EntityCodec {

    private static final String ID = "id";
    private static final String SOURCE = "source";
    private static final String TARGET = "target";
    private static final String PROPERTIES = "properties";
    private static final String OUTGOING = "outgoing";
    private static final String INCOMING = "incoming";

    private final Codec codec;

    public EntityCodec(Codec codec) {
        E.checkNotNull(codec, "codec");
        this.codec = codec;
    }

    public Codec codec() {
        return this.codec;
    }

    public byte[] encode(Object entity, EntityKind kind) {
        E.checkNotNull(entity, "entity");
        E.checkNotNull(kind, "kind");
        E.checkArgument(kind.entityClass().isInstance(entity),
                        "Can't encode %s as %s",
                        entity.getClass().getSimpleName(), kind);
        switch (kind) {
            case NODE:
                return this.encodeNode((Node) entity);
            case EDGE:
                return this.encodeEdge((Edge) entity);
            case ADJACENCY:
                return this.encodeAdjacency((AdjacencyRecord) entity);
            default:
                throw new AssertionError("Unknown entity kind " + kind);
        }
    }

    public Object decode(byte[] bytes, EntityKind kind) {
        E.checkNotNull(kind, "kind");
        switch (kind) {
            case NODE:
                return this.decodeNode(bytes);
            case EDGE:
                return this.decodeEdge(bytes);
            case ADJACENCY:
                return this.decodeAdjacency(bytes);
            default:
                throw new AssertionError("Unknown entity kind " + kind);
        }
    }

    public byte[] encodeNode(Node node) {
        Map<String, PropertyValue> record = new LinkedHashMap<>();
        record.put(ID, PropertyValue.ofString(node.id()));
        record.put(PROPERTIES, PropertyValue.ofMap(node.properties()));
        return this.codec.encode(PropertyValue.ofMap(record));
    }

    public Node decodeNode(byte[] bytes) {
        Map<String, PropertyValue> record = this.decodeRecord(bytes,
                                                              EntityKind.NODE);
        Node node = new Node(this.stringField(record, ID, false));
        node.properties(this.mapField(record, PROPERTIES));
        return node;
    }

    public byte[] encodeEdge(Edge edge) {
        Map<String, PropertyValue> record = new LinkedHashMap<>();
        record.put(ID, PropertyValue.ofString(edge.id()));
        record.put(SOURCE, PropertyValue.of(edge.source()));
        record.put(TARGET, PropertyValue.of(edge.target()));
        record.put(PROPERTIES, PropertyValue.ofMap(edge.properties()));
        return this.codec.encode(PropertyValue.ofMap(record));
    }

    public Edge decodeEdge(byte[] bytes) {
        Map<String, PropertyValue> record = this.decodeRecord(bytes,
                                                              EntityKind.EDGE);
        Edge edge = new Edge(this.stringField(record, ID, false),
                             this.stringField(record, SOURCE, true),
                             this.stringField(record, TARGET, true));
        edge.properties(this.mapField(record, PROPERTIES));
        return edge;
    }

    public byte[] encodeAdjacency(AdjacencyRecord adjacency) {
        Map<String, PropertyValue> record = new LinkedHashMap<>();
        record.put(OUTGOING, PropertyValue.of(adjacency.outgoing()));
        record.put(INCOMING, PropertyValue.of(adjacency.incoming()));
        return this.codec.encode(PropertyValue.ofMap(record));
    }

    public AdjacencyRecord decodeAdjacency(byte[] bytes) {
        Map<String, PropertyValue> record = this.decodeRecord(
                                            bytes, EntityKind.ADJACENCY);
        return new AdjacencyRecord(this.idsField(record, OUTGOING),
                                   this.idsField(record, INCOMING));
    }

    private Map<String, PropertyValue> decodeRecord(byte[] bytes,
                                                    EntityKind kind) {
        E.checkNotNull(bytes, "bytes");
        PropertyValue value = this.codec.decode(bytes);
        if (value.type() != PropertyValue.Type.MAP) {
            throw new SerializationException("Invalid %s record, expect a " +
                                             "map but got %s",
                                             kind, value.type());
        }
        return value.asMap();
    }

    private String stringField(Map<String, PropertyValue> record,
                               String field, boolean nullable) {
        PropertyValue value = record.get(field);
        if (value == null) {
            throw new SerializationException("Missing field '%s' in record",
                                             field);
        }
        if (nullable && value.isNull()) {
            return null;
        }
        if (value.type() != PropertyValue.Type.STRING ||
            value.asString().isEmpty()) {
            throw new SerializationException("Invalid field '%s' in record: " +
                                             "%s", field, value);
        }
        return value.asString();
    }

    private Map<String, PropertyValue> mapField(
                                       Map<String, PropertyValue> record,
                                       String field) {
        PropertyValue value = record.get(field);
        if (value == null || value.type() != PropertyValue.Type.MAP) {
            throw new SerializationException("Invalid field '%s' in record: " +
                                             "%s", field, value);
        }
        return value.asMap();
    }

    private List<String> idsField(Map<String, PropertyValue> record,
                                  String field) {
        PropertyValue value = record.get(field);
        if (value == null || value.type() != PropertyValue.Type.LIST) {
            throw new SerializationException("Invalid field '%s' in record: " +
                                             "%s", field, value);
        }
        List<String> ids = new ArrayList<>(value.asList().size());
        for (PropertyValue id : value.asList()) {
            if (id.type() != PropertyValue.Type.STRING) {
                throw new SerializationException("Invalid edge id in '%s': " +
                                                 "%s", field, id);
            }
            ids.add(id.asString());
        }
        return ids;
    }
}
