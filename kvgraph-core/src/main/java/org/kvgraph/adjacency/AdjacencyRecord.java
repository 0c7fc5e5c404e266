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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Outgoing and incoming edge ids of one node. Both sides are sets kept in
 * insertion order. The record has no id, it's stored under its node's key.
 */
public class AdjacencyRecord {

    private final Set<String> outgoing;
    private final Set<String> incoming;

    public AdjacencyRecord() {
        this.outgoing = new LinkedHashSet<>();
        this.incoming = new LinkedHashSet<>();
    }

    public AdjacencyRecord(Collection<String> outgoing,
                           Collection<String> incoming) {
        this.outgoing = new LinkedHashSet<>(outgoing);
        this.incoming = new LinkedHashSet<>(incoming);
    }

    public Set<String> outgoing() {
        return Collections.unmodifiableSet(this.outgoing);
    }

    public Set<String> incoming() {
        return Collections.unmodifiableSet(this.incoming);
    }

    public boolean addOutgoing(String edgeId) {
        return this.outgoing.add(edgeId);
    }

    public boolean addIncoming(String edgeId) {
        return this.incoming.add(edgeId);
    }

    public boolean removeOutgoing(String edgeId) {
        return this.outgoing.remove(edgeId);
    }

    public boolean removeIncoming(String edgeId) {
        return this.incoming.remove(edgeId);
    }

    /**
     * Add all edge ids of another record.
     * @return true if this record changed
     */
    public boolean merge(AdjacencyRecord other) {
        boolean changed = this.outgoing.addAll(other.outgoing);
        changed |= this.incoming.addAll(other.incoming);
        return changed;
    }

    public boolean empty() {
        return this.outgoing.isEmpty() && this.incoming.isEmpty();
    }

    public Set<String> edges(Directions direction) {
        Set<String> edges = new LinkedHashSet<>();
        if (direction.outgoing()) {
            edges.addAll(this.outgoing);
        }
        if (direction.incoming()) {
            edges.addAll(this.incoming);
        }
        return edges;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof AdjacencyRecord)) {
            return false;
        }
        AdjacencyRecord other = (AdjacencyRecord) obj;
        return this.outgoing.equals(other.outgoing) &&
               this.incoming.equals(other.incoming);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.outgoing, this.incoming);
    }

    @Override
    public String toString() {
        return String.format("{outgoing=%s, incoming=%s}",
                             this.outgoing, this.incoming);
    }
}
