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

package org.kvgraph.structure;

import java.util.Objects;

import javax.annotation.Nullable;

/**
 * An edge references its endpoints by node id, the nodes aren't owned and
 * may not exist. A placeholder edge created by an update of a missing edge
 * has no endpoints at all.
 */
public class Edge extends GraphElement {

    private final String source;
    private final String target;

    public Edge(String id, @Nullable String source, @Nullable String target) {
        super(id);
        this.source = source;
        this.target = target;
    }

    @Nullable
    public String source() {
        return this.source;
    }

    @Nullable
    public String target() {
        return this.target;
    }

    public boolean selfLoop() {
        return this.source != null && this.source.equals(this.target);
    }

    /**
     * Get the endpoint on the other side of the given node, or null if the
     * node isn't an endpoint of this edge.
     */
    @Nullable
    public String otherEnd(String nodeId) {
        if (nodeId.equals(this.source)) {
            return this.target;
        } else if (nodeId.equals(this.target)) {
            return this.source;
        }
        return null;
    }

    @Override
    public Edge property(String key, Object value) {
        super.property(key, value);
        return this;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Edge)) {
            return false;
        }
        Edge other = (Edge) obj;
        return this.id().equals(other.id()) &&
               Objects.equals(this.source, other.source) &&
               Objects.equals(this.target, other.target) &&
               this.properties().equals(other.properties());
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.id(), this.source, this.target,
                            this.properties());
    }

    @Override
    public String toString() {
        return String.format("Edge{id=%s, %s->%s, properties=%s}",
                             this.id(), this.source, this.target,
                             this.properties());
    }
}
