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

public class Node extends GraphElement {

    public Node(String id) {
        super(id);
    }

    @Override
    public Node property(String key, Object value) {
        super.property(key, value);
        return this;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Node)) {
            return false;
        }
        Node other = (Node) obj;
        return this.id().equals(other.id()) &&
               this.properties().equals(other.properties());
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.id(), this.properties());
    }

    @Override
    public String toString() {
        return String.format("Node{id=%s, properties=%s}",
                             this.id(), this.properties());
    }
}
