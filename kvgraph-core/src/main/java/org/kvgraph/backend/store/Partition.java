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

package org.kvgraph.backend.store;

/**
 * Logical namespaces of a backend store. Each engine keeps one separate
 * ordered key space per partition.
 */
public enum Partition {

    NODES("nodes"),

    EDGES("edges"),

    ADJACENCY("adjacency"),

    // id string -> interned key
    ID_KEYS("id_keys"),

    // interned key -> id string, and the key counter
    KEY_IDS("key_ids");

    private final String name;

    Partition(String name) {
        this.name = name;
    }

    public String string() {
        return this.name;
    }

    public static Partition fromString(String name) {
        for (Partition partition : values()) {
            if (partition.name.equals(name)) {
                return partition;
            }
        }
        throw new IllegalArgumentException(String.format(
                  "Unknown partition '%s'", name));
    }
}
