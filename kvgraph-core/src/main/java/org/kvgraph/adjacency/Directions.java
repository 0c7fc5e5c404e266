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

/**
 * Direction of an adjacency query or traversal. FORWARD follows the
 * outgoing edges of a node (the node is the source), BACKWARD follows the
 * incoming ones (the node is the target), ANY follows both.
 */
public enum Directions {

    FORWARD("forward", "out"),

    BACKWARD("backward", "in"),

    ANY("any", "both");

    private final String name;
    private final String alias;

    Directions(String name, String alias) {
        this.name = name;
        this.alias = alias;
    }

    public boolean outgoing() {
        return this != BACKWARD;
    }

    public boolean incoming() {
        return this != FORWARD;
    }

    public static Directions fromString(String direction) {
        for (Directions dir : values()) {
            if (dir.name.equalsIgnoreCase(direction) ||
                dir.alias.equalsIgnoreCase(direction)) {
                return dir;
            }
        }
        throw new IllegalArgumentException(String.format(
                  "Unrecognized direction: '%s'", direction));
    }
}
