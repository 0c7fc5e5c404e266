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

package org.kvgraph.unit;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.kvgraph.GraphStore;
import org.kvgraph.backend.store.memory.InMemoryBackendStore;
import org.kvgraph.codec.BinaryCodec;
import org.kvgraph.structure.Edge;
import org.kvgraph.structure.Node;
import org.kvgraph.util.Log;
import org.slf4j.Logger;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

public class BaseUnitTest {

    protected static final Logger LOG = Log.logger(BaseUnitTest.class);

    protected static GraphStore memoryGraph() {
        return new GraphStore(new InMemoryBackendStore("test"),
                              new BinaryCodec());
    }

    protected static Node node(String id, Object... keyValues) {
        Node node = new Node(id);
        node.properties(props(keyValues));
        return node;
    }

    protected static Edge edge(String id, String source, String target,
                               Object... keyValues) {
        Edge edge = new Edge(id, source, target);
        edge.properties(props(keyValues));
        return edge;
    }

    protected static Map<String, Object> props(Object... keyValues) {
        assert keyValues.length % 2 == 0;
        ImmutableMap.Builder<String, Object> builder = ImmutableMap.builder();
        for (int i = 0; i < keyValues.length; i += 2) {
            builder.put((String) keyValues[i], keyValues[i + 1]);
        }
        return builder.build();
    }

    @SafeVarargs
    protected static <T> List<T> list(T... items) {
        return Arrays.asList(items);
    }

    /**
     * The given order, the reversed one and a fixed-seed shuffle.
     */
    protected static <T> List<List<T>> orderings(List<T> items) {
        List<T> shuffled = new ArrayList<>(items);
        Collections.shuffle(shuffled, new Random(20221019L));
        return ImmutableList.of(items, Lists.reverse(items), shuffled);
    }
}
