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

package org.kvgraph.backend.store.memory;

import org.kvgraph.backend.store.BackendStore;
import org.kvgraph.backend.store.BackendStoreProvider;
import org.kvgraph.config.CoreOptions;
import org.kvgraph.config.GraphConfig;

public class InMemoryStoreProvider implements BackendStoreProvider {

    public static final String TYPE = "memory";

    public static boolean matchType(String type) {
        return TYPE.equalsIgnoreCase(type);
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public BackendStore open(GraphConfig config) {
        return new InMemoryBackendStore(config.get(CoreOptions.STORE));
    }
}
