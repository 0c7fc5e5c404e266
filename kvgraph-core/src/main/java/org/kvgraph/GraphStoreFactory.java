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

import java.util.Map;

import org.apache.commons.configuration2.Configuration;
import org.kvgraph.backend.store.BackendProviderFactory;
import org.kvgraph.backend.store.BackendStore;
import org.kvgraph.backend.store.InterningKeyMapper;
import org.kvgraph.backend.store.KeyMapper;
import org.kvgraph.backend.store.RawKeyMapper;
import org.kvgraph.codec.Codec;
import org.kvgraph.codec.CodecFactory;
import org.kvgraph.codec.EntityCodec;
import org.kvgraph.config.CoreOptions;
import org.kvgraph.config.GraphConfig;
import org.kvgraph.id.UuidIdGenerator;
import org.kvgraph.util.E;
import org.kvgraph.util.Log;
import org.slf4j.Logger;

/**
 * Opens graph stores from configuration. Backends other than memory must
 * be registered first, see {@link RegisterUtil}.
 */
public class GraphStoreFactory {

    private static final Logger LOG = Log.logger(GraphStoreFactory.class);

    static {
        RegisterUtil.registerCore();
    }

    public static GraphStore open(String path) {
        return open(new GraphConfig(path));
    }

    public static GraphStore open(Map<String, ?> properties) {
        return open(new GraphConfig(properties));
    }

    public static GraphStore open(Configuration config) {
        GraphConfig conf = config instanceof GraphConfig ?
                           (GraphConfig) config : new GraphConfig(config);
        return open(conf);
    }

    public static GraphStore open(GraphConfig config) {
        E.checkNotNull(config, "config");
        String name = config.get(CoreOptions.STORE);

        // Resolve the codec before opening the backend, nothing to close
        Codec codec = CodecFactory.codec(config.get(CoreOptions.SERIALIZER));
        BackendStore store = BackendProviderFactory.open(config);

        KeyMapper keyMapper;
        try {
            keyMapper = config.get(CoreOptions.INTERN_IDS) ?
                        new InterningKeyMapper(store) : RawKeyMapper.INSTANCE;
        } catch (RuntimeException e) {
            store.close();
            throw e;
        }

        LOG.info("Opened graph store '{}' with backend '{}' and codec '{}'",
                 name, config.get(CoreOptions.BACKEND), codec.name());
        return new GraphStore(store, new EntityCodec(codec), keyMapper,
                              UuidIdGenerator.INSTANCE);
    }
}
