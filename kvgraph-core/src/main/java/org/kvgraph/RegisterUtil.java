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

import org.kvgraph.backend.store.BackendProviderFactory;
import org.kvgraph.config.CoreOptions;
import org.kvgraph.config.OptionSpace;

/**
 * Registers option holders and backend providers. Options must be
 * registered before building a config that sets them, otherwise their
 * values are kept as raw strings.
 */
public class RegisterUtil {

    public static final String ROCKSDB = "rocksdb";

    public static void registerCore() {
        OptionSpace.register("core", CoreOptions.instance());
    }

    public static synchronized void registerRocksDB() {
        if (BackendProviderFactory.registered(ROCKSDB)) {
            return;
        }
        // Register config
        OptionSpace.register(ROCKSDB,
                "org.kvgraph.backend.store.rocksdb.RocksDBOptions");
        // Register backend
        BackendProviderFactory.register(ROCKSDB,
                "org.kvgraph.backend.store.rocksdb.RocksDBStoreProvider");
    }
}
