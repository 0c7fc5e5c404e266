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

package org.kvgraph.config;

import static org.kvgraph.config.OptionChecker.disallowEmpty;

public class CoreOptions extends OptionHolder {

    private CoreOptions() {
        super();
    }

    private static volatile CoreOptions instance;

    public static synchronized CoreOptions instance() {
        if (instance == null) {
            instance = new CoreOptions();
            instance.registerOptions();
        }
        return instance;
    }

    public static final ConfigOption<String> BACKEND =
            new ConfigOption<>(
                    "backend",
                    "The storage engine of the graph, like memory or rocksdb.",
                    disallowEmpty(),
                    "memory"
            );

    public static final ConfigOption<String> SERIALIZER =
            new ConfigOption<>(
                    "serializer",
                    "The codec of the stored entities, binary or json.",
                    disallowEmpty(),
                    "binary"
            );

    public static final ConfigOption<Boolean> INTERN_IDS =
            new ConfigOption<>(
                    "backend.intern_ids",
                    "Whether to store entities under 8 bytes interned keys " +
                    "instead of their id strings.",
                    disallowEmpty(),
                    false
            );

    public static final ConfigOption<String> STORE =
            new ConfigOption<>(
                    "store",
                    "The name of the graph store, used in log messages.",
                    disallowEmpty(),
                    "kvgraph"
            );
}
