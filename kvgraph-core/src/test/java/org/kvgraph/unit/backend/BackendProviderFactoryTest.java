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

package org.kvgraph.unit.backend;

import org.junit.BeforeClass;
import org.junit.Test;
import org.kvgraph.RegisterUtil;
import org.kvgraph.backend.BackendException;
import org.kvgraph.backend.store.BackendProviderFactory;
import org.kvgraph.backend.store.BackendStore;
import org.kvgraph.backend.store.BackendStoreProvider;
import org.kvgraph.backend.store.memory.InMemoryBackendStore;
import org.kvgraph.config.CoreOptions;
import org.kvgraph.config.GraphConfig;
import org.kvgraph.testutil.Assert;

import com.google.common.collect.ImmutableMap;

public class BackendProviderFactoryTest {

    @BeforeClass
    public static void init() {
        RegisterUtil.registerCore();
    }

    @Test
    public void testOpenMemoryByDefault() {
        BackendStore store = BackendProviderFactory.open(new GraphConfig());
        try {
            Assert.assertInstanceOf(InMemoryBackendStore.class, store);
            Assert.assertEquals("kvgraph", store.name());
        } finally {
            store.close();
        }
    }

    @Test
    public void testOpenUnknownBackend() {
        GraphConfig config = new GraphConfig(ImmutableMap.of("backend",
                                                             "cassandra"));
        Assert.assertThrows(BackendException.class, () -> {
            BackendProviderFactory.open(config);
        }, e -> {
            Assert.assertContains("Not exists BackendStoreProvider: cassandra",
                                  e.getMessage());
        });
    }

    @Test
    public void testRegisterProvider() {
        BackendProviderFactory.register("named",
                                        NamedStoreProvider.class.getName());
        Assert.assertTrue(BackendProviderFactory.registered("named"));

        GraphConfig config = new GraphConfig(ImmutableMap.of("backend", "named",
                                                             "store", "g1"));
        BackendStore store = BackendProviderFactory.open(config);
        try {
            Assert.assertEquals("named-g1", store.name());
        } finally {
            store.close();
        }

        Assert.assertThrows(BackendException.class, () -> {
            BackendProviderFactory.register("named",
                                            NamedStoreProvider.class.getName());
        }, e -> {
            Assert.assertContains("Exists BackendStoreProvider: named",
                                  e.getMessage());
        });
    }

    @Test
    public void testRegisterInvalidProvider() {
        Assert.assertThrows(BackendException.class, () -> {
            BackendProviderFactory.register("string", String.class.getName());
        }, e -> {
            Assert.assertContains("is not a subclass", e.getMessage());
        });
        Assert.assertThrows(BackendException.class, () -> {
            BackendProviderFactory.register("none", "org.kvgraph.NoSuchClass");
        });
    }

    @Test
    public void testOpenProviderWithMismatchedType() {
        BackendProviderFactory.register("alias",
                                        NamedStoreProvider.class.getName());
        GraphConfig config = new GraphConfig(ImmutableMap.of("backend",
                                                             "alias"));
        Assert.assertThrows(BackendException.class, () -> {
            BackendProviderFactory.open(config);
        }, e -> {
            Assert.assertContains("can't be opened by key 'alias'",
                                  e.getMessage());
        });
    }

    public static class NamedStoreProvider implements BackendStoreProvider {

        @Override
        public String type() {
            return "named";
        }

        @Override
        public BackendStore open(GraphConfig config) {
            return new InMemoryBackendStore("named-" +
                                            config.get(CoreOptions.STORE));
        }
    }
}
