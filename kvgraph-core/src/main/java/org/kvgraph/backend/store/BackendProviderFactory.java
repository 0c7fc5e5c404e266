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

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.kvgraph.backend.BackendException;
import org.kvgraph.backend.store.memory.InMemoryStoreProvider;
import org.kvgraph.config.CoreOptions;
import org.kvgraph.config.GraphConfig;
import org.kvgraph.util.Log;
import org.slf4j.Logger;

public class BackendProviderFactory {

    private static final Logger LOG = Log.logger(BackendProviderFactory.class);

    private static final Map<String, Class<? extends BackendStoreProvider>>
            PROVIDERS = new ConcurrentHashMap<>();

    public static BackendStore open(GraphConfig config) {
        String backend = config.get(CoreOptions.BACKEND).toLowerCase();
        BackendStoreProvider provider = newProvider(backend);
        LOG.info("Opening backend store '{}'", backend);
        return provider.open(config);
    }

    private static BackendStoreProvider newProvider(String backend) {
        if (InMemoryStoreProvider.matchType(backend)) {
            return new InMemoryStoreProvider();
        }

        Class<? extends BackendStoreProvider> clazz = PROVIDERS.get(backend);
        BackendException.check(clazz != null,
                               "Not exists BackendStoreProvider: %s", backend);

        assert BackendStoreProvider.class.isAssignableFrom(clazz);
        BackendStoreProvider instance;
        try {
            instance = clazz.getConstructor().newInstance();
        } catch (Exception e) {
            throw new BackendException(e);
        }

        BackendException.check(backend.equals(instance.type()),
                               "BackendStoreProvider with type '%s' " +
                               "can't be opened by key '%s'",
                               instance.type(), backend);
        return instance;
    }

    @SuppressWarnings({ "rawtypes", "unchecked" })
    public static void register(String name, String classPath) {
        ClassLoader classLoader = BackendProviderFactory.class.getClassLoader();
        Class<?> clazz;
        try {
            clazz = classLoader.loadClass(classPath);
        } catch (Exception e) {
            throw new BackendException(e);
        }

        // Check subclass
        boolean subclass = BackendStoreProvider.class.isAssignableFrom(clazz);
        BackendException.check(subclass, "Class '%s' is not a subclass of " +
                               "class BackendStoreProvider", classPath);

        // Check exists
        BackendException.check(!PROVIDERS.containsKey(name),
                               "Exists BackendStoreProvider: %s (%s)",
                               name, PROVIDERS.get(name));

        // Register class
        PROVIDERS.put(name, (Class) clazz);
    }

    public static boolean registered(String name) {
        return PROVIDERS.containsKey(name);
    }
}
