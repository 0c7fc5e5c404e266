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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.kvgraph.backend.BackendException;
import org.kvgraph.util.Bytes;
import org.kvgraph.util.E;
import org.kvgraph.util.Log;
import org.kvgraph.util.StringEncoding;
import org.slf4j.Logger;

import com.google.common.collect.ImmutableList;

/**
 * Replaces id strings by fixed width 8 bytes big-endian keys. Each
 * assignment is written both ways, {@link Partition#ID_KEYS} maps the id
 * to its key and {@link Partition#KEY_IDS} maps the key back. The last
 * assigned key is kept in {@link Partition#KEY_IDS} under key 0, so
 * assigned keys start from 1.
 *
 * Assignments are never removed, deleting an entity keeps its key.
 * Key assignment is synchronized on this mapper, so a store must be
 * interned through a single mapper instance.
 */
public class InterningKeyMapper implements KeyMapper {

    private static final Logger LOG = Log.logger(InterningKeyMapper.class);

    public static final int KEY_LEN = Long.BYTES;

    private static final byte[] COUNTER_KEY = Bytes.longToBytes(0L);

    private final BackendStore store;
    private long lastKey;

    public InterningKeyMapper(BackendStore store) {
        E.checkNotNull(store, "store");
        this.store = store;
        byte[] counter = store.get(Partition.KEY_IDS, COUNTER_KEY);
        this.lastKey = counter == null ? 0L : toLong(counter);
        LOG.debug("Loaded interned key counter {} of store '{}'",
                  this.lastKey, store.name());
    }

    @Override
    public synchronized byte[] encodeKey(String id) {
        E.checkNotNull(id, "id");
        return this.encodeKeys(ImmutableList.of(id)).get(0);
    }

    @Override
    public synchronized List<byte[]> encodeKeys(List<String> ids) {
        E.checkNotNull(ids, "ids");
        List<byte[]> keys = this.lookupKeys(ids);

        List<BackendColumn> idToKey = new ArrayList<>();
        List<BackendColumn> keyToId = new ArrayList<>();
        Map<String, byte[]> assigned = new HashMap<>();
        long next = this.lastKey;
        for (int i = 0; i < ids.size(); i++) {
            if (keys.get(i) != null) {
                continue;
            }
            String id = ids.get(i);
            byte[] key = assigned.get(id);
            if (key == null) {
                key = Bytes.longToBytes(++next);
                assigned.put(id, key);
                byte[] idBytes = StringEncoding.encode(id);
                idToKey.add(BackendColumn.of(idBytes, key));
                keyToId.add(BackendColumn.of(key, idBytes));
            }
            keys.set(i, key);
        }

        if (!assigned.isEmpty()) {
            keyToId.add(BackendColumn.of(COUNTER_KEY, Bytes.longToBytes(next)));
            /*
             * The reverse mapping and the counter are written first, if
             * the second batch fails the keys are burnt but never reused
             */
            this.store.multiPut(Partition.KEY_IDS, keyToId);
            this.store.multiPut(Partition.ID_KEYS, idToKey);
            this.lastKey = next;
            LOG.debug("Interned {} ids of store '{}'",
                      assigned.size(), this.store.name());
        }
        return keys;
    }

    @Override
    public byte[] lookupKey(String id) {
        E.checkNotNull(id, "id");
        return this.store.get(Partition.ID_KEYS, StringEncoding.encode(id));
    }

    @Override
    public List<byte[]> lookupKeys(List<String> ids) {
        E.checkNotNull(ids, "ids");
        if (ids.isEmpty()) {
            return new ArrayList<>();
        }
        Set<String> distinct = new LinkedHashSet<>(ids);
        List<byte[]> idBytes = new ArrayList<>(distinct.size());
        for (String id : distinct) {
            E.checkNotNull(id, "id");
            idBytes.add(StringEncoding.encode(id));
        }
        List<byte[]> found = this.store.multiGet(Partition.ID_KEYS, idBytes);

        Map<String, byte[]> keyOfId = new HashMap<>();
        int i = 0;
        for (String id : distinct) {
            keyOfId.put(id, found.get(i++));
        }
        List<byte[]> keys = new ArrayList<>(ids.size());
        for (String id : ids) {
            keys.add(keyOfId.get(id));
        }
        return keys;
    }

    @Override
    public String decodeKey(byte[] key) {
        E.checkNotNull(key, "key");
        E.checkArgument(key.length == KEY_LEN && !Bytes.equals(key,
                                                               COUNTER_KEY),
                        "Invalid interned key '%s'", Bytes.toHex(key));
        byte[] id = this.store.get(Partition.KEY_IDS, key);
        if (id == null) {
            throw new BackendException("Unknown interned key '%s'",
                                       Bytes.toHex(key));
        }
        return StringEncoding.decode(id);
    }

    private static long toLong(byte[] counter) {
        if (counter.length != KEY_LEN) {
            throw new BackendException("Invalid interned key counter '%s'",
                                       Bytes.toHex(counter));
        }
        return Bytes.bytesToLong(counter);
    }
}
