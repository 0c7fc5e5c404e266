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

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

import org.kvgraph.backend.store.BackendColumn;
import org.kvgraph.backend.store.BackendColumnIterator;
import org.kvgraph.backend.store.BackendColumnIterator.BackendColumnIteratorWrapper;
import org.kvgraph.backend.store.BackendStore;
import org.kvgraph.backend.store.Partition;
import org.kvgraph.util.Bytes;
import org.kvgraph.util.E;
import org.kvgraph.util.Log;
import org.slf4j.Logger;

/**
 * Backend store keeping every partition in a sorted map on the heap.
 * All calls are serialized on the store monitor, which makes each call,
 * a whole batch included, atomic. Keys and values are copied in and out.
 */
public class InMemoryBackendStore implements BackendStore {

    private static final Logger LOG = Log.logger(InMemoryBackendStore.class);

    private final String name;
    private final Map<Partition, NavigableMap<byte[], byte[]>> partitions;
    private volatile boolean closed;

    public InMemoryBackendStore(String name) {
        this.name = name;
        this.partitions = new EnumMap<>(Partition.class);
        for (Partition partition : Partition.values()) {
            this.partitions.put(partition, new TreeMap<>(Bytes::compare));
        }
        this.closed = false;
    }

    @Override
    public String name() {
        return this.name;
    }

    @Override
    public synchronized byte[] get(Partition partition, byte[] key) {
        NavigableMap<byte[], byte[]> table = this.table(partition);
        E.checkNotNull(key, "key");
        return copy(table.get(key));
    }

    @Override
    public synchronized void put(Partition partition, byte[] key,
                                 byte[] value) {
        NavigableMap<byte[], byte[]> table = this.table(partition);
        E.checkNotNull(key, "key");
        E.checkNotNull(value, "value");
        table.put(copy(key), copy(value));
    }

    @Override
    public synchronized void delete(Partition partition, byte[] key) {
        NavigableMap<byte[], byte[]> table = this.table(partition);
        E.checkNotNull(key, "key");
        table.remove(key);
    }

    @Override
    public synchronized List<byte[]> multiGet(Partition partition,
                                              List<byte[]> keys) {
        NavigableMap<byte[], byte[]> table = this.table(partition);
        E.checkNotNull(keys, "keys");
        List<byte[]> values = new ArrayList<>(keys.size());
        for (byte[] key : keys) {
            E.checkNotNull(key, "key");
            values.add(copy(table.get(key)));
        }
        return values;
    }

    @Override
    public synchronized void multiPut(Partition partition,
                                      List<BackendColumn> columns) {
        NavigableMap<byte[], byte[]> table = this.table(partition);
        E.checkNotNull(columns, "columns");
        // Validate all before applying any
        for (BackendColumn column : columns) {
            E.checkNotNull(column.name, "column name");
            E.checkNotNull(column.value, "column value");
        }
        for (BackendColumn column : columns) {
            table.put(copy(column.name), copy(column.value));
        }
        LOG.debug("Put {} columns into partition '{}' of store '{}'",
                  columns.size(), partition.string(), this.name);
    }

    @Override
    public synchronized BackendColumnIterator scan(Partition partition,
                                                   byte[] from, byte[] to) {
        NavigableMap<byte[], byte[]> table = this.table(partition);
        NavigableMap<byte[], byte[]> range;
        if (from != null && to != null) {
            if (Bytes.compare(from, to) >= 0) {
                return BackendColumnIterator.empty();
            }
            range = table.subMap(from, true, to, false);
        } else if (from != null) {
            range = table.tailMap(from, true);
        } else if (to != null) {
            range = table.headMap(to, false);
        } else {
            range = table;
        }

        // Snapshot the range, writes after scan() aren't visible
        List<BackendColumn> columns = new ArrayList<>(range.size());
        for (Map.Entry<byte[], byte[]> e : range.entrySet()) {
            columns.add(BackendColumn.of(copy(e.getKey()), copy(e.getValue())));
        }
        return new BackendColumnIteratorWrapper(columns.iterator());
    }

    @Override
    public boolean closed() {
        return this.closed;
    }

    @Override
    public synchronized void close() {
        if (this.closed) {
            return;
        }
        this.closed = true;
        this.partitions.clear();
        LOG.info("Closed in-memory store '{}'", this.name);
    }

    private NavigableMap<byte[], byte[]> table(Partition partition) {
        E.checkState(!this.closed, "Store '%s' has been closed", this.name);
        E.checkNotNull(partition, "partition");
        return this.partitions.get(partition);
    }

    private static byte[] copy(byte[] bytes) {
        return bytes == null ? null : bytes.clone();
    }
}
