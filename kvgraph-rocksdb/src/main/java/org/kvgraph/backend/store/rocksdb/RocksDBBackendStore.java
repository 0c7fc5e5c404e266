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

package org.kvgraph.backend.store.rocksdb;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.apache.commons.io.FileUtils;
import org.kvgraph.backend.BackendException;
import org.kvgraph.backend.store.BackendColumn;
import org.kvgraph.backend.store.BackendColumnIterator;
import org.kvgraph.backend.store.BackendStore;
import org.kvgraph.backend.store.Partition;
import org.kvgraph.config.GraphConfig;
import org.kvgraph.util.Bytes;
import org.kvgraph.util.E;
import org.kvgraph.util.Log;
import org.kvgraph.util.StringEncoding;
import org.rocksdb.BlockBasedTableConfig;
import org.rocksdb.BloomFilter;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.ColumnFamilyOptions;
import org.rocksdb.DBOptions;
import org.rocksdb.InfoLogLevel;
import org.rocksdb.Options;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;
import org.slf4j.Logger;

import com.google.common.collect.ImmutableList;

/**
 * Backend store on an embedded RocksDB, one column family per
 * {@link Partition}. A batch is written with one {@link WriteBatch}, a scan
 * reads from the implicit snapshot of its RocksDB iterator.
 *
 * Closing the store closes the iterators still open, they end silently.
 * Other calls must not be in flight while the store is being closed.
 */
public class RocksDBBackendStore implements BackendStore {

    private static final Logger LOG = Log.logger(RocksDBBackendStore.class);

    private static final String DEFAULT_CF = "default";

    static {
        RocksDB.loadLibrary();
    }

    private final String name;
    private final String dataPath;
    private final DBOptions dbOptions;
    private final ColumnFamilyOptions cfOptions;
    private final BloomFilter bloomFilter;
    private final WriteOptions writeOptions;
    private final RocksDB rocksdb;
    private final List<ColumnFamilyHandle> cfHandles;
    private final Map<Partition, ColumnFamilyHandle> partitions;
    private final Set<ColumnIterator> iterators;
    private volatile boolean closed;

    public RocksDBBackendStore(GraphConfig config, String name) {
        E.checkNotNull(config, "config");
        E.checkArgument(name != null && !name.isEmpty(),
                        "The store name can't be null or empty");
        this.name = name;
        this.dataPath = path(config.get(RocksDBOptions.DATA_PATH), name);
        String walPath = config.get(RocksDBOptions.WAL_PATH);
        walPath = walPath.isEmpty() ? this.dataPath : path(walPath, name);

        try {
            FileUtils.forceMkdir(new File(this.dataPath));
        } catch (IOException e) {
            throw new BackendException("Can't create data directory '%s'",
                                       e, this.dataPath);
        }

        this.cfOptions = new ColumnFamilyOptions();
        this.dbOptions = new DBOptions();
        this.bloomFilter = initOptions(config, this.dbOptions,
                                       this.cfOptions);
        this.dbOptions.setWalDir(walPath);
        this.writeOptions = new WriteOptions();
        this.writeOptions.setSync(config.get(RocksDBOptions.SYNC_WRITE));

        List<String> cfs = this.columnFamilies();
        List<ColumnFamilyDescriptor> cfds = new ArrayList<>(cfs.size());
        for (String cf : cfs) {
            cfds.add(new ColumnFamilyDescriptor(StringEncoding.encode(cf),
                                                this.cfOptions));
        }

        this.cfHandles = new ArrayList<>(cfs.size());
        try {
            this.rocksdb = RocksDB.open(this.dbOptions, this.dataPath, cfds,
                                        this.cfHandles);
        } catch (RocksDBException e) {
            this.closeOptions();
            throw new BackendException("Failed to open RocksDB at '%s'",
                                       e, this.dataPath);
        }
        E.checkState(this.cfHandles.size() == cfs.size(),
                     "Expect same size of cf-handles and cf-names");

        this.partitions = new EnumMap<>(Partition.class);
        for (Partition partition : Partition.values()) {
            int index = cfs.indexOf(partition.string());
            this.partitions.put(partition, this.cfHandles.get(index));
        }
        this.iterators = ConcurrentHashMap.newKeySet();
        this.closed = false;
        LOG.info("Opened RocksDB store '{}' at '{}'", name, this.dataPath);
    }

    @Override
    public String name() {
        return this.name;
    }

    @Override
    public byte[] get(Partition partition, byte[] key) {
        ColumnFamilyHandle cf = this.cf(partition);
        E.checkNotNull(key, "key");
        try {
            return this.rocksdb.get(cf, key);
        } catch (RocksDBException e) {
            throw new BackendException(e);
        }
    }

    @Override
    public void put(Partition partition, byte[] key, byte[] value) {
        ColumnFamilyHandle cf = this.cf(partition);
        E.checkNotNull(key, "key");
        E.checkNotNull(value, "value");
        try {
            this.rocksdb.put(cf, this.writeOptions, key, value);
        } catch (RocksDBException e) {
            throw new BackendException(e);
        }
    }

    @Override
    public void delete(Partition partition, byte[] key) {
        ColumnFamilyHandle cf = this.cf(partition);
        E.checkNotNull(key, "key");
        try {
            this.rocksdb.delete(cf, this.writeOptions, key);
        } catch (RocksDBException e) {
            throw new BackendException(e);
        }
    }

    @Override
    public List<byte[]> multiGet(Partition partition, List<byte[]> keys) {
        ColumnFamilyHandle cf = this.cf(partition);
        E.checkNotNull(keys, "keys");
        if (keys.isEmpty()) {
            return new ArrayList<>();
        }
        List<ColumnFamilyHandle> cfs = new ArrayList<>(keys.size());
        for (byte[] key : keys) {
            E.checkNotNull(key, "key");
            cfs.add(cf);
        }
        try {
            return this.rocksdb.multiGetAsList(cfs, keys);
        } catch (RocksDBException e) {
            throw new BackendException(e);
        }
    }

    @Override
    public void multiPut(Partition partition, List<BackendColumn> columns) {
        ColumnFamilyHandle cf = this.cf(partition);
        E.checkNotNull(columns, "columns");
        if (columns.isEmpty()) {
            return;
        }
        try (WriteBatch batch = new WriteBatch()) {
            for (BackendColumn column : columns) {
                E.checkNotNull(column.name, "column name");
                E.checkNotNull(column.value, "column value");
                batch.put(cf, column.name, column.value);
            }
            this.rocksdb.write(this.writeOptions, batch);
        } catch (RocksDBException e) {
            throw new BackendException("Failed to write batch of %s columns",
                                       e, columns.size());
        }
        LOG.debug("Put {} columns into partition '{}' of store '{}'",
                  columns.size(), partition.string(), this.name);
    }

    @Override
    public BackendColumnIterator scan(Partition partition,
                                      byte[] from, byte[] to) {
        ColumnFamilyHandle cf = this.cf(partition);
        if (from != null && to != null && Bytes.compare(from, to) >= 0) {
            return BackendColumnIterator.empty();
        }
        ColumnIterator iter = new ColumnIterator(this.rocksdb.newIterator(cf),
                                                 from, to);
        this.iterators.add(iter);
        return iter;
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

        for (ColumnIterator iter : this.iterators) {
            iter.close();
        }
        this.iterators.clear();
        for (ColumnFamilyHandle cf : this.cfHandles) {
            cf.close();
        }
        this.rocksdb.close();
        this.closeOptions();
        LOG.info("Closed RocksDB store '{}'", this.name);
    }

    private void closeOptions() {
        this.writeOptions.close();
        this.dbOptions.close();
        this.cfOptions.close();
        if (this.bloomFilter != null) {
            this.bloomFilter.close();
        }
    }

    private ColumnFamilyHandle cf(Partition partition) {
        E.checkState(!this.closed, "Store '%s' has been closed", this.name);
        E.checkNotNull(partition, "partition");
        ColumnFamilyHandle cf = this.partitions.get(partition);
        assert cf != null : partition;
        return cf;
    }

    private List<String> columnFamilies() {
        Set<String> cfs = new HashSet<>();
        // Column families of an existing db must all be opened
        if (new File(this.dataPath, "CURRENT").exists()) {
            try (Options options = new Options()) {
                for (byte[] cf : RocksDB.listColumnFamilies(options,
                                                            this.dataPath)) {
                    cfs.add(StringEncoding.decode(cf));
                }
            } catch (RocksDBException e) {
                throw new BackendException("Failed to list column families " +
                                           "at '%s'", e, this.dataPath);
            }
        }
        cfs.add(DEFAULT_CF);
        for (Partition partition : Partition.values()) {
            cfs.add(partition.string());
        }
        return ImmutableList.copyOf(cfs);
    }

    private static String path(String base, String name) {
        return base + File.separator + name;
    }

    /**
     * Set the db and column family options from the config.
     * @return the bloom filter of the table config, null if disabled
     */
    private static BloomFilter initOptions(GraphConfig conf, DBOptions db,
                                           ColumnFamilyOptions cf) {
        db.setCreateIfMissing(true);
        db.setCreateMissingColumnFamilies(true);
        db.setInfoLogLevel(InfoLogLevel.valueOf(
                conf.get(RocksDBOptions.LOG_LEVEL) + "_LEVEL"));
        db.setMaxOpenFiles(conf.get(RocksDBOptions.MAX_OPEN_FILES));

        cf.setCompressionType(conf.get(RocksDBOptions.COMPRESSION));
        cf.setWriteBufferSize(conf.get(RocksDBOptions.MEMTABLE_SIZE));

        // https://github.com/facebook/rocksdb/wiki/RocksDB-Bloom-Filter
        int bitsPerKey = conf.get(RocksDBOptions.BLOOM_FILTER_BITS_PER_KEY);
        if (bitsPerKey < 0) {
            return null;
        }
        BloomFilter bloomFilter = new BloomFilter(bitsPerKey);
        BlockBasedTableConfig tableConfig = new BlockBasedTableConfig();
        tableConfig.setFilterPolicy(bloomFilter);
        cf.setTableFormatConfig(tableConfig);
        return bloomFilter;
    }

    /**
     * A wrapper for RocksIterator that ends before the upper bound, keys
     * are compared as unsigned bytes.
     */
    private final class ColumnIterator implements BackendColumnIterator {

        private final RocksIterator iter;
        private final byte[] keyEnd;
        private boolean matched;

        public ColumnIterator(RocksIterator iter, byte[] keyBegin,
                              byte[] keyEnd) {
            this.iter = iter;
            this.keyEnd = keyEnd;
            this.matched = false;
            if (keyBegin == null) {
                this.iter.seekToFirst();
            } else {
                this.iter.seek(keyBegin);
            }
        }

        @Override
        public boolean hasNext() {
            if (this.matched) {
                return true;
            }
            if (!this.iter.isOwningHandle()) {
                // Closed
                return false;
            }
            this.matched = this.iter.isValid() &&
                           (this.keyEnd == null ||
                            Bytes.compare(this.iter.key(), this.keyEnd) < 0);
            if (!this.matched) {
                // Free the iterator if finished
                this.close();
            }
            return this.matched;
        }

        @Override
        public BackendColumn next() {
            if (!this.hasNext()) {
                throw new NoSuchElementException();
            }
            BackendColumn col = BackendColumn.of(this.iter.key(),
                                                 this.iter.value());
            this.iter.next();
            this.matched = false;
            return col;
        }

        @Override
        public void close() {
            if (this.iter.isOwningHandle()) {
                this.iter.close();
            }
            RocksDBBackendStore.this.iterators.remove(this);
        }
    }
}
