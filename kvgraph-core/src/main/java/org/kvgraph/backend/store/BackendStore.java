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

import java.util.List;

/**
 * Byte-keyed storage capability the graph store is built on, one
 * implementation per engine. Keys of a partition are kept in unsigned
 * lexicographic order.
 *
 * Every call is atomic on its own, including a whole {@link #multiPut}
 * batch, but no sequence of calls is. Engine failures are reported as
 * {@link org.kvgraph.backend.BackendException}. Any call after
 * {@link #close()} fails with {@link IllegalStateException}.
 */
public interface BackendStore extends AutoCloseable {

    String name();

    /**
     * Get the value of a key, or null if it's absent.
     */
    byte[] get(Partition partition, byte[] key);

    void put(Partition partition, byte[] key, byte[] value);

    /**
     * Delete a key, deleting an absent key is a no-op.
     */
    void delete(Partition partition, byte[] key);

    /**
     * Get the values of many keys at once.
     * @return values aligned with {@code keys}, null for absent keys
     */
    List<byte[]> multiGet(Partition partition, List<byte[]> keys);

    /**
     * Write all the columns as one atomic batch.
     */
    void multiPut(Partition partition, List<BackendColumn> columns);

    /**
     * Iterate the columns in key order from {@code from} (inclusive) to
     * {@code to} (exclusive), a null bound means unbounded.
     */
    BackendColumnIterator scan(Partition partition, byte[] from, byte[] to);

    boolean closed();

    @Override
    void close();
}
