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

import java.util.ArrayList;
import java.util.List;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.kvgraph.backend.store.BackendColumn;
import org.kvgraph.backend.store.BackendColumnIterator;
import org.kvgraph.backend.store.BackendStore;
import org.kvgraph.backend.store.Partition;
import org.kvgraph.backend.store.memory.InMemoryBackendStore;
import org.kvgraph.testutil.Assert;
import org.kvgraph.util.StringEncoding;

import com.google.common.collect.ImmutableList;

public class InMemoryBackendStoreTest {

    private BackendStore store;

    @Before
    public void setup() {
        this.store = new InMemoryBackendStore("test");
    }

    @After
    public void teardown() {
        this.store.close();
    }

    @Test
    public void testPutGetDelete() {
        Assert.assertNull(this.store.get(Partition.NODES, b("k1")));

        this.store.put(Partition.NODES, b("k1"), b("v1"));
        Assert.assertArrayEquals(b("v1"), this.store.get(Partition.NODES,
                                                         b("k1")));
        this.store.put(Partition.NODES, b("k1"), b("v2"));
        Assert.assertArrayEquals(b("v2"), this.store.get(Partition.NODES,
                                                         b("k1")));

        this.store.delete(Partition.NODES, b("k1"));
        Assert.assertNull(this.store.get(Partition.NODES, b("k1")));
        // Deleting an absent key is a no-op
        this.store.delete(Partition.NODES, b("k1"));
    }

    @Test
    public void testPartitionsAreSeparate() {
        this.store.put(Partition.NODES, b("k"), b("node"));
        this.store.put(Partition.EDGES, b("k"), b("edge"));
        Assert.assertArrayEquals(b("node"), this.store.get(Partition.NODES,
                                                           b("k")));
        Assert.assertArrayEquals(b("edge"), this.store.get(Partition.EDGES,
                                                           b("k")));
        Assert.assertNull(this.store.get(Partition.ADJACENCY, b("k")));
    }

    @Test
    public void testValuesAreCopied() {
        byte[] key = b("k");
        byte[] value = b("value");
        this.store.put(Partition.NODES, key, value);
        value[0] = 'X';
        key[0] = 'X';

        byte[] stored = this.store.get(Partition.NODES, b("k"));
        Assert.assertArrayEquals(b("value"), stored);
        stored[0] = 'Y';
        Assert.assertArrayEquals(b("value"), this.store.get(Partition.NODES,
                                                            b("k")));
    }

    @Test
    public void testMultiGetAligned() {
        this.store.put(Partition.NODES, b("a"), b("1"));
        this.store.put(Partition.NODES, b("c"), b("3"));

        List<byte[]> values = this.store.multiGet(Partition.NODES,
                                                  ImmutableList.of(b("c"),
                                                                   b("b"),
                                                                   b("a"),
                                                                   b("c")));
        Assert.assertEquals(4, values.size());
        Assert.assertArrayEquals(b("3"), values.get(0));
        Assert.assertNull(values.get(1));
        Assert.assertArrayEquals(b("1"), values.get(2));
        Assert.assertArrayEquals(b("3"), values.get(3));

        Assert.assertEquals(0, this.store.multiGet(Partition.NODES,
                                                   ImmutableList.of()).size());
    }

    @Test
    public void testMultiPut() {
        this.store.multiPut(Partition.EDGES, ImmutableList.of(
                            BackendColumn.of(b("e1"), b("v1")),
                            BackendColumn.of(b("e2"), b("v2"))));
        Assert.assertArrayEquals(b("v1"), this.store.get(Partition.EDGES,
                                                         b("e1")));
        Assert.assertArrayEquals(b("v2"), this.store.get(Partition.EDGES,
                                                         b("e2")));
    }

    @Test
    public void testMultiPutInvalidColumnWritesNothing() {
        List<BackendColumn> columns = new ArrayList<>();
        columns.add(BackendColumn.of(b("e1"), b("v1")));
        columns.add(BackendColumn.of(b("e2"), null));
        Assert.assertThrows(NullPointerException.class, () -> {
            this.store.multiPut(Partition.EDGES, columns);
        });
        Assert.assertNull(this.store.get(Partition.EDGES, b("e1")));
    }

    @Test
    public void testScanBounds() {
        for (String key : ImmutableList.of("b", "a", "d", "c")) {
            this.store.put(Partition.NODES, b(key), b(key.toUpperCase()));
        }

        Assert.assertEquals(ImmutableList.of("a", "b", "c", "d"),
                            this.scanKeys(null, null));
        Assert.assertEquals(ImmutableList.of("b", "c"),
                            this.scanKeys(b("b"), b("d")));
        Assert.assertEquals(ImmutableList.of("c", "d"),
                            this.scanKeys(b("bb"), null));
        Assert.assertEquals(ImmutableList.of("a"),
                            this.scanKeys(null, b("b")));
        Assert.assertEquals(ImmutableList.of(),
                            this.scanKeys(b("c"), b("c")));
        Assert.assertEquals(ImmutableList.of(),
                            this.scanKeys(b("d"), b("a")));
    }

    @Test
    public void testScanUnsignedOrder() {
        this.store.put(Partition.NODES, new byte[]{(byte) 0xff}, b("high"));
        this.store.put(Partition.NODES, new byte[]{0x01}, b("low"));

        try (BackendColumnIterator iter = this.store.scan(Partition.NODES,
                                                          null, null)) {
            Assert.assertArrayEquals(b("low"), iter.next().value);
            Assert.assertArrayEquals(b("high"), iter.next().value);
            Assert.assertFalse(iter.hasNext());
        }
    }

    @Test
    public void testClosedStore() {
        Assert.assertFalse(this.store.closed());
        this.store.close();
        Assert.assertTrue(this.store.closed());
        // Idempotent
        this.store.close();

        Assert.assertThrows(IllegalStateException.class, () -> {
            this.store.get(Partition.NODES, b("k"));
        }, e -> {
            Assert.assertContains("has been closed", e.getMessage());
        });
        Assert.assertThrows(IllegalStateException.class, () -> {
            this.store.put(Partition.NODES, b("k"), b("v"));
        });
        Assert.assertThrows(IllegalStateException.class, () -> {
            this.store.scan(Partition.NODES, null, null);
        });
    }

    private List<String> scanKeys(byte[] from, byte[] to) {
        List<String> keys = new ArrayList<>();
        try (BackendColumnIterator iter = this.store.scan(Partition.NODES,
                                                          from, to)) {
            while (iter.hasNext()) {
                keys.add(StringEncoding.decode(iter.next().name));
            }
        }
        return keys;
    }

    private static byte[] b(String string) {
        return StringEncoding.encode(string);
    }
}
