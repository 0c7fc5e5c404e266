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

package org.kvgraph.unit.util;

import org.junit.Test;
import org.kvgraph.testutil.Assert;
import org.kvgraph.util.Bytes;
import org.kvgraph.util.StringEncoding;

public class BytesTest {

    @Test
    public void testBytesEquals() {
        Assert.assertTrue(Bytes.equals(b("12345678"), b("12345678")));
        Assert.assertTrue(Bytes.equals(new byte[]{1, 3, 5, 7},
                                       new byte[]{1, 3, 5, 7}));

        Assert.assertFalse(Bytes.equals(new byte[]{1, 3, 5, 7},
                                        new byte[]{1, 3, 6, 7}));
        Assert.assertFalse(Bytes.equals(new byte[]{1, 3, 5, 7},
                                        new byte[]{1, 3, 5, 7, 0}));
    }

    @Test
    public void testBytesCompare() {
        Assert.assertTrue(Bytes.compare(b("12345678"), b("12345678")) == 0);
        Assert.assertTrue(Bytes.compare(b("12345678"), b("1234567")) > 0);
        Assert.assertTrue(Bytes.compare(b("12345678"), b("12345679")) < 0);

        Assert.assertTrue(Bytes.compare(new byte[]{1, 3, 5, 7},
                                        new byte[]{1, 3, 5, 7, 0}) < 0);
        Assert.assertTrue(Bytes.compare(new byte[]{1, 3, 5, 7},
                                        new byte[]{1, 3, 5, -1}) < 0);
        Assert.assertTrue(Bytes.compare(new byte[]{1, 3, 5, 0},
                                        new byte[]{1, 3, 5, -128}) < 0);
        Assert.assertTrue(Bytes.compare(new byte[]{1, 3, 5, -128},
                                        new byte[]{1, 3, 5, -1}) < 0);
    }

    @Test
    public void testLongBytes() {
        Assert.assertArrayEquals(new byte[]{0, 0, 0, 0, 0, 0, 1, 2},
                                 Bytes.longToBytes(0x0102L));
        Assert.assertEquals(0x0102L,
                            Bytes.bytesToLong(Bytes.longToBytes(0x0102L)));
        Assert.assertEquals(Long.MAX_VALUE,
                            Bytes.bytesToLong(Bytes.longToBytes(
                                              Long.MAX_VALUE)));

        // Big-endian keeps numeric order for non-negative values
        Assert.assertTrue(Bytes.compare(Bytes.longToBytes(255L),
                                        Bytes.longToBytes(256L)) < 0);

        Assert.assertThrows(IllegalArgumentException.class, () -> {
            Bytes.bytesToLong(new byte[]{1, 2});
        });
    }

    @Test
    public void testBytesHex() {
        Assert.assertEquals("0103807f",
                            Bytes.toHex(new byte[]{1, 3, -128, 127}));
        Assert.assertEquals("ff", Bytes.toHex((byte) -1));
    }

    @Test
    public void testStringEncodingStrict() throws Exception {
        byte[] bytes = StringEncoding.encode("héllo");
        Assert.assertEquals("héllo",
                            StringEncoding.decodeStrict(bytes, 0,
                                                        bytes.length));
        Assert.assertThrows(java.nio.charset.CharacterCodingException.class,
                            () -> {
            StringEncoding.decodeStrict(new byte[]{(byte) 0xc3}, 0, 1);
        });
    }

    private static byte[] b(String string) {
        return StringEncoding.encode(string);
    }
}
