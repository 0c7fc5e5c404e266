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

package org.kvgraph.util;

import java.util.Arrays;

import org.apache.commons.codec.binary.Hex;

/**
 * Byte array helpers shared by the codecs and the storage engines.
 * Comparison is unsigned lexicographic, the order every engine keeps
 * its keys in.
 */
public final class Bytes {

    public static final long BASE = 1024L;
    public static final long KB = BASE;
    public static final long MB = KB * BASE;
    public static final long GB = MB * BASE;

    public static boolean equals(byte[] bytes1, byte[] bytes2) {
        return Arrays.equals(bytes1, bytes2);
    }

    public static int compare(byte[] bytes1, byte[] bytes2) {
        E.checkNotNull(bytes1, "bytes1");
        E.checkNotNull(bytes2, "bytes2");
        int length = Math.min(bytes1.length, bytes2.length);
        for (int i = 0; i < length; i++) {
            int a = bytes1[i] & 0xff;
            int b = bytes2[i] & 0xff;
            if (a != b) {
                return a - b;
            }
        }
        return bytes1.length - bytes2.length;
    }

    public static byte[] longToBytes(long value) {
        byte[] bytes = new byte[Long.BYTES];
        for (int i = Long.BYTES - 1; i >= 0; i--) {
            bytes[i] = (byte) value;
            value >>>= 8;
        }
        return bytes;
    }

    public static long bytesToLong(byte[] bytes) {
        E.checkArgument(bytes.length == Long.BYTES,
                        "Expect %s bytes for long, but got %s",
                        Long.BYTES, bytes.length);
        long value = 0L;
        for (byte b : bytes) {
            value = (value << 8) | (b & 0xff);
        }
        return value;
    }

    public static String toHex(byte b) {
        return toHex(new byte[]{b});
    }

    public static String toHex(byte[] bytes) {
        return new String(Hex.encodeHex(bytes));
    }
}
