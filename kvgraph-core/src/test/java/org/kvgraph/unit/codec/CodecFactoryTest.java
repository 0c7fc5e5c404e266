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

package org.kvgraph.unit.codec;

import org.junit.Test;
import org.kvgraph.codec.BinaryCodec;
import org.kvgraph.codec.Codec;
import org.kvgraph.codec.CodecFactory;
import org.kvgraph.codec.JsonCodec;
import org.kvgraph.codec.SerializationException;
import org.kvgraph.structure.PropertyValue;
import org.kvgraph.testutil.Assert;

public class CodecFactoryTest {

    @Test
    public void testBuiltinCodecs() {
        Assert.assertInstanceOf(BinaryCodec.class, CodecFactory.codec("binary"));
        Assert.assertInstanceOf(JsonCodec.class, CodecFactory.codec("JSON"));
    }

    @Test
    public void testUnknownCodec() {
        Assert.assertThrows(SerializationException.class, () -> {
            CodecFactory.codec("avro");
        }, e -> {
            Assert.assertContains("Not exists codec: avro", e.getMessage());
        });
    }

    @Test
    public void testRegister() {
        CodecFactory.register("reversed", ReversedCodec.class.getName());
        Codec codec = CodecFactory.codec("reversed");
        Assert.assertInstanceOf(ReversedCodec.class, codec);
        PropertyValue value = PropertyValue.ofString("abc");
        Assert.assertEquals(value, codec.decode(codec.encode(value)));

        Assert.assertThrows(SerializationException.class, () -> {
            CodecFactory.register("reversed", ReversedCodec.class.getName());
        }, e -> {
            Assert.assertContains("Exists codec", e.getMessage());
        });
        Assert.assertThrows(SerializationException.class, () -> {
            CodecFactory.register("json", ReversedCodec.class.getName());
        });
    }

    @Test
    public void testRegisterInvalidClass() {
        Assert.assertThrows(SerializationException.class, () -> {
            CodecFactory.register("missing", "org.kvgraph.codec.NoSuchCodec");
        });
        Assert.assertThrows(SerializationException.class, () -> {
            CodecFactory.register("string", String.class.getName());
        }, e -> {
            Assert.assertContains("is not a subclass of class Codec",
                                  e.getMessage());
        });
    }

    public static class ReversedCodec implements Codec {

        private final Codec binary = new BinaryCodec();

        @Override
        public String name() {
            return "reversed";
        }

        @Override
        public byte[] encode(PropertyValue value) {
            return reverse(this.binary.encode(value));
        }

        @Override
        public PropertyValue decode(byte[] bytes) {
            return this.binary.decode(reverse(bytes));
        }

        private static byte[] reverse(byte[] bytes) {
            byte[] reversed = new byte[bytes.length];
            for (int i = 0; i < bytes.length; i++) {
                reversed[i] = bytes[bytes.length - 1 - i];
            }
            return reversed;
        }
    }
}
