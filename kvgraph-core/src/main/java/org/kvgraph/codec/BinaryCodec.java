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

package org.kvgraph.codec;

import java.nio.BufferUnderflowException;
import java.nio.charset.CharacterCodingException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.kvgraph.structure.PropertyValue;
import org.kvgraph.util.Bytes;
import org.kvgraph.util.E;

/**
 * Compact binary format: a format byte followed by one tagged value.
 * Longs are var-longs, strings are var-int length prefixed UTF-8, lists
 * and maps are var-int count prefixed.
 */
public class BinaryCodec implements Codec {

    public static final String NAME = "binary";

    private static final byte FORMAT_V1 = 0x01;

    // Max nesting depth of lists and maps accepted by decode
    public static final int MAX_DEPTH = 1000;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public byte[] encode(PropertyValue value) {
        E.checkNotNull(value, "value");
        BytesBuffer buffer = new BytesBuffer();
        buffer.write(FORMAT_V1);
        this.writeValue(buffer, value);
        return buffer.bytes();
    }

    @Override
    public PropertyValue decode(byte[] bytes) {
        E.checkNotNull(bytes, "bytes");
        if (bytes.length == 0) {
            throw new SerializationException("Can't decode empty bytes");
        }
        BytesBuffer buffer = BytesBuffer.wrap(bytes);
        try {
            byte format = buffer.read();
            if (format != FORMAT_V1) {
                throw new SerializationException(
                          "Unsupported binary format '0x%s'",
                          Bytes.toHex(format));
            }
            PropertyValue value = this.readValue(buffer, 1);
            if (buffer.remaining() > 0) {
                throw new SerializationException(
                          "Unexpected %s trailing bytes", buffer.remaining());
            }
            return value;
        } catch (BufferUnderflowException e) {
            throw new SerializationException("Truncated binary payload", e);
        } catch (IllegalArgumentException | CharacterCodingException e) {
            throw new SerializationException("Corrupt binary payload: %s",
                                             e, e.getMessage());
        }
    }

    private void writeValue(BytesBuffer buffer, PropertyValue value) {
        buffer.write(value.type().code());
        switch (value.type()) {
            case NULL:
                break;
            case BOOLEAN:
                buffer.writeBoolean(value.asBoolean());
                break;
            case LONG:
                buffer.writeVLong(value.asLong());
                break;
            case DOUBLE:
                buffer.writeDouble(value.asDouble());
                break;
            case STRING:
                buffer.writeString(value.asString());
                break;
            case LIST:
                List<PropertyValue> list = value.asList();
                buffer.writeVInt(list.size());
                for (PropertyValue item : list) {
                    this.writeValue(buffer, item);
                }
                break;
            case MAP:
                Map<String, PropertyValue> map = value.asMap();
                buffer.writeVInt(map.size());
                for (Map.Entry<String, PropertyValue> e : map.entrySet()) {
                    buffer.writeString(e.getKey());
                    this.writeValue(buffer, e.getValue());
                }
                break;
            default:
                throw new AssertionError("Unknown value type " + value.type());
        }
    }

    private PropertyValue readValue(BytesBuffer buffer, int depth)
                                    throws CharacterCodingException {
        if (depth > MAX_DEPTH) {
            throw new SerializationException(
                      "Nesting depth exceeds the limit %s", MAX_DEPTH);
        }
        byte code = buffer.read();
        PropertyValue.Type type = PropertyValue.Type.fromCode(code);
        if (type == null) {
            throw new SerializationException("Unknown value type tag '0x%s'",
                                             Bytes.toHex(code));
        }
        switch (type) {
            case NULL:
                return PropertyValue.NULL;
            case BOOLEAN:
                return PropertyValue.ofBoolean(buffer.readBoolean());
            case LONG:
                return PropertyValue.ofLong(buffer.readVLong());
            case DOUBLE:
                return PropertyValue.ofDouble(buffer.readDouble());
            case STRING:
                return PropertyValue.ofString(buffer.readString());
            case LIST:
                int size = this.readCount(buffer);
                List<PropertyValue> list = new ArrayList<>(size);
                for (int i = 0; i < size; i++) {
                    list.add(this.readValue(buffer, depth + 1));
                }
                return PropertyValue.ofList(list);
            case MAP:
                int count = this.readCount(buffer);
                Map<String, PropertyValue> map = new LinkedHashMap<>();
                for (int i = 0; i < count; i++) {
                    String key = buffer.readString();
                    map.put(key, this.readValue(buffer, depth + 1));
                }
                return PropertyValue.ofMap(map);
            default:
                throw new AssertionError("Unknown value type " + type);
        }
    }

    private int readCount(BytesBuffer buffer) {
        int count = buffer.readVInt();
        // Every item takes one byte at least
        if (count < 0 || count > buffer.remaining()) {
            throw new SerializationException(
                      "Invalid item count %s, remaining %s bytes",
                      count, buffer.remaining());
        }
        return count;
    }
}
