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

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.kvgraph.structure.PropertyValue;
import org.kvgraph.util.E;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * UTF-8 JSON text through the Jackson tree model. Integral numbers decode
 * as LONG and fractional ones as DOUBLE, non-finite doubles are written as
 * the bare tokens NaN and Infinity.
 */
public class JsonCodec implements Codec {

    public static final String NAME = "json";

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .disable(JsonWriteFeature.WRITE_NAN_AS_STRINGS)
            .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public byte[] encode(PropertyValue value) {
        E.checkNotNull(value, "value");
        try {
            return MAPPER.writeValueAsBytes(toJson(value));
        } catch (JsonProcessingException e) {
            throw new SerializationException("Can't write json: %s",
                                             e, e.getMessage());
        }
    }

    @Override
    public PropertyValue decode(byte[] bytes) {
        E.checkNotNull(bytes, "bytes");
        JsonNode node;
        try {
            node = MAPPER.readTree(bytes);
        } catch (IOException e) {
            throw new SerializationException("Can't read json: %s",
                                             e, e.getMessage());
        }
        if (node == null || node.isMissingNode()) {
            throw new SerializationException("Can't read json from empty " +
                                             "content");
        }
        return fromJson(node);
    }

    private static JsonNode toJson(PropertyValue value) {
        switch (value.type()) {
            case NULL:
                return NODES.nullNode();
            case BOOLEAN:
                return NODES.booleanNode(value.asBoolean());
            case LONG:
                return NODES.numberNode(value.asLong());
            case DOUBLE:
                return NODES.numberNode(value.asDouble());
            case STRING:
                return NODES.textNode(value.asString());
            case LIST:
                ArrayNode array = NODES.arrayNode();
                for (PropertyValue item : value.asList()) {
                    array.add(toJson(item));
                }
                return array;
            case MAP:
                ObjectNode object = NODES.objectNode();
                for (Map.Entry<String, PropertyValue> e :
                     value.asMap().entrySet()) {
                    object.set(e.getKey(), toJson(e.getValue()));
                }
                return object;
            default:
                throw new AssertionError("Unknown value type " + value.type());
        }
    }

    private static PropertyValue fromJson(JsonNode node) {
        if (node.isNull()) {
            return PropertyValue.NULL;
        } else if (node.isBoolean()) {
            return PropertyValue.ofBoolean(node.booleanValue());
        } else if (node.isIntegralNumber()) {
            if (!node.canConvertToLong()) {
                throw new SerializationException(
                          "Integral number out of long range: %s", node);
            }
            return PropertyValue.ofLong(node.longValue());
        } else if (node.isNumber()) {
            return PropertyValue.ofDouble(node.doubleValue());
        } else if (node.isTextual()) {
            return PropertyValue.ofString(node.textValue());
        } else if (node.isArray()) {
            List<PropertyValue> list = new ArrayList<>(node.size());
            for (JsonNode item : node) {
                list.add(fromJson(item));
            }
            return PropertyValue.ofList(list);
        } else if (node.isObject()) {
            Map<String, PropertyValue> map = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                map.put(field.getKey(), fromJson(field.getValue()));
            }
            return PropertyValue.ofMap(map);
        }
        throw new SerializationException("Unsupported json node type %s",
                                         node.getNodeType());
    }
}
