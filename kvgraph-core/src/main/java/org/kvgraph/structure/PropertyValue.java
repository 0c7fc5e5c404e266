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

package org.kvgraph.structure;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.kvgraph.util.E;

/**
 * Immutable value of a node or edge property. A property is one of the
 * variants of {@link Type}: lists keep their order, maps keep insertion
 * order but compare as unordered mappings.
 */
public final class PropertyValue {

    public enum Type {

        NULL(0x00),
        BOOLEAN(0x01),
        LONG(0x02),
        DOUBLE(0x03),
        STRING(0x04),
        LIST(0x05),
        MAP(0x06);

        private final byte code;

        Type(int code) {
            assert code < 256;
            this.code = (byte) code;
        }

        public byte code() {
            return this.code;
        }

        public static Type fromCode(byte code) {
            for (Type type : values()) {
                if (type.code == code) {
                    return type;
                }
            }
            return null;
        }
    }

    public static final PropertyValue NULL = new PropertyValue(Type.NULL, null);
    public static final PropertyValue TRUE = new PropertyValue(Type.BOOLEAN,
                                                               true);
    public static final PropertyValue FALSE = new PropertyValue(Type.BOOLEAN,
                                                                false);

    private final Type type;
    private final Object value;

    private PropertyValue(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static PropertyValue ofBoolean(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static PropertyValue ofLong(long value) {
        return new PropertyValue(Type.LONG, value);
    }

    public static PropertyValue ofDouble(double value) {
        return new PropertyValue(Type.DOUBLE, value);
    }

    public static PropertyValue ofString(String value) {
        E.checkNotNull(value, "value");
        return new PropertyValue(Type.STRING, value);
    }

    public static PropertyValue ofList(List<PropertyValue> values) {
        E.checkNotNull(values, "values");
        List<PropertyValue> list = new ArrayList<>(values.size());
        for (PropertyValue value : values) {
            list.add(value == null ? NULL : value);
        }
        return new PropertyValue(Type.LIST, Collections.unmodifiableList(list));
    }

    public static PropertyValue ofMap(Map<String, PropertyValue> values) {
        E.checkNotNull(values, "values");
        Map<String, PropertyValue> map = new LinkedHashMap<>();
        for (Map.Entry<String, PropertyValue> e : values.entrySet()) {
            E.checkArgumentNotNull(e.getKey(),
                                   "The key of map value can't be null");
            map.put(e.getKey(), e.getValue() == null ? NULL : e.getValue());
        }
        return new PropertyValue(Type.MAP, Collections.unmodifiableMap(map));
    }

    /**
     * Wrap a plain java value: integral numbers become LONG, floating
     * numbers DOUBLE, char sequences STRING, collections and arrays LIST,
     * maps MAP (keys converted with {@link String#valueOf}).
     */
    public static PropertyValue of(Object value) {
        if (value == null) {
            return NULL;
        }
        if (value instanceof PropertyValue) {
            return (PropertyValue) value;
        }
        if (value instanceof Boolean) {
            return ofBoolean((Boolean) value);
        }
        if (value instanceof Byte || value instanceof Short ||
            value instanceof Integer || value instanceof Long) {
            return ofLong(((Number) value).longValue());
        }
        if (value instanceof BigInteger) {
            return ofLong(((BigInteger) value).longValueExact());
        }
        if (value instanceof Float || value instanceof Double ||
            value instanceof BigDecimal) {
            return ofDouble(((Number) value).doubleValue());
        }
        if (value instanceof CharSequence || value instanceof Character) {
            return ofString(value.toString());
        }
        if (value instanceof Collection) {
            List<PropertyValue> list = new ArrayList<>();
            for (Object item : (Collection<?>) value) {
                list.add(of(item));
            }
            return ofList(list);
        }
        if (value instanceof Object[]) {
            List<PropertyValue> list = new ArrayList<>();
            for (Object item : (Object[]) value) {
                list.add(of(item));
            }
            return ofList(list);
        }
        if (value instanceof Map) {
            Map<String, PropertyValue> map = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
                map.put(String.valueOf(e.getKey()), of(e.getValue()));
            }
            return ofMap(map);
        }
        throw new IllegalArgumentException(String.format(
                  "Unsupported property value type %s: %s",
                  value.getClass().getName(), value));
    }

    public Type type() {
        return this.type;
    }

    public boolean isNull() {
        return this.type == Type.NULL;
    }

    public boolean asBoolean() {
        this.checkType(Type.BOOLEAN);
        return (Boolean) this.value;
    }

    public long asLong() {
        this.checkType(Type.LONG);
        return (Long) this.value;
    }

    public double asDouble() {
        this.checkType(Type.DOUBLE);
        return (Double) this.value;
    }

    public String asString() {
        this.checkType(Type.STRING);
        return (String) this.value;
    }

    @SuppressWarnings("unchecked")
    public List<PropertyValue> asList() {
        this.checkType(Type.LIST);
        return (List<PropertyValue>) this.value;
    }

    @SuppressWarnings("unchecked")
    public Map<String, PropertyValue> asMap() {
        this.checkType(Type.MAP);
        return (Map<String, PropertyValue>) this.value;
    }

    /**
     * Unwrap to plain java objects, recursively for lists and maps.
     */
    public Object toObject() {
        switch (this.type) {
            case LIST:
                List<Object> list = new ArrayList<>();
                for (PropertyValue item : this.asList()) {
                    list.add(item.toObject());
                }
                return list;
            case MAP:
                Map<String, Object> map = new LinkedHashMap<>();
                for (Map.Entry<String, PropertyValue> e :
                     this.asMap().entrySet()) {
                    map.put(e.getKey(), e.getValue().toObject());
                }
                return map;
            default:
                return this.value;
        }
    }

    private void checkType(Type expected) {
        E.checkState(this.type == expected,
                     "Can't read %s value as %s", this.type, expected);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof PropertyValue)) {
            return false;
        }
        PropertyValue other = (PropertyValue) obj;
        return this.type == other.type &&
               Objects.equals(this.value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.type, this.value);
    }

    @Override
    public String toString() {
        if (this.type == Type.STRING) {
            return "\"" + this.value + "\"";
        }
        return String.valueOf(this.value);
    }
}
