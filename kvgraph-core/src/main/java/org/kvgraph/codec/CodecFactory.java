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

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class CodecFactory {

    private static final Map<String, Class<? extends Codec>> CODECS;

    static {
        CODECS = new ConcurrentHashMap<>();
    }

    public static Codec codec(String name) {
        name = name.toLowerCase();
        if (name.equals(BinaryCodec.NAME)) {
            return new BinaryCodec();
        } else if (name.equals(JsonCodec.NAME)) {
            return new JsonCodec();
        }

        Class<? extends Codec> clazz = CODECS.get(name);
        if (clazz == null) {
            throw new SerializationException("Not exists codec: %s", name);
        }

        assert Codec.class.isAssignableFrom(clazz);
        try {
            return clazz.getConstructor().newInstance();
        } catch (Exception e) {
            throw new SerializationException("Failed to create codec '%s'",
                                             e, name);
        }
    }

    @SuppressWarnings({ "rawtypes", "unchecked" })
    public static void register(String name, String classPath) {
        ClassLoader classLoader = CodecFactory.class.getClassLoader();
        Class<?> clazz;
        try {
            clazz = classLoader.loadClass(classPath);
        } catch (Exception e) {
            throw new SerializationException("Failed to load codec class " +
                                             "'%s'", e, classPath);
        }

        // Check subclass
        if (!Codec.class.isAssignableFrom(clazz)) {
            throw new SerializationException("Class '%s' is not a subclass " +
                                             "of class Codec", classPath);
        }

        // Check exists
        name = name.toLowerCase();
        if (name.equals(BinaryCodec.NAME) || name.equals(JsonCodec.NAME) ||
            CODECS.containsKey(name)) {
            throw new SerializationException("Exists codec: %s", name);
        }

        // Register class
        CODECS.put(name, (Class) clazz);
    }
}
