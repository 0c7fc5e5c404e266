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

import java.util.ArrayList;
import java.util.List;

import org.kvgraph.util.E;
import org.kvgraph.util.StringEncoding;

/**
 * Uses the UTF-8 bytes of the id as the key.
 */
public class RawKeyMapper implements KeyMapper {

    public static final RawKeyMapper INSTANCE = new RawKeyMapper();

    @Override
    public byte[] encodeKey(String id) {
        E.checkNotNull(id, "id");
        return StringEncoding.encode(id);
    }

    @Override
    public List<byte[]> encodeKeys(List<String> ids) {
        List<byte[]> keys = new ArrayList<>(ids.size());
        for (String id : ids) {
            keys.add(this.encodeKey(id));
        }
        return keys;
    }

    @Override
    public byte[] lookupKey(String id) {
        return this.encodeKey(id);
    }

    @Override
    public List<byte[]> lookupKeys(List<String> ids) {
        return this.encodeKeys(ids);
    }

    @Override
    public String decodeKey(byte[] key) {
        E.checkNotNull(key, "key");
        return StringEncoding.decode(key);
    }
}
