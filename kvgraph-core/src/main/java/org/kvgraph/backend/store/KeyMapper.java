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
 * Maps entity ids to backend keys. The same id always maps to the same key
 * in every partition.
 */
public interface KeyMapper {

    /**
     * Get the key to write an entity under, assigning one if needed.
     */
    byte[] encodeKey(String id);

    /**
     * Bulk form of {@link #encodeKey}, aligned with {@code ids}.
     */
    List<byte[]> encodeKeys(List<String> ids);

    /**
     * Get the key of an id without assigning one.
     * @return the key, or null if nothing was ever written under the id
     */
    byte[] lookupKey(String id);

    /**
     * Bulk form of {@link #lookupKey}, aligned with {@code ids}.
     */
    List<byte[]> lookupKeys(List<String> ids);

    /**
     * Get the id a key was assigned to.
     */
    String decodeKey(byte[] key);
}
