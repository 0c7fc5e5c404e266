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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Computes the new properties of an updated element from its current
 * properties and the data passed to the update. Implementations must not
 * modify either argument.
 */
@FunctionalInterface
public interface MergeStrategy {

    /**
     * Current properties overlaid with the new data, new values win.
     */
    MergeStrategy OVERWRITE = (oldProperties, newData) -> {
        Map<String, PropertyValue> merged = new LinkedHashMap<>(oldProperties);
        merged.putAll(newData);
        return merged;
    };

    /**
     * Only keys absent from the current properties are taken from the new
     * data.
     */
    MergeStrategy KEEP_EXISTING = (oldProperties, newData) -> {
        Map<String, PropertyValue> merged = new LinkedHashMap<>(oldProperties);
        for (Map.Entry<String, PropertyValue> e : newData.entrySet()) {
            merged.putIfAbsent(e.getKey(), e.getValue());
        }
        return merged;
    };

    /**
     * The new data replaces all current properties.
     */
    MergeStrategy REPLACE = (oldProperties, newData) -> {
        return new LinkedHashMap<>(newData);
    };

    Map<String, PropertyValue> merge(Map<String, PropertyValue> oldProperties,
                                     Map<String, PropertyValue> newData);
}
