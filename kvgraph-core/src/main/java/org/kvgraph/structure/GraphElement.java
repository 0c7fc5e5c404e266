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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.kvgraph.util.E;

public abstract class GraphElement {

    private final String id;
    private final Map<String, PropertyValue> properties;

    protected GraphElement(String id) {
        E.checkArgument(id != null && !id.isEmpty(),
                        "The id of %s can't be null or empty",
                        this.getClass().getSimpleName().toLowerCase());
        this.id = id;
        this.properties = new LinkedHashMap<>();
    }

    public String id() {
        return this.id;
    }

    public PropertyValue property(String key) {
        return this.properties.get(key);
    }

    public GraphElement property(String key, Object value) {
        E.checkNotNull(key, "property key");
        this.properties.put(key, PropertyValue.of(value));
        return this;
    }

    public Map<String, PropertyValue> properties() {
        return Collections.unmodifiableMap(this.properties);
    }

    /**
     * Replace all properties of this element.
     */
    public void properties(Map<String, ?> properties) {
        E.checkNotNull(properties, "properties");
        this.properties.clear();
        for (Map.Entry<String, ?> e : properties.entrySet()) {
            this.property(e.getKey(), e.getValue());
        }
    }
}
