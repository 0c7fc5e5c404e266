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

import org.kvgraph.KvGraphException;

/**
 * Thrown when a payload can't be decoded: truncated or corrupt bytes, an
 * unknown type tag, or a record whose shape doesn't match its kind.
 */
public class SerializationException extends KvGraphException {

    private static final long serialVersionUID = 3209452168462309213L;

    public SerializationException(String message) {
        super(message);
    }

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }

    public SerializationException(String message, Object... args) {
        super(message, args);
    }

    public SerializationException(String message, Throwable cause,
                                  Object... args) {
        super(message, cause, args);
    }
}
