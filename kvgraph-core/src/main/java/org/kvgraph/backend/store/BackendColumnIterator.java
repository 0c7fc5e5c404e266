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

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Iterator over a key range of a partition. It may hold engine resources
 * and must be closed.
 */
public interface BackendColumnIterator extends Iterator<BackendColumn>,
                                               AutoCloseable {

    @Override
    void close();

    static BackendColumnIterator empty() {
        return EMPTY;
    }

    BackendColumnIterator EMPTY = new BackendColumnIterator() {

        @Override
        public boolean hasNext() {
            return false;
        }

        @Override
        public BackendColumn next() {
            throw new NoSuchElementException();
        }

        @Override
        public void close() {
            // pass
        }
    };

    class BackendColumnIteratorWrapper implements BackendColumnIterator {

        private final Iterator<BackendColumn> itor;

        public BackendColumnIteratorWrapper(Iterator<BackendColumn> itor) {
            this.itor = itor;
        }

        @Override
        public boolean hasNext() {
            return this.itor.hasNext();
        }

        @Override
        public BackendColumn next() {
            return this.itor.next();
        }

        @Override
        public void close() {
            // pass
        }
    }
}
