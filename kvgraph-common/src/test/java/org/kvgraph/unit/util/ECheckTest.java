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

package org.kvgraph.unit.util;

import java.util.Collections;

import org.junit.Test;
import org.kvgraph.testutil.Assert;
import org.kvgraph.util.E;

public class ECheckTest {

    @Test
    public void testCheckNotNull() {
        E.checkNotNull("value", "elem");
        Assert.assertThrows(NullPointerException.class, () -> {
            E.checkNotNull(null, "id", "node");
        }, e -> {
            Assert.assertEquals("The 'id' of 'node' can't be null",
                                e.getMessage());
        });
    }

    @Test
    public void testCheckArgumentAndState() {
        Assert.assertThrows(IllegalArgumentException.class, () -> {
            E.checkArgument(false, "Invalid key '%s'", "k1");
        }, e -> {
            Assert.assertEquals("Invalid key 'k1'", e.getMessage());
        });
        Assert.assertThrows(IllegalArgumentException.class, () -> {
            E.checkNotEmpty(Collections.emptyList(), "ids");
        });
        Assert.assertThrows(IllegalStateException.class, () -> {
            E.checkState(false, "Store '%s' is closed", "memory");
        }, e -> {
            Assert.assertEquals("Store 'memory' is closed", e.getMessage());
        });
    }
}
