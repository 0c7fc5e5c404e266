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

package org.kvgraph.unit.adjacency;

import org.junit.Test;
import org.kvgraph.adjacency.AdjacencyRecord;
import org.kvgraph.adjacency.Directions;
import org.kvgraph.testutil.Assert;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

public class DirectionsTest {

    @Test
    public void testFromString() {
        Assert.assertEquals(Directions.FORWARD, Directions.fromString("out"));
        Assert.assertEquals(Directions.FORWARD,
                            Directions.fromString("forward"));
        Assert.assertEquals(Directions.BACKWARD, Directions.fromString("IN"));
        Assert.assertEquals(Directions.ANY, Directions.fromString("both"));
        Assert.assertEquals(Directions.ANY, Directions.fromString("any"));

        Assert.assertThrows(IllegalArgumentException.class, () -> {
            Directions.fromString("sideways");
        });
    }

    @Test
    public void testRecordEdgesByDirection() {
        AdjacencyRecord record = new AdjacencyRecord(
                                 ImmutableList.of("e1", "loop"),
                                 ImmutableList.of("e2", "loop"));
        Assert.assertEquals(ImmutableSet.of("e1", "loop"),
                            record.edges(Directions.FORWARD));
        Assert.assertEquals(ImmutableSet.of("e2", "loop"),
                            record.edges(Directions.BACKWARD));
        Assert.assertEquals(ImmutableList.of("e1", "loop", "e2"),
                            ImmutableList.copyOf(
                            record.edges(Directions.ANY)));
    }

    @Test
    public void testRecordMerge() {
        AdjacencyRecord record = new AdjacencyRecord();
        Assert.assertTrue(record.empty());
        Assert.assertTrue(record.merge(new AdjacencyRecord(
                                       ImmutableList.of("e1"),
                                       ImmutableList.of())));
        Assert.assertFalse(record.merge(new AdjacencyRecord(
                                        ImmutableList.of("e1"),
                                        ImmutableList.of())));
        Assert.assertFalse(record.empty());
        Assert.assertTrue(record.removeOutgoing("e1"));
        Assert.assertFalse(record.removeIncoming("e1"));
        Assert.assertTrue(record.empty());
    }
}
