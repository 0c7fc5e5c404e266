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

package org.kvgraph.unit.rocksdb;

import java.io.File;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.BeforeClass;
import org.kvgraph.RegisterUtil;
import org.kvgraph.config.GraphConfig;
import org.kvgraph.util.StringEncoding;

public class BaseRocksDBUnitTest {

    private static final String TMP_DIR = System.getProperty("java.io.tmpdir");

    protected String dataPath;

    @BeforeClass
    public static void init() {
        RegisterUtil.registerCore();
        RegisterUtil.registerRocksDB();
    }

    @Before
    public void setupDataPath() throws IOException {
        File dir = new File(TMP_DIR, "kvgraph-rocksdb-" + System.nanoTime());
        FileUtils.forceMkdir(dir);
        this.dataPath = dir.getAbsolutePath();
    }

    @After
    public void clearDataPath() throws IOException {
        /*
         * The FileUtils.forceDelete() can only accept a `File`
         * in `org.apache.commons.io` version 2.4
         */
        FileUtils.forceDelete(FileUtils.getFile(this.dataPath));
    }

    protected GraphConfig config(Object... keyValues) {
        Map<String, Object> properties = new HashMap<>();
        properties.put("backend", "rocksdb");
        properties.put("store", "graph");
        properties.put("rocksdb.data_path", this.dataPath);
        properties.put("rocksdb.compression", "none");
        for (int i = 0; i < keyValues.length; i += 2) {
            properties.put((String) keyValues[i], keyValues[i + 1]);
        }
        return new GraphConfig(properties);
    }

    protected static byte[] b(String str) {
        return StringEncoding.encode(str);
    }

    protected static String s(byte[] bytes) {
        return bytes == null ? null : StringEncoding.decode(bytes);
    }
}
