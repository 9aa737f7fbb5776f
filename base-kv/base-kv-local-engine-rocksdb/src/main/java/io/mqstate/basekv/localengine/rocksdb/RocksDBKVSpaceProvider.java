/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.mqstate.basekv.localengine.rocksdb;

import com.google.protobuf.Struct;
import io.mqstate.basekv.localengine.IKVSpace;
import io.mqstate.basekv.localengine.spi.IKVSpaceProvider;
import java.nio.file.Path;
import org.slf4j.LoggerFactory;

/**
 * Provider for RocksDB space implementation.
 */
public class RocksDBKVSpaceProvider implements IKVSpaceProvider {
    @Override
    public String type() {
        return "rocksdb";
    }

    @Override
    public Struct defaults() {
        return RocksDBDefaultConfigs.DEFAULT;
    }

    @Override
    public IKVSpace create(String id, Path dir, Struct conf) {
        return new RocksDBKVSpace(id, dir.toFile(), conf, LoggerFactory.getLogger(RocksDBKVSpace.class));
    }
}
