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

import static io.mqstate.basekv.localengine.StructUtil.toValue;

import com.google.protobuf.Struct;
import org.rocksdb.util.SizeUnit;

/**
 * Default configuration constants for RocksDB backed spaces.
 */
public final class RocksDBDefaultConfigs {
    public static final String LOCK_WAIT_TIMEOUT_MILLIS = "lockWaitTimeoutMillis";
    public static final String LOCK_RETRY_INTERVAL_MILLIS = "lockRetryIntervalMillis";
    public static final String SYNC_WRITES = "syncWrites";
    public static final String BLOCK_CACHE_SIZE = "blockCacheSize";
    public static final String WRITE_BUFFER_SIZE = "writeBufferSize";
    public static final String MAX_WRITE_BUFFER_NUMBER = "maxWriteBufferNumber";
    public static final String MAX_BACKGROUND_JOBS = "maxBackgroundJobs";
    public static final String LEVEL0_FILE_NUM_COMPACTION_TRIGGER = "level0FileNumCompactionTrigger";
    public static final String MAX_OPEN_FILES = "maxOpenFiles";
    public static final Struct DEFAULT;

    static {
        Struct.Builder configBuilder = Struct.newBuilder();
        configBuilder.putFields(LOCK_WAIT_TIMEOUT_MILLIS, toValue(250));
        configBuilder.putFields(LOCK_RETRY_INTERVAL_MILLIS, toValue(10));
        configBuilder.putFields(SYNC_WRITES, toValue(true));
        configBuilder.putFields(BLOCK_CACHE_SIZE, toValue(8 * SizeUnit.MB));
        configBuilder.putFields(WRITE_BUFFER_SIZE, toValue(16 * SizeUnit.MB));
        configBuilder.putFields(MAX_WRITE_BUFFER_NUMBER, toValue(4));
        configBuilder.putFields(MAX_BACKGROUND_JOBS,
            toValue(Math.max(Runtime.getRuntime().availableProcessors() / 4, 2)));
        configBuilder.putFields(LEVEL0_FILE_NUM_COMPACTION_TRIGGER, toValue(4));
        configBuilder.putFields(MAX_OPEN_FILES, toValue(256));
        DEFAULT = configBuilder.build();
    }

    private RocksDBDefaultConfigs() {
    }
}
