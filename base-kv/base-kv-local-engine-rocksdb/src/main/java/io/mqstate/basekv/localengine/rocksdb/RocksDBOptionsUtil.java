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

import static io.mqstate.basekv.localengine.StructUtil.numVal;
import static io.mqstate.basekv.localengine.rocksdb.RocksDBDefaultConfigs.BLOCK_CACHE_SIZE;
import static io.mqstate.basekv.localengine.rocksdb.RocksDBDefaultConfigs.LEVEL0_FILE_NUM_COMPACTION_TRIGGER;
import static io.mqstate.basekv.localengine.rocksdb.RocksDBDefaultConfigs.MAX_BACKGROUND_JOBS;
import static io.mqstate.basekv.localengine.rocksdb.RocksDBDefaultConfigs.MAX_OPEN_FILES;
import static io.mqstate.basekv.localengine.rocksdb.RocksDBDefaultConfigs.MAX_WRITE_BUFFER_NUMBER;
import static io.mqstate.basekv.localengine.rocksdb.RocksDBDefaultConfigs.WRITE_BUFFER_SIZE;

import com.google.protobuf.Struct;
import org.rocksdb.BlockBasedTableConfig;
import org.rocksdb.BloomFilter;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyOptions;
import org.rocksdb.CompactionStyle;
import org.rocksdb.CompressionType;
import org.rocksdb.DBOptions;
import org.rocksdb.Env;
import org.rocksdb.LRUCache;
import org.rocksdb.RocksDB;
import org.rocksdb.util.SizeUnit;

/**
 * Build RocksDB options from Struct configuration.
 */
final class RocksDBOptionsUtil {
    static DBOptions buildDBOptions(Struct conf) {
        return new DBOptions()
            .setEnv(Env.getDefault())
            .setCreateIfMissing(true)
            .setCreateMissingColumnFamilies(true)
            .setMaxManifestFileSize(64 * SizeUnit.MB)
            // info log file settings
            .setMaxLogFileSize(16 * SizeUnit.MB)
            .setKeepLogFileNum(4)
            .setMaxOpenFiles((int) numVal(conf, MAX_OPEN_FILES))
            .setMaxBackgroundJobs((int) numVal(conf, MAX_BACKGROUND_JOBS))
            .setAllowConcurrentMemtableWrite(true)
            .setBytesPerSync(1048576);
    }

    static ColumnFamilyDescriptor buildCFDesc(Struct conf, CloseableResources resources) {
        ColumnFamilyOptions cfOptions = resources.track(new ColumnFamilyOptions());
        LRUCache blockCache = resources.track(new LRUCache((long) numVal(conf, BLOCK_CACHE_SIZE), 4));
        BloomFilter bloomFilter = resources.track(new BloomFilter(10, false));
        cfOptions
            .setTableFormatConfig(new BlockBasedTableConfig()
                .setFilterPolicy(bloomFilter)
                .setCacheIndexAndFilterBlocks(true)
                .setPinL0FilterAndIndexBlocksInCache(true)
                .setBlockSize(4 * SizeUnit.KB)
                .setBlockCache(blockCache))
            // https://github.com/facebook/rocksdb/pull/5744
            .setForceConsistencyChecks(true)
            .setCompactionStyle(CompactionStyle.LEVEL)
            .setCompressionType(CompressionType.LZ4_COMPRESSION)
            .setBottommostCompressionType(CompressionType.ZSTD_COMPRESSION)
            .setWriteBufferSize((long) numVal(conf, WRITE_BUFFER_SIZE))
            .setMaxWriteBufferNumber((int) numVal(conf, MAX_WRITE_BUFFER_NUMBER))
            .setLevel0FileNumCompactionTrigger((int) numVal(conf, LEVEL0_FILE_NUM_COMPACTION_TRIGGER));
        return new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY, cfOptions);
    }

    private RocksDBOptionsUtil() {
    }
}
