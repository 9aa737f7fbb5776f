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

import static io.mqstate.basekv.localengine.StructUtil.boolVal;
import static io.mqstate.basekv.localengine.StructUtil.numVal;
import static io.mqstate.basekv.localengine.rocksdb.RocksDBDefaultConfigs.LOCK_RETRY_INTERVAL_MILLIS;
import static io.mqstate.basekv.localengine.rocksdb.RocksDBDefaultConfigs.LOCK_WAIT_TIMEOUT_MILLIS;
import static io.mqstate.basekv.localengine.rocksdb.RocksDBDefaultConfigs.SYNC_WRITES;

import com.google.protobuf.Struct;
import io.mqstate.basekv.localengine.AbstractKVSpace;
import io.mqstate.basekv.localengine.IKVSpaceReader;
import io.mqstate.basekv.localengine.IKVSpaceWriter;
import io.mqstate.basekv.localengine.KVEngineException;
import java.io.File;
import java.nio.file.Files;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.DBOptions;
import org.rocksdb.FlushOptions;
import org.rocksdb.RocksDBException;
import org.rocksdb.WriteOptions;
import org.slf4j.Logger;

class RocksDBKVSpace extends AbstractKVSpace {
    private final Struct conf;
    private final File dbDir;
    private CloseableResources resources;
    private RocksDBHelper.RocksDBHandle dbHandle;
    private WriteOptions writeOptions;

    RocksDBKVSpace(String id, File dbDir, Struct conf, Logger logger, String... tags) {
        super(id, logger, tags);
        this.conf = conf;
        this.dbDir = dbDir;
    }

    @Override
    protected void doOpen() {
        try {
            Files.createDirectories(dbDir.getAbsoluteFile().toPath());
        } catch (Throwable e) {
            throw new KVEngineException("Failed to create dir: " + dbDir, e);
        }
        resources = new CloseableResources();
        try {
            DBOptions dbOptions = resources.track(RocksDBOptionsUtil.buildDBOptions(conf));
            ColumnFamilyDescriptor cfDesc = RocksDBOptionsUtil.buildCFDesc(conf, resources);
            dbHandle = RocksDBHelper.openDBInDir(dbDir, dbOptions, cfDesc,
                (long) numVal(conf, LOCK_WAIT_TIMEOUT_MILLIS),
                (long) numVal(conf, LOCK_RETRY_INTERVAL_MILLIS));
            writeOptions = resources.track(new WriteOptions().setSync(boolVal(conf, SYNC_WRITES)));
            logger.debug("KVSpace[{}] opened at {}", id, dbDir.getAbsolutePath());
        } catch (Throwable e) {
            resources.close();
            throw e;
        }
    }

    @Override
    protected void doClose() {
        try (FlushOptions flushOptions = new FlushOptions().setWaitForFlush(true)) {
            dbHandle.db().flush(flushOptions, dbHandle.cf());
        } catch (RocksDBException e) {
            logger.error("KVSpace[{}] flush before close failed", id, e);
        }
        dbHandle.cf().close();
        try {
            dbHandle.db().closeE();
        } catch (RocksDBException e) {
            logger.error("KVSpace[{}] close failed", id, e);
        } finally {
            resources.close();
        }
        logger.debug("KVSpace[{}] closed", id);
    }

    @Override
    protected long doSize() {
        try {
            return dbHandle.db().getLongProperty(dbHandle.cf(), "rocksdb.estimate-live-data-size")
                + dbHandle.db().getLongProperty(dbHandle.cf(), "rocksdb.cur-size-all-mem-tables");
        } catch (RocksDBException e) {
            throw new KVEngineException("Size estimation failed", e);
        }
    }

    @Override
    protected IKVSpaceReader doReader() {
        return new RocksDBKVSpaceReader(id, dbHandle.db(), dbHandle.cf());
    }

    @Override
    protected IKVSpaceWriter doWriter() {
        return new RocksDBKVSpaceWriter(id, dbHandle.db(), dbHandle.cf(), writeOptions);
    }
}
