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

import com.google.protobuf.ByteString;
import io.mqstate.basekv.localengine.IKVSpaceWriter;
import io.mqstate.basekv.localengine.KVEngineException;
import lombok.extern.slf4j.Slf4j;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;

@Slf4j
class RocksDBKVSpaceWriter implements IKVSpaceWriter {
    private final String id;
    private final RocksDB db;
    private final ColumnFamilyHandle cf;
    private final WriteOptions writeOptions;
    private final WriteBatch batch;

    RocksDBKVSpaceWriter(String id, RocksDB db, ColumnFamilyHandle cf, WriteOptions writeOptions) {
        this.id = id;
        this.db = db;
        this.cf = cf;
        this.writeOptions = writeOptions;
        this.batch = new WriteBatch();
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public IKVSpaceWriter put(ByteString key, ByteString value) {
        try {
            batch.put(cf, key.toByteArray(), value.toByteArray());
            return this;
        } catch (RocksDBException e) {
            throw new KVEngineException("Put in batch failed", e);
        }
    }

    @Override
    public IKVSpaceWriter delete(ByteString key) {
        try {
            batch.delete(cf, key.toByteArray());
            return this;
        } catch (RocksDBException e) {
            throw new KVEngineException("Delete in batch failed", e);
        }
    }

    @Override
    public void done() {
        try {
            db.write(writeOptions, batch);
        } catch (Throwable e) {
            log.error("KVSpace[{}] write batch commit failed", id, e);
            throw new KVEngineException("Batch commit failed", e);
        } finally {
            batch.close();
        }
    }

    @Override
    public void abort() {
        batch.close();
    }

    @Override
    public int count() {
        return batch.count();
    }
}
