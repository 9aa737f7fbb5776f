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

import static com.google.protobuf.UnsafeByteOperations.unsafeWrap;

import com.google.common.collect.Sets;
import com.google.protobuf.ByteString;
import io.mqstate.basekv.localengine.IKVSpaceIterator;
import io.mqstate.basekv.localengine.IKVSpaceReader;
import io.mqstate.basekv.localengine.KVEngineException;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.ReadOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.Snapshot;

class RocksDBKVSpaceReader implements IKVSpaceReader {
    private final String id;
    private final RocksDB db;
    private final ColumnFamilyHandle cf;
    private final Snapshot snapshot;
    private final ReadOptions readOptions;
    private final Set<RocksDBKVSpaceIterator> openedIterators = Sets.newConcurrentHashSet();
    private final AtomicBoolean closed = new AtomicBoolean();

    RocksDBKVSpaceReader(String id, RocksDB db, ColumnFamilyHandle cf) {
        this.id = id;
        this.db = db;
        this.cf = cf;
        this.snapshot = db.getSnapshot();
        this.readOptions = new ReadOptions().setSnapshot(snapshot);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean exist(ByteString key) {
        return get(key).isPresent();
    }

    @Override
    public Optional<ByteString> get(ByteString key) {
        try {
            byte[] data = db.get(cf, readOptions, key.toByteArray());
            return Optional.ofNullable(data == null ? null : unsafeWrap(data));
        } catch (RocksDBException e) {
            throw new KVEngineException("Get failed", e);
        }
    }

    @Override
    public IKVSpaceIterator newIterator(ByteString prefix) {
        RocksDBKVSpaceIterator itr = new RocksDBKVSpaceIterator(db, cf, snapshot, prefix, openedIterators::remove);
        openedIterators.add(itr);
        return itr;
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            openedIterators.forEach(RocksDBKVSpaceIterator::close);
            readOptions.close();
            db.releaseSnapshot(snapshot);
        }
    }
}
