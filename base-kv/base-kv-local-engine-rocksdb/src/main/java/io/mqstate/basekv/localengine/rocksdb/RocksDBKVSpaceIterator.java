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

import com.google.protobuf.ByteString;
import io.mqstate.basekv.localengine.IKVSpaceIterator;
import java.util.concurrent.atomic.AtomicBoolean;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.ReadOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksIterator;
import org.rocksdb.Slice;
import org.rocksdb.Snapshot;

class RocksDBKVSpaceIterator implements IKVSpaceIterator {
    private final RocksIterator rocksIterator;
    private final ReadOptions readOptions;
    private final Slice lowerSlice;
    private final Slice upperSlice;
    private final AtomicBoolean closed = new AtomicBoolean();
    private final CloseListener closeListener;

    RocksDBKVSpaceIterator(RocksDB db,
                           ColumnFamilyHandle cf,
                           Snapshot snapshot,
                           ByteString prefix,
                           CloseListener closeListener) {
        this.closeListener = closeListener;
        readOptions = new ReadOptions().setSnapshot(snapshot);
        byte[] lower = prefix.toByteArray();
        byte[] upper = RocksDBHelper.upperBound(lower);
        lowerSlice = new Slice(lower);
        readOptions.setIterateLowerBound(lowerSlice);
        if (upper != null) {
            upperSlice = new Slice(upper);
            readOptions.setIterateUpperBound(upperSlice);
        } else {
            upperSlice = null;
        }
        rocksIterator = db.newIterator(cf, readOptions);
    }

    @Override
    public ByteString key() {
        return unsafeWrap(rocksIterator.key());
    }

    @Override
    public ByteString value() {
        return unsafeWrap(rocksIterator.value());
    }

    @Override
    public boolean isValid() {
        return rocksIterator.isValid();
    }

    @Override
    public void next() {
        rocksIterator.next();
    }

    @Override
    public void seekToFirst() {
        rocksIterator.seekToFirst();
    }

    @Override
    public void seek(ByteString target) {
        rocksIterator.seek(target.toByteArray());
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            try {
                rocksIterator.close();
                readOptions.close();
                lowerSlice.close();
                if (upperSlice != null) {
                    upperSlice.close();
                }
            } finally {
                closeListener.onClose(this);
            }
        }
    }

    interface CloseListener {
        void onClose(RocksDBKVSpaceIterator itr);
    }
}
