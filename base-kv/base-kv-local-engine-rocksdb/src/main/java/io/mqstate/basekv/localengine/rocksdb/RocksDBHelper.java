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

import io.mqstate.basekv.localengine.KVEngineException;
import io.mqstate.basekv.localengine.KVSpaceLockedException;
import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.DBOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.Status;

class RocksDBHelper {
    static {
        RocksDB.loadLibrary();
    }

    /**
     * Open the database in the given directory. RocksDB refuses to open a directory whose LOCK file is held, so the
     * open is retried until the lock wait is exhausted.
     */
    static RocksDBHandle openDBInDir(File dir,
                                     DBOptions dbOptions,
                                     ColumnFamilyDescriptor cfDesc,
                                     long lockWaitMillis,
                                     long retryIntervalMillis) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(lockWaitMillis);
        while (true) {
            try {
                List<ColumnFamilyHandle> cfHandles = new ArrayList<>();
                RocksDB db = RocksDB.open(dbOptions, dir.getAbsolutePath(), Collections.singletonList(cfDesc),
                    cfHandles);
                assert cfHandles.size() == 1;
                return new RocksDBHandle(db, cfHandles.get(0));
            } catch (RocksDBException e) {
                if (!isLockHeld(e)) {
                    throw new KVEngineException("Open RocksDB at dir failed: " + dir, e);
                }
                long remainingNanos = deadline - System.nanoTime();
                if (remainingNanos <= 0) {
                    throw new KVSpaceLockedException("Lock of RocksDB dir not acquired in "
                        + lockWaitMillis + "ms: " + dir, e);
                }
                try {
                    Thread.sleep(Math.max(1, Math.min(retryIntervalMillis,
                        TimeUnit.NANOSECONDS.toMillis(remainingNanos))));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new KVEngineException("Interrupted while waiting for lock of RocksDB dir: " + dir, ie);
                }
            }
        }
    }

    static boolean isLockHeld(RocksDBException e) {
        Status status = e.getStatus();
        if (status != null && status.getCode() != Status.Code.IOError) {
            return false;
        }
        String msg = e.getMessage();
        return msg != null && msg.toLowerCase(Locale.ROOT).contains("lock");
    }

    /**
     * The smallest key greater than every key prefixed by the given prefix, or null if no such key exists.
     */
    static byte[] upperBound(byte[] prefix) {
        for (int i = prefix.length - 1; i >= 0; i--) {
            if (prefix[i] != (byte) 0xFF) {
                byte[] upper = new byte[i + 1];
                System.arraycopy(prefix, 0, upper, 0, i + 1);
                upper[i]++;
                return upper;
            }
        }
        return null;
    }

    record RocksDBHandle(RocksDB db, ColumnFamilyHandle cf) {
    }
}
