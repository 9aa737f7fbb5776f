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

package io.mqstate.basekv.localengine;

import com.google.protobuf.ByteString;

/**
 * Batched mutations against a KV space. Nothing is visible until {@link #done()} commits the batch, and a
 * committed batch is applied atomically.
 */
public interface IKVSpaceWriter {
    String id();

    IKVSpaceWriter put(ByteString key, ByteString value);

    IKVSpaceWriter delete(ByteString key);

    /**
     * Commit the batch.
     *
     * @throws KVEngineException if the batch could not be persisted
     */
    void done();

    /**
     * Discard the batch.
     */
    void abort();

    /**
     * The number of mutations in the batch.
     *
     * @return the count
     */
    int count();
}
