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
import java.util.Optional;

/**
 * Point-in-time view of a KV space. All reads of the same reader, including its iterators, observe the state
 * of the space at the moment the reader was created.
 */
public interface IKVSpaceReader extends AutoCloseable {
    String id();

    boolean exist(ByteString key);

    Optional<ByteString> get(ByteString key);

    /**
     * Create an iterator over all keys starting with the given prefix, in byte order.
     *
     * @param prefix the key prefix, empty for the whole space
     * @return the iterator, which must be closed by the caller
     */
    IKVSpaceIterator newIterator(ByteString prefix);

    /**
     * Release the snapshot and every iterator still open on it.
     */
    void close();
}
