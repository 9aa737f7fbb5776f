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

/**
 * A durable, ordered key-value space backed by a local storage engine.
 */
public interface IKVSpace {
    String id();

    /**
     * Open the space, creating it if missing. Opening an already opened space is a no-op.
     *
     * @throws KVSpaceLockedException if another owner holds the space beyond the configured wait
     * @throws KVEngineException      if the space cannot be opened for any other reason
     */
    void open();

    boolean isOpen();

    /**
     * Approximate size of the stored data in bytes.
     *
     * @return the size
     */
    long size();

    IKVSpaceReader reader();

    IKVSpaceWriter writer();

    /**
     * Flush and release the space. Closing more than once has no effect.
     */
    void close();
}
