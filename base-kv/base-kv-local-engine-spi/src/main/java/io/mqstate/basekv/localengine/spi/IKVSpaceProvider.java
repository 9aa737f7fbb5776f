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

package io.mqstate.basekv.localengine.spi;

import com.google.protobuf.Struct;
import io.mqstate.basekv.localengine.IKVSpace;
import java.nio.file.Path;

/**
 * Service provider for IKVSpace runtime binding.
 */
public interface IKVSpaceProvider {
    /**
     * Engine type identifier used in configuration, such as "rocksdb".
     */
    String type();

    /**
     * The default config of the spaces created by this provider.
     *
     * @return the default config in struct
     */
    Struct defaults();

    /**
     * Create a space stored in the given directory. The space is not opened.
     *
     * @param id   the identity of the space used in logs and metrics
     * @param dir  the directory holding the space data
     * @param conf the complete config
     * @return the space instance
     */
    IKVSpace create(String id, Path dir, Struct conf);
}
