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

import com.google.protobuf.Struct;
import io.mqstate.basekv.localengine.spi.IKVSpaceProvider;
import java.nio.file.Path;
import java.util.ServiceLoader;

public class KVSpaceFactory {
    public static IKVSpaceProvider findProvider(String type) {
        for (IKVSpaceProvider provider : ServiceLoader.load(IKVSpaceProvider.class)) {
            if (provider.type().equalsIgnoreCase(type)) {
                return provider;
            }
        }
        throw new UnsupportedOperationException("No KVSpaceProvider found for type: " + type);
    }

    /**
     * Create a space of the given engine type, overlaying the supplied config on the provider's defaults.
     *
     * @param type the engine type
     * @param id   the space identity
     * @param dir  the data directory
     * @param conf the partial config
     * @return the unopened space
     */
    public static IKVSpace create(String type, String id, Path dir, Struct conf) {
        IKVSpaceProvider provider = findProvider(type);
        return provider.create(id, dir, StructUtil.merge(provider.defaults(), conf));
    }
}
