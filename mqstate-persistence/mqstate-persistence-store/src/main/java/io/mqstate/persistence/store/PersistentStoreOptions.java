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

package io.mqstate.persistence.store;

import com.google.protobuf.Struct;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import lombok.experimental.Accessors;

@Accessors(chain = true)
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
public class PersistentStoreOptions {
    public static final String DEFAULT_PATH = "mqstate.db";

    @Builder.Default
    private String path = DEFAULT_PATH;
    @Builder.Default
    private Duration lockWaitTimeout = Duration.ofMillis(250);
    @Builder.Default
    private boolean syncWrites = true;
    @Builder.Default
    private long inflightTTLSeconds = 86400;

    // tuning values overlaid on the engine provider's defaults
    @Builder.Default
    private String engineType = "rocksdb";
    @Builder.Default
    private Struct engineConf = Struct.getDefaultInstance();

    /**
     * The data directory, an empty path or "." selects {@link #DEFAULT_PATH}.
     */
    public Path dataPath() {
        if (path == null || path.isEmpty() || ".".equals(path)) {
            return Paths.get(DEFAULT_PATH);
        }
        return Paths.get(path);
    }
}
