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

import io.mqstate.persistence.proto.Message;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Deletes the inflight messages created before a threshold. Messages of unknown creation time are always expired.
 * A message saved again after the sweep's snapshot is deleted only if its current version is still expired. The sweep
 * stops at the first failed deletion, deletions already done are kept.
 */
@Slf4j
class InflightExpirySweeper {
    private final PersistentStore store;

    InflightExpirySweeper(PersistentStore store) {
        this.store = store;
    }

    int sweep(long expiry) {
        List<Message> expired = store.readInflight().stream()
            .filter(msg -> isExpired(msg, expiry))
            .collect(Collectors.toList());
        int deleted = 0;
        for (Message msg : expired) {
            if (store.deleteExpiredInflight(msg.getId(), expiry)) {
                deleted++;
            }
        }
        log.debug("Expired inflight messages deleted: expiry={}, count={}", expiry, deleted);
        return deleted;
    }

    static boolean isExpired(Message msg, long expiry) {
        return msg.getCreated() < expiry || msg.getCreated() == 0;
    }
}
