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

import static com.google.protobuf.ByteString.copyFromUtf8;
import static io.mqstate.persistence.store.KVSchemaConstants.CLIENT_TAG;
import static io.mqstate.persistence.store.KVSchemaConstants.INFLIGHT_TAG;
import static io.mqstate.persistence.store.KVSchemaConstants.KIND_INDEX_TAG;
import static io.mqstate.persistence.store.KVSchemaConstants.MESSAGE_TAG;
import static io.mqstate.persistence.store.KVSchemaConstants.RETAINED_TAG;
import static io.mqstate.persistence.store.KVSchemaConstants.SCHEMA_VER;
import static io.mqstate.persistence.store.KVSchemaConstants.SERVER_INFO_TAG;
import static io.mqstate.persistence.store.KVSchemaConstants.SUBSCRIPTION_TAG;

import com.google.protobuf.ByteString;
import io.mqstate.persistence.RecordKind;

/**
 * Key layout of the records kept in the KV space.
 *
 * <pre>
 *   record:     [schema version][container tag][id]
 *   kind index: [schema version]['k'][kind tag][id] -> empty
 * </pre>
 * Server info, clients and subscriptions have a container each. Inflight and retained messages share the message
 * container and are told apart by the kind index.
 */
class KVSchemaUtil {
    static ByteString containerPrefix(RecordKind kind) {
        return SCHEMA_VER.concat(containerTag(kind));
    }

    static ByteString recordKey(RecordKind kind, String id) {
        return containerPrefix(kind).concat(copyFromUtf8(id));
    }

    static ByteString kindIndexPrefix(RecordKind kind) {
        assert kind.isMessage();
        return SCHEMA_VER.concat(KIND_INDEX_TAG).concat(kindTag(kind));
    }

    static ByteString kindIndexKey(RecordKind kind, String id) {
        return kindIndexPrefix(kind).concat(copyFromUtf8(id));
    }

    static String parseId(ByteString prefix, ByteString key) {
        assert key.startsWith(prefix);
        return key.substring(prefix.size()).toStringUtf8();
    }

    private static ByteString containerTag(RecordKind kind) {
        switch (kind) {
            case SERVER_INFO:
                return SERVER_INFO_TAG;
            case CLIENT:
                return CLIENT_TAG;
            case SUBSCRIPTION:
                return SUBSCRIPTION_TAG;
            default:
                return MESSAGE_TAG;
        }
    }

    private static ByteString kindTag(RecordKind kind) {
        return kind == RecordKind.INFLIGHT ? INFLIGHT_TAG : RETAINED_TAG;
    }
}
