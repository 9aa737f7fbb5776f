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

import com.google.protobuf.ByteString;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Message;
import com.google.protobuf.Parser;
import io.mqstate.persistence.PersistFailureException;
import io.mqstate.persistence.proto.Client;
import io.mqstate.persistence.proto.ServerInfo;
import io.mqstate.persistence.proto.Subscription;

/**
 * Converts a record type from and to the bytes kept in the KV space.
 *
 * @param <T> the record type
 */
final class RecordCodec<T extends Message> {
    static final RecordCodec<ServerInfo> SERVER_INFO = new RecordCodec<>(ServerInfo.parser());
    static final RecordCodec<Client> CLIENT = new RecordCodec<>(Client.parser());
    static final RecordCodec<Subscription> SUBSCRIPTION = new RecordCodec<>(Subscription.parser());
    static final RecordCodec<io.mqstate.persistence.proto.Message> MESSAGE =
        new RecordCodec<>(io.mqstate.persistence.proto.Message.parser());

    private final Parser<T> parser;

    private RecordCodec(Parser<T> parser) {
        this.parser = parser;
    }

    ByteString encode(T record) {
        return record.toByteString();
    }

    T decode(ByteString key, ByteString value) {
        try {
            return parser.parseFrom(value);
        } catch (InvalidProtocolBufferException e) {
            throw new PersistFailureException("Unable to parse record: key=" + key.toStringUtf8(), e);
        }
    }
}
