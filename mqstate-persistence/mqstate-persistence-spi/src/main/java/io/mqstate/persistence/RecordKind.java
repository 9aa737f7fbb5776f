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

package io.mqstate.persistence;

import io.mqstate.persistence.proto.MessageKind;

/**
 * The kinds of records kept by the persistent store.
 */
public enum RecordKind {
    SERVER_INFO(null),
    CLIENT(null),
    SUBSCRIPTION(null),
    INFLIGHT(MessageKind.INFLIGHT),
    RETAINED(MessageKind.RETAINED);

    private final MessageKind messageKind;

    RecordKind(MessageKind messageKind) {
        this.messageKind = messageKind;
    }

    /**
     * The message discriminator of this kind, or null if records of this kind are not messages.
     */
    public MessageKind messageKind() {
        return messageKind;
    }

    public boolean isMessage() {
        return messageKind != null;
    }

    public static RecordKind of(MessageKind messageKind) {
        switch (messageKind) {
            case INFLIGHT:
                return INFLIGHT;
            case RETAINED:
                return RETAINED;
            default:
                throw new IllegalArgumentException("Not a persistable message kind: " + messageKind);
        }
    }
}
