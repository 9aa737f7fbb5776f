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

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;

import com.google.protobuf.ByteString;
import io.mqstate.persistence.RecordKind;
import org.testng.annotations.Test;

public class KVSchemaUtilTest {
    @Test
    public void messagesShareContainer() {
        assertEquals(KVSchemaUtil.recordKey(RecordKind.INFLIGHT, "m1"),
            KVSchemaUtil.recordKey(RecordKind.RETAINED, "m1"));
    }

    @Test
    public void containersDisjoint() {
        ByteString clientKey = KVSchemaUtil.recordKey(RecordKind.CLIENT, "id");
        ByteString subKey = KVSchemaUtil.recordKey(RecordKind.SUBSCRIPTION, "id");
        ByteString msgKey = KVSchemaUtil.recordKey(RecordKind.INFLIGHT, "id");
        assertTrue(clientKey.startsWith(KVSchemaUtil.containerPrefix(RecordKind.CLIENT)));
        assertFalse(subKey.startsWith(KVSchemaUtil.containerPrefix(RecordKind.CLIENT)));
        assertFalse(msgKey.startsWith(KVSchemaUtil.containerPrefix(RecordKind.SUBSCRIPTION)));
        assertFalse(KVSchemaUtil.kindIndexKey(RecordKind.INFLIGHT, "id")
            .startsWith(KVSchemaUtil.kindIndexPrefix(RecordKind.RETAINED)));
    }

    @Test
    public void parseId() {
        ByteString prefix = KVSchemaUtil.kindIndexPrefix(RecordKind.RETAINED);
        ByteString key = KVSchemaUtil.kindIndexKey(RecordKind.RETAINED, "topic/消息");
        assertEquals(KVSchemaUtil.parseId(prefix, key), "topic/消息");
    }
}
