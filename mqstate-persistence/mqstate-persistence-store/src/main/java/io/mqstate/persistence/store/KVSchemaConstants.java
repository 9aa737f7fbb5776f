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

import static com.google.protobuf.UnsafeByteOperations.unsafeWrap;

import com.google.protobuf.ByteString;

class KVSchemaConstants {
    static final ByteString SCHEMA_VER = unsafeWrap(new byte[] {0x00});
    static final ByteString SERVER_INFO_TAG = unsafeWrap(new byte[] {'s'});
    static final ByteString CLIENT_TAG = unsafeWrap(new byte[] {'c'});
    static final ByteString SUBSCRIPTION_TAG = unsafeWrap(new byte[] {'u'});
    static final ByteString MESSAGE_TAG = unsafeWrap(new byte[] {'m'});
    static final ByteString KIND_INDEX_TAG = unsafeWrap(new byte[] {'k'});
    static final ByteString INFLIGHT_TAG = unsafeWrap(new byte[] {'i'});
    static final ByteString RETAINED_TAG = unsafeWrap(new byte[] {'r'});
    static final String SERVER_INFO_ID = "srv";
}
