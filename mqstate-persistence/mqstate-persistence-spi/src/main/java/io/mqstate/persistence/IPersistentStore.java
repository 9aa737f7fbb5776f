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

import io.mqstate.persistence.proto.Client;
import io.mqstate.persistence.proto.Message;
import io.mqstate.persistence.proto.ServerInfo;
import io.mqstate.persistence.proto.Subscription;
import java.util.List;

/**
 * Durable storage of broker state: server info, client sessions, subscriptions, inflight and retained messages.
 *
 * <p>Every write is atomic on its own, there is no transaction spanning calls. Reads see a snapshot taken when the
 * call starts. All failures are reported as subclasses of {@link PersistenceException}.
 */
public interface IPersistentStore extends AutoCloseable {
    /**
     * Open the store, creating its data directory when missing. Opening an open store does nothing.
     *
     * @throws LockTimeoutException      if another process or handle holds the data directory
     * @throws OpenFailureException      if the data can't be opened
     * @throws StoreUnavailableException if the store has been closed
     */
    void open();

    boolean isOpen();

    /**
     * Close the store and release the data directory. Closing more than once is allowed.
     */
    @Override
    void close();

    void save(ServerInfo serverInfo);

    void save(Client client);

    void save(Subscription subscription);

    /**
     * Insert or replace a message. The message kind decides whether it's an inflight or a retained message, a
     * message saved under an existing id with another kind moves to the new kind.
     *
     * @param message the message, must carry an id and a kind
     */
    void save(Message message);

    /**
     * Delete the record of the kind with the id. Deleting an absent record is not an error.
     *
     * @param kind the record kind
     * @param id   the record id
     */
    void delete(RecordKind kind, String id);

    /**
     * All records of the kind in unspecified order.
     *
     * @param kind the record kind
     * @return the records, empty if there is none
     */
    List<? extends com.google.protobuf.Message> findByKind(RecordKind kind);

    List<Client> readClients();

    List<Subscription> readSubscriptions();

    List<Message> readInflight();

    List<Message> readRetained();

    /**
     * The saved server info, or the default instance if none has been saved.
     */
    ServerInfo readServerInfo();

    /**
     * Delete inflight messages created before the expiry, and those of unknown creation time.
     *
     * @param expiry the threshold in unix seconds
     * @return the number of deleted messages
     */
    int clearExpiredInflight(long expiry);

    /**
     * Delete inflight messages older than the inflight TTL.
     *
     * @return the number of deleted messages
     */
    int clearExpiredInflight();

    /**
     * Set the TTL of inflight messages used by {@link #clearExpiredInflight()}.
     *
     * @param seconds the TTL in seconds, not negative
     */
    void setInflightTTL(long seconds);
}
