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

import static com.google.common.base.Preconditions.checkArgument;
import static io.mqstate.persistence.store.KVSchemaConstants.SERVER_INFO_ID;
import static io.mqstate.persistence.store.KVSchemaUtil.containerPrefix;
import static io.mqstate.persistence.store.KVSchemaUtil.kindIndexKey;
import static io.mqstate.persistence.store.KVSchemaUtil.kindIndexPrefix;
import static io.mqstate.persistence.store.KVSchemaUtil.parseId;
import static io.mqstate.persistence.store.KVSchemaUtil.recordKey;

import com.google.common.util.concurrent.Striped;
import com.google.protobuf.ByteString;
import com.google.protobuf.Struct;
import io.micrometer.core.instrument.Timer;
import io.mqstate.basekv.localengine.IKVSpace;
import io.mqstate.basekv.localengine.IKVSpaceIterator;
import io.mqstate.basekv.localengine.IKVSpaceReader;
import io.mqstate.basekv.localengine.IKVSpaceWriter;
import io.mqstate.basekv.localengine.KVEngineException;
import io.mqstate.basekv.localengine.KVSpaceFactory;
import io.mqstate.basekv.localengine.KVSpaceLockedException;
import io.mqstate.basekv.localengine.StructUtil;
import io.mqstate.basekv.localengine.rocksdb.RocksDBDefaultConfigs;
import io.mqstate.persistence.IPersistentStore;
import io.mqstate.persistence.LockTimeoutException;
import io.mqstate.persistence.OpenFailureException;
import io.mqstate.persistence.PersistFailureException;
import io.mqstate.persistence.RecordKind;
import io.mqstate.persistence.StoreUnavailableException;
import io.mqstate.persistence.proto.Client;
import io.mqstate.persistence.proto.Message;
import io.mqstate.persistence.proto.ServerInfo;
import io.mqstate.persistence.proto.Subscription;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Persistent store backed by an embedded KV space.
 *
 * <p>Data operations run concurrently under the read side of the lifecycle lock, open and close take the write side.
 * Writes to the same message id are serialized so the kind index is maintained with the record in one batch.
 */
@Slf4j
public class PersistentStore implements IPersistentStore {
    static final String SPACE_ID = "mqstate";

    private final PersistentStoreOptions options;
    private final String path;
    private final IKVSpace kvSpace;
    private final Clock clock;
    private final ReadWriteLock lifecycleLock = new ReentrantReadWriteLock();
    private final Striped<Lock> idLocks = Striped.lock(64);
    private final InflightExpirySweeper sweeper = new InflightExpirySweeper(this);
    private volatile long inflightTTLSeconds;
    private volatile State state = State.INIT;
    private PersistentStoreMeters meters;

    public PersistentStore(PersistentStoreOptions options) {
        this(options, KVSpaceFactory.create(options.getEngineType(), SPACE_ID, options.dataPath(), engineConf(options)),
            Clock.systemUTC());
    }

    PersistentStore(PersistentStoreOptions options, IKVSpace kvSpace, Clock clock) {
        checkArgument(options.getInflightTTLSeconds() >= 0, "Inflight TTL must not be negative");
        this.options = options;
        this.path = options.dataPath().toAbsolutePath().toString();
        this.kvSpace = kvSpace;
        this.clock = clock;
        this.inflightTTLSeconds = options.getInflightTTLSeconds();
    }

    private static Struct engineConf(PersistentStoreOptions options) {
        // only engines which know the keys get them
        Struct defaults = KVSpaceFactory.findProvider(options.getEngineType()).defaults();
        Struct.Builder conf = options.getEngineConf().toBuilder();
        if (defaults.containsFields(RocksDBDefaultConfigs.LOCK_WAIT_TIMEOUT_MILLIS)) {
            conf.putFields(RocksDBDefaultConfigs.LOCK_WAIT_TIMEOUT_MILLIS,
                StructUtil.toValue(options.getLockWaitTimeout().toMillis()));
        }
        if (defaults.containsFields(RocksDBDefaultConfigs.SYNC_WRITES)) {
            conf.putFields(RocksDBDefaultConfigs.SYNC_WRITES, StructUtil.toValue(options.isSyncWrites()));
        }
        return conf.build();
    }

    @Override
    public void open() {
        lifecycleLock.writeLock().lock();
        try {
            switch (state) {
                case OPEN:
                    return;
                case CLOSED:
                    throw new StoreUnavailableException("Persistent store has been closed: path=" + path);
                default:
                    break;
            }
            try {
                kvSpace.open();
            } catch (KVSpaceLockedException e) {
                throw new LockTimeoutException("Persistent store is locked by another owner: path=" + path
                    + ", lockWaitTimeout=" + options.getLockWaitTimeout(), e);
            } catch (KVEngineException e) {
                throw new OpenFailureException("Failed to open persistent store: path=" + path, e);
            }
            meters = new PersistentStoreMeters(path);
            state = State.OPEN;
            log.info("Persistent store opened: path={}", path);
        } finally {
            lifecycleLock.writeLock().unlock();
        }
    }

    @Override
    public boolean isOpen() {
        return state == State.OPEN;
    }

    @Override
    public void close() {
        lifecycleLock.writeLock().lock();
        try {
            if (state == State.CLOSED) {
                return;
            }
            boolean wasOpen = state == State.OPEN;
            state = State.CLOSED;
            if (wasOpen) {
                meters.close();
                try {
                    kvSpace.close();
                } catch (KVEngineException e) {
                    throw new PersistFailureException("Failed to close persistent store: path=" + path, e);
                }
                log.info("Persistent store closed: path={}", path);
            }
        } finally {
            lifecycleLock.writeLock().unlock();
        }
    }

    @Override
    public void save(ServerInfo serverInfo) {
        call("save server info", () -> meters.saveCallTimer, () -> {
            // the stored id is always the singleton's
            ServerInfo stored = serverInfo.toBuilder().setId(SERVER_INFO_ID).build();
            write(writer -> writer.put(recordKey(RecordKind.SERVER_INFO, SERVER_INFO_ID),
                RecordCodec.SERVER_INFO.encode(stored)));
            return null;
        });
    }

    @Override
    public void save(Client client) {
        call("save client", () -> meters.saveCallTimer, () -> {
            checkArgument(!client.getId().isEmpty(), "Client id must not be empty");
            write(writer -> writer.put(recordKey(RecordKind.CLIENT, client.getId()),
                RecordCodec.CLIENT.encode(client)));
            return null;
        });
    }

    @Override
    public void save(Subscription subscription) {
        call("save subscription", () -> meters.saveCallTimer, () -> {
            checkArgument(!subscription.getId().isEmpty(), "Subscription id must not be empty");
            write(writer -> writer.put(recordKey(RecordKind.SUBSCRIPTION, subscription.getId()),
                RecordCodec.SUBSCRIPTION.encode(subscription)));
            return null;
        });
    }

    @Override
    public void save(Message message) {
        call("save message", () -> meters.saveCallTimer, () -> {
            checkArgument(!message.getId().isEmpty(), "Message id must not be empty");
            RecordKind kind = RecordKind.of(message.getKind());
            String id = message.getId();
            Lock idLock = idLocks.get(id);
            idLock.lock();
            try {
                ByteString recordKey = recordKey(kind, id);
                Optional<Message> prev = readMessage(recordKey);
                write(writer -> {
                    prev.filter(m -> m.getKind() != message.getKind())
                        .ifPresent(m -> writer.delete(kindIndexKey(RecordKind.of(m.getKind()), id)));
                    writer.put(recordKey, RecordCodec.MESSAGE.encode(message))
                        .put(kindIndexKey(kind, id), ByteString.EMPTY);
                });
                if (prev.isPresent() && prev.get().getKind() != message.getKind()) {
                    log.debug("Message kind changed: id={}, from={}, to={}", id, prev.get().getKind(),
                        message.getKind());
                }
            } finally {
                idLock.unlock();
            }
            return null;
        });
    }

    @Override
    public void delete(RecordKind kind, String id) {
        call("delete " + kind, () -> meters.deleteCallTimer, () -> {
            if (!kind.isMessage()) {
                write(writer -> writer.delete(recordKey(kind, id)));
                return null;
            }
            deleteMessageIf(kind, id, stored -> true);
            return null;
        });
    }

    /**
     * Delete the inflight message only if the currently stored version is still expired.
     *
     * @return true if the message has been deleted
     */
    boolean deleteExpiredInflight(String id, long expiry) {
        return call("delete expired inflight", () -> meters.deleteCallTimer, () ->
            deleteMessageIf(RecordKind.INFLIGHT, id, stored -> InflightExpirySweeper.isExpired(stored, expiry)));
    }

    private boolean deleteMessageIf(RecordKind kind, String id, Predicate<Message> condition) {
        Lock idLock = idLocks.get(id);
        idLock.lock();
        try {
            ByteString recordKey = recordKey(kind, id);
            Optional<Message> stored = readMessage(recordKey)
                .filter(m -> m.getKind() == kind.messageKind())
                .filter(condition);
            if (stored.isEmpty()) {
                return false;
            }
            write(writer -> writer.delete(recordKey).delete(kindIndexKey(kind, id)));
            return true;
        } finally {
            idLock.unlock();
        }
    }

    @Override
    public List<? extends com.google.protobuf.Message> findByKind(RecordKind kind) {
        switch (kind) {
            case SERVER_INFO:
                return call("find " + kind, () -> meters.findCallTimer, () -> {
                    try (IKVSpaceReader reader = kvSpace.reader()) {
                        ByteString key = recordKey(kind, SERVER_INFO_ID);
                        return reader.get(key)
                            .map(v -> Collections.singletonList(RecordCodec.SERVER_INFO.decode(key, v)))
                            .orElse(Collections.emptyList());
                    }
                });
            case CLIENT:
                return readClients();
            case SUBSCRIPTION:
                return readSubscriptions();
            case INFLIGHT:
                return readInflight();
            case RETAINED:
                return readRetained();
            default:
                throw new IllegalArgumentException("Unknown record kind: " + kind);
        }
    }

    @Override
    public List<Client> readClients() {
        return call("read clients", () -> meters.findCallTimer,
            () -> scanContainer(RecordKind.CLIENT, RecordCodec.CLIENT));
    }

    @Override
    public List<Subscription> readSubscriptions() {
        return call("read subscriptions", () -> meters.findCallTimer,
            () -> scanContainer(RecordKind.SUBSCRIPTION, RecordCodec.SUBSCRIPTION));
    }

    @Override
    public List<Message> readInflight() {
        return call("read inflight", () -> meters.findCallTimer, () -> scanMessages(RecordKind.INFLIGHT));
    }

    @Override
    public List<Message> readRetained() {
        return call("read retained", () -> meters.findCallTimer, () -> scanMessages(RecordKind.RETAINED));
    }

    @Override
    public ServerInfo readServerInfo() {
        return call("read server info", () -> meters.findCallTimer, () -> {
            try (IKVSpaceReader reader = kvSpace.reader()) {
                ByteString key = recordKey(RecordKind.SERVER_INFO, SERVER_INFO_ID);
                return reader.get(key)
                    .map(v -> RecordCodec.SERVER_INFO.decode(key, v))
                    .orElse(ServerInfo.getDefaultInstance());
            }
        });
    }

    @Override
    public int clearExpiredInflight(long expiry) {
        return call("clear expired inflight", () -> meters.sweepCallTimer, () -> {
            int deleted = sweeper.sweep(expiry);
            meters.expiredInflightCounter.increment(deleted);
            return deleted;
        });
    }

    @Override
    public int clearExpiredInflight() {
        return clearExpiredInflight(clock.instant().getEpochSecond() - inflightTTLSeconds);
    }

    @Override
    public void setInflightTTL(long seconds) {
        checkArgument(seconds >= 0, "Inflight TTL must not be negative");
        inflightTTLSeconds = seconds;
    }

    long inflightTTL() {
        return inflightTTLSeconds;
    }

    private <T> T call(String opName, Supplier<Timer> timer, Supplier<T> op) {
        lifecycleLock.readLock().lock();
        try {
            if (state != State.OPEN) {
                throw new StoreUnavailableException("Persistent store is not open: path=" + path + ", state=" + state);
            }
            return timer.get().record(op);
        } catch (KVEngineException e) {
            throw new PersistFailureException("Failed to " + opName + ": path=" + path, e);
        } finally {
            lifecycleLock.readLock().unlock();
        }
    }

    private void write(Consumer<IKVSpaceWriter> mutation) {
        IKVSpaceWriter writer = kvSpace.writer();
        try {
            mutation.accept(writer);
        } catch (Throwable e) {
            writer.abort();
            throw e;
        }
        writer.done();
    }

    private Optional<Message> readMessage(ByteString recordKey) {
        try (IKVSpaceReader reader = kvSpace.reader()) {
            return reader.get(recordKey).map(v -> RecordCodec.MESSAGE.decode(recordKey, v));
        }
    }

    private <T extends com.google.protobuf.Message> List<T> scanContainer(RecordKind kind, RecordCodec<T> codec) {
        List<T> records = new ArrayList<>();
        ByteString prefix = containerPrefix(kind);
        try (IKVSpaceReader reader = kvSpace.reader(); IKVSpaceIterator itr = reader.newIterator(prefix)) {
            for (itr.seekToFirst(); itr.isValid(); itr.next()) {
                records.add(codec.decode(itr.key(), itr.value()));
            }
        }
        return records;
    }

    private List<Message> scanMessages(RecordKind kind) {
        List<Message> messages = new ArrayList<>();
        ByteString prefix = kindIndexPrefix(kind);
        try (IKVSpaceReader reader = kvSpace.reader(); IKVSpaceIterator itr = reader.newIterator(prefix)) {
            for (itr.seekToFirst(); itr.isValid(); itr.next()) {
                String id = parseId(prefix, itr.key());
                ByteString recordKey = recordKey(kind, id);
                Optional<Message> message = reader.get(recordKey).map(v -> RecordCodec.MESSAGE.decode(recordKey, v));
                if (message.isEmpty() || message.get().getKind() != kind.messageKind()) {
                    log.warn("Dangling kind index entry skipped: kind={}, id={}", kind, id);
                    continue;
                }
                messages.add(message.get());
            }
        }
        return messages;
    }

    private enum State {
        INIT, OPEN, CLOSED
    }
}
