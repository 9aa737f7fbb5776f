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
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertThrows;
import static org.testng.Assert.assertTrue;

import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.mqstate.persistence.LockTimeoutException;
import io.mqstate.persistence.RecordKind;
import io.mqstate.persistence.StoreUnavailableException;
import io.mqstate.persistence.proto.Client;
import io.mqstate.persistence.proto.FixedHeader;
import io.mqstate.persistence.proto.LWT;
import io.mqstate.persistence.proto.Message;
import io.mqstate.persistence.proto.MessageKind;
import io.mqstate.persistence.proto.ServerInfo;
import io.mqstate.persistence.proto.Subscription;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import lombok.SneakyThrows;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

public class PersistentStoreTest {
    private Path dbRootDir;
    private PersistentStore store;

    @SneakyThrows
    @BeforeMethod
    public void setup() {
        dbRootDir = Files.createTempDirectory("");
        store = newStore();
        store.open();
    }

    @AfterMethod(alwaysRun = true)
    public void teardown() {
        store.close();
        TestUtil.deleteDir(dbRootDir.toString());
    }

    private PersistentStore newStore() {
        return new PersistentStore(PersistentStoreOptions.builder()
            .path(dbRootDir.resolve("data").toString())
            .lockWaitTimeout(Duration.ofMillis(100))
            .build());
    }

    private static Client client(String id, String username) {
        return Client.newBuilder()
            .setId(id)
            .setClientId("client-" + id)
            .setListener("tcp1")
            .setUsername(username)
            .setProtocolVersion(4)
            .setCleanSession(true)
            .setLwt(LWT.newBuilder()
                .setTopic("a/b/c")
                .setMessage(copyFromUtf8("bye"))
                .setQos(1)
                .build())
            .putSubscriptions("a/b/+", 1)
            .putSubscriptions("d/#", 2)
            .build();
    }

    private static Subscription subscription(String id) {
        return Subscription.newBuilder()
            .setId(id)
            .setClient("client-" + id)
            .setFilter("a/b/+")
            .setQos(1)
            .build();
    }

    private static Message message(String id, MessageKind kind, long created) {
        return Message.newBuilder()
            .setId(id)
            .setKind(kind)
            .setClient("client1")
            .setTopicName("a/b/c")
            .setPayload(copyFromUtf8("payload-" + id))
            .setFixedHeader(FixedHeader.newBuilder().setType(3).setQos(1).setRemaining(12).build())
            .setCreated(created)
            .setPacketId(7)
            .build();
    }

    private static Set<String> ids(List<Message> messages) {
        return messages.stream().map(Message::getId).collect(Collectors.toSet());
    }

    @Test
    public void saveAndReadClient() {
        Client client = client("c1", "user1");
        store.save(client);
        assertEquals(store.readClients(), List.of(client));
        assertEquals(store.findByKind(RecordKind.CLIENT), List.of(client));
    }

    @Test
    public void upsertKeepsLatest() {
        store.save(client("c1", "user1"));
        Client updated = client("c1", "user2");
        store.save(updated);
        assertEquals(store.readClients(), List.of(updated));
    }

    @Test
    public void saveAndDeleteSubscription() {
        Subscription sub1 = subscription("s1");
        Subscription sub2 = subscription("s2");
        store.save(sub1);
        store.save(sub2);
        assertEquals(new HashSet<>(store.readSubscriptions()), Set.of(sub1, sub2));

        store.delete(RecordKind.SUBSCRIPTION, "s1");
        assertEquals(store.readSubscriptions(), List.of(sub2));
    }

    @Test
    public void deleteMissing() {
        store.delete(RecordKind.CLIENT, "absent");
        store.delete(RecordKind.INFLIGHT, "absent");
        store.delete(RecordKind.SERVER_INFO, "absent");
        assertTrue(store.readClients().isEmpty());
        assertTrue(store.readInflight().isEmpty());
    }

    @Test
    public void emptyStore() {
        assertEquals(store.readServerInfo(), ServerInfo.getDefaultInstance());
        assertTrue(store.findByKind(RecordKind.SERVER_INFO).isEmpty());
        for (RecordKind kind : RecordKind.values()) {
            assertTrue(store.findByKind(kind).isEmpty());
        }
    }

    @Test
    public void saveServerInfo() {
        ServerInfo info = ServerInfo.newBuilder()
            .setId("srv")
            .setVersion("1.0.0")
            .setStarted(1700000000)
            .setClientsConnected(3)
            .setMessagesReceived(100)
            .build();
        store.save(info);
        assertEquals(store.readServerInfo(), info);
        assertEquals(store.findByKind(RecordKind.SERVER_INFO), List.of(info));

        ServerInfo updated = info.toBuilder().setClientsConnected(4).build();
        store.save(updated);
        assertEquals(store.readServerInfo(), updated);
    }

    @Test
    public void serverInfoKeepsSingletonId() {
        store.save(ServerInfo.newBuilder().setId("other").setVersion("1.0.0").build());
        assertEquals(store.readServerInfo().getId(), "srv");
        store.save(ServerInfo.newBuilder().setVersion("1.0.1").build());
        assertEquals(store.readServerInfo(), ServerInfo.newBuilder().setId("srv").setVersion("1.0.1").build());
    }

    @Test
    public void inflightAndRetainedSeparated() {
        Message inflight = message("m1", MessageKind.INFLIGHT, 100);
        Message retained = message("m2", MessageKind.RETAINED, 100);
        store.save(inflight);
        store.save(retained);
        assertEquals(store.readInflight(), List.of(inflight));
        assertEquals(store.readRetained(), List.of(retained));
        assertEquals(store.findByKind(RecordKind.INFLIGHT), List.of(inflight));
        assertEquals(store.findByKind(RecordKind.RETAINED), List.of(retained));
    }

    @Test
    public void kindChangeMovesMessage() {
        store.save(message("m1", MessageKind.INFLIGHT, 100));
        Message retained = message("m1", MessageKind.RETAINED, 200);
        store.save(retained);
        assertTrue(store.readInflight().isEmpty());
        assertEquals(store.readRetained(), List.of(retained));

        Message inflight = message("m1", MessageKind.INFLIGHT, 300);
        store.save(inflight);
        assertEquals(store.readInflight(), List.of(inflight));
        assertTrue(store.readRetained().isEmpty());
    }

    @Test
    public void deleteRequiresMatchingKind() {
        Message inflight = message("m1", MessageKind.INFLIGHT, 100);
        store.save(inflight);
        store.delete(RecordKind.RETAINED, "m1");
        assertEquals(store.readInflight(), List.of(inflight));

        store.delete(RecordKind.INFLIGHT, "m1");
        assertTrue(store.readInflight().isEmpty());
    }

    @Test
    public void clearExpiredInflight() {
        store.save(message("a", MessageKind.INFLIGHT, 0));
        store.save(message("b", MessageKind.INFLIGHT, 100));
        store.save(message("c", MessageKind.INFLIGHT, 200));
        store.save(message("d", MessageKind.INFLIGHT, 300));
        store.save(message("r", MessageKind.RETAINED, 0));

        assertEquals(store.clearExpiredInflight(200), 2);
        assertEquals(ids(store.readInflight()), Set.of("c", "d"));
        assertEquals(ids(store.readRetained()), Set.of("r"));

        assertEquals(store.clearExpiredInflight(200), 0);
    }

    @Test
    public void keepMessageRefreshedDuringSweep() {
        store.close();
        Message refreshed = message("m1", MessageKind.INFLIGHT, 1000);
        AtomicBoolean refresh = new AtomicBoolean(true);
        store = new PersistentStore(PersistentStoreOptions.builder()
            .path(dbRootDir.resolve("data").toString())
            .build()) {
            @Override
            public List<Message> readInflight() {
                List<Message> inflight = super.readInflight();
                if (refresh.compareAndSet(true, false)) {
                    save(refreshed);
                }
                return inflight;
            }
        };
        store.open();
        store.save(message("m1", MessageKind.INFLIGHT, 100));

        assertEquals(store.clearExpiredInflight(200), 0);
        assertEquals(store.readInflight(), List.of(refreshed));
    }

    @Test
    public void clearExpiredInflightByTTL() {
        long now = TimeUnit.MILLISECONDS.toSeconds(System.currentTimeMillis());
        store.setInflightTTL(3600);
        store.save(message("old", MessageKind.INFLIGHT, now - 7200));
        store.save(message("new", MessageKind.INFLIGHT, now));
        assertEquals(store.clearExpiredInflight(), 1);
        assertEquals(ids(store.readInflight()), Set.of("new"));
    }

    @Test
    public void inflightTTL() {
        assertEquals(store.inflightTTL(), 86400);
        store.setInflightTTL(0);
        assertEquals(store.inflightTTL(), 0);
        assertThrows(IllegalArgumentException.class, () -> store.setInflightTTL(-1));
    }

    @Test
    public void invalidRecords() {
        assertThrows(IllegalArgumentException.class, () -> store.save(Client.getDefaultInstance()));
        assertThrows(IllegalArgumentException.class, () -> store.save(Subscription.getDefaultInstance()));
        assertThrows(IllegalArgumentException.class, () -> store.save(Message.newBuilder().setId("m1").build()));
        assertThrows(IllegalArgumentException.class,
            () -> store.save(Message.newBuilder().setKind(MessageKind.INFLIGHT).build()));
    }

    @Test
    public void reopen() {
        ServerInfo info = ServerInfo.newBuilder().setId("srv").setVersion("1.0.0").setUptime(60).build();
        Client client = client("c1", "user1");
        Subscription sub = subscription("s1");
        Message inflight = message("m1", MessageKind.INFLIGHT, 100);
        Message retained = message("m2", MessageKind.RETAINED, 100);
        store.save(info);
        store.save(client);
        store.save(sub);
        store.save(inflight);
        store.save(retained);
        store.close();

        store = newStore();
        store.open();
        assertEquals(store.readServerInfo(), info);
        assertEquals(store.readClients(), List.of(client));
        assertEquals(store.readSubscriptions(), List.of(sub));
        assertEquals(store.readInflight(), List.of(inflight));
        assertEquals(store.readRetained(), List.of(retained));
    }

    @Test
    public void lifecycle() {
        store.open();
        assertTrue(store.isOpen());
        store.close();
        store.close();
        assertFalse(store.isOpen());
        assertThrows(StoreUnavailableException.class, store::open);
        assertThrows(StoreUnavailableException.class, () -> store.save(client("c1", "user1")));
        assertThrows(StoreUnavailableException.class, () -> store.delete(RecordKind.CLIENT, "c1"));
        assertThrows(StoreUnavailableException.class, store::readServerInfo);
        assertThrows(StoreUnavailableException.class, () -> store.clearExpiredInflight(100));
    }

    @Test
    public void unavailableBeforeArgumentCheck() {
        store.close();
        assertThrows(StoreUnavailableException.class, () -> store.save(Client.getDefaultInstance()));
        assertThrows(StoreUnavailableException.class, () -> store.save(Subscription.getDefaultInstance()));
        assertThrows(StoreUnavailableException.class, () -> store.save(Message.getDefaultInstance()));
    }

    @Test
    public void unavailableBeforeOpen() {
        PersistentStore unopened = new PersistentStore(PersistentStoreOptions.builder()
            .path(dbRootDir.resolve("unopened").toString())
            .build());
        assertFalse(unopened.isOpen());
        assertThrows(StoreUnavailableException.class, unopened::readClients);
        assertThrows(StoreUnavailableException.class, () -> unopened.findByKind(RecordKind.SERVER_INFO));
        unopened.close();
    }

    @Test
    public void lockTimeout() {
        PersistentStore another = newStore();
        long start = System.nanoTime();
        assertThrows(LockTimeoutException.class, another::open);
        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) >= 100);
        assertFalse(another.isOpen());
        assertEquals(store.readServerInfo(), ServerInfo.getDefaultInstance());
    }

    @Test
    public void openAfterLockReleased() {
        PersistentStore another = newStore();
        assertThrows(LockTimeoutException.class, another::open);
        store.close();
        another.open();
        assertTrue(another.isOpen());
        another.close();
    }

    @SneakyThrows
    @Test
    public void concurrentUpserts() {
        int ids = 100;
        int writes = 1000;
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < writes; i++) {
                int seq = i;
                // the kind of an id flips every 100 writes
                MessageKind kind = (seq / ids) % 2 == 0 ? MessageKind.INFLIGHT : MessageKind.RETAINED;
                futures.add(executor.submit(() -> store.save(Message.newBuilder()
                    .setId("m" + seq % ids)
                    .setKind(kind)
                    .setPayload(copyFromUtf8(Integer.toString(seq)))
                    .setCreated(seq)
                    .build())));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdown();
        }
        List<Message> inflight = store.readInflight();
        List<Message> retained = store.readRetained();
        assertTrue(inflight.stream().allMatch(m -> m.getKind() == MessageKind.INFLIGHT));
        assertTrue(retained.stream().allMatch(m -> m.getKind() == MessageKind.RETAINED));

        Map<String, Message> all = new HashMap<>();
        inflight.forEach(m -> all.put(m.getId(), m));
        retained.forEach(m -> assertNull(all.put(m.getId(), m)));
        assertEquals(all.size(), ids);
        for (Message m : all.values()) {
            int seq = Integer.parseInt(m.getPayload().toStringUtf8());
            assertEquals(m.getId(), "m" + seq % ids);
            assertEquals(m.getCreated(), seq);
        }
    }

    @Test
    public void meters() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        Metrics.globalRegistry.add(registry);
        try {
            store.close();
            store = newStore();
            store.open();
            store.save(client("c1", "user1"));
            store.readClients();
            String path = dbRootDir.resolve("data").toAbsolutePath().toString();
            Timer saveTimer = registry.find(PersistentStoreMetric.CallTimer.metricName())
                .tags("path", path, "op", "save")
                .timer();
            assertEquals(saveTimer.count(), 1);
        } finally {
            Metrics.globalRegistry.remove(registry);
        }
    }
}
