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
import static com.google.common.base.Preconditions.checkState;

import io.mqstate.persistence.IPersistentStore;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Periodically deletes expired inflight messages of a store using the executor of the caller.
 */
@Slf4j
public class InflightGCScheduler {
    private final IPersistentStore store;
    private final ScheduledExecutorService executor;
    private final Duration interval;
    private ScheduledFuture<?> gcTask;

    public InflightGCScheduler(IPersistentStore store, ScheduledExecutorService executor, Duration interval) {
        checkArgument(!interval.isNegative() && !interval.isZero(), "Interval must be positive");
        this.store = store;
        this.executor = executor;
        this.interval = interval;
    }

    public synchronized void start() {
        checkState(gcTask == null, "Already started");
        long intervalMillis = interval.toMillis();
        gcTask = executor.scheduleWithFixedDelay(this::gc, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        log.debug("Inflight gc scheduled: interval={}", interval);
    }

    public synchronized boolean isStarted() {
        return gcTask != null;
    }

    public synchronized void stop() {
        if (gcTask != null) {
            gcTask.cancel(false);
            gcTask = null;
            log.debug("Inflight gc stopped");
        }
    }

    private void gc() {
        try {
            int deleted = store.clearExpiredInflight();
            if (deleted > 0) {
                log.info("Inflight gc deleted {} expired messages", deleted);
            }
        } catch (Throwable e) {
            // an exception escaping the task would cancel the schedule
            log.error("Inflight gc failed", e);
        }
    }
}
