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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.List;

class PersistentStoreMeters {
    final Timer saveCallTimer;
    final Timer deleteCallTimer;
    final Timer findCallTimer;
    final Timer sweepCallTimer;
    final Counter expiredInflightCounter;
    private final List<Meter> meters = new ArrayList<>();

    PersistentStoreMeters(String path) {
        saveCallTimer = timer(path, "save");
        deleteCallTimer = timer(path, "delete");
        findCallTimer = timer(path, "find");
        sweepCallTimer = timer(path, "sweep");
        expiredInflightCounter = Counter.builder(PersistentStoreMetric.ExpiredInflightCount.metricName())
            .tags("path", path)
            .register(Metrics.globalRegistry);
        meters.add(expiredInflightCounter);
    }

    void close() {
        meters.forEach(Metrics.globalRegistry::remove);
        meters.clear();
    }

    private Timer timer(String path, String op) {
        Timer timer = Timer.builder(PersistentStoreMetric.CallTimer.metricName())
            .tags("path", path, "op", op)
            .register(Metrics.globalRegistry);
        meters.add(timer);
        return timer;
    }
}
