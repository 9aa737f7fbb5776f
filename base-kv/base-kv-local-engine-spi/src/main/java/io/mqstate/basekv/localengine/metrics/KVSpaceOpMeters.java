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

package io.mqstate.basekv.localengine.metrics;

import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.List;

/**
 * Meters of the operations issued against one KV space, registered in the global registry for the lifetime of
 * the opened space.
 */
public class KVSpaceOpMeters {
    public final Timer sizeCallTimer;
    public final Timer readerNewCallTimer;
    public final Timer existCallTimer;
    public final Timer getCallTimer;
    public final Timer iterNewCallTimer;
    public final Timer batchWriteCallTimer;
    public final DistributionSummary readBytesSummary;
    public final DistributionSummary writeBatchSizeSummary;
    private final List<Meter> meters = new ArrayList<>();

    public KVSpaceOpMeters(String id, Tags tags) {
        sizeCallTimer = timer(id, "size", tags);
        readerNewCallTimer = timer(id, "reader", tags);
        existCallTimer = timer(id, "exist", tags);
        getCallTimer = timer(id, "get", tags);
        iterNewCallTimer = timer(id, "newitr", tags);
        batchWriteCallTimer = timer(id, "write", tags);
        readBytesSummary = summary(id, KVSpaceMetric.ReadBytesDistribution, tags);
        writeBatchSizeSummary = summary(id, KVSpaceMetric.WriteBatchSizeDistribution, tags);
    }

    public void close() {
        meters.forEach(Metrics.globalRegistry::remove);
        meters.clear();
    }

    private Timer timer(String id, String op, Tags tags) {
        Timer timer = Timer.builder(KVSpaceMetric.CallTimer.metricName())
            .tags(tags)
            .tags("kvspace", id, "op", op)
            .register(Metrics.globalRegistry);
        meters.add(timer);
        return timer;
    }

    private DistributionSummary summary(String id, KVSpaceMetric metric, Tags tags) {
        assert metric.meterType() == Meter.Type.DISTRIBUTION_SUMMARY;
        DistributionSummary summary = DistributionSummary.builder(metric.metricName())
            .tags(tags)
            .tags("kvspace", id)
            .register(Metrics.globalRegistry);
        meters.add(summary);
        return summary;
    }
}
