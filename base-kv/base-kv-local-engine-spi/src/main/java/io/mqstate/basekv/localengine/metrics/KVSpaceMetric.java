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

import io.micrometer.core.instrument.Meter;

/**
 * Operation metrics of a KV space.
 */
public enum KVSpaceMetric {
    CallTimer("basekv.le.call.time", Meter.Type.TIMER),
    ReadBytesDistribution("basekv.le.read.bytes", Meter.Type.DISTRIBUTION_SUMMARY),
    WriteBatchSizeDistribution("basekv.le.write.batch.size", Meter.Type.DISTRIBUTION_SUMMARY);

    private final String metricName;
    private final Meter.Type meterType;

    KVSpaceMetric(String metricName, Meter.Type meterType) {
        this.metricName = metricName;
        this.meterType = meterType;
    }

    public String metricName() {
        return metricName;
    }

    public Meter.Type meterType() {
        return meterType;
    }
}
