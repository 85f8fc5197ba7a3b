/*
 * Copyright (c) agentpulse contributors. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *     http://www.apache.org/licenses/LICENSE-2.0
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */

package io.agentpulse.sdk.monitoring.resources;

import io.agentpulse.common.BoundedHistory;
import io.agentpulse.sdk.monitoring.TelemetryConfiguration;
import io.agentpulse.sdk.monitoring.resources.collectors.CpuCollector;
import io.agentpulse.sdk.monitoring.resources.collectors.DiskCollector;
import io.agentpulse.sdk.monitoring.resources.collectors.MemoryCollector;
import io.agentpulse.sdk.monitoring.resources.collectors.MetricCollector;
import io.agentpulse.sdk.monitoring.resources.collectors.NetworkCollector;
import io.agentpulse.sdk.monitoring.resources.events.ResourceSample;
import io.agentpulse.sdk.monitoring.resources.events.ResourceSample.CpuUsage;
import io.agentpulse.sdk.monitoring.resources.events.ResourceSample.DiskUsage;
import io.agentpulse.sdk.monitoring.resources.events.ResourceSample.MemoryUsage;
import io.agentpulse.sdk.monitoring.resources.events.ResourceSample.NetworkUsage;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Takes snapshots of host CPU, memory, disk and network usage and keeps a bounded history of them.
 * <p>
 * Sampling has no failure path of its own: if a collector throws, the exception propagates to the caller and
 * nothing is added to the history.
 */
@Slf4j
public class ResourceSampler {

    private final Clock clock;
    private final MetricCollector<CpuUsage> cpuCollector;
    private final MetricCollector<MemoryUsage> memoryCollector;
    private final MetricCollector<DiskUsage> diskCollector;
    private final MetricCollector<NetworkUsage> networkCollector;
    private final BoundedHistory<ResourceSample> history;

    /**
     * Creates a sampler with the default collectors.
     */
    public ResourceSampler(TelemetryConfiguration configuration, Clock clock) {
        this(configuration, clock, new DiskCollector(configuration.getDiskPaths()),
             new NetworkCollector(configuration.getProcRoot()));
    }

    /**
     * Creates a sampler with the default CPU and memory collectors and the given disk and network collectors.
     */
    public ResourceSampler(TelemetryConfiguration configuration, Clock clock,
                           MetricCollector<DiskUsage> diskCollector, MetricCollector<NetworkUsage> networkCollector) {
        this(clock, configuration.getResourceHistorySize(), new CpuCollector(configuration.getProcRoot()),
             new MemoryCollector(), diskCollector, networkCollector);
    }

    public ResourceSampler(@NonNull Clock clock, int historySize,
                           @NonNull MetricCollector<CpuUsage> cpuCollector,
                           @NonNull MetricCollector<MemoryUsage> memoryCollector,
                           @NonNull MetricCollector<DiskUsage> diskCollector,
                           @NonNull MetricCollector<NetworkUsage> networkCollector) {
        this.clock = clock;
        this.cpuCollector = cpuCollector;
        this.memoryCollector = memoryCollector;
        this.diskCollector = diskCollector;
        this.networkCollector = networkCollector;
        this.history = new BoundedHistory<>(historySize);
    }

    /**
     * Takes a new sample, appends it to the history and returns it.
     */
    public ResourceSample sample() {
        ResourceSample sample = ResourceSample.builder()
                .timestamp(clock.instant())
                .cpu(collect(cpuCollector, () -> CpuUsage.builder().build()))
                .memory(collect(memoryCollector, () -> MemoryUsage.builder().build()))
                .disk(collect(diskCollector, () -> DiskUsage.builder().build()))
                .network(collect(networkCollector, () -> NetworkUsage.builder().build()))
                .build();
        history.add(sample);
        log.debug("Sampled host resources: cpu {}%, memory {}%", sample.getCpu().getUsagePercent(),
                  Math.round(sample.getMemory().getUsagePercent()));
        return sample;
    }

    /**
     * Returns all retained samples, oldest first.
     */
    public List<ResourceSample> getHistory() {
        return history.getAll();
    }

    /**
     * Returns the retained samples taken at or after the given cutoff, oldest first.
     */
    public List<ResourceSample> getHistorySince(Instant cutoff) {
        return history.filter(s -> !s.getTimestamp().isBefore(cutoff));
    }

    public Optional<ResourceSample> getLatest() {
        return history.getLatest();
    }

    /**
     * Drops all retained samples.
     */
    public void reset() {
        history.clear();
    }

    private static <T> T collect(MetricCollector<T> collector, Supplier<T> fallback) {
        return collector.isAvailable() ? collector.collect().orElseGet(fallback) : fallback.get();
    }
}
