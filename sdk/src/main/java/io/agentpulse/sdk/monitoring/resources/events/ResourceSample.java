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

package io.agentpulse.sdk.monitoring.resources.events;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * A snapshot of host resource usage taken at a specific point in time.
 * <p>
 * Sections that could not be measured on the current platform are reported as zeros.
 */
@Value
@Builder
public class ResourceSample {

    /**
     * The timestamp when this sample was taken.
     */
    @NonNull
    Instant timestamp;

    @NonNull
    @Builder.Default
    CpuUsage cpu = CpuUsage.builder().build();

    @NonNull
    @Builder.Default
    MemoryUsage memory = MemoryUsage.builder().build();

    @NonNull
    @Builder.Default
    DiskUsage disk = DiskUsage.builder().build();

    @NonNull
    @Builder.Default
    NetworkUsage network = NetworkUsage.builder().build();

    /**
     * Host CPU usage.
     */
    @Value
    @Builder
    public static class CpuUsage {
        /**
         * Percentage of non-idle CPU time across all cores since the previous read, between 0 and 100.
         */
        double usagePercent;

        /**
         * System load averages, typically over the last 1, 5 and 15 minutes. Empty if unavailable.
         */
        @Singular
        List<Double> loadAverages;
    }

    /**
     * Host physical memory.
     */
    @Value
    @Builder
    public static class MemoryUsage {
        long usedBytes;
        long freeBytes;
        long totalBytes;

        /**
         * Used memory as a percentage of the total, between 0 and 100.
         */
        double usagePercent;
    }

    /**
     * Disk space, summed over all monitored file systems.
     */
    @Value
    @Builder
    public static class DiskUsage {
        long usedBytes;
        long freeBytes;
        long totalBytes;
        double usagePercent;
    }

    /**
     * Network traffic counters, summed over all non-loopback interfaces.
     */
    @Value
    @Builder
    public static class NetworkUsage {
        /**
         * Total bytes received since the interfaces came up.
         */
        long bytesIn;

        /**
         * Total bytes sent since the interfaces came up.
         */
        long bytesOut;

        /**
         * The number of established TCP connections.
         */
        int activeConnections;
    }

    /**
     * Returns {@code part} as a percentage of {@code total}, or 0 if the total is not positive.
     */
    public static double percentage(long part, long total) {
        return total <= 0 ? 0d : part * 100d / total;
    }
}
