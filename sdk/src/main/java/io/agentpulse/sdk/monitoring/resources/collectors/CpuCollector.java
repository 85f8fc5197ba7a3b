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

package io.agentpulse.sdk.monitoring.resources.collectors;

import io.agentpulse.sdk.monitoring.resources.events.ResourceSample.CpuUsage;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Collector for host CPU usage.
 * <p>
 * Usage is derived from the cumulative tick counters of the aggregate {@code cpu} line in {@code /proc/stat}:
 * {@code 100 - round(100 * idle / total)} over the ticks elapsed since the previous read. The first read covers
 * the time since boot. Two reads close together can see nearly identical counters and under-report; this is an
 * approximation, not a precision sampler.
 * <p>
 * Where {@code /proc} is not available, the JMX system CPU load is used instead.
 */
public class CpuCollector implements MetricCollector<CpuUsage> {

    // user, nice, system, idle, iowait, irq, softirq, steal. Guest time is already part of user time.
    private static final int COUNTED_FIELDS = 8;
    private static final int IDLE_FIELD = 3;

    private final Path statFile;
    private final Path loadAverageFile;
    private final OperatingSystemMXBean osMXBean;

    private long previousIdleTicks;
    private long previousTotalTicks;

    public CpuCollector() {
        this(Path.of("/proc"));
    }

    public CpuCollector(Path procRoot) {
        this.statFile = procRoot.resolve("stat");
        this.loadAverageFile = procRoot.resolve("loadavg");
        this.osMXBean = ManagementFactory.getOperatingSystemMXBean();
    }

    @Override
    public synchronized Optional<CpuUsage> collect() {
        return Optional.of(CpuUsage.builder()
                                   .usagePercent(readUsagePercent())
                                   .loadAverages(readLoadAverages())
                                   .build());
    }

    private double readUsagePercent() {
        return ProcFiles.readLines(statFile).flatMap(
                lines -> lines.stream().filter(line -> line.startsWith("cpu ")).findFirst())
                .map(this::usageFromStatLine)
                .orElseGet(this::usageFromJmx);
    }

    private double usageFromStatLine(String line) {
        String[] fields = ProcFiles.fields(line);
        long[] ticks = Arrays.stream(fields, 1, Math.min(fields.length, COUNTED_FIELDS + 1))
                .mapToLong(ProcFiles::parseLong).toArray();
        if (ticks.length <= IDLE_FIELD) {
            throw new IllegalStateException("Unexpected cpu line in " + statFile + ": " + line);
        }
        long idleTicks = ticks[IDLE_FIELD];
        long totalTicks = Arrays.stream(ticks).sum();
        long idleDelta = idleTicks - previousIdleTicks;
        long totalDelta = totalTicks - previousTotalTicks;
        previousIdleTicks = idleTicks;
        previousTotalTicks = totalTicks;
        if (totalDelta <= 0) {
            return 0d;
        }
        return 100 - Math.round(100d * idleDelta / totalDelta);
    }

    private double usageFromJmx() {
        if (osMXBean instanceof com.sun.management.OperatingSystemMXBean sunOsMXBean) {
            double cpuLoad = sunOsMXBean.getCpuLoad();
            if (cpuLoad >= 0) {
                return Math.round(cpuLoad * 100);
            }
        }
        return 0d;
    }

    private List<Double> readLoadAverages() {
        Optional<List<String>> lines = ProcFiles.readLines(loadAverageFile);
        if (lines.isPresent() && !lines.get().isEmpty()) {
            String[] fields = ProcFiles.fields(lines.get().get(0));
            List<Double> result = new ArrayList<>(3);
            for (int i = 0; i < Math.min(3, fields.length); i++) {
                result.add(Double.parseDouble(fields[i]));
            }
            return result;
        }
        double loadAverage = osMXBean.getSystemLoadAverage();
        return loadAverage >= 0 ? List.of(loadAverage) : List.of();
    }

    @Override
    public boolean isAvailable() {
        return true;
    }
}
