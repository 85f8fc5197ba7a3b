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

import io.agentpulse.sdk.monitoring.resources.events.ResourceSample;
import io.agentpulse.sdk.monitoring.resources.events.ResourceSample.MemoryUsage;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.util.Optional;

/**
 * Collector for host physical memory, using the com.sun.management extension of the operating system MXBean.
 */
public class MemoryCollector implements MetricCollector<MemoryUsage> {

    private final OperatingSystemMXBean osMXBean;
    private final boolean hasSunExtension;

    public MemoryCollector() {
        this.osMXBean = ManagementFactory.getOperatingSystemMXBean();
        this.hasSunExtension = osMXBean instanceof com.sun.management.OperatingSystemMXBean;
    }

    @Override
    public Optional<MemoryUsage> collect() {
        if (!hasSunExtension) {
            return Optional.empty();
        }
        var sunOsMXBean = (com.sun.management.OperatingSystemMXBean) osMXBean;
        long total = sunOsMXBean.getTotalMemorySize();
        long free = sunOsMXBean.getFreeMemorySize();
        long used = total - free;
        return Optional.of(MemoryUsage.builder()
                                   .usedBytes(used)
                                   .freeBytes(free)
                                   .totalBytes(total)
                                   .usagePercent(ResourceSample.percentage(used, total))
                                   .build());
    }

    @Override
    public boolean isAvailable() {
        return hasSunExtension;
    }
}
