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
import io.agentpulse.sdk.monitoring.resources.events.ResourceSample.DiskUsage;

import java.io.File;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Collector for disk space. Figures of all monitored paths that exist are added up.
 */
public class DiskCollector implements MetricCollector<DiskUsage> {

    private final List<Path> paths;

    public DiskCollector(List<Path> paths) {
        this.paths = paths.isEmpty() ? List.of(Path.of("/")) : List.copyOf(paths);
    }

    @Override
    public Optional<DiskUsage> collect() {
        long total = 0;
        long free = 0;
        boolean found = false;
        for (Path path : paths) {
            File file = path.toFile();
            if (file.exists()) {
                total += file.getTotalSpace();
                free += file.getFreeSpace();
                found = true;
            }
        }
        if (!found) {
            return Optional.empty();
        }
        long used = total - free;
        return Optional.of(DiskUsage.builder()
                                   .usedBytes(used)
                                   .freeBytes(free)
                                   .totalBytes(total)
                                   .usagePercent(ResourceSample.percentage(used, total))
                                   .build());
    }

    @Override
    public boolean isAvailable() {
        return paths.stream().anyMatch(p -> p.toFile().exists());
    }
}
