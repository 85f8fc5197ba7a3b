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

import io.agentpulse.sdk.monitoring.resources.events.ResourceSample.NetworkUsage;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Collector for network traffic on Linux hosts.
 * <p>
 * Byte counters come from {@code /proc/net/dev}, excluding the loopback interface. Active connections are the
 * IPv4 and IPv6 TCP sockets in state ESTABLISHED.
 */
public class NetworkCollector implements MetricCollector<NetworkUsage> {

    private static final String LOOPBACK = "lo";
    private static final String ESTABLISHED = "01";

    private final Path devFile;
    private final List<Path> tcpFiles;

    public NetworkCollector() {
        this(Path.of("/proc"));
    }

    public NetworkCollector(Path procRoot) {
        Path netDir = procRoot.resolve("net");
        this.devFile = netDir.resolve("dev");
        this.tcpFiles = List.of(netDir.resolve("tcp"), netDir.resolve("tcp6"));
    }

    @Override
    public Optional<NetworkUsage> collect() {
        return ProcFiles.readLines(devFile).map(lines -> {
            long bytesIn = 0;
            long bytesOut = 0;
            for (String line : lines) {
                int separator = line.indexOf(':');
                if (separator < 0 || LOOPBACK.equals(line.substring(0, separator).trim())) {
                    continue;
                }
                String[] fields = ProcFiles.fields(line.substring(separator + 1));
                if (fields.length < 9) {
                    continue;
                }
                bytesIn += ProcFiles.parseLong(fields[0]);
                bytesOut += ProcFiles.parseLong(fields[8]);
            }
            return NetworkUsage.builder()
                    .bytesIn(bytesIn)
                    .bytesOut(bytesOut)
                    .activeConnections(countEstablishedConnections())
                    .build();
        });
    }

    private int countEstablishedConnections() {
        int count = 0;
        for (Path tcpFile : tcpFiles) {
            List<String> lines = ProcFiles.readLines(tcpFile).orElse(List.of());
            // first line is the column header
            for (String line : lines.subList(Math.min(1, lines.size()), lines.size())) {
                String[] fields = ProcFiles.fields(line);
                if (fields.length > 3 && ESTABLISHED.equals(fields[3])) {
                    count++;
                }
            }
        }
        return count;
    }

    @Override
    public boolean isAvailable() {
        return Files.exists(devFile);
    }
}
