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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NetworkCollectorTest {

    private static final String TCP_HEADER =
            "  sl  local_address rem_address   st tx_queue rx_queue tr tm->when retrnsmt   uid  timeout inode";

    @TempDir
    Path procRoot;

    @BeforeEach
    void setUp() throws IOException {
        Files.createDirectory(procRoot.resolve("net"));
    }

    @Test
    void isAvailable_falseWithoutDeviceFile() {
        var collector = new NetworkCollector(procRoot);

        assertFalse(collector.isAvailable());
        assertTrue(collector.collect().isEmpty());
    }

    @Test
    void collect_sumsBytesOfNonLoopbackInterfaces() throws IOException {
        writeDev();
        var collector = new NetworkCollector(procRoot);

        assertTrue(collector.isAvailable());
        NetworkUsage usage = collector.collect().orElseThrow();
        assertEquals(5100L, usage.getBytesIn());
        assertEquals(7200L, usage.getBytesOut());
        assertEquals(0, usage.getActiveConnections());
    }

    @Test
    void collect_countsEstablishedConnections() throws IOException {
        writeDev();
        Files.write(procRoot.resolve("net/tcp"), List.of(
                TCP_HEADER,
                "   0: 0100007F:0CEA 00000000:0000 0A 00000000:00000000 00:00000000 00000000  1000        0 1",
                "   1: 0100007F:0CEA 0100007F:D2B4 01 00000000:00000000 00:00000000 00000000  1000        0 2",
                "   2: 0100007F:0CEA 0100007F:D2B6 01 00000000:00000000 00:00000000 00000000  1000        0 3"));
        Files.write(procRoot.resolve("net/tcp6"), List.of(
                TCP_HEADER,
                "   0: 00000000000000000000000001000000:1F90 00000000000000000000000001000000:C350 01 "
                + "00000000:00000000 00:00000000 00000000  1000        0 4",
                "   1: 00000000000000000000000001000000:1F90 00000000000000000000000001000000:C352 06 "
                + "00000000:00000000 00:00000000 00000000  1000        0 5"));

        assertEquals(3, new NetworkCollector(procRoot).collect().orElseThrow().getActiveConnections());
    }

    private void writeDev() throws IOException {
        Files.write(procRoot.resolve("net/dev"), List.of(
                "Inter-|   Receive                                                |  Transmit",
                " face |bytes    packets errs drop fifo frame compressed multicast"
                + "|bytes    packets errs drop fifo colls carrier compressed",
                "    lo:    1000      10    0    0    0     0          0         0     1000      10    0    0    0"
                + "     0       0          0",
                "  eth0:    5000      50    0    0    0     0          0         0     7000      70    0    0    0"
                + "     0       0          0",
                "  eth1:     100       1    0    0    0     0          0         0      200       2    0    0    0"
                + "     0       0          0"));
    }
}
