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

package io.agentpulse.sdk.monitoring;

import io.agentpulse.common.application.ApplicationProperties;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Configuration of the telemetry system.
 * <p>
 * Use the builder to override individual settings, or {@link #fromProperties()} to read them from the
 * application properties.
 */
@Value
@Builder(toBuilder = true)
public class TelemetryConfiguration {

    public static final String PROPERTY_PREFIX = "agentpulse.telemetry.";

    /**
     * The interval between collection ticks. Defaults to 60 seconds.
     */
    @NonNull
    @Builder.Default
    Duration collectionInterval = Duration.ofSeconds(60);

    /**
     * The maximum number of resource samples kept in history.
     */
    @Builder.Default
    int resourceHistorySize = 1000;

    /**
     * The maximum number of application snapshots kept in history.
     */
    @Builder.Default
    int applicationHistorySize = 1000;

    /**
     * The maximum number of errors kept in the recent error window of the live counters.
     */
    @Builder.Default
    int recentErrorsSize = 100;

    /**
     * The maximum number of alerts kept in the alert ledger, resolved or not.
     */
    @Builder.Default
    int alertLedgerSize = 500;

    /**
     * Paths to monitor for disk metrics. If empty, uses the root filesystem.
     */
    @NonNull
    @Builder.Default
    List<Path> diskPaths = List.of();

    /**
     * Root of the proc file system used for CPU and network figures.
     */
    @NonNull
    @Builder.Default
    Path procRoot = Path.of("/proc");

    /**
     * Maximum time a single health probe may take before it is reported unhealthy. {@code null} means probes may
     * take as long as they like, in which case a hung probe blocks the whole health check run.
     */
    Duration probeTimeout;

    /**
     * The window of {@link io.agentpulse.sdk.monitoring.dashboard.DashboardAggregator#getMetricsHistory()}.
     */
    @NonNull
    @Builder.Default
    Duration defaultHistoryWindow = Duration.ofHours(24);

    /**
     * Creates a configuration from application properties prefixed with {@value #PROPERTY_PREFIX}, falling back to
     * the defaults for missing properties. Durations use the ISO-8601 format, e.g. {@code PT30S}; disk paths are
     * comma separated.
     */
    public static TelemetryConfiguration fromProperties() {
        TelemetryConfiguration defaults = TelemetryConfiguration.builder().build();
        return TelemetryConfiguration.builder()
                .collectionInterval(ApplicationProperties.mapProperty(
                        PROPERTY_PREFIX + "collection-interval", Duration::parse, defaults::getCollectionInterval))
                .resourceHistorySize(ApplicationProperties.getIntegerProperty(
                        PROPERTY_PREFIX + "resource-history-size", defaults.getResourceHistorySize()))
                .applicationHistorySize(ApplicationProperties.getIntegerProperty(
                        PROPERTY_PREFIX + "application-history-size", defaults.getApplicationHistorySize()))
                .recentErrorsSize(ApplicationProperties.getIntegerProperty(
                        PROPERTY_PREFIX + "recent-errors-size", defaults.getRecentErrorsSize()))
                .alertLedgerSize(ApplicationProperties.getIntegerProperty(
                        PROPERTY_PREFIX + "alert-ledger-size", defaults.getAlertLedgerSize()))
                .diskPaths(ApplicationProperties.mapProperty(
                        PROPERTY_PREFIX + "disk-paths", TelemetryConfiguration::parsePaths, defaults::getDiskPaths))
                .procRoot(ApplicationProperties.mapProperty(
                        PROPERTY_PREFIX + "proc-root", Path::of, defaults::getProcRoot))
                .probeTimeout(ApplicationProperties.mapProperty(
                        PROPERTY_PREFIX + "probe-timeout", Duration::parse, () -> null))
                .defaultHistoryWindow(ApplicationProperties.mapProperty(
                        PROPERTY_PREFIX + "default-history-window", Duration::parse,
                        defaults::getDefaultHistoryWindow))
                .build();
    }

    static List<Path> parsePaths(String value) {
        return Arrays.stream(value.split(",")).map(String::trim).filter(s -> !s.isEmpty()).map(Path::of).toList();
    }
}
