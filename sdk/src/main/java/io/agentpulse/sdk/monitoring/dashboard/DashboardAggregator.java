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

package io.agentpulse.sdk.monitoring.dashboard;

import io.agentpulse.sdk.monitoring.TelemetryConfiguration;
import io.agentpulse.sdk.monitoring.alerting.AlertEngine;
import io.agentpulse.sdk.monitoring.application.ApplicationAggregator;
import io.agentpulse.sdk.monitoring.health.HealthCheckOrchestrator;
import io.agentpulse.sdk.monitoring.resources.ResourceSampler;
import lombok.AllArgsConstructor;
import lombok.NonNull;

import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Composes the state of the other telemetry components into views for dashboards and status endpoints. Owns no
 * state of its own.
 */
@AllArgsConstructor
public class DashboardAggregator {

    @NonNull
    private final Clock clock;
    @NonNull
    private final Duration defaultHistoryWindow;
    @NonNull
    private final ResourceSampler resourceSampler;
    @NonNull
    private final ApplicationAggregator applicationAggregator;
    @NonNull
    private final AlertEngine alertEngine;
    @NonNull
    private final HealthCheckOrchestrator healthCheckOrchestrator;
    @NonNull
    private final Supplier<Duration> uptimeSupplier;

    public DashboardAggregator(TelemetryConfiguration configuration, Clock clock, ResourceSampler resourceSampler,
                               ApplicationAggregator applicationAggregator, AlertEngine alertEngine,
                               HealthCheckOrchestrator healthCheckOrchestrator) {
        this(clock, configuration.getDefaultHistoryWindow(), resourceSampler, applicationAggregator, alertEngine,
             healthCheckOrchestrator, DashboardAggregator::processUptime);
    }

    /**
     * Composes the current view. Note that this runs all health probes.
     */
    public DashboardData getDashboardData() {
        return DashboardData.builder()
                .system(resourceSampler.getLatest().orElse(null))
                .application(applicationAggregator.currentSnapshot())
                .alerts(alertEngine.getActiveAlerts())
                .health(healthCheckOrchestrator.runAll())
                .uptime(uptimeSupplier.get())
                .build();
    }

    /**
     * Returns resource samples and application snapshots taken within the default window.
     */
    public MetricsHistory getMetricsHistory() {
        return getMetricsHistory(defaultHistoryWindow);
    }

    /**
     * Returns resource samples and application snapshots taken within the given number of hours. Entries taken
     * exactly at the cutoff are included.
     */
    public MetricsHistory getMetricsHistory(double hours) {
        if (hours < 0 || Double.isNaN(hours)) {
            throw new IllegalArgumentException("Hours should not be negative: " + hours);
        }
        return getMetricsHistory(Duration.ofMillis(Math.round(hours * Duration.ofHours(1).toMillis())));
    }

    public MetricsHistory getMetricsHistory(@NonNull Duration window) {
        Instant cutoff = clock.instant().minus(window);
        return new MetricsHistory(resourceSampler.getHistorySince(cutoff),
                                  applicationAggregator.getHistorySince(cutoff));
    }

    static Duration processUptime() {
        return Duration.ofMillis(ManagementFactory.getRuntimeMXBean().getUptime());
    }
}
