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

import io.agentpulse.common.DefaultTaskScheduler;
import io.agentpulse.common.TaskScheduler;
import io.agentpulse.sdk.monitoring.alerting.Alert;
import io.agentpulse.sdk.monitoring.alerting.AlertEngine;
import io.agentpulse.sdk.monitoring.alerting.AlertRule;
import io.agentpulse.sdk.monitoring.alerting.DefaultAlertRules;
import io.agentpulse.sdk.monitoring.alerting.Severity;
import io.agentpulse.sdk.monitoring.application.ApplicationAggregator;
import io.agentpulse.sdk.monitoring.dashboard.DashboardAggregator;
import io.agentpulse.sdk.monitoring.dashboard.DashboardData;
import io.agentpulse.sdk.monitoring.dashboard.MetricsHistory;
import io.agentpulse.sdk.monitoring.health.HealthCheckOrchestrator;
import io.agentpulse.sdk.monitoring.health.HealthProbe;
import io.agentpulse.sdk.monitoring.health.HealthReport;
import io.agentpulse.sdk.monitoring.resources.ResourceSampler;
import io.agentpulse.sdk.monitoring.resources.collectors.DiskCollector;
import io.agentpulse.sdk.monitoring.resources.collectors.MetricCollector;
import io.agentpulse.sdk.monitoring.resources.collectors.NetworkCollector;
import io.agentpulse.sdk.monitoring.resources.events.ResourceSample.DiskUsage;
import io.agentpulse.sdk.monitoring.resources.events.ResourceSample.NetworkUsage;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Entry point of the telemetry and alerting core. Owns the resource sampler, application aggregator, alert
 * engine, health check orchestrator, dashboard aggregator and collection scheduler.
 * <p>
 * Create an instance with {@link #builder()} and call {@link #initialize()} once to start periodic collection.
 * Recording and querying work before initialization as well. Every instance holds its own state, so tests can
 * simply create a fresh system.
 * <p>
 * Example:
 * <pre>{@code
 * TelemetrySystem telemetry = TelemetrySystem.builder()
 *         .configuration(TelemetryConfiguration.fromProperties())
 *         .build();
 * telemetry.registerCheck("llm", new HttpHealthProbe(URI.create("https://llm.example.com/health")));
 * telemetry.initialize();
 *
 * telemetry.recordCall(true, 1250);
 * }</pre>
 */
@Slf4j
@Getter
public class TelemetrySystem {

    private final TelemetryConfiguration configuration;
    private final ResourceSampler resourceSampler;
    private final ApplicationAggregator applicationAggregator;
    private final AlertEngine alertEngine;
    private final HealthCheckOrchestrator healthCheckOrchestrator;
    private final DashboardAggregator dashboardAggregator;
    private final CollectionScheduler collectionScheduler;

    @Getter(AccessLevel.NONE)
    private final TaskScheduler taskScheduler;
    @Getter(AccessLevel.NONE)
    private final boolean ownsTaskScheduler;
    @Getter(AccessLevel.NONE)
    private final AtomicBoolean initialized = new AtomicBoolean();

    /**
     * Creates a telemetry system. All arguments are optional.
     *
     * @param configuration    the configuration, defaults to {@code TelemetryConfiguration.builder().build()}
     * @param clock            the clock used for timestamps, defaults to the UTC system clock
     * @param taskScheduler    the scheduler of collection ticks. If not given, the system creates one and shuts it
     *                         down in {@link #shutdown()}
     * @param diskCollector    collector for disk figures, defaults to a {@link DiskCollector} for the configured
     *                         paths
     * @param networkCollector collector for network figures, defaults to a {@link NetworkCollector}
     * @param alertRules       the alert rules, defaults to {@link DefaultAlertRules#all()}
     * @param uptimeSupplier   supplier of the uptime shown on the dashboard, defaults to the JVM uptime
     */
    @Builder
    private TelemetrySystem(TelemetryConfiguration configuration, Clock clock, TaskScheduler taskScheduler,
                            MetricCollector<DiskUsage> diskCollector,
                            MetricCollector<NetworkUsage> networkCollector,
                            List<AlertRule> alertRules, Supplier<Duration> uptimeSupplier) {
        this.configuration = Optional.ofNullable(configuration)
                .orElseGet(() -> TelemetryConfiguration.builder().build());
        clock = Optional.ofNullable(clock).orElseGet(Clock::systemUTC);
        this.ownsTaskScheduler = taskScheduler == null;
        this.taskScheduler = Optional.ofNullable(taskScheduler)
                .orElseGet(() -> new DefaultTaskScheduler("telemetry-collection"));

        this.resourceSampler = new ResourceSampler(
                this.configuration, clock,
                Optional.ofNullable(diskCollector).orElseGet(
                        () -> new DiskCollector(this.configuration.getDiskPaths())),
                Optional.ofNullable(networkCollector).orElseGet(
                        () -> new NetworkCollector(this.configuration.getProcRoot())));
        this.applicationAggregator = new ApplicationAggregator(this.configuration, clock);
        this.alertEngine = new AlertEngine(this.configuration, clock,
                                           Optional.ofNullable(alertRules).orElseGet(DefaultAlertRules::all));
        this.healthCheckOrchestrator = new HealthCheckOrchestrator(this.configuration, clock);
        this.dashboardAggregator = uptimeSupplier == null
                ? new DashboardAggregator(this.configuration, clock, resourceSampler, applicationAggregator,
                                          alertEngine, healthCheckOrchestrator)
                : new DashboardAggregator(clock, this.configuration.getDefaultHistoryWindow(), resourceSampler,
                                          applicationAggregator, alertEngine, healthCheckOrchestrator,
                                          uptimeSupplier);
        this.collectionScheduler = new CollectionScheduler(this.configuration, this.taskScheduler,
                                                           resourceSampler, applicationAggregator, alertEngine);
    }

    /**
     * Starts periodic collection. Only the first call has an effect.
     *
     * @return true if this call started the system
     */
    public boolean initialize() {
        if (initialized.compareAndSet(false, true)) {
            collectionScheduler.start();
            return true;
        }
        log.info("Telemetry system already initialized");
        return false;
    }

    public boolean isInitialized() {
        return initialized.get();
    }

    /**
     * Stops periodic collection. If the task scheduler was created by this system it is shut down as well.
     */
    public void shutdown() {
        collectionScheduler.stop();
        if (ownsTaskScheduler) {
            taskScheduler.shutdown();
        }
    }

    /**
     * Clears all history, the live application counters and the alert ledger. Registered health probes are kept.
     */
    public void reset() {
        resourceSampler.reset();
        applicationAggregator.reset();
        alertEngine.reset();
    }

    // Recording

    public void recordSessionStart() {
        applicationAggregator.recordSessionStart();
    }

    public void recordSessionEnd(boolean success) {
        applicationAggregator.recordSessionEnd(success);
    }

    public void recordCall(boolean success, double durationMs) {
        applicationAggregator.recordCall(success, durationMs);
    }

    public void recordApiRequest(boolean success, double responseTimeMs) {
        applicationAggregator.recordApiRequest(success, responseTimeMs);
    }

    public void recordInferenceRequest(boolean success, double responseTimeMs) {
        applicationAggregator.recordInferenceRequest(success, responseTimeMs);
    }

    public void recordInferenceRequest(boolean success, double responseTimeMs, long tokens) {
        applicationAggregator.recordInferenceRequest(success, responseTimeMs, tokens);
    }

    public void recordError(String kind, String message) {
        applicationAggregator.recordError(kind, message);
    }

    public void recordError(String kind, String message, String trace) {
        applicationAggregator.recordError(kind, message, trace);
    }

    public void recordError(String kind, Throwable error) {
        applicationAggregator.recordError(kind, error);
    }

    // Health

    public void registerCheck(String name, HealthProbe probe) {
        healthCheckOrchestrator.register(name, probe);
    }

    public HealthReport runHealthChecks() {
        return healthCheckOrchestrator.runAll();
    }

    public boolean isHealthy() {
        return healthCheckOrchestrator.isHealthy();
    }

    // Dashboard

    public DashboardData getDashboardData() {
        return dashboardAggregator.getDashboardData();
    }

    public MetricsHistory getMetricsHistory() {
        return dashboardAggregator.getMetricsHistory();
    }

    public MetricsHistory getMetricsHistory(double hours) {
        return dashboardAggregator.getMetricsHistory(hours);
    }

    // Alerts

    public Alert createAlert(String kind, Severity severity, String message) {
        return alertEngine.createAlert(kind, severity, message);
    }

    public boolean resolveAlert(String alertId) {
        return alertEngine.resolveAlert(alertId);
    }

    public List<Alert> getActiveAlerts() {
        return alertEngine.getActiveAlerts();
    }

    public List<Alert> getAllAlerts() {
        return alertEngine.getAllAlerts();
    }

    public List<Alert> getAlertsBySeverity(Severity severity) {
        return alertEngine.getAlertsBySeverity(severity);
    }
}
