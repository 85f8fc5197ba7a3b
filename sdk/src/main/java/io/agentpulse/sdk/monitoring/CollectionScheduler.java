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

import io.agentpulse.common.Registration;
import io.agentpulse.common.TaskScheduler;
import io.agentpulse.sdk.monitoring.alerting.Alert;
import io.agentpulse.sdk.monitoring.alerting.AlertEngine;
import io.agentpulse.sdk.monitoring.application.ApplicationAggregator;
import io.agentpulse.sdk.monitoring.application.ApplicationSnapshot;
import io.agentpulse.sdk.monitoring.resources.ResourceSampler;
import io.agentpulse.sdk.monitoring.resources.events.ResourceSample;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Periodically samples host resources, snapshots the application counters and evaluates the alert rules against
 * the new snapshot.
 * <p>
 * A failing tick is logged and does not stop the scheduler: the next tick is always scheduled.
 */
@Slf4j
public class CollectionScheduler {

    private final Duration interval;
    private final TaskScheduler taskScheduler;
    private final ResourceSampler resourceSampler;
    private final ApplicationAggregator applicationAggregator;
    private final AlertEngine alertEngine;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<Registration> scheduledTask = new AtomicReference<>();

    public CollectionScheduler(TelemetryConfiguration configuration, TaskScheduler taskScheduler,
                               ResourceSampler resourceSampler, ApplicationAggregator applicationAggregator,
                               AlertEngine alertEngine) {
        this(configuration.getCollectionInterval(), taskScheduler, resourceSampler, applicationAggregator,
             alertEngine);
    }

    public CollectionScheduler(@NonNull Duration interval, @NonNull TaskScheduler taskScheduler,
                               @NonNull ResourceSampler resourceSampler,
                               @NonNull ApplicationAggregator applicationAggregator,
                               @NonNull AlertEngine alertEngine) {
        this.interval = interval;
        this.taskScheduler = taskScheduler;
        this.resourceSampler = resourceSampler;
        this.applicationAggregator = applicationAggregator;
        this.alertEngine = alertEngine;
    }

    /**
     * Starts periodic collection. The first tick runs one interval from now. Has no effect if already running.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            log.info("Starting telemetry collection with interval {}", interval);
            scheduleNextCollection();
        }
    }

    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Stopping telemetry collection");
            Registration task = scheduledTask.getAndSet(null);
            if (task != null) {
                task.cancel();
            }
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Runs a single collection on the calling thread, outside the periodic schedule. Unlike a scheduled tick,
     * failures are thrown to the caller.
     *
     * @return the alerts raised by this collection
     */
    public List<Alert> collectNow() {
        return collect();
    }

    private void scheduleNextCollection() {
        if (running.get()) {
            scheduledTask.set(taskScheduler.schedule(interval, this::tick));
        }
    }

    private void tick() {
        try {
            collect();
        } catch (Exception e) {
            log.warn("Failed to collect telemetry", e);
        } finally {
            scheduleNextCollection();
        }
    }

    private List<Alert> collect() {
        ResourceSample sample = resourceSampler.sample();
        ApplicationSnapshot snapshot = applicationAggregator.snapshot();
        List<Alert> alerts = alertEngine.evaluate(snapshot, sample);
        log.debug("Collected telemetry, {} alert(s) raised", alerts.size());
        return alerts;
    }
}
