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

import io.agentpulse.sdk.monitoring.alerting.Alert;
import io.agentpulse.sdk.monitoring.application.ApplicationSnapshot;
import io.agentpulse.sdk.monitoring.health.HealthReport;
import io.agentpulse.sdk.monitoring.resources.events.ResourceSample;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Composed read-only view of the telemetry system.
 */
@Value
@Builder
public class DashboardData {

    /**
     * The latest resource sample, or {@code null} if no sample has been taken yet.
     */
    ResourceSample system;

    /**
     * The live application counters at the time the view was composed.
     */
    @NonNull
    ApplicationSnapshot application;

    /**
     * Unresolved alerts, oldest first.
     */
    @NonNull
    List<Alert> alerts;

    @NonNull
    HealthReport health;

    /**
     * Uptime of the process.
     */
    @NonNull
    Duration uptime;
}
