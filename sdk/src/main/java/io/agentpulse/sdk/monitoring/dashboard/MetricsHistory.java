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

import io.agentpulse.sdk.monitoring.application.ApplicationSnapshot;
import io.agentpulse.sdk.monitoring.resources.events.ResourceSample;
import lombok.NonNull;
import lombok.Value;

import java.util.List;

/**
 * Resource samples and application snapshots within a time window, each oldest first.
 */
@Value
public class MetricsHistory {
    @NonNull
    List<ResourceSample> system;
    @NonNull
    List<ApplicationSnapshot> application;
}
