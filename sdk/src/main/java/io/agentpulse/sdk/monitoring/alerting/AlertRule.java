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

package io.agentpulse.sdk.monitoring.alerting;

import io.agentpulse.sdk.monitoring.application.ApplicationSnapshot;
import io.agentpulse.sdk.monitoring.resources.events.ResourceSample;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A declarative alert rule. Each time the rule's condition holds during an evaluation, a new alert is raised whose
 * kind is the rule's name.
 */
@Value
@Builder
public class AlertRule {

    /**
     * Unique name of the rule. Also used as the kind of the alerts it raises.
     */
    @NonNull
    String name;

    @NonNull
    Severity severity;

    /**
     * Message of the alerts raised by this rule.
     */
    @NonNull
    String message;

    @NonNull
    Condition condition;

    public boolean matches(ApplicationSnapshot snapshot, ResourceSample latestResourceSample) {
        return condition.test(snapshot, latestResourceSample);
    }

    @FunctionalInterface
    public interface Condition {
        /**
         * Tests the rule against the latest metrics.
         *
         * @param snapshot             the application snapshot being evaluated
         * @param latestResourceSample the most recent resource sample, or {@code null} if none was taken yet
         */
        boolean test(ApplicationSnapshot snapshot, ResourceSample latestResourceSample);
    }
}
