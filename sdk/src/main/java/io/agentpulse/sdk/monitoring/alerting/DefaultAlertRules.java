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

import java.util.List;

/**
 * The alert rules a telemetry system starts with.
 */
public class DefaultAlertRules {

    public static final AlertRule HIGH_ERROR_RATE = AlertRule.builder()
            .name("high_error_rate").severity(Severity.HIGH).message("High error rate detected")
            .condition((snapshot, resources) -> snapshot.getErrors().getTotal() > 10)
            .build();

    public static final AlertRule LOW_SUCCESS_RATE = AlertRule.builder()
            .name("low_success_rate").severity(Severity.MEDIUM).message("Low call success rate detected")
            .condition((snapshot, resources) -> {
                long total = snapshot.getCalls().getTotal();
                return total > 0 && (double) snapshot.getCalls().getSuccessful() / total < 0.8;
            })
            .build();

    public static final AlertRule HIGH_MEMORY_USAGE = AlertRule.builder()
            .name("high_memory_usage").severity(Severity.HIGH).message("High memory usage detected")
            .condition((snapshot, resources) -> resources != null && resources.getMemory().getUsagePercent() > 90)
            .build();

    public static final AlertRule API_FAILURES = AlertRule.builder()
            .name("api_failures").severity(Severity.MEDIUM).message("High API failure rate detected")
            .condition((snapshot, resources) -> {
                long total = snapshot.getApi().getTotalRequests();
                return total > 0 && (double) snapshot.getApi().getFailedRequests() / total > 0.1;
            })
            .build();

    public static final AlertRule INFERENCE_FAILURES = AlertRule.builder()
            .name("inference_failures").severity(Severity.HIGH).message("High inference failure rate detected")
            .condition((snapshot, resources) -> {
                long total = snapshot.getInference().getTotalRequests();
                return total > 0 && (double) snapshot.getInference().getFailedRequests() / total > 0.05;
            })
            .build();

    public static List<AlertRule> all() {
        return List.of(HIGH_ERROR_RATE, LOW_SUCCESS_RATE, HIGH_MEMORY_USAGE, API_FAILURES, INFERENCE_FAILURES);
    }
}
