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

package io.agentpulse.sdk.monitoring.application;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * An immutable point-in-time copy of the application counters.
 * <p>
 * Counts are cumulative for the lifetime of the counter set, not deltas since the previous snapshot.
 */
@Value
@Builder
public class ApplicationSnapshot {

    @NonNull
    Instant timestamp;
    @NonNull
    SessionStats sessions;
    @NonNull
    CallStats calls;
    @NonNull
    RequestStats api;
    @NonNull
    InferenceStats inference;
    @NonNull
    ErrorStats errors;

    @Value
    @Builder
    public static class SessionStats {
        /**
         * Sessions started and not yet ended.
         */
        long active;
        long total;

        /**
         * Sessions that ended unsuccessfully.
         */
        long expiredCount;
    }

    @Value
    @Builder
    public static class CallStats {
        long total;
        long successful;
        long failed;
        double averageDurationMs;
    }

    /**
     * Counters of requests to external APIs.
     */
    @Value
    @Builder
    public static class RequestStats {
        long totalRequests;
        long successfulRequests;
        long failedRequests;
        double averageResponseTimeMs;
    }

    /**
     * Counters of model inference requests.
     */
    @Value
    @Builder
    public static class InferenceStats {
        long totalRequests;
        long successfulRequests;
        long failedRequests;
        double averageResponseTimeMs;

        /**
         * Tokens consumed by successful requests.
         */
        long tokensConsumed;
    }

    @Value
    @Builder
    public static class ErrorStats {
        long total;

        /**
         * Number of errors per kind, in order of first occurrence.
         */
        @NonNull
        Map<String, Long> countByKind;

        /**
         * The most recent errors, oldest first. This is a bounded window and not authoritative for totals.
         */
        @NonNull
        List<ErrorRecord> recent;
    }

    @Value
    @Builder
    public static class ErrorRecord {
        @NonNull
        Instant timestamp;
        @NonNull
        String kind;
        String message;

        /**
         * Stack trace or other diagnostic trace. May be null.
         */
        String trace;
    }
}
