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

import io.agentpulse.common.BoundedHistory;
import io.agentpulse.sdk.monitoring.TelemetryConfiguration;
import io.agentpulse.sdk.monitoring.application.ApplicationSnapshot.CallStats;
import io.agentpulse.sdk.monitoring.application.ApplicationSnapshot.ErrorRecord;
import io.agentpulse.sdk.monitoring.application.ApplicationSnapshot.ErrorStats;
import io.agentpulse.sdk.monitoring.application.ApplicationSnapshot.InferenceStats;
import io.agentpulse.sdk.monitoring.application.ApplicationSnapshot.RequestStats;
import io.agentpulse.sdk.monitoring.application.ApplicationSnapshot.SessionStats;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates application-level counters for sessions, calls, API requests, inference requests and errors.
 * <p>
 * The aggregator owns exactly one live counter set, which the {@code record*} methods update incrementally, and a
 * bounded history of immutable snapshots of that set. Averages are maintained as streaming means, so no per-event
 * data is retained beyond the bounded window of recent errors.
 * <p>
 * All mutations of the live counter set are serialized on this aggregator.
 */
@Slf4j
public class ApplicationAggregator {

    private final Clock clock;
    private final int recentErrorsSize;
    private final BoundedHistory<ApplicationSnapshot> history;

    private long activeSessions;
    private long totalSessions;
    private long expiredSessions;

    private long totalCalls;
    private long successfulCalls;
    private long failedCalls;
    private double averageCallDurationMs;

    private long totalApiRequests;
    private long successfulApiRequests;
    private long failedApiRequests;
    private double averageApiResponseTimeMs;

    private long totalInferenceRequests;
    private long successfulInferenceRequests;
    private long failedInferenceRequests;
    private double averageInferenceResponseTimeMs;
    private long tokensConsumed;

    private long totalErrors;
    private Map<String, Long> errorCountByKind;
    private BoundedHistory<ErrorRecord> recentErrors;

    public ApplicationAggregator(TelemetryConfiguration configuration, Clock clock) {
        this(clock, configuration.getApplicationHistorySize(), configuration.getRecentErrorsSize());
    }

    public ApplicationAggregator(@NonNull Clock clock, int historySize, int recentErrorsSize) {
        this.clock = clock;
        this.recentErrorsSize = recentErrorsSize;
        this.history = new BoundedHistory<>(historySize);
        resetCounters();
    }

    public synchronized void recordSessionStart() {
        activeSessions++;
        totalSessions++;
    }

    /**
     * Records the end of a session. Sessions that did not end successfully are counted as expired.
     */
    public synchronized void recordSessionEnd(boolean success) {
        activeSessions--;
        if (!success) {
            expiredSessions++;
        }
    }

    /**
     * Records a finished call.
     * <p>
     * The average duration is a streaming mean over the number of successful calls, but it is updated for every
     * call, failed calls included: {@code avg = (avg * (successful - 1) + duration) / successful}. A failed call
     * therefore replaces part of the average without increasing its denominator. While no call has succeeded yet
     * the average is left untouched.
     */
    public synchronized void recordCall(boolean success, double durationMs) {
        totalCalls++;
        if (success) {
            successfulCalls++;
        } else {
            failedCalls++;
        }
        if (successfulCalls > 0) {
            averageCallDurationMs = streamingMean(averageCallDurationMs, successfulCalls, durationMs);
        }
    }

    /**
     * Records a request to an external API. The average response time covers successful and failed requests.
     */
    public synchronized void recordApiRequest(boolean success, double responseTimeMs) {
        totalApiRequests++;
        if (success) {
            successfulApiRequests++;
        } else {
            failedApiRequests++;
        }
        averageApiResponseTimeMs = streamingMean(averageApiResponseTimeMs, totalApiRequests, responseTimeMs);
    }

    /**
     * Records a model inference request that consumed no tokens.
     */
    public void recordInferenceRequest(boolean success, double responseTimeMs) {
        recordInferenceRequest(success, responseTimeMs, 0L);
    }

    /**
     * Records a model inference request. Tokens are only counted for successful requests; the average response time
     * covers successful and failed requests.
     */
    public synchronized void recordInferenceRequest(boolean success, double responseTimeMs, long tokens) {
        totalInferenceRequests++;
        if (success) {
            successfulInferenceRequests++;
            tokensConsumed += tokens;
        } else {
            failedInferenceRequests++;
        }
        averageInferenceResponseTimeMs =
                streamingMean(averageInferenceResponseTimeMs, totalInferenceRequests, responseTimeMs);
    }

    public void recordError(String kind, String message) {
        recordError(kind, message, null);
    }

    /**
     * Records an error, using the error's message and its stack trace as trace.
     */
    public void recordError(String kind, @NonNull Throwable error) {
        StringWriter trace = new StringWriter();
        error.printStackTrace(new PrintWriter(trace));
        recordError(kind, error.getMessage(), trace.toString());
    }

    /**
     * Records an application error. The error is counted and kept in the window of recent errors, evicting the oldest
     * entry when the window is full.
     *
     * @param trace optional diagnostic trace, may be null
     */
    public synchronized void recordError(@NonNull String kind, String message, String trace) {
        totalErrors++;
        errorCountByKind.merge(kind, 1L, Long::sum);
        recentErrors.add(ErrorRecord.builder().timestamp(clock.instant()).kind(kind).message(message)
                                 .trace(trace).build());
    }

    /**
     * Freezes the live counters into a snapshot and appends it to the history. The live counters are not reset.
     */
    public synchronized ApplicationSnapshot snapshot() {
        ApplicationSnapshot snapshot = currentSnapshot();
        history.add(snapshot);
        log.debug("Captured application snapshot: {} calls, {} errors", snapshot.getCalls().getTotal(),
                  snapshot.getErrors().getTotal());
        return snapshot;
    }

    /**
     * Returns a copy of the live counters without touching the history.
     */
    public synchronized ApplicationSnapshot currentSnapshot() {
        return ApplicationSnapshot.builder()
                .timestamp(clock.instant())
                .sessions(SessionStats.builder().active(activeSessions).total(totalSessions)
                                  .expiredCount(expiredSessions).build())
                .calls(CallStats.builder().total(totalCalls).successful(successfulCalls).failed(failedCalls)
                               .averageDurationMs(averageCallDurationMs).build())
                .api(RequestStats.builder().totalRequests(totalApiRequests)
                             .successfulRequests(successfulApiRequests).failedRequests(failedApiRequests)
                             .averageResponseTimeMs(averageApiResponseTimeMs).build())
                .inference(InferenceStats.builder().totalRequests(totalInferenceRequests)
                                   .successfulRequests(successfulInferenceRequests)
                                   .failedRequests(failedInferenceRequests)
                                   .averageResponseTimeMs(averageInferenceResponseTimeMs)
                                   .tokensConsumed(tokensConsumed).build())
                .errors(ErrorStats.builder().total(totalErrors)
                                .countByKind(Collections.unmodifiableMap(new LinkedHashMap<>(errorCountByKind)))
                                .recent(List.copyOf(recentErrors.getAll())).build())
                .build();
    }

    /**
     * Returns all retained snapshots, oldest first.
     */
    public List<ApplicationSnapshot> getHistory() {
        return history.getAll();
    }

    /**
     * Returns the retained snapshots taken at or after the given cutoff, oldest first.
     */
    public List<ApplicationSnapshot> getHistorySince(Instant cutoff) {
        return history.filter(s -> !s.getTimestamp().isBefore(cutoff));
    }

    /**
     * Replaces the live counter set with a fresh one and drops the history.
     */
    public synchronized void reset() {
        resetCounters();
        history.clear();
    }

    private void resetCounters() {
        activeSessions = totalSessions = expiredSessions = 0L;
        totalCalls = successfulCalls = failedCalls = 0L;
        averageCallDurationMs = 0d;
        totalApiRequests = successfulApiRequests = failedApiRequests = 0L;
        averageApiResponseTimeMs = 0d;
        totalInferenceRequests = successfulInferenceRequests = failedInferenceRequests = tokensConsumed = 0L;
        averageInferenceResponseTimeMs = 0d;
        totalErrors = 0L;
        errorCountByKind = new LinkedHashMap<>();
        recentErrors = new BoundedHistory<>(recentErrorsSize);
    }

    static double streamingMean(double average, long count, double value) {
        return (average * (count - 1) + value) / count;
    }
}
