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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentpulse.common.BoundedHistory;
import io.agentpulse.common.serialization.JsonUtils;
import io.agentpulse.sdk.monitoring.TelemetryConfiguration;
import io.agentpulse.sdk.monitoring.application.ApplicationSnapshot;
import io.agentpulse.sdk.monitoring.resources.events.ResourceSample;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Evaluates alert rules against application snapshots and keeps a bounded ledger of the resulting alerts.
 * <p>
 * Alerts are not deduplicated: a rule whose condition keeps holding raises a new alert on every evaluation. The
 * ledger evicts its oldest alerts first, whether they are resolved or not.
 */
@Slf4j
public class AlertEngine {

    private static final int ID_SUFFIX_LENGTH = 9;

    private final Clock clock;
    @Getter
    private final List<AlertRule> rules;
    private final BoundedHistory<Alert> ledger;

    public AlertEngine(TelemetryConfiguration configuration, Clock clock, List<AlertRule> rules) {
        this(clock, configuration.getAlertLedgerSize(), rules);
    }

    /**
     * Creates an engine for the given rules, which are evaluated in the given order.
     *
     * @throws IllegalArgumentException if two rules share the same name
     */
    public AlertEngine(@NonNull Clock clock, int ledgerSize, @NonNull List<AlertRule> rules) {
        Set<String> names = new HashSet<>();
        for (AlertRule rule : rules) {
            if (!names.add(rule.getName())) {
                throw new IllegalArgumentException("Duplicate alert rule name: " + rule.getName());
            }
        }
        this.clock = clock;
        this.rules = List.copyOf(rules);
        this.ledger = new BoundedHistory<>(ledgerSize);
    }

    /**
     * Evaluates all rules against the given snapshot and raises an alert for every rule that matches.
     *
     * @param latestResourceSample the most recent resource sample, or {@code null} if none was taken yet
     * @return the alerts raised by this evaluation, in rule order
     */
    public List<Alert> evaluate(@NonNull ApplicationSnapshot snapshot, ResourceSample latestResourceSample) {
        List<Alert> raised = new ArrayList<>();
        for (AlertRule rule : rules) {
            if (rule.matches(snapshot, latestResourceSample)) {
                raised.add(createAlert(rule.getName(), rule.getSeverity(), rule.getMessage(),
                                       captureMetadata(snapshot)));
            }
        }
        return raised;
    }

    public Alert createAlert(String kind, Severity severity, String message) {
        return createAlert(kind, severity, message, null);
    }

    /**
     * Raises an alert and appends it to the ledger.
     *
     * @param metadata optional context to store with the alert, may be null
     */
    public Alert createAlert(@NonNull String kind, @NonNull Severity severity, String message,
                             Map<String, Object> metadata) {
        Alert alert = Alert.builder()
                .id(generateId())
                .kind(kind)
                .type(AlertType.forSeverity(severity))
                .severity(severity)
                .title(severity.name() + ": " + kind)
                .message(message)
                .timestamp(clock.instant())
                .metadata(metadata == null ? null
                                  : Collections.unmodifiableMap(new LinkedHashMap<>(metadata)))
                .build();
        ledger.add(alert);
        if (log.isWarnEnabled()) {
            log.warn("ALERT [{}]: {} {}", severity, message, describeMetadata(metadata));
        }
        return alert;
    }

    /**
     * Resolves the alert with the given id.
     *
     * @return true if the alert exists and was unresolved; false if it is unknown, evicted or already resolved
     */
    public boolean resolveAlert(@NonNull String alertId) {
        return ledger.find(a -> alertId.equals(a.getId())).map(alert -> {
            boolean resolved = alert.resolve(clock.instant());
            if (resolved) {
                log.info("Alert resolved: {}", alert.getTitle());
            }
            return resolved;
        }).orElse(false);
    }

    /**
     * Returns all alerts in the ledger, oldest first.
     */
    public List<Alert> getAllAlerts() {
        return ledger.getAll();
    }

    /**
     * Returns the unresolved alerts in the ledger, oldest first.
     */
    public List<Alert> getActiveAlerts() {
        return ledger.filter(alert -> !alert.isResolved());
    }

    public List<Alert> getAlertsBySeverity(@NonNull Severity severity) {
        return ledger.filter(alert -> alert.getSeverity() == severity);
    }

    /**
     * Empties the ledger. Rules are not affected.
     */
    public void reset() {
        ledger.clear();
    }

    protected Map<String, Object> captureMetadata(ApplicationSnapshot snapshot) {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("calls", snapshot.getCalls());
        metrics.put("api", snapshot.getApi());
        metrics.put("inference", snapshot.getInference());
        metrics.put("errors", snapshot.getErrors());
        return Map.of("metrics", Collections.unmodifiableMap(metrics));
    }

    /**
     * Renders metadata as JSON for logging. Error traces are left out. Metadata that cannot be serialized is
     * rendered with its {@code toString()}.
     */
    static String describeMetadata(Map<String, Object> metadata) {
        if (metadata == null) {
            return "{}";
        }
        try {
            JsonNode tree = JsonUtils.writer.valueToTree(metadata);
            for (JsonNode error : tree.path("metrics").path("errors").path("recent")) {
                if (error instanceof ObjectNode) {
                    ((ObjectNode) error).remove("trace");
                }
            }
            return tree.toString();
        } catch (RuntimeException e) {
            log.debug("Failed to serialize alert metadata", e);
            return String.valueOf(metadata);
        }
    }

    private String generateId() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder suffix = new StringBuilder(ID_SUFFIX_LENGTH);
        for (int i = 0; i < ID_SUFFIX_LENGTH; i++) {
            suffix.append(Character.forDigit(random.nextInt(36), 36));
        }
        return "alert_" + clock.millis() + "_" + suffix;
    }
}
