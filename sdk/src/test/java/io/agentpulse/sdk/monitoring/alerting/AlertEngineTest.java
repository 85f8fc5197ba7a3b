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

import io.agentpulse.sdk.monitoring.AdjustableClock;
import io.agentpulse.sdk.monitoring.application.ApplicationAggregator;
import io.agentpulse.sdk.monitoring.application.ApplicationSnapshot;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class AlertEngineTest {

    private final Instant start = Instant.parse("2024-01-01T00:00:00Z");
    private final AdjustableClock clock = new AdjustableClock(start);
    private final ApplicationAggregator aggregator = new ApplicationAggregator(clock, 1000, 100);

    private final AlertRule alwaysRule = AlertRule.builder()
            .name("always").severity(Severity.HIGH).message("Always fires")
            .condition((snapshot, resources) -> true).build();
    private final AlertRule neverRule = AlertRule.builder()
            .name("never").severity(Severity.LOW).message("Never fires")
            .condition((snapshot, resources) -> false).build();
    private final AlertRule errorsRule = AlertRule.builder()
            .name("errors").severity(Severity.CRITICAL).message("Errors detected")
            .condition((snapshot, resources) -> snapshot.getErrors().getTotal() > 0).build();

    @Nested
    class Evaluate {

        @Test
        void raisesAlertForEveryMatchingRuleInRuleOrder() {
            var engine = new AlertEngine(clock, 500, List.of(errorsRule, neverRule, alwaysRule));
            aggregator.recordError("kind", "message");

            List<Alert> alerts = engine.evaluate(aggregator.snapshot(), null);

            assertEquals(List.of("errors", "always"), alerts.stream().map(Alert::getKind).toList());
            assertEquals(alerts, engine.getAllAlerts());
        }

        @Test
        void alertCarriesRuleDetails() {
            var engine = new AlertEngine(clock, 500, List.of(alwaysRule));

            Alert alert = engine.evaluate(aggregator.snapshot(), null).get(0);

            assertTrue(alert.getId().matches("alert_" + start.toEpochMilli() + "_[0-9a-z]{9}"), alert.getId());
            assertEquals("HIGH: always", alert.getTitle());
            assertEquals("Always fires", alert.getMessage());
            assertEquals(Severity.HIGH, alert.getSeverity());
            assertEquals(AlertType.WARNING, alert.getType());
            assertEquals(start, alert.getTimestamp());
            assertFalse(alert.isResolved());
            assertNull(alert.getResolvedAt());
        }

        @Test
        void metadataCapturesSnapshotMetrics() {
            var engine = new AlertEngine(clock, 500, List.of(alwaysRule));
            aggregator.recordCall(true, 100);
            ApplicationSnapshot snapshot = aggregator.snapshot();

            Alert alert = engine.evaluate(snapshot, null).get(0);

            @SuppressWarnings("unchecked")
            Map<String, Object> metrics = (Map<String, Object>) alert.getMetadata().get("metrics");
            assertEquals(List.of("calls", "api", "inference", "errors"), List.copyOf(metrics.keySet()));
            assertEquals(snapshot.getCalls(), metrics.get("calls"));
        }

        @Test
        void alertsAreNotDeduplicated() {
            var engine = new AlertEngine(clock, 500, List.of(alwaysRule));

            IntStream.range(0, 7).forEach(i -> engine.evaluate(aggregator.snapshot(), null));

            assertEquals(7, engine.getAllAlerts().size());
            assertTrue(engine.getAllAlerts().stream().allMatch(a -> a.getKind().equals("always")));
            assertEquals(7, engine.getAllAlerts().stream().map(Alert::getId).distinct().count());
        }

        @Test
        void ruleReceivesLatestResourceSample() {
            var rule = AlertRule.builder().name("resources").severity(Severity.MEDIUM).message("No resources")
                    .condition((snapshot, resources) -> resources == null).build();
            var engine = new AlertEngine(clock, 500, List.of(rule));

            assertEquals(1, engine.evaluate(aggregator.snapshot(), null).size());
        }

        @Test
        void failingRulePropagates() {
            var rule = AlertRule.builder().name("broken").severity(Severity.MEDIUM).message("Broken")
                    .condition((snapshot, resources) -> {
                        throw new IllegalStateException("broken rule");
                    }).build();
            var engine = new AlertEngine(clock, 500, List.of(rule));

            assertThrows(IllegalStateException.class, () -> engine.evaluate(aggregator.snapshot(), null));
        }
    }

    @Test
    void duplicateRuleNamesAreRejected() {
        assertThrows(IllegalArgumentException.class,
                     () -> new AlertEngine(clock, 500, List.of(alwaysRule, alwaysRule)));
    }

    @Test
    void createAlert_withoutMetadata() {
        var engine = new AlertEngine(clock, 500, List.of());

        Alert alert = engine.createAlert("manual", Severity.CRITICAL, "Manual alert");

        assertEquals("CRITICAL: manual", alert.getTitle());
        assertEquals(AlertType.ERROR, alert.getType());
        assertNull(alert.getMetadata());
        assertEquals(List.of(alert), engine.getActiveAlerts());
    }

    @Test
    void createAlert_unserializableMetadataIsStillRecorded() {
        var engine = new AlertEngine(clock, 500, List.of());

        Alert alert = engine.createAlert("manual", Severity.HIGH, "Manual alert",
                                         Map.of("state", new UnavailableState()));

        assertEquals(List.of(alert), engine.getAllAlerts());
        assertEquals("{state=unavailable}", AlertEngine.describeMetadata(alert.getMetadata()));
    }

    @Test
    void loggedMetadataOmitsErrorTraces() {
        var engine = new AlertEngine(clock, 500, List.of(errorsRule));
        aggregator.recordError("tool", "tool failed", "java.lang.IllegalStateException\n\tat Tool.run(Tool.java:42)");

        Alert alert = engine.evaluate(aggregator.snapshot(), null).get(0);
        String logged = AlertEngine.describeMetadata(alert.getMetadata());

        assertTrue(logged.contains("tool failed"), logged);
        assertFalse(logged.contains("Tool.run"), logged);
        @SuppressWarnings("unchecked")
        var errors = (ApplicationSnapshot.ErrorStats) ((Map<String, Object>) alert.getMetadata().get("metrics"))
                .get("errors");
        assertTrue(errors.getRecent().get(0).getTrace().contains("Tool.run"));
    }

    static class UnavailableState {
        public String getValue() {
            throw new IllegalStateException("state not available");
        }

        @Override
        public String toString() {
            return "unavailable";
        }
    }

    @Nested
    class Resolve {

        private final AlertEngine engine = new AlertEngine(clock, 500, List.of());

        @Test
        void resolvesAlert() {
            Alert alert = engine.createAlert("manual", Severity.LOW, "message");
            clock.advance(Duration.ofMinutes(5));

            assertTrue(engine.resolveAlert(alert.getId()));

            assertTrue(alert.isResolved());
            assertEquals(start.plus(Duration.ofMinutes(5)), alert.getResolvedAt());
            assertTrue(engine.getActiveAlerts().isEmpty());
            assertEquals(List.of(alert), engine.getAllAlerts());
        }

        @Test
        void secondResolveIsNoOp() {
            Alert alert = engine.createAlert("manual", Severity.LOW, "message");
            engine.resolveAlert(alert.getId());
            Instant resolvedAt = alert.getResolvedAt();
            clock.advance(Duration.ofMinutes(5));

            assertFalse(engine.resolveAlert(alert.getId()));

            assertTrue(alert.isResolved());
            assertEquals(resolvedAt, alert.getResolvedAt());
        }

        @Test
        void unknownAlert() {
            assertFalse(engine.resolveAlert("alert_0_unknown00"));
        }
    }

    @Nested
    class Ledger {

        @Test
        void evictsOldestAlertsWhetherResolvedOrNot() {
            var engine = new AlertEngine(clock, 5, List.of());
            List<Alert> created = IntStream.range(0, 7)
                    .mapToObj(i -> engine.createAlert("kind" + i, Severity.LOW, "message")).toList();
            engine.resolveAlert(created.get(2).getId());
            engine.resolveAlert(created.get(0).getId());

            engine.createAlert("kind7", Severity.LOW, "message");

            assertEquals(List.of("kind3", "kind4", "kind5", "kind6", "kind7"),
                         engine.getAllAlerts().stream().map(Alert::getKind).toList());
        }

        @Test
        void defaultCapIsRespected() {
            var engine = new AlertEngine(clock, 500, List.of());

            IntStream.range(0, 510).forEach(i -> engine.createAlert("kind" + i, Severity.LOW, null));

            assertEquals(500, engine.getAllAlerts().size());
            assertEquals("kind10", engine.getAllAlerts().get(0).getKind());
        }

        @Test
        void filterBySeverity() {
            var engine = new AlertEngine(clock, 500, List.of());
            engine.createAlert("a", Severity.LOW, null);
            engine.createAlert("b", Severity.HIGH, null);
            engine.createAlert("c", Severity.HIGH, null);

            assertEquals(List.of("b", "c"),
                         engine.getAlertsBySeverity(Severity.HIGH).stream().map(Alert::getKind).toList());
            assertTrue(engine.getAlertsBySeverity(Severity.CRITICAL).isEmpty());
        }

        @Test
        void resetEmptiesLedger() {
            var engine = new AlertEngine(clock, 500, List.of(alwaysRule));
            engine.createAlert("a", Severity.LOW, null);

            engine.reset();

            assertTrue(engine.getAllAlerts().isEmpty());
            assertEquals(List.of(alwaysRule), engine.getRules());
        }
    }

    @Test
    void alertTypeFollowsSeverity() {
        assertEquals(AlertType.ERROR, AlertType.forSeverity(Severity.CRITICAL));
        assertEquals(AlertType.WARNING, AlertType.forSeverity(Severity.HIGH));
        assertEquals(AlertType.INFO, AlertType.forSeverity(Severity.MEDIUM));
        assertEquals(AlertType.INFO, AlertType.forSeverity(Severity.LOW));
    }
}
