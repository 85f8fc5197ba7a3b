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

package io.agentpulse.common.application;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static io.agentpulse.common.TestUtils.runWithSystemProperties;
import static org.junit.jupiter.api.Assertions.*;

class ApplicationPropertiesTest {

    @Test
    void substitutesPlaceholderFromSameFile() {
        assertEquals("PT12H", ApplicationProperties.getProperty("agentpulse.telemetry.default-history-window"));
    }

    @Test
    void substitutedValueFollowsSystemProperty() {
        runWithSystemProperties(
                () -> assertEquals("PT6H",
                                   ApplicationProperties.getProperty("agentpulse.telemetry.default-history-window")),
                "history.hours", "6");
    }

    @Test
    void placeholderFallsBackToDefault() {
        assertEquals("PT60S", ApplicationProperties.getProperty("agentpulse.telemetry.collection-interval"));
        runWithSystemProperties(
                () -> assertEquals("PT10S",
                                   ApplicationProperties.getProperty("agentpulse.telemetry.collection-interval")),
                "collection.interval", "PT10S");
    }

    @Test
    void nestedPlaceholderName() {
        runWithSystemProperties(
                () -> assertEquals("PT3S", ApplicationProperties.getProperty("agentpulse.telemetry.probe-timeout")),
                "agentpulse.telemetry.probe-timeout", "${probe.timeout.${deployment}}",
                "deployment", "prod", "probe.timeout.prod", "PT3S");
    }

    @Test
    void missingPlaceholderWithoutDefaultFails() {
        runWithSystemProperties(
                () -> assertThrows(IllegalStateException.class,
                                   () -> ApplicationProperties.getProperty("agentpulse.telemetry.probe-timeout")),
                "agentpulse.telemetry.probe-timeout", "${no.such.timeout}");
    }

    @Test
    void circularPlaceholdersFail() {
        runWithSystemProperties(
                () -> assertThrows(IllegalStateException.class,
                                   () -> ApplicationProperties.getProperty("agentpulse.telemetry.proc-root")),
                "agentpulse.telemetry.proc-root", "${proc.a}", "proc.a", "${proc.b}", "proc.b", "${proc.a}");
    }

    @Test
    void mapPropertyParsesDurations() {
        assertEquals(Duration.ofHours(12), ApplicationProperties.mapProperty(
                "agentpulse.telemetry.default-history-window", Duration::parse, () -> Duration.ZERO));
        assertEquals(Duration.ZERO, ApplicationProperties.mapProperty(
                "agentpulse.telemetry.no-such-key", Duration::parse, () -> Duration.ZERO));
    }

    @Test
    void integerPropertyIsTrimmed() {
        assertEquals(80, ApplicationProperties.getIntegerProperty("agentpulse.telemetry.recent-errors-size", 100));
        runWithSystemProperties(
                () -> assertEquals(42, ApplicationProperties.getIntegerProperty(
                        "agentpulse.telemetry.recent-errors-size", 100)),
                "agentpulse.telemetry.recent-errors-size", " 42 ");
        assertEquals(100, ApplicationProperties.getIntegerProperty("agentpulse.telemetry.no-such-key", 100));
    }
}
