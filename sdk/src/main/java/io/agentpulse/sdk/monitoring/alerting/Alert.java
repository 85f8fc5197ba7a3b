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

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.time.Instant;
import java.util.Map;

/**
 * An alert in the alert ledger.
 * <p>
 * Apart from its resolution state an alert is immutable. Alerts are created by the {@link AlertEngine}, either when
 * a rule matches or on explicit request, and are only removed when the ledger evicts them.
 */
@Getter
@ToString
@Builder(access = AccessLevel.PACKAGE)
public class Alert {

    /**
     * Unique id of the alert, of the form {@code alert_<epoch millis>_<random suffix>}.
     */
    @NonNull
    private final String id;

    /**
     * The kind of alert, i.e. the name of the rule that raised it.
     */
    @NonNull
    private final String kind;

    @NonNull
    private final AlertType type;

    @NonNull
    private final Severity severity;

    @NonNull
    private final String title;

    private final String message;

    @NonNull
    private final Instant timestamp;

    /**
     * Context captured when the alert was raised. May be null.
     */
    private final Map<String, Object> metadata;

    private volatile boolean resolved;

    private volatile Instant resolvedAt;

    /**
     * Marks this alert as resolved unless it already was.
     *
     * @return true if the alert was unresolved before this call
     */
    synchronized boolean resolve(@NonNull Instant timestamp) {
        if (resolved) {
            return false;
        }
        resolvedAt = timestamp;
        resolved = true;
        return true;
    }
}
