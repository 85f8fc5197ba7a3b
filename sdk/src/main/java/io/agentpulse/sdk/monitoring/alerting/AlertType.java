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

/**
 * Coarse classification of an alert, derived from its {@link Severity}.
 */
public enum AlertType {
    ERROR, WARNING, INFO;

    public static AlertType forSeverity(Severity severity) {
        return switch (severity) {
            case CRITICAL -> ERROR;
            case HIGH -> WARNING;
            default -> INFO;
        };
    }
}
