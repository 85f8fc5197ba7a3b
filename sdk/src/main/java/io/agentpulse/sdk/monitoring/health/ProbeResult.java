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

package io.agentpulse.sdk.monitoring.health;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Outcome of a single health probe.
 */
@Value
@Builder
public class ProbeResult {

    boolean healthy;

    /**
     * Optional diagnostic details, e.g. the status code of a dependency. May be null.
     */
    Map<String, Object> details;

    /**
     * Error message if the probe failed. May be null.
     */
    String error;

    public static ProbeResult healthy() {
        return ProbeResult.builder().healthy(true).build();
    }

    public static ProbeResult healthy(Map<String, Object> details) {
        return ProbeResult.builder().healthy(true).details(details).build();
    }

    public static ProbeResult unhealthy(String error) {
        return ProbeResult.builder().healthy(false).error(error).build();
    }
}
