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

import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregate result of running all registered health probes.
 */
@Value
public class HealthReport {

    /**
     * True if and only if every probe reported healthy and none failed.
     */
    boolean overall;

    /**
     * Result per probe name, in registration order.
     */
    @NonNull
    Map<String, ProbeResult> checks;

    /**
     * When the run completed.
     */
    @NonNull
    Instant timestamp;
}
