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

import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * A named check of one dependency or subsystem.
 * <p>
 * A probe reports failure either by returning an unhealthy {@link ProbeResult} or by failing: throwing from
 * {@link #check()} or completing the returned future exceptionally. Both are recorded as unhealthy.
 */
@FunctionalInterface
public interface HealthProbe {

    /**
     * Creates a probe from a synchronous check.
     */
    static HealthProbe of(Supplier<ProbeResult> check) {
        return () -> CompletableFuture.completedFuture(check.get());
    }

    /**
     * Starts the check.
     *
     * @return a future completing with the outcome of the check
     */
    CompletableFuture<ProbeResult> check();
}
