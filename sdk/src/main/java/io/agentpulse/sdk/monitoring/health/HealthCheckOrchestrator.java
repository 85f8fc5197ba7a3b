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

import io.agentpulse.sdk.monitoring.TelemetryConfiguration;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Keeps a registry of named health probes and runs them on demand.
 * <p>
 * Probes run one at a time, in registration order. A probe that fails is recorded as unhealthy without affecting
 * the other probes. Without a configured probe timeout the orchestrator waits for every probe to finish, so a
 * probe that never completes blocks the run.
 */
@Slf4j
public class HealthCheckOrchestrator {

    private final Clock clock;
    private final Duration probeTimeout;
    private final Map<String, HealthProbe> probes = new LinkedHashMap<>();

    public HealthCheckOrchestrator(TelemetryConfiguration configuration, Clock clock) {
        this(clock, configuration.getProbeTimeout());
    }

    /**
     * @param probeTimeout maximum time to wait for a single probe, or {@code null} to wait indefinitely
     */
    public HealthCheckOrchestrator(@NonNull Clock clock, Duration probeTimeout) {
        this.clock = clock;
        this.probeTimeout = probeTimeout;
    }

    /**
     * Registers a probe under the given name, replacing any probe registered earlier under that name.
     */
    public synchronized void register(@NonNull String name, @NonNull HealthProbe probe) {
        probes.put(name, probe);
    }

    public synchronized Set<String> getCheckNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(probes.keySet()));
    }

    /**
     * Runs all registered probes sequentially and composes their results. The report is computed afresh on every
     * call.
     */
    public HealthReport runAll() {
        Map<String, HealthProbe> registered;
        synchronized (this) {
            registered = new LinkedHashMap<>(probes);
        }
        Map<String, ProbeResult> results = new LinkedHashMap<>();
        boolean overall = true;
        for (Map.Entry<String, HealthProbe> entry : registered.entrySet()) {
            ProbeResult result = runProbe(entry.getKey(), entry.getValue());
            results.put(entry.getKey(), result);
            overall &= result.isHealthy();
        }
        return new HealthReport(overall, Collections.unmodifiableMap(results), clock.instant());
    }

    public boolean isHealthy() {
        return runAll().isOverall();
    }

    protected ProbeResult runProbe(String name, HealthProbe probe) {
        CompletableFuture<ProbeResult> future = null;
        try {
            future = probe.check();
            if (future == null) {
                return unhealthy(name, "Probe returned no result");
            }
            ProbeResult result = probeTimeout == null
                    ? future.get() : future.get(probeTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                return unhealthy(name, "Probe returned no result");
            }
            log.debug("Health probe {} reported {}", name, result.isHealthy() ? "healthy" : "unhealthy");
            return result;
        } catch (ExecutionException e) {
            return unhealthy(name, errorMessage(e.getCause()));
        } catch (TimeoutException e) {
            future.cancel(true);
            return unhealthy(name, "Probe timed out after " + probeTimeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return unhealthy(name, "Interrupted while waiting for probe");
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            return unhealthy(name, errorMessage(e));
        }
    }

    private ProbeResult unhealthy(String name, String error) {
        log.debug("Health probe {} failed: {}", name, error);
        return ProbeResult.unhealthy(error);
    }

    static String errorMessage(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        return Optional.ofNullable(cause.getMessage()).orElseGet(() -> cause.getClass().getSimpleName());
    }
}
