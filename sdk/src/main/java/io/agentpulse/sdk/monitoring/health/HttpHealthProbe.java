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

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Probe that checks a dependency by sending a GET request to one of its endpoints. The dependency is healthy if
 * the endpoint answers with a 2xx status. Connection failures fail the probe.
 */
public class HttpHealthProbe implements HealthProbe {

    private final HttpClient httpClient;
    private final HttpRequest request;

    public HttpHealthProbe(URI uri) {
        this(uri, Map.of(), Duration.ofSeconds(10));
    }

    /**
     * @param headers        headers to send, e.g. an authorization header
     * @param requestTimeout maximum time to wait for the response
     */
    public HttpHealthProbe(URI uri, Map<String, String> headers, Duration requestTimeout) {
        this(HttpClient.newBuilder().connectTimeout(requestTimeout).build(),
             buildRequest(uri, headers, requestTimeout));
    }

    public HttpHealthProbe(@NonNull HttpClient httpClient, @NonNull HttpRequest request) {
        this.httpClient = httpClient;
        this.request = request;
    }

    @Override
    public CompletableFuture<ProbeResult> check() {
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .thenApply(response -> ProbeResult.builder()
                        .healthy(response.statusCode() >= 200 && response.statusCode() < 300)
                        .details(Map.of("status", response.statusCode()))
                        .build());
    }

    private static HttpRequest buildRequest(@NonNull URI uri, @NonNull Map<String, String> headers,
                                            @NonNull Duration requestTimeout) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri).timeout(requestTimeout).GET();
        headers.forEach(builder::header);
        return builder.build();
    }
}
