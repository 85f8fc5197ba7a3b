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

package io.agentpulse.common.serialization;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class JsonUtilsTest {

    @Test
    void writesTimestampsAsIsoStrings() {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("timestamp", Instant.parse("2024-01-01T00:00:00Z"));
        value.put("uptime", Duration.ofSeconds(90));

        assertEquals("{\"timestamp\":\"2024-01-01T00:00:00Z\",\"uptime\":\"PT1M30S\"}", JsonUtils.asJson(value));
    }

    @Test
    void writesNull() {
        assertEquals("null", JsonUtils.asJson(null));
    }
}
