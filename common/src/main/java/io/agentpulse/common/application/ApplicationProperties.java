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

import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Static access to application properties resolved by the {@link DefaultPropertySource}.
 * <p>
 * Values are substituted before they are returned, so {@code ${...}} placeholders in property files resolve
 * against the other sources.
 */
public class ApplicationProperties {

    /**
     * Returns the property for the given key, or {@code null} if not found.
     */
    public static String getProperty(String name) {
        return getProperty(DefaultPropertySource.getInstance(), name);
    }

    /**
     * Maps a property value to a desired type. If the property is not found, the method returns a default value
     * supplied by the given supplier.
     */
    public static <T> T mapProperty(String name, Function<String, T> mapper, Supplier<T> defaultValueSupplier) {
        var stringValue = getProperty(name);
        return stringValue == null ? defaultValueSupplier.get() : mapper.apply(stringValue);
    }

    /**
     * Resolves an integer property by key, or returns the given default value if not found.
     *
     * @throws NumberFormatException if the property value is not a valid integer
     */
    public static Integer getIntegerProperty(String name, Integer defaultValue) {
        return Optional.ofNullable(getProperty(name)).map(String::trim).map(Integer::valueOf).orElse(defaultValue);
    }

    static String getProperty(PropertySource source, String name) {
        return source.substituteProperties(source.get(name));
    }
}
