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

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * The default chain of property sources, in order of precedence:
 * <ol>
 *     <li>JVM system properties</li>
 *     <li>environment variables</li>
 *     <li>{@code application-<environment>.properties} on the classpath, where the environment is taken from the
 *     {@code environment} property of the sources above</li>
 *     <li>{@code application.properties} on the classpath</li>
 * </ol>
 * System properties are read on every lookup; property files are loaded once, when the source is created.
 */
@Slf4j
public class DefaultPropertySource implements PropertySource {

    private static final DefaultPropertySource instance = new DefaultPropertySource();

    private final PropertySource delegate;

    public static DefaultPropertySource getInstance() {
        return instance;
    }

    public DefaultPropertySource() {
        PropertySource runtimeSource = ((PropertySource) System::getProperty).andThen(System::getenv);
        String environment = runtimeSource.get("environment");
        PropertySource fileSource = fromClasspath("application.properties");
        if (environment != null && !environment.isBlank()) {
            fileSource = fromClasspath("application-" + environment + ".properties").andThen(fileSource);
        }
        this.delegate = runtimeSource.andThen(fileSource);
    }

    @Override
    public String get(String name) {
        return delegate.get(name);
    }

    static PropertySource fromClasspath(String fileName) {
        Properties properties = new Properties();
        try (InputStream inputStream = DefaultPropertySource.class.getClassLoader().getResourceAsStream(fileName)) {
            if (inputStream == null) {
                log.trace("No {} found on the classpath", fileName);
            } else {
                properties.load(inputStream);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + fileName, e);
        }
        return properties::getProperty;
    }
}
