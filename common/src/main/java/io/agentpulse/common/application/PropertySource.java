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

import java.util.HashSet;
import java.util.Set;

/**
 * Source of application configuration values.
 * <p>
 * Besides plain lookups, a property source can expand {@code ${name}} and {@code ${name:default}} placeholders,
 * resolving them against itself. Placeholders may be nested, both in names and in default values.
 */
@FunctionalInterface
public interface PropertySource {

    /**
     * Returns the raw value for the given key, or {@code null} if the key is unknown.
     */
    String get(String name);

    /**
     * Returns a source that consults this source first and falls back to the given source.
     */
    default PropertySource andThen(PropertySource next) {
        return name -> {
            String value = get(name);
            return value == null ? next.get(name) : value;
        };
    }

    /**
     * Substitutes all placeholders in the template.
     *
     * @throws IllegalStateException if a placeholder without default cannot be resolved or properties refer to
     *                               each other in a loop
     */
    default String substituteProperties(String template) {
        return substitute(template, new HashSet<>());
    }

    private String substitute(String template, Set<String> resolving) {
        if (template == null) {
            return null;
        }
        StringBuilder result = new StringBuilder();
        int position = 0;
        while (position < template.length()) {
            int start = template.indexOf("${", position);
            if (start < 0) {
                result.append(template, position, template.length());
                break;
            }
            int end = findClosingBrace(template, start + 2);
            if (end < 0) {
                result.append(template, position, template.length());
                break;
            }
            result.append(template, position, start);
            String expression = substitute(template.substring(start + 2, end), resolving);
            int separator = expression.indexOf(':');
            String name = separator < 0 ? expression : expression.substring(0, separator);
            String defaultValue = separator < 0 ? null : expression.substring(separator + 1);
            String value = get(name);
            if (value == null) {
                if (defaultValue == null) {
                    throw new IllegalStateException(String.format("Property for %s is missing", name));
                }
                result.append(defaultValue);
            } else {
                if (!resolving.add(name)) {
                    throw new IllegalStateException(String.format("Property %s refers to itself", name));
                }
                result.append(substitute(value, resolving));
                resolving.remove(name);
            }
            position = end + 1;
        }
        return result.toString();
    }

    private static int findClosingBrace(String template, int from) {
        int depth = 1;
        for (int i = from; i < template.length(); i++) {
            if (template.startsWith("${", i)) {
                depth++;
                i++;
            } else if (template.charAt(i) == '}' && --depth == 0) {
                return i;
            }
        }
        return -1;
    }
}
