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

package io.agentpulse.common;

import lombok.Getter;
import lombok.NonNull;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * A fixed-capacity, insertion-ordered buffer that evicts its oldest entry when full.
 * <p>
 * All operations are synchronized on the buffer, so a single instance forms one mutual-exclusion domain.
 *
 * @param <T> the type of entries
 */
public class BoundedHistory<T> {

    @Getter
    private final int capacity;
    private final Deque<T> entries;

    public BoundedHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity should be at least 1 but was " + capacity);
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    /**
     * Appends an entry, evicting the oldest entry if the capacity would otherwise be exceeded.
     *
     * @return the evicted entry, if any
     */
    public synchronized Optional<T> add(@NonNull T entry) {
        entries.addLast(entry);
        return entries.size() > capacity ? Optional.of(entries.pollFirst()) : Optional.empty();
    }

    /**
     * Returns a copy of all entries, oldest first.
     */
    public synchronized List<T> getAll() {
        return new ArrayList<>(entries);
    }

    public synchronized Optional<T> getLatest() {
        return Optional.ofNullable(entries.peekLast());
    }

    /**
     * Returns the oldest entry matching the predicate.
     */
    public synchronized Optional<T> find(Predicate<? super T> predicate) {
        return entries.stream().filter(predicate).findFirst();
    }

    /**
     * Returns all entries matching the predicate, oldest first.
     */
    public synchronized List<T> filter(Predicate<? super T> predicate) {
        return entries.stream().filter(predicate).toList();
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }
}
