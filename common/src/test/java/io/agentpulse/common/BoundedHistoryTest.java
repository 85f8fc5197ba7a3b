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

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class BoundedHistoryTest {

    @Test
    void add_keepsInsertionOrder() {
        var history = new BoundedHistory<String>(3);
        history.add("a");
        history.add("b");

        assertEquals(List.of("a", "b"), history.getAll());
        assertEquals(Optional.of("b"), history.getLatest());
    }

    @Test
    void add_evictsOldestWhenFull() {
        var history = new BoundedHistory<Integer>(3);

        IntStream.range(0, 3).forEach(history::add);
        Optional<Integer> evicted = history.add(3);

        assertEquals(Optional.of(0), evicted);
        assertEquals(List.of(1, 2, 3), history.getAll());
    }

    @Test
    void sizeNeverExceedsCapacity() {
        var history = new BoundedHistory<Integer>(10);

        IntStream.range(0, 1_000).forEach(history::add);

        assertEquals(10, history.size());
        assertEquals(IntStream.range(990, 1_000).boxed().toList(), history.getAll());
    }

    @Test
    void getLatest_emptyWhenNothingAdded() {
        assertTrue(new BoundedHistory<String>(1).getLatest().isEmpty());
    }

    @Test
    void findAndFilter_searchOldestFirst() {
        var history = new BoundedHistory<Integer>(5);
        List.of(1, 2, 3, 4).forEach(history::add);

        assertEquals(Optional.of(2), history.find(i -> i % 2 == 0));
        assertEquals(List.of(2, 4), history.filter(i -> i % 2 == 0));
    }

    @Test
    void getAll_returnsCopy() {
        var history = new BoundedHistory<String>(2);
        history.add("a");
        List<String> copy = history.getAll();

        history.add("b");

        assertEquals(List.of("a"), copy);
    }

    @Test
    void clear_removesEverything() {
        var history = new BoundedHistory<String>(2);
        history.add("a");

        history.clear();

        assertEquals(0, history.size());
        assertTrue(history.getAll().isEmpty());
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new BoundedHistory<String>(0));
    }
}
