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

import java.time.Duration;

/**
 * Schedules one-off tasks after a delay.
 * <p>
 * Periodic work is expressed by having a task schedule its own successor, so a failing or slow run never
 * overlaps with the next one.
 */
public interface TaskScheduler {

    /**
     * Schedules a task to run once after the given delay.
     *
     * @param delay the delay before the task runs
     * @param task  the task to run
     * @return a registration that cancels the task if it has not started yet
     */
    Registration schedule(Duration delay, Runnable task);

    /**
     * Stops the scheduler. Pending tasks are discarded.
     */
    void shutdown();
}
