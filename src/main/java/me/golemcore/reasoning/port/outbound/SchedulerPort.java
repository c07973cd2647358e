/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.reasoning.port.outbound;

import java.time.Duration;

/**
 * Port for delayed and periodic background tasks: session idle clocks,
 * debounced persistence and the notebook sweep.
 */
public interface SchedulerPort {

    /**
     * Runs the task once after the delay.
     */
    ScheduledTask schedule(Runnable task, Duration delay);

    /**
     * Runs the task repeatedly, first after one period.
     */
    ScheduledTask scheduleAtFixedRate(Runnable task, Duration period);

    /**
     * Handle of a scheduled task.
     */
    interface ScheduledTask {

        /**
         * Prevents further runs. Cancelling twice, or after a one-shot task ran,
         * has no effect.
         */
        void cancel();

        boolean isCancelled();
    }
}
