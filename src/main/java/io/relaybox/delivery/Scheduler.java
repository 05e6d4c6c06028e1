/*
 * Copyright 2022 Neil Madden.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 *
 */

package io.relaybox.delivery;

import java.time.Duration;

/**
 * Runs tasks after a delay. Production code uses {@link ExecutorScheduler}; tests substitute a scheduler driven by
 * virtual time.
 */
public interface Scheduler {
    /**
     * Runs the task once after the given delay.
     */
    Cancellable schedule(Runnable task, Duration delay);

    /**
     * Runs the task after the initial delay and then repeatedly at the given period until cancelled.
     */
    Cancellable scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period);

    @FunctionalInterface
    interface Cancellable {
        /**
         * Cancels the task if it has not started yet. A run that is already in progress is not interrupted.
         */
        void cancel();
    }
}
