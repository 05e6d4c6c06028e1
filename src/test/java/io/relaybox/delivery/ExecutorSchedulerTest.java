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

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.testng.annotations.Test;

public class ExecutorSchedulerTest {

    @Test
    public void shouldRunOneShotTask() throws Exception {
        try (var scheduler = new ExecutorScheduler()) {
            var latch = new CountDownLatch(1);
            scheduler.schedule(latch::countDown, Duration.ofMillis(10));
            assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        }
    }

    @Test
    public void shouldKeepPeriodicTaskRunningAfterFailure() throws Exception {
        try (var scheduler = new ExecutorScheduler()) {
            var runs = new AtomicInteger();
            var latch = new CountDownLatch(3);
            scheduler.scheduleAtFixedRate(() -> {
                latch.countDown();
                if (runs.incrementAndGet() == 1) {
                    throw new IllegalStateException("boom");
                }
            }, Duration.ZERO, Duration.ofMillis(10));
            assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        }
    }

    @Test
    public void shouldNotRunCancelledTask() throws Exception {
        try (var scheduler = new ExecutorScheduler()) {
            var runs = new AtomicInteger();
            var cancellable = scheduler.schedule(runs::incrementAndGet, Duration.ofMillis(200));
            cancellable.cancel();
            Thread.sleep(400);
            assertThat(runs).hasValue(0);
        }
    }
}
