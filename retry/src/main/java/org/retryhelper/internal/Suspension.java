/*
 * Copyright 2020 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.retryhelper.internal;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * How the retry loop waits between two tries.
 */
public interface Suspension {

    Mono<Void> suspendFor(Duration interval);

    /**
     * Waits by putting the calling thread to sleep.
     */
    static Suspension blocking() {
        return interval -> {
            if (interval.isZero() || interval.isNegative()) {
                return Mono.empty();
            }
            long nanos = saturatedNanos(interval);
            return Mono.fromRunnable(() -> {
                try {
                    TimeUnit.NANOSECONDS.sleep(nanos);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted while waiting " + interval + " before next try", e);
                }
            });
        };
    }

    /**
     * Waits without blocking by scheduling the next try on the given {@code scheduler}.
     */
    static Suspension nonBlocking(Scheduler scheduler) {
        Objects.requireNonNull(scheduler, "Scheduler cannot be null");
        return interval -> {
            if (interval.isZero() || interval.isNegative()) {
                return Mono.empty();
            }
            return Mono.delay(Duration.ofNanos(saturatedNanos(interval)), scheduler).then();
        };
    }

    // Durations beyond ~292 years don't fit in a long of nanoseconds
    private static long saturatedNanos(Duration interval) {
        return interval.compareTo(Duration.ofNanos(Long.MAX_VALUE)) >= 0 ? Long.MAX_VALUE : interval.toNanos();
    }
}
