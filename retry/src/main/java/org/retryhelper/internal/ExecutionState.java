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

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.StringJoiner;
import java.util.function.LongSupplier;

/**
 * The mutable state of one invocation of a retry. A new instance is created for every invocation and is never shared.
 */
final class ExecutionState<T> {

    private final LongSupplier nanoClock;
    private final long startedAt;
    private int triesMade;
    private @Nullable T lastResult;
    private @Nullable Throwable lastError;

    ExecutionState(LongSupplier nanoClock) {
        this.nanoClock = nanoClock;
        this.startedAt = nanoClock.getAsLong();
    }

    void record(AttemptOutcome<T> outcome) {
        triesMade++;
        if (outcome instanceof AttemptOutcome.Returned<T> returned) {
            lastResult = returned.value();
            lastError = null;
        } else if (outcome instanceof AttemptOutcome.Failed<T> failed) {
            lastResult = null;
            lastError = failed.error();
        }
    }

    int triesMade() {
        return triesMade;
    }

    @Nullable
    T lastResult() {
        return lastResult;
    }

    @Nullable
    Throwable lastError() {
        return lastError;
    }

    Duration elapsed() {
        return Duration.ofNanos(nanoClock.getAsLong() - startedAt);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", ExecutionState.class.getSimpleName() + "[", "]")
                .add("triesMade=" + triesMade)
                .add("elapsed=" + elapsed())
                .add("lastResult=" + lastResult)
                .add("lastError=" + lastError)
                .toString();
    }
}
