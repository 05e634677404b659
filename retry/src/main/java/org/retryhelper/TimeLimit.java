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

package org.retryhelper;

import org.jspecify.annotations.NullMarked;

import java.time.Duration;
import java.util.Objects;

/**
 * The maximum time that may elapse, counted from the start of the first try, before giving up.
 */
@NullMarked
public sealed interface TimeLimit {

    static TimeLimit of(Duration duration) {
        return new Limit(duration);
    }

    static TimeLimit ofMillis(long millis) {
        return new Limit(Duration.ofMillis(millis));
    }

    static TimeLimit infinite() {
        return Infinite.INSTANCE;
    }

    /**
     * @param elapsed The time elapsed since the first try started
     * @return {@code true} if the time limit has been reached, {@code false} otherwise.
     */
    boolean isExceededBy(Duration elapsed);

    record Limit(Duration duration) implements TimeLimit {
        public Limit {
            Objects.requireNonNull(duration, "Time limit duration cannot be null");
        }

        @Override
        public boolean isExceededBy(Duration elapsed) {
            return elapsed.compareTo(duration) >= 0;
        }

        @Override
        public String toString() {
            return duration.toString();
        }
    }

    record Infinite() implements TimeLimit {
        private static final Infinite INSTANCE = new Infinite();

        @Override
        public boolean isExceededBy(Duration elapsed) {
            return false;
        }

        @Override
        public String toString() {
            return "infinite";
        }
    }
}
