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

/**
 * The maximum number of times an operation is tried before giving up.
 */
@NullMarked
public sealed interface MaxTryCount {

    static MaxTryCount limit(int limit) {
        return new Limit(limit);
    }

    static MaxTryCount infinite() {
        return Infinite.INSTANCE;
    }

    /**
     * @param triesMade The number of tries completed so far
     * @return {@code true} if no more tries are allowed, {@code false} otherwise.
     */
    boolean isReachedBy(int triesMade);

    record Limit(int limit) implements MaxTryCount {
        public Limit {
            if (limit < 0) {
                throw new IllegalArgumentException("Max try count cannot be negative");
            }
        }

        @Override
        public boolean isReachedBy(int triesMade) {
            return triesMade >= limit;
        }

        @Override
        public String toString() {
            return String.valueOf(limit);
        }
    }

    record Infinite() implements MaxTryCount {
        private static final Infinite INSTANCE = new Infinite();

        @Override
        public boolean isReachedBy(int triesMade) {
            return false;
        }

        @Override
        public String toString() {
            return "infinite";
        }
    }
}
