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

import org.jspecify.annotations.NullMarked;

import java.util.Objects;

/**
 * Decides which exceptions thrown by the tried operation are tolerated.
 */
@NullMarked
public sealed interface ExceptionPolicy {

    static ExceptionPolicy propagate() {
        return Propagate.INSTANCE;
    }

    static ExceptionPolicy retryOn(Class<? extends Throwable> kind) {
        return new RetryOn(kind);
    }

    /**
     * Every exception thrown by the operation is rethrown.
     */
    record Propagate() implements ExceptionPolicy {
        private static final Propagate INSTANCE = new Propagate();
    }

    /**
     * Exceptions that are instances of {@code kind} are tolerated and the operation is tried again.
     */
    record RetryOn(Class<? extends Throwable> kind) implements ExceptionPolicy {
        public RetryOn {
            Objects.requireNonNull(kind, "Exception type cannot be null");
        }
    }
}
