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

/**
 * The outcome of a single try of the operation
 */
sealed interface AttemptOutcome<T> {

    /**
     * The operation returned a value, possibly {@code null}
     */
    record Returned<T>(@Nullable T value) implements AttemptOutcome<T> {
    }

    /**
     * The operation threw an exception that is tolerated
     */
    record Failed<T>(Throwable error) implements AttemptOutcome<T> {
    }
}
