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

import org.jspecify.annotations.Nullable;

/**
 * A callback that is invoked with the result of a try and the number of tries made.
 *
 * @param <T> The type of the result
 */
@FunctionalInterface
public interface TryCallback<T> {

    /**
     * @param result   The result of the last try, or {@code null} if the try threw a tolerated exception
     * @param tryCount The number of tries made
     */
    void accept(@Nullable T result, int tryCount);
}
