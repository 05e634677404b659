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
import org.retryhelper.AsyncTryCallback;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Invokes the callbacks registered for an event one by one, in registration order. A callback is not started until the
 * previous one has completed, and an error from a callback cancels the callbacks that remain.
 */
final class CallbackDispatcher {

    private CallbackDispatcher() {
    }

    static <T> Mono<Void> dispatch(List<AsyncTryCallback<T>> callbacks, @Nullable T result, int tryCount) {
        if (callbacks.isEmpty()) {
            return Mono.empty();
        }
        return Flux.fromIterable(callbacks)
                .concatMap(callback -> Mono.defer(() -> callback.apply(result, tryCount)))
                .then();
    }
}
