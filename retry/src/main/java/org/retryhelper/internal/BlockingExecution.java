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
import reactor.core.publisher.Mono;
import reactor.core.publisher.Signal;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Awaits a {@link Mono} on the calling thread and rethrows its error as-is, even if it's a checked exception.
 * <p>
 * The outcome is materialized before it's handed to the {@link CompletableFuture} so that the error is never unwrapped
 * or wrapped on its way to the caller.
 */
public class BlockingExecution {

    public static <T> @Nullable T await(Mono<T> mono) {
        CompletableFuture<Signal<T>> future = mono.materialize().toFuture();
        Signal<T> signal;
        try {
            signal = future.get();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the retry to complete", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Retry completed exceptionally without an error signal", e);
        }

        if (signal == null || signal.isOnComplete()) {
            return null;
        } else if (signal.isOnError()) {
            return safeRethrow(signal.getThrowable());
        }
        return signal.get();
    }

    private static <T> @Nullable T safeRethrow(Throwable t) {
        BlockingExecution.safeRethrow0(t);
        return null;
    }

    @SuppressWarnings("unchecked")
    private static <T extends Throwable> void safeRethrow0(Throwable t) throws T {
        throw (T) t;
    }
}
