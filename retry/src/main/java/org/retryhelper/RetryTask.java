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
import org.jspecify.annotations.Nullable;
import org.retryhelper.internal.ExceptionPolicy;
import org.retryhelper.internal.RetryConfiguration;
import org.retryhelper.internal.Suspension;
import reactor.core.publisher.Mono;

import java.util.Objects;
import java.util.function.BooleanSupplier;
import java.util.function.Predicate;

import static org.retryhelper.internal.BlockingExecution.await;
import static org.retryhelper.internal.RetryExecution.executeWithRetry;

/**
 * An operation that is tried on the calling thread, which is blocked while waiting between tries. Create one with
 * {@link RetryHelper#attempt(java.util.concurrent.Callable)}.
 * <p>
 * Exceptions that are not tolerated, including checked exceptions thrown by the operation, are rethrown as-is.
 *
 * @param <T> The type of the result of the operation
 */
@NullMarked
public final class RetryTask<T> extends AbstractRetryTask<T, RetryTask<T>> {

    RetryTask(RetryConfiguration<T> configuration) {
        super(configuration);
    }

    @Override
    RetryTask<T> newTask(RetryConfiguration<T> configuration) {
        return new RetryTask<>(configuration);
    }

    /**
     * Try the operation until the end condition is fulfilled, or the time limit or max try count is reached, or the
     * operation throws an exception.
     *
     * @param endCondition The condition that the result of the operation must fulfill
     * @return The result of the successful try
     * @throws RetryTimeoutException If the time limit or max try count is reached
     */
    public @Nullable T until(Predicate<? super T> endCondition) {
        Objects.requireNonNull(endCondition, "End condition cannot be null");
        return execute(configuration.withEndCondition(result -> Mono.fromCallable(() -> endCondition.test(result))));
    }

    /**
     * Try the operation until the end condition, which doesn't depend on the result, is fulfilled.
     *
     * @see #until(Predicate)
     */
    public @Nullable T until(BooleanSupplier endCondition) {
        Objects.requireNonNull(endCondition, "End condition cannot be null");
        return execute(configuration.withEndCondition(__ -> Mono.fromCallable(endCondition::getAsBoolean)));
    }

    /**
     * Try the operation until it doesn't throw an exception.
     *
     * @return The result of the successful try
     * @throws RetryTimeoutException If the time limit or max try count is reached, the last exception is the cause.
     */
    public @Nullable T untilNoException() {
        return untilNoException(Exception.class);
    }

    /**
     * Try the operation until it doesn't throw an exception of the given type, or a subtype of it. Any other exception is
     * rethrown immediately.
     *
     * @param exceptionType The type of exception to tolerate
     * @return The result of the successful try
     * @throws RetryTimeoutException If the time limit or max try count is reached, the last exception is the cause.
     */
    public @Nullable T untilNoException(Class<? extends Throwable> exceptionType) {
        return execute(configuration.withExceptionPolicy(ExceptionPolicy.retryOn(exceptionType)));
    }

    private @Nullable T execute(RetryConfiguration<T> configuration) {
        return await(executeWithRetry(configuration, Suspension.blocking()));
    }
}
