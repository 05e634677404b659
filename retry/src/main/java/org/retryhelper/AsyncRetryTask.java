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
import org.retryhelper.internal.ExceptionPolicy;
import org.retryhelper.internal.RetryConfiguration;
import org.retryhelper.internal.Suspension;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.Objects;
import java.util.function.BooleanSupplier;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

import static org.retryhelper.internal.RetryExecution.executeWithRetry;

/**
 * An operation that is tried without blocking. Create one with {@link RetryHelper#attemptAsync(Supplier)}.
 * <p>
 * The terminal methods ({@code until...}) return a cold {@link Mono}: nothing is tried until it's subscribed, and every
 * subscription is a new, independent retry. Disposing the subscription stops the retry.
 *
 * @param <T> The type of the result of the operation
 */
@NullMarked
public final class AsyncRetryTask<T> extends AbstractRetryTask<T, AsyncRetryTask<T>> {

    private final Scheduler scheduler;

    AsyncRetryTask(RetryConfiguration<T> configuration, Scheduler scheduler) {
        super(configuration);
        this.scheduler = Objects.requireNonNull(scheduler, Scheduler.class.getSimpleName() + " cannot be null");
    }

    @Override
    AsyncRetryTask<T> newTask(RetryConfiguration<T> configuration) {
        return new AsyncRetryTask<>(configuration, scheduler);
    }

    /**
     * Configure the scheduler used to wait between tries.
     *
     * @param scheduler The scheduler
     * @return A new task that waits on the given scheduler
     */
    public AsyncRetryTask<T> withScheduler(Scheduler scheduler) {
        return new AsyncRetryTask<>(configuration, scheduler);
    }

    public AsyncRetryTask<T> onSuccessAsync(Supplier<? extends Mono<?>> successAction) {
        Objects.requireNonNull(successAction, "Success action cannot be null");
        return onSuccessAsync((result, tryCount) -> successAction.get().then());
    }

    public AsyncRetryTask<T> onSuccessAsync(Function<? super T, ? extends Mono<?>> successAction) {
        Objects.requireNonNull(successAction, "Success action cannot be null");
        return onSuccessAsync((result, tryCount) -> successAction.apply(result).then());
    }

    /**
     * Add a non-blocking action to run when the operation succeeds. The next action is not started until the {@code Mono}
     * returned by this action has completed.
     */
    public AsyncRetryTask<T> onSuccessAsync(AsyncTryCallback<? super T> successAction) {
        return newTask(configuration.addOnSuccess(narrow(successAction)));
    }

    public AsyncRetryTask<T> onFailureAsync(Supplier<? extends Mono<?>> failureAction) {
        Objects.requireNonNull(failureAction, "Failure action cannot be null");
        return onFailureAsync((result, tryCount) -> failureAction.get().then());
    }

    public AsyncRetryTask<T> onFailureAsync(Function<? super T, ? extends Mono<?>> failureAction) {
        Objects.requireNonNull(failureAction, "Failure action cannot be null");
        return onFailureAsync((result, tryCount) -> failureAction.apply(result).then());
    }

    /**
     * Add a non-blocking action to run after each try that fails. The next try is not started until the {@code Mono}
     * returned by this action, and those of the actions added after it, have completed.
     */
    public AsyncRetryTask<T> onFailureAsync(AsyncTryCallback<? super T> failureAction) {
        return newTask(configuration.addOnFailure(narrow(failureAction)));
    }

    public AsyncRetryTask<T> onTimeoutAsync(Supplier<? extends Mono<?>> timeoutAction) {
        Objects.requireNonNull(timeoutAction, "Timeout action cannot be null");
        return onTimeoutAsync((result, tryCount) -> timeoutAction.get().then());
    }

    public AsyncRetryTask<T> onTimeoutAsync(Function<? super T, ? extends Mono<?>> timeoutAction) {
        Objects.requireNonNull(timeoutAction, "Timeout action cannot be null");
        return onTimeoutAsync((result, tryCount) -> timeoutAction.apply(result).then());
    }

    /**
     * Add a non-blocking action to run when the retry gives up because the time limit or the max try count was reached.
     */
    public AsyncRetryTask<T> onTimeoutAsync(AsyncTryCallback<? super T> timeoutAction) {
        return newTask(configuration.addOnTimeout(narrow(timeoutAction)));
    }

    /**
     * Try the operation until the end condition is fulfilled, or the time limit or max try count is reached, or the
     * operation fails with an exception.
     *
     * @param endCondition The condition that the result of the operation must fulfill
     * @return A {@code Mono} with the result of the successful try, empty if the result is {@code null}. It fails with
     * {@link RetryTimeoutException} if the time limit or max try count is reached.
     */
    public Mono<T> until(Predicate<? super T> endCondition) {
        Objects.requireNonNull(endCondition, "End condition cannot be null");
        return execute(configuration.withEndCondition(result -> Mono.fromCallable(() -> endCondition.test(result))));
    }

    /**
     * Try the operation until the end condition, which doesn't depend on the result, is fulfilled.
     *
     * @see #until(Predicate)
     */
    public Mono<T> until(BooleanSupplier endCondition) {
        Objects.requireNonNull(endCondition, "End condition cannot be null");
        return execute(configuration.withEndCondition(__ -> Mono.fromCallable(endCondition::getAsBoolean)));
    }

    /**
     * Try the operation until the non-blocking end condition is fulfilled. An empty {@code Mono} counts as not fulfilled.
     *
     * @see #until(Predicate)
     */
    public Mono<T> untilAsync(Function<? super T, ? extends Mono<Boolean>> endCondition) {
        Objects.requireNonNull(endCondition, "End condition cannot be null");
        return execute(configuration.withEndCondition(endCondition::apply));
    }

    /**
     * Try the operation until the non-blocking end condition, which doesn't depend on the result, is fulfilled.
     *
     * @see #untilAsync(Function)
     */
    public Mono<T> untilAsync(Supplier<? extends Mono<Boolean>> endCondition) {
        Objects.requireNonNull(endCondition, "End condition cannot be null");
        return execute(configuration.withEndCondition(__ -> endCondition.get()));
    }

    /**
     * Try the operation until it doesn't fail with an exception.
     */
    public Mono<T> untilNoException() {
        return untilNoException(Exception.class);
    }

    /**
     * Try the operation until it doesn't fail with an exception of the given type, or a subtype of it. Any other exception
     * fails the returned {@code Mono} immediately.
     */
    public Mono<T> untilNoException(Class<? extends Throwable> exceptionType) {
        return execute(configuration.withExceptionPolicy(ExceptionPolicy.retryOn(exceptionType)));
    }

    private Mono<T> execute(RetryConfiguration<T> configuration) {
        return executeWithRetry(configuration, Suspension.nonBlocking(scheduler));
    }

    private static <T> AsyncTryCallback<T> narrow(AsyncTryCallback<? super T> callback) {
        Objects.requireNonNull(callback, "Callback cannot be null");
        return callback::apply;
    }
}
