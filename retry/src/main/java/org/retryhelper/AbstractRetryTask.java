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
import org.retryhelper.internal.RetryConfiguration;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Settings shared by {@link RetryTask} and {@link AsyncRetryTask}.
 * <p>
 * A retry task is thread-safe and immutable, every method returns a new instance and leaves the original untouched:
 * <pre>
 * RetryTask&lt;Boolean&gt; task = RetryHelper.instance().attempt(() -&gt; server.isUp()).withMaxTryCount(5);
 * // Tries at most 5 times
 * task.until(up -&gt; up);
 * // Tries at most 10 times
 * task.withMaxTryCount(10).until(up -&gt; up);
 * // Still tries at most 5 times
 * task.until(up -&gt; up);
 * </pre>
 *
 * @param <T>    The type of the result of the operation
 * @param <SELF> The concrete type of the task
 */
@NullMarked
public abstract class AbstractRetryTask<T, SELF extends AbstractRetryTask<T, SELF>> {

    final RetryConfiguration<T> configuration;

    AbstractRetryTask(RetryConfiguration<T> configuration) {
        this.configuration = Objects.requireNonNull(configuration, RetryConfiguration.class.getSimpleName() + " cannot be null");
    }

    abstract SELF newTask(RetryConfiguration<T> configuration);

    /**
     * Configure the max number of times the operation is tried. A max try count of {@code 0} still tries the operation once.
     *
     * @param maxTryCount The max try count
     * @return A new task with the max try count applied
     */
    public SELF withMaxTryCount(int maxTryCount) {
        return newTask(configuration.withMaxTryCount(MaxTryCount.limit(maxTryCount)));
    }

    /**
     * Try an infinite number of times (unless configured otherwise in {@link RetryHelper}, this is the default).
     *
     * @return A new task without a max try count
     */
    public SELF withInfiniteTryCount() {
        return newTask(configuration.withMaxTryCount(MaxTryCount.infinite()));
    }

    /**
     * Configure the max time to spend trying, counted from the start of the first try.
     *
     * @param timeLimit The time limit
     * @return A new task with the time limit applied
     */
    public SELF withTimeLimit(Duration timeLimit) {
        return newTask(configuration.withTimeLimit(TimeLimit.of(timeLimit)));
    }

    /**
     * Configure the max time, in milliseconds, to spend trying.
     *
     * @see #withTimeLimit(Duration)
     */
    public SELF withTimeLimit(long millis) {
        return newTask(configuration.withTimeLimit(TimeLimit.ofMillis(millis)));
    }

    /**
     * Remove the time limit.
     */
    public SELF withoutTimeLimit() {
        return newTask(configuration.withTimeLimit(TimeLimit.infinite()));
    }

    /**
     * Configure the time to wait between two tries.
     *
     * @param tryInterval The time to wait
     * @return A new task with the try interval applied
     */
    public SELF withTryInterval(Duration tryInterval) {
        Objects.requireNonNull(tryInterval, "Try interval cannot be null");
        return newTask(configuration.withTryInterval(tryInterval));
    }

    /**
     * Configure the time, in milliseconds, to wait between two tries.
     *
     * @see #withTryInterval(Duration)
     */
    public SELF withTryInterval(long millis) {
        return newTask(configuration.withTryInterval(Duration.ofMillis(millis)));
    }

    /**
     * Add an action to run when the operation succeeds.
     */
    public SELF onSuccess(Runnable successAction) {
        Objects.requireNonNull(successAction, "Success action cannot be null");
        return onSuccess((result, tryCount) -> successAction.run());
    }

    /**
     * Add an action to run when the operation succeeds. The result of the successful try is passed to the action.
     */
    public SELF onSuccess(Consumer<? super T> successAction) {
        Objects.requireNonNull(successAction, "Success action cannot be null");
        return onSuccess((result, tryCount) -> successAction.accept(result));
    }

    /**
     * Add an action to run when the operation succeeds. The result of the successful try, and the number of tries made
     * including the successful one, are passed to the action. Actions are run in the order they were added.
     */
    public SELF onSuccess(TryCallback<? super T> successAction) {
        return newTask(configuration.addOnSuccess(toAsync(successAction)));
    }

    /**
     * Add an action to run after each try that fails, before the next try.
     */
    public SELF onFailure(Runnable failureAction) {
        Objects.requireNonNull(failureAction, "Failure action cannot be null");
        return onFailure((result, tryCount) -> failureAction.run());
    }

    /**
     * Add an action to run after each try that fails, before the next try. The result of the failed try is passed to
     * the action, it's {@code null} if the try threw a tolerated exception.
     */
    public SELF onFailure(Consumer<? super T> failureAction) {
        Objects.requireNonNull(failureAction, "Failure action cannot be null");
        return onFailure((result, tryCount) -> failureAction.accept(result));
    }

    /**
     * Add an action to run after each try that fails, before the next try. The result of the failed try and the number
     * of tries made so far are passed to the action.
     */
    public SELF onFailure(TryCallback<? super T> failureAction) {
        return newTask(configuration.addOnFailure(toAsync(failureAction)));
    }

    /**
     * Add an action to run when the retry gives up because the time limit or the max try count was reached.
     */
    public SELF onTimeout(Runnable timeoutAction) {
        Objects.requireNonNull(timeoutAction, "Timeout action cannot be null");
        return onTimeout((result, tryCount) -> timeoutAction.run());
    }

    /**
     * Add an action to run when the retry gives up. The result of the last try is passed to the action.
     */
    public SELF onTimeout(Consumer<? super T> timeoutAction) {
        Objects.requireNonNull(timeoutAction, "Timeout action cannot be null");
        return onTimeout((result, tryCount) -> timeoutAction.accept(result));
    }

    /**
     * Add an action to run when the retry gives up. The result of the last try and the total number of tries are passed
     * to the action.
     */
    public SELF onTimeout(TryCallback<? super T> timeoutAction) {
        return newTask(configuration.addOnTimeout(toAsync(timeoutAction)));
    }

    private static <T> AsyncTryCallback<T> toAsync(TryCallback<? super T> callback) {
        Objects.requireNonNull(callback, "Callback cannot be null");
        return (result, tryCount) -> Mono.fromRunnable(() -> callback.accept(result, tryCount));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + configuration + "]";
    }
}
