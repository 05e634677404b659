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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * Entry point for retrying operations. Holds the default settings that every new retry task starts with:
 *
 * <ul>
 *     <li>Try interval of {@value #DEFAULT_TRY_INTERVAL_MILLIS} ms</li>
 *     <li>Infinite max try count</li>
 *     <li>No time limit</li>
 * </ul>
 * <p>
 * A {@code RetryHelper} is immutable, use {@link #instance()} for the shared default instance or derive a new one with
 * different defaults:
 * <pre>
 * RetryHelper retryHelper = RetryHelper.instance().withDefaultTryInterval(Duration.ofMillis(100));
 * String content = retryHelper.attempt(() -&gt; readFile()).withMaxTryCount(3).untilNoException(IOException.class);
 * </pre>
 */
@NullMarked
public final class RetryHelper {
    public static final long DEFAULT_TRY_INTERVAL_MILLIS = 500;

    private static final RetryHelper INSTANCE = new RetryHelper();

    private final Logger log;
    private final Duration defaultTryInterval;
    private final MaxTryCount defaultMaxTryCount;
    private final TimeLimit defaultTimeLimit;

    private RetryHelper(Logger log, Duration defaultTryInterval, MaxTryCount defaultMaxTryCount, TimeLimit defaultTimeLimit) {
        this.log = Objects.requireNonNull(log, Logger.class.getSimpleName() + " cannot be null");
        this.defaultTryInterval = Objects.requireNonNull(defaultTryInterval, "Default try interval cannot be null");
        this.defaultMaxTryCount = Objects.requireNonNull(defaultMaxTryCount, MaxTryCount.class.getSimpleName() + " cannot be null");
        this.defaultTimeLimit = Objects.requireNonNull(defaultTimeLimit, TimeLimit.class.getSimpleName() + " cannot be null");
    }

    public RetryHelper() {
        this(LoggerFactory.getLogger(RetryHelper.class), Duration.ofMillis(DEFAULT_TRY_INTERVAL_MILLIS), MaxTryCount.infinite(), TimeLimit.infinite());
    }

    /**
     * @return The shared {@code RetryHelper} with the default settings
     */
    public static RetryHelper instance() {
        return INSTANCE;
    }

    public RetryHelper withDefaultTryInterval(Duration tryInterval) {
        return new RetryHelper(log, tryInterval, defaultMaxTryCount, defaultTimeLimit);
    }

    public RetryHelper withDefaultTryInterval(long millis) {
        return withDefaultTryInterval(Duration.ofMillis(millis));
    }

    public RetryHelper withDefaultMaxTryCount(int maxTryCount) {
        return new RetryHelper(log, defaultTryInterval, MaxTryCount.limit(maxTryCount), defaultTimeLimit);
    }

    public RetryHelper withDefaultTimeLimit(Duration timeLimit) {
        return new RetryHelper(log, defaultTryInterval, defaultMaxTryCount, TimeLimit.of(timeLimit));
    }

    public RetryHelper withDefaultTimeLimit(long millis) {
        return withDefaultTimeLimit(Duration.ofMillis(millis));
    }

    /**
     * Use another logger for tracing the retries made by tasks created from this helper.
     */
    public RetryHelper withLogger(Logger log) {
        return new RetryHelper(log, defaultTryInterval, defaultMaxTryCount, defaultTimeLimit);
    }

    public Duration getDefaultTryInterval() {
        return defaultTryInterval;
    }

    public MaxTryCount getDefaultMaxTryCount() {
        return defaultMaxTryCount;
    }

    public TimeLimit getDefaultTimeLimit() {
        return defaultTimeLimit;
    }

    /**
     * Create a task that tries the given operation on the calling thread.
     *
     * @param operation The operation to try
     * @return A new {@link RetryTask}
     */
    public <T> RetryTask<T> attempt(Callable<T> operation) {
        Objects.requireNonNull(operation, Callable.class.getSimpleName() + " cannot be null");
        return new RetryTask<>(newConfiguration(() -> fromCallable(operation)));
    }

    /**
     * Create a task that tries the given action on the calling thread. The result of the task is always {@code null}.
     *
     * @param action The action to try
     * @return A new {@link RetryTask}
     */
    public RetryTask<Void> attempt(ThrowingRunnable action) {
        Objects.requireNonNull(action, ThrowingRunnable.class.getSimpleName() + " cannot be null");
        return attempt(toCallable(action));
    }

    /**
     * Create a task that tries the given non-blocking operation. The operation is invoked once per try and the
     * {@code Mono} it returns is subscribed to, an empty {@code Mono} is treated as a {@code null} result.
     *
     * @param operation The operation to try
     * @return A new {@link AsyncRetryTask}
     */
    public <T> AsyncRetryTask<T> attemptAsync(Supplier<? extends Mono<T>> operation) {
        Objects.requireNonNull(operation, Supplier.class.getSimpleName() + " cannot be null");
        return new AsyncRetryTask<>(newConfiguration(operation), Schedulers.parallel());
    }

    /**
     * Create a task that tries the given blocking operation on the given {@code scheduler}, for example
     * {@link Schedulers#boundedElastic()}, without blocking the caller.
     *
     * @param operation The operation to try
     * @param scheduler The scheduler to run the operation on
     * @return A new {@link AsyncRetryTask}
     */
    public <T> AsyncRetryTask<T> attemptAsync(Callable<T> operation, Scheduler scheduler) {
        Objects.requireNonNull(operation, Callable.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(scheduler, Scheduler.class.getSimpleName() + " cannot be null");
        return attemptAsync(() -> fromCallable(operation).subscribeOn(scheduler));
    }

    /**
     * Create a task that tries the given blocking action on the given {@code scheduler} without blocking the caller.
     *
     * @see #attemptAsync(Callable, Scheduler)
     */
    public AsyncRetryTask<Void> attemptAsync(ThrowingRunnable action, Scheduler scheduler) {
        Objects.requireNonNull(action, ThrowingRunnable.class.getSimpleName() + " cannot be null");
        return attemptAsync(toCallable(action), scheduler);
    }

    private <T> RetryConfiguration<T> newConfiguration(Supplier<? extends Mono<T>> operation) {
        return RetryConfiguration.of(operation, defaultTryInterval, defaultMaxTryCount, defaultTimeLimit, log);
    }

    /**
     * Unlike {@link Mono#fromCallable(Callable)}, every error thrown by the operation is signalled as {@code onError},
     * including {@link VirtualMachineError} and {@link LinkageError}, so that the retry fails instead of hanging.
     */
    private static <T> Mono<T> fromCallable(Callable<T> operation) {
        return Mono.create(sink -> {
            T result;
            try {
                result = operation.call();
            } catch (Throwable e) {
                sink.error(e);
                return;
            }
            sink.success(result);
        });
    }

    private static Callable<Void> toCallable(ThrowingRunnable action) {
        return () -> {
            action.run();
            return null;
        };
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", RetryHelper.class.getSimpleName() + "[", "]")
                .add("defaultTryInterval=" + defaultTryInterval)
                .add("defaultMaxTryCount=" + defaultMaxTryCount)
                .add("defaultTimeLimit=" + defaultTimeLimit)
                .add("log=" + log.getName())
                .toString();
    }
}
