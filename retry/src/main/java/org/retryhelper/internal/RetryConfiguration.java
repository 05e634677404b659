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
import org.jspecify.annotations.Nullable;
import org.retryhelper.AsyncTryCallback;
import org.retryhelper.MaxTryCount;
import org.retryhelper.TimeLimit;
import org.slf4j.Logger;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The immutable settings of a retry. Every {@code with} and {@code add} method returns a new instance and leaves the
 * receiver untouched, so an instance can be shared freely between threads and used as a template for many invocations.
 * <p>
 * By default, the following settings are used:
 * <ul>
 *     <li>The end condition is always fulfilled</li>
 *     <li>No exception is tolerated</li>
 *     <li>No callbacks</li>
 * </ul>
 * The try interval, max try count and time limit are given when the configuration is created.
 */
@NullMarked
public final class RetryConfiguration<T> {
    final Supplier<? extends Mono<T>> operation;
    final Function<@Nullable T, ? extends Mono<Boolean>> endCondition;
    final ExceptionPolicy exceptionPolicy;
    final MaxTryCount maxTryCount;
    final TimeLimit timeLimit;
    final Duration tryInterval;
    final List<AsyncTryCallback<T>> onSuccess;
    final List<AsyncTryCallback<T>> onFailure;
    final List<AsyncTryCallback<T>> onTimeout;
    final Logger log;

    private RetryConfiguration(Supplier<? extends Mono<T>> operation, Function<@Nullable T, ? extends Mono<Boolean>> endCondition, ExceptionPolicy exceptionPolicy,
                               MaxTryCount maxTryCount, TimeLimit timeLimit, Duration tryInterval,
                               List<AsyncTryCallback<T>> onSuccess, List<AsyncTryCallback<T>> onFailure, List<AsyncTryCallback<T>> onTimeout, Logger log) {
        this.operation = Objects.requireNonNull(operation, "Operation cannot be null");
        this.endCondition = Objects.requireNonNull(endCondition, "End condition cannot be null");
        this.exceptionPolicy = Objects.requireNonNull(exceptionPolicy, ExceptionPolicy.class.getSimpleName() + " cannot be null");
        this.maxTryCount = Objects.requireNonNull(maxTryCount, MaxTryCount.class.getSimpleName() + " cannot be null");
        this.timeLimit = Objects.requireNonNull(timeLimit, TimeLimit.class.getSimpleName() + " cannot be null");
        this.tryInterval = Objects.requireNonNull(tryInterval, "Try interval cannot be null");
        this.onSuccess = List.copyOf(onSuccess);
        this.onFailure = List.copyOf(onFailure);
        this.onTimeout = List.copyOf(onTimeout);
        this.log = Objects.requireNonNull(log, Logger.class.getSimpleName() + " cannot be null");
    }

    public static <T> RetryConfiguration<T> of(Supplier<? extends Mono<T>> operation, Duration tryInterval, MaxTryCount maxTryCount, TimeLimit timeLimit, Logger log) {
        return new RetryConfiguration<>(operation, __ -> Mono.just(true), ExceptionPolicy.propagate(), maxTryCount, timeLimit, tryInterval, List.of(), List.of(), List.of(), log);
    }

    public RetryConfiguration<T> withEndCondition(Function<@Nullable T, ? extends Mono<Boolean>> endCondition) {
        return new RetryConfiguration<>(operation, endCondition, exceptionPolicy, maxTryCount, timeLimit, tryInterval, onSuccess, onFailure, onTimeout, log);
    }

    public RetryConfiguration<T> withExceptionPolicy(ExceptionPolicy exceptionPolicy) {
        return new RetryConfiguration<>(operation, endCondition, exceptionPolicy, maxTryCount, timeLimit, tryInterval, onSuccess, onFailure, onTimeout, log);
    }

    public RetryConfiguration<T> withMaxTryCount(MaxTryCount maxTryCount) {
        return new RetryConfiguration<>(operation, endCondition, exceptionPolicy, maxTryCount, timeLimit, tryInterval, onSuccess, onFailure, onTimeout, log);
    }

    public RetryConfiguration<T> withTimeLimit(TimeLimit timeLimit) {
        return new RetryConfiguration<>(operation, endCondition, exceptionPolicy, maxTryCount, timeLimit, tryInterval, onSuccess, onFailure, onTimeout, log);
    }

    public RetryConfiguration<T> withTryInterval(Duration tryInterval) {
        return new RetryConfiguration<>(operation, endCondition, exceptionPolicy, maxTryCount, timeLimit, tryInterval, onSuccess, onFailure, onTimeout, log);
    }

    public RetryConfiguration<T> addOnSuccess(AsyncTryCallback<T> callback) {
        return new RetryConfiguration<>(operation, endCondition, exceptionPolicy, maxTryCount, timeLimit, tryInterval, append(onSuccess, callback), onFailure, onTimeout, log);
    }

    public RetryConfiguration<T> addOnFailure(AsyncTryCallback<T> callback) {
        return new RetryConfiguration<>(operation, endCondition, exceptionPolicy, maxTryCount, timeLimit, tryInterval, onSuccess, append(onFailure, callback), onTimeout, log);
    }

    public RetryConfiguration<T> addOnTimeout(AsyncTryCallback<T> callback) {
        return new RetryConfiguration<>(operation, endCondition, exceptionPolicy, maxTryCount, timeLimit, tryInterval, onSuccess, onFailure, append(onTimeout, callback), log);
    }

    public MaxTryCount maxTryCount() {
        return maxTryCount;
    }

    public TimeLimit timeLimit() {
        return timeLimit;
    }

    public Duration tryInterval() {
        return tryInterval;
    }

    public ExceptionPolicy exceptionPolicy() {
        return exceptionPolicy;
    }

    public List<AsyncTryCallback<T>> onSuccess() {
        return onSuccess;
    }

    public List<AsyncTryCallback<T>> onFailure() {
        return onFailure;
    }

    public List<AsyncTryCallback<T>> onTimeout() {
        return onTimeout;
    }

    private static <T> List<AsyncTryCallback<T>> append(List<AsyncTryCallback<T>> callbacks, AsyncTryCallback<T> callback) {
        Objects.requireNonNull(callback, "Callback cannot be null");
        List<AsyncTryCallback<T>> appended = new ArrayList<>(callbacks.size() + 1);
        appended.addAll(callbacks);
        appended.add(callback);
        return appended;
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", RetryConfiguration.class.getSimpleName() + "[", "]")
                .add("exceptionPolicy=" + exceptionPolicy)
                .add("maxTryCount=" + maxTryCount)
                .add("timeLimit=" + timeLimit)
                .add("tryInterval=" + tryInterval)
                .add("onSuccess=" + onSuccess.size())
                .add("onFailure=" + onFailure.size())
                .add("onTimeout=" + onTimeout.size())
                .add("log=" + log.getName())
                .toString();
    }
}
