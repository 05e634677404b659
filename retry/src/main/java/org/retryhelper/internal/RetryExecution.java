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

import org.retryhelper.RetryTimeoutException;
import org.retryhelper.StopReason;
import org.retryhelper.internal.AttemptOutcome.Failed;
import org.retryhelper.internal.AttemptOutcome.Returned;
import reactor.core.publisher.Mono;

import java.util.Objects;
import java.util.Optional;

/**
 * Internal class for executing an operation with retry capability. Never use this class directly from your own code!
 * <p>
 * The same loop is used for blocking and non-blocking retries, only the {@link Suspension} differs. Each round of the loop
 * tries the operation once and either emits the successful outcome, errors, or completes empty in which case the round
 * is resubscribed by {@link Mono#repeat()}.
 */
public class RetryExecution {

    public static <T> Mono<T> executeWithRetry(RetryConfiguration<T> configuration, Suspension suspension) {
        Objects.requireNonNull(configuration, RetryConfiguration.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(suspension, Suspension.class.getSimpleName() + " cannot be null");
        return Mono.defer(() -> {
            ExecutionState<T> state = new ExecutionState<>(System::nanoTime);
            configuration.log.debug("Starting trying with max try time {} and max try count {}.", configuration.timeLimit, configuration.maxTryCount);
            return Mono.defer(() -> tryOnce(configuration, state, suspension))
                    .repeat()
                    .next()
                    .flatMap(returned -> Mono.justOrEmpty(returned.value()));
        });
    }

    private static <T> Mono<Returned<T>> tryOnce(RetryConfiguration<T> configuration, ExecutionState<T> state, Suspension suspension) {
        configuration.log.debug("Trying time {}, elapsed time {}.", state.triesMade(), state.elapsed());
        return invokeOperation(configuration)
                .flatMap(outcome -> {
                    state.record(outcome);
                    if (outcome instanceof Returned<T> returned) {
                        return evaluateEndCondition(configuration, state, suspension, returned);
                    }
                    return afterUnsuccessfulTry(configuration, state, suspension);
                });
    }

    private static <T> Mono<AttemptOutcome<T>> invokeOperation(RetryConfiguration<T> configuration) {
        return Mono.defer(configuration.operation)
                .<AttemptOutcome<T>>map(value -> new Returned<>(value))
                .defaultIfEmpty(new Returned<>(null))
                .onErrorResume(error -> ExceptionClassifier.isTolerated(error, configuration.exceptionPolicy, configuration.log),
                        error -> Mono.<AttemptOutcome<T>>just(new Failed<>(error)));
    }

    private static <T> Mono<Returned<T>> evaluateEndCondition(RetryConfiguration<T> configuration, ExecutionState<T> state, Suspension suspension, Returned<T> returned) {
        return Mono.defer(() -> configuration.endCondition.apply(returned.value()))
                .defaultIfEmpty(false)
                .flatMap(fulfilled -> {
                    if (!fulfilled) {
                        return afterUnsuccessfulTry(configuration, state, suspension);
                    }
                    configuration.log.debug("Trying succeeded after time {} and total try count {}.", state.elapsed(), state.triesMade());
                    return CallbackDispatcher.dispatch(configuration.onSuccess, returned.value(), state.triesMade()).thenReturn(returned);
                });
    }

    private static <T> Mono<Returned<T>> afterUnsuccessfulTry(RetryConfiguration<T> configuration, ExecutionState<T> state, Suspension suspension) {
        int triesMade = state.triesMade();
        Optional<StopReason> stopReason = StoppingRules.evaluate(configuration.timeLimit, configuration.maxTryCount, state.elapsed(), triesMade);
        if (stopReason.isPresent()) {
            String message = StoppingRules.describe(stopReason.get(), configuration.timeLimit, configuration.maxTryCount);
            configuration.log.debug("Giving up after {} tries: {}", triesMade, message);
            return CallbackDispatcher.dispatch(configuration.onTimeout, state.lastResult(), triesMade)
                    .then(Mono.<Returned<T>>error(() -> new RetryTimeoutException(message, stopReason.get(), triesMade, state.lastError())));
        }

        return CallbackDispatcher.dispatch(configuration.onFailure, state.lastResult(), triesMade)
                .then(suspension.suspendFor(configuration.tryInterval))
                .then(Mono.<Returned<T>>empty());
    }
}
