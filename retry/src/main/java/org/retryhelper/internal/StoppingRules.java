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

import org.retryhelper.MaxTryCount;
import org.retryhelper.StopReason;
import org.retryhelper.TimeLimit;

import java.time.Duration;
import java.util.Optional;

/**
 * Decides whether another try is allowed after a try that didn't succeed. The time limit is checked before the max try count.
 */
final class StoppingRules {

    private StoppingRules() {
    }

    static Optional<StopReason> evaluate(TimeLimit timeLimit, MaxTryCount maxTryCount, Duration elapsed, int triesMade) {
        if (timeLimit.isExceededBy(elapsed)) {
            return Optional.of(StopReason.TIME_LIMIT_EXCEEDED);
        } else if (maxTryCount.isReachedBy(triesMade)) {
            return Optional.of(StopReason.TRY_COUNT_EXCEEDED);
        }
        return Optional.empty();
    }

    static String describe(StopReason reason, TimeLimit timeLimit, MaxTryCount maxTryCount) {
        return switch (reason) {
            case TIME_LIMIT_EXCEEDED -> "The maximum try time " + timeLimit + " for the operation has been exceeded.";
            case TRY_COUNT_EXCEEDED -> "The maximum try count " + maxTryCount + " for the operation has been exceeded.";
        };
    }
}
