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
 * Thrown when a retry gives up because the time limit or the max try count was reached before the end condition was fulfilled.
 * The cause, if any, is the last exception that was tolerated during the retry.
 */
public class RetryTimeoutException extends RuntimeException {

    private final StopReason reason;
    private final int tryCount;

    public RetryTimeoutException(String message, StopReason reason, int tryCount, @Nullable Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.tryCount = tryCount;
    }

    /**
     * @return The stopping rule that ended the retry
     */
    public StopReason getReason() {
        return reason;
    }

    /**
     * @return The number of tries that were made
     */
    public int getTryCount() {
        return tryCount;
    }
}
