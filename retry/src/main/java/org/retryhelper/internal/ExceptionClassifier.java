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

import org.slf4j.Logger;

/**
 * Classifies exceptions thrown by the tried operation as either fatal (rethrown immediately) or tolerated (tried again).
 */
final class ExceptionClassifier {

    private ExceptionClassifier() {
    }

    static boolean isTolerated(Throwable error, ExceptionPolicy policy, Logger log) {
        boolean tolerated = !isUnrecoverable(error)
                && policy instanceof ExceptionPolicy.RetryOn retryOn
                && retryOn.kind().isInstance(error);
        if (tolerated) {
            log.debug("{} detected when trying; continue trying...", error.getClass().getName(), error);
        } else {
            log.error("{} detected when trying; throwing...", error.getClass().getName());
        }
        return tolerated;
    }

    static boolean isUnrecoverable(Throwable error) {
        return error instanceof VirtualMachineError || error instanceof LinkageError;
    }
}
