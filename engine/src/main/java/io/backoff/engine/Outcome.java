/**
 * Copyright Backoff Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.backoff.engine;

import io.backoff.common.Exceptions;

/**
 * Classification of the outcome of a single attempt.
 */
enum Outcome {
    SUCCESS,
    RETRYABLE,
    TERMINAL;

    /**
     * Classifies the failure of an attempt.
     *
     * @param failure The exception the attempt failed with, or null if it succeeded.
     * @return The Outcome.
     */
    static Outcome classify(Throwable failure) {
        if (failure == null) {
            return SUCCESS;
        }

        return findTerminal(failure) == null ? RETRYABLE : TERMINAL;
    }

    static TerminalException findTerminal(Throwable failure) {
        return Exceptions.findCause(failure, TerminalException.class);
    }
}
