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

import lombok.Getter;

/**
 * Base class for the exceptions thrown by {@link Backoff} when it gives up because a budget has been used up.
 * The cause is set to the last retryable failure.
 */
public abstract class BackoffExhaustedException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /**
     * The number of failed attempts, including the last one.
     */
    @Getter
    private final int attempts;

    protected BackoffExhaustedException(String message, int attempts, Throwable last) {
        super(message, last);
        this.attempts = attempts;
    }

    /**
     * Gets the reason why the {@link Backoff} gave up.
     *
     * @return The TerminationReason.
     */
    public abstract TerminationReason getReason();
}
