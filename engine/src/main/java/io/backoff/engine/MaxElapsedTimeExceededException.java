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

import java.time.Duration;
import lombok.Getter;

/**
 * Thrown by {@link Backoff} when more time than the configured maximum elapsed time has passed since the first attempt.
 */
public class MaxElapsedTimeExceededException extends BackoffExhaustedException {
    private static final long serialVersionUID = 1L;

    /**
     * How much time had passed since the first attempt when the engine gave up.
     */
    @Getter
    private final Duration elapsed;

    public MaxElapsedTimeExceededException(int attempts, Duration elapsed, Throwable last) {
        super(String.format("Giving up after %d failed attempt(s) and %d ms.", attempts, elapsed.toMillis()), attempts, last);
        this.elapsed = elapsed;
    }

    @Override
    public TerminationReason getReason() {
        return TerminationReason.TIME_BUDGET_EXHAUSTED;
    }
}
