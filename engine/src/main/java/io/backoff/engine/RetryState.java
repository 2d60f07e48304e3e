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

import io.backoff.common.TimeoutTimer;
import java.time.Duration;
import java.util.function.Supplier;
import javax.annotation.concurrent.NotThreadSafe;
import lombok.Getter;

/**
 * The state of a single {@link Backoff} execution. A new instance is created for every execution.
 */
@NotThreadSafe
final class RetryState {
    private final BackoffConfig config;
    private final IntervalCalculator intervals;
    private final TimeoutTimer timer;
    /**
     * The number of failed attempts so far.
     */
    @Getter
    private int attempts;
    /**
     * The base interval (before jitter) used for the last wait.
     */
    @Getter
    private Duration currentInterval;

    RetryState(BackoffConfig config, IntervalCalculator intervals, Supplier<Long> getNanos) {
        this.config = config;
        this.intervals = intervals;
        this.timer = new TimeoutTimer(config.getMaxElapsedTime(), getNanos);
        this.currentInterval = config.getInitialInterval();
        this.attempts = 0;
    }

    /**
     * Records a retryable failure and computes how long to wait before the next attempt.
     *
     * @param failure The failure.
     * @return The (randomized) delay before the next attempt.
     * @throws RetriesExhaustedException       If this failure used up the last allowed attempt.
     * @throws MaxElapsedTimeExceededException If more than the maximum elapsed time has passed since the first attempt.
     */
    Duration recordFailure(Throwable failure) {
        this.attempts++;
        if (this.config.getMaxRetries() != 0 && this.attempts >= this.config.getMaxRetries()) {
            throw new RetriesExhaustedException(this.attempts, failure);
        }

        if (this.timer.isExpired()) {
            throw new MaxElapsedTimeExceededException(this.attempts, this.timer.getElapsed(), failure);
        }

        this.currentInterval = this.intervals.next(this.currentInterval);
        return this.intervals.randomize(this.currentInterval);
    }

    /**
     * Gets the amount of time elapsed since this execution started.
     *
     * @return The elapsed time.
     */
    Duration getElapsed() {
        return this.timer.getElapsed();
    }
}
