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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import io.backoff.common.Durations;
import java.time.Duration;
import java.util.Random;
import java.util.function.Supplier;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Computes the intervals between attempts: the growth of the base interval, and the jitter applied on top of it.
 */
@ThreadSafe
final class IntervalCalculator {
    private final BackoffConfig config;
    private final Supplier<Random> random;

    /**
     * Creates a new instance of the IntervalCalculator class.
     *
     * @param config The configuration to use.
     * @param random Supplies the random generator to draw jitter from. It is invoked once per draw, so it may return a
     *               thread-local generator.
     */
    IntervalCalculator(BackoffConfig config, Supplier<Random> random) {
        this.config = Preconditions.checkNotNull(config, "config");
        this.random = Preconditions.checkNotNull(random, "random");
    }

    /**
     * Computes the base (pre-jitter) interval that follows the given one.
     *
     * @param current The current base interval.
     * @return The next base interval. This is never greater than the configured maximum interval.
     */
    Duration next(Duration current) {
        long currentNanos = Durations.toNanosSaturated(current);
        long maxNanos = Durations.toNanosSaturated(this.config.getMaxInterval());
        if (currentNanos >= maxNanos / this.config.getMultiplier()) {
            return this.config.getMaxInterval();
        } else if (this.config.isExponential()) {
            return Duration.ofNanos(Math.min(maxNanos, (long) (currentNanos * this.config.getMultiplier())));
        } else {
            return this.config.getInitialInterval();
        }
    }

    /**
     * Applies jitter to the given base interval.
     *
     * @param base The base interval.
     * @return A duration drawn uniformly from [base - delta, base + delta] (both ends included, nanosecond precision),
     * where delta is the randomization factor multiplied by base. Never negative, and never longer than
     * {@link Durations#MAX_NANOS}.
     */
    Duration randomize(Duration base) {
        return randomize(base, this.config.getRandomizationFactor(), this.random.get());
    }

    @VisibleForTesting
    static Duration randomize(Duration base, double randomizationFactor, Random random) {
        long nanos = Math.max(0L, Durations.toNanosSaturated(base));
        double baseNanos = nanos;
        double delta = randomizationFactor * baseNanos;
        long low = Math.max(0L, (long) Math.ceil(baseNanos - delta));
        long high = Math.max(0L, (long) Math.floor(baseNanos + delta));
        if (high <= low) {
            return Duration.ofNanos(nanos);
        }

        // The bound of nextLong is exclusive.
        long bound = high == Long.MAX_VALUE ? high : high + 1;
        return Duration.ofNanos(random.nextLong(low, bound));
    }
}
