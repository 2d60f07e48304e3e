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
package io.backoff.common;

import com.google.common.base.Preconditions;
import java.time.Duration;
import java.util.function.Supplier;
import lombok.Getter;
import lombok.ToString;

/**
 * Measures how much time has passed since it was created, relative to a time budget.
 * A zero budget means "unbounded": such a timer never expires. A negative budget is already expired.
 */
@ToString(of = { "budget" })
public class TimeoutTimer {
    private final Supplier<Long> getNanos;
    private final long initialNanos;
    @Getter
    private final Duration budget;

    /**
     * Creates a new instance of the TimeoutTimer class.
     *
     * @param budget The time budget. Zero means unbounded.
     */
    public TimeoutTimer(Duration budget) {
        this(budget, System::nanoTime);
    }

    /**
     * Creates a new instance of the TimeoutTimer class.
     *
     * @param budget   The time budget. Zero means unbounded.
     * @param getNanos The supplier of nanoseconds.
     */
    public TimeoutTimer(Duration budget, Supplier<Long> getNanos) {
        Preconditions.checkNotNull(budget, "budget");
        this.budget = budget;
        this.getNanos = Preconditions.checkNotNull(getNanos, "getNanos");
        this.initialNanos = getNanos.get();
    }

    /**
     * Returns the time elapsed since this timer was created.
     *
     * @return The elapsed time.
     */
    public Duration getElapsed() {
        return Duration.ofNanos(getNanos.get() - initialNanos);
    }

    /**
     * Gets a value indicating whether the elapsed time has gone past the budget. An elapsed time exactly equal to
     * the budget does not count as expired.
     *
     * @return True if the budget is bounded and has been exceeded, false otherwise.
     */
    public boolean isExpired() {
        return !this.budget.isZero() && getElapsed().compareTo(this.budget) > 0;
    }
}
