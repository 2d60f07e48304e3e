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

import io.backoff.test.common.AssertExtensions;
import io.backoff.test.common.IntentionalException;
import java.time.Duration;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;
import lombok.val;
import org.junit.Assert;
import org.junit.Test;

/**
 * Unit tests for the RetryState class.
 */
public class RetryStateTests {

    /**
     * Each failure increments the attempt counter by exactly one and advances the interval.
     */
    @Test
    public void testRecordFailure() {
        val config = BackoffConfig.builder()
                                  .exponential(true)
                                  .multiplier(2)
                                  .initialInterval(Duration.ofMillis(10))
                                  .maxInterval(Duration.ofMillis(100))
                                  .randomizationFactor(0)
                                  .build();
        val state = newState(config, new AtomicLong());
        Assert.assertEquals("Unexpected initial attempt count.", 0, state.getAttempts());
        Assert.assertEquals("Unexpected initial interval.", Duration.ofMillis(10), state.getCurrentInterval());

        Assert.assertEquals("Unexpected delay.", Duration.ofMillis(20), state.recordFailure(new IntentionalException()));
        Assert.assertEquals("Unexpected attempt count.", 1, state.getAttempts());
        Assert.assertEquals("Unexpected delay.", Duration.ofMillis(40), state.recordFailure(new IntentionalException()));
        Assert.assertEquals("Unexpected attempt count.", 2, state.getAttempts());
        Assert.assertEquals("Unexpected current interval.", Duration.ofMillis(40), state.getCurrentInterval());
    }

    /**
     * The retry budget is checked after incrementing the attempt counter.
     */
    @Test
    public void testRetryBudget() {
        val config = BackoffConfig.builder().maxRetries(2).randomizationFactor(0).build();
        val state = newState(config, new AtomicLong());
        state.recordFailure(new IntentionalException());
        val last = new IntentionalException("last");
        val ex = AssertExtensions.assertThrows(RetriesExhaustedException.class, () -> state.recordFailure(last));
        Assert.assertEquals("Unexpected attempt count.", 2, ex.getAttempts());
        Assert.assertSame("Unexpected cause.", last, ex.getCause());
        Assert.assertEquals("Unexpected reason.", TerminationReason.RETRY_BUDGET_EXHAUSTED, ex.getReason());
    }

    /**
     * The time budget is exceeded only once the elapsed time is strictly greater than the maximum elapsed time.
     */
    @Test
    public void testTimeBudget() {
        val clock = new AtomicLong();
        val config = BackoffConfig.builder().maxElapsedTime(Duration.ofSeconds(2)).randomizationFactor(0).build();
        val state = newState(config, clock);

        clock.set(Duration.ofSeconds(2).toNanos());
        state.recordFailure(new IntentionalException());

        clock.incrementAndGet();
        val ex = AssertExtensions.assertThrows(MaxElapsedTimeExceededException.class,
                () -> state.recordFailure(new IntentionalException()));
        Assert.assertEquals("Unexpected attempt count.", 2, ex.getAttempts());
        Assert.assertEquals("Unexpected elapsed time.", Duration.ofSeconds(2).plusNanos(1), ex.getElapsed());
        Assert.assertEquals("Unexpected reason.", TerminationReason.TIME_BUDGET_EXHAUSTED, ex.getReason());
    }

    /**
     * Zero budgets never end the execution.
     */
    @Test
    public void testUnlimited() {
        val clock = new AtomicLong();
        val config = BackoffConfig.builder().randomizationFactor(0).build();
        val state = newState(config, clock);
        for (int i = 0; i < 1000; i++) {
            clock.addAndGet(Duration.ofHours(1).toNanos());
            state.recordFailure(new IntentionalException());
        }

        Assert.assertEquals("Unexpected attempt count.", 1000, state.getAttempts());
        Assert.assertEquals("Unexpected elapsed time.", Duration.ofHours(1000), state.getElapsed());
    }

    private static RetryState newState(BackoffConfig config, AtomicLong clock) {
        return new RetryState(config, new IntervalCalculator(config, Random::new), clock::get);
    }
}
