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

import io.backoff.common.util.ConfigurationException;
import io.backoff.common.util.InvalidPropertyValueException;
import io.backoff.test.common.AssertExtensions;
import java.time.Duration;
import java.util.Properties;
import lombok.val;
import org.junit.Assert;
import org.junit.Test;

/**
 * Unit tests for the BackoffConfig class.
 */
public class BackoffConfigTests {

    @Test
    public void testDefaults() {
        val config = BackoffConfig.defaults();
        Assert.assertEquals(0, config.getMaxRetries());
        Assert.assertFalse(config.isExponential());
        Assert.assertEquals(1.5, config.getMultiplier(), 0);
        Assert.assertEquals(Duration.ofMillis(500), config.getInitialInterval());
        Assert.assertEquals(Duration.ofSeconds(60), config.getMaxInterval());
        Assert.assertEquals(0.5, config.getRandomizationFactor(), 0);
        Assert.assertEquals(Duration.ZERO, config.getMaxElapsedTime());
        Assert.assertNull(config.getOnRetry());
    }

    /**
     * Each option can be set without affecting the others.
     */
    @Test
    public void testBuilder() {
        RetryListener listener = (ex, delay, attempts) -> { };
        val config = BackoffConfig.builder()
                                  .maxRetries(7)
                                  .exponential(true)
                                  .onRetry(listener)
                                  .build();
        Assert.assertEquals(7, config.getMaxRetries());
        Assert.assertTrue(config.isExponential());
        Assert.assertSame(listener, config.getOnRetry());
        Assert.assertEquals(1.5, config.getMultiplier(), 0);
        Assert.assertEquals(Duration.ofMillis(500), config.getInitialInterval());
        Assert.assertEquals(Duration.ofSeconds(60), config.getMaxInterval());
        Assert.assertEquals(0.5, config.getRandomizationFactor(), 0);
        Assert.assertEquals(Duration.ZERO, config.getMaxElapsedTime());
    }

    /**
     * toBuilder() derives a modified copy and leaves the original untouched.
     */
    @Test
    public void testToBuilder() {
        val original = BackoffConfig.builder().maxRetries(3).multiplier(3).build();
        val copy = original.toBuilder().maxInterval(Duration.ofSeconds(5)).build();
        Assert.assertEquals(3, copy.getMaxRetries());
        Assert.assertEquals(3, copy.getMultiplier(), 0);
        Assert.assertEquals(Duration.ofSeconds(5), copy.getMaxInterval());
        Assert.assertEquals(Duration.ofSeconds(60), original.getMaxInterval());
    }

    /**
     * Out of range values are accepted as they are; building never fails.
     */
    @Test
    public void testBuildNeverValidatesRanges() {
        val config = BackoffConfig.builder()
                                  .multiplier(0.5)
                                  .randomizationFactor(2)
                                  .maxElapsedTime(Duration.ofSeconds(-1))
                                  .initialInterval(Duration.ofSeconds(10))
                                  .maxInterval(Duration.ofSeconds(1))
                                  .build();
        Assert.assertEquals(0.5, config.getMultiplier(), 0);
        Assert.assertEquals(2, config.getRandomizationFactor(), 0);
        Assert.assertNotNull(new Backoff(config));
    }

    @Test
    public void testFromProperties() {
        val props = new Properties();
        props.setProperty("backoff.maxRetries", "5");
        props.setProperty("backoff.exponential", "yes");
        props.setProperty("backoff.multiplier", "2.5");
        props.setProperty("backoff.initialIntervalMillis", "100");
        props.setProperty("backoff.maxIntervalMillis", " 2000 ");
        props.setProperty("backoff.randomizationFactor", "0");
        props.setProperty("backoff.maxElapsedTimeMillis", "30000");
        props.setProperty("other.maxRetries", "100");

        val config = BackoffConfig.fromProperties(props);
        Assert.assertEquals(5, config.getMaxRetries());
        Assert.assertTrue(config.isExponential());
        Assert.assertEquals(2.5, config.getMultiplier(), 0);
        Assert.assertEquals(Duration.ofMillis(100), config.getInitialInterval());
        Assert.assertEquals(Duration.ofSeconds(2), config.getMaxInterval());
        Assert.assertEquals(0, config.getRandomizationFactor(), 0);
        Assert.assertEquals(Duration.ofSeconds(30), config.getMaxElapsedTime());
    }

    /**
     * Missing properties keep their default values.
     */
    @Test
    public void testFromEmptyProperties() {
        val config = BackoffConfig.fromProperties(new Properties());
        val defaults = BackoffConfig.defaults();
        Assert.assertEquals(defaults.getMaxRetries(), config.getMaxRetries());
        Assert.assertEquals(defaults.isExponential(), config.isExponential());
        Assert.assertEquals(defaults.getMultiplier(), config.getMultiplier(), 0);
        Assert.assertEquals(defaults.getInitialInterval(), config.getInitialInterval());
        Assert.assertEquals(defaults.getMaxInterval(), config.getMaxInterval());
        Assert.assertEquals(defaults.getRandomizationFactor(), config.getRandomizationFactor(), 0);
        Assert.assertEquals(defaults.getMaxElapsedTime(), config.getMaxElapsedTime());
    }

    @Test
    public void testConfigBuilder() {
        val config = BackoffConfig.properties()
                                  .with(BackoffConfig.MAX_RETRIES, 3)
                                  .with(BackoffConfig.EXPONENTIAL, true)
                                  .with(BackoffConfig.MAX_ELAPSED_TIME_MILLIS, 1500L)
                                  .build();
        Assert.assertEquals(3, config.getMaxRetries());
        Assert.assertTrue(config.isExponential());
        Assert.assertEquals(Duration.ofMillis(1500), config.getMaxElapsedTime());
        Assert.assertEquals(Duration.ofMillis(500), config.getInitialInterval());
    }

    @Test
    public void testInvalidProperties() {
        AssertExtensions.assertThrows(
                "Unparseable integer was accepted.",
                () -> BackoffConfig.properties().with(BackoffConfig.MAX_RETRIES, null).build(),
                ex -> ex instanceof InvalidPropertyValueException);

        val props = new Properties();
        props.setProperty("backoff.exponential", "maybe");
        AssertExtensions.assertThrows(
                "Unparseable boolean was accepted.",
                () -> BackoffConfig.fromProperties(props),
                ex -> ex instanceof InvalidPropertyValueException);

        AssertExtensions.assertThrows(
                "Negative retry count was accepted.",
                () -> BackoffConfig.properties().with(BackoffConfig.MAX_RETRIES, -1).build(),
                ex -> ex instanceof ConfigurationException);

        AssertExtensions.assertThrows(
                "Negative interval was accepted.",
                () -> BackoffConfig.properties().with(BackoffConfig.INITIAL_INTERVAL_MILLIS, -5L).build(),
                ex -> ex instanceof ConfigurationException);
    }

    @Test
    public void testToStringExcludesListener() {
        val config = BackoffConfig.builder().maxRetries(4).onRetry((ex, delay, attempts) -> { }).build();
        val s = config.toString();
        Assert.assertTrue(s, s.contains("maxRetries=4"));
        Assert.assertFalse(s, s.contains("onRetry"));
    }
}
