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

import io.backoff.common.util.ConfigBuilder;
import io.backoff.common.util.ConfigurationException;
import io.backoff.common.util.Property;
import io.backoff.common.util.TypedProperties;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Properties;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * Immutable configuration for a {@link Backoff}.
 * <p>
 * Every option can be set independently through {@link #builder()}; options that are not set keep their defaults.
 * Scalar options can also be read from a {@link Properties} object, under the {@code backoff} namespace (see the
 * {@link Property} constants below).
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class BackoffConfig {
    //region Config Names

    public static final Property<Integer> MAX_RETRIES = Property.named("maxRetries", 0);
    public static final Property<Boolean> EXPONENTIAL = Property.named("exponential", false);
    public static final Property<Double> MULTIPLIER = Property.named("multiplier", 1.5);
    public static final Property<Long> INITIAL_INTERVAL_MILLIS = Property.named("initialIntervalMillis", 500L);
    public static final Property<Long> MAX_INTERVAL_MILLIS = Property.named("maxIntervalMillis", 60_000L);
    public static final Property<Double> RANDOMIZATION_FACTOR = Property.named("randomizationFactor", 0.5);
    public static final Property<Long> MAX_ELAPSED_TIME_MILLIS = Property.named("maxElapsedTimeMillis", 0L);
    private static final String COMPONENT_CODE = "backoff";

    //endregion

    //region Members

    /**
     * The maximum number of attempts. 0 means unlimited.
     */
    @Builder.Default
    private final int maxRetries = MAX_RETRIES.getDefaultValue();

    /**
     * Whether the interval grows by {@link #getMultiplier()} after every failure. If false, the interval stays at
     * {@link #getInitialInterval()}.
     */
    @Builder.Default
    private final boolean exponential = EXPONENTIAL.getDefaultValue();

    /**
     * The growth rate of the interval.
     */
    @Builder.Default
    private final double multiplier = MULTIPLIER.getDefaultValue();

    /**
     * The interval before jitter is applied, for the first retry.
     */
    @NonNull
    @Builder.Default
    private final Duration initialInterval = Duration.ofMillis(INITIAL_INTERVAL_MILLIS.getDefaultValue());

    /**
     * The cap on the interval before jitter is applied.
     */
    @NonNull
    @Builder.Default
    private final Duration maxInterval = Duration.ofMillis(MAX_INTERVAL_MILLIS.getDefaultValue());

    /**
     * The amount of jitter, as a fraction of the interval. 0 disables jitter.
     */
    @Builder.Default
    private final double randomizationFactor = RANDOMIZATION_FACTOR.getDefaultValue();

    /**
     * The maximum amount of time since the first attempt after which no more retries are made. Zero means unlimited.
     */
    @NonNull
    @Builder.Default
    private final Duration maxElapsedTime = Duration.ofMillis(MAX_ELAPSED_TIME_MILLIS.getDefaultValue());

    /**
     * An optional listener notified before every wait.
     */
    @ToString.Exclude
    private final RetryListener onRetry;

    //endregion

    //region Constructor

    /**
     * Creates a BackoffConfig using only default values.
     *
     * @return A new BackoffConfig.
     */
    public static BackoffConfig defaults() {
        return builder().build();
    }

    /**
     * Creates a new ConfigBuilder that can be used to create instances of this class from Properties.
     *
     * @return A new ConfigBuilder for this class.
     */
    public static ConfigBuilder<BackoffConfig> properties() {
        return new ConfigBuilder<>(COMPONENT_CODE, BackoffConfig::fromTypedProperties);
    }

    /**
     * Creates a new BackoffConfig from the {@code backoff.*} entries of the given Properties. Missing entries keep
     * their default values.
     *
     * @param properties The Properties to read from.
     * @return A new BackoffConfig.
     * @throws ConfigurationException If any of the entries has an invalid value.
     */
    public static BackoffConfig fromProperties(Properties properties) throws ConfigurationException {
        return properties().rebase(properties).build();
    }

    private static BackoffConfig fromTypedProperties(TypedProperties properties) throws ConfigurationException {
        return builder()
                .maxRetries(properties.getNonNegativeInt(MAX_RETRIES))
                .exponential(properties.getBoolean(EXPONENTIAL))
                .multiplier(properties.getDouble(MULTIPLIER))
                .initialInterval(properties.getDuration(INITIAL_INTERVAL_MILLIS, ChronoUnit.MILLIS))
                .maxInterval(properties.getDuration(MAX_INTERVAL_MILLIS, ChronoUnit.MILLIS))
                .randomizationFactor(properties.getDouble(RANDOMIZATION_FACTOR))
                .maxElapsedTime(properties.getDuration(MAX_ELAPSED_TIME_MILLIS, ChronoUnit.MILLIS))
                .build();
    }

    //endregion
}
