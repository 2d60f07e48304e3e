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
package io.backoff.common.util;

import com.google.common.base.Preconditions;
import io.backoff.common.Exceptions;
import java.time.Duration;
import java.time.temporal.TemporalUnit;
import java.util.Properties;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/**
 * Wrapper for a java.util.Properties object, that sections it based on a namespace. Each property in the wrapped object
 * is prefixed by a namespace.
 * <p>
 * Example:
 * <ul>
 * <li>backoff.maxRetries=10
 * <li>backoff.exponential=true
 * <li>other.maxRetries=3
 * </ul>
 * Indicate that namespace "backoff" has Key-Values (maxRetries=10, exponential=true), and namespace "other" has
 * (maxRetries=3).
 */
@Slf4j
public class TypedProperties {
    //region Members

    private static final String SEPARATOR = ".";
    private final String keyPrefix;
    private final Properties properties;

    //endregion

    //region Constructor

    /**
     * Creates a new instance of the TypedProperties class.
     *
     * @param properties The java.util.Properties to wrap.
     * @param namespace  The namespace of this instance.
     */
    public TypedProperties(Properties properties, String namespace) {
        Preconditions.checkNotNull(properties, "properties");
        Exceptions.checkNotNullOrEmpty(namespace, "namespace");
        this.properties = properties;
        this.keyPrefix = namespace + SEPARATOR;
    }

    //endregion

    //region Getters

    /**
     * Gets the value of an Integer property only if it is non-negative (greater than or equal to 0).
     *
     * @param property The Property to get.
     * @return The property value or default value, if no such is defined in the base Properties.
     * @throws ConfigurationException When the given property name does not exist within the current namespace and the
     *                                property does not have a default value set, or when the property cannot be parsed
     *                                as a non-negative Integer.
     */
    public int getNonNegativeInt(Property<Integer> property) throws ConfigurationException {
        int value = tryGet(property, Integer::parseInt);
        if (value < 0) {
            throw new ConfigurationException(String.format("Property '%s' must be a non-negative integer.", property));
        }
        return value;
    }

    /**
     * Gets the value of a Long property only if it is non-negative (greater than or equal to 0).
     *
     * @param property The Property to get.
     * @return The property value or default value, if no such is defined in the base Properties.
     * @throws ConfigurationException When the given property name does not exist within the current namespace and the
     *                                property does not have a default value set, or when the property cannot be parsed
     *                                as a non-negative Long.
     */
    public long getNonNegativeLong(Property<Long> property) throws ConfigurationException {
        long value = tryGet(property, Long::parseLong);
        if (value < 0) {
            throw new ConfigurationException(String.format("Property '%s' must be a non-negative long.", property));
        }
        return value;
    }

    /**
     * Gets the value of a Double property.
     *
     * @param property The Property to get.
     * @return The property value or default value, if no such is defined in the base Properties.
     * @throws ConfigurationException When the given property name does not exist within the current namespace and the
     *                                property does not have a default value set, or when the property cannot be parsed
     *                                as a Double.
     */
    public double getDouble(Property<Double> property) throws ConfigurationException {
        return tryGet(property, Double::parseDouble);
    }

    /**
     * Gets the value of a boolean property.
     * Notes:
     * <ul>
     * <li> "true", "yes" and "1" (case insensitive) map to boolean "true".
     * <li> "false", "no" and "0" (case insensitive) map to boolean "false".
     * </ul>
     *
     * @param property The Property to get.
     * @return The property value or default value, if no such is defined in the base Properties.
     * @throws ConfigurationException When the given property name does not exist within the current namespace and the
     *                                property does not have a default value set, or when the property cannot be parsed
     *                                as a Boolean.
     */
    public boolean getBoolean(Property<Boolean> property) throws ConfigurationException {
        return tryGet(property, this::parseBoolean);
    }

    /**
     * Gets a Duration from a non-negative Long property.
     *
     * @param property The Property to get.
     * @param unit     Temporal unit related to the value associated to this property (i.e, seconds, millis).
     * @return The property value or default value, if no such is defined in the base Properties.
     * @throws ConfigurationException When the given property name does not exist within the current namespace and the
     *                                property does not have a default value set, or when the property cannot be parsed
     *                                as a non-negative Long.
     */
    public Duration getDuration(Property<Long> property, TemporalUnit unit) throws ConfigurationException {
        return Duration.of(getNonNegativeLong(property), unit);
    }

    private <T> T tryGet(Property<T> property, Function<String, T> converter) {
        String fullName = this.keyPrefix + property.getName();
        String propValue = this.properties.getProperty(fullName, null);
        if (propValue == null) {
            if (property.hasDefaultValue()) {
                log.debug("Property '{}' is not set; using default value '{}'.", fullName, property.getDefaultValue());
                return property.getDefaultValue();
            } else {
                throw new MissingPropertyException(fullName);
            }
        }

        try {
            return converter.apply(propValue.trim());
        } catch (IllegalArgumentException ex) {
            throw new InvalidPropertyValueException(fullName, propValue, ex);
        }
    }

    private boolean parseBoolean(String value) {
        if (value.equalsIgnoreCase("true") || value.equalsIgnoreCase("yes") || value.equalsIgnoreCase("1")) {
            return true;
        } else if (value.equalsIgnoreCase("false") || value.equalsIgnoreCase("no") || value.equalsIgnoreCase("0")) {
            return false;
        } else {
            throw new IllegalArgumentException(String.format("String '%s' cannot be interpreted as a valid Boolean.", value));
        }
    }

    //endregion
}
