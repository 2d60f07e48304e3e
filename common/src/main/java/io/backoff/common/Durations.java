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

import java.time.Duration;

/**
 * Helper methods for Durations.
 */
public final class Durations {
    /**
     * The longest Duration that can be expressed as a long number of nanoseconds.
     */
    public static final Duration MAX_NANOS = Duration.ofNanos(Long.MAX_VALUE);
    private static final Duration MIN_NANOS = Duration.ofNanos(Long.MIN_VALUE);

    private Durations() {
    }

    /**
     * Converts the given Duration to nanoseconds, saturating at Long.MAX_VALUE and Long.MIN_VALUE instead of
     * throwing an ArithmeticException like {@link Duration#toNanos()} does.
     *
     * @param duration The Duration to convert.
     * @return The number of nanoseconds.
     */
    public static long toNanosSaturated(Duration duration) {
        if (duration.compareTo(MAX_NANOS) >= 0) {
            return Long.MAX_VALUE;
        } else if (duration.compareTo(MIN_NANOS) <= 0) {
            return Long.MIN_VALUE;
        }

        return duration.toNanos();
    }
}
