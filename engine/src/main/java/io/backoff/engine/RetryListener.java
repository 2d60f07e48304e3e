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

/**
 * Receives a notification every time an attempt fails with a retryable error, before the engine starts waiting.
 * Listeners are invoked synchronously on the thread running the retry loop and must not throw.
 */
@FunctionalInterface
public interface RetryListener {
    /**
     * Invoked after a failed attempt that is going to be retried.
     *
     * @param failure  The exception thrown by the failed attempt.
     * @param delay    How long the engine will wait before the next attempt.
     * @param attempts The number of failed attempts so far (1 after the first failure).
     */
    void onRetry(Throwable failure, Duration delay, int attempts);
}
