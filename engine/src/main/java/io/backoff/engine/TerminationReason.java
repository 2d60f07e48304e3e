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

/**
 * The reasons why a {@link Backoff} execution may end.
 */
public enum TerminationReason {
    /**
     * An attempt completed normally.
     */
    SUCCESS,
    /**
     * The maximum number of attempts was reached.
     */
    RETRY_BUDGET_EXHAUSTED,
    /**
     * The maximum elapsed time was exceeded.
     */
    TIME_BUDGET_EXHAUSTED,
    /**
     * The CancellationToken was cancelled (or the waiting thread was interrupted).
     */
    CANCELLED,
    /**
     * An attempt failed with a {@link TerminalException}.
     */
    TERMINAL_ERROR
}
