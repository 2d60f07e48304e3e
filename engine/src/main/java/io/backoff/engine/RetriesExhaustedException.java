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
 * Thrown by {@link Backoff} when the configured maximum number of attempts have all failed.
 */
public class RetriesExhaustedException extends BackoffExhaustedException {
    private static final long serialVersionUID = 1L;

    public RetriesExhaustedException(int attempts, Throwable last) {
        super(String.format("Giving up after %d failed attempt(s).", attempts), attempts, last);
    }

    @Override
    public TerminationReason getReason() {
        return TerminationReason.RETRY_BUDGET_EXHAUSTED;
    }
}
