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

import io.backoff.common.concurrent.CancellationToken;

/**
 * An operation that may be attempted multiple times by a {@link Backoff}.
 *
 * @param <ReturnT> Type of the result.
 */
@FunctionalInterface
public interface Retryable<ReturnT> {
    /**
     * Makes one attempt at the operation.
     *
     * @param token The CancellationToken of the current execution. Long-running attempts may observe it.
     * @return The result of the operation.
     * @throws Exception If the attempt failed. Throw a {@link TerminalException} to stop retrying.
     */
    ReturnT attempt(CancellationToken token) throws Exception;
}
