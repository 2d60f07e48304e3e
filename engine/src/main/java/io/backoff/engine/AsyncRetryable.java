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
import java.util.concurrent.CompletableFuture;

/**
 * An asynchronous operation that may be attempted multiple times by a {@link Backoff}.
 * A failure may be reported either by throwing or by completing the returned future exceptionally.
 *
 * @param <ReturnT> Type of the result.
 */
@FunctionalInterface
public interface AsyncRetryable<ReturnT> {
    CompletableFuture<ReturnT> attempt(CancellationToken token) throws Exception;
}
