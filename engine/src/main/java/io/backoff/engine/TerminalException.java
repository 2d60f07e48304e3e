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

import com.google.common.base.Preconditions;

/**
 * Marks a failure as non-retryable. When an attempt throws this exception (directly, or anywhere in the cause chain
 * of what it throws), the {@link Backoff} stops immediately and rethrows the wrapped exception, unmodified.
 */
public class TerminalException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private TerminalException(Exception cause) {
        super(cause.toString(), cause, false, false);
    }

    /**
     * Wraps the given exception so that it is not retried.
     *
     * @param cause The exception to surface to the caller of the {@link Backoff}.
     * @return A new TerminalException.
     */
    public static TerminalException of(Exception cause) {
        Preconditions.checkNotNull(cause, "cause");
        return new TerminalException(cause);
    }

    /**
     * Gets the wrapped exception, exactly as it was passed to {@link #of(Exception)}.
     *
     * @return The wrapped exception.
     */
    @Override
    public synchronized Exception getCause() {
        return (Exception) super.getCause();
    }
}
