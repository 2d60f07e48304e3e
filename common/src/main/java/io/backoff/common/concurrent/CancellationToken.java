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
package io.backoff.common.concurrent;

import com.google.common.base.Preconditions;
import io.backoff.common.Durations;
import io.backoff.common.Exceptions;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Represents a token that can be passed around to various components to indicate when a task should be cancelled.
 * <p>
 * Pending waits (registered futures, or threads blocked in {@link #await(Duration)}) are released as soon as
 * {@link #requestCancellation()} is invoked. A token cannot be reset once cancelled.
 */
@ThreadSafe
public class CancellationToken {
    /**
     * A CancellationToken that can be used as a placeholder for "no token to pass". This token instance cannot be cancelled.
     */
    public static final CancellationToken NONE = new NonCancellableToken();
    @GuardedBy("futures")
    private final Collection<CompletableFuture<?>> futures;
    @GuardedBy("futures")
    private boolean cancellationRequested;

    /**
     * Creates a new instance of the CancellationToken class.
     */
    public CancellationToken() {
        this.futures = new HashSet<>();
    }

    /**
     * Gets a value indicating whether cancellation has been requested on this token.
     *
     * @return True if {@link #requestCancellation()} has been invoked.
     */
    public boolean isCancellationRequested() {
        synchronized (this.futures) {
            return this.cancellationRequested;
        }
    }

    /**
     * Registers the given Future to the token. The Future will be cancelled when cancellation is requested; if the
     * token is already cancelled, the Future is cancelled right away.
     *
     * @param future The Future to register.
     * @param <T>    Return type of the future.
     */
    public <T> void register(CompletableFuture<T> future) {
        Preconditions.checkNotNull(future, "future");
        if (future.isDone()) {
            return;
        }

        boolean autoCancel = false;
        synchronized (this.futures) {
            if (this.cancellationRequested) {
                autoCancel = true;
            } else {
                this.futures.add(future);
            }
        }

        if (autoCancel) {
            future.cancel(true);
            return;
        }

        // Cleanup once the future is completed.
        future.whenComplete((r, ex) -> {
            synchronized (this.futures) {
                this.futures.remove(future);
            }
        });
    }

    /**
     * Blocks the calling thread for the given duration, or until cancellation is requested, whichever comes first.
     *
     * @param delay How long to wait.
     * @return True if the whole delay has elapsed, false if cancellation was requested before (or during) the wait.
     * @throws InterruptedException If the calling thread was interrupted while waiting.
     */
    public boolean await(Duration delay) throws InterruptedException {
        Preconditions.checkNotNull(delay, "delay");
        if (delay.isZero() || delay.isNegative()) {
            return !isCancellationRequested();
        }

        CompletableFuture<Void> wait = new CompletableFuture<>();
        register(wait);
        try {
            wait.get(Durations.toNanosSaturated(delay), TimeUnit.NANOSECONDS);
            return !wait.isCancelled();
        } catch (TimeoutException ex) {
            return true;
        } catch (CancellationException ex) {
            return false;
        } catch (ExecutionException ex) {
            // Nothing but cancel() or complete() ever touches this future.
            throw Exceptions.sneakyThrow(ex.getCause());
        } finally {
            wait.complete(null);
        }
    }

    /**
     * Cancels all registered futures.
     */
    public void requestCancellation() {
        Collection<CompletableFuture<?>> toInvoke;
        synchronized (this.futures) {
            this.cancellationRequested = true;
            toInvoke = new ArrayList<>(this.futures);
        }

        toInvoke.forEach(f -> f.cancel(true));
        synchronized (this.futures) {
            this.futures.clear();
        }
    }

    @Override
    public String toString() {
        synchronized (this.futures) {
            return "Cancelled = " + this.cancellationRequested;
        }
    }

    private static final class NonCancellableToken extends CancellationToken {
        @Override
        public <T> void register(CompletableFuture<T> future) {
            // This method intentionally left blank. No point in registering anything.
        }

        @Override
        public void requestCancellation() {
            // This method intentionally left blank. No point in requesting any cancellation.
        }
    }
}
