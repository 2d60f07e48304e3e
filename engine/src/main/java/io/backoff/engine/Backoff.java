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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import io.backoff.common.Exceptions;
import io.backoff.common.concurrent.CancellationToken;
import io.backoff.common.concurrent.Futures;
import java.time.Duration;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;
import javax.annotation.concurrent.ThreadSafe;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Executes an operation repeatedly, waiting a growing, randomized interval between attempts, until it succeeds.
 * It can be used as follows:
 * <p>
 * {@code
 * Backoff backoff = new Backoff(BackoffConfig.builder().exponential(true).maxRetries(5).build());
 * String result = backoff.execute(token, t -> fetchSomething());
 * }
 * <p>
 * An execution ends with exactly one of the following:
 * <ul>
 * <li> the result of the first successful attempt;
 * <li> the exception wrapped by a {@link TerminalException} thrown by an attempt (no retry is made);
 * <li> {@link RetriesExhaustedException}, once {@link BackoffConfig#getMaxRetries()} attempts have failed;
 * <li> {@link MaxElapsedTimeExceededException}, when an attempt fails after {@link BackoffConfig#getMaxElapsedTime()}
 * has passed since the first one;
 * <li> {@link CancellationException}, if the CancellationToken is cancelled before an attempt or during a wait.
 * </ul>
 * Instances are immutable and can be shared between threads; every execution keeps its own state.
 */
@Slf4j
@ThreadSafe
public final class Backoff {
    @Getter
    private final BackoffConfig config;
    private final IntervalCalculator intervals;
    private final Supplier<Long> getNanos;

    /**
     * Creates a new instance of the Backoff class.
     *
     * @param config The configuration to use.
     */
    public Backoff(BackoffConfig config) {
        this(config, ThreadLocalRandom::current, System::nanoTime);
    }

    @VisibleForTesting
    Backoff(BackoffConfig config, Supplier<Random> random, Supplier<Long> getNanos) {
        this.config = Preconditions.checkNotNull(config, "config");
        this.intervals = new IntervalCalculator(config, Preconditions.checkNotNull(random, "random"));
        this.getNanos = Preconditions.checkNotNull(getNanos, "getNanos");
    }

    /**
     * Creates a new Backoff using the default configuration.
     *
     * @return A new Backoff.
     */
    public static Backoff withDefaults() {
        return new Backoff(BackoffConfig.defaults());
    }

    /**
     * Wraps the given exception so that, if thrown by an attempt, it is not retried.
     *
     * @param cause The exception to surface to the caller.
     * @return A new TerminalException to throw from the attempt.
     */
    public static TerminalException stop(Exception cause) {
        return TerminalException.of(cause);
    }

    //region Blocking execution

    /**
     * Executes the given operation until it succeeds or this Backoff gives up, blocking the calling thread.
     *
     * @param token     A CancellationToken that can be used to abandon the execution.
     * @param operation The operation to attempt.
     * @param <ReturnT> Type of the result.
     * @return The result of the first successful attempt.
     * @throws CancellationException           If the token was cancelled before an attempt or while waiting, or if the
     *                                         calling thread was interrupted while waiting.
     * @throws RetriesExhaustedException       If the maximum number of attempts have failed.
     * @throws MaxElapsedTimeExceededException If the maximum elapsed time was exceeded.
     * @throws Exception                       The exception wrapped by a {@link TerminalException}, if an attempt threw one.
     */
    public <ReturnT> ReturnT execute(CancellationToken token, Retryable<ReturnT> operation) throws Exception {
        Preconditions.checkNotNull(token, "token");
        Preconditions.checkNotNull(operation, "operation");
        RetryState state = newState();
        while (true) {
            if (token.isCancellationRequested()) {
                throw cancelled(state, null);
            }

            Exception failure;
            try {
                ReturnT result = operation.attempt(token);
                finished(state, TerminationReason.SUCCESS);
                return result;
            } catch (Exception ex) {
                failure = ex;
            }

            Duration delay = handleFailure(state, token, failure);
            boolean elapsed;
            try {
                elapsed = token.await(delay);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw cancelled(state, ex);
            }

            if (!elapsed) {
                throw cancelled(state, null);
            }
        }
    }

    /**
     * Same as {@link #execute(CancellationToken, Retryable)}, with a token that cannot be cancelled.
     *
     * @param operation The operation to attempt.
     * @param <ReturnT> Type of the result.
     * @return The result of the first successful attempt.
     * @throws Exception See {@link #execute(CancellationToken, Retryable)}.
     */
    public <ReturnT> ReturnT execute(Retryable<ReturnT> operation) throws Exception {
        return execute(CancellationToken.NONE, operation);
    }

    /**
     * Same as {@link #execute(CancellationToken, Retryable)}, for an operation that has no result.
     *
     * @param token     A CancellationToken that can be used to abandon the execution.
     * @param operation The operation to attempt.
     * @throws Exception See {@link #execute(CancellationToken, Retryable)}.
     */
    public void run(CancellationToken token, RetryableRunnable operation) throws Exception {
        Preconditions.checkNotNull(operation, "operation");
        execute(token, t -> {
            operation.attempt(t);
            return null;
        });
    }

    /**
     * Same as {@link #run(CancellationToken, RetryableRunnable)}, with a token that cannot be cancelled.
     *
     * @param operation The operation to attempt.
     * @throws Exception See {@link #execute(CancellationToken, Retryable)}.
     */
    public void run(RetryableRunnable operation) throws Exception {
        run(CancellationToken.NONE, operation);
    }

    //endregion

    //region Asynchronous execution

    /**
     * Executes the given asynchronous operation until it succeeds or this Backoff gives up. No thread is held while
     * waiting between attempts.
     *
     * @param token           A CancellationToken that can be used to abandon the execution.
     * @param operation       The operation to attempt.
     * @param executorService The executor to schedule waits and run the retry loop on.
     * @param <ReturnT>       Type of the result.
     * @return A CompletableFuture that completes with the result of the first successful attempt, or exceptionally with
     * the same exceptions {@link #execute(CancellationToken, Retryable)} throws.
     */
    public <ReturnT> CompletableFuture<ReturnT> executeAsync(CancellationToken token, AsyncRetryable<ReturnT> operation,
                                                             ScheduledExecutorService executorService) {
        Preconditions.checkNotNull(token, "token");
        Preconditions.checkNotNull(operation, "operation");
        Preconditions.checkNotNull(executorService, "executorService");
        CompletableFuture<ReturnT> result = new CompletableFuture<>();
        RetryState state = newState();
        Futures.loop(
                () -> !result.isDone(),
                () -> attemptAsync(state, token, operation, executorService, result),
                executorService)
               .exceptionally(ex -> {
                   result.completeExceptionally(Exceptions.unwrap(ex));
                   return null;
               });
        return result;
    }

    private <ReturnT> CompletableFuture<Void> attemptAsync(RetryState state, CancellationToken token, AsyncRetryable<ReturnT> operation,
                                                           ScheduledExecutorService executorService, CompletableFuture<ReturnT> result) {
        if (token.isCancellationRequested()) {
            result.completeExceptionally(cancelled(state, null));
            return CompletableFuture.completedFuture(null);
        }

        CompletableFuture<ReturnT> attempt;
        try {
            attempt = Preconditions.checkNotNull(operation.attempt(token), "operation returned a null future");
        } catch (Exception ex) {
            attempt = Futures.failedFuture(ex);
        }

        return attempt
                .handle((value, ex) -> {
                    Throwable failure = ex == null ? null : Exceptions.unwrap(ex);
                    if (Outcome.classify(failure) == Outcome.SUCCESS) {
                        finished(state, TerminationReason.SUCCESS);
                        result.complete(value);
                        return null;
                    }

                    if (!(failure instanceof Exception)) {
                        // Errors are not retried, same as in execute().
                        result.completeExceptionally(failure);
                        return null;
                    }

                    try {
                        return handleFailure(state, token, failure);
                    } catch (Exception giveUp) {
                        result.completeExceptionally(giveUp);
                        return null;
                    }
                })
                .thenCompose(delay -> delay == null
                        ? CompletableFuture.<Void>completedFuture(null)
                        : awaitAsync(state, token, delay, executorService, result));
    }

    private CompletableFuture<Void> awaitAsync(RetryState state, CancellationToken token, Duration delay,
                                               ScheduledExecutorService executorService, CompletableFuture<?> result) {
        CompletableFuture<Void> wait = Futures.delayedFuture(delay, executorService);
        token.register(wait);
        return wait.handle((r, ex) -> {
            if (ex != null) {
                result.completeExceptionally(cancelled(state, null));
            }
            return null;
        });
    }

    //endregion

    //region Helpers

    private RetryState newState() {
        return new RetryState(this.config, this.intervals, this.getNanos);
    }

    /**
     * Decides what to do after a failed attempt.
     *
     * @return The delay before the next attempt.
     * @throws Exception The cause of a TerminalException, one of the budget exceptions if this Backoff gives up, or
     *                   CancellationException if the token was cancelled while the attempt was running.
     */
    private Duration handleFailure(RetryState state, CancellationToken token, Throwable failure) throws Exception {
        if (Outcome.classify(failure) == Outcome.TERMINAL) {
            finished(state, TerminationReason.TERMINAL_ERROR);
            throw Outcome.findTerminal(failure).getCause();
        }

        Duration delay;
        try {
            delay = state.recordFailure(failure);
        } catch (BackoffExhaustedException ex) {
            finished(state, ex.getReason());
            throw ex;
        }

        if (token.isCancellationRequested()) {
            throw cancelled(state, null);
        }

        log.debug("Attempt #{} failed with \"{}\"; retrying in {} ms (elapsed {} ms).",
                state.getAttempts(), failure.getMessage(), delay.toMillis(), state.getElapsed().toMillis());
        RetryListener listener = this.config.getOnRetry();
        if (listener != null) {
            listener.onRetry(failure, delay, state.getAttempts());
        }

        return delay;
    }

    private CancellationException cancelled(RetryState state, Throwable cause) {
        finished(state, TerminationReason.CANCELLED);
        CancellationException ex = new CancellationException(
                String.format("Backoff cancelled after %d failed attempt(s).", state.getAttempts()));
        if (cause != null) {
            ex.initCause(cause);
        }
        return ex;
    }

    private void finished(RetryState state, TerminationReason reason) {
        log.debug("Backoff finished with {} after {} failed attempt(s) and {} ms.",
                reason, state.getAttempts(), state.getElapsed().toMillis());
    }

    //endregion
}
