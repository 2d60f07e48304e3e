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
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.SneakyThrows;

/**
 * Extensions to CompletableFuture.
 */
public final class Futures {

    private Futures() {
    }

    /**
     * Returns true if the future is done and successful.
     *
     * @param f   The future to inspect.
     * @param <T> The Type of the future's result.
     * @return True if the given CompletableFuture has completed successfully.
     */
    public static <T> boolean isSuccessful(CompletableFuture<T> f) {
        return f.isDone() && !f.isCompletedExceptionally() && !f.isCancelled();
    }

    /**
     * Creates a new CompletableFuture that is failed with the given exception.
     *
     * @param exception The exception to fail the CompletableFuture.
     * @param <T>       The Type of the future's result.
     * @return A CompletableFuture that fails with the given exception.
     */
    public static <T> CompletableFuture<T> failedFuture(Throwable exception) {
        CompletableFuture<T> result = new CompletableFuture<>();
        result.completeExceptionally(exception);
        return result;
    }

    /**
     * Creates a CompletableFuture that will do nothing and complete after a specified delay, without using a thread during
     * the delay. Cancelling the returned future also cancels the underlying scheduled task.
     *
     * @param delay           The duration of the delay (how much to wait until completing the Future).
     * @param executorService An ExecutorService that will be used to complete the Future on.
     * @return A CompletableFuture that will complete after the specified delay.
     */
    public static CompletableFuture<Void> delayedFuture(Duration delay, ScheduledExecutorService executorService) {
        CompletableFuture<Void> result = new CompletableFuture<>();
        long delayNanos = Durations.toNanosSaturated(delay);
        if (delayNanos <= 0) {
            // Zero delay; no need to bother with scheduling a task in the future.
            result.complete(null);
        } else {
            ScheduledFuture<Boolean> sf = executorService.schedule(() -> result.complete(null), delayNanos, TimeUnit.NANOSECONDS);
            result.whenComplete((r, ex) -> sf.cancel(true));
        }

        return result;
    }

    /**
     * Executes a loop using CompletableFutures, without invoking join()/get() on any of them or exclusively hogging a thread.
     * Each iteration is started on the given Executor, so loop bodies that complete synchronously do not grow the stack.
     *
     * @param condition A Supplier that indicates whether to proceed with the loop or not.
     * @param loopBody  A Supplier that returns a CompletableFuture which represents the body of the loop. This
     *                  supplier is invoked every time the loopBody needs to execute.
     * @param executor  An Executor that is used to execute the condition and the loop support code.
     * @return A CompletableFuture that, when completed, indicates the loop terminated without any exception. If
     * either the loopBody or condition throw/return Exceptions, these will be set as the result of this returned Future.
     */
    public static CompletableFuture<Void> loop(Supplier<Boolean> condition, Supplier<CompletableFuture<Void>> loopBody, Executor executor) {
        Preconditions.checkNotNull(condition, "condition");
        Preconditions.checkNotNull(loopBody, "loopBody");
        Preconditions.checkNotNull(executor, "executor");
        CompletableFuture<Void> result = new CompletableFuture<>();
        executor.execute(new Loop(condition, loopBody, result, executor));
        return result;
    }

    /**
     * Runs the provided Callable in the current thread (synchronously). If it throws, the exception is propagated, but
     * the supplied future is also failed.
     */
    @SneakyThrows(Exception.class)
    private static <T, R> R runOrFail(Callable<R> callable, CompletableFuture<T> future) {
        try {
            return callable.call();
        } catch (Throwable t) {
            future.completeExceptionally(t);
            throw t;
        }
    }

    @RequiredArgsConstructor
    private static class Loop implements Runnable, Callable<Void> {
        /**
         * The condition to evaluate at the beginning of each loop iteration.
         */
        final Supplier<Boolean> condition;

        /**
         * A supplier that creates a CompletableFuture which will indicate the end of an iteration when complete.
         */
        final Supplier<CompletableFuture<Void>> loopBody;

        /**
         * A CompletableFuture that will be completed, whether normally or exceptionally, when the loop completes.
         */
        final CompletableFuture<Void> result;

        final Executor executor;

        @Override
        public Void call() {
            if (this.condition.get()) {
                this.loopBody.get()
                             .exceptionally(this::handleException)
                             .thenRunAsync(this, this.executor);
            } else {
                this.result.complete(null);
            }
            return null;
        }

        @Override
        public void run() {
            runOrFail(this, this.result);
        }

        private Void handleException(Throwable ex) {
            this.result.completeExceptionally(ex);
            throw new CompletionException(ex);
        }
    }
}
