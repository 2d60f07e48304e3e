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

import com.google.common.base.Preconditions;
import com.google.common.collect.Sets;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import lombok.SneakyThrows;

/**
 * Helper methods that perform various checks and throw exceptions if certain conditions are met.
 */
public final class Exceptions {

    private Exceptions() {
    }

    /**
     * Throws any throwable 'sneakily' - you don't need to catch it, nor declare that you throw it onwards.
     * <p>
     * Note that this method has a return type of {@code RuntimeException}; always call it as the argument of a
     * {@code throw} statement. It never returns normally.
     *
     * @param t The throwable to throw without requiring you to catch its type.
     * @return A dummy RuntimeException; this method never returns normally.
     */
    @SneakyThrows
    public static RuntimeException sneakyThrow(Throwable t) {
        throw t;
    }

    /**
     * If the provided exception is a CompletionException or ExecutionException which need be unwrapped.
     *
     * @param ex The exception to be unwrapped.
     * @return The cause or the exception provided.
     */
    public static Throwable unwrap(Throwable ex) {
        Throwable result = ex;
        Set<Throwable> seen = Sets.newIdentityHashSet();
        while (canInspectCause(result) && result.getCause() != null && seen.add(result)) {
            result = result.getCause();
        }

        return result;
    }

    /**
     * Walks the cause chain of the given Throwable (starting with the Throwable itself) and returns the first element
     * that is an instance of the given type.
     *
     * @param ex   The Throwable to inspect.
     * @param type The type to look for.
     * @param <T>  The type to look for.
     * @return The first matching element of the cause chain, or null if there is none. A cause chain that loops back
     * on itself is walked until the first repeated element.
     */
    public static <T extends Throwable> T findCause(Throwable ex, Class<T> type) {
        Preconditions.checkNotNull(type, "type");
        if (ex == null) {
            return null;
        }

        Set<Throwable> seen = Sets.newIdentityHashSet();
        for (Throwable t = ex; t != null && seen.add(t); t = t.getCause()) {
            if (type.isInstance(t)) {
                return type.cast(t);
            }
        }

        return null;
    }

    private static boolean canInspectCause(Throwable ex) {
        return ex instanceof CompletionException
                || ex instanceof ExecutionException;
    }

    /**
     * Throws a NullPointerException if the arg argument is null. Throws an IllegalArgumentException if the String arg
     * argument has a length of zero.
     *
     * @param arg     The argument to check.
     * @param argName The name of the argument (to be included in the exception message).
     * @return The arg.
     * @throws NullPointerException     If arg is null.
     * @throws IllegalArgumentException If arg is not null, but has a length of zero.
     */
    public static String checkNotNullOrEmpty(String arg, String argName) throws NullPointerException, IllegalArgumentException {
        Preconditions.checkNotNull(arg, argName);
        checkArgument(arg.length() > 0, argName, "Cannot be an empty string.");
        return arg;
    }

    /**
     * Throws an IllegalArgumentException if the validCondition argument is false.
     *
     * @param validCondition The result of the condition to validate.
     * @param argName        The name of the argument (to be included in the exception message).
     * @param message        The message to include in the exception. This should not include the name of the argument,
     *                       as that is already prefixed.
     * @param args           Format args for message. These must correspond to String.format() args.
     * @throws IllegalArgumentException If validCondition is false.
     */
    public static void checkArgument(boolean validCondition, String argName, String message, Object... args) throws IllegalArgumentException {
        if (!validCondition) {
            throw new IllegalArgumentException(argName + ": " + String.format(message, args));
        }
    }
}
