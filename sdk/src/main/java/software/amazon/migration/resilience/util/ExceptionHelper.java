// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.migration.resilience.util;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/** Utility class for handling exceptions */
public final class ExceptionHelper {

    private ExceptionHelper() {}

    /**
     * Throws any exception as if it were unchecked using type erasure. This preserves the original exception type and
     * stack trace, so callers see exactly what the remote operation raised.
     *
     * <p>Declared to return an exception so call sites can write {@code throw sneakyThrow(e);}; it never returns.
     *
     * @param exception the exception to throw
     * @param <T> the exception type (erased at runtime)
     * @return never returns normally
     * @throws T the exception as an unchecked exception
     */
    @SuppressWarnings("unchecked")
    public static <T extends Throwable> RuntimeException sneakyThrow(Throwable exception) throws T {
        throw (T) exception;
    }

    /**
     * unwrap the exception that is wrapped by CompletionException or ExecutionException
     *
     * @param throwable the throwable to unwrap
     * @return the innermost Throwable that is not a future wrapper, or the wrapper itself if it has no cause
     */
    public static Throwable unwrapCompletion(Throwable throwable) {
        while ((throwable instanceof CompletionException || throwable instanceof ExecutionException)
                && throwable.getCause() != null) {
            throwable = throwable.getCause();
        }
        return throwable;
    }

    /**
     * Message of a throwable, falling back to the class name when the message is absent.
     *
     * @param throwable the throwable to describe
     * @return a non-null description for log output and attempt records
     */
    public static String describe(Throwable throwable) {
        var message = throwable.getMessage();
        return message != null ? message : throwable.getClass().getName();
    }
}
