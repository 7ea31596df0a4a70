package org.opensearch.migrations.artifacts.retry;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import org.opensearch.migrations.artifacts.errors.AuthorizationException;
import org.opensearch.migrations.artifacts.errors.RemoteErrors;
import org.opensearch.migrations.artifacts.errors.TransientRemoteException;
import org.opensearch.migrations.artifacts.ratelimit.RateLimitTimeoutException;

import lombok.Getter;

/**
 * Decides whether a failed remote call is worth repeating.  Anything not known to be transient is fatal.
 */
public class RetryClassifier {
    @Getter
    private final BackoffPolicy backoffPolicy;

    public RetryClassifier(BackoffPolicy backoffPolicy) {
        this.backoffPolicy = backoffPolicy;
    }

    /**
     * @param attempt 1-based number of the attempt that just failed
     */
    public Classification classify(Throwable error, int attempt) {
        var cause = unwrap(error);
        if (isTransient(cause)) {
            return new Classification.Retryable(backoffPolicy.delayFor(attempt));
        }
        return new Classification.Fatal(errorClassOf(cause), isSystemic(cause));
    }

    public static boolean isTransient(Throwable error) {
        if (error instanceof TransientRemoteException) {
            var status = ((TransientRemoteException) error).getStatusCode();
            return status.isEmpty()
                || !(RemoteErrors.isClientError(status.getAsInt())
                    || RemoteErrors.isAuthorizationFailure(status.getAsInt()));
        }
        return error instanceof RateLimitTimeoutException
            || error instanceof IOException;
    }

    /** Rejected credentials recur on every artifact. */
    static boolean isSystemic(Throwable error) {
        if (error instanceof AuthorizationException) {
            return true;
        }
        if (error instanceof TransientRemoteException) {
            var status = ((TransientRemoteException) error).getStatusCode();
            return status.isPresent() && RemoteErrors.isAuthorizationFailure(status.getAsInt());
        }
        return false;
    }

    public static Throwable unwrap(Throwable error) {
        var current = error;
        while ((current instanceof CompletionException
            || current instanceof ExecutionException
            || current instanceof UncheckedIOException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public static String errorClassOf(Throwable error) {
        return unwrap(error).getClass().getSimpleName();
    }
}
