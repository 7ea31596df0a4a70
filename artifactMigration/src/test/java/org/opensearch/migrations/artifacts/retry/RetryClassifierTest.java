package org.opensearch.migrations.artifacts.retry;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import org.opensearch.migrations.artifacts.errors.ArtifactNotFoundException;
import org.opensearch.migrations.artifacts.errors.AuthorizationException;
import org.opensearch.migrations.artifacts.errors.IntegrityException;
import org.opensearch.migrations.artifacts.errors.MalformedRequestException;
import org.opensearch.migrations.artifacts.errors.RemoteErrors;
import org.opensearch.migrations.artifacts.errors.TransientRemoteException;
import org.opensearch.migrations.artifacts.ratelimit.Bucket;
import org.opensearch.migrations.artifacts.ratelimit.RateLimitTimeoutException;
import org.opensearch.migrations.artifacts.validation.ValidationResult;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryClassifierTest {
    private final RetryClassifier classifier =
        new RetryClassifier(new BackoffPolicy(Duration.ofMillis(100), 2.0, Duration.ofSeconds(30), () -> 0.5));

    static Stream<Throwable> retryableErrors() {
        return Stream.of(
            new IOException("connection reset"),
            new SocketTimeoutException("read timed out"),
            TransientRemoteException.throttled("slow down"),
            RemoteErrors.fromStatusCode(503, "unavailable"),
            RemoteErrors.fromStatusCode(500, "internal"),
            new RateLimitTimeoutException(Bucket.TARGET, 1, Duration.ofSeconds(1)),
            new CompletionException(new IOException("wrapped"))
        );
    }

    static Stream<Throwable> fatalErrors() {
        return Stream.of(
            RemoteErrors.fromStatusCode(400, "bad request"),
            RemoteErrors.fromStatusCode(404, "missing"),
            new MalformedRequestException("bad identity"),
            new ArtifactNotFoundException("a"),
            new IntegrityException("a",
                new ValidationResult.Mismatch(ValidationResult.Phase.PRE_TRANSFER, "aa", "bb", null, 1)),
            new IllegalStateException("unexpected")
        );
    }

    @ParameterizedTest
    @MethodSource("retryableErrors")
    void transientErrorsAreRetryable(Throwable error) {
        assertThat(classifier.classify(error, 1), instanceOf(Classification.Retryable.class));
    }

    @ParameterizedTest
    @MethodSource("fatalErrors")
    void otherErrorsAreFatalButNotSystemic(Throwable error) {
        var classification = classifier.classify(error, 1);
        assertThat(classification, instanceOf(Classification.Fatal.class));
        assertFalse(((Classification.Fatal) classification).isSystemic());
    }

    @Test
    void authorizationIsFatalAndSystemic() {
        for (int status : new int[] { 401, 403 }) {
            var classification = classifier.classify(RemoteErrors.fromStatusCode(status, "denied"), 1);
            assertThat(classification, instanceOf(Classification.Fatal.class));
            var fatal = (Classification.Fatal) classification;
            assertTrue(fatal.isSystemic());
            assertEquals("AuthorizationException", fatal.getReason());
        }
        assertThat(classifier.classify(new AuthorizationException("expired token"), 5),
            instanceOf(Classification.Fatal.class));
    }

    @Test
    void statusCodeOnATransientErrorDecidesTheClassification() {
        var denied = classifier.classify(new TransientRemoteException("denied", 403, null), 7);
        assertFalse(denied.isRetryable());
        assertTrue(((Classification.Fatal) denied).isSystemic());

        var notFound = classifier.classify(new TransientRemoteException("gone", 404, null), 1);
        assertFalse(notFound.isRetryable());
        assertFalse(((Classification.Fatal) notFound).isSystemic());

        assertTrue(classifier.classify(new TransientRemoteException("slow down", 429, null), 1).isRetryable());
        assertTrue(classifier.classify(new TransientRemoteException("no status"), 1).isRetryable());
    }

    @Test
    void statusCodesMapToTheirExceptionTypes() {
        assertThat(RemoteErrors.fromStatusCode(401, "x"), instanceOf(AuthorizationException.class));
        assertThat(RemoteErrors.fromStatusCode(409, "x"), instanceOf(MalformedRequestException.class));
        assertThat(RemoteErrors.fromStatusCode(429, "x"), instanceOf(TransientRemoteException.class));
        assertThat(RemoteErrors.fromStatusCode(502, "x"), instanceOf(TransientRemoteException.class));
    }

    @Test
    void retryDelaysIncreaseWithTheAttempt() {
        var error = new IOException("flaky");
        var previous = Duration.ZERO;
        for (int attempt = 1; attempt <= 6; attempt++) {
            var delay = ((Classification.Retryable) classifier.classify(error, attempt)).getDelay();
            assertTrue(delay.compareTo(previous) > 0);
            previous = delay;
        }
    }

    @Test
    void wrappersAreUnwrappedForTheErrorClass() {
        var wrapped = new UncheckedIOException(new SocketTimeoutException("slow"));
        assertEquals("SocketTimeoutException", RetryClassifier.errorClassOf(wrapped));
    }
}
