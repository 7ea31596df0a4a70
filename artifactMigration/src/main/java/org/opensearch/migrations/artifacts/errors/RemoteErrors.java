package org.opensearch.migrations.artifacts.errors;

/**
 * Maps a status code returned by a remote store to the exception the retry classifier understands.
 */
public final class RemoteErrors {
    public static final int TOO_MANY_REQUESTS = 429;

    private RemoteErrors() {}

    public static MigrationException fromStatusCode(int statusCode, String message) {
        if (isAuthorizationFailure(statusCode)) {
            return new AuthorizationException(message + " (status " + statusCode + ")");
        }
        if (isClientError(statusCode)) {
            return new MalformedRequestException(message + " (status " + statusCode + ")");
        }
        return new TransientRemoteException(message, statusCode, null);
    }

    /** 4xx other than 429, which only means the caller should slow down. */
    public static boolean isClientError(int statusCode) {
        return statusCode >= 400 && statusCode < 500 && statusCode != TOO_MANY_REQUESTS;
    }

    public static boolean isAuthorizationFailure(int statusCode) {
        return statusCode == 401 || statusCode == 403;
    }
}
