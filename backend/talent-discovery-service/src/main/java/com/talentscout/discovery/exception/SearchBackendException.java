package com.talentscout.discovery.exception;

/**
 * Failure of a single backend call. Always recoverable: the executor moves on
 * to the next backend or query.
 */
public class SearchBackendException extends DiscoveryException {

    public enum Kind {
        TIMEOUT,
        RATE_LIMITED,
        PARSE_FAILURE,
        TRANSPORT_FAILURE
    }

    private final Kind kind;
    private final String backend;

    public SearchBackendException(Kind kind, String backend, String message) {
        super("BACKEND_" + kind.name(), message);
        this.kind = kind;
        this.backend = backend;
    }

    public SearchBackendException(Kind kind, String backend, String message, Throwable cause) {
        super("BACKEND_" + kind.name(), message, cause);
        this.kind = kind;
        this.backend = backend;
    }

    public Kind getKind() {
        return kind;
    }

    public String getBackend() {
        return backend;
    }

    public static SearchBackendException timeout(String backend, Throwable cause) {
        return new SearchBackendException(Kind.TIMEOUT, backend, backend + " timed out", cause);
    }

    public static SearchBackendException rateLimited(String backend, int status) {
        return new SearchBackendException(Kind.RATE_LIMITED, backend, backend + " rate limited the request (HTTP " + status + ")");
    }

    public static SearchBackendException parseFailure(String backend, String detail) {
        return new SearchBackendException(Kind.PARSE_FAILURE, backend, backend + " response could not be parsed: " + detail);
    }

    public static SearchBackendException transportFailure(String backend, String detail, Throwable cause) {
        return new SearchBackendException(Kind.TRANSPORT_FAILURE, backend, backend + " request failed: " + detail, cause);
    }
}
