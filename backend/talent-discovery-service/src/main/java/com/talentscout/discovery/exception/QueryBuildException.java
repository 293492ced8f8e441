package com.talentscout.discovery.exception;

/**
 * Role attributes that cannot be turned into queries. Raised before any network call.
 */
public class QueryBuildException extends DiscoveryException {

    public QueryBuildException(String message) {
        super("BUILDER_ERROR", message);
    }

    public QueryBuildException(String message, Throwable cause) {
        super("BUILDER_ERROR", message, cause);
    }

    public static QueryBuildException missingAttributes() {
        return new QueryBuildException("Role attributes are required");
    }

    public static QueryBuildException invalidLimit(int maxQueries) {
        return new QueryBuildException("maxQueries must be at least 1 but was " + maxQueries);
    }
}
