package com.talentscout.discovery.exception;

/**
 * Base class for profile discovery errors
 */
public class DiscoveryException extends RuntimeException {

    private final String errorCode;

    public DiscoveryException(String message) {
        super(message);
        this.errorCode = "DISCOVERY_ERROR";
    }

    public DiscoveryException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public DiscoveryException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
